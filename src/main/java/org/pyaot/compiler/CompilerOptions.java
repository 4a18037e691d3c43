/*
 * Copyright 2025 The PyAOT Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pyaot.compiler;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Properties;

/**
 * Settings that control a compilation. CompilerOptions are immutable; use {@link #builder} or
 * {@link #toBuilder} to make a modified copy.
 */
public final class CompilerOptions {

  public static final String INDENT_PROPERTY = "pyaot.indent";
  public static final String RUNTIME_IMPORT_PROPERTY = "pyaot.runtimeImport";
  public static final String MODULE_MODE_PROPERTY = "pyaot.moduleMode";
  public static final String STRICT_ANALYSIS_PROPERTY = "pyaot.strictAnalysis";

  private static final CompilerOptions DEFAULTS = new Builder().build();

  /** The number of spaces per indentation level. */
  public final int indent;

  /** The path passed to {@code @import} for the runtime support module. */
  public final String runtimeImport;

  /**
   * If true, emit a library module (declarations wrapped in a public struct, no {@code main})
   * instead of a program.
   */
  public final boolean moduleMode;

  /** If true, any gap in requirement analysis is a CompileError rather than a warning. */
  public final boolean strictAnalysis;

  private CompilerOptions(Builder builder) {
    this.indent = builder.indent;
    this.runtimeImport = builder.runtimeImport;
    this.moduleMode = builder.moduleMode;
    this.strictAnalysis = builder.strictAnalysis;
  }

  public static CompilerOptions defaults() {
    return DEFAULTS;
  }

  /** Returns options read from the given properties, using defaults for any not set. */
  public static CompilerOptions fromProperties(Properties props) {
    Builder builder = new Builder();
    String indent = props.getProperty(INDENT_PROPERTY);
    if (indent != null) {
      try {
        builder.setIndent(Integer.parseInt(indent.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("%s must be an integer, got '%s'", INDENT_PROPERTY, indent), e);
      }
    }
    builder.setRuntimeImport(props.getProperty(RUNTIME_IMPORT_PROPERTY, builder.runtimeImport));
    builder.setModuleMode(Boolean.parseBoolean(props.getProperty(MODULE_MODE_PROPERTY, "false")));
    builder.setStrictAnalysis(
        Boolean.parseBoolean(props.getProperty(STRICT_ANALYSIS_PROPERTY, "false")));
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setIndent(indent)
        .setRuntimeImport(runtimeImport)
        .setModuleMode(moduleMode)
        .setStrictAnalysis(strictAnalysis);
  }

  @Override
  public String toString() {
    return String.format(
        "CompilerOptions{indent=%s, runtimeImport=%s, moduleMode=%s, strictAnalysis=%s}",
        indent, runtimeImport, moduleMode, strictAnalysis);
  }

  /** A builder for CompilerOptions. */
  public static final class Builder {
    private int indent = 4;
    private String runtimeImport = "./runtime.zig";
    private boolean moduleMode;
    private boolean strictAnalysis;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setIndent(int indent) {
      Preconditions.checkArgument(indent >= 0, "indent must be non-negative");
      this.indent = indent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRuntimeImport(String runtimeImport) {
      Preconditions.checkArgument(!runtimeImport.isEmpty(), "runtimeImport must be non-empty");
      this.runtimeImport = runtimeImport;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setModuleMode(boolean moduleMode) {
      this.moduleMode = moduleMode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStrictAnalysis(boolean strictAnalysis) {
      this.strictAnalysis = strictAnalysis;
      return this;
    }

    public CompilerOptions build() {
      return new CompilerOptions(this);
    }
  }
}
