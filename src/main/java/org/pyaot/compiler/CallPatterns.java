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
import java.util.List;
import org.pyaot.Ast.Expr;

/**
 * Factories that build {@link Handler}s from {@link CallPattern}s. All three shapes produce the
 * same code:
 *
 * <pre>
 *   [try ]path([allocator, ]arg0, arg1, ...)
 * </pre>
 *
 * with the field-projecting shape wrapping that as {@code (...).field}. Argument counts outside
 * the pattern's range are rejected with {@link CompileError.ArityMismatch} before anything is
 * written.
 */
public final class CallPatterns {

  // Static methods only
  private CallPatterns() {}

  /** Returns a handler for a pattern that takes a fixed number of arguments. */
  public static Handler fixedArity(CallPattern pattern) {
    Preconditions.checkArgument(pattern.isFixedArity(), "%s is not fixed-arity", pattern);
    Preconditions.checkArgument(pattern.field() == null);
    return handler(pattern);
  }

  /** Returns a handler for a pattern that takes a range of argument counts. */
  public static Handler variableArity(CallPattern pattern) {
    Preconditions.checkArgument(!pattern.isFixedArity(), "%s is fixed-arity", pattern);
    Preconditions.checkArgument(pattern.field() == null);
    return handler(pattern);
  }

  /** Returns a handler for a pattern whose value is one field of the call's result. */
  public static Handler fieldProjecting(CallPattern pattern) {
    Preconditions.checkArgument(pattern.field() != null, "%s has no field", pattern);
    return handler(pattern);
  }

  /** Chooses the appropriate factory for {@code pattern}. */
  public static Handler forPattern(CallPattern pattern) {
    if (pattern.field() != null) {
      return fieldProjecting(pattern);
    } else if (pattern.isFixedArity()) {
      return fixedArity(pattern);
    } else {
      return variableArity(pattern);
    }
  }

  private static Handler handler(CallPattern pattern) {
    Handler.Body body = (out, args) -> emitCall(pattern, out, args);
    return pattern.producesValue()
        ? Handler.expression(pattern.minArgs(), pattern.maxArgs(), body)
        : Handler.statement(pattern.minArgs(), pattern.maxArgs(), body);
  }

  private static void emitCall(CallPattern pattern, Emitter out, List<Expr> args) {
    boolean projecting = pattern.field() != null;
    if (projecting && pattern.useTry()) {
      out.write("(");
    }
    if (pattern.useTry()) {
      out.write("try ");
    }
    out.write(pattern.runtimePath());
    out.write("(");
    if (pattern.passAllocator()) {
      out.write(out.allocator(pattern.runtimePath()));
      if (!args.isEmpty()) {
        out.write(", ");
      }
    }
    out.emitArgs(args);
    out.write(")");
    if (projecting) {
      if (pattern.useTry()) {
        out.write(")");
      }
      out.write(".");
      out.write(pattern.field());
    }
  }
}
