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

package org.pyaot.util;

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.analysis.InferredType;

@RunWith(TestParameterInjector.class)
public class ZigSyntaxTest {

  @Test
  public void plainIdentifiersAreUnchanged(
      @TestParameter({"x", "_private", "camelCase", "snake_case_2"}) String name) {
    assertThat(ZigSyntax.identifier(name)).isEqualTo(name);
  }

  @Test
  public void reservedWordsAreQuoted(
      @TestParameter({"const", "error", "type", "u8", "i64", "null"}) String name) {
    assertThat(ZigSyntax.identifier(name)).isEqualTo("@\"" + name + "\"");
  }

  @Test
  public void stringLiteralEscapes() {
    assertThat(ZigSyntax.stringLiteral("a\"b\\c\nd\te")).isEqualTo("\"a\\\"b\\\\c\\nd\\te\"");
    assertThat(ZigSyntax.stringLiteral("\u0001")).isEqualTo("\"\\x01\"");
  }

  @Test
  public void formatTextDoublesBraces() {
    assertThat(ZigSyntax.formatText("{x}: ")).isEqualTo("{{x}}: ");
  }

  @Test
  public void floatLiterals() {
    assertThat(ZigSyntax.floatLiteral(1.5)).isEqualTo("1.5");
    assertThat(ZigSyntax.floatLiteral(1e100)).isEqualTo("1.0e100");
    assertThat(ZigSyntax.floatLiteral(Double.NaN)).isEqualTo("std.math.nan(f64)");
    assertThat(ZigSyntax.floatLiteral(Double.NEGATIVE_INFINITY)).isEqualTo("-std.math.inf(f64)");
  }

  @Test
  public void formatSpecs() {
    assertThat(ZigSyntax.formatSpec(InferredType.INT)).isEqualTo("{d}");
    assertThat(ZigSyntax.formatSpec(InferredType.FLOAT)).isEqualTo("{d}");
    assertThat(ZigSyntax.formatSpec(InferredType.STRING)).isEqualTo("{s}");
    assertThat(ZigSyntax.formatSpec(InferredType.SEQUENCE)).isEqualTo("{any}");
  }

  @Test
  public void types() {
    assertThat(ZigSyntax.zigType(InferredType.STRING)).isEqualTo("[]const u8");
    assertThat(ZigSyntax.zigType(InferredType.UNKNOWN)).isNull();
    assertThat(ZigSyntax.zigType(ConstantKind.BOOL)).isEqualTo("bool");
    assertThat(ZigSyntax.annotationType("int")).isEqualTo("i64");
    assertThat(ZigSyntax.annotationType("None")).isEqualTo("void");
    assertThat(ZigSyntax.annotationType("Point")).isNull();
  }
}
