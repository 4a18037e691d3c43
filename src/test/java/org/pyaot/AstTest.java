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


package org.pyaot;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.ConstantKind;

@RunWith(JUnit4.class)
public class AstTest {

  @Test
  public void nodeInterfacesAreClosed() {
    assertThat(Ast.Stmt.class.isSealed()).isTrue();
    assertThat(Ast.Expr.class.isSealed()).isTrue();
    assertThat(Ast.FStringPart.class.isSealed()).isTrue();
  }

  @Test
  public void constantFactories() {
    assertThat(Ast.constant(3).value()).isEqualTo(3L);
    assertThat(Ast.constant(1.5).kind()).isEqualTo(ConstantKind.FLOAT);
    assertThat(Ast.none().value()).isNull();
  }

  @Test
  public void constantValueMustMatchItsKind() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> new Constant(ConstantKind.INT, 1));
    assertThat(e).hasMessageThat().isEqualTo("1 is not a valid INT constant");
    assertThrows(IllegalArgumentException.class, () -> new Constant(ConstantKind.NONE, "x"));
    assertThrows(IllegalArgumentException.class, () -> new Constant(ConstantKind.STRING, null));
    assertThat(new Constant(ConstantKind.INT, 1L).value()).isEqualTo(1L);
  }
}
