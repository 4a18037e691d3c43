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

package org.pyaot.analysis;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.pyaot.Ast.binOp;
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.compare;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.dict;
import static org.pyaot.Ast.fString;
import static org.pyaot.Ast.list;
import static org.pyaot.Ast.methodCall;
import static org.pyaot.Ast.name;
import static org.pyaot.Ast.none;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.CompareOp;

@RunWith(TestParameterInjector.class)
public class TypeInferrerTest {

  private final TypeInferrer inferrer = new TypeInferrer();

  @Test
  public void constants() {
    assertThat(inferrer.infer(constant(1))).isEqualTo(InferredType.INT);
    assertThat(inferrer.infer(constant(true))).isEqualTo(InferredType.INT);
    assertThat(inferrer.infer(constant(1.5))).isEqualTo(InferredType.FLOAT);
    assertThat(inferrer.infer(constant("s"))).isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(none())).isEqualTo(InferredType.UNKNOWN);
  }

  @Test
  public void displays() {
    assertThat(inferrer.infer(list())).isEqualTo(InferredType.SEQUENCE);
    assertThat(inferrer.infer(dict())).isEqualTo(InferredType.MAPPING);
    assertThat(inferrer.infer(fString("x"))).isEqualTo(InferredType.STRING);
  }

  @Test
  public void joinIsCommutative(
      @TestParameter InferredType a, @TestParameter InferredType b) {
    assertThat(a.join(b)).isEqualTo(b.join(a));
    assertThat(a.join(a)).isEqualTo(a);
  }

  @Test
  public void arithmetic() {
    assertThat(inferrer.infer(binOp(constant(1), BinaryOp.ADD, constant(2))))
        .isEqualTo(InferredType.INT);
    assertThat(inferrer.infer(binOp(constant(1), BinaryOp.ADD, constant(2.0))))
        .isEqualTo(InferredType.FLOAT);
    assertThat(inferrer.infer(binOp(constant(4), BinaryOp.DIV, constant(2))))
        .isEqualTo(InferredType.FLOAT);
    assertThat(inferrer.infer(binOp(constant("a"), BinaryOp.ADD, constant("b"))))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(binOp(constant("a"), BinaryOp.MULT, constant(3))))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(binOp(dict(), BinaryOp.ADD, dict())))
        .isEqualTo(InferredType.UNKNOWN);
  }

  @Test
  public void stringOperandDecidesConcatenationAndRepetition() {
    assertThat(inferrer.infer(binOp(constant("hi "), BinaryOp.ADD, name("who"))))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(binOp(name("who"), BinaryOp.ADD, constant("!"))))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(binOp(constant("-"), BinaryOp.MULT, name("n"))))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(binOp(constant("a"), BinaryOp.MULT, constant(2.0))))
        .isEqualTo(InferredType.UNKNOWN);
  }

  @Test
  public void comparisonsAreIntegers() {
    assertThat(inferrer.infer(compare(name("a"), CompareOp.LT, name("b"))))
        .isEqualTo(InferredType.INT);
  }

  @Test
  public void calls() {
    assertThat(inferrer.infer(call("len", name("xs")))).isEqualTo(InferredType.INT);
    assertThat(inferrer.infer(call("str", constant(1)))).isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(call("abs", constant(-1.5)))).isEqualTo(InferredType.FLOAT);
    assertThat(inferrer.infer(call("mystery"))).isEqualTo(InferredType.UNKNOWN);
    assertThat(inferrer.infer(methodCall(constant("a,b"), "split", constant(","))))
        .isEqualTo(InferredType.SEQUENCE);
    assertThat(inferrer.infer(methodCall(constant("a"), "upper")))
        .isEqualTo(InferredType.STRING);
    assertThat(inferrer.infer(methodCall(name("x"), "upper"))).isEqualTo(InferredType.UNKNOWN);
  }

  @Test
  public void variablesJoinAcrossAssignments() {
    inferrer.bind("x", InferredType.INT);
    assertThat(inferrer.infer(name("x"))).isEqualTo(InferredType.INT);
    inferrer.bind("x", InferredType.FLOAT);
    assertThat(inferrer.infer(name("x"))).isEqualTo(InferredType.FLOAT);
    inferrer.bind("x", InferredType.STRING);
    assertThat(inferrer.infer(name("x"))).isEqualTo(InferredType.UNKNOWN);
    assertThat(inferrer.infer(name("y"))).isEqualTo(InferredType.UNKNOWN);
  }

  @Test
  public void scopes() {
    inferrer.bind("outer", InferredType.STRING);
    inferrer.enterScope();
    assertThat(inferrer.depth()).isEqualTo(2);
    inferrer.bind("inner", InferredType.INT);
    inferrer.bind("outer", InferredType.STRING);
    assertThat(inferrer.lookup("inner")).isEqualTo(InferredType.INT);
    inferrer.exitScope();
    assertThat(inferrer.lookup("inner")).isNull();
    assertThat(inferrer.lookup("outer")).isEqualTo(InferredType.STRING);
    assertThrows(IllegalStateException.class, inferrer::exitScope);
  }
}
