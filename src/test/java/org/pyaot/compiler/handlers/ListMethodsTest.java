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

package org.pyaot.compiler.handlers;

import static com.google.common.truth.Truth.assertThat;
import static org.pyaot.Ast.assign;
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.def;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.forStmt;
import static org.pyaot.Ast.list;
import static org.pyaot.Ast.methodCall;
import static org.pyaot.Ast.module;
import static org.pyaot.Ast.name;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.compiler.Compiler;

@RunWith(JUnit4.class)
public class ListMethodsTest {

  private static String compileFunction(Ast.Stmt... body) {
    return Compiler.compile(module(def("f", List.of(), body)));
  }

  private static Ast.Stmt printEach(String list) {
    return forStmt(name("x"), name(list), exprStmt(call("print", name("x"))));
  }

  @Test
  public void unmodifiedListIsAFixedArray() {
    String out =
        compileFunction(assign("xs", list(constant(1), constant(2), constant(3))), printEach("xs"));
    assertThat(out).contains("const xs = [_]i64{ 1, 2, 3 };");
    assertThat(out).contains("for (xs) |x| {");
    assertThat(out).doesNotContain("__global_allocator");
  }

  @Test
  public void appendedListIsGrowable() {
    String out =
        compileFunction(
            assign("xs", list(constant(1), constant(2))),
            exprStmt(methodCall(name("xs"), "append", constant(3))),
            printEach("xs"));
    assertThat(out)
        .containsMatch(
            "var xs = (list_\\d+): \\{ var (__list_\\d+) = std.ArrayList\\(i64\\)\\{\\}; "
                + "try \\2.append\\(__global_allocator, 1\\); "
                + "try \\2.append\\(__global_allocator, 2\\); break :\\1 \\2; \\};");
    assertThat(out).contains("try xs.append(__global_allocator, 3);");
    assertThat(out).contains("for (xs.items) |x| {");
    assertThat(out).contains("print(\"{d}\\n\", .{ x });");
  }

  @Test
  public void popAndInsert() {
    String out =
        compileFunction(
            assign("xs", list(constant(1), constant(2))),
            exprStmt(methodCall(name("xs"), "insert", constant(0), constant(5))),
            exprStmt(methodCall(name("xs"), "pop")),
            exprStmt(methodCall(name("xs"), "pop", constant(0))));
    assertThat(out).contains("try xs.insert(__global_allocator, @intCast(0), 5);");
    assertThat(out).contains("_ = xs.pop().?;");
    assertThat(out).contains("_ = xs.orderedRemove(@intCast(0));");
  }

  @Test
  public void runtimeListHelpers() {
    String out =
        compileFunction(
            assign("xs", list(constant(3), constant(1))),
            exprStmt(methodCall(name("xs"), "sort")),
            exprStmt(methodCall(name("xs"), "count", constant(1))));
    assertThat(out).contains("runtime.list.sort(xs);");
    assertThat(out).contains("_ = runtime.list.count(xs, 1);");
  }
}
