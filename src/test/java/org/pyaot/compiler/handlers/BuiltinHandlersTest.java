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
import static org.junit.Assert.assertThrows;
import static org.pyaot.Ast.assign;
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.classDef;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.forStmt;
import static org.pyaot.Ast.module;
import static org.pyaot.Ast.name;
import static org.pyaot.Ast.typedDef;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.compiler.CompileError;
import org.pyaot.compiler.Compiler;

@RunWith(JUnit4.class)
public class BuiltinHandlersTest {

  private static String compile(Ast.Stmt... body) {
    return Compiler.compile(module(body));
  }

  /** Compiles a function "f" with the given (alternating name and type) parameters. */
  private static String compileFunction(List<String> params, Ast.Stmt... body) {
    return compile(typedDef("f", params, null, body));
  }

  private static Ast.Stmt print(Ast.Expr... args) {
    return exprStmt(call("print", args));
  }

  @Test
  public void printChoosesPlaceholdersByType() {
    String out =
        compileFunction(
            List.of("n", "int", "s", "str", "x", "float"),
            print(constant("n ="), name("n"), name("s"), name("x")));
    assertThat(out)
        .contains("try std.io.getStdOut().writer().print(\"n = {d} {s} {d}\\n\", .{ n, s, x });");
  }

  @Test
  public void printEscapesBracesInText() {
    assertThat(compile(print(constant("{}"))))
        .contains("try std.io.getStdOut().writer().print(\"{{}}\\n\", .{});");
  }

  @Test
  public void lenOfString() {
    assertThat(compileFunction(List.of("s", "str"), exprStmt(call("len", name("s")))))
        .contains("_ = @as(i64, @intCast(s.len));");
  }

  @Test
  public void strFormatsWithTheAllocator() {
    assertThat(compileFunction(List.of("n", "int"), exprStmt(call("str", name("n")))))
        .contains("_ = try std.fmt.allocPrint(__global_allocator, \"{d}\", .{ n });");
  }

  @Test
  public void conversions() {
    String out =
        compileFunction(
            List.of("n", "int", "x", "float"),
            exprStmt(call("int", constant("42"))),
            exprStmt(call("float", name("n"))),
            exprStmt(call("round", name("x"))),
            exprStmt(call("int", name("n"))));
    assertThat(out).contains("_ = runtime.parseInt(\"42\");");
    assertThat(out).contains("_ = @as(f64, @floatFromInt(n));");
    assertThat(out).contains("_ = @as(i64, @intFromFloat(@round(x)));");
    assertThat(out).contains("_ = n;");
  }

  @Test
  public void minAndMaxOfArguments() {
    String out =
        compileFunction(
            List.of("a", "int", "b", "int"),
            exprStmt(call("min", name("a"), name("b"))),
            exprStmt(call("max", name("a"), name("b"), constant(3))));
    assertThat(out).contains("_ = @min(a, b);");
    assertThat(out).contains("_ = @max(a, b, 3);");
  }

  @Test
  public void rangeIsOnlyALoopHeader() {
    CompileError.Unsupported e =
        assertThrows(
            CompileError.Unsupported.class,
            () -> compile(exprStmt(call("range", constant(3)))));
    assertThat(e.construct).isEqualTo("range() outside of a for loop");
  }

  @Test
  public void rangeLoop() {
    String out =
        compileFunction(
            List.of("n", "int"),
            forStmt(
                name("i"), call("range", constant(1), name("n"), constant(2)), print(name("i"))));
    assertThat(out).contains("var i: i64 = 1;\n");
    assertThat(out).contains("while (i < n) : (i += 2) {\n");
    assertThat(out).contains("print(\"{d}\\n\", .{ i });");
  }

  @Test
  public void isinstanceOfBuiltinTypeIsDecidedStatically() {
    String out =
        compileFunction(
            List.of("n", "int"),
            exprStmt(call("isinstance", name("n"), name("int"))),
            exprStmt(call("isinstance", name("n"), name("str"))));
    assertThat(out).containsMatch("isinstance_\\d+: \\{ break :isinstance_\\d+ true; \\}");
    assertThat(out).containsMatch("isinstance_\\d+: \\{ break :isinstance_\\d+ false; \\}");
  }

  @Test
  public void isinstanceFollowsTheClassHierarchy() {
    String out =
        compile(
            classDef("Animal", List.of()),
            classDef("Dog", List.of("Animal")),
            assign("d", call("Dog")),
            print(call("isinstance", name("d"), name("Animal"))));
    assertThat(out).contains("const d: *Dog = try Dog.init();");
    assertThat(out).containsMatch("break :isinstance_\\d+ true; \\}");
  }
}
