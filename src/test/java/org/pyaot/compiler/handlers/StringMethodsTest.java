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
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.def;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.methodCall;
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
public class StringMethodsTest {

  /** Compiles a function whose only parameter is the string s. */
  private static String withString(Ast.Stmt... body) {
    return Compiler.compile(module(typedDef("f", List.of("s", "str"), null, body)));
  }

  private static Ast.Stmt discard(String method, Ast.Expr... args) {
    return exprStmt(methodCall(name("s"), method, args));
  }

  @Test
  public void caseConversionUsesStringUtils() {
    String out = withString(discard("upper"), discard("lower"));
    assertThat(out).contains("const string_utils = @import(\"string_utils.zig\");");
    assertThat(out).contains("_ = try string_utils.toUpper(__global_allocator, s);");
    assertThat(out).contains("_ = try string_utils.toLower(__global_allocator, s);");
  }

  @Test
  public void strip() {
    String out = withString(discard("strip"), discard("rstrip", constant("x")));
    assertThat(out).contains("_ = std.mem.trim(u8, s, \" \\t\\n\\r\");");
    assertThat(out).contains("_ = std.mem.trimRight(u8, s, \"x\");");
  }

  @Test
  public void replace() {
    assertThat(withString(discard("replace", constant("a"), constant("b"))))
        .contains("_ = try std.mem.replaceOwned(u8, __global_allocator, s, \"a\", \"b\");");
  }

  @Test
  public void find() {
    assertThat(withString(discard("find", constant("x"))))
        .containsMatch(
            "_ = \\(if \\(std.mem.indexOf\\(u8, s, \"x\"\\)\\) \\|(__find_\\d+)\\|"
                + " @as\\(i64, @intCast\\(\\1\\)\\) else -1\\);");
  }

  @Test
  public void splitAndJoin() {
    String out =
        withString(
            assign("parts", methodCall(name("s"), "split", constant(","))),
            exprStmt(methodCall(constant("-"), "join", name("parts"))));
    assertThat(out).contains("std.ArrayList([]const u8){}");
    assertThat(out).contains("std.mem.splitSequence(u8, s, \",\")");
    assertThat(out).contains("_ = try std.mem.join(__global_allocator, \"-\", parts.items);");
  }

  @Test
  public void methodOfUntypedReceiverIsResolvedByName() {
    String out =
        Compiler.compile(
            module(
                def(
                    "f",
                    List.of("s"),
                    exprStmt(methodCall(name("s"), "startswith", constant("a"))))));
    assertThat(out).contains("fn f(s: anytype) anyerror!void {");
    assertThat(out).contains("_ = std.mem.startsWith(u8, s, \"a\");");
  }

  @Test
  public void ambiguousMethodOfUntypedReceiverIsUnresolved() {
    Ast.Module module =
        module(def("f", List.of("x"), exprStmt(methodCall(name("x"), "count", constant(1)))));
    CompileError.UnresolvedSymbol e =
        assertThrows(CompileError.UnresolvedSymbol.class, () -> Compiler.compile(module));
    assertThat(e.symbol).isEqualTo("x.count");
    assertThat(e.context()).isEqualTo("f");
  }
}
