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
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.importStmt;
import static org.pyaot.Ast.module;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.compiler.CompileError;
import org.pyaot.compiler.Compiler;

@RunWith(JUnit4.class)
public class StdlibModulesTest {

  private static String compile(Ast.Stmt... body) {
    return Compiler.compile(module(body));
  }

  @Test
  public void jsonPassesTheAllocator() {
    String out = compile(importStmt("json"), exprStmt(call("json.loads", constant("[1]"))));
    assertThat(out).contains("const json = runtime.json;");
    assertThat(out).contains("_ = try json.loads(__global_allocator, \"[1]\");");
  }

  @Test
  public void httpIsInitializedInMain() {
    String out =
        compile(importStmt("http"), exprStmt(call("http.get", constant("http://example.com"))));
    assertThat(out).contains("const http = runtime.http;");
    assertThat(out).contains("try http.init(__global_allocator);");
    assertThat(out)
        .contains("_ = (try http.get(__global_allocator, \"http://example.com\")).body;");
  }

  @Test
  public void mathMapsToZigBuiltins() {
    String out =
        compile(
            importStmt("math"),
            exprStmt(call("print", Ast.dotted("math.pi"))),
            exprStmt(call("math.sqrt", constant(2.0))));
    assertThat(out).contains("std.math.pi");
    assertThat(out).contains("_ = @sqrt(2.0);");
  }

  @Test
  public void osPathJoinWithoutImport() {
    assertThat(compile(exprStmt(call("os.path.join", constant("a"), constant("b")))))
        .contains("_ = try std.fs.path.join(__global_allocator, &.{ \"a\", \"b\" });");
  }

  @Test
  public void sysExit() {
    String out = compile(importStmt("sys"), exprStmt(call("sys.exit", constant(1))));
    assertThat(out).contains("std.process.exit(@intCast(1));");
  }

  @Test
  public void timeNeedsNoAllocator() {
    String out = compile(importStmt("time"), exprStmt(call("time.time")));
    assertThat(out).contains("_ = runtime.time.time();");
    assertThat(out).doesNotContain("__global_allocator");
  }

  @Test
  public void aliasedImportResolvesToTheModule() {
    Ast.Module module =
        module(new Ast.Import("numpy", "np"), exprStmt(call("np.zeros", constant(3))));
    CompileError.UnresolvedSymbol e =
        assertThrows(CompileError.UnresolvedSymbol.class, () -> Compiler.compile(module));
    assertThat(e.symbol).isEqualTo("numpy.zeros");
  }
}
