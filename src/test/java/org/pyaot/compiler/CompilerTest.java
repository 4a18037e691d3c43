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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.pyaot.Ast.assign;
import static org.pyaot.Ast.binOp;
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.module;
import static org.pyaot.Ast.name;
import static org.pyaot.Ast.ret;
import static org.pyaot.Ast.typedDef;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.compiler.handlers.StandardHandlers;

@RunWith(JUnit4.class)
public class CompilerTest {

  private static final CompilerOptions STRICT =
      CompilerOptions.builder().setStrictAnalysis(true).build();

  private static final CompilerOptions MODULE_MODE =
      CompilerOptions.builder().setModuleMode(true).build();

  /** A module whose requirements can't be fully analyzed. */
  private static final Ast.Module WITH_TRY =
      module(
          new Ast.Try(
              ImmutableList.of(exprStmt(call("print", constant(1)))),
              ImmutableList.of(),
              ImmutableList.of()));

  @Test
  public void defaultOverloadUsesStandardHandlers() {
    Ast.Module module = module(exprStmt(call("print", constant("hi"))));
    assertThat(Compiler.compile(module))
        .isEqualTo(
            Compiler.compile(
                module, "main", StandardHandlers.registry(), CompilerOptions.defaults()));
  }

  @Test
  public void analysisGapsAreFatalInStrictMode() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile(WITH_TRY, "main", STRICT));
    assertThat(e).hasMessageThat().isEqualTo("Requirement analysis can't handle try in <module>");
  }

  @Test
  public void analysisGapsAreOtherwiseLogged() {
    // The gap is only a warning, but the emitter has no translation for try.
    CompileError.Unsupported e =
        assertThrows(CompileError.Unsupported.class, () -> Compiler.compile(WITH_TRY));
    assertThat(e.construct).isEqualTo("try");
  }

  @Test
  public void moduleMode() {
    Ast.Module module =
        module(
            assign("VERSION", constant("1.0")),
            typedDef(
                "double",
                List.of("x", "int"),
                "int",
                ret(binOp(name("x"), BinaryOp.MULT, constant(2)))));
    assertThat(Compiler.compile(module, "utils", MODULE_MODE))
        .isEqualTo(
            String.join(
                "\n",
                "const std = @import(\"std\");",
                "const runtime = @import(\"./runtime.zig\");",
                "",
                "pub const utils = struct {",
                "    pub const VERSION = \"1.0\";",
                "",
                "    pub fn double(x: i64) anyerror!i64 {",
                "        return (x * 2);",
                "    }",
                "};",
                ""));
  }

  @Test
  public void moduleModeRejectsTopLevelCode() {
    Ast.Module module = module(exprStmt(call("print", constant("hi"))));
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile(module, "utils", MODULE_MODE));
    assertThat(e).hasMessageThat().contains("in module mode");
  }

  @Test
  public void indentAndRuntimeImportAreConfigurable() {
    CompilerOptions options =
        CompilerOptions.builder().setIndent(2).setRuntimeImport("lib/rt.zig").build();
    String out = Compiler.compile(module(exprStmt(call("print", constant("hi")))), "main", options);
    assertThat(out).contains("const runtime = @import(\"lib/rt.zig\");");
    assertThat(out).contains("\n  try std.io.getStdOut().writer().print(\"hi\\n\", .{});\n");
  }
}
