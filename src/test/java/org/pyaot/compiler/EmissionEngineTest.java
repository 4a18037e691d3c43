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
import static org.pyaot.Ast.attr;
import static org.pyaot.Ast.binOp;
import static org.pyaot.Ast.call;
import static org.pyaot.Ast.classDef;
import static org.pyaot.Ast.compare;
import static org.pyaot.Ast.comprehension;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.def;
import static org.pyaot.Ast.exprStmt;
import static org.pyaot.Ast.forStmt;
import static org.pyaot.Ast.ifStmt;
import static org.pyaot.Ast.list;
import static org.pyaot.Ast.listComp;
import static org.pyaot.Ast.methodCall;
import static org.pyaot.Ast.module;
import static org.pyaot.Ast.name;
import static org.pyaot.Ast.ret;
import static org.pyaot.Ast.typedDef;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.Ast.AugAssign;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.CompareOp;
import org.pyaot.analysis.RequirementAnalyzer;
import org.pyaot.compiler.handlers.StandardHandlers;

@RunWith(JUnit4.class)
public class EmissionEngineTest {

  private static EmissionState emit(Ast.Module module) {
    EmissionEngine engine =
        new EmissionEngine(
            RequirementAnalyzer.analyze(module),
            StandardHandlers.registry(),
            CompilerOptions.defaults());
    return engine.emitModule(module, "main");
  }

  private static Ast.Stmt print(Ast.Expr... args) {
    return exprStmt(call("print", args));
  }

  private static Ast.Expr superCall(String method) {
    return methodCall(call("super"), method);
  }

  @Test
  public void helloWorld() {
    assertThat(emit(module(print(constant("hello")))).contents())
        .isEqualTo(
            String.join(
                "\n",
                "const std = @import(\"std\");",
                "const runtime = @import(\"./runtime.zig\");",
                "const __name__ = \"__main__\";",
                "",
                "pub fn main() !void {",
                "    try std.io.getStdOut().writer().print(\"hello\\n\", .{});",
                "}",
                ""));
  }

  @Test
  public void infallibleMainIsVoid() {
    Ast.Module module =
        module(
            assign("x", constant(1)),
            assign("y", binOp(name("x"), BinaryOp.ADD, constant(2))));
    assertThat(emit(module).contents())
        .isEqualTo(
            String.join(
                "\n",
                "const std = @import(\"std\");",
                "const runtime = @import(\"./runtime.zig\");",
                "const __name__ = \"__main__\";",
                "",
                "const x: i64 = 1;",
                "",
                "pub fn main() void {",
                "    const y: i64 = (x + 2);",
                "    _ = y;",
                "}",
                ""));
  }

  @Test
  public void userFunctionsAreFallible() {
    Ast.Module module =
        module(
            typedDef(
                "add",
                List.of("a", "int", "b", "int"),
                "int",
                ret(binOp(name("a"), BinaryOp.ADD, name("b")))),
            print(call("add", constant(1), constant(2))));
    String out = emit(module).contents();
    assertThat(out).contains("fn add(a: i64, b: i64) anyerror!i64 {\n    return (a + b);\n}\n");
    assertThat(out).contains("print(\"{d}\\n\", .{ try add(1, 2) });");
    assertThat(out).contains("pub fn main() !void {");
  }

  @Test
  public void userMainIsRenamedAndCalled() {
    Ast.Module module = module(def("main", List.of(), print(constant("hi"))));
    String out = emit(module).contents();
    assertThat(out).contains("fn __user_main() anyerror!void {");
    assertThat(out).contains("\n    try __user_main();\n}\n");
  }

  @Test
  public void explicitMainCallIsNotRepeated() {
    Ast.Module module =
        module(
            def("main", List.of(), print(constant("hi"))),
            ifStmt(
                compare(name("__name__"), CompareOp.EQ, constant("__main__")),
                List.of(exprStmt(call("main"))),
                List.of()));
    String out = emit(module).contents();
    assertThat(out).contains("if (std.mem.eql(u8, __name__, \"__main__\")) {");
    assertThat(out).contains("\n        try __user_main();\n");
    assertThat(out).doesNotContain("\n    try __user_main();\n");
  }

  @Test
  public void unusedLocalsAreDiscarded() {
    Ast.Module module =
        module(
            def(
                "f",
                List.of("unused"),
                assign("a", constant(1)),
                assign("b", constant(2)),
                ret(name("b"))));
    String out = emit(module).contents();
    assertThat(out).contains("fn f(unused: anytype) anyerror!i64 {\n    _ = unused;\n");
    assertThat(out).contains("    const a: i64 = 1;\n    _ = a;\n    const b: i64 = 2;\n");
  }

  @Test
  public void reboundParametersAreCopied() {
    Ast.Module module =
        module(
            typedDef(
                "countdown",
                List.of("n", "int"),
                "int",
                new AugAssign(name("n"), BinaryOp.SUB, constant(1)),
                ret(name("n"))));
    String out = emit(module).contents();
    assertThat(out).contains("fn countdown(__arg_n: i64) anyerror!i64 {");
    assertThat(out).contains("    var n: i64 = __arg_n;\n    n -= 1;\n");
  }

  @Test
  public void superWithoutParentGetsFreshLabels() {
    Ast.Module module =
        module(
            classDef(
                "Base",
                List.of(),
                def(
                    "__init__",
                    List.of("self"),
                    exprStmt(superCall("__init__")),
                    exprStmt(superCall("__init__")))));
    String out = emit(module).contents();
    Matcher m =
        Pattern.compile("(super_\\d+): \\{ break :(super_\\d+) \\.\\{\\}; \\}").matcher(out);
    List<String> labels = new ArrayList<>();
    while (m.find()) {
      assertThat(m.group(2)).isEqualTo(m.group(1));
      labels.add(m.group(1));
    }
    assertThat(labels).hasSize(2);
    assertThat(labels).containsNoDuplicates();
  }

  @Test
  public void superCallsUpcastToTheParentLayout() {
    Ast.Module module =
        module(
            classDef(
                "Animal",
                List.of(),
                typedDef(
                    "__init__",
                    List.of("self", "Animal", "name", "str"),
                    null,
                    assign(attr(name("self"), "name"), name("name")))),
            classDef(
                "Dog",
                List.of("Animal"),
                typedDef(
                    "__init__",
                    List.of("self", "Dog", "name", "str"),
                    null,
                    exprStmt(call(attr(call("super"), "__init__"), name("name"))),
                    assign(attr(name("self"), "tricks"), constant(0)))));
    String out = emit(module).contents();
    assertThat(out)
        .contains("const Dog = struct {\n    name: []const u8,\n    tricks: i64,\n");
    assertThat(out).contains("try Animal.__init__(@as(*Animal, @ptrCast(self)), name);");
  }

  @Test
  public void indentationIsBalanced() {
    Ast.Module module =
        module(
            classDef(
                "Counter",
                List.of(),
                typedDef(
                    "__init__",
                    List.of("self", "Counter", "start", "int"),
                    null,
                    assign(attr(name("self"), "count"), name("start"))),
                typedDef(
                    "bump",
                    List.of("self", "Counter", "n", "int"),
                    "int",
                    new AugAssign(attr(name("self"), "count"), BinaryOp.ADD, name("n")),
                    ret(attr(name("self"), "count")))),
            typedDef(
                "total",
                List.of("n", "int"),
                "int",
                assign("s", constant(0)),
                forStmt(
                    name("i"),
                    call("range", name("n")),
                    ifStmt(
                        compare(
                            binOp(name("i"), BinaryOp.MOD, constant(2)),
                            CompareOp.EQ,
                            constant(0)),
                        List.of(new AugAssign(name("s"), BinaryOp.ADD, name("i"))),
                        List.of(new AugAssign(name("s"), BinaryOp.SUB, constant(1))))),
                ret(name("s"))),
            assign("c", call("Counter", constant(1))),
            print(methodCall(name("c"), "bump", call("total", constant(10)))));
    EmissionState state = emit(module);
    assertThat(state.depth()).isEqualTo(0);
    assertThat(state.indentsEntered()).isEqualTo(state.indentsExited());
    assertThat(state.indentsEntered()).isGreaterThan(0);
    String out = state.contents();
    assertThat(out).contains("pub fn init(start: i64) anyerror!*Counter {");
    assertThat(out).contains("const self = try __global_allocator.create(Counter);");
    assertThat(out).contains("self.count += n;");
    assertThat(out).contains("var s: i64 = 0;");
    assertThat(out).contains("while (i < n) : (i += 1) {");
    assertThat(out).contains("const c: *Counter = try Counter.init(1);");
    assertThat(out).contains("print(\"{d}\\n\", .{ try c.bump(try total(10)) });");
  }

  @Test
  public void unknownMethodIsUnresolved() {
    Ast.Module module = module(exprStmt(methodCall(name("foo"), "bar")));
    CompileError.UnresolvedSymbol e =
        assertThrows(CompileError.UnresolvedSymbol.class, () -> emit(module));
    assertThat(e.symbol).isEqualTo("foo.bar");
  }

  @Test
  public void errorsInFunctionsNameTheFunction() {
    Ast.Module module = module(def("f", List.of(), exprStmt(call("nope"))));
    CompileError e = assertThrows(CompileError.class, () -> emit(module));
    assertThat(e).hasMessageThat().isEqualTo("Unresolved symbol 'builtins.nope' (in f)");
  }

  @Test
  public void preambleIsGatedOnRequirements() {
    String plain = emit(module(print(constant(1)))).contents();
    assertThat(plain).doesNotContain("allocator_helper");
    assertThat(plain).doesNotContain("hashmap_helper");
    assertThat(plain).doesNotContain("string_utils");
    assertThat(plain).doesNotContain("runtime.json");

    Ast.Expr dict = Ast.dict(constant("k"), methodCall(constant("v"), "upper"));
    String rich = emit(module(print(call("json.dumps", dict)))).contents();
    assertThat(rich).contains("const string_utils = @import(\"string_utils.zig\");");
    assertThat(rich).contains("const hashmap_helper = @import(\"./utils/hashmap_helper.zig\");");
    assertThat(rich)
        .contains("const allocator_helper = @import(\"./utils/allocator_helper.zig\");");
    assertThat(rich).contains("const json = runtime.json;");
    assertThat(rich).doesNotContain("runtime.http");
    assertThat(rich).contains("var __global_allocator: std.mem.Allocator = undefined;");
    assertThat(rich).contains("if (comptime allocator_helper.useFastAllocator()) {");
  }

  @Test
  public void engineIsSingleUse() {
    Ast.Module module = module();
    EmissionEngine engine =
        new EmissionEngine(
            RequirementAnalyzer.analyze(module),
            StandardHandlers.registry(),
            CompilerOptions.defaults());
    engine.emitModule(module, "main");
    assertThrows(IllegalStateException.class, () -> engine.emitModule(module, "main"));
  }

  @Test
  public void stringLiteralPlusUntypedValueIsConcatenation() {
    Ast.Module module =
        module(
            def(
                "greet",
                List.of("who"),
                print(binOp(constant("hi "), BinaryOp.ADD, name("who"))),
                print(binOp(name("who"), BinaryOp.ADD, constant("!")))));
    assertThat(emit(module).contents())
        .contains(
            String.join(
                "\n",
                "fn greet(who: anytype) anyerror!void {",
                "    try std.io.getStdOut().writer().print(\"{s}\\n\", .{ try std.mem.concat("
                    + "__global_allocator, u8, &.{ \"hi \", who }) });",
                "    try std.io.getStdOut().writer().print(\"{s}\\n\", .{ try std.mem.concat("
                    + "__global_allocator, u8, &.{ who, \"!\" }) });",
                "}",
                ""));
  }

  @Test
  public void stringLiteralTimesUntypedValueIsRepetition() {
    Ast.Module module =
        module(
            def(
                "rule",
                List.of("n"),
                print(binOp(constant("-"), BinaryOp.MULT, name("n")))));
    assertThat(emit(module).contents())
        .contains(
            "print(\"{s}\\n\", .{ try runtime.string.repeat(__global_allocator, \"-\", n) });");
  }

  @Test
  public void comprehensionOverComprehension() {
    Ast.Module module =
        module(
            def(
                "f",
                List.of(),
                assign("xs", list(constant(1), constant(2), constant(3))),
                assign(
                    "ys",
                    listComp(
                        binOp(name("x"), BinaryOp.MULT, constant(2)),
                        comprehension(name("x"), name("xs")))),
                assign(
                    "zs",
                    listComp(
                        binOp(name("y"), BinaryOp.ADD, constant(1)),
                        comprehension(name("y"), name("ys")))),
                print(call("len", name("zs")))));
    String out = emit(module).contents();
    assertThat(out)
        .containsMatch(
            "const ys = (comp_\\d+): \\{ var (__comp_\\d+) = std.ArrayList\\(i64\\)\\{\\}; "
                + "for \\(xs\\) \\|x\\| \\{ try \\2.append\\(__global_allocator, "
                + "\\(x \\* 2\\)\\); \\} break :\\1 \\2; \\};");
    assertThat(out)
        .containsMatch(
            "const zs = (comp_\\d+): \\{ var (__comp_\\d+) = std.ArrayList\\(i64\\)\\{\\}; "
                + "for \\(ys.items\\) \\|y\\| \\{ try \\2.append\\(__global_allocator, "
                + "\\(y \\+ 1\\)\\); \\} break :\\1 \\2; \\};");
  }
}
