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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.pyaot.Ast.Expr;
import org.pyaot.analysis.InferredType;
import org.pyaot.compiler.CallPattern;
import org.pyaot.compiler.Emitter;
import org.pyaot.compiler.Handler;
import org.pyaot.compiler.HandlerRegistry;

/**
 * Handlers for functions of the supported stdlib modules. Most are described by a {@link
 * CallPattern}, translating the Python function to a single call into the runtime library; the
 * rest map to Zig builtins or std functions.
 */
public final class StdlibModules {

  // Static methods only
  private StdlibModules() {}

  static final ImmutableMap<String, CallPattern> JSON =
      ImmutableMap.of(
          "loads", CallPattern.of("json.loads", 1),
          "dumps", CallPattern.of("json.dumps", 1).upTo(2));

  static final ImmutableMap<String, CallPattern> HTTP =
      ImmutableMap.of(
          "get", CallPattern.of("http.get", 1).projecting("body"),
          "post", CallPattern.of("http.post", 2).projecting("body"),
          "status", CallPattern.of("http.get", 1).projecting("status"));

  static final ImmutableMap<String, CallPattern> ASYNCIO =
      ImmutableMap.of(
          "run", CallPattern.of("asyncio.run", 1),
          "sleep", CallPattern.of("asyncio.sleep", 1).noAllocator().returnsNone());

  static final ImmutableMap<String, CallPattern> TIME =
      ImmutableMap.of(
          "time", CallPattern.of("runtime.time.time", 0).noAllocator().noTry(),
          "sleep", CallPattern.of("runtime.time.sleep", 1).noAllocator().noTry().returnsNone());

  static final ImmutableMap<String, CallPattern> RANDOM =
      ImmutableMap.of(
          "random", CallPattern.of("runtime.random.random", 0).noAllocator().noTry(),
          "randint", CallPattern.of("runtime.random.randint", 2).noAllocator().noTry(),
          "choice", CallPattern.of("runtime.random.choice", 1).noAllocator().noTry());

  static final ImmutableMap<String, CallPattern> OS_PATH =
      ImmutableMap.of(
          "exists", CallPattern.of("runtime.os.path.exists", 1).noAllocator().noTry(),
          "basename", CallPattern.of("std.fs.path.basename", 1).noAllocator().noTry());

  static final ImmutableMap<String, CallPattern> RE =
      ImmutableMap.of(
          "search", CallPattern.of("runtime.re.search", 2),
          "match", CallPattern.of("runtime.re.match", 2),
          "sub", CallPattern.of("runtime.re.sub", 3),
          "findall", CallPattern.of("runtime.re.findall", 2),
          "compile", CallPattern.of("runtime.re.compile", 1));

  static final ImmutableMap<String, CallPattern> BASE64 =
      ImmutableMap.of(
          "b64encode", CallPattern.of("runtime.base64.b64encode", 1),
          "b64decode", CallPattern.of("runtime.base64.b64decode", 1));

  static void register(HandlerRegistry.Builder builder) {
    builder
        .addModule("json", JSON)
        .addModule("http", HTTP)
        .addModule("asyncio", ASYNCIO)
        .addModule("time", TIME)
        .addModule("random", RANDOM)
        .addModule("os.path", OS_PATH)
        .addModule("re", RE)
        .addModule("base64", BASE64)
        .add("asyncio.gather", Handler.expression(1, Integer.MAX_VALUE, StdlibModules::gather))
        .add("os.path.join", Handler.expression(1, Integer.MAX_VALUE, StdlibModules::pathJoin))
        .add("math.pi", constant("std.math.pi"))
        .add("math.e", constant("std.math.e"))
        .add("math.sqrt", Handler.expression(1, StdlibModules::sqrt))
        .add("math.floor", Handler.expression(1, rounding("@floor")))
        .add("math.ceil", Handler.expression(1, rounding("@ceil")))
        .add("math.pow", Handler.expression(2, StdlibModules::pow))
        .add("sys.platform", Handler.expression(0, StdlibModules::platform))
        .add("sys.exit", Handler.statement(0, 1, StdlibModules::exit));
  }

  /** A module attribute whose value is a fixed Zig expression. */
  private static Handler constant(String zig) {
    return Handler.expression(0, (out, args) -> out.write(zig));
  }

  private static void gather(Emitter out, List<Expr> args) {
    out.write("try asyncio.gather(" + out.allocator("asyncio.gather") + ", .{ ");
    out.emitArgs(args);
    out.write(" })");
  }

  private static void pathJoin(Emitter out, List<Expr> args) {
    out.write("try std.fs.path.join(" + out.allocator("os.path.join") + ", &.{ ");
    out.emitArgs(args);
    out.write(" })");
  }

  private static void sqrt(Emitter out, List<Expr> args) {
    out.write("@sqrt(");
    BuiltinHandlers.asFloat(out, args.get(0));
    out.write(")");
  }

  /** {@code math.floor} and {@code math.ceil} return ints. */
  private static Handler.Body rounding(String builtin) {
    return (out, args) -> {
      Expr arg = args.get(0);
      if (out.typeOf(arg) == InferredType.INT) {
        out.emitExpr(arg);
      } else {
        out.write("@as(i64, @intFromFloat(" + builtin + "(");
        out.emitExpr(arg);
        out.write(")))");
      }
    };
  }

  private static void pow(Emitter out, List<Expr> args) {
    out.write("std.math.pow(f64, ");
    BuiltinHandlers.asFloat(out, args.get(0));
    out.write(", ");
    BuiltinHandlers.asFloat(out, args.get(1));
    out.write(")");
  }

  /** {@code sys.platform} is determined by the target the program is compiled for. */
  private static void platform(Emitter out, List<Expr> args) {
    out.write(
        "switch (@import(\"builtin\").os.tag) { .linux => \"linux\", .macos => \"darwin\","
            + " .windows => \"win32\", else => \"unknown\" }");
  }

  private static void exit(Emitter out, List<Expr> args) {
    out.write("std.process.exit(");
    if (args.isEmpty()) {
      out.write("0");
    } else {
      out.write("@intCast(");
      out.emitExpr(args.get(0));
      out.write(")");
    }
    out.write(")");
  }
}
