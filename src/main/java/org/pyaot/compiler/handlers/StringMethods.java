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

import java.util.List;
import org.pyaot.Ast.Expr;
import org.pyaot.compiler.CallPattern;
import org.pyaot.compiler.Emitter;
import org.pyaot.compiler.Handler;
import org.pyaot.compiler.HandlerRegistry;

/**
 * Handlers for methods of {@code str}, registered as "str.<method>". The receiver is passed as
 * the first argument.
 */
public final class StringMethods {

  // Static methods only
  private StringMethods() {}

  /** The characters removed by strip() when none are given. */
  private static final String WHITESPACE = "\" \\t\\n\\r\"";

  static void register(HandlerRegistry.Builder builder) {
    builder
        .add("str.upper", CallPattern.of("string_utils.toUpper", 1))
        .add("str.lower", CallPattern.of("string_utils.toLower", 1))
        .add("str.replace", Handler.expression(3, StringMethods::replace))
        .add("str.split", Handler.expression(1, 2, StringMethods::split))
        .add("str.join", Handler.expression(2, StringMethods::join))
        .add("str.strip", Handler.expression(1, 2, trim("trim")))
        .add("str.lstrip", Handler.expression(1, 2, trim("trimLeft")))
        .add("str.rstrip", Handler.expression(1, 2, trim("trimRight")))
        .add("str.startswith", Handler.expression(2, memCall("startsWith")))
        .add("str.endswith", Handler.expression(2, memCall("endsWith")))
        .add("str.find", Handler.expression(2, StringMethods::find))
        .add("str.count", Handler.expression(2, StringMethods::count))
        .add("str.isdigit", CallPattern.of("runtime.string.isDigit", 1).noAllocator().noTry())
        .add("str.isalpha", CallPattern.of("runtime.string.isAlpha", 1).noAllocator().noTry())
        .add("str.isspace", CallPattern.of("runtime.string.isSpace", 1).noAllocator().noTry());
  }

  /** Returns a body that writes {@code std.mem.<fn>(u8, args...)}. */
  private static Handler.Body memCall(String fn) {
    return (out, args) -> {
      out.write("std.mem." + fn + "(u8, ");
      out.emitArgs(args);
      out.write(")");
    };
  }

  private static Handler.Body trim(String fn) {
    return (out, args) -> {
      out.write("std.mem." + fn + "(u8, ");
      out.emitExpr(args.get(0));
      out.write(", ");
      if (args.size() == 2) {
        out.emitExpr(args.get(1));
      } else {
        out.write(WHITESPACE);
      }
      out.write(")");
    };
  }

  private static void replace(Emitter out, List<Expr> args) {
    out.write("try std.mem.replaceOwned(u8, " + out.allocator("str.replace") + ", ");
    out.emitArgs(args);
    out.write(")");
  }

  /**
   * {@code s.split(sep)} is a list of the parts of s; without a separator, s is split on runs of
   * whitespace.
   */
  private static void split(Emitter out, List<Expr> args) {
    String allocator = out.allocator("str.split");
    String label = out.state().freshLabel("split");
    String result = "__" + label;
    out.write(label + ": { var " + result + " = std.ArrayList([]const u8){}; ");
    out.write("var " + result + "_it = ");
    if (args.size() == 2) {
      out.write("std.mem.splitSequence(u8, ");
      out.emitExpr(args.get(0));
      out.write(", ");
      out.emitExpr(args.get(1));
    } else {
      out.write("std.mem.tokenizeAny(u8, ");
      out.emitExpr(args.get(0));
      out.write(", " + WHITESPACE);
    }
    out.write("); while (" + result + "_it.next()) |" + result + "_part| try " + result);
    out.write(".append(" + allocator + ", " + result + "_part); ");
    out.write("break :" + label + " " + result + "; }");
  }

  /** {@code sep.join(items)}. */
  private static void join(Emitter out, List<Expr> args) {
    out.write("try std.mem.join(" + out.allocator("str.join") + ", ");
    out.emitExpr(args.get(0));
    out.write(", ");
    out.emitItems(args.get(1));
    out.write(")");
  }

  /** {@code s.find(sub)} is the index of the first occurrence of sub, or -1. */
  private static void find(Emitter out, List<Expr> args) {
    String index = "__" + out.state().freshLabel("find");
    out.write("(if (std.mem.indexOf(u8, ");
    out.emitArgs(args);
    out.write(")) |" + index + "| @as(i64, @intCast(" + index + ")) else -1)");
  }

  private static void count(Emitter out, List<Expr> args) {
    out.write("@as(i64, @intCast(std.mem.count(u8, ");
    out.emitArgs(args);
    out.write(")))");
  }
}
