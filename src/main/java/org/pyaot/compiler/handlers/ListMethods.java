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
 * Handlers for methods of {@code list}, registered as "list.<method>". The receiver, a {@code
 * std.ArrayList}, is passed as the first argument.
 */
public final class ListMethods {

  // Static methods only
  private ListMethods() {}

  static void register(HandlerRegistry.Builder builder) {
    builder
        .add("list.append", Handler.statement(2, ListMethods::append))
        .add("list.extend", Handler.statement(2, ListMethods::extend))
        .add("list.insert", Handler.statement(3, ListMethods::insert))
        .add("list.pop", Handler.expression(1, 2, ListMethods::pop))
        .add("list.remove", Handler.statement(2, ListMethods::remove))
        .add("list.clear", Handler.statement(1, receiverCall("clearRetainingCapacity")))
        .add(
            "list.reverse",
            CallPattern.of("runtime.list.reverse", 1).noAllocator().noTry().returnsNone())
        .add(
            "list.sort",
            CallPattern.of("runtime.list.sort", 1).noAllocator().noTry().returnsNone())
        .add("list.index", CallPattern.of("runtime.list.index", 2).noAllocator())
        .add("list.count", CallPattern.of("runtime.list.count", 2).noAllocator().noTry());
  }

  /** Returns a body that writes {@code receiver.<method>()}. */
  static Handler.Body receiverCall(String method) {
    return (out, args) -> {
      out.emitExpr(args.get(0));
      out.write("." + method + "()");
    };
  }

  private static void append(Emitter out, List<Expr> args) {
    out.write("try ");
    out.emitExpr(args.get(0));
    out.write(".append(" + out.allocator("list.append") + ", ");
    out.emitExpr(args.get(1));
    out.write(")");
  }

  private static void extend(Emitter out, List<Expr> args) {
    out.write("try ");
    out.emitExpr(args.get(0));
    out.write(".appendSlice(" + out.allocator("list.extend") + ", ");
    out.emitItems(args.get(1));
    out.write(")");
  }

  private static void insert(Emitter out, List<Expr> args) {
    out.write("try ");
    out.emitExpr(args.get(0));
    out.write(".insert(" + out.allocator("list.insert") + ", @intCast(");
    out.emitExpr(args.get(1));
    out.write("), ");
    out.emitExpr(args.get(2));
    out.write(")");
  }

  /** {@code xs.pop()} removes the last element; {@code xs.pop(i)} removes the i'th. */
  private static void pop(Emitter out, List<Expr> args) {
    out.emitExpr(args.get(0));
    if (args.size() == 1) {
      out.write(".pop().?");
    } else {
      out.write(".orderedRemove(@intCast(");
      out.emitExpr(args.get(1));
      out.write("))");
    }
  }

  private static void remove(Emitter out, List<Expr> args) {
    out.write("try runtime.list.remove(&");
    out.emitExpr(args.get(0));
    out.write(", ");
    out.emitExpr(args.get(1));
    out.write(")");
  }
}
