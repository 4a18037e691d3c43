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
 * Handlers for methods of {@code dict}, registered as "dict.<method>". The receiver, a hash map,
 * is passed as the first argument.
 */
public final class DictMethods {

  // Static methods only
  private DictMethods() {}

  static void register(HandlerRegistry.Builder builder) {
    builder
        .add("dict.get", Handler.expression(2, 3, DictMethods::get))
        .add("dict.pop", Handler.expression(2, DictMethods::pop))
        .add("dict.update", Handler.statement(2, DictMethods::update))
        .add(
            "dict.clear", Handler.statement(1, ListMethods.receiverCall("clearRetainingCapacity")))
        .add("dict.keys", CallPattern.of("runtime.dict.keys", 1))
        .add("dict.values", CallPattern.of("runtime.dict.values", 1))
        .add("dict.items", CallPattern.of("runtime.dict.items", 1));
  }

  /** {@code d.get(k, default)}; without a default the result is optional. */
  private static void get(Emitter out, List<Expr> args) {
    if (args.size() == 3) {
      out.write("(");
    }
    out.emitExpr(args.get(0));
    out.write(".get(");
    out.emitExpr(args.get(1));
    out.write(")");
    if (args.size() == 3) {
      out.write(" orelse ");
      out.emitExpr(args.get(2));
      out.write(")");
    }
  }

  private static void pop(Emitter out, List<Expr> args) {
    out.emitExpr(args.get(0));
    out.write(".fetchRemove(");
    out.emitExpr(args.get(1));
    out.write(").?.value");
  }

  private static void update(Emitter out, List<Expr> args) {
    out.write("try runtime.dict.update(&");
    out.emitExpr(args.get(0));
    out.write(", ");
    out.emitExpr(args.get(1));
    out.write(")");
  }
}
