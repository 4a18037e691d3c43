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

import com.google.common.base.Preconditions;
import java.util.List;
import org.pyaot.Ast.Expr;

/**
 * Emits the Zig code for a call to one Python function or method. A Handler is registered in a
 * {@link HandlerRegistry} under a qualified symbol ("json.loads", "str.upper", "builtins.len").
 *
 * <p>The registry checks the number of arguments against {@link #minArgs} and {@link #maxArgs}
 * before the handler's body is called, so bodies may assume the count is in range. For a method
 * the receiver is passed as the first argument.
 */
public final class Handler {

  /** The code that does the work. */
  @FunctionalInterface
  public interface Body {
    /**
     * Writes the Zig code for a call with the given (unevaluated) arguments. Every argument must
     * either be emitted or explicitly discarded.
     */
    void emit(Emitter out, List<Expr> args);
  }

  public final int minArgs;
  public final int maxArgs;

  /**
   * False if the emitted code is a statement rather than an expression (e.g. {@code print}), so
   * that a call used as an expression statement must not be wrapped in a discard.
   */
  public final boolean producesValue;

  private final Body body;

  private Handler(int minArgs, int maxArgs, boolean producesValue, Body body) {
    Preconditions.checkArgument(minArgs >= 0 && minArgs <= maxArgs);
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.producesValue = producesValue;
    this.body = body;
  }

  /** Returns a Handler whose emitted code is an expression. */
  public static Handler expression(int minArgs, int maxArgs, Body body) {
    return new Handler(minArgs, maxArgs, true, body);
  }

  /** Returns a Handler whose emitted code is an expression, taking exactly {@code n} arguments. */
  public static Handler expression(int n, Body body) {
    return expression(n, n, body);
  }

  /** Returns a Handler whose emitted code has no value. */
  public static Handler statement(int minArgs, int maxArgs, Body body) {
    return new Handler(minArgs, maxArgs, false, body);
  }

  /** Returns a Handler whose emitted code has no value, taking exactly {@code n} arguments. */
  public static Handler statement(int n, Body body) {
    return statement(n, n, body);
  }

  /** Returns true if a call with {@code n} arguments is acceptable. */
  public boolean accepts(int n) {
    return n >= minArgs && n <= maxArgs;
  }

  /**
   * Emits a call to {@code symbol} with the given arguments; throws {@link
   * CompileError.ArityMismatch} if the number of arguments is out of range.
   */
  public void emit(String symbol, Emitter out, List<Expr> args) {
    if (!accepts(args.size())) {
      throw CompileError.arity(symbol, minArgs, maxArgs, args.size());
    }
    body.emit(out, args);
  }
}
