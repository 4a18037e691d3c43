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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * All errors detected while compiling a module throw a CompileError. There is no recovery: the
 * first CompileError aborts compilation of the enclosing module, and no output is produced.
 */
public class CompileError extends RuntimeException {
  public final String msg;

  /** The qualified name of the function or class being emitted, if known. */
  private @Nullable String context;

  public CompileError(String msg) {
    super(msg);
    this.msg = msg;
  }

  public @Nullable String context() {
    return context;
  }

  /**
   * Records where this error was detected, unless an inner context was already recorded. Returns
   * this error, so that it can be rethrown.
   */
  CompileError inContext(@Nullable String context) {
    if (this.context == null) {
      this.context = context;
    }
    return this;
  }

  @Override
  public String getMessage() {
    return (context == null) ? msg : String.format("%s (in %s)", msg, context);
  }

  /** Returns a new CompileError with the given message. */
  public static CompileError error(String msg) {
    return new CompileError(msg);
  }

  /** Returns a new CompileError with a formatted message. */
  @FormatMethod
  public static CompileError error(String fmt, Object... fmtArgs) {
    return new CompileError(String.format(fmt, fmtArgs));
  }

  /** Returns a new "Unresolved symbol '%s'" CompileError. */
  public static UnresolvedSymbol unresolved(String symbol) {
    return new UnresolvedSymbol(symbol);
  }

  /** Returns a new ArityMismatch for a call to {@code symbol} with {@code actual} arguments. */
  public static ArityMismatch arity(String symbol, int min, int max, int actual) {
    return new ArityMismatch(symbol, min, max, actual);
  }

  /** Returns a new "%s is not supported" CompileError. */
  public static Unsupported unsupported(String construct) {
    return new Unsupported(construct);
  }

  /** Returns a new "%s is not supported" CompileError with a formatted construct description. */
  @FormatMethod
  public static Unsupported unsupported(String fmt, Object... fmtArgs) {
    return new Unsupported(String.format(fmt, fmtArgs));
  }

  /**
   * Returns a new CompileError for a construct that must allocate in a module that was analyzed
   * as not needing an allocator.
   */
  public static CompileError allocationGap(String construct) {
    return error("%s needs an allocator, but none was provided for this module", construct);
  }

  /** Thrown when a called function, method, or attribute has no handler. */
  public static class UnresolvedSymbol extends CompileError {
    public final String symbol;

    UnresolvedSymbol(String symbol) {
      super(String.format("Unresolved symbol '%s'", symbol));
      this.symbol = symbol;
    }
  }

  /** Thrown when a handler is called with too few or too many arguments. */
  public static class ArityMismatch extends CompileError {
    public final String symbol;
    public final int min;
    public final int max;
    public final int actual;

    ArityMismatch(String symbol, int min, int max, int actual) {
      super(describe(symbol, min, max, actual));
      this.symbol = symbol;
      this.min = min;
      this.max = max;
      this.actual = actual;
    }

    private static String describe(String symbol, int min, int max, int actual) {
      String expected;
      if (min == max) {
        expected = String.valueOf(min);
      } else if (max == Integer.MAX_VALUE) {
        expected = "at least " + min;
      } else {
        expected = min + " to " + max;
      }
      return String.format("'%s' expects %s argument(s), got %s", symbol, expected, actual);
    }
  }

  /** Thrown for Python constructs that have no translation. */
  public static class Unsupported extends CompileError {
    public final String construct;

    Unsupported(String construct) {
      super(construct + " is not supported");
      this.construct = construct;
    }
  }
}
