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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.BinOp;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.UnaryOp;
import org.pyaot.analysis.InferredType;
import org.pyaot.analysis.RequirementSet;

/** The view of an in-progress compilation that is given to each {@link Handler}. */
public interface Emitter {

  /** The name of the module-level variable holding the allocator in emitted code. */
  String ALLOCATOR = "__global_allocator";

  EmissionState state();

  CompilerOptions options();

  /** The requirements computed for the module being compiled. */
  RequirementSet requirements();

  /** Emits the given expression inline. */
  void emitExpr(Expr expr);

  /** Returns the best guess at the type of {@code expr}. */
  InferredType typeOf(Expr expr);

  /**
   * Emits {@code expr} in a form that can be iterated, sliced, or have its {@code .len} taken,
   * i.e. with a trailing {@code .items} if it is a dynamic list.
   */
  void emitItems(Expr expr);

  /** Emits {@code expr} as a Zig {@code bool}, applying Python's truthiness rules. */
  void emitCondition(Expr expr);

  /** Returns the {@code std.fmt} placeholder for printing {@code expr}, e.g. "{d}" or "{s}". */
  String formatSpec(Expr expr);

  /** If {@code expr} is known to be an instance of a user class, returns that class. */
  ClassHierarchy.@Nullable ClassInfo classOf(Expr expr);

  /** The name of the receiver parameter of the method being emitted, or null. */
  @Nullable String selfName();

  /** Appends text to the output. */
  default void write(String text) {
    state().write(text);
  }

  /** Emits each expression, separated by ", ". */
  default void emitArgs(List<Expr> args) {
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        write(", ");
      }
      emitExpr(args.get(i));
    }
  }

  /**
   * Returns the expression that refers to the allocator in emitted code; throws a CompileError if
   * the module was analyzed as not needing one.
   *
   * @param construct a description of what needs the allocator, for the error message
   */
  default String allocator(String construct) {
    if (!requirements().needsAllocator()) {
      throw CompileError.allocationGap(construct);
    }
    return ALLOCATOR;
  }

  /**
   * For each of {@code args} that contains a call, writes a statement that evaluates and discards
   * it ({@code _ = f(x); }). Used by handlers that don't need their arguments' values, since Zig
   * rejects unused values.
   */
  default void discardCalls(List<Expr> args) {
    for (Expr arg : args) {
      if (containsCall(arg)) {
        write("_ = ");
        emitExpr(arg);
        write("; ");
      }
    }
  }

  /** Returns true if evaluating {@code expr} might have side effects. */
  static boolean containsCall(Expr expr) {
    if (expr instanceof Call) {
      return true;
    } else if (expr instanceof Attribute attribute) {
      return containsCall(attribute.value());
    } else if (expr instanceof BinOp binOp) {
      return containsCall(binOp.left()) || containsCall(binOp.right());
    } else if (expr instanceof Subscript subscript) {
      return containsCall(subscript.value()) || containsCall(subscript.index());
    } else if (expr instanceof UnaryOp unary) {
      return containsCall(unary.operand());
    }
    return false;
  }
}
