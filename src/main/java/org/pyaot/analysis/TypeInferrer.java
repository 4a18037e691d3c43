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

package org.pyaot.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.BinOp;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.BoolOp;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.Compare;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.DictComp;
import org.pyaot.Ast.DictExpr;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.FString;
import org.pyaot.Ast.IfExp;
import org.pyaot.Ast.ListComp;
import org.pyaot.Ast.ListExpr;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.TupleExpr;
import org.pyaot.Ast.UnaryOp;
import org.pyaot.Ast.UnaryOperator;

/**
 * A best-effort classifier of expressions. Results are only ever used to choose between
 * equivalent encodings, so any expression it doesn't recognize is simply {@link
 * InferredType#UNKNOWN}; inference never fails.
 *
 * <p>A TypeInferrer also tracks the types of local variables, in a stack of scopes that the
 * emitter pushes and pops as it enters and leaves function bodies and blocks. A TypeInferrer is
 * owned by a single compilation and is not thread-safe.
 */
public final class TypeInferrer {

  private static final ImmutableMap<String, InferredType> BUILTIN_RESULTS =
      ImmutableMap.<String, InferredType>builder()
          .put("len", InferredType.INT)
          .put("int", InferredType.INT)
          .put("abs", InferredType.UNKNOWN)
          .put("float", InferredType.FLOAT)
          .put("str", InferredType.STRING)
          .put("repr", InferredType.STRING)
          .put("list", InferredType.SEQUENCE)
          .put("sorted", InferredType.SEQUENCE)
          .put("reversed", InferredType.SEQUENCE)
          .put("dict", InferredType.MAPPING)
          .buildOrThrow();

  /** String methods whose result is another string. */
  private static final ImmutableSet<String> STRING_TO_STRING_METHODS =
      ImmutableSet.of(
          "upper", "lower", "strip", "lstrip", "rstrip", "replace", "join", "capitalize", "title");

  private final Deque<Map<String, InferredType>> scopes = new ArrayDeque<>();

  public TypeInferrer() {
    enterScope();
  }

  /** Starts a new innermost scope; must be paired with a call to {@link #exitScope}. */
  public void enterScope() {
    scopes.push(new HashMap<>());
  }

  /** Discards the innermost scope and any variables that were first bound in it. */
  public void exitScope() {
    Preconditions.checkState(scopes.size() > 1, "exitScope() without matching enterScope()");
    scopes.pop();
  }

  /** Returns the number of open scopes, including the outermost one. */
  public int depth() {
    return scopes.size();
  }

  /**
   * Records that {@code name} is assigned a value of the given type. If the name is already
   * visible its type becomes the join of the old and new types; otherwise it is bound in the
   * innermost scope.
   */
  public void bind(String name, InferredType type) {
    for (Map<String, InferredType> scope : scopes) {
      InferredType prev = scope.get(name);
      if (prev != null) {
        scope.put(name, prev.join(type));
        return;
      }
    }
    scopes.peek().put(name, type);
  }

  /** Returns the type bound to {@code name}, or null if it is not visible. */
  public @Nullable InferredType lookup(String name) {
    for (Map<String, InferredType> scope : scopes) {
      InferredType type = scope.get(name);
      if (type != null) {
        return type;
      }
    }
    return null;
  }

  /** Returns the inferred type of {@code expr}. */
  public InferredType infer(Expr expr) {
    if (expr instanceof Constant constant) {
      switch (constant.kind()) {
        case INT:
        case BOOL:
          return InferredType.INT;
        case FLOAT:
          return InferredType.FLOAT;
        case STRING:
          return InferredType.STRING;
        case NONE:
          return InferredType.UNKNOWN;
      }
    } else if (expr instanceof Name name) {
      InferredType type = lookup(name.id());
      return (type == null) ? InferredType.UNKNOWN : type;
    } else if (expr instanceof ListExpr
        || expr instanceof TupleExpr
        || expr instanceof ListComp) {
      return InferredType.SEQUENCE;
    } else if (expr instanceof DictExpr || expr instanceof DictComp) {
      return InferredType.MAPPING;
    } else if (expr instanceof FString) {
      return InferredType.STRING;
    } else if (expr instanceof BinOp binOp) {
      return binary(binOp);
    } else if (expr instanceof UnaryOp unary) {
      if (unary.op() == UnaryOperator.NOT) {
        return InferredType.INT;
      }
      InferredType operand = infer(unary.operand());
      return operand.isNumeric() ? operand : InferredType.UNKNOWN;
    } else if (expr instanceof Compare || expr instanceof BoolOp) {
      // Booleans are classified with the integers.
      return InferredType.INT;
    } else if (expr instanceof IfExp ifExp) {
      return infer(ifExp.body()).join(infer(ifExp.orElse()));
    } else if (expr instanceof Call call) {
      return call(call);
    } else if (expr instanceof Subscript subscript) {
      if (infer(subscript.value()) == InferredType.STRING) {
        return InferredType.STRING;
      }
    }
    return InferredType.UNKNOWN;
  }

  private InferredType binary(BinOp binOp) {
    InferredType left = infer(binOp.left());
    InferredType right = infer(binOp.right());
    BinaryOp op = binOp.op();
    if (op == BinaryOp.DIV) {
      return (left.isNumeric() && right.isNumeric()) ? InferredType.FLOAT : InferredType.UNKNOWN;
    } else if (op == BinaryOp.ADD
        && (left == InferredType.STRING || right == InferredType.STRING)) {
      // A str can only be added to another str.
      return InferredType.STRING;
    } else if (op == BinaryOp.ADD && left == right) {
      // Covers numbers of one kind and sequence concatenation.
      return (left == InferredType.MAPPING) ? InferredType.UNKNOWN : left;
    } else if (op == BinaryOp.MULT && isRepetition(left, right)) {
      return InferredType.STRING;
    } else if (left.isNumeric() && right.isNumeric()) {
      return left.join(right);
    }
    return InferredType.UNKNOWN;
  }

  /** True if {@code left * right} repeats a string: one side is a str, the other may be an int. */
  public static boolean isRepetition(InferredType left, InferredType right) {
    return (left == InferredType.STRING && canBeInt(right))
        || (right == InferredType.STRING && canBeInt(left));
  }

  private static boolean canBeInt(InferredType type) {
    return type == InferredType.INT || type == InferredType.UNKNOWN;
  }

  private InferredType call(Call call) {
    if (call.func() instanceof Name name) {
      InferredType result = BUILTIN_RESULTS.get(name.id());
      if (result == InferredType.UNKNOWN && !call.args().isEmpty()) {
        // abs() preserves its argument's numeric type.
        InferredType arg = infer(call.args().get(0));
        return arg.isNumeric() ? arg : InferredType.UNKNOWN;
      }
      return (result == null) ? InferredType.UNKNOWN : result;
    } else if (call.func() instanceof Attribute attribute) {
      String method = attribute.attr();
      if (STRING_TO_STRING_METHODS.contains(method) || method.equals("format")) {
        InferredType receiver = infer(attribute.value());
        if (receiver == InferredType.STRING) {
          return InferredType.STRING;
        }
      } else if (method.equals("split")) {
        return InferredType.SEQUENCE;
      }
    }
    return InferredType.UNKNOWN;
  }
}
