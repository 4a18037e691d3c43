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

import static org.pyaot.analysis.Capability.ALLOCATOR;
import static org.pyaot.analysis.Capability.ASYNC;
import static org.pyaot.analysis.Capability.HASHMAP_HELPER;
import static org.pyaot.analysis.Capability.HTTP;
import static org.pyaot.analysis.Capability.JSON;
import static org.pyaot.analysis.Capability.RUNTIME;
import static org.pyaot.analysis.Capability.STD;
import static org.pyaot.analysis.Capability.STRING_UTILS;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast;
import org.pyaot.Ast.Assert;
import org.pyaot.Ast.Assign;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.AugAssign;
import org.pyaot.Ast.BinOp;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.BoolOp;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.ClassDef;
import org.pyaot.Ast.Compare;
import org.pyaot.Ast.CompareOp;
import org.pyaot.Ast.Comprehension;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.Ast.DictComp;
import org.pyaot.Ast.DictExpr;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.FString;
import org.pyaot.Ast.FStringValue;
import org.pyaot.Ast.For;
import org.pyaot.Ast.FunctionDef;
import org.pyaot.Ast.If;
import org.pyaot.Ast.IfExp;
import org.pyaot.Ast.ListComp;
import org.pyaot.Ast.ListExpr;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Slice;
import org.pyaot.Ast.Stmt;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.TupleExpr;
import org.pyaot.Ast.UnaryOp;
import org.pyaot.Ast.While;

/**
 * Computes the {@link RequirementSet} of a module: which pieces of runtime support the emitted
 * program will need. This is a purely structural recursion over the tree; it does no type
 * inference and no I/O, and analyzing the same tree twice always gives the same result.
 *
 * <p>Each node's requirements are the merge of its own requirements with those of its children.
 * Nodes the analyzer doesn't understand ({@code try}, {@code raise}, {@code lambda}, {@code
 * await}) are treated as requiring nothing, but each one is recorded as an {@link AnalysisGap} so
 * that the resulting false negatives can be found.
 */
public final class RequirementAnalyzer {

  /** The result of analyzing a module: its requirements and any nodes that were skipped. */
  public record Result(RequirementSet requirements, ImmutableList<AnalysisGap> gaps) {}

  /** Calls to {@code <module>.<anything>} for these modules need the corresponding support. */
  private static final ImmutableMap<String, RequirementSet> RESOURCE_MODULES =
      ImmutableMap.of(
          "json", RequirementSet.of(JSON, ALLOCATOR),
          "http", RequirementSet.of(HTTP, RUNTIME, ALLOCATOR),
          "asyncio", RequirementSet.of(ASYNC, RUNTIME, ALLOCATOR),
          // These runtime modules take the allocator for their results.
          "re", RequirementSet.of(ALLOCATOR),
          "base64", RequirementSet.of(ALLOCATOR),
          "os", RequirementSet.of(ALLOCATOR));

  /** Method names that grow or copy a sequence, whatever the receiver turns out to be. */
  private static final ImmutableSet<String> MUTATING_SEQUENCE_METHODS =
      ImmutableSet.of("append", "extend", "insert", "remove", "clone");

  /** String methods that build a new string of a different case. */
  private static final ImmutableSet<String> CASE_METHODS = ImmutableSet.of("upper", "lower");

  /** String methods that build new strings or lists of strings. */
  private static final ImmutableSet<String> SPLITTING_METHODS =
      ImmutableSet.of("replace", "split", "join");

  /** Mapping views that the runtime copies into a new list. */
  private static final ImmutableSet<String> VIEW_METHODS =
      ImmutableSet.of("keys", "values", "items");

  /** Builtins whose result is a freshly allocated copy. */
  private static final ImmutableSet<String> ALLOCATING_BUILTINS =
      ImmutableSet.of("reversed", "sorted", "str", "repr", "list");

  private static final String MODULE_CONTEXT = "<module>";

  /** Analyzes a module; see {@link #analyzeWithGaps} to also get the skipped nodes. */
  public static RequirementSet analyze(Ast.Module module) {
    return analyzeWithGaps(module).requirements();
  }

  /** Analyzes a module, returning both its requirements and the nodes that were skipped. */
  public static Result analyzeWithGaps(Ast.Module module) {
    RequirementAnalyzer analyzer = new RequirementAnalyzer();
    RequirementSet requirements = analyzer.statements(module.body());
    return new Result(requirements, ImmutableList.copyOf(analyzer.gaps));
  }

  /** Analyzes an arbitrary statement list, e.g. the body of a single function. */
  public static RequirementSet analyzeStatements(List<Stmt> body) {
    return new RequirementAnalyzer().statements(body);
  }

  /** Analyzes a single expression. */
  public static RequirementSet analyzeExpr(Expr expr) {
    return new RequirementAnalyzer().expr(expr);
  }

  /**
   * Returns true if the given list display can be represented as a fixed-size array that needs no
   * allocation: it must be non-empty, and its elements must all be constants of the same kind.
   */
  public static boolean isFixedArrayLiteral(ListExpr list) {
    return constantElementKind(list) != null;
  }

  /**
   * If {@link #isFixedArrayLiteral} is true for {@code list}, returns the kind shared by all of its
   * elements; otherwise returns null.
   */
  public static @Nullable ConstantKind constantElementKind(ListExpr list) {
    if (list.elts().isEmpty()) {
      return null;
    }
    ConstantKind kind = null;
    for (Expr elt : list.elts()) {
      if (!(elt instanceof Constant constant)) {
        return null;
      } else if (kind == null) {
        kind = constant.kind();
      } else if (kind != constant.kind()) {
        return null;
      }
    }
    return kind;
  }

  private final List<AnalysisGap> gaps = new ArrayList<>();

  /** Names of the enclosing classes and functions, innermost last. */
  private final Deque<String> context = new ArrayDeque<>();

  private RequirementAnalyzer() {}

  private String currentContext() {
    return context.isEmpty() ? MODULE_CONTEXT : String.join(".", context);
  }

  private RequirementSet gap(Object node) {
    gaps.add(new AnalysisGap(Ast.kindOf(node), currentContext()));
    return RequirementSet.NONE;
  }

  private RequirementSet statements(List<Stmt> body) {
    RequirementSet result = RequirementSet.NONE;
    for (Stmt stmt : body) {
      result = result.merge(statement(stmt));
    }
    return result;
  }

  private RequirementSet statement(Stmt stmt) {
    if (stmt instanceof Assign assign) {
      return exprs(assign.targets()).merge(expr(assign.value()));
    } else if (stmt instanceof AugAssign aug) {
      return binary(aug.target(), aug.op(), aug.value());
    } else if (stmt instanceof Ast.AnnAssign ann) {
      return (ann.value() == null) ? RequirementSet.NONE : expr(ann.value());
    } else if (stmt instanceof Ast.ExprStmt exprStmt) {
      return expr(exprStmt.value());
    } else if (stmt instanceof If ifStmt) {
      return expr(ifStmt.condition())
          .merge(statements(ifStmt.body()))
          .merge(statements(ifStmt.orElse()));
    } else if (stmt instanceof For forStmt) {
      return expr(forStmt.iter()).merge(statements(forStmt.body()));
    } else if (stmt instanceof While whileStmt) {
      return expr(whileStmt.condition()).merge(statements(whileStmt.body()));
    } else if (stmt instanceof FunctionDef def) {
      context.addLast(def.name());
      RequirementSet result = statements(def.body());
      context.removeLast();
      return result;
    } else if (stmt instanceof ClassDef classDef) {
      // Instances are heap-allocated by the generated init().
      context.addLast(classDef.name());
      RequirementSet result = statements(classDef.body()).merge(RequirementSet.of(ALLOCATOR));
      context.removeLast();
      return result;
    } else if (stmt instanceof Ast.Return ret) {
      return (ret.value() == null) ? RequirementSet.NONE : expr(ret.value());
    } else if (stmt instanceof Assert assertStmt) {
      RequirementSet result = RequirementSet.of(STD).merge(expr(assertStmt.test()));
      return (assertStmt.msg() == null) ? result : result.merge(expr(assertStmt.msg()));
    } else if (stmt instanceof Ast.Import || stmt instanceof Ast.SimpleStmt) {
      return RequirementSet.NONE;
    }
    return gap(stmt);
  }

  private RequirementSet exprs(List<Expr> exprs) {
    RequirementSet result = RequirementSet.NONE;
    for (Expr e : exprs) {
      result = result.merge(expr(e));
    }
    return result;
  }

  private RequirementSet expr(Expr expr) {
    if (expr instanceof Name || expr instanceof Constant) {
      return RequirementSet.NONE;
    } else if (expr instanceof Call call) {
      return call(call);
    } else if (expr instanceof BinOp binOp) {
      return binary(binOp.left(), binOp.op(), binOp.right());
    } else if (expr instanceof UnaryOp unary) {
      return expr(unary.operand());
    } else if (expr instanceof Compare compare) {
      return compare(compare);
    } else if (expr instanceof BoolOp boolOp) {
      return exprs(boolOp.values());
    } else if (expr instanceof ListExpr list) {
      RequirementSet elements = exprs(list.elts());
      return isFixedArrayLiteral(list) ? elements : elements.merge(RequirementSet.of(ALLOCATOR));
    } else if (expr instanceof TupleExpr tuple) {
      return exprs(tuple.elts());
    } else if (expr instanceof DictExpr dict) {
      return RequirementSet.of(ALLOCATOR, HASHMAP_HELPER)
          .merge(exprs(dict.keys()))
          .merge(exprs(dict.values()));
    } else if (expr instanceof ListComp comp) {
      return RequirementSet.of(ALLOCATOR)
          .merge(expr(comp.elt()))
          .merge(generators(comp.generators()));
    } else if (expr instanceof DictComp comp) {
      return RequirementSet.of(ALLOCATOR, HASHMAP_HELPER)
          .merge(expr(comp.key()))
          .merge(expr(comp.value()))
          .merge(generators(comp.generators()));
    } else if (expr instanceof FString fString) {
      RequirementSet result = RequirementSet.of(ALLOCATOR);
      for (Ast.FStringPart part : fString.parts()) {
        if (part instanceof FStringValue value) {
          result = result.merge(expr(value.value()));
        }
      }
      return result;
    } else if (expr instanceof Attribute attribute) {
      return expr(attribute.value());
    } else if (expr instanceof Subscript subscript) {
      return expr(subscript.value()).merge(expr(subscript.index()));
    } else if (expr instanceof Slice slice) {
      return optional(slice.lower()).merge(optional(slice.upper())).merge(optional(slice.step()));
    } else if (expr instanceof IfExp ifExp) {
      return expr(ifExp.test()).merge(expr(ifExp.body())).merge(expr(ifExp.orElse()));
    }
    return gap(expr);
  }

  private RequirementSet optional(@Nullable Expr expr) {
    return (expr == null) ? RequirementSet.NONE : expr(expr);
  }

  private RequirementSet generators(List<Comprehension> generators) {
    RequirementSet result = RequirementSet.NONE;
    for (Comprehension gen : generators) {
      result = result.merge(expr(gen.iter())).merge(exprs(gen.ifs()));
    }
    return result;
  }

  private RequirementSet call(Call call) {
    RequirementSet.Builder own = new RequirementSet.Builder();
    RequirementSet children = exprs(call.args());
    if (call.func() instanceof Attribute attribute) {
      String method = attribute.attr();
      if (CASE_METHODS.contains(method)) {
        own.add(STRING_UTILS, ALLOCATOR);
      } else if (SPLITTING_METHODS.contains(method)
          || MUTATING_SEQUENCE_METHODS.contains(method)
          || VIEW_METHODS.contains(method)) {
        own.add(ALLOCATOR);
      }
      String root = rootName(attribute.value());
      if (root != null && RESOURCE_MODULES.containsKey(root)) {
        own.addAll(RESOURCE_MODULES.get(root));
      }
      children = children.merge(expr(attribute.value()));
    } else if (call.func() instanceof Name name) {
      String id = name.id();
      if (ALLOCATING_BUILTINS.contains(id)) {
        own.add(ALLOCATOR);
      } else if (id.equals("print")) {
        own.add(STD);
      } else if (!id.isEmpty() && Character.isUpperCase(id.charAt(0))) {
        // Probably a class constructor.
        own.add(ALLOCATOR);
      }
    } else {
      children = children.merge(expr(call.func()));
    }
    return own.build().merge(children);
  }

  private RequirementSet binary(Expr left, BinaryOp op, Expr right) {
    RequirementSet result = expr(left).merge(expr(right));
    if ((op == BinaryOp.ADD || op == BinaryOp.MULT)
        && (isStringConstant(left) || isStringConstant(right))) {
      // String concatenation and repetition build a new buffer.
      result = result.merge(RequirementSet.of(ALLOCATOR));
    } else if (op == BinaryOp.POW) {
      result = result.merge(RequirementSet.of(STD));
    }
    return result;
  }

  private RequirementSet compare(Compare compare) {
    RequirementSet result = expr(compare.left()).merge(exprs(compare.comparators()));
    boolean anyString =
        isStringConstant(compare.left())
            || compare.comparators().stream().anyMatch(RequirementAnalyzer::isStringConstant);
    if (anyString
        && compare.ops().stream()
            .anyMatch(
                op ->
                    op == CompareOp.EQ
                        || op == CompareOp.NOT_EQ
                        || op == CompareOp.IN
                        || op == CompareOp.NOT_IN)) {
      // Lowered to std.mem.eql / std.mem.indexOf.
      result = result.merge(RequirementSet.of(STD));
    }
    return result;
  }

  /** Returns "a" for {@code a}, {@code a.b}, {@code a.b.c}, ...; otherwise returns null. */
  private static @Nullable String rootName(Expr expr) {
    while (expr instanceof Attribute attribute) {
      expr = attribute.value();
    }
    return (expr instanceof Name name) ? name.id() : null;
  }

  /** Returns true if {@code expr} is a str literal. */
  public static boolean isStringConstant(Expr expr) {
    return expr instanceof Constant constant && constant.kind() == ConstantKind.STRING;
  }
}
