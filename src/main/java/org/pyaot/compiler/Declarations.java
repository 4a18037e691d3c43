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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast;
import org.pyaot.Ast.Assign;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.AugAssign;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.ClassDef;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.For;
import org.pyaot.Ast.FunctionDef;
import org.pyaot.Ast.Import;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Stmt;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.TupleExpr;
import org.pyaot.analysis.InferredType;

/**
 * The names declared by a module: its functions, classes and imports. These are collected in a
 * single pass before anything is emitted, so that a function may be called before the point where
 * it is defined.
 */
final class Declarations {

  /** The Zig name for a user-defined {@code main()}, which would collide with the entry point. */
  static final String USER_MAIN = "__user_main";

  /** Method names that modify their receiver in place. */
  private static final ImmutableSet<String> MUTATING_METHODS =
      ImmutableSet.of(
          "append", "extend", "insert", "remove", "pop", "clear", "reverse", "sort", "update",
          "put", "setdefault");

  final ImmutableMap<String, FunctionDef> functions;
  final ClassHierarchy classes;

  /** Maps each name bound by an import statement to the module it refers to. */
  final ImmutableMap<String, String> imports;

  private Declarations(
      ImmutableMap<String, FunctionDef> functions,
      ClassHierarchy classes,
      ImmutableMap<String, String> imports) {
    this.functions = functions;
    this.classes = classes;
    this.imports = imports;
  }

  /**
   * Collects the top-level declarations of {@code module}. Imports are collected wherever they
   * appear.
   */
  static Declarations collect(Ast.Module module, ClassHierarchy.FieldTyper typer) {
    Map<String, FunctionDef> functions = new LinkedHashMap<>();
    ImmutableList.Builder<ClassDef> classDefs = ImmutableList.builder();
    for (Stmt stmt : module.body()) {
      if (stmt instanceof FunctionDef def) {
        if (functions.put(def.name(), def) != null) {
          throw CompileError.error("Function '%s' is defined more than once", def.name());
        }
      } else if (stmt instanceof ClassDef def) {
        classDefs.add(def);
      }
    }
    Map<String, String> imports = new LinkedHashMap<>();
    Ast.walk(
        module,
        node -> {
          if (node instanceof Import imp) {
            imports.put(imp.boundName(), imp.boundModule());
          }
        });
    ClassHierarchy classes = ClassHierarchy.build(classDefs.build(), typer);
    for (ClassHierarchy.ClassInfo info : classes.classes()) {
      if (functions.containsKey(info.name)) {
        throw CompileError.error("'%s' is defined as both a function and a class", info.name);
      }
    }
    return new Declarations(
        ImmutableMap.copyOf(functions), classes, ImmutableMap.copyOf(imports));
  }

  /** Returns the Zig name for the top-level function {@code name}. */
  static String functionName(String name) {
    return name.equals("main") ? USER_MAIN : name;
  }

  /** Returns the module that {@code name} refers to if it was bound by an import, else null. */
  @Nullable String importedModule(String name) {
    return imports.get(name);
  }

  /**
   * Returns the names in {@code body} that must be declared with {@code var} rather than {@code
   * const}: names assigned more than once, augmented, assigned through a subscript, or used as
   * the receiver of a method that mutates in place.
   */
  static ImmutableSet<String> mutatedNames(List<Stmt> body) {
    Map<String, Integer> assignments = new HashMap<>();
    Set<String> mutated = new HashSet<>();
    Ast.walkAll(
        body,
        node -> {
          if (node instanceof Assign assign) {
            for (Expr target : assign.targets()) {
              countTargets(target, assignments, mutated);
            }
          } else if (node instanceof AugAssign aug) {
            rootName(aug.target(), mutated);
          } else if (node instanceof For forStmt && forStmt.target() instanceof Name name) {
            assignments.merge(name.id(), 1, Integer::sum);
          } else if (node instanceof Call call
              && call.func() instanceof Attribute attribute
              && MUTATING_METHODS.contains(attribute.attr())) {
            rootName(attribute.value(), mutated);
          }
        });
    assignments.forEach(
        (name, count) -> {
          if (count > 1) {
            mutated.add(name);
          }
        });
    return ImmutableSet.copyOf(mutated);
  }

  /** Returns every name that {@code body} binds by assignment, augmented assignment or loop. */
  static ImmutableSet<String> assignedNames(List<Stmt> body) {
    Map<String, Integer> assignments = new HashMap<>();
    Set<String> augmented = new HashSet<>();
    Ast.walkAll(
        body,
        node -> {
          if (node instanceof Assign assign) {
            for (Expr target : assign.targets()) {
              countTargets(target, assignments, new HashSet<>());
            }
          } else if (node instanceof AugAssign aug && aug.target() instanceof Name name) {
            augmented.add(name.id());
          } else if (node instanceof For forStmt) {
            countTargets(forStmt.target(), assignments, new HashSet<>());
          }
        });
    return ImmutableSet.<String>builder()
        .addAll(assignments.keySet())
        .addAll(augmented)
        .build();
  }

  private static void countTargets(
      Expr target, Map<String, Integer> assignments, Set<String> mutated) {
    if (target instanceof Name name) {
      assignments.merge(name.id(), 1, Integer::sum);
    } else if (target instanceof TupleExpr tuple) {
      for (Expr elt : tuple.elts()) {
        countTargets(elt, assignments, mutated);
      }
    } else if (target instanceof Subscript subscript) {
      rootName(subscript.value(), mutated);
    }
  }

  /** If {@code expr} is a name, possibly subscripted, adds the name to {@code names}. */
  private static void rootName(Expr expr, Set<String> names) {
    while (expr instanceof Subscript subscript) {
      expr = subscript.value();
    }
    if (expr instanceof Name name) {
      names.add(name.id());
    }
  }

  /** Returns true if {@code name} is referenced anywhere in {@code nodes}. */
  static boolean uses(List<?> nodes, String name) {
    boolean[] found = new boolean[1];
    Ast.walkAll(
        nodes,
        node -> {
          if (node instanceof Name n && n.id().equals(name)) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /**
   * What is known about a local variable.
   *
   * @param zigType the declared Zig type, if known ("*C" for an instance of user class C)
   * @param fixedArray true if the value is a fixed-size array rather than a dynamic list
   * @param element if the value is a sequence, the type of its elements
   */
  record Local(@Nullable String zigType, boolean fixedArray, InferredType element) {
    static Local of(@Nullable String zigType) {
      return new Local(zigType, false, InferredType.UNKNOWN);
    }
  }

  /**
   * The local variables of the function being emitted, in a stack of Zig block scopes. A name
   * first assigned in a block is declared in that block and is not visible after it ends.
   */
  static final class Locals {
    private final ImmutableSet<String> mutated;
    private final Deque<Map<String, Local>> blocks = new ArrayDeque<>();

    Locals(ImmutableSet<String> mutated) {
      this.mutated = mutated;
      blocks.push(new HashMap<>());
    }

    void enterBlock() {
      blocks.push(new HashMap<>());
    }

    void exitBlock() {
      Preconditions.checkState(blocks.size() > 1);
      blocks.pop();
    }

    /** Declares {@code name} in the innermost block. */
    void declare(String name, Local info) {
      blocks.peek().put(name, info);
    }

    boolean isDeclared(String name) {
      return get(name) != null;
    }

    @Nullable Local get(String name) {
      for (Map<String, Local> block : blocks) {
        Local info = block.get(name);
        if (info != null) {
          return info;
        }
      }
      return null;
    }

    /** Returns true if {@code name} must be declared with {@code var}. */
    boolean isMutated(String name) {
      return mutated.contains(name);
    }
  }
}
