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

package org.pyaot;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * The Ast class is just a namespace for the node types of a parsed Python module. Trees are
 * produced by an external parser and are never mutated by the compiler; every child list is an
 * ImmutableList.
 *
 * <p>The node set follows Python's own {@code ast} module closely enough that a parser adapter is
 * a direct mapping. A handful of static factories at the end of this class make it convenient to
 * build trees by hand.
 */
public final class Ast {

  // Just a namespace for the contained types.
  private Ast() {}

  /** A Python statement. Every kind of statement is declared in this file. */
  public sealed interface Stmt {}

  /** A Python expression. Every kind of expression is declared in this file. */
  public sealed interface Expr {}

  /** The root of a parsed source file. */
  public record Module(ImmutableList<Stmt> body) {}

  // Statements

  /** {@code a = b = value}; most assignments have a single target. */
  public record Assign(ImmutableList<Expr> targets, Expr value) implements Stmt {
    public Assign {
      Preconditions.checkArgument(!targets.isEmpty());
    }
  }

  /** {@code target op= value}. */
  public record AugAssign(Expr target, BinaryOp op, Expr value) implements Stmt {}

  /** {@code target: annotation = value}; value may be absent. */
  public record AnnAssign(Expr target, String annotation, @Nullable Expr value) implements Stmt {}

  /** An expression evaluated for its side effects. */
  public record ExprStmt(Expr value) implements Stmt {}

  /**
   * {@code if condition: body else: orElse}. An {@code elif} chain is represented as an If whose
   * orElse is a single nested If.
   */
  public record If(Expr condition, ImmutableList<Stmt> body, ImmutableList<Stmt> orElse)
      implements Stmt {}

  /** {@code for target in iter: body}. */
  public record For(Expr target, Expr iter, ImmutableList<Stmt> body) implements Stmt {}

  /** {@code while condition: body}. */
  public record While(Expr condition, ImmutableList<Stmt> body) implements Stmt {}

  /** A function or method parameter; the annotation is the unparsed annotation text, if any. */
  public record Param(String name, @Nullable String annotation) {}

  /**
   * {@code def name(params) -> returns: body}, or {@code async def} if isAsync. The return
   * annotation is null if absent.
   */
  public record FunctionDef(
      String name,
      ImmutableList<Param> params,
      @Nullable String returns,
      ImmutableList<Stmt> body,
      boolean isAsync)
      implements Stmt {

    /** Returns the number of declared parameters. */
    public int arity() {
      return params.size();
    }
  }

  /** {@code class name(bases): body}. Bases are given by name. */
  public record ClassDef(String name, ImmutableList<String> bases, ImmutableList<Stmt> body)
      implements Stmt {}

  /** {@code return value}; value is null for a bare return. */
  public record Return(@Nullable Expr value) implements Stmt {}

  /** {@code import module as asName}; one Import per imported name. */
  public record Import(String module, @Nullable String asName) implements Stmt {

    /**
     * Returns the name under which a module is bound in the importing scope; {@code import
     * os.path} binds "os".
     */
    public String boundName() {
      if (asName != null) {
        return asName;
      }
      int dot = module.indexOf('.');
      return (dot < 0) ? module : module.substring(0, dot);
    }

    /** Returns the module that {@link #boundName} refers to. */
    public String boundModule() {
      return (asName != null) ? module : boundName();
    }
  }

  /** {@code assert test, msg}. */
  public record Assert(Expr test, @Nullable Expr msg) implements Stmt {}

  /** {@code raise exc}; exc is null for a bare re-raise. */
  public record Raise(@Nullable Expr exc) implements Stmt {}

  /** One {@code except type as name: body} clause. */
  public record ExceptHandler(
      @Nullable String type, @Nullable String name, ImmutableList<Stmt> body) {}

  /** {@code try: body except...: ... finally: finalBody}. */
  public record Try(
      ImmutableList<Stmt> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<Stmt> finalBody)
      implements Stmt {}

  /** Statements with no content of their own. */
  public enum SimpleStmt implements Stmt {
    PASS,
    BREAK,
    CONTINUE
  }

  // Expressions

  /** The kinds of literal constant. */
  public enum ConstantKind {
    INT(Long.class),
    FLOAT(Double.class),
    STRING(String.class),
    BOOL(Boolean.class),
    NONE(null);

    private final @Nullable Class<?> valueClass;

    ConstantKind(@Nullable Class<?> valueClass) {
      this.valueClass = valueClass;
    }

    /** Returns true if {@code value} is a valid value for a constant of this kind. */
    public boolean accepts(@Nullable Object value) {
      return (valueClass == null) ? (value == null) : valueClass.isInstance(value);
    }
  }

  /**
   * A literal constant. The value is a Long (INT), Double (FLOAT), String (STRING), Boolean
   * (BOOL), or null (NONE).
   */
  public record Constant(ConstantKind kind, @Nullable Object value) implements Expr {
    public Constant {
      Preconditions.checkArgument(
          kind.accepts(value), "%s is not a valid %s constant", value, kind);
    }
  }

  /** A reference to a variable, function, class, or module by name. */
  public record Name(String id) implements Expr {}

  /** {@code value.attr}. */
  public record Attribute(Expr value, String attr) implements Expr {}

  /** {@code func(args)}. Keyword arguments are not represented. */
  public record Call(Expr func, ImmutableList<Expr> args) implements Expr {}

  /** Python's binary arithmetic operators. */
  public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    LSHIFT("<<"),
    RSHIFT(">>");

    public final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** {@code left op right}. */
  public record BinOp(Expr left, BinaryOp op, Expr right) implements Expr {}

  /** Python's unary operators. */
  public enum UnaryOperator {
    NEG,
    POS,
    NOT,
    INVERT
  }

  /** {@code op operand}. */
  public record UnaryOp(UnaryOperator op, Expr operand) implements Expr {}

  /** Python's comparison operators. */
  public enum CompareOp {
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_E("<="),
    GT(">"),
    GT_E(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    public final String symbol;

    CompareOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /**
   * {@code left op1 c1 op2 c2 ...}; ops and comparators always have the same length, and most
   * comparisons have exactly one of each.
   */
  public record Compare(Expr left, ImmutableList<CompareOp> ops, ImmutableList<Expr> comparators)
      implements Expr {
    public Compare {
      Preconditions.checkArgument(!ops.isEmpty() && ops.size() == comparators.size());
    }
  }

  /** {@code and} / {@code or}. */
  public enum BoolOperator {
    AND,
    OR
  }

  /** {@code v1 and v2 and ...}. */
  public record BoolOp(BoolOperator op, ImmutableList<Expr> values) implements Expr {}

  /** A list display {@code [a, b, c]}. */
  public record ListExpr(ImmutableList<Expr> elts) implements Expr {}

  /** A tuple display {@code (a, b)}. */
  public record TupleExpr(ImmutableList<Expr> elts) implements Expr {}

  /** A dict display {@code {k1: v1, k2: v2}}; keys and values have the same length. */
  public record DictExpr(ImmutableList<Expr> keys, ImmutableList<Expr> values) implements Expr {
    public DictExpr {
      Preconditions.checkArgument(keys.size() == values.size());
    }
  }

  /** One {@code for target in iter if cond...} clause of a comprehension. */
  public record Comprehension(Expr target, Expr iter, ImmutableList<Expr> ifs) {}

  /** {@code [elt for ...]}. */
  public record ListComp(Expr elt, ImmutableList<Comprehension> generators) implements Expr {}

  /** {@code {key: value for ...}}. */
  public record DictComp(Expr key, Expr value, ImmutableList<Comprehension> generators)
      implements Expr {}

  /** A piece of an f-string: either literal text or an interpolated expression. */
  public sealed interface FStringPart {}

  /** Literal text inside an f-string. */
  public record FStringText(String text) implements FStringPart {}

  /** {@code {value:formatSpec}} inside an f-string; formatSpec may be null. */
  public record FStringValue(Expr value, @Nullable String formatSpec) implements FStringPart {}

  /** {@code f"..."}. */
  public record FString(ImmutableList<FStringPart> parts) implements Expr {}

  /** {@code value[index]}; index may be a {@link Slice}. */
  public record Subscript(Expr value, Expr index) implements Expr {}

  /** {@code lower:upper:step}, only valid as the index of a Subscript. */
  public record Slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step)
      implements Expr {}

  /** {@code body if test else orElse}. */
  public record IfExp(Expr test, Expr body, Expr orElse) implements Expr {}

  /** {@code lambda params: body}. */
  public record Lambda(ImmutableList<Param> params, Expr body) implements Expr {}

  /** {@code await value}. */
  public record Await(Expr value) implements Expr {}

  /** Returns a short lowercase description of a node's kind, for diagnostics. */
  public static String kindOf(Object node) {
    if (node instanceof SimpleStmt simple) {
      return simple.name().toLowerCase();
    }
    return node.getClass().getSimpleName().toLowerCase();
  }

  /**
   * Calls {@code visitor} on {@code node} and then, recursively, on each of its statement and
   * expression descendants (pre-order). Comprehensions and f-string parts are not passed to the
   * visitor, but their expressions are.
   */
  public static void walk(Object node, Consumer<Object> visitor) {
    visitor.accept(node);
    if (node instanceof Module m) {
      walkAll(m.body(), visitor);
    } else if (node instanceof Assign a) {
      walkAll(a.targets(), visitor);
      walk(a.value(), visitor);
    } else if (node instanceof AugAssign a) {
      walk(a.target(), visitor);
      walk(a.value(), visitor);
    } else if (node instanceof AnnAssign a) {
      walk(a.target(), visitor);
      walkOptional(a.value(), visitor);
    } else if (node instanceof ExprStmt e) {
      walk(e.value(), visitor);
    } else if (node instanceof If i) {
      walk(i.condition(), visitor);
      walkAll(i.body(), visitor);
      walkAll(i.orElse(), visitor);
    } else if (node instanceof For f) {
      walk(f.target(), visitor);
      walk(f.iter(), visitor);
      walkAll(f.body(), visitor);
    } else if (node instanceof While w) {
      walk(w.condition(), visitor);
      walkAll(w.body(), visitor);
    } else if (node instanceof FunctionDef f) {
      walkAll(f.body(), visitor);
    } else if (node instanceof ClassDef c) {
      walkAll(c.body(), visitor);
    } else if (node instanceof Return r) {
      walkOptional(r.value(), visitor);
    } else if (node instanceof Assert a) {
      walk(a.test(), visitor);
      walkOptional(a.msg(), visitor);
    } else if (node instanceof Raise r) {
      walkOptional(r.exc(), visitor);
    } else if (node instanceof Try t) {
      walkAll(t.body(), visitor);
      for (ExceptHandler h : t.handlers()) {
        walkAll(h.body(), visitor);
      }
      walkAll(t.finalBody(), visitor);
    } else if (node instanceof Attribute a) {
      walk(a.value(), visitor);
    } else if (node instanceof Call c) {
      walk(c.func(), visitor);
      walkAll(c.args(), visitor);
    } else if (node instanceof BinOp b) {
      walk(b.left(), visitor);
      walk(b.right(), visitor);
    } else if (node instanceof UnaryOp u) {
      walk(u.operand(), visitor);
    } else if (node instanceof Compare c) {
      walk(c.left(), visitor);
      walkAll(c.comparators(), visitor);
    } else if (node instanceof BoolOp b) {
      walkAll(b.values(), visitor);
    } else if (node instanceof ListExpr l) {
      walkAll(l.elts(), visitor);
    } else if (node instanceof TupleExpr t) {
      walkAll(t.elts(), visitor);
    } else if (node instanceof DictExpr d) {
      walkAll(d.keys(), visitor);
      walkAll(d.values(), visitor);
    } else if (node instanceof ListComp c) {
      walk(c.elt(), visitor);
      walkGenerators(c.generators(), visitor);
    } else if (node instanceof DictComp c) {
      walk(c.key(), visitor);
      walk(c.value(), visitor);
      walkGenerators(c.generators(), visitor);
    } else if (node instanceof FString f) {
      for (FStringPart part : f.parts()) {
        if (part instanceof FStringValue v) {
          walk(v.value(), visitor);
        }
      }
    } else if (node instanceof Subscript s) {
      walk(s.value(), visitor);
      walk(s.index(), visitor);
    } else if (node instanceof Slice s) {
      walkOptional(s.lower(), visitor);
      walkOptional(s.upper(), visitor);
      walkOptional(s.step(), visitor);
    } else if (node instanceof IfExp i) {
      walk(i.test(), visitor);
      walk(i.body(), visitor);
      walk(i.orElse(), visitor);
    } else if (node instanceof Lambda l) {
      walk(l.body(), visitor);
    } else if (node instanceof Await a) {
      walk(a.value(), visitor);
    }
  }

  /** Calls {@link #walk} on each of the given nodes. */
  public static void walkAll(List<?> nodes, Consumer<Object> visitor) {
    for (Object node : nodes) {
      walk(node, visitor);
    }
  }

  private static void walkOptional(@Nullable Object node, Consumer<Object> visitor) {
    if (node != null) {
      walk(node, visitor);
    }
  }

  private static void walkGenerators(List<Comprehension> generators, Consumer<Object> visitor) {
    for (Comprehension gen : generators) {
      walk(gen.target(), visitor);
      walk(gen.iter(), visitor);
      walkAll(gen.ifs(), visitor);
    }
  }

  // Factories

  public static Module module(Stmt... body) {
    return new Module(ImmutableList.copyOf(body));
  }

  public static Name name(String id) {
    return new Name(id);
  }

  /**
   * Returns a Name or a chain of Attributes for a dotted path, e.g. {@code dotted("os.path.join")}
   * is {@code Attribute(Attribute(Name("os"), "path"), "join")}.
   */
  public static Expr dotted(String path) {
    List<String> parts = Splitter.on('.').splitToList(path);
    Expr result = new Name(parts.get(0));
    for (String part : parts.subList(1, parts.size())) {
      result = new Attribute(result, part);
    }
    return result;
  }

  public static Attribute attr(Expr value, String attr) {
    return new Attribute(value, attr);
  }

  public static Constant constant(long value) {
    return new Constant(ConstantKind.INT, value);
  }

  public static Constant constant(double value) {
    return new Constant(ConstantKind.FLOAT, value);
  }

  public static Constant constant(String value) {
    return new Constant(ConstantKind.STRING, value);
  }

  public static Constant constant(boolean value) {
    return new Constant(ConstantKind.BOOL, value);
  }

  public static Constant none() {
    return new Constant(ConstantKind.NONE, null);
  }

  public static Call call(Expr func, Expr... args) {
    return new Call(func, ImmutableList.copyOf(args));
  }

  /** Returns a call to a dotted path, e.g. {@code call("json.loads", s)}. */
  public static Call call(String path, Expr... args) {
    return call(dotted(path), args);
  }

  /** Returns {@code receiver.method(args)}. */
  public static Call methodCall(Expr receiver, String method, Expr... args) {
    return call(new Attribute(receiver, method), args);
  }

  public static BinOp binOp(Expr left, BinaryOp op, Expr right) {
    return new BinOp(left, op, right);
  }

  public static Compare compare(Expr left, CompareOp op, Expr right) {
    return new Compare(left, ImmutableList.of(op), ImmutableList.of(right));
  }

  public static ListExpr list(Expr... elts) {
    return new ListExpr(ImmutableList.copyOf(elts));
  }

  public static TupleExpr tuple(Expr... elts) {
    return new TupleExpr(ImmutableList.copyOf(elts));
  }

  /** Returns a dict display from alternating keys and values. */
  public static DictExpr dict(Expr... keysAndValues) {
    Preconditions.checkArgument(keysAndValues.length % 2 == 0);
    ImmutableList.Builder<Expr> keys = ImmutableList.builder();
    ImmutableList.Builder<Expr> values = ImmutableList.builder();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      keys.add(keysAndValues[i]);
      values.add(keysAndValues[i + 1]);
    }
    return new DictExpr(keys.build(), values.build());
  }

  public static Comprehension comprehension(Expr target, Expr iter, Expr... ifs) {
    return new Comprehension(target, iter, ImmutableList.copyOf(ifs));
  }

  public static ListComp listComp(Expr elt, Comprehension... generators) {
    return new ListComp(elt, ImmutableList.copyOf(generators));
  }

  public static DictComp dictComp(Expr key, Expr value, Comprehension... generators) {
    return new DictComp(key, value, ImmutableList.copyOf(generators));
  }

  /**
   * Returns an f-string; each String argument becomes literal text and each Expr an
   * interpolation without a format spec.
   */
  public static FString fString(Object... parts) {
    return new FString(
        Arrays.stream(parts)
            .map(
                p ->
                    (p instanceof String s)
                        ? (FStringPart) new FStringText(s)
                        : new FStringValue((Expr) p, null))
            .collect(ImmutableList.toImmutableList()));
  }

  public static Assign assign(Expr target, Expr value) {
    return new Assign(ImmutableList.of(target), value);
  }

  /** Returns {@code id = value}. */
  public static Assign assign(String id, Expr value) {
    return assign(new Name(id), value);
  }

  public static ExprStmt exprStmt(Expr value) {
    return new ExprStmt(value);
  }

  public static Return ret(@Nullable Expr value) {
    return new Return(value);
  }

  public static If ifStmt(Expr condition, List<Stmt> body, List<Stmt> orElse) {
    return new If(condition, ImmutableList.copyOf(body), ImmutableList.copyOf(orElse));
  }

  public static For forStmt(Expr target, Expr iter, Stmt... body) {
    return new For(target, iter, ImmutableList.copyOf(body));
  }

  public static While whileStmt(Expr condition, Stmt... body) {
    return new While(condition, ImmutableList.copyOf(body));
  }

  /** Returns a non-async function whose parameters have no annotations. */
  public static FunctionDef def(String name, List<String> params, Stmt... body) {
    return new FunctionDef(
        name,
        params.stream().map(p -> new Param(p, null)).collect(ImmutableList.toImmutableList()),
        null,
        ImmutableList.copyOf(body),
        false);
  }

  /**
   * Returns a FunctionDef with annotated parameters; {@code params} alternates names and
   * annotations, e.g. {@code typedDef("f", List.of("x", "int"), "int", body)}.
   */
  public static FunctionDef typedDef(
      String name, List<String> params, @Nullable String returns, Stmt... body) {
    Preconditions.checkArgument(params.size() % 2 == 0);
    ImmutableList.Builder<Param> builder = ImmutableList.builder();
    for (int i = 0; i < params.size(); i += 2) {
      builder.add(new Param(params.get(i), params.get(i + 1)));
    }
    return new FunctionDef(name, builder.build(), returns, ImmutableList.copyOf(body), false);
  }

  public static ClassDef classDef(String name, List<String> bases, Stmt... body) {
    return new ClassDef(name, ImmutableList.copyOf(bases), ImmutableList.copyOf(body));
  }

  public static Import importStmt(String module) {
    return new Import(module, null);
  }
}
