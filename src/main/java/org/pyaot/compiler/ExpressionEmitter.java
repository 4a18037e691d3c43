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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.BinOp;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.BoolOp;
import org.pyaot.Ast.BoolOperator;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.Compare;
import org.pyaot.Ast.CompareOp;
import org.pyaot.Ast.Comprehension;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.Ast.DictComp;
import org.pyaot.Ast.DictExpr;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.FString;
import org.pyaot.Ast.FStringPart;
import org.pyaot.Ast.FStringText;
import org.pyaot.Ast.FStringValue;
import org.pyaot.Ast.FunctionDef;
import org.pyaot.Ast.IfExp;
import org.pyaot.Ast.ListComp;
import org.pyaot.Ast.ListExpr;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Slice;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.TupleExpr;
import org.pyaot.Ast.UnaryOp;
import org.pyaot.Ast.UnaryOperator;
import org.pyaot.analysis.InferredType;
import org.pyaot.analysis.RequirementAnalyzer;
import org.pyaot.analysis.TypeInferrer;
import org.pyaot.compiler.ClassHierarchy.ClassInfo;
import org.pyaot.compiler.Declarations.Local;
import org.pyaot.util.ZigSyntax;

/**
 * Emits expressions, and resolves each call to the user function, constructor, method, or
 * registered {@link Handler} that implements it.
 *
 * <p>Python constructs that build a value through a sequence of statements (list and dict
 * displays, comprehensions) are emitted as labelled Zig block expressions. Each label comes from
 * {@link EmissionState#freshLabel} and any temporaries are named after their label, so nested or
 * repeated constructs never collide.
 */
final class ExpressionEmitter {

  /** Builtins whose result is a bool. */
  private static final ImmutableSet<String> BOOLEAN_BUILTINS =
      ImmutableSet.of("isinstance", "hasattr", "callable", "bool");

  /** Methods whose result is a bool. */
  private static final ImmutableSet<String> BOOLEAN_METHODS =
      ImmutableSet.of(
          "startswith", "endswith", "isdigit", "isalpha", "isalnum", "isspace", "isupper",
          "islower");

  /** Binary operators that can be written as a Zig compound assignment. */
  private static final ImmutableSet<BinaryOp> COMPOUND_ASSIGNABLE =
      ImmutableSet.of(
          BinaryOp.ADD,
          BinaryOp.SUB,
          BinaryOp.MULT,
          BinaryOp.BIT_AND,
          BinaryOp.BIT_OR,
          BinaryOp.BIT_XOR);

  /** Python format specs of the form ".2f". */
  private static final Pattern FIXED_PRECISION = Pattern.compile("\\.(\\d+)f");

  private final EmissionEngine engine;

  ExpressionEmitter(EmissionEngine engine) {
    this.engine = engine;
  }

  private void write(String text) {
    engine.state().write(text);
  }

  private String fresh(String prefix) {
    return engine.state().freshLabel(prefix);
  }

  // Types

  /** Returns the inferred type of {@code expr}, using what is known about user classes too. */
  InferredType typeOf(Expr expr) {
    if (expr instanceof Attribute attribute) {
      ClassInfo cls = classOf(attribute.value());
      if (cls != null) {
        ClassHierarchy.Field field = cls.field(attribute.attr());
        if (field != null) {
          return EmissionEngine.inferredType(field.zigType());
        }
      }
    } else if (expr instanceof Call call
        && call.func() instanceof Name name
        && isUserFunction(name.id())) {
      return EmissionEngine.inferredType(
          engine.returnType(engine.declarations().functions.get(name.id()), null));
    } else if (expr instanceof Call call && call.func() instanceof Attribute attribute) {
      ClassInfo cls = classOf(attribute.value());
      ClassInfo owner = (cls == null) ? null : cls.methodOwner(attribute.attr());
      if (owner != null) {
        return EmissionEngine.inferredType(
            engine.returnType(owner.methods.get(attribute.attr()), owner));
      }
    }
    return engine.types().infer(expr);
  }

  /**
   * Returns the Zig type of {@code expr} if it can be determined, for use in a declaration;
   * otherwise returns null.
   */
  @Nullable String zigTypeOf(Expr expr) {
    if (isBoolean(expr)) {
      return "bool";
    }
    ClassInfo cls = classOf(expr);
    if (cls != null) {
      return "*" + cls.name;
    } else if (expr instanceof Name name) {
      Local local = engine.locals().get(name.id());
      if (local != null && local.zigType() != null) {
        return local.zigType();
      }
    } else if (expr instanceof Call call
        && call.func() instanceof Name name
        && isUserFunction(name.id())) {
      String type = engine.returnType(engine.declarations().functions.get(name.id()), null);
      return type.equals("void") ? null : type;
    }
    return ZigSyntax.zigType(typeOf(expr));
  }

  /** If {@code expr} is known to be an instance of a user class, returns that class. */
  @Nullable ClassInfo classOf(Expr expr) {
    Declarations decls = engine.declarations();
    String type = null;
    if (expr instanceof Name name) {
      Local local = engine.locals().get(name.id());
      type = (local == null) ? null : local.zigType();
    } else if (expr instanceof Call call
        && call.func() instanceof Name name
        && !isLocal(name.id())
        && decls.classes.contains(name.id())) {
      return decls.classes.get(name.id());
    } else if (expr instanceof Attribute attribute) {
      ClassInfo owner = classOf(attribute.value());
      ClassHierarchy.Field field = (owner == null) ? null : owner.field(attribute.attr());
      type = (field == null) ? null : field.zigType();
    }
    if (type != null && type.startsWith("*")) {
      return decls.classes.get(type.substring(1));
    }
    return null;
  }

  /** Returns true if {@code expr} is known to produce a Zig {@code bool}. */
  boolean isBoolean(Expr expr) {
    if (expr instanceof Compare || expr instanceof BoolOp) {
      return true;
    } else if (expr instanceof Constant constant) {
      return constant.kind() == ConstantKind.BOOL;
    } else if (expr instanceof UnaryOp unary) {
      return unary.op() == UnaryOperator.NOT;
    } else if (expr instanceof Name name) {
      Local local = engine.locals().get(name.id());
      return local != null && "bool".equals(local.zigType());
    } else if (expr instanceof Call call) {
      if (call.func() instanceof Name name) {
        return BOOLEAN_BUILTINS.contains(name.id()) && !isUserCallable(name.id());
      } else if (call.func() instanceof Attribute attribute) {
        return BOOLEAN_METHODS.contains(attribute.attr()) && classOf(attribute.value()) == null;
      }
    }
    return false;
  }

  /** Returns true if {@code expr} evaluates to a fixed-size array rather than a dynamic list. */
  boolean isFixedArray(Expr expr) {
    if (expr instanceof ListExpr list) {
      return RequirementAnalyzer.isFixedArrayLiteral(list);
    } else if (expr instanceof Name name) {
      Local local = engine.locals().get(name.id());
      return local != null && local.fixedArray();
    }
    return false;
  }

  /** Returns true if {@code expr} evaluates to a dynamic list, whose elements are in .items. */
  boolean isDynamicSequence(Expr expr) {
    return typeOf(expr) == InferredType.SEQUENCE
        && !isFixedArray(expr)
        && !(expr instanceof TupleExpr);
  }

  String formatSpec(Expr expr) {
    return isBoolean(expr) ? "{}" : ZigSyntax.formatSpec(typeOf(expr));
  }

  private boolean isLocal(String name) {
    return engine.locals().isDeclared(name);
  }

  private boolean isUserFunction(String name) {
    return !isLocal(name) && engine.declarations().functions.containsKey(name);
  }

  private boolean isUserCallable(String name) {
    return !isLocal(name)
        && (engine.declarations().functions.containsKey(name)
            || engine.declarations().classes.contains(name));
  }

  /** Returns true if {@code expr} is a call to the builtin {@code name}. */
  boolean isBuiltinCall(Expr expr, String name) {
    return expr instanceof Call call
        && call.func() instanceof Name n
        && n.id().equals(name)
        && !isUserCallable(name);
  }

  // Dispatch

  void emit(Expr expr) {
    if (expr instanceof Constant constant) {
      constant(constant);
    } else if (expr instanceof Name name) {
      String id = name.id();
      write(ZigSyntax.identifier(isUserFunction(id) ? Declarations.functionName(id) : id));
    } else if (expr instanceof Attribute attribute) {
      attribute(attribute);
    } else if (expr instanceof Call call) {
      call(call);
    } else if (expr instanceof BinOp binOp) {
      binary(binOp.left(), binOp.op(), binOp.right());
    } else if (expr instanceof UnaryOp unary) {
      unary(unary);
    } else if (expr instanceof Compare compare) {
      compare(compare);
    } else if (expr instanceof BoolOp boolOp) {
      String op = (boolOp.op() == BoolOperator.AND) ? " and " : " or ";
      write("(");
      for (int i = 0; i < boolOp.values().size(); i++) {
        if (i != 0) {
          write(op);
        }
        condition(boolOp.values().get(i));
      }
      write(")");
    } else if (expr instanceof IfExp ifExp) {
      write("(if (");
      condition(ifExp.test());
      write(") ");
      emit(ifExp.body());
      write(" else ");
      emit(ifExp.orElse());
      write(")");
    } else if (expr instanceof ListExpr list) {
      list(list);
    } else if (expr instanceof TupleExpr tuple) {
      anonymousList(tuple.elts());
    } else if (expr instanceof DictExpr dict) {
      dict(dict);
    } else if (expr instanceof ListComp comp) {
      listComp(comp);
    } else if (expr instanceof DictComp comp) {
      dictComp(comp);
    } else if (expr instanceof FString fString) {
      fString(fString);
    } else if (expr instanceof Subscript subscript) {
      subscript(subscript);
    } else if (expr instanceof Slice) {
      throw CompileError.unsupported("A slice outside of a subscript");
    } else {
      throw CompileError.unsupported(Ast.kindOf(expr));
    }
  }

  private void emitArgs(List<Expr> args) {
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        write(", ");
      }
      emit(args.get(i));
    }
  }

  /** Writes {@code .{ a, b }}. */
  private void anonymousList(List<Expr> elts) {
    if (elts.isEmpty()) {
      write(".{}");
    } else {
      write(".{ ");
      emitArgs(elts);
      write(" }");
    }
  }

  private void constant(Constant constant) {
    switch (constant.kind()) {
      case INT, BOOL -> write(String.valueOf(constant.value()));
      case FLOAT -> write(ZigSyntax.floatLiteral((Double) constant.value()));
      case STRING -> write(ZigSyntax.stringLiteral((String) constant.value()));
      case NONE -> write("null");
    }
  }

  /** Emits {@code expr} as a Zig bool, following Python's truthiness rules. */
  void condition(Expr expr) {
    if (isBoolean(expr)) {
      emit(expr);
      return;
    }
    switch (typeOf(expr)) {
      case INT, FLOAT -> {
        write("(");
        emit(expr);
        write(" != 0)");
      }
      case STRING -> {
        write("(");
        emit(expr);
        write(".len != 0)");
      }
      case SEQUENCE -> {
        write("(");
        items(expr);
        write(".len != 0)");
      }
      case MAPPING -> {
        write("(");
        emit(expr);
        write(".count() != 0)");
      }
      default -> emit(expr);
    }
  }

  /** Emits {@code expr}, followed by {@code .items} if it is a dynamic list. */
  void items(Expr expr) {
    if (!isDynamicSequence(expr)) {
      emit(expr);
    } else if (expr instanceof Name || expr instanceof Attribute) {
      emit(expr);
      write(".items");
    } else {
      write("(");
      emit(expr);
      write(").items");
    }
  }

  // Attributes and calls

  /**
   * If {@code attribute} refers to a member of a module ({@code math.pi}, {@code os.path.join}),
   * returns its qualified symbol; otherwise returns null.
   */
  private @Nullable String moduleSymbol(Attribute attribute) {
    List<String> parts = new ArrayList<>();
    Expr expr = attribute;
    while (expr instanceof Attribute a) {
      parts.add(0, a.attr());
      expr = a.value();
    }
    if (!(expr instanceof Name root) || isLocal(root.id())) {
      return null;
    }
    String module = engine.declarations().importedModule(root.id());
    if (module == null) {
      if (!engine.registry().isModule(root.id())) {
        return null;
      }
      module = root.id();
    }
    return module + "." + String.join(".", parts);
  }

  private void attribute(Attribute attribute) {
    String symbol = moduleSymbol(attribute);
    if (symbol != null) {
      engine.registry().emit(symbol, engine, ImmutableList.of());
      return;
    }
    emit(attribute.value());
    write(".");
    write(ZigSyntax.identifier(attribute.attr()));
  }

  /** What a call resolves to. */
  private sealed interface CallTarget
      permits SuperMethod, UserFunction, Constructor, Registered, UserMethod {}

  /** {@code super().method(...)}; owner is null if the current class has no parent. */
  private record SuperMethod(String method, @Nullable ClassInfo owner, @Nullable FunctionDef def)
      implements CallTarget {}

  private record UserFunction(FunctionDef def) implements CallTarget {}

  private record Constructor(ClassInfo cls) implements CallTarget {}

  /** A call to a registered handler; for a method call the receiver is the first argument. */
  private record Registered(String symbol, Handler handler, ImmutableList<Expr> args)
      implements CallTarget {}

  /** A method defined by {@code owner}, called on an instance of {@code receiverClass}. */
  private record UserMethod(
      Expr receiver, ClassInfo receiverClass, ClassInfo owner, FunctionDef def)
      implements CallTarget {}

  /**
   * Resolves {@code call}, trying in order: {@code super()} methods, user functions, user class
   * constructors, module functions, methods of user classes, methods of builtin types, and
   * finally methods whose name is registered for only one builtin type.
   */
  private CallTarget resolve(Call call) {
    Expr func = call.func();
    if (func instanceof Attribute attribute && isBuiltinCall(attribute.value(), "super")) {
      if (!((Call) attribute.value()).args().isEmpty()) {
        throw CompileError.unsupported("super() with arguments");
      }
      return superMethod(attribute.attr());
    } else if (func instanceof Name name) {
      String id = name.id();
      if (!isLocal(id)) {
        FunctionDef def = engine.declarations().functions.get(id);
        if (def != null) {
          return new UserFunction(def);
        }
        ClassInfo cls = engine.declarations().classes.get(id);
        if (cls != null) {
          return new Constructor(cls);
        }
      }
      return registered(HandlerRegistry.BUILTINS + "." + id, call.args());
    } else if (func instanceof Attribute attribute) {
      String symbol = moduleSymbol(attribute);
      if (symbol != null) {
        return registered(symbol, call.args());
      }
      String method = attribute.attr();
      ClassInfo cls = classOf(attribute.value());
      if (cls != null) {
        ClassInfo owner = cls.methodOwner(method);
        if (owner == null) {
          throw CompileError.unresolved(cls.name + "." + method);
        }
        return new UserMethod(attribute.value(), cls, owner, owner.methods.get(method));
      }
      ImmutableList<Expr> args =
          ImmutableList.<Expr>builder().add(attribute.value()).addAll(call.args()).build();
      String prefix = typeOf(attribute.value()).registryPrefix;
      if (prefix == null) {
        prefix = engine.registry().methodOwner(method);
        if (prefix == null) {
          throw CompileError.unresolved(describe(func));
        }
      }
      return registered(prefix + "." + method, args);
    }
    throw CompileError.unsupported("Calling %s", Ast.kindOf(func));
  }

  private Registered registered(String symbol, ImmutableList<Expr> args) {
    return new Registered(symbol, engine.registry().resolve(symbol), args);
  }

  private SuperMethod superMethod(String method) {
    String current = engine.state().currentClass();
    if (current == null || engine.selfName() == null) {
      throw CompileError.error("super() used outside of a method");
    }
    ClassInfo parent = engine.declarations().classes.get(current).parent;
    if (parent == null) {
      return new SuperMethod(method, null, null);
    }
    ClassInfo owner = parent.methodOwner(method);
    if (owner == null) {
      throw CompileError.unresolved(parent.name + "." + method);
    }
    return new SuperMethod(method, owner, owner.methods.get(method));
  }

  /** Returns a readable rendering of a callee, e.g. "foo.bar" or "f().bar". */
  private static String describe(Expr expr) {
    if (expr instanceof Name name) {
      return name.id();
    } else if (expr instanceof Attribute attribute) {
      return describe(attribute.value()) + "." + attribute.attr();
    } else if (expr instanceof Call call) {
      return describe(call.func()) + "()";
    }
    return "<" + Ast.kindOf(expr) + ">";
  }

  /** Returns false if the code emitted for {@code call} has no value (Zig {@code void}). */
  boolean producesValue(Call call) {
    CallTarget target = resolve(call);
    if (target instanceof SuperMethod s) {
      return s.owner() == null || !engine.returnType(s.def(), s.owner()).equals("void");
    } else if (target instanceof UserFunction f) {
      return !engine.returnType(f.def(), null).equals("void");
    } else if (target instanceof UserMethod m) {
      return !engine.returnType(m.def(), m.owner()).equals("void");
    } else if (target instanceof Registered r) {
      return r.handler().producesValue;
    }
    return true;
  }

  private void call(Call call) {
    CallTarget target = resolve(call);
    List<Expr> args = call.args();
    if (target instanceof Registered r) {
      r.handler().emit(r.symbol(), engine, r.args());
    } else if (target instanceof UserFunction f) {
      checkArity(f.def().name(), f.def().arity(), args);
      write("try ");
      write(ZigSyntax.identifier(Declarations.functionName(f.def().name())));
      write("(");
      emitArgs(args);
      write(")");
    } else if (target instanceof Constructor c) {
      FunctionDef init = c.cls().findMethod("__init__");
      checkArity(c.cls().name, (init == null) ? 0 : init.arity() - 1, args);
      write("try " + c.cls().name + ".init(");
      emitArgs(args);
      write(")");
    } else if (target instanceof UserMethod m) {
      checkArity(m.owner().name + "." + m.def().name(), m.def().arity() - 1, args);
      write("try ");
      if (m.owner() == m.receiverClass()) {
        emit(m.receiver());
        write("." + ZigSyntax.identifier(m.def().name()) + "(");
        emitArgs(args);
        write(")");
      } else {
        upcastCall(m.owner(), m.def(), () -> emit(m.receiver()), args);
      }
    } else if (target instanceof SuperMethod s) {
      superCall(s, args);
    }
  }

  /** Writes {@code Owner.method(@as(*Owner, @ptrCast(receiver)), args)}. */
  private void upcastCall(ClassInfo owner, FunctionDef method, Runnable receiver, List<Expr> args) {
    write(owner.name + "." + ZigSyntax.identifier(method.name()));
    write("(@as(*" + owner.name + ", @ptrCast(");
    receiver.run();
    write("))");
    if (!args.isEmpty()) {
      write(", ");
      emitArgs(args);
    }
    write(")");
  }

  private void superCall(SuperMethod s, List<Expr> args) {
    if (s.owner() == null) {
      // No parent: the call does nothing, but its arguments must still be evaluated.
      String label = fresh("super");
      write(label + ": { ");
      engine.discardCalls(args);
      write("break :" + label + " .{}; }");
      return;
    }
    checkArity(s.owner().name + "." + s.method(), s.def().arity() - 1, args);
    write("try ");
    upcastCall(s.owner(), s.def(), () -> write(engine.selfName()), args);
  }

  private static void checkArity(String symbol, int expected, List<Expr> args) {
    if (args.size() != expected) {
      throw CompileError.arity(symbol, expected, expected, args.size());
    }
  }

  // Operators

  /** Emits {@code left op right}. */
  void binary(Expr left, BinaryOp op, Expr right) {
    InferredType lt = typeOf(left);
    InferredType rt = typeOf(right);
    boolean useFloat = lt == InferredType.FLOAT || rt == InferredType.FLOAT;
    switch (op) {
      case ADD -> {
        // A str literal on either side makes this a concatenation, whatever the other side is.
        if (RequirementAnalyzer.isStringConstant(left)
            || RequirementAnalyzer.isStringConstant(right)
            || lt == InferredType.STRING
            || rt == InferredType.STRING) {
          concat(left, right);
          return;
        }
      }
      case DIV -> {
        write("(");
        asFloat(left, lt);
        write(" / ");
        asFloat(right, rt);
        write(")");
        return;
      }
      case FLOOR_DIV -> {
        if (useFloat) {
          write("@floor(");
          numeric(left, lt, true);
          write(" / ");
          numeric(right, rt, true);
          write(")");
        } else {
          builtin("@divFloor", left, right);
        }
        return;
      }
      case MOD -> {
        builtin("@mod", left, right);
        return;
      }
      case POW -> {
        write("std.math.pow(" + (useFloat ? "f64" : "i64") + ", ");
        numeric(left, lt, useFloat);
        write(", ");
        numeric(right, rt, useFloat);
        write(")");
        return;
      }
      case MULT -> {
        if (TypeInferrer.isRepetition(lt, rt)) {
          Expr s = (lt == InferredType.STRING) ? left : right;
          Expr n = (s == left) ? right : left;
          write("try runtime.string.repeat(" + engine.allocator("string repetition") + ", ");
          emit(s);
          write(", ");
          emit(n);
          write(")");
          return;
        }
      }
      case LSHIFT, RSHIFT -> {
        write("(");
        emit(left);
        write(" " + op.symbol + " @intCast(");
        emit(right);
        write("))");
        return;
      }
      default -> {}
    }
    write("(");
    numeric(left, lt, useFloat);
    write(" " + op.symbol + " ");
    numeric(right, rt, useFloat);
    write(")");
  }

  /** Writes {@code try std.mem.concat(allocator, u8, &.{ left, right })}. */
  void concat(Expr left, Expr right) {
    write("try std.mem.concat(" + engine.allocator("string concatenation") + ", u8, &.{ ");
    emit(left);
    write(", ");
    emit(right);
    write(" })");
  }

  private void builtin(String fn, Expr left, Expr right) {
    write(fn + "(");
    emit(left);
    write(", ");
    emit(right);
    write(")");
  }

  /** Emits {@code expr}, converting it to f64 if {@code toFloat} and it is an integer. */
  private void numeric(Expr expr, InferredType type, boolean toFloat) {
    if (toFloat && type == InferredType.INT) {
      asFloat(expr, type);
    } else {
      emit(expr);
    }
  }

  private void asFloat(Expr expr, InferredType type) {
    if (type != InferredType.INT) {
      emit(expr);
    } else if (expr instanceof Constant) {
      write("@as(f64, ");
      emit(expr);
      write(")");
    } else {
      write("@as(f64, @floatFromInt(");
      emit(expr);
      write("))");
    }
  }

  /** Returns true if an augmented assignment with {@code op} can use a Zig compound operator. */
  static boolean isCompoundAssignable(BinaryOp op) {
    return COMPOUND_ASSIGNABLE.contains(op);
  }

  private void unary(UnaryOp unary) {
    switch (unary.op()) {
      case NEG -> {
        write("(-");
        emit(unary.operand());
        write(")");
      }
      case POS -> emit(unary.operand());
      case NOT -> {
        write("(!");
        condition(unary.operand());
        write(")");
      }
      case INVERT -> {
        write("(~");
        emit(unary.operand());
        write(")");
      }
    }
  }

  private void compare(Compare compare) {
    if (compare.ops().size() != 1) {
      throw CompileError.unsupported("Chained comparison");
    }
    CompareOp op = compare.ops().get(0);
    Expr left = compare.left();
    Expr right = compare.comparators().get(0);
    InferredType lt = typeOf(left);
    InferredType rt = typeOf(right);
    switch (op) {
      case EQ, NOT_EQ -> {
        if (lt == InferredType.STRING || rt == InferredType.STRING) {
          write((op == CompareOp.NOT_EQ) ? "!std.mem.eql(u8, " : "std.mem.eql(u8, ");
          emit(left);
          write(", ");
          emit(right);
          write(")");
          return;
        }
      }
      case IN, NOT_IN -> {
        if (op == CompareOp.NOT_IN) {
          write("!");
        }
        if (rt == InferredType.STRING) {
          write("(std.mem.indexOf(u8, ");
          emit(right);
          write(", ");
          emit(left);
          write(") != null)");
        } else if (rt == InferredType.MAPPING) {
          emit(right);
          write(".contains(");
          emit(left);
          write(")");
        } else {
          write("runtime.contains(");
          items(right);
          write(", ");
          emit(left);
          write(")");
        }
        return;
      }
      default -> {}
    }
    String symbol =
        switch (op) {
          case IS -> "==";
          case IS_NOT -> "!=";
          default -> op.symbol;
        };
    boolean useFloat = lt == InferredType.FLOAT || rt == InferredType.FLOAT;
    write("(");
    numeric(left, lt, useFloat);
    write(" " + symbol + " ");
    numeric(right, rt, useFloat);
    write(")");
  }

  // Displays and comprehensions

  /**
   * Returns the Zig element type for a collection of the given values: the Zig type of their
   * joined inferred type if known, else the type of the first value, else i64 if there are none.
   * The first value is only written inside {@code @TypeOf}, so it is not evaluated.
   */
  private void elementType(List<Expr> values) {
    if (values.isEmpty()) {
      write("i64");
      return;
    }
    InferredType joined = typeOf(values.get(0));
    for (Expr value : values.subList(1, values.size())) {
      joined = joined.join(typeOf(value));
    }
    String type = ZigSyntax.zigType(joined);
    if (type != null) {
      write(type);
    } else {
      write("@TypeOf(");
      emit(values.get(0));
      write(")");
    }
  }

  private void list(ListExpr list) {
    ConstantKind kind = RequirementAnalyzer.constantElementKind(list);
    if (kind != null) {
      write("[_]" + ZigSyntax.zigType(kind) + "{ ");
      emitArgs(list.elts());
      write(" }");
    } else {
      dynamicList(list);
    }
  }

  /** Emits a list display as a std.ArrayList, even if it could be a fixed-size array. */
  void dynamicList(ListExpr list) {
    String allocator = engine.allocator("list display");
    String label = fresh("list");
    String tmp = "__" + label;
    write(label + ": { var " + tmp + " = std.ArrayList(");
    elementType(list.elts());
    write("){}; ");
    for (Expr elt : list.elts()) {
      write("try " + tmp + ".append(" + allocator + ", ");
      emit(elt);
      write("); ");
    }
    write("break :" + label + " " + tmp + "; }");
  }

  /** Writes the type of a hash map with the given keys and values. */
  private void mapType(List<Expr> keys, List<Expr> values) {
    boolean stringKeys =
        !keys.isEmpty() && keys.stream().allMatch(k -> typeOf(k) == InferredType.STRING);
    if (stringKeys) {
      write("hashmap_helper.StringHashMap(");
    } else {
      write("std.AutoHashMap(");
      elementType(keys);
      write(", ");
    }
    elementType(values);
    write(")");
  }

  private void dict(DictExpr dict) {
    String allocator = engine.allocator("dict display");
    String label = fresh("dict");
    String tmp = "__" + label;
    write(label + ": { var " + tmp + " = ");
    mapType(dict.keys(), dict.values());
    write(".init(" + allocator + "); ");
    for (int i = 0; i < dict.keys().size(); i++) {
      write("try " + tmp + ".put(");
      emit(dict.keys().get(i));
      write(", ");
      emit(dict.values().get(i));
      write("); ");
    }
    write("break :" + label + " " + tmp + "; }");
  }

  private Comprehension onlyGenerator(List<Comprehension> generators) {
    if (generators.size() != 1) {
      throw CompileError.unsupported("A comprehension with more than one 'for'");
    }
    return generators.get(0);
  }

  private void listComp(ListComp comp) {
    Comprehension gen = onlyGenerator(comp.generators());
    String allocator = engine.allocator("list comprehension");
    String label = fresh("comp");
    String tmp = "__" + label;
    write(label + ": { ");
    Loop loop = loop(gen.target(), gen.iter());
    enterLoopScope(loop);
    String elementType = zigTypeOf(comp.elt());
    if (elementType == null) {
      throw CompileError.unsupported(
          "A list comprehension whose elements have an unknown type (%s)", describe(comp.elt()));
    }
    write("var " + tmp + " = std.ArrayList(" + elementType + "){}; ");
    openLoop(
        loop,
        ImmutableList.<Object>builder().add(comp.elt()).addAll(gen.ifs()).build(),
        true,
        false);
    filters(gen.ifs());
    write("try " + tmp + ".append(" + allocator + ", ");
    emit(comp.elt());
    write("); } ");
    exitLoopScope();
    write("break :" + label + " " + tmp + "; }");
  }

  private void dictComp(DictComp comp) {
    Comprehension gen = onlyGenerator(comp.generators());
    String allocator = engine.allocator("dict comprehension");
    String label = fresh("comp");
    String tmp = "__" + label;
    write(label + ": { ");
    Loop loop = loop(gen.target(), gen.iter());
    enterLoopScope(loop);
    String keyType = zigTypeOf(comp.key());
    String valueType = zigTypeOf(comp.value());
    if (keyType == null || valueType == null) {
      throw CompileError.unsupported(
          "A dict comprehension whose keys or values have unknown types");
    }
    String map =
        keyType.equals("[]const u8")
            ? "hashmap_helper.StringHashMap(" + valueType + ")"
            : "std.AutoHashMap(" + keyType + ", " + valueType + ")";
    write("var " + tmp + " = " + map + ".init(" + allocator + "); ");
    openLoop(
        loop,
        ImmutableList.<Object>builder().add(comp.key(), comp.value()).addAll(gen.ifs()).build(),
        true,
        false);
    filters(gen.ifs());
    write("try " + tmp + ".put(");
    emit(comp.key());
    write(", ");
    emit(comp.value());
    write("); } ");
    exitLoopScope();
    write("break :" + label + " " + tmp + "; }");
  }

  private void filters(List<Expr> ifs) {
    for (Expr test : ifs) {
      write("if (!");
      condition(test);
      write(") continue; ");
    }
  }

  // Loops

  /** The ways a Python {@code for} loop is lowered. */
  enum LoopKind {
    /** {@code for i in range(...)}: a counted while loop. */
    RANGE,
    /** {@code for i, x in enumerate(xs)}: a for loop with an index capture. */
    ENUMERATE,
    /** {@code for k in d}: a while loop over the map's key iterator. */
    KEYS,
    /** {@code for c in s}: a loop over the indices of a string, binding one-character slices. */
    CHARS,
    /** Anything else: a for loop over the value (or its .items). */
    ITEMS
  }

  /**
   * A lowered loop header.
   *
   * @param var the loop variable
   * @param index for ENUMERATE, the index variable
   * @param iter the iterable (for RANGE, the stop value)
   * @param start for RANGE, the start value, if given
   * @param step for RANGE, the step, if given
   */
  record Loop(
      LoopKind kind,
      String var,
      @Nullable String index,
      Expr iter,
      @Nullable Expr start,
      @Nullable Expr step) {

    boolean descending() {
      Long value = (step == null) ? null : intConstant(step);
      return value != null && value < 0;
    }
  }

  /** Determines how a loop over {@code iter} binding {@code target} should be lowered. */
  Loop loop(Expr target, Expr iter) {
    if (isBuiltinCall(iter, "range")) {
      List<Expr> args = ((Call) iter).args();
      if (args.isEmpty() || args.size() > 3) {
        throw CompileError.arity("builtins.range", 1, 3, args.size());
      }
      String var = loopVariable(target);
      return switch (args.size()) {
        case 1 -> new Loop(LoopKind.RANGE, var, null, args.get(0), null, null);
        case 2 -> new Loop(LoopKind.RANGE, var, null, args.get(1), args.get(0), null);
        default -> new Loop(LoopKind.RANGE, var, null, args.get(1), args.get(0), args.get(2));
      };
    } else if (isBuiltinCall(iter, "enumerate")) {
      List<Expr> args = ((Call) iter).args();
      if (args.size() != 1) {
        throw CompileError.arity("builtins.enumerate", 1, 1, args.size());
      }
      if (!(target instanceof TupleExpr tuple) || tuple.elts().size() != 2) {
        throw CompileError.unsupported("enumerate() without a two-name target");
      }
      return new Loop(
          LoopKind.ENUMERATE,
          loopVariable(tuple.elts().get(1)),
          loopVariable(tuple.elts().get(0)),
          args.get(0),
          null,
          null);
    }
    String var = loopVariable(target);
    LoopKind kind =
        switch (typeOf(iter)) {
          case MAPPING -> LoopKind.KEYS;
          case STRING -> LoopKind.CHARS;
          default -> LoopKind.ITEMS;
        };
    return new Loop(kind, var, null, iter, null, null);
  }

  private static String loopVariable(Expr target) {
    if (target instanceof Name name) {
      return name.id();
    }
    throw CompileError.unsupported("A for loop target that is a %s", Ast.kindOf(target));
  }

  /** Returns the type of the values bound to the loop variable. */
  InferredType elementType(Loop loop) {
    return switch (loop.kind()) {
      case RANGE -> InferredType.INT;
      case CHARS -> InferredType.STRING;
      case KEYS -> InferredType.UNKNOWN;
      default -> elementTypeOf(loop.iter());
    };
  }

  /** Returns the type of the elements of the sequence {@code expr}, if it can be determined. */
  InferredType elementTypeOf(Expr expr) {
    List<Expr> elts = null;
    if (expr instanceof ListExpr list) {
      elts = list.elts();
    } else if (expr instanceof TupleExpr tuple) {
      elts = tuple.elts();
    } else if (expr instanceof Name name) {
      Local local = engine.locals().get(name.id());
      return (local == null) ? InferredType.UNKNOWN : local.element();
    } else if (isBuiltinCall(expr, "sorted") || isBuiltinCall(expr, "reversed")) {
      List<Expr> args = ((Call) expr).args();
      return args.isEmpty() ? InferredType.UNKNOWN : elementTypeOf(args.get(0));
    } else if (expr instanceof ListComp comp && comp.generators().size() == 1) {
      Comprehension gen = comp.generators().get(0);
      enterLoopScope(loop(gen.target(), gen.iter()));
      try {
        return typeOf(comp.elt());
      } finally {
        exitLoopScope();
      }
    } else if (expr instanceof Call call
        && call.func() instanceof Attribute attribute
        && attribute.attr().equals("split")
        && typeOf(attribute.value()) == InferredType.STRING) {
      return InferredType.STRING;
    }
    if (elts == null || elts.isEmpty()) {
      return InferredType.UNKNOWN;
    }
    InferredType result = typeOf(elts.get(0));
    for (Expr elt : elts.subList(1, elts.size())) {
      result = result.join(typeOf(elt));
    }
    return result;
  }

  /**
   * Opens the scopes in which a loop's variables are bound, and binds them. Must be paired with
   * {@link #exitLoopScope}.
   */
  void enterLoopScope(Loop loop) {
    engine.locals().enterBlock();
    engine.types().enterScope();
    InferredType type = elementType(loop);
    engine.locals().declare(loop.var(), Local.of(ZigSyntax.zigType(type)));
    engine.types().bind(loop.var(), type);
    if (loop.index() != null) {
      engine.locals().declare(loop.index(), Local.of("i64"));
      engine.types().bind(loop.index(), InferredType.INT);
    }
  }

  void exitLoopScope() {
    engine.types().exitScope();
    engine.locals().exitBlock();
  }

  /**
   * Writes a loop header, leaving the loop body's brace open for the caller to close.
   *
   * <p>If {@code multiline} each part of the header is written as its own line, and the header
   * ends with the indentation increased by one; otherwise the parts are written on the current
   * line, separated by spaces.
   *
   * @param body the nodes that make up the loop body, to determine which variables are used
   * @param declare whether a RANGE loop should declare its variable (rather than assign to an
   *     existing one)
   */
  void openLoop(Loop loop, List<?> body, boolean declare, boolean multiline) {
    String var = ZigSyntax.identifier(loop.var());
    switch (loop.kind()) {
      case RANGE -> {
        beginPart(multiline);
        write(declare ? "var " + var + ": i64 = " : var + " = ");
        if (loop.start() == null) {
          write("0");
        } else {
          emit(loop.start());
        }
        write(";");
        endPart(multiline, false);
        beginPart(multiline);
        write("while (" + var + (loop.descending() ? " > " : " < "));
        emit(loop.iter());
        write(") : (" + var + " += ");
        if (loop.step() == null) {
          write("1");
        } else {
          emit(loop.step());
        }
        write(") {");
        endPart(multiline, true);
      }
      case ENUMERATE -> {
        boolean useIndex = Declarations.uses(body, loop.index());
        String index = "__" + fresh("idx");
        beginPart(multiline);
        write("for (");
        items(loop.iter());
        write(", 0..) |" + capture(loop.var(), body) + ", " + (useIndex ? index : "_") + "| {");
        endPart(multiline, true);
        if (useIndex) {
          beginPart(multiline);
          write("const " + ZigSyntax.identifier(loop.index()) + ": i64 = @intCast(" + index + ");");
          endPart(multiline, false);
        }
      }
      case KEYS -> {
        String it = "__" + fresh("it");
        beginPart(multiline);
        write("var " + it + " = ");
        emit(loop.iter());
        write(".keyIterator();");
        endPart(multiline, false);
        beginPart(multiline);
        write("while (" + it + ".next()) |" + it + "_key| {");
        endPart(multiline, true);
        beginPart(multiline);
        write(
            Declarations.uses(body, loop.var())
                ? "const " + var + " = " + it + "_key.*;"
                : "_ = " + it + "_key;");
        endPart(multiline, false);
      }
      case CHARS -> {
        boolean used = Declarations.uses(body, loop.var());
        String index = "__" + fresh("i");
        beginPart(multiline);
        write("for (0..");
        emit(loop.iter());
        write(".len) |" + (used ? index : "_") + "| {");
        endPart(multiline, true);
        if (used) {
          beginPart(multiline);
          write("const " + var + " = ");
          emit(loop.iter());
          write("[" + index + "..][0..1];");
          endPart(multiline, false);
        }
      }
      case ITEMS -> {
        beginPart(multiline);
        write("for (");
        items(loop.iter());
        write(") |" + capture(loop.var(), body) + "| {");
        endPart(multiline, true);
      }
    }
  }

  private void beginPart(boolean multiline) {
    if (multiline) {
      engine.state().startLine();
    }
  }

  private void endPart(boolean multiline, boolean opened) {
    if (multiline) {
      engine.state().endLine();
      if (opened) {
        engine.state().indent();
      }
    } else {
      write(" ");
    }
  }

  /** Returns the capture name for {@code var}, or "_" if the body doesn't use it. */
  static String capture(String var, List<?> body) {
    return Declarations.uses(body, var) ? ZigSyntax.identifier(var) : "_";
  }

  // Strings

  private void fString(FString fString) {
    String allocator = engine.allocator("f-string");
    StringBuilder format = new StringBuilder();
    List<Expr> values = new ArrayList<>();
    for (FStringPart part : fString.parts()) {
      if (part instanceof FStringText text) {
        format.append(ZigSyntax.formatText(text.text()));
      } else if (part instanceof FStringValue value) {
        format.append(placeholder(value));
        values.add(value.value());
      }
    }
    write("try std.fmt.allocPrint(" + allocator + ", \"" + format + "\", ");
    anonymousList(values);
    write(")");
  }

  private String placeholder(FStringValue value) {
    if (value.formatSpec() != null) {
      Matcher m = FIXED_PRECISION.matcher(value.formatSpec());
      if (m.matches()) {
        return "{d:." + m.group(1) + "}";
      }
    }
    return formatSpec(value.value());
  }

  // Subscripts

  private void subscript(Subscript subscript) {
    Expr value = subscript.value();
    if (subscript.index() instanceof Slice slice) {
      slice(value, slice);
      return;
    }
    switch (typeOf(value)) {
      case MAPPING -> {
        emit(value);
        write(".get(");
        emit(subscript.index());
        write(").?");
      }
      case STRING -> {
        emit(value);
        write("[");
        index(value, subscript.index());
        write("..][0..1]");
      }
      default -> {
        items(value);
        write("[");
        index(value, subscript.index());
        write("]");
      }
    }
  }

  /** Writes an index into {@code value}, counting from the end if it is a negative constant. */
  private void index(Expr value, Expr index) {
    Long constant = intConstant(index);
    if (constant != null && constant < 0) {
      items(value);
      write(".len - " + (-constant));
    } else if (constant != null) {
      write(String.valueOf(constant));
    } else {
      write("@intCast(");
      emit(index);
      write(")");
    }
  }

  private static @Nullable Long intConstant(Expr expr) {
    if (expr instanceof Constant c && c.kind() == ConstantKind.INT) {
      return (Long) c.value();
    } else if (expr instanceof UnaryOp u
        && u.op() == UnaryOperator.NEG
        && u.operand() instanceof Constant c
        && c.kind() == ConstantKind.INT) {
      return -(Long) c.value();
    }
    return null;
  }

  private void slice(Expr value, Slice slice) {
    if (slice.step() != null) {
      throw CompileError.unsupported("A slice with a step");
    }
    items(value);
    write("[");
    if (slice.lower() == null) {
      write("0");
    } else {
      index(value, slice.lower());
    }
    write("..");
    if (slice.upper() != null) {
      index(value, slice.upper());
    }
    write("]");
  }
}
