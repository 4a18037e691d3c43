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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast;
import org.pyaot.Ast.AnnAssign;
import org.pyaot.Ast.Assert;
import org.pyaot.Ast.Assign;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.AugAssign;
import org.pyaot.Ast.BinaryOp;
import org.pyaot.Ast.Call;
import org.pyaot.Ast.ClassDef;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.ExprStmt;
import org.pyaot.Ast.For;
import org.pyaot.Ast.FunctionDef;
import org.pyaot.Ast.If;
import org.pyaot.Ast.Import;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Param;
import org.pyaot.Ast.Raise;
import org.pyaot.Ast.Return;
import org.pyaot.Ast.SimpleStmt;
import org.pyaot.Ast.Stmt;
import org.pyaot.Ast.Subscript;
import org.pyaot.Ast.TupleExpr;
import org.pyaot.Ast.While;
import org.pyaot.analysis.InferredType;
import org.pyaot.analysis.RequirementSet;
import org.pyaot.analysis.TypeInferrer;
import org.pyaot.compiler.ClassHierarchy.ClassInfo;
import org.pyaot.compiler.Declarations.Local;
import org.pyaot.compiler.Declarations.Locals;
import org.pyaot.compiler.ExpressionEmitter.Loop;
import org.pyaot.compiler.ExpressionEmitter.LoopKind;
import org.pyaot.util.ZigSyntax;

/**
 * Walks a module and writes the corresponding Zig source to an {@link EmissionState}.
 *
 * <p>Emission proceeds in passes:
 *
 * <ul>
 *   <li>the declarations of the module (functions, classes and imports) are collected, and the
 *       field layout of each class is computed;
 *   <li>the preamble is written, importing only the runtime support that the module's {@link
 *       RequirementSet} calls for;
 *   <li>module-level constants, classes, and functions are written;
 *   <li>the remaining top-level statements are written as the body of {@code main} (or, in
 *       module mode, rejected).
 * </ul>
 *
 * <p>Expressions are delegated to an {@link ExpressionEmitter}, and calls to stdlib functions and
 * methods of builtin types are delegated to the {@link Handler}s in a {@link HandlerRegistry}.
 *
 * <p>An EmissionEngine is used for a single module; it is not reentrant.
 */
public final class EmissionEngine implements Emitter {

  private final RequirementSet requirements;
  private final HandlerRegistry registry;
  private final CompilerOptions options;
  private final EmissionState state;
  private final ExpressionEmitter expr;

  private Declarations declarations;

  /** Top-level names that are emitted as module-level constants, and what is known about them. */
  private final Map<String, Local> constants = new LinkedHashMap<>();

  private Locals locals = new Locals(ImmutableSet.of());
  private TypeInferrer types = new TypeInferrer();

  /** The name of the receiver of the method being emitted, or null. */
  private @Nullable String selfName;

  /** For each enclosing block, the statements that follow the one being emitted. */
  private final Deque<List<Stmt>> following = new ArrayDeque<>();

  private final Map<FunctionDef, String> returnTypes = new IdentityHashMap<>();
  private final Set<String> classNames = new HashSet<>();

  private boolean emitted;

  public EmissionEngine(
      RequirementSet requirements, HandlerRegistry registry, CompilerOptions options) {
    this.requirements = requirements;
    this.registry = registry;
    this.options = options;
    this.state = new EmissionState(options.indent);
    this.expr = new ExpressionEmitter(this);
  }

  // Emitter

  @Override
  public EmissionState state() {
    return state;
  }

  @Override
  public CompilerOptions options() {
    return options;
  }

  @Override
  public RequirementSet requirements() {
    return requirements;
  }

  @Override
  public void emitExpr(Expr e) {
    expr.emit(e);
  }

  @Override
  public InferredType typeOf(Expr e) {
    return expr.typeOf(e);
  }

  @Override
  public void emitItems(Expr e) {
    expr.items(e);
  }

  @Override
  public void emitCondition(Expr e) {
    expr.condition(e);
  }

  @Override
  public String formatSpec(Expr e) {
    return expr.formatSpec(e);
  }

  @Override
  public @Nullable ClassInfo classOf(Expr e) {
    return expr.classOf(e);
  }

  @Override
  public @Nullable String selfName() {
    return selfName;
  }

  // Accessors for ExpressionEmitter

  Declarations declarations() {
    return declarations;
  }

  Locals locals() {
    return locals;
  }

  TypeInferrer types() {
    return types;
  }

  HandlerRegistry registry() {
    return registry;
  }

  /** Maps a Zig type back to the InferredType it represents. */
  static InferredType inferredType(String zigType) {
    return switch (zigType) {
      case "i64", "bool" -> InferredType.INT;
      case "f64" -> InferredType.FLOAT;
      case "[]const u8" -> InferredType.STRING;
      default -> InferredType.UNKNOWN;
    };
  }

  // Module

  /**
   * Emits {@code module}, returning the state holding the output.
   *
   * @param moduleName the name of the struct wrapping the declarations in module mode
   */
  public EmissionState emitModule(Ast.Module module, String moduleName) {
    Preconditions.checkState(!emitted, "An EmissionEngine can only be used once");
    emitted = true;
    for (Stmt stmt : module.body()) {
      if (stmt instanceof ClassDef def) {
        classNames.add(def.name());
      }
    }
    declarations = Declarations.collect(module, this::fieldType);
    List<Stmt> topLevel = new ArrayList<>();
    for (Stmt stmt : module.body()) {
      if (!(stmt instanceof FunctionDef || stmt instanceof ClassDef || stmt instanceof Import)) {
        topLevel.add(stmt);
      }
    }
    preamble();
    if (options.moduleMode) {
      moduleStruct(module, moduleName);
    } else {
      collectConstants(topLevel);
      program(module, topLevel);
    }
    Preconditions.checkState(state.depth() == 0);
    return state;
  }

  private void preamble() {
    state.line("const std = @import(\"std\");");
    state.line("const runtime = @import(%s);", ZigSyntax.stringLiteral(options.runtimeImport));
    if (requirements.needsStringUtils()) {
      state.line("const string_utils = @import(\"string_utils.zig\");");
    }
    if (requirements.needsHashmapHelper()) {
      state.line("const hashmap_helper = @import(\"./utils/hashmap_helper.zig\");");
    }
    if (requirements.needsAllocator()) {
      state.line("const allocator_helper = @import(\"./utils/allocator_helper.zig\");");
    }
    if (requirements.needsJson()) {
      state.line("const json = runtime.json;");
    }
    if (requirements.needsHttp()) {
      state.line("const http = runtime.http;");
    }
    if (requirements.needsAsync()) {
      state.line("const asyncio = runtime.asyncio;");
    }
  }

  /**
   * Top-level names bound exactly once, to a constant, are emitted at module level so that
   * functions can refer to them.
   */
  private void collectConstants(List<Stmt> topLevel) {
    ImmutableSet<String> assigned = Declarations.mutatedNames(topLevel);
    for (Stmt stmt : topLevel) {
      if (stmt instanceof Assign assign
          && assign.targets().size() == 1
          && assign.targets().get(0) instanceof Name name
          && assign.value() instanceof Constant constant
          && constant.kind() != ConstantKind.NONE
          && !assigned.contains(name.id())
          && !declarations.functions.containsKey(name.id())
          && !classNames.contains(name.id())) {
        constants.put(name.id(), Local.of(ZigSyntax.zigType(constant.kind())));
      }
    }
  }

  private void program(Ast.Module module, List<Stmt> topLevel) {
    state.line("const __name__ = \"__main__\";");
    if (requirements.needsAllocator()) {
      state.blankLine();
      state.line("var __gpa = std.heap.GeneralPurposeAllocator(.{ .safety = true }){};");
      state.line("var %s: std.mem.Allocator = undefined;", ALLOCATOR);
    }
    if (!constants.isEmpty()) {
      state.blankLine();
      for (Stmt stmt : topLevel) {
        if (stmt instanceof Assign assign
            && assign.targets().get(0) instanceof Name name
            && constants.containsKey(name.id())) {
          state.startLine();
          write("const " + ZigSyntax.identifier(name.id()) + ": ");
          write(constants.get(name.id()).zigType() + " = ");
          emitExpr(assign.value());
          write(";");
          state.endLine();
        }
      }
    }
    declarationsOf(module, false);
    state.blankLine();
    mainFunction(topLevel);
  }

  /** Emits the classes and functions of {@code module}, in source order. */
  private void declarationsOf(Ast.Module module, boolean pub) {
    for (Stmt stmt : module.body()) {
      if (stmt instanceof ClassDef def) {
        state.blankLine();
        classDef(declarations.classes.get(def.name()), pub);
      } else if (stmt instanceof FunctionDef def) {
        state.blankLine();
        functionDef(def, null, pub);
      }
    }
  }

  private void moduleStruct(Ast.Module module, String moduleName) {
    if (requirements.needsAllocator()) {
      state.blankLine();
      state.line("var __gpa = std.heap.GeneralPurposeAllocator(.{ .safety = true }){};");
      state.line("var %s: std.mem.Allocator = __gpa.allocator();", ALLOCATOR);
    }
    state.blankLine();
    state.line("pub const %s = struct {", ZigSyntax.identifier(moduleName));
    state.indent();
    boolean first = true;
    for (Stmt stmt : module.body()) {
      if (stmt instanceof Assign assign
          && assign.targets().size() == 1
          && assign.targets().get(0) instanceof Name name) {
        state.startLine();
        write("pub const " + ZigSyntax.identifier(name.id()) + " = ");
        emitExpr(assign.value());
        write(";");
        state.endLine();
        types.bind(name.id(), typeOf(assign.value()));
      } else if (stmt instanceof ClassDef def) {
        if (!first) {
          state.blankLine();
        }
        classDef(declarations.classes.get(def.name()), true);
      } else if (stmt instanceof FunctionDef def) {
        if (!first) {
          state.blankLine();
        }
        functionDef(def, null, true);
      } else if (!(stmt instanceof Import || isDocstring(stmt))) {
        throw CompileError.unsupported("A top-level %s in module mode", Ast.kindOf(stmt));
      }
      first = false;
    }
    state.dedent();
    state.line("};");
  }

  private static boolean isDocstring(Stmt stmt) {
    return stmt instanceof ExprStmt e && e.value() instanceof Constant;
  }

  /**
   * Returns true if {@code main} must be declared {@code !void}: the runtime support it sets up
   * can fail, or the top-level code may raise or call something that can.
   */
  private boolean mainIsFallible(List<Stmt> topLevel) {
    if (requirements.needsAllocator()
        || requirements.needsRuntime()
        || requirements.needsStd()
        || declarations.functions.containsKey("main")) {
      return true;
    }
    boolean[] fallible = new boolean[1];
    Ast.walkAll(
        topLevel,
        node -> {
          if (node instanceof Raise) {
            fallible[0] = true;
          } else if (node instanceof Call call
              && !(call.func() instanceof Name name
                  && !declarations.functions.containsKey(name.id())
                  && !classNames.contains(name.id()))) {
            fallible[0] = true;
          }
        });
    return fallible[0];
  }

  private void mainFunction(List<Stmt> topLevel) {
    state.line("pub fn main() %s {", mainIsFallible(topLevel) ? "!void" : "void");
    state.indent();
    if (requirements.needsAllocator()) {
      String label = state.freshLabel("alloc");
      state.line("%s = %s: {", ALLOCATOR, label);
      state.indent();
      state.line("if (comptime allocator_helper.useFastAllocator()) {");
      state.indent();
      state.line("break :%s std.heap.c_allocator;", label);
      state.dedent();
      state.line("}");
      state.line("break :%s __gpa.allocator();", label);
      state.dedent();
      state.line("};");
      if (requirements.needsHttp()) {
        state.line("try http.init(%s);", ALLOCATOR);
      }
      if (requirements.needsAsync()) {
        state.line("try asyncio.init(%s);", ALLOCATOR);
        state.line("defer asyncio.deinit();");
      }
    }
    List<Stmt> body = new ArrayList<>();
    for (Stmt stmt : topLevel) {
      if (!(stmt instanceof Assign assign
          && assign.targets().get(0) instanceof Name name
          && constants.containsKey(name.id()))) {
        body.add(stmt);
      }
    }
    locals = newLocals(body);
    types = newTypes();
    types.bind("__name__", InferredType.STRING);
    statements(body);
    FunctionDef userMain = declarations.functions.get("main");
    if (userMain != null && !callsMain(topLevel)) {
      boolean discard = !returnType(userMain, null).equals("void");
      state.line("%stry %s();", discard ? "_ = " : "", Declarations.USER_MAIN);
    }
    state.dedent();
    state.line("}");
  }

  private static boolean callsMain(List<Stmt> topLevel) {
    boolean[] found = new boolean[1];
    Ast.walkAll(
        topLevel,
        node -> {
          if (node instanceof Call call
              && call.func() instanceof Name name
              && name.id().equals("main")) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /** Creates the locals for a new function body; module-level constants are visible in it. */
  private Locals newLocals(List<Stmt> body) {
    Locals result = new Locals(Declarations.mutatedNames(body));
    constants.forEach(result::declare);
    return result;
  }

  /** Creates the type environment for a new function body, with module-level constants bound. */
  private TypeInferrer newTypes() {
    TypeInferrer result = new TypeInferrer();
    constants.forEach((name, local) -> result.bind(name, inferredType(local.zigType())));
    return result;
  }

  // Types of declarations

  /**
   * Returns the Zig type for a type annotation: a builtin type, or a pointer to an instance of a
   * user class.
   */
  private String declaredType(String annotation) {
    String type = ZigSyntax.annotationType(annotation);
    if (type != null) {
      return type;
    } else if (classNames.contains(annotation)) {
      return "*" + annotation;
    }
    throw CompileError.unsupported("The type annotation '%s'", annotation);
  }

  /** Returns a TypeInferrer with the annotated parameters and simple assignments of def bound. */
  private TypeInferrer inferrerFor(FunctionDef def) {
    TypeInferrer inferrer = newTypes();
    for (Param param : def.params()) {
      if (param.annotation() != null) {
        inferrer.bind(param.name(), inferredType(declaredType(param.annotation())));
      }
    }
    Ast.walkAll(
        def.body(),
        node -> {
          if (node instanceof Assign assign) {
            for (Expr target : assign.targets()) {
              if (target instanceof Name name) {
                inferrer.bind(name.id(), inferrer.infer(assign.value()));
              }
            }
          } else if (node instanceof AnnAssign ann && ann.target() instanceof Name name) {
            inferrer.bind(name.id(), inferredType(declaredType(ann.annotation())));
          } else if (node instanceof For forStmt
              && forStmt.target() instanceof Name name
              && forStmt.iter() instanceof Call call
              && call.func() instanceof Name func
              && func.id().equals("range")) {
            inferrer.bind(name.id(), InferredType.INT);
          }
        });
    return inferrer;
  }

  /** Returns the Zig type of a field first assigned in {@code method}. */
  private String fieldType(
      ClassDef cls,
      FunctionDef method,
      String field,
      @Nullable String annotation,
      @Nullable Expr value) {
    if (annotation != null) {
      return declaredType(annotation);
    }
    String type = (value == null) ? null : knownType(method, value);
    if (type == null) {
      throw CompileError.unsupported(
          "A field whose type can't be determined (%s.%s)", cls.name(), field);
    }
    return type;
  }

  /**
   * Returns the Zig type of {@code value} within {@code def}, if it is evident from annotations,
   * literals and constructor calls; otherwise returns null.
   */
  private @Nullable String knownType(FunctionDef def, Expr value) {
    if (value instanceof Name name) {
      for (Param param : def.params()) {
        if (param.name().equals(name.id()) && param.annotation() != null) {
          return declaredType(param.annotation());
        }
      }
    } else if (value instanceof Call call
        && call.func() instanceof Name name
        && classNames.contains(name.id())) {
      return "*" + name.id();
    } else if (value instanceof Constant c && c.kind() == ConstantKind.BOOL
        || value instanceof Ast.Compare
        || value instanceof Ast.BoolOp) {
      return "bool";
    }
    return ZigSyntax.zigType(inferrerFor(def).infer(value));
  }

  /**
   * Returns the Zig type returned by {@code def} (without the error union): its annotation if it
   * has one, {@code void} if it never returns a value, and otherwise the type of the values it
   * returns.
   *
   * @param owner the class that defines {@code def}, if it is a method
   */
  String returnType(FunctionDef def, @Nullable ClassInfo owner) {
    String result = returnTypes.get(def);
    if (result == null) {
      result = computeReturnType(def, owner);
      returnTypes.put(def, result);
    }
    return result;
  }

  private String computeReturnType(FunctionDef def, @Nullable ClassInfo owner) {
    if (def.returns() != null) {
      return declaredType(def.returns());
    } else if (def.name().equals("__init__")) {
      return "void";
    }
    List<Expr> values = new ArrayList<>();
    Ast.walkAll(
        def.body(),
        node -> {
          if (node instanceof Return ret && ret.value() != null) {
            values.add(ret.value());
          }
        });
    if (values.isEmpty()) {
      return "void";
    }
    String self = (owner == null || def.params().isEmpty()) ? null : def.params().get(0).name();
    String type = null;
    InferredType joined = null;
    for (Expr value : values) {
      String valueType;
      if (self != null
          && value instanceof Attribute attribute
          && attribute.value() instanceof Name name
          && name.id().equals(self)
          && owner.field(attribute.attr()) != null) {
        valueType = owner.field(attribute.attr()).zigType();
      } else if (self != null && value instanceof Name name && name.id().equals(self)) {
        valueType = "*" + owner.name;
      } else {
        valueType = knownType(def, value);
      }
      if (valueType == null) {
        continue;
      }
      if (type == null || type.equals(valueType)) {
        type = valueType;
        joined = inferredType(valueType);
      } else {
        joined = joined.join(inferredType(valueType));
        type = ZigSyntax.zigType(joined);
        if (type == null) {
          break;
        }
      }
    }
    if (type == null) {
      throw CompileError.unsupported(
          "A function whose return type can't be determined (%s)", def.name());
    }
    return type;
  }

  // Classes and functions

  private void classDef(ClassInfo cls, boolean pub) {
    state.enterClass(cls.name, (cls.parent == null) ? null : cls.parent.name);
    try {
      state.line("%sconst %s = struct {", pub ? "pub " : "", cls.name);
      state.indent();
      for (ClassHierarchy.Field field : cls.fields) {
        state.line("%s: %s,", ZigSyntax.identifier(field.name()), field.zigType());
      }
      for (Stmt stmt : cls.def.body()) {
        if (!(stmt instanceof FunctionDef
            || stmt == SimpleStmt.PASS
            || isDocstring(stmt))) {
          throw CompileError.unsupported("A %s in a class body", Ast.kindOf(stmt));
        }
      }
      if (!cls.fields.isEmpty()) {
        state.blankLine();
      }
      constructor(cls);
      for (FunctionDef method : cls.methods.values()) {
        state.blankLine();
        functionDef(method, cls, true);
      }
      state.dedent();
      state.line("};");
    } catch (CompileError e) {
      throw e.inContext(state.context());
    }
    state.exitClass();
  }

  /** Writes {@code init}, which allocates an instance and passes it to {@code __init__}. */
  private void constructor(ClassInfo cls) {
    FunctionDef init = cls.findMethod("__init__");
    ClassInfo owner = cls.methodOwner("__init__");
    List<Param> params =
        (init == null) ? ImmutableList.of() : init.params().subList(1, init.params().size());
    state.startLine();
    write("pub fn init(");
    parameters(params, ImmutableSet.of());
    write(") anyerror!*" + cls.name + " {");
    state.endLine();
    state.indent();
    state.line("const self = try %s.create(%s);", allocator("class instance"), cls.name);
    if (init != null) {
      state.startLine();
      if (owner == cls) {
        write("try self.__init__(");
      } else {
        write("try " + owner.name + ".__init__(@as(*" + owner.name + ", @ptrCast(self))");
        if (!params.isEmpty()) {
          write(", ");
        }
      }
      for (int i = 0; i < params.size(); i++) {
        if (i != 0) {
          write(", ");
        }
        write(ZigSyntax.identifier(params.get(i).name()));
      }
      write(");");
      state.endLine();
    }
    state.line("return self;");
    state.dedent();
    state.line("}");
  }

  /** The prefix given to a parameter that is rebound in the function body. */
  private static final String REBOUND_PREFIX = "__arg_";

  private void parameters(List<Param> params, Set<String> rebound) {
    for (int i = 0; i < params.size(); i++) {
      Param param = params.get(i);
      if (i != 0) {
        write(", ");
      }
      String name = rebound.contains(param.name()) ? REBOUND_PREFIX + param.name() : param.name();
      write(ZigSyntax.identifier(name) + ": ");
      write((param.annotation() == null) ? "anytype" : declaredType(param.annotation()));
    }
  }

  private void functionDef(FunctionDef def, @Nullable ClassInfo owner, boolean pub) {
    if (def.isAsync()) {
      throw CompileError.unsupported("async def (%s)", def.name());
    }
    state.enterFunction(def.name());
    try {
      function(def, owner, pub);
    } catch (CompileError e) {
      throw e.inContext(state.context());
    }
    state.exitFunction();
  }

  private void function(FunctionDef def, @Nullable ClassInfo owner, boolean pub) {
    List<Param> params = def.params();
    String name;
    if (owner != null) {
      if (params.isEmpty()) {
        throw CompileError.unsupported("A method with no self parameter");
      }
      selfName = params.get(0).name();
      params = params.subList(1, params.size());
      name = def.name();
    } else {
      selfName = null;
      name = Declarations.functionName(def.name());
    }
    Set<String> rebound = new HashSet<>(Declarations.assignedNames(def.body()));
    rebound.retainAll(params.stream().map(Param::name).toList());
    state.startLine();
    write((pub ? "pub " : "") + "fn " + ZigSyntax.identifier(name) + "(");
    if (owner != null) {
      write(ZigSyntax.identifier(selfName) + ": *" + owner.name);
      if (!params.isEmpty()) {
        write(", ");
      }
    }
    parameters(params, rebound);
    write(") anyerror!" + returnType(def, owner) + " {");
    state.endLine();
    state.indent();

    locals = newLocals(def.body());
    types = newTypes();
    if (owner != null) {
      locals.declare(selfName, Local.of("*" + owner.name));
      if (!Declarations.uses(def.body(), selfName)) {
        state.line("_ = %s;", ZigSyntax.identifier(selfName));
      }
    }
    for (Param param : params) {
      String type = (param.annotation() == null) ? null : declaredType(param.annotation());
      locals.declare(param.name(), Local.of(type));
      if (type != null) {
        types.bind(param.name(), inferredType(type));
      }
      String id = ZigSyntax.identifier(param.name());
      if (rebound.contains(param.name())) {
        state.line(
            "var %s%s = %s;",
            id,
            (type == null) ? "" : ": " + type,
            ZigSyntax.identifier(REBOUND_PREFIX + param.name()));
      } else if (!Declarations.uses(def.body(), param.name())) {
        state.line("_ = %s;", id);
      }
    }
    statements(def.body());
    state.dedent();
    state.line("}");
    selfName = null;
  }

  // Statements

  /** Emits {@code stmts} as the body of a new Zig block. */
  private void block(List<Stmt> stmts) {
    locals.enterBlock();
    types.enterScope();
    statements(stmts);
    types.exitScope();
    locals.exitBlock();
  }

  private void statements(List<Stmt> stmts) {
    for (int i = 0; i < stmts.size(); i++) {
      following.push(stmts.subList(i + 1, stmts.size()));
      statement(stmts.get(i));
      following.pop();
    }
  }

  private void statement(Stmt stmt) {
    if (stmt instanceof Assign assign) {
      assign(assign);
    } else if (stmt instanceof AugAssign aug) {
      augAssign(aug);
    } else if (stmt instanceof AnnAssign ann) {
      annAssign(ann);
    } else if (stmt instanceof ExprStmt exprStmt) {
      exprStmt(exprStmt.value());
    } else if (stmt instanceof If ifStmt) {
      ifStmt(ifStmt);
    } else if (stmt instanceof While whileStmt) {
      state.startLine();
      write("while (");
      expr.condition(whileStmt.condition());
      write(") {");
      state.endLine();
      state.indent();
      block(whileStmt.body());
      state.dedent();
      state.line("}");
    } else if (stmt instanceof For forStmt) {
      forStmt(forStmt);
    } else if (stmt instanceof Return ret) {
      if (state.currentFunction() == null) {
        throw CompileError.error("'return' outside function");
      } else if (ret.value() == null) {
        state.line("return;");
      } else {
        state.startLine();
        write("return ");
        emitExpr(ret.value());
        write(";");
        state.endLine();
      }
    } else if (stmt instanceof Assert assertStmt) {
      assertStmt(assertStmt);
    } else if (stmt instanceof Raise raise) {
      raise(raise);
    } else if (stmt instanceof SimpleStmt simple) {
      switch (simple) {
        case PASS -> {}
        case BREAK -> state.line("break;");
        case CONTINUE -> state.line("continue;");
      }
    } else if (stmt instanceof Import) {
      // Imports are resolved through the registry; nothing is emitted for them.
    } else if (stmt instanceof FunctionDef || stmt instanceof ClassDef) {
      throw CompileError.unsupported("A nested %s", Ast.kindOf(stmt));
    } else {
      throw CompileError.unsupported(Ast.kindOf(stmt));
    }
  }

  /**
   * Declares a local, followed by a discard if it is not used by the remaining statements of its
   * block (Zig rejects unused locals).
   */
  private void declare(String name, @Nullable String zigType, Expr value) {
    boolean mutable = locals.isMutated(name);
    String id = ZigSyntax.identifier(name);
    state.startLine();
    write((mutable ? "var " : "const ") + id);
    if (zigType != null) {
      write(": " + zigType);
    }
    write(" = ");
    // A list that is modified in place can't be a fixed-size array.
    boolean growable =
        mutable && value instanceof Ast.ListExpr && requirements.needsAllocator();
    if (growable) {
      expr.dynamicList((Ast.ListExpr) value);
    } else {
      emitExpr(value);
    }
    write(";");
    state.endLine();
    locals.declare(
        name,
        new Local(
            zigType, !growable && expr.isFixedArray(value), expr.elementTypeOf(value)));
    types.bind(name, typeOf(value));
    if (!following.isEmpty() && !Declarations.uses(following.peek(), name)) {
      state.line(mutable ? "_ = &%s;" : "_ = %s;", id);
    }
  }

  private void assign(Assign assign) {
    List<Expr> targets = assign.targets();
    if (targets.size() == 1) {
      assignTo(targets.get(0), assign.value());
      return;
    }
    // a = b = value: evaluate the value once.
    String temp = "__" + state.freshLabel("chain");
    state.startLine();
    write("const " + temp + " = ");
    emitExpr(assign.value());
    write(";");
    state.endLine();
    locals.declare(temp, Local.of(expr.zigTypeOf(assign.value())));
    types.bind(temp, typeOf(assign.value()));
    for (Expr target : targets) {
      assignTo(target, Ast.name(temp));
    }
  }

  private void assignTo(Expr target, Expr value) {
    if (target instanceof Name name) {
      if (locals.isDeclared(name.id())) {
        if (constants.containsKey(name.id())) {
          throw CompileError.error("Module constant '%s' can't be reassigned", name.id());
        }
        state.startLine();
        write(ZigSyntax.identifier(name.id()) + " = ");
        emitExpr(value);
        write(";");
        state.endLine();
        types.bind(name.id(), typeOf(value));
      } else {
        declare(name.id(), expr.zigTypeOf(value), value);
      }
    } else if (target instanceof TupleExpr tuple) {
      unpack(tuple, value);
    } else if (target instanceof Attribute) {
      state.startLine();
      emitExpr(target);
      write(" = ");
      emitExpr(value);
      write(";");
      state.endLine();
    } else if (target instanceof Subscript subscript) {
      subscriptAssign(subscript, value);
    } else {
      throw CompileError.unsupported("Assigning to a %s", Ast.kindOf(target));
    }
  }

  private void unpack(TupleExpr targets, Expr value) {
    List<Expr> values = (value instanceof TupleExpr tuple) ? tuple.elts() : null;
    if (values != null && values.size() != targets.elts().size()) {
      throw CompileError.error(
          "Can't unpack %s values into %s targets", values.size(), targets.elts().size());
    }
    String temp = "__" + state.freshLabel("unpack");
    state.startLine();
    write("const " + temp + " = ");
    emitExpr(value);
    write(";");
    state.endLine();
    for (int i = 0; i < targets.elts().size(); i++) {
      Expr target = targets.elts().get(i);
      String element = temp + "[" + i + "]";
      if (!(target instanceof Name name)) {
        throw CompileError.unsupported("Unpacking into a %s", Ast.kindOf(target));
      }
      String id = ZigSyntax.identifier(name.id());
      Expr source = (values == null) ? null : values.get(i);
      if (locals.isDeclared(name.id())) {
        state.line("%s = %s;", id, element);
      } else {
        String type = (source == null) ? null : expr.zigTypeOf(source);
        state.line(
            "%s %s%s = %s;",
            locals.isMutated(name.id()) ? "var" : "const",
            id,
            (type == null) ? "" : ": " + type,
            element);
        locals.declare(name.id(), Local.of(type));
      }
      if (source != null) {
        types.bind(name.id(), typeOf(source));
      }
    }
  }

  private void subscriptAssign(Subscript target, Expr value) {
    switch (typeOf(target.value())) {
      case MAPPING -> {
        state.startLine();
        write("try ");
        emitExpr(target.value());
        write(".put(");
        emitExpr(target.index());
        write(", ");
        emitExpr(value);
        write(");");
        state.endLine();
      }
      case STRING -> throw CompileError.error("Strings are immutable");
      default -> {
        state.startLine();
        emitExpr(target);
        write(" = ");
        emitExpr(value);
        write(";");
        state.endLine();
      }
    }
  }

  private void augAssign(AugAssign aug) {
    Expr target = aug.target();
    if (target instanceof Name name && !locals.isDeclared(name.id())) {
      throw CompileError.unresolved(name.id());
    }
    InferredType targetType = typeOf(target);
    InferredType valueType = typeOf(aug.value());
    state.startLine();
    if (aug.op() == BinaryOp.ADD && targetType == InferredType.SEQUENCE) {
      write("try ");
      emitExpr(target);
      write(".appendSlice(" + allocator("list extension") + ", ");
      expr.items(aug.value());
      write(");");
    } else if (target instanceof Subscript subscript
        && typeOf(subscript.value()) == InferredType.MAPPING) {
      write("try ");
      emitExpr(subscript.value());
      write(".put(");
      emitExpr(subscript.index());
      write(", ");
      expr.binary(target, aug.op(), aug.value());
      write(");");
    } else if (ExpressionEmitter.isCompoundAssignable(aug.op())
        && targetType != InferredType.STRING
        && !(targetType == InferredType.INT && valueType == InferredType.FLOAT)) {
      emitExpr(target);
      write(" " + aug.op().symbol + "= ");
      emitExpr(aug.value());
      write(";");
    } else {
      emitExpr(target);
      write(" = ");
      expr.binary(target, aug.op(), aug.value());
      write(";");
    }
    state.endLine();
    if (target instanceof Name name) {
      types.bind(name.id(), types.infer(Ast.binOp(target, aug.op(), aug.value())));
    }
  }

  private void annAssign(AnnAssign ann) {
    if (ann.target() instanceof Name name) {
      String type = declaredType(ann.annotation());
      if (ann.value() != null) {
        declare(name.id(), type, ann.value());
        return;
      }
      state.line("var %s: %s = undefined;", ZigSyntax.identifier(name.id()), type);
      locals.declare(name.id(), Local.of(type));
      types.bind(name.id(), inferredType(type));
    } else if (ann.value() != null) {
      assignTo(ann.target(), ann.value());
    }
  }

  private void exprStmt(Expr value) {
    if (value instanceof Constant) {
      // Docstrings and other bare constants have no effect.
      return;
    }
    boolean discard = !(value instanceof Call call) || expr.producesValue(call);
    state.startLine();
    if (discard) {
      write("_ = ");
    }
    emitExpr(value);
    write(";");
    state.endLine();
  }

  private void ifStmt(If ifStmt) {
    state.startLine();
    write("if (");
    expr.condition(ifStmt.condition());
    write(") {");
    state.endLine();
    state.indent();
    block(ifStmt.body());
    state.dedent();
    List<Stmt> orElse = ifStmt.orElse();
    while (orElse.size() == 1 && orElse.get(0) instanceof If elif) {
      state.startLine();
      write("} else if (");
      expr.condition(elif.condition());
      write(") {");
      state.endLine();
      state.indent();
      block(elif.body());
      state.dedent();
      orElse = elif.orElse();
    }
    if (!orElse.isEmpty()) {
      state.line("} else {");
      state.indent();
      block(orElse);
      state.dedent();
    }
    state.line("}");
  }

  private void forStmt(For forStmt) {
    Loop loop = expr.loop(forStmt.target(), forStmt.iter());
    boolean declare = !(loop.kind() == LoopKind.RANGE && locals.isDeclared(loop.var()));
    // Loops that declare a variable before the loop get their own block.
    boolean scoped =
        (loop.kind() == LoopKind.RANGE && declare) || loop.kind() == LoopKind.KEYS;
    if (scoped) {
      state.line("{");
      state.indent();
    }
    if (declare) {
      expr.enterLoopScope(loop);
    } else {
      locals.enterBlock();
      types.enterScope();
    }
    expr.openLoop(loop, forStmt.body(), declare, true);
    statements(forStmt.body());
    state.dedent();
    state.line("}");
    expr.exitLoopScope();
    if (scoped) {
      state.dedent();
      state.line("}");
    }
  }

  private void assertStmt(Assert assertStmt) {
    state.startLine();
    if (assertStmt.msg() == null) {
      write("std.debug.assert(");
      expr.condition(assertStmt.test());
      write(");");
    } else {
      write("if (!(");
      expr.condition(assertStmt.test());
      write(")) ");
      if (assertStmt.msg() instanceof Constant c && c.kind() == ConstantKind.STRING) {
        write("@panic(" + ZigSyntax.stringLiteral((String) c.value()) + ");");
      } else {
        write("std.debug.panic(\"" + formatSpec(assertStmt.msg()) + "\", .{ ");
        emitExpr(assertStmt.msg());
        write(" });");
      }
    }
    state.endLine();
  }

  /** {@code raise E(...)} returns the Zig error {@code error.E}. */
  private void raise(Raise raise) {
    Expr exc = raise.exc();
    String name;
    List<Expr> args = ImmutableList.of();
    if (exc instanceof Name n) {
      name = n.id();
    } else if (exc instanceof Call call && call.func() instanceof Name n) {
      name = n.id();
      args = call.args();
    } else {
      throw CompileError.unsupported("A raise statement without an exception class");
    }
    state.startLine();
    discardCalls(args);
    write("return error." + ZigSyntax.identifier(name) + ";");
    state.endLine();
  }
}
