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

import java.util.ArrayList;
import java.util.List;
import org.pyaot.Ast.Constant;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.Name;
import org.pyaot.analysis.InferredType;
import org.pyaot.compiler.ClassHierarchy.ClassInfo;
import org.pyaot.compiler.CompileError;
import org.pyaot.compiler.Emitter;
import org.pyaot.compiler.Handler;
import org.pyaot.compiler.HandlerRegistry;
import org.pyaot.util.ZigSyntax;

/** Handlers for Python's builtin functions, registered as "builtins.<name>". */
public final class BuiltinHandlers {

  // Static methods only
  private BuiltinHandlers() {}

  private static final String STDOUT = "std.io.getStdOut().writer()";

  static void register(HandlerRegistry.Builder builder) {
    String prefix = HandlerRegistry.BUILTINS + ".";
    builder
        .add(prefix + "print", Handler.statement(0, Integer.MAX_VALUE, BuiltinHandlers::print))
        .add(prefix + "len", Handler.expression(1, BuiltinHandlers::len))
        .add(prefix + "str", Handler.expression(1, BuiltinHandlers::str))
        .add(prefix + "repr", Handler.expression(1, BuiltinHandlers::repr))
        .add(prefix + "int", Handler.expression(1, BuiltinHandlers::toInt))
        .add(prefix + "float", Handler.expression(1, BuiltinHandlers::toFloat))
        .add(prefix + "bool", Handler.expression(1, (out, args) -> out.emitCondition(args.get(0))))
        .add(prefix + "abs", Handler.expression(1, BuiltinHandlers::abs))
        .add(prefix + "round", Handler.expression(1, BuiltinHandlers::round))
        .add(prefix + "min", Handler.expression(1, Integer.MAX_VALUE, minMax("min")))
        .add(prefix + "max", Handler.expression(1, Integer.MAX_VALUE, minMax("max")))
        .add(prefix + "sum", Handler.expression(1, BuiltinHandlers::sum))
        .add(prefix + "sorted", Handler.expression(1, copying("runtime.sorted")))
        .add(prefix + "reversed", Handler.expression(1, copying("runtime.reversed")))
        .add(prefix + "list", Handler.expression(0, 1, BuiltinHandlers::list))
        .add(prefix + "ord", Handler.expression(1, BuiltinHandlers::ord))
        .add(prefix + "range", Handler.expression(1, 3, loopOnly("range")))
        .add(prefix + "enumerate", Handler.expression(1, loopOnly("enumerate")))
        .add(prefix + "isinstance", Handler.expression(2, BuiltinHandlers::isinstance))
        .add(prefix + "hasattr", Handler.expression(2, BuiltinHandlers::hasattr))
        .add(prefix + "getattr", Handler.expression(2, 3, BuiltinHandlers::getattr))
        .add(prefix + "super", Handler.expression(0, BuiltinHandlers::bareSuper));
  }

  /**
   * {@code print(a, b)} writes its arguments separated by spaces and followed by a newline.
   * String literals are copied into the format string.
   */
  private static void print(Emitter out, List<Expr> args) {
    StringBuilder format = new StringBuilder();
    List<Expr> values = new ArrayList<>();
    for (Expr arg : args) {
      if (format.length() != 0) {
        format.append(' ');
      }
      if (arg instanceof Constant c && c.kind() == ConstantKind.STRING) {
        format.append(ZigSyntax.formatText((String) c.value()));
      } else {
        format.append(out.formatSpec(arg));
        values.add(arg);
      }
    }
    out.write("try " + STDOUT + ".print(\"" + format + "\\n\", .{");
    if (!values.isEmpty()) {
      out.write(" ");
      out.emitArgs(values);
      out.write(" ");
    }
    out.write("})");
  }

  private static void len(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    out.write("@as(i64, @intCast(");
    if (out.typeOf(arg) == InferredType.MAPPING) {
      out.emitExpr(arg);
      out.write(".count()");
    } else {
      out.emitItems(arg);
      out.write(".len");
    }
    out.write("))");
  }

  /** Writes {@code try std.fmt.allocPrint(allocator, format, .{ arg })}. */
  private static void allocPrint(Emitter out, String construct, String format, Expr arg) {
    out.write("try std.fmt.allocPrint(" + out.allocator(construct) + ", \"" + format + "\", .{ ");
    out.emitExpr(arg);
    out.write(" })");
  }

  private static void str(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    if (out.typeOf(arg) == InferredType.STRING) {
      out.emitExpr(arg);
    } else {
      allocPrint(out, "str()", out.formatSpec(arg), arg);
    }
  }

  private static void repr(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    if (out.typeOf(arg) == InferredType.STRING) {
      allocPrint(out, "repr()", "'{s}'", arg);
    } else {
      allocPrint(out, "repr()", out.formatSpec(arg), arg);
    }
  }

  private static void toInt(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    switch (out.typeOf(arg)) {
      case INT -> out.emitExpr(arg);
      case FLOAT -> wrap(out, "@as(i64, @intFromFloat(", arg, "))");
      case STRING -> wrap(out, "runtime.parseInt(", arg, ")");
      default -> wrap(out, "@as(i64, ", arg, ")");
    }
  }

  private static void toFloat(Emitter out, List<Expr> args) {
    asFloat(out, args.get(0));
  }

  /** Emits {@code arg} converted to f64. */
  static void asFloat(Emitter out, Expr arg) {
    switch (out.typeOf(arg)) {
      case FLOAT -> out.emitExpr(arg);
      case INT -> {
        if (arg instanceof Constant) {
          wrap(out, "@as(f64, ", arg, ")");
        } else {
          wrap(out, "@as(f64, @floatFromInt(", arg, "))");
        }
      }
      case STRING -> wrap(out, "runtime.parseFloat(", arg, ")");
      default -> wrap(out, "@as(f64, ", arg, ")");
    }
  }

  private static void abs(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    if (out.typeOf(arg) == InferredType.FLOAT) {
      wrap(out, "@abs(", arg, ")");
    } else {
      wrap(out, "@as(i64, @intCast(@abs(", arg, ")))");
    }
  }

  private static void round(Emitter out, List<Expr> args) {
    Expr arg = args.get(0);
    if (out.typeOf(arg) == InferredType.INT) {
      out.emitExpr(arg);
    } else {
      wrap(out, "@as(i64, @intFromFloat(@round(", arg, ")))");
    }
  }

  /** With one argument, the smallest/largest element of a sequence; otherwise of the arguments. */
  private static Handler.Body minMax(String name) {
    return (out, args) -> {
      if (args.size() == 1) {
        out.write("runtime." + name + "(");
        out.emitItems(args.get(0));
        out.write(")");
      } else {
        out.write("@" + name + "(");
        out.emitArgs(args);
        out.write(")");
      }
    };
  }

  private static void sum(Emitter out, List<Expr> args) {
    out.write("runtime.sum(");
    out.emitItems(args.get(0));
    out.write(")");
  }

  /** A builtin that returns a new list built from the elements of its argument. */
  private static Handler.Body copying(String runtimePath) {
    return (out, args) -> {
      out.write("try " + runtimePath + "(" + out.allocator(runtimePath) + ", ");
      out.emitItems(args.get(0));
      out.write(")");
    };
  }

  private static void list(Emitter out, List<Expr> args) {
    if (args.isEmpty()) {
      out.write("std.ArrayList(i64){}");
      return;
    }
    out.write("try runtime.toList(" + out.allocator("list()") + ", ");
    out.emitItems(args.get(0));
    out.write(")");
  }

  private static void ord(Emitter out, List<Expr> args) {
    wrap(out, "@as(i64, ", args.get(0), "[0])");
  }

  /** range() and enumerate() are only supported as the iterable of a for loop. */
  private static Handler.Body loopOnly(String name) {
    return (out, args) -> {
      throw CompileError.unsupported("%s() outside of a for loop", name);
    };
  }

  private static void wrap(Emitter out, String before, Expr arg, String after) {
    out.write(before);
    out.emitExpr(arg);
    out.write(after);
  }

  /**
   * Writes a labelled block that evaluates the calls among {@code args} for their side effects and
   * then yields {@code value}.
   */
  private static void constantBlock(Emitter out, String prefix, List<Expr> args, String value) {
    String label = out.state().freshLabel(prefix);
    out.write(label + ": { ");
    out.discardCalls(args);
    out.write("break :" + label + " " + value + "; }");
  }

  /**
   * {@code isinstance(x, C)} is decided at compile time, from the class of x if it is a user
   * class instance or else from its inferred type.
   */
  private static void isinstance(Emitter out, List<Expr> args) {
    boolean result = false;
    if (args.get(1) instanceof Name type) {
      ClassInfo cls = out.classOf(args.get(0));
      if (cls != null) {
        for (ClassInfo c = cls; c != null; c = c.parent) {
          result |= c.name.equals(type.id());
        }
      } else {
        InferredType inferred = out.typeOf(args.get(0));
        result = inferred != InferredType.UNKNOWN && type.id().equals(inferred.registryPrefix);
      }
    }
    constantBlock(out, "isinstance", args, String.valueOf(result));
  }

  private static void hasattr(Emitter out, List<Expr> args) {
    boolean result = false;
    ClassInfo cls = out.classOf(args.get(0));
    if (cls != null && args.get(1) instanceof Constant c && c.kind() == ConstantKind.STRING) {
      String attr = (String) c.value();
      result = cls.field(attr) != null || cls.findMethod(attr) != null;
    }
    constantBlock(out, "hasattr", args, String.valueOf(result));
  }

  /**
   * {@code getattr(x, "f")} is the field access {@code x.f} if x is known to have that field;
   * otherwise it is the default, if one was given.
   */
  private static void getattr(Emitter out, List<Expr> args) {
    ClassInfo cls = out.classOf(args.get(0));
    if (args.get(1) instanceof Constant c && c.kind() == ConstantKind.STRING) {
      String attr = (String) c.value();
      if (cls != null && cls.field(attr) != null) {
        out.emitExpr(args.get(0));
        out.write("." + ZigSyntax.identifier(attr));
        return;
      }
      if (args.size() == 3) {
        String label = out.state().freshLabel("getattr");
        out.write(label + ": { ");
        out.discardCalls(args.subList(0, 2));
        out.write("break :" + label + " ");
        out.emitExpr(args.get(2));
        out.write("; }");
        return;
      }
      throw CompileError.unresolved(((cls == null) ? "<object>" : cls.name) + "." + attr);
    }
    throw CompileError.unsupported("getattr() with a computed attribute name");
  }

  /** A bare {@code super()} is the receiver, viewed as an instance of the parent class. */
  private static void bareSuper(Emitter out, List<Expr> args) {
    String self = out.selfName();
    if (self == null) {
      throw CompileError.error("super() used outside of a method");
    }
    String parent = out.state().currentParent();
    if (parent == null) {
      constantBlock(out, "super", args, ".{}");
    } else {
      out.write("@as(*const " + parent + ", @ptrCast(" + ZigSyntax.identifier(self) + "))");
    }
  }
}
