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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast;
import org.pyaot.Ast.AnnAssign;
import org.pyaot.Ast.Assign;
import org.pyaot.Ast.Attribute;
import org.pyaot.Ast.ClassDef;
import org.pyaot.Ast.Expr;
import org.pyaot.Ast.FunctionDef;
import org.pyaot.Ast.Name;
import org.pyaot.Ast.Stmt;

/**
 * The classes declared by a module, with their single-inheritance relationships and their
 * flattened field layouts.
 *
 * <p>Each class is emitted as a Zig struct whose fields are its parent's fields, in the parent's
 * order, followed by the fields that only the child assigns. Because every layout begins with its
 * parent's layout, a pointer to an instance can be reinterpreted as a pointer to any of its
 * ancestors; this is how {@code super()} and inherited methods are lowered. The prefix property is
 * established here, when layouts are built, and checked again when each {@link ClassInfo} is
 * created.
 */
public final class ClassHierarchy {

  /** One field of a class layout. */
  public record Field(String name, String zigType) {}

  /** Determines the Zig type of a field from the first assignment to it. */
  @FunctionalInterface
  public interface FieldTyper {
    /**
     * Returns the Zig type of a field.
     *
     * @param cls the class whose method contains the assignment
     * @param method the method containing the assignment
     * @param field the field name
     * @param annotation the annotation on the assignment, or null
     * @param value the assigned value, or null for an annotation without a value
     */
    String fieldType(
        ClassDef cls,
        FunctionDef method,
        String field,
        @Nullable String annotation,
        @Nullable Expr value);
  }

  /** A class of the module being compiled. */
  public static final class ClassInfo {
    public final String name;
    public final ClassDef def;
    public final @Nullable ClassInfo parent;

    /** All fields, starting with the parent's. */
    public final ImmutableList<Field> fields;

    /** The methods defined directly in this class, in declaration order. */
    public final ImmutableMap<String, FunctionDef> methods;

    ClassInfo(
        ClassDef def,
        @Nullable ClassInfo parent,
        ImmutableList<Field> fields,
        ImmutableMap<String, FunctionDef> methods) {
      if (parent != null) {
        Preconditions.checkState(
            fields.size() >= parent.fields.size()
                && fields.subList(0, parent.fields.size()).equals(parent.fields),
            "Layout of %s does not begin with the layout of %s",
            def.name(),
            parent.name);
      }
      this.name = def.name();
      this.def = def;
      this.parent = parent;
      this.fields = fields;
      this.methods = methods;
    }

    /**
     * Returns the class that provides method {@code method} for instances of this class (this
     * class or the nearest ancestor that defines it), or null if there is none.
     */
    public @Nullable ClassInfo methodOwner(String method) {
      for (ClassInfo c = this; c != null; c = c.parent) {
        if (c.methods.containsKey(method)) {
          return c;
        }
      }
      return null;
    }

    /** Returns the definition of {@code method} as seen by instances of this class, or null. */
    public @Nullable FunctionDef findMethod(String method) {
      ClassInfo owner = methodOwner(method);
      return (owner == null) ? null : owner.methods.get(method);
    }

    /** Returns the field named {@code name}, or null. */
    public @Nullable Field field(String name) {
      for (Field field : fields) {
        if (field.name().equals(name)) {
          return field;
        }
      }
      return null;
    }

    /** Returns true if this class is {@code other} or one of its descendants. */
    public boolean isSubclassOf(ClassInfo other) {
      for (ClassInfo c = this; c != null; c = c.parent) {
        if (c == other) {
          return true;
        }
      }
      return false;
    }

    /** Returns the fields that this class adds to its parent's layout. */
    public List<Field> ownFields() {
      return fields.subList((parent == null) ? 0 : parent.fields.size(), fields.size());
    }

    @Override
    public String toString() {
      return (parent == null) ? name : name + "(" + parent.name + ")";
    }
  }

  private final ImmutableMap<String, ClassInfo> classes;

  private ClassHierarchy(ImmutableMap<String, ClassInfo> classes) {
    this.classes = classes;
  }

  /** A hierarchy with no classes. */
  public static final ClassHierarchy EMPTY = new ClassHierarchy(ImmutableMap.of());

  /**
   * Builds the hierarchy for the given class definitions, which must be in declaration order.
   *
   * <p>A class may have at most one base. If the base is one of {@code defs} it must precede the
   * subclass; any other base (such as {@code object} or {@code Exception}) is ignored, making the
   * class a root.
   */
  public static ClassHierarchy build(List<ClassDef> defs, FieldTyper typer) {
    Map<String, ClassInfo> classes = new LinkedHashMap<>();
    List<String> declared = defs.stream().map(ClassDef::name).toList();
    for (ClassDef def : defs) {
      if (classes.containsKey(def.name())) {
        throw CompileError.error("Class '%s' is declared more than once", def.name());
      } else if (def.bases().size() > 1) {
        throw CompileError.unsupported("Multiple inheritance (class %s)", def.name());
      }
      ClassInfo parent = null;
      if (!def.bases().isEmpty()) {
        String base = def.bases().get(0);
        parent = classes.get(base);
        if (parent == null && declared.contains(base)) {
          throw CompileError.error("Class '%s' is used as a base before it is declared", base);
        }
      }
      classes.put(def.name(), layout(def, parent, typer));
    }
    return new ClassHierarchy(ImmutableMap.copyOf(classes));
  }

  private static ClassInfo layout(ClassDef def, @Nullable ClassInfo parent, FieldTyper typer) {
    List<Field> fields = new ArrayList<>();
    if (parent != null) {
      fields.addAll(parent.fields);
    }
    ImmutableMap.Builder<String, FunctionDef> methods = ImmutableMap.builder();
    for (Stmt stmt : def.body()) {
      if (stmt instanceof FunctionDef method) {
        methods.put(method.name(), method);
        collectFields(def, method, method.body(), parent, fields, typer);
      }
    }
    return new ClassInfo(def, parent, ImmutableList.copyOf(fields), methods.buildOrThrow());
  }

  /** Appends a Field for each new {@code self.x} assigned in {@code body}. */
  private static void collectFields(
      ClassDef def,
      FunctionDef method,
      List<Stmt> body,
      @Nullable ClassInfo parent,
      List<Field> fields,
      FieldTyper typer) {
    if (method.params().isEmpty()) {
      return;
    }
    String self = method.params().get(0).name();
    Ast.walkAll(
        body,
        node -> {
          if (node instanceof Assign assign) {
            for (Expr target : assign.targets()) {
              addField(def, method, self, target, null, assign.value(), parent, fields, typer);
            }
          } else if (node instanceof AnnAssign ann) {
            addField(
                def,
                method,
                self,
                ann.target(),
                ann.annotation(),
                ann.value(),
                parent,
                fields,
                typer);
          }
        });
  }

  private static void addField(
      ClassDef def,
      FunctionDef method,
      String self,
      Expr target,
      @Nullable String annotation,
      @Nullable Expr value,
      @Nullable ClassInfo parent,
      List<Field> fields,
      FieldTyper typer) {
    if (!(target instanceof Attribute attribute
        && attribute.value() instanceof Name name
        && name.id().equals(self))) {
      return;
    }
    String fieldName = attribute.attr();
    if (fields.stream().anyMatch(f -> f.name().equals(fieldName))) {
      Field inherited = (parent == null) ? null : parent.field(fieldName);
      if (inherited != null && annotation != null) {
        String type = typer.fieldType(def, method, fieldName, annotation, value);
        if (!type.equals(inherited.zigType())) {
          throw CompileError.error(
              "Field '%s' of %s has type %s, but is inherited from %s with type %s",
              fieldName, def.name(), type, parent.name, inherited.zigType());
        }
      }
      return;
    }
    fields.add(new Field(fieldName, typer.fieldType(def, method, fieldName, annotation, value)));
  }

  /** Returns the class named {@code name}, or null if there is none. */
  public @Nullable ClassInfo get(String name) {
    return classes.get(name);
  }

  public boolean contains(String name) {
    return classes.containsKey(name);
  }

  /** All classes, in declaration order. */
  public ImmutableList<ClassInfo> classes() {
    return classes.values().asList();
  }

  /** Returns the parent of class {@code name}, or null if it is a root or not a class. */
  public @Nullable String parentOf(String name) {
    ClassInfo info = classes.get(name);
    return (info == null || info.parent == null) ? null : info.parent.name;
  }
}
