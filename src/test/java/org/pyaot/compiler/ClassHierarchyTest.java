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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.pyaot.Ast.assign;
import static org.pyaot.Ast.attr;
import static org.pyaot.Ast.classDef;
import static org.pyaot.Ast.constant;
import static org.pyaot.Ast.def;
import static org.pyaot.Ast.name;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyaot.Ast;
import org.pyaot.Ast.ClassDef;
import org.pyaot.compiler.ClassHierarchy.ClassInfo;
import org.pyaot.compiler.ClassHierarchy.Field;

@RunWith(JUnit4.class)
public class ClassHierarchyTest {

  /** Types every field by its name: "n..." fields are integers, anything else a string. */
  private static final ClassHierarchy.FieldTyper BY_NAME =
      (cls, method, field, annotation, value) ->
          (annotation != null) ? annotation : field.startsWith("n") ? "i64" : "[]const u8";

  private static Ast.Stmt setField(String field) {
    return assign(attr(name("self"), field), constant(0));
  }

  private static final ClassDef ANIMAL =
      classDef(
          "Animal",
          List.of(),
          def("__init__", List.of("self"), setField("name"), setField("nlegs")),
          def("speak", List.of("self")));

  private static final ClassDef DOG =
      classDef(
          "Dog",
          List.of("Animal"),
          def("__init__", List.of("self"), setField("breed"), setField("name")),
          def("fetch", List.of("self"), setField("nballs")));

  @Test
  public void childLayoutExtendsParentLayout() {
    ClassHierarchy hierarchy = ClassHierarchy.build(List.of(ANIMAL, DOG), BY_NAME);
    ClassInfo animal = hierarchy.get("Animal");
    ClassInfo dog = hierarchy.get("Dog");
    assertThat(animal.fields)
        .containsExactly(new Field("name", "[]const u8"), new Field("nlegs", "i64"))
        .inOrder();
    assertThat(dog.fields)
        .containsExactly(
            new Field("name", "[]const u8"),
            new Field("nlegs", "i64"),
            new Field("breed", "[]const u8"),
            new Field("nballs", "i64"))
        .inOrder();
    assertThat(dog.ownFields()).hasSize(2);
    assertThat(hierarchy.parentOf("Dog")).isEqualTo("Animal");
    assertThat(hierarchy.parentOf("Animal")).isNull();
    assertThat(dog.isSubclassOf(animal)).isTrue();
    assertThat(animal.isSubclassOf(dog)).isFalse();
  }

  @Test
  public void methodsAreFoundInAncestors() {
    ClassHierarchy hierarchy = ClassHierarchy.build(List.of(ANIMAL, DOG), BY_NAME);
    ClassInfo dog = hierarchy.get("Dog");
    assertThat(dog.methodOwner("speak").name).isEqualTo("Animal");
    assertThat(dog.methodOwner("__init__").name).isEqualTo("Dog");
    assertThat(dog.methodOwner("fly")).isNull();
    assertThat(dog.findMethod("fetch").name()).isEqualTo("fetch");
  }

  @Test
  public void multipleBasesAreRejected() {
    ClassDef mixed = classDef("Mixed", List.of("Animal", "Object"));
    CompileError e =
        assertThrows(
            CompileError.Unsupported.class,
            () -> ClassHierarchy.build(List.of(ANIMAL, mixed), BY_NAME));
    assertThat(e).hasMessageThat().contains("Multiple inheritance");
  }

  @Test
  public void basesMustBeDeclaredFirst() {
    CompileError e =
        assertThrows(CompileError.class, () -> ClassHierarchy.build(List.of(DOG, ANIMAL), BY_NAME));
    assertThat(e).hasMessageThat().contains("before it is declared");
  }

  @Test
  public void duplicateClassesAreRejected() {
    assertThrows(
        CompileError.class, () -> ClassHierarchy.build(List.of(ANIMAL, ANIMAL), BY_NAME));
  }

  @Test
  public void redeclaredFieldMustKeepItsType() {
    ClassDef bad =
        classDef(
            "Bad",
            List.of("Animal"),
            def(
                "__init__",
                List.of("self"),
                new Ast.AnnAssign(attr(name("self"), "nlegs"), "float", constant(4.0))));
    CompileError e =
        assertThrows(CompileError.class, () -> ClassHierarchy.build(List.of(ANIMAL, bad), BY_NAME));
    assertThat(e).hasMessageThat().contains("inherited from Animal");
  }

  @Test
  public void unknownBaseIsIgnored() {
    ClassDef error = classDef("MyError", List.of("Exception"));
    ClassHierarchy hierarchy = ClassHierarchy.build(List.of(error), BY_NAME);
    assertThat(hierarchy.get("MyError").parent).isNull();
    assertThat(hierarchy.get("MyError").fields).isEmpty();
  }
}
