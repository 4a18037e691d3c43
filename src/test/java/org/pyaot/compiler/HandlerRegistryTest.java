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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HandlerRegistryTest {

  private static final Handler NOOP = Handler.expression(0, (out, args) -> out.write("0"));

  private static final HandlerRegistry REGISTRY =
      HandlerRegistry.builder()
          .add("builtins.len", NOOP)
          .add("str.upper", NOOP)
          .add("str.count", NOOP)
          .add("list.count", NOOP)
          .add("list.append", NOOP)
          .add("os.path.exists", CallPattern.of("runtime.os.path.exists", 1))
          .addModule(
              "json",
              ImmutableMap.of(
                  "loads", CallPattern.of("json.loads", 1),
                  "dumps", CallPattern.of("json.dumps", 1).upTo(2)))
          .build();

  @Test
  public void lookup() {
    assertThat(REGISTRY.lookup("builtins.len")).isSameInstanceAs(NOOP);
    assertThat(REGISTRY.lookup("builtins.nope")).isNull();
    assertThat(REGISTRY.contains("json.dumps")).isTrue();
    assertThat(REGISTRY.size()).isEqualTo(8);
    assertThat(REGISTRY.resolve("json.dumps").maxArgs).isEqualTo(2);
  }

  @Test
  public void unknownSymbolIsUnresolved() {
    CompileError.UnresolvedSymbol e =
        assertThrows(CompileError.UnresolvedSymbol.class, () -> REGISTRY.resolve("json.parse"));
    assertThat(e.symbol).isEqualTo("json.parse");
    assertThat(e).hasMessageThat().isEqualTo("Unresolved symbol 'json.parse'");
  }

  @Test
  public void methodOwnerRequiresAUniqueType() {
    assertThat(REGISTRY.methodOwner("upper")).isEqualTo("str");
    assertThat(REGISTRY.methodOwner("append")).isEqualTo("list");
    // Defined on both str and list.
    assertThat(REGISTRY.methodOwner("count")).isNull();
    assertThat(REGISTRY.methodOwner("loads")).isNull();
  }

  @Test
  public void modulesIncludeParents() {
    assertThat(REGISTRY.isModule("json")).isTrue();
    assertThat(REGISTRY.isModule("os.path")).isTrue();
    assertThat(REGISTRY.isModule("os")).isTrue();
    assertThat(REGISTRY.isModule("str")).isFalse();
    assertThat(REGISTRY.isModule("builtins")).isFalse();
  }

  @Test
  public void duplicateSymbolsAreRejected() {
    HandlerRegistry.Builder builder = HandlerRegistry.builder().add("builtins.len", NOOP);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> builder.add("builtins.len", NOOP));
    assertThat(e).hasMessageThat().contains("already registered");
  }

  @Test
  public void symbolsMustBeQualified() {
    assertThrows(IllegalArgumentException.class, () -> HandlerRegistry.builder().add("len", NOOP));
  }

  @Test
  public void arityIsCheckedBeforeEmitting() {
    CompileError.ArityMismatch e =
        assertThrows(
            CompileError.ArityMismatch.class,
            () -> REGISTRY.emit("json.dumps", null, ImmutableList.of()));
    assertThat(e.symbol).isEqualTo("json.dumps");
    assertThat(e.min).isEqualTo(1);
    assertThat(e.max).isEqualTo(2);
    assertThat(e.actual).isEqualTo(0);
    assertThat(e).hasMessageThat().isEqualTo("'json.dumps' expects 1 to 2 argument(s), got 0");
  }
}
