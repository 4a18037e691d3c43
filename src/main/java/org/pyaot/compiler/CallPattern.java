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
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A declarative description of a Python function that is translated to a single call into the
 * runtime library. For example {@code http.get(url)} is described by
 *
 * <pre>
 *   CallPattern.of("http.get", 1).projecting("body")
 * </pre>
 *
 * and is emitted as {@code (try http.get(__global_allocator, url)).body}.
 *
 * @param runtimePath the Zig function to call
 * @param minArgs the minimum number of Python arguments
 * @param maxArgs the maximum number of Python arguments
 * @param field if non-null, the field of the result that is the value of the Python call
 * @param passAllocator whether the allocator is passed as an additional first argument
 * @param useTry whether the call can fail, so must be prefixed with {@code try}
 * @param producesValue false if the Python function returns None
 */
@Immutable
public record CallPattern(
    String runtimePath,
    int minArgs,
    int maxArgs,
    @Nullable String field,
    boolean passAllocator,
    boolean useTry,
    boolean producesValue) {

  public CallPattern {
    Preconditions.checkArgument(!runtimePath.isEmpty());
    Preconditions.checkArgument(
        minArgs >= 0 && minArgs <= maxArgs, "Bad arity for %s", runtimePath);
  }

  /**
   * Returns a pattern for a fallible, allocating call with exactly {@code arity} arguments; use the
   * other methods to adjust it.
   */
  public static CallPattern of(String runtimePath, int arity) {
    return new CallPattern(runtimePath, arity, arity, null, true, true, true);
  }

  /** Returns a copy of this pattern that also accepts up to {@code maxArgs} arguments. */
  public CallPattern upTo(int maxArgs) {
    return new CallPattern(
        runtimePath, minArgs, maxArgs, field, passAllocator, useTry, producesValue);
  }

  /** Returns a copy of this pattern that accepts any number of arguments beyond its minimum. */
  public CallPattern variadic() {
    return upTo(Integer.MAX_VALUE);
  }

  /** Returns a copy of this pattern whose value is the given field of the call's result. */
  public CallPattern projecting(String field) {
    return new CallPattern(
        runtimePath, minArgs, maxArgs, field, passAllocator, useTry, producesValue);
  }

  /** Returns a copy of this pattern that doesn't pass the allocator. */
  public CallPattern noAllocator() {
    return new CallPattern(runtimePath, minArgs, maxArgs, field, false, useTry, producesValue);
  }

  /** Returns a copy of this pattern for a call that can't fail. */
  public CallPattern noTry() {
    return new CallPattern(
        runtimePath, minArgs, maxArgs, field, passAllocator, false, producesValue);
  }

  /** Returns a copy of this pattern for a function that returns None. */
  public CallPattern returnsNone() {
    return new CallPattern(runtimePath, minArgs, maxArgs, field, passAllocator, useTry, false);
  }

  public boolean isFixedArity() {
    return minArgs == maxArgs;
  }
}
