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

import org.jspecify.annotations.Nullable;

/**
 * A coarse classification of an expression's runtime representation. UNKNOWN is always a safe
 * answer; the other values only let the emitter pick a more convenient encoding.
 */
public enum InferredType {
  INT("int"),
  FLOAT("float"),
  STRING("str"),
  SEQUENCE("list"),
  MAPPING("dict"),
  UNKNOWN(null);

  /**
   * The name under which methods on values of this type are registered (e.g. "str" for
   * "str.upper"), or null if there is none.
   */
  public final @Nullable String registryPrefix;

  InferredType(@Nullable String registryPrefix) {
    this.registryPrefix = registryPrefix;
  }

  /**
   * Returns the least upper bound of this and {@code other}: equal types join to themselves, INT
   * and FLOAT join to FLOAT, and anything else joins to UNKNOWN.
   */
  public InferredType join(InferredType other) {
    if (this == other) {
      return this;
    } else if (isNumeric() && other.isNumeric()) {
      return FLOAT;
    }
    return UNKNOWN;
  }

  public boolean isNumeric() {
    return this == INT || this == FLOAT;
  }
}
