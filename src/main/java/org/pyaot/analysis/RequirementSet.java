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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * An immutable set of {@link Capability}s, represented as a bit mask.
 *
 * <p>RequirementSets form a bounded join-semilattice: {@link #merge} is bitwise OR, so it is
 * associative, commutative, and idempotent, with {@link #NONE} as its identity and {@link #ALL} as
 * its top. Nothing ever clears a flag.
 */
@Immutable
public final class RequirementSet {

  private static final Capability[] CAPABILITIES = Capability.values();

  /** The RequirementSet with no capabilities. */
  public static final RequirementSet NONE = new RequirementSet(0);

  /** The RequirementSet with every capability. */
  public static final RequirementSet ALL = new RequirementSet((1 << CAPABILITIES.length) - 1);

  private final int bits;

  private RequirementSet(int bits) {
    this.bits = bits;
  }

  private static int bit(Capability c) {
    return 1 << c.ordinal();
  }

  /** Returns a RequirementSet containing exactly the given capabilities. */
  public static RequirementSet of(Capability... capabilities) {
    int bits = 0;
    for (Capability c : capabilities) {
      bits |= bit(c);
    }
    return fromBits(bits);
  }

  private static RequirementSet fromBits(int bits) {
    return (bits == 0) ? NONE : new RequirementSet(bits);
  }

  /** Returns the least upper bound of this and {@code other}. */
  public RequirementSet merge(RequirementSet other) {
    int merged = bits | other.bits;
    if (merged == bits) {
      return this;
    } else if (merged == other.bits) {
      return other;
    }
    return new RequirementSet(merged);
  }

  /** Returns true if every capability in {@code other} is also in this. */
  public boolean containsAll(RequirementSet other) {
    return (bits & other.bits) == other.bits;
  }

  public boolean needs(Capability c) {
    return (bits & bit(c)) != 0;
  }

  public boolean isEmpty() {
    return bits == 0;
  }

  public boolean needsJson() {
    return needs(Capability.JSON);
  }

  public boolean needsHttp() {
    return needs(Capability.HTTP);
  }

  public boolean needsAsync() {
    return needs(Capability.ASYNC);
  }

  public boolean needsAllocator() {
    return needs(Capability.ALLOCATOR);
  }

  public boolean needsRuntime() {
    return needs(Capability.RUNTIME);
  }

  public boolean needsStringUtils() {
    return needs(Capability.STRING_UTILS);
  }

  public boolean needsHashmapHelper() {
    return needs(Capability.HASHMAP_HELPER);
  }

  public boolean needsStd() {
    return needs(Capability.STD);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof RequirementSet other) && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return bits;
  }

  /** Returns e.g. "{needs_json, needs_allocator}". */
  @Override
  public String toString() {
    return Arrays.stream(CAPABILITIES)
        .filter(this::needs)
        .map(Capability::flagName)
        .collect(Collectors.joining(", ", "{", "}"));
  }

  /**
   * A mutable accumulator for a RequirementSet. Flags can only be added, so the result of {@link
   * #build} only ever grows as more of the tree is visited.
   */
  public static final class Builder {
    private int bits;

    @CanIgnoreReturnValue
    public Builder add(Capability... capabilities) {
      for (Capability c : capabilities) {
        bits |= bit(c);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(RequirementSet other) {
      bits |= other.bits;
      return this;
    }

    public RequirementSet build() {
      return fromBits(bits);
    }
  }
}
