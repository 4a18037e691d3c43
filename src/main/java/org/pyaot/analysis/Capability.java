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

/**
 * A piece of runtime support that an emitted program may need. Each Capability gates some part of
 * the emitted preamble (an import, a module alias, or setup code in {@code main}).
 */
public enum Capability {
  /** The JSON codec ({@code const json = runtime.json}). */
  JSON,
  /** The HTTP client ({@code const http = runtime.http}, initialized in main). */
  HTTP,
  /** The async executor ({@code const asyncio = runtime.asyncio}, initialized in main). */
  ASYNC,
  /** A heap allocator, selected at the start of main and stored in a module-level global. */
  ALLOCATOR,
  /** Runtime calls that can fail, which forces main to return an error union. */
  RUNTIME,
  /** The string_utils helper module (case conversion). */
  STRING_UTILS,
  /** The hashmap_helper module (dict literals and comprehensions). */
  HASHMAP_HELPER,
  /** A stdout writer (print) or other std calls that the emitted main must be able to fail on. */
  STD;

  /** Returns the name used for this capability in diagnostics, e.g. "needs_string_utils". */
  public String flagName() {
    return "needs_" + name().toLowerCase();
  }
}
