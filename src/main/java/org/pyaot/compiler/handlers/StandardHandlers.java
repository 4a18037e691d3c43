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

import org.pyaot.compiler.HandlerRegistry;

/** Assembles the registry of handlers for the builtins, builtin types, and stdlib modules. */
public final class StandardHandlers {

  // Static methods only
  private StandardHandlers() {}

  private static final HandlerRegistry STANDARD = builder().build();

  /** Returns the standard registry. */
  public static HandlerRegistry registry() {
    return STANDARD;
  }

  /**
   * Returns a builder containing all the standard handlers, to which handlers for additional
   * symbols may be added.
   */
  public static HandlerRegistry.Builder builder() {
    HandlerRegistry.Builder builder = HandlerRegistry.builder();
    BuiltinHandlers.register(builder);
    StringMethods.register(builder);
    ListMethods.register(builder);
    DictMethods.register(builder);
    StdlibModules.register(builder);
    return builder;
  }
}
