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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A table from qualified Python symbols to the {@link Handler}s that emit calls to them. Symbols
 * take one of three forms:
 *
 * <ul>
 *   <li>{@code <module>.<function>}, e.g. "json.loads" or "os.path.join";
 *   <li>{@code builtins.<name>} for functions that are called without a qualifier, e.g.
 *       "builtins.len";
 *   <li>{@code <type>.<method>}, where type is one of {@link #TYPE_PREFIXES}, e.g. "str.upper".
 * </ul>
 *
 * HandlerRegistries are immutable and can be shared by any number of compilations.
 */
public final class HandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

  public static final String BUILTINS = "builtins";

  /** The prefixes used for methods on builtin types. */
  public static final ImmutableSet<String> TYPE_PREFIXES =
      ImmutableSet.of("str", "list", "dict", "int", "float");

  private final ImmutableMap<String, Handler> handlers;

  /** Maps a method name to the only type prefix that defines it. */
  private final ImmutableMap<String, String> methodOwners;

  /** Every module with at least one registered symbol, including parents ("os" for "os.path"). */
  private final ImmutableSet<String> modules;

  private HandlerRegistry(ImmutableMap<String, Handler> handlers) {
    this.handlers = handlers;
    Map<String, String> owners = new HashMap<>();
    Map<String, Integer> ownerCounts = new HashMap<>();
    ImmutableSet.Builder<String> modules = ImmutableSet.builder();
    for (String symbol : handlers.keySet()) {
      int dot = symbol.lastIndexOf('.');
      String prefix = symbol.substring(0, dot);
      String name = symbol.substring(dot + 1);
      if (TYPE_PREFIXES.contains(prefix)) {
        owners.put(name, prefix);
        ownerCounts.merge(name, 1, Integer::sum);
      } else if (!prefix.equals(BUILTINS)) {
        for (int i = prefix.indexOf('.'); i >= 0; i = prefix.indexOf('.', i + 1)) {
          modules.add(prefix.substring(0, i));
        }
        modules.add(prefix);
      }
    }
    ImmutableMap.Builder<String, String> unique = ImmutableMap.builder();
    owners.forEach(
        (name, prefix) -> {
          if (ownerCounts.get(name) == 1) {
            unique.put(name, prefix);
          }
        });
    this.methodOwners = unique.buildOrThrow();
    this.modules = modules.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the handler registered for {@code symbol}, or null if there is none. */
  public @Nullable Handler lookup(String symbol) {
    return handlers.get(symbol);
  }

  /** Returns the handler for {@code symbol}; throws UnresolvedSymbol if there is none. */
  public Handler resolve(String symbol) {
    Handler handler = handlers.get(symbol);
    if (handler == null) {
      throw CompileError.unresolved(symbol);
    }
    return handler;
  }

  public boolean contains(String symbol) {
    return handlers.containsKey(symbol);
  }

  /**
   * Emits a call to {@code symbol}. Throws UnresolvedSymbol if it isn't registered, or
   * ArityMismatch if its handler doesn't accept that many arguments.
   */
  public void emit(String symbol, Emitter out, List<Expr> args) {
    resolve(symbol).emit(symbol, out, args);
  }

  /**
   * If exactly one of the builtin types has a method with the given name, returns that type's
   * prefix (e.g. "str" for "upper"); otherwise returns null.
   */
  public @Nullable String methodOwner(String method) {
    return methodOwners.get(method);
  }

  /** Returns true if at least one symbol is registered in the module {@code name}. */
  public boolean isModule(String name) {
    return modules.contains(name);
  }

  public ImmutableSet<String> symbols() {
    return handlers.keySet();
  }

  public int size() {
    return handlers.size();
  }

  /** A builder for HandlerRegistry. Registering the same symbol twice is an error. */
  public static final class Builder {
    private final Map<String, Handler> handlers = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(String symbol, Handler handler) {
      Preconditions.checkArgument(symbol.indexOf('.') > 0, "Unqualified symbol '%s'", symbol);
      Handler prev = handlers.putIfAbsent(symbol, handler);
      Preconditions.checkArgument(prev == null, "'%s' is already registered", symbol);
      return this;
    }

    /** Registers a handler built from {@code pattern} by {@link CallPatterns#forPattern}. */
    @CanIgnoreReturnValue
    public Builder add(String symbol, CallPattern pattern) {
      return add(symbol, CallPatterns.forPattern(pattern));
    }

    /** Registers a handler for each of the given patterns, under "<module>.<name>". */
    @CanIgnoreReturnValue
    public Builder addModule(String module, Map<String, CallPattern> patterns) {
      patterns.forEach((name, pattern) -> add(module + "." + name, pattern));
      return this;
    }

    public HandlerRegistry build() {
      HandlerRegistry result = new HandlerRegistry(ImmutableMap.copyOf(handlers));
      logger.debug(
          "Built handler registry with {} symbols in {} modules",
          result.size(),
          result.modules.size());
      return result;
    }
  }
}
