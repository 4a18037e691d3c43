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

package org.pyaot.util;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.pyaot.Ast.ConstantKind;
import org.pyaot.analysis.InferredType;

/** Static helpers for writing Zig tokens. */
public final class ZigSyntax {

  private ZigSyntax() {}

  /** Words that can't be used as plain Zig identifiers. */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "addrspace", "align", "allowzero", "and", "anyframe", "anytype", "asm", "async", "await",
          "break", "callconv", "catch", "comptime", "const", "continue", "defer", "else", "enum",
          "errdefer", "error", "export", "extern", "fn", "for", "if", "inline", "linksection",
          "noalias", "noinline", "nosuspend", "opaque", "or", "orelse", "packed", "pub", "resume",
          "return", "struct", "suspend", "switch", "test", "threadlocal", "try", "union",
          "unreachable", "usingnamespace", "var", "volatile", "while",
          // Primitive values and types also can't be shadowed.
          "anyerror", "anyopaque", "bool", "f16", "f32", "f64", "f80", "f128", "false", "isize",
          "noreturn", "null", "true", "type", "undefined", "usize", "void");

  /** Arbitrary-width integer types (i7, u64, ...) are primitives too. */
  private static final Pattern INT_TYPE = Pattern.compile("[iu][0-9]+");

  private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final ImmutableMap<String, String> ANNOTATION_TYPES =
      ImmutableMap.of(
          "int", "i64",
          "float", "f64",
          "str", "[]const u8",
          "bytes", "[]const u8",
          "bool", "bool",
          "None", "void");

  /**
   * Returns {@code name} if it can be used as-is as a Zig identifier, or the quoted form
   * {@code @"name"} otherwise.
   */
  public static String identifier(String name) {
    if (RESERVED.contains(name)
        || INT_TYPE.matcher(name).matches()
        || !PLAIN_IDENTIFIER.matcher(name).matches()) {
      return "@\"" + escape(name) + "\"";
    }
    return name;
  }

  /** Returns a Zig string literal with the given contents. */
  public static String stringLiteral(String s) {
    return "\"" + escape(s) + "\"";
  }

  private static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  /**
   * Returns the contents of a {@code std.fmt} format string that prints {@code text} literally,
   * i.e. with braces doubled.
   */
  public static String formatText(String text) {
    return escape(text).replace("{", "{{").replace("}", "}}");
  }

  /** Returns the Zig literal for a Python float. */
  public static String floatLiteral(double d) {
    if (Double.isNaN(d)) {
      return "std.math.nan(f64)";
    } else if (Double.isInfinite(d)) {
      return (d > 0) ? "std.math.inf(f64)" : "-std.math.inf(f64)";
    }
    return Double.toString(d).replace('E', 'e');
  }

  /** Returns the {@code std.fmt} placeholder to use for a value of the given type. */
  public static String formatSpec(InferredType type) {
    switch (type) {
      case INT:
      case FLOAT:
        return "{d}";
      case STRING:
        return "{s}";
      default:
        return "{any}";
    }
  }

  /** Returns the Zig type used to represent values of the given type, or null if unknown. */
  public static @Nullable String zigType(InferredType type) {
    switch (type) {
      case INT:
        return "i64";
      case FLOAT:
        return "f64";
      case STRING:
        return "[]const u8";
      default:
        return null;
    }
  }

  /** Returns the element type of a constant array literal whose elements have the given kind. */
  public static String zigType(ConstantKind kind) {
    switch (kind) {
      case INT:
        return "i64";
      case FLOAT:
        return "f64";
      case STRING:
        return "[]const u8";
      case BOOL:
        return "bool";
      case NONE:
        return "?i64";
    }
    throw new AssertionError();
  }

  /**
   * Returns the Zig type for a builtin Python type annotation ("int", "str", ...), or null if the
   * annotation doesn't name one.
   */
  public static @Nullable String annotationType(String annotation) {
    return ANNOTATION_TYPES.get(annotation);
  }
}
