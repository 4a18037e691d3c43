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
import com.google.common.base.Strings;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * All of the mutable state of a single compilation: the output buffer, the current indentation,
 * the counter used to make hygienic labels, and the class and function currently being emitted.
 *
 * <p>An EmissionState is owned by one compilation and is not thread-safe; compiling several
 * modules concurrently requires one EmissionState for each.
 */
public final class EmissionState {

  private final StringBuilder out = new StringBuilder();
  private final String indentUnit;

  private int depth;
  private int indentsEntered;
  private int indentsExited;

  /** Incremented each time a label is allocated, and never reset. */
  private int nextLabel;

  /** One entry for each class being emitted (classes may not nest, but we don't rely on that). */
  private final Deque<ClassContext> classes = new ArrayDeque<>();

  /** The names of the enclosing functions, innermost first. */
  private final Deque<String> functions = new ArrayDeque<>();

  private record ClassContext(String name, @Nullable String parent) {}

  public EmissionState(int indentWidth) {
    Preconditions.checkArgument(indentWidth >= 0);
    this.indentUnit = Strings.repeat(" ", indentWidth);
  }

  /** Appends text to the output, without any indentation. */
  public void write(String text) {
    out.append(text);
  }

  /** Appends formatted text to the output, without any indentation. */
  @FormatMethod
  public void write(String fmt, Object... args) {
    out.append(String.format(fmt, args));
  }

  /** Writes the indentation for a new line at the current depth. */
  public void startLine() {
    for (int i = 0; i < depth; i++) {
      out.append(indentUnit);
    }
  }

  /** Ends the current line. */
  public void endLine() {
    out.append('\n');
  }

  /** Writes a complete line at the current depth. */
  public void line(String text) {
    startLine();
    out.append(text);
    endLine();
  }

  /** Writes a complete, formatted line at the current depth. */
  @FormatMethod
  public void line(String fmt, Object... args) {
    line(String.format(fmt, args));
  }

  /** Writes an empty line. */
  public void blankLine() {
    endLine();
  }

  /** Increases the indentation depth; must be paired with a call to {@link #dedent}. */
  public void indent() {
    depth++;
    indentsEntered++;
  }

  /** Decreases the indentation depth. */
  public void dedent() {
    Preconditions.checkState(depth > 0, "dedent() without matching indent()");
    depth--;
    indentsExited++;
  }

  /** The current indentation depth. */
  public int depth() {
    return depth;
  }

  /** The total number of calls to {@link #indent} so far. */
  public int indentsEntered() {
    return indentsEntered;
  }

  /** The total number of calls to {@link #dedent} so far. */
  public int indentsExited() {
    return indentsExited;
  }

  /**
   * Returns a label that has not been returned before by this EmissionState, formed from the
   * given prefix and a numeric suffix (e.g. "super_3").
   */
  public String freshLabel(String prefix) {
    return prefix + "_" + nextLabel++;
  }

  /** Called when starting to emit the body of class {@code name}. */
  public void enterClass(String name, @Nullable String parent) {
    classes.push(new ClassContext(name, parent));
  }

  public void exitClass() {
    Preconditions.checkState(!classes.isEmpty());
    classes.pop();
  }

  /** The class whose body is being emitted, or null if we're not in a class. */
  public @Nullable String currentClass() {
    return classes.isEmpty() ? null : classes.peek().name();
  }

  /** The parent of {@link #currentClass}, or null if there is none. */
  public @Nullable String currentParent() {
    return classes.isEmpty() ? null : classes.peek().parent();
  }

  /** Called when starting to emit the body of function {@code name}. */
  public void enterFunction(String name) {
    functions.push(name);
  }

  public void exitFunction() {
    Preconditions.checkState(!functions.isEmpty());
    functions.pop();
  }

  /** The function whose body is being emitted, or null if at top level. */
  public @Nullable String currentFunction() {
    return functions.isEmpty() ? null : functions.peek();
  }

  /**
   * A description of where emission currently is, e.g. "Dog.speak", "main", or null if at top
   * level outside any class.
   */
  public @Nullable String context() {
    String fn = currentFunction();
    String cls = currentClass();
    if (cls == null) {
      return fn;
    }
    return (fn == null) ? cls : cls + "." + fn;
  }

  /** The number of characters written so far. */
  public int length() {
    return out.length();
  }

  /** Returns everything written so far. */
  public String contents() {
    return out.toString();
  }

  @Override
  public String toString() {
    return String.format(
        "EmissionState{depth=%s, labels=%s, length=%s}", depth, nextLabel, length());
  }
}
