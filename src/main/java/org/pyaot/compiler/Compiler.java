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

import org.pyaot.Ast;
import org.pyaot.analysis.AnalysisGap;
import org.pyaot.analysis.RequirementAnalyzer;
import org.pyaot.compiler.handlers.StandardHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compiles a parsed Python module to Zig source. */
public final class Compiler {

  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /**
   * Compiles a module to a Zig program, using the standard handlers and default options.
   *
   * @throws CompileError if the module uses a construct or symbol that can't be compiled
   */
  public static String compile(Ast.Module module) {
    return compile(module, "main", StandardHandlers.registry(), CompilerOptions.defaults());
  }

  /** Compiles a module using the standard handlers. */
  public static String compile(Ast.Module module, String moduleName, CompilerOptions options) {
    return compile(module, moduleName, StandardHandlers.registry(), options);
  }

  /**
   * Compiles a module to Zig source.
   *
   * <p>First computes the module's requirements; any parts of the module the analysis could not
   * account for are logged (or, if {@link CompilerOptions#strictAnalysis}, rejected). Then emits
   * the module. Nothing is returned unless the whole module is emitted successfully.
   *
   * @param module the parsed module
   * @param moduleName the module's name; used for the wrapping struct in module mode
   * @param registry the handlers for stdlib functions and methods of builtin types
   * @param options compilation options
   * @return the Zig source
   * @throws CompileError if the module uses a construct or symbol that can't be compiled
   */
  public static String compile(
      Ast.Module module, String moduleName, HandlerRegistry registry, CompilerOptions options) {
    RequirementAnalyzer.Result analysis = RequirementAnalyzer.analyzeWithGaps(module);
    for (AnalysisGap gap : analysis.gaps()) {
      if (options.strictAnalysis) {
        throw CompileError.error("Requirement analysis can't handle %s", gap);
      }
      logger.warn("requirement analysis skipped {} in {}", gap.kind(), gap.context());
    }
    EmissionEngine engine = new EmissionEngine(analysis.requirements(), registry, options);
    String result = engine.emitModule(module, moduleName).contents();
    logger.debug(
        "compiled {}: requirements {}, {} chars",
        moduleName,
        analysis.requirements(),
        result.length());
    return result;
  }
}
