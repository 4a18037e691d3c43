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
 * A node that {@link RequirementAnalyzer} did not look inside. Anything such a node would have
 * required is missing from the result, so gaps are reported rather than silently dropped.
 *
 * @param kind the node kind, as returned by {@link org.pyaot.Ast#kindOf}
 * @param context the enclosing function or class ("&lt;module&gt;" at top level)
 */
public record AnalysisGap(String kind, String context) {

  @Override
  public String toString() {
    return String.format("%s in %s", kind, context);
  }
}
