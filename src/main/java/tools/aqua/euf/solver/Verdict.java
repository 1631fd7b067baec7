/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2019-2025 The TurnKey Authors
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

package tools.aqua.euf.solver;

/** The answer of a decision procedure. */
public enum Verdict {
  /** The query has a model. */
  SAT,
  /** The query has no model. */
  UNSAT;

  /**
   * Map a satisfiability flag to a verdict.
   *
   * @param satisfiable whether the query is satisfiable.
   * @return {@link #SAT} or {@link #UNSAT}.
   */
  public static Verdict of(final boolean satisfiable) {
    return satisfiable ? SAT : UNSAT;
  }
}
