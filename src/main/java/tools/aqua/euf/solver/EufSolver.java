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

import com.microsoft.z3.BoolExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tools.aqua.euf.egraph.CongruenceGraph;
import tools.aqua.euf.formula.Formulas;
import tools.aqua.euf.formula.Literals;

/**
 * Decides conjunctions of equality literals over uninterpreted functions by congruence closure. A
 * conjunction is satisfiable iff no disequality has both sides in the same class once all
 * equalities are merged.
 */
public final class EufSolver {

  private static final Logger LOGGER = LogManager.getLogger(EufSolver.class);

  /**
   * Decide a conjunction of equality literals.
   *
   * @param conjunction a conjunction whose conjuncts are {@code a = b} or {@code not (a = b)}.
   * @return the verdict.
   * @throws IllegalArgumentException if a conjunct is not an equality literal.
   */
  public Verdict decide(final BoolExpr conjunction) {
    return decide(Formulas.splitLiterals(conjunction));
  }

  /**
   * Decide already split literals.
   *
   * @param literals the literals.
   * @return the verdict.
   */
  public Verdict decide(final Literals literals) {
    final Verdict verdict = Verdict.of(graphOf(literals).close(literals));
    LOGGER.debug("EUF verdict {} for {}", verdict, literals);
    return verdict;
  }

  /**
   * Build the congruence graph of a conjunction and merge all of its equalities.
   *
   * @param conjunction a conjunction of equality literals.
   * @return the closed graph.
   * @throws IllegalArgumentException if a conjunct is not an equality literal.
   */
  public CongruenceGraph closure(final BoolExpr conjunction) {
    final Literals literals = Formulas.splitLiterals(conjunction);
    final CongruenceGraph graph = graphOf(literals);
    graph.mergeEqualities(literals.equalities());
    return graph;
  }

  private static CongruenceGraph graphOf(final Literals literals) {
    return new CongruenceGraph(Formulas.terms(literals.atoms()));
  }
}
