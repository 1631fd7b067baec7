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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tools.aqua.euf.config.SolverSettings;
import tools.aqua.euf.formula.Formulas;
import tools.aqua.euf.oracle.BooleanModel;
import tools.aqua.euf.oracle.BooleanOracle;
import tools.aqua.euf.oracle.OracleException;
import tools.aqua.euf.oracle.OracleSession;

/**
 * Decides arbitrary boolean combinations of equality atoms by abstraction refinement.
 *
 * <p>Each equality atom is replaced by a fresh boolean variable and the resulting skeleton is
 * handed to the oracle. Every model the oracle proposes is translated back into theory literals and
 * checked by the {@link EufSolver}. A theory-consistent model answers SAT; otherwise a clause
 * excluding exactly that model is added and the oracle is asked again. With {@code k} atoms the
 * loop calls the oracle at most {@code 2^k} times.
 */
public final class LazySolver {

  private static final Logger LOGGER = LogManager.getLogger(LazySolver.class);

  /** Prefix of the placeholder variables. */
  private static final String PLACEHOLDER_PREFIX = "eq";

  /** The context the input formulas live in. */
  private final Context context;

  /** The boolean oracle. */
  private final BooleanOracle oracle;

  /** The theory check. */
  private final EufSolver theory = new EufSolver();

  /** Supplies the round limit. */
  private final SolverSettings settings;

  /**
   * Create a solver without a round limit.
   *
   * @param context the Z3 context of the input formulas and the oracle.
   * @param oracle the boolean oracle.
   */
  public LazySolver(final Context context, final BooleanOracle oracle) {
    this(context, oracle, SolverSettings.defaults());
  }

  /**
   * Create a solver.
   *
   * @param context the Z3 context of the input formulas and the oracle.
   * @param oracle the boolean oracle.
   * @param settings supplies the round limit.
   */
  public LazySolver(
      final Context context, final BooleanOracle oracle, final SolverSettings settings) {
    this.context = requireNonNull(context);
    this.oracle = requireNonNull(oracle);
    this.settings = requireNonNull(settings);
  }

  /**
   * Decide a boolean combination of equality atoms. Term {@code distinct} is accepted and treated
   * as pairwise disequality.
   *
   * @param input the formula.
   * @return the verdict, with a witness if satisfiable.
   * @throws IllegalArgumentException if the formula contains any other predicate or theory atom.
   * @throws OracleException if the oracle fails or the round limit is exceeded.
   */
  public LazyResult decide(final BoolExpr input) {
    final BoolExpr formula = Formulas.expandDistinct(context, input);
    Formulas.requireEqualityCombination(formula);
    final BoolExpr[] atoms = Formulas.equalityAtoms(formula).toArray(new BoolExpr[0]);
    final BoolExpr[] placeholders = new BoolExpr[atoms.length];
    for (int i = 0; i < atoms.length; i++) {
      placeholders[i] =
          (BoolExpr) context.mkFreshConst(PLACEHOLDER_PREFIX, context.getBoolSort());
    }
    final BoolExpr skeleton =
        atoms.length == 0 ? formula : (BoolExpr) formula.substitute(atoms, placeholders);
    LOGGER.debug("Abstracted {} atoms, skeleton: {}", atoms.length, skeleton);

    try (OracleSession session = oracle.newSession()) {
      session.add(skeleton);
      return refine(session, atoms, placeholders);
    }
  }

  /**
   * Ask the oracle for models of the skeleton until one is theory-consistent or none is left.
   *
   * @param session the session holding the skeleton.
   * @param atoms the abstracted equality atoms.
   * @param placeholders the placeholder of each atom, index by index.
   * @return the result.
   */
  private LazyResult refine(
      final OracleSession session, final BoolExpr[] atoms, final BoolExpr[] placeholders) {
    int rounds = 0;
    while (true) {
      if (settings.hasRoundLimit() && rounds >= settings.getMaxRounds()) {
        throw new OracleException(
            "No answer within " + settings.getMaxRounds() + " oracle rounds");
      }
      rounds++;

      final Optional<BooleanModel> model = session.solve();
      if (!model.isPresent()) {
        LOGGER.info("UNSAT after {} round(s)", rounds);
        return LazyResult.unsat(rounds);
      }

      final List<BoolExpr> equalities = new ArrayList<>();
      final List<BoolExpr> disequalities = new ArrayList<>();
      final List<BoolExpr> candidate = new ArrayList<>();
      final BoolExpr[] blocking = new BoolExpr[atoms.length];
      for (int i = 0; i < atoms.length; i++) {
        if (model.get().valueOf(placeholders[i])) {
          equalities.add(atoms[i]);
          candidate.add(atoms[i]);
          blocking[i] = context.mkNot(placeholders[i]);
        } else {
          disequalities.add(atoms[i]);
          candidate.add(context.mkNot(atoms[i]));
          blocking[i] = placeholders[i];
        }
      }
      LOGGER.debug("Round {}: candidate {}", rounds, candidate);

      if (theory.decide(Formulas.literals(equalities, disequalities)) == Verdict.SAT) {
        LOGGER.info("SAT after {} round(s)", rounds);
        return LazyResult.sat(candidate, rounds);
      }

      final BoolExpr clause = context.mkOr(blocking);
      LOGGER.debug("Round {}: blocking {}", rounds, clause);
      session.add(clause);
    }
  }
}
