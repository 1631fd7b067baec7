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

package tools.aqua.euf.cli;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.UninterpretedSort;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tools.aqua.euf.config.SolverSettings;
import tools.aqua.euf.oracle.OracleException;
import tools.aqua.euf.oracle.Z3Oracle;
import tools.aqua.euf.solver.EufSolver;
import tools.aqua.euf.solver.LazyResult;
import tools.aqua.euf.solver.LazySolver;
import tools.aqua.euf.solver.Verdict;

/**
 * Runs a fixed set of sample queries through both decision procedures and reports whether each
 * produced the expected verdict. Settings are taken from the system properties described in {@link
 * SolverSettings}.
 */
public final class EufMain {

  private static final Logger LOGGER = LogManager.getLogger(EufMain.class);

  /** This class should not be constructed. */
  private EufMain() {
    throw new AssertionError();
  }

  /**
   * Entry point. Exits with status {@code 0} if every sample query is answered as expected.
   *
   * @param args ignored.
   */
  public static void main(final String[] args) {
    System.exit(run(SolverSettings.fromSystemProperties()));
  }

  /**
   * Run all sample queries.
   *
   * @param settings the solver settings.
   * @return {@code 0} if all verdicts match, {@code 1} otherwise.
   */
  static int run(final SolverSettings settings) {
    LOGGER.info("Z3 backend {}, {}", Z3Oracle.backendVersion(), settings);
    try (Context ctx = new Context()) {
      final EufSolver euf = new EufSolver();
      final LazySolver lazy = new LazySolver(ctx, new Z3Oracle(ctx, settings), settings);

      int failures = 0;
      for (final Sample sample : samples(ctx)) {
        final Verdict verdict;
        try {
          verdict = sample.lazy ? decideLazy(lazy, sample.formula) : euf.decide(sample.formula);
        } catch (OracleException e) {
          LOGGER.error("{}: oracle failure", sample.name, e);
          failures++;
          continue;
        }
        if (verdict == sample.expected) {
          LOGGER.info("{}: {}", sample.name, verdict);
        } else {
          LOGGER.error("{}: got {}, expected {}", sample.name, verdict, sample.expected);
          failures++;
        }
      }
      return failures == 0 ? 0 : 1;
    }
  }

  private static Verdict decideLazy(final LazySolver lazy, final BoolExpr formula) {
    final LazyResult result = lazy.decide(formula);
    LOGGER.debug("Witness: {}", result.getWitness());
    return result.getVerdict();
  }

  /**
   * Build the sample queries over constants {@code a}, {@code b}, {@code c} and a unary function
   * {@code f}.
   *
   * @param ctx the context to build in.
   * @return the samples.
   */
  static List<Sample> samples(final Context ctx) {
    final UninterpretedSort u = ctx.mkUninterpretedSort("U");
    final Expr<UninterpretedSort> a = ctx.mkConst("a", u);
    final Expr<UninterpretedSort> b = ctx.mkConst("b", u);
    final Expr<UninterpretedSort> c = ctx.mkConst("c", u);
    final FuncDecl<UninterpretedSort> f = ctx.mkFuncDecl("f", u, u);

    final BoolExpr ab = ctx.mkEq(a, b);
    final BoolExpr bc = ctx.mkEq(b, c);
    final BoolExpr ac = ctx.mkEq(a, c);

    final List<Sample> samples = new ArrayList<>();
    samples.add(new Sample("a = b", ab, false, Verdict.SAT));
    samples.add(new Sample("a = b and a != b", ctx.mkAnd(ab, ctx.mkNot(ab)), false, Verdict.UNSAT));
    samples.add(new Sample("a = b or b = c", ctx.mkOr(ab, bc), true, Verdict.SAT));
    samples.add(
        new Sample(
            "(a = b or b = c) and a != c",
            ctx.mkAnd(ctx.mkOr(ab, bc), ctx.mkNot(ac)),
            true,
            Verdict.SAT));
    samples.add(
        new Sample(
            "a = b and f(a) != f(b)",
            ctx.mkAnd(ab, ctx.mkNot(ctx.mkEq(ctx.mkApp(f, a), ctx.mkApp(f, b)))),
            false,
            Verdict.UNSAT));
    samples.add(
        new Sample(
            "a = b and b = c and a != c",
            ctx.mkAnd(ab, bc, ctx.mkNot(ac)),
            true,
            Verdict.UNSAT));
    return samples;
  }

  /** A named sample query with its expected verdict. */
  static final class Sample {
    final String name;
    final BoolExpr formula;
    /** Whether the query goes through the lazy loop instead of the conjunction procedure. */
    final boolean lazy;
    final Verdict expected;

    Sample(final String name, final BoolExpr formula, final boolean lazy, final Verdict expected) {
      this.name = name;
      this.formula = formula;
      this.lazy = lazy;
      this.expected = expected;
    }
  }
}
