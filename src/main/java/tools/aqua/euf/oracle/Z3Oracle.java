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

package tools.aqua.euf.oracle;

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Version;
import com.microsoft.z3.Z3Exception;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tools.aqua.euf.config.SolverSettings;

/**
 * A {@link BooleanOracle} backed by Z3. Every session owns a separate {@link Solver} of the given
 * context, so assertions never leak between sessions. The context must outlive all sessions.
 */
public final class Z3Oracle implements BooleanOracle {

  private static final Logger LOGGER = LogManager.getLogger(Z3Oracle.class);

  /** The context all sessions create their solvers in. */
  private final Context context;

  /** Solver parameters applied to each session. */
  private final SolverSettings settings;

  /**
   * Create an oracle with default settings.
   *
   * @param context the Z3 context.
   */
  public Z3Oracle(final Context context) {
    this(context, SolverSettings.defaults());
  }

  /**
   * Create an oracle.
   *
   * @param context the Z3 context.
   * @param settings the timeout and seed to apply to each session.
   */
  public Z3Oracle(final Context context, final SolverSettings settings) {
    this.context = requireNonNull(context);
    this.settings = requireNonNull(settings);
  }

  /**
   * Get the version string of the loaded Z3 native library.
   *
   * @return the version, e.g. {@code 4.12.2.0}.
   */
  public static String backendVersion() {
    return Version.getString();
  }

  @Override
  public OracleSession newSession() {
    try {
      final Solver solver = context.mkSolver();
      final Params params = context.mkParams();
      if (settings.getOracleTimeoutMillis() > 0) {
        params.add("timeout", settings.getOracleTimeoutMillis());
      }
      params.add("random_seed", settings.getOracleSeed());
      solver.setParameters(params);
      return new Z3Session(solver);
    } catch (Z3Exception e) {
      throw new OracleException("Could not create Z3 solver", e);
    }
  }

  /** A session wrapping one Z3 solver. */
  private static final class Z3Session implements OracleSession {

    /** The session's solver. */
    private final Solver solver;

    /**
     * Wrap a solver.
     *
     * @param solver the {@link #solver}.
     */
    Z3Session(final Solver solver) {
      this.solver = solver;
    }

    @Override
    public void add(final BoolExpr assertion) {
      try {
        solver.add(assertion);
      } catch (Z3Exception e) {
        throw new OracleException("Z3 rejected assertion " + assertion, e);
      }
    }

    @Override
    public Optional<BooleanModel> solve() {
      final Status status;
      try {
        status = solver.check();
      } catch (Z3Exception e) {
        throw new OracleException("Z3 failed while solving", e);
      }
      LOGGER.trace("Z3 answered {} on {} assertions", status, solver.getNumAssertions());

      switch (status) {
        case SATISFIABLE:
          final Model model = solver.getModel();
          return Optional.of(variable -> model.eval(variable, true).isTrue());
        case UNSATISFIABLE:
          return Optional.empty();
        default:
          throw new OracleException("Z3 returned unknown: " + solver.getReasonUnknown());
      }
    }

    @Override
    public void close() {
      try {
        solver.reset();
      } catch (Z3Exception e) {
        throw new OracleException("Could not reset Z3 solver", e);
      }
    }
  }
}
