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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The outcome of a {@link LazySolver} query. */
public final class LazyResult {

  /** The verdict. */
  private final Verdict verdict;

  /** The accepted theory literals; empty unless {@link #verdict} is {@link Verdict#SAT}. */
  private final List<BoolExpr> witness;

  /** Number of oracle {@code solve} calls made. */
  private final int rounds;

  private LazyResult(final Verdict verdict, final List<BoolExpr> witness, final int rounds) {
    this.verdict = requireNonNull(verdict);
    this.witness = Collections.unmodifiableList(new ArrayList<>(witness));
    this.rounds = rounds;
  }

  /** A satisfiable result with its witness literals. */
  static LazyResult sat(final List<BoolExpr> witness, final int rounds) {
    return new LazyResult(Verdict.SAT, witness, rounds);
  }

  /** An unsatisfiable result, without witness. */
  static LazyResult unsat(final int rounds) {
    return new LazyResult(Verdict.UNSAT, Collections.emptyList(), rounds);
  }

  /**
   * Get the verdict.
   *
   * @return SAT or UNSAT.
   */
  public Verdict getVerdict() {
    return verdict;
  }

  /**
   * Get the witness of a satisfiable query: for every equality atom of the input, either the atom
   * or its negation, as assigned by the accepted boolean model.
   *
   * @return the witness literals, empty for {@link Verdict#UNSAT}.
   */
  public List<BoolExpr> getWitness() {
    return witness;
  }

  /**
   * Get the number of oracle {@code solve} calls the query took.
   *
   * @return the round count, at least one.
   */
  public int getRounds() {
    return rounds;
  }

  @Override
  public String toString() {
    return "LazyResult{verdict=" + verdict + ", rounds=" + rounds + ", witness=" + witness + "}";
  }
}
