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

package tools.aqua.euf.formula;

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import java.util.ArrayList;
import java.util.List;

/**
 * A conjunction of equality literals, split by polarity. Both lists hold the equality atoms
 * themselves; {@link #disequalities()} are the atoms asserted false.
 */
public final class Literals {

  /** Atoms asserted true. */
  private final List<BoolExpr> equalities;

  /** Atoms asserted false. */
  private final List<BoolExpr> disequalities;

  Literals(final List<BoolExpr> equalities, final List<BoolExpr> disequalities) {
    this.equalities = requireNonNull(equalities);
    this.disequalities = requireNonNull(disequalities);
  }

  /**
   * Get the atoms asserted true.
   *
   * @return the equalities.
   */
  public List<BoolExpr> equalities() {
    return equalities;
  }

  /**
   * Get the atoms asserted false.
   *
   * @return the disequalities, as their underlying equality atoms.
   */
  public List<BoolExpr> disequalities() {
    return disequalities;
  }

  /**
   * Get all atoms regardless of polarity, equalities first.
   *
   * @return the atoms.
   */
  public List<BoolExpr> atoms() {
    final List<BoolExpr> atoms = new ArrayList<>(equalities);
    atoms.addAll(disequalities);
    return atoms;
  }

  @Override
  public String toString() {
    return "Literals{equalities=" + equalities + ", disequalities=" + disequalities + "}";
  }
}
