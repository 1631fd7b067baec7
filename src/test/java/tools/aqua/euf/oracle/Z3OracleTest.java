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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import tools.aqua.euf.config.SolverSettings;

/** Test oracle sessions backed by the Z3 solver. */
class Z3OracleTest {

  /** A satisfiable assertion yields a model that satisfies it. */
  @Test
  void testSatisfiableSession() {
    try (Context ctx = new Context()) {
      final OracleSession session = new Z3Oracle(ctx).newSession();

      final BoolExpr p = ctx.mkBoolConst("p");
      final BoolExpr q = ctx.mkBoolConst("q");
      session.add(ctx.mkAnd(p, ctx.mkNot(q)));

      final Optional<BooleanModel> model = session.solve();
      assertThat(model).isPresent();
      assertThat(model.get().valueOf(p)).isTrue();
      assertThat(model.get().valueOf(q)).isFalse();
    }
  }

  /** Assertions accumulate until the session becomes unsatisfiable. */
  @Test
  void testAssertionsAccumulate() {
    try (Context ctx = new Context()) {
      final OracleSession session = new Z3Oracle(ctx).newSession();

      final BoolExpr p = ctx.mkBoolConst("p");
      final BoolExpr q = ctx.mkBoolConst("q");
      session.add(ctx.mkOr(p, q));
      assertThat(session.solve()).isPresent();

      session.add(ctx.mkNot(p));
      final Optional<BooleanModel> model = session.solve();
      assertThat(model).isPresent();
      assertThat(model.get().valueOf(q)).isTrue();

      session.add(ctx.mkNot(q));
      assertThat(session.solve()).isEmpty();
    }
  }

  /** Sessions of one oracle do not share assertions. */
  @Test
  void testSessionsAreIndependent() {
    try (Context ctx = new Context()) {
      final Z3Oracle oracle = new Z3Oracle(ctx, new SolverSettings(10_000, 3, 0));
      final BoolExpr p = ctx.mkBoolConst("p");

      final OracleSession first = oracle.newSession();
      first.add(p);
      first.add(ctx.mkNot(p));

      final OracleSession second = oracle.newSession();
      second.add(p);

      assertThat(first.solve()).isEmpty();
      assertThat(second.solve()).isPresent();
    }
  }

  /** Variables absent from the assertions still get a value. */
  @Test
  void testModelCompletion() {
    try (Context ctx = new Context()) {
      final OracleSession session = new Z3Oracle(ctx).newSession();
      session.add(ctx.mkBoolConst("p"));

      final Optional<BooleanModel> model = session.solve();
      assertThat(model).isPresent();
      final BoolExpr unconstrained = ctx.mkBoolConst("unconstrained");
      assertThatCode(() -> model.get().valueOf(unconstrained)).doesNotThrowAnyException();
    }
  }

  /** An undecided query fails with the backend's reason instead of looking unsatisfiable. */
  @Test
  void testUnknownIsFailure() {
    try (Context ctx = new Context()) {
      final Z3Oracle oracle = new Z3Oracle(ctx, new SolverSettings(1, 0, 0));
      try (OracleSession session = oracle.newSession()) {
        final IntExpr x = ctx.mkIntConst("x");
        final IntExpr y = ctx.mkIntConst("y");
        final IntExpr z = ctx.mkIntConst("z");
        session.add(ctx.mkGt(x, ctx.mkInt(0)));
        session.add(ctx.mkGt(y, ctx.mkInt(0)));
        session.add(ctx.mkGt(z, ctx.mkInt(0)));
        session.add(
            ctx.mkEq(
                ctx.mkAdd(ctx.mkMul(x, x, x), ctx.mkMul(y, y, y)), ctx.mkMul(z, z, z)));

        assertThatThrownBy(session::solve)
            .isInstanceOf(OracleException.class)
            .hasMessageStartingWith("Z3 returned unknown: ");
      }
    }
  }
}
