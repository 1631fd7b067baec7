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

package tools.aqua.euf.egraph;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.UninterpretedSort;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test union-find, congruence propagation and diagnostics of the congruence graph. */
class CongruenceGraphTest {

  private Context ctx;
  private Expr<UninterpretedSort> a;
  private Expr<UninterpretedSort> b;
  private Expr<UninterpretedSort> c;
  private Expr<UninterpretedSort> d;
  private FuncDecl<UninterpretedSort> f;
  private FuncDecl<UninterpretedSort> g;

  @BeforeEach
  void setUp() {
    ctx = new Context();
    final UninterpretedSort u = ctx.mkUninterpretedSort("U");
    a = ctx.mkConst("a", u);
    b = ctx.mkConst("b", u);
    c = ctx.mkConst("c", u);
    d = ctx.mkConst("d", u);
    f = ctx.mkFuncDecl("f", u, u);
    g = ctx.mkFuncDecl("g", new UninterpretedSort[] {u, u}, u);
  }

  @AfterEach
  void tearDown() {
    ctx.close();
  }

  private Expr<UninterpretedSort> f(final Expr<UninterpretedSort> arg) {
    return ctx.mkApp(f, arg);
  }

  private Expr<UninterpretedSort> g(
      final Expr<UninterpretedSort> left, final Expr<UninterpretedSort> right) {
    return ctx.mkApp(g, left, right);
  }

  /** Shallow terms get smaller ids and arguments are wired to already created nodes. */
  @Test
  void testConstructionOrder() {
    final Expr<UninterpretedSort> ffa = f(f(a));
    final CongruenceGraph graph = new CongruenceGraph(asList(ffa, f(a), a));

    assertThat(graph.size()).isEqualTo(3);
    assertThat(graph.idOf(a)).isEqualTo(0);
    assertThat(graph.idOf(f(a))).isEqualTo(1);
    assertThat(graph.idOf(ffa)).isEqualTo(2);
    assertThat(graph.node(2).args()).containsExactly(1);
    assertThat(graph.node(0).parents()).containsExactly(1);
    assertThat(graph.node(1).parents()).containsExactly(2);
    assertThat(graph.node(2).parents()).isEmpty();
  }

  /** Argument sub-terms missing from the input are registered anyway. */
  @Test
  void testMissingArgumentsAreRegistered() {
    final CongruenceGraph graph = new CongruenceGraph(Collections.singletonList(g(a, f(b))));

    assertThat(graph.size()).isEqualTo(4);
    assertThat(graph.contains(b)).isTrue();
    assertThat(graph.idOf(b)).isLessThan(graph.idOf(f(b)));
    assertThat(graph.node(graph.idOf(g(a, f(b)))).args())
        .containsExactly(graph.idOf(a), graph.idOf(f(b)));
  }

  /** Every node starts as its own representative. */
  @Test
  void testInitialClasses() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, f(a)));

    for (int id = 0; id < graph.size(); id++) {
      assertThat(graph.find(id)).isEqualTo(id);
    }
    assertThat(graph.equivalenceClasses()).hasSize(3);
  }

  /** The class of the second argument absorbs the class of the first. */
  @Test
  void testUnionIsRightBiased() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, c));

    graph.union(graph.idOf(a), graph.idOf(b));
    assertThat(graph.find(graph.idOf(a))).isEqualTo(graph.idOf(b));

    graph.union(graph.idOf(c), graph.idOf(a));
    assertThat(graph.find(graph.idOf(c))).isEqualTo(graph.idOf(b));
  }

  /** Find re-points every node on the path at the representative. */
  @Test
  void testPathCompression() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, c, d));
    graph.union(0, 1);
    graph.union(1, 2);
    graph.union(2, 3);
    graph.node(0).find = 1;
    graph.node(1).find = 2;

    assertThat(graph.find(0)).isEqualTo(3);
    assertThat(graph.node(0).find).isEqualTo(3);
    assertThat(graph.node(1).find).isEqualTo(3);
    assertThat(graph.node(2).find).isEqualTo(3);
  }

  /** The parents of a class are the direct parents of all its members. */
  @Test
  void testParentsOfClass() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, f(a), g(b, c)));
    final int fa = graph.idOf(f(a));
    final int gbc = graph.idOf(g(b, c));

    assertThat(graph.parentsOf(graph.idOf(a))).containsExactly(fa);

    graph.union(graph.idOf(a), graph.idOf(b));
    assertThat(graph.parentsOf(graph.idOf(a))).containsExactlyInAnyOrder(fa, gbc);
    assertThat(graph.parentsOf(graph.idOf(b))).containsExactlyInAnyOrder(fa, gbc);
    assertThat(graph.node(graph.idOf(b)).parents()).containsExactly(gbc);
  }

  /** Constants are never congruent, not even to themselves. */
  @Test
  void testConstantsAreNotCongruent() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b));

    assertThat(graph.congruent(0, 0)).isFalse();
    assertThat(graph.congruent(0, 1)).isFalse();
  }

  /** Applications are congruent once their arguments are equivalent. */
  @Test
  void testCongruentApplications() {
    final CongruenceGraph graph = new CongruenceGraph(asList(f(a), f(b), g(a, b), g(b, b)));
    final int fa = graph.idOf(f(a));
    final int fb = graph.idOf(f(b));
    final int gab = graph.idOf(g(a, b));
    final int gbb = graph.idOf(g(b, b));

    assertThat(graph.congruent(fa, fb)).isFalse();
    assertThat(graph.congruent(fa, gab)).isFalse();

    graph.union(graph.idOf(a), graph.idOf(b));
    assertThat(graph.congruent(fa, fb)).isTrue();
    assertThat(graph.congruent(gab, gbb)).isTrue();
    assertThat(graph.congruent(fa, gbb)).isFalse();
  }

  /** Merging the arguments pairwise merges the applications without a direct equality. */
  @Test
  void testMergePropagatesCongruence() {
    final CongruenceGraph graph = new CongruenceGraph(asList(g(a, b), g(c, d)));

    graph.merge(graph.idOf(a), graph.idOf(c));
    assertThat(graph.sameClass(g(a, b), g(c, d))).isFalse();

    graph.merge(graph.idOf(b), graph.idOf(d));
    assertThat(graph.sameClass(g(a, b), g(c, d))).isTrue();
    assertThat(graph.sameClass(a, b)).isFalse();
  }

  /** Congruence propagates through nested applications. */
  @Test
  void testMergePropagatesThroughNesting() {
    final CongruenceGraph graph = new CongruenceGraph(asList(f(f(f(a))), f(f(f(b)))));

    graph.merge(graph.idOf(a), graph.idOf(b));

    assertThat(graph.sameClass(f(a), f(b))).isTrue();
    assertThat(graph.sameClass(f(f(a)), f(f(b)))).isTrue();
    assertThat(graph.sameClass(f(f(f(a))), f(f(f(b))))).isTrue();
    assertThat(graph.sameClass(a, f(a))).isFalse();
  }

  /** Cyclic equalities such as {@code f(a) = a} collapse the whole chain. */
  @Test
  void testMergeWithCycle() {
    final CongruenceGraph graph = new CongruenceGraph(asList(f(f(f(a)))));

    graph.merge(graph.idOf(f(a)), graph.idOf(a));

    assertThat(graph.equivalenceClasses()).hasSize(1);
  }

  /** Merging an already merged pair changes nothing. */
  @Test
  void testMergeIsIdempotent() {
    final CongruenceGraph graph = new CongruenceGraph(asList(f(a), f(b), c));
    graph.merge(graph.idOf(a), graph.idOf(b));
    final List<Set<Expr<?>>> before = graph.equivalenceClasses();

    graph.merge(graph.idOf(a), graph.idOf(b));
    graph.merge(graph.idOf(f(b)), graph.idOf(f(a)));

    assertThat(graph.equivalenceClasses()).isEqualTo(before);
  }

  /** Equalities mentioning unknown terms are skipped without error. */
  @Test
  void testMergeEqualitiesSkipsUnknownTerms() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b));

    graph.mergeEqualities(asList(ctx.mkEq(a, c), ctx.mkEq(a, b)));

    assertThat(graph.contains(c)).isFalse();
    assertThat(graph.sameClass(a, b)).isTrue();
  }

  /** A disequality whose sides were merged is detected. */
  @Test
  void testCheckConsistency() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, c, f(a), f(b)));
    final List<BoolExpr> disequalities = asList(ctx.mkEq(a, c), ctx.mkEq(f(a), f(b)));

    assertThat(graph.checkConsistency(disequalities)).isTrue();

    graph.mergeEqualities(Collections.singletonList(ctx.mkEq(a, b)));
    assertThat(graph.checkConsistency(disequalities)).isFalse();
    assertThat(graph.checkConsistency(asList(ctx.mkEq(a, c), ctx.mkEq(a, d)))).isTrue();
  }

  /** Class membership queries reject unknown terms. */
  @Test
  void testSameClassRejectsUnknownTerms() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b));

    assertThatThrownBy(() -> graph.sameClass(a, d))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("d");
  }

  /** Nodes and classes render in node order. */
  @Test
  void testDescriptions() {
    final CongruenceGraph graph = new CongruenceGraph(asList(a, b, f(a)));
    graph.merge(graph.idOf(a), graph.idOf(b));

    assertThat(graph.describeClasses()).isEqualTo("{a,b} {(f a)}");
    assertThat(graph.node(graph.idOf(f(a))).toString()).isEqualTo("2 - 2 - f ((f a)) - [0]");
    assertThat(graph.node(0).toString()).isEqualTo("1 - 0 - a (a) - []");
    assertThat(graph.describe()).contains("1 - 1 - b (b) - []");
    assertThat(graph.node(2).name()).isEqualTo("f");
    assertThat(graph.node(0).symbol()).isNull();
  }
}
