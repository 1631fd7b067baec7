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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tools.aqua.euf.formula.Formulas;
import tools.aqua.euf.formula.Literals;

/**
 * An E-graph over a fixed set of terms. Nodes are stored in an arena indexed by id; equivalence
 * classes are kept in a union-find structure over those ids. The graph is built once per query
 * and afterwards only changes by merging classes.
 *
 * <p>Congruence is restored after every {@link #merge}: any two applications of the same function
 * whose arguments are pairwise equivalent end up in the same class. Propagation compares every
 * pair of parents touched by a merge and is meant for small formulas.
 */
public final class CongruenceGraph {

  private static final Logger LOGGER = LogManager.getLogger(CongruenceGraph.class);

  /** The node arena. A node's id is its index. */
  private final List<ENode> nodes = new ArrayList<>();

  /** Maps every registered term to its node id. */
  private final Map<Expr<?>, Integer> termToId = new HashMap<>();

  /**
   * Build the graph for a set of terms. Terms are registered by ascending nesting depth, so a
   * node's arguments always have smaller ids than the node itself.
   *
   * @param terms the terms to register. Argument sub-terms missing from the collection are
   *     registered as well.
   */
  public CongruenceGraph(final Collection<? extends Expr<?>> terms) {
    final Map<Expr<?>, Integer> depths = new HashMap<>();
    final List<Expr<?>> ordered = new ArrayList<>(terms);
    ordered.sort(
        Comparator.comparingInt(
            (Expr<?> term) -> depths.computeIfAbsent(term, Formulas::depth)));
    for (final Expr<?> term : ordered) {
      register(term);
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "Built congruence graph with {} nodes:{}{}",
          nodes.size(),
          System.lineSeparator(),
          describe());
    }
  }

  /**
   * Get or create the node for a term, creating argument nodes first.
   *
   * @param term the term.
   * @return the term's node id.
   */
  private int register(final Expr<?> term) {
    final Integer known = termToId.get(term);
    if (known != null) return known;

    final int[] args;
    if (Formulas.isApplication(term)) {
      final Expr<?>[] children = term.getArgs();
      args = new int[children.length];
      for (int i = 0; i < children.length; i++) {
        args[i] = register(children[i]);
      }
    } else {
      args = new int[0];
    }

    final int id = nodes.size();
    nodes.add(new ENode(id, term, args));
    termToId.put(term, id);
    for (final int arg : args) {
      nodes.get(arg).addParent(id);
    }
    return id;
  }

  /**
   * Get the number of nodes.
   *
   * @return the node count.
   */
  public int size() {
    return nodes.size();
  }

  /**
   * Get a node by id.
   *
   * @param id the node id.
   * @return the node.
   * @throws IndexOutOfBoundsException if no such node exists.
   */
  public ENode node(final int id) {
    return nodes.get(id);
  }

  /**
   * Check if a term is registered.
   *
   * @param term the term.
   * @return {@code true} iff the graph has a node for {@code term}.
   */
  public boolean contains(final Expr<?> term) {
    return termToId.containsKey(term);
  }

  /**
   * Get the node id of a registered term.
   *
   * @param term the term.
   * @return the node id.
   * @throws IllegalArgumentException if the term is not registered.
   */
  public int idOf(final Expr<?> term) {
    final Integer id = termToId.get(term);
    if (id == null) throw new IllegalArgumentException("Unknown term: " + term);
    return id;
  }

  /**
   * Find the representative of a node's class. Every node visited on the way is re-pointed
   * directly at the representative.
   *
   * @param id the node id.
   * @return the representative's id.
   */
  public int find(final int id) {
    int root = id;
    while (nodes.get(root).find != root) {
      root = nodes.get(root).find;
    }
    int current = id;
    while (current != root) {
      final ENode node = nodes.get(current);
      current = node.find;
      node.find = root;
    }
    return root;
  }

  /**
   * Join two classes. The class of {@code id2} absorbs the class of {@code id1}; congruence is
   * not restored, use {@link #merge} for that.
   *
   * @param id1 a node of the absorbed class.
   * @param id2 a node of the absorbing class.
   */
  public void union(final int id1, final int id2) {
    final int root1 = find(id1);
    final int root2 = find(id2);
    if (root1 != root2) {
      nodes.get(root1).find = root2;
    }
  }

  /**
   * Collect the direct parents of every node in the class of {@code id}.
   *
   * @param id the node id.
   * @return the parent ids.
   */
  public Set<Integer> parentsOf(final int id) {
    final Set<Integer> parents = new TreeSet<>();
    final int root = find(id);
    for (final ENode node : nodes) {
      if (find(node.id()) == root) {
        parents.addAll(node.parents());
      }
    }
    return parents;
  }

  /**
   * Check if two nodes are congruent: both apply the same function to the same number of
   * arguments, and their arguments are pairwise equivalent. Constants are never congruent.
   *
   * @param id1 the first node id.
   * @param id2 the second node id.
   * @return {@code true} iff the nodes are congruent.
   */
  public boolean congruent(final int id1, final int id2) {
    final ENode node1 = nodes.get(id1);
    final ENode node2 = nodes.get(id2);
    if (!node1.isApplication() || !node2.isApplication()) return false;
    if (!node1.symbol().equals(node2.symbol())) return false;
    if (node1.arity() != node2.arity()) return false;
    for (int i = 0; i < node1.arity(); i++) {
      if (find(node1.arg(i)) != find(node2.arg(i))) return false;
    }
    return true;
  }

  /**
   * Merge the classes of two nodes and restore congruence. Congruent parent pairs discovered on
   * the way are queued and merged in turn until no new pair appears. Merging two nodes that
   * already share a class does nothing.
   *
   * @param id1 the first node id.
   * @param id2 the second node id.
   */
  public void merge(final int id1, final int id2) {
    final Deque<int[]> pending = new ArrayDeque<>();
    pending.add(new int[] {id1, id2});
    while (!pending.isEmpty()) {
      final int[] pair = pending.poll();
      if (find(pair[0]) == find(pair[1])) continue;

      final Set<Integer> parents = parentsOf(pair[0]);
      parents.addAll(parentsOf(pair[1]));
      union(pair[0], pair[1]);

      final int[] candidates = parents.stream().mapToInt(Integer::intValue).toArray();
      for (int i = 0; i < candidates.length; i++) {
        for (int j = i + 1; j < candidates.length; j++) {
          if (find(candidates[i]) != find(candidates[j])
              && congruent(candidates[i], candidates[j])) {
            pending.add(new int[] {candidates[i], candidates[j]});
          }
        }
      }
    }
  }

  /**
   * Merge both sides of every equality atom. Atoms with a side that is not registered are
   * skipped.
   *
   * @param equalities the equality atoms.
   */
  public void mergeEqualities(final Collection<BoolExpr> equalities) {
    for (final BoolExpr equality : equalities) {
      final Integer lhs = termToId.get(equality.getArgs()[0]);
      final Integer rhs = termToId.get(equality.getArgs()[1]);
      if (lhs == null || rhs == null) {
        LOGGER.debug("Skipping equality over unregistered terms: {}", equality);
        continue;
      }
      merge(lhs, rhs);
    }
  }

  /**
   * Check that no disequality has collapsed, i.e., that the two sides of every atom asserted false
   * are in different classes. Atoms with a side that is not registered are skipped.
   *
   * <p>All equalities must have been merged before; the result is meaningless otherwise. {@link
   * #close} performs both steps in order.
   *
   * @param disequalities the equality atoms asserted false.
   * @return {@code true} iff all disequalities hold.
   */
  public boolean checkConsistency(final Collection<BoolExpr> disequalities) {
    for (final BoolExpr disequality : disequalities) {
      final Integer lhs = termToId.get(disequality.getArgs()[0]);
      final Integer rhs = termToId.get(disequality.getArgs()[1]);
      if (lhs == null || rhs == null) {
        LOGGER.debug("Skipping disequality over unregistered terms: {}", disequality);
        continue;
      }
      if (find(lhs) == find(rhs)) {
        LOGGER.debug("Disequality collapsed: {}", disequality);
        return false;
      }
    }
    return true;
  }

  /**
   * Compute the congruence closure of the equalities and check the disequalities against it.
   *
   * @param literals the literals to decide.
   * @return {@code true} iff the literals are consistent.
   */
  public boolean close(final Literals literals) {
    mergeEqualities(literals.equalities());
    final boolean consistent = checkConsistency(literals.disequalities());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Equivalence classes: {}", describeClasses());
    }
    return consistent;
  }

  /**
   * Check if two registered terms are in the same class.
   *
   * @param term1 the first term.
   * @param term2 the second term.
   * @return {@code true} iff both terms share a class.
   * @throws IllegalArgumentException if a term is not registered.
   */
  public boolean sameClass(final Expr<?> term1, final Expr<?> term2) {
    return find(idOf(term1)) == find(idOf(term2));
  }

  /**
   * Get the current partition of the registered terms, ordered by the smallest node id of each
   * class.
   *
   * @return the classes.
   */
  public List<Set<Expr<?>>> equivalenceClasses() {
    final Map<Integer, Set<Expr<?>>> classes = new LinkedHashMap<>();
    for (final ENode node : nodes) {
      classes.computeIfAbsent(find(node.id()), root -> new LinkedHashSet<>()).add(node.term());
    }
    return Collections.unmodifiableList(new ArrayList<>(classes.values()));
  }

  /**
   * Render the current partition as {@code {a,b} {(f a)} ...}.
   *
   * @return the rendered classes.
   */
  public String describeClasses() {
    return equivalenceClasses().stream()
        .map(
            members ->
                members.stream().map(Object::toString).collect(Collectors.joining(",", "{", "}")))
        .collect(Collectors.joining(" "));
  }

  /**
   * Render all nodes, one per line.
   *
   * @return the rendered nodes.
   */
  public String describe() {
    return nodes.stream().map(ENode::toString).collect(Collectors.joining(System.lineSeparator()));
  }

  @Override
  public String toString() {
    return "CongruenceGraph{nodes=" + nodes.size() + ", classes=" + describeClasses() + "}";
  }
}
