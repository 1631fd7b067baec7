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

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import tools.aqua.euf.formula.Formulas;

/**
 * A node of the {@link CongruenceGraph}, one per distinct term. Nodes live in the graph's arena
 * and refer to each other by index only.
 */
public final class ENode {

  /** The node's index in the arena. */
  private final int id;

  /** The represented term. */
  private final Expr<?> term;

  /** Argument node ids, in argument order. Empty for constants. */
  private final int[] args;

  /** Ids of the nodes that have this node as a direct argument. */
  private final Set<Integer> parents = new TreeSet<>();

  /** Union-find parent pointer. */
  int find;

  /**
   * Create a new node that is its own class representative.
   *
   * @param id the {@link #id}.
   * @param term the {@link #term}.
   * @param args the {@link #args}.
   */
  ENode(final int id, final Expr<?> term, final int[] args) {
    this.id = id;
    this.term = term;
    this.args = args;
    this.find = id;
  }

  /**
   * Register a node that uses this node as a direct argument.
   *
   * @param parent the parent node id.
   */
  void addParent(final int parent) {
    parents.add(parent);
  }

  /**
   * Get the node's index in the arena.
   *
   * @return the id.
   */
  public int id() {
    return id;
  }

  /**
   * Get the represented term.
   *
   * @return the term.
   */
  public Expr<?> term() {
    return term;
  }

  /**
   * Get the argument node ids.
   *
   * @return a copy of the argument ids.
   */
  public int[] args() {
    return args.clone();
  }

  /** Argument id at {@code position}, without copying. */
  int arg(final int position) {
    return args[position];
  }

  /** Number of arguments, zero for constants. */
  int arity() {
    return args.length;
  }

  /**
   * Get the direct parents recorded when the graph was built. Merges never change this set.
   *
   * @return an unmodifiable view of the parent ids.
   */
  public Set<Integer> parents() {
    return Collections.unmodifiableSet(parents);
  }

  /**
   * Check if this node is a function application, as opposed to a constant.
   *
   * @return {@code true} iff the term applies an uninterpreted function to arguments.
   */
  public boolean isApplication() {
    return Formulas.isApplication(term);
  }

  /**
   * Get the applied function, if any.
   *
   * @return the function declaration, or {@code null} for constants.
   */
  public FuncDecl<?> symbol() {
    return isApplication() ? term.getFuncDecl() : null;
  }

  /**
   * Get the display name: the function symbol for applications, the term itself otherwise.
   *
   * @return the name.
   */
  public String name() {
    return isApplication() ? term.getFuncDecl().getName().toString() : term.toString();
  }

  @Override
  public String toString() {
    return find
        + " - "
        + id
        + " - "
        + name()
        + " ("
        + term
        + ") - ["
        + Arrays.stream(args).mapToObj(String::valueOf).collect(Collectors.joining(","))
        + "]";
  }
}
