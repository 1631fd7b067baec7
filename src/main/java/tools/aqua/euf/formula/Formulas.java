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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Term and atom extraction over Z3 formulas. Terms are non-boolean expressions; an equality atom
 * is a binary {@code =} between two such terms.
 */
public final class Formulas {

  /** This class should not be constructed. */
  private Formulas() {
    throw new AssertionError();
  }

  /**
   * Check if an expression is an equality between two non-boolean terms. Boolean equalities are
   * {@code iff} connectives and do not count.
   *
   * @param expr the expression to test.
   * @return {@code true} iff {@code expr} is an equality atom.
   */
  public static boolean isEqualityAtom(final Expr<?> expr) {
    return expr.isEq() && expr.getNumArgs() == 2 && !expr.getArgs()[0].isBool();
  }

  /**
   * Check if a term is an application of an uninterpreted function to at least one argument.
   * Constants (arity zero) and interpreted terms are leaves.
   *
   * @param term the term to test.
   * @return {@code true} iff {@code term} is a function application.
   */
  public static boolean isApplication(final Expr<?> term) {
    return term.isApp()
        && term.getNumArgs() > 0
        && term.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED;
  }

  /**
   * Compute the nesting depth of a term: zero for a leaf, one more than the deepest argument for
   * a function application.
   *
   * @param term the term.
   * @return the nesting depth.
   */
  public static int depth(final Expr<?> term) {
    if (!isApplication(term)) return 0;
    int deepest = 0;
    for (final Expr<?> arg : term.getArgs()) {
      deepest = Math.max(deepest, depth(arg));
    }
    return 1 + deepest;
  }

  /**
   * Collect the distinct equality atoms anywhere in the boolean structure of a formula, in
   * depth-first, left-to-right order of first occurrence.
   *
   * @param formula the formula.
   * @return the equality atoms.
   */
  public static Set<BoolExpr> equalityAtoms(final BoolExpr formula) {
    final Set<BoolExpr> atoms = new LinkedHashSet<>();
    final Set<Expr<?>> visited = new HashSet<>();
    final Deque<Expr<?>> pending = new ArrayDeque<>();
    pending.push(formula);
    while (!pending.isEmpty()) {
      final Expr<?> current = pending.pop();
      if (!visited.add(current)) continue;
      if (isEqualityAtom(current)) {
        atoms.add((BoolExpr) current);
      } else if (current.isApp()) {
        final Expr<?>[] args = current.getArgs();
        for (int i = args.length - 1; i >= 0; i--) {
          if (args[i].isBool()) pending.push(args[i]);
        }
      }
    }
    return atoms;
  }

  /**
   * Rewrite every {@code distinct} over terms in the boolean structure of a formula into the
   * conjunction of its pairwise disequalities. Afterwards {@code =} is the only theory predicate
   * left. Boolean {@code distinct} is a connective and stays untouched.
   *
   * @param ctx the context of the formula.
   * @param formula the formula.
   * @return the rewritten formula, or {@code formula} itself if it has no term {@code distinct}.
   */
  public static BoolExpr expandDistinct(final Context ctx, final BoolExpr formula) {
    final List<Expr<?>> from = new ArrayList<>();
    final List<Expr<?>> to = new ArrayList<>();
    final Set<Expr<?>> visited = new HashSet<>();
    final Deque<Expr<?>> pending = new ArrayDeque<>();
    pending.push(formula);
    while (!pending.isEmpty()) {
      final Expr<?> current = pending.pop();
      if (!visited.add(current) || !current.isApp()) continue;
      final Expr<?>[] args = current.getArgs();
      if (current.isDistinct() && !args[0].isBool()) {
        final List<BoolExpr> pairs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
          for (int j = i + 1; j < args.length; j++) {
            pairs.add(ctx.mkNot(mkEq(ctx, args[i], args[j])));
          }
        }
        from.add(current);
        to.add(pairs.size() == 1 ? pairs.get(0) : ctx.mkAnd(pairs.toArray(new BoolExpr[0])));
      } else {
        for (final Expr<?> arg : args) {
          if (arg.isBool()) pending.push(arg);
        }
      }
    }
    if (from.isEmpty()) return formula;
    return (BoolExpr) formula.substitute(from.toArray(new Expr<?>[0]), to.toArray(new Expr<?>[0]));
  }

  @SuppressWarnings("unchecked")
  private static BoolExpr mkEq(final Context ctx, final Expr<?> left, final Expr<?> right) {
    return ctx.mkEq((Expr<Sort>) left, (Expr<Sort>) right);
  }

  /**
   * Check that a formula is a boolean combination of equality atoms and propositional variables.
   * Connectives are {@code and}, {@code or}, {@code not}, {@code =>}, {@code xor}, {@code ite} and
   * boolean {@code =} and {@code distinct}.
   *
   * @param formula the formula.
   * @throws IllegalArgumentException naming the first other predicate, quantifier or theory atom.
   */
  public static void requireEqualityCombination(final BoolExpr formula) {
    final Set<Expr<?>> visited = new HashSet<>();
    final Deque<Expr<?>> pending = new ArrayDeque<>();
    pending.push(formula);
    while (!pending.isEmpty()) {
      final Expr<?> current = pending.pop();
      if (!visited.add(current)
          || isEqualityAtom(current)
          || current.isTrue()
          || current.isFalse()
          || (current.isConst()
              && current.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED)) {
        continue;
      }
      if (!isConnective(current)) {
        throw new IllegalArgumentException(
            "Not a boolean combination of equality atoms: " + current);
      }
      final Expr<?>[] args = current.getArgs();
      for (int i = args.length - 1; i >= 0; i--) {
        pending.push(args[i]);
      }
    }
  }

  private static boolean isConnective(final Expr<?> expr) {
    if (expr.isAnd()
        || expr.isOr()
        || expr.isNot()
        || expr.isImplies()
        || expr.isXor()
        || expr.isIff()
        || expr.isITE()) {
      return true;
    }
    return (expr.isEq() || expr.isDistinct()) && expr.getArgs()[0].isBool();
  }

  /**
   * Collect every distinct term occurring in the equality atoms of a formula, including all
   * argument sub-terms.
   *
   * @param formula the formula.
   * @return the terms.
   */
  public static Set<Expr<?>> terms(final BoolExpr formula) {
    return terms(equalityAtoms(formula));
  }

  /**
   * Collect every distinct term occurring in the given equality atoms, including all argument
   * sub-terms.
   *
   * @param atoms the equality atoms.
   * @return the terms.
   */
  public static Set<Expr<?>> terms(final Iterable<BoolExpr> atoms) {
    final Set<Expr<?>> terms = new LinkedHashSet<>();
    for (final BoolExpr atom : atoms) {
      for (final Expr<?> side : atom.getArgs()) {
        addSubTerms(side, terms);
      }
    }
    return terms;
  }

  private static void addSubTerms(final Expr<?> term, final Set<Expr<?>> terms) {
    if (!terms.add(term) || !isApplication(term)) return;
    for (final Expr<?> arg : term.getArgs()) {
      addSubTerms(arg, terms);
    }
  }

  /**
   * Split a conjunction of equality literals into the atoms asserted true and the atoms asserted
   * false. Nested conjunctions are flattened and {@code true} conjuncts are dropped.
   *
   * @param conjunction the conjunction.
   * @return the split literals.
   * @throws IllegalArgumentException if a conjunct is neither an equality atom nor its negation.
   */
  public static Literals splitLiterals(final BoolExpr conjunction) {
    final List<BoolExpr> equalities = new ArrayList<>();
    final List<BoolExpr> disequalities = new ArrayList<>();
    final Deque<Expr<?>> pending = new ArrayDeque<>();
    pending.push(conjunction);
    while (!pending.isEmpty()) {
      final Expr<?> current = pending.pop();
      if (current.isAnd()) {
        final Expr<?>[] args = current.getArgs();
        for (int i = args.length - 1; i >= 0; i--) {
          pending.push(args[i]);
        }
      } else if (isEqualityAtom(current)) {
        equalities.add((BoolExpr) current);
      } else if (current.isNot() && isEqualityAtom(current.getArgs()[0])) {
        disequalities.add((BoolExpr) current.getArgs()[0]);
      } else if (!current.isTrue()) {
        throw new IllegalArgumentException("Not an equality literal: " + current);
      }
    }
    return literals(equalities, disequalities);
  }

  /**
   * Wrap the atoms asserted true and false into {@link Literals} without inspecting them.
   *
   * @param equalities atoms asserted true.
   * @param disequalities atoms asserted false.
   * @return the literals.
   */
  public static Literals literals(
      final List<BoolExpr> equalities, final List<BoolExpr> disequalities) {
    return new Literals(
        Collections.unmodifiableList(new ArrayList<>(equalities)),
        Collections.unmodifiableList(new ArrayList<>(disequalities)));
  }
}
