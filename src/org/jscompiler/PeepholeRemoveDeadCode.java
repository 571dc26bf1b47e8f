/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.jscompiler;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.jscompiler.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * Peephole optimization to remove useless code such as IF's with false guard conditions, loops
 * that never run and expression statements without side effects.
 */
class PeepholeRemoveDeadCode extends AbstractPeepholeOptimization {

  @Override
  @Nullable Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case SCRIPT, BLOCK -> {
        return tryOptimizeBlock(subtree);
      }
      case EXPR_RESULT -> {
        return tryFoldExpr(subtree);
      }
      case HOOK -> {
        return tryFoldHook(subtree);
      }
      case IF -> {
        return tryFoldIf(subtree);
      }
      case WHILE -> {
        return tryFoldWhile(subtree);
      }
      case FOR -> {
        return tryFoldFor(subtree);
      }
      default -> {
        return subtree;
      }
    }
  }

  /** Removes empty statements from a statement list. */
  private Node tryOptimizeBlock(Node n) {
    Node c = n.getFirstChild();
    while (c != null) {
      Node next = c.getNext();
      if (c.isEmpty()) {
        c.detach();
        reportChangeToEnclosingScope(n);
      }
      c = next;
    }
    return n;
  }

  /**
   * Removes expression statements that evaluate a literal, such as {@code 0;} or {@code !1;}.
   * String literal statements are kept, since they may be directives.
   */
  private @Nullable Node tryFoldExpr(Node n) {
    Node expr = n.getFirstChild();
    if (expr.isStringLit()
        || !NodeUtil.isLiteralValue(expr, true)
        || mayHaveSideEffects(expr)) {
      return n;
    }
    Node parent = checkNotNull(n.getParent());
    NodeUtil.removeChild(parent, n);
    reportChangeToEnclosingScope(parent);
    return null;
  }

  /**
   * Try folding IF nodes by removing dead branches.
   *
   * @return the replacement node, if changed, or the original if not
   */
  private @Nullable Node tryFoldIf(Node n) {
    checkState(n.isIf(), n);
    Node parent = checkNotNull(n.getParent());
    Node cond = n.getFirstChild();
    if (mayHaveSideEffects(cond)) {
      return n;
    }
    Tri condValue = NodeUtil.getBooleanValue(cond);
    if (condValue == Tri.UNKNOWN) {
      return n;
    }

    boolean condTrue = condValue.toBoolean(true);
    if (n.hasTwoChildren()) {
      if (condTrue) {
        // Replace "if (true) { X }" with "{ X }".
        Node thenStmt = n.getSecondChild().detach();
        n.replaceWith(thenStmt);
        reportChangeToEnclosingScope(thenStmt);
        return thenStmt;
      } else {
        // Remove "if (false) { X }" completely.
        NodeUtil.redeclareVarsInsideBranch(n);
        NodeUtil.removeChild(parent, n);
        reportChangeToEnclosingScope(parent);
        return null;
      }
    } else {
      // Replace "if (true) { X } else { Y }" with X, or
      // replace "if (false) { X } else { Y }" with Y.
      Node trueBranch = n.getSecondChild();
      Node falseBranch = trueBranch.getNext();
      Node branchToKeep = condTrue ? trueBranch : falseBranch;
      Node branchToRemove = condTrue ? falseBranch : trueBranch;
      NodeUtil.redeclareVarsInsideBranch(branchToRemove);
      branchToKeep.detach();
      n.replaceWith(branchToKeep);
      reportChangeToEnclosingScope(branchToKeep);
      return branchToKeep;
    }
  }

  /**
   * Try folding HOOK (?:) if the condition results of the condition is known.
   *
   * @return the replacement node, if changed, or the original if not
   */
  private Node tryFoldHook(Node n) {
    checkState(n.isHook(), n);
    Node cond = n.getFirstChild();
    if (mayHaveSideEffects(cond)) {
      return n;
    }
    Tri condValue = NodeUtil.getBooleanValue(cond);
    if (condValue == Tri.UNKNOWN) {
      return n;
    }

    Node thenBody = cond.getNext();
    Node elseBody = thenBody.getNext();
    Node branchToKeep = condValue.toBoolean(true) ? thenBody : elseBody;
    branchToKeep.detach();
    branchToKeep.setIsParenthesized(false);
    n.replaceWith(branchToKeep);
    reportChangeToEnclosingScope(branchToKeep);
    return branchToKeep;
  }

  /** Removes WHILEs that always evaluate to false. */
  private @Nullable Node tryFoldWhile(Node n) {
    checkState(n.isWhile(), n);
    Node cond = n.getFirstChild();
    if (mayHaveSideEffects(cond) || NodeUtil.getBooleanValue(cond) != Tri.FALSE) {
      return n;
    }
    return removeLoop(n);
  }

  /** Removes FORs that always evaluate to false. */
  private @Nullable Node tryFoldFor(Node n) {
    checkState(n.isFor(), n);
    Node init = n.getFirstChild();
    Node cond = init.getNext();

    // There is an initializer skip it
    if (!init.isEmpty() || cond.isEmpty()) {
      return n;
    }
    if (mayHaveSideEffects(cond) || NodeUtil.getBooleanValue(cond) != Tri.FALSE) {
      return n;
    }
    return removeLoop(n);
  }

  private @Nullable Node removeLoop(Node n) {
    Node parent = checkNotNull(n.getParent());
    NodeUtil.redeclareVarsInsideBranch(n);
    // Remove the entire loop and any associated labels.
    while (parent.isLabel()) {
      n = parent;
      parent = checkNotNull(parent.getParent());
    }
    n.detach();
    reportChangeToEnclosingScope(parent);
    return null;
  }
}
