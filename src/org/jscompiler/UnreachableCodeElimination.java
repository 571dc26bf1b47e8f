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

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscompiler.NodeTraversal.AbstractPostOrderCallback;
import org.jscompiler.ir.Node;

/**
 * Removes the statements of a statement list that follow an unconditional jump, such as the
 * {@code alert} call in {@code if (x) { return; alert('unreachable'); }}. A nested block that ends
 * in such a jump is a jump too.
 *
 * <p>Function declarations are hoisted and stay. Let and const declarations stay too, since a
 * closure declared earlier may still refer to them. The names of removed {@code var} declarations
 * are redeclared at the top of their function.
 */
class UnreachableCodeElimination implements CompilerPass {
  private static final Logger logger = Logger.getLogger(UnreachableCodeElimination.class.getName());
  private final AbstractCompiler compiler;

  UnreachableCodeElimination(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, new EliminationPass());
  }

  private class EliminationPass extends AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
      if (!NodeUtil.isStatementBlock(n)) {
        return;
      }
      Node jump = n.getFirstChild();
      while (jump != null && !isUnconditionalJump(jump)) {
        jump = jump.getNext();
      }
      if (jump == null) {
        return;
      }

      Node c = jump.getNext();
      while (c != null) {
        Node next = c.getNext();
        if (!NodeUtil.isFunctionDeclaration(c) && !c.isLet() && !c.isConst()) {
          if (logger.isLoggable(Level.FINE)) {
            logger.fine("Removing " + c);
          }
          NodeUtil.redeclareVarsInsideBranch(c);
          c.detach();
          t.reportCodeChange(n);
        }
        c = next;
      }
    }
  }

  /** A block never completes normally when its last statement is a jump. */
  private static boolean isUnconditionalJump(Node n) {
    return switch (n.getToken()) {
      case RETURN, THROW, BREAK, CONTINUE -> true;
      case BLOCK -> n.hasChildren() && isUnconditionalJump(n.getLastChild());
      default -> false;
    };
  }
}
