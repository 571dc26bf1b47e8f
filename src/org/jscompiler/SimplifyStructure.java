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

import org.jscompiler.NodeTraversal.AbstractPostOrderCallback;
import org.jscompiler.ir.IR;
import org.jscompiler.ir.Node;

/**
 * Rewrites statements into smaller equivalent forms, as a last step before printing:
 *
 * <ul>
 *   <li>blocks nested in a statement list are merged into it, unless they declare a let, a const
 *       or a function;
 *   <li>empty statements are removed;
 *   <li>adjacent declarations of the same kind are collapsed, {@code var a; var b = 1;} becomes
 *       {@code var a, b = 1;};
 *   <li>{@code while (x)} becomes {@code for (; x;)};
 *   <li>{@code true} and {@code false} become {@code !0} and {@code !1};
 *   <li>parentheses recorded from the source are dropped, leaving the printer to add the ones
 *       the precedence of the operators requires.
 * </ul>
 */
class SimplifyStructure implements CompilerPass {

  private final AbstractCompiler compiler;

  SimplifyStructure(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, new SimplifyCallback());
  }

  private static class SimplifyCallback extends AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
      if (n.getIsParenthesized()) {
        n.setIsParenthesized(false);
        t.reportCodeChange(n);
      }
      switch (n.getToken()) {
        case SCRIPT, BLOCK -> {
          mergeBlocks(t, n);
          collapseDeclarations(t, n);
        }
        case WHILE -> {
          Node cond = n.removeFirstChild();
          Node body = n.removeFirstChild();
          Node forNode =
              IR.forNode(IR.empty().srcref(n), cond, IR.empty().srcref(n), body).srcref(n);
          n.replaceWith(forNode);
          t.reportCodeChange(forNode);
        }
        case TRUE, FALSE -> {
          Node not = IR.not(IR.number(n.isTrue() ? 0 : 1)).srcrefTree(n);
          n.replaceWith(not);
          t.reportCodeChange(not);
        }
        default -> {}
      }
    }

    /** Removes empty statements, and splices nested blocks into the statement list. */
    private static void mergeBlocks(NodeTraversal t, Node n) {
      Node c = n.getFirstChild();
      while (c != null) {
        Node next = c.getNext();
        if (c.isEmpty()) {
          c.detach();
          t.reportCodeChange(n);
        } else if (c.isBlock() && !NodeUtil.hasBlockScopedDeclaration(c)) {
          while (c.hasChildren()) {
            Node stmt = c.removeFirstChild();
            stmt.insertBefore(c);
          }
          c.detach();
          t.reportCodeChange(n);
        }
        c = next;
      }
    }

    private static void collapseDeclarations(NodeTraversal t, Node n) {
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        if (!c.isNameDeclaration()) {
          continue;
        }
        Node next = c.getNext();
        while (next != null && next.getToken() == c.getToken()) {
          next.detach();
          while (next.hasChildren()) {
            c.addChildToBack(next.removeFirstChild());
          }
          t.reportCodeChange(c);
          next = c.getNext();
        }
      }
    }
  }
}
