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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import org.jscompiler.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * optimizations on the parse tree.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;
  private final @Nullable ScopedCallback scopeCallback;

  /** Contains the current node */
  private Node currentNode;

  /** The roots of the scopes entered so far, innermost first. */
  private final Deque<Node> scopeRoots = new ArrayDeque<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} in preorder and by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * <p>Implementations can have side-effects (e.g. modify the parse tree). Removing the current
     * node is legal, but removing or reordering nodes above the current node may cause nodes to be
     * visited twice or not at all.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} returned true for its parent and itself.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Callback that also knows about scope changes */
  public interface ScopedCallback extends Callback {

    /**
     * Called immediately after entering a new scope. The new scope root can be accessed through
     * t.getScopeRoot()
     */
    void enterScope(NodeTraversal t);

    /** Called immediately before exiting a scope. */
    void exitScope(NodeTraversal t);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  private NodeTraversal(AbstractCompiler compiler, Callback cb) {
    this.compiler = compiler;
    this.callback = cb;
    this.scopeCallback = cb instanceof ScopedCallback ? (ScopedCallback) cb : null;
  }

  /** Traverses using the callback starting at {@code root}, which must be a scope root. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    NodeTraversal t = new NodeTraversal(compiler, cb);
    t.traverse(root);
  }

  private void traverse(Node root) {
    try {
      if (root.isFunction()) {
        traverseBranch(root, null);
        return;
      }
      pushScope(root);
      traverseBranch(root, null);
      popScope();
    } catch (StackOverflowError e) {
      // The compiler reports input nested too deeply as a diagnostic.
      throw e;
    } catch (Error | RuntimeException unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    // If there's an unexpected exception, try to get the
    // line number of the code that caused it.
    String message = unexpectedException.getMessage();
    if (currentNode != null && currentNode.getLineno() > 0) {
      message = "at line " + currentNode.getLineno() + ": " + message;
    }
    throw new IllegalStateException(message, unexpectedException);
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    if (n.isFunction()) {
      traverseFunction(n, parent);
      return;
    }

    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    // The root of the traversal has already pushed its scope.
    boolean createsBlockScope = parent != null && NodeUtil.createsBlockScope(n);
    if (createsBlockScope) {
      pushScope(n);
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node
      // would no longer point to the true next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    if (createsBlockScope) {
      popScope();
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Traverses a function. */
  private void traverseFunction(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    final Node fnName = n.getFirstChild();
    boolean isFunctionDeclaration = parent != null && NodeUtil.isFunctionDeclaration(n);

    if (isFunctionDeclaration) {
      // Function declarations are in the scope containing the declaration.
      traverseBranch(fnName, n);
    }

    pushScope(n);

    if (!isFunctionDeclaration) {
      // Function expression names are only accessible within the function
      // scope.
      traverseBranch(fnName, n);
    }

    final Node args = fnName.getNext();
    final Node body = args.getNext();
    traverseBranch(args, n);
    traverseBranch(body, n);

    popScope();

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void pushScope(Node node) {
    scopeRoots.push(node);
    if (scopeCallback != null) {
      scopeCallback.enterScope(this);
    }
  }

  private void popScope() {
    if (scopeCallback != null) {
      scopeCallback.exitScope(this);
    }
    scopeRoots.pop();
  }

  /** Returns the root node of the innermost scope. */
  public Node getScopeRoot() {
    checkState(!scopeRoots.isEmpty(), "no scope entered");
    return scopeRoots.peek();
  }

  /** Records a change to the AST under {@code n}. */
  public void reportCodeChange(Node n) {
    compiler.reportChangeToEnclosingScope(n);
  }
}
