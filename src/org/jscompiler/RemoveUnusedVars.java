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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscompiler.ir.Node;

/**
 * Garbage collection for local variable and function definitions.
 *
 * <p>For each scope below the global scope, removes the declarations of variables that are never
 * referenced, provided their initializer has no side effects. Removing one declaration may leave
 * another unreferenced, so the pass repeats until nothing changes. Parameters, catch variables,
 * for-in targets, the names of function expressions and {@linkplain Var#isPinned pinned} variables
 * are kept, as is every variable of a scope that contains a direct {@code eval} or a {@code with}.
 * So is a declaration whose initializer reads an undeclared name.
 */
class RemoveUnusedVars implements CompilerPass {
  private static final Logger logger = Logger.getLogger(RemoveUnusedVars.class.getName());

  private final AbstractCompiler compiler;

  RemoveUnusedVars(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    boolean changed;
    do {
      Scope globalScope = new ScopeCreator(compiler).createScopes(root);
      List<Var> unused = new ArrayList<>();
      for (Scope child : globalScope.getChildren()) {
        collectUnusedVars(child, unused);
      }
      changed = false;
      for (Var v : unused) {
        changed |= removeDeclaration(v);
      }
    } while (changed);
  }

  private static void collectUnusedVars(Scope scope, List<Var> unused) {
    if (!scope.containsEvalOrWith()) {
      for (Var v : scope.getVarIterable()) {
        if (v.getReferenceCount() == 0 && !v.isPinned() && isRemovableKind(v)) {
          unused.add(v);
        }
      }
    }
    for (Scope child : scope.getChildren()) {
      collectUnusedVars(child, unused);
    }
  }

  private static boolean isRemovableKind(Var v) {
    return switch (v.getKind()) {
      case VAR, LET, CONST -> true;
      case FUNCTION -> NodeUtil.isFunctionDeclaration(v.getNameNode().getParent());
      case PARAM, CATCH, ARGUMENTS -> false;
    };
  }

  /**
   * Removes the declaration of an unreferenced variable.
   *
   * @return whether the AST changed
   */
  private boolean removeDeclaration(Var v) {
    Node nameNode = v.getNameNode();
    Node declaration = nameNode.getParent();
    if (declaration == null || !isAttached(declaration)) {
      // Already removed along with an enclosing function.
      return false;
    }
    Node parent = checkNotNull(declaration.getParent());

    if (declaration.isFunction()) {
      log(v);
      compiler.reportChangeToEnclosingScope(declaration);
      NodeUtil.removeChild(parent, declaration);
      return true;
    }

    if (parent.isForIn()) {
      return false;
    }
    Node value = nameNode.getFirstChild();
    if (value != null && (NodeUtil.mayHaveSideEffects(value) || readsFreeName(value))) {
      return false;
    }

    log(v);
    compiler.reportChangeToEnclosingScope(declaration);
    if (declaration.hasOneChild()) {
      NodeUtil.removeChild(parent, declaration);
    } else {
      nameNode.detach();
    }
    return true;
  }

  /**
   * Whether evaluating {@code n} reads a name that has no declaration, which throws a
   * ReferenceError. {@code typeof} of a free name and the bodies of nested functions do not count.
   */
  private static boolean readsFreeName(Node n) {
    if (n.isName()) {
      return n.getSlot() == null && !n.getString().isEmpty();
    }
    if (n.isFunction() || (n.isTypeOf() && n.getFirstChild().isName())) {
      return false;
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (readsFreeName(child)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isAttached(Node n) {
    Node root = n;
    while (root.hasParent()) {
      root = root.getParent();
    }
    return root.isScript();
  }

  private static void log(Var v) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Removing unused variable " + v.getName());
    }
  }
}
