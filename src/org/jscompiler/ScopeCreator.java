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
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.jscompiler.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * The scope creator scans the parse tree to create the tree of {@link Scope}s and binds every NAME
 * node to the {@link Var} it refers to.
 *
 * <p>{@code var} and function declarations are hoisted to the closest function or global scope.
 * {@code let} and {@code const} belong to the closest block scope. A reference to a {@code let}
 * or {@code const} that precedes the end of its declaration in the same function does not see the
 * binding and resolves further out. Both that declaration and the variable the reference resolves
 * to are then {@linkplain Var#isPinned pinned}.
 *
 * <p>This implementation is not thread-safe.
 */
public class ScopeCreator {
  private final AbstractCompiler compiler;

  private final Deque<Scope> scopes = new ArrayDeque<>();
  private final Map<Node, Var> declarations = new IdentityHashMap<>();
  private final Set<Var> initialized = Collections.newSetFromMap(new IdentityHashMap<>());
  private @Nullable Scope globalScope;

  public ScopeCreator(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  /**
   * Builds the scopes of the script and binds its names. Bindings left by a previous run are
   * replaced.
   *
   * @return the global scope, the root of the scope tree
   */
  public Scope createScopes(Node root) {
    checkState(root.isScript(), "expected a script: %s", root);
    scopes.clear();
    declarations.clear();
    initialized.clear();
    globalScope = null;
    NodeTraversal.traverse(compiler, root, new Binder());
    Scope result = globalScope;
    globalScope = null;
    return result;
  }

  private final class Binder implements NodeTraversal.ScopedCallback {
    @Override
    public void enterScope(NodeTraversal t) {
      Node root = t.getScopeRoot();
      Scope scope;
      if (scopes.isEmpty()) {
        scope = Scope.createGlobalScope(root);
        globalScope = scope;
      } else {
        scope = Scope.createChildScope(scopes.peek(), root);
      }
      scopes.push(scope);
      scanRoot(root, scope);
    }

    @Override
    public void exitScope(NodeTraversal t) {
      scopes.pop();
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
      switch (n.getToken()) {
        case NAME:
          visitName(n);
          break;
        case CALL:
          Node callee = n.getFirstChild();
          if (callee.isName() && callee.getString().equals("eval") && callee.getSlot() == null) {
            scopes.peek().markEvalOrWith();
          }
          break;
        case WITH:
          scopes.peek().markEvalOrWith();
          break;
        default:
          break;
      }
    }
  }

  private void scanRoot(Node n, Scope scope) {
    switch (n.getToken()) {
      case SCRIPT:
        scanVars(n, scope, true);
        break;

      case FUNCTION:
        {
          final Node fnNameNode = n.getFirstChild();
          final Node args = fnNameNode.getNext();
          final Node body = args.getNext();

          // The name of a function expression is only visible inside the function.
          if (!fnNameNode.getString().isEmpty() && NodeUtil.isFunctionExpression(n)) {
            declareVar(scope, fnNameNode, Var.Kind.FUNCTION);
          }
          for (Node a = args.getFirstChild(); a != null; a = a.getNext()) {
            declareVar(scope, a, Var.Kind.PARAM);
          }
          scope.declareArguments();
          scanVars(body, scope, true);
          break;
        }

      case BLOCK:
        scanLexicalDeclarations(n, scope);
        break;

      case FOR:
      case FOR_IN:
        {
          Node init = n.getFirstChild();
          if (init.isLet() || init.isConst()) {
            declareNames(init, scope);
          }
          break;
        }

      case SWITCH:
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          scanLexicalDeclarations(c.getLastChild(), scope);
        }
        break;

      case CATCH:
        declareVar(scope, n.getFirstChild(), Var.Kind.CATCH);
        scanLexicalDeclarations(n.getLastChild(), scope);
        break;

      default:
        throw new IllegalStateException("not a scope root: " + n);
    }
  }

  /**
   * Scans and gathers the hoisted declarations under a Node. Lexical declarations are only
   * gathered when {@code direct}, that is for the statements of the scope root itself.
   */
  private void scanVars(Node n, Scope hoistScope, boolean direct) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      switch (child.getToken()) {
        case VAR:
          declareNames(child, hoistScope);
          continue;

        case LET:
        case CONST:
          if (direct) {
            declareNames(child, hoistScope);
          }
          continue;

        case FUNCTION:
          if (NodeUtil.isFunctionDeclaration(child)) {
            declareVar(hoistScope, child.getFirstChild(), Var.Kind.FUNCTION);
          }
          // should not examine function's children
          continue;

        default:
          break;
      }

      // Variables can only occur in statement-level nodes, so
      // we only need to traverse children in a couple special cases.
      if (NodeUtil.isControlStructure(child) || NodeUtil.isStatementBlock(child)) {
        scanVars(child, hoistScope, false);
      }
    }
  }

  private void scanLexicalDeclarations(Node block, Scope scope) {
    for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isLet() || child.isConst()) {
        declareNames(child, scope);
      }
    }
  }

  private void declareNames(Node declaration, Scope scope) {
    Var.Kind kind =
        switch (declaration.getToken()) {
          case VAR -> Var.Kind.VAR;
          case LET -> Var.Kind.LET;
          case CONST -> Var.Kind.CONST;
          default -> throw new IllegalStateException("not a declaration: " + declaration);
        };
    for (Node name = declaration.getFirstChild(); name != null; name = name.getNext()) {
      declareVar(scope, name, kind);
    }
  }

  /**
   * Declares a variable.
   *
   * @param n The node corresponding to the variable name.
   */
  private void declareVar(Scope scope, Node n, Var.Kind kind) {
    checkState(n.isName(), n);
    declarations.put(n, scope.declare(n.getString(), kind, n));
  }

  private void visitName(Node n) {
    if (n.getString().isEmpty()) {
      // An anonymous function.
      return;
    }
    Var declared = declarations.get(n);
    if (declared != null) {
      bind(n, declared);
      if (declared.getNameNode() != n) {
        // A redeclaration counts as a use of the existing variable.
        declared.addReference(n);
      }
      if (declared.isBlockScoped()) {
        initialized.add(declared);
      }
      Scope current = scopes.peek();
      if (declared.getScope() != current) {
        // A var or function hoisted out of a block is visible in that block too.
        current.addOuterReference(declared);
        if (declared.getKind() == Var.Kind.VAR) {
          pinShadowedCatchParameters(n, declared, current);
        }
      }
      return;
    }

    Scope current = scopes.peek();
    Scope hoistScope = current.getClosestHoistScope();
    String name = n.getString();
    boolean early = false;
    for (Scope s = current; s != null; s = s.getParent()) {
      Var var = s.getOwnSlot(name);
      if (var == null) {
        continue;
      }
      if (var.isBlockScoped()
          && !initialized.contains(var)
          && s.getClosestHoistScope() == hoistScope) {
        if (!early) {
          current.addEarlyReference(n);
          early = true;
        }
        var.pin();
        continue;
      }
      bind(n, var);
      var.addReference(n);
      if (early) {
        var.pin();
      }
      if (s != current) {
        current.addOuterReference(var);
      }
      return;
    }
    n.setSlot(null);
    current.addFreeReference(n);
  }

  /**
   * The initializer of a var that redeclares the parameter of an enclosing catch assigns to that
   * parameter, while the var itself is declared in the function. Both keep their name.
   */
  private static void pinShadowedCatchParameters(Node n, Var declared, Scope current) {
    for (Scope s = current; s != declared.getScope(); s = s.getParent()) {
      Var shadowed = s.getOwnSlot(n.getString());
      if (shadowed != null && shadowed.isCatch()) {
        shadowed.pin();
        declared.pin();
      }
    }
  }

  private static void bind(Node n, Var var) {
    if (n.getOriginalName() == null) {
      n.setOriginalName(n.getString());
    }
    n.setSlot(var);
  }
}
