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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jscompiler.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * Scope contains information about a variable scope in JavaScript. Scopes can be nested, a scope
 * points back to its parent scope. A Scope contains information about variables defined in that
 * scope.
 *
 * @see ScopeCreator
 */
public final class Scope {

  /** What kind of construct the scope belongs to. */
  public enum Kind {
    GLOBAL,
    FUNCTION,
    BLOCK
  }

  private final Map<String, Var> vars = new LinkedHashMap<>();
  private final @Nullable Scope parent;
  private final Node rootNode;
  private final int depth;
  private final List<Scope> children = new ArrayList<>();

  /** Variables of enclosing scopes that are referenced somewhere inside this scope. */
  private final Set<Var> outerReferences = new LinkedHashSet<>();

  /** Names referenced inside this scope that match no declaration. */
  private final Set<String> freeNames = new LinkedHashSet<>();

  private boolean containsEvalOrWith;

  // Only populated on the global scope.
  private final Map<String, List<Node>> freeReferences = new LinkedHashMap<>();
  private final List<Node> earlyReferences = new ArrayList<>();

  static Scope createGlobalScope(Node rootNode) {
    return new Scope(null, rootNode);
  }

  static Scope createChildScope(Scope parent, Node rootNode) {
    Scope scope = new Scope(parent, rootNode);
    parent.children.add(scope);
    return scope;
  }

  private Scope(@Nullable Scope parent, Node rootNode) {
    this.parent = parent;
    this.rootNode = rootNode;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  public Kind getKind() {
    if (parent == null) {
      return Kind.GLOBAL;
    }
    return rootNode.isFunction() ? Kind.FUNCTION : Kind.BLOCK;
  }

  public boolean isGlobal() {
    return parent == null;
  }

  public boolean isFunctionScope() {
    return rootNode.isFunction();
  }

  /** Whether {@code var} declarations inside this scope are declared in it. */
  public boolean isHoistScope() {
    return isGlobal() || isFunctionScope();
  }

  /** Returns the closest function or global scope. */
  public Scope getClosestHoistScope() {
    Scope s = this;
    while (!s.isHoistScope()) {
      s = s.parent;
    }
    return s;
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  public Scope getGlobalScope() {
    Scope s = this;
    while (s.parent != null) {
      s = s.parent;
    }
    return s;
  }

  public Node getRootNode() {
    return rootNode;
  }

  public int getDepth() {
    return depth;
  }

  /** The scopes directly nested in this one, in source order. */
  public List<Scope> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Declares a variable. Redeclaring a name returns the existing variable.
   *
   * @param name name of the variable
   * @param kind how the variable is declared
   * @param nameNode the NAME node declaring the variable
   */
  Var declare(String name, Var.Kind kind, Node nameNode) {
    Var existing = vars.get(name);
    if (existing != null) {
      return existing;
    }
    Var var = new Var(name, kind, nameNode, this, vars.size());
    vars.put(name, var);
    return var;
  }

  void declareArguments() {
    checkState(isFunctionScope(), "arguments outside of a function: %s", rootNode);
    vars.putIfAbsent(Var.ARGUMENTS, Var.makeArgumentsVar(this));
  }

  /** Returns the variable declared in this scope under its original name, ignoring parents. */
  public @Nullable Var getOwnSlot(String name) {
    return vars.get(name);
  }

  /** Returns the variable visible under {@code name}, searching outward. */
  public @Nullable Var getVar(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Var var = s.vars.get(name);
      if (var != null) {
        return var;
      }
    }
    return null;
  }

  public boolean hasOwnSlot(String name) {
    return vars.containsKey(name);
  }

  /** Returns the variables of this scope in declaration order. */
  public ImmutableList<Var> getVarIterable() {
    return ImmutableList.copyOf(vars.values());
  }

  public int getVarCount() {
    return vars.size();
  }

  /** Whether this scope or a scope nested in it contains a direct eval call or a with statement. */
  public boolean containsEvalOrWith() {
    return containsEvalOrWith;
  }

  /** Marks this scope and every enclosing scope as containing eval or with. */
  void markEvalOrWith() {
    for (Scope s = this; s != null; s = s.parent) {
      s.containsEvalOrWith = true;
    }
  }

  /** The variables declared outside of this scope and referenced inside it. */
  public Set<Var> getOuterReferences() {
    return Collections.unmodifiableSet(outerReferences);
  }

  /** The free names referenced inside this scope. */
  public Set<String> getFreeNames() {
    return Collections.unmodifiableSet(freeNames);
  }

  /** Records a reference from this scope to {@code var}, declared in an enclosing scope. */
  void addOuterReference(Var var) {
    for (Scope s = this; s != var.getScope(); s = s.parent) {
      s.outerReferences.add(var);
    }
  }

  /** Records a free reference made from inside this scope. */
  void addFreeReference(Node n) {
    String name = n.getString();
    for (Scope s = this; s != null; s = s.parent) {
      s.freeNames.add(name);
    }
    getGlobalScope().freeReferences.computeIfAbsent(name, k -> new ArrayList<>()).add(n);
  }

  void addEarlyReference(Node n) {
    getGlobalScope().earlyReferences.add(n);
  }

  /** The free references of the program, per name, in source order. Global scope only. */
  public Map<String, List<Node>> getFreeReferences() {
    checkState(isGlobal(), "free references are recorded on the global scope");
    return Collections.unmodifiableMap(freeReferences);
  }

  /** The references to a let or const made before its declaration. Global scope only. */
  public List<Node> getEarlyReferences() {
    checkState(isGlobal(), "early references are recorded on the global scope");
    return Collections.unmodifiableList(earlyReferences);
  }

  @Override
  public String toString() {
    return "Scope@" + rootNode;
  }
}
