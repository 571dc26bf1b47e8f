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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jscompiler.ir.Node;
import org.jscompiler.ir.StaticSlot;
import org.jspecify.annotations.Nullable;

/**
 * Used by {@code Scope} to store information about variables.
 *
 * <p>Every NAME node bound to a Var reads its name through the {@link StaticSlot} interface, so
 * {@link #rename} renames the declaration and all references at once.
 */
public class Var implements StaticSlot {

  static final String ARGUMENTS = "arguments";

  /** How the variable was declared. */
  public enum Kind {
    VAR,
    LET,
    CONST,
    FUNCTION,
    PARAM,
    CATCH,
    ARGUMENTS
  }

  private String name;
  private final Kind kind;
  private final @Nullable Node nameNode;
  private final Scope scope;
  private final int index;
  private final List<Node> references = new ArrayList<>();
  private boolean pinned;

  Var(String name, Kind kind, @Nullable Node nameNode, Scope scope, int index) {
    this.name = checkNotNull(name);
    this.kind = kind;
    this.nameNode = nameNode;
    this.scope = scope;
    this.index = index;
  }

  static Var makeArgumentsVar(Scope scope) {
    return new Var(ARGUMENTS, Kind.ARGUMENTS, null, scope, -1);
  }

  @Override
  public String getName() {
    return name;
  }

  /** The declaring NAME node, or null for the implicit {@code arguments}. */
  @Override
  public @Nullable Node getDeclarationNode() {
    return nameNode;
  }

  public Node getNameNode() {
    return nameNode;
  }

  public Kind getKind() {
    return kind;
  }

  public Scope getScope() {
    return scope;
  }

  /** The position of the declaration among the Vars of its scope. */
  int getIndex() {
    return index;
  }

  public boolean isArguments() {
    return kind == Kind.ARGUMENTS;
  }

  public boolean isParam() {
    return kind == Kind.PARAM;
  }

  public boolean isCatch() {
    return kind == Kind.CATCH;
  }

  public boolean isLet() {
    return kind == Kind.LET;
  }

  public boolean isConst() {
    return kind == Kind.CONST;
  }

  /** Whether the variable is a let or const and so has a temporal dead zone. */
  boolean isBlockScoped() {
    return kind == Kind.LET || kind == Kind.CONST;
  }

  public boolean isGlobal() {
    return scope.isGlobal();
  }

  /** The NAME nodes, other than the declaring one, that refer to this variable. */
  public ImmutableList<Node> getReferences() {
    return ImmutableList.copyOf(references);
  }

  public int getReferenceCount() {
    return references.size();
  }

  void addReference(Node n) {
    references.add(n);
  }

  /**
   * Whether the variable keeps its name and its declaration. A variable is pinned when some
   * reference reaches a binding that depends on the name: a reference made in the temporal dead
   * zone of a let or const of that name, or a var redeclaring a catch parameter.
   */
  public boolean isPinned() {
    return pinned;
  }

  void pin() {
    pinned = true;
  }

  /** Renames the variable along with every node bound to it. */
  public void rename(String newName) {
    checkState(kind != Kind.ARGUMENTS, "arguments cannot be renamed");
    this.name = checkNotNull(newName);
  }

  @Override
  public String toString() {
    return "Var " + name + " @ " + nameNode;
  }
}
