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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscompiler.ir.Node;

/**
 * RenameVars renames all the variables names into short names, to reduce code size.
 *
 * <p>Scopes are renamed top down, each with its own {@link NameGenerator}. Within a scope the most
 * referenced variables get the shortest names. A name stays out of reach of a scope when using it
 * would capture another binding:
 *
 * <ul>
 *   <li>the current name of a variable of an enclosing scope referenced in this scope;
 *   <li>a free name referenced in this scope;
 *   <li>the name of a variable in a nested scope that keeps its name.
 * </ul>
 *
 * <p>Global variables, free names, {@code arguments} and {@linkplain Var#isPinned pinned} variables
 * are never renamed, and neither is any variable of a scope that contains a direct {@code eval} or
 * a {@code with}.
 */
final class RenameVars implements CompilerPass {
  private static final Logger logger = Logger.getLogger(RenameVars.class.getName());

  /** Most referenced first, declaration order breaking ties. */
  private static final Comparator<Var> FREQUENCY_COMPARATOR =
      Comparator.comparingInt((Var v) -> -v.getReferenceCount()).thenComparingInt(Var::getIndex);

  private final AbstractCompiler compiler;

  RenameVars(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    Scope globalScope = new ScopeCreator(compiler).createScopes(root);
    for (Scope child : globalScope.getChildren()) {
      renameScope(child);
    }
  }

  private void renameScope(Scope scope) {
    if (!scope.containsEvalOrWith()) {
      Set<String> reservedNames = new HashSet<>(scope.getFreeNames());
      for (Var outer : scope.getOuterReferences()) {
        reservedNames.add(outer.getName());
      }
      for (Scope child : scope.getChildren()) {
        collectKeptNames(child, reservedNames);
      }

      List<Var> vars = new ArrayList<>();
      for (Var v : scope.getVarIterable()) {
        if (v.isPinned()) {
          reservedNames.add(v.getName());
        } else if (!v.isArguments()) {
          vars.add(v);
        }
      }
      vars.sort(FREQUENCY_COMPARATOR);

      NameGenerator nameGenerator = new DefaultNameGenerator(reservedNames);
      for (Var v : vars) {
        String newName = nameGenerator.generateNextName();
        reservedNames.add(newName);
        if (!newName.equals(v.getName())) {
          if (logger.isLoggable(Level.FINE)) {
            logger.fine("Renaming " + v.getName() + " to " + newName);
          }
          v.rename(newName);
          compiler.reportChangeToEnclosingScope(scope.getRootNode());
        }
      }
    }
    for (Scope child : scope.getChildren()) {
      renameScope(child);
    }
  }

  /** Adds the names of the variables of {@code scope} and its children that will not be renamed. */
  private static void collectKeptNames(Scope scope, Set<String> names) {
    for (Var v : scope.getVarIterable()) {
      if (scope.containsEvalOrWith() || v.isPinned()) {
        names.add(v.getName());
      }
    }
    for (Scope child : scope.getChildren()) {
      collectKeptNames(child, names);
    }
  }
}
