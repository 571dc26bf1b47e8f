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

import java.util.List;
import java.util.Map;
import org.jscompiler.ir.Node;

/**
 * Checks that all variables are declared and that no {@code let} or {@code const} is used before
 * its declaration. Both problems are warnings: the affected names are free, and free names are
 * never renamed or removed.
 */
class VarCheck implements CompilerPass {

  static final DiagnosticType UNRESOLVED_REFERENCE =
      DiagnosticType.warning("JSC_UNRESOLVED_REFERENCE", "variable {0} is undeclared");

  static final DiagnosticType EARLY_REFERENCE =
      DiagnosticType.warning(
          "JSC_REFERENCE_BEFORE_DECLARE", "Variable referenced before declaration: {0}");

  private final AbstractCompiler compiler;

  VarCheck(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    Scope globalScope = new ScopeCreator(compiler).createScopes(root);

    for (Node n : globalScope.getEarlyReferences()) {
      report(n, EARLY_REFERENCE);
    }
    // Only the first reference to each undeclared name is reported.
    for (Map.Entry<String, List<Node>> entry : globalScope.getFreeReferences().entrySet()) {
      report(entry.getValue().get(0), UNRESOLVED_REFERENCE);
    }
  }

  private void report(Node n, DiagnosticType type) {
    compiler.report(JSError.make(compiler.getSourceName(), n, type, n.getString()));
  }
}
