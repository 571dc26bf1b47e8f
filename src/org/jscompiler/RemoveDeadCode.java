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

import org.jscompiler.ir.Node;

/**
 * Dead code elimination: removes unreachable statements, branches and loops guarded by a known
 * condition, useless expression statements, and unused local declarations. The component passes
 * feed each other, so they run in turn until none of them changes the AST.
 */
class RemoveDeadCode implements CompilerPass {

  private final AbstractCompiler compiler;

  RemoveDeadCode(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    int changeStamp;
    do {
      changeStamp = compiler.getChangeStamp();
      new UnreachableCodeElimination(compiler).process(root);
      new PeepholeOptimizationsPass(compiler, new PeepholeRemoveDeadCode()).process(root);
      new RemoveUnusedVars(compiler).process(root);
    } while (changeStamp != compiler.getChangeStamp());
  }
}
