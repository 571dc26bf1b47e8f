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

import com.google.common.collect.ImmutableList;
import org.jscompiler.NodeTraversal.AbstractPostOrderCallback;
import org.jscompiler.ir.Node;

/**
 * A compiler pass to run various peephole optimizations (e.g. constant folding, some useless code
 * removal, some minimizations).
 */
class PeepholeOptimizationsPass implements CompilerPass {

  private final AbstractCompiler compiler;
  private final ImmutableList<AbstractPeepholeOptimization> peepholeOptimizations;

  /** Creates a peephole optimization pass that runs the given optimizations. */
  PeepholeOptimizationsPass(
      AbstractCompiler compiler, AbstractPeepholeOptimization... optimizations) {
    this.compiler = compiler;
    this.peepholeOptimizations = ImmutableList.copyOf(optimizations);
  }

  @Override
  public void process(Node root) {
    beginTraversal();

    // Repeat to an internal fixed point.
    int changeStamp;
    do {
      changeStamp = compiler.getChangeStamp();
      NodeTraversal.traverse(compiler, root, new PeepCallback());
    } while (changeStamp != compiler.getChangeStamp());
  }

  private class PeepCallback extends AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
      Node currentNode = n;
      for (AbstractPeepholeOptimization optim : peepholeOptimizations) {
        currentNode = optim.optimizeSubtree(currentNode);
        if (currentNode == null) {
          return;
        }
      }
    }
  }

  /** Make sure that all the optimizations have the current compiler so they can report errors. */
  private void beginTraversal() {
    for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
      optimization.beginTraversal(compiler);
    }
  }
}
