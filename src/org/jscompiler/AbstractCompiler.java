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
 * An abstract compiler, to help remove the circular dependency of passes on the driver.
 *
 * <p>This is an abstract class, so that we can make the methods package-private.
 */
public abstract class AbstractCompiler implements SourceExcerptProvider {

  /** Returns the options of the running compilation. */
  abstract CompilerOptions getOptions();

  /** Reports an error or warning, applying the configured level of its type. */
  public abstract void report(JSError error);

  public abstract ErrorManager getErrorManager();

  /** Whether an error that halts the pipeline has been reported. */
  abstract boolean hasHaltingErrors();

  /**
   * Records that the AST under {@code n} changed. Passes that run to a fixed point compare the
   * change stamp before and after an iteration.
   */
  public abstract void reportChangeToEnclosingScope(Node n);

  /** A counter that increases with every reported change. */
  abstract int getChangeStamp();

  /** The name diagnostics and source maps use for the input. */
  abstract String getSourceName();
}
