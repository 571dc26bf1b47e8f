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

/**
 * Thrown when the compiler hits a state it should never be in: a broken invariant of the AST or of
 * a pass. Carries the phase that failed.
 */
public class InternalCompilerError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String phase;

  InternalCompilerError(String phase, Throwable cause) {
    super("INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + phase, cause);
    this.phase = phase;
  }

  /** The name of the phase that failed. */
  public String getPhase() {
    return phase;
  }
}
