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

import org.jspecify.annotations.Nullable;

/**
 * A CompilationLevel represents the level of optimization that should be applied when compiling
 * JavaScript code.
 */
public enum CompilationLevel {
  /** WHITESPACE_ONLY removes comments and extra whitespace in the input JS. */
  WHITESPACE_ONLY,

  /**
   * SIMPLE_OPTIMIZATIONS performs transformations to the input JS that do not require any changes
   * to JS that depend on the input JS. For example, function arguments are renamed (which should
   * not matter to code that depends on the input JS), but functions themselves are not renamed
   * (which would otherwise require external code to change to use the renamed function names).
   */
  SIMPLE_OPTIMIZATIONS;

  public static @Nullable CompilationLevel fromString(@Nullable String value) {
    if (value == null) {
      return null;
    }
    switch (value) {
      case "WHITESPACE_ONLY":
      case "WHITESPACE":
        return CompilationLevel.WHITESPACE_ONLY;
      case "SIMPLE_OPTIMIZATIONS":
      case "SIMPLE":
        return CompilationLevel.SIMPLE_OPTIMIZATIONS;
      default:
        return null;
    }
  }

  public void setOptionsForCompilationLevel(CompilerOptions options) {
    switch (this) {
      case WHITESPACE_ONLY:
        options.setAllOptimizations(false);
        break;
      case SIMPLE_OPTIMIZATIONS:
        options.setAllOptimizations(true);
        break;
    }
  }
}
