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
import org.jspecify.annotations.Nullable;

/** Compilation results */
public class Result {
  public final boolean success;
  public final ImmutableList<JSError> errors;
  public final ImmutableList<JSError> warnings;

  /** The generated code, or null when the compilation failed. */
  public final @Nullable String code;

  /** The source map in JSON, or null when none was requested or the compilation failed. */
  public final @Nullable String sourceMap;

  Result(
      ImmutableList<JSError> errors,
      ImmutableList<JSError> warnings,
      @Nullable String code,
      @Nullable String sourceMap) {
    this.success = errors.isEmpty();
    this.errors = errors;
    this.warnings = warnings;
    this.code = success ? code : null;
    this.sourceMap = success ? sourceMap : null;
  }
}
