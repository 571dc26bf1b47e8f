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

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported during a compilation.
 */
public interface ErrorManager {

  /**
   * Reports an error. The level of the error is passed independently of the error's type to allow
   * callers to override a diagnostic's default level.
   */
  void report(CheckLevel level, JSError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all the errors, sorted by position. */
  ImmutableList<JSError> getErrors();

  /** Gets all the warnings, sorted by position. */
  ImmutableList<JSError> getWarnings();

  /** Whether any error that stops the compilation has been reported. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
