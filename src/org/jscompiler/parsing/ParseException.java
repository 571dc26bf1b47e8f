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

package org.jscompiler.parsing;

/**
 * Thrown when the source text cannot be turned into an AST. Carries the 1-based line and 0-based
 * column of the offending input.
 */
public class ParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int lineNumber;
  private final int columnNumber;

  public ParseException(String details, int lineNumber, int columnNumber) {
    super(details);
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  /** Returns the message without position information. */
  public final String details() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    return details() + " (" + lineNumber + ":" + columnNumber + ")";
  }

  public final int getLineNumber() {
    return lineNumber;
  }

  public final int getColumnNumber() {
    return columnNumber;
  }
}
