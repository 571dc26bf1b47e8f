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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/**
 * A lexical token. Identifiers and keywords carry their name, string literals their cooked value,
 * numbers their value and regular expressions their pattern and flags.
 */
public final class JsToken {
  private final TokenType type;
  private final @Nullable String value;
  private final double number;
  private final @Nullable String regExpFlags;
  private final int line;
  private final int column;
  private final int start;
  private final int end;
  private final boolean precededByNewline;

  JsToken(
      TokenType type,
      @Nullable String value,
      double number,
      @Nullable String regExpFlags,
      int line,
      int column,
      int start,
      int end,
      boolean precededByNewline) {
    this.type = type;
    this.value = value;
    this.number = number;
    this.regExpFlags = regExpFlags;
    this.line = line;
    this.column = column;
    this.start = start;
    this.end = end;
    this.precededByNewline = precededByNewline;
  }

  public TokenType getType() {
    return type;
  }

  /** Returns the identifier name, keyword, cooked string value or regular expression pattern. */
  public String getValue() {
    checkState(value != null, "%s has no value", type);
    return value;
  }

  public double getNumber() {
    checkState(type == TokenType.NUMBER, "%s is not a number", type);
    return number;
  }

  public String getRegExpFlags() {
    checkState(type == TokenType.REGULAR_EXPRESSION, "%s is not a regular expression", type);
    return regExpFlags;
  }

  /** 1-based line of the first character. */
  public int getLine() {
    return line;
  }

  /** 0-based column of the first character. */
  public int getColumn() {
    return column;
  }

  /** Offset of the first character in the source. */
  public int getStart() {
    return start;
  }

  /** Offset just past the last character in the source. */
  public int getEnd() {
    return end;
  }

  /** Whether a line terminator, possibly inside a comment, separates this token from the last. */
  public boolean isPrecededByNewline() {
    return precededByNewline;
  }

  /** Whether this token can be used as a property name, which includes every keyword. */
  public boolean isIdentifierName() {
    return type == TokenType.IDENTIFIER || type.isKeyword();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type.name())
        .add("value", value)
        .add("line", line)
        .add("column", column)
        .toString();
  }
}
