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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The types of JavaScript tokens. */
public enum TokenType {
  END_OF_FILE("End of File"),

  // 7.6 Identifier Names
  IDENTIFIER("identifier"),

  // 7.6.1.1 Keywords
  BREAK("break"),
  CASE("case"),
  CATCH("catch"),
  CONST("const"),
  CONTINUE("continue"),
  DEBUGGER("debugger"),
  DEFAULT("default"),
  DELETE("delete"),
  DO("do"),
  ELSE("else"),
  FINALLY("finally"),
  FOR("for"),
  FUNCTION("function"),
  IF("if"),
  IN("in"),
  INSTANCEOF("instanceof"),
  NEW("new"),
  RETURN("return"),
  SWITCH("switch"),
  THIS("this"),
  THROW("throw"),
  TRY("try"),
  TYPEOF("typeof"),
  VAR("var"),
  VOID("void"),
  WHILE("while"),
  WITH("with"),

  // 7.8 Literals
  NULL("null"),
  TRUE("true"),
  FALSE("false"),
  NUMBER("number literal"),
  STRING("string literal"),
  REGULAR_EXPRESSION("regular expression literal"),

  // 7.7 Punctuators
  OPEN_CURLY("{"),
  CLOSE_CURLY("}"),
  OPEN_PAREN("("),
  CLOSE_PAREN(")"),
  OPEN_SQUARE("["),
  CLOSE_SQUARE("]"),
  PERIOD("."),
  SEMI_COLON(";"),
  COMMA(","),
  OPEN_ANGLE("<"),
  CLOSE_ANGLE(">"),
  LESS_EQUAL("<="),
  GREATER_EQUAL(">="),
  EQUAL_EQUAL("=="),
  NOT_EQUAL("!="),
  EQUAL_EQUAL_EQUAL("==="),
  NOT_EQUAL_EQUAL("!=="),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  STAR_STAR("**"),
  PERCENT("%"),
  PLUS_PLUS("++"),
  MINUS_MINUS("--"),
  LEFT_SHIFT("<<"),
  RIGHT_SHIFT(">>"),
  UNSIGNED_RIGHT_SHIFT(">>>"),
  AMPERSAND("&"),
  BAR("|"),
  CARET("^"),
  BANG("!"),
  TILDE("~"),
  AND("&&"),
  OR("||"),
  QUESTION("?"),
  COLON(":"),
  EQUAL("="),
  PLUS_EQUAL("+="),
  MINUS_EQUAL("-="),
  STAR_EQUAL("*="),
  STAR_STAR_EQUAL("**="),
  PERCENT_EQUAL("%="),
  LEFT_SHIFT_EQUAL("<<="),
  RIGHT_SHIFT_EQUAL(">>="),
  UNSIGNED_RIGHT_SHIFT_EQUAL(">>>="),
  AMPERSAND_EQUAL("&="),
  BAR_EQUAL("|="),
  CARET_EQUAL("^="),
  SLASH("/"),
  SLASH_EQUAL("/=");

  private static final ImmutableMap<String, TokenType> KEYWORDS;

  static {
    ImmutableMap.Builder<String, TokenType> keywords = ImmutableMap.builder();
    for (TokenType type : values()) {
      if (type.isKeyword()) {
        keywords.put(type.value, type);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
  }

  public final String value;

  TokenType(String value) {
    this.value = value;
  }

  /** Whether this is a reserved word, including the literal keywords. */
  public boolean isKeyword() {
    return ordinal() >= BREAK.ordinal() && ordinal() <= FALSE.ordinal();
  }

  /** Returns the keyword type spelled by {@code value}, or null if it is not a keyword. */
  public static @Nullable TokenType getKeyword(String value) {
    return KEYWORDS.get(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
