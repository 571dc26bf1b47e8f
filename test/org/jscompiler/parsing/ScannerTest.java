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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScannerTest {

  private static List<JsToken> scan(String source) throws LexException {
    Scanner scanner = new Scanner(source);
    List<JsToken> tokens = new ArrayList<>();
    JsToken t;
    do {
      t = scanner.nextToken();
      tokens.add(t);
    } while (t.getType() != TokenType.END_OF_FILE);
    return tokens;
  }

  private static List<TokenType> types(String source) throws LexException {
    List<TokenType> types = new ArrayList<>();
    for (JsToken t : scan(source)) {
      types.add(t.getType());
    }
    return types;
  }

  private static JsToken single(String source) throws LexException {
    List<JsToken> tokens = scan(source);
    assertThat(tokens).hasSize(2);
    return tokens.get(0);
  }

  private static double number(String source) throws LexException {
    JsToken t = single(source);
    assertThat(t.getType()).isEqualTo(TokenType.NUMBER);
    return t.getNumber();
  }

  private static String string(String source) throws LexException {
    JsToken t = single(source);
    assertThat(t.getType()).isEqualTo(TokenType.STRING);
    return t.getValue();
  }

  @Test
  public void testStatement() throws Exception {
    assertThat(types("var x = 1;"))
        .containsExactly(
            TokenType.VAR,
            TokenType.IDENTIFIER,
            TokenType.EQUAL,
            TokenType.NUMBER,
            TokenType.SEMI_COLON,
            TokenType.END_OF_FILE)
        .inOrder();
  }

  @Test
  public void testEndOfFileRepeats() throws Exception {
    Scanner scanner = new Scanner("a");
    assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.IDENTIFIER);
    assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.END_OF_FILE);
    assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.END_OF_FILE);
  }

  @Test
  public void testKeywordsAndIdentifiers() throws Exception {
    assertThat(single("function").getType()).isEqualTo(TokenType.FUNCTION);
    assertThat(single("null").getType()).isEqualTo(TokenType.NULL);
    assertThat(single("let").getType()).isEqualTo(TokenType.IDENTIFIER);
    assertThat(single("$foo_1").getValue()).isEqualTo("$foo_1");
    assertThat(single("caf\u00e9").getValue()).isEqualTo("caf\u00e9");
  }

  @Test
  public void testEscapedIdentifier() throws Exception {
    JsToken t = single("v\\u0061r");
    assertThat(t.getType()).isEqualTo(TokenType.IDENTIFIER);
    assertThat(t.getValue()).isEqualTo("var");
    assertThat(single("\\u{62}c").getValue()).isEqualTo("bc");
    assertThrows(LexException.class, () -> scan("a\\x41"));
    assertThrows(LexException.class, () -> scan("\\u0031a"));
  }

  @Test
  public void testNumbers() throws Exception {
    assertThat(number("42")).isEqualTo(42.0);
    assertThat(number("3.25")).isEqualTo(3.25);
    assertThat(number(".5")).isEqualTo(0.5);
    assertThat(number("1.")).isEqualTo(1.0);
    assertThat(number("1e3")).isEqualTo(1000.0);
    assertThat(number("2E-2")).isEqualTo(0.02);
    assertThat(number("0x1F")).isEqualTo(31.0);
    assertThat(number("0o17")).isEqualTo(15.0);
    assertThat(number("0b101")).isEqualTo(5.0);
    assertThat(number("017")).isEqualTo(15.0);
    assertThat(number("019")).isEqualTo(19.0);
  }

  @Test
  public void testMalformedNumbers() {
    assertThrows(LexException.class, () -> scan("1e"));
    assertThrows(LexException.class, () -> scan("3in"));
    assertThrows(LexException.class, () -> scan("0x"));
    assertThrows(LexException.class, () -> scan("0b2"));
  }

  @Test
  public void testStrings() throws Exception {
    assertThat(string("'abc'")).isEqualTo("abc");
    assertThat(string("\"it's\"")).isEqualTo("it's");
    assertThat(string("'a\\nb\\tc'")).isEqualTo("a\nb\tc");
    assertThat(string("'\\x41\\u0042\\u{43}'")).isEqualTo("ABC");
    assertThat(string("'\\101'")).isEqualTo("A");
    assertThat(string("'\\0'")).isEqualTo("\0");
    assertThat(string("'\\q'")).isEqualTo("q");
    assertThat(string("'a\\\nb'")).isEqualTo("ab");
    assertThat(string("'\\u{1F600}'")).isEqualTo("\uD83D\uDE00");
  }

  @Test
  public void testUnterminatedString() {
    LexException e = assertThrows(LexException.class, () -> scan("x = 'abc"));
    assertThat(e.details()).isEqualTo("Unterminated string literal");
    assertThat(e.getLineNumber()).isEqualTo(1);
    assertThat(e.getColumnNumber()).isEqualTo(4);
    assertThrows(LexException.class, () -> scan("'ab\ncd'"));
    assertThrows(LexException.class, () -> scan("'\\x4'"));
    assertThrows(LexException.class, () -> scan("'\\u12'"));
  }

  @Test
  public void testComments() throws Exception {
    assertThat(types("a // comment\nb /* another */ c"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE)
        .inOrder();
    LexException e = assertThrows(LexException.class, () -> scan("a /* never closed"));
    assertThat(e.details()).isEqualTo("Unterminated comment");
  }

  @Test
  public void testPrecededByNewline() throws Exception {
    List<JsToken> tokens = scan("a // c\nb /* x */ c /*\n*/ d");
    assertThat(tokens.get(0).isPrecededByNewline()).isFalse();
    assertThat(tokens.get(1).isPrecededByNewline()).isTrue();
    assertThat(tokens.get(2).isPrecededByNewline()).isFalse();
    assertThat(tokens.get(3).isPrecededByNewline()).isTrue();
  }

  @Test
  public void testPositions() throws Exception {
    List<JsToken> tokens = scan("a\n  bc\r\nd");
    assertThat(tokens.get(0).getLine()).isEqualTo(1);
    assertThat(tokens.get(0).getColumn()).isEqualTo(0);
    assertThat(tokens.get(1).getLine()).isEqualTo(2);
    assertThat(tokens.get(1).getColumn()).isEqualTo(2);
    assertThat(tokens.get(1).getStart()).isEqualTo(4);
    assertThat(tokens.get(1).getEnd()).isEqualTo(6);
    assertThat(tokens.get(2).getLine()).isEqualTo(3);
    assertThat(tokens.get(2).getColumn()).isEqualTo(0);
  }

  @Test
  public void testPunctuators() throws Exception {
    assertThat(types(">>>= >>> >> >= > === !== == != ** **= ++ -- && || ?"))
        .containsExactly(
            TokenType.UNSIGNED_RIGHT_SHIFT_EQUAL,
            TokenType.UNSIGNED_RIGHT_SHIFT,
            TokenType.RIGHT_SHIFT,
            TokenType.GREATER_EQUAL,
            TokenType.CLOSE_ANGLE,
            TokenType.EQUAL_EQUAL_EQUAL,
            TokenType.NOT_EQUAL_EQUAL,
            TokenType.EQUAL_EQUAL,
            TokenType.NOT_EQUAL,
            TokenType.STAR_STAR,
            TokenType.STAR_STAR_EQUAL,
            TokenType.PLUS_PLUS,
            TokenType.MINUS_MINUS,
            TokenType.AND,
            TokenType.OR,
            TokenType.QUESTION,
            TokenType.END_OF_FILE)
        .inOrder();
  }

  @Test
  public void testIllegalCharacters() {
    LexException e = assertThrows(LexException.class, () -> scan("a # b"));
    assertThat(e.details()).isEqualTo("Illegal character '#'");
    assertThat(e.getColumnNumber()).isEqualTo(2);
    assertThrows(LexException.class, () -> scan("`template`"));
  }

  @Test
  public void testRegularExpression() throws Exception {
    Scanner scanner = new Scanner("/ab[/]c\\//gi;");
    JsToken slash = scanner.nextToken();
    assertThat(slash.getType()).isEqualTo(TokenType.SLASH);
    JsToken regExp = scanner.rescanAsRegExp(slash);
    assertThat(regExp.getType()).isEqualTo(TokenType.REGULAR_EXPRESSION);
    assertThat(regExp.getValue()).isEqualTo("ab[/]c\\/");
    assertThat(regExp.getRegExpFlags()).isEqualTo("gi");
    assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.SEMI_COLON);
  }

  @Test
  public void testRegularExpressionStartingWithEquals() throws Exception {
    Scanner scanner = new Scanner("/=a/");
    JsToken slash = scanner.nextToken();
    assertThat(slash.getType()).isEqualTo(TokenType.SLASH_EQUAL);
    assertThat(scanner.rescanAsRegExp(slash).getValue()).isEqualTo("=a");
  }

  @Test
  public void testBadRegularExpressions() throws Exception {
    Scanner unterminated = new Scanner("/abc");
    JsToken slash = unterminated.nextToken();
    assertThrows(LexException.class, () -> unterminated.rescanAsRegExp(slash));

    Scanner duplicateFlag = new Scanner("/a/gg");
    JsToken slash2 = duplicateFlag.nextToken();
    assertThrows(LexException.class, () -> duplicateFlag.rescanAsRegExp(slash2));

    Scanner badFlag = new Scanner("/a/x");
    JsToken slash3 = badFlag.nextToken();
    assertThrows(LexException.class, () -> badFlag.rescanAsRegExp(slash3));
  }
}
