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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import org.jscompiler.ir.TokenStream;

/**
 * Scans JavaScript source text into tokens on demand.
 *
 * <p>A slash is always scanned as a division operator. The parser asks for {@link
 * #rescanAsRegExp} when its grammatical position calls for a primary expression.
 */
public class Scanner {
  private final String source;
  private int index;
  private int line = 1;
  private int lineStart;

  public Scanner(String source) {
    this.source = source;
  }

  /** Returns the next token. Once the end is reached, every call returns END_OF_FILE. */
  public JsToken nextToken() throws LexException {
    boolean newline = skipWhitespaceAndComments();
    int start = index;
    int tokenLine = line;
    int column = index - lineStart;
    if (isAtEnd()) {
      return new JsToken(
          TokenType.END_OF_FILE, null, 0, null, tokenLine, column, start, start, newline);
    }
    char ch = source.charAt(index);
    if (TokenStream.isJSIdentifierStart(ch) || ch == '\\') {
      String name = scanIdentifierName();
      TokenType keyword = TokenType.getKeyword(name);
      // Keywords written with escapes are plain identifiers for the grammar's purposes.
      TokenType type =
          keyword != null && index - start == name.length() ? keyword : TokenType.IDENTIFIER;
      return new JsToken(type, name, 0, null, tokenLine, column, start, index, newline);
    }
    if (isDecimalDigit(ch) || (ch == '.' && isDecimalDigit(peekChar(1)))) {
      double value = scanNumber();
      return new JsToken(TokenType.NUMBER, null, value, null, tokenLine, column, start, index,
          newline);
    }
    if (ch == '"' || ch == '\'') {
      String value = scanString(ch);
      return new JsToken(TokenType.STRING, value, 0, null, tokenLine, column, start, index,
          newline);
    }
    TokenType punctuator = scanPunctuator();
    return new JsToken(
        punctuator, punctuator.value, 0, null, tokenLine, column, start, index, newline);
  }

  /**
   * Scans a regular expression literal starting at the slash of {@code slash}, which must be the
   * last token returned by {@link #nextToken}.
   */
  public JsToken rescanAsRegExp(JsToken slash) throws LexException {
    checkArgument(
        slash.getType() == TokenType.SLASH || slash.getType() == TokenType.SLASH_EQUAL,
        "not a slash: %s",
        slash);
    checkArgument(slash.getEnd() == index, "%s is not the last token scanned", slash);
    index = slash.getStart() + 1;
    StringBuilder pattern = new StringBuilder();
    boolean inCharacterClass = false;
    while (true) {
      if (isAtEnd() || isLineTerminator(source.charAt(index))) {
        throw error("Unterminated regular expression literal", slash.getLine(),
            slash.getColumn());
      }
      char ch = source.charAt(index++);
      if (ch == '/' && !inCharacterClass) {
        break;
      }
      pattern.append(ch);
      if (ch == '\\') {
        if (isAtEnd() || isLineTerminator(source.charAt(index))) {
          throw error("Unterminated regular expression literal", slash.getLine(),
              slash.getColumn());
        }
        pattern.append(source.charAt(index++));
      } else if (ch == '[') {
        inCharacterClass = true;
      } else if (ch == ']') {
        inCharacterClass = false;
      }
    }
    int flagsStart = index;
    while (!isAtEnd() && TokenStream.isJSIdentifierPart(source.charAt(index))) {
      char flag = source.charAt(index);
      if ("gimsuy".indexOf(flag) < 0 || source.substring(flagsStart, index).indexOf(flag) >= 0) {
        throw error("Invalid regular expression flag '" + flag + "'");
      }
      index++;
    }
    return new JsToken(
        TokenType.REGULAR_EXPRESSION,
        pattern.toString(),
        0,
        source.substring(flagsStart, index),
        slash.getLine(),
        slash.getColumn(),
        slash.getStart(),
        index,
        slash.isPrecededByNewline());
  }

  /** Skips whitespace and comments, reporting whether a line terminator was among them. */
  private boolean skipWhitespaceAndComments() throws LexException {
    boolean newline = false;
    while (!isAtEnd()) {
      char ch = source.charAt(index);
      if (isLineTerminator(ch)) {
        newline = true;
        skipLineTerminator();
      } else if (isWhitespace(ch)) {
        index++;
      } else if (ch == '/' && peekChar(1) == '/') {
        while (!isAtEnd() && !isLineTerminator(source.charAt(index))) {
          index++;
        }
      } else if (ch == '/' && peekChar(1) == '*') {
        newline |= skipMultiLineComment();
      } else {
        break;
      }
    }
    return newline;
  }

  private boolean skipMultiLineComment() throws LexException {
    int startLine = line;
    int startColumn = index - lineStart;
    boolean newline = false;
    index += 2;
    while (true) {
      if (isAtEnd()) {
        throw error("Unterminated comment", startLine, startColumn);
      }
      char ch = source.charAt(index);
      if (ch == '*' && peekChar(1) == '/') {
        index += 2;
        return newline;
      }
      if (isLineTerminator(ch)) {
        newline = true;
        skipLineTerminator();
      } else {
        index++;
      }
    }
  }

  private void skipLineTerminator() {
    char ch = source.charAt(index++);
    if (ch == '\r' && !isAtEnd() && source.charAt(index) == '\n') {
      index++;
    }
    line++;
    lineStart = index;
  }

  private String scanIdentifierName() throws LexException {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    while (!isAtEnd()) {
      char ch = source.charAt(index);
      if (ch == '\\') {
        int escapeStart = index;
        if (peekChar(1) != 'u') {
          throw error("Invalid escape sequence in identifier");
        }
        index += 2;
        int cp = scanUnicodeEscapeValue(escapeStart);
        if (cp > 0xFFFF
            || !(first
                ? TokenStream.isJSIdentifierStart((char) cp)
                : TokenStream.isJSIdentifierPart((char) cp))) {
          throw error("Invalid character escape in identifier", line, escapeStart - lineStart);
        }
        sb.append((char) cp);
      } else if (first ? TokenStream.isJSIdentifierStart(ch) : TokenStream.isJSIdentifierPart(ch)) {
        sb.append(ch);
        index++;
      } else {
        break;
      }
      first = false;
    }
    return sb.toString();
  }

  private double scanNumber() throws LexException {
    int start = index;
    char ch = source.charAt(index);
    double value;
    if (ch == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
      value = scanRadixDigits(16);
    } else if (ch == '0' && (peekChar(1) == 'o' || peekChar(1) == 'O')) {
      value = scanRadixDigits(8);
    } else if (ch == '0' && (peekChar(1) == 'b' || peekChar(1) == 'B')) {
      value = scanRadixDigits(2);
    } else if (ch == '0' && isDecimalDigit(peekChar(1))) {
      // Legacy octal, unless a digit rules it out.
      index++;
      boolean octal = true;
      while (!isAtEnd() && isDecimalDigit(source.charAt(index))) {
        if (source.charAt(index) > '7') {
          octal = false;
        }
        index++;
      }
      String digits = source.substring(start + 1, index);
      if (octal) {
        value = new BigInteger(digits, 8).doubleValue();
      } else {
        index = start;
        value = scanDecimal();
      }
    } else {
      value = scanDecimal();
    }
    if (!isAtEnd()
        && (TokenStream.isJSIdentifierStart(source.charAt(index))
            || isDecimalDigit(source.charAt(index)))) {
      throw error("Malformed number", line, start - lineStart);
    }
    return value;
  }

  private double scanDecimal() throws LexException {
    int start = index;
    skipDecimalDigits();
    if (!isAtEnd() && source.charAt(index) == '.') {
      index++;
      skipDecimalDigits();
    }
    if (!isAtEnd() && (source.charAt(index) == 'e' || source.charAt(index) == 'E')) {
      index++;
      if (!isAtEnd() && (source.charAt(index) == '+' || source.charAt(index) == '-')) {
        index++;
      }
      if (isAtEnd() || !isDecimalDigit(source.charAt(index))) {
        throw error("Malformed number", line, start - lineStart);
      }
      skipDecimalDigits();
    }
    return Double.parseDouble(source.substring(start, index));
  }

  private void skipDecimalDigits() {
    while (!isAtEnd() && isDecimalDigit(source.charAt(index))) {
      index++;
    }
  }

  private double scanRadixDigits(int radix) throws LexException {
    int start = index;
    index += 2;
    int digitsStart = index;
    while (!isAtEnd() && Character.digit(source.charAt(index), radix) >= 0
        && source.charAt(index) < 128) {
      index++;
    }
    if (index == digitsStart) {
      throw error("Malformed number", line, start - lineStart);
    }
    return new BigInteger(source.substring(digitsStart, index), radix).doubleValue();
  }

  private String scanString(char quote) throws LexException {
    int startLine = line;
    int startColumn = index - lineStart;
    index++;
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (isAtEnd()) {
        throw error("Unterminated string literal", startLine, startColumn);
      }
      char ch = source.charAt(index);
      if (ch == quote) {
        index++;
        return sb.toString();
      }
      if (ch == '\n' || ch == '\r') {
        throw error("Unterminated string literal", startLine, startColumn);
      }
      if (ch != '\\') {
        sb.append(ch);
        index++;
        continue;
      }
      int escapeStart = index;
      index++;
      if (isAtEnd()) {
        throw error("Unterminated string literal", startLine, startColumn);
      }
      char escaped = source.charAt(index);
      if (isLineTerminator(escaped)) {
        // Line continuation.
        skipLineTerminator();
        continue;
      }
      index++;
      switch (escaped) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'v':
          sb.append('\u000B');
          break;
        case 'x':
          {
            int hi = hexValue(peekChar(0));
            int lo = hexValue(peekChar(1));
            if (hi < 0 || lo < 0) {
              throw error("Malformed hex escape sequence", line, escapeStart - lineStart);
            }
            index += 2;
            sb.append((char) (hi * 16 + lo));
            break;
          }
        case 'u':
          sb.appendCodePoint(scanUnicodeEscapeValue(escapeStart));
          break;
        case '0':
        case '1':
        case '2':
        case '3':
        case '4':
        case '5':
        case '6':
        case '7':
          sb.append((char) scanLegacyOctalEscape(escaped));
          break;
        default:
          sb.append(escaped);
          break;
      }
    }
  }

  private int scanLegacyOctalEscape(char first) {
    int value = first - '0';
    int maxDigits = first <= '3' ? 3 : 2;
    for (int i = 1; i < maxDigits && isOctalDigit(peekChar(0)); i++) {
      value = value * 8 + (source.charAt(index) - '0');
      index++;
    }
    return value;
  }

  /** Scans the part of a unicode escape after {@code \\u}. */
  private int scanUnicodeEscapeValue(int escapeStart) throws LexException {
    int column = escapeStart - lineStart;
    if (peekChar(0) == '{') {
      index++;
      int value = 0;
      int digits = 0;
      while (hexValue(peekChar(0)) >= 0) {
        value = value * 16 + hexValue(peekChar(0));
        if (value > 0x10FFFF) {
          throw error("Undefined Unicode code-point", line, column);
        }
        digits++;
        index++;
      }
      if (digits == 0 || peekChar(0) != '}') {
        throw error("Malformed unicode escape sequence", line, column);
      }
      index++;
      return value;
    }
    int value = 0;
    for (int i = 0; i < 4; i++) {
      int digit = hexValue(peekChar(i));
      if (digit < 0) {
        throw error("Malformed unicode escape sequence", line, column);
      }
      value = value * 16 + digit;
    }
    index += 4;
    return value;
  }

  private TokenType scanPunctuator() throws LexException {
    char ch = source.charAt(index);
    switch (ch) {
      case '{':
        return advance(1, TokenType.OPEN_CURLY);
      case '}':
        return advance(1, TokenType.CLOSE_CURLY);
      case '(':
        return advance(1, TokenType.OPEN_PAREN);
      case ')':
        return advance(1, TokenType.CLOSE_PAREN);
      case '[':
        return advance(1, TokenType.OPEN_SQUARE);
      case ']':
        return advance(1, TokenType.CLOSE_SQUARE);
      case '.':
        return advance(1, TokenType.PERIOD);
      case ';':
        return advance(1, TokenType.SEMI_COLON);
      case ',':
        return advance(1, TokenType.COMMA);
      case '~':
        return advance(1, TokenType.TILDE);
      case '?':
        return advance(1, TokenType.QUESTION);
      case ':':
        return advance(1, TokenType.COLON);
      case '<':
        if (peekChar(1) == '<') {
          return peekChar(2) == '='
              ? advance(3, TokenType.LEFT_SHIFT_EQUAL)
              : advance(2, TokenType.LEFT_SHIFT);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.LESS_EQUAL)
            : advance(1, TokenType.OPEN_ANGLE);
      case '>':
        if (peekChar(1) == '>') {
          if (peekChar(2) == '>') {
            return peekChar(3) == '='
                ? advance(4, TokenType.UNSIGNED_RIGHT_SHIFT_EQUAL)
                : advance(3, TokenType.UNSIGNED_RIGHT_SHIFT);
          }
          return peekChar(2) == '='
              ? advance(3, TokenType.RIGHT_SHIFT_EQUAL)
              : advance(2, TokenType.RIGHT_SHIFT);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.GREATER_EQUAL)
            : advance(1, TokenType.CLOSE_ANGLE);
      case '=':
        if (peekChar(1) == '=') {
          return peekChar(2) == '='
              ? advance(3, TokenType.EQUAL_EQUAL_EQUAL)
              : advance(2, TokenType.EQUAL_EQUAL);
        }
        return advance(1, TokenType.EQUAL);
      case '!':
        if (peekChar(1) == '=') {
          return peekChar(2) == '='
              ? advance(3, TokenType.NOT_EQUAL_EQUAL)
              : advance(2, TokenType.NOT_EQUAL);
        }
        return advance(1, TokenType.BANG);
      case '+':
        if (peekChar(1) == '+') {
          return advance(2, TokenType.PLUS_PLUS);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.PLUS_EQUAL)
            : advance(1, TokenType.PLUS);
      case '-':
        if (peekChar(1) == '-') {
          return advance(2, TokenType.MINUS_MINUS);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.MINUS_EQUAL)
            : advance(1, TokenType.MINUS);
      case '*':
        if (peekChar(1) == '*') {
          return peekChar(2) == '='
              ? advance(3, TokenType.STAR_STAR_EQUAL)
              : advance(2, TokenType.STAR_STAR);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.STAR_EQUAL)
            : advance(1, TokenType.STAR);
      case '%':
        return peekChar(1) == '='
            ? advance(2, TokenType.PERCENT_EQUAL)
            : advance(1, TokenType.PERCENT);
      case '&':
        if (peekChar(1) == '&') {
          return advance(2, TokenType.AND);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.AMPERSAND_EQUAL)
            : advance(1, TokenType.AMPERSAND);
      case '|':
        if (peekChar(1) == '|') {
          return advance(2, TokenType.OR);
        }
        return peekChar(1) == '='
            ? advance(2, TokenType.BAR_EQUAL)
            : advance(1, TokenType.BAR);
      case '^':
        return peekChar(1) == '='
            ? advance(2, TokenType.CARET_EQUAL)
            : advance(1, TokenType.CARET);
      case '/':
        return peekChar(1) == '='
            ? advance(2, TokenType.SLASH_EQUAL)
            : advance(1, TokenType.SLASH);
      case '`':
        throw error("Template literals are not supported");
      default:
        throw error("Illegal character '" + printable(ch) + "'");
    }
  }

  private TokenType advance(int length, TokenType type) {
    index += length;
    return type;
  }

  private static String printable(char ch) {
    return ch < 0x20 || ch > 0x7e ? String.format("\\u%04X", (int) ch) : String.valueOf(ch);
  }

  private boolean isAtEnd() {
    return index >= source.length();
  }

  /** Returns the character {@code offset} places ahead, or NUL past the end. */
  private char peekChar(int offset) {
    int i = index + offset;
    return i < source.length() ? source.charAt(i) : '\0';
  }

  private LexException error(String message) {
    return error(message, line, index - lineStart);
  }

  private static LexException error(String message, int line, int column) {
    return new LexException(message, line, column);
  }

  static boolean isLineTerminator(char ch) {
    return ch == '\n' || ch == '\r' || ch == '\u2028' || ch == '\u2029';
  }

  private static boolean isWhitespace(char ch) {
    switch (ch) {
      case ' ':
      case '\t':
      case '\u000B':
      case '\f':
      case '\u00A0':
      case '\uFEFF':
        return true;
      default:
        return ch > 127 && Character.getType(ch) == Character.SPACE_SEPARATOR;
    }
  }

  private static boolean isDecimalDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isOctalDigit(char ch) {
    return ch >= '0' && ch <= '7';
  }

  private static int hexValue(char ch) {
    if (ch >= '0' && ch <= '9') {
      return ch - '0';
    } else if (ch >= 'a' && ch <= 'f') {
      return ch - 'a' + 10;
    } else if (ch >= 'A' && ch <= 'F') {
      return ch - 'A' + 10;
    }
    return -1;
  }
}
