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
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {
  boolean statementNeedsEnded = false;
  boolean statementStarted = false;
  boolean sawFunction = false;

  /** Starts the source mapping for the given node at the current position. */
  void startSourceMapping(Node node) {}

  /** Retrieve the last character of the last string sent to append. */
  abstract char getLastChar();

  void addIdentifier(String identifier) {
    add(identifier);
  }

  /**
   * Appends a string to the code, keeping track of the current line length.
   *
   * <p>NOTE: the string must be a complete token. Do not directly append newlines with this method.
   * Instead use {@link #startNewLine}.
   */
  abstract void append(String str);

  void appendBlockStart() {
    append("{");
  }

  void appendBlockEnd() {
    append("}");
  }

  void startNewLine() {}

  void maybeLineBreak() {
    maybeCutLine();
  }

  void maybeCutLine() {}

  void endLine() {}

  void beginBlock() {
    if (statementNeedsEnded) {
      append(";");
      maybeLineBreak();
    }
    appendBlockStart();

    endLine();
    statementNeedsEnded = false;
  }

  void endBlock() {
    endBlock(false);
  }

  void endBlock(boolean shouldEndLine) {
    appendBlockEnd();
    if (shouldEndLine) {
      endLine();
    }
    statementNeedsEnded = false;
  }

  void listSeparator() {
    add(",");
    maybeLineBreak();
  }

  /**
   * Indicates the end of a statement and a ';' may need to be added. But we don't add it now, in
   * case we're at the end of a block (in which case we don't have to add the ';').
   *
   * @see #maybeEndStatement()
   */
  void endStatement() {
    endStatement(false);
  }

  void endStatement(boolean needSemiColon) {
    if (needSemiColon) {
      append(";");
      maybeLineBreak();
      statementNeedsEnded = false;
    } else if (statementStarted) {
      statementNeedsEnded = true;
    }
  }

  /**
   * This is to be called when we're in a statement. If the prev statement needs to be ended, add a
   * ';'.
   */
  void maybeEndStatement() {
    // Add a ';' if we need to.
    if (statementNeedsEnded) {
      append(";");
      maybeLineBreak();
      endLine();
      statementNeedsEnded = false;
    }
    statementStarted = true;
  }

  void endFunction() {
    endFunction(false);
  }

  void endFunction(boolean statementContext) {
    sawFunction = true;
    if (statementContext) {
      endLine();
    }
  }

  void beginCaseBody() {
    append(":");
  }

  void endCaseBody() {}

  void add(String newcode) {
    maybeEndStatement();

    if (newcode.isEmpty()) {
      return;
    }

    char c = newcode.charAt(0);
    char prev = getLastChar();
    if ((isWordChar(c) || c == '\\') && isWordChar(prev)) {
      // need space to separate. This is not pretty printing.
      // For example: "return foo;"
      append(" ");
    } else if (c == '/' && prev == '/') {
      // A regular expression after a division would start a comment.
      append(" ");
    }

    append(newcode);
  }

  void appendOp(String op, boolean binOp) {
    append(op);
  }

  void addOp(String op, boolean binOp) {
    maybeEndStatement();

    char first = op.charAt(0);
    char prev = getLastChar();

    if ((first == '+' || first == '-') && prev == first) {
      // This is not pretty printing. This is to prevent misparsing of
      // things like "x + ++y" or "x++ + ++y"
      append(" ");
    } else if (Character.isLetter(first) && isWordChar(prev)) {
      // Make sure there is a space after e.g. instanceof , typeof
      append(" ");
    } else if (prev == '-' && first == '>') {
      // Make sure that we don't emit -->
      append(" ");
    } else if (prev == '<' && first == '!') {
      // Make sure that we don't emit <!--
      append(" ");
    } else if (prev == '/' && (first == '/' || first == '*')) {
      // An operator after a regular expression must not start a comment.
      append(" ");
    }

    // Allow formatting around the operator.
    appendOp(op, binOp);

    // Line breaking after an operator is always safe. Line breaking before an
    // operator on the other hand is not. We only line break after a bin op
    // because it looks strange.
    if (binOp) {
      maybeCutLine();
    }
  }

  void addNumber(double x) {
    if ((long) x == x) {
      long value = (long) x;
      long mantissa = value;
      int exp = 0;
      if (Math.abs(x) >= 100) {
        while (mantissa / 10 * Math.pow(10, exp + 1) == value) {
          mantissa /= 10;
          exp++;
        }
      }
      if (exp > 2) {
        add(mantissa + "E" + exp);
      } else {
        add(Long.toString(value));
      }
    } else {
      add(formatDecimal(x));
    }
  }

  /** Java's decimal form without the leading zero of a fraction or the ".0" of a mantissa. */
  static String formatDecimal(double x) {
    String s = String.valueOf(x);
    if (s.startsWith("0.")) {
      s = s.substring(1);
    }
    return s.replace(".0E", "E");
  }

  static boolean isWordChar(char ch) {
    return ch == '_' || ch == '$' || Character.isLetterOrDigit(ch);
  }

  /**
   * If the body of a for loop or the then clause of an if statement has a single statement, should
   * it be wrapped in a block?
   */
  boolean shouldPreserveExtraBlocks() {
    return false;
  }

  /** Whether parentheses written in the source, and still flagged on the AST, are printed. */
  boolean shouldPreserveParentheses() {
    return false;
  }

  /** Whether a line break can be added after the specified BLOCK. */
  boolean breakAfterBlockFor(Node n, boolean statementContext) {
    return statementContext;
  }

  void maybeInsertSpace() {}

  /** Called when we're at the end of a file. */
  void endFile() {}
}
