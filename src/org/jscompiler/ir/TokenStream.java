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

package org.jscompiler.ir;

import com.google.common.collect.ImmutableSet;

/** Keyword and identifier predicates shared by the scanner, the renamer and the printer. */
public class TokenStream {

  private TokenStream() {}

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "break", "case", "catch", "continue", "debugger", "default", "delete", "do", "else",
          "false", "finally", "for", "function", "if", "in", "instanceof", "new", "null",
          "return", "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
          "with");

  /** Future reserved words, including the ones ES3 reserved and later editions released. */
  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "abstract", "boolean", "byte", "char", "class", "const", "double", "enum", "export",
          "extends", "final", "float", "goto", "implements", "import", "int", "interface",
          "let", "long", "native", "package", "private", "protected", "public", "short",
          "static", "super", "synchronized", "throws", "transient", "volatile", "yield",
          "await", "async");

  /** Whether {@code name} is an ES5 keyword or literal keyword. */
  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  /** Whether {@code name} may never be used as a binding name. */
  public static boolean isReservedWord(String name) {
    return KEYWORDS.contains(name) || RESERVED_WORDS.contains(name);
  }

  public static boolean isJSIdentifierStart(char c) {
    return c == '$' || c == '_' || Character.isLetter(c);
  }

  public static boolean isJSIdentifierPart(char c) {
    return isJSIdentifierStart(c)
        || Character.isDigit(c)
        || Character.getType(c) == Character.NON_SPACING_MARK
        || Character.getType(c) == Character.COMBINING_SPACING_MARK
        || Character.getType(c) == Character.CONNECTOR_PUNCTUATION
        || c == '\u200C'
        || c == '\u200D';
  }
}
