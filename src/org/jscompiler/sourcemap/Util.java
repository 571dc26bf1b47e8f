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

package org.jscompiler.sourcemap;

/** Utilities shared by the source map generator and the code printer. */
public final class Util {
  private static final char[] HEX_CHARS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  private Util() {}

  /** Appends the character as a four digit hex escape sequence. */
  public static void appendHexJavaScriptRepresentation(StringBuilder sb, char c) {
    sb.append("\\u")
        .append(HEX_CHARS[(c >>> 12) & 0xf])
        .append(HEX_CHARS[(c >>> 8) & 0xf])
        .append(HEX_CHARS[(c >>> 4) & 0xf])
        .append(HEX_CHARS[c & 0xf]);
  }
}
