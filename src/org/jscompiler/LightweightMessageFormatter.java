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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * Lightweight message formatter. The format of messages this formatter produces is very compact
 * and to the point: {@code source:line:column: LEVEL - [KEY] description}, followed by the
 * offending source line and a caret under the column when the source is available.
 */
public final class LightweightMessageFormatter extends AbstractMessageFormatter {

  /**
   * A constructor for when the client doesn't care about source information.
   */
  private LightweightMessageFormatter() {
    super(null);
  }

  public LightweightMessageFormatter(SourceExcerptProvider source) {
    super(checkNotNull(source));
  }

  public static LightweightMessageFormatter withoutSource() {
    return new LightweightMessageFormatter();
  }

  @Override
  public String formatError(JSError error) {
    return format(error, false);
  }

  @Override
  public String formatWarning(JSError warning) {
    return format(warning, true);
  }

  private String format(JSError error, boolean warning) {
    String sourceName = error.getSourceName();
    int lineNumber = error.getLineNumber();
    int charno = error.getCharno();

    StringBuilder b = new StringBuilder();
    appendPosition(b, sourceName, lineNumber, charno);
    b.append(getLevelName(warning ? CheckLevel.WARNING : CheckLevel.ERROR));
    b.append(" - [");
    b.append(error.getType().key);
    b.append("] ");
    b.append(error.getDescription());
    b.append('\n');

    String sourceExcerpt = getExcerpt(sourceName, lineNumber);
    if (sourceExcerpt != null) {
      b.append(sourceExcerpt);
      b.append('\n');

      // charno == sourceExcerpt.length() means something is missing
      // at the end of the line
      if (0 <= charno && charno <= sourceExcerpt.length()) {
        padLine(charno, sourceExcerpt, b);
      }
    }
    return b.toString();
  }

  private @Nullable String getExcerpt(@Nullable String sourceName, int lineNumber) {
    SourceExcerptProvider source = getSource();
    if (source == null || sourceName == null || lineNumber <= 0) {
      return null;
    }
    return source.getSourceLine(sourceName, lineNumber);
  }

  private static void appendPosition(
      StringBuilder b, @Nullable String sourceName, int lineNumber, int charno) {
    if (sourceName != null) {
      b.append(sourceName);
      if (lineNumber > 0) {
        b.append(':').append(lineNumber);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
  }

  private static void padLine(int charno, String sourceExcerpt, StringBuilder b) {
    // Append leading whitespace
    for (int i = 0; i < charno; i++) {
      char c = sourceExcerpt.charAt(i);
      if (Character.isWhitespace(c)) {
        b.append(c);
      } else {
        b.append(' ');
      }
    }
    b.append("^\n");
  }
}
