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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LightweightMessageFormatterTest {
  private static final DiagnosticType FOO_TYPE =
      DiagnosticType.error("TEST_FOO", "error description here");
  private static final DiagnosticType BAR_TYPE =
      DiagnosticType.warning("TEST_BAR", "unknown name {0}");

  private static final SourceExcerptProvider SOURCE =
      (sourceName, lineNumber) ->
          sourceName.equals("foo.js") && lineNumber == 2 ? "  if (a) b;" : null;

  @Test
  public void testFormatErrorWithExcerpt() {
    JSError error = JSError.make("foo.js", 2, 6, FOO_TYPE);

    assertThat(new LightweightMessageFormatter(SOURCE).formatError(error))
        .isEqualTo(
            "foo.js:2:6: ERROR - [TEST_FOO] error description here\n"
                + "  if (a) b;\n"
                + "      ^\n");
  }

  @Test
  public void testFormatWarningWithoutExcerpt() {
    JSError warning = JSError.make("foo.js", 5, 0, BAR_TYPE, "x");

    assertThat(new LightweightMessageFormatter(SOURCE).formatWarning(warning))
        .isEqualTo("foo.js:5:0: WARNING - [TEST_BAR] unknown name x\n");
  }

  @Test
  public void testCaretAtEndOfLine() {
    JSError error = JSError.make("foo.js", 2, 11, FOO_TYPE);

    assertThat(new LightweightMessageFormatter(SOURCE).formatError(error))
        .endsWith("  if (a) b;\n           ^\n");
  }

  @Test
  public void testNoSourceInformation() {
    JSError error = JSError.make(FOO_TYPE);

    assertThat(LightweightMessageFormatter.withoutSource().formatError(error))
        .isEqualTo("ERROR - [TEST_FOO] error description here\n");
  }

  @Test
  public void testColorize() {
    LightweightMessageFormatter formatter = LightweightMessageFormatter.withoutSource();
    formatter.setColorize(true);

    assertThat(formatter.formatError(JSError.make(FOO_TYPE)))
        .isEqualTo("\033[31mERROR\033[39m - [TEST_FOO] error description here\n");
  }
}
