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
import static com.google.common.truth.Truth.assertWithMessage;

import org.jscompiler.ir.Node;
import org.jscompiler.parsing.ParseException;
import org.jscompiler.parsing.Parser;
import org.junit.Before;

/**
 * Base class for testing compiler passes. A test parses its input, runs the pass returned by
 * {@link #getProcessor} over it and compares the result against the parse of the expected code.
 */
public abstract class CompilerTestCase {

  private int numRepetitions;
  private Compiler lastCompiler;

  /** Gets the pass under test. */
  protected abstract CompilerPass getProcessor(Compiler compiler);

  @Before
  public void setUp() throws Exception {
    numRepetitions = 2;
    lastCompiler = null;
  }

  /** Returns the options used to create the compiler. */
  protected CompilerOptions getOptions() {
    return new CompilerOptions();
  }

  /**
   * Sets how many times the pass runs over its input. Running a pass a second time must not change
   * the result.
   */
  protected final void setNumRepetitions(int numRepetitions) {
    this.numRepetitions = numRepetitions;
  }

  protected final Compiler getLastCompiler() {
    return lastCompiler;
  }

  /** Parses {@code js}, failing the test if it is not valid. */
  protected static Node parse(String js) {
    try {
      return new Parser(js).parse();
    } catch (ParseException e) {
      throw new AssertionError("Unexpected parse error in <" + js + ">: " + e.getMessage(), e);
    }
  }

  /** Verifies that the pass turns {@code js} into {@code expected} without reporting anything. */
  protected void test(String js, String expected) {
    Node root = process(js);
    assertThat(lastCompiler.getErrors()).isEmpty();
    assertThat(lastCompiler.getWarnings()).isEmpty();
    assertEquivalent(parse(expected), root);
  }

  /** Verifies that the pass leaves {@code js} unchanged. */
  protected void testSame(String js) {
    test(js, js);
  }

  /** Verifies that the pass reports exactly one warning, of the given type. */
  protected void testWarning(String js, DiagnosticType warning) {
    process(js);
    assertThat(lastCompiler.getErrors()).isEmpty();
    assertWithMessage("Expected exactly one warning")
        .that(lastCompiler.getWarnings())
        .hasSize(1);
    assertThat(lastCompiler.getWarnings().get(0).getType()).isEqualTo(warning);
  }

  /** Verifies that the pass reports exactly one error, of the given type. */
  protected void testError(String js, DiagnosticType error) {
    process(js);
    assertWithMessage("Expected exactly one error").that(lastCompiler.getErrors()).hasSize(1);
    assertThat(lastCompiler.getErrors().get(0).getType()).isEqualTo(error);
  }

  /** Runs the pass over the parse of {@code js} and returns the resulting AST. */
  protected final Node process(String js) {
    Node root = parse(js);
    lastCompiler = new Compiler();
    lastCompiler.initOptions(getOptions());
    for (int i = 0; i < numRepetitions; i++) {
      getProcessor(lastCompiler).process(root);
    }
    return root;
  }

  private static void assertEquivalent(Node expected, Node actual) {
    if (!expected.isEquivalentTo(actual)) {
      assertWithMessage(
              "Unexpected AST.\nExpected:\n%s\nResult:\n%s",
              expected.toStringTree(),
              actual.toStringTree())
          .fail();
    }
  }
}
