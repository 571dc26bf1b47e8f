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
public final class VarCheckTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new VarCheck(compiler);
  }

  @Test
  public void testDeclaredNames() {
    testSame("var a = 1; function f(b) { return a + b + arguments.length; }");
    testSame("let x = 1; { const y = x; }");
    testSame("try {} catch (e) { e; }");
  }

  @Test
  public void testUndeclaredName() {
    testWarning("x = 1;", VarCheck.UNRESOLVED_REFERENCE);
    testWarning("function f() { return y; }", VarCheck.UNRESOLVED_REFERENCE);
  }

  @Test
  public void testUndeclaredNameReportedOnce() {
    testWarning("x; x; function f() { x; }", VarCheck.UNRESOLVED_REFERENCE);
    assertThat(getLastCompiler().getWarnings().get(0).getDescription())
        .isEqualTo("variable x is undeclared");
    assertThat(getLastCompiler().getWarnings().get(0).getLineno()).isEqualTo(1);
    assertThat(getLastCompiler().getWarnings().get(0).getCharno()).isEqualTo(0);
  }

  @Test
  public void testHoistedDeclarationsAreNotEarly() {
    testSame("f(); function f() {}");
    testSame("v; var v;");
    testSame("function g() { return x; } let x = 1;");
  }

  @Test
  public void testEarlyReferenceInSameFunction() {
    setNumRepetitions(1);
    process("x; let x = 1;");
    assertThat(getLastCompiler().getWarnings()).hasSize(2);
    assertThat(getLastCompiler().getWarnings().get(0).getType())
        .isEqualTo(VarCheck.EARLY_REFERENCE);
    assertThat(getLastCompiler().getWarnings().get(0).getDescription())
        .isEqualTo("Variable referenced before declaration: x");
  }

  @Test
  public void testWarningCanBeSilenced() {
    CompilerOptions options = new CompilerOptions();
    options.setWarningLevel(VarCheck.UNRESOLVED_REFERENCE, CheckLevel.OFF);
    Compiler compiler = new Compiler();
    Result result = compiler.compile("console.log(1);", options);
    assertThat(result.warnings).isEmpty();
    assertThat(result.success).isTrue();
  }
}
