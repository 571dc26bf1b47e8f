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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private static final ImmutableList<String> FUNCTIONS =
      ImmutableList.of(
          "function f(x, y) { var unused = 1; if (true) { return x * 2 + y; } return 0; }",
          "function sum(list) { var total = 0;"
              + " for (var i = 0; i < list.length; i++) { total += list[i]; } return total; }",
          "function g() { var x = 1; { h(x); let x = 2; } }",
          "function k() { try { throw 1; } catch (e) { var e = 2; } return e; }",
          "function m(a) { while (a) { a--; } return a; }");

  private CompilerOptions options;

  @Before
  public void setUp() {
    options = new CompilerOptions();
  }

  @Test
  public void testFunctionDeclaration() {
    Result result = compile("function add(a, b) { return a + b; }");

    assertThat(result.success).isTrue();
    assertThat(result.errors).isEmpty();
    assertThat(result.warnings).isEmpty();
    assertThat(result.code).isEqualTo("function add(a,b){return a+b}");
    assertThat(result.sourceMap).isNull();
  }

  @Test
  public void testFoldingKeepsGlobals() {
    Result result = compile("var x = 1 + 2; console.log(x);");

    assertThat(result.success).isTrue();
    assertThat(result.code).isEqualTo("var x=3;console.log(x)");
    assertThat(result.warnings).hasSize(1);
    assertThat(result.warnings.get(0).getType()).isEqualTo(VarCheck.UNRESOLVED_REFERENCE);
  }

  @Test
  public void testDeadBranchRemoved() {
    Result result = compile("if (false) { doSomething(); }");

    assertThat(result.success).isTrue();
    assertThat(result.code).isEmpty();
  }

  @Test
  public void testDeadBranchLeavesNoReference() {
    Result result = compile("if (false) { doSomething(); } other();");

    assertThat(result.success).isTrue();
    assertThat(result.code).isEqualTo("other()");
    assertThat(result.code).doesNotContain("doSomething");
  }

  @Test
  public void testCompilingOutputAgainChangesNothing() {
    for (String js : CodePrinterTest.PROGRAMS) {
      assertIdempotent(js);
    }
    for (String js : FUNCTIONS) {
      assertIdempotent(js);
    }
  }

  @Test
  public void testLongBinaryChain() {
    StringBuilder js = new StringBuilder("x = a");
    StringBuilder expected = new StringBuilder("x=a");
    for (int i = 0; i < 10000; i++) {
      js.append(" + a");
      expected.append("+a");
    }

    Result result = compile(js.toString());

    assertThat(result.success).isTrue();
    assertThat(result.code.replace("\n", "")).isEqualTo(expected.toString());
  }

  @Test
  public void testProgramTooDeepIsReported() {
    int depth = 1_000_000;
    Result result = compile("x = " + Strings.repeat("(", depth) + "a" + Strings.repeat(")", depth));

    assertThat(result.success).isFalse();
    assertThat(result.code).isNull();
    assertThat(result.errors).hasSize(1);
    assertThat(result.errors.get(0).getType()).isEqualTo(Compiler.PROGRAM_TOO_DEEP);
    assertThat(result.errors.get(0).getDescription()).contains("parsing");
  }

  @Test
  public void testParseError() {
    Result result = compile("function( {");

    assertThat(result.success).isFalse();
    assertThat(result.code).isNull();
    assertThat(result.sourceMap).isNull();
    assertThat(result.errors).hasSize(1);
    JSError error = result.errors.get(0);
    assertThat(error.getType()).isEqualTo(Compiler.PARSE_ERROR);
    assertThat(error.getDescription()).isEqualTo("Parse error. 'identifier' expected");
    assertThat(error.getSourceName()).isEqualTo("input.js");
    assertThat(error.getLineno()).isEqualTo(1);
    assertThat(error.getCharno()).isEqualTo(8);
  }

  @Test
  public void testLexErrorIsAParseError() {
    Result result = compile("var s = 'abc");

    assertThat(result.success).isFalse();
    assertThat(result.errors.get(0).getType()).isEqualTo(Compiler.PARSE_ERROR);
    assertThat(result.errors.get(0).getDescription())
        .isEqualTo("Parse error. Unterminated string literal");
  }

  @Test
  public void testLocalsRenamed() {
    Result result =
        compile("function f(longName) { var other = longName * 2; return other + longName; }");

    assertThat(result.code).isEqualTo("function f(a){var b=a*2;return b+a}");
  }

  @Test
  public void testStructureSimplified() {
    Result result = compile("var a = 1; var b = 2; while (a) b();");

    assertThat(result.code).isEqualTo("var a=1,b=2;for(;a;)b()");
  }

  @Test
  public void testWhitespaceOnly() {
    CompilationLevel.WHITESPACE_ONLY.setOptionsForCompilationLevel(options);

    Result result = compile("var x = 1 + 2; // comment\nif (false) { f(x); }");

    assertThat(result.code).isEqualTo("var x=1+2;if(false)f(x)");
  }

  @Test
  public void testCompilationLevelFromString() {
    assertThat(CompilationLevel.fromString("SIMPLE"))
        .isEqualTo(CompilationLevel.SIMPLE_OPTIMIZATIONS);
    assertThat(CompilationLevel.fromString("WHITESPACE_ONLY"))
        .isEqualTo(CompilationLevel.WHITESPACE_ONLY);
    assertThat(CompilationLevel.fromString("ADVANCED")).isNull();
    assertThat(CompilationLevel.fromString(null)).isNull();
  }

  @Test
  public void testPrettyOutput() {
    options.setOutputMode(CompilerOptions.OutputMode.PRETTY);

    Result result = compile("function add(a, b) { return a + b; }");

    assertThat(result.code).isEqualTo("function add(a, b) {\n  return a + b;\n}\n");
  }

  @Test
  public void testSourceMap() {
    options.setSourceMapOutput(true);
    options.setSourceName("lib.js");

    Result result =
        compile(
            "function f(longName) {\n"
                + "  var other = longName * 2;\n"
                + "  return other + longName;\n"
                + "}");

    assertThat(result.sourceMap).isNotNull();
    JsonObject map = JsonParser.parseString(result.sourceMap).getAsJsonObject();
    assertThat(map.get("version").getAsInt()).isEqualTo(3);
    assertThat(map.get("lineCount").getAsInt()).isEqualTo(1);
    assertThat(map.get("sources").toString()).isEqualTo("[\"lib.js\"]");
    assertThat(map.get("names").toString()).isEqualTo("[\"longName\",\"other\"]");
    assertThat(map.get("mappings").getAsString()).startsWith("AAAA");
    assertThat(map.get("mappings").getAsString()).doesNotContain(";");
  }

  @Test
  public void testSourceNameInDiagnostics() {
    options.setSourceName("lib.js");

    Result result = compile("undeclared;");

    assertThat(result.warnings.get(0).getSourceName()).isEqualTo("lib.js");
  }

  @Test
  public void testPassesCanBeTurnedOff() {
    options.setMangleNames(false);
    assertThat(compile("function f(longName) { return longName; }").code)
        .isEqualTo("function f(longName){return longName}");

    options.setFoldConstants(false);
    assertThat(compile("var x = 1 + 2;").code).isEqualTo("var x=1+2");

    options.setRemoveDeadCode(false);
    assertThat(compile("if (false) { f(); }").code).isEqualTo("if(!1)f()");

    options.setSimplifyStructure(false);
    assertThat(compile("var a = 1; var b = 2;").code).isEqualTo("var a=1;var b=2");
  }

  @Test
  public void testColorizedOutputStillCompiles() {
    options.setColorizeErrorOutput(true);

    Result result = compile("undeclared;");

    assertThat(options.shouldColorizeErrorOutput()).isTrue();
    assertThat(result.success).isTrue();
    assertThat(result.warnings).hasSize(1);
  }

  @Test
  public void testInternalCompilerErrorNamesPhase() {
    IllegalStateException cause = new IllegalStateException("broken");
    InternalCompilerError error = new InternalCompilerError("renameVars", cause);

    assertThat(error.getPhase()).isEqualTo("renameVars");
    assertThat(error).hasCauseThat().isSameInstanceAs(cause);
    assertThat(error).hasMessageThat().contains("renameVars");
  }

  @Test
  public void testCompilesOnlyOnce() {
    Compiler compiler = new Compiler();
    compiler.compile("var a;", options);

    assertThrows(IllegalStateException.class, () -> compiler.compile("var b;", options));
  }

  @Test
  public void testSourceExcerpt() {
    Compiler compiler = new Compiler();
    compiler.compile("var a;\nfunction( {", options);

    assertThat(compiler.getSourceLine("input.js", 2)).isEqualTo("function( {");
    assertThat(compiler.getSourceLine("input.js", 3)).isNull();
    assertThat(compiler.getSourceLine("other.js", 1)).isNull();
    assertThat(compiler.getErrors()).hasSize(1);
    assertThat(compiler.getErrors().get(0).getLineno()).isEqualTo(2);
  }

  private void assertIdempotent(String js) {
    Result once = compile(js);
    assertWithMessage(js).that(once.success).isTrue();
    assertWithMessage(js).that(compile(once.code).code).isEqualTo(once.code);
  }

  private Result compile(String source) {
    return new Compiler().compile(source, options);
  }
}
