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

import com.google.common.collect.ImmutableList;
import org.jscompiler.ir.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  /** Programs covering the grammar, shared with the compiler tests. */
  static final ImmutableList<String> PROGRAMS =
      ImmutableList.of(
          "var a = 1, b = [1, , 3,], c = {x: 1, 'y z': 2, get w() { return 1; }};",
          "for (var i = 0; i < n; i++) { if (i % 2) continue; f(i); }",
          "do x++; while (x < 10);",
          "try { f(); } catch (e) { g(e); } finally { h(); }",
          "switch (x) { case 1: a(); break; default: b(); }",
          "label: for (;;) { break label; }",
          "x = a ? b : c, y = typeof z, delete o.p, void 0;",
          "new Foo(1).bar;",
          "a = b ** -c; d = (-e) ** 2;",
          "if (a) { if (b) c(); } else d();",
          "x = /re/g.test(s) / 2;",
          "s = 'it\\'s' + \"say \\\"hi\\\"\";",
          "(function () { return this; })();",
          "({}).toString();",
          "for (var k in o) if (k in p) delete o[k];",
          "while (x) ;",
          "let y = 1; { const z = y; }",
          "a: { break a; }",
          "throw new Error('x');",
          "x = a - -b + +c - --d;",
          "var f = function g() {}, h = function () {};",
          "x = (a, b) + (c = d);",
          "x = a || b && c | d ^ e & f == g < h << i + j * k;");

  @Test
  public void testFunction() {
    assertPrint("function add(a, b) { return a + b; }", "function add(a,b){return a+b}");
  }

  @Test
  public void testStatementsAreSeparated() {
    assertPrint("var x = 1 + 2; console.log(x);", "var x=1+2;console.log(x)");
    assertPrint("a(); b();", "a();b()");
  }

  @Test
  public void testIfElse() {
    assertPrint("if (a) b(); else c();", "if(a)b();else c()");
    assertPrint("if (a) { if (b) c(); } else d();", "if(a){if(b)c()}else d()");
  }

  @Test
  public void testEmptyBodies() {
    assertPrint("while (x);", "while(x);");
    assertPrint("for (;;) {}", "for(;;);");
  }

  @Test
  public void testParenthesesFromPrecedence() {
    assertPrint("x = (a + b) * c;", "x=(a+b)*c");
    assertPrint("x = a + (b + c);", "x=a+(b+c)");
    assertPrint("x = ((a) * (b));", "x=a*b");
    assertPrint("x = (-a) ** 2;", "x=(-a)**2");
  }

  @Test
  public void testStatementStartDisambiguation() {
    assertPrint("({a: 1});", "({a:1})");
    assertPrint("(function () {})();", "(function(){})()");
  }

  @Test
  public void testSpacing() {
    assertPrint("x = a - -b + +c - --d;", "x=a- -b+ +c- --d");
    assertPrint("x = a++ + b;", "x=a++ +b");
    assertPrint("x = typeof y;", "x=typeof y");
    assertPrint("x = a / /b/;", "x=a/ /b/");
    assertPrint("for (x in y) z();", "for(x in y)z()");
  }

  @Test
  public void testNumbers() {
    assertPrint("x = 100;", "x=100");
    assertPrint("x = 1000;", "x=1E3");
    assertPrint("x = 0.5;", "x=.5");
    assertPrint("x = 1.5;", "x=1.5");
    assertPrint("x = 1e21;", "x=1E21");
  }

  @Test
  public void testStrings() {
    assertPrint("x = 'it\\'s';", "x=\"it's\"");
    assertPrint("x = \"say \\\"hi\\\"\";", "x='say \"hi\"'");
    assertPrint("x = 'a\\nb\\u0001';", "x=\"a\\nb\\u0001\"");
    assertPrint("x = '</script>';", "x=\"\\x3c/script>\"");
  }

  @Test
  public void testPrettyPrint() {
    assertPrettyPrint("var x = 1 + 2; console.log(x);", "var x = 1 + 2;\nconsole.log(x);\n");
    assertPrettyPrint(
        "function add(a, b) { return a + b; }", "function add(a, b) {\n  return a + b;\n}\n");
    assertPrettyPrint("if (a) b();", "if (a) {\n  b();\n}\n");
    assertPrettyPrint(
        "if (a) b(); else c();", "if (a) {\n  b();\n} else {\n  c();\n}\n");
  }

  @Test
  public void testCompactRoundTrip() {
    for (String js : PROGRAMS) {
      assertRoundTrip(js, new CodePrinter.Builder(parse(js)).build());
    }
  }

  @Test
  public void testPrettyRoundTrip() {
    for (String js : PROGRAMS) {
      assertRoundTrip(js, new CodePrinter.Builder(parse(js)).setPrettyPrint(true).build());
    }
  }

  @Test
  public void testLongLinesAreCut() {
    CompilerOptions options = new CompilerOptions();
    options.setLineLengthThreshold(10);
    String js = "var alpha = 1; var beta = alpha + 2; call(alpha, beta, alpha * beta);";

    String code = new CodePrinter.Builder(parse(js)).setCompilerOptions(options).build();

    assertThat(code).contains("\n");
    assertRoundTrip(js, code);
  }

  private static Node parse(String js) {
    return CompilerTestCase.parse(js);
  }

  private static void assertPrint(String js, String expected) {
    assertThat(new CodePrinter.Builder(parse(js)).build()).isEqualTo(expected);
  }

  private static void assertPrettyPrint(String js, String expected) {
    assertThat(new CodePrinter.Builder(parse(js)).setPrettyPrint(true).build())
        .isEqualTo(expected);
  }

  private static void assertRoundTrip(String js, String code) {
    Node original = parse(js);
    Node reparsed = parse(code);
    assertWithMessage("%s printed as %s", js, code)
        .that(reparsed.isEquivalentTo(original))
        .isTrue();
  }
}
