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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RemoveDeadCodeTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RemoveDeadCode(compiler);
  }

  @Test
  public void testFoldIf() {
    test("if (false) { doSomething(); }", "");
    test("if (0) { a(); } else { b(); }", "{ b(); }");
    test("if (true) { a(); } else { b(); }", "{ a(); }");
    test("if (1) { a(); }", "{ a(); }");
    testSame("if (x) { a(); }");
    testSame("if (f()) { a(); }");
  }

  @Test
  public void testFoldIfKeepsHoistedVars() {
    test("if (false) { var x = 1; }", "var x;");
    test(
        "function f() { if (false) { var x = 1; } return x; }",
        "function f() { var x; return x; }");
  }

  @Test
  public void testFoldHook() {
    test("x = true ? a : b;", "x = a;");
    test("x = null ? a : b;", "x = b;");
    testSame("x = y ? a : b;");
  }

  @Test
  public void testRemoveLoops() {
    test("while (false) { foo(); }", "");
    test("for (; false;) { foo(); }", "");
    test("a: while (false) { foo(); }", "");
    testSame("for (i = 0; false;) { foo(); }");
    testSame("do { foo(); } while (false);");
    testSame("while (x) { foo(); }");
  }

  @Test
  public void testRemoveUselessExpressions() {
    test("0; foo();", "foo();");
    test("[1, 2]; !1; foo();", "foo();");
    test("(function() {}); foo();", "foo();");
    test("foo();;", "foo();");
    testSame("'use strict'; foo();");
    testSame("x;");
  }

  @Test
  public void testUnreachableCode() {
    test("function f() { return 1; foo(); }", "function f() { return 1; }");
    test("function f() { throw e; foo(); }", "function f() { throw e; }");
    test(
        "for (;;) { if (x) { break; foo(); } }",
        "for (;;) { if (x) { break; } }");
    test(
        "switch (x) { case 1: break; foo(); default: bar(); }",
        "switch (x) { case 1: break; default: bar(); }");
    testSame("function f() { try { return; } finally { g(); } }");
  }

  @Test
  public void testUnreachableVarIsRedeclared() {
    test(
        "function f() { return x; var x = 1; }",
        "function f() { var x; return x; }");
  }

  @Test
  public void testStatementsAfterBlockEndingInJump() {
    test(
        "function f() { if (true) { return 1; } return 0; }",
        "function f() { { return 1; } }");
    testSame("function f() { { g(); } return 0; }");
  }

  @Test
  public void testUnreachableFunctionAndLetKept() {
    testSame("function f() { return g(); function g() { return 1; } }");
    testSame("function f() { return function() { return x; }; let x = 1; }");
  }

  @Test
  public void testRemoveUnusedLocals() {
    test(
        "function f() { var x = 1; var y = 2; return x; }",
        "function f() { var x = 1; return x; }");
    test("function f() { var a = 1, b = 2; return b; }", "function f() { var b = 2; return b; }");
    test("function f(a) { var b = a; }", "function f(a) {}");
    test("function f() { var a = 1; var b = a; }", "function f() {}");
    test("function f() { function g() {} }", "function f() {}");
    test("function f() { let x = 1; const y = 2; }", "function f() {}");
  }

  @Test
  public void testKeepUsedOrImpureLocals() {
    testSame("function f() { var x = g(); }");
    testSame("function f(a, b) { return a; }");
    testSame("function f() { try { g(); } catch (e) {} }");
    testSame("function f() { for (var k in o) {} }");
    testSame("x = function g() {};");
  }

  @Test
  public void testKeepDeclarationsReferencedEarly() {
    testSame("function f() { var x = 1; { g(x); let x = 2; } }");
    testSame("function f() { g(x); const x = 2; }");
  }

  @Test
  public void testKeepInitializerReadingUndeclaredName() {
    testSame("function f() { var u = undeclared; }");
    testSame("function f() { var u = 1 + undeclared; }");
    test("function f() { var u = typeof undeclared; }", "function f() {}");
    test("function f() { var u = function() { return undeclared; }; }", "function f() {}");
  }

  @Test
  public void testKeepGlobals() {
    testSame("var x = 1;");
    testSame("function f() {}");
    testSame("let y = 2;");
  }

  @Test
  public void testKeepLocalsWithEval() {
    testSame("function f() { var x = 1; eval('x'); }");
    testSame("function f() { var x = 1; with (o) { g(); } }");
  }
}
