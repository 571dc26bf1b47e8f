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

import java.util.ArrayList;
import java.util.List;
import org.jscompiler.ir.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeCreatorTest {

  private Compiler compiler;

  @Before
  public void setUp() {
    compiler = new Compiler();
    compiler.initOptions(new CompilerOptions());
  }

  @Test
  public void testFunctionScope() {
    Scope global = createScopes("var a; function f(b) { var c; let d; }");

    assertThat(names(global)).containsExactly("a", "f").inOrder();
    assertThat(global.getKind()).isEqualTo(Scope.Kind.GLOBAL);
    assertThat(global.getChildren()).hasSize(1);

    Scope fn = global.getChildren().get(0);
    assertThat(fn.getKind()).isEqualTo(Scope.Kind.FUNCTION);
    assertThat(fn.getParent()).isSameInstanceAs(global);
    assertThat(fn.getDepth()).isEqualTo(1);
    assertThat(names(fn)).containsExactly("b", "arguments", "c", "d").inOrder();
    assertThat(fn.getOwnSlot("b").isParam()).isTrue();
    assertThat(fn.getOwnSlot("d").isLet()).isTrue();
    assertThat(fn.getOwnSlot("arguments").isArguments()).isTrue();
  }

  @Test
  public void testNamesAreBound() {
    Node root = parse("var x = 1; x; x = 2;");
    Scope global = new ScopeCreator(compiler).createScopes(root);

    Var x = global.getVar("x");
    List<Node> nodes = findNames(root, "x");
    assertThat(nodes).hasSize(3);
    for (Node n : nodes) {
      assertThat(n.getSlot()).isSameInstanceAs(x);
    }
    assertThat(x.getNameNode()).isSameInstanceAs(nodes.get(0));
    assertThat(x.getReferences()).containsExactly(nodes.get(1), nodes.get(2)).inOrder();
    assertThat(x.isGlobal()).isTrue();
  }

  @Test
  public void testRedeclarationIsAReference() {
    Scope global = createScopes("var a = 1; var a = 2;");

    assertThat(global.getVarCount()).isEqualTo(1);
    assertThat(global.getVar("a").getReferenceCount()).isEqualTo(1);
  }

  @Test
  public void testBlockScope() {
    Node root = parse("let a = 1; { let a = 2; f(a); } f(a);");
    Scope global = new ScopeCreator(compiler).createScopes(root);

    Scope block = global.getChildren().get(0);
    assertThat(block.getKind()).isEqualTo(Scope.Kind.BLOCK);
    assertThat(block.getClosestHoistScope()).isSameInstanceAs(global);

    List<Node> refs = findNames(root, "a");
    assertThat(refs.get(2).getSlot()).isSameInstanceAs(block.getOwnSlot("a"));
    assertThat(refs.get(3).getSlot()).isSameInstanceAs(global.getOwnSlot("a"));
  }

  @Test
  public void testVarIsHoistedOutOfBlocks() {
    Scope global = createScopes("function f() { { var v = 1; } return v; }");

    Scope fn = global.getChildren().get(0);
    Scope block = fn.getChildren().get(0);
    Var v = fn.getOwnSlot("v");
    assertThat(v).isNotNull();
    assertThat(block.hasOwnSlot("v")).isFalse();
    assertThat(block.getOuterReferences()).contains(v);
    assertThat(v.getReferenceCount()).isEqualTo(1);
  }

  @Test
  public void testOuterReferences() {
    Scope global = createScopes("var a; function f() { return function () { return a; }; }");

    Var a = global.getVar("a");
    Scope outer = global.getChildren().get(0);
    Scope inner = outer.getChildren().get(0);
    assertThat(inner.getOuterReferences()).containsExactly(a);
    assertThat(outer.getOuterReferences()).containsExactly(a);
    assertThat(global.getOuterReferences()).isEmpty();
  }

  @Test
  public void testFreeReferences() {
    Node root = parse("function f() { return g; } g;");
    Scope global = new ScopeCreator(compiler).createScopes(root);

    assertThat(global.getFreeReferences().keySet()).containsExactly("g");
    assertThat(global.getFreeReferences().get("g")).hasSize(2);
    assertThat(global.getChildren().get(0).getFreeNames()).containsExactly("g");
    for (Node n : findNames(root, "g")) {
      assertThat(n.getSlot()).isNull();
    }
  }

  @Test
  public void testEarlyReference() {
    Scope global = createScopes("f(x); let x = 1;");

    assertThat(global.getEarlyReferences()).hasSize(1);
    assertThat(global.getEarlyReferences().get(0).getString()).isEqualTo("x");
    assertThat(global.getOwnSlot("x").getReferenceCount()).isEqualTo(0);
  }

  @Test
  public void testEarlyReferencePinsBothBindings() {
    Node root = parse("function f() { var x = 1; { g(x); let x = 2; } var y; }");
    Scope global = new ScopeCreator(compiler).createScopes(root);

    Scope fn = global.getChildren().get(0);
    Var outer = fn.getOwnSlot("x");
    Var inner = fn.getChildren().get(0).getOwnSlot("x");
    assertThat(findNames(root, "x").get(1).getSlot()).isSameInstanceAs(outer);
    assertThat(outer.isPinned()).isTrue();
    assertThat(inner.isPinned()).isTrue();
    assertThat(inner.getReferenceCount()).isEqualTo(0);
    assertThat(fn.getOwnSlot("y").isPinned()).isFalse();
  }

  @Test
  public void testVarRedeclaringCatchParameterIsPinned() {
    Scope global = createScopes("function f() { try {} catch (e) { var e = 2; } return e; }");

    Scope fn = global.getChildren().get(0);
    assertThat(fn.getOwnSlot("e").isPinned()).isTrue();
    Var parameter = null;
    for (Scope child : fn.getChildren()) {
      if (parameter == null) {
        parameter = findVar(child, "e");
      }
    }
    assertThat(parameter.isCatch()).isTrue();
    assertThat(parameter.isPinned()).isTrue();
  }

  @Test
  public void testReferenceFromFunctionIsNotEarly() {
    Scope global = createScopes("function g() { return x; } let x = 1;");

    assertThat(global.getEarlyReferences()).isEmpty();
    assertThat(global.getOwnSlot("x").getReferenceCount()).isEqualTo(1);
  }

  @Test
  public void testEvalAndWithAreMarked() {
    Scope global = createScopes("function f() { eval('x'); } function g(o) { with (o) { y; } }"
        + " function h() {}");

    assertThat(global.containsEvalOrWith()).isTrue();
    assertThat(global.getChildren().get(0).containsEvalOrWith()).isTrue();
    assertThat(global.getChildren().get(1).containsEvalOrWith()).isTrue();
    assertThat(global.getChildren().get(2).containsEvalOrWith()).isFalse();
  }

  @Test
  public void testShadowedEvalIsNotMarked() {
    Scope global = createScopes("function f(eval) { eval('x'); }");

    assertThat(global.containsEvalOrWith()).isFalse();
  }

  @Test
  public void testCatchScope() {
    Scope global = createScopes("try {} catch (e) { e; }");

    Var e = findVar(global, "e");
    assertThat(e.isCatch()).isTrue();
    assertThat(e.getReferenceCount()).isEqualTo(1);
    assertThat(global.hasOwnSlot("e")).isFalse();
  }

  @Test
  public void testFunctionExpressionName() {
    Scope global = createScopes("var f = function g() { return g; };");

    assertThat(global.hasOwnSlot("g")).isFalse();
    Scope fn = global.getChildren().get(0);
    assertThat(fn.getOwnSlot("g").getKind()).isEqualTo(Var.Kind.FUNCTION);
    assertThat(fn.getOwnSlot("g").getReferenceCount()).isEqualTo(1);
  }

  @Test
  public void testRescanReplacesBindings() {
    Node root = parse("var a; a;");
    ScopeCreator creator = new ScopeCreator(compiler);
    Scope first = creator.createScopes(root);
    Scope second = creator.createScopes(root);

    assertThat(second).isNotSameInstanceAs(first);
    Node ref = findNames(root, "a").get(1);
    assertThat(ref.getSlot()).isSameInstanceAs(second.getVar("a"));
    assertThat(second.getVar("a").getReferenceCount()).isEqualTo(1);
  }

  private Scope createScopes(String js) {
    return new ScopeCreator(compiler).createScopes(parse(js));
  }

  private static Node parse(String js) {
    return CompilerTestCase.parse(js);
  }

  private static List<String> names(Scope scope) {
    List<String> names = new ArrayList<>();
    for (Var v : scope.getVarIterable()) {
      names.add(v.getName());
    }
    return names;
  }

  /** Finds the variable named {@code name} declared in {@code scope} or a nested scope. */
  private static Var findVar(Scope scope, String name) {
    Var var = scope.getOwnSlot(name);
    if (var != null) {
      return var;
    }
    for (Scope child : scope.getChildren()) {
      var = findVar(child, name);
      if (var != null) {
        return var;
      }
    }
    return null;
  }

  /** The NAME nodes named {@code name} in source order. */
  private static List<Node> findNames(Node root, String name) {
    List<Node> result = new ArrayList<>();
    collectNames(root, name, result);
    return result;
  }

  private static void collectNames(Node n, String name, List<Node> result) {
    if (n.isName() && n.getString().equals(name)) {
      result.add(n);
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      collectNames(c, name, result);
    }
  }
}
