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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static final class TestSlot implements StaticSlot {
    String name;

    TestSlot(String name) {
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public @Nullable Node getDeclarationNode() {
      return null;
    }
  }

  @Test
  public void testAddChildren() {
    Node block = IR.block();
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    block.addChildToBack(b);
    block.addChildToFront(a);
    block.addChildToBack(c);

    assertThat(block.getChildCount()).isEqualTo(3);
    assertThat(block.getFirstChild()).isSameInstanceAs(a);
    assertThat(block.getSecondChild()).isSameInstanceAs(b);
    assertThat(block.getLastChild()).isSameInstanceAs(c);
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(a.getPrevious()).isNull();
    assertThat(c.getNext()).isNull();
    assertThat(block.children()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void testCannotAddOwnedChild() {
    Node a = IR.name("a");
    IR.exprResult(a);
    assertThrows(IllegalArgumentException.class, () -> IR.block().addChildToBack(a));
  }

  @Test
  public void testInsertBeforeAndAfter() {
    Node b = IR.name("b");
    Node block = IR.block(IR.exprResult(b));
    Node first = b.getParent();
    Node before = IR.exprResult(IR.name("a"));
    Node after = IR.exprResult(IR.name("c"));
    before.insertBefore(first);
    after.insertAfter(first);

    assertThat(block.getChildCount()).isEqualTo(3);
    assertThat(block.getFirstChild()).isSameInstanceAs(before);
    assertThat(block.getLastChild()).isSameInstanceAs(after);
    assertThat(after.getPrevious()).isSameInstanceAs(first);
  }

  @Test
  public void testDetachAndReplace() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node comma = IR.comma(IR.comma(a, b), c);
    Node inner = comma.getFirstChild();

    inner.detach();
    assertThat(inner.getParent()).isNull();
    assertThat(comma.getChildCount()).isEqualTo(1);
    assertThat(comma.getFirstChild()).isSameInstanceAs(c);

    Node d = IR.name("d");
    c.setLinenoCharno(3, 4);
    c.replaceWith(d);
    assertThat(comma.getOnlyChild()).isSameInstanceAs(d);
    assertThat(c.getParent()).isNull();
    assertThat(d.getLineno()).isEqualTo(3);
    assertThat(d.getCharno()).isEqualTo(4);
  }

  @Test
  public void testRemoveChildren() {
    Node block = IR.block();
    block.addChildToBack(IR.empty());
    block.addChildToBack(IR.empty());
    Node removed = block.removeChildren();

    assertThat(block.hasChildren()).isFalse();
    Node other = IR.block();
    other.addChildrenToBack(removed);
    assertThat(other.getChildCount()).isEqualTo(2);
  }

  @Test
  public void testNumbers() {
    assertThat(IR.number(1.5).getDouble()).isEqualTo(1.5);
    assertThrows(IllegalArgumentException.class, () -> IR.number(-1));
    assertThrows(IllegalArgumentException.class, () -> IR.number(-0.0));
    assertThrows(IllegalStateException.class, () -> IR.name("x").getDouble());
  }

  @Test
  public void testEquivalenceIgnoresPositionsAndParens() {
    Node a = IR.exprResult(IR.name("x")).setLinenoCharno(1, 0);
    Node b = IR.exprResult(IR.name("x")).setLinenoCharno(7, 3);
    b.getFirstChild().setIsParenthesized(true);
    assertThat(a.isEquivalentTo(b)).isTrue();
  }

  @Test
  public void testEquivalenceComparesValues() {
    assertThat(IR.name("x").isEquivalentTo(IR.name("y"))).isFalse();
    assertThat(IR.number(1).isEquivalentTo(IR.number(2))).isFalse();
    assertThat(IR.string("a").isEquivalentTo(IR.name("a"))).isFalse();
    assertThat(IR.block(IR.empty()).isEquivalentTo(IR.block())).isFalse();

    Node quoted = Node.newString(Token.STRING_KEY, "a");
    quoted.setQuotedString();
    assertThat(quoted.isEquivalentTo(Node.newString(Token.STRING_KEY, "a"))).isFalse();

    Node postfix = new Node(Token.INC, IR.name("i"));
    postfix.setPostfix(true);
    Node prefix = new Node(Token.INC, IR.name("i"));
    assertThat(postfix.isEquivalentTo(prefix)).isFalse();
  }

  @Test
  public void testBoundNameReadsItsSlot() {
    TestSlot slot = new TestSlot("foo");
    Node name = IR.name("foo");
    name.setSlot(slot);
    slot.name = "a";
    assertThat(name.getString()).isEqualTo("a");
    assertThat(name.isEquivalentTo(IR.name("a"))).isTrue();
    assertThrows(IllegalStateException.class, () -> name.setString("b"));

    name.setSlot(null);
    assertThat(name.getString()).isEqualTo("a");
    name.setString("b");
    assertThat(name.getString()).isEqualTo("b");
  }

  @Test
  public void testOnlyNamesCanBeBound() {
    assertThrows(IllegalStateException.class, () -> IR.string("s").setSlot(new TestSlot("s")));
  }

  @Test
  public void testCloneTree() {
    Node original = IR.exprResult(IR.comma(IR.name("a"), IR.number(2)));
    original.setLinenoCharno(2, 5);
    Node clone = original.cloneTree();

    assertThat(clone).isNotSameInstanceAs(original);
    assertThat(clone.isEquivalentTo(original)).isTrue();
    assertThat(clone.getParent()).isNull();
    assertThat(clone.getLineno()).isEqualTo(2);
    assertThat(clone.getFirstChild()).isNotSameInstanceAs(original.getFirstChild());
  }

  @Test
  public void testSrcrefTree() {
    Node source = IR.name("x").setLinenoCharno(4, 2);
    Node tree = IR.not(IR.number(0)).srcrefTree(source);
    assertThat(tree.getLineno()).isEqualTo(4);
    assertThat(tree.getFirstChild().getCharno()).isEqualTo(2);
  }

  @Test
  public void testToString() {
    Node name = IR.name("x").setLinenoCharno(1, 2);
    assertThat(name.toString()).isEqualTo("NAME x 1:2");
    assertThat(IR.number(3).toString()).isEqualTo("NUMBER 3.0");
    assertThat(IR.exprResult(IR.name("y")).toStringTree())
        .isEqualTo("EXPR_RESULT\n    NAME y\n");
  }

  @Test
  public void testMayBeStatementOrExpression() {
    assertThat(IR.mayBeStatement(IR.returnNode())).isTrue();
    assertThat(IR.mayBeExpression(IR.returnNode())).isFalse();
    assertThat(IR.mayBeExpression(IR.name("x"))).isTrue();
  }
}
