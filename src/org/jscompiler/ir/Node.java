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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.Serializable;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked sibling list. The {@code previous} pointer of the first
 * child points at the last child, which makes appending constant time.
 */
public class Node implements Serializable {
  private static final long serialVersionUID = 1L;

  private Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private int lineno = -1;
  private int charno = -1;

  private @Nullable String str;
  private double number;
  private transient @Nullable StaticSlot slot;
  private @Nullable String originalName;

  private boolean quoted;
  private boolean parenthesized;
  private boolean postfix;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node mid2, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(mid2);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    checkArgument(!(number < 0) && !isNegativeZero(number), "negative number literal: %s", number);
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.str = checkNotNull(str);
    return n;
  }

  private static boolean isNegativeZero(double d) {
    return d == 0 && 1 / d < 0;
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "not exactly one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first == null ? null : first.previous;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  /** Returns the previous sibling, or null for the first child. */
  public final @Nullable Node getPrevious() {
    return (parent == null || this == parent.first) ? null : previous;
  }

  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0, "negative index %s", i);
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "index out of range");
      n = n.next;
      i--;
    }
    checkArgument(n != null, "index out of range");
    return n;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Appends a detached sibling chain, as returned by {@link #removeChildren}. */
  public final void addChildrenToBack(@Nullable Node children) {
    for (Node child = children; child != null; ) {
      Node nextChild = child.next;
      child.next = null;
      child.previous = null;
      child.parent = null;
      addChildToBack(child);
      child = nextChild;
    }
  }

  /** Inserts this detached node as the next sibling of {@code existing}. */
  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingNext = existing.next;
    this.parent = existingParent;
    existing.next = this;
    this.previous = existing;
    if (existingNext == null) {
      existingParent.first.previous = this;
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  /** Inserts this detached node as the previous sibling of {@code existing}. */
  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingPrevious = existing.previous;
    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;
    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Puts {@code replacement} where this node is and detaches this node. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();
    if (replacement.lineno == -1) {
      replacement.lineno = lineno;
      replacement.charno = charno;
    }
    replacement.insertBefore(this);
    detach();
  }

  @CanIgnoreReturnValue
  public final Node detach() {
    checkNotNull(parent, "node has no parent: %s", this);
    Node p = parent;
    Node last = p.first.previous;
    if (this == p.first) {
      p.first = next;
      if (next != null) {
        next.previous = last;
      }
    } else {
      previous.next = next;
      if (next == null) {
        p.first.previous = previous;
      } else {
        next.previous = previous;
      }
    }
    parent = null;
    next = null;
    previous = null;
    return this;
  }

  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  /** Detaches all children and returns them as a parentless sibling chain. */
  public final @Nullable Node removeChildren() {
    Node children = first;
    for (Node child = first; child != null; child = child.next) {
      child.parent = null;
    }
    if (children != null) {
      children.previous = null;
    }
    first = null;
    return children;
  }

  public final void detachChildren() {
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      child = nextChild;
    }
    first = null;
  }

  public final void checkAttached() {
    checkState(parent != null, "node is not attached: %s", this);
  }

  public final void checkDetached() {
    checkState(parent == null && next == null && previous == null, "node is attached: %s", this);
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number node", token);
    return number;
  }

  /** Returns the string of this node. A bound NAME reports the current name of its slot. */
  public final String getString() {
    if (slot != null) {
      return slot.getName();
    }
    checkState(str != null, "%s has no string", token);
    return str;
  }

  public final void setString(String str) {
    checkState(slot == null, "cannot set the string of a bound name");
    this.str = checkNotNull(str);
  }

  public final @Nullable StaticSlot getSlot() {
    return slot;
  }

  /**
   * Binds this NAME to {@code slot}, or unbinds it when {@code slot} is null. The current name is
   * kept as the node's own string so that an unbound node still prints.
   */
  public final void setSlot(@Nullable StaticSlot slot) {
    checkState(token == Token.NAME, "only names can be bound: %s", token);
    this.str = getString();
    this.slot = slot;
  }

  public final @Nullable String getOriginalName() {
    return originalName;
  }

  public final void setOriginalName(String originalName) {
    this.originalName = originalName;
  }

  public final boolean isQuotedString() {
    return quoted;
  }

  public final void setQuotedString() {
    this.quoted = true;
  }

  public final boolean getIsParenthesized() {
    return parenthesized;
  }

  public final void setIsParenthesized(boolean b) {
    this.parenthesized = b;
  }

  /** Whether an INC or DEC is in postfix position. */
  public final boolean isPostfix() {
    return postfix;
  }

  public final void setPostfix(boolean postfix) {
    checkState(token == Token.INC || token == Token.DEC, "%s is not an update", token);
    this.postfix = postfix;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Copy the source info from `other` onto `this`. */
  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    this.lineno = other.lineno;
    this.charno = other.charno;
    this.originalName = other.originalName;
    return this;
  }

  /** For all Nodes in the subtree of `this`, copy the source info from `other`. */
  @CanIgnoreReturnValue
  public final Node srcrefTree(Node other) {
    this.srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  public final Iterable<Node> children() {
    if (first == null) {
      return ImmutableList.of();
    }
    return () -> new SiblingNodeIterator(first);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next.next == null;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  /**
   * Returns true if this node is equivalent semantically to another. Source positions, bindings
   * and parenthesization are not compared.
   */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token || getChildCount() != node.getChildCount()) {
      return false;
    }
    switch (token) {
      case NUMBER:
        if (Double.compare(number, node.number) != 0) {
          return false;
        }
        break;
      case NAME:
      case STRINGLIT:
      case GETPROP:
      case LABEL_NAME:
        if (!getString().equals(node.getString())) {
          return false;
        }
        break;
      case STRING_KEY:
      case GETTER_DEF:
      case SETTER_DEF:
        if (!getString().equals(node.getString()) || quoted != node.quoted) {
          return false;
        }
        break;
      case INC:
      case DEC:
        if (postfix != node.postfix) {
          return false;
        }
        break;
      default:
        break;
    }
    for (Node n = first, m = node.first; n != null; n = n.next, m = m.next) {
      if (!n.isEquivalentTo(m)) {
        return false;
      }
    }
    return true;
  }

  /** Returns a detached copy of this node without its children. */
  public final Node cloneNode() {
    Node clone = new Node(token);
    clone.lineno = lineno;
    clone.charno = charno;
    clone.str = str;
    clone.number = number;
    clone.slot = slot;
    clone.originalName = originalName;
    clone.quoted = quoted;
    clone.parenthesized = parenthesized;
    clone.postfix = postfix;
    return clone;
  }

  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (str != null || slot != null) {
      sb.append(' ').append(getString());
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (quoted) {
      sb.append(" [quoted]");
    }
    if (postfix) {
      sb.append(" [postfix]");
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }

  // Token predicates

  public final boolean isAdd() {
    return token == Token.ADD;
  }

  public final boolean isAnd() {
    return token == Token.AND;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isComma() {
    return token == Token.COMMA;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isFalse() {
    return token == Token.FALSE;
  }

  public final boolean isFor() {
    return token == Token.FOR;
  }

  public final boolean isForIn() {
    return token == Token.FOR_IN;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isHook() {
    return token == Token.HOOK;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isLabel() {
    return token == Token.LABEL;
  }

  public final boolean isLabelName() {
    return token == Token.LABEL_NAME;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNeg() {
    return token == Token.NEG;
  }

  public final boolean isNull() {
    return token == Token.NULL;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isObjectLit() {
    return token == Token.OBJECTLIT;
  }

  public final boolean isOr() {
    return token == Token.OR;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isTrue() {
    return token == Token.TRUE;
  }

  public final boolean isTry() {
    return token == Token.TRY;
  }

  public final boolean isTypeOf() {
    return token == Token.TYPEOF;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isWhile() {
    return token == Token.WHILE;
  }

  /** Whether this is a VAR, LET or CONST declaration. */
  public final boolean isNameDeclaration() {
    return token == Token.VAR || token == Token.LET || token == Token.CONST;
  }
}
