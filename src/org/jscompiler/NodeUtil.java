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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import org.jscompiler.ir.DToA;
import org.jscompiler.ir.IR;
import org.jscompiler.ir.Node;
import org.jscompiler.ir.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  static final Predicate<Node> MATCH_NOT_FUNCTION = n -> !n.isFunction();

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /**
   * Gets the boolean value of a node that represents an expression, or {@code Tri.UNKNOWN} if no
   * such value can be determined by static analysis.
   *
   * <p>This method does not consider whether the node may have side-effects. Names are never
   * evaluated, since {@code undefined} and friends may be shadowed by a local.
   */
  static Tri getBooleanValue(Node n) {
    switch (n.getToken()) {
      case NULL:
      case FALSE:
      case VOID:
        return Tri.FALSE;

      case TRUE:
      case REGEXP:
      case FUNCTION:
      case NEW:
      case ARRAYLIT:
      case OBJECTLIT:
        return Tri.TRUE;

      case STRINGLIT:
        return Tri.forBoolean(n.getString().length() > 0);

      case NUMBER:
        return Tri.forBoolean(n.getDouble() != 0 && !Double.isNaN(n.getDouble()));

      case NOT:
        return getBooleanValue(n.getLastChild()).not();

      case BITNOT:
      case POS:
      case NEG:
        {
          Double doubleVal = getNumberValue(n);
          if (doubleVal != null) {
            boolean isFalsey = doubleVal.isNaN() || doubleVal == 0;
            return Tri.forBoolean(!isFalsey);
          }
          return Tri.UNKNOWN;
        }

      case ASSIGN:
      case COMMA:
        // For ASSIGN and COMMA the value is the value of the RHS.
        return getBooleanValue(n.getLastChild());

      case AND:
        {
          Tri lhs = getBooleanValue(n.getFirstChild());
          Tri rhs = getBooleanValue(n.getLastChild());
          return lhs.and(rhs);
        }
      case OR:
        {
          Tri lhs = getBooleanValue(n.getFirstChild());
          Tri rhs = getBooleanValue(n.getLastChild());
          return lhs.or(rhs);
        }
      case HOOK:
        {
          Tri trueValue = getBooleanValue(n.getSecondChild());
          Tri falseValue = getBooleanValue(n.getLastChild());
          return trueValue.equals(falseValue) ? trueValue : Tri.UNKNOWN;
        }
      default:
        return Tri.UNKNOWN;
    }
  }

  /**
   * Gets the value of a literal node as a String, or null if it cannot be converted. When it
   * returns a non-null String, this method effectively emulates the <code>String()</code>
   * JavaScript cast function.
   */
  static @Nullable String getStringValue(Node n) {
    switch (n.getToken()) {
      case STRINGLIT:
        return n.getString();

      case NEG:
      case NUMBER:
        {
          Double value = getNumberValue(n);
          return value == null ? null : DToA.numberToString(value);
        }

      case FALSE:
        return "false";

      case TRUE:
        return "true";

      case NULL:
        return "null";

      case VOID:
        return "undefined";

      default:
        return null;
    }
  }

  /**
   * Gets the value of a node as a Number, or null if it cannot be converted. Strings are never
   * converted.
   *
   * <p>IMPORTANT: This method does not consider whether {@code n} may have side effects.
   */
  static @Nullable Double getNumberValue(Node n) {
    switch (n.getToken()) {
      case NUMBER:
        return n.getDouble();

      case VOID:
        return Double.NaN;

      case POS:
        return getNumberValue(n.getOnlyChild());

      case NEG:
        {
          Double val = getNumberValue(n.getOnlyChild());
          return (val == null) ? null : -val;
        }

      case BITNOT:
        {
          Double val = getNumberValue(n.getOnlyChild());
          return (val == null) ? null : (double) ~ecmascriptToInt32(val);
        }

      case FALSE:
      case NOT:
      case NULL:
      case TRUE:
        switch (getBooleanValue(n)) {
          case TRUE:
            return 1.0;
          case FALSE:
            return 0.0;
          case UNKNOWN:
            return null;
        }
        throw new AssertionError();

      default:
        return null;
    }
  }

  /** Converts a double to a 32-bit signed integer the way the ECMAScript ToInt32 operation does. */
  static int ecmascriptToInt32(double number) {
    int intValue = (int) number;
    if (number == intValue) {
      return intValue;
    }
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      return 0;
    }
    double d = (number >= 0) ? Math.floor(number) : Math.ceil(number);
    double twoToThe32 = 4294967296.0;
    d = d % twoToThe32;
    // (double) (long) d == d is always true here
    long l = (long) d;
    return (int) l;
  }

  /** Returns true if this is an immutable value. */
  static boolean isImmutableValue(Node n) {
    switch (n.getToken()) {
      case STRINGLIT:
      case NUMBER:
      case NULL:
      case TRUE:
      case FALSE:
        return true;
      case NOT:
      case VOID:
      case NEG:
      case POS:
      case BITNOT:
        return isImmutableValue(n.getFirstChild());
      default:
        return false;
    }
  }

  /**
   * Returns true if the node is a literal: a primitive, a regular expression, or an array or
   * object literal made of literals. Function literals count only if {@code includeFunctions}.
   */
  static boolean isLiteralValue(Node n, boolean includeFunctions) {
    switch (n.getToken()) {
      case ARRAYLIT:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (!child.isEmpty() && !isLiteralValue(child, includeFunctions)) {
            return false;
          }
        }
        return true;

      case REGEXP:
        return true;

      case OBJECTLIT:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (!isLiteralValue(child.getFirstChild(), includeFunctions)) {
            return false;
          }
        }
        return true;

      case FUNCTION:
        return includeFunctions && !isFunctionDeclaration(n);

      default:
        return isImmutableValue(n);
    }
  }

  /**
   * Returns true if evaluating the expression could change state or throw. Property reads are
   * assumed to run getters, so they count as side effects.
   */
  public static boolean mayHaveSideEffects(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_EXPONENT:
      case INC:
      case DEC:
      case CALL:
      case NEW:
      case DELPROP:
      case GETPROP:
      case GETELEM:
      case IN:
      case INSTANCEOF:
        return true;

      case NAME:
      case THIS:
      case NUMBER:
      case STRINGLIT:
      case NULL:
      case TRUE:
      case FALSE:
      case REGEXP:
      case EMPTY:
        return false;

      case FUNCTION:
        return isFunctionDeclaration(n);

      case OBJECTLIT:
        for (Node key = n.getFirstChild(); key != null; key = key.getNext()) {
          if (mayHaveSideEffects(key.getFirstChild())) {
            return true;
          }
        }
        return false;

      default:
        if (!IR.mayBeExpression(n)) {
          return true;
        }
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (mayHaveSideEffects(child)) {
            return true;
          }
        }
        return false;
    }
  }

  /**
   * The comma operator has the lowest precedence, 0, followed by the assignment operators ({@code
   * =}, {@code &=}, {@code +=}, etc.) which have precedence of 1, and so on.
   */
  public static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return 0;
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_EXPONENT:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN:
        return 1;
      case HOOK:
        return 3; // ?: operator
      case OR:
        return 4;
      case AND:
        return 5;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case LSH:
      case RSH:
      case URSH:
        return 12;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;

      case EXPONENT:
        return 15;

      case NEW:
      case DELPROP:
      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        return 16; // Unary operators

      case INC:
      case DEC:
        return 17; // Update operators

      case CALL:
      case GETELEM:
      case GETPROP:
        // Data values
      case ARRAYLIT:
      case EMPTY:
      case FALSE:
      case FUNCTION:
      case NAME:
      case NULL:
      case NUMBER:
      case OBJECTLIT:
      case REGEXP:
      case STRINGLIT:
      case STRING_KEY:
      case THIS:
      case TRUE:
        return 18;

      default:
        throw new IllegalStateException("Unknown precedence for " + type);
    }
  }

  /** Returns the source text of an operator, or null if the token is not an operator. */
  static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case BITOR:
        return "|";
      case OR:
        return "||";
      case BITXOR:
        return "^";
      case AND:
        return "&&";
      case BITAND:
        return "&";
      case SHEQ:
        return "===";
      case EQ:
        return "==";
      case NOT:
        return "!";
      case NE:
        return "!=";
      case SHNE:
        return "!==";
      case LSH:
        return "<<";
      case IN:
        return "in";
      case LE:
        return "<=";
      case LT:
        return "<";
      case URSH:
        return ">>>";
      case RSH:
        return ">>";
      case GE:
        return ">=";
      case GT:
        return ">";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case EXPONENT:
        return "**";
      case BITNOT:
        return "~";
      case ADD:
      case POS:
        return "+";
      case SUB:
      case NEG:
        return "-";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_EXPONENT:
        return "**=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case VOID:
        return "void";
      case TYPEOF:
        return "typeof";
      case INSTANCEOF:
        return "instanceof";
      default:
        return null;
    }
  }

  static String opToStrNoFail(Token operator) {
    String res = opToStr(operator);
    if (res == null) {
      throw new IllegalStateException("Unknown op " + operator);
    }
    return res;
  }

  /** Whether the node is a unary operator. */
  static boolean isUnaryOperator(Node n) {
    switch (n.getToken()) {
      case DELPROP:
      case VOID:
      case TYPEOF:
      case POS:
      case NEG:
      case BITNOT:
      case NOT:
        return true;
      default:
        return false;
    }
  }

  /** Determines whether the given node is a FOR, DO, WHILE, WITH, or IF node. */
  public static boolean isControlStructure(Node n) {
    switch (n.getToken()) {
      case FOR:
      case FOR_IN:
      case DO:
      case WHILE:
      case WITH:
      case IF:
      case LABEL:
      case TRY:
      case CATCH:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return Whether the node is of a type that contain other statements.
   */
  public static boolean isStatementBlock(Node n) {
    return n.isScript() || n.isBlock();
  }

  /**
   * @return Whether the node is used as a statement.
   */
  public static boolean isStatement(Node n) {
    return !n.isScript() && n.hasParent() && isStatementParent(n.getParent());
  }

  public static boolean isStatementParent(Node parent) {
    switch (parent.getToken()) {
      case SCRIPT:
      case BLOCK:
      case LABEL:
        return true;
      default:
        return false;
    }
  }

  /**
   * A block scope is created by a BLOCK that is not a function body, case body, catch body or catch
   * container, and by a FOR, FOR_IN, SWITCH or CATCH node.
   *
   * @return Whether the node creates a block scope.
   */
  static boolean createsBlockScope(Node n) {
    switch (n.getToken()) {
      case BLOCK:
        Node parent = n.getParent();
        return parent != null
            && !parent.isFunction()
            && !isSwitchCase(parent)
            && !parent.isCatch()
            && !isTryCatchNodeContainer(n);
      case FOR:
      case FOR_IN:
      case SWITCH:
      case CATCH:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node is the body of a CASE or DEFAULT_CASE. */
  static boolean isSwitchCase(Node n) {
    return n.isCase() || n.isDefaultCase();
  }

  /** Whether the node is a CATCH container BLOCK. */
  static boolean isTryCatchNodeContainer(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isTry() && parent.getSecondChild() == n;
  }

  /** Whether the child is the finally block of a TRY. */
  static boolean isTryFinallyNode(Node parent, Node child) {
    return parent.isTry() && parent.getChildCount() == 3 && child == parent.getLastChild();
  }

  /** Is this node a function declaration? A function declaration always has a non-empty name. */
  public static boolean isFunctionDeclaration(Node n) {
    return n.isFunction()
        && n.hasParent()
        && isStatementParent(n.getParent())
        && !n.getFirstChild().getString().isEmpty();
  }

  static boolean isFunctionExpression(Node n) {
    return n.isFunction() && !isFunctionDeclaration(n);
  }

  /** Creates a number literal, wrapped in NEG when the value is negative or negative zero. */
  public static Node numberNode(double value, @Nullable Node srcref) {
    Node result;
    if (value < 0 || (value == 0 && 1 / value < 0)) {
      result = IR.neg(IR.number(-value));
    } else {
      result = IR.number(value);
    }
    if (srcref != null) {
      result.srcrefTree(srcref);
    }
    return result;
  }

  public static Node booleanNode(boolean value) {
    return value ? IR.trueNode() : IR.falseNode();
  }

  /**
   * @return Whether the predicate is true for the node or any of its descendants.
   */
  public static boolean has(Node node, Predicate<Node> pred, Predicate<Node> traverseChildrenPred) {
    if (pred.test(node)) {
      return true;
    }
    if (!traverseChildrenPred.test(node)) {
      return false;
    }
    for (Node c = node.getFirstChild(); c != null; c = c.getNext()) {
      if (has(c, pred, traverseChildrenPred)) {
        return true;
      }
    }
    return false;
  }

  /** Whether the statement list contains a let, const or function declaration directly. */
  static boolean hasBlockScopedDeclaration(Node block) {
    for (Node c = block.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isLet() || c.isConst() || isFunctionDeclaration(c)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Given a node tree, finds all the VAR declarations in that tree that are not in an inner scope.
   * Then adds a new VAR node at the top of the current scope that redeclares them, if necessary.
   */
  static void redeclareVarsInsideBranch(Node branch) {
    Map<String, Node> vars = getVarsDeclaredInBranch(branch);
    if (vars.isEmpty()) {
      return;
    }

    Node parent = getAddingRoot(branch);
    for (Node nameNode : vars.values()) {
      Node var = IR.var(IR.name(nameNode.getString()).srcref(nameNode)).srcref(nameNode);
      parent.addChildToFront(var);
    }
  }

  /** Returns the NAME nodes declared by a var in the subtree, outside nested functions. */
  static Map<String, Node> getVarsDeclaredInBranch(Node root) {
    Map<String, Node> vars = new LinkedHashMap<>();
    collectVars(root, vars);
    return vars;
  }

  private static void collectVars(Node n, Map<String, Node> vars) {
    if (n.isVar()) {
      for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
        vars.putIfAbsent(name.getString(), name);
      }
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (!c.isFunction()) {
        collectVars(c, vars);
      }
    }
  }

  /**
   * Gets a Node at the top of the current scope where we can add new var declarations as children.
   */
  private static Node getAddingRoot(Node n) {
    for (Node ancestor = n.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      if (ancestor.isScript()) {
        return ancestor;
      } else if (ancestor.isFunction()) {
        return ancestor.getLastChild();
      }
    }
    throw new IllegalStateException("node is not attached to a script: " + n);
  }

  /**
   * Safely remove children while maintaining a valid node structure. In some cases, this is done by
   * removing the parent from the AST as well.
   */
  public static void removeChild(Node parent, Node node) {
    if (isTryFinallyNode(parent, node)) {
      if (parent.getSecondChild().hasChildren()) {
        // A finally can only be removed if there is a catch.
        node.detach();
      } else {
        // Otherwise, only its children can be removed.
        node.detachChildren();
      }
    } else if (node.isBlock()) {
      // Simply empty the block.
      node.detachChildren();
    } else if (isStatementBlock(parent) || isSwitchCase(node)) {
      node.detach();
    } else if (parent.isNameDeclaration() || parent.isExprResult()) {
      node.detach();
      if (!parent.hasChildren()) {
        removeChild(parent.getParent(), parent);
      }
    } else if (parent.isLabel() && node == parent.getLastChild()) {
      node.detach();
      // A LABEL without children can not be referred to, remove it.
      removeChild(parent.getParent(), parent);
    } else if (parent.isFor()) {
      node.replaceWith(IR.empty());
    } else {
      throw new IllegalStateException("Cannot remove child " + node + " of " + parent);
    }
  }
}
