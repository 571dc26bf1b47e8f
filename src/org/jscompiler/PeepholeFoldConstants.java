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

import static com.google.common.base.Preconditions.checkArgument;

import org.jscompiler.ir.DToA;
import org.jscompiler.ir.IR;
import org.jscompiler.ir.Node;
import org.jscompiler.ir.Token;
import org.jspecify.annotations.Nullable;

/**
 * Peephole optimization to fold constants (e.g. 1 + 7 --> 8).
 *
 * <p>Only operations whose operands are all literals are folded, and only when the JavaScript
 * result is known exactly. Operations that depend on implicit conversions between strings and
 * numbers are left alone.
 */
class PeepholeFoldConstants extends AbstractPeepholeOptimization {

  static final DiagnosticType FRACTIONAL_BITWISE_OPERAND =
      DiagnosticType.warning("JSC_FRACTIONAL_BITWISE_OPERAND", "Fractional bitwise operand: {0}");

  private static final double MAX_FOLD_NUMBER = Math.pow(2, 53);

  @Override
  Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case TYPEOF:
        return tryFoldTypeof(subtree);

      case NOT:
      case POS:
      case NEG:
      case BITNOT:
        return tryFoldUnaryOperator(subtree);

      case VOID:
        return tryReduceVoid(subtree);

      default:
        return tryFoldBinaryOperator(subtree);
    }
  }

  private Node tryFoldBinaryOperator(Node subtree) {
    Node left = subtree.getFirstChild();
    if (left == null) {
      return subtree;
    }
    Node right = left.getNext();
    if (right == null || right.getNext() != null) {
      return subtree;
    }

    // If we've reached here, node is truly a binary operator.
    switch (subtree.getToken()) {
      case AND:
      case OR:
        return tryFoldAndOr(subtree, left, right);

      case LSH:
      case RSH:
      case URSH:
        return tryFoldShift(subtree, left, right);

      case ADD:
        return tryFoldAdd(subtree, left, right);

      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case EXPONENT:
      case BITAND:
      case BITOR:
      case BITXOR:
        return tryFoldArithmeticOp(subtree, left, right);

      case LT:
      case GT:
      case LE:
      case GE:
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return tryFoldComparison(subtree, left, right);

      default:
        return subtree;
    }
  }

  private Node tryReduceVoid(Node n) {
    Node child = n.getFirstChild();
    if ((!child.isNumber() || child.getDouble() != 0.0) && NodeUtil.isImmutableValue(child)) {
      child.replaceWith(IR.number(0));
      reportChangeToEnclosingScope(n);
    }
    return n;
  }

  /** Folds 'typeof(foo)' if foo is a literal, e.g. typeof("bar") --> "string" */
  private Node tryFoldTypeof(Node originalTypeofNode) {
    checkArgument(originalTypeofNode.isTypeOf());

    Node argumentNode = originalTypeofNode.getFirstChild();
    if (!NodeUtil.isLiteralValue(argumentNode, true)) {
      return originalTypeofNode;
    }

    String typeNameString = null;
    switch (argumentNode.getToken()) {
      case FUNCTION:
        typeNameString = "function";
        break;
      case STRINGLIT:
        typeNameString = "string";
        break;
      case NUMBER:
      case NEG:
      case POS:
      case BITNOT:
        typeNameString = "number";
        break;
      case TRUE:
      case FALSE:
      case NOT:
        typeNameString = "boolean";
        break;
      case NULL:
      case OBJECTLIT:
      case ARRAYLIT:
      case REGEXP:
        typeNameString = "object";
        break;
      case VOID:
        typeNameString = "undefined";
        break;
      default:
        break;
    }

    if (typeNameString != null) {
      Node newNode = IR.string(typeNameString).srcref(originalTypeofNode);
      reportChangeToEnclosingScope(originalTypeofNode);
      originalTypeofNode.replaceWith(newNode);
      return newNode;
    }
    return originalTypeofNode;
  }

  private Node tryFoldUnaryOperator(Node n) {
    Node left = n.getFirstChild();
    Node result = null;
    switch (n.getToken()) {
      case NOT:
        {
          Tri leftVal = NodeUtil.getBooleanValue(left);
          if (leftVal != Tri.UNKNOWN && NodeUtil.isImmutableValue(left)) {
            result = NodeUtil.booleanNode(!leftVal.toBoolean(true));
          }
          break;
        }
      case NEG:
        // -(-4) --> 4. A negated literal is already in its canonical form.
        if (left.isNeg() && left.getFirstChild().isNumber()) {
          result = left.getFirstChild().detach();
        }
        break;
      case POS:
        if (getLiteralNumber(left) != null) {
          result = left.detach();
        }
        break;
      case BITNOT:
        {
          Double value = getLiteralNumber(left);
          if (value != null) {
            if (!isMathematicalInteger(value)) {
              report(FRACTIONAL_BITWISE_OPERAND, left);
            } else {
              result = NodeUtil.numberNode(~NodeUtil.ecmascriptToInt32(value), null);
            }
          }
          break;
        }
      default:
        break;
    }

    if (result == null) {
      return n;
    }
    result.srcrefTree(n);
    n.replaceWith(result);
    reportChangeToEnclosingScope(result);
    return result;
  }

  /** Try to fold a AND/OR node whose left operand is a literal with a known boolean value. */
  private Node tryFoldAndOr(Node n, Node left, Node right) {
    Tri leftVal = NodeUtil.getBooleanValue(left);
    if (leftVal == Tri.UNKNOWN || !NodeUtil.isImmutableValue(left)) {
      return n;
    }

    boolean lval = leftVal.toBoolean(true);
    // (TRUE || x) => TRUE (also, (3 || x) => 3)
    // (FALSE && x) => FALSE
    // (FALSE || x) => x
    // (TRUE && x) => x
    Node result = (lval ? n.isOr() : n.isAnd()) ? left : right;
    result.detach();
    n.replaceWith(result);
    reportChangeToEnclosingScope(result);
    return result;
  }

  private Node tryFoldAdd(Node node, Node left, Node right) {
    if (left.isStringLit() || right.isStringLit()) {
      return tryFoldAddConstantString(node, left, right);
    }
    return tryFoldArithmeticOp(node, left, right);
  }

  /** Try to fold an ADD node with constant operands, one of them a string. */
  private Node tryFoldAddConstantString(Node n, Node left, Node right) {
    String leftString = getConcatenableString(left);
    String rightString = getConcatenableString(right);
    if (leftString == null || rightString == null) {
      return n;
    }
    Node newStringNode = IR.string(leftString + rightString).srcref(n);
    n.replaceWith(newStringNode);
    reportChangeToEnclosingScope(newStringNode);
    return newStringNode;
  }

  /**
   * Returns the string a literal contributes to a concatenation. Numbers are only accepted when
   * integral.
   */
  private static @Nullable String getConcatenableString(Node n) {
    switch (n.getToken()) {
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
        return NodeUtil.getStringValue(n);
      case NUMBER:
      case NEG:
        {
          Double value = getLiteralNumber(n);
          if (value == null || !isMathematicalInteger(value)) {
            return null;
          }
          return DToA.numberToString(value);
        }
      default:
        return null;
    }
  }

  private Node tryFoldArithmeticOp(Node n, Node left, Node right) {
    Node result = performArithmeticOp(n, left, right);
    if (result != null) {
      result.srcrefTree(n);
      n.replaceWith(result);
      reportChangeToEnclosingScope(result);
      return result;
    }
    return n;
  }

  /** Try to fold arithmetic binary operators */
  private @Nullable Node performArithmeticOp(Node n, Node left, Node right) {
    Double lValObj = getLiteralNumber(left);
    Double rValObj = getLiteralNumber(right);
    if (lValObj == null || rValObj == null) {
      return null;
    }
    double lval = lValObj;
    double rval = rValObj;
    double result;
    switch (n.getToken()) {
      case ADD:
        result = lval + rval;
        break;
      case SUB:
        result = lval - rval;
        break;
      case MUL:
        result = lval * rval;
        break;
      case DIV:
        if (rval == 0) {
          return null;
        }
        result = lval / rval;
        break;
      case MOD:
        if (rval == 0) {
          return null;
        }
        result = lval % rval;
        break;
      case EXPONENT:
        result = Math.pow(lval, rval);
        break;
      case BITAND:
      case BITOR:
      case BITXOR:
        return performBitwiseOp(n, left, right, lval, rval);
      default:
        throw new IllegalStateException("Unexpected arithmetic operator: " + n.getToken());
    }
    return maybeReplaceBinaryOpWithNumericResult(result, lval, rval);
  }

  private @Nullable Node performBitwiseOp(
      Node n, Node left, Node right, double lval, double rval) {
    if (!isMathematicalInteger(lval)) {
      report(FRACTIONAL_BITWISE_OPERAND, left);
      return null;
    }
    if (!isMathematicalInteger(rval)) {
      report(FRACTIONAL_BITWISE_OPERAND, right);
      return null;
    }
    int l = NodeUtil.ecmascriptToInt32(lval);
    int r = NodeUtil.ecmascriptToInt32(rval);
    int result =
        switch (n.getToken()) {
          case BITAND -> l & r;
          case BITOR -> l | r;
          case BITXOR -> l ^ r;
          default -> throw new IllegalStateException("Unexpected bitwise operator: " + n);
        };
    return NodeUtil.numberNode(result, null);
  }

  private static @Nullable Node maybeReplaceBinaryOpWithNumericResult(
      double result, double lval, double rval) {
    // Do not try to fold arithmetic for numbers > 2^53. After that
    // point, fixed-point math starts to break down and become inaccurate.
    if (Double.isNaN(result)
        || Double.isInfinite(result)
        || Math.abs(result) > MAX_FOLD_NUMBER
        || (result == 0 && 1 / result < 0)) {
      return null;
    }
    // length of the left and right value plus 1 byte for the operator.
    if (printedLength(result) > printedLength(lval) + printedLength(rval) + 1) {
      return null;
    }
    return NodeUtil.numberNode(result, null);
  }

  private static int printedLength(double value) {
    return DToA.numberToString(value).length();
  }

  /** Try to fold shift operations */
  private Node tryFoldShift(Node n, Node left, Node right) {
    Double leftVal = getLiteralNumber(left);
    Double rightVal = getLiteralNumber(right);
    if (leftVal == null || rightVal == null) {
      return n;
    }
    if (!isMathematicalInteger(leftVal)) {
      report(FRACTIONAL_BITWISE_OPERAND, left);
      return n;
    }
    if (!isMathematicalInteger(rightVal)) {
      report(FRACTIONAL_BITWISE_OPERAND, right);
      return n;
    }

    // only the lower 5 bits are used when shifting, so don't do anything
    // if the shift amount is outside [0,32)
    if (!(0 <= rightVal && rightVal < 32)) {
      return n;
    }

    int rvalInt = rightVal.intValue();
    int bits = NodeUtil.ecmascriptToInt32(leftVal);

    double result;
    switch (n.getToken()) {
      case LSH:
        result = bits << rvalInt;
        break;
      case RSH:
        result = bits >> rvalInt;
        break;
      case URSH:
        // JavaScript always treats the result of >>> as unsigned.
        // We must force Java to do the same here.
        result = 0xffffffffL & (bits >>> rvalInt);
        break;
      default:
        throw new AssertionError("Unknown shift operator: " + n.getToken());
    }

    Node newNumber = NodeUtil.numberNode(result, n);
    n.replaceWith(newNumber);
    reportChangeToEnclosingScope(newNumber);
    return newNumber;
  }

  /** Try to fold comparison nodes, e.g == */
  private Node tryFoldComparison(Node n, Node left, Node right) {
    Tri result = evaluateComparison(n.getToken(), left, right);
    if (result == Tri.UNKNOWN) {
      return n;
    }

    Node newNode = NodeUtil.booleanNode(result.toBoolean(true)).srcref(n);
    n.replaceWith(newNode);
    reportChangeToEnclosingScope(newNode);
    return newNode;
  }

  /** The primitive types a comparison can be folded for. */
  private enum LiteralType {
    NUMBER,
    STRING,
    BOOLEAN,
    NULL,
    UNDEFINED
  }

  private static @Nullable LiteralType getLiteralType(Node n) {
    switch (n.getToken()) {
      case STRINGLIT:
        return LiteralType.STRING;
      case TRUE:
      case FALSE:
        return LiteralType.BOOLEAN;
      case NULL:
        return LiteralType.NULL;
      case VOID:
        return NodeUtil.isImmutableValue(n.getFirstChild()) ? LiteralType.UNDEFINED : null;
      default:
        return getLiteralNumber(n) != null ? LiteralType.NUMBER : null;
    }
  }

  static Tri evaluateComparison(Token op, Node left, Node right) {
    LiteralType leftType = getLiteralType(left);
    LiteralType rightType = getLiteralType(right);
    if (leftType == null || rightType == null) {
      return Tri.UNKNOWN;
    }

    if (leftType != rightType) {
      boolean bothNullish = isNullish(leftType) && isNullish(rightType);
      switch (op) {
        case SHEQ:
          return Tri.FALSE;
        case SHNE:
          return Tri.TRUE;
        case EQ:
          return bothNullish ? Tri.TRUE : Tri.UNKNOWN;
        case NE:
          return bothNullish ? Tri.FALSE : Tri.UNKNOWN;
        default:
          return Tri.UNKNOWN;
      }
    }

    switch (leftType) {
      case NUMBER:
        return compareNumbers(op, getLiteralNumber(left), getLiteralNumber(right));
      case BOOLEAN:
        return compareNumbers(op, left.isTrue() ? 1.0 : 0.0, right.isTrue() ? 1.0 : 0.0);
      case STRING:
        return compareStrings(op, left.getString(), right.getString());
      case NULL:
      case UNDEFINED:
        switch (op) {
          case EQ:
          case SHEQ:
            return Tri.TRUE;
          case NE:
          case SHNE:
            return Tri.FALSE;
          default:
            return Tri.UNKNOWN;
        }
    }
    throw new AssertionError(leftType);
  }

  private static boolean isNullish(LiteralType type) {
    return type == LiteralType.NULL || type == LiteralType.UNDEFINED;
  }

  private static Tri compareNumbers(Token op, double l, double r) {
    switch (op) {
      case EQ:
      case SHEQ:
        return Tri.forBoolean(l == r);
      case NE:
      case SHNE:
        return Tri.forBoolean(l != r);
      case LT:
        return Tri.forBoolean(l < r);
      case GT:
        return Tri.forBoolean(l > r);
      case LE:
        return Tri.forBoolean(l <= r);
      case GE:
        return Tri.forBoolean(l >= r);
      default:
        throw new IllegalStateException("Unexpected comparison: " + op);
    }
  }

  /** Compares by UTF-16 code units, which is how JavaScript orders strings. */
  private static Tri compareStrings(Token op, String l, String r) {
    int cmp = l.compareTo(r);
    switch (op) {
      case EQ:
      case SHEQ:
        return Tri.forBoolean(cmp == 0);
      case NE:
      case SHNE:
        return Tri.forBoolean(cmp != 0);
      case LT:
        return Tri.forBoolean(cmp < 0);
      case GT:
        return Tri.forBoolean(cmp > 0);
      case LE:
        return Tri.forBoolean(cmp <= 0);
      case GE:
        return Tri.forBoolean(cmp >= 0);
      default:
        throw new IllegalStateException("Unexpected comparison: " + op);
    }
  }

  /** Returns the value of a NUMBER or negated NUMBER literal, or null for anything else. */
  private static @Nullable Double getLiteralNumber(Node n) {
    if (n.isNumber()) {
      return n.getDouble();
    }
    if (n.isNeg() && n.getFirstChild().isNumber()) {
      return -n.getFirstChild().getDouble();
    }
    return null;
  }

  private static boolean isMathematicalInteger(double x) {
    return !Double.isNaN(x) && !Double.isInfinite(x) && Math.floor(x) == x;
  }
}
