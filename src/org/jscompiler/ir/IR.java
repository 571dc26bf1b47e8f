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

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList() {
    return new Node(Token.PARAM_LIST);
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node stmt) {
    checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
    return new Node(Token.BLOCK, stmt);
  }

  public static Node block(List<Node> stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt));
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node script() {
    return new Node(Token.SCRIPT);
  }

  public static Node var(Node lhs) {
    return declaration(lhs, Token.VAR);
  }

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName(), lhs);
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    checkState(lhs.isName() && !lhs.hasChildren(), lhs);
    checkState(mayBeExpression(value), "%s can't be an expression", value);
    lhs.addChildToBack(value);
    return new Node(type, lhs);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isEmpty() || init.isNameDeclaration() || mayBeExpression(init));
    checkState(cond.isEmpty() || mayBeExpression(cond));
    checkState(incr.isEmpty() || mayBeExpression(incr));
    checkState(body.isBlock());
    return new Node(Token.FOR, init, cond, incr, body);
  }

  public static Node labelName(String name) {
    checkState(!name.isEmpty());
    return Node.newString(Token.LABEL_NAME, name);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  public static Node not(Node expr1) {
    return unaryOp(Token.NOT, expr1);
  }

  public static Node neg(Node expr1) {
    return unaryOp(Token.NEG, expr1);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  // helper methods

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  // NOTE: some nodes are neither statements nor expression nodes:
  //   SCRIPT, LABEL_NAME, PARAM_LIST, CASE, DEFAULT_CASE, CATCH
  //   GETTER_DEF, SETTER_DEF, STRING_KEY

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
      case BLOCK:
      case BREAK:
      case CONST:
      case CONTINUE:
      case DEBUGGER:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case IF:
      case LABEL:
      case LET:
      case RETURN:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
      case WITH:
        return true;
      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
      case EMPTY:
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case IF:
      case FOR:
      case FOR_IN:
      case WHILE:
      case DO:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
      case BREAK:
      case CONTINUE:
      case RETURN:
      case THROW:
      case TRY:
      case CATCH:
      case LABEL:
      case LABEL_NAME:
      case WITH:
      case DEBUGGER:
      case PARAM_LIST:
      case STRING_KEY:
      case GETTER_DEF:
      case SETTER_DEF:
        return false;
      default:
        return true;
    }
  }
}
