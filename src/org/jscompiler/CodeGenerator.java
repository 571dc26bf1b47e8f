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

import static com.google.common.base.Preconditions.checkState;

import java.util.HashMap;
import java.util.Map;
import org.jscompiler.ir.Node;
import org.jscompiler.ir.Token;
import org.jscompiler.sourcemap.Util;

/**
 * CodeGenerator generates codes from a parse tree, sending it to the specified CodeConsumer.
 *
 * <p>Parentheses are derived from operator precedence, so the printed text parses back to an AST
 * equivalent to the one printed. Single-statement bodies lose their braces unless the statement
 * could not stand alone.
 */
class CodeGenerator {
  private static final String LT_ESCAPED = "\\x3c";
  private static final String GT_ESCAPED = "\\x3e";

  // A memoizer for formatting strings as JS strings.
  private final Map<String, String> escapedJsStrings = new HashMap<>();

  private final CodeConsumer cc;

  CodeGenerator(CodeConsumer consumer) {
    this.cc = consumer;
  }

  private void add(String str) {
    cc.add(str);
  }

  void add(Node n) {
    add(n, Context.OTHER);
  }

  void add(Node n, Context context) {
    cc.startSourceMapping(n);

    Token type = n.getToken();
    String opstr = NodeUtil.opToStr(type);
    int childCount = n.getChildCount();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();

    // Handle all binary operators
    if (opstr != null && first != last) {
      checkState(
          childCount == 2,
          "Bad binary operator \"%s\": expected 2 arguments but got %s",
          opstr,
          childCount);
      int p = NodeUtil.precedence(type);

      // For right-hand-side of operations, only pass context if it's
      // the IN_FOR_INIT_CLAUSE one.
      Context rhsContext = getContextForNoInOperator(context);

      if (type.isAssign() || type == Token.EXPONENT) {
        // Assignment operators and '**' are the only right-associative binary operators
        addExpr(first, p + 1, context);
        cc.addOp(opstr, true);
        addExpr(last, p, rhsContext);
      } else {
        unrollBinaryOperator(n, type, opstr, context, rhsContext, p, p + 1);
      }
      return;
    }

    switch (type) {
      case TRY:
        {
          checkState(first.getNext().isBlock() && childCount <= 3, n);
          add("try");
          add(first);

          // second child contains the catch block, or nothing if there
          // isn't a catch block
          Node catchblock = first.getNext().getFirstChild();
          if (catchblock != null) {
            add(catchblock);
          }

          if (childCount == 3) {
            cc.maybeInsertSpace();
            add("finally");
            add(last);
          }
          break;
        }

      case CATCH:
        checkState(childCount == 2, n);
        cc.maybeInsertSpace();
        add("catch");
        cc.maybeInsertSpace();
        add("(");
        add(first);
        add(")");
        add(last);
        break;

      case THROW:
        checkState(childCount == 1, n);
        add("throw");
        cc.maybeInsertSpace();
        addExpr(first, 0, Context.OTHER);
        cc.endStatement();
        break;

      case RETURN:
        add("return");
        if (childCount == 1) {
          cc.maybeInsertSpace();
          addExpr(first, 0, Context.OTHER);
        } else {
          checkState(childCount == 0, n);
        }
        cc.endStatement();
        break;

      case VAR:
      case LET:
      case CONST:
        add(declarationKeyword(type));
        addList(first, false, getContextForNoInOperator(context));
        if (NodeUtil.isStatement(n)) {
          cc.endStatement();
        }
        break;

      case LABEL_NAME:
        checkState(!n.getString().isEmpty(), n);
        cc.addIdentifier(n.getString());
        break;

      case NAME:
        cc.addIdentifier(identifierEscape(n.getString()));
        if (first != null) {
          checkState(childCount == 1, n);
          cc.addOp("=", true);
          if (first.isComma()) {
            addExpr(first, NodeUtil.precedence(Token.ASSIGN), Context.OTHER);
          } else {
            // Add expression, consider nearby code at lowest level of
            // precedence.
            addExpr(first, 0, getContextForNoInOperator(context));
          }
        }
        break;

      case ARRAYLIT:
        add("[");
        addArrayList(first);
        add("]");
        break;

      case PARAM_LIST:
        add("(");
        addList(first);
        add(")");
        break;

      case COMMA:
        checkState(childCount == 2, n);
        unrollBinaryOperator(
            n, Token.COMMA, ",", context, getContextForNoInOperator(context), 0, 1);
        break;

      case NUMBER:
        checkState(childCount == 0, n);
        cc.addNumber(n.getDouble());
        break;

      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        {
          // All of these unary operators are right-associative
          checkState(childCount == 1, n);
          cc.addOp(NodeUtil.opToStrNoFail(type), false);
          addExpr(first, NodeUtil.precedence(type), Context.OTHER);
          break;
        }

      case HOOK:
        {
          checkState(childCount == 3, n);
          int p = NodeUtil.precedence(type);
          Context rhsContext = getContextForNoInOperator(context);
          addExpr(first, p + 1, context);
          cc.addOp("?", true);
          addExpr(first.getNext(), 1, rhsContext);
          cc.addOp(":", true);
          addExpr(last, 1, rhsContext);
          break;
        }

      case REGEXP:
        {
          checkState(first.isStringLit() && last.isStringLit(), n);
          // Only one add because whitespace inside the literal matters.
          String regexp = "/" + first.getString() + "/";
          add(childCount == 2 ? regexp + last.getString() : regexp);
          break;
        }

      case FUNCTION:
        checkState(childCount == 3, n);
        addFunction(n, first, last, context);
        break;

      case GETTER_DEF:
      case SETTER_DEF:
        {
          checkState(n.getParent().isObjectLit(), n);
          checkState(childCount == 1 && first.isFunction(), n);
          add(type == Token.GETTER_DEF ? "get" : "set");
          addPropertyName(n);
          add(first.getSecondChild());
          add(first.getLastChild());
          break;
        }

      case SCRIPT:
      case BLOCK:
        {
          boolean preserveBlock = n.isBlock();
          if (preserveBlock) {
            cc.beginBlock();
          }
          for (Node c = first; c != null; c = c.getNext()) {
            add(c, Context.STATEMENT);
            if (c.isFunction()) {
              cc.maybeLineBreak();
            }
          }
          if (preserveBlock) {
            cc.endBlock(cc.breakAfterBlockFor(n, context == Context.STATEMENT));
          }
          break;
        }

      case FOR:
        checkState(childCount == 4, n);
        add("for");
        cc.maybeInsertSpace();
        add("(");
        if (first.isNameDeclaration()) {
          add(first, Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, 0, Context.IN_FOR_INIT_CLAUSE);
        }
        add(";");
        if (!first.getNext().isEmpty()) {
          cc.maybeInsertSpace();
        }
        addExpr(first.getNext(), 0, Context.OTHER);
        add(";");
        if (!first.getNext().getNext().isEmpty()) {
          cc.maybeInsertSpace();
        }
        addExpr(first.getNext().getNext(), 0, Context.OTHER);
        add(")");
        addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        break;

      case FOR_IN:
        checkState(childCount == 3, n);
        add("for");
        cc.maybeInsertSpace();
        add("(");
        if (first.isNameDeclaration()) {
          add(first, Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, NodeUtil.precedence(Token.INC), Context.IN_FOR_INIT_CLAUSE);
        }
        add("in");
        addExpr(first.getNext(), 0, Context.OTHER);
        add(")");
        addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        break;

      case DO:
        checkState(childCount == 2, n);
        add("do");
        addNonEmptyStatement(first, Context.OTHER);
        cc.maybeInsertSpace();
        add("while");
        cc.maybeInsertSpace();
        add("(");
        addExpr(last, 0, Context.OTHER);
        add(")");
        cc.endStatement();
        break;

      case WHILE:
        checkState(childCount == 2, n);
        add("while");
        cc.maybeInsertSpace();
        add("(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        break;

      case EMPTY:
        checkState(childCount == 0, n);
        if (context == Context.STATEMENT || context == Context.BEFORE_DANGLING_ELSE) {
          cc.maybeEndStatement();
          cc.endStatement(true);
        }
        break;

      case GETPROP:
        {
          checkState(childCount == 1, "Bad GETPROP: expected 1 child, but got %s", childCount);
          boolean needsParens = first.isNumber();
          if (needsParens) {
            add("(");
          }
          addExpr(first, NodeUtil.precedence(type), needsParens ? Context.OTHER : context);
          if (needsParens) {
            add(")");
          }
          add(".");
          cc.addIdentifier(identifierEscape(n.getString()));
          break;
        }

      case GETELEM:
        checkState(childCount == 2, "Bad GETELEM: expected 2 children, but got %s", childCount);
        addExpr(first, NodeUtil.precedence(type), context);
        add("[");
        addExpr(first.getNext(), 0, Context.OTHER);
        add("]");
        break;

      case WITH:
        checkState(childCount == 2, n);
        add("with");
        cc.maybeInsertSpace();
        add("(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        break;

      case INC:
      case DEC:
        {
          checkState(childCount == 1, n);
          String o = type == Token.INC ? "++" : "--";
          if (n.isPostfix()) {
            addExpr(first, NodeUtil.precedence(type), context);
            cc.addOp(o, false);
          } else {
            cc.addOp(o, false);
            addExpr(first, NodeUtil.precedence(type), Context.OTHER);
          }
          break;
        }

      case CALL:
        addExpr(first, NodeUtil.precedence(type), context);
        add("(");
        addList(first.getNext());
        add(")");
        break;

      case IF:
        checkState(childCount == 2 || childCount == 3, n);
        boolean hasElse = childCount == 3;
        boolean ambiguousElseClause = context == Context.BEFORE_DANGLING_ELSE && !hasElse;
        if (ambiguousElseClause) {
          cc.beginBlock();
        }
        add("if");
        cc.maybeInsertSpace();
        add("(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        if (hasElse) {
          addNonEmptyStatement(first.getNext(), Context.BEFORE_DANGLING_ELSE);
          cc.maybeInsertSpace();
          add("else");
          addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        } else {
          addNonEmptyStatement(first.getNext(), Context.OTHER);
        }
        if (ambiguousElseClause) {
          cc.endBlock();
        }
        break;

      case NULL:
        checkState(childCount == 0, n);
        add("null");
        break;

      case THIS:
        checkState(childCount == 0, n);
        add("this");
        break;

      case FALSE:
        checkState(childCount == 0, n);
        add("false");
        break;

      case TRUE:
        checkState(childCount == 0, n);
        add("true");
        break;

      case CONTINUE:
      case BREAK:
        checkState(childCount <= 1, n);
        add(type == Token.BREAK ? "break" : "continue");
        if (childCount == 1) {
          checkState(first.isLabelName(), "Unexpected token type. Should be LABEL_NAME.");
          add(first);
        }
        cc.endStatement();
        break;

      case DEBUGGER:
        checkState(childCount == 0, n);
        add("debugger");
        cc.endStatement();
        break;

      case EXPR_RESULT:
        checkState(childCount == 1, n);
        addExpr(first, 0, Context.START_OF_EXPR);
        cc.endStatement();
        break;

      case NEW:
        {
          add("new");
          int precedence = NodeUtil.precedence(type);
          // `new void 0` is a syntax error add parentheses in this case.
          int precedenceOfFirst = NodeUtil.precedence(first.getToken());
          if (precedenceOfFirst == precedence) {
            precedence = precedence + 1;
          }
          // If the first child contains a CALL, then claim higher precedence
          // to force parentheses. Otherwise, when parsed, NEW will bind to the
          // first viable parentheses (don't traverse into functions).
          if (NodeUtil.has(first, Node::isCall, NodeUtil.MATCH_NOT_FUNCTION)) {
            precedence = precedenceOfFirst + 1;
          }
          addExpr(first, precedence, Context.OTHER);
          // '()' is optional when no arguments are present
          Node next = first.getNext();
          if (next != null) {
            add("(");
            addList(next);
            add(")");
          }
          break;
        }

      case STRING_KEY:
        checkState(childCount == 1, n);
        addPropertyName(n);
        add(":");
        addExpr(first, 1, Context.OTHER);
        break;

      case STRINGLIT:
        checkState(childCount == 0, "String node %s may not have children", n);
        addJsString(n.getString());
        break;

      case DELPROP:
        checkState(childCount == 1, n);
        add("delete");
        addExpr(first, NodeUtil.precedence(type), Context.OTHER);
        break;

      case OBJECTLIT:
        {
          boolean needsParens = context == Context.START_OF_EXPR;
          if (needsParens) {
            add("(");
          }
          add("{");
          for (Node c = first; c != null; c = c.getNext()) {
            if (c != first) {
              cc.listSeparator();
            }
            add(c);
          }
          add("}");
          if (needsParens) {
            add(")");
          }
          break;
        }

      case SWITCH:
        add("switch");
        cc.maybeInsertSpace();
        add("(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        cc.beginBlock();
        for (Node c = first.getNext(); c != null; c = c.getNext()) {
          add(c);
        }
        cc.endBlock(context == Context.STATEMENT);
        break;

      case CASE:
        checkState(childCount == 2, n);
        add("case");
        cc.maybeInsertSpace();
        addExpr(first, 0, Context.OTHER);
        addCaseBody(last);
        break;

      case DEFAULT_CASE:
        checkState(childCount == 1, n);
        add("default");
        addCaseBody(first);
        break;

      case LABEL:
        checkState(childCount == 2, n);
        checkState(first.isLabelName(), "Unexpected token type. Should be LABEL_NAME.");
        add(first);
        add(":");
        if (!last.isBlock()) {
          cc.maybeInsertSpace();
        }
        // The labeled statement keeps its braces: they belong to the labeled BLOCK.
        add(
            last,
            context == Context.BEFORE_DANGLING_ELSE
                ? Context.BEFORE_DANGLING_ELSE
                : Context.STATEMENT);
        break;

      default:
        throw new IllegalStateException("Unexpected node " + n);
    }
  }

  private static String declarationKeyword(Token type) {
    switch (type) {
      case VAR:
        return "var";
      case LET:
        return "let";
      case CONST:
        return "const";
      default:
        throw new IllegalStateException("Not a declaration: " + type);
    }
  }

  private void addFunction(Node n, Node first, Node last, Context context) {
    boolean funcNeedsParens = context == Context.START_OF_EXPR;
    if (funcNeedsParens) {
      add("(");
    }

    add("function");
    if (!first.getString().isEmpty()) {
      add(first);
    }

    add(first.getNext()); // param list
    add(last);
    cc.endFunction(context == Context.STATEMENT);

    if (funcNeedsParens) {
      add(")");
    }
  }

  /** Prints the key of an object literal property: quoted if it was, as written otherwise. */
  private void addPropertyName(Node n) {
    String key = n.getString();
    if (n.isQuotedString()) {
      addJsString(key);
    } else {
      // Identifier names, keywords included, and simple numbers.
      add(identifierEscape(key));
    }
  }

  private void unrollBinaryOperator(
      Node n,
      Token op,
      String opStr,
      Context context,
      Context rhsContext,
      int leftPrecedence,
      int rightPrecedence) {
    Node firstNonOperator = n.getFirstChild();
    while (firstNonOperator.getToken() == op) {
      firstNonOperator = firstNonOperator.getFirstChild();
    }

    addExpr(firstNonOperator, leftPrecedence, context);

    Node current = firstNonOperator;
    do {
      current = current.getParent();
      cc.addOp(opStr, true);
      addExpr(current.getSecondChild(), rightPrecedence, rhsContext);
    } while (current != n);
  }

  /**
   * Adds a statement body, which is always a BLOCK, stripping the braces when the block holds a
   * single statement that can stand alone.
   *
   * @param n The node to print.
   * @param context The context to determine how the node should be printed.
   */
  private void addNonEmptyStatement(Node n, Context context) {
    checkState(n.isBlock(), "Missing BLOCK child: %s", n);

    if (!n.hasChildren()) {
      if (cc.shouldPreserveExtraBlocks()) {
        cc.beginBlock();
        cc.endBlock(cc.breakAfterBlockFor(n, context == Context.STATEMENT));
      } else {
        cc.endStatement(true);
      }
      return;
    }

    Node firstAndOnlyChild = n.hasOneChild() ? n.getFirstChild() : null;
    if (firstAndOnlyChild == null
        || cc.shouldPreserveExtraBlocks()
        || needsBlock(firstAndOnlyChild)) {
      add(n, context);
    } else {
      add(firstAndOnlyChild, context);
    }
  }

  /**
   * Whether the statement, as the only statement of a body, must keep its braces: declarations
   * only allowed in blocks, blocks and empty statements whose braces are part of the AST, and DO
   * for old browsers.
   */
  private static boolean needsBlock(Node n) {
    if (n.isLabel()) {
      return needsBlock(n.getLastChild());
    }
    switch (n.getToken()) {
      case LET:
      case CONST:
      case FUNCTION:
      case DO:
      case BLOCK:
      case EMPTY:
        return true;
      default:
        return false;
    }
  }

  private void addExpr(Node n, int minPrecedence, Context context) {
    if (opRequiresParentheses(n, minPrecedence, context)
        || (cc.shouldPreserveParentheses() && n.getIsParenthesized())) {
      add("(");
      add(n, Context.OTHER);
      add(")");
    } else {
      add(n, context);
    }
  }

  private static boolean opRequiresParentheses(Node n, int minPrecedence, Context context) {
    if (context == Context.IN_FOR_INIT_CLAUSE && n.getToken() == Token.IN) {
      // make sure this operator 'in' isn't confused with the for-loop 'in'
      return true;
    } else if (NodeUtil.isUnaryOperator(n) && isFirstOperandOfExponentiationExpression(n)) {
      // Unary operators are higher precedence than '**', but
      // ExponentiationExpression cannot expand to
      //     UnaryExpression ** ExponentiationExpression
      return true;
    } else {
      return NodeUtil.precedence(n.getToken()) < minPrecedence;
    }
  }

  private static boolean isFirstOperandOfExponentiationExpression(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.getToken() == Token.EXPONENT && parent.getFirstChild() == n;
  }

  private void addList(Node firstInList) {
    addList(firstInList, true, Context.OTHER);
  }

  private void addList(Node firstInList, boolean isArrayOrFunctionArgument, Context lhsContext) {
    for (Node n = firstInList; n != null; n = n.getNext()) {
      boolean isFirst = n == firstInList;
      if (isFirst) {
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, lhsContext);
      } else {
        cc.listSeparator();
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, getContextForNoInOperator(lhsContext));
      }
    }
  }

  /**
   * This function adds a comma-separated list as is specified by an ARRAYLIT node. A trailing hole
   * needs a second comma, the last comma of an array literal being ignored.
   */
  private void addArrayList(Node firstInList) {
    boolean lastWasEmpty = false;
    for (Node n = firstInList; n != null; n = n.getNext()) {
      if (n != firstInList) {
        cc.listSeparator();
      }
      addExpr(n, 1, Context.OTHER);
      lastWasEmpty = n.isEmpty();
    }

    if (lastWasEmpty) {
      cc.listSeparator();
    }
  }

  private void addCaseBody(Node caseBody) {
    checkState(caseBody.isBlock(), caseBody);
    cc.beginCaseBody();
    for (Node c = caseBody.getFirstChild(); c != null; c = c.getNext()) {
      add(c, Context.STATEMENT);
    }
    cc.endCaseBody();
  }

  /** Outputs a JS string, using the optimal (single/double) quote character */
  private void addJsString(String s) {
    add(escapedJsStrings.computeIfAbsent(s, CodeGenerator::jsString));
  }

  static String jsString(String s) {
    int singleq = 0;
    int doubleq = 0;

    // could count the quotes and pick the optimal quote character
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '"':
          doubleq++;
          break;
        case '\'':
          singleq++;
          break;
        default: // skip non-quote characters
      }
    }

    String doublequote;
    String singlequote;
    char quote;
    if (singleq < doubleq) {
      // more double quotes so enclose in single quotes.
      quote = '\'';
      doublequote = "\"";
      singlequote = "\\'";
    } else {
      // more single quotes so escape the doubles
      quote = '"';
      doublequote = "\\\"";
      singlequote = "'";
    }

    return quote + strEscape(s, doublequote, singlequote) + quote;
  }

  private static String strEscape(String s, String doublequoteEscape, String singlequoteEscape) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append("\\x00");
          break;
        case '\u000B':
          sb.append("\\x0B");
          break;
          // From the SingleEscapeCharacter grammar production.
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append(doublequoteEscape);
          break;
        case '\'':
          sb.append(singlequoteEscape);
          break;

          // From LineTerminators (ES5 Section 7.3, Table 3)
        case '\u2028':
          sb.append("\\u2028");
          break;
        case '\u2029':
          sb.append("\\u2029");
          break;

        case '>':
          // Break --> into --\> or ]]> into ]]\>
          if (i >= 2
              && ((s.charAt(i - 1) == '-' && s.charAt(i - 2) == '-')
                  || (s.charAt(i - 1) == ']' && s.charAt(i - 2) == ']'))) {
            sb.append(GT_ESCAPED);
          } else {
            sb.append(c);
          }
          break;
        case '<':
          // Break </script into <\/script
          final String endScript = "/script";

          // Break <!-- into <\!--
          final String startComment = "!--";

          if (s.regionMatches(true, i + 1, endScript, 0, endScript.length())) {
            sb.append(LT_ESCAPED);
          } else if (s.regionMatches(false, i + 1, startComment, 0, startComment.length())) {
            sb.append(LT_ESCAPED);
          } else {
            sb.append(c);
          }
          break;
        default:
          if (c > 0x1f && c < 0x7f) {
            sb.append(c);
          } else {
            // Other characters can be misinterpreted by some JS parsers,
            // or perhaps mangled by proxies along the way,
            // so we play it safe and Unicode escape them.
            Util.appendHexJavaScriptRepresentation(sb, c);
          }
      }
    }
    return sb.toString();
  }

  static String identifierEscape(String s) {
    // First check if escaping is needed at all -- in most cases it isn't.
    if (isLatin(s)) {
      return s;
    }

    // Now going through the string to escape non-Latin characters if needed.
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      // Identifiers should always go to Latin1/ ASCII characters because
      // different browser's rules for valid identifier characters are
      // crazy.
      if (c > 0x1F && c < 0x7F) {
        sb.append(c);
      } else {
        Util.appendHexJavaScriptRepresentation(sb, c);
      }
    }
    return sb.toString();
  }

  private static boolean isLatin(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c <= 0x1F || c >= 0x7F) {
        return false;
      }
    }
    return true;
  }

  /**
   * Information on the current context. Used for disambiguating special cases. For example, a "{"
   * could indicate the start of an object literal or a block, depending on the current context.
   */
  enum Context {
    STATEMENT,
    BEFORE_DANGLING_ELSE, // a hack to resolve the else-clause ambiguity
    START_OF_EXPR,
    // Are we inside the init clause of a for loop?  If so, the containing
    // expression can't contain an in operator.  Pass this context flag down
    // until we reach expressions which no longer have the limitation.
    IN_FOR_INIT_CLAUSE,
    OTHER // nothing special to watch out for.
  }

  private static Context getContextForNonEmptyExpression(Context currentContext) {
    return currentContext == Context.BEFORE_DANGLING_ELSE
        ? Context.BEFORE_DANGLING_ELSE
        : Context.OTHER;
  }

  /**
   * If we're in a IN_FOR_INIT_CLAUSE, we can't permit in operators in the expression. Pass on the
   * IN_FOR_INIT_CLAUSE flag through subexpressions.
   */
  private static Context getContextForNoInOperator(Context context) {
    return context == Context.IN_FOR_INIT_CLAUSE ? context : Context.OTHER;
  }
}
