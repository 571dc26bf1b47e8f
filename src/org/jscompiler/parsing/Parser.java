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

package org.jscompiler.parsing;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jscompiler.ir.DToA;
import org.jscompiler.ir.IR;
import org.jscompiler.ir.Node;
import org.jscompiler.ir.Token;
import org.jspecify.annotations.Nullable;

/**
 * A recursive descent parser for ES5 plus {@code let}, {@code const} and {@code **}. Binary
 * operators are parsed by precedence climbing.
 *
 * <p>Parsing stops at the first error: {@link #parse} either returns a complete SCRIPT or throws.
 */
public class Parser {

  /** Words reserved for syntax this parser does not accept. */
  private static final ImmutableSet<String> FUTURE_RESERVED_WORDS =
      ImmutableSet.of("class", "enum", "export", "extends", "import", "super");

  private final Scanner scanner;
  private final Deque<JsToken> lookahead = new ArrayDeque<>();

  private FunctionContext context = new FunctionContext(false);

  /** Jump targets visible from the code being parsed, reset at function boundaries. */
  private static final class FunctionContext {
    final boolean inFunction;
    int loopDepth;
    int switchDepth;
    final List<Label> labels = new ArrayList<>();
    final List<Label> pendingLabels = new ArrayList<>();

    FunctionContext(boolean inFunction) {
      this.inFunction = inFunction;
    }

    @Nullable Label findLabel(String name) {
      for (Label label : labels) {
        if (label.name.equals(name)) {
          return label;
        }
      }
      return null;
    }
  }

  private static final class Label {
    final String name;
    boolean isLoop;

    Label(String name) {
      this.name = name;
    }
  }

  public Parser(String source) {
    this.scanner = new Scanner(source);
  }

  /** Parses the whole source. */
  public Node parse() throws ParseException {
    Node script = IR.script();
    script.setLinenoCharno(1, 0);
    while (peekType() != TokenType.END_OF_FILE) {
      script.addChildToBack(parseStatementListItem());
    }
    return script;
  }

  // Statements

  private Node parseStatementListItem() throws ParseException {
    if (isLexicalDeclarationStart()) {
      context.pendingLabels.clear();
      Node decl = parseVariableDeclarationList(declarationToken(), true);
      consumeSemicolon();
      return decl;
    }
    return parseStatement();
  }

  private Node parseStatement() throws ParseException {
    JsToken t = peek();
    switch (t.getType()) {
      case FOR:
      case WHILE:
      case DO:
        for (Label label : context.pendingLabels) {
          label.isLoop = true;
        }
        context.pendingLabels.clear();
        break;
      case IDENTIFIER:
        if (peekSecond().getType() != TokenType.COLON) {
          context.pendingLabels.clear();
        }
        break;
      default:
        context.pendingLabels.clear();
        break;
    }

    switch (t.getType()) {
      case OPEN_CURLY:
        return parseBlock();
      case VAR:
        {
          Node decl = parseVariableDeclarationList(Token.VAR, true);
          consumeSemicolon();
          return decl;
        }
      case CONST:
        throw error(t, "Lexical declaration cannot appear in a single-statement context");
      case SEMI_COLON:
        next();
        return position(IR.empty(), t);
      case IF:
        return parseIfStatement();
      case FOR:
        return parseForStatement();
      case WHILE:
        return parseWhileStatement();
      case DO:
        return parseDoWhileStatement();
      case CONTINUE:
        return parseContinueStatement();
      case BREAK:
        return parseBreakStatement();
      case RETURN:
        return parseReturnStatement();
      case WITH:
        return parseWithStatement();
      case SWITCH:
        return parseSwitchStatement();
      case THROW:
        return parseThrowStatement();
      case TRY:
        return parseTryStatement();
      case DEBUGGER:
        next();
        consumeSemicolon();
        return position(new Node(Token.DEBUGGER), t);
      case FUNCTION:
        return parseFunction(true);
      case IDENTIFIER:
        if (isLexicalDeclarationStart()) {
          throw error(t, "Lexical declaration cannot appear in a single-statement context");
        }
        if (peekSecond().getType() == TokenType.COLON) {
          return parseLabelledStatement();
        }
        return parseExpressionStatement();
      default:
        return parseExpressionStatement();
    }
  }

  private boolean isLexicalDeclarationStart() throws ParseException {
    JsToken t = peek();
    if (t.getType() == TokenType.CONST) {
      return true;
    }
    return t.getType() == TokenType.IDENTIFIER
        && t.getValue().equals("let")
        && t.getEnd() - t.getStart() == 3
        && peekSecond().getType() == TokenType.IDENTIFIER;
  }

  private Token declarationToken() throws ParseException {
    return peekType() == TokenType.CONST ? Token.CONST : Token.LET;
  }

  private Node parseBlock() throws ParseException {
    JsToken start = expect(TokenType.OPEN_CURLY);
    Node block = position(IR.block(), start);
    while (peekType() != TokenType.CLOSE_CURLY) {
      if (peekType() == TokenType.END_OF_FILE) {
        throw error(peek(), "'}' expected");
      }
      block.addChildToBack(parseStatementListItem());
    }
    next();
    return block;
  }

  /** Parses a var, let or const declaration, excluding the terminating semicolon. */
  private Node parseVariableDeclarationList(Token kind, boolean allowIn) throws ParseException {
    JsToken start = next();
    Node decl = position(new Node(kind), start);
    do {
      JsToken nameToken = expectBindingIdentifier();
      if (kind != Token.VAR && nameToken.getValue().equals("let")) {
        throw error(nameToken, "let is disallowed as a lexically bound name");
      }
      Node name = position(IR.name(nameToken.getValue()), nameToken);
      if (eat(TokenType.EQUAL)) {
        name.addChildToBack(parseAssignment(allowIn));
      }
      decl.addChildToBack(name);
    } while (eat(TokenType.COMMA));

    // A const without initializer is only valid as a for-in target.
    boolean forInTarget = !allowIn && peekType() == TokenType.IN;
    if (kind == Token.CONST && !forInTarget) {
      for (Node name = decl.getFirstChild(); name != null; name = name.getNext()) {
        if (!name.hasChildren()) {
          throw error(name, "const variables must have an initializer");
        }
      }
    }
    return decl;
  }

  private Node parseIfStatement() throws ParseException {
    JsToken start = expect(TokenType.IF);
    Node condition = parseParenExpression();
    Node thenBranch = ensureBlock(parseStatement());
    Node n;
    if (eat(TokenType.ELSE)) {
      Node elseBranch = ensureBlock(parseStatement());
      n = IR.ifNode(condition, thenBranch, elseBranch);
    } else {
      n = IR.ifNode(condition, thenBranch);
    }
    return position(n, start);
  }

  private Node parseForStatement() throws ParseException {
    JsToken start = expect(TokenType.FOR);
    expect(TokenType.OPEN_PAREN);

    Node initializer;
    if (peekType() == TokenType.SEMI_COLON) {
      initializer = position(IR.empty(), peek());
    } else if (peekType() == TokenType.VAR) {
      initializer = parseVariableDeclarationList(Token.VAR, false);
    } else if (isLexicalDeclarationStart()) {
      initializer = parseVariableDeclarationList(declarationToken(), false);
    } else {
      initializer = parseExpression(false);
    }

    if (peekType() == TokenType.IN) {
      JsToken in = next();
      if (initializer.isNameDeclaration()) {
        if (!initializer.hasOneChild()) {
          throw error(initializer, "for-in statement may not have more than one variable");
        }
        if (initializer.getFirstChild().hasChildren()) {
          throw error(
              initializer.getFirstChild(),
              "for-in statement may not have initializer");
        }
      } else if (initializer.isEmpty() || !isSimpleAssignmentTarget(initializer)) {
        throw error(in, "Invalid left hand side of for-in");
      }
      Node collection = parseExpression(true);
      expect(TokenType.CLOSE_PAREN);
      Node body = parseLoopBody();
      return position(new Node(Token.FOR_IN, initializer, collection, body), start);
    }

    expect(TokenType.SEMI_COLON);
    Node condition =
        peekType() == TokenType.SEMI_COLON ? position(IR.empty(), peek()) : parseExpression(true);
    expect(TokenType.SEMI_COLON);
    Node increment =
        peekType() == TokenType.CLOSE_PAREN ? position(IR.empty(), peek()) : parseExpression(true);
    expect(TokenType.CLOSE_PAREN);
    Node body = parseLoopBody();
    return position(IR.forNode(initializer, condition, increment, body), start);
  }

  private Node parseWhileStatement() throws ParseException {
    JsToken start = expect(TokenType.WHILE);
    Node condition = parseParenExpression();
    Node body = parseLoopBody();
    return position(IR.whileNode(condition, body), start);
  }

  private Node parseDoWhileStatement() throws ParseException {
    JsToken start = expect(TokenType.DO);
    Node body = parseLoopBody();
    expect(TokenType.WHILE);
    Node condition = parseParenExpression();
    // The semicolon after do-while is always optional.
    eat(TokenType.SEMI_COLON);
    return position(new Node(Token.DO, body, condition), start);
  }

  private Node parseLoopBody() throws ParseException {
    context.loopDepth++;
    try {
      return ensureBlock(parseStatement());
    } finally {
      context.loopDepth--;
    }
  }

  private Node parseContinueStatement() throws ParseException {
    JsToken start = expect(TokenType.CONTINUE);
    Node n = position(new Node(Token.CONTINUE), start);
    Node label = parseJumpLabel();
    if (label != null) {
      Label target = context.findLabel(label.getString());
      if (target == null) {
        throw error(label, "undefined label \"" + label.getString() + "\"");
      }
      if (!target.isLoop) {
        throw error(label, "continue must refer to a loop label");
      }
      n.addChildToBack(label);
    } else if (context.loopDepth == 0) {
      throw error(start, "continue must be inside loop");
    }
    consumeSemicolon();
    return n;
  }

  private Node parseBreakStatement() throws ParseException {
    JsToken start = expect(TokenType.BREAK);
    Node n = position(new Node(Token.BREAK), start);
    Node label = parseJumpLabel();
    if (label != null) {
      if (context.findLabel(label.getString()) == null) {
        throw error(label, "undefined label \"" + label.getString() + "\"");
      }
      n.addChildToBack(label);
    } else if (context.loopDepth == 0 && context.switchDepth == 0) {
      throw error(start, "break must be inside loop or switch");
    }
    consumeSemicolon();
    return n;
  }

  private @Nullable Node parseJumpLabel() throws ParseException {
    JsToken t = peek();
    if (t.getType() != TokenType.IDENTIFIER || t.isPrecededByNewline()) {
      return null;
    }
    next();
    return position(IR.labelName(t.getValue()), t);
  }

  private Node parseReturnStatement() throws ParseException {
    JsToken start = expect(TokenType.RETURN);
    if (!context.inFunction) {
      throw error(start, "return must be inside function");
    }
    Node n = position(IR.returnNode(), start);
    if (!isStatementEnd()) {
      n.addChildToBack(parseExpression(true));
    }
    consumeSemicolon();
    return n;
  }

  private Node parseWithStatement() throws ParseException {
    JsToken start = expect(TokenType.WITH);
    Node object = parseParenExpression();
    Node body = ensureBlock(parseStatement());
    return position(new Node(Token.WITH, object, body), start);
  }

  private Node parseSwitchStatement() throws ParseException {
    JsToken start = expect(TokenType.SWITCH);
    Node n = position(new Node(Token.SWITCH, parseParenExpression()), start);
    expect(TokenType.OPEN_CURLY);
    context.switchDepth++;
    try {
      boolean sawDefault = false;
      while (!eat(TokenType.CLOSE_CURLY)) {
        JsToken clauseStart = next();
        Node clause;
        if (clauseStart.getType() == TokenType.CASE) {
          clause = new Node(Token.CASE, parseExpression(true));
        } else if (clauseStart.getType() == TokenType.DEFAULT) {
          if (sawDefault) {
            throw error(clauseStart, "Switch statements may have at most one default clause");
          }
          sawDefault = true;
          clause = new Node(Token.DEFAULT_CASE);
        } else {
          throw error(clauseStart, "'case' or 'default' expected");
        }
        position(clause, clauseStart);
        expect(TokenType.COLON);
        Node body = position(IR.block(), clauseStart);
        while (peekType() != TokenType.CASE
            && peekType() != TokenType.DEFAULT
            && peekType() != TokenType.CLOSE_CURLY) {
          if (peekType() == TokenType.END_OF_FILE) {
            throw error(peek(), "'}' expected");
          }
          body.addChildToBack(parseStatementListItem());
        }
        clause.addChildToBack(body);
        n.addChildToBack(clause);
      }
    } finally {
      context.switchDepth--;
    }
    return n;
  }

  private Node parseThrowStatement() throws ParseException {
    JsToken start = expect(TokenType.THROW);
    if (peek().isPrecededByNewline() || isStatementEnd()) {
      throw error(peek(), "semicolon/newline not allowed after 'throw'");
    }
    Node n = position(new Node(Token.THROW, parseExpression(true)), start);
    consumeSemicolon();
    return n;
  }

  private Node parseTryStatement() throws ParseException {
    JsToken start = expect(TokenType.TRY);
    Node tryBody = parseBlock();
    Node catchBlock = position(IR.block(), peek());
    if (peekType() == TokenType.CATCH) {
      JsToken catchStart = next();
      expect(TokenType.OPEN_PAREN);
      JsToken paramToken = expectBindingIdentifier();
      expect(TokenType.CLOSE_PAREN);
      Node param = position(IR.name(paramToken.getValue()), paramToken);
      catchBlock.addChildToBack(position(new Node(Token.CATCH, param, parseBlock()), catchStart));
    }
    Node n = position(new Node(Token.TRY, tryBody, catchBlock), start);
    if (eat(TokenType.FINALLY)) {
      n.addChildToBack(parseBlock());
    } else if (!catchBlock.hasChildren()) {
      throw error(peek(), "'catch' or 'finally' expected");
    }
    return n;
  }

  private Node parseLabelledStatement() throws ParseException {
    JsToken nameToken = expectBindingIdentifier();
    expect(TokenType.COLON);
    if (context.findLabel(nameToken.getValue()) != null) {
      throw error(nameToken, "Duplicate label \"" + nameToken.getValue() + "\"");
    }
    Label label = new Label(nameToken.getValue());
    context.labels.add(label);
    context.pendingLabels.add(label);
    try {
      Node statement = parseStatement();
      if (statement.isFunction()) {
        throw error(statement, "functions can only be declared at top level or in blocks");
      }
      return position(
          new Node(Token.LABEL, position(IR.labelName(nameToken.getValue()), nameToken),
              statement),
          nameToken);
    } finally {
      context.labels.remove(label);
      context.pendingLabels.remove(label);
    }
  }

  private Node parseExpressionStatement() throws ParseException {
    JsToken start = peek();
    Node expression = parseExpression(true);
    consumeSemicolon();
    return position(IR.exprResult(expression), start);
  }

  private Node parseFunction(boolean isDeclaration) throws ParseException {
    JsToken start = expect(TokenType.FUNCTION);
    Node name;
    if (peekType() == TokenType.IDENTIFIER) {
      JsToken nameToken = expectBindingIdentifier();
      name = position(IR.name(nameToken.getValue()), nameToken);
    } else if (isDeclaration) {
      throw error(peek(), "'identifier' expected");
    } else {
      name = position(IR.name(""), start);
    }
    return position(parseFunctionTail(name), start);
  }

  /** Parses the parameters and body following a function's name. */
  private Node parseFunctionTail(Node name) throws ParseException {
    JsToken paramStart = expect(TokenType.OPEN_PAREN);
    Node params = position(IR.paramList(), paramStart);
    if (peekType() != TokenType.CLOSE_PAREN) {
      do {
        JsToken paramToken = expectBindingIdentifier();
        params.addChildToBack(position(IR.name(paramToken.getValue()), paramToken));
      } while (eat(TokenType.COMMA));
    }
    expect(TokenType.CLOSE_PAREN);

    FunctionContext outer = context;
    context = new FunctionContext(true);
    try {
      return IR.function(name, params, parseBlock());
    } finally {
      context = outer;
    }
  }

  // Expressions

  private Node parseParenExpression() throws ParseException {
    expect(TokenType.OPEN_PAREN);
    Node n = parseExpression(true);
    expect(TokenType.CLOSE_PAREN);
    return n;
  }

  private Node parseExpression(boolean allowIn) throws ParseException {
    JsToken start = peek();
    Node result = parseAssignment(allowIn);
    while (eat(TokenType.COMMA)) {
      result = position(new Node(Token.COMMA, result, parseAssignment(allowIn)), start);
    }
    return result;
  }

  private Node parseAssignment(boolean allowIn) throws ParseException {
    JsToken start = peek();
    Node left = parseConditional(allowIn);
    Token assignToken = assignmentToken(peekType());
    if (assignToken == null) {
      return left;
    }
    JsToken operator = next();
    if (!isSimpleAssignmentTarget(left)) {
      throw error(operator, "invalid assignment target");
    }
    Node right = parseAssignment(allowIn);
    return position(new Node(assignToken, left, right), start);
  }

  private Node parseConditional(boolean allowIn) throws ParseException {
    JsToken start = peek();
    Node condition = parseBinary(0, allowIn);
    if (!eat(TokenType.QUESTION)) {
      return condition;
    }
    Node left = parseAssignment(true);
    expect(TokenType.COLON);
    Node right = parseAssignment(allowIn);
    return position(new Node(Token.HOOK, condition, left, right), start);
  }

  private Node parseBinary(int minPrecedence, boolean allowIn) throws ParseException {
    JsToken start = peek();
    Node left = parseUnary();
    while (true) {
      TokenType type = peekType();
      int precedence = binaryPrecedence(type, allowIn);
      if (precedence < 0 || precedence < minPrecedence) {
        return left;
      }
      JsToken operator = next();
      Node right;
      if (type == TokenType.STAR_STAR) {
        if (isUnaryOperator(left) && !left.getIsParenthesized()) {
          throw error(
              operator,
              "Unary operator '" + left.getToken() + "' requires parentheses before '**'");
        }
        right = parseBinary(precedence, allowIn);
      } else {
        right = parseBinary(precedence + 1, allowIn);
      }
      left = position(new Node(binaryToken(type), left, right), start);
    }
  }

  private Node parseUnary() throws ParseException {
    JsToken start = peek();
    Token unaryToken;
    switch (start.getType()) {
      case DELETE:
        unaryToken = Token.DELPROP;
        break;
      case VOID:
        unaryToken = Token.VOID;
        break;
      case TYPEOF:
        unaryToken = Token.TYPEOF;
        break;
      case PLUS:
        unaryToken = Token.POS;
        break;
      case MINUS:
        unaryToken = Token.NEG;
        break;
      case TILDE:
        unaryToken = Token.BITNOT;
        break;
      case BANG:
        unaryToken = Token.NOT;
        break;
      case PLUS_PLUS:
      case MINUS_MINUS:
        {
          next();
          Node operand = parseUnary();
          if (!isSimpleAssignmentTarget(operand)) {
            throw error(start, "invalid increment target");
          }
          Token token = start.getType() == TokenType.PLUS_PLUS ? Token.INC : Token.DEC;
          Node n = new Node(token, operand);
          n.setPostfix(false);
          return position(n, start);
        }
      default:
        return parsePostfix();
    }
    next();
    return position(new Node(unaryToken, parseUnary()), start);
  }

  private Node parsePostfix() throws ParseException {
    JsToken start = peek();
    Node operand = parseLeftHandSide();
    JsToken t = peek();
    if ((t.getType() == TokenType.PLUS_PLUS || t.getType() == TokenType.MINUS_MINUS)
        && !t.isPrecededByNewline()) {
      next();
      if (!isSimpleAssignmentTarget(operand)) {
        throw error(t, "invalid increment target");
      }
      Node n = new Node(t.getType() == TokenType.PLUS_PLUS ? Token.INC : Token.DEC, operand);
      n.setPostfix(true);
      return position(n, start);
    }
    return operand;
  }

  private Node parseLeftHandSide() throws ParseException {
    JsToken start = peek();
    Node n = peekType() == TokenType.NEW ? parseNewExpression() : parsePrimary();
    while (true) {
      switch (peekType()) {
        case PERIOD:
        case OPEN_SQUARE:
          n = parseMemberSuffix(n, start);
          break;
        case OPEN_PAREN:
          {
            Node call = position(new Node(Token.CALL, n), start);
            parseArguments(call);
            n = call;
            break;
          }
        default:
          return n;
      }
    }
  }

  private Node parseNewExpression() throws ParseException {
    JsToken start = expect(TokenType.NEW);
    JsToken calleeStart = peek();
    Node callee = peekType() == TokenType.NEW ? parseNewExpression() : parsePrimary();
    while (peekType() == TokenType.PERIOD || peekType() == TokenType.OPEN_SQUARE) {
      callee = parseMemberSuffix(callee, calleeStart);
    }
    Node n = position(new Node(Token.NEW, callee), start);
    if (peekType() == TokenType.OPEN_PAREN) {
      parseArguments(n);
    }
    return n;
  }

  private Node parseMemberSuffix(Node object, JsToken start) throws ParseException {
    if (eat(TokenType.PERIOD)) {
      JsToken property = next();
      if (!property.isIdentifierName()) {
        throw error(property, "'identifier' expected");
      }
      Node n = position(Node.newString(Token.GETPROP, property.getValue()), start);
      n.addChildToBack(object);
      return n;
    }
    expect(TokenType.OPEN_SQUARE);
    Node index = parseExpression(true);
    expect(TokenType.CLOSE_SQUARE);
    return position(new Node(Token.GETELEM, object, index), start);
  }

  private void parseArguments(Node callOrNew) throws ParseException {
    expect(TokenType.OPEN_PAREN);
    if (!eat(TokenType.CLOSE_PAREN)) {
      do {
        callOrNew.addChildToBack(parseAssignment(true));
      } while (eat(TokenType.COMMA));
      expect(TokenType.CLOSE_PAREN);
    }
  }

  private Node parsePrimary() throws ParseException {
    JsToken t = peek();
    switch (t.getType()) {
      case THIS:
        next();
        return position(new Node(Token.THIS), t);
      case NULL:
        next();
        return position(IR.nullNode(), t);
      case TRUE:
        next();
        return position(IR.trueNode(), t);
      case FALSE:
        next();
        return position(IR.falseNode(), t);
      case IDENTIFIER:
        {
          JsToken name = expectIdentifierReference();
          return position(IR.name(name.getValue()), name);
        }
      case NUMBER:
        next();
        return position(IR.number(t.getNumber()), t);
      case STRING:
        next();
        return position(IR.string(t.getValue()), t);
      case SLASH:
      case SLASH_EQUAL:
        return parseRegularExpression();
      case OPEN_PAREN:
        {
          next();
          Node n = parseExpression(true);
          expect(TokenType.CLOSE_PAREN);
          n.setIsParenthesized(true);
          return n;
        }
      case OPEN_SQUARE:
        return parseArrayLiteral();
      case OPEN_CURLY:
        return parseObjectLiteral();
      case FUNCTION:
        return parseFunction(false);
      case END_OF_FILE:
        throw error(t, "Unexpected end of input");
      default:
        throw error(t, "primary expression expected");
    }
  }

  private Node parseRegularExpression() throws ParseException {
    JsToken slash = next();
    JsToken regExp = scanner.rescanAsRegExp(slash);
    Node n = position(new Node(Token.REGEXP, position(IR.string(regExp.getValue()), regExp)),
        regExp);
    if (!regExp.getRegExpFlags().isEmpty()) {
      n.addChildToBack(position(IR.string(regExp.getRegExpFlags()), regExp));
    }
    return n;
  }

  private Node parseArrayLiteral() throws ParseException {
    JsToken start = expect(TokenType.OPEN_SQUARE);
    Node array = position(new Node(Token.ARRAYLIT), start);
    while (!eat(TokenType.CLOSE_SQUARE)) {
      if (peekType() == TokenType.COMMA) {
        array.addChildToBack(position(IR.empty(), next()));
        continue;
      }
      array.addChildToBack(parseAssignment(true));
      if (peekType() != TokenType.CLOSE_SQUARE) {
        expect(TokenType.COMMA);
      }
    }
    return array;
  }

  private Node parseObjectLiteral() throws ParseException {
    JsToken start = expect(TokenType.OPEN_CURLY);
    Node object = position(new Node(Token.OBJECTLIT), start);
    while (!eat(TokenType.CLOSE_CURLY)) {
      object.addChildToBack(parsePropertyDefinition());
      if (peekType() != TokenType.CLOSE_CURLY) {
        expect(TokenType.COMMA);
      }
    }
    return object;
  }

  private Node parsePropertyDefinition() throws ParseException {
    JsToken t = peek();
    if (t.getType() == TokenType.IDENTIFIER
        && (t.getValue().equals("get") || t.getValue().equals("set"))
        && isPropertyNameStart(peekSecond())) {
      next();
      boolean isGetter = t.getValue().equals("get");
      Node key = parsePropertyName(isGetter ? Token.GETTER_DEF : Token.SETTER_DEF);
      JsToken paramStart = peek();
      Node function = position(parseFunctionTail(position(IR.name(""), paramStart)), paramStart);
      int paramCount = function.getSecondChild().getChildCount();
      if (isGetter && paramCount != 0) {
        throw error(paramStart, "Getter must not have any parameters");
      } else if (!isGetter && paramCount != 1) {
        throw error(paramStart, "Setter must have exactly one parameter");
      }
      key.addChildToBack(function);
      return position(key, t);
    }
    Node key = parsePropertyName(Token.STRING_KEY);
    expect(TokenType.COLON);
    key.addChildToBack(parseAssignment(true));
    return key;
  }

  private static boolean isPropertyNameStart(JsToken t) {
    return t.isIdentifierName()
        || t.getType() == TokenType.STRING
        || t.getType() == TokenType.NUMBER;
  }

  private Node parsePropertyName(Token keyToken) throws ParseException {
    JsToken t = next();
    Node key;
    if (t.isIdentifierName()) {
      key = Node.newString(keyToken, t.getValue());
    } else if (t.getType() == TokenType.STRING) {
      key = Node.newString(keyToken, t.getValue());
      key.setQuotedString();
    } else if (t.getType() == TokenType.NUMBER) {
      String value = DToA.numberToString(t.getNumber());
      key = Node.newString(keyToken, value);
      if (!isSimpleNumber(value)) {
        key.setQuotedString();
      }
    } else {
      throw error(t, "'identifier' expected");
    }
    return position(key, t);
  }

  /** Whether a numeric key can be printed back without quotes and read as the same string. */
  static boolean isSimpleNumber(String s) {
    if (s.isEmpty() || s.startsWith(".") || s.endsWith(".")) {
      return false;
    }
    if (s.length() > 1 && s.charAt(0) == '0' && s.charAt(1) != '.') {
      return false;
    }
    boolean seenDot = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '.' && !seenDot) {
        seenDot = true;
      } else if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  // Helpers

  private static boolean isSimpleAssignmentTarget(Node n) {
    return n.isName() || n.isGetProp() || n.isGetElem();
  }

  private static boolean isUnaryOperator(Node n) {
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

  private static int binaryPrecedence(TokenType type, boolean allowIn) {
    switch (type) {
      case OR:
        return 1;
      case AND:
        return 2;
      case BAR:
        return 3;
      case CARET:
        return 4;
      case AMPERSAND:
        return 5;
      case EQUAL_EQUAL:
      case NOT_EQUAL:
      case EQUAL_EQUAL_EQUAL:
      case NOT_EQUAL_EQUAL:
        return 6;
      case IN:
        return allowIn ? 7 : -1;
      case OPEN_ANGLE:
      case CLOSE_ANGLE:
      case LESS_EQUAL:
      case GREATER_EQUAL:
      case INSTANCEOF:
        return 7;
      case LEFT_SHIFT:
      case RIGHT_SHIFT:
      case UNSIGNED_RIGHT_SHIFT:
        return 8;
      case PLUS:
      case MINUS:
        return 9;
      case STAR:
      case SLASH:
      case PERCENT:
        return 10;
      case STAR_STAR:
        return 11;
      default:
        return -1;
    }
  }

  private static Token binaryToken(TokenType type) {
    switch (type) {
      case OR:
        return Token.OR;
      case AND:
        return Token.AND;
      case BAR:
        return Token.BITOR;
      case CARET:
        return Token.BITXOR;
      case AMPERSAND:
        return Token.BITAND;
      case EQUAL_EQUAL:
        return Token.EQ;
      case NOT_EQUAL:
        return Token.NE;
      case EQUAL_EQUAL_EQUAL:
        return Token.SHEQ;
      case NOT_EQUAL_EQUAL:
        return Token.SHNE;
      case IN:
        return Token.IN;
      case INSTANCEOF:
        return Token.INSTANCEOF;
      case OPEN_ANGLE:
        return Token.LT;
      case CLOSE_ANGLE:
        return Token.GT;
      case LESS_EQUAL:
        return Token.LE;
      case GREATER_EQUAL:
        return Token.GE;
      case LEFT_SHIFT:
        return Token.LSH;
      case RIGHT_SHIFT:
        return Token.RSH;
      case UNSIGNED_RIGHT_SHIFT:
        return Token.URSH;
      case PLUS:
        return Token.ADD;
      case MINUS:
        return Token.SUB;
      case STAR:
        return Token.MUL;
      case SLASH:
        return Token.DIV;
      case PERCENT:
        return Token.MOD;
      case STAR_STAR:
        return Token.EXPONENT;
      default:
        throw new IllegalStateException("not a binary operator: " + type);
    }
  }

  private static @Nullable Token assignmentToken(TokenType type) {
    switch (type) {
      case EQUAL:
        return Token.ASSIGN;
      case BAR_EQUAL:
        return Token.ASSIGN_BITOR;
      case CARET_EQUAL:
        return Token.ASSIGN_BITXOR;
      case AMPERSAND_EQUAL:
        return Token.ASSIGN_BITAND;
      case LEFT_SHIFT_EQUAL:
        return Token.ASSIGN_LSH;
      case RIGHT_SHIFT_EQUAL:
        return Token.ASSIGN_RSH;
      case UNSIGNED_RIGHT_SHIFT_EQUAL:
        return Token.ASSIGN_URSH;
      case PLUS_EQUAL:
        return Token.ASSIGN_ADD;
      case MINUS_EQUAL:
        return Token.ASSIGN_SUB;
      case STAR_EQUAL:
        return Token.ASSIGN_MUL;
      case SLASH_EQUAL:
        return Token.ASSIGN_DIV;
      case PERCENT_EQUAL:
        return Token.ASSIGN_MOD;
      case STAR_STAR_EQUAL:
        return Token.ASSIGN_EXPONENT;
      default:
        return null;
    }
  }

  private static Node ensureBlock(Node statement) {
    if (statement.isBlock()) {
      return statement;
    } else if (statement.isEmpty()) {
      // if (x);
      return IR.block().srcref(statement);
    }
    return IR.block(statement).srcref(statement);
  }

  private static Node position(Node n, JsToken t) {
    return n.setLinenoCharno(t.getLine(), t.getColumn());
  }

  private boolean isStatementEnd() throws ParseException {
    JsToken t = peek();
    return t.getType() == TokenType.SEMI_COLON
        || t.getType() == TokenType.CLOSE_CURLY
        || t.getType() == TokenType.END_OF_FILE
        || t.isPrecededByNewline();
  }

  /** Consumes a semicolon or accepts its automatic insertion. */
  private void consumeSemicolon() throws ParseException {
    if (eat(TokenType.SEMI_COLON)) {
      return;
    }
    if (!isStatementEnd()) {
      throw error(peek(), "Semi-colon expected");
    }
  }

  private JsToken expectBindingIdentifier() throws ParseException {
    JsToken t = peek();
    if (t.getType() != TokenType.IDENTIFIER) {
      throw error(t, "'identifier' expected");
    }
    return expectIdentifierReference();
  }

  private JsToken expectIdentifierReference() throws ParseException {
    JsToken t = expect(TokenType.IDENTIFIER);
    if (FUTURE_RESERVED_WORDS.contains(t.getValue())) {
      throw error(t, "'" + t.getValue() + "' is a reserved word and is not supported");
    }
    return t;
  }

  private TokenType peekType() throws ParseException {
    return peek().getType();
  }

  private JsToken peek() throws ParseException {
    if (lookahead.isEmpty()) {
      lookahead.add(scanner.nextToken());
    }
    return lookahead.getFirst();
  }

  private JsToken peekSecond() throws ParseException {
    peek();
    if (lookahead.size() < 2) {
      lookahead.add(scanner.nextToken());
    }
    return lookahead.getLast();
  }

  private JsToken next() throws ParseException {
    JsToken t = peek();
    lookahead.removeFirst();
    return t;
  }

  private boolean eat(TokenType type) throws ParseException {
    if (peekType() == type) {
      next();
      return true;
    }
    return false;
  }

  private JsToken expect(TokenType type) throws ParseException {
    JsToken t = peek();
    if (t.getType() != type) {
      throw error(t, "'" + type + "' expected");
    }
    return next();
  }

  private static SyntaxException error(JsToken t, String message) {
    return new SyntaxException(message, t.getLine(), t.getColumn());
  }

  private static SyntaxException error(Node n, String message) {
    return new SyntaxException(message, n.getLineno(), n.getCharno());
  }
}
