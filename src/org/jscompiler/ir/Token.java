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

/** The kinds of AST nodes. */
public enum Token {
  RETURN,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,
  NOT,
  BITNOT,
  POS,
  NEG,
  NEW,
  DELPROP,
  TYPEOF,
  GETPROP,
  GETELEM,
  CALL,

  NAME,
  NUMBER,
  STRINGLIT,
  NULL,
  THIS,
  FALSE,
  TRUE,
  SHEQ, // shallow equality (===)
  SHNE, // shallow inequality (!==)
  REGEXP,
  THROW,
  IN,
  INSTANCEOF,
  ARRAYLIT, // array literal
  OBJECTLIT, // object literal

  TRY,
  PARAM_LIST,
  COMMA, // comma operator

  ASSIGN, // simple assignment  (=)
  ASSIGN_BITOR, // |=
  ASSIGN_BITXOR, // ^=
  ASSIGN_BITAND, // &=
  ASSIGN_LSH, // <<=
  ASSIGN_RSH, // >>=
  ASSIGN_URSH, // >>>=
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_EXPONENT, // **=

  HOOK, // conditional (?:)
  OR, // logical or (||)
  AND, // logical and (&&)
  INC, // increment (++)
  DEC, // decrement (--)
  FUNCTION, // function keyword
  IF, // if keyword
  SWITCH, // switch keyword
  CASE, // case keyword
  DEFAULT_CASE, // default keyword
  WHILE, // while keyword
  DO, // do keyword
  FOR, // for(;;) statement
  FOR_IN, // for-in
  BREAK, // break keyword
  CONTINUE, // continue keyword
  VAR, // var keyword
  WITH, // with keyword
  CATCH, // catch keyword
  VOID, // void keyword

  EMPTY,

  BLOCK, // statement block
  LABEL, // label
  EXPR_RESULT, // expression statement in scripts
  SCRIPT, // top-level node for entire script

  GETTER_DEF,
  SETTER_DEF,

  CONST, // JS 1.5 const keyword
  DEBUGGER,

  LABEL_NAME,
  STRING_KEY, // object literal key
  LET;

  /** Whether this is an assignment, simple or compound. */
  public boolean isAssign() {
    switch (this) {
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
        return true;
      default:
        return false;
    }
  }
}
