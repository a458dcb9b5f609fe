/*
 * Copyright 2025 The Taintflow Authors
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

package org.taintflow.syntax;

import com.google.common.base.CaseFormat;

/** The syntactic kinds of {@link SyntaxNode} that the front end can hand us. */
public enum SyntaxKind {
  // Expressions
  ADD_EXPRESSION,
  SUBTRACT_EXPRESSION,
  MULTIPLY_EXPRESSION,
  DIVIDE_EXPRESSION,
  LOGICAL_AND_EXPRESSION,
  LOGICAL_OR_EXPRESSION,
  EQUALS_EXPRESSION,
  NOT_EQUALS_EXPRESSION,
  LESS_THAN_EXPRESSION,
  GREATER_THAN_EXPRESSION,
  SIMPLE_ASSIGNMENT_EXPRESSION,
  INVOCATION_EXPRESSION,
  SIMPLE_MEMBER_ACCESS_EXPRESSION,
  IDENTIFIER_NAME,
  OBJECT_CREATION_EXPRESSION,
  PARENTHESIZED_EXPRESSION,
  STRING_LITERAL_EXPRESSION,
  NUMERIC_LITERAL_EXPRESSION,
  NULL_LITERAL_EXPRESSION,
  TRUE_LITERAL_EXPRESSION,
  FALSE_LITERAL_EXPRESSION,

  // Declarations
  VARIABLE_DECLARATOR,
  METHOD_DECLARATION,
  CONSTRUCTOR_DECLARATION,
  GET_ACCESSOR_DECLARATION,
  SET_ACCESSOR_DECLARATION,
  PARAMETER,
  ATTRIBUTE,

  // Statements
  RETURN_STATEMENT,
  IF_STATEMENT,
  WHILE_STATEMENT,
  DO_STATEMENT,
  FOR_STATEMENT,
  FOR_EACH_STATEMENT,
  SWITCH_STATEMENT,
  LOCK_STATEMENT,
  USING_STATEMENT,
  BREAK_STATEMENT,
  CONTINUE_STATEMENT,
  GOTO_STATEMENT,
  THROW_STATEMENT,
  YIELD_RETURN_STATEMENT;

  private final String displayName =
      CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());

  /** The kind's name in camel case, e.g. {@code "IfStatement"} for {@link #IF_STATEMENT}. */
  public String displayName() {
    return displayName;
  }

  /** True for the binary operator kinds, which are represented by {@link SyntaxNode.Binary}. */
  public boolean isBinary() {
    return compareTo(ADD_EXPRESSION) >= 0 && compareTo(GREATER_THAN_EXPRESSION) <= 0;
  }

  /** True for the literal kinds, which are represented by {@link SyntaxNode.Literal}. */
  public boolean isLiteral() {
    return compareTo(STRING_LITERAL_EXPRESSION) >= 0 && compareTo(FALSE_LITERAL_EXPRESSION) <= 0;
  }
}
