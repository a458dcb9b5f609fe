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

package org.taintflow.ucfg;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.taintflow.semantic.MethodSymbol;
import org.taintflow.semantic.SemanticModel;
import org.taintflow.semantic.Symbol;
import org.taintflow.syntax.SyntaxNode;

/**
 * Lowers the statements of one CFG block into UCFG instructions, appended to a {@link
 * BlockBuilder}.
 *
 * <p>Each node (ignoring redundant parentheses) is lowered at most once: the CFG lists a
 * sub-expression before the expressions that use it, and later references reuse the first result
 * without emitting its instructions again. Anything that isn't relevant to string data flow, or
 * can't be resolved, is lowered to {@link Expression#CONSTANT}.
 */
final class InstructionBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<SyntaxNode, Expression> nodeExpressions = new IdentityHashMap<>();
  private final SemanticModel semanticModel;
  private final BlockBuilder blockBuilder;

  InstructionBuilder(SemanticModel semanticModel, BlockBuilder blockBuilder) {
    this.semanticModel = semanticModel;
    this.blockBuilder = blockBuilder;
  }

  /**
   * Returns the expression for {@code node}, lowering it if this is the first time we've seen it.
   * Statements (declarations, returns) have no value and return {@link Expression#CONSTANT}.
   */
  Expression build(SyntaxNode node) {
    SyntaxNode key = node.withoutParentheses();
    Expression result = nodeExpressions.get(key);
    if (result == null) {
      // Not computeIfAbsent(), since building a node recursively builds its children.
      result = buildImpl(key);
      nodeExpressions.put(key, result);
    }
    return result;
  }

  private Expression buildImpl(SyntaxNode node) {
    switch (node.kind()) {
      case ADD_EXPRESSION:
        return buildConcatenation((SyntaxNode.Binary) node);
      case SIMPLE_ASSIGNMENT_EXPRESSION:
        return buildAssignment((SyntaxNode.Assignment) node);
      case INVOCATION_EXPRESSION:
        return buildInvocation((SyntaxNode.Invocation) node);
      case IDENTIFIER_NAME:
        return buildIdentifier((SyntaxNode.Identifier) node);
      case OBJECT_CREATION_EXPRESSION:
        return buildObjectCreation((SyntaxNode.ObjectCreation) node);
      case VARIABLE_DECLARATOR:
        buildVariableDeclarator((SyntaxNode.VariableDeclarator) node);
        return Expression.CONSTANT;
      case RETURN_STATEMENT:
        buildReturn((SyntaxNode.Return) node);
        return Expression.CONSTANT;
      default:
        return Expression.CONSTANT;
    }
  }

  /** Any addition is treated as a concatenation; the right operand is built (and passed) first. */
  private Expression buildConcatenation(SyntaxNode.Binary binary) {
    Expression right = build(binary.right);
    Expression left = build(binary.left);
    return blockBuilder.addConcatenation(binary, right, left);
  }

  private Expression buildAssignment(SyntaxNode.Assignment assignment) {
    Symbol left = semanticModel.symbolOf(assignment.left);
    Expression right = build(assignment.right);
    if (left != null && left.isStringLocalOrParameter()) {
      return blockBuilder.addAssignment(assignment, left.name, right);
    } else if (left instanceof Symbol.Property property && property.setter != null) {
      return blockBuilder.addMethodCall(assignment, property.setter, ImmutableList.of(right));
    }
    return Expression.CONSTANT;
  }

  private Expression buildInvocation(SyntaxNode.Invocation invocation) {
    MethodSymbol method = methodSymbolOf(invocation);
    if (method == null) {
      return Expression.CONSTANT;
    }
    // The arguments are built before we decide whether to keep the call, so that instructions
    // nested in them are emitted either way: in LogStatus(StoreInDb(a + b)), "a + b" and
    // StoreInDb(string) must be kept even if LogStatus(int) is not.
    ImmutableList.Builder<Expression> arguments = ImmutableList.builder();
    if ((method.isInstanceMethodOnString() || method.isExtensionMethodCalledAsExtension())
        && invocation.expression instanceof SyntaxNode.MemberAccess memberAccess) {
      // The receiver is passed as the first argument
      arguments.add(build(memberAccess.expression));
    }
    for (SyntaxNode argument : invocation.arguments) {
      arguments.add(build(argument));
    }
    return blockBuilder.addMethodCall(invocation, method, arguments.build());
  }

  private Expression buildObjectCreation(SyntaxNode.ObjectCreation objectCreation) {
    MethodSymbol constructor = methodSymbolOf(objectCreation);
    if (constructor == null) {
      return Expression.CONSTANT;
    }
    ImmutableList.Builder<Expression> arguments = ImmutableList.builder();
    if (objectCreation.arguments != null) {
      for (SyntaxNode argument : objectCreation.arguments) {
        arguments.add(build(argument));
      }
    }
    return blockBuilder.addMethodCall(objectCreation, constructor, arguments.build());
  }

  /** A property read becomes a call to its getter; a string local or parameter is a variable. */
  private Expression buildIdentifier(SyntaxNode.Identifier identifier) {
    Symbol symbol = semanticModel.symbolOf(identifier);
    if (symbol instanceof Symbol.Property property) {
      return (property.getter == null)
          ? Expression.CONSTANT
          : blockBuilder.addMethodCall(identifier, property.getter, ImmutableList.of());
    } else if (symbol != null && symbol.isStringLocalOrParameter()) {
      return Expression.variable(symbol.name);
    }
    return Expression.CONSTANT;
  }

  private void buildVariableDeclarator(SyntaxNode.VariableDeclarator declarator) {
    if (declarator.initializer == null) {
      return;
    }
    Symbol variable = semanticModel.declaredSymbolOf(declarator);
    if (variable != null && variable.isStringLocalOrParameter()) {
      blockBuilder.addAssignment(declarator, variable.name, build(declarator.initializer));
    }
  }

  private void buildReturn(SyntaxNode.Return returnStatement) {
    Location location = Location.of(returnStatement);
    Expression returned =
        (returnStatement.expression == null)
            ? Expression.CONSTANT
            : build(returnStatement.expression);
    blockBuilder.setReturn(location, returned);
  }

  private @Nullable MethodSymbol methodSymbolOf(SyntaxNode node) {
    if (semanticModel.symbolOf(node) instanceof MethodSymbol method) {
      return method;
    }
    logger.atFinest().log("No method symbol for \"%s\"; lowered to a constant", node);
    return null;
  }
}
