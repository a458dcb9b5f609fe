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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.taintflow.semantic.AttributeData;
import org.taintflow.semantic.KnownType;
import org.taintflow.semantic.MethodSymbol;
import org.taintflow.semantic.Symbol;
import org.taintflow.syntax.SyntaxNode;

/**
 * Accumulates the instructions and terminator of one {@link BasicBlock}, and names the temporary
 * variables its instructions store into ({@code %0}, {@code %1}, ...).
 */
final class BlockBuilder {

  private final String id;
  private final List<Instruction> instructions = new ArrayList<>();
  private @Nullable Terminator terminator;
  private int tempVariablesCounter;

  BlockBuilder(String id) {
    this.id = id;
  }

  /** Emits {@code variable = argument}; returns a reference to {@code variable}. */
  Expression addAssignment(SyntaxNode node, String variable, Expression argument) {
    Instruction instruction =
        addInstruction(node, KnownMethodId.ASSIGNMENT, variable, ImmutableList.of(argument));
    return Expression.variable(instruction.variable());
  }

  /**
   * Emits a concatenation into a new temporary; returns a reference to it. Callers pass the right
   * operand first.
   */
  Expression addConcatenation(SyntaxNode node, Expression right, Expression left) {
    Instruction instruction =
        addInstruction(
            node, KnownMethodId.CONCATENATION, newTempVariable(), ImmutableList.of(right, left));
    return Expression.variable(instruction.variable());
  }

  /**
   * Emits a call to {@code method}, unless it can't affect string data: a call is only kept if the
   * method takes or returns a string, or if one of the arguments is a variable. The arguments have
   * already been built (and any instructions they need emitted) either way.
   *
   * <p>Returns a reference to the call's result if the call was kept and returns a string, {@link
   * Expression#CONSTANT} otherwise.
   */
  Expression addMethodCall(SyntaxNode node, MethodSymbol method, List<Expression> arguments) {
    if (!method.acceptsOrReturnsString() && arguments.stream().noneMatch(Expression::isVariable)) {
      return Expression.CONSTANT;
    }
    Instruction instruction =
        addInstruction(
            node, MethodIds.of(method), newTempVariable(), ImmutableList.copyOf(arguments));
    return method.returnType.is(KnownType.STRING)
        ? Expression.variable(instruction.variable())
        : Expression.CONSTANT;
  }

  /**
   * Emits the instructions that record the attributes applied to an entry point's parameter: for
   * each attribute whose constructor is known, a call to the constructor and an annotation linking
   * its result to the parameter.
   */
  void addAttributeInstructions(Symbol.Parameter parameter) {
    for (AttributeData attribute : parameter.attributes) {
      if (attribute.constructor() == null) {
        continue;
      }
      String attributeVariable = newTempVariable();
      addInstruction(
          attribute.applicationSyntax(),
          MethodIds.of(attribute.constructor()),
          attributeVariable,
          ImmutableList.of());
      addInstruction(
          attribute.applicationSyntax(),
          KnownMethodId.ANNOTATION,
          parameter.name,
          ImmutableList.of(Expression.variable(attributeVariable)));
    }
  }

  /** Emits the instruction that marks each of the declared parameters as an entry point input. */
  void addEntryPointInstruction(SyntaxNode.MethodDeclaration declaration) {
    addInstruction(
        declaration,
        KnownMethodId.ENTRY_POINT,
        newTempVariable(),
        declaration.parameters.stream()
            .map(p -> (Expression) Expression.variable(p.name))
            .collect(ImmutableList.toImmutableList()));
  }

  void setReturn(@Nullable Location location, Expression returned) {
    terminator = new Terminator.Return(location, returned);
  }

  void setJump(List<String> destinations) {
    terminator = new Terminator.Jump(ImmutableList.copyOf(destinations));
  }

  boolean hasTerminator() {
    return terminator != null;
  }

  BasicBlock build() {
    Preconditions.checkState(terminator != null, "Block %s has no terminator", id);
    return new BasicBlock(id, ImmutableList.copyOf(instructions), terminator);
  }

  private Instruction addInstruction(
      SyntaxNode node, String methodId, String variable, ImmutableList<Expression> args) {
    Instruction instruction = new Instruction(Location.of(node), methodId, variable, args);
    instructions.add(instruction);
    return instruction;
  }

  private String newTempVariable() {
    return "%" + tempVariablesCounter++;
  }
}
