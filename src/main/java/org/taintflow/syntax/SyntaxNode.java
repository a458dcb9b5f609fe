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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.taintflow.util.StringUtil;

/**
 * A SyntaxNode is one statement or expression of the method being lowered, as produced by the front
 * end. Nodes form a tree; the CFG's blocks refer to them directly.
 *
 * <p>Nodes are compared by identity: two nodes with the same text are still different nodes (the
 * same expression written twice in a method is evaluated twice). {@link #toString} returns the
 * node's source text.
 *
 * <p>Every node that may become an instruction must have a {@link #span}; nodes built only for
 * their text (e.g. branching statements shown in debug graphs) may omit it.
 */
public abstract class SyntaxNode {

  private final SyntaxKind kind;
  private final @Nullable SourceSpan span;

  SyntaxNode(SyntaxKind kind, @Nullable SourceSpan span) {
    this.kind = Preconditions.checkNotNull(kind);
    this.span = span;
  }

  public final SyntaxKind kind() {
    return kind;
  }

  /** The node's position in its source file, or null if the front end didn't provide one. */
  public final @Nullable SourceSpan span() {
    return span;
  }

  /** Returns the innermost node that is not a {@link Parenthesized} expression. */
  public SyntaxNode withoutParentheses() {
    return this;
  }

  @Override
  public abstract String toString();

  /** A binary operator expression such as {@code a + b}. */
  public static final class Binary extends SyntaxNode {
    public final SyntaxNode left;
    public final SyntaxNode right;

    public Binary(SyntaxKind kind, SyntaxNode left, SyntaxNode right, @Nullable SourceSpan span) {
      super(kind, span);
      Preconditions.checkArgument(kind.isBinary(), "%s is not a binary operator", kind);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    private String operator() {
      return switch (kind()) {
        case ADD_EXPRESSION -> "+";
        case SUBTRACT_EXPRESSION -> "-";
        case MULTIPLY_EXPRESSION -> "*";
        case DIVIDE_EXPRESSION -> "/";
        case LOGICAL_AND_EXPRESSION -> "&&";
        case LOGICAL_OR_EXPRESSION -> "||";
        case EQUALS_EXPRESSION -> "==";
        case NOT_EQUALS_EXPRESSION -> "!=";
        case LESS_THAN_EXPRESSION -> "<";
        case GREATER_THAN_EXPRESSION -> ">";
        default -> throw new AssertionError();
      };
    }

    @Override
    public String toString() {
      return left + " " + operator() + " " + right;
    }
  }

  /** A simple assignment, {@code left = right}. */
  public static final class Assignment extends SyntaxNode {
    public final SyntaxNode left;
    public final SyntaxNode right;

    public Assignment(SyntaxNode left, SyntaxNode right, @Nullable SourceSpan span) {
      super(SyntaxKind.SIMPLE_ASSIGNMENT_EXPRESSION, span);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public String toString() {
      return left + " = " + right;
    }
  }

  /**
   * A method call. {@code expression} is the called member, either an {@link Identifier} (e.g.
   * {@code Foo(x)}) or a {@link MemberAccess} (e.g. {@code s.Trim()}).
   */
  public static final class Invocation extends SyntaxNode {
    public final SyntaxNode expression;
    public final ImmutableList<SyntaxNode> arguments;

    public Invocation(
        SyntaxNode expression, List<? extends SyntaxNode> arguments, @Nullable SourceSpan span) {
      super(SyntaxKind.INVOCATION_EXPRESSION, span);
      this.expression = Preconditions.checkNotNull(expression);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public String toString() {
      return expression + StringUtil.joinElements("(", ")", arguments.size(), arguments::get);
    }
  }

  /** A member access, {@code expression.name}. */
  public static final class MemberAccess extends SyntaxNode {
    public final SyntaxNode expression;
    public final Identifier name;

    public MemberAccess(SyntaxNode expression, Identifier name, @Nullable SourceSpan span) {
      super(SyntaxKind.SIMPLE_MEMBER_ACCESS_EXPRESSION, span);
      this.expression = Preconditions.checkNotNull(expression);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return expression + "." + name;
    }
  }

  /** A simple name referring to a local, parameter, field, property or method. */
  public static final class Identifier extends SyntaxNode {
    public final String name;

    public Identifier(String name, @Nullable SourceSpan span) {
      super(SyntaxKind.IDENTIFIER_NAME, span);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A literal; {@code text} is exactly as written in the source, including any quotes. */
  public static final class Literal extends SyntaxNode {
    public final String text;

    public Literal(SyntaxKind kind, String text, @Nullable SourceSpan span) {
      super(kind, span);
      Preconditions.checkArgument(kind.isLiteral(), "%s is not a literal", kind);
      this.text = Preconditions.checkNotNull(text);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /**
   * A constructor call, {@code new Type(arguments)}. {@code arguments} is null if the source has no
   * argument list at all (e.g. {@code new Type { X = 1 }}).
   */
  public static final class ObjectCreation extends SyntaxNode {
    public final String typeName;
    public final @Nullable ImmutableList<SyntaxNode> arguments;

    public ObjectCreation(
        String typeName,
        @Nullable List<? extends SyntaxNode> arguments,
        @Nullable SourceSpan span) {
      super(SyntaxKind.OBJECT_CREATION_EXPRESSION, span);
      this.typeName = Preconditions.checkNotNull(typeName);
      this.arguments = (arguments == null) ? null : ImmutableList.copyOf(arguments);
    }

    @Override
    public String toString() {
      if (arguments == null) {
        return "new " + typeName;
      }
      ImmutableList<SyntaxNode> args = arguments;
      return "new " + typeName + StringUtil.joinElements("(", ")", args.size(), args::get);
    }
  }

  /** An expression in parentheses. */
  public static final class Parenthesized extends SyntaxNode {
    public final SyntaxNode expression;

    public Parenthesized(SyntaxNode expression, @Nullable SourceSpan span) {
      super(SyntaxKind.PARENTHESIZED_EXPRESSION, span);
      this.expression = Preconditions.checkNotNull(expression);
    }

    @Override
    public SyntaxNode withoutParentheses() {
      return expression.withoutParentheses();
    }

    @Override
    public String toString() {
      return "(" + expression + ")";
    }
  }

  /** One variable in a local declaration, {@code name = initializer}. */
  public static final class VariableDeclarator extends SyntaxNode {
    public final String name;
    public final @Nullable SyntaxNode initializer;

    public VariableDeclarator(
        String name, @Nullable SyntaxNode initializer, @Nullable SourceSpan span) {
      super(SyntaxKind.VARIABLE_DECLARATOR, span);
      this.name = Preconditions.checkNotNull(name);
      this.initializer = initializer;
    }

    @Override
    public String toString() {
      return (initializer == null) ? name : name + " = " + initializer;
    }
  }

  /** {@code return expression;}, or {@code return;} if expression is null. */
  public static final class Return extends SyntaxNode {
    public final @Nullable SyntaxNode expression;

    public Return(@Nullable SyntaxNode expression, @Nullable SourceSpan span) {
      super(SyntaxKind.RETURN_STATEMENT, span);
      this.expression = expression;
    }

    @Override
    public String toString() {
      return (expression == null) ? "return;" : "return " + expression + ";";
    }
  }

  /**
   * Any other statement (an {@code if}, a {@code lock}, a {@code break}, ...). The lowering never
   * looks inside these; they are kept so that the CFG can name the statement that ends a block.
   */
  public static final class Statement extends SyntaxNode {
    public final String text;

    public Statement(SyntaxKind kind, String text, @Nullable SourceSpan span) {
      super(kind, span);
      Preconditions.checkArgument(
          kind.compareTo(SyntaxKind.RETURN_STATEMENT) > 0, "%s has its own node class", kind);
      this.text = Preconditions.checkNotNull(text);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** A formal parameter of a {@link MethodDeclaration}. */
  public static final class Parameter extends SyntaxNode {
    public final String name;

    public Parameter(String name, @Nullable SourceSpan span) {
      super(SyntaxKind.PARAMETER, span);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An attribute application, e.g. {@code [FromQuery]}; {@code text} excludes the brackets. */
  public static final class Attribute extends SyntaxNode {
    public final String text;

    public Attribute(String text, @Nullable SourceSpan span) {
      super(SyntaxKind.ATTRIBUTE, span);
      this.text = Preconditions.checkNotNull(text);
    }

    @Override
    public String toString() {
      return "[" + text + "]";
    }
  }

  /**
   * The declaration of a callable body: a method, a constructor, or a property accessor. Only the
   * header is modelled; the body reaches us as a CFG.
   */
  public static final class MethodDeclaration extends SyntaxNode {
    public final String name;
    public final ImmutableList<Parameter> parameters;

    public MethodDeclaration(
        SyntaxKind kind,
        String name,
        List<Parameter> parameters,
        @Nullable SourceSpan span) {
      super(kind, span);
      Preconditions.checkArgument(
          kind.compareTo(SyntaxKind.METHOD_DECLARATION) >= 0
              && kind.compareTo(SyntaxKind.SET_ACCESSOR_DECLARATION) <= 0,
          "%s is not a callable declaration",
          kind);
      this.name = Preconditions.checkNotNull(name);
      this.parameters = ImmutableList.copyOf(parameters);
    }

    /**
     * True for method and constructor declarations, which have a parameter list of their own;
     * false for property accessors.
     */
    public boolean hasParameterList() {
      return kind() == SyntaxKind.METHOD_DECLARATION
          || kind() == SyntaxKind.CONSTRUCTOR_DECLARATION;
    }

    @Override
    public String toString() {
      return name + StringUtil.joinElements("(", ")", parameters.size(), parameters::get);
    }
  }
}
