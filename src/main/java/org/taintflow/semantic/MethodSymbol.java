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

package org.taintflow.semantic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.taintflow.util.StringUtil;

/**
 * A method, constructor or property accessor, as resolved by the front end at a declaration or at a
 * call site.
 *
 * <p>A symbol seen at a call site may be a constructed or reduced form of some declared method; the
 * declared method is available as {@link #originalDefinition()} (for generic instantiations) or
 * {@link #reducedFrom} (for extension methods called with instance syntax).
 */
public final class MethodSymbol extends Symbol {

  public final MethodKind kind;
  public final TypeSymbol containingType;
  public final TypeSymbol returnType;
  public final ImmutableList<Symbol.Parameter> parameters;
  public final boolean isStatic;
  public final Accessibility accessibility;
  public final ImmutableList<AttributeData> attributes;

  /**
   * The method's fully-qualified display form, e.g. {@code "Ns.C.M(string, int)"}; this is what
   * method ids are built from.
   */
  public final String displayString;

  /** If this is a {@link MethodKind#REDUCED_EXTENSION}, the static method it was reduced from. */
  public final @Nullable MethodSymbol reducedFrom;

  /**
   * If this is a {@link MethodKind#EXPLICIT_INTERFACE_IMPLEMENTATION}, the interface methods it
   * implements (in practice always exactly one).
   */
  public final ImmutableList<MethodSymbol> explicitInterfaceImplementations;

  private final @Nullable MethodSymbol originalDefinition;

  private MethodSymbol(Builder builder) {
    super(builder.name);
    this.kind = builder.kind;
    this.containingType = builder.containingType;
    this.returnType = builder.returnType;
    this.parameters = builder.parameters.build();
    this.isStatic = builder.isStatic;
    this.accessibility = builder.accessibility;
    this.attributes = builder.attributes.build();
    this.reducedFrom = builder.reducedFrom;
    this.explicitInterfaceImplementations = builder.explicitInterfaceImplementations.build();
    this.originalDefinition = builder.originalDefinition;
    this.displayString =
        (builder.displayString != null)
            ? builder.displayString
            : containingType
                + "."
                + name
                + StringUtil.joinElements("(", ")", parameters.size(), i -> parameters.get(i).type);
    Preconditions.checkArgument(
        (kind == MethodKind.REDUCED_EXTENSION) == (reducedFrom != null),
        "reducedFrom must be set exactly for reduced extension methods");
    Preconditions.checkArgument(
        kind != MethodKind.EXPLICIT_INTERFACE_IMPLEMENTATION
            || !explicitInterfaceImplementations.isEmpty(),
        "An explicit interface implementation must name the method it implements");
  }

  /** Starts building a method named {@code name} declared in {@code containingType}. */
  public static Builder builder(String name, TypeSymbol containingType) {
    return new Builder(name, containingType);
  }

  /**
   * The declared method this symbol was constructed from; the symbol itself if it is not a
   * constructed form.
   */
  public MethodSymbol originalDefinition() {
    return (originalDefinition == null) ? this : originalDefinition;
  }

  /** True if the method returns a string or has at least one string parameter. */
  public boolean acceptsOrReturnsString() {
    return returnType.is(KnownType.STRING)
        || parameters.stream().anyMatch(p -> p.type.is(KnownType.STRING));
  }

  /** True if this is an instance method declared by {@code System.String} itself. */
  public boolean isInstanceMethodOnString() {
    return containingType.is(KnownType.STRING) && !isStatic;
  }

  /** True if this is an extension method called with instance syntax. */
  public boolean isExtensionMethodCalledAsExtension() {
    return reducedFrom != null;
  }

  /** True if any attribute applied to this method has (or derives from) the given class. */
  public boolean hasAttribute(KnownType attributeClass) {
    return attributes.stream().anyMatch(a -> a.attributeClass().derivesFrom(attributeClass));
  }

  @Override
  public String toString() {
    return displayString;
  }

  /** Collects the properties of a {@link MethodSymbol}. */
  public static final class Builder {
    private final String name;
    private final TypeSymbol containingType;
    private MethodKind kind = MethodKind.ORDINARY;
    private TypeSymbol returnType = TypeSymbol.VOID;
    private final ImmutableList.Builder<Symbol.Parameter> parameters = ImmutableList.builder();
    private boolean isStatic;
    private Accessibility accessibility = Accessibility.PUBLIC;
    private final ImmutableList.Builder<AttributeData> attributes = ImmutableList.builder();
    private @Nullable String displayString;
    private @Nullable MethodSymbol reducedFrom;
    private final ImmutableList.Builder<MethodSymbol> explicitInterfaceImplementations =
        ImmutableList.builder();
    private @Nullable MethodSymbol originalDefinition;

    private Builder(String name, TypeSymbol containingType) {
      this.name = Preconditions.checkNotNull(name);
      this.containingType = Preconditions.checkNotNull(containingType);
    }

    @CanIgnoreReturnValue
    public Builder kind(MethodKind kind) {
      this.kind = Preconditions.checkNotNull(kind);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder returns(TypeSymbol returnType) {
      this.returnType = Preconditions.checkNotNull(returnType);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parameter(String name, TypeSymbol type) {
      parameters.add(new Symbol.Parameter(name, type));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parameter(Symbol.Parameter parameter) {
      parameters.add(parameter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder isStatic(boolean isStatic) {
      this.isStatic = isStatic;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder accessibility(Accessibility accessibility) {
      this.accessibility = Preconditions.checkNotNull(accessibility);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attribute(AttributeData attribute) {
      attributes.add(attribute);
      return this;
    }

    /** Overrides the display string that would otherwise be derived from the signature. */
    @CanIgnoreReturnValue
    public Builder displayString(String displayString) {
      this.displayString = Preconditions.checkNotNull(displayString);
      return this;
    }

    /** Marks the method as a reduced extension method; sets {@link #kind} accordingly. */
    @CanIgnoreReturnValue
    public Builder reducedFrom(MethodSymbol reducedFrom) {
      this.reducedFrom = Preconditions.checkNotNull(reducedFrom);
      this.kind = MethodKind.REDUCED_EXTENSION;
      return this;
    }

    /** Marks the method as an explicit implementation of the given interface method. */
    @CanIgnoreReturnValue
    public Builder explicitlyImplements(MethodSymbol interfaceMethod) {
      explicitInterfaceImplementations.add(interfaceMethod);
      this.kind = MethodKind.EXPLICIT_INTERFACE_IMPLEMENTATION;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder originalDefinition(MethodSymbol originalDefinition) {
      this.originalDefinition = Preconditions.checkNotNull(originalDefinition);
      return this;
    }

    public MethodSymbol build() {
      return new MethodSymbol(this);
    }
  }
}
