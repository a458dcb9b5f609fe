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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A Symbol is what the front end resolved a name to: a local variable, a parameter, a field, a
 * property or a method. Symbols are compared by identity.
 */
public abstract class Symbol {

  public final String name;

  Symbol(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  /**
   * True if this is a local variable or a parameter whose type is {@code System.String}; the only
   * symbols that are tracked as variables in the UCFG.
   */
  public boolean isStringLocalOrParameter() {
    return false;
  }

  /** A local variable. */
  public static final class Local extends Symbol {
    public final TypeSymbol type;

    public Local(String name, TypeSymbol type) {
      super(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public boolean isStringLocalOrParameter() {
      return type.is(KnownType.STRING);
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  /** A formal parameter of a method, with any attributes applied to it. */
  public static final class Parameter extends Symbol {
    public final TypeSymbol type;
    public final ImmutableList<AttributeData> attributes;

    public Parameter(String name, TypeSymbol type) {
      this(name, type, ImmutableList.of());
    }

    public Parameter(String name, TypeSymbol type, List<AttributeData> attributes) {
      super(name);
      this.type = Preconditions.checkNotNull(type);
      this.attributes = ImmutableList.copyOf(attributes);
    }

    @Override
    public boolean isStringLocalOrParameter() {
      return type.is(KnownType.STRING);
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  /** A field; never tracked, whatever its type. */
  public static final class Field extends Symbol {
    public final TypeSymbol type;

    public Field(String name, TypeSymbol type) {
      super(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  /** A property; reads and writes are lowered as calls to its accessors. */
  public static final class Property extends Symbol {
    public final TypeSymbol type;
    public final @Nullable MethodSymbol getter;
    public final @Nullable MethodSymbol setter;

    public Property(
        String name,
        TypeSymbol type,
        @Nullable MethodSymbol getter,
        @Nullable MethodSymbol setter) {
      super(name);
      this.type = Preconditions.checkNotNull(type);
      Preconditions.checkArgument(getter == null || getter.kind == MethodKind.PROPERTY_GET);
      Preconditions.checkArgument(setter == null || setter.kind == MethodKind.PROPERTY_SET);
      this.getter = getter;
      this.setter = setter;
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }
}
