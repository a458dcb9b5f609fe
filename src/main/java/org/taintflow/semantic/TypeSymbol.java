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
import org.jspecify.annotations.Nullable;

/** A named type, with the chain of base types the front end resolved for it. */
public final class TypeSymbol {

  public static final TypeSymbol STRING = new TypeSymbol(KnownType.STRING.typeName, null);
  public static final TypeSymbol VOID = new TypeSymbol(KnownType.VOID.typeName, null);

  /** The fully-qualified name of the type. */
  public final String name;

  /** The direct base type, or null if none was resolved. */
  public final @Nullable TypeSymbol baseType;

  private TypeSymbol(String name, @Nullable TypeSymbol baseType) {
    this.name = Preconditions.checkNotNull(name);
    this.baseType = baseType;
  }

  public static TypeSymbol of(String name) {
    return new TypeSymbol(name, null);
  }

  public static TypeSymbol of(String name, @Nullable TypeSymbol baseType) {
    return new TypeSymbol(name, baseType);
  }

  /** True if this is exactly the given type. */
  public boolean is(KnownType type) {
    return name.equals(type.typeName);
  }

  /** True if this is the given type or has it among its base types. */
  public boolean derivesFrom(KnownType type) {
    for (TypeSymbol t = this; t != null; t = t.baseType) {
      if (t.is(type)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return name;
  }
}
