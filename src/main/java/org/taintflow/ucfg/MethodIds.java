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
import org.jspecify.annotations.Nullable;
import org.taintflow.semantic.MethodSymbol;

/**
 * Computes method ids: the string by which the UCFG names a method. A method has the same id
 * whichever way it is reached, so that the analysis engine can match calls with the UCFGs of the
 * methods they call.
 */
public final class MethodIds {

  private MethodIds() {}

  /**
   * Returns the id of {@code method}, or {@link KnownMethodId#UNKNOWN} if it is null.
   *
   * <ul>
   *   <li>An explicit interface implementation has the id of the interface method it implements.
   *   <li>An extension method called with instance syntax has the id of the declared static
   *       method.
   *   <li>Otherwise, the id is the display string of the method's original definition (so every
   *       instantiation of a generic method shares one id).
   * </ul>
   */
  public static String of(@Nullable MethodSymbol method) {
    if (method == null) {
      return KnownMethodId.UNKNOWN;
    }
    switch (method.kind) {
      case EXPLICIT_INTERFACE_IMPLEMENTATION:
        return of(method.explicitInterfaceImplementations.get(0));
      case REDUCED_EXTENSION:
        return Preconditions.checkNotNull(method.reducedFrom).displayString;
      default:
        return method.originalDefinition().displayString;
    }
  }
}
