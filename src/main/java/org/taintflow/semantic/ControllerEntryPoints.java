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

import com.google.common.collect.ImmutableList;

/**
 * Recognizes web controller actions: public, non-static, ordinary methods of a class deriving from
 * one of the MVC controller base classes, unless they are marked as non-actions.
 */
public final class ControllerEntryPoints implements EntryPointRecognizer {

  public static final ControllerEntryPoints INSTANCE = new ControllerEntryPoints();

  private static final ImmutableList<KnownType> CONTROLLER_TYPES =
      ImmutableList.of(
          KnownType.MVC_CONTROLLER,
          KnownType.ASP_NET_CORE_CONTROLLER_BASE,
          KnownType.ASP_NET_CORE_CONTROLLER);

  private static final ImmutableList<KnownType> NON_ACTION_ATTRIBUTES =
      ImmutableList.of(
          KnownType.MVC_NON_ACTION_ATTRIBUTE, KnownType.ASP_NET_CORE_NON_ACTION_ATTRIBUTE);

  private ControllerEntryPoints() {}

  @Override
  public boolean isEntryPoint(MethodSymbol method) {
    return method.kind == MethodKind.ORDINARY
        && method.accessibility == Accessibility.PUBLIC
        && !method.isStatic
        && CONTROLLER_TYPES.stream().anyMatch(method.containingType::derivesFrom)
        && NON_ACTION_ATTRIBUTES.stream().noneMatch(method::hasAttribute);
  }
}
