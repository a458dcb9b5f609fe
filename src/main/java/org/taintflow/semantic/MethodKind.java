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

/** The ways in which a {@link MethodSymbol} can be declared or referenced. */
public enum MethodKind {
  ORDINARY,
  CONSTRUCTOR,
  STATIC_CONSTRUCTOR,
  PROPERTY_GET,
  PROPERTY_SET,

  /** A method that implements an interface method by naming it, e.g. {@code void I.M() {}}. */
  EXPLICIT_INTERFACE_IMPLEMENTATION,

  /**
   * An extension method as seen at a call site that uses instance syntax, e.g. {@code s.Foo()}
   * for {@code static void Foo(this string s)}. The unreduced method is {@link
   * MethodSymbol#reducedFrom}.
   */
  REDUCED_EXTENSION
}
