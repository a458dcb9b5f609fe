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

/**
 * A well-known type that the lowering or the entry-point recognizer needs to identify, named by its
 * fully-qualified name.
 */
public final class KnownType {

  public static final KnownType STRING = new KnownType("System.String");
  public static final KnownType VOID = new KnownType("System.Void");

  public static final KnownType MVC_CONTROLLER = new KnownType("System.Web.Mvc.Controller");
  public static final KnownType ASP_NET_CORE_CONTROLLER_BASE =
      new KnownType("Microsoft.AspNetCore.Mvc.ControllerBase");
  public static final KnownType ASP_NET_CORE_CONTROLLER =
      new KnownType("Microsoft.AspNetCore.Mvc.Controller");

  public static final KnownType MVC_NON_ACTION_ATTRIBUTE =
      new KnownType("System.Web.Mvc.NonActionAttribute");
  public static final KnownType ASP_NET_CORE_NON_ACTION_ATTRIBUTE =
      new KnownType("Microsoft.AspNetCore.Mvc.NonActionAttribute");

  public final String typeName;

  public KnownType(String typeName) {
    this.typeName = Preconditions.checkNotNull(typeName);
  }

  @Override
  public String toString() {
    return typeName;
  }
}
