/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.rdl.common.lang;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import exm.rdl.common.lang.Types.Type;

/**
 * A named, typed property slot that components can carry, either builtin
 * or user-defined (<code>property p_int { type = longint; component = all; };</code>)
 */
public class PropertyType {
  private final String name;
  private final Type type;
  private final Set<ComponentKind> components;

  /** Value assigned by a bare assignment (<code>p_int;</code>), may be null */
  private final Value defaultVal;

  private final boolean userDefined;

  public PropertyType(String name, Type type, Set<ComponentKind> components,
                      Value defaultVal, boolean userDefined) {
    assert(!components.isEmpty());
    this.name = name;
    this.type = type;
    this.components = Collections.unmodifiableSet(
                                    EnumSet.copyOf(components));
    this.defaultVal = defaultVal;
    this.userDefined = userDefined;
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public Set<ComponentKind> components() {
    return components;
  }

  public boolean appliesTo(ComponentKind kind) {
    return components.contains(kind);
  }

  public Value defaultVal() {
    return defaultVal;
  }

  public boolean isUserDefined() {
    return userDefined;
  }

  @Override
  public String toString() {
    return "property " + name + " : " + type.typeName() + " " + components;
  }
}
