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

package exm.rdl.frontend;

import org.apache.log4j.Logger;

import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.lang.PropertyDefs;
import exm.rdl.common.lang.PropertyType;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;

/**
 * Global context for the whole description: top-level component
 * definitions, struct types and the property registry.
 *
 * Declarations are loaded once, before elaboration starts, and only read
 * afterwards, so a global context can be shared by concurrent
 * specializations.
 */
public class GlobalContext extends Context {

  private final PropertyDefs propertyDefs;

  public GlobalContext(String inputFile, Logger logger) {
    this(inputFile, logger, PropertyDefs.withBuiltins());
  }

  public GlobalContext(String inputFile, Logger logger,
                       PropertyDefs propertyDefs) {
    super(logger, ROOT_LEVEL, inputFile);
    this.propertyDefs = propertyDefs;
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public Context getParent() {
    return null;
  }

  public PropertyDefs getPropertyDefs() {
    return propertyDefs;
  }

  public void defineProperty(PropertyType prop)
      throws DoubleDefineException {
    if (propertyDefs.isDefined(prop.name())) {
      throw new DoubleDefineException(this, "Property " + prop.name() +
                                      " was already defined");
    }
    logger.trace("context: defineProperty: " + prop);
    propertyDefs.add(prop);
  }

  @Override
  public Value lookupValue(String name) {
    // No parameters or instances at global scope
    return null;
  }

  @Override
  public ParameterEnvironment visibleParameters() {
    return ParameterEnvironment.EMPTY;
  }

  @Override
  public ChildSlot lookupInstance(String name) {
    return null;
  }
}
