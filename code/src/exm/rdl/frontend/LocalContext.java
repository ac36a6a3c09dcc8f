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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;

/**
 * Context for the body of one component specialization: the bound
 * parameters, plus definitions and instances declared in the body so far.
 */
public class LocalContext extends Context {

  private final Context parent;
  private final GlobalContext globals;

  private final ParameterEnvironment params;

  /**
   * Name of the component being specialized, for log messages
   */
  private final String scopeName;

  /**
   * Sub-component instances in declaration order
   */
  private final Map<String, ChildSlot> instances =
                                  new LinkedHashMap<String, ChildSlot>();

  public LocalContext(Context parent, ParameterEnvironment params,
                      String scopeName) {
    super(parent.getLogger(), parent.getLevel() + 1, parent.getInputFile());
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.params = params;
    this.scopeName = scopeName;
    this.line = parent.getLine();
    this.col = parent.getColumn();
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public Context getParent() {
    return parent;
  }

  public String getScopeName() {
    return scopeName;
  }

  public ParameterEnvironment getParams() {
    return params;
  }

  /**
   * Parameters first, then instances declared so far in this body, then
   * enclosing scopes.
   */
  @Override
  public Value lookupValue(String name) throws UserException {
    Value v = params.get(name);
    if (v != null) {
      return v;
    }
    if (instances.containsKey(name)) {
      return Value.createComponentRef(name);
    }
    return parent.lookupValue(name);
  }

  @Override
  public ParameterEnvironment visibleParameters() {
    return parent.visibleParameters().extend(params);
  }

  public void declareInstance(ChildSlot slot) throws DoubleDefineException {
    if (instances.containsKey(slot.name())) {
      throw new DoubleDefineException(this, "Instance " + slot.name() +
                          " was already declared in " + scopeName);
    }
    logger.trace("context: declareInstance: " + slot.name() + " in " +
                 scopeName);
    instances.put(slot.name(), slot);
  }

  @Override
  public ChildSlot lookupInstance(String name) {
    return instances.get(name);
  }

  public List<ChildSlot> instances() {
    return new ArrayList<ChildSlot>(instances.values());
  }
}
