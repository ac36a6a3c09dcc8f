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

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.rdl.ast.RDLAST;
import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.PropertyType;
import exm.rdl.common.lang.Types.StructType;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;

/**
 * Abstract interface used to track and access contextual information about
 * the description at different points in the AST: which struct types,
 * component templates, parameters and instances are visible.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
   * Struct types defined in this scope
   */
  protected final Map<String, StructType> structTypes =
                                      new HashMap<String, StructType>();

  /**
   * Component templates defined in this scope
   */
  protected final Map<String, ComponentTemplate> templates =
                                new HashMap<String, ComponentTemplate>();

  /**
   * Current input file
   */
  protected String inputFile;

  /**
     Current line in input file
   */
  protected int line = 0;

  /**
   * Current column in input file.  0 if unknown
   */
  protected int col = 0;

  public Context(Logger logger, int level, String inputFile) {
    super();
    this.level = level;
    this.logger = logger;
    this.inputFile = inputFile;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * @return enclosing scope, null for the global scope
   */
  public abstract Context getParent();

  public boolean isTopLevel() {
    return getParent() == null;
  }

  /**
   * Lookup parameter or instance name in this or enclosing scopes.
   * @return the value, or null if not defined
   * @throws UserException if the name is defined, but can't be read here
   */
  public abstract Value lookupValue(String name)
      throws UserException;

  /**
   * @return parameter values visible from this scope, inner scopes shadowing
   *         outer ones
   */
  public abstract ParameterEnvironment visibleParameters();

  /**
   * Lookup a sub-component instance declared in this scope.
   * Instances of enclosing components are not visible.
   * @return null if not declared
   */
  public abstract ChildSlot lookupInstance(String name);

  public Value lookupValueUser(String name)
      throws UserException {
    Value result = lookupValue(name);
    if (result == null) {
      throw UndefinedReferenceException.fromName(this, name);
    }
    return result;
  }

  public void defineStructType(StructType type)
      throws DoubleDefineException {
    String name = type.getStructTypeName();
    if (structTypes.containsKey(name)) {
      throw new DoubleDefineException(this, "Struct type " + name +
                              " was already defined in this scope");
    }
    logger.trace("context: defineStructType: " + name);
    structTypes.put(name, type);
  }

  /**
   * @return null if not defined in this or enclosing scopes
   */
  public StructType lookupStructType(String name) {
    Context curr = this;
    while (curr != null) {
      StructType t = curr.structTypes.get(name);
      if (t != null) {
        return t;
      }
      curr = curr.getParent();
    }
    return null;
  }

  public StructType lookupStructTypeUser(String name)
      throws UndefinedReferenceException {
    StructType t = lookupStructType(name);
    if (t == null) {
      throw UndefinedReferenceException.fromName(this, "struct type", name);
    }
    return t;
  }

  public void defineTemplate(ComponentTemplate template)
      throws DoubleDefineException {
    String name = template.name();
    if (templates.containsKey(name)) {
      throw new DoubleDefineException(this, "Component " + name +
                              " was already defined in this scope");
    }
    logger.trace("context: defineTemplate: " + name);
    templates.put(name, template);
  }

  /**
   * @return null if not defined in this or enclosing scopes
   */
  public ComponentTemplate lookupTemplate(String name) {
    Context curr = this;
    while (curr != null) {
      ComponentTemplate t = curr.templates.get(name);
      if (t != null) {
        return t;
      }
      curr = curr.getParent();
    }
    return null;
  }

  public ComponentTemplate lookupTemplateUser(String name)
      throws UndefinedReferenceException {
    ComponentTemplate t = lookupTemplate(name);
    if (t == null) {
      throw UndefinedReferenceException.fromName(this, "component", name);
    }
    return t;
  }

  /**
   * Properties are always global
   * @return null if not defined
   */
  public PropertyType lookupProperty(String name) {
    return getGlobals().getPropertyDefs().lookup(name);
  }

  public String getInputFile() {
    return inputFile;
  }

  /**
   * Move current position to that of tree.
   * Nodes built without position info leave it unchanged.
   */
  public void syncFilePos(RDLAST tree) {
    if (tree.getLine() > 0) {
      this.line = tree.getLine();
      this.col = tree.getCharPositionInLine();
    }
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return col;
  }

  public int getLevel() {
    return level;
  }

  public Logger getLogger() {
    return logger;
  }

  /**
     @return E.g.; "file.rdl:42:3: "
   */
  public String getLocation() {
    String res = inputFile + ":" + line;
    if (col > 0) {
      res += ":" + (col + 1);
    }
    return res + ": ";
  }
}
