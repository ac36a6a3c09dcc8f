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
import java.util.Collections;
import java.util.List;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.descriptor.ComponentDecl;
import exm.rdl.ast.descriptor.ComponentDecl.ParamDecl;
import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.Types.Type;

/**
 * A component definition together with the scope it was defined in.
 *
 * Two templates are the same if they come from the same definition in the
 * description and see the same enclosing parameter values.  A definition
 * nested inside a parameterized component is therefore a different template
 * for each distinct parameterization of the enclosing component.
 */
public class ComponentTemplate {

  private final ComponentDecl decl;
  private final List<Formal> formals;
  private final Context definingContext;

  /**
   * Enclosing parameter values at the point of definition
   */
  private final ParameterEnvironment outerEnv;

  private final int hashCode;

  private ComponentTemplate(ComponentDecl decl, List<Formal> formals,
                            Context definingContext) {
    this.decl = decl;
    this.formals = Collections.unmodifiableList(formals);
    this.definingContext = definingContext;
    this.outerEnv = definingContext.visibleParameters();
    this.hashCode = System.identityHashCode(decl.getTree()) * 31 +
                    outerEnv.hashCode();
  }

  /**
   * Build a template, resolving the types of its formal parameters in the
   * defining context
   */
  public static ComponentTemplate create(Context definingContext,
      ComponentDecl decl) throws UserException {
    List<Formal> formals = new ArrayList<Formal>();
    for (ParamDecl p: decl.getParams()) {
      definingContext.syncFilePos(p.getTree());
      for (Formal prev: formals) {
        if (prev.name().equals(p.getName())) {
          throw new DoubleDefineException(definingContext, "Parameter " +
              p.getName() + " is declared twice for component " +
              nameOf(decl));
        }
      }
      Type t = TypeChecker.resolveType(definingContext, p.getTypeTree());
      formals.add(new Formal(p.getName(), t, p.getDefaultExpr()));
    }
    return new ComponentTemplate(decl, formals, definingContext);
  }

  private static String nameOf(ComponentDecl decl) {
    if (decl.isAnonymous()) {
      return "<anonymous " + decl.getKind().keyword() + ">";
    }
    return decl.getName();
  }

  /**
   * @return template name, or a placeholder for anonymous definitions
   */
  public String name() {
    return nameOf(decl);
  }

  public boolean isAnonymous() {
    return decl.isAnonymous();
  }

  public ComponentKind kind() {
    return decl.getKind();
  }

  public List<Formal> formals() {
    return formals;
  }

  /**
   * @return null if no such formal
   */
  public Formal formal(String name) {
    for (Formal f: formals) {
      if (f.name().equals(name)) {
        return f;
      }
    }
    return null;
  }

  public RDLAST body() {
    return decl.getBody();
  }

  /**
   * @return the definition tree, identifying the definition in the
   *         description
   */
  public RDLAST definitionTree() {
    return decl.getTree();
  }

  public Context definingContext() {
    return definingContext;
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ComponentTemplate)) {
      return false;
    }
    ComponentTemplate o = (ComponentTemplate)other;
    return decl.getTree() == o.decl.getTree() && outerEnv.equals(o.outerEnv);
  }

  @Override
  public String toString() {
    return decl.getKind().keyword() + " " + name();
  }

  public static class Formal {
    private final String name;
    private final Type type;
    private final RDLAST defaultExpr;

    public Formal(String name, Type type, RDLAST defaultExpr) {
      this.name = name;
      this.type = type;
      this.defaultExpr = defaultExpr;
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    /**
     * @return null if the parameter must be given a value when instantiated
     */
    public RDLAST defaultExpr() {
      return defaultExpr;
    }

    @Override
    public String toString() {
      return type.typeName() + " " + name;
    }
  }
}
