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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.rdl.ast.RDLAST;
import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.ParameterTypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UnknownParameterException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Value;
import exm.rdl.common.util.Pair;
import exm.rdl.frontend.ComponentTemplate.Formal;

/**
 * Resolves the formal parameters of a template against caller-supplied
 * overrides and the template's default expressions.
 */
public class ParameterBinder {

  /**
   * Bind parameters, reporting errors at the template's definition
   */
  public static ParameterEnvironment bind(ComponentTemplate template,
      Map<String, Value> overrides) throws UserException {
    return bind(template.definingContext(), template, overrides);
  }

  /**
   * Bind parameters in declaration order.  Overrides are converted to the
   * declared type of their formal.  Formals without an override get their
   * default, evaluated with only the formals before them (and the
   * template's enclosing scope) visible.
   *
   * @param site context of the instantiation, for error reporting
   * @param overrides already evaluated values by parameter name
   * @return self-contained snapshot of all formals' values
   */
  public static ParameterEnvironment bind(Context site,
      ComponentTemplate template, Map<String, Value> overrides)
          throws UserException {
    for (String name: overrides.keySet()) {
      if (template.formal(name) == null) {
        throw new UnknownParameterException(site, template.name(), name);
      }
    }

    ParamBindContext bindContext =
        new ParamBindContext(template.definingContext(), template);
    for (Formal f: template.formals()) {
      Value val;
      Value override = overrides.get(f.name());
      if (override != null) {
        val = TypeChecker.assignCast(f.type(), override);
        if (val == null) {
          throw new ParameterTypeMismatchException(site, "Parameter " +
              f.name() + " of " + template.name() + " has type " +
              f.type().typeName() + " but was given a value of type " +
              override.getType().typeName());
        }
      } else if (f.defaultExpr() != null) {
        Value def = ExprEvaluator.evaluate(bindContext, f.defaultExpr());
        val = TypeChecker.assignCast(f.type(), def);
        if (val == null) {
          throw new ParameterTypeMismatchException(bindContext, "Default " +
              "value of parameter " + f.name() + " of " + template.name() +
              " has type " + def.getType().typeName() + " but parameter " +
              "has type " + f.type().typeName());
        }
      } else {
        throw new UndefinedReferenceException(site, "No value given for " +
            "parameter " + f.name() + " of " + template.name() +
            ", which has no default");
      }
      LogHelper.trace(site, "bind " + template.name() + "." + f.name() +
                      " = " + val);
      bindContext.bind(f.name(), val);
    }
    return ParameterEnvironment.of(bindContext.bound());
  }

  /**
   * Evaluate the parameter overrides of an instantiation statement in the
   * scope of the instantiation
   */
  public static Map<String, Value> evalOverrides(Context context,
      List<Pair<String, RDLAST>> assigns) throws UserException {
    Map<String, Value> result = new LinkedHashMap<String, Value>();
    for (Pair<String, RDLAST> assign: assigns) {
      if (result.containsKey(assign.val1)) {
        throw new DoubleDefineException(context, "Parameter " +
            assign.val1 + " was assigned twice");
      }
      result.put(assign.val1, ExprEvaluator.evaluate(context, assign.val2));
    }
    return result;
  }
}
