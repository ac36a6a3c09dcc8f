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

package exm.rdl.elab;

import java.util.List;
import java.util.Map;

import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.ComponentSpecializer;
import exm.rdl.frontend.Context;
import exm.rdl.frontend.ComponentTemplate;
import exm.rdl.frontend.LogHelper;
import exm.rdl.frontend.ParameterBinder;
import exm.rdl.frontend.ParameterEnvironment;
import exm.rdl.frontend.SpecializedComponent;

/**
 * Builds the elaborated tree for a top-level instantiation: binds the
 * parameters, specializes the template, then expands all instances.
 */
public class ElaboratedTreeBuilder {
  private final ComponentSpecializer specializer;
  private final InstanceExpander expander;

  public ElaboratedTreeBuilder(ComponentSpecializer specializer,
                               InstanceExpander expander) {
    this.specializer = specializer;
    this.expander = expander;
  }

  public ComponentSpecializer getSpecializer() {
    return specializer;
  }

  /**
   * Elaborate a template instantiated under its own name
   */
  public ElaboratedTree build(ComponentTemplate template,
      Map<String, Value> overrides) throws UserException {
    return build(template.definingContext(), template, overrides,
                 template.name());
  }

  /**
   * @param site context of the instantiation, for error reporting
   * @param instName name of the root instance
   */
  public ElaboratedTree build(Context site, ComponentTemplate template,
      Map<String, Value> overrides, String instName) throws UserException {
    ParameterEnvironment env = ParameterBinder.bind(site, template,
                                                    overrides);
    SpecializedComponent def = specializer.specialize(template, env);
    List<Instance> roots = expander.expand(instName, def, null);
    assert(roots.size() == 1);
    ElaboratedTree tree = new ElaboratedTree(roots.get(0));
    LogHelper.debug(site, "elaborated " + instName + ": " + tree.size() +
                    " instances");
    return tree;
  }
}
