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
import java.util.concurrent.Callable;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.ast.descriptor.ComponentDecl;
import exm.rdl.ast.descriptor.ComponentInstantiation;
import exm.rdl.ast.descriptor.ComponentInstantiation.InstElem;
import exm.rdl.ast.descriptor.PropAssignment;
import exm.rdl.ast.descriptor.StructDecl;
import exm.rdl.common.exceptions.InstantiationCycleException;
import exm.rdl.common.exceptions.InvalidExtentException;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.OutOfBoundsException;
import exm.rdl.common.exceptions.PropertyTypeMismatchException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UnknownPropertyException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.PropertyType;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;
import exm.rdl.frontend.SpecializedComponent.PathElem;
import exm.rdl.frontend.SpecializedComponent.PropertyDefault;
import exm.rdl.frontend.SpecializedComponent.PropertyOverride;

/**
 * Specializes component templates: runs the template body under a
 * parameter environment, producing a {@link SpecializedComponent}.
 *
 * Body statements are processed in order, and the first error aborts the
 * body.  Results are shared through a {@link SpecializationCache} if one is
 * provided.
 */
public class ComponentSpecializer {

  private final SpecializationCache cache;
  private final long maxExtent;

  /**
   * @param cache cache to share results through, or null to build every
   *              specialization afresh
   * @param maxExtent largest instance array allowed
   */
  public ComponentSpecializer(SpecializationCache cache, long maxExtent) {
    this.cache = cache;
    this.maxExtent = maxExtent;
  }

  public SpecializationCache getCache() {
    return cache;
  }

  public SpecializedComponent specialize(ComponentTemplate template,
      ParameterEnvironment env) throws UserException {
    return specialize(template.definingContext(), template, env,
                      new ArrayList<ComponentTemplate>());
  }

  /**
   * @param site context of the instantiation, for error reporting
   * @param chain templates currently being specialized by this thread,
   *              outermost first
   */
  private SpecializedComponent specialize(Context site,
      final ComponentTemplate template, final ParameterEnvironment env,
      final List<ComponentTemplate> chain) throws UserException {
    for (ComponentTemplate outer: chain) {
      if (outer.definitionTree() == template.definitionTree()) {
        List<String> names = new ArrayList<String>();
        for (ComponentTemplate t: chain.subList(chain.indexOf(outer),
                                                chain.size())) {
          names.add(t.name());
        }
        names.add(template.name());
        throw new InstantiationCycleException(site, names);
      }
    }

    if (cache == null) {
      return build(template, env, chain);
    }
    return cache.get(site, template, env,
        new Callable<SpecializedComponent>() {
          @Override
          public SpecializedComponent call() throws UserException {
            return build(template, env, chain);
          }
        });
  }

  private SpecializedComponent build(ComponentTemplate template,
      ParameterEnvironment env, List<ComponentTemplate> chain)
          throws UserException {
    LocalContext context = new LocalContext(template.definingContext(), env,
                                            template.name());
    LogHelper.debug(context, "specializing " + template + env);
    chain.add(template);
    try {
      BodyWalker walker = new BodyWalker(context, template, env, chain);
      for (RDLAST stmt: template.body().children()) {
        walker.walk(stmt);
      }
      return walker.result.build();
    } finally {
      chain.remove(chain.size() - 1);
    }
  }

  /**
   * State for one walk over a template body
   */
  private class BodyWalker {
    final LocalContext context;
    final ComponentTemplate template;
    final List<ComponentTemplate> chain;
    final SpecializedComponent.Builder result;

    /** Default assignments in effect, by property name */
    final Map<String, PropertyDefault> defaults =
                        new LinkedHashMap<String, PropertyDefault>();

    BodyWalker(LocalContext context, ComponentTemplate template,
        ParameterEnvironment env, List<ComponentTemplate> chain) {
      this.context = context;
      this.template = template;
      this.chain = chain;
      this.result = new SpecializedComponent.Builder(template.kind(),
                                                     template.name(), env);
    }

    void walk(RDLAST stmt) throws UserException {
      context.syncFilePos(stmt);
      int token = stmt.getType();
      switch (token) {
        case RDLTokens.COMPONENT_DEF:
          defineComponent(stmt);
          break;
        case RDLTokens.STRUCT_DEF:
          context.defineStructType(
                      StructDecl.fromAST(context, stmt).getType());
          break;
        case RDLTokens.COMPONENT_INST:
          instantiate(stmt);
          break;
        case RDLTokens.PROP_ASSIGN:
          assignProperty(PropAssignment.fromAST(context, stmt));
          break;
        case RDLTokens.DEFAULT_PROP_ASSIGN:
          assignDefault(PropAssignment.fromAST(context, stmt));
          break;
        default:
          throw new RDLRuntimeError("Unexpected token in component body: "
                                    + LogHelper.tokName(token));
      }
    }

    void defineComponent(RDLAST stmt) throws UserException {
      ComponentDecl decl = ComponentDecl.fromAST(context, stmt);
      if (decl.isAnonymous()) {
        throw new InvalidSyntaxException(context, "Anonymous " +
            decl.getKind().keyword() + " definition must be instantiated");
      }
      context.defineTemplate(ComponentTemplate.create(context, decl));
    }

    void instantiate(RDLAST stmt) throws UserException {
      ComponentInstantiation inst =
                        ComponentInstantiation.fromAST(context, stmt);
      ComponentTemplate childTemplate;
      if (inst.isAnonymous()) {
        childTemplate = ComponentTemplate.create(context, inst.getAnonDef());
      } else {
        childTemplate = context.lookupTemplateUser(inst.getTypeName());
      }

      Map<String, Value> overrides =
          ParameterBinder.evalOverrides(context, inst.getParamAssigns());
      context.syncFilePos(stmt);
      ParameterEnvironment childEnv =
          ParameterBinder.bind(context, childTemplate, overrides);
      SpecializedComponent childDef =
          specialize(context, childTemplate, childEnv, chain);

      for (InstElem elem: inst.getElems()) {
        context.syncFilePos(elem.getTree());
        Long extent = null;
        if (elem.getExtentExpr() != null) {
          extent = evalExtent(elem);
        }
        ChildSlot slot = new ChildSlot(elem.getName(), childDef, extent,
                                       defaults);
        context.declareInstance(slot);
        result.addChild(slot);
        LogHelper.trace(context, "instance " + slot + " in " +
                        template.name());
      }
    }

    long evalExtent(InstElem elem) throws UserException {
      Value v = ExprEvaluator.evaluate(context, elem.getExtentExpr());
      context.syncFilePos(elem.getTree());
      if (!v.isIntVal()) {
        throw new InvalidExtentException(context, "Extent of instance " +
            "array " + elem.getName() + " must be an integer, but had type " +
            v.getType().typeName());
      }
      // Extents come from 64-bit unsigned arithmetic, so treat as signed
      // here to catch negative results such as N - 1 with N = 0
      long extent = v.getIntLit();
      if (extent < 0) {
        throw new InvalidExtentException(context, "Extent of instance " +
            "array " + elem.getName() + " is negative: " + extent);
      }
      if (extent > maxExtent) {
        throw new InvalidExtentException(context, "Extent of instance " +
            "array " + elem.getName() + " is " + extent +
            ", more than the maximum of " + maxExtent);
      }
      return extent;
    }

    void assignProperty(PropAssignment assign) throws UserException {
      List<PathElem> path = new ArrayList<PathElem>();
      ComponentKind targetKind = resolveTarget(assign, path);
      PropertyType prop = lookupProperty(assign.getProperty());
      if (!prop.appliesTo(targetKind)) {
        throw new UnknownPropertyException(context, "Property " +
            prop.name() + " cannot be assigned on a " + targetKind.keyword());
      }
      Value val = propertyValue(prop, assign.getValueExpr());
      if (path.isEmpty()) {
        LogHelper.trace(context, template.name() + "->" + prop.name() +
                        " = " + val);
        result.setProperty(prop.name(), val);
      } else {
        PropertyOverride override =
                    new PropertyOverride(path, prop.name(), val);
        LogHelper.trace(context, template.name() + ": " + override);
        result.addOverride(override);
      }
    }

    void assignDefault(PropAssignment assign) throws UserException {
      PropertyType prop = lookupProperty(assign.getProperty());
      Value val = propertyValue(prop, assign.getValueExpr());
      LogHelper.trace(context, template.name() + ": default " +
                      prop.name() + " = " + val);
      defaults.remove(prop.name());
      defaults.put(prop.name(), new PropertyDefault(prop, val));
    }

    PropertyType lookupProperty(String name) throws UnknownPropertyException {
      PropertyType prop = context.lookupProperty(name);
      if (prop == null) {
        throw new UnknownPropertyException(context, "No property called " +
                                           name + " was defined");
      }
      return prop;
    }

    /**
     * Resolve the instance path of an assignment through the instances
     * declared so far.
     * @param resolved filled in with the resolved path
     * @return kind of the component assigned to
     */
    ComponentKind resolveTarget(PropAssignment assign,
        List<PathElem> resolved) throws UserException {
      ComponentKind kind = template.kind();
      SpecializedComponent scope = null;
      for (PropAssignment.PathElem elem: assign.getTarget()) {
        ChildSlot slot = (scope == null) ?
                          context.lookupInstance(elem.getName()) :
                          scope.child(elem.getName());
        if (slot == null) {
          throw UndefinedReferenceException.fromName(context, "instance",
                                                     elem.getName());
        }
        Long index = null;
        if (elem.getIndexExpr() != null) {
          if (!slot.isArray()) {
            throw new TypeMismatchException(context, "Instance " +
                            slot.name() + " is not an array");
          }
          index = ExprEvaluator.evaluateInt(context, elem.getIndexExpr(),
                                            "Instance array index");
          if (Long.compareUnsigned(index, slot.extent()) >= 0) {
            throw new OutOfBoundsException(context, "Index " +
                Long.toUnsignedString(index) + " out of bounds for " +
                "instance array " + slot.name() + " of size " +
                slot.extent());
          }
        }
        resolved.add(new PathElem(slot.name(), index));
        scope = slot.definition();
        kind = scope.kind();
      }
      return kind;
    }

    /**
     * @param expr value expression, or null for a bare assignment
     */
    Value propertyValue(PropertyType prop, RDLAST expr)
        throws UserException {
      if (expr == null) {
        if (prop.defaultVal() != null) {
          return prop.defaultVal();
        } else if (prop.type().equals(Types.BOOLEAN)) {
          return Value.TRUE;
        }
        throw new PropertyTypeMismatchException(context, "Property " +
            prop.name() + " of type " + prop.type().typeName() +
            " must be given a value");
      }
      Value v = ExprEvaluator.evaluate(context, expr);
      Value cast = TypeChecker.assignCast(prop.type(), v);
      if (cast == null) {
        context.syncFilePos(expr);
        throw new PropertyTypeMismatchException(context, "Property " +
            prop.name() + " has type " + prop.type().typeName() +
            " but was assigned a value of type " + v.getType().typeName());
      }
      return cast;
    }
  }
}
