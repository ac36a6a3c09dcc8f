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

package exm.rdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.ast.descriptor.ComponentDecl;
import exm.rdl.ast.descriptor.ComponentInstantiation;
import exm.rdl.ast.descriptor.ComponentInstantiation.InstElem;
import exm.rdl.ast.descriptor.PropertyDecl;
import exm.rdl.ast.descriptor.StructDecl;
import exm.rdl.common.Logging;
import exm.rdl.common.Settings;
import exm.rdl.common.exceptions.InvalidOptionException;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.PropertyTypeMismatchException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.PropertyType;
import exm.rdl.common.lang.Value;
import exm.rdl.elab.ElaboratedTree;
import exm.rdl.elab.ElaboratedTreeBuilder;
import exm.rdl.elab.InstanceExpander;
import exm.rdl.frontend.ComponentSpecializer;
import exm.rdl.frontend.ComponentTemplate;
import exm.rdl.frontend.ExprEvaluator;
import exm.rdl.frontend.GlobalContext;
import exm.rdl.frontend.LogHelper;
import exm.rdl.frontend.ParameterBinder;
import exm.rdl.frontend.ParameterEnvironment;
import exm.rdl.frontend.SpecializationCache;
import exm.rdl.frontend.TypeChecker;

/**
 * This is the main entry point to the elaborator: it takes the AST of a
 * whole description and produces one elaborated tree per top-level
 * instantiation.
 */
public class Elaborator {

  private final Logger logger;
  private final GlobalContext globals;
  private final ElaboratedTreeBuilder builder;

  /**
   * If true, keep elaborating other top-level instantiations after one
   * fails
   */
  private final boolean collectErrors;

  /**
   * Last address map defined at top level, elaborated if the description
   * doesn't instantiate anything
   */
  private ComponentTemplate lastAddrmap = null;

  /**
   * Configure from {@link Settings}
   */
  public Elaborator() throws InvalidOptionException {
    this(Settings.get(Settings.INPUT_FILENAME),
         Settings.getBoolean(Settings.COLLECT_ERRORS),
         Settings.getBoolean(Settings.SPECIALIZATION_CACHE),
         Settings.getLong(Settings.MAX_EXTENT));
  }

  /**
   * Read options from system properties, set up logging, and create an
   * elaborator with those options
   */
  public static Elaborator fromSystemProperties()
      throws InvalidOptionException {
    Settings.initRDLProperties();
    Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                         Settings.getBoolean(Settings.LOG_TRACE));
    return new Elaborator();
  }

  public Elaborator(String inputFile, boolean collectErrors,
                    boolean useCache, long maxExtent) {
    this.logger = Logging.getRDLLogger();
    this.globals = new GlobalContext(inputFile, logger);
    this.collectErrors = collectErrors;
    SpecializationCache cache = useCache ? new SpecializationCache() : null;
    this.builder = new ElaboratedTreeBuilder(
                          new ComponentSpecializer(cache, maxExtent),
                          new InstanceExpander(maxExtent));
  }

  public GlobalContext getGlobals() {
    return globals;
  }

  /**
   * @return null if caching is disabled
   */
  public SpecializationCache getCache() {
    return builder.getSpecializer().getCache();
  }

  /**
   * Load declarations and elaborate all top-level instantiations
   * @throws UserException on the first error, or on errors in
   *          declarations even when collecting errors
   */
  public ElaborationResult elaborate(RDLAST root) throws UserException {
    logger.info("elaborating " + globals.getInputFile());
    loadDeclarations(root);

    List<RDLAST> insts = new ArrayList<RDLAST>();
    for (RDLAST stmt: root.children()) {
      if (stmt.getType() == RDLTokens.COMPONENT_INST) {
        insts.add(stmt);
      }
    }

    List<ElaboratedTree> trees = new ArrayList<ElaboratedTree>();
    List<UserException> errors = new ArrayList<UserException>();
    if (insts.isEmpty()) {
      if (lastAddrmap == null) {
        Logging.uniqueWarn("Nothing to elaborate in " +
                            globals.getInputFile());
      } else {
        LogHelper.info(globals, "No top-level instantiation, elaborating " +
                       "address map " + lastAddrmap.name());
        try {
          trees.add(builder.build(lastAddrmap,
                                  Collections.<String, Value>emptyMap()));
        } catch (UserException e) {
          handleError(e, errors);
        }
      }
    }

    for (RDLAST inst: insts) {
      try {
        elaborateInstantiation(inst, trees);
      } catch (UserException e) {
        handleError(e, errors);
      }
    }

    SpecializationCache cache = getCache();
    if (cache != null) {
      logger.debug("specialization cache: " + cache.size() + " entries, " +
                   cache.hits() + " hits, " + cache.misses() + " misses");
    }
    return new ElaborationResult(trees, errors);
  }

  private void handleError(UserException e, List<UserException> errors)
      throws UserException {
    if (!collectErrors) {
      throw e;
    }
    logger.error(e.getMessage());
    errors.add(e);
  }

  private void elaborateInstantiation(RDLAST tree,
      List<ElaboratedTree> trees) throws UserException {
    ComponentInstantiation inst =
                    ComponentInstantiation.fromAST(globals, tree);
    ComponentTemplate template;
    if (inst.isAnonymous()) {
      template = ComponentTemplate.create(globals, inst.getAnonDef());
    } else {
      template = globals.lookupTemplateUser(inst.getTypeName());
    }
    Map<String, Value> overrides =
          ParameterBinder.evalOverrides(globals, inst.getParamAssigns());

    for (InstElem elem: inst.getElems()) {
      globals.syncFilePos(elem.getTree());
      if (elem.getExtentExpr() != null) {
        throw new InvalidSyntaxException(globals, "Top-level instance " +
                              elem.getName() + " cannot be an array");
      }
      LogHelper.debug(globals, "elaborating " + template + " " +
                      elem.getName());
      trees.add(builder.build(globals, template, overrides,
                              elem.getName()));
    }
  }

  /**
   * Register struct types, properties and component definitions found at
   * the top level of the description
   */
  public void loadDeclarations(RDLAST root) throws UserException {
    assert(root.getType() == RDLTokens.ROOT);
    for (RDLAST stmt: root.children()) {
      globals.syncFilePos(stmt);
      int token = stmt.getType();
      switch (token) {
        case RDLTokens.STRUCT_DEF:
          globals.defineStructType(
                        StructDecl.fromAST(globals, stmt).getType());
          break;
        case RDLTokens.PROPERTY_DEF:
          defineProperty(PropertyDecl.fromAST(globals, stmt));
          break;
        case RDLTokens.COMPONENT_DEF:
          defineComponent(stmt);
          break;
        case RDLTokens.COMPONENT_INST:
          // Elaborated once all declarations are known
          break;
        default:
          throw new RDLRuntimeError("Unexpected token at top level: " +
                                    LogHelper.tokName(token));
      }
    }
  }

  private void defineProperty(PropertyDecl decl) throws UserException {
    Value defaultVal = null;
    if (decl.getDefaultExpr() != null) {
      Value v = ExprEvaluator.evaluate(globals, decl.getDefaultExpr(),
                                       ParameterEnvironment.EMPTY);
      defaultVal = TypeChecker.assignCast(decl.getType(), v);
      if (defaultVal == null) {
        throw new PropertyTypeMismatchException(globals, "Default of " +
            "property " + decl.getName() + " has type " +
            v.getType().typeName() + " but property has type " +
            decl.getType().typeName());
      }
    }
    globals.defineProperty(new PropertyType(decl.getName(), decl.getType(),
                          decl.getComponents(), defaultVal, true));
  }

  private void defineComponent(RDLAST stmt) throws UserException {
    ComponentDecl decl = ComponentDecl.fromAST(globals, stmt);
    if (decl.isAnonymous()) {
      throw new InvalidSyntaxException(globals, "Anonymous " +
          decl.getKind().keyword() + " definition must be instantiated");
    }
    ComponentTemplate template = ComponentTemplate.create(globals, decl);
    globals.defineTemplate(template);
    if (template.kind() == ComponentKind.ADDRMAP) {
      lastAddrmap = template;
    }
  }

  /**
   * Elaborate a top-level component definition directly, as if instantiated
   * under its own name with the given overrides
   */
  public ElaboratedTree elaborateTop(String templateName,
      Map<String, Value> overrides) throws UserException {
    ComponentTemplate template = globals.lookupTemplateUser(templateName);
    return builder.build(template, overrides);
  }

  public static class ElaborationResult {
    private final List<ElaboratedTree> trees;
    private final List<UserException> errors;

    public ElaborationResult(List<ElaboratedTree> trees,
                             List<UserException> errors) {
      this.trees = Collections.unmodifiableList(trees);
      this.errors = Collections.unmodifiableList(errors);
    }

    /**
     * @return trees of the instantiations that succeeded, in order
     */
    public List<ElaboratedTree> getTrees() {
      return trees;
    }

    /**
     * @return null if no tree has that root instance name
     */
    public ElaboratedTree getTree(String instName) {
      for (ElaboratedTree t: trees) {
        if (t.getRoot().name().equals(instName)) {
          return t;
        }
      }
      return null;
    }

    public List<UserException> getErrors() {
      return errors;
    }

    public boolean isSuccess() {
      return errors.isEmpty();
    }
  }
}
