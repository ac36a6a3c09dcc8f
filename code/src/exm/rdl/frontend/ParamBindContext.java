package exm.rdl.frontend;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import exm.rdl.common.exceptions.ForwardReferenceException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;

/**
 * Context used while binding the formal parameters of one template.
 * Defaults see the formals bound before them, plus whatever the template's
 * defining scope sees.  Reading a formal that is not bound yet is an error.
 */
class ParamBindContext extends Context {

  private final Context parent;
  private final String templateName;
  private final Map<String, Value> bound = new LinkedHashMap<String, Value>();
  private final Set<String> pending = new HashSet<String>();

  ParamBindContext(Context parent, ComponentTemplate template) {
    super(parent.getLogger(), parent.getLevel() + 1, parent.getInputFile());
    this.parent = parent;
    this.templateName = template.name();
    for (ComponentTemplate.Formal f: template.formals()) {
      pending.add(f.name());
    }
  }

  void bind(String name, Value val) {
    pending.remove(name);
    bound.put(name, val);
  }

  Map<String, Value> bound() {
    return bound;
  }

  @Override
  public GlobalContext getGlobals() {
    return parent.getGlobals();
  }

  @Override
  public Context getParent() {
    return parent;
  }

  @Override
  public Value lookupValue(String name) throws UserException {
    Value v = bound.get(name);
    if (v != null) {
      return v;
    }
    if (pending.contains(name)) {
      throw new ForwardReferenceException(this, "Default value for a " +
          "parameter of " + templateName + " refers to parameter " + name +
          ", which is not declared before it");
    }
    return parent.lookupValue(name);
  }

  @Override
  public ParameterEnvironment visibleParameters() {
    return parent.visibleParameters().extend(ParameterEnvironment.of(bound));
  }

  @Override
  public ChildSlot lookupInstance(String name) {
    return null;
  }
}
