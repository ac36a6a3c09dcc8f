package exm.rdl.elab;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent;

/**
 * One placement of a specialized component in the elaborated tree.
 * Elements of an instance array share their definition and differ in
 * ordinal.
 */
public class Instance {
  private final String name;
  /** Position in instance array, null if not an array element */
  private final Long ordinal;
  private final SpecializedComponent definition;
  private final ImmutableMap<String, Value> properties;
  private final ImmutableList<Instance> children;

  public Instance(String name, Long ordinal, SpecializedComponent definition,
      ImmutableMap<String, Value> properties, List<Instance> children) {
    this.name = name;
    this.ordinal = ordinal;
    this.definition = definition;
    this.properties = properties;
    this.children = ImmutableList.copyOf(children);
  }

  public String name() {
    return name;
  }

  public Long ordinal() {
    return ordinal;
  }

  public boolean isArrayElem() {
    return ordinal != null;
  }

  /**
   * @return name plus index if an array element, e.g. "regs[3]"
   */
  public String displayName() {
    return ordinal == null ? name : name + "[" + ordinal + "]";
  }

  public ComponentKind kind() {
    return definition.kind();
  }

  public SpecializedComponent definition() {
    return definition;
  }

  /**
   * @return fully resolved properties, by name
   */
  public ImmutableMap<String, Value> properties() {
    return properties;
  }

  /**
   * @return null if the property has no value
   */
  public Value property(String name) {
    return properties.get(name);
  }

  public ImmutableList<Instance> children() {
    return children;
  }

  /**
   * @param displayName e.g. "data" or "regs[3]"
   * @return null if no such child
   */
  public Instance child(String displayName) {
    for (Instance c: children) {
      if (c.displayName().equals(displayName)) {
        return c;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return kind().keyword() + " " + definition.typeName() + " " +
           displayName();
  }
}
