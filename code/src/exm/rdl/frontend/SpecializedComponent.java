package exm.rdl.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.PropertyType;
import exm.rdl.common.lang.Value;

/**
 * The result of specializing a component template under one parameter
 * environment.  Immutable, and compared structurally.
 */
public class SpecializedComponent {
  private final ComponentKind kind;
  private final String typeName;
  private final ParameterEnvironment params;
  /** Properties assigned in the body, by name */
  private final ImmutableMap<String, Value> properties;
  private final ImmutableList<ChildSlot> children;
  /** Assignments in the body to properties of sub-components, in order */
  private final ImmutableList<PropertyOverride> overrides;

  private final int hashCode;

  private SpecializedComponent(ComponentKind kind, String typeName,
      ParameterEnvironment params, ImmutableMap<String, Value> properties,
      ImmutableList<ChildSlot> children,
      ImmutableList<PropertyOverride> overrides) {
    this.kind = kind;
    this.typeName = typeName;
    this.params = params;
    this.properties = properties;
    this.children = children;
    this.overrides = overrides;
    this.hashCode = Objects.hash(kind, typeName, params, properties,
                                 children, overrides);
  }

  public ComponentKind kind() {
    return kind;
  }

  public String typeName() {
    return typeName;
  }

  public ParameterEnvironment params() {
    return params;
  }

  public ImmutableMap<String, Value> properties() {
    return properties;
  }

  /**
   * @return null if not assigned in the body
   */
  public Value property(String name) {
    return properties.get(name);
  }

  public ImmutableList<ChildSlot> children() {
    return children;
  }

  /**
   * @return null if no child of that name
   */
  public ChildSlot child(String name) {
    for (ChildSlot c: children) {
      if (c.name().equals(name)) {
        return c;
      }
    }
    return null;
  }

  public ImmutableList<PropertyOverride> overrides() {
    return overrides;
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
    if (!(other instanceof SpecializedComponent)) {
      return false;
    }
    SpecializedComponent o = (SpecializedComponent)other;
    return hashCode == o.hashCode && kind == o.kind &&
           typeName.equals(o.typeName) && params.equals(o.params) &&
           properties.equals(o.properties) && children.equals(o.children) &&
           overrides.equals(o.overrides);
  }

  @Override
  public String toString() {
    return kind.keyword() + " " + typeName + params;
  }

  public static class Builder {
    private final ComponentKind kind;
    private final String typeName;
    private final ParameterEnvironment params;
    private final Map<String, Value> properties =
                                    new LinkedHashMap<String, Value>();
    private final List<ChildSlot> children = new ArrayList<ChildSlot>();
    private final List<PropertyOverride> overrides =
                                    new ArrayList<PropertyOverride>();

    public Builder(ComponentKind kind, String typeName,
                   ParameterEnvironment params) {
      this.kind = kind;
      this.typeName = typeName;
      this.params = params;
    }

    /**
     * Later assignments replace earlier ones
     */
    public Builder setProperty(String name, Value val) {
      properties.remove(name);
      properties.put(name, val);
      return this;
    }

    public Builder addChild(ChildSlot child) {
      children.add(child);
      return this;
    }

    public Builder addOverride(PropertyOverride override) {
      overrides.add(override);
      return this;
    }

    public SpecializedComponent build() {
      return new SpecializedComponent(kind, typeName, params,
          ImmutableMap.copyOf(properties), ImmutableList.copyOf(children),
          ImmutableList.copyOf(overrides));
    }
  }

  /**
   * A named sub-component, possibly an instance array
   */
  public static class ChildSlot {
    private final String name;
    private final SpecializedComponent definition;
    /** null if not an array */
    private final Long extent;
    /** Default property assignments in effect where it was instantiated */
    private final ImmutableMap<String, PropertyDefault> defaults;

    public ChildSlot(String name, SpecializedComponent definition,
        Long extent, Map<String, PropertyDefault> defaults) {
      this.name = name;
      this.definition = definition;
      this.extent = extent;
      this.defaults = ImmutableMap.copyOf(defaults);
    }

    public String name() {
      return name;
    }

    public SpecializedComponent definition() {
      return definition;
    }

    public boolean isArray() {
      return extent != null;
    }

    public Long extent() {
      return extent;
    }

    public ImmutableMap<String, PropertyDefault> defaults() {
      return defaults;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, definition, extent, defaults);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ChildSlot)) {
        return false;
      }
      ChildSlot o = (ChildSlot)other;
      return name.equals(o.name) && definition.equals(o.definition) &&
             Objects.equals(extent, o.extent) && defaults.equals(o.defaults);
    }

    @Override
    public String toString() {
      return definition.typeName() + " " + name +
             (extent == null ? "" : "[" + extent + "]");
    }
  }

  public static class PathElem {
    private final String name;
    /** null to select the whole instance or instance array */
    private final Long index;

    public PathElem(String name, Long index) {
      this.name = name;
      this.index = index;
    }

    public String name() {
      return name;
    }

    public Long index() {
      return index;
    }

    /**
     * @param ordinal position in instance array, null if not an array
     */
    public boolean matches(String instName, Long ordinal) {
      return name.equals(instName) &&
             (index == null || index.equals(ordinal));
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, index);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof PathElem)) {
        return false;
      }
      PathElem o = (PathElem)other;
      return name.equals(o.name) && Objects.equals(index, o.index);
    }

    @Override
    public String toString() {
      return index == null ? name : name + "[" + index + "]";
    }
  }

  /**
   * Property assignment to a sub-component, e.g.
   * <code>data->hdl_path_slice = FIELD_SLICES</code>
   */
  public static class PropertyOverride {
    private final ImmutableList<PathElem> path;
    private final String property;
    private final Value value;

    public PropertyOverride(List<PathElem> path, String property,
                            Value value) {
      this.path = ImmutableList.copyOf(path);
      this.property = property;
      this.value = value;
    }

    public ImmutableList<PathElem> path() {
      return path;
    }

    public String property() {
      return property;
    }

    public Value value() {
      return value;
    }

    /**
     * @return the override relative to the first element of the path
     */
    public PropertyOverride stripFirst() {
      assert(!path.isEmpty());
      return new PropertyOverride(path.subList(1, path.size()), property,
                                  value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(path, property, value);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof PropertyOverride)) {
        return false;
      }
      PropertyOverride o = (PropertyOverride)other;
      return path.equals(o.path) && property.equals(o.property) &&
             value.equals(o.value);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < path.size(); i++) {
        if (i > 0) {
          sb.append('.');
        }
        sb.append(path.get(i));
      }
      return sb.append("->").append(property).append(" = ")
               .append(value).toString();
    }
  }

  /**
   * A <code>default</code> property assignment.  Applies to the
   * sub-components it reaches that can hold the property, unless they
   * assign it themselves.
   */
  public static class PropertyDefault {
    private final PropertyType property;
    private final Value value;

    public PropertyDefault(PropertyType property, Value value) {
      this.property = property;
      this.value = value;
    }

    public PropertyType property() {
      return property;
    }

    public Value value() {
      return value;
    }

    @Override
    public int hashCode() {
      return property.name().hashCode() * 31 + value.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof PropertyDefault)) {
        return false;
      }
      PropertyDefault o = (PropertyDefault)other;
      return property.name().equals(o.property.name()) &&
             value.equals(o.value);
    }

    @Override
    public String toString() {
      return "default " + property.name() + " = " + value;
    }
  }
}
