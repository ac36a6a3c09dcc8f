package exm.rdl.frontend;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import exm.rdl.common.lang.Value;

/**
 * Resolved parameter values for one instantiation: a flat, immutable
 * snapshot from parameter name to value.  Two environments are equal if
 * they bind the same names to structurally equal values, so they can be
 * used as part of a specialization cache key.
 */
public class ParameterEnvironment {
  public static final ParameterEnvironment EMPTY =
      new ParameterEnvironment(ImmutableMap.<String, Value>of());

  private final ImmutableMap<String, Value> vals;

  private ParameterEnvironment(ImmutableMap<String, Value> vals) {
    this.vals = vals;
  }

  public static ParameterEnvironment of(Map<String, Value> vals) {
    if (vals.isEmpty()) {
      return EMPTY;
    }
    return new ParameterEnvironment(ImmutableMap.copyOf(vals));
  }

  /**
   * @return new environment where bindings in inner shadow this one's
   */
  public ParameterEnvironment extend(ParameterEnvironment inner) {
    if (inner.vals.isEmpty()) {
      return this;
    } else if (vals.isEmpty()) {
      return inner;
    }
    Map<String, Value> merged = new LinkedHashMap<String, Value>(vals);
    merged.putAll(inner.vals);
    return of(merged);
  }

  /**
   * @return null if not bound
   */
  public Value get(String name) {
    return vals.get(name);
  }

  public boolean contains(String name) {
    return vals.containsKey(name);
  }

  public Set<String> names() {
    return vals.keySet();
  }

  public ImmutableMap<String, Value> asMap() {
    return vals;
  }

  public int size() {
    return vals.size();
  }

  @Override
  public int hashCode() {
    return vals.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ParameterEnvironment)) {
      return false;
    }
    // Map equality ignores binding order
    return vals.equals(((ParameterEnvironment)other).vals);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("#(");
    boolean first = true;
    for (Map.Entry<String, Value> e: vals.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append('.').append(e.getKey()).append('(')
        .append(e.getValue()).append(')');
    }
    return sb.append(')').toString();
  }
}
