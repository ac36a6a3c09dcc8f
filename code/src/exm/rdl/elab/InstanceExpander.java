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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;

import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.InvalidExtentException;
import exm.rdl.common.lang.Value;
import exm.rdl.frontend.SpecializedComponent;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;
import exm.rdl.frontend.SpecializedComponent.PropertyDefault;
import exm.rdl.frontend.SpecializedComponent.PropertyOverride;

/**
 * Expands specialized components into instances, replicating instance
 * arrays and resolving the properties of each instance.
 *
 * Property values for an instance are, from weakest to strongest:
 * <ol>
 * <li>default assignments in effect where it was instantiated, nearest
 *     enclosing scope winning</li>
 * <li>assignments in its own definition's body</li>
 * <li>assignments through instance paths in enclosing bodies, outermost
 *     winning, and later assignments winning within one body</li>
 * </ol>
 */
public class InstanceExpander {
  private static final Logger logger = Logging.getRDLLogger();

  private final long maxExtent;

  public InstanceExpander(long maxExtent) {
    this.maxExtent = maxExtent;
  }

  /**
   * @param extent null for a single instance, otherwise the number of
   *               array elements
   * @return one instance per array element, or a single instance without
   *         ordinal, all sharing def
   */
  public List<Instance> expand(String name, SpecializedComponent def,
      Long extent) throws InvalidExtentException {
    return expand(name, def, extent,
                  Collections.<String, PropertyDefault>emptyMap(),
                  Collections.<PropertyOverride>emptyList());
  }

  /**
   * @param defaults defaults in effect at the instantiation
   * @param overrides assignments from enclosing bodies, with paths relative
   *                  to the instances being expanded, outermost last
   */
  public List<Instance> expand(String name, SpecializedComponent def,
      Long extent, Map<String, PropertyDefault> defaults,
      List<PropertyOverride> overrides) throws InvalidExtentException {
    if (extent == null) {
      return Collections.singletonList(
          expandOne(name, null, def, defaults, overrides));
    }
    if (extent < 0) {
      throw new InvalidExtentException("Extent of instance array " + name +
                                       " is negative: " + extent);
    }
    if (extent > maxExtent) {
      throw new InvalidExtentException("Extent of instance array " + name +
          " is " + extent + ", more than the maximum of " + maxExtent);
    }
    List<Instance> result = new ArrayList<Instance>((int)(long)extent);
    for (long i = 0; i < extent; i++) {
      result.add(expandOne(name, i, def, defaults, overrides));
    }
    return result;
  }

  private Instance expandOne(String name, Long ordinal,
      SpecializedComponent def, Map<String, PropertyDefault> defaults,
      List<PropertyOverride> overrides) throws InvalidExtentException {
    Map<String, Value> props = new LinkedHashMap<String, Value>();
    for (PropertyDefault d: defaults.values()) {
      if (d.property().appliesTo(def.kind())) {
        props.put(d.property().name(), d.value());
      }
    }
    props.putAll(def.properties());
    for (PropertyOverride o: overrides) {
      if (o.path().isEmpty()) {
        props.put(o.property(), o.value());
      }
    }

    List<Instance> children = new ArrayList<Instance>();
    for (ChildSlot slot: def.children()) {
      Map<String, PropertyDefault> childDefaults =
          new LinkedHashMap<String, PropertyDefault>(defaults);
      childDefaults.putAll(slot.defaults());
      if (slot.isArray()) {
        for (long i = 0; i < slot.extent(); i++) {
          children.add(expandOne(slot.name(), i, slot.definition(),
              childDefaults, childOverrides(slot, i, def, overrides)));
        }
      } else {
        children.add(expandOne(slot.name(), null, slot.definition(),
              childDefaults, childOverrides(slot, null, def, overrides)));
      }
    }

    Instance inst = new Instance(name, ordinal, def,
                                 ImmutableMap.copyOf(props), children);
    if (logger.isTraceEnabled()) {
      logger.trace("expanded " + inst + ": " + props);
    }
    return inst;
  }

  /**
   * Select the overrides that reach a child, own body first so that
   * enclosing bodies win
   */
  private static List<PropertyOverride> childOverrides(ChildSlot slot,
      Long ordinal, SpecializedComponent def,
      List<PropertyOverride> incoming) {
    List<PropertyOverride> result = new ArrayList<PropertyOverride>();
    selectOverrides(slot, ordinal, def.overrides(), result);
    selectOverrides(slot, ordinal, incoming, result);
    return result;
  }

  private static void selectOverrides(ChildSlot slot, Long ordinal,
      List<PropertyOverride> overrides, List<PropertyOverride> result) {
    for (PropertyOverride o: overrides) {
      if (!o.path().isEmpty() &&
          o.path().get(0).matches(slot.name(), ordinal)) {
        result.add(o.stripFirst());
      }
    }
  }
}
