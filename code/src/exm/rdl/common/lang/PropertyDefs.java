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
package exm.rdl.common.lang;

import static exm.rdl.common.lang.ComponentKind.ADDRMAP;
import static exm.rdl.common.lang.ComponentKind.FIELD;
import static exm.rdl.common.lang.ComponentKind.MEM;
import static exm.rdl.common.lang.ComponentKind.REG;
import static exm.rdl.common.lang.ComponentKind.REGFILE;
import static exm.rdl.common.lang.ComponentKind.SIGNAL;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.rdl.common.lang.Types.ArrayType;
import exm.rdl.common.lang.Types.Type;

/**
 * Registry of property definitions, builtin and user-defined.
 * Populated while declarations are loaded, read-only during elaboration.
 */
public class PropertyDefs {

  private final Map<String, PropertyType> byName =
                                    new HashMap<String, PropertyType>();

  private final ListMultimap<ComponentKind, PropertyType> byComponent =
                                            ArrayListMultimap.create();

  /**
   * @return registry containing only the builtin properties
   */
  public static PropertyDefs withBuiltins() {
    PropertyDefs defs = new PropertyDefs();
    Set<ComponentKind> all = EnumSet.allOf(ComponentKind.class);

    defs.builtin("name", Types.STRING, all);
    defs.builtin("desc", Types.STRING, all);
    defs.builtin("ispresent", Types.BOOLEAN, all);

    defs.builtin("sw", Types.ACCESSTYPE, EnumSet.of(FIELD, MEM));
    defs.builtin("hw", Types.ACCESSTYPE, EnumSet.of(FIELD));
    defs.builtin("reset", Types.LONGINT, EnumSet.of(FIELD));
    defs.builtin("resetsignal", Types.REF, EnumSet.of(FIELD));
    defs.builtin("fieldwidth", Types.LONGINT, EnumSet.of(FIELD));
    defs.builtin("rclr", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("rset", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("woclr", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("woset", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("onread", Types.ONREADTYPE, EnumSet.of(FIELD));
    defs.builtin("onwrite", Types.ONWRITETYPE, EnumSet.of(FIELD));
    defs.builtin("we", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("hwclr", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("hwset", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("singlepulse", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("counter", Types.BOOLEAN, EnumSet.of(FIELD));
    defs.builtin("precedence", Types.PRECEDENCETYPE, EnumSet.of(FIELD));
    defs.builtin("hdl_path_slice", new ArrayType(Types.STRING),
                 EnumSet.of(FIELD, MEM));

    defs.builtin("regwidth", Types.LONGINT, EnumSet.of(REG));
    defs.builtin("accesswidth", Types.LONGINT, EnumSet.of(REG));
    defs.builtin("shared", Types.BOOLEAN, EnumSet.of(REG));
    defs.builtin("errextbus", Types.BOOLEAN, EnumSet.of(REG));
    defs.builtin("hdl_path", Types.STRING, EnumSet.of(ADDRMAP, REGFILE, REG));

    defs.builtin("alignment", Types.LONGINT, EnumSet.of(ADDRMAP, REGFILE));
    defs.builtin("sharedextbus", Types.BOOLEAN, EnumSet.of(ADDRMAP, REGFILE));
    defs.builtin("addressing", Types.ADDRESSINGTYPE, EnumSet.of(ADDRMAP));
    defs.builtin("rsvdset", Types.BOOLEAN, EnumSet.of(ADDRMAP));
    defs.builtin("bigendian", Types.BOOLEAN, EnumSet.of(ADDRMAP));
    defs.builtin("littleendian", Types.BOOLEAN, EnumSet.of(ADDRMAP));
    defs.builtin("lsb0", Types.BOOLEAN, EnumSet.of(ADDRMAP));
    defs.builtin("msb0", Types.BOOLEAN, EnumSet.of(ADDRMAP));

    defs.builtin("mementries", Types.LONGINT, EnumSet.of(MEM));
    defs.builtin("memwidth", Types.LONGINT, EnumSet.of(MEM));

    defs.builtin("signalwidth", Types.LONGINT, EnumSet.of(SIGNAL));
    defs.builtin("sync", Types.BOOLEAN, EnumSet.of(SIGNAL));
    defs.builtin("async", Types.BOOLEAN, EnumSet.of(SIGNAL));
    defs.builtin("activehigh", Types.BOOLEAN, EnumSet.of(SIGNAL));
    defs.builtin("activelow", Types.BOOLEAN, EnumSet.of(SIGNAL));
    defs.builtin("cpuif_reset", Types.BOOLEAN, EnumSet.of(SIGNAL));
    defs.builtin("field_reset", Types.BOOLEAN, EnumSet.of(SIGNAL));
    return defs;
  }

  private void builtin(String name, Type type, Set<ComponentKind> comps) {
    add(new PropertyType(name, type, comps, null, false));
  }

  /**
   * Register property.  Caller is responsible for checking that the
   * name isn't already defined.
   */
  public void add(PropertyType prop) {
    assert(!byName.containsKey(prop.name())) : prop.name();
    byName.put(prop.name(), prop);
    for (ComponentKind kind: prop.components()) {
      byComponent.put(kind, prop);
    }
  }

  /**
   * @return null if not defined
   */
  public PropertyType lookup(String name) {
    return byName.get(name);
  }

  public boolean isDefined(String name) {
    return byName.containsKey(name);
  }

  /**
   * @return all properties that can be assigned on the component kind
   */
  public List<PropertyType> applicableTo(ComponentKind kind) {
    return Collections.unmodifiableList(byComponent.get(kind));
  }

  public Collection<PropertyType> all() {
    return byName.values();
  }
}
