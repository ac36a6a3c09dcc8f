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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Types of parameters, struct fields and properties.
 *
 * The base class for all types is Type.  Types are immutable and compare
 * structurally.
 */
public class Types {

  public static enum PrimType {
    LONGINT("longint"),
    BIT("bit"),
    BOOLEAN("boolean"),
    STRING("string"),
    ACCESSTYPE("accesstype"),
    ONREADTYPE("onreadtype"),
    ONWRITETYPE("onwritetype"),
    ADDRESSINGTYPE("addressingtype"),
    PRECEDENCETYPE("precedencetype"),
    /** Reference to a component instance */
    REF("ref");

    private final String keyword;

    private PrimType(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  public abstract static class Type {
    public abstract String typeName();

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class ScalarType extends Type {
    private final PrimType primType;

    private ScalarType(PrimType primType) {
      this.primType = primType;
    }

    public PrimType primType() {
      return primType;
    }

    @Override
    public String typeName() {
      return primType.keyword();
    }

    @Override
    public int hashCode() {
      return primType.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ScalarType)) {
        return false;
      }
      return ((ScalarType)other).primType == primType;
    }
  }

  /**
   * Dynamically sized array, e.g. <code>longint n_arr[]</code>.  The length
   * of an array value comes from the literal it was built from.
   */
  public static class ArrayType extends Type {
    private final Type elemType;

    public ArrayType(Type elemType) {
      assert(elemType != null);
      this.elemType = elemType;
    }

    public Type elemType() {
      return elemType;
    }

    @Override
    public String typeName() {
      return elemType.typeName() + "[]";
    }

    @Override
    public int hashCode() {
      return elemType.hashCode() * 17 + 1;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      return ((ArrayType)other).elemType.equals(elemType);
    }
  }

  /**
   * Element type of an empty array literal: matches any declared element
   * type once the literal is assigned.
   */
  public static class WildcardType extends Type {
    @Override
    public String typeName() {
      return "?";
    }

    @Override
    public int hashCode() {
      return WildcardType.class.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof WildcardType;
    }
  }

  public static class StructType extends Type {
    public static class StructField {
      private final Type type;
      private final String name;
      public StructField(Type type, String name) {
        this.type = type;
        this.name = name;
      }

      public Type type() {
        return type;
      }

      public String name() {
        return name;
      }

      @Override
      public int hashCode() {
        return name.hashCode() * 31 + type.hashCode();
      }

      @Override
      public boolean equals(Object other) {
        if (!(other instanceof StructField)) {
          return false;
        }
        StructField o = (StructField)other;
        return name.equals(o.name) && type.equals(o.type);
      }

      @Override
      public String toString() {
        return name + ": " + type.typeName();
      }
    }

    private final String typeName;

    /** Struct this one extends, null if none */
    private final StructType base;

    /** All fields, base struct fields first */
    private final List<StructField> fields;

    private final int hashCode;

    /**
     * @param base struct whose fields are inherited, or null
     * @param ownFields fields declared by this struct only
     */
    public StructType(String typeName, StructType base,
                      List<StructField> ownFields) {
      this.typeName = typeName;
      this.base = base;
      this.fields = new ArrayList<StructField>();
      if (base != null) {
        this.fields.addAll(base.fields);
      }
      this.fields.addAll(ownFields);
      this.hashCode = calcHashCode();
    }

    public String getStructTypeName() {
      return typeName;
    }

    public StructType base() {
      return base;
    }

    public List<StructField> fields() {
      return Collections.unmodifiableList(fields);
    }

    public int fieldCount() {
      return fields.size();
    }

    public Type fieldTypeByName(String name) {
      for (StructField field: fields) {
        if (field.name().equals(name)) {
          return field.type();
        }
      }
      return null;
    }

    /**
     * @return true if this is other or derives from it
     */
    public boolean isSubtypeOf(StructType other) {
      StructType curr = this;
      while (curr != null) {
        if (curr.equals(other)) {
          return true;
        }
        curr = curr.base;
      }
      return false;
    }

    @Override
    public String typeName() {
      return typeName;
    }

    private int calcHashCode() {
      return typeName.hashCode() * 37 + fields.hashCode();
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
      if (!(other instanceof StructType)) {
        return false;
      }
      StructType o = (StructType)other;
      return hashCode == o.hashCode && typeName.equals(o.typeName) &&
             fields.equals(o.fields);
    }
  }

  public static final ScalarType LONGINT = new ScalarType(PrimType.LONGINT);
  public static final ScalarType BIT = new ScalarType(PrimType.BIT);
  public static final ScalarType BOOLEAN = new ScalarType(PrimType.BOOLEAN);
  public static final ScalarType STRING = new ScalarType(PrimType.STRING);
  public static final ScalarType ACCESSTYPE =
                                  new ScalarType(PrimType.ACCESSTYPE);
  public static final ScalarType ONREADTYPE =
                                  new ScalarType(PrimType.ONREADTYPE);
  public static final ScalarType ONWRITETYPE =
                                  new ScalarType(PrimType.ONWRITETYPE);
  public static final ScalarType ADDRESSINGTYPE =
                                  new ScalarType(PrimType.ADDRESSINGTYPE);
  public static final ScalarType PRECEDENCETYPE =
                                  new ScalarType(PrimType.PRECEDENCETYPE);
  public static final ScalarType REF = new ScalarType(PrimType.REF);
  public static final WildcardType WILDCARD = new WildcardType();

  private static final Map<String, ScalarType> builtinTypes =
                                    new HashMap<String, ScalarType>();
  static {
    for (ScalarType t: new ScalarType[] {LONGINT, BIT, BOOLEAN, STRING,
          ACCESSTYPE, ONREADTYPE, ONWRITETYPE, ADDRESSINGTYPE,
          PRECEDENCETYPE, REF}) {
      builtinTypes.put(t.typeName(), t);
    }
  }

  public static ScalarType scalar(PrimType primType) {
    return builtinTypes.get(primType.keyword());
  }

  /**
   * @param keyword e.g. "longint"
   * @return the builtin type, or null if not a builtin type keyword
   */
  public static ScalarType builtinType(String keyword) {
    return builtinTypes.get(keyword);
  }

  /**
   * Number-like types convert freely between each other
   */
  public static boolean isNumeric(Type t) {
    if (!(t instanceof ScalarType)) {
      return false;
    }
    PrimType pt = ((ScalarType)t).primType();
    return pt == PrimType.LONGINT || pt == PrimType.BIT ||
           pt == PrimType.BOOLEAN;
  }

  public static boolean isStruct(Type t) {
    return t instanceof StructType;
  }

  public static boolean isArray(Type t) {
    return t instanceof ArrayType;
  }

  public static boolean isWildcard(Type t) {
    return t instanceof WildcardType;
  }
}
