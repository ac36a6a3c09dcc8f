package exm.rdl.common.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.lang.BuiltinEnums.RDLEnum;
import exm.rdl.common.lang.Types.ArrayType;
import exm.rdl.common.lang.Types.StructType;
import exm.rdl.common.lang.Types.Type;

/**
 * A fully evaluated value: the currency of parameters and properties.
 *
 * Values are immutable and compare structurally, so that struct and array
 * values can be part of specialization keys.
 */
public class Value {
  public static enum ValueKind {
    INTEGER, BOOLEAN, STRING, ENUM, STRUCT, ARRAY, COMPONENT_REF
  }

  public static final Value TRUE = createBoolLit(true);
  public static final Value FALSE = createBoolLit(false);

  public final ValueKind kind;

  /** Storage for value, dependent on kind */
  private final long intlit;
  private final boolean boollit;
  private final String stringlit;
  private final RDLEnum enumlit;

  /** Struct type for STRUCT, element type for ARRAY */
  private final Type type;
  private final ImmutableMap<String, Value> fields;
  private final ImmutableList<Value> elems;

  private final int hashCode;

  /**
   * Private constructors so that it can only be build using static builder
   * methods (below)
   */
  private Value(ValueKind kind, long intlit, boolean boollit,
      String stringlit, RDLEnum enumlit, Type type,
      ImmutableMap<String, Value> fields, ImmutableList<Value> elems) {
    this.kind = kind;
    this.intlit = intlit;
    this.boollit = boollit;
    this.stringlit = stringlit;
    this.enumlit = enumlit;
    this.type = type;
    this.fields = fields;
    this.elems = elems;
    this.hashCode = calcHashCode();
  }

  public static Value createIntLit(long v) {
    return new Value(ValueKind.INTEGER, v, false, null, null, null,
                     null, null);
  }

  public static Value createBoolLit(boolean v) {
    return new Value(ValueKind.BOOLEAN, 0, v, null, null, null, null, null);
  }

  public static Value createStringLit(String v) {
    assert(v != null);
    return new Value(ValueKind.STRING, 0, false, v, null, null, null, null);
  }

  public static Value createEnumLit(RDLEnum v) {
    assert(v != null);
    return new Value(ValueKind.ENUM, 0, false, null, v, null, null, null);
  }

  /**
   * @param fields values for all fields of structType.  Field order is
   *              normalized to declaration order.
   */
  public static Value createStruct(StructType structType,
                                   Map<String, Value> fields) {
    assert(structType.fieldCount() == fields.size());
    ImmutableMap.Builder<String, Value> ordered = ImmutableMap.builder();
    for (StructType.StructField f: structType.fields()) {
      Value fieldVal = fields.get(f.name());
      assert(fieldVal != null) : "Missing field " + f.name();
      ordered.put(f.name(), fieldVal);
    }
    return new Value(ValueKind.STRUCT, 0, false, null, null, structType,
                     ordered.build(), null);
  }

  public static Value createArray(Type elemType, List<Value> elems) {
    assert(elemType != null);
    return new Value(ValueKind.ARRAY, 0, false, null, null, elemType,
                     null, ImmutableList.copyOf(elems));
  }

  /**
   * @param instPath dotted hierarchical name of the referenced instance,
   *                 relative to the scope the reference was made in
   */
  public static Value createComponentRef(String instPath) {
    assert(instPath != null);
    return new Value(ValueKind.COMPONENT_REF, 0, false, instPath, null,
                     null, null, null);
  }

  public ValueKind getKind() {
    return kind;
  }

  public long getIntLit() {
    if (kind == ValueKind.INTEGER) {
      return intlit;
    } else {
      throw new RDLRuntimeError("getIntLit for non-integer value " + this);
    }
  }

  public boolean getBoolLit() {
    if (kind == ValueKind.BOOLEAN) {
      return boollit;
    } else {
      throw new RDLRuntimeError("getBoolLit for non-boolean value " + this);
    }
  }

  public String getStringLit() {
    if (kind == ValueKind.STRING) {
      return stringlit;
    } else {
      throw new RDLRuntimeError("getStringLit for non-string value " + this);
    }
  }

  public RDLEnum getEnumLit() {
    if (kind == ValueKind.ENUM) {
      return enumlit;
    } else {
      throw new RDLRuntimeError("getEnumLit for non-enum value " + this);
    }
  }

  public String getComponentRef() {
    if (kind == ValueKind.COMPONENT_REF) {
      return stringlit;
    } else {
      throw new RDLRuntimeError("getComponentRef for non-reference value "
                                + this);
    }
  }

  public StructType getStructType() {
    if (kind == ValueKind.STRUCT) {
      return (StructType)type;
    } else {
      throw new RDLRuntimeError("getStructType for non-struct value " + this);
    }
  }

  /**
   * @return field value, or null if the struct has no such field
   */
  public Value getField(String name) {
    if (kind == ValueKind.STRUCT) {
      return fields.get(name);
    } else {
      throw new RDLRuntimeError("getField for non-struct value " + this);
    }
  }

  public ImmutableMap<String, Value> getFields() {
    if (kind == ValueKind.STRUCT) {
      return fields;
    } else {
      throw new RDLRuntimeError("getFields for non-struct value " + this);
    }
  }

  public Type getElemType() {
    if (kind == ValueKind.ARRAY) {
      return type;
    } else {
      throw new RDLRuntimeError("getElemType for non-array value " + this);
    }
  }

  public ImmutableList<Value> getElems() {
    if (kind == ValueKind.ARRAY) {
      return elems;
    } else {
      throw new RDLRuntimeError("getElems for non-array value " + this);
    }
  }

  public Type getType() {
    switch (kind) {
      case INTEGER:
        return Types.LONGINT;
      case BOOLEAN:
        return Types.BOOLEAN;
      case STRING:
        return Types.STRING;
      case ENUM:
        return Types.scalar(enumlit.primType());
      case STRUCT:
        return type;
      case ARRAY:
        return new ArrayType(type);
      case COMPONENT_REF:
        return Types.REF;
      default:
        throw new RDLRuntimeError("Unknown value kind " + kind);
    }
  }

  public boolean isIntVal() {
    return kind == ValueKind.INTEGER;
  }

  public boolean isBoolVal() {
    return kind == ValueKind.BOOLEAN;
  }

  public boolean isStringVal() {
    return kind == ValueKind.STRING;
  }

  public boolean isStructVal() {
    return kind == ValueKind.STRUCT;
  }

  public boolean isArrayVal() {
    return kind == ValueKind.ARRAY;
  }

  /**
   * Integers and booleans can both be used where a number is expected
   */
  public boolean isNumeric() {
    return kind == ValueKind.INTEGER || kind == ValueKind.BOOLEAN;
  }

  /**
   * @return numeric interpretation: booleans are 0 or 1
   */
  public long asLong() {
    switch (kind) {
      case INTEGER:
        return intlit;
      case BOOLEAN:
        return boollit ? 1 : 0;
      default:
        throw new RDLRuntimeError("asLong for non-numeric value " + this);
    }
  }

  public boolean asBoolean() {
    return asLong() != 0;
  }

  public static List<Value> fromLongs(long ...vals) {
    List<Value> res = new ArrayList<Value>(vals.length);
    for (long v: vals) {
      res.add(createIntLit(v));
    }
    return res;
  }

  @Override
  public String toString() {
    switch (kind) {
      case INTEGER:
        return Long.toUnsignedString(intlit);
      case BOOLEAN:
        return Boolean.toString(boollit);
      case STRING:
        return "\"" + stringlit.replace("\\", "\\\\").replace("\"", "\\\"")
               + "\"";
      case ENUM:
        return enumlit.literal();
      case COMPONENT_REF:
        return stringlit;
      case STRUCT: {
        StringBuilder sb = new StringBuilder();
        sb.append(type.typeName()).append("'{");
        boolean first = true;
        for (Map.Entry<String, Value> e: fields.entrySet()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.append("}").toString();
      }
      case ARRAY: {
        StringBuilder sb = new StringBuilder("'{");
        boolean first = true;
        for (Value elem: elems) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          sb.append(elem);
        }
        return sb.append("}").toString();
      }
      default:
        throw new RDLRuntimeError("Unknown value kind " + kind);
    }
  }

  private int calcHashCode() {
    int hash1;
    switch (kind) {
      case INTEGER:
        hash1 = Long.hashCode(intlit);
        break;
      case BOOLEAN:
        hash1 = boollit ? 0 : 1;
        break;
      case STRING:
      case COMPONENT_REF:
        hash1 = stringlit.hashCode();
        break;
      case ENUM:
        hash1 = enumlit.hashCode();
        break;
      case STRUCT:
        hash1 = type.hashCode() * 31 + fields.hashCode();
        break;
      case ARRAY:
        // Element type doesn't take part: '{} of any type are equal
        hash1 = elems.hashCode();
        break;
      default:
        throw new RDLRuntimeError("Unknown value kind " + kind);
    }
    return kind.hashCode() ^ hash1;
  }

  /**
   * Define hashCode and equals so this can be used as key in hash table.
   * Struct and array values are compared element-wise.
   */
  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public boolean equals(Object otherO) {
    if (this == otherO) {
      return true;
    }
    if (!(otherO instanceof Value)) {
      return false;
    }
    Value other = (Value) otherO;
    if (this.kind != other.kind || this.hashCode != other.hashCode) {
      return false;
    }
    switch (this.kind) {
      case INTEGER:
        return this.intlit == other.intlit;
      case BOOLEAN:
        return this.boollit == other.boollit;
      case STRING:
      case COMPONENT_REF:
        return this.stringlit.equals(other.stringlit);
      case ENUM:
        return this.enumlit == other.enumlit;
      case STRUCT:
        return this.type.equals(other.type) &&
               this.fields.equals(other.fields);
      case ARRAY:
        return this.elems.equals(other.elems);
      default:
        throw new RDLRuntimeError("Unknown value kind " + this.kind);
    }
  }
}
