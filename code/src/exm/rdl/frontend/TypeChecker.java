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
import java.util.List;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Types.ArrayType;
import exm.rdl.common.lang.Types.PrimType;
import exm.rdl.common.lang.Types.ScalarType;
import exm.rdl.common.lang.Types.StructType;
import exm.rdl.common.lang.Types.Type;
import exm.rdl.common.lang.Value;
import exm.rdl.common.lang.Value.ValueKind;

/**
 * Type resolution and the assignment compatibility rules used for
 * parameters, properties, struct fields and array elements.
 */
public class TypeChecker {

  /**
   * Resolve a TYPE tree to a type
   * @throws UndefinedReferenceException if the type name is unknown
   */
  public static Type resolveType(Context context, RDLAST typeTree)
      throws UndefinedReferenceException {
    assert(typeTree.getType() == RDLTokens.TYPE);
    assert(typeTree.getChildCount() >= 1);
    context.syncFilePos(typeTree);
    String typeName = typeTree.child(0).getText();
    Type t = Types.builtinType(typeName);
    if (t == null) {
      t = context.lookupStructTypeUser(typeName);
    }
    if (typeTree.getChildCount() > 1) {
      assert(typeTree.child(1).getType() == RDLTokens.ARRAY_DIM);
      t = new ArrayType(t);
    }
    return t;
  }

  /**
   * Convert a value for assignment to a slot of the given type.
   *
   * Number-like types convert between each other: booleans are 0 or 1,
   * numbers are true if non-zero.  Struct values may be assigned to a
   * slot of the same struct type or of a base type.  Arrays convert
   * element-wise.  Everything else must match exactly.
   *
   * @return the converted value, or null if not compatible
   */
  public static Value assignCast(Type dest, Value v) {
    if (dest instanceof ScalarType) {
      return castScalar((ScalarType)dest, v);
    } else if (dest instanceof StructType) {
      if (v.isStructVal() && v.getStructType().isSubtypeOf((StructType)dest)) {
        return v;
      }
      return null;
    } else if (dest instanceof ArrayType) {
      if (!v.isArrayVal()) {
        return null;
      }
      Type elemType = ((ArrayType)dest).elemType();
      List<Value> elems = new ArrayList<Value>(v.getElems().size());
      for (Value elem: v.getElems()) {
        Value castElem = assignCast(elemType, elem);
        if (castElem == null) {
          return null;
        }
        elems.add(castElem);
      }
      return Value.createArray(elemType, elems);
    } else if (Types.isWildcard(dest)) {
      // Nothing can be assigned to an unknown type
      return null;
    } else {
      throw new RDLRuntimeError("Unexpected type " + dest);
    }
  }

  private static Value castScalar(ScalarType dest, Value v) {
    PrimType pt = dest.primType();
    switch (pt) {
      case LONGINT:
        if (v.isNumeric()) {
          return v.isIntVal() ? v : Value.createIntLit(v.asLong());
        }
        return null;
      case BIT:
        if (v.isNumeric()) {
          return Value.createIntLit(v.asLong() & 1);
        }
        return null;
      case BOOLEAN:
        if (v.isNumeric()) {
          return v.isBoolVal() ? v : Value.createBoolLit(v.asBoolean());
        }
        return null;
      case STRING:
        return v.isStringVal() ? v : null;
      case REF:
        return v.getKind() == ValueKind.COMPONENT_REF ? v : null;
      default:
        // Builtin enumerations
        if (v.getKind() == ValueKind.ENUM &&
            v.getEnumLit().primType() == pt) {
          return v;
        }
        return null;
    }
  }

  public static boolean isAssignable(Type dest, Value v) {
    return assignCast(dest, v) != null;
  }

  /**
   * Infer the element type of an array literal.
   *
   * All numbers gives longint, unless all are booleans.  Otherwise the
   * first element's type, or for structs the first element's type (or base
   * type) that every other element can be assigned to.
   * @return WILDCARD if elems is empty
   */
  public static Type commonElemType(Context context, List<Value> elems)
      throws TypeMismatchException {
    if (elems.isEmpty()) {
      return Types.WILDCARD;
    }
    boolean allNumeric = true;
    boolean allBool = true;
    for (Value e: elems) {
      allNumeric = allNumeric && e.isNumeric();
      allBool = allBool && e.isBoolVal();
    }
    if (allBool) {
      return Types.BOOLEAN;
    } else if (allNumeric) {
      return Types.LONGINT;
    }

    List<Type> candidates = new ArrayList<Type>();
    Type first = elems.get(0).getType();
    candidates.add(first);
    if (first instanceof StructType) {
      StructType base = ((StructType)first).base();
      while (base != null) {
        candidates.add(base);
        base = base.base();
      }
    }
    for (Type candidate: candidates) {
      if (allAssignable(candidate, elems)) {
        return candidate;
      }
    }
    throw new TypeMismatchException(context, "Array literal elements do " +
        "not have a common type: first element has type " +
        first.typeName());
  }

  private static boolean allAssignable(Type t, List<Value> elems) {
    for (Value e: elems) {
      if (!isAssignable(t, e)) {
        return false;
      }
    }
    return true;
  }
}
