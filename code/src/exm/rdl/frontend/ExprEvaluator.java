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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.ast.descriptor.Literals;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.OutOfBoundsException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.BuiltinEnums;
import exm.rdl.common.lang.BuiltinEnums.RDLEnum;
import exm.rdl.common.lang.OpEvaluator;
import exm.rdl.common.lang.Operators;
import exm.rdl.common.lang.Operators.Opcode;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Types.StructType;
import exm.rdl.common.lang.Types.StructType.StructField;
import exm.rdl.common.lang.Types.Type;
import exm.rdl.common.lang.Value;

/**
 * Evaluates expression trees to values.
 *
 * Evaluation only reads the context: the result depends on nothing but
 * the expression and the names visible in the context.
 *
 * Integer expressions are evaluated at a bit width, as in Verilog.  A
 * self-determined expression is as wide as its widest operand, with sized
 * literals counting their declared width and everything else 64 bits.
 * That width flows down into arithmetic and bitwise operands, so results
 * wrap at it.  Comparisons, reductions and logical operators give a
 * single bit and start a new context for their operands.
 */
public class ExprEvaluator {

  /**
   * Evaluate an expression with only the given parameters in scope
   */
  public static Value evaluate(GlobalContext globals, RDLAST tree,
      ParameterEnvironment env) throws UserException {
    return evaluate(new LocalContext(globals, env, "<expression>"), tree);
  }

  /**
   * Evaluate a self-determined expression
   */
  public static Value evaluate(Context context, RDLAST tree)
      throws UserException {
    return evaluate(context, tree, selfWidth(context, tree));
  }

  /**
   * Evaluate an expression inside an enclosing expression of the given
   * width
   */
  private static Value evaluate(Context context, RDLAST tree, int width)
      throws UserException {
    context.syncFilePos(tree);
    int token = tree.getType();
    switch (token) {
      case RDLTokens.INT_LITERAL:
        return Value.createIntLit(Literals.extractIntLit(context, tree));
      case RDLTokens.BOOL_LITERAL:
        return Value.createBoolLit(Literals.extractBoolLit(context, tree));
      case RDLTokens.STRING_LITERAL:
        return Value.createStringLit(
                        Literals.extractStringLit(context, tree));
      case RDLTokens.ENUM_LITERAL:
        return evalEnumLiteral(context, tree);
      case RDLTokens.VARIABLE:
        return context.lookupValueUser(tree.child(0).getText());
      case RDLTokens.STRUCT_LOAD:
        return evalStructLoad(context, tree);
      case RDLTokens.ARRAY_LOAD:
        return evalArrayLoad(context, tree);
      case RDLTokens.STRUCT_LITERAL:
        return evalStructLiteral(context, tree);
      case RDLTokens.ARRAY_LITERAL:
        return evalArrayLiteral(context, tree);
      case RDLTokens.OPERATOR:
        return evalOperator(context, tree, width);
      case RDLTokens.TERNARY:
        return evalTernary(context, tree, width);
      case RDLTokens.CAST:
        return evalCast(context, tree);
      default:
        throw new RDLRuntimeError("Unexpected token in expression: " +
                                  LogHelper.tokName(token));
    }
  }

  /**
   * Evaluate an expression that must give a non-negative integer, e.g.
   * an array index or extent
   * @param what description for error messages
   */
  public static long evaluateInt(Context context, RDLAST tree, String what)
      throws UserException {
    Value v = evaluate(context, tree);
    if (!v.isIntVal()) {
      throw new TypeMismatchException(context, what + " must be an " +
                  "integer, but had type " + v.getType().typeName());
    }
    return v.getIntLit();
  }

  private static int selfWidth(Context context, RDLAST tree)
      throws UserException {
    return Math.max(1, minWidth(context, tree));
  }

  private static int maxMinWidth(Context context, List<RDLAST> trees)
      throws UserException {
    int width = 1;
    for (RDLAST tree: trees) {
      width = Math.max(width, minWidth(context, tree));
    }
    return width;
  }

  /**
   * Number of bits needed by an expression, worked out from its structure
   * alone so that nothing is evaluated that evaluation would skip
   */
  private static int minWidth(Context context, RDLAST tree)
      throws UserException {
    switch (tree.getType()) {
      case RDLTokens.INT_LITERAL:
        return Literals.extractIntLitWidth(context, tree);
      case RDLTokens.VARIABLE:
      case RDLTokens.STRUCT_LOAD:
      case RDLTokens.ARRAY_LOAD:
        return 64;
      case RDLTokens.OPERATOR: {
        Opcode op = lookupOp(context, tree);
        List<RDLAST> operands = tree.children(1);
        switch (Operators.widthRule(op)) {
          case CONTEXT:
            return maxMinWidth(context, operands);
          case LEFT_OPERAND:
            return minWidth(context, operands.get(0));
          default:
            return 1;
        }
      }
      case RDLTokens.TERNARY:
        return Math.max(minWidth(context, tree.child(1)),
                        minWidth(context, tree.child(2)));
      case RDLTokens.CAST: {
        RDLAST target = tree.child(0);
        if (target.getType() == RDLTokens.TYPE) {
          Type type = TypeChecker.resolveType(context, target);
          return type.equals(Types.LONGINT) ? 64 : 1;
        }
        return castWidth(context, tree);
      }
      default:
        // Booleans, strings, enums and aggregates
        return 1;
    }
  }

  private static Value evalEnumLiteral(Context context, RDLAST tree)
      throws UndefinedReferenceException {
    String literal = tree.child(0).getText();
    RDLEnum e = BuiltinEnums.lookup(literal);
    if (e == null) {
      throw UndefinedReferenceException.fromName(context, "enumerator",
                                                 literal);
    }
    return Value.createEnumLit(e);
  }

  private static Value evalStructLoad(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getChildCount() == 2);
    Value struct = evaluate(context, tree.child(0));
    String fieldName = tree.child(1).getText();
    context.syncFilePos(tree);
    if (!struct.isStructVal()) {
      throw new TypeMismatchException(context, "Tried to access field " +
          fieldName + " of a value of type " + struct.getType().typeName() +
          ", which is not a struct");
    }
    Value field = struct.getField(fieldName);
    if (field == null) {
      throw UndefinedReferenceException.fromName(context, "field of struct "
              + struct.getStructType().typeName(), fieldName);
    }
    return field;
  }

  private static Value evalArrayLoad(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getChildCount() == 2);
    Value arr = evaluate(context, tree.child(0));
    Value index = evaluate(context, tree.child(1));
    context.syncFilePos(tree);
    if (!arr.isArrayVal()) {
      throw new TypeMismatchException(context, "Tried to index a value of " +
          "type " + arr.getType().typeName() + ", which is not an array");
    }
    if (!index.isIntVal()) {
      throw new TypeMismatchException(context, "Array index must be an " +
          "integer, but had type " + index.getType().typeName());
    }
    List<Value> elems = arr.getElems();
    long i = index.getIntLit();
    if (Long.compareUnsigned(i, elems.size()) >= 0) {
      throw new OutOfBoundsException(context, "Array index " +
          Long.toUnsignedString(i) + " out of bounds for array of size " +
          elems.size());
    }
    return elems.get((int)i);
  }

  private static Value evalStructLiteral(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getChildCount() >= 1);
    StructType type = context.lookupStructTypeUser(
                                      tree.child(0).getText());
    Map<String, Value> fields = new HashMap<String, Value>();
    for (RDLAST init: tree.children(1)) {
      assert(init.getType() == RDLTokens.STRUCT_FIELD_INIT);
      context.syncFilePos(init);
      String fieldName = init.child(0).getText();
      Type fieldType = type.fieldTypeByName(fieldName);
      if (fieldType == null) {
        throw UndefinedReferenceException.fromName(context,
            "field of struct " + type.typeName(), fieldName);
      }
      if (fields.containsKey(fieldName)) {
        throw new TypeMismatchException(context, "Field " + fieldName +
            " given twice in literal of struct " + type.typeName());
      }
      Value val = evaluate(context, init.child(1));
      Value cast = TypeChecker.assignCast(fieldType, val);
      if (cast == null) {
        context.syncFilePos(init);
        throw new TypeMismatchException(context, "Field " + fieldName +
            " of struct " + type.typeName() + " has type " +
            fieldType.typeName() + " but was given a value of type " +
            val.getType().typeName());
      }
      fields.put(fieldName, cast);
    }

    for (StructField f: type.fields()) {
      if (!fields.containsKey(f.name())) {
        context.syncFilePos(tree);
        throw new TypeMismatchException(context, "Literal of struct " +
            type.typeName() + " is missing field " + f.name());
      }
    }
    return Value.createStruct(type, fields);
  }

  private static Value evalArrayLiteral(Context context, RDLAST tree)
      throws UserException {
    List<Value> elems = new ArrayList<Value>(tree.getChildCount());
    for (RDLAST elemTree: tree.children()) {
      elems.add(evaluate(context, elemTree));
    }
    context.syncFilePos(tree);
    Type elemType = TypeChecker.commonElemType(context, elems);
    if (Types.isWildcard(elemType)) {
      return Value.createArray(elemType, elems);
    }
    List<Value> castElems = new ArrayList<Value>(elems.size());
    for (Value elem: elems) {
      castElems.add(TypeChecker.assignCast(elemType, elem));
    }
    return Value.createArray(elemType, castElems);
  }

  private static Opcode lookupOp(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getChildCount() >= 2);
    int opTok = tree.child(0).getType();
    int arity = tree.getChildCount() - 1;
    Opcode op = Operators.lookup(opTok, arity);
    if (op == null) {
      context.syncFilePos(tree);
      throw new InvalidSyntaxException(context, "Operator " +
          LogHelper.tokName(opTok) + " cannot be applied to " +
          arity + " operands");
    }
    return op;
  }

  private static Value evalOperator(Context context, RDLAST tree,
      int width) throws UserException {
    Opcode op = lookupOp(context, tree);
    List<RDLAST> operandTrees = tree.children(1);
    List<Value> operands = new ArrayList<Value>(operandTrees.size());
    int opWidth;
    switch (Operators.widthRule(op)) {
      case CONTEXT:
        opWidth = width;
        for (RDLAST operand: operandTrees) {
          operands.add(evaluate(context, operand, opWidth));
        }
        break;
      case LEFT_OPERAND:
        opWidth = width;
        operands.add(evaluate(context, operandTrees.get(0), opWidth));
        operands.add(evaluate(context, operandTrees.get(1)));
        break;
      case NEW_CONTEXT:
        opWidth = maxMinWidth(context, operandTrees);
        for (RDLAST operand: operandTrees) {
          operands.add(evaluate(context, operand, opWidth));
        }
        break;
      case SELF_DETERMINED:
        opWidth = 64;
        for (RDLAST operand: operandTrees) {
          operands.add(evaluate(context, operand));
        }
        break;
      default:
        throw new RDLRuntimeError("Unexpected width rule for " + op);
    }
    context.syncFilePos(tree);
    return OpEvaluator.eval(context, op, operands, opWidth);
  }

  /**
   * Only the selected branch is evaluated
   */
  private static Value evalTernary(Context context, RDLAST tree, int width)
      throws UserException {
    assert(tree.getChildCount() == 3);
    Value cond = evaluate(context, tree.child(0));
    if (!cond.isNumeric()) {
      context.syncFilePos(tree);
      throw new TypeMismatchException(context, "Condition of ?: must be " +
          "a boolean or integer, but had type " + cond.getType().typeName());
    }
    return evaluate(context, cond.asBoolean() ? tree.child(1) : tree.child(2),
                    width);
  }

  /**
   * <code>longint'(x)</code>, <code>boolean'(x)</code> or width casts
   * such as <code>4'(x)</code> or <code>W'(x)</code>
   */
  private static Value evalCast(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getChildCount() == 2);
    RDLAST target = tree.child(0);
    if (target.getType() == RDLTokens.TYPE) {
      Value v = evaluate(context, tree.child(1));
      Type type = TypeChecker.resolveType(context, target);
      if (!Types.isNumeric(type) || !v.isNumeric()) {
        throw new TypeMismatchException(context, "Cannot cast value of type "
            + v.getType().typeName() + " to " + type.typeName());
      }
      return TypeChecker.assignCast(type, v);
    }

    int width = castWidth(context, tree);
    // The operand is evaluated at least as wide as the cast
    int evalWidth = Math.max(width, selfWidth(context, tree.child(1)));
    Value v = evaluate(context, tree.child(1), evalWidth);
    context.syncFilePos(tree);
    if (!v.isNumeric()) {
      throw new TypeMismatchException(context, "Cannot cast value of type "
          + v.getType().typeName() + " to a width");
    }
    return Value.createIntLit(OpEvaluator.truncate(v.asLong(), width));
  }

  /**
   * @return the width of a cast such as <code>W'(x)</code>
   */
  private static int castWidth(Context context, RDLAST tree)
      throws UserException {
    long width = evaluateInt(context, tree.child(0), "Width of cast");
    context.syncFilePos(tree);
    if (width < 1 || width > 64) {
      throw new TypeMismatchException(context, "Width of cast must be " +
          "between 1 and 64, but was " + Long.toUnsignedString(width));
    }
    return (int)width;
  }
}
