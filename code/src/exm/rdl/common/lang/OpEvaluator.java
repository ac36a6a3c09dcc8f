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

import java.util.List;

import exm.rdl.common.exceptions.DivisionByZeroException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Operators.Opcode;
import exm.rdl.frontend.Context;

/**
 * Elaboration-time evaluation of builtin operators.
 *
 * Integers are unsigned quantities of at most 64 bits.  Each operator is
 * evaluated at a width: arithmetic and bitwise results wrap to that width,
 * and reductions look at exactly that many bits.  Division, modulo,
 * comparisons and right shifts are unsigned.  Booleans are accepted
 * wherever a number is expected and count as 0 or 1.
 */
public class OpEvaluator {

  public static Value eval(Context context, Opcode op, List<Value> inputs)
                                                throws UserException {
    return eval(context, op, inputs, 64);
  }

  /**
   * @param width width in bits of the expression the operator appears
   *        in, between 1 and 64.  Operands must already fit in it
   */
  public static Value eval(Context context, Opcode op, List<Value> inputs,
                           int width) throws UserException {
    if (Operators.isEquality(op)) {
      return evalEquality(context, op, inputs.get(0), inputs.get(1));
    }

    for (int i = 0; i < inputs.size(); i++) {
      Value in = inputs.get(i);
      if (!in.isNumeric()) {
        throw new TypeMismatchException(context, "Operand " + (i + 1) +
            " of operator " + op + " is not a compatible numeric type: " +
            in.getType().typeName());
      }
    }

    if (inputs.size() == 1) {
      return evalUnary(op, truncate(inputs.get(0).asLong(), width), width);
    } else if (inputs.size() == 2) {
      return evalBinary(context, op, inputs.get(0).asLong(),
                                     inputs.get(1).asLong(), width);
    } else {
      throw new RDLRuntimeError("Operator " + op + " with " + inputs.size()
                                + " operands");
    }
  }

  private static Value evalEquality(Context context, Opcode op,
      Value arg1, Value arg2) throws TypeMismatchException {
    boolean eq;
    if (arg1.isNumeric() && arg2.isNumeric()) {
      eq = arg1.asLong() == arg2.asLong();
    } else if (arg1.getKind() == arg2.getKind()) {
      if (arg1.getKind() == Value.ValueKind.ENUM &&
          arg1.getEnumLit().primType() != arg2.getEnumLit().primType()) {
        throw incomparable(context, arg1, arg2);
      }
      eq = arg1.equals(arg2);
    } else {
      throw incomparable(context, arg1, arg2);
    }
    return Value.createBoolLit(op == Opcode.EQ ? eq : !eq);
  }

  private static TypeMismatchException incomparable(Context context,
                                                    Value arg1, Value arg2) {
    return new TypeMismatchException(context, "Cannot compare values of " +
        "type " + arg1.getType().typeName() + " and " +
        arg2.getType().typeName());
  }

  private static Value evalUnary(Opcode op, long arg, int width) {
    switch (op) {
      case UNARY_PLUS:
        return Value.createIntLit(arg);
      case NEGATE:
        return Value.createIntLit(truncate(-arg, width));
      case BIT_NOT:
        return Value.createIntLit(truncate(~arg, width));
      case NOT:
        return Value.createBoolLit(arg == 0);
      case AND_REDUCE:
        return Value.createBoolLit(truncate(~arg, width) == 0);
      case NAND_REDUCE:
        return Value.createBoolLit(truncate(~arg, width) != 0);
      case OR_REDUCE:
        return Value.createBoolLit(arg != 0);
      case NOR_REDUCE:
        return Value.createBoolLit(arg == 0);
      case XOR_REDUCE:
        return Value.createBoolLit(Long.bitCount(arg) % 2 == 1);
      case XNOR_REDUCE:
        return Value.createBoolLit(Long.bitCount(arg) % 2 == 0);
      default:
        throw new RDLRuntimeError("Not a unary operator: " + op);
    }
  }

  private static Value evalBinary(Context context, Opcode op,
                        long arg1, long arg2, int width) throws UserException {
    switch (op) {
      case PLUS:
        return intLit(arg1 + arg2, width);
      case MINUS:
        return intLit(arg1 - arg2, width);
      case MULT:
        return intLit(arg1 * arg2, width);
      case DIV:
        checkNonZero(context, op, arg2);
        return intLit(Long.divideUnsigned(arg1, arg2), width);
      case MOD:
        checkNonZero(context, op, arg2);
        return intLit(Long.remainderUnsigned(arg1, arg2), width);
      case POW:
        return intLit(pow(arg1, arg2), width);
      case BIT_AND:
        return intLit(arg1 & arg2, width);
      case BIT_OR:
        return intLit(arg1 | arg2, width);
      case BIT_XOR:
        return intLit(arg1 ^ arg2, width);
      case BIT_XNOR:
        return intLit(~(arg1 ^ arg2), width);
      case SHIFT_L:
        return intLit(shiftOut(arg2) ? 0 : arg1 << arg2, width);
      case SHIFT_R:
        return intLit(shiftOut(arg2) ? 0 : arg1 >>> arg2, width);
      case LT:
        return Value.createBoolLit(Long.compareUnsigned(arg1, arg2) < 0);
      case GT:
        return Value.createBoolLit(Long.compareUnsigned(arg1, arg2) > 0);
      case LTE:
        return Value.createBoolLit(Long.compareUnsigned(arg1, arg2) <= 0);
      case GTE:
        return Value.createBoolLit(Long.compareUnsigned(arg1, arg2) >= 0);
      case AND:
        return Value.createBoolLit(arg1 != 0 && arg2 != 0);
      case OR:
        return Value.createBoolLit(arg1 != 0 || arg2 != 0);
      default:
        throw new RDLRuntimeError("Not a binary operator: " + op);
    }
  }

  private static Value intLit(long val, int width) {
    return Value.createIntLit(truncate(val, width));
  }

  private static void checkNonZero(Context context, Opcode op, long divisor)
      throws DivisionByZeroException {
    if (divisor == 0) {
      throw new DivisionByZeroException(context, "Right operand of " + op +
                                        " is zero");
    }
  }

  /**
   * Shift amounts are unsigned: anything 64 or more clears all bits
   */
  private static boolean shiftOut(long amount) {
    return Long.compareUnsigned(amount, 64) >= 0;
  }

  /**
   * Exponentiation by squaring, wrapping modulo 2^64
   */
  private static long pow(long base, long exp) {
    long result = 1;
    while (exp != 0) {
      if ((exp & 1) != 0) {
        result *= base;
      }
      base *= base;
      exp >>>= 1;
    }
    return result;
  }

  /**
   * Truncate to the low width bits
   * @param width between 1 and 64
   */
  public static long truncate(long val, long width) {
    assert(width >= 1 && width <= 64);
    if (width == 64) {
      return val;
    }
    return val & ((1L << width) - 1);
  }
}
