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

import java.util.HashMap;
import java.util.Map;

import exm.rdl.ast.RDLTokens;

/**
 * This class serves to define details of builtin operators
 */
public class Operators {

  public static enum Opcode {
    PLUS, MINUS, MULT, DIV, MOD, POW,
    BIT_AND, BIT_OR, BIT_XOR, BIT_XNOR, SHIFT_L, SHIFT_R,
    UNARY_PLUS, NEGATE, BIT_NOT, NOT,
    AND_REDUCE, NAND_REDUCE, OR_REDUCE, NOR_REDUCE, XOR_REDUCE, XNOR_REDUCE,
    EQ, NEQ, LT, GT, LTE, GTE,
    AND, OR,
  }

  /** Map of operator token -> opcode, for each arity */
  private static final Map<Integer, Opcode> unaryOps =
                                      new HashMap<Integer, Opcode>();
  private static final Map<Integer, Opcode> binaryOps =
                                      new HashMap<Integer, Opcode>();

  static {
    fillOps();
  }

  private static void fillOps() {
    binaryOps.put(RDLTokens.PLUS, Opcode.PLUS);
    binaryOps.put(RDLTokens.MINUS, Opcode.MINUS);
    binaryOps.put(RDLTokens.MULT, Opcode.MULT);
    binaryOps.put(RDLTokens.DIV, Opcode.DIV);
    binaryOps.put(RDLTokens.MOD, Opcode.MOD);
    binaryOps.put(RDLTokens.POW, Opcode.POW);
    binaryOps.put(RDLTokens.AMP, Opcode.BIT_AND);
    binaryOps.put(RDLTokens.PIPE, Opcode.BIT_OR);
    binaryOps.put(RDLTokens.CARET, Opcode.BIT_XOR);
    binaryOps.put(RDLTokens.XNOR, Opcode.BIT_XNOR);
    binaryOps.put(RDLTokens.SHL, Opcode.SHIFT_L);
    binaryOps.put(RDLTokens.SHR, Opcode.SHIFT_R);
    binaryOps.put(RDLTokens.EQUALS, Opcode.EQ);
    binaryOps.put(RDLTokens.NEQUALS, Opcode.NEQ);
    binaryOps.put(RDLTokens.LT, Opcode.LT);
    binaryOps.put(RDLTokens.GT, Opcode.GT);
    binaryOps.put(RDLTokens.LTE, Opcode.LTE);
    binaryOps.put(RDLTokens.GTE, Opcode.GTE);
    binaryOps.put(RDLTokens.LAND, Opcode.AND);
    binaryOps.put(RDLTokens.LOR, Opcode.OR);

    unaryOps.put(RDLTokens.PLUS, Opcode.UNARY_PLUS);
    unaryOps.put(RDLTokens.MINUS, Opcode.NEGATE);
    unaryOps.put(RDLTokens.TILDE, Opcode.BIT_NOT);
    unaryOps.put(RDLTokens.NOT, Opcode.NOT);
    unaryOps.put(RDLTokens.AMP, Opcode.AND_REDUCE);
    unaryOps.put(RDLTokens.NAND, Opcode.NAND_REDUCE);
    unaryOps.put(RDLTokens.PIPE, Opcode.OR_REDUCE);
    unaryOps.put(RDLTokens.NOR, Opcode.NOR_REDUCE);
    unaryOps.put(RDLTokens.CARET, Opcode.XOR_REDUCE);
    unaryOps.put(RDLTokens.XNOR, Opcode.XNOR_REDUCE);
  }

  /**
   * @param opToken operator token from AST
   * @param arity number of operands
   * @return null if no such operator
   */
  public static Opcode lookup(int opToken, int arity) {
    if (arity == 1) {
      return unaryOps.get(opToken);
    } else if (arity == 2) {
      return binaryOps.get(opToken);
    } else {
      return null;
    }
  }

  /**
   * Relational and logical operators, plus reductions, produce booleans
   */
  public static boolean isBoolResult(Opcode op) {
    switch (op) {
      case EQ: case NEQ: case LT: case GT: case LTE: case GTE:
      case AND: case OR: case NOT:
      case AND_REDUCE: case NAND_REDUCE: case OR_REDUCE: case NOR_REDUCE:
      case XOR_REDUCE: case XNOR_REDUCE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Equality is defined on all values, not just numbers
   */
  public static boolean isEquality(Opcode op) {
    return op == Opcode.EQ || op == Opcode.NEQ;
  }

  /**
   * How an operator's operands get their bit width.
   */
  public static enum WidthRule {
    /** Operands are evaluated in the width of the enclosing expression */
    CONTEXT,
    /** Left operand as for CONTEXT; right operand is self-determined */
    LEFT_OPERAND,
    /**
     * Result is a single bit.  Operands are evaluated in a new context as
     * wide as the widest of them
     */
    NEW_CONTEXT,
    /** Result is a single bit; each operand is self-determined */
    SELF_DETERMINED,
  }

  public static WidthRule widthRule(Opcode op) {
    switch (op) {
      case POW: case SHIFT_L: case SHIFT_R:
        return WidthRule.LEFT_OPERAND;
      case AND: case OR:
        return WidthRule.SELF_DETERMINED;
      default:
        return isBoolResult(op) ? WidthRule.NEW_CONTEXT : WidthRule.CONTEXT;
    }
  }
}
