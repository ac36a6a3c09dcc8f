package exm.rdl.common.lang;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.DivisionByZeroException;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.BuiltinEnums.AccessType;
import exm.rdl.common.lang.BuiltinEnums.OnReadType;
import exm.rdl.common.lang.Operators.Opcode;
import exm.rdl.frontend.GlobalContext;

public class OpEvaluatorTest {

  private static final GlobalContext FAKE_CONTEXT =
      new GlobalContext("fake.rdl", Logging.getRDLLogger());

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Value eval(Opcode op, long ...args) throws UserException {
    return OpEvaluator.eval(FAKE_CONTEXT, op, Value.fromLongs(args));
  }

  private static Value eval(Opcode op, Value ...args) throws UserException {
    return OpEvaluator.eval(FAKE_CONTEXT, op, Arrays.asList(args));
  }

  private static Value i(long v) {
    return Value.createIntLit(v);
  }

  @Test
  public void testArithmeticWraps() throws UserException {
    assertEquals(i(-1), eval(Opcode.MINUS, 0, 1));
    assertEquals(i(0), eval(Opcode.PLUS, -1, 1));
    assertEquals(i(1024), eval(Opcode.POW, 2, 10));
    assertEquals(i(0), eval(Opcode.POW, 2, 64));
    assertEquals(i(1), eval(Opcode.POW, 0, 0));
  }

  @Test
  public void testUnsignedDivision() throws UserException {
    assertEquals(i(3), eval(Opcode.DIV, 7, 2));
    assertEquals(i(1), eval(Opcode.MOD, 7, 2));
    assertEquals(i(Long.MAX_VALUE), eval(Opcode.DIV, -1, 2));
  }

  @Test
  public void testShifts() throws UserException {
    assertEquals(i(15), eval(Opcode.SHIFT_R, -1, 60));
    assertEquals(i(256), eval(Opcode.SHIFT_L, 1, 8));
    assertEquals(i(0), eval(Opcode.SHIFT_L, 1, 64));
  }

  @Test
  public void testComparisonsUnsigned() throws UserException {
    assertEquals(Value.TRUE, eval(Opcode.LT, 1, 2));
    assertEquals(Value.FALSE, eval(Opcode.LT, -1, 2));
    assertEquals(Value.TRUE, eval(Opcode.GTE, 2, 2));
  }

  @Test
  public void testReductions() throws UserException {
    assertEquals(Value.TRUE, eval(Opcode.AND_REDUCE, -1));
    assertEquals(Value.FALSE, eval(Opcode.AND_REDUCE, 0xff));
    assertEquals(Value.TRUE, eval(Opcode.OR_REDUCE, 0x10));
    assertEquals(Value.TRUE, eval(Opcode.XOR_REDUCE, 0x7));
    assertEquals(Value.TRUE, eval(Opcode.XNOR_REDUCE, 0x3));
  }

  @Test
  public void testBooleansAsNumbers() throws UserException {
    assertEquals(i(2), eval(Opcode.PLUS, Value.TRUE, Value.TRUE));
    assertEquals(Value.TRUE, eval(Opcode.EQ, Value.TRUE, i(1)));
    assertEquals(Value.FALSE, eval(Opcode.NOT, Value.TRUE));
  }

  @Test
  public void testEqualityOnStringsAndEnums() throws UserException {
    assertEquals(Value.TRUE, eval(Opcode.EQ, Value.createStringLit("a"),
                                             Value.createStringLit("a")));
    assertEquals(Value.TRUE, eval(Opcode.NEQ,
        Value.createEnumLit(AccessType.RW), Value.createEnumLit(AccessType.R)));
  }

  @Test
  public void testCompareDifferentEnums() throws UserException {
    exception.expect(TypeMismatchException.class);
    eval(Opcode.EQ, Value.createEnumLit(AccessType.RW),
                    Value.createEnumLit(OnReadType.RCLR));
  }

  @Test
  public void testArithmeticOnString() throws UserException {
    exception.expect(TypeMismatchException.class);
    eval(Opcode.PLUS, i(1), Value.createStringLit("a"));
  }

  @Test
  public void testDivideByZero() throws UserException {
    exception.expect(DivisionByZeroException.class);
    eval(Opcode.MOD, 5, 0);
  }

  private static Value evalAt(int width, Opcode op, long ...args)
      throws UserException {
    return OpEvaluator.eval(FAKE_CONTEXT, op, Value.fromLongs(args), width);
  }

  @Test
  public void testNarrowWidths() throws UserException {
    assertEquals(i(0), evalAt(4, Opcode.PLUS, 0xf, 1));
    assertEquals(i(0xf), evalAt(4, Opcode.MINUS, 0, 1));
    assertEquals(i(0xf), evalAt(4, Opcode.BIT_NOT, 0));
    assertEquals(i(0xe), evalAt(4, Opcode.NEGATE, 2));
    assertEquals(i(0), evalAt(4, Opcode.SHIFT_L, 1, 4));
    assertEquals(i(0xc), evalAt(4, Opcode.BIT_XNOR, 0x5, 0x6));
  }

  @Test
  public void testReductionsAtWidth() throws UserException {
    assertEquals(Value.TRUE, evalAt(4, Opcode.AND_REDUCE, 0xf));
    assertEquals(Value.FALSE, evalAt(4, Opcode.NAND_REDUCE, 0xf));
    assertEquals(Value.FALSE, evalAt(5, Opcode.AND_REDUCE, 0xf));
    assertEquals(Value.TRUE, evalAt(5, Opcode.NAND_REDUCE, 0xf));
    assertEquals(Value.TRUE, evalAt(1, Opcode.AND_REDUCE, 1));
  }

  @Test
  public void testTruncate() {
    assertEquals(0xf, OpEvaluator.truncate(0xff, 4));
    assertEquals(-1, OpEvaluator.truncate(-1, 64));
  }
}
