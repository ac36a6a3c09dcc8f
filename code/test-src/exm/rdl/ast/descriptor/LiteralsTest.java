package exm.rdl.ast.descriptor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.rdl.ast.ASTBuilder;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.frontend.GlobalContext;

public class LiteralsTest {
  private static final GlobalContext CONTEXT =
      new GlobalContext("literals.rdl", Logger.getLogger(""));

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static long parse(String text) throws InvalidSyntaxException {
    return Literals.parseIntLit(CONTEXT, text);
  }

  @Test
  public void testDecimalAndHex() throws InvalidSyntaxException {
    assertEquals(0, parse("0"));
    assertEquals(32, parse("32"));
    assertEquals(1000000, parse("1_000_000"));
    assertEquals(0x1f, parse("0x1f"));
    assertEquals(0xABCDL, parse("0XabCD"));
  }

  @Test
  public void testUnsigned64Bit() throws InvalidSyntaxException {
    assertEquals(-1L, parse("0xffffffffffffffff"));
    assertEquals(-1L, parse("18446744073709551615"));
    assertEquals(-1L, parse("64'hFFFF_FFFF_FFFF_FFFF"));
  }

  @Test
  public void testVerilogStyle() throws InvalidSyntaxException {
    assertEquals(15, parse("4'hf"));
    assertEquals(255, parse("8'd255"));
    assertEquals(2, parse("2'b10"));
    assertEquals(7, parse("3'o7"));
    assertEquals(5, parse("8'B0000_0101"));
  }

  @Test
  public void testVerilogValueTooWide() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("does not fit in 4 bits");
    parse("4'h1f");
  }

  @Test
  public void testVerilogZeroWidth() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    parse("0'h0");
  }

  @Test
  public void testVerilogBadRadix() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Invalid radix");
    parse("4'x3");
  }

  @Test
  public void testVerilogMissingWidth() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    parse("'hf");
  }

  @Test
  public void testOverflow() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("literals.rdl:");
    parse("18446744073709551616");
  }

  @Test
  public void testBadDigits() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    parse("2'b102");
  }

  @Test
  public void testBoolAndStringLiterals() throws InvalidSyntaxException {
    assertTrue(Literals.extractBoolLit(CONTEXT, ASTBuilder.boolLit(true)));
    assertFalse(Literals.extractBoolLit(CONTEXT, ASTBuilder.boolLit(false)));
    assertEquals("a \"quoted\" \\ \\n",
        Literals.extractStringLit(CONTEXT,
                      ASTBuilder.strLit("a \\\"quoted\\\" \\\\ \\n")));
  }

  @Test
  public void testUnescape() {
    assertEquals("plain", Literals.unescapeString("plain"));
    assertEquals("trailing\\", Literals.unescapeString("trailing\\"));
    assertEquals("\\t", Literals.unescapeString("\\t"));
  }
}
