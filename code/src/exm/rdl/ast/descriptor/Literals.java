package exm.rdl.ast.descriptor;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.frontend.Context;
import exm.rdl.frontend.LogHelper;

public class Literals {

  /**
   * Parse an integer literal.  Accepted forms: decimal (<code>32</code>),
   * C-style hex (<code>0x1f</code>) and Verilog-style sized literals
   * (<code>4'hf</code>, <code>8'd255</code>, <code>2'b10</code>).
   * Underscores may separate digits.
   * @return the value as an unsigned 64 bit quantity
   */
  public static long parseIntLit(Context context, String text)
      throws InvalidSyntaxException {
    String s = text.replace("_", "");
    try {
      int tick = s.indexOf('\'');
      if (tick >= 0) {
        return parseVerilogLit(context, text, s, tick);
      } else if (s.startsWith("0x") || s.startsWith("0X")) {
        return Long.parseUnsignedLong(s.substring(2), 16);
      } else {
        return Long.parseUnsignedLong(s);
      }
    } catch (NumberFormatException e) {
      throw new InvalidSyntaxException(context, "Invalid integer literal: "
                                        + text);
    }
  }

  private static long parseVerilogLit(Context context, String text,
      String s, int tick) throws InvalidSyntaxException {
    if (tick == 0 || tick + 2 > s.length()) {
      throw new InvalidSyntaxException(context, "Invalid integer literal: "
                                        + text);
    }
    int width = Integer.parseInt(s.substring(0, tick));
    if (width <= 0 || width > 64) {
      throw new InvalidSyntaxException(context, "Width of integer literal "
          + text + " must be between 1 and 64");
    }
    int radix;
    switch (Character.toLowerCase(s.charAt(tick + 1))) {
      case 'b':
        radix = 2;
        break;
      case 'o':
        radix = 8;
        break;
      case 'd':
        radix = 10;
        break;
      case 'h':
        radix = 16;
        break;
      default:
        throw new InvalidSyntaxException(context, "Invalid radix in " +
                                         "integer literal: " + text);
    }
    long val = Long.parseUnsignedLong(s.substring(tick + 2), radix);
    if (width < 64 && Long.compareUnsigned(val, 1L << width) >= 0) {
      throw new InvalidSyntaxException(context, "Value of integer literal "
          + text + " does not fit in " + width + " bits");
    }
    return val;
  }

  public static long extractIntLit(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.INT_LITERAL);
    assert(tree.getChildCount() == 1);
    return parseIntLit(context, tree.child(0).getText());
  }

  /**
   * @return the declared width of a sized literal such as
   *         <code>4'hf</code>, or 64 for unsized literals
   */
  public static int intLitWidth(Context context, String text)
      throws InvalidSyntaxException {
    int tick = text.indexOf('\'');
    if (tick < 0) {
      return 64;
    }
    // Checks the width is valid
    parseIntLit(context, text);
    return Integer.parseInt(text.substring(0, tick).replace("_", ""));
  }

  public static int extractIntLitWidth(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.INT_LITERAL);
    assert(tree.getChildCount() == 1);
    return intLitWidth(context, tree.child(0).getText());
  }

  public static boolean extractBoolLit(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.BOOL_LITERAL);
    assert(tree.getChildCount() == 1);
    String text = tree.child(0).getText();
    if (text.equals("true")) {
      return true;
    } else if (text.equals("false")) {
      return false;
    } else {
      throw new InvalidSyntaxException(context, "Invalid boolean literal: "
                                       + text);
    }
  }

  public static String extractStringLit(Context context, RDLAST tree) {
    assert(tree.getType() == RDLTokens.STRING_LITERAL);
    assert(tree.getChildCount() == 1);
    String result = unescapeString(unquote(tree.child(0).getText()));
    LogHelper.trace(context, "Unescaped string '" + tree.child(0).getText() +
              "', resulting in '" + result + "'");
    return result;
  }

  public static String unquote(String s)
  {
    if (s.length() < 2 || s.charAt(0) != '"' ||
        s.charAt(s.length()-1) != '"')
      throw new RDLRuntimeError("String not quoted: " + s);
    return s.substring(1, s.length()-1);
  }

  /**
   * Only <code>\"</code> and <code>\\</code> are escape codes, any other
   * backslash is kept as is.
   */
  public static String unescapeString(String escapedString) {
    StringBuilder realString = new StringBuilder();
    for (int i = 0; i < escapedString.length(); i++) {
      char c = escapedString.charAt(i);
      if (c == '\\' && i + 1 < escapedString.length()) {
        char next = escapedString.charAt(i + 1);
        if (next == '"' || next == '\\') {
          realString.append(next);
          i++;
          continue;
        }
      }
      realString.append(c);
    }
    return realString.toString();
  }
}
