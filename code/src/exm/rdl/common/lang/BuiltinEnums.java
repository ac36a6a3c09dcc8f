package exm.rdl.common.lang;

import java.util.HashMap;
import java.util.Map;

import exm.rdl.common.lang.Types.PrimType;

/**
 * Builtin enumerations of the description language.  Enumerator literals
 * are unique across all of them, so a bare literal such as <code>rw</code>
 * identifies its enumeration.
 */
public class BuiltinEnums {

  public static interface RDLEnum {
    String literal();
    PrimType primType();
  }

  public static enum AccessType implements RDLEnum {
    NA, RW, WR, R, W, RW1, W1;

    @Override
    public String literal() {
      return name().toLowerCase();
    }

    @Override
    public PrimType primType() {
      return PrimType.ACCESSTYPE;
    }
  }

  public static enum OnReadType implements RDLEnum {
    RCLR, RSET, RUSER;

    @Override
    public String literal() {
      return name().toLowerCase();
    }

    @Override
    public PrimType primType() {
      return PrimType.ONREADTYPE;
    }
  }

  public static enum OnWriteType implements RDLEnum {
    WOSET, WOCLR, WOT, WZS, WZC, WZT, WCLR, WSET, WUSER;

    @Override
    public String literal() {
      return name().toLowerCase();
    }

    @Override
    public PrimType primType() {
      return PrimType.ONWRITETYPE;
    }
  }

  public static enum AddressingType implements RDLEnum {
    COMPACT, REGALIGN, FULLALIGN;

    @Override
    public String literal() {
      return name().toLowerCase();
    }

    @Override
    public PrimType primType() {
      return PrimType.ADDRESSINGTYPE;
    }
  }

  public static enum PrecedenceType implements RDLEnum {
    HW, SW;

    @Override
    public String literal() {
      return name().toLowerCase();
    }

    @Override
    public PrimType primType() {
      return PrimType.PRECEDENCETYPE;
    }
  }

  private static final Map<String, RDLEnum> literals =
                                    new HashMap<String, RDLEnum>();

  static {
    register(AccessType.values());
    register(OnReadType.values());
    register(OnWriteType.values());
    register(AddressingType.values());
    register(PrecedenceType.values());
  }

  private static void register(RDLEnum[] vals) {
    for (RDLEnum val: vals) {
      RDLEnum prev = literals.put(val.literal(), val);
      assert(prev == null) : "Duplicate enum literal " + val.literal();
    }
  }

  /**
   * @param literal e.g. "woclr"
   * @return the enumerator, or null if no builtin enumeration has it
   */
  public static RDLEnum lookup(String literal) {
    return literals.get(literal);
  }
}
