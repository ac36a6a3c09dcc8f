package exm.rdl.common.lang;

/**
 * Kinds of component a template can define
 */
public enum ComponentKind {
  ADDRMAP, REGFILE, REG, FIELD, MEM, SIGNAL;

  public String keyword() {
    return name().toLowerCase();
  }

  /**
   * @param keyword e.g. "regfile"
   * @return null if not a component keyword
   */
  public static ComponentKind fromKeyword(String keyword) {
    for (ComponentKind k: values()) {
      if (k.keyword().equals(keyword)) {
        return k;
      }
    }
    return null;
  }
}
