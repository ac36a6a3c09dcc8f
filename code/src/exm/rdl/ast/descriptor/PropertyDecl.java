package exm.rdl.ast.descriptor;

import java.util.EnumSet;
import java.util.Set;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.Types.Type;
import exm.rdl.frontend.Context;
import exm.rdl.frontend.TypeChecker;

/**
 * User-defined property declaration, e.g.
 * <code>property p_int { type = longint; component = reg | field; };</code>
 */
public class PropertyDecl {
  private final String name;
  private final Type type;
  private final Set<ComponentKind> components;
  /** Default value expression, null if none */
  private final RDLAST defaultExpr;

  private PropertyDecl(String name, Type type, Set<ComponentKind> components,
                       RDLAST defaultExpr) {
    this.name = name;
    this.type = type;
    this.components = components;
    this.defaultExpr = defaultExpr;
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  public Set<ComponentKind> getComponents() {
    return components;
  }

  public RDLAST getDefaultExpr() {
    return defaultExpr;
  }

  public static PropertyDecl fromAST(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getType() == RDLTokens.PROPERTY_DEF);
    context.syncFilePos(tree);
    String name = tree.child(0).getText();
    Type type = null;
    Set<ComponentKind> components = null;
    RDLAST defaultExpr = null;

    for (RDLAST attr: tree.children(1)) {
      assert(attr.getType() == RDLTokens.PROPERTY_ATTR);
      context.syncFilePos(attr);
      String attrName = attr.child(0).getText();
      RDLAST attrVal = attr.child(1);
      if (attrName.equals("type")) {
        checkUnset(context, name, attrName, type);
        type = TypeChecker.resolveType(context, attrVal);
      } else if (attrName.equals("component")) {
        checkUnset(context, name, attrName, components);
        components = componentKinds(context, name, attrVal);
      } else if (attrName.equals("default")) {
        checkUnset(context, name, attrName, defaultExpr);
        defaultExpr = attrVal;
      } else {
        throw new InvalidSyntaxException(context, "Unknown attribute " +
                              attrName + " in definition of property " + name);
      }
    }

    if (type == null) {
      throw new InvalidSyntaxException(context, "Definition of property " +
                                       name + " has no type");
    }
    if (components == null) {
      throw new InvalidSyntaxException(context, "Definition of property " +
                                       name + " has no component");
    }
    return new PropertyDecl(name, type, components, defaultExpr);
  }

  private static void checkUnset(Context context, String name,
      String attrName, Object prev) throws InvalidSyntaxException {
    if (prev != null) {
      throw new InvalidSyntaxException(context, "Attribute " + attrName +
                      " given twice in definition of property " + name);
    }
  }

  private static Set<ComponentKind> componentKinds(Context context,
      String name, RDLAST tree) throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.COMPONENT_KINDS);
    Set<ComponentKind> kinds = EnumSet.noneOf(ComponentKind.class);
    for (RDLAST kindTree: tree.children()) {
      String kw = kindTree.getText();
      if (kw.equals("all")) {
        kinds.addAll(EnumSet.allOf(ComponentKind.class));
      } else {
        ComponentKind kind = ComponentKind.fromKeyword(kw);
        if (kind == null) {
          throw new InvalidSyntaxException(context, "Unknown component " +
                          "type " + kw + " in definition of property " + name);
        }
        kinds.add(kind);
      }
    }
    if (kinds.isEmpty()) {
      throw new InvalidSyntaxException(context, "Definition of property " +
                                       name + " has no component");
    }
    return kinds;
  }
}
