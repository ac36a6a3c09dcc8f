package exm.rdl.ast.descriptor;

import java.util.ArrayList;
import java.util.List;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.frontend.Context;

/**
 * Property assignment in a component body.  Covers the plain form
 * <code>regwidth = SIZE;</code>, assignments through instance paths
 * <code>data->hdl_path_slice = FIELD_SLICES;</code> or
 * <code>regs[2].data->reset = 1;</code>, bare assignments
 * <code>shared;</code> and default assignments
 * <code>default sw = rw;</code>.
 */
public class PropAssignment {
  private final List<PathElem> target;
  private final String property;
  /** null for bare assignments */
  private final RDLAST valueExpr;
  private final boolean isDefault;

  private PropAssignment(List<PathElem> target, String property,
                         RDLAST valueExpr, boolean isDefault) {
    this.target = target;
    this.property = property;
    this.valueExpr = valueExpr;
    this.isDefault = isDefault;
  }

  /**
   * @return instance path to assign on, empty for the enclosing component
   */
  public List<PathElem> getTarget() {
    return target;
  }

  public String getProperty() {
    return property;
  }

  public RDLAST getValueExpr() {
    return valueExpr;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public static PropAssignment fromAST(Context context, RDLAST tree) {
    context.syncFilePos(tree);
    if (tree.getType() == RDLTokens.DEFAULT_PROP_ASSIGN) {
      RDLAST value = tree.getChildCount() > 1 ? tree.child(1) : null;
      return new PropAssignment(new ArrayList<PathElem>(),
                                tree.child(0).getText(), value, true);
    }

    assert(tree.getType() == RDLTokens.PROP_ASSIGN);
    assert(tree.getChildCount() >= 2);
    RDLAST targetTree = tree.child(0);
    assert(targetTree.getType() == RDLTokens.PROP_TARGET);
    List<PathElem> target = new ArrayList<PathElem>();
    for (RDLAST elem: targetTree.children()) {
      assert(elem.getType() == RDLTokens.PATH_ELEM);
      RDLAST index = elem.getChildCount() > 1 ? elem.child(1) : null;
      target.add(new PathElem(elem.child(0).getText(), index));
    }
    RDLAST value = tree.getChildCount() > 2 ? tree.child(2) : null;
    return new PropAssignment(target, tree.child(1).getText(), value, false);
  }

  public static class PathElem {
    private final String name;
    private final RDLAST indexExpr;

    public PathElem(String name, RDLAST indexExpr) {
      this.name = name;
      this.indexExpr = indexExpr;
    }

    public String getName() {
      return name;
    }

    /** null if not indexed */
    public RDLAST getIndexExpr() {
      return indexExpr;
    }
  }
}
