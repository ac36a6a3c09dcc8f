package exm.rdl.ast.descriptor;

import java.util.ArrayList;
import java.util.List;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.util.Pair;
import exm.rdl.frontend.Context;

/**
 * Component instantiation statement, e.g.
 * <code>myReg #(.SIZE(16)) r1, regs[8];</code>
 * or an anonymous definition instantiated in place:
 * <code>field { sw = rw; } data;</code>
 */
public class ComponentInstantiation {
  /** null if anonymous */
  private final String typeName;
  /** null unless anonymous */
  private final ComponentDecl anonDef;
  private final List<Pair<String, RDLAST>> paramAssigns;
  private final List<InstElem> elems;

  private ComponentInstantiation(String typeName, ComponentDecl anonDef,
      List<Pair<String, RDLAST>> paramAssigns, List<InstElem> elems) {
    this.typeName = typeName;
    this.anonDef = anonDef;
    this.paramAssigns = paramAssigns;
    this.elems = elems;
  }

  public String getTypeName() {
    return typeName;
  }

  public ComponentDecl getAnonDef() {
    return anonDef;
  }

  public boolean isAnonymous() {
    return anonDef != null;
  }

  /**
   * @return named parameter overrides, in order written
   */
  public List<Pair<String, RDLAST>> getParamAssigns() {
    return paramAssigns;
  }

  public List<InstElem> getElems() {
    return elems;
  }

  public static ComponentInstantiation fromAST(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.COMPONENT_INST);
    assert(tree.getChildCount() >= 3);
    context.syncFilePos(tree);

    RDLAST defTree = tree.child(0);
    String typeName = null;
    ComponentDecl anonDef = null;
    if (defTree.getType() == RDLTokens.COMPONENT_DEF) {
      anonDef = ComponentDecl.fromAST(context, defTree);
      if (!anonDef.isAnonymous()) {
        throw new InvalidSyntaxException(context, "Only anonymous " +
            "definitions can be instantiated where they are defined");
      }
    } else {
      assert(defTree.getType() == RDLTokens.ID);
      typeName = defTree.getText();
    }

    RDLAST assignsTree = tree.child(1);
    assert(assignsTree.getType() == RDLTokens.PARAM_ASSIGNS);
    List<Pair<String, RDLAST>> paramAssigns =
                            new ArrayList<Pair<String, RDLAST>>();
    for (RDLAST assign: assignsTree.children()) {
      assert(assign.getType() == RDLTokens.PARAM_ASSIGN);
      paramAssigns.add(Pair.create(assign.child(0).getText(),
                                   assign.child(1)));
    }
    if (anonDef != null && !paramAssigns.isEmpty()) {
      throw new InvalidSyntaxException(context, "Anonymous definitions " +
                                       "cannot have parameters");
    }

    List<InstElem> elems = new ArrayList<InstElem>();
    for (RDLAST elemTree: tree.children(2)) {
      assert(elemTree.getType() == RDLTokens.INST_ELEM);
      RDLAST extent = null;
      if (elemTree.getChildCount() > 1) {
        assert(elemTree.child(1).getType() == RDLTokens.INST_EXTENT);
        extent = elemTree.child(1).child(0);
      }
      elems.add(new InstElem(elemTree, elemTree.child(0).getText(), extent));
    }
    return new ComponentInstantiation(typeName, anonDef, paramAssigns, elems);
  }

  public static class InstElem {
    private final RDLAST tree;
    private final String name;
    private final RDLAST extentExpr;

    public InstElem(RDLAST tree, String name, RDLAST extentExpr) {
      this.tree = tree;
      this.name = name;
      this.extentExpr = extentExpr;
    }

    public RDLAST getTree() {
      return tree;
    }

    public String getName() {
      return name;
    }

    /**
     * @return null if not an instance array
     */
    public RDLAST getExtentExpr() {
      return extentExpr;
    }
  }
}
