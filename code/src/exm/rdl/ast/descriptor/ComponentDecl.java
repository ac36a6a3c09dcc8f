package exm.rdl.ast.descriptor;

import java.util.ArrayList;
import java.util.List;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.frontend.Context;

/**
 * Component definition, e.g.
 * <code>reg myReg #(longint SIZE = 32, boolean SHARED = true) { ... };</code>
 */
public class ComponentDecl {
  private final RDLAST tree;
  private final ComponentKind kind;
  /** null for anonymous definitions */
  private final String name;
  private final List<ParamDecl> params;
  private final RDLAST body;

  private ComponentDecl(RDLAST tree, ComponentKind kind, String name,
                        List<ParamDecl> params, RDLAST body) {
    this.tree = tree;
    this.kind = kind;
    this.name = name;
    this.params = params;
    this.body = body;
  }

  /**
   * @return the definition tree, which identifies the definition
   */
  public RDLAST getTree() {
    return tree;
  }

  public ComponentKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public boolean isAnonymous() {
    return name == null;
  }

  public List<ParamDecl> getParams() {
    return params;
  }

  public RDLAST getBody() {
    return body;
  }

  public static ComponentDecl fromAST(Context context, RDLAST tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == RDLTokens.COMPONENT_DEF);
    assert(tree.getChildCount() == 4);
    context.syncFilePos(tree);
    String kindName = tree.child(0).getText();
    ComponentKind kind = ComponentKind.fromKeyword(kindName);
    if (kind == null) {
      throw new InvalidSyntaxException(context, "Unknown component type: "
                                       + kindName);
    }

    RDLAST nameTree = tree.child(1);
    String name;
    if (nameTree.getType() == RDLTokens.ANONYMOUS) {
      name = null;
    } else {
      assert(nameTree.getType() == RDLTokens.ID);
      name = nameTree.getText();
    }

    RDLAST paramsTree = tree.child(2);
    assert(paramsTree.getType() == RDLTokens.PARAM_DECLS);
    List<ParamDecl> params = new ArrayList<ParamDecl>();
    for (RDLAST paramTree: paramsTree.children()) {
      assert(paramTree.getType() == RDLTokens.PARAM_DECL);
      RDLAST defaultExpr = paramTree.getChildCount() > 2 ?
                           paramTree.child(2) : null;
      params.add(new ParamDecl(paramTree, paramTree.child(0),
                     paramTree.child(1).getText(), defaultExpr));
    }

    RDLAST body = tree.child(3);
    assert(body.getType() == RDLTokens.BODY);
    return new ComponentDecl(tree, kind, name, params, body);
  }

  public static class ParamDecl {
    private final RDLAST tree;
    private final RDLAST typeTree;
    private final String name;
    private final RDLAST defaultExpr;

    public ParamDecl(RDLAST tree, RDLAST typeTree, String name,
                     RDLAST defaultExpr) {
      this.tree = tree;
      this.typeTree = typeTree;
      this.name = name;
      this.defaultExpr = defaultExpr;
    }

    public RDLAST getTree() {
      return tree;
    }

    public RDLAST getTypeTree() {
      return typeTree;
    }

    public String getName() {
      return name;
    }

    /** null if the parameter has no default */
    public RDLAST getDefaultExpr() {
      return defaultExpr;
    }
  }
}
