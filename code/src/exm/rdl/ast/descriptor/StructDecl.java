package exm.rdl.ast.descriptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Types.StructType;
import exm.rdl.common.lang.Types.StructType.StructField;
import exm.rdl.common.lang.Types.Type;
import exm.rdl.frontend.Context;
import exm.rdl.frontend.TypeChecker;

/**
 * Struct type declaration, e.g.
 * <code>struct s2_t : base_t { string str; s1_t nest_arr[]; };</code>
 */
public class StructDecl {

  private final StructType type;

  private StructDecl(StructType type) {
    this.type = type;
  }

  public StructType getType() {
    return type;
  }

  public static StructDecl fromAST(Context context, RDLAST tree)
      throws UserException {
    assert(tree.getType() == RDLTokens.STRUCT_DEF);
    assert(tree.getChildCount() >= 1);
    context.syncFilePos(tree);
    String name = tree.child(0).getText();

    StructType base = null;
    int fieldStart = 1;
    if (tree.getChildCount() > 1 &&
        tree.child(1).getType() == RDLTokens.STRUCT_BASE) {
      base = context.lookupStructTypeUser(tree.child(1).child(0).getText());
      fieldStart = 2;
    }

    Set<String> names = new HashSet<String>();
    if (base != null) {
      for (StructField f: base.fields()) {
        names.add(f.name());
      }
    }
    List<StructField> fields = new ArrayList<StructField>();
    for (RDLAST fieldTree: tree.children(fieldStart)) {
      assert(fieldTree.getType() == RDLTokens.STRUCT_FIELD);
      context.syncFilePos(fieldTree);
      Type fieldType = TypeChecker.resolveType(context, fieldTree.child(0));
      String fieldName = fieldTree.child(1).getText();
      if (!names.add(fieldName)) {
        throw new DoubleDefineException(context, "Field " + fieldName +
                          " is declared twice in struct " + name);
      }
      fields.add(new StructField(fieldType, fieldName));
    }
    return new StructDecl(new StructType(name, base, fields));
  }
}
