package exm.rdl.elab;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.rdl.common.lang.Value;

/**
 * The result of elaborating one top-level instantiation: an immutable
 * hierarchy of instances.
 */
public class ElaboratedTree {

  public static interface Visitor {
    /**
     * @param depth 0 for the root
     */
    public void visit(Instance inst, int depth);
  }

  private final Instance root;

  public ElaboratedTree(Instance root) {
    this.root = root;
  }

  public Instance getRoot() {
    return root;
  }

  /**
   * Find instance by path relative to root
   * @param path e.g. "regs[3].data", or "" for the root
   * @return null if not found
   */
  public Instance find(String path) {
    Instance curr = root;
    if (path.isEmpty()) {
      return curr;
    }
    for (String elem: StringUtils.split(path, '.')) {
      curr = curr.child(elem);
      if (curr == null) {
        return null;
      }
    }
    return curr;
  }

  /**
   * Visit all instances, parents before children
   */
  public void visit(Visitor visitor) {
    visit(root, 0, visitor);
  }

  private static void visit(Instance inst, int depth, Visitor visitor) {
    visitor.visit(inst, depth);
    for (Instance child: inst.children()) {
      visit(child, depth + 1, visitor);
    }
  }

  /**
   * @return total number of instances, including the root
   */
  public int size() {
    final int[] count = new int[1];
    visit(new Visitor() {
      @Override
      public void visit(Instance inst, int depth) {
        count[0]++;
      }
    });
    return count[0];
  }

  /**
   * @return human-readable dump of the tree, one instance per line
   */
  public String dump() {
    final StringBuilder sb = new StringBuilder();
    visit(new Visitor() {
      @Override
      public void visit(Instance inst, int depth) {
        sb.append(StringUtils.repeat(' ', depth * 2));
        sb.append(inst);
        for (Map.Entry<String, Value> e: inst.properties().entrySet()) {
          sb.append(' ').append(e.getKey()).append('=').append(e.getValue());
        }
        sb.append('\n');
      }
    });
    return sb.toString();
  }

  @Override
  public String toString() {
    return "ElaboratedTree(" + root + ")";
  }
}
