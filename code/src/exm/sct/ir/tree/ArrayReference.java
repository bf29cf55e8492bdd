package exm.sct.ir.tree;

import java.util.List;

import exm.sct.ir.symbols.Symbol;

/**
 * Access to an array element or section: a(i, j:k)
 */
public class ArrayReference extends Reference {

  public ArrayReference(Symbol symbol) {
    super(symbol);
  }

  public static ArrayReference create(Symbol symbol,
                                      List<? extends Node> subscripts) {
    ArrayReference ref = new ArrayReference(symbol);
    ref.addChildren(subscripts, 0);
    return ref;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ARRAY_REFERENCE;
  }

  public List<Node> getIndices() {
    return getChildren();
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return checkSubscripts(proposed, 0, proposed.size());
  }

  static String checkSubscripts(List<Node> proposed, int from, int to) {
    for (int i = from; i < to; i++) {
      if (!proposed.get(i).kind().isSubscript()) {
        return "subscript " + i + " must be an expression or range but found "
               + proposed.get(i);
      }
    }
    return null;
  }

  @Override
  protected int minChildren() {
    return 1;
  }

  @Override
  protected Node shallowCopy() {
    return new ArrayReference(getSymbol());
  }
}
