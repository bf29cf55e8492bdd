package exm.sct.ir.tree;

import java.util.List;

public class Return extends Node {

  @Override
  public NodeKind kind() {
    return NodeKind.RETURN;
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new Return();
  }
}
