package exm.sct.ir.tree;

import java.util.List;

/**
 * lhs = rhs
 */
public class Assignment extends Node {

  public static Assignment create(Reference lhs, Node rhs) {
    Assignment a = new Assignment();
    a.addChild(lhs);
    a.addChild(rhs);
    return a;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ASSIGNMENT;
  }

  public Reference getLhs() {
    return (Reference)getChild(0);
  }

  public Node getRhs() {
    return getChild(1);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    if (!proposed.isEmpty() && !proposed.get(0).kind().isReference()) {
      return "target must be a reference but found " + proposed.get(0);
    }
    return firstProblem(expectMax(proposed, 2),
                        expectExpression(proposed, 1, "value"));
  }

  @Override
  protected int minChildren() {
    return 2;
  }

  @Override
  protected Node shallowCopy() {
    return new Assignment();
  }
}
