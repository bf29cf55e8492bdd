package exm.sct.ir.tree;

import java.util.List;

/**
 * start:stop:step, as an array subscript
 */
public class Range extends Node {

  public static Range create(Node start, Node stop, Node step) {
    Range r = new Range();
    r.addChild(start);
    r.addChild(stop);
    r.addChild(step);
    return r;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.RANGE;
  }

  public Node getStart() {
    return getChild(0);
  }

  public Node getStop() {
    return getChild(1);
  }

  public Node getStep() {
    return getChild(2);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 3),
                        expectExpression(proposed, 0, "start"),
                        expectExpression(proposed, 1, "stop"),
                        expectExpression(proposed, 2, "step"));
  }

  @Override
  protected int minChildren() {
    return 3;
  }

  @Override
  protected Node shallowCopy() {
    return new Range();
  }
}
