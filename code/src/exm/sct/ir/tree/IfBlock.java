package exm.sct.ir.tree;

import java.util.List;

/**
 * if (condition) then ... [else ...]
 */
public class IfBlock extends Node {

  public static IfBlock create(Node condition, List<? extends Node> ifBody,
                               List<? extends Node> elseBody) {
    IfBlock ifBlock = new IfBlock();
    ifBlock.addChild(condition);
    ifBlock.addChild(new Schedule(ifBody));
    if (elseBody != null) {
      ifBlock.addChild(new Schedule(elseBody));
    }
    return ifBlock;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.IF_BLOCK;
  }

  public Node getCondition() {
    return getChild(0);
  }

  public Schedule getIfBody() {
    return (Schedule)getChild(1);
  }

  /**
   * @return else body, or null if none
   */
  public Schedule getElseBody() {
    return numChildren() > 2 ? (Schedule)getChild(2) : null;
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 3),
                        expectExpression(proposed, 0, "condition"),
                        expectKind(proposed, 1, NodeKind.SCHEDULE, "if body"),
                        expectKind(proposed, 2, NodeKind.SCHEDULE, "else body"));
  }

  @Override
  protected int minChildren() {
    return 2;
  }

  @Override
  protected Node shallowCopy() {
    return new IfBlock();
  }
}
