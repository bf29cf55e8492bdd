package exm.sct.ir.tree;

import java.util.List;

/**
 * Ordered sequence of statements with its own scope, e.g. a loop body
 */
public class Schedule extends ScopingNode {

  public Schedule() {
  }

  public Schedule(List<? extends Node> statements) {
    addChildren(statements, 0);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SCHEDULE;
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    for (int i = 0; i < proposed.size(); i++) {
      if (!proposed.get(i).kind().isStatement()) {
        return "child " + i + " must be a statement but found " +
               proposed.get(i);
      }
    }
    return null;
  }

  @Override
  protected Node shallowCopy() {
    return new Schedule();
  }
}
