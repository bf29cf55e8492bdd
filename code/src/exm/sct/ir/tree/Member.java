package exm.sct.ir.tree;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * One component of a structure access.  Children are the subscripts of
 * this component, optionally followed by the next component.
 */
public class Member extends Node {
  private final String name;

  public Member(String name) {
    Preconditions.checkArgument(name != null && !name.isEmpty());
    this.name = name;
  }

  public static Member create(String name, List<? extends Node> subscripts,
                              Member next) {
    Member m = new Member(name);
    m.addChildren(subscripts, 0);
    if (next != null) {
      m.addChild(next);
    }
    return m;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.MEMBER;
  }

  public String getName() {
    return name;
  }

  public List<Node> getIndices() {
    List<Node> result = new ArrayList<Node>();
    for (Node child: getChildren()) {
      if (child.kind() != NodeKind.MEMBER) {
        result.add(child);
      }
    }
    return result;
  }

  /**
   * @return the next component, or null if this is the last
   */
  public Member getNext() {
    int n = numChildren();
    if (n > 0 && getChild(n - 1).kind() == NodeKind.MEMBER) {
      return (Member)getChild(n - 1);
    }
    return null;
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    int end = proposed.size();
    if (end > 0 && proposed.get(end - 1).kind() == NodeKind.MEMBER) {
      end--;
    }
    return ArrayReference.checkSubscripts(proposed, 0, end);
  }

  @Override
  protected Node shallowCopy() {
    return new Member(name);
  }

  @Override
  protected String describe() {
    return name;
  }
}
