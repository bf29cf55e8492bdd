package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A module: a named scope holding routines and nested containers.
 * A nameless file-level container holds the program units of one file.
 */
public class Container extends ScopingNode {
  /** Name of the container wrapping a whole source file */
  public static final String FILE_CONTAINER = "";

  private final String name;

  public Container(String name) {
    Preconditions.checkNotNull(name);
    this.name = name;
  }

  public static Container create(String name, List<? extends Node> children) {
    Container c = new Container(name);
    c.addChildren(children, 0);
    return c;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CONTAINER;
  }

  public String getName() {
    return name;
  }

  public boolean isFileContainer() {
    return name.equals(FILE_CONTAINER);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    for (int i = 0; i < proposed.size(); i++) {
      NodeKind k = proposed.get(i).kind();
      if (k != NodeKind.ROUTINE && k != NodeKind.CONTAINER) {
        return "child " + i + " must be a routine or container but found " +
               proposed.get(i);
      }
    }
    return null;
  }

  @Override
  protected Node shallowCopy() {
    return new Container(name);
  }

  @Override
  protected String describe() {
    return name;
  }
}
