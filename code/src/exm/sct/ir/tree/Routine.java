package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A subroutine or main program
 */
public class Routine extends Schedule {
  private final String name;
  private final boolean isProgram;

  public Routine(String name) {
    this(name, false);
  }

  public Routine(String name, boolean isProgram) {
    Preconditions.checkArgument(name != null && !name.isEmpty(),
                                "Routine must have a name");
    this.name = name;
    this.isProgram = isProgram;
  }

  public static Routine create(String name, List<? extends Node> body) {
    Routine r = new Routine(name);
    r.addChildren(body, 0);
    return r;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ROUTINE;
  }

  public String getName() {
    return name;
  }

  public boolean isProgram() {
    return isProgram;
  }

  @Override
  protected Node shallowCopy() {
    return new Routine(name, isProgram);
  }

  @Override
  protected String describe() {
    return name;
  }
}
