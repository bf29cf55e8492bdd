package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Call to a language intrinsic function
 */
public class IntrinsicCall extends Node {

  /** Max args for variadic intrinsics */
  private static final int UNBOUNDED = Integer.MAX_VALUE;

  public enum Intrinsic {
    ABS(1, 1),
    SIGN(2, 2),
    MIN(2, UNBOUNDED),
    MAX(2, UNBOUNDED),
    SUM(1, 3),
    LBOUND(2, 2),
    UBOUND(2, 2),
    SIZE(1, 2),
    MOD(2, 2),
    SQRT(1, 1),
    EXP(1, 1),
    REAL(1, 1),
    INT(1, 1);

    public final int minArgs;
    public final int maxArgs;

    private Intrinsic(int minArgs, int maxArgs) {
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
    }

    /**
     * @return intrinsic with name, case-insensitive, or null
     */
    public static Intrinsic fromName(String name) {
      for (Intrinsic i: values()) {
        if (i.name().equalsIgnoreCase(name)) {
          return i;
        }
      }
      return null;
    }
  }

  private final Intrinsic intrinsic;

  public IntrinsicCall(Intrinsic intrinsic) {
    Preconditions.checkNotNull(intrinsic);
    this.intrinsic = intrinsic;
  }

  public static IntrinsicCall create(Intrinsic intrinsic,
                                     List<? extends Node> args) {
    IntrinsicCall call = new IntrinsicCall(intrinsic);
    call.addChildren(args, 0);
    return call;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.INTRINSIC_CALL;
  }

  public Intrinsic getIntrinsic() {
    return intrinsic;
  }

  public List<Node> getArguments() {
    return getChildren();
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    if (proposed.size() > intrinsic.maxArgs) {
      return intrinsic + " takes at most " + intrinsic.maxArgs +
             " arguments but has " + proposed.size();
    }
    for (int i = 0; i < proposed.size(); i++) {
      String problem = expectExpression(proposed, i, "argument " + i);
      if (problem != null) {
        return problem;
      }
    }
    return null;
  }

  @Override
  protected int minChildren() {
    return intrinsic.minArgs;
  }

  @Override
  protected Node shallowCopy() {
    return new IntrinsicCall(intrinsic);
  }

  @Override
  protected String describe() {
    return intrinsic.name();
  }
}
