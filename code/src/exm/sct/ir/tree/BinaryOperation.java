package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

public class BinaryOperation extends Node {

  public enum Operator {
    ADD,
    SUB,
    MUL,
    DIV,
    POW,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    AND,
    OR;

    public boolean isComparison() {
      switch (this) {
        case EQ:
        case NE:
        case LT:
        case LE:
        case GT:
        case GE:
          return true;
        default:
          return false;
      }
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }
  }

  private final Operator operator;

  public BinaryOperation(Operator operator) {
    Preconditions.checkNotNull(operator);
    this.operator = operator;
  }

  public static BinaryOperation create(Operator operator, Node lhs, Node rhs) {
    BinaryOperation op = new BinaryOperation(operator);
    op.addChild(lhs);
    op.addChild(rhs);
    return op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.BINARY_OPERATION;
  }

  public Operator getOperator() {
    return operator;
  }

  public Node getLhs() {
    return getChild(0);
  }

  public Node getRhs() {
    return getChild(1);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 2),
                        expectExpression(proposed, 0, "left operand"),
                        expectExpression(proposed, 1, "right operand"));
  }

  @Override
  protected int minChildren() {
    return 2;
  }

  @Override
  protected Node shallowCopy() {
    return new BinaryOperation(operator);
  }

  @Override
  protected String describe() {
    return operator.name();
  }
}
