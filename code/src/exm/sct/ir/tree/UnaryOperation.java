package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

public class UnaryOperation extends Node {

  public enum Operator {
    MINUS,
    PLUS,
    NOT;
  }

  private final Operator operator;

  public UnaryOperation(Operator operator) {
    Preconditions.checkNotNull(operator);
    this.operator = operator;
  }

  public static UnaryOperation create(Operator operator, Node operand) {
    UnaryOperation op = new UnaryOperation(operator);
    op.addChild(operand);
    return op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.UNARY_OPERATION;
  }

  public Operator getOperator() {
    return operator;
  }

  public Node getOperand() {
    return getChild(0);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 1),
                        expectExpression(proposed, 0, "operand"));
  }

  @Override
  protected int minChildren() {
    return 1;
  }

  @Override
  protected Node shallowCopy() {
    return new UnaryOperation(operator);
  }

  @Override
  protected String describe() {
    return operator.name();
  }
}
