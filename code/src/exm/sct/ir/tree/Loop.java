package exm.sct.ir.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;

/**
 * Counted loop: do var = start, stop, step
 */
public class Loop extends Node {
  /** Annotation added by loop blocking */
  public static final String BLOCKED = "blocked";

  private DataSymbol variable;

  public Loop(DataSymbol variable) {
    Preconditions.checkNotNull(variable);
    this.variable = variable;
  }

  public static Loop create(DataSymbol variable, Node start, Node stop,
                            Node step, List<? extends Node> body) {
    Loop loop = new Loop(variable);
    loop.addChild(start);
    loop.addChild(stop);
    loop.addChild(step);
    loop.addChild(new Schedule(body));
    return loop;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.LOOP;
  }

  public DataSymbol getVariable() {
    return variable;
  }

  public void setVariable(DataSymbol variable) {
    Preconditions.checkNotNull(variable);
    this.variable = variable;
  }

  public Node getStartExpr() {
    return getChild(0);
  }

  public Node getStopExpr() {
    return getChild(1);
  }

  public Node getStepExpr() {
    return getChild(2);
  }

  public Schedule getLoopBody() {
    return (Schedule)getChild(3);
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.<Symbol>singletonList(variable);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(variable)) {
      variable = (DataSymbol)renames.get(variable);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 4),
                        expectExpression(proposed, 0, "start"),
                        expectExpression(proposed, 1, "stop"),
                        expectExpression(proposed, 2, "step"),
                        expectKind(proposed, 3, NodeKind.SCHEDULE, "body"));
  }

  @Override
  protected int minChildren() {
    return 4;
  }

  @Override
  protected Node shallowCopy() {
    return new Loop(variable);
  }

  @Override
  protected String describe() {
    return variable.getName();
  }
}
