package exm.sct.ir.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.RoutineSymbol;
import exm.sct.ir.symbols.Symbol;

/**
 * Call to a routine, with arguments as children
 */
public class Call extends Node {
  private RoutineSymbol routine;

  public Call(RoutineSymbol routine) {
    Preconditions.checkNotNull(routine);
    this.routine = routine;
  }

  public static Call create(RoutineSymbol routine, List<? extends Node> args) {
    Call call = new Call(routine);
    call.addChildren(args, 0);
    return call;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL;
  }

  public RoutineSymbol getRoutine() {
    return routine;
  }

  public List<Node> getArguments() {
    return getChildren();
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.<Symbol>singletonList(routine);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(routine)) {
      routine = (RoutineSymbol)renames.get(routine);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    for (int i = 0; i < proposed.size(); i++) {
      String problem = expectExpression(proposed, i, "argument " + i);
      if (problem != null) {
        return problem;
      }
    }
    return null;
  }

  @Override
  protected Node shallowCopy() {
    return new Call(routine);
  }

  @Override
  protected String describe() {
    return routine.getName();
  }
}
