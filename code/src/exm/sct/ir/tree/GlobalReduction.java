package exm.sct.ir.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;

/**
 * Reduction of a scalar over all processes
 */
public class GlobalReduction extends Node {

  public enum ReductionOp {
    SUM,
    MIN,
    MAX;
  }

  private DataSymbol operand;
  private final ReductionOp op;

  public GlobalReduction(DataSymbol operand, ReductionOp op) {
    Preconditions.checkNotNull(operand);
    Preconditions.checkNotNull(op);
    this.operand = operand;
    this.op = op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.GLOBAL_REDUCTION;
  }

  public DataSymbol getOperand() {
    return operand;
  }

  public ReductionOp getOp() {
    return op;
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.<Symbol>singletonList(operand);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(operand)) {
      operand = (DataSymbol)renames.get(operand);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new GlobalReduction(operand, op);
  }

  @Override
  protected String describe() {
    return op + "(" + operand.getName() + ")";
  }
}
