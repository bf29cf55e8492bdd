package exm.sct.ir.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;

/**
 * Update of the halo of a distributed field from neighbouring processes
 */
public class HaloExchange extends Node {
  private DataSymbol field;
  private final int depth;

  public HaloExchange(DataSymbol field, int depth) {
    Preconditions.checkNotNull(field);
    Preconditions.checkArgument(depth > 0, "Halo depth must be positive");
    this.field = field;
    this.depth = depth;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.HALO_EXCHANGE;
  }

  public DataSymbol getField() {
    return field;
  }

  public int getDepth() {
    return depth;
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.<Symbol>singletonList(field);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(field)) {
      field = (DataSymbol)renames.get(field);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new HaloExchange(field, depth);
  }

  @Override
  protected String describe() {
    return field.getName() + ", depth=" + depth;
  }
}
