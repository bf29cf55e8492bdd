package exm.sct.ir.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.Symbol;

/**
 * Use of a symbol by identity.  Subclasses add subscripts or member
 * accesses as children.
 */
public class Reference extends Node {
  private Symbol symbol;

  public Reference(Symbol symbol) {
    Preconditions.checkNotNull(symbol);
    this.symbol = symbol;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.REFERENCE;
  }

  public Symbol getSymbol() {
    return symbol;
  }

  public void setSymbol(Symbol symbol) {
    Preconditions.checkNotNull(symbol);
    this.symbol = symbol;
  }

  public String getName() {
    return symbol.getName();
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.singletonList(symbol);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(symbol)) {
      symbol = renames.get(symbol);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new Reference(symbol);
  }

  @Override
  protected String describe() {
    return symbol.getName();
  }
}
