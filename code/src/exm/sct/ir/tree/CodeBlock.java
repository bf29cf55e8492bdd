package exm.sct.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.sct.ir.symbols.Symbol;

/**
 * Source lines the IR doesn't model, passed through verbatim.  The
 * symbols the lines mention are recorded so that analysis can treat them
 * conservatively.
 */
public class CodeBlock extends Node {
  private final List<String> lines;
  private final List<Symbol> symbols;

  public CodeBlock(List<String> lines, List<? extends Symbol> symbols) {
    this.lines = Collections.unmodifiableList(new ArrayList<String>(lines));
    this.symbols = new ArrayList<Symbol>(symbols);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CODE_BLOCK;
  }

  public List<String> getLines() {
    return lines;
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.unmodifiableList(symbols);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    for (int i = 0; i < symbols.size(); i++) {
      Symbol replacement = renames.get(symbols.get(i));
      if (replacement != null) {
        symbols.set(i, replacement);
      }
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new CodeBlock(lines, symbols);
  }
}
