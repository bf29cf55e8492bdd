package exm.sct.ir.tree;

import java.util.List;

import exm.sct.ir.symbols.Symbol;

/**
 * Access to a member of a derived-type variable: a%b%c(i)
 */
public class StructureReference extends Reference {

  public StructureReference(Symbol symbol) {
    super(symbol);
  }

  public static StructureReference create(Symbol symbol, Member member) {
    StructureReference ref = new StructureReference(symbol);
    ref.addChild(member);
    return ref;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.STRUCTURE_REFERENCE;
  }

  public Member getMember() {
    return (Member)getChild(0);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 1),
                        expectKind(proposed, 0, NodeKind.MEMBER, "member"));
  }

  @Override
  protected int minChildren() {
    return 1;
  }

  @Override
  protected Node shallowCopy() {
    return new StructureReference(getSymbol());
  }
}
