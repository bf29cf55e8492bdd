package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Directive such as an OpenMP or OpenACC region around a schedule.
 * The directive text is opaque.
 */
public class Directive extends Node {
  private final String beginText;
  /** null if the directive has no closing line */
  private final String endText;

  public Directive(String beginText, String endText) {
    Preconditions.checkNotNull(beginText);
    this.beginText = beginText;
    this.endText = endText;
  }

  public static Directive create(String beginText, String endText,
                                 List<? extends Node> body) {
    Directive d = new Directive(beginText, endText);
    d.addChild(new Schedule(body));
    return d;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DIRECTIVE;
  }

  public String getBeginText() {
    return beginText;
  }

  public String getEndText() {
    return endText;
  }

  public Schedule getBody() {
    return (Schedule)getChild(0);
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 1),
                        expectKind(proposed, 0, NodeKind.SCHEDULE, "body"));
  }

  @Override
  protected int minChildren() {
    return 1;
  }

  @Override
  protected Node shallowCopy() {
    return new Directive(beginText, endText);
  }

  @Override
  protected String describe() {
    return beginText;
  }
}
