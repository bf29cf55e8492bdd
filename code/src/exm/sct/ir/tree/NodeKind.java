package exm.sct.ir.tree;

import java.util.EnumSet;

/**
 * Closed set of IR node kinds.  Traversals filter on these tags, and
 * backends and analyses switch over them exhaustively.
 */
public enum NodeKind {
  CONTAINER,
  ROUTINE,
  SCHEDULE,

  ASSIGNMENT,
  LOOP,
  IF_BLOCK,
  CALL,
  RETURN,
  CODE_BLOCK,
  DIRECTIVE,
  EXTRACT_REGION,
  PROFILE_REGION,
  HALO_EXCHANGE,
  GLOBAL_REDUCTION,

  REFERENCE,
  ARRAY_REFERENCE,
  STRUCTURE_REFERENCE,
  MEMBER,
  LITERAL,
  UNARY_OPERATION,
  BINARY_OPERATION,
  INTRINSIC_CALL,
  RANGE;

  public static final EnumSet<NodeKind> SCOPES =
      EnumSet.of(CONTAINER, ROUTINE, SCHEDULE);

  public static final EnumSet<NodeKind> STATEMENTS =
      EnumSet.of(ASSIGNMENT, LOOP, IF_BLOCK, CALL, RETURN, CODE_BLOCK,
                 DIRECTIVE, EXTRACT_REGION, PROFILE_REGION, HALO_EXCHANGE,
                 GLOBAL_REDUCTION);

  /** Nodes whose children are a list of statements */
  public static final EnumSet<NodeKind> STATEMENT_LISTS =
      EnumSet.of(ROUTINE, SCHEDULE);

  public static final EnumSet<NodeKind> REFERENCES =
      EnumSet.of(REFERENCE, ARRAY_REFERENCE, STRUCTURE_REFERENCE);

  public static final EnumSet<NodeKind> EXPRESSIONS =
      EnumSet.of(REFERENCE, ARRAY_REFERENCE, STRUCTURE_REFERENCE, LITERAL,
                 UNARY_OPERATION, BINARY_OPERATION, INTRINSIC_CALL);

  /** Regions that wrap code for data capture or profiling */
  public static final EnumSet<NodeKind> DATA_REGIONS =
      EnumSet.of(EXTRACT_REGION, PROFILE_REGION);

  /** Cross-process communication constructs */
  public static final EnumSet<NodeKind> DISTRIBUTED_MEMORY =
      EnumSet.of(HALO_EXCHANGE, GLOBAL_REDUCTION);

  public boolean isScope() {
    return SCOPES.contains(this);
  }

  public boolean isStatement() {
    return STATEMENTS.contains(this);
  }

  public boolean isStatementList() {
    return STATEMENT_LISTS.contains(this);
  }

  public boolean isExpression() {
    return EXPRESSIONS.contains(this);
  }

  public boolean isReference() {
    return REFERENCES.contains(this);
  }

  /**
   * @return true if a node of this kind may appear as an array subscript
   */
  public boolean isSubscript() {
    return isExpression() || this == RANGE;
  }
}
