package exm.sct.ir.tree;

import java.util.List;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ScalarType;

/**
 * Constant of scalar type.  The value is kept as text: integer and real
 * literals are unsigned (negative constants are a unary minus of a literal),
 * booleans are "true" or "false".
 */
public class Literal extends Node {
  private final String value;
  private final ScalarType type;

  public Literal(String value, ScalarType type) {
    Preconditions.checkNotNull(value);
    Preconditions.checkNotNull(type);
    checkValue(value, type);
    this.value = value;
    this.type = type;
  }

  private static void checkValue(String value, ScalarType type) {
    switch (type.intrinsic()) {
      case INTEGER:
        Preconditions.checkArgument(value.matches("[0-9]+"),
            "Invalid integer literal: '" + value + "'");
        break;
      case REAL:
        Preconditions.checkArgument(
            value.matches("[0-9]+(\\.[0-9]*)?([eE][+-]?[0-9]+)?"),
            "Invalid real literal: '" + value + "'");
        break;
      case BOOLEAN:
        Preconditions.checkArgument(value.equals("true") ||
            value.equals("false"), "Invalid boolean literal: '" + value + "'");
        break;
      case CHARACTER:
        break;
      default:
        throw new IllegalArgumentException("Unknown intrinsic " + type);
    }
  }

  public static Literal integer(int value) {
    Preconditions.checkArgument(value >= 0, "Literal must not be negative");
    return new Literal(Integer.toString(value), Types.INTEGER_TYPE);
  }

  /**
   * @return literal, or unary minus of a literal for negative values
   */
  public static Node signedInteger(int value) {
    if (value >= 0) {
      return integer(value);
    }
    return UnaryOperation.create(UnaryOperation.Operator.MINUS,
                                 integer(-value));
  }

  /**
   * Zero of the given type, e.g. to initialise an accumulator
   */
  public static Literal zero(ScalarType type) {
    if (type.isReal()) {
      return new Literal("0.0", type);
    }
    return new Literal("0", type);
  }

  /**
   * @return the integer value of an integer literal, or of a unary minus
   *         applied to one, otherwise null
   */
  public static Integer integerValue(Node expr) {
    if (expr.kind() == NodeKind.LITERAL) {
      Literal lit = (Literal)expr;
      if (lit.type.isInteger()) {
        try {
          return Integer.valueOf(lit.value);
        } catch (NumberFormatException e) {
          // Doesn't fit
          return null;
        }
      }
    } else if (expr.kind() == NodeKind.UNARY_OPERATION) {
      UnaryOperation op = (UnaryOperation)expr;
      if (op.getOperator() == UnaryOperation.Operator.MINUS) {
        Integer inner = integerValue(op.getOperand());
        return inner == null ? null : Integer.valueOf(-inner);
      } else if (op.getOperator() == UnaryOperation.Operator.PLUS) {
        return integerValue(op.getOperand());
      }
    }
    return null;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.LITERAL;
  }

  public String getValue() {
    return value;
  }

  public ScalarType getType() {
    return type;
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return expectMax(proposed, 0);
  }

  @Override
  protected Node shallowCopy() {
    return new Literal(value, type);
  }

  @Override
  protected String describe() {
    return value + ", " + type;
  }
}
