package exm.sct.ir.trans;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.sct.ir.symbols.Types;
import exm.sct.ir.tree.ArrayReference;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Runs assignments, if blocks and counted loops over numeric scalars and
 * arrays, so that tests can check transformed code computes what the
 * original did.  Only MIN and MAX are evaluated among the intrinsics.
 * Writes to array elements are recorded in order.
 */
public class StatementInterpreter {

  private final Map<String, Double> scalars = new HashMap<String, Double>();
  private final Map<String, Double> elements = new HashMap<String, Double>();
  private final List<String> writes = new ArrayList<String>();

  public StatementInterpreter set(String name, double value) {
    scalars.put(name.toLowerCase(), value);
    return this;
  }

  public StatementInterpreter setElement(String name, double value,
                                         int... indices) {
    elements.put(elementKey(name, toList(indices)), value);
    return this;
  }

  public double get(String name) {
    Double value = scalars.get(name.toLowerCase());
    if (value == null) {
      throw new AssertionError("'" + name + "' has no value");
    }
    return value;
  }

  /**
   * @return array elements written, e.g. "a(3, 1)", in order of execution
   */
  public List<String> getWrites() {
    return writes;
  }

  public void run(Node node) {
    switch (node.kind()) {
      case ROUTINE:
      case SCHEDULE:
        for (Node stmt: node.getChildren()) {
          run(stmt);
        }
        break;
      case ASSIGNMENT:
        assign((Assignment)node);
        break;
      case IF_BLOCK:
        IfBlock ifBlock = (IfBlock)node;
        if (eval(ifBlock.getCondition()) != 0.0) {
          run(ifBlock.getIfBody());
        } else if (ifBlock.getElseBody() != null) {
          run(ifBlock.getElseBody());
        }
        break;
      case LOOP:
        loop((Loop)node);
        break;
      default:
        throw new AssertionError("Cannot run " + node);
    }
  }

  private void assign(Assignment a) {
    double value = eval(a.getRhs());
    Reference lhs = a.getLhs();
    if (lhs.kind() == NodeKind.ARRAY_REFERENCE) {
      String key = elementKey(lhs.getName(), indices((ArrayReference)lhs));
      elements.put(key, value);
      writes.add(key);
    } else if (lhs.kind() == NodeKind.REFERENCE) {
      scalars.put(lhs.getName().toLowerCase(), value);
    } else {
      throw new AssertionError("Cannot assign to " + lhs);
    }
  }

  /**
   * Bounds and step are evaluated once, before the first iteration
   */
  private void loop(Loop loop) {
    double start = eval(loop.getStartExpr());
    double stop = eval(loop.getStopExpr());
    double step = eval(loop.getStepExpr());
    long count = (long)Math.floor((stop - start + step) / step);
    String var = loop.getVariable().getName().toLowerCase();
    for (long k = 0; k < count; k++) {
      scalars.put(var, start + k * step);
      run(loop.getLoopBody());
    }
    if (count > 0) {
      scalars.put(var, start + count * step);
    }
  }

  public double eval(Node expr) {
    switch (expr.kind()) {
      case LITERAL:
        Literal lit = (Literal)expr;
        if (lit.getType().intrinsic() == Types.Intrinsic.BOOLEAN) {
          return lit.getValue().equals("true") ? 1.0 : 0.0;
        }
        return Double.parseDouble(lit.getValue());
      case REFERENCE:
        return get(((Reference)expr).getName());
      case ARRAY_REFERENCE:
        ArrayReference ref = (ArrayReference)expr;
        String key = elementKey(ref.getName(), indices(ref));
        Double value = elements.get(key);
        if (value == null) {
          throw new AssertionError(key + " has no value");
        }
        return value;
      case UNARY_OPERATION:
        return unary((UnaryOperation)expr);
      case BINARY_OPERATION:
        return binary((BinaryOperation)expr);
      case INTRINSIC_CALL:
        return intrinsic((IntrinsicCall)expr);
      default:
        throw new AssertionError("Cannot evaluate " + expr);
    }
  }

  private double unary(UnaryOperation op) {
    double x = eval(op.getOperand());
    switch (op.getOperator()) {
      case MINUS:
        return -x;
      case PLUS:
        return x;
      case NOT:
        return x == 0.0 ? 1.0 : 0.0;
      default:
        throw new AssertionError("Unknown operator " + op);
    }
  }

  private double binary(BinaryOperation op) {
    double a = eval(op.getLhs());
    double b = eval(op.getRhs());
    switch (op.getOperator()) {
      case ADD: return a + b;
      case SUB: return a - b;
      case MUL: return a * b;
      case DIV: return a / b;
      case POW: return Math.pow(a, b);
      case EQ: return truth(a == b);
      case NE: return truth(a != b);
      case LT: return truth(a < b);
      case LE: return truth(a <= b);
      case GT: return truth(a > b);
      case GE: return truth(a >= b);
      case AND: return truth(a != 0.0 && b != 0.0);
      case OR: return truth(a != 0.0 || b != 0.0);
      default:
        throw new AssertionError("Unknown operator " + op);
    }
  }

  private double intrinsic(IntrinsicCall call) {
    List<Node> args = call.getArguments();
    switch (call.getIntrinsic()) {
      case MIN: {
        double result = eval(args.get(0));
        for (Node arg: args.subList(1, args.size())) {
          result = Math.min(result, eval(arg));
        }
        return result;
      }
      case MAX: {
        double result = eval(args.get(0));
        for (Node arg: args.subList(1, args.size())) {
          result = Math.max(result, eval(arg));
        }
        return result;
      }
      default:
        throw new AssertionError("Intrinsic should have been lowered: " +
                                 call);
    }
  }

  private List<Integer> indices(ArrayReference ref) {
    List<Integer> result = new ArrayList<Integer>();
    for (Node index: ref.getIndices()) {
      result.add((int)eval(index));
    }
    return result;
  }

  private static double truth(boolean b) {
    return b ? 1.0 : 0.0;
  }

  private static List<Integer> toList(int... values) {
    List<Integer> result = new ArrayList<Integer>();
    for (int v: values) {
      result.add(v);
    }
    return result;
  }

  private static String elementKey(String name, List<Integer> indices) {
    String list = Arrays.toString(indices.toArray());
    return name.toLowerCase() + "(" + list.substring(1, list.length() - 1) +
           ")";
  }
}
