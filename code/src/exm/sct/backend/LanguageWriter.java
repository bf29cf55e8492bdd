/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sct.backend;

import exm.sct.common.exceptions.BackendException;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Renders IR as source text in some language.  Rendering is pure: the
 * tree is not changed, and the same tree always gives the same text.
 *
 * Statements are written one per line, indented two spaces per level of
 * nesting.  Expressions are written with the minimum of parentheses
 * needed to keep the structure of the tree.
 */
public abstract class LanguageWriter {

  protected static final String INDENT = "  ";

  /** Precedence of literals, references and calls */
  protected static final int ATOM_PRECEDENCE = 10;

  /**
   * @return text for a whole tree, a statement, or an expression
   * @throws BackendException if the tree contains something that can't be
   *          written in this language
   */
  public String render(Node node) throws BackendException {
    if (node.kind().isExpression() || node.kind() == NodeKind.RANGE) {
      return expression(node);
    }
    StringBuilder sb = new StringBuilder();
    write(node, sb, 0);
    return sb.toString();
  }

  public abstract String language();

  /**
   * Append text of a non-expression node
   */
  protected abstract void write(Node node, StringBuilder sb, int depth)
                                                  throws BackendException;

  /**
   * @return text of an expression
   */
  public String expression(Node expr) throws BackendException {
    return expression(expr, 0);
  }

  /**
   * @param minPrecedence parenthesise if the expression binds less
   *                      tightly than this
   */
  protected String expression(Node expr, int minPrecedence)
                                            throws BackendException {
    String text;
    int prec;
    switch (expr.kind()) {
      case BINARY_OPERATION:
        text = binaryOperation((BinaryOperation)expr);
        prec = precedence(((BinaryOperation)expr).getOperator());
        break;
      case UNARY_OPERATION:
        text = unaryOperation((UnaryOperation)expr);
        prec = precedence(((UnaryOperation)expr).getOperator());
        break;
      default:
        text = atom(expr);
        prec = ATOM_PRECEDENCE;
        break;
    }
    if (prec < minPrecedence) {
      return "(" + text + ")";
    }
    return text;
  }

  /**
   * Literals, references, calls and anything else without operators
   */
  protected abstract String atom(Node expr) throws BackendException;

  protected abstract String operatorSymbol(BinaryOperation.Operator op)
                                                  throws BackendException;

  protected abstract String operatorSymbol(UnaryOperation.Operator op)
                                                  throws BackendException;

  protected String binaryOperation(BinaryOperation op)
                                          throws BackendException {
    BinaryOperation.Operator o = op.getOperator();
    int prec = precedence(o);
    int lhsPrec;
    int rhsPrec;
    if (o == BinaryOperation.Operator.POW) {
      // Right associative
      lhsPrec = prec + 1;
      rhsPrec = prec;
    } else if (o.isComparison()) {
      lhsPrec = prec + 1;
      rhsPrec = prec + 1;
    } else {
      lhsPrec = prec;
      rhsPrec = prec + 1;
    }
    return expression(op.getLhs(), lhsPrec) + " " + operatorSymbol(o) + " " +
           expression(op.getRhs(), rhsPrec);
  }

  protected String unaryOperation(UnaryOperation op)
                                          throws BackendException {
    int prec = precedence(op.getOperator());
    // Operand of a sign binds at least as tightly as a power
    int operandPrec = op.getOperator() == UnaryOperation.Operator.NOT ?
                      prec : precedence(BinaryOperation.Operator.POW);
    return operatorSymbol(op.getOperator()) +
           expression(op.getOperand(), operandPrec);
  }

  protected static int precedence(BinaryOperation.Operator op) {
    switch (op) {
      case POW:
        return 9;
      case MUL:
      case DIV:
        return 7;
      case ADD:
      case SUB:
        return 6;
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return 5;
      case AND:
        return 3;
      case OR:
        return 2;
      default:
        throw new IllegalArgumentException("Unknown operator " + op);
    }
  }

  protected static int precedence(UnaryOperation.Operator op) {
    switch (op) {
      case MINUS:
      case PLUS:
        return 8;
      case NOT:
        return 4;
      default:
        throw new IllegalArgumentException("Unknown operator " + op);
    }
  }

  protected static void indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  protected static void line(StringBuilder sb, int depth, String text) {
    indent(sb, depth);
    sb.append(text);
    sb.append("\n");
  }
}
