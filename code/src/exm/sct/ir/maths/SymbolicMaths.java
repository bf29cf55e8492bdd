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
package exm.sct.ir.maths;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;

import com.google.common.base.Preconditions;

import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Member;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.StructureReference;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Symbolic comparison of IR expressions.
 *
 * Both expressions are converted to polynomials with exact rational
 * coefficients.  Variables, array elements and structure components are
 * transparent atoms named by their access path with normalised subscripts,
 * so a%b(2*i) and a%b(3*i-i) are the same atom.  Anything else (intrinsic
 * calls, comparisons, division by non-constants) becomes an opaque atom
 * named by its normalised text.
 *
 * Two expressions whose difference differs from zero only in transparent
 * atoms are NOT_EQUAL; if an opaque atom is involved the answer is
 * UNKNOWN.  Intrinsic calls are not interpreted, so max(1,2,3) and
 * max(3,2,1) compare as UNKNOWN.
 */
public class SymbolicMaths {

  public enum Equality {
    EQUAL,
    NOT_EQUAL,
    UNKNOWN;
  }

  /** Don't expand powers above this */
  private static final int MAX_EXPANDED_POWER = 16;

  private SymbolicMaths() {
    // Static methods only
  }

  /**
   * Compare two expressions.
   * @throws IllegalArgumentException if either is not an expression
   */
  public static Equality equal(Node a, Node b) {
    Converter conv = new Converter();
    Polynomial diff;
    try {
      diff = conv.convert(a).minus(conv.convert(b));
    } catch (ArithmeticException e) {
      // Coefficient overflow
      return Equality.UNKNOWN;
    }
    if (diff.isZero()) {
      return Equality.EQUAL;
    }
    return conv.isTransparent(diff) ? Equality.NOT_EQUAL : Equality.UNKNOWN;
  }

  /**
   * @return the value of an expression that simplifies to an integer
   *         constant, otherwise null
   */
  public static Integer integerValue(Node expr) {
    try {
      Polynomial p = new Converter().convert(expr);
      if (p.isConstant()) {
        Fraction f = p.constantValue();
        if (f.getDenominator() == 1) {
          return f.getNumerator();
        }
      }
    } catch (ArithmeticException e) {
      // Too large to represent
      return null;
    }
    return null;
  }

  /**
   * @return canonical text of an expression: expressions that are EQUAL
   *         have the same canonical text
   * @throws ArithmeticException if a coefficient overflows
   */
  public static String canonical(Node expr) {
    return new Converter().convert(expr).toString();
  }

  private static class Converter {
    /** Transparency of each atom met so far */
    private final Map<String, Boolean> atoms = new HashMap<String, Boolean>();

    boolean isTransparent(Polynomial p) {
      for (String atom: p.atoms()) {
        if (!atoms.get(atom)) {
          return false;
        }
      }
      return true;
    }

    private Polynomial atom(String key, boolean transparent) {
      Boolean prev = atoms.get(key);
      atoms.put(key, transparent && (prev == null || prev));
      return Polynomial.atom(key);
    }

    Polynomial convert(Node expr) {
      switch (expr.kind()) {
        case LITERAL:
          return convertLiteral((Literal)expr);
        case REFERENCE:
        case ARRAY_REFERENCE:
        case STRUCTURE_REFERENCE:
          return convertReference((Reference)expr);
        case UNARY_OPERATION:
          return convertUnary((UnaryOperation)expr);
        case BINARY_OPERATION:
          return convertBinary((BinaryOperation)expr);
        case INTRINSIC_CALL: {
          IntrinsicCall call = (IntrinsicCall)expr;
          return opaque(call.getIntrinsic().name().toLowerCase(),
                        call.getArguments());
        }
        case RANGE:
          return opaque("range", expr.getChildren());
        default:
          throw new IllegalArgumentException("Not an expression: " + expr);
      }
    }

    private Polynomial convertLiteral(Literal lit) {
      switch (lit.getType().intrinsic()) {
        case INTEGER:
          try {
            return Polynomial.constant(Fraction.getFraction(
                              Integer.parseInt(lit.getValue()), 1));
          } catch (NumberFormatException e) {
            // Too large for an int
            return atom(lit.getValue(), false);
          }
        case REAL:
          return Polynomial.constant(Fraction.getFraction(
                            Double.parseDouble(lit.getValue())));
        default:
          return atom("'" + lit.getValue() + "'", false);
      }
    }

    private Polynomial convertReference(Reference ref) {
      StringBuilder key = new StringBuilder(ref.getName().toLowerCase());
      boolean transparent = true;
      if (ref.kind() == NodeKind.ARRAY_REFERENCE) {
        transparent = appendSubscripts(key, ref.getChildren());
      } else if (ref.kind() == NodeKind.STRUCTURE_REFERENCE) {
        Member m = ((StructureReference)ref).getMember();
        while (m != null) {
          key.append("%");
          key.append(m.getName().toLowerCase());
          List<Node> indices = m.getIndices();
          if (!indices.isEmpty()) {
            transparent = appendSubscripts(key, indices) && transparent;
          }
          m = m.getNext();
        }
      }
      return atom(key.toString(), transparent);
    }

    /**
     * @return true if all subscripts are transparent
     */
    private boolean appendSubscripts(StringBuilder key, List<Node> indices) {
      boolean transparent = true;
      List<String> canon = new ArrayList<String>();
      for (Node index: indices) {
        Polynomial p = convert(index);
        transparent = transparent && isTransparent(p);
        canon.add(p.toString());
      }
      key.append("(");
      key.append(StringUtils.join(canon, ", "));
      key.append(")");
      return transparent;
    }

    private Polynomial convertUnary(UnaryOperation op) {
      switch (op.getOperator()) {
        case MINUS:
          return convert(op.getOperand()).negate();
        case PLUS:
          return convert(op.getOperand());
        default:
          return opaque(op.getOperator().name().toLowerCase(),
                        op.getChildren());
      }
    }

    private Polynomial convertBinary(BinaryOperation op) {
      switch (op.getOperator()) {
        case ADD:
          return convert(op.getLhs()).plus(convert(op.getRhs()));
        case SUB:
          return convert(op.getLhs()).minus(convert(op.getRhs()));
        case MUL:
          return convert(op.getLhs()).times(convert(op.getRhs()));
        case DIV:
          return convertDivision(op);
        case POW:
          return convertPower(op);
        default:
          return opaque(op.getOperator().name().toLowerCase(),
                        op.getChildren());
      }
    }

    /**
     * Only constants that divide exactly are evaluated: integer division
     * truncates.
     */
    private Polynomial convertDivision(BinaryOperation op) {
      Polynomial num = convert(op.getLhs());
      Polynomial den = convert(op.getRhs());
      if (num.isConstant() && den.isConstant() &&
          den.constantValue().getNumerator() != 0) {
        Fraction q = num.constantValue().divideBy(den.constantValue());
        if (q.getDenominator() == 1) {
          return Polynomial.constant(q);
        }
      }
      return opaque("div", op.getChildren());
    }

    private Polynomial convertPower(BinaryOperation op) {
      Polynomial base = convert(op.getLhs());
      Polynomial exp = convert(op.getRhs());
      if (exp.isConstant()) {
        Fraction e = exp.constantValue();
        if (e.getDenominator() == 1 && e.getNumerator() >= 0 &&
            e.getNumerator() <= MAX_EXPANDED_POWER) {
          Polynomial result = Polynomial.constant(Fraction.ONE);
          for (int i = 0; i < e.getNumerator(); i++) {
            result = result.times(base);
          }
          return result;
        }
      }
      return opaque("pow", op.getChildren());
    }

    /**
     * Atom named after an operation and the canonical form of its operands
     */
    private Polynomial opaque(String name, List<Node> operands) {
      Preconditions.checkNotNull(name);
      List<String> canon = new ArrayList<String>();
      for (Node operand: operands) {
        canon.add(convert(operand).toString());
      }
      // Prefix keeps opaque atoms apart from array element names
      return atom("@" + name + "(" + StringUtils.join(canon, ", ") + ")",
                  false);
    }
  }
}
