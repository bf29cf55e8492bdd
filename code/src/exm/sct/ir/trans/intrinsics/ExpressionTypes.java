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
package exm.sct.ir.trans.intrinsics;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Best-effort scalar type of expressions, for declaring temporaries
 */
class ExpressionTypes {

  /**
   * @return scalar type of the expression value, or null if not known
   */
  static ScalarType typeOf(Node expr) {
    switch (expr.kind()) {
      case LITERAL:
        return ((Literal)expr).getType();
      case REFERENCE:
      case ARRAY_REFERENCE: {
        Symbol sym = ((Reference)expr).getSymbol();
        if (sym instanceof DataSymbol) {
          return Types.scalarOf(((DataSymbol)sym).getDatatype());
        }
        return null;
      }
      case UNARY_OPERATION: {
        UnaryOperation op = (UnaryOperation)expr;
        if (op.getOperator() == UnaryOperation.Operator.NOT) {
          return Types.BOOLEAN_TYPE;
        }
        return typeOf(op.getOperand());
      }
      case BINARY_OPERATION: {
        BinaryOperation op = (BinaryOperation)expr;
        if (op.getOperator().isComparison() || op.getOperator().isLogical()) {
          return Types.BOOLEAN_TYPE;
        }
        ScalarType lhs = typeOf(op.getLhs());
        ScalarType rhs = typeOf(op.getRhs());
        if (lhs != null && rhs != null && lhs.isInteger() && rhs.isReal()) {
          return rhs;
        }
        return lhs != null ? lhs : rhs;
      }
      case INTRINSIC_CALL:
        return intrinsicType((IntrinsicCall)expr);
      default:
        // Structure components have no declared type here
        return null;
    }
  }

  private static ScalarType intrinsicType(IntrinsicCall call) {
    switch (call.getIntrinsic()) {
      case LBOUND:
      case UBOUND:
      case SIZE:
      case INT:
        return Types.INTEGER_TYPE;
      case REAL:
        return Types.REAL_TYPE;
      default:
        return typeOf(call.getChild(0));
    }
  }

  /**
   * @return type of result of intrinsic: that of its first argument if
   *         known, otherwise real
   */
  static ScalarType resultType(IntrinsicCall call) {
    ScalarType t = typeOf(call.getChild(0));
    return t == null ? Types.REAL_TYPE : t;
  }

  static Literal one(ScalarType type) {
    if (type.isReal()) {
      return new Literal("1.0", type);
    }
    return new Literal("1", type);
  }

  static boolean isArrayValued(Node expr) {
    if (expr.kind() == NodeKind.REFERENCE) {
      Symbol sym = ((Reference)expr).getSymbol();
      return sym instanceof DataSymbol && ((DataSymbol)sym).isArray();
    }
    return false;
  }
}
