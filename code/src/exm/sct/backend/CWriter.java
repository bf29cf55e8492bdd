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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.sct.common.exceptions.BackendException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.Extent;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.tree.ArrayReference;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.Directive;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.Routine;
import exm.sct.ir.tree.UnaryOperation;

/**
 * C writer for routines and the statements and expressions inside them.
 * Array subscripts are written in reverse order, so that the fastest
 * varying index comes last as C expects; index values are unchanged.
 *
 * Constructs with no direct C form fail with a BackendException:
 * modules, whole-array intrinsics such as SUM, structure accesses,
 * array ranges, code blocks and PSyData regions.
 */
public class CWriter extends LanguageWriter {

  @Override
  public String language() {
    return "c";
  }

  @Override
  protected void write(Node node, StringBuilder sb, int depth)
                                            throws BackendException {
    switch (node.kind()) {
      case ROUTINE:
        writeRoutine((Routine)node, sb, depth);
        break;
      case SCHEDULE:
        writeStatements(node.getChildren(), sb, depth);
        break;
      case ASSIGNMENT: {
        Assignment a = (Assignment)node;
        line(sb, depth, expression(a.getLhs()) + " = " +
                        expression(a.getRhs()) + ";");
        break;
      }
      case LOOP:
        writeLoop((Loop)node, sb, depth);
        break;
      case IF_BLOCK: {
        IfBlock ifBlock = (IfBlock)node;
        line(sb, depth, "if (" + expression(ifBlock.getCondition()) + ") {");
        writeStatements(ifBlock.getIfBody().getChildren(), sb, depth + 1);
        if (ifBlock.getElseBody() != null) {
          line(sb, depth, "} else {");
          writeStatements(ifBlock.getElseBody().getChildren(), sb, depth + 1);
        }
        line(sb, depth, "}");
        break;
      }
      case CALL: {
        Call call = (Call)node;
        line(sb, depth, call.getRoutine().getName() + "(" +
                        expressionList(call.getArguments()) + ");");
        break;
      }
      case RETURN:
        line(sb, depth, "return;");
        break;
      case DIRECTIVE: {
        Directive d = (Directive)node;
        line(sb, depth, "#pragma " + d.getBeginText());
        line(sb, depth, "{");
        writeStatements(d.getBody().getChildren(), sb, depth + 1);
        line(sb, depth, "}");
        break;
      }
      case CONTAINER:
        throw new BackendException("Modules cannot be written in C: " +
                                   node);
      case CODE_BLOCK:
        throw new BackendException("Code blocks cannot be written in C: " +
                                   "they hold Fortran source");
      case EXTRACT_REGION:
      case PROFILE_REGION:
        throw new BackendException("PSyData regions are not supported " +
                                   "by the C writer: " + node);
      case HALO_EXCHANGE:
      case GLOBAL_REDUCTION:
        throw new BackendException("Distributed memory constructs are not " +
                                   "supported by the C writer: " + node);
      default:
        throw new SCTRuntimeError("Unexpected node kind " + node.kind());
    }
  }

  private void writeStatements(List<Node> stmts, StringBuilder sb, int depth)
                                                throws BackendException {
    for (Node stmt: stmts) {
      write(stmt, sb, depth);
    }
  }

  private void writeRoutine(Routine r, StringBuilder sb, int depth)
                                                throws BackendException {
    List<String> params = new ArrayList<String>();
    for (DataSymbol arg: r.getSymbolTable().getArgumentList()) {
      params.add(declarator(arg));
    }
    line(sb, depth, "void " + r.getName() + "(" +
                    StringUtils.join(params, ", ") + ")");
    line(sb, depth, "{");
    List<DataSymbol> locals = new ArrayList<DataSymbol>();
    addLocals(r, locals);
    for (Node n: r.walk(NodeKind.SCHEDULE)) {
      if (n != r) {
        addLocals(n, locals);
      }
    }
    for (DataSymbol local: locals) {
      String decl = declarator(local);
      if (local.isConstant()) {
        decl = "const " + decl + " = " + expression(local.getConstantValue());
      }
      line(sb, depth + 1, decl + ";");
    }
    writeStatements(r.getChildren(), sb, depth + 1);
    line(sb, depth, "}");
  }

  private static void addLocals(Node scope, List<DataSymbol> locals) {
    for (Symbol s: scope.getSymbolTable().getSymbols()) {
      if (s instanceof DataSymbol && !s.isArgument() && !s.isImported()) {
        locals.add((DataSymbol)s);
      }
    }
  }

  private String declarator(DataSymbol s) throws BackendException {
    Type t = s.getDatatype();
    ScalarType scalar = Types.scalarOf(t);
    if (scalar == null) {
      throw new BackendException("Type of '" + s.getName() +
                                 "' has no C form: " + t);
    }
    StringBuilder decl = new StringBuilder();
    decl.append(cType(s, scalar));
    decl.append(" ");
    decl.append(s.getName());
    if (t instanceof ArrayType) {
      List<Extent> shape = ((ArrayType)t).shape();
      for (int i = shape.size() - 1; i >= 0; i--) {
        Extent e = shape.get(i);
        decl.append("[");
        if (e.isLiteral()) {
          decl.append(e.literal());
        } else if (e.isSymbol()) {
          decl.append(e.symbol().getName());
        } else {
          throw new BackendException("Array '" + s.getName() +
              "' has an extent not known at declaration, which C can't " +
              "declare");
        }
        decl.append("]");
      }
    }
    return decl.toString();
  }

  private static String cType(DataSymbol s, ScalarType t)
                                        throws BackendException {
    switch (t.intrinsic()) {
      case INTEGER:
      case BOOLEAN:
        return "int";
      case REAL:
        return t.precision() == 4 ? "float" : "double";
      default:
        throw new BackendException("Type of '" + s.getName() +
                                   "' has no C form: " + t);
    }
  }

  private void writeLoop(Loop loop, StringBuilder sb, int depth)
                                            throws BackendException {
    String var = loop.getVariable().getName();
    Integer step = Literal.integerValue(loop.getStepExpr());
    String cmp = step != null && step < 0 ? " >= " : " <= ";
    line(sb, depth, "for (" + var + " = " + expression(loop.getStartExpr()) +
        "; " + var + cmp + expression(loop.getStopExpr()) + "; " + var +
        " += " + expression(loop.getStepExpr()) + ") {");
    writeStatements(loop.getLoopBody().getChildren(), sb, depth + 1);
    line(sb, depth, "}");
  }

  @Override
  protected String atom(Node expr) throws BackendException {
    switch (expr.kind()) {
      case LITERAL: {
        Literal lit = (Literal)expr;
        switch (lit.getType().intrinsic()) {
          case BOOLEAN:
            return lit.getValue().equals("true") ? "1" : "0";
          case CHARACTER:
            return "\"" + lit.getValue().replace("\"", "\\\"") + "\"";
          default:
            return lit.getValue();
        }
      }
      case REFERENCE:
        return ((Reference)expr).getName();
      case ARRAY_REFERENCE: {
        ArrayReference ref = (ArrayReference)expr;
        StringBuilder sb = new StringBuilder(ref.getName());
        List<Node> indices = ref.getIndices();
        for (int i = indices.size() - 1; i >= 0; i--) {
          if (indices.get(i).kind() == NodeKind.RANGE) {
            throw new BackendException("Array ranges cannot be written in " +
                                       "C: " + ref);
          }
          sb.append("[");
          sb.append(expression(indices.get(i)));
          sb.append("]");
        }
        return sb.toString();
      }
      case STRUCTURE_REFERENCE:
        throw new BackendException("Structure accesses are not supported " +
                                   "by the C writer: " + expr);
      case INTRINSIC_CALL:
        return intrinsicCall((IntrinsicCall)expr);
      case RANGE:
        throw new BackendException("Array ranges cannot be written in C");
      default:
        throw new SCTRuntimeError("Not an expression: " + expr);
    }
  }

  private String intrinsicCall(IntrinsicCall call) throws BackendException {
    List<Node> args = call.getArguments();
    switch (call.getIntrinsic()) {
      case ABS:
        return "fabs(" + expressionList(args) + ")";
      case SIGN:
        return "copysign(" + expressionList(args) + ")";
      case MIN:
        return nested("fmin", args);
      case MAX:
        return nested("fmax", args);
      case SQRT:
        return "sqrt(" + expressionList(args) + ")";
      case EXP:
        return "exp(" + expressionList(args) + ")";
      case MOD:
        return "fmod(" + expressionList(args) + ")";
      case REAL:
        return "(double)" + expression(args.get(0), ATOM_PRECEDENCE);
      case INT:
        return "(int)" + expression(args.get(0), ATOM_PRECEDENCE);
      default:
        throw new BackendException("Intrinsic " + call.getIntrinsic() +
            " has no C equivalent: lower it to code first");
    }
  }

  /**
   * C functions take two arguments: fmin(a, fmin(b, c))
   */
  private String nested(String function, List<Node> args)
                                        throws BackendException {
    String result = expression(args.get(args.size() - 1));
    for (int i = args.size() - 2; i >= 0; i--) {
      result = function + "(" + expression(args.get(i)) + ", " + result + ")";
    }
    return result;
  }

  private String expressionList(List<Node> exprs) throws BackendException {
    List<String> parts = new ArrayList<String>();
    for (Node e: exprs) {
      parts.add(expression(e));
    }
    return StringUtils.join(parts, ", ");
  }

  @Override
  protected String binaryOperation(BinaryOperation op)
                                          throws BackendException {
    if (op.getOperator() == BinaryOperation.Operator.POW) {
      return "pow(" + expression(op.getLhs()) + ", " +
             expression(op.getRhs()) + ")";
    }
    return super.binaryOperation(op);
  }

  @Override
  protected String unaryOperation(UnaryOperation op)
                                          throws BackendException {
    if (op.getOperator() == UnaryOperation.Operator.NOT) {
      // ! binds more tightly than any binary operator in C
      return "!" + expression(op.getOperand(), ATOM_PRECEDENCE);
    }
    return super.unaryOperation(op);
  }

  @Override
  protected String operatorSymbol(BinaryOperation.Operator op) {
    switch (op) {
      case ADD: return "+";
      case SUB: return "-";
      case MUL: return "*";
      case DIV: return "/";
      case EQ: return "==";
      case NE: return "!=";
      case LT: return "<";
      case LE: return "<=";
      case GT: return ">";
      case GE: return ">=";
      case AND: return "&&";
      case OR: return "||";
      default:
        throw new SCTRuntimeError("No C operator for " + op);
    }
  }

  @Override
  protected String operatorSymbol(UnaryOperation.Operator op) {
    switch (op) {
      case MINUS: return "-";
      case PLUS: return "+";
      case NOT: return "!";
      default:
        throw new SCTRuntimeError("Unknown operator " + op);
    }
  }
}
