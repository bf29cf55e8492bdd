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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.sct.common.exceptions.BackendException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.DeferredType;
import exm.sct.ir.symbols.Types.Extent;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.symbols.Types.UnknownType;
import exm.sct.ir.tree.ArrayReference;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.CodeBlock;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Directive;
import exm.sct.ir.tree.ExtractNode;
import exm.sct.ir.tree.GlobalReduction;
import exm.sct.ir.tree.HaloExchange;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Member;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.PSyDataNode;
import exm.sct.ir.tree.Range;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.Routine;
import exm.sct.ir.tree.ScopingNode;
import exm.sct.ir.tree.StructureReference;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Free-form Fortran writer.  Every node kind has a Fortran form.
 *
 * A routine is written as its use statements, its declarations and then
 * its body.  Declarations come from the routine's symbol table followed by
 * those of schedules nested inside it, in insertion order except that a
 * symbol used in the declaration of another is declared first.
 */
public class FortranWriter extends LanguageWriter {

  @Override
  public String language() {
    return "fortran";
  }

  @Override
  protected void write(Node node, StringBuilder sb, int depth)
                                            throws BackendException {
    switch (node.kind()) {
      case CONTAINER:
        writeContainer((Container)node, sb, depth);
        break;
      case ROUTINE:
        writeRoutine((Routine)node, sb, depth);
        break;
      case SCHEDULE:
        writeStatements(node.getChildren(), sb, depth);
        break;
      case ASSIGNMENT: {
        Assignment a = (Assignment)node;
        line(sb, depth, expression(a.getLhs()) + " = " +
                        expression(a.getRhs()));
        break;
      }
      case LOOP:
        writeLoop((Loop)node, sb, depth);
        break;
      case IF_BLOCK:
        writeIf((IfBlock)node, sb, depth);
        break;
      case CALL: {
        Call call = (Call)node;
        line(sb, depth, "call " + call.getRoutine().getName() + "(" +
                        expressionList(call.getArguments()) + ")");
        break;
      }
      case RETURN:
        line(sb, depth, "return");
        break;
      case CODE_BLOCK:
        for (String text: ((CodeBlock)node).getLines()) {
          line(sb, depth, text);
        }
        break;
      case DIRECTIVE: {
        Directive d = (Directive)node;
        line(sb, depth, "!$" + d.getBeginText());
        writeStatements(d.getBody().getChildren(), sb, depth);
        if (d.getEndText() != null) {
          line(sb, depth, "!$" + d.getEndText());
        }
        break;
      }
      case EXTRACT_REGION:
        writeExtract((ExtractNode)node, sb, depth);
        break;
      case PROFILE_REGION:
        writeProfile((PSyDataNode)node, sb, depth);
        break;
      case HALO_EXCHANGE: {
        HaloExchange h = (HaloExchange)node;
        line(sb, depth, "call " + h.getField().getName() +
                        "%halo_exchange(depth=" + h.getDepth() + ")");
        break;
      }
      case GLOBAL_REDUCTION: {
        GlobalReduction r = (GlobalReduction)node;
        line(sb, depth, "call global_" + r.getOp().name().toLowerCase() +
                        "(" + r.getOperand().getName() + ")");
        break;
      }
      case MEMBER:
        throw new BackendException("A structure member can only be " +
                                   "written as part of a reference");
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

  private void writeContainer(Container c, StringBuilder sb, int depth)
                                                throws BackendException {
    if (c.isFileContainer()) {
      boolean first = true;
      for (Node child: c.getChildren()) {
        if (!first) {
          sb.append("\n");
        }
        write(child, sb, depth);
        first = false;
      }
      return;
    }
    line(sb, depth, "module " + c.getName());
    writeUses(c.getSymbolTable(), sb, depth + 1);
    writeDeclarations(declaredSymbols(c), sb, depth + 1);
    if (c.numChildren() > 0) {
      sb.append("\n");
      line(sb, depth, "contains");
      for (Node child: c.getChildren()) {
        write(child, sb, depth + 1);
      }
    }
    line(sb, depth, "end module " + c.getName());
  }

  private void writeRoutine(Routine r, StringBuilder sb, int depth)
                                                throws BackendException {
    SymbolTable table = r.getSymbolTable();
    if (r.isProgram()) {
      line(sb, depth, "program " + r.getName());
    } else {
      List<String> args = new ArrayList<String>();
      for (DataSymbol arg: table.getArgumentList()) {
        args.add(arg.getName());
      }
      line(sb, depth, "subroutine " + r.getName() + "(" +
                      StringUtils.join(args, ", ") + ")");
    }
    writeUses(table, sb, depth + 1);
    writeDeclarations(declaredSymbols(r), sb, depth + 1);
    sb.append("\n");
    writeStatements(r.getChildren(), sb, depth + 1);
    sb.append("\n");
    line(sb, depth, "end " + (r.isProgram() ? "program " : "subroutine ") +
                    r.getName());
  }

  private void writeUses(SymbolTable table, StringBuilder sb, int depth) {
    for (ContainerSymbol mod: table.getContainerSymbols()) {
      List<String> names = new ArrayList<String>();
      for (Symbol s: table.symbolsImportedFrom(mod)) {
        names.add(s.getName());
      }
      if (mod.hasWildcardImport()) {
        line(sb, depth, "use " + mod.getName());
      } else {
        line(sb, depth, "use " + mod.getName() + ", only: " +
                        StringUtils.join(names, ", "));
      }
    }
  }

  /**
   * Data symbols of the scope and nested schedules that need declaring
   */
  private static List<DataSymbol> declaredSymbols(ScopingNode scope) {
    List<DataSymbol> result = new ArrayList<DataSymbol>();
    addDeclared(scope.getSymbolTable(), result);
    if (scope.kind() == NodeKind.ROUTINE) {
      for (Node n: scope.walk(NodeKind.SCHEDULE)) {
        if (n != scope) {
          addDeclared(n.getSymbolTable(), result);
        }
      }
    }
    return result;
  }

  private static void addDeclared(SymbolTable table, List<DataSymbol> result) {
    for (DataSymbol s: table.getDataSymbols()) {
      if (!s.isImported() && !s.isUnresolved() &&
          !(s.getDatatype() instanceof DeferredType)) {
        result.add(s);
      }
    }
  }

  private void writeDeclarations(List<DataSymbol> symbols, StringBuilder sb,
                                 int depth) throws BackendException {
    Set<DataSymbol> done = new HashSet<DataSymbol>();
    for (DataSymbol s: symbols) {
      writeDeclaration(s, symbols, done, sb, depth);
    }
  }

  private void writeDeclaration(DataSymbol s, List<DataSymbol> symbols,
        Set<DataSymbol> done, StringBuilder sb, int depth)
                                            throws BackendException {
    if (!done.add(s)) {
      return;
    }
    for (DataSymbol other: symbols) {
      if (other != s && usedInDeclaration(s, other)) {
        writeDeclaration(other, symbols, done, sb, depth);
      }
    }
    line(sb, depth, declaration(s));
  }

  private static boolean usedInDeclaration(DataSymbol s, DataSymbol other) {
    if (s.dependsOn(other)) {
      return true;
    }
    if (s.isConstant()) {
      for (Node n: s.getConstantValue().walk(NodeKind.REFERENCES)) {
        if (n.refersTo(other)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * @return declaration statement for a data symbol
   */
  public String declaration(DataSymbol s) throws BackendException {
    Type t = s.getDatatype();
    if (t instanceof UnknownType) {
      String text = ((UnknownType)t).declaration();
      // Declarations read from source are complete statements
      return text.contains("::") ? text : text + " :: " + s.getName();
    }
    StringBuilder decl = new StringBuilder();
    decl.append(typeSpec(s, t));
    if (t instanceof ArrayType) {
      List<String> extents = new ArrayList<String>();
      for (Extent e: ((ArrayType)t).shape()) {
        extents.add(extent(e));
      }
      decl.append(", dimension(");
      decl.append(StringUtils.join(extents, ","));
      decl.append(")");
    }
    String intent = s.isArgument() ? intent(s) : null;
    if (intent != null) {
      decl.append(", intent(");
      decl.append(intent);
      decl.append(")");
    }
    if (s.isConstant()) {
      decl.append(", parameter");
    }
    decl.append(" :: ");
    decl.append(s.getName());
    if (s.isConstant()) {
      decl.append(" = ");
      decl.append(expression(s.getConstantValue()));
    }
    return decl.toString();
  }

  private static String typeSpec(DataSymbol s, Type t)
                                        throws BackendException {
    ScalarType scalar = t instanceof ArrayType ?
                        ((ArrayType)t).elementType() : (ScalarType)t;
    String kind = scalar.precision() == 0 ? "" :
                  "(kind=" + scalar.precision() + ")";
    switch (scalar.intrinsic()) {
      case INTEGER:
        return "integer" + kind;
      case REAL:
        return "real" + kind;
      case BOOLEAN:
        return "logical" + kind;
      case CHARACTER:
        return "character" + (scalar.precision() == 0 ? "" :
                              "(len=" + scalar.precision() + ")");
      default:
        throw new BackendException("Cannot declare '" + s.getName() +
                                   "' of type " + t);
    }
  }

  private static String extent(Extent e) {
    if (e.isLiteral()) {
      return Integer.toString(e.literal());
    } else if (e.isSymbol()) {
      return e.symbol().getName();
    }
    return ":";
  }

  /**
   * @return intent of an argument, or null if it isn't known
   */
  private static String intent(DataSymbol s) {
    SymbolInterface.Access access =
        ((SymbolInterface.ArgumentInterface)s.getInterface()).access();
    switch (access) {
      case READ:
        return "in";
      case WRITE:
        return "out";
      case READWRITE:
        return "inout";
      default:
        return null;
    }
  }

  private void writeLoop(Loop loop, StringBuilder sb, int depth)
                                            throws BackendException {
    line(sb, depth, "do " + loop.getVariable().getName() + " = " +
        expression(loop.getStartExpr()) + ", " +
        expression(loop.getStopExpr()) + ", " +
        expression(loop.getStepExpr()));
    writeStatements(loop.getLoopBody().getChildren(), sb, depth + 1);
    line(sb, depth, "end do");
  }

  private void writeIf(IfBlock ifBlock, StringBuilder sb, int depth)
                                            throws BackendException {
    line(sb, depth, "if (" + expression(ifBlock.getCondition()) + ") then");
    writeStatements(ifBlock.getIfBody().getChildren(), sb, depth + 1);
    if (ifBlock.getElseBody() != null) {
      line(sb, depth, "else");
      writeStatements(ifBlock.getElseBody().getChildren(), sb, depth + 1);
    }
    line(sb, depth, "end if");
  }

  private void writeProfile(PSyDataNode region, StringBuilder sb, int depth)
                                            throws BackendException {
    String var = region.getPSyDataSymbol().getName();
    line(sb, depth, "call " + var + "%PreStart(\"" + region.getModuleName() +
                    "\", \"" + region.getRegionName() + "\", 0, 0)");
    writeStatements(region.getBody().getChildren(), sb, depth);
    line(sb, depth, "call " + var + "%PostEnd");
  }

  private void writeExtract(ExtractNode region, StringBuilder sb, int depth)
                                            throws BackendException {
    String var = region.getPSyDataSymbol().getName();
    List<String> inputs = region.getInputs();
    List<String> outputs = region.getOutputs();
    line(sb, depth, "call " + var + "%PreStart(\"" + region.getModuleName() +
        "\", \"" + region.getRegionName() + "\", " + inputs.size() + ", " +
        outputs.size() + ")");
    for (String in: inputs) {
      line(sb, depth, "call " + var + "%PreDeclareVariable(\"" + in +
                      "\", " + in + ")");
    }
    for (String out: outputs) {
      line(sb, depth, "call " + var + "%PreDeclareVariable(\"" + out +
                      "_post\", " + out + ")");
    }
    line(sb, depth, "call " + var + "%PreEndDeclaration");
    for (String in: inputs) {
      line(sb, depth, "call " + var + "%ProvideVariable(\"" + in + "\", " +
                      in + ")");
    }
    line(sb, depth, "call " + var + "%PreEnd");
    writeStatements(region.getBody().getChildren(), sb, depth);
    line(sb, depth, "call " + var + "%PostStart");
    for (String out: outputs) {
      line(sb, depth, "call " + var + "%ProvideVariable(\"" + out +
                      "_post\", " + out + ")");
    }
    line(sb, depth, "call " + var + "%PostEnd");
  }

  @Override
  protected String atom(Node expr) throws BackendException {
    switch (expr.kind()) {
      case LITERAL:
        return literal((Literal)expr);
      case REFERENCE:
        return ((Reference)expr).getName();
      case ARRAY_REFERENCE: {
        ArrayReference ref = (ArrayReference)expr;
        return ref.getName() + "(" + subscripts(ref, ref.getIndices()) + ")";
      }
      case STRUCTURE_REFERENCE:
        return structureReference((StructureReference)expr);
      case INTRINSIC_CALL: {
        IntrinsicCall call = (IntrinsicCall)expr;
        return call.getIntrinsic().name() + "(" +
               expressionList(call.getArguments()) + ")";
      }
      case RANGE:
        return range((Range)expr, null, 0);
      default:
        throw new SCTRuntimeError("Not an expression: " + expr);
    }
  }

  private String literal(Literal lit) {
    ScalarType type = lit.getType();
    switch (type.intrinsic()) {
      case BOOLEAN:
        return "." + lit.getValue() + ".";
      case CHARACTER:
        return "'" + lit.getValue().replace("'", "''") + "'";
      case REAL: {
        String text = lit.getValue();
        if (!text.contains(".") && !text.contains("e") &&
            !text.contains("E")) {
          text += ".0";
        }
        if (type.precision() != 0) {
          text += "_" + type.precision();
        }
        return text;
      }
      default:
        if (type.precision() != 0) {
          return lit.getValue() + "_" + type.precision();
        }
        return lit.getValue();
    }
  }

  private String structureReference(StructureReference ref)
                                            throws BackendException {
    StringBuilder sb = new StringBuilder(ref.getName());
    Member m = ref.getMember();
    while (m != null) {
      sb.append("%");
      sb.append(m.getName());
      if (!m.getIndices().isEmpty()) {
        sb.append("(");
        sb.append(subscripts(null, m.getIndices()));
        sb.append(")");
      }
      m = m.getNext();
    }
    return sb.toString();
  }

  private String subscripts(Reference array, List<Node> indices)
                                            throws BackendException {
    List<String> parts = new ArrayList<String>();
    for (int i = 0; i < indices.size(); i++) {
      Node index = indices.get(i);
      if (index.kind() == NodeKind.RANGE) {
        parts.add(range((Range)index, array, i + 1));
      } else {
        parts.add(expression(index));
      }
    }
    return StringUtils.join(parts, ", ");
  }

  /**
   * Bounds equal to LBOUND/UBOUND of the dimension being indexed and a
   * step of 1 are left out
   */
  private String range(Range range, Reference array, int dim)
                                            throws BackendException {
    String start = isBoundOf(range.getStart(), Intrinsic.LBOUND, array, dim)
                   ? "" : expression(range.getStart());
    String stop = isBoundOf(range.getStop(), Intrinsic.UBOUND, array, dim)
                  ? "" : expression(range.getStop());
    Integer step = Literal.integerValue(range.getStep());
    if (step != null && step == 1) {
      return start + ":" + stop;
    }
    return start + ":" + stop + ":" + expression(range.getStep());
  }

  private static boolean isBoundOf(Node expr, Intrinsic bound,
                                   Reference array, int dim) {
    if (array == null || expr.kind() != NodeKind.INTRINSIC_CALL ||
        ((IntrinsicCall)expr).getIntrinsic() != bound ||
        expr.numChildren() != 2) {
      return false;
    }
    Node of = expr.getChild(0);
    Integer d = Literal.integerValue(expr.getChild(1));
    return of.kind() == NodeKind.REFERENCE &&
           ((Reference)of).getSymbol() == array.getSymbol() &&
           d != null && d == dim;
  }

  private String expressionList(List<Node> exprs) throws BackendException {
    List<String> parts = new ArrayList<String>();
    for (Node e: exprs) {
      parts.add(expression(e));
    }
    return StringUtils.join(parts, ", ");
  }

  @Override
  protected String operatorSymbol(BinaryOperation.Operator op) {
    switch (op) {
      case ADD: return "+";
      case SUB: return "-";
      case MUL: return "*";
      case DIV: return "/";
      case POW: return "**";
      case EQ: return "==";
      case NE: return "/=";
      case LT: return "<";
      case LE: return "<=";
      case GT: return ">";
      case GE: return ">=";
      case AND: return ".AND.";
      case OR: return ".OR.";
      default:
        throw new SCTRuntimeError("Unknown operator " + op);
    }
  }

  @Override
  protected String operatorSymbol(UnaryOperation.Operator op) {
    switch (op) {
      case MINUS: return "-";
      case PLUS: return "+";
      case NOT: return ".NOT. ";
      default:
        throw new SCTRuntimeError("Unknown operator " + op);
    }
  }
}
