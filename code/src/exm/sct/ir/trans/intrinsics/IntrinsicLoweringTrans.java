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

import java.util.List;

import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.trans.Transformation;
import exm.sct.ir.trans.TransformationOptions;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;

/**
 * Base for transformations that replace a call to an intrinsic with
 * explicit code.  The call is replaced by a reference to a new result
 * variable, and the statements computing it are inserted immediately
 * before the statement containing the call.
 */
public abstract class IntrinsicLoweringTrans extends Transformation {

  /**
   * @return the intrinsic this lowers
   */
  public abstract Intrinsic intrinsic();

  @Override
  public String description() {
    return "Replace " + intrinsic().name() + " intrinsic with equivalent code";
  }

  @Override
  public void validate(Node target, TransformationOptions options)
                                          throws TransformationException {
    if (target == null || target.kind() != NodeKind.INTRINSIC_CALL ||
        ((IntrinsicCall)target).getIntrinsic() != intrinsic()) {
      throw new TransformationException("Target of " + name() +
          " must be a call to the " + intrinsic().name() +
          " intrinsic but got " + target);
    }
    Node stmt = enclosingStatement(target);
    if (stmt == null || stmt.getParent() == null ||
        !stmt.getParent().kind().isStatementList()) {
      throw new TransformationException("Cannot apply " + name() +
          ": " + target + " is not inside a statement of a routine or " +
          "schedule");
    }
    validateCall((IntrinsicCall)target);
  }

  /**
   * Further checks on the arguments of the call
   */
  protected void validateCall(IntrinsicCall call)
                                  throws TransformationException {
    // Nothing by default
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                          throws TransformationException {
    validate(target, options);
    IntrinsicCall call = (IntrinsicCall)target;
    Node stmt = enclosingStatement(call);
    List<Node> code = lower(call, stmt, tableFor(stmt));
    Node parent = stmt.getParent();
    parent.addChildren(code, stmt.getPosition());
  }

  /**
   * Build the code computing the call, and replace the call with a
   * reference to the result.
   * @param call the validated call
   * @param stmt statement containing the call
   * @param table table for new symbols
   * @return statements to insert before stmt, in order
   */
  protected abstract List<Node> lower(IntrinsicCall call, Node stmt,
              SymbolTable table) throws TransformationException;

  protected static Node enclosingStatement(Node call) {
    return call.ancestor(NodeKind.STATEMENTS);
  }

  /**
   * New symbols go in the routine if there is one
   */
  protected static SymbolTable tableFor(Node stmt) {
    Node routine = stmt.ancestor(NodeKind.ROUTINE);
    if (routine != null) {
      return routine.getSymbolTable();
    }
    return stmt.getSymbolTable();
  }

  protected static DataSymbol newVariable(SymbolTable table, String root,
                                          ScalarType type) {
    return table.newDataSymbol(root, null, type);
  }

  protected static Reference ref(DataSymbol sym) {
    return new Reference(sym);
  }
}
