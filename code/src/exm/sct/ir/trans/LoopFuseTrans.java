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
package exm.sct.ir.trans;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.AccessInfo;
import exm.sct.ir.analysis.Signature;
import exm.sct.ir.analysis.SingleVariableAccessInfo;
import exm.sct.ir.analysis.VariablesAccessInfo;
import exm.sct.ir.maths.SymbolicMaths;
import exm.sct.ir.maths.SymbolicMaths.Equality;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * Fuse a loop with the loop that immediately follows it.  Both must
 * iterate over the same variable with bounds and step that can be proven
 * equal.  Variables written in one loop and accessed in the other must be
 * arrays accessed at the same, loop-dependent index everywhere.
 */
public class LoopFuseTrans extends LoopTrans {
  private static final Logger logger = Logging.getSCTLogger();

  @Override
  public String name() {
    return "LoopFuseTrans";
  }

  @Override
  public String description() {
    return "Fuse a loop with the following loop";
  }

  @Override
  public void validate(Node target, TransformationOptions options)
                                        throws TransformationException {
    Loop first = checkLoop(target);
    Node next = first.nextSibling();
    if (next == null || next.kind() != NodeKind.LOOP) {
      throw new TransformationException("Cannot apply " + name() +
          ": loop over '" + first.getVariable().getName() +
          "' is not immediately followed by another loop");
    }
    Loop second = (Loop)next;
    DataSymbol var = first.getVariable();
    if (second.getVariable() != var) {
      throw new TransformationException("Cannot apply " + name() +
          ": loops use different variables '" + var.getName() + "' and '" +
          second.getVariable().getName() + "'");
    }
    checkEqual("start", first.getStartExpr(), second.getStartExpr());
    checkEqual("stop", first.getStopExpr(), second.getStopExpr());
    checkEqual("step", first.getStepExpr(), second.getStepExpr());
    if (!second.getLoopBody().getSymbolTable().getSymbols().isEmpty()) {
      throw new TransformationException("Cannot apply " + name() +
          ": body of the second loop declares its own symbols");
    }

    VariablesAccessInfo info1 = new VariablesAccessInfo(first.getLoopBody());
    VariablesAccessInfo info2 = new VariablesAccessInfo(second.getLoopBody());
    if (info1.hasOpaqueAccess() || info2.hasOpaqueAccess()) {
      throw new TransformationException("Cannot apply " + name() +
          ": loop bodies contain code that cannot be analysed");
    }
    checkBodyKeepsBounds(first, info1);
    checkBodyKeepsBounds(second, info2);
    checkDependencies(var, info1, info2);
    checkDependencies(var, info2, info1);
  }

  private void checkEqual(String what, Node a, Node b)
                                        throws TransformationException {
    Equality eq = SymbolicMaths.equal(a, b);
    if (eq == Equality.NOT_EQUAL) {
      throw new TransformationException("Cannot apply " + name() +
          ": loop " + what + " expressions differ");
    } else if (eq == Equality.UNKNOWN) {
      throw new TransformationException("Cannot apply " + name() +
          ": cannot prove loop " + what + " expressions are equal");
    }
  }

  /**
   * Everything written in one loop and accessed in the other must be an
   * array accessed only at one index that depends on the loop variable
   */
  private void checkDependencies(DataSymbol var, VariablesAccessInfo writer,
        VariablesAccessInfo other) throws TransformationException {
    for (Signature sig: writer.getWrittenSignatures()) {
      for (Signature otherSig: other.getSignatures()) {
        if (!otherSig.equals(sig) && otherSig.overlaps(sig)) {
          throw new TransformationException("Cannot apply " + name() +
              ": '" + sig + "' is written in one loop and '" + otherSig +
              "' is accessed in the other");
        }
      }
      if (!other.has(sig)) {
        continue;
      }
      List<AccessInfo> all = new ArrayList<AccessInfo>();
      all.addAll(writer.get(sig).getAccesses());
      all.addAll(other.get(sig).getAccesses());
      checkSameLoopIndex(var, writer.get(sig), all);
    }
  }

  private void checkSameLoopIndex(DataSymbol var,
        SingleVariableAccessInfo info, List<AccessInfo> accesses)
                                        throws TransformationException {
    Node reference = null;
    for (AccessInfo access: accesses) {
      Node n = access.getNode();
      if (n.kind() != NodeKind.ARRAY_REFERENCE) {
        throw new TransformationException("Cannot apply " + name() +
            ": '" + info.getSignature() + "' is written in one loop and " +
            "accessed in the other, and is not an array");
      }
      if (reference == null) {
        reference = n;
        if (!usesVariable(n, var)) {
          throw new TransformationException("Cannot apply " + name() +
              ": index of '" + info.getSignature() + "' does not depend on " +
              "loop variable '" + var.getName() + "'");
        }
      } else if (!sameIndices(reference, n)) {
        throw new TransformationException("Cannot apply " + name() +
            ": '" + info.getSignature() + "' is accessed at different " +
            "indices in the two loops");
      }
    }
  }

  private static boolean usesVariable(Node ref, DataSymbol var) {
    for (Node index: ref.getChildren()) {
      for (Node n: index.walk(NodeKind.REFERENCE)) {
        if (n.refersTo(var)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean sameIndices(Node a, Node b) {
    if (a.numChildren() != b.numChildren()) {
      return false;
    }
    for (int i = 0; i < a.numChildren(); i++) {
      Node ia = a.getChild(i);
      Node ib = b.getChild(i);
      if (ia.kind() == NodeKind.RANGE || ib.kind() == NodeKind.RANGE ||
          SymbolicMaths.equal(ia, ib) != Equality.EQUAL) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                        throws TransformationException {
    validate(target, options);
    Loop first = (Loop)target;
    Loop second = (Loop)first.nextSibling();
    List<Node> moved = new ArrayList<Node>(second.getLoopBody().getChildren());
    for (Node stmt: moved) {
      stmt.detach();
    }
    first.getLoopBody().addChildren(moved, first.getLoopBody().numChildren());
    second.detach();
    logger.debug("Fused two loops over " + first.getVariable().getName());
  }
}
