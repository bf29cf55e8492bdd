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

import java.util.List;

import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.Signature;
import exm.sct.ir.analysis.VariablesAccessInfo;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * Base for transformations whose target is a single loop
 */
public abstract class LoopTrans extends Transformation {

  /**
   * Check target is a loop with a parent
   * @return the target as a loop
   */
  protected Loop checkLoop(Node target) throws TransformationException {
    if (target == null || target.kind() != NodeKind.LOOP) {
      throw new TransformationException("Target of " + name() +
          " must be a loop but got " + target);
    }
    if (target.getParent() == null) {
      throw new TransformationException("Target loop of " + name() +
          " must be inside a routine or schedule but has no parent");
    }
    return (Loop)target;
  }

  /**
   * Check that the body of the loop doesn't change how the loop iterates:
   * no opaque code, no write to the loop variable or to anything read in
   * the bounds or step.
   */
  protected void checkBodyKeepsBounds(Loop loop, VariablesAccessInfo bodyInfo)
                                              throws TransformationException {
    if (bodyInfo.hasOpaqueAccess()) {
      throw new TransformationException("Cannot apply " + name() +
          " to loop over '" + loop.getVariable().getName() +
          "': its body contains code that cannot be analysed");
    }
    String var = loop.getVariable().getName();
    if (bodyInfo.isVariableWritten(var)) {
      throw new TransformationException("Cannot apply " + name() +
          ": loop variable '" + var + "' is written inside the loop body");
    }
    for (Signature sig: boundsInfo(loop).getReadSignatures()) {
      if (bodyInfo.isWrittenOverlapping(sig)) {
        throw new TransformationException("Cannot apply " + name() +
            " to loop over '" + var + "': '" + sig + "' is read in the loop " +
            "bounds or step and written in the loop body");
      }
    }
  }

  /**
   * @return accesses in the start, stop and step of the loop
   */
  protected static VariablesAccessInfo boundsInfo(Loop loop) {
    List<Node> bounds = loop.getChildren().subList(0, 3);
    return new VariablesAccessInfo(bounds);
  }

  /**
   * @return the only child of the loop body if it is a loop, otherwise null
   */
  protected static Loop singleNestedLoop(Loop loop) {
    List<Node> body = loop.getLoopBody().getChildren();
    if (body.size() == 1 && body.get(0).kind() == NodeKind.LOOP) {
      return (Loop)body.get(0);
    }
    return null;
  }
}
