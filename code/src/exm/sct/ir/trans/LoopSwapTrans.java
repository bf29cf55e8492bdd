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

import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.Signature;
import exm.sct.ir.analysis.VariablesAccessInfo;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;

/**
 * Interchange a loop with the single loop nested in it:
 *
 * <pre>
 * do j = ...          do i = ...
 *   do i = ...    =>    do j = ...
 *     body                body
 * </pre>
 */
public class LoopSwapTrans extends LoopTrans {
  private static final Logger logger = Logging.getSCTLogger();

  @Override
  public String name() {
    return "LoopSwapTrans";
  }

  @Override
  public String description() {
    return "Exchange the order of two immediately nested loops";
  }

  @Override
  public void validate(Node target, TransformationOptions options)
                                        throws TransformationException {
    Loop outer = checkLoop(target);
    Loop inner = singleNestedLoop(outer);
    if (inner == null) {
      throw new TransformationException("Cannot apply " + name() +
          " to loop over '" + outer.getVariable().getName() + "': the body " +
          "of the target loop must consist of exactly one loop");
    }
    String outerVar = outer.getVariable().getName();
    String innerVar = inner.getVariable().getName();
    if (boundsInfo(inner).has(new Signature(outerVar))) {
      throw new TransformationException("Cannot apply " + name() +
          ": bounds of the inner loop over '" + innerVar +
          "' depend on the outer loop variable '" + outerVar + "'");
    }
    if (boundsInfo(outer).has(new Signature(innerVar))) {
      throw new TransformationException("Cannot apply " + name() +
          ": bounds of the outer loop over '" + outerVar +
          "' use the inner loop variable '" + innerVar + "'");
    }
    VariablesAccessInfo bodyInfo = new VariablesAccessInfo(inner.getLoopBody());
    checkBodyKeepsBounds(outer, bodyInfo);
    checkBodyKeepsBounds(inner, bodyInfo);
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                        throws TransformationException {
    validate(target, options);
    Loop outer = (Loop)target;
    Loop inner = singleNestedLoop(outer);

    DataSymbol outerVar = outer.getVariable();
    outer.setVariable(inner.getVariable());
    inner.setVariable(outerVar);
    for (int i = 0; i < 3; i++) {
      swapChildren(outer.getChild(i), inner.getChild(i));
    }
    logger.debug("Swapped loops over " + inner.getVariable().getName() +
                 " and " + outer.getVariable().getName());
  }

  /**
   * Exchange positions of two attached nodes
   */
  private static void swapChildren(Node a, Node b) {
    Node placeholder = Literal.integer(0);
    a.replaceWith(placeholder);
    b.replaceWith(a);
    placeholder.replaceWith(b);
  }
}
