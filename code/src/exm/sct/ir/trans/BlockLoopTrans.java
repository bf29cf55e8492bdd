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
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.VariablesAccessInfo;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;

/**
 * Split a loop into an outer loop over blocks and an inner loop over the
 * elements of one block:
 *
 * <pre>
 * do i = start, stop, step
 * </pre>
 * becomes
 * <pre>
 * do i_out_var = start, stop, B
 *   i_el_inner = MIN(i_out_var + (B - step), stop)
 *   do i = i_out_var, i_el_inner, step
 * </pre>
 * where B is the block size rounded down to a multiple of the step.
 * Negative steps use MAX and subtraction.  Every iteration value of the
 * original loop occurs exactly once, in the same order.
 *
 * Option "blocksize": positive integer, default from settings.
 */
public class BlockLoopTrans extends LoopTrans {
  public static final String BLOCKSIZE = "blocksize";

  private static final Logger logger = Logging.getSCTLogger();

  private final int defaultBlocksize;

  public BlockLoopTrans(Settings settings) {
    try {
      this.defaultBlocksize = settings.getInt(Settings.TRANS_BLOCKSIZE);
    } catch (InvalidOptionException e) {
      // Validated when settings were created
      throw new SCTRuntimeError(e.getMessage(), e);
    }
  }

  @Override
  public String name() {
    return "BlockLoopTrans";
  }

  @Override
  public String description() {
    return "Split a loop into a loop over blocks and a loop within a block";
  }

  @Override
  public void validate(Node target, TransformationOptions options)
                                          throws TransformationException {
    Loop loop = checkLoop(target);
    int blocksize = options.getPositiveInt(BLOCKSIZE, defaultBlocksize);
    Integer step = Literal.integerValue(loop.getStepExpr());
    if (step == null) {
      throw new TransformationException("Cannot apply a " + name() +
          " to a loop with a non-constant step size");
    }
    if (step == 0) {
      throw new TransformationException("Cannot apply a " + name() +
          " to a loop with a step size of 0");
    }
    if (Math.abs(step) > blocksize) {
      throw new TransformationException("Cannot apply a " + name() +
          " to a loop with larger step size than the chosen block size (" +
          Math.abs(step) + " > " + blocksize + ")");
    }
    if (loop.hasAnnotation(Loop.BLOCKED)) {
      throw new TransformationException("Cannot apply a " + name() +
          " to loop over '" + loop.getVariable().getName() +
          "': it is already blocked");
    }
    if (loop.ancestor(NodeKind.ROUTINE) == null) {
      throw new TransformationException("Cannot apply a " + name() +
          ": loop is not inside a routine");
    }
    checkBodyKeepsBounds(loop,
                         new VariablesAccessInfo(loop.getLoopBody()));
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                          throws TransformationException {
    validate(target, options);
    Loop loop = (Loop)target;
    int blocksize = options.getPositiveInt(BLOCKSIZE, defaultBlocksize);
    int step = Literal.integerValue(loop.getStepExpr());
    int absStep = Math.abs(step);
    int block = blocksize - blocksize % absStep;

    SymbolTable table = loop.ancestor(NodeKind.ROUTINE).getSymbolTable();
    DataSymbol var = loop.getVariable();
    Type varType = var.isScalar() ? var.getDatatype() : Types.INTEGER_TYPE;
    DataSymbol outVar = table.newDataSymbol(var.getName() + "_out_var",
                                            null, varType);
    DataSymbol elInner = table.newDataSymbol(var.getName() + "_el_inner",
                                             null, varType);

    Node start = loop.getStartExpr();
    Node stop = loop.getStopExpr();
    start.replaceWith(new Reference(outVar));
    stop.replaceWith(new Reference(elInner));

    // Last element of the block, clipped to the end of the loop
    Node blockEnd = new Reference(outVar);
    if (block > absStep) {
      blockEnd = BinaryOperation.create(step > 0 ? BinaryOperation.Operator.ADD
                                                 : BinaryOperation.Operator.SUB,
                              blockEnd, Literal.integer(block - absStep));
    }
    Intrinsic clip = step > 0 ? Intrinsic.MIN : Intrinsic.MAX;
    Assignment setInner = Assignment.create(new Reference(elInner),
        IntrinsicCall.create(clip, Arrays.asList(blockEnd, stop.copy())));

    Loop outer = Loop.create(outVar, start, stop,
                             Literal.signedInteger(step > 0 ? block : -block),
                             new ArrayList<Node>());
    outer.setLine(loop.getLine());
    loop.replaceWith(outer);
    List<Node> outerBody = new ArrayList<Node>();
    outerBody.add(setInner);
    outerBody.add(loop);
    outer.getLoopBody().addChildren(outerBody, 0);

    outer.addAnnotation(Loop.BLOCKED);
    loop.addAnnotation(Loop.BLOCKED);
    logger.debug("Blocked loop over " + var.getName() + " with block size " +
                 block + " using " + outVar.getName() + " and " +
                 elInner.getName());
  }
}
