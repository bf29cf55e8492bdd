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
import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.Signature;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;

/**
 * Tile a 2D loop nest: block both loops, then interchange so that the
 * loops run in the order tile-i, tile-j, element-i, element-j.
 *
 * Option "tilesize": positive integer, default from settings.
 */
public class LoopTiling2DTrans extends LoopTrans {
  public static final String TILESIZE = "tilesize";

  private static final Logger logger = Logging.getSCTLogger();

  private final BlockLoopTrans blocking;
  private final LoopSwapTrans swap = new LoopSwapTrans();
  private final int defaultTilesize;

  public LoopTiling2DTrans(Settings settings) {
    this.blocking = new BlockLoopTrans(settings);
    try {
      this.defaultTilesize = settings.getInt(Settings.TRANS_TILESIZE);
    } catch (InvalidOptionException e) {
      throw new SCTRuntimeError(e.getMessage(), e);
    }
  }

  @Override
  public String name() {
    return "LoopTiling2DTrans";
  }

  @Override
  public String description() {
    return "Tile a nest of two loops";
  }

  private TransformationOptions blockOptions(TransformationOptions options)
                                            throws TransformationException {
    int tilesize = options.getPositiveInt(TILESIZE, defaultTilesize);
    return options.with(BlockLoopTrans.BLOCKSIZE, Integer.toString(tilesize));
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
    TransformationOptions blockOpts = blockOptions(options);
    blocking.validate(outer, blockOpts);
    blocking.validate(inner, blockOpts);
    String outerVar = outer.getVariable().getName();
    if (boundsInfo(inner).has(new Signature(outerVar))) {
      throw new TransformationException("Cannot apply " + name() +
          ": bounds of the inner loop over '" +
          inner.getVariable().getName() +
          "' depend on the outer loop variable '" + outerVar + "'");
    }
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                            throws TransformationException {
    validate(target, options);
    Loop outer = (Loop)target;
    Loop inner = singleNestedLoop(outer);
    TransformationOptions blockOpts = blockOptions(options);
    String outerVar = outer.getVariable().getName();
    String innerVar = inner.getVariable().getName();

    blocking.apply(outer, blockOpts);
    blocking.apply(inner, blockOpts);
    // outer now contains the loop over tiles of the inner loop
    try {
      swap.apply(outer, TransformationOptions.EMPTY);
    } catch (TransformationException e) {
      throw new SCTRuntimeError("Interchange failed after blocking " +
                                "a validated loop nest: " + e.getMessage(), e);
    }
    logger.debug("Tiled loops over " + outerVar + " and " + innerVar);
  }
}
