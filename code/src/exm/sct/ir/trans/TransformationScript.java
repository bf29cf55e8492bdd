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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.tree.IRValidator;
import exm.sct.ir.tree.Node;

/**
 * Sequence of transformations applied to a tree in order.  Each step
 * selects its targets when it runs, then applies its transformation to
 * each.  A target that fails validation is logged and skipped.
 */
public class TransformationScript {

  public static class Step {
    private final Transformation trans;
    private final TargetSelector selector;
    private final TransformationOptions options;

    public Step(Transformation trans, TargetSelector selector,
                TransformationOptions options) {
      this.trans = trans;
      this.selector = selector;
      this.options = options;
    }

    public Transformation getTransformation() {
      return trans;
    }

    public TargetSelector getSelector() {
      return selector;
    }

    public TransformationOptions getOptions() {
      return options;
    }

    @Override
    public String toString() {
      return trans.name() + " on " + selector.describe() +
             (options.asMap().isEmpty() ? "" : " with " + options);
    }
  }

  private final List<Step> steps = new ArrayList<Step>();
  private final boolean validateIR;

  public TransformationScript(Settings settings) {
    try {
      this.validateIR = settings.getBoolean(Settings.VALIDATE_IR);
    } catch (InvalidOptionException e) {
      throw new SCTRuntimeError(e.getMessage(), e);
    }
  }

  public void addStep(Step step) {
    steps.add(step);
  }

  public void addStep(Transformation trans, TargetSelector selector,
                      TransformationOptions options) {
    addStep(new Step(trans, selector, options));
  }

  public List<Step> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  /**
   * Run all steps
   * @return number of successful applications
   */
  public int run(Logger logger, Node root) {
    int applied = 0;
    for (Step step: steps) {
      logger.debug("Step: " + step);
      applied += runStep(logger, step, root);
      if (validateIR) {
        IRValidator.validate(logger, root);
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Tree after " + step.getTransformation().name() + ":\n" +
                     root.debugString());
      }
    }
    return applied;
  }

  private int runStep(Logger logger, Step step, Node root) {
    List<Node> targets = step.getSelector().select(root);
    int applied = 0;
    if (step.getTransformation() instanceof RegionTrans) {
      RegionTrans trans = (RegionTrans)step.getTransformation();
      for (List<Node> region: consecutiveRuns(targets)) {
        try {
          trans.apply(region, step.getOptions());
          applied++;
        } catch (TransformationException e) {
          logger.warn("Skipped " + trans.name() + ": " + e.getMessage());
        }
      }
    } else {
      Transformation trans = step.getTransformation();
      for (Node target: targets) {
        if (target.getRoot() != root) {
          // Removed by an earlier application
          logger.debug("Skipped " + target + ": no longer in tree");
          continue;
        }
        try {
          trans.apply(target, step.getOptions());
          applied++;
        } catch (TransformationException e) {
          logger.warn("Skipped " + trans.name() + " on " + target + ": " +
                      e.getMessage());
        }
      }
    }
    logger.debug(step.getTransformation().name() + " applied " + applied +
                 " times to " + targets.size() + " targets");
    return applied;
  }

  /**
   * Group nodes into runs of adjacent siblings
   */
  static List<List<Node>> consecutiveRuns(List<Node> nodes) {
    List<List<Node>> runs = new ArrayList<List<Node>>();
    List<Node> curr = null;
    Node prev = null;
    for (Node n: nodes) {
      if (curr == null || n.getParent() != prev.getParent() ||
          n.getPosition() != prev.getPosition() + 1) {
        curr = new ArrayList<Node>();
        runs.add(curr);
      }
      curr.add(n);
      prev = n;
    }
    return runs;
  }
}
