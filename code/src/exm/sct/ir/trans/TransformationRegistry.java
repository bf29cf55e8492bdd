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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.ir.trans.intrinsics.Abs2CodeTrans;
import exm.sct.ir.trans.intrinsics.IntrinsicLoweringTrans;
import exm.sct.ir.trans.intrinsics.Max2CodeTrans;
import exm.sct.ir.trans.intrinsics.Min2CodeTrans;
import exm.sct.ir.trans.intrinsics.Sign2CodeTrans;
import exm.sct.ir.trans.intrinsics.Sum2CodeTrans;

/**
 * Look up transformations by name, and build script steps from text of
 * the form name[:key=value,...].  Names are case-insensitive.
 *
 * Two option keys are reserved for the step rather than the
 * transformation: "target" names a {@link TargetSelector} and "routine"
 * restricts it to one routine.
 */
public class TransformationRegistry {
  public static final String TARGET = "target";
  public static final String ROUTINE = "routine";

  public static final List<String> NAMES = Collections.unmodifiableList(
      Arrays.asList("BlockLoopTrans", "LoopTiling2DTrans", "LoopSwapTrans",
                    "LoopFuseTrans", "Abs2CodeTrans", "Sign2CodeTrans",
                    "Min2CodeTrans", "Max2CodeTrans", "Sum2CodeTrans",
                    "ExtractTrans", "ProfileTrans"));

  private final Settings settings;

  public TransformationRegistry(Settings settings) {
    this.settings = settings;
  }

  /**
   * @throws InvalidOptionException if no transformation has the name
   */
  public Transformation create(String name) throws InvalidOptionException {
    String lower = name.trim().toLowerCase();
    if (lower.equals("blocklooptrans")) {
      return new BlockLoopTrans(settings);
    } else if (lower.equals("looptiling2dtrans")) {
      return new LoopTiling2DTrans(settings);
    } else if (lower.equals("loopswaptrans")) {
      return new LoopSwapTrans();
    } else if (lower.equals("loopfusetrans")) {
      return new LoopFuseTrans();
    } else if (lower.equals("abs2codetrans")) {
      return new Abs2CodeTrans();
    } else if (lower.equals("sign2codetrans")) {
      return new Sign2CodeTrans();
    } else if (lower.equals("min2codetrans")) {
      return new Min2CodeTrans();
    } else if (lower.equals("max2codetrans")) {
      return new Max2CodeTrans();
    } else if (lower.equals("sum2codetrans")) {
      return new Sum2CodeTrans();
    } else if (lower.equals("extracttrans")) {
      return new ExtractTrans(settings);
    } else if (lower.equals("profiletrans")) {
      return new ProfileTrans(settings);
    } else {
      throw new InvalidOptionException("Unknown transformation '" + name +
                                       "', expected one of " + NAMES);
    }
  }

  /**
   * Target used when a step doesn't name one
   */
  public static TargetSelector defaultSelector(Transformation trans) {
    if (trans instanceof IntrinsicLoweringTrans) {
      return TargetSelector.intrinsicCalls(
                      ((IntrinsicLoweringTrans)trans).intrinsic());
    } else if (trans instanceof RegionTrans) {
      return TargetSelector.routineBodies();
    } else {
      return TargetSelector.outerLoops();
    }
  }

  /**
   * Parse name[:key=value,...]
   */
  public TransformationScript.Step parseStep(String text)
                                        throws InvalidOptionException {
    String name = text;
    String optText = "";
    int colon = text.indexOf(':');
    if (colon >= 0) {
      name = text.substring(0, colon);
      optText = text.substring(colon + 1);
    }
    Transformation trans = create(name);
    TransformationOptions options = TransformationOptions.parse(optText);

    TargetSelector selector;
    if (options.has(TARGET)) {
      IntrinsicLoweringTrans lowering = trans instanceof IntrinsicLoweringTrans
                            ? (IntrinsicLoweringTrans)trans : null;
      selector = TargetSelector.fromName(options.getString(TARGET, null),
                      lowering == null ? null : lowering.intrinsic());
    } else {
      selector = defaultSelector(trans);
    }
    if (options.has(ROUTINE)) {
      selector = TargetSelector.inRoutine(options.getString(ROUTINE, null),
                                          selector);
    }
    options = options.without(TARGET).without(ROUTINE);
    return new TransformationScript.Step(trans, selector, options);
  }
}
