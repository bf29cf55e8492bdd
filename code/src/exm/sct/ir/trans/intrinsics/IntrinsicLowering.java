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

import java.util.EnumSet;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * Lower intrinsic calls throughout a tree
 */
public class IntrinsicLowering {
  private static final Logger logger = Logging.getSCTLogger();

  private IntrinsicLowering() {
    // Static methods only
  }

  /**
   * @return the transformation that lowers the intrinsic, or null if
   *         there is none
   */
  public static IntrinsicLoweringTrans forIntrinsic(Intrinsic intrinsic) {
    switch (intrinsic) {
      case ABS:
        return new Abs2CodeTrans();
      case SIGN:
        return new Sign2CodeTrans();
      case MIN:
        return new Min2CodeTrans();
      case MAX:
        return new Max2CodeTrans();
      case SUM:
        return new Sum2CodeTrans();
      default:
        return null;
    }
  }

  /**
   * Lower every call to one of the intrinsics under root.  Calls nested in
   * the arguments of other calls are lowered first.  Calls that can't be
   * lowered are left in place.
   * @return number of calls lowered
   */
  public static int lowerAll(Node root, EnumSet<Intrinsic> intrinsics) {
    // Reverse pre-order visits arguments before the calls containing them
    List<Node> calls = Lists.reverse(root.walkList(NodeKind.INTRINSIC_CALL));
    int lowered = 0;
    for (Node n: calls) {
      IntrinsicCall call = (IntrinsicCall)n;
      if (!intrinsics.contains(call.getIntrinsic())) {
        continue;
      }
      IntrinsicLoweringTrans trans = forIntrinsic(call.getIntrinsic());
      if (trans == null) {
        logger.debug("No lowering for " + call.getIntrinsic());
        continue;
      }
      try {
        trans.apply(call);
        lowered++;
      } catch (TransformationException e) {
        logger.debug("Left " + call + " in place: " + e.getMessage());
      }
    }
    return lowered;
  }
}
