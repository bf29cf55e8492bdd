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

import exm.sct.ir.tree.BinaryOperation.Operator;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;

public class Min2CodeTrans extends MinOrMax2CodeTrans {

  @Override
  public String name() {
    return "Min2CodeTrans";
  }

  @Override
  public Intrinsic intrinsic() {
    return Intrinsic.MIN;
  }

  @Override
  protected Operator comparison() {
    return Operator.LT;
  }
}
