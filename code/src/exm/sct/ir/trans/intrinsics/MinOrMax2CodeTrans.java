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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.BinaryOperation.Operator;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.Node;

/**
 * <pre>
 * r = MIN(a, b, c)
 * </pre>
 * becomes
 * <pre>
 * res_min = a
 * tmp_min = b
 * if (tmp_min &lt; res_min) then
 *   res_min = tmp_min
 * end if
 * tmp_min = c
 * if (tmp_min &lt; res_min) then
 *   res_min = tmp_min
 * end if
 * r = res_min
 * </pre>
 * MAX is the same with &gt;.
 */
public abstract class MinOrMax2CodeTrans extends IntrinsicLoweringTrans {
  private static final Logger logger = Logging.getSCTLogger();

  /**
   * @return comparison that is true if the new value replaces the result
   */
  protected abstract Operator comparison();

  @Override
  protected List<Node> lower(IntrinsicCall call, Node stmt,
                             SymbolTable table) {
    String suffix = intrinsic().name().toLowerCase();
    ScalarType type = ExpressionTypes.resultType(call);
    DataSymbol res = newVariable(table, "res_" + suffix, type);
    DataSymbol tmp = newVariable(table, "tmp_" + suffix, type);

    List<Node> args = new ArrayList<Node>(call.getArguments());
    for (Node arg: args) {
      arg.detach();
    }
    call.replaceWith(ref(res));

    List<Node> code = new ArrayList<Node>();
    code.add(Assignment.create(ref(res), args.get(0)));
    for (Node arg: args.subList(1, args.size())) {
      code.add(Assignment.create(ref(tmp), arg));
      Node replace = BinaryOperation.create(comparison(), ref(tmp), ref(res));
      code.add(IfBlock.create(replace,
          Arrays.asList(Assignment.create(ref(res), ref(tmp))), null));
    }
    logger.debug("Lowered " + intrinsic() + " of " + args.size() +
                 " arguments into " + res.getName());
    return code;
  }
}
