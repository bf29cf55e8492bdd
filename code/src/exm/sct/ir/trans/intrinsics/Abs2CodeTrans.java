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
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.UnaryOperation;

/**
 * <pre>
 * r = ABS(x)
 * </pre>
 * becomes
 * <pre>
 * tmp_abs = x
 * if (tmp_abs &lt; 0) then
 *   res_abs = tmp_abs * -1
 * else
 *   res_abs = tmp_abs
 * end if
 * r = res_abs
 * </pre>
 */
public class Abs2CodeTrans extends IntrinsicLoweringTrans {
  private static final Logger logger = Logging.getSCTLogger();

  @Override
  public String name() {
    return "Abs2CodeTrans";
  }

  @Override
  public Intrinsic intrinsic() {
    return Intrinsic.ABS;
  }

  @Override
  protected List<Node> lower(IntrinsicCall call, Node stmt,
                             SymbolTable table) {
    ScalarType type = ExpressionTypes.resultType(call);
    DataSymbol res = newVariable(table, "res_abs", type);
    DataSymbol tmp = newVariable(table, "tmp_abs", type);

    Node arg = call.getChild(0).detach();
    call.replaceWith(ref(res));

    List<Node> code = new ArrayList<Node>();
    code.add(Assignment.create(ref(tmp), arg));
    Node negative = BinaryOperation.create(Operator.LT, ref(tmp),
                                           Literal.zero(type));
    Node negated = BinaryOperation.create(Operator.MUL, ref(tmp),
        UnaryOperation.create(UnaryOperation.Operator.MINUS,
                              ExpressionTypes.one(type)));
    code.add(IfBlock.create(negative,
        Arrays.asList(Assignment.create(ref(res), negated)),
        Arrays.asList(Assignment.create(ref(res), ref(tmp)))));
    logger.debug("Lowered ABS into " + res.getName());
    return code;
  }
}
