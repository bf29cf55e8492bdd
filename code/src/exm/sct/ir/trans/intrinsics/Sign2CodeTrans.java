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
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.trans.TransformationOptions;
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
 * r = SIGN(a, b)
 * </pre>
 * becomes
 * <pre>
 * tmp_sign = a
 * res_sign = ABS(tmp_sign)      (itself lowered)
 * tmp_sign = b
 * if (tmp_sign &lt; 0) then
 *   res_sign = res_sign * -1
 * end if
 * r = res_sign
 * </pre>
 */
public class Sign2CodeTrans extends IntrinsicLoweringTrans {
  private static final Logger logger = Logging.getSCTLogger();

  private final Abs2CodeTrans abs = new Abs2CodeTrans();

  @Override
  public String name() {
    return "Sign2CodeTrans";
  }

  @Override
  public Intrinsic intrinsic() {
    return Intrinsic.SIGN;
  }

  @Override
  protected List<Node> lower(IntrinsicCall call, Node stmt,
                             SymbolTable table) {
    ScalarType type = ExpressionTypes.resultType(call);
    DataSymbol res = newVariable(table, "res_sign", type);
    DataSymbol tmp = newVariable(table, "tmp_sign", type);

    Node a = call.getChild(0).detach();
    Node b = call.getChild(0).detach();
    call.replaceWith(ref(res));

    IntrinsicCall absCall = IntrinsicCall.create(Intrinsic.ABS,
                                                 Arrays.asList(ref(tmp)));
    List<Node> code = new ArrayList<Node>();
    code.add(Assignment.create(ref(tmp), a));
    code.add(Assignment.create(ref(res), absCall));
    code.add(Assignment.create(ref(tmp), b));
    Node negative = BinaryOperation.create(Operator.LT, ref(tmp),
                                           Literal.zero(type));
    Node negated = BinaryOperation.create(Operator.MUL, ref(res),
        UnaryOperation.create(UnaryOperation.Operator.MINUS,
                              ExpressionTypes.one(type)));
    code.add(IfBlock.create(negative,
        Arrays.asList(Assignment.create(ref(res), negated)), null));
    logger.debug("Lowered SIGN into " + res.getName());
    return code;
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                          throws TransformationException {
    validate(target, options);
    Node stmt = enclosingStatement(target);
    super.apply(target, options);
    // Second of the four statements inserted before stmt
    Assignment absAssign = (Assignment)stmt.getSiblings().get(
                                          stmt.getPosition() - 3);
    try {
      abs.apply(absAssign.getRhs(), options);
    } catch (TransformationException e) {
      throw new SCTRuntimeError("Could not lower ABS inserted by " + name() +
                                ": " + e.getMessage(), e);
    }
  }
}
