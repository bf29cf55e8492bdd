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
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.Extent;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.tree.ArrayReference;
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
 * <pre>
 * r = SUM(a)
 * </pre>
 * for a two-dimensional array a(n, m) becomes
 * <pre>
 * res_sum = 0
 * do idx = 1, m, 1
 *   do idx_1 = 1, n, 1
 *     res_sum = res_sum + a(idx_1, idx)
 *   end do
 * end do
 * r = res_sum
 * </pre>
 * Dimensions with unknown extent are iterated from LBOUND to UBOUND.
 * Only the whole-array form is supported: no dim or mask arguments.
 */
public class Sum2CodeTrans extends IntrinsicLoweringTrans {
  private static final Logger logger = Logging.getSCTLogger();

  @Override
  public String name() {
    return "Sum2CodeTrans";
  }

  @Override
  public Intrinsic intrinsic() {
    return Intrinsic.SUM;
  }

  @Override
  protected void validateCall(IntrinsicCall call)
                              throws TransformationException {
    if (call.numChildren() != 1) {
      throw new TransformationException("Cannot apply " + name() +
          ": dimension and mask arguments of SUM are not supported");
    }
    Node arg = call.getChild(0);
    if (arg.kind() != NodeKind.REFERENCE) {
      throw new TransformationException("Cannot apply " + name() +
          ": argument of SUM must be a whole array but got " + arg);
    }
    Symbol sym = ((Reference)arg).getSymbol();
    if (!(sym instanceof DataSymbol) ||
        !(((DataSymbol)sym).getDatatype() instanceof ArrayType)) {
      throw new TransformationException("Cannot apply " + name() +
          ": '" + sym.getName() + "' is not known to be an array");
    }
  }

  @Override
  protected List<Node> lower(IntrinsicCall call, Node stmt,
                             SymbolTable table) {
    DataSymbol array = (DataSymbol)((Reference)call.getChild(0)).getSymbol();
    ArrayType type = (ArrayType)array.getDatatype();
    ScalarType elemType = type.elementType();
    DataSymbol res = newVariable(table, "res_sum", elemType);
    call.replaceWith(ref(res));

    // Outermost loop is over the last dimension
    int rank = type.rank();
    DataSymbol[] indices = new DataSymbol[rank];
    for (int dim = rank - 1; dim >= 0; dim--) {
      indices[dim] = newVariable(table, "idx", Types.INTEGER_TYPE);
    }

    List<Node> subscripts = new ArrayList<Node>();
    for (DataSymbol idx: indices) {
      subscripts.add(ref(idx));
    }
    Node body = Assignment.create(ref(res),
        BinaryOperation.create(BinaryOperation.Operator.ADD, ref(res),
                               ArrayReference.create(array, subscripts)));
    for (int dim = 0; dim < rank; dim++) {
      Extent extent = type.shape().get(dim);
      body = Loop.create(indices[dim], lowerBound(array, extent, dim),
                         upperBound(array, extent, dim), Literal.integer(1),
                         Arrays.asList(body));
    }

    List<Node> code = new ArrayList<Node>();
    code.add(Assignment.create(ref(res), Literal.zero(elemType)));
    code.add(body);
    logger.debug("Lowered SUM of " + array.getName() + " into " +
                 res.getName());
    return code;
  }

  private static Node lowerBound(DataSymbol array, Extent extent, int dim) {
    if (extent.isDeferred()) {
      return boundCall(Intrinsic.LBOUND, array, dim);
    }
    return Literal.integer(1);
  }

  private static Node upperBound(DataSymbol array, Extent extent, int dim) {
    if (extent.isLiteral()) {
      return Literal.integer(extent.literal());
    } else if (extent.isSymbol()) {
      return ref(extent.symbol());
    }
    return boundCall(Intrinsic.UBOUND, array, dim);
  }

  private static Node boundCall(Intrinsic bound, DataSymbol array, int dim) {
    return IntrinsicCall.create(bound, Arrays.asList(
                  new Reference(array), Literal.integer(dim + 1)));
  }
}
