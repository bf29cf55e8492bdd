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
package exm.sct.ir.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.tree.Node;

/**
 * Inputs and outputs of a region of code.  Inputs are the variables whose
 * values before the region may be used by it, outputs those it writes.
 * Named constants are neither.
 */
public class ReadWriteInfo {
  private final List<Signature> inputs = new ArrayList<Signature>();
  private final List<Signature> outputs = new ArrayList<Signature>();

  public ReadWriteInfo(List<? extends Node> nodes) {
    this(new VariablesAccessInfo(nodes));
  }

  public ReadWriteInfo(VariablesAccessInfo accessInfo) {
    for (SingleVariableAccessInfo info: accessInfo.all()) {
      if (!isVariable(info.getSymbol())) {
        continue;
      }
      if (info.isReadFirst()) {
        inputs.add(info.getSignature());
      }
      if (info.isWritten()) {
        outputs.add(info.getSignature());
      }
    }
  }

  private static boolean isVariable(Symbol sym) {
    return sym instanceof DataSymbol && !((DataSymbol)sym).isConstant();
  }

  public List<Signature> getInputs() {
    return Collections.unmodifiableList(inputs);
  }

  public List<Signature> getOutputs() {
    return Collections.unmodifiableList(outputs);
  }

  @Override
  public String toString() {
    return "inputs=" + inputs + " outputs=" + outputs;
  }
}
