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
package exm.sct.ir.symbols;

import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.DeferredType;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.tree.Node;

/**
 * Symbol for a variable or named constant
 */
public class DataSymbol extends Symbol {
  private Type datatype;
  private Node constantValue;

  public DataSymbol(String name, Type datatype) {
    this(name, datatype, SymbolInterface.local());
  }

  public DataSymbol(String name, Type datatype, SymbolInterface iface) {
    super(name, iface);
    Preconditions.checkNotNull(datatype);
    this.datatype = datatype;
  }

  public Type getDatatype() {
    return datatype;
  }

  /**
   * Resolve a deferred type once it becomes known.
   * @throws IllegalStateException if the type was already resolved
   */
  public void resolveType(Type resolved) {
    Preconditions.checkState(datatype instanceof DeferredType,
        "Type of '" + getName() + "' is already resolved as " + datatype);
    Preconditions.checkNotNull(resolved);
    this.datatype = resolved;
  }

  public boolean isArray() {
    return datatype instanceof ArrayType;
  }

  public boolean isScalar() {
    return datatype instanceof ScalarType;
  }

  /**
   * @return the initial value of a named constant, or null
   */
  public Node getConstantValue() {
    return constantValue;
  }

  public void setConstantValue(Node value) {
    Preconditions.checkArgument(value == null || value.getParent() == null,
        "Constant value must be a detached expression");
    this.constantValue = value;
  }

  public boolean isConstant() {
    return constantValue != null;
  }

  @Override
  public DataSymbol copy() {
    DataSymbol copy = new DataSymbol(getName(), datatype, getInterface());
    if (constantValue != null) {
      copy.setConstantValue(constantValue.copy());
    }
    return copy;
  }

  @Override
  void rebind(Map<Symbol, Symbol> renames) {
    super.rebind(renames);
    if (datatype instanceof ArrayType) {
      datatype = ((ArrayType)datatype).rebind(renames);
    }
  }

  @Override
  public boolean dependsOn(Symbol other) {
    return super.dependsOn(other) || (datatype instanceof ArrayType &&
                             ((ArrayType)datatype).usesSymbol(other));
  }

  @Override
  public String toString() {
    return getName() + ": DataSymbol<" + datatype + ", " + getInterface() +
           (isConstant() ? ", constant" : "") + ">";
  }
}
