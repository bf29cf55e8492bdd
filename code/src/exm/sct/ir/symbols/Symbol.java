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

/**
 * A named entity bound in a scope.  The name never changes: renaming means
 * creating a new symbol and rebinding every node that targets the old one.
 * Nodes refer to symbols by identity, so two symbols of the same name in
 * different scopes are distinct.
 */
public class Symbol {
  private final String name;
  private SymbolInterface iface;

  public Symbol(String name) {
    this(name, SymbolInterface.local());
  }

  public Symbol(String name, SymbolInterface iface) {
    Preconditions.checkArgument(name != null && !name.isEmpty(),
                                "Symbol name must be non-empty");
    Preconditions.checkNotNull(iface);
    this.name = name;
    this.iface = iface;
  }

  public String getName() {
    return name;
  }

  public SymbolInterface getInterface() {
    return iface;
  }

  public void setInterface(SymbolInterface iface) {
    Preconditions.checkNotNull(iface);
    this.iface = iface;
  }

  public boolean isImported() {
    return iface.isImport();
  }

  public boolean isArgument() {
    return iface.isArgument();
  }

  public boolean isUnresolved() {
    return iface.isUnresolved();
  }

  /**
   * @return a new symbol with the same properties
   */
  public Symbol copy() {
    return new Symbol(name, iface);
  }

  /**
   * Point any symbols this one depends on (import containers, array extents)
   * at their replacements
   */
  void rebind(Map<Symbol, Symbol> renames) {
    if (iface.isImport()) {
      ContainerSymbol c = ((SymbolInterface.ImportInterface)iface).container();
      if (renames.containsKey(c)) {
        iface = SymbolInterface.imported((ContainerSymbol)renames.get(c));
      }
    }
  }

  /**
   * @return true if this symbol's definition refers to the other symbol
   */
  public boolean dependsOn(Symbol other) {
    return iface.isImport() &&
        ((SymbolInterface.ImportInterface)iface).container() == other;
  }

  @Override
  public String toString() {
    return name + ": Symbol<" + iface + ">";
  }
}
