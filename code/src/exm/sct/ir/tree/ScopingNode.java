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
package exm.sct.ir.tree;

import java.util.HashMap;
import java.util.Map;

import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolTable;

/**
 * A node that owns a symbol table
 */
public abstract class ScopingNode extends Node {
  private SymbolTable symbolTable;

  protected ScopingNode() {
    this.symbolTable = new SymbolTable(this);
  }

  @Override
  public SymbolTable getSymbolTable() {
    return symbolTable;
  }

  /**
   * The clone gets its own copy of the symbol table, and everything inside
   * the clone that targeted an original symbol targets its copy.
   */
  @Override
  public Node copy() {
    ScopingNode clone = (ScopingNode)super.copy();
    Map<Symbol, Symbol> mapping = new HashMap<Symbol, Symbol>();
    clone.symbolTable = symbolTable.deepCopy(clone, mapping);
    for (Node n: clone.walk()) {
      n.rebindSymbols(mapping);
      if (n != clone && n.kind().isScope()) {
        ((ScopingNode)n).getSymbolTable().rebindSymbols(mapping);
      }
    }
    return clone;
  }
}
