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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.NameCollisionException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.common.exceptions.SymbolInUseException;
import exm.sct.common.exceptions.SymbolNotFoundException;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.ScopingNode;

/**
 * Bindings of names to symbols for one scope.
 *
 * Names are case-insensitive.  The table of the enclosing scope is found
 * through the owning node, so moving a scope in the tree changes which
 * names are visible from it.
 */
public class SymbolTable {

  private static final Logger logger = Logging.getSCTLogger();

  private final ScopingNode owner;

  /** Keyed by lower-case name, in insertion order */
  private final LinkedHashMap<String, Symbol> symbols =
                                    new LinkedHashMap<String, Symbol>();

  private final HashMap<String, Symbol> tags = new HashMap<String, Symbol>();

  private final List<DataSymbol> argumentList = new ArrayList<DataSymbol>();

  public SymbolTable(ScopingNode owner) {
    Preconditions.checkNotNull(owner);
    this.owner = owner;
  }

  public ScopingNode getNode() {
    return owner;
  }

  /**
   * @return table of the nearest enclosing scope, or null at the root
   */
  public SymbolTable parentSymbolTable() {
    Node parent = owner.getParent();
    if (parent == null) {
      return null;
    }
    return parent.scope().getSymbolTable();
  }

  private static String key(String name) {
    return name.toLowerCase();
  }

  public void add(Symbol symbol) throws NameCollisionException {
    add(symbol, null);
  }

  /**
   * Add a symbol, optionally with a tag that transformations can use to
   * find it again.
   * @throws NameCollisionException if name or tag is already in this table
   */
  public void add(Symbol symbol, String tag) throws NameCollisionException {
    String k = key(symbol.getName());
    if (symbols.containsKey(k)) {
      throw new NameCollisionException(symbol.getName(),
          "Symbol '" + symbol.getName() + "' is already declared in " + owner);
    }
    if (tag != null && tags.containsKey(tag)) {
      throw new NameCollisionException(symbol.getName(), "Tag '" + tag +
          "' is already used by symbol '" + tags.get(tag).getName() + "' in " +
          owner);
    }
    symbols.put(k, symbol);
    if (tag != null) {
      tags.put(tag, symbol);
    }
  }

  /**
   * @return true if name is bound in this table (ancestors not searched)
   */
  public boolean containsName(String name) {
    return symbols.containsKey(key(name));
  }

  /**
   * @return true if this exact symbol is bound in this table
   */
  public boolean contains(Symbol symbol) {
    return symbols.get(key(symbol.getName())) == symbol;
  }

  /**
   * Look name up in this table and then all enclosing tables
   */
  public Symbol lookup(String name) throws SymbolNotFoundException {
    return lookup(name, null);
  }

  /**
   * Look name up in this table and enclosing tables, stopping after the
   * table of scopeLimit.
   * @param scopeLimit if null, search up to the root
   */
  public Symbol lookup(String name, ScopingNode scopeLimit)
                                          throws SymbolNotFoundException {
    Symbol result = findSymbol(name, scopeLimit);
    if (result == null) {
      throw new SymbolNotFoundException(name, "Could not find symbol '" +
                                        name + "' from scope " + owner);
    }
    return result;
  }

  /**
   * Like lookup, but return null rather than throw
   */
  public Symbol findSymbol(String name) {
    return findSymbol(name, null);
  }

  public Symbol findSymbol(String name, ScopingNode scopeLimit) {
    String k = key(name);
    SymbolTable table = this;
    while (table != null) {
      Symbol sym = table.symbols.get(k);
      if (sym != null) {
        return sym;
      }
      if (scopeLimit != null && table.owner == scopeLimit) {
        return null;
      }
      table = table.parentSymbolTable();
    }
    return null;
  }

  /**
   * Find symbol by tag in this and enclosing tables
   */
  public Symbol lookupWithTag(String tag) throws SymbolNotFoundException {
    Symbol sym = findWithTag(tag);
    if (sym == null) {
      throw new SymbolNotFoundException(tag, "Could not find symbol with tag '"
                                        + tag + "' from scope " + owner);
    }
    return sym;
  }

  /**
   * @return symbol with tag in this or an enclosing table, or null
   */
  public Symbol findWithTag(String tag) {
    for (SymbolTable t = this; t != null; t = t.parentSymbolTable()) {
      Symbol sym = t.tags.get(tag);
      if (sym != null) {
        return sym;
      }
    }
    return null;
  }

  /**
   * Return the data symbol with the given tag, creating it in this table
   * with a name derived from the tag if it doesn't exist yet
   */
  public DataSymbol symbolFromTag(String tag, Type type) {
    Symbol existing = findWithTag(tag);
    if (existing != null) {
      if (!(existing instanceof DataSymbol)) {
        throw new SCTRuntimeError("Symbol tagged '" + tag +
                                  "' is not a data symbol: " + existing);
      }
      return (DataSymbol)existing;
    }
    return newDataSymbol(tag, tag, type);
  }

  /**
   * Find first name of sequence root, root_1, root_2, ... that isn't visible
   * from this scope and isn't declared in any scope nested inside it.
   */
  public String nextAvailableName(String root) {
    Preconditions.checkArgument(root != null && !root.isEmpty());
    String candidate = root;
    int counter = 1;
    while (nameInUse(candidate)) {
      candidate = root + "_" + counter;
      counter++;
    }
    return candidate;
  }

  private boolean nameInUse(String name) {
    if (findSymbol(name) != null) {
      return true;
    }
    for (Node n: owner.walk(NodeKind.SCOPES)) {
      if (((ScopingNode)n).getSymbolTable().containsName(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Create a symbol with a fresh name and add it to this table.
   * @param root base of the name
   * @param tag tag to associate, or null
   * @param factory builds the symbol from the chosen name
   */
  public <T extends Symbol> T newSymbol(String root, String tag,
                                        Function<String, T> factory) {
    String name = nextAvailableName(root);
    T symbol = factory.apply(name);
    try {
      add(symbol, tag);
    } catch (NameCollisionException e) {
      throw new SCTRuntimeError("Fresh name " + name + " collided", e);
    }
    logger.trace("New symbol " + symbol + " in " + owner);
    return symbol;
  }

  public DataSymbol newDataSymbol(String root, String tag, final Type type) {
    return newSymbol(root, tag, new Function<String, DataSymbol>() {
      @Override
      public DataSymbol apply(String name) {
        return new DataSymbol(name, type);
      }
    });
  }

  /**
   * Remove a symbol from this table.
   * @throws SymbolNotFoundException if the symbol isn't in this table
   * @throws SymbolInUseException if something in this scope still refers
   *          to the symbol
   */
  public void remove(Symbol symbol)
        throws SymbolNotFoundException, SymbolInUseException {
    if (!contains(symbol)) {
      throw new SymbolNotFoundException(symbol.getName(), "Cannot remove '" +
          symbol.getName() + "': not in symbol table of " + owner);
    }
    for (Node n: owner.walk()) {
      if (n.refersTo(symbol)) {
        throw new SymbolInUseException(symbol.getName(), "Cannot remove '" +
            symbol.getName() + "': still referenced by " + n);
      }
    }
    for (Node n: owner.walk(NodeKind.SCOPES)) {
      for (Symbol other: ((ScopingNode)n).getSymbolTable().getSymbols()) {
        if (other != symbol && other.dependsOn(symbol)) {
          throw new SymbolInUseException(symbol.getName(), "Cannot remove '" +
              symbol.getName() + "': symbol '" + other.getName() +
              "' depends on it");
        }
      }
    }
    if (argumentList.contains(symbol)) {
      throw new SymbolInUseException(symbol.getName(), "Cannot remove '" +
          symbol.getName() + "': it is a routine argument");
    }
    symbols.remove(key(symbol.getName()));
    tags.values().removeAll(Collections.singleton(symbol));
  }

  /**
   * @return all symbols of this table in insertion order
   */
  public List<Symbol> getSymbols() {
    return Collections.unmodifiableList(new ArrayList<Symbol>(symbols.values()));
  }

  public List<DataSymbol> getDataSymbols() {
    List<DataSymbol> result = new ArrayList<DataSymbol>();
    for (Symbol s: symbols.values()) {
      if (s instanceof DataSymbol) {
        result.add((DataSymbol)s);
      }
    }
    return result;
  }

  public List<ContainerSymbol> getContainerSymbols() {
    List<ContainerSymbol> result = new ArrayList<ContainerSymbol>();
    for (Symbol s: symbols.values()) {
      if (s instanceof ContainerSymbol) {
        result.add((ContainerSymbol)s);
      }
    }
    return result;
  }

  public List<RoutineSymbol> getRoutineSymbols() {
    List<RoutineSymbol> result = new ArrayList<RoutineSymbol>();
    for (Symbol s: symbols.values()) {
      if (s instanceof RoutineSymbol) {
        result.add((RoutineSymbol)s);
      }
    }
    return result;
  }

  /**
   * @return symbols imported from the given container
   */
  public List<Symbol> symbolsImportedFrom(ContainerSymbol container) {
    List<Symbol> result = new ArrayList<Symbol>();
    for (Symbol s: symbols.values()) {
      if (s.dependsOn(container) && s.isImported()) {
        result.add(s);
      }
    }
    return result;
  }

  /**
   * @return the tag of a symbol in this table, or null
   */
  public String tagOf(Symbol symbol) {
    for (Map.Entry<String, Symbol> e: tags.entrySet()) {
      if (e.getValue() == symbol) {
        return e.getKey();
      }
    }
    return null;
  }

  /**
   * Set the routine arguments, in order.  Each must be a data symbol of
   * this table with an argument interface.
   */
  public void specifyArgumentList(List<DataSymbol> args) {
    for (DataSymbol arg: args) {
      if (!contains(arg)) {
        throw new SCTRuntimeError("Argument '" + arg.getName() +
                                  "' is not in symbol table of " + owner);
      }
      if (!arg.isArgument()) {
        throw new SCTRuntimeError("Symbol '" + arg.getName() +
            "' is in argument list but has interface " + arg.getInterface());
      }
    }
    argumentList.clear();
    argumentList.addAll(args);
  }

  public List<DataSymbol> getArgumentList() {
    return Collections.unmodifiableList(argumentList);
  }

  /**
   * Find the definition of an imported symbol in the module it comes from.
   * The module must be a Container of the same tree.
   * @return the symbol exported by the module
   * @throws SymbolNotFoundException if the module or name can't be found
   */
  public Symbol resolveImport(Symbol symbol) throws SymbolNotFoundException {
    if (!symbol.isImported()) {
      throw new SCTRuntimeError("Symbol '" + symbol.getName() +
                                "' is not imported");
    }
    ContainerSymbol module =
        ((SymbolInterface.ImportInterface)symbol.getInterface()).container();
    for (Node n: owner.getRoot().walk(NodeKind.CONTAINER)) {
      Container c = (Container)n;
      if (c.getName().equalsIgnoreCase(module.getName())) {
        Symbol exported = c.getSymbolTable().symbols.get(key(symbol.getName()));
        if (exported == null) {
          throw new SymbolNotFoundException(symbol.getName(),
              "Module '" + module.getName() + "' does not define '" +
              symbol.getName() + "'");
        }
        return exported;
      }
    }
    throw new SymbolNotFoundException(module.getName(), "Could not find module '"
        + module.getName() + "' to resolve import of '" + symbol.getName() + "'");
  }

  /**
   * Copy this table for a cloned scope.  Every symbol is copied; symbols
   * that depend on other symbols of this table are pointed at the copies.
   * @param newOwner the cloned scope
   * @param mapping filled in with original to copy
   */
  public SymbolTable deepCopy(ScopingNode newOwner, Map<Symbol, Symbol> mapping) {
    SymbolTable copy = new SymbolTable(newOwner);
    for (Map.Entry<String, Symbol> e: symbols.entrySet()) {
      Symbol symCopy = e.getValue().copy();
      mapping.put(e.getValue(), symCopy);
      copy.symbols.put(e.getKey(), symCopy);
    }
    for (Map.Entry<String, Symbol> e: tags.entrySet()) {
      copy.tags.put(e.getKey(), mapping.get(e.getValue()));
    }
    for (DataSymbol arg: argumentList) {
      copy.argumentList.add((DataSymbol)mapping.get(arg));
    }
    copy.rebindSymbols(mapping);
    return copy;
  }

  /**
   * Point dependencies of this table's symbols at replacements
   */
  public void rebindSymbols(Map<Symbol, Symbol> renames) {
    for (Symbol s: symbols.values()) {
      s.rebind(renames);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Symbol Table of ");
    sb.append(owner);
    sb.append(":\n");
    for (Symbol s: symbols.values()) {
      sb.append("  ");
      sb.append(s);
      sb.append("\n");
    }
    return sb.toString();
  }
}
