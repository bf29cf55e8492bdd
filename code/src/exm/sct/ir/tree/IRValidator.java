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

import org.apache.log4j.Logger;

import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.Extent;

/**
 * Perform some sanity checks on an IR tree:
 * - Check parent links are valid
 * - Check every node has all of its mandatory children
 * - Check every symbol table is owned by its node
 * - Check symbols targeted by nodes are visible from where they are used
 *
 * Any failure is a bug in whatever produced the tree.
 */
public class IRValidator {

  private IRValidator() {
    // Static methods only
  }

  public static void validate(Logger logger, Node root) {
    int count = 0;
    for (Node n: root.walk()) {
      checkParentLinks(n);
      checkComplete(n);
      if (n.kind().isScope()) {
        checkSymbolTable((ScopingNode)n);
      }
      checkSymbolsVisible(n);
      count++;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Validated " + count + " nodes under " + root);
    }
  }

  private static void checkParentLinks(Node n) {
    for (Node child: n.getChildren()) {
      if (child.getParent() != n) {
        throw new SCTRuntimeError("Parent link of " + child + " is " +
                        child.getParent() + " but it is a child of " + n);
      }
    }
  }

  private static void checkComplete(Node n) {
    if (!n.isComplete()) {
      throw new SCTRuntimeError(n + " is missing mandatory children: has " +
                                n.numChildren() + " children");
    }
  }

  private static void checkSymbolTable(ScopingNode scope) {
    SymbolTable table = scope.getSymbolTable();
    if (table == null || table.getNode() != scope) {
      throw new SCTRuntimeError("Symbol table of " + scope +
                                " is not owned by it");
    }
    // Array bounds must refer to symbols visible from the declaration
    for (DataSymbol s: table.getDataSymbols()) {
      if (s.getDatatype() instanceof ArrayType) {
        for (Extent e: ((ArrayType)s.getDatatype()).shape()) {
          if (e.isSymbol()) {
            checkVisible(scope, e.symbol(), s.getName() + " declaration");
          }
        }
      }
    }
  }

  private static void checkSymbolsVisible(Node n) {
    if (n.getSymbols().isEmpty()) {
      return;
    }
    if (n.ancestor(NodeKind.SCOPES, null, true) == null) {
      throw new SCTRuntimeError(n + " refers to symbols but is not in a scope");
    }
    for (Symbol s: n.getSymbols()) {
      checkVisible(n, s, n.toString());
    }
  }

  private static void checkVisible(Node from, Symbol s, String user) {
    Symbol found = from.getSymbolTable().findSymbol(s.getName());
    if (found != s) {
      throw new SCTRuntimeError("Symbol " + s + " used by " + user +
          " is not visible from its scope" +
          (found == null ? "" : ": name is bound to " + found));
    }
  }
}
