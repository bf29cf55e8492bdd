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
package exm.sct.ir.trans;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import com.google.common.base.Function;

import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types.UnknownType;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Routine;
import exm.sct.ir.tree.Schedule;

/**
 * Base for transformations that enclose a run of consecutive statements
 * in a new node.  The target can be a single statement or a list.
 */
public abstract class RegionTrans extends Transformation {

  /**
   * @return kinds of node that may not be inside, contain or be part of
   *         the region
   */
  protected abstract EnumSet<NodeKind> excludedKinds();

  public abstract void validate(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException;

  public abstract void apply(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException;

  @Override
  public void validate(Node target, TransformationOptions options)
                                          throws TransformationException {
    validate(Collections.singletonList(target), options);
  }

  @Override
  public void apply(Node target, TransformationOptions options)
                                          throws TransformationException {
    apply(Collections.singletonList(target), options);
  }

  /**
   * Check the nodes are consecutive statements of one routine or schedule,
   * and that no node of an excluded kind is involved
   */
  protected void checkRegion(List<? extends Node> nodes)
                                          throws TransformationException {
    if (nodes == null || nodes.isEmpty()) {
      throw new TransformationException("Cannot apply " + name() +
                                        " to an empty list of nodes");
    }
    Node parent = nodes.get(0).getParent();
    for (Node n: nodes) {
      if (n == null || !n.kind().isStatement()) {
        throw new TransformationException("Cannot apply " + name() +
            ": only statements can be enclosed in a region but got " + n);
      }
    }
    if (parent == null || !parent.kind().isStatementList()) {
      throw new TransformationException("Cannot apply " + name() +
          ": " + nodes.get(0) + " is not inside a routine or schedule");
    }
    int expected = nodes.get(0).getPosition();
    for (Node n: nodes) {
      if (n.getParent() != parent || n.getPosition() != expected) {
        throw new TransformationException(
            "Children are not consecutive children of one parent: " +
            "cannot apply " + name());
      }
      expected++;
    }

    EnumSet<NodeKind> excluded = excludedKinds();
    if (nodes.get(0).ancestor(excluded) != null) {
      throw new TransformationException("Cannot apply " + name() +
          " inside an existing " + nodes.get(0).ancestor(excluded).kind());
    }
    checkNotEnclosed(nodes, excluded);
  }

  /**
   * Check no node in the region is of one of the kinds
   */
  protected void checkNotEnclosed(List<? extends Node> nodes,
        EnumSet<NodeKind> kinds) throws TransformationException {
    for (Node n: nodes) {
      List<Node> found = n.walkList(kinds);
      if (!found.isEmpty()) {
        throw new TransformationException("Nodes of type " +
            found.get(0).kind() + " cannot be enclosed by a " + name());
      }
    }
  }

  /**
   * Replace the nodes with the region node, whose body becomes a new
   * schedule holding the nodes
   */
  protected static void wrap(List<? extends Node> nodes, Node region) {
    List<Node> moved = new ArrayList<Node>(nodes);
    Node parent = moved.get(0).getParent();
    int pos = moved.get(0).getPosition();
    for (Node n: moved) {
      n.detach();
    }
    region.addChild(new Schedule(moved));
    parent.addChild(region, pos);
  }

  /**
   * @return table where region symbols go: the enclosing routine's if any
   */
  protected static SymbolTable regionTable(Node first) {
    Node routine = first.ancestor(NodeKind.ROUTINE);
    return routine != null ? routine.getSymbolTable() : first.getSymbolTable();
  }

  /**
   * Default module name: the enclosing module, or else the routine
   */
  protected static String defaultModuleName(Node first) {
    Node container = first.ancestor(NodeKind.CONTAINER);
    while (container != null) {
      if (!((Container)container).isFileContainer()) {
        return ((Container)container).getName();
      }
      container = container.ancestor(NodeKind.CONTAINER);
    }
    Routine routine = (Routine)first.ancestor(NodeKind.ROUTINE);
    return routine != null ? routine.getName() : "unknown";
  }

  /**
   * Default region name: routine name and an index that differs for each
   * region of the same kind in the routine
   */
  protected static String defaultRegionName(Node first, NodeKind kind) {
    Node routine = first.ancestor(NodeKind.ROUTINE);
    if (routine == null) {
      routine = first.getRoot();
    }
    int index = routine.walkList(kind).size();
    String routineName = routine.kind() == NodeKind.ROUTINE ?
                        ((Routine)routine).getName() : "region";
    return routineName + "-r" + index;
  }

  /**
   * Split "module:region" option value
   * @return two-element array of module and region names
   */
  protected String[] parseRegionName(String value)
                                          throws TransformationException {
    String[] parts = value.split(":");
    if (parts.length != 2 || parts[0].trim().isEmpty() ||
        parts[1].trim().isEmpty()) {
      throw new TransformationException("Option region_name of " + name() +
          " must have the form 'module:region' but was '" + value + "'");
    }
    return new String[] {parts[0].trim(), parts[1].trim()};
  }

  /**
   * Find or create the symbols for the PSyData API with a prefix: the
   * module, the type imported from it, and a new variable of that type.
   * @return the new variable
   */
  protected static DataSymbol psyDataVariable(SymbolTable table,
                                              String prefix) {
    final String modName = prefix + "_psy_data_mod";
    Symbol mod = table.findWithTag(modName);
    if (mod == null) {
      mod = table.newSymbol(modName, modName,
                            new Function<String, ContainerSymbol>() {
        @Override
        public ContainerSymbol apply(String name) {
          return new ContainerSymbol(name);
        }
      });
    }
    final ContainerSymbol container = (ContainerSymbol)mod;
    String typeTag = prefix + "_PSyDataType";
    Symbol type = table.findWithTag(typeTag);
    if (type == null) {
      type = table.newSymbol(typeTag, typeTag, new Function<String, Symbol>() {
        @Override
        public Symbol apply(String name) {
          return new Symbol(name, SymbolInterface.imported(container));
        }
      });
    }
    UnknownType varType = new UnknownType("type(" + type.getName() +
                                          "), save, target");
    return table.newDataSymbol(prefix + "_psy_data", null, varType);
  }
}
