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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;

import exm.sct.common.exceptions.InvalidTreeShapeException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolTable;

/**
 * Base class of all IR nodes.
 *
 * A node owns its ordered children and holds a non-owning link to its parent.
 * Every structural mutation is checked against the child contract of the
 * parent's kind before anything is changed: on violation an
 * {@link InvalidTreeShapeException} is thrown and the tree is untouched.
 *
 * Contracts are checked position by position as children are added, so
 * trees can be built incrementally; {@link #isComplete()} says whether the
 * mandatory children are all present, and is checked by {@link IRValidator}.
 */
public abstract class Node {

  public static final int NO_LINE = -1;

  private Node parent = null;
  private final ArrayList<Node> children = new ArrayList<Node>();
  private final List<String> annotations = new ArrayList<String>();
  private int line = NO_LINE;

  public abstract NodeKind kind();

  /**
   * Check a proposed list of children against this node's contract.
   * Lists that are too short are acceptable here.
   * @return null if acceptable, otherwise a description of the problem
   */
  protected abstract String checkChildren(List<Node> proposed);

  /**
   * @return number of mandatory children
   */
  protected int minChildren() {
    return 0;
  }

  /**
   * @return true if all mandatory children are present
   */
  public boolean isComplete() {
    return children.size() >= minChildren() &&
           checkChildren(children) == null;
  }

  /**
   * Create a copy of this node without children
   */
  protected abstract Node shallowCopy();

  public Node getParent() {
    return parent;
  }

  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public Node getChild(int i) {
    return children.get(i);
  }

  public int numChildren() {
    return children.size();
  }

  public void addChild(Node child) {
    addChild(child, children.size());
  }

  /**
   * Insert child at given position
   * @throws InvalidTreeShapeException
   */
  public void addChild(Node child, int position) {
    checkAttachable(child);
    if (position < 0 || position > children.size()) {
      throw new InvalidTreeShapeException("Position " + position +
          " out of range for " + this + " with " + children.size() +
          " children");
    }
    List<Node> proposed = new ArrayList<Node>(children);
    proposed.add(position, child);
    checkProposed(proposed);
    children.add(position, child);
    child.parent = this;
  }

  /**
   * Insert several children starting at position, all or nothing
   */
  public void addChildren(List<? extends Node> newChildren, int position) {
    for (Node child: newChildren) {
      checkAttachable(child);
    }
    if (position < 0 || position > children.size()) {
      throw new InvalidTreeShapeException("Position " + position +
          " out of range for " + this);
    }
    List<Node> proposed = new ArrayList<Node>(children);
    proposed.addAll(position, newChildren);
    checkProposed(proposed);
    children.addAll(position, newChildren);
    for (Node child: newChildren) {
      child.parent = this;
    }
  }

  public void removeChild(Node child) {
    int position = indexOfChild(child);
    if (position < 0) {
      throw new InvalidTreeShapeException(child + " is not a child of " +
                                          this);
    }
    List<Node> proposed = new ArrayList<Node>(children);
    proposed.remove(position);
    checkProposed(proposed);
    children.remove(position);
    child.parent = null;
  }

  /**
   * Remove this node from its parent
   * @return this node
   */
  public Node detach() {
    if (parent != null) {
      parent.removeChild(this);
    }
    return this;
  }

  /**
   * Put replacement in this node's place in its parent.  This node is
   * left detached.
   */
  public void replaceWith(Node replacement) {
    if (parent == null) {
      throw new InvalidTreeShapeException("Cannot replace " + this +
                                          ": it has no parent");
    }
    parent.checkAttachable(replacement);
    int position = getPosition();
    List<Node> proposed = new ArrayList<Node>(parent.children);
    proposed.set(position, replacement);
    parent.checkProposed(proposed);
    parent.children.set(position, replacement);
    replacement.parent = parent;
    this.parent = null;
  }

  private void checkAttachable(Node child) {
    if (child == null) {
      throw new InvalidTreeShapeException("Null child for " + this);
    }
    if (child.parent != null) {
      throw new InvalidTreeShapeException(child + " already has a parent (" +
          child.parent + "): detach it first");
    }
    for (Node n = this; n != null; n = n.parent) {
      if (n == child) {
        throw new InvalidTreeShapeException("Adding " + child + " to " + this +
                                            " would create a cycle");
      }
    }
  }

  private void checkProposed(List<Node> proposed) {
    String problem = checkChildren(proposed);
    if (problem != null) {
      throw new InvalidTreeShapeException("Invalid children for " + this +
                                          ": " + problem);
    }
  }

  private int indexOfChild(Node child) {
    // Identity, not equals
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Deep copy of this subtree.  The copy is detached and refers to the
   * same symbols, except where a copied scope owns them.
   */
  public Node copy() {
    Node clone = shallowCopy();
    clone.annotations.addAll(annotations);
    clone.line = line;
    for (Node child: children) {
      Node childCopy = child.copy();
      clone.children.add(childCopy);
      childCopy.parent = clone;
    }
    return clone;
  }

  /**
   * @return symbols targeted by this node itself, not its children
   */
  public List<Symbol> getSymbols() {
    return Collections.emptyList();
  }

  /**
   * @return true if this node itself (not its children) targets the symbol
   */
  public boolean refersTo(Symbol symbol) {
    for (Symbol s: getSymbols()) {
      if (s == symbol) {
        return true;
      }
    }
    return false;
  }

  /**
   * Rebind symbols this node itself targets
   */
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    // Most nodes have none
  }

  /**
   * Lazy depth-first pre-order traversal of this subtree, this node
   * included.  Each call starts a new traversal.  Don't mutate the tree
   * until the traversal has finished: use {@link #walkList} for that.
   * @param kinds kinds to yield; all kinds if none given
   */
  public Iterable<Node> walk(NodeKind... kinds) {
    final EnumSet<NodeKind> filter = kindSet(kinds);
    final Node root = this;
    return new Iterable<Node>() {
      @Override
      public Iterator<Node> iterator() {
        return new DepthFirstIterator(root, filter);
      }
    };
  }

  public Iterable<Node> walk(EnumSet<NodeKind> kinds) {
    return walk(kinds.toArray(new NodeKind[kinds.size()]));
  }

  /**
   * Like walk, but collect results into a list so tree can be modified
   */
  public List<Node> walkList(NodeKind... kinds) {
    return Lists.newArrayList(walk(kinds));
  }

  public List<Node> walkList(EnumSet<NodeKind> kinds) {
    return Lists.newArrayList(walk(kinds));
  }

  private static EnumSet<NodeKind> kindSet(NodeKind... kinds) {
    if (kinds.length == 0) {
      return EnumSet.allOf(NodeKind.class);
    }
    EnumSet<NodeKind> set = EnumSet.noneOf(NodeKind.class);
    for (NodeKind k: kinds) {
      set.add(k);
    }
    return set;
  }

  public Node ancestor(NodeKind kind) {
    return ancestor(EnumSet.of(kind), null, false);
  }

  public Node ancestor(EnumSet<NodeKind> kinds) {
    return ancestor(kinds, null, false);
  }

  /**
   * Find nearest enclosing node of one of the given kinds.
   * @param kinds
   * @param excluding stop searching, returning null, at nodes of these
   *                  kinds (may be null)
   * @param includeSelf whether this node is a candidate
   * @return the ancestor, or null
   */
  public Node ancestor(EnumSet<NodeKind> kinds, EnumSet<NodeKind> excluding,
                       boolean includeSelf) {
    Node curr = includeSelf ? this : parent;
    while (curr != null) {
      if (kinds.contains(curr.kind())) {
        return curr;
      }
      if (excluding != null && excluding.contains(curr.kind())) {
        return null;
      }
      curr = curr.parent;
    }
    return null;
  }

  /**
   * @return nearest scope, this node included
   */
  public ScopingNode scope() {
    ScopingNode scope = (ScopingNode)ancestor(NodeKind.SCOPES, null, true);
    if (scope == null) {
      throw new SCTRuntimeError("Unable to find a scope for " + this +
                                ": it is not inside a routine or container");
    }
    return scope;
  }

  /**
   * @return symbol table of nearest scope
   */
  public SymbolTable getSymbolTable() {
    return scope().getSymbolTable();
  }

  /**
   * @return position among siblings, 0 if no parent
   */
  public int getPosition() {
    if (parent == null) {
      return 0;
    }
    int pos = parent.indexOfChild(this);
    if (pos < 0) {
      throw new SCTRuntimeError("Broken parent link for " + this);
    }
    return pos;
  }

  /**
   * @return children of the parent, or just this node at a root
   */
  public List<Node> getSiblings() {
    if (parent == null) {
      return Collections.singletonList(this);
    }
    return parent.getChildren();
  }

  /**
   * @return following sibling, or null
   */
  public Node nextSibling() {
    if (parent == null) {
      return null;
    }
    int pos = getPosition();
    return pos + 1 < parent.children.size() ? parent.children.get(pos + 1)
                                            : null;
  }

  /**
   * @return pre-order index of this node counting from the root (0)
   */
  public int getAbsPosition() {
    Node root = getRoot();
    int i = 0;
    for (Node n: root.walk()) {
      if (n == this) {
        return i;
      }
      i++;
    }
    throw new SCTRuntimeError("Node " + this + " not found under its root");
  }

  /**
   * @return number of ancestors, 0 for a root
   */
  public int getDepth() {
    int depth = 0;
    for (Node n = parent; n != null; n = n.parent) {
      depth++;
    }
    return depth;
  }

  public Node getRoot() {
    Node n = this;
    while (n.parent != null) {
      n = n.parent;
    }
    return n;
  }

  /**
   * @return true if this node comes before other in pre-order
   * @throws IllegalArgumentException if they are in different trees
   */
  public boolean isBefore(Node other) {
    if (getRoot() != other.getRoot()) {
      throw new IllegalArgumentException(this + " and " + other +
                                         " are not in the same tree");
    }
    return getAbsPosition() < other.getAbsPosition();
  }

  /**
   * @return true if this node is other or inside it
   */
  public boolean isDescendantOf(Node other) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == other) {
        return true;
      }
    }
    return false;
  }

  public List<String> getAnnotations() {
    return Collections.unmodifiableList(annotations);
  }

  public void addAnnotation(String annotation) {
    annotations.add(annotation);
  }

  public boolean hasAnnotation(String annotation) {
    return annotations.contains(annotation);
  }

  public int getLine() {
    return line;
  }

  public void setLine(int line) {
    this.line = line;
  }

  /**
   * Text describing this node alone, e.g. for error messages
   */
  protected String describe() {
    return "";
  }

  @Override
  public String toString() {
    String desc = describe();
    String name = getClass().getSimpleName();
    return desc.isEmpty() ? name : name + "[" + desc + "]";
  }

  /**
   * Indented dump of the subtree, used for trace logging
   */
  public String debugString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }

  public void prettyPrint(StringBuilder sb, String currentIndent) {
    sb.append(currentIndent);
    sb.append(toString());
    sb.append("\n");
    for (Node child: children) {
      child.prettyPrint(sb, currentIndent + "  ");
    }
  }

  /** Helpers for child contracts */

  protected static String expectKind(List<Node> proposed, int i,
                                     NodeKind kind, String role) {
    if (proposed.size() > i && proposed.get(i).kind() != kind) {
      return role + " must be a " + kind + " but found " + proposed.get(i);
    }
    return null;
  }

  protected static String expectExpression(List<Node> proposed, int i,
                                           String role) {
    if (proposed.size() > i && !proposed.get(i).kind().isExpression()) {
      return role + " must be an expression but found " + proposed.get(i);
    }
    return null;
  }

  protected static String expectMax(List<Node> proposed, int max) {
    if (proposed.size() > max) {
      return "at most " + max + " children allowed but found " +
             proposed.size();
    }
    return null;
  }

  protected static String firstProblem(String... problems) {
    for (String p: problems) {
      if (p != null) {
        return p;
      }
    }
    return null;
  }
}
