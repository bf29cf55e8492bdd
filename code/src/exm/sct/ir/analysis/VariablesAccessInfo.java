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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Member;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.StructureReference;

/**
 * Accesses to all variables within some nodes, keyed by signature.  Both
 * signatures and the accesses of each are in execution order.
 *
 * Built from the tree as it is at construction: build a new one after
 * any change to the tree.
 */
public class VariablesAccessInfo {
  private final ListMultimap<Signature, AccessInfo> accesses =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  private final Map<Signature, Symbol> symbols =
                                  new HashMap<Signature, Symbol>();

  /** True if some code could not be analysed precisely */
  private boolean opaqueAccess = false;

  public VariablesAccessInfo(Node node) {
    this(Collections.singletonList(node));
  }

  public VariablesAccessInfo(List<? extends Node> nodes) {
    for (Node n: nodes) {
      visit(n);
    }
  }

  private void add(Signature sig, Symbol sym, AccessType type, Node node) {
    accesses.put(sig, new AccessInfo(type, node));
    if (!symbols.containsKey(sig)) {
      symbols.put(sig, sym);
    }
  }

  private void visit(Node node) {
    switch (node.kind()) {
      case CONTAINER:
      case ROUTINE:
      case SCHEDULE:
      case IF_BLOCK:
      case DIRECTIVE:
      case EXTRACT_REGION:
      case PROFILE_REGION:
        visitChildren(node);
        break;
      case ASSIGNMENT:
        visitAssignment((Assignment)node);
        break;
      case LOOP:
        visitLoop((Loop)node);
        break;
      case CALL:
        visitCall((Call)node);
        break;
      case RETURN:
        break;
      case CODE_BLOCK:
        opaqueAccess = true;
        addOpaque(node);
        break;
      case HALO_EXCHANGE:
      case GLOBAL_REDUCTION:
        addOpaque(node);
        break;
      case REFERENCE:
      case ARRAY_REFERENCE:
      case STRUCTURE_REFERENCE:
        visitReference((Reference)node, AccessType.READ);
        break;
      case MEMBER:
      case LITERAL:
      case UNARY_OPERATION:
      case BINARY_OPERATION:
      case INTRINSIC_CALL:
      case RANGE:
        visitChildren(node);
        break;
      default:
        throw new SCTRuntimeError("Unexpected node kind " + node.kind());
    }
  }

  private void visitChildren(Node node) {
    for (Node child: node.getChildren()) {
      visit(child);
    }
  }

  private void visitAssignment(Assignment a) {
    Reference lhs = a.getLhs();
    visitSubscripts(lhs);
    Signature lhsSig = Signature.of(lhs);
    boolean readInValue = false;
    for (Node n: a.getRhs().walk(NodeKind.REFERENCES)) {
      if (Signature.of((Reference)n).equals(lhsSig)) {
        readInValue = true;
        break;
      }
    }
    visit(a.getRhs());
    add(lhsSig, lhs.getSymbol(),
        readInValue ? AccessType.READWRITE : AccessType.WRITE, lhs);
  }

  private void visitLoop(Loop loop) {
    visit(loop.getStartExpr());
    visit(loop.getStopExpr());
    visit(loop.getStepExpr());
    DataSymbol var = loop.getVariable();
    add(new Signature(var.getName()), var, AccessType.READWRITE, loop);
    visit(loop.getLoopBody());
  }

  private void visitCall(Call call) {
    for (Node arg: call.getArguments()) {
      if (arg.kind().isReference()) {
        // Intent of the callee is not known
        visitReference((Reference)arg, AccessType.READWRITE);
      } else {
        visit(arg);
      }
    }
  }

  private void visitReference(Reference ref, AccessType type) {
    visitSubscripts(ref);
    add(Signature.of(ref), ref.getSymbol(), type, ref);
  }

  /**
   * Subscripts of an accessed reference are read
   */
  private void visitSubscripts(Reference ref) {
    if (ref.kind() == NodeKind.STRUCTURE_REFERENCE) {
      Member m = ((StructureReference)ref).getMember();
      while (m != null) {
        for (Node index: m.getIndices()) {
          visit(index);
        }
        m = m.getNext();
      }
    } else {
      visitChildren(ref);
    }
  }

  /**
   * Record every symbol a construct names as both read and written
   */
  private void addOpaque(Node node) {
    for (Symbol s: node.getSymbols()) {
      if (s instanceof DataSymbol) {
        add(new Signature(s.getName()), s, AccessType.READWRITE, node);
      }
    }
  }

  /**
   * @return all accessed signatures, in order of first access
   */
  public List<Signature> getSignatures() {
    return new ArrayList<Signature>(accesses.keySet());
  }

  public boolean has(Signature sig) {
    return accesses.containsKey(sig);
  }

  /**
   * @return accesses to signature, or null if it isn't accessed
   */
  public SingleVariableAccessInfo get(Signature sig) {
    if (!accesses.containsKey(sig)) {
      return null;
    }
    return new SingleVariableAccessInfo(sig, symbols.get(sig),
                                        accesses.get(sig));
  }

  public List<SingleVariableAccessInfo> all() {
    List<SingleVariableAccessInfo> result =
                    new ArrayList<SingleVariableAccessInfo>();
    for (Signature sig: accesses.keySet()) {
      result.add(get(sig));
    }
    return result;
  }

  public boolean isRead(Signature sig) {
    return has(sig) && get(sig).isRead();
  }

  public boolean isWritten(Signature sig) {
    return has(sig) && get(sig).isWritten();
  }

  /**
   * @return true if the signature, an enclosing structure or one of its
   *         components is written
   */
  public boolean isWrittenOverlapping(Signature sig) {
    for (Signature written: getWrittenSignatures()) {
      if (written.overlaps(sig)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return true if any variable with this name, including any of its
   *         members, is written
   */
  public boolean isVariableWritten(String varName) {
    for (Signature sig: accesses.keySet()) {
      if (sig.getVarName().equalsIgnoreCase(varName) && get(sig).isWritten()) {
        return true;
      }
    }
    return false;
  }

  public List<Signature> getWrittenSignatures() {
    List<Signature> result = new ArrayList<Signature>();
    for (Signature sig: accesses.keySet()) {
      if (get(sig).isWritten()) {
        result.add(sig);
      }
    }
    return result;
  }

  public List<Signature> getReadSignatures() {
    List<Signature> result = new ArrayList<Signature>();
    for (Signature sig: accesses.keySet()) {
      if (get(sig).isRead()) {
        result.add(sig);
      }
    }
    return result;
  }

  /**
   * @return true if the code contains constructs such as code blocks whose
   *         accesses are not known.  Such code must be assumed to conflict
   *         with everything.
   */
  public boolean hasOpaqueAccess() {
    return opaqueAccess;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Signature sig: accesses.keySet()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      SingleVariableAccessInfo info = get(sig);
      sb.append(sig);
      sb.append(": ");
      if (info.isRead() && info.isWritten()) {
        sb.append("READ+WRITE");
      } else if (info.isWritten()) {
        sb.append("WRITE");
      } else {
        sb.append("READ");
      }
    }
    return sb.toString();
  }
}
