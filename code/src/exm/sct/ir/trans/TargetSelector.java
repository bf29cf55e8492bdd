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
import java.util.List;

import com.google.common.collect.Lists;

import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Routine;

/**
 * Chooses the nodes in a tree that a scripted transformation is applied
 * to.  Selection happens before any change to the tree.
 */
public abstract class TargetSelector {

  public static final String ALL_LOOPS = "loops";
  public static final String OUTER_LOOPS = "outer_loops";
  public static final String INNER_LOOPS = "inner_loops";
  public static final String ROUTINE_BODY = "routine_body";
  public static final String INTRINSICS = "intrinsics";

  /**
   * @return targets in the order to apply them
   */
  public abstract List<Node> select(Node root);

  public abstract String describe();

  @Override
  public String toString() {
    return describe();
  }

  /**
   * Every loop, outermost first
   */
  public static TargetSelector allLoops() {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        return root.walkList(NodeKind.LOOP);
      }

      @Override
      public String describe() {
        return ALL_LOOPS;
      }
    };
  }

  /**
   * Loops not nested in another loop
   */
  public static TargetSelector outerLoops() {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Node loop: root.walk(NodeKind.LOOP)) {
          if (loop.ancestor(NodeKind.LOOP) == null) {
            result.add(loop);
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return OUTER_LOOPS;
      }
    };
  }

  /**
   * Loops with no loop inside them
   */
  public static TargetSelector innerLoops() {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Node loop: root.walk(NodeKind.LOOP)) {
          if (loop.walkList(NodeKind.LOOP).size() == 1) {
            result.add(loop);
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return INNER_LOOPS;
      }
    };
  }

  /**
   * All statements directly in the body of each routine
   */
  public static TargetSelector routineBodies() {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Node routine: root.walk(NodeKind.ROUTINE)) {
          for (Node stmt: routine.getChildren()) {
            if (stmt.kind() != NodeKind.RETURN) {
              result.add(stmt);
            }
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return ROUTINE_BODY;
      }
    };
  }

  /**
   * Calls to an intrinsic, or to any intrinsic if null, in reverse order
   * so that nested calls come before the calls containing them
   */
  public static TargetSelector intrinsicCalls(final Intrinsic intrinsic) {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Node call: Lists.reverse(root.walkList(NodeKind.INTRINSIC_CALL))) {
          if (intrinsic == null ||
              ((IntrinsicCall)call).getIntrinsic() == intrinsic) {
            result.add(call);
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return intrinsic == null ? INTRINSICS :
                          INTRINSICS + "(" + intrinsic.name() + ")";
      }
    };
  }

  /**
   * Restrict another selector to routines with a name
   */
  public static TargetSelector inRoutine(final String routineName,
                                         final TargetSelector inner) {
    return new TargetSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Node routine: root.walk(NodeKind.ROUTINE)) {
          if (((Routine)routine).getName().equalsIgnoreCase(routineName)) {
            result.addAll(inner.select(routine));
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return inner.describe() + " in " + routineName;
      }
    };
  }

  /**
   * @param name one of the selector names
   * @param intrinsic intrinsic for the intrinsics selector, may be null
   */
  public static TargetSelector fromName(String name, Intrinsic intrinsic)
                                            throws InvalidOptionException {
    String lower = name.toLowerCase();
    if (lower.equals(ALL_LOOPS)) {
      return allLoops();
    } else if (lower.equals(OUTER_LOOPS)) {
      return outerLoops();
    } else if (lower.equals(INNER_LOOPS)) {
      return innerLoops();
    } else if (lower.equals(ROUTINE_BODY)) {
      return routineBodies();
    } else if (lower.equals(INTRINSICS)) {
      return intrinsicCalls(intrinsic);
    } else {
      throw new InvalidOptionException("Unknown target '" + name +
          "': expected one of " + ALL_LOOPS + ", " + OUTER_LOOPS + ", " +
          INNER_LOOPS + ", " + ROUTINE_BODY + ", " + INTRINSICS);
    }
  }
}
