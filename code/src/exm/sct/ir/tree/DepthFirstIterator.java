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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;

import com.google.common.collect.AbstractIterator;

/**
 * Iterates over a subtree in depth-first pre-order, starting with the root,
 * yielding only nodes whose kind is in the filter.
 *
 * The tree must not be mutated while an iteration is in progress.
 */
class DepthFirstIterator extends AbstractIterator<Node> {
  private final Deque<Node> stack = new ArrayDeque<Node>();
  private final EnumSet<NodeKind> filter;

  DepthFirstIterator(Node root, EnumSet<NodeKind> filter) {
    this.filter = filter;
    stack.push(root);
  }

  @Override
  protected Node computeNext() {
    while (!stack.isEmpty()) {
      Node curr = stack.pop();
      // Push in reverse so that first child is visited first
      List<Node> children = curr.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
      if (filter.contains(curr.kind())) {
        return curr;
      }
    }
    return endOfData();
  }
}
