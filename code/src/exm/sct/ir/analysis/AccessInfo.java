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

import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * One access: its type and the node that performs it
 */
public class AccessInfo {
  private final AccessType type;
  private final Node node;

  public AccessInfo(AccessType type, Node node) {
    this.type = type;
    this.node = node;
  }

  public AccessType getType() {
    return type;
  }

  public Node getNode() {
    return node;
  }

  /**
   * @return true if access is the update of a loop variable by its loop
   */
  public boolean isLoopVariable() {
    return node.kind() == NodeKind.LOOP;
  }

  @Override
  public String toString() {
    return type + "@" + node;
  }
}
