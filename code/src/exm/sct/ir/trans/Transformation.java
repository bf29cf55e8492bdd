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

import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.tree.Node;

/**
 * A rewrite of an IR subtree.
 *
 * Transformations are stateless and can be reused.  {@link #validate} never
 * changes the tree.  {@link #apply} validates first, so it is always safe to
 * call directly: either it rewrites the tree completely, leaving it valid,
 * or it throws before changing anything.
 */
public abstract class Transformation {

  /**
   * @return name used to select the transformation, e.g. in scripts
   */
  public abstract String name();

  /**
   * @return one-line description
   */
  public abstract String description();

  /**
   * Check that the transformation can be applied
   * @throws TransformationException with the reason if it can't
   */
  public abstract void validate(Node target, TransformationOptions options)
                                              throws TransformationException;

  public abstract void apply(Node target, TransformationOptions options)
                                              throws TransformationException;

  public void validate(Node target) throws TransformationException {
    validate(target, TransformationOptions.EMPTY);
  }

  public void apply(Node target) throws TransformationException {
    apply(target, TransformationOptions.EMPTY);
  }

  @Override
  public String toString() {
    return name();
  }
}
