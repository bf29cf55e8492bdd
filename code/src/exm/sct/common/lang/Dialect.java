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
package exm.sct.common.lang;

/**
 * Host dialects the IR can come from.  The dialect decides policy that is
 * not universal, such as whether distributed-memory constructs may appear.
 */
public enum Dialect {
  GENERIC(false),
  NEMO(false),
  LFRIC(true),
  GOCEAN(true);

  private final boolean supportsDistributedMemory;

  private Dialect(boolean supportsDistributedMemory) {
    this.supportsDistributedMemory = supportsDistributedMemory;
  }

  public boolean supportsDistributedMemory() {
    return supportsDistributedMemory;
  }

  public static Dialect fromString(String name) {
    for (Dialect d: values()) {
      if (d.name().equalsIgnoreCase(name)) {
        return d;
      }
    }
    return null;
  }
}
