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
import java.util.List;

import exm.sct.ir.symbols.Symbol;

/**
 * All accesses to one signature, in execution order
 */
public class SingleVariableAccessInfo {
  private final Signature signature;
  private final Symbol symbol;
  private final List<AccessInfo> accesses;

  SingleVariableAccessInfo(Signature signature, Symbol symbol,
                           List<AccessInfo> accesses) {
    this.signature = signature;
    this.symbol = symbol;
    this.accesses = Collections.unmodifiableList(
                            new ArrayList<AccessInfo>(accesses));
  }

  public Signature getSignature() {
    return signature;
  }

  /**
   * @return the symbol of the accessed variable
   */
  public Symbol getSymbol() {
    return symbol;
  }

  public List<AccessInfo> getAccesses() {
    return accesses;
  }

  public AccessInfo firstAccess() {
    return accesses.get(0);
  }

  public boolean isRead() {
    for (AccessInfo a: accesses) {
      if (a.getType().isRead()) {
        return true;
      }
    }
    return false;
  }

  public boolean isWritten() {
    for (AccessInfo a: accesses) {
      if (a.getType().isWrite()) {
        return true;
      }
    }
    return false;
  }

  public boolean isReadOnly() {
    return !isWritten();
  }

  /**
   * @return true if the value before the accesses may be used: the first
   *         access reads, and isn't a loop setting its own variable
   */
  public boolean isReadFirst() {
    AccessInfo first = firstAccess();
    return first.getType().isRead() && !first.isLoopVariable();
  }

  @Override
  public String toString() {
    return signature + ": " + accesses;
  }
}
