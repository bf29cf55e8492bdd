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
package exm.sct.ir.symbols;

import com.google.common.base.Preconditions;

/**
 * How a symbol is made available in its scope
 */
public abstract class SymbolInterface {

  /** Intent of a routine argument */
  public enum Access {
    READ,
    WRITE,
    READWRITE,
    UNKNOWN;
  }

  private static final SymbolInterface LOCAL = new LocalInterface();
  private static final SymbolInterface UNRESOLVED = new UnresolvedInterface();

  public static SymbolInterface local() {
    return LOCAL;
  }

  public static SymbolInterface unresolved() {
    return UNRESOLVED;
  }

  public static SymbolInterface argument(Access access) {
    return new ArgumentInterface(access);
  }

  public static SymbolInterface imported(ContainerSymbol container) {
    return new ImportInterface(container);
  }

  public boolean isLocal() {
    return false;
  }

  public boolean isArgument() {
    return false;
  }

  public boolean isImport() {
    return false;
  }

  public boolean isUnresolved() {
    return false;
  }

  public static class LocalInterface extends SymbolInterface {
    private LocalInterface() {
    }

    @Override
    public boolean isLocal() {
      return true;
    }

    @Override
    public String toString() {
      return "Local";
    }
  }

  public static class UnresolvedInterface extends SymbolInterface {
    private UnresolvedInterface() {
    }

    @Override
    public boolean isUnresolved() {
      return true;
    }

    @Override
    public String toString() {
      return "Unresolved";
    }
  }

  public static class ArgumentInterface extends SymbolInterface {
    private final Access access;

    private ArgumentInterface(Access access) {
      Preconditions.checkNotNull(access);
      this.access = access;
    }

    public Access access() {
      return access;
    }

    @Override
    public boolean isArgument() {
      return true;
    }

    @Override
    public String toString() {
      return "Argument(" + access + ")";
    }
  }

  public static class ImportInterface extends SymbolInterface {
    private final ContainerSymbol container;

    private ImportInterface(ContainerSymbol container) {
      Preconditions.checkNotNull(container);
      this.container = container;
    }

    public ContainerSymbol container() {
      return container;
    }

    @Override
    public boolean isImport() {
      return true;
    }

    @Override
    public String toString() {
      return "Import(" + container.getName() + ")";
    }
  }
}
