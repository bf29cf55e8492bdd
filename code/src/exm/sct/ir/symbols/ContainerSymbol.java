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

/**
 * Symbol for a module that other scopes import from
 */
public class ContainerSymbol extends Symbol {
  /** True if every public name of the module is imported */
  private boolean wildcardImport;

  public ContainerSymbol(String name) {
    this(name, false);
  }

  public ContainerSymbol(String name, boolean wildcardImport) {
    super(name);
    this.wildcardImport = wildcardImport;
  }

  public boolean hasWildcardImport() {
    return wildcardImport;
  }

  public void setWildcardImport(boolean wildcardImport) {
    this.wildcardImport = wildcardImport;
  }

  @Override
  public ContainerSymbol copy() {
    return new ContainerSymbol(getName(), wildcardImport);
  }

  @Override
  public String toString() {
    return getName() + ": ContainerSymbol<" +
           (wildcardImport ? "wildcard" : "explicit") + ">";
  }
}
