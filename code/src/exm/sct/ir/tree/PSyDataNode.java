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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;

/**
 * Region of code wrapped in calls to a PSyData API object, which is
 * identified by module and region name
 */
public abstract class PSyDataNode extends Node {
  private DataSymbol psyDataSymbol;
  private final String moduleName;
  private final String regionName;

  protected PSyDataNode(DataSymbol psyDataSymbol, String moduleName,
                        String regionName) {
    Preconditions.checkNotNull(psyDataSymbol);
    Preconditions.checkNotNull(moduleName);
    Preconditions.checkNotNull(regionName);
    this.psyDataSymbol = psyDataSymbol;
    this.moduleName = moduleName;
    this.regionName = regionName;
  }

  public DataSymbol getPSyDataSymbol() {
    return psyDataSymbol;
  }

  public String getModuleName() {
    return moduleName;
  }

  public String getRegionName() {
    return regionName;
  }

  public Schedule getBody() {
    return (Schedule)getChild(0);
  }

  @Override
  public List<Symbol> getSymbols() {
    return Collections.<Symbol>singletonList(psyDataSymbol);
  }

  @Override
  void rebindSymbols(Map<Symbol, Symbol> renames) {
    if (renames.containsKey(psyDataSymbol)) {
      psyDataSymbol = (DataSymbol)renames.get(psyDataSymbol);
    }
  }

  @Override
  protected String checkChildren(List<Node> proposed) {
    return firstProblem(expectMax(proposed, 1),
                        expectKind(proposed, 0, NodeKind.SCHEDULE, "body"));
  }

  @Override
  protected int minChildren() {
    return 1;
  }

  @Override
  protected String describe() {
    return moduleName + ":" + regionName;
  }
}
