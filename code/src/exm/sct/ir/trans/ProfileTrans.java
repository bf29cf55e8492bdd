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

import java.util.EnumSet;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.ProfileNode;

/**
 * Enclose statements in a profiling region.  Options as for
 * {@link ExtractTrans}, with the prefix defaulting to the profile prefix.
 */
public class ProfileTrans extends RegionTrans {
  private static final Logger logger = Logging.getSCTLogger();

  private final String defaultPrefix;

  public ProfileTrans(Settings settings) {
    this.defaultPrefix = settings.get(Settings.PROFILE_PREFIX);
  }

  @Override
  public String name() {
    return "ProfileTrans";
  }

  @Override
  public String description() {
    return "Create a region that is timed by a profiling library";
  }

  @Override
  protected EnumSet<NodeKind> excludedKinds() {
    return EnumSet.of(NodeKind.PROFILE_REGION);
  }

  @Override
  public void validate(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException {
    checkRegion(nodes);
    if (options.has(ExtractTrans.REGION_NAME)) {
      parseRegionName(options.getString(ExtractTrans.REGION_NAME, null));
    }
  }

  @Override
  public void apply(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException {
    validate(nodes, options);
    Node first = nodes.get(0);
    String moduleName = defaultModuleName(first);
    String regionName = defaultRegionName(first, NodeKind.PROFILE_REGION);
    if (options.has(ExtractTrans.REGION_NAME)) {
      String[] names = parseRegionName(
                  options.getString(ExtractTrans.REGION_NAME, null));
      moduleName = names[0];
      regionName = names[1];
    }
    String prefix = options.getString(ExtractTrans.PREFIX, defaultPrefix);
    DataSymbol psyData = psyDataVariable(regionTable(first), prefix);
    ProfileNode region = new ProfileNode(psyData, moduleName, regionName);
    region.setLine(first.getLine());
    wrap(nodes, region);
    logger.debug("Profile region " + moduleName + ":" + regionName);
  }
}
