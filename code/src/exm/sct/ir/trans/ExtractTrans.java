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
import java.util.EnumSet;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Predicate;

import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.ir.analysis.ReadWriteInfo;
import exm.sct.ir.analysis.Signature;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.tree.ExtractNode;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * Enclose statements in an extract region, which captures the values of
 * every variable the region reads before it runs and of every variable it
 * writes afterwards.
 *
 * Options:
 *  "prefix": prefix of the PSyData symbols, default from settings
 *  "region_name": "module:region", default derived from the enclosing
 *                 module and routine
 */
public class ExtractTrans extends RegionTrans {
  public static final String PREFIX = "prefix";
  public static final String REGION_NAME = "region_name";

  private static final Logger logger = Logging.getSCTLogger();

  /** Communication can't be replayed from captured data */
  public static final Predicate<Node> DISTRIBUTED_MEMORY_NODES =
      new Predicate<Node>() {
    @Override
    public boolean apply(Node n) {
      return NodeKind.DISTRIBUTED_MEMORY.contains(n.kind());
    }
  };

  private final boolean distributedMemory;
  private final String defaultPrefix;
  private final Predicate<Node> illegalEnclosed;

  public ExtractTrans(Settings settings) {
    this(settings, DISTRIBUTED_MEMORY_NODES);
  }

  /**
   * @param illegalEnclosed nodes that may not be in the region when
   *                        distributed memory is active
   */
  public ExtractTrans(Settings settings, Predicate<Node> illegalEnclosed) {
    this.distributedMemory = settings.isDistributedMemoryActive();
    this.defaultPrefix = settings.get(Settings.EXTRACT_PREFIX);
    this.illegalEnclosed = illegalEnclosed;
  }

  @Override
  public String name() {
    return "ExtractTrans";
  }

  @Override
  public String description() {
    return "Create a region whose inputs and outputs are captured";
  }

  @Override
  protected EnumSet<NodeKind> excludedKinds() {
    return EnumSet.of(NodeKind.EXTRACT_REGION);
  }

  @Override
  public void validate(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException {
    checkRegion(nodes);
    if (distributedMemory) {
      for (Node n: nodes) {
        for (Node inner: n.walk()) {
          if (illegalEnclosed.apply(inner)) {
            throw new TransformationException("Nodes of type " +
                inner.kind() + " cannot be enclosed by a " + name() +
                " when distributed memory is enabled");
          }
        }
      }
    }
    String prefix = options.getString(PREFIX, defaultPrefix);
    if (prefix == null || !prefix.matches("[A-Za-z][A-Za-z0-9_]*")) {
      throw new TransformationException("Option " + PREFIX + " of " + name() +
          " must be a valid identifier but was '" + prefix + "'");
    }
    if (options.has(REGION_NAME)) {
      parseRegionName(options.getString(REGION_NAME, null));
    }
  }

  @Override
  public void apply(List<? extends Node> nodes,
          TransformationOptions options) throws TransformationException {
    validate(nodes, options);
    Node first = nodes.get(0);
    String moduleName;
    String regionName;
    if (options.has(REGION_NAME)) {
      String[] names = parseRegionName(options.getString(REGION_NAME, null));
      moduleName = names[0];
      regionName = names[1];
    } else {
      moduleName = defaultModuleName(first);
      regionName = defaultRegionName(first, NodeKind.EXTRACT_REGION);
    }

    // Analyse before the tree changes
    ReadWriteInfo rw = new ReadWriteInfo(nodes);
    List<String> inputs = new ArrayList<String>();
    for (Signature sig: rw.getInputs()) {
      inputs.add(sig.toString());
    }
    List<String> outputs = new ArrayList<String>();
    for (Signature sig: rw.getOutputs()) {
      outputs.add(sig.toString());
    }

    String prefix = options.getString(PREFIX, defaultPrefix);
    DataSymbol psyData = psyDataVariable(regionTable(first), prefix);
    ExtractNode region = new ExtractNode(psyData, moduleName, regionName,
                                         inputs, outputs);
    region.setLine(first.getLine());
    wrap(nodes, region);
    logger.debug("Extract region " + moduleName + ":" + regionName +
                 " inputs: " + inputs + " outputs: " + outputs);
  }
}
