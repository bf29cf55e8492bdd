package exm.sct.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sct.ir.symbols.DataSymbol;

/**
 * Region whose input values are captured before and output values after
 * it runs.  Inputs and outputs are access signatures such as "a" or "a%b".
 */
public class ExtractNode extends PSyDataNode {
  private final List<String> inputs;
  private final List<String> outputs;

  public ExtractNode(DataSymbol psyDataSymbol, String moduleName,
                     String regionName, List<String> inputs,
                     List<String> outputs) {
    super(psyDataSymbol, moduleName, regionName);
    this.inputs = Collections.unmodifiableList(new ArrayList<String>(inputs));
    this.outputs = Collections.unmodifiableList(new ArrayList<String>(outputs));
  }

  @Override
  public NodeKind kind() {
    return NodeKind.EXTRACT_REGION;
  }

  public List<String> getInputs() {
    return inputs;
  }

  public List<String> getOutputs() {
    return outputs;
  }

  @Override
  protected Node shallowCopy() {
    return new ExtractNode(getPSyDataSymbol(), getModuleName(),
                           getRegionName(), inputs, outputs);
  }
}
