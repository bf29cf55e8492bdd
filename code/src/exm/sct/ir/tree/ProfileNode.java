package exm.sct.ir.tree;

import exm.sct.ir.symbols.DataSymbol;

/**
 * Region timed through the PSyData profiling API
 */
public class ProfileNode extends PSyDataNode {

  public ProfileNode(DataSymbol psyDataSymbol, String moduleName,
                     String regionName) {
    super(psyDataSymbol, moduleName, regionName);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PROFILE_REGION;
  }

  @Override
  protected Node shallowCopy() {
    return new ProfileNode(getPSyDataSymbol(), getModuleName(),
                           getRegionName());
  }
}
