package exm.sct.ir.trans;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sct.backend.FortranWriter;
import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.ExtractNode;
import exm.sct.ir.tree.HaloExchange;
import exm.sct.ir.tree.IRValidator;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.ProfileNode;
import exm.sct.ir.tree.Routine;

public class RegionTransTest {

  private static final String KERNEL =
      "module kernels\n" +
      "contains\n" +
      "  subroutine s(a, b, n)\n" +
      "    integer, intent(in) :: n\n" +
      "    real, dimension(n), intent(in) :: a\n" +
      "    real, dimension(n), intent(out) :: b\n" +
      "    integer :: i\n" +
      "    do i = 1, n\n" +
      "      b(i) = a(i) + 1.0\n" +
      "    end do\n" +
      "    b(1) = 0.0\n" +
      "    b(n) = 0.0\n" +
      "  end subroutine s\n" +
      "end module kernels\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Routine routine(Container root) {
    return (Routine)root.walkList(NodeKind.ROUTINE).get(0);
  }

  private static Container read() throws Exception {
    return new FortranReader().psyirFromSource(KERNEL);
  }

  @Test
  public void testExtractLoop() throws Exception {
    Container root = read();
    Routine s = routine(root);
    new ExtractTrans(Settings.defaultSettings()).apply(s.getChild(0));
    IRValidator.validate(Logging.getSCTLogger(), root);

    ExtractNode region = (ExtractNode)s.getChild(0);
    assertEquals("kernels", region.getModuleName());
    assertEquals("s-r0", region.getRegionName());
    assertEquals(Arrays.asList("n", "a"), region.getInputs());
    assertEquals("Loop variable is an output but not an input",
                 Arrays.asList("i", "b"), region.getOutputs());
    assertEquals(NodeKind.LOOP, region.getBody().getChild(0).kind());

    assertEquals(
        "call extract_psy_data%PreStart(\"kernels\", \"s-r0\", 2, 2)\n" +
        "call extract_psy_data%PreDeclareVariable(\"n\", n)\n" +
        "call extract_psy_data%PreDeclareVariable(\"a\", a)\n" +
        "call extract_psy_data%PreDeclareVariable(\"i_post\", i)\n" +
        "call extract_psy_data%PreDeclareVariable(\"b_post\", b)\n" +
        "call extract_psy_data%PreEndDeclaration\n" +
        "call extract_psy_data%ProvideVariable(\"n\", n)\n" +
        "call extract_psy_data%ProvideVariable(\"a\", a)\n" +
        "call extract_psy_data%PreEnd\n" +
        "do i = 1, n, 1\n" +
        "  b(i) = a(i) + 1.0\n" +
        "end do\n" +
        "call extract_psy_data%PostStart\n" +
        "call extract_psy_data%ProvideVariable(\"i_post\", i)\n" +
        "call extract_psy_data%ProvideVariable(\"b_post\", b)\n" +
        "call extract_psy_data%PostEnd\n",
        new FortranWriter().render(region));

    String text = new FortranWriter().render(root);
    assertTrue(text, text.contains(
        "use extract_psy_data_mod, only: extract_PSyDataType"));
    assertTrue(text, text.contains(
        "type(extract_PSyDataType), save, target :: extract_psy_data"));
  }

  @Test
  public void testExtractOptions() throws Exception {
    Routine s = routine(read());
    TransformationOptions options = TransformationOptions
        .of(ExtractTrans.REGION_NAME, "main:init")
        .with(ExtractTrans.PREFIX, "dump");
    new ExtractTrans(Settings.defaultSettings()).apply(
        Arrays.asList(s.getChild(1), s.getChild(2)), options);
    ExtractNode region = (ExtractNode)s.getChild(1);
    assertEquals("main", region.getModuleName());
    assertEquals("init", region.getRegionName());
    assertEquals("Only n is read before being written",
                 Arrays.asList("n"), region.getInputs());
    assertEquals(Arrays.asList("b"), region.getOutputs());
    assertEquals(2, region.getBody().numChildren());
    assertEquals("dump_psy_data", region.getPSyDataSymbol().getName());
  }

  @Test
  public void testBadRegionName() throws Exception {
    Routine s = routine(read());
    exception.expect(TransformationException.class);
    exception.expectMessage("'module:region'");
    new ExtractTrans(Settings.defaultSettings()).apply(s.getChild(0),
        TransformationOptions.of(ExtractTrans.REGION_NAME, "just_a_name"));
  }

  @Test
  public void testNestedExtract() throws Exception {
    Routine s = routine(read());
    ExtractTrans trans = new ExtractTrans(Settings.defaultSettings());
    Node loop = s.getChild(0);
    trans.apply(loop);
    exception.expect(TransformationException.class);
    exception.expectMessage("inside an existing EXTRACT_REGION");
    trans.apply(loop);
  }

  @Test
  public void testNotConsecutive() throws Exception {
    Routine s = routine(read());
    exception.expect(TransformationException.class);
    exception.expectMessage("not consecutive");
    new ProfileTrans(Settings.defaultSettings()).apply(
        Arrays.asList(s.getChild(0), s.getChild(2)),
        TransformationOptions.EMPTY);
  }

  @Test
  public void testExtractHaloExchangeWithDistributedMemory()
                                                        throws Exception {
    Routine s = routine(read());
    DataSymbol a = (DataSymbol)s.getSymbolTable().lookup("a");
    s.addChild(new HaloExchange(a, 1), 0);
    Settings settings = Settings.defaultSettings()
        .with(Settings.DIALECT, "lfric")
        .with(Settings.DISTRIBUTED_MEMORY, "true");
    exception.expect(TransformationException.class);
    exception.expectMessage("when distributed memory is enabled");
    new ExtractTrans(settings).apply(
        Arrays.asList(s.getChild(0), s.getChild(1)),
        TransformationOptions.EMPTY);
  }

  @Test
  public void testProfileRegions() throws Exception {
    Container root = read();
    Routine s = routine(root);
    ProfileTrans trans = new ProfileTrans(Settings.defaultSettings());
    trans.apply(s.getChild(0));
    trans.apply(s.getChild(1));
    IRValidator.validate(Logging.getSCTLogger(), root);

    ProfileNode first = (ProfileNode)s.getChild(0);
    ProfileNode second = (ProfileNode)s.getChild(1);
    assertEquals("s-r0", first.getRegionName());
    assertEquals("s-r1", second.getRegionName());
    assertTrue("Each region has its own variable",
               first.getPSyDataSymbol() != second.getPSyDataSymbol());
    assertEquals("profile_psy_data_1",
                 second.getPSyDataSymbol().getName());

    SymbolTable table = s.getSymbolTable();
    ContainerSymbol mod =
        (ContainerSymbol)table.lookup("profile_psy_data_mod");
    assertEquals(1, table.symbolsImportedFrom(mod).size());

    assertEquals(
        "call profile_psy_data%PreStart(\"kernels\", \"s-r0\", 0, 0)\n" +
        "do i = 1, n, 1\n" +
        "  b(i) = a(i) + 1.0\n" +
        "end do\n" +
        "call profile_psy_data%PostEnd\n",
        new FortranWriter().render(first));
  }

  @Test
  public void testProfileAndExtractNest() throws Exception {
    Container root = read();
    Routine s = routine(root);
    new ExtractTrans(Settings.defaultSettings()).apply(s.getChild(0));
    new ProfileTrans(Settings.defaultSettings()).apply(s.getChild(0));
    IRValidator.validate(Logging.getSCTLogger(), root);
    assertEquals(NodeKind.PROFILE_REGION, s.getChild(0).kind());
    assertEquals(NodeKind.EXTRACT_REGION,
        ((ProfileNode)s.getChild(0)).getBody().getChild(0).kind());
  }

  @Test
  public void testProfileRoutineAndLoopBodies() throws Exception {
    Container root = read();
    Routine s = routine(root);
    Loop loop = (Loop)s.getChild(0);
    Node stmt = loop.getLoopBody().getChild(0);
    ProfileTrans trans = new ProfileTrans(Settings.defaultSettings());
    trans.apply(stmt);
    trans.apply(Arrays.asList(s.getChild(1), s.getChild(2)),
                TransformationOptions.EMPTY);
    IRValidator.validate(Logging.getSCTLogger(), root);
    assertEquals(NodeKind.PROFILE_REGION,
                 loop.getLoopBody().getChild(0).kind());
    assertEquals(2, s.numChildren());
    assertEquals(NodeKind.PROFILE_REGION, s.getChild(1).kind());
  }

  @Test
  public void testRegionWithoutParent() throws Exception {
    Routine s = routine(read());
    Node stmt = s.getChild(1).detach();
    exception.expect(TransformationException.class);
    exception.expectMessage("is not inside a routine or schedule");
    new ExtractTrans(Settings.defaultSettings()).apply(stmt);
  }
}
