package exm.sct.ir.trans;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sct.backend.FortranWriter;
import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.TransformationException;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Routine;

public class LoopTransTest {

  private static final String NEST =
      "subroutine s(a, n, m)\n" +
      "  integer, intent(in) :: n, m\n" +
      "  real, dimension(n, m), intent(inout) :: a\n" +
      "  integer :: i, j\n" +
      "  do i = 1, n\n" +
      "    do j = 1, m\n" +
      "      a(i, j) = 0.0\n" +
      "    end do\n" +
      "  end do\n" +
      "end subroutine s\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Routine routine(String source) throws Exception {
    Container root = new FortranReader().psyirFromSource(source);
    return (Routine)root.walkList(NodeKind.ROUTINE).get(0);
  }

  private static Loop firstLoop(Node root) {
    return (Loop)root.walkList(NodeKind.LOOP).get(0);
  }

  private static String text(Node node) throws Exception {
    return new FortranWriter().render(node);
  }

  @Test
  public void testBlockLoop() throws Exception {
    Routine s = routine(NEST);
    Loop loop = firstLoop(s);
    new BlockLoopTrans(Settings.defaultSettings()).apply(loop);

    assertEquals(
        "do i_out_var = 1, n, 32\n" +
        "  i_el_inner = MIN(i_out_var + 31, n)\n" +
        "  do i = i_out_var, i_el_inner, 1\n" +
        "    do j = 1, m, 1\n" +
        "      a(i, j) = 0.0\n" +
        "    end do\n" +
        "  end do\n" +
        "end do\n", text(s.getChild(0)));

    List<Symbol> symbols = s.getSymbolTable().getSymbols();
    assertEquals("New variables are added to the routine", "i_out_var",
                 symbols.get(symbols.size() - 2).getName());
    assertEquals("i_el_inner", symbols.get(symbols.size() - 1).getName());
    assertTrue(((Loop)s.getChild(0)).hasAnnotation(Loop.BLOCKED));
    assertTrue(loop.hasAnnotation(Loop.BLOCKED));
  }

  @Test
  public void testBlockStepRoundsBlockSize() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 2, n, 2\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s),
        TransformationOptions.of(BlockLoopTrans.BLOCKSIZE, "5"));
    assertEquals(
        "do i_out_var = 2, n, 4\n" +
        "  i_el_inner = MIN(i_out_var + 2, n)\n" +
        "  do i = i_out_var, i_el_inner, 2\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end do\n", text(s.getChild(0)));
  }

  @Test
  public void testBlockNegativeStep() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = n, 1, -1\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
    assertEquals(
        "do i_out_var = n, 1, -32\n" +
        "  i_el_inner = MAX(i_out_var - 31, 1)\n" +
        "  do i = i_out_var, i_el_inner, -1\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end do\n", text(s.getChild(0)));
  }

  /**
   * Elements written by a loop over a(i) from start to stop by step,
   * run with n set
   */
  private static List<String> blockedWrites(String start, String stop,
        int step, int blocksize, int n) throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = " + start + ", " + stop + ", " + step + "\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    StatementInterpreter original = new StatementInterpreter().set("n", n);
    original.run(s);
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s),
        TransformationOptions.of(BlockLoopTrans.BLOCKSIZE,
                                 Integer.toString(blocksize)));
    StatementInterpreter blocked = new StatementInterpreter().set("n", n);
    blocked.run(s);
    assertEquals("Blocked loop visits the same elements in the same order",
                 original.getWrites(), blocked.getWrites());
    return blocked.getWrites();
  }

  private static List<String> elements(int start, int stop, int step) {
    List<String> result = new ArrayList<String>();
    for (int i = start; step > 0 ? i <= stop : i >= stop; i += step) {
      result.add("a(" + i + ")");
    }
    return result;
  }

  @Test
  public void testBlockedIterationOrder() throws Exception {
    assertEquals(elements(1, 100, 1), blockedWrites("1", "n", 1, 32, 100));
    assertEquals(elements(1, 96, 1), blockedWrites("1", "n", 1, 32, 96));
    assertEquals(elements(1, 5, 1), blockedWrites("1", "n", 1, 32, 5));
    assertEquals(elements(1, 1, 1), blockedWrites("1", "n", 1, 32, 1));
    assertTrue(blockedWrites("1", "n", 1, 32, 0).isEmpty());
  }

  @Test
  public void testBlockedIterationOrderWithStep() throws Exception {
    assertEquals(elements(1, 70, 3), blockedWrites("1", "n", 3, 32, 70));
    assertEquals(elements(2, 99, 3), blockedWrites("2", "n", 3, 32, 100));
    assertEquals(elements(1, 20, 3), blockedWrites("1", "n", 3, 4, 20));
    assertEquals(elements(3, 64, 3), blockedWrites("3", "n", 3, 3, 64));
  }

  @Test
  public void testBlockedIterationOrderNegativeStep() throws Exception {
    assertEquals(elements(77, 1, -1), blockedWrites("n", "1", -1, 10, 77));
    assertEquals(elements(50, 3, -2), blockedWrites("n", "3", -2, 7, 50));
  }

  @Test
  public void testTiledNestVisitsEveryElementOnce() throws Exception {
    Routine s = routine(NEST);
    StatementInterpreter original = new StatementInterpreter()
        .set("n", 37).set("m", 19);
    original.run(s);
    new LoopTiling2DTrans(Settings.defaultSettings()).apply(firstLoop(s),
        TransformationOptions.of(LoopTiling2DTrans.TILESIZE, "8"));
    StatementInterpreter tiled = new StatementInterpreter()
        .set("n", 37).set("m", 19);
    tiled.run(s);

    List<String> expected = new ArrayList<String>(original.getWrites());
    List<String> actual = new ArrayList<String>(tiled.getWrites());
    assertEquals(37 * 19, actual.size());
    assertEquals("a(1, 1)", actual.get(0));
    assertEquals("Tile of 8 by 8 completes before the next starts",
                 "a(2, 1)", actual.get(8));
    Collections.sort(expected);
    Collections.sort(actual);
    assertEquals(expected, actual);
  }

  @Test
  public void testBlockNamesAvoidClashes() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i, i_out_var\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
    assertEquals("i_out_var_1", firstLoop(s).getVariable().getName());
  }

  @Test
  public void testBlockNonConstantStep() throws Exception {
    Routine s = routine(
        "subroutine s(a, n, k)\n" +
        "  integer :: n, k, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n, k\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("non-constant step size");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
  }

  @Test
  public void testBlockStepLargerThanBlock() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n, 8\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("(8 > 4)");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s),
        TransformationOptions.of(BlockLoopTrans.BLOCKSIZE, "4"));
  }

  @Test
  public void testBlockTwice() throws Exception {
    Routine s = routine(NEST);
    Loop loop = firstLoop(s);
    BlockLoopTrans trans = new BlockLoopTrans(Settings.defaultSettings());
    trans.apply(loop);
    exception.expect(TransformationException.class);
    exception.expectMessage("already blocked");
    trans.apply(loop);
  }

  @Test
  public void testBlockBodyWritesBound() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    n = n - 1\n" +
        "  end do\n" +
        "end subroutine s\n");
    String before = text(s);
    exception.expect(TransformationException.class);
    exception.expectMessage("'n' is read in the loop bounds");
    try {
      new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
    } finally {
      assertEquals("Tree unchanged by failed transformation", before,
                   text(s));
    }
  }

  private static final String GRID_LOOP =
      "subroutine s(g, h)\n" +
      "  use grid_mod, only: grid_type\n" +
      "  type(grid_type), intent(inout) :: g, h\n" +
      "  integer :: i\n" +
      "  do i = 1, g%%n\n" +
      "    %s\n" +
      "  end do\n" +
      "end subroutine s\n";

  private static void checkBlockRejected(String body) throws Exception {
    Routine s = routine(String.format(GRID_LOOP, body));
    String before = text(s);
    try {
      new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
    } catch (TransformationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "'g%n' is read in the loop bounds or step and written"));
      assertEquals(before, text(s));
      return;
    }
    throw new AssertionError("Blocked a loop whose body '" + body +
                             "' changes its bound");
  }

  @Test
  public void testBlockBodyWritesBoundComponent() throws Exception {
    checkBlockRejected("g%n = 3");
  }

  @Test
  public void testBlockBodyWritesWholeStructure() throws Exception {
    checkBlockRejected("g = h");
  }

  @Test
  public void testBlockBodyPassesStructureToCall() throws Exception {
    checkBlockRejected("call update(g)");
  }

  @Test
  public void testBlockBodyWritesOtherComponent() throws Exception {
    Routine s = routine(String.format(GRID_LOOP, "g%m = i"));
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
    assertEquals("  i_el_inner = MIN(i_out_var + 31, g%n)",
                 text(s.getChild(0)).split("\n")[1]);
  }

  @Test
  public void testSwapBodyWritesBoundStructure() throws Exception {
    Routine s = routine(
        "subroutine s(g, a)\n" +
        "  use grid_mod, only: grid_type\n" +
        "  type(grid_type), intent(inout) :: g\n" +
        "  real, intent(inout) :: a(10, 10)\n" +
        "  integer :: i, j\n" +
        "  do i = 1, 10\n" +
        "    do j = 1, g%n\n" +
        "      call reset(g)\n" +
        "    end do\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("'g%n' is read in the loop bounds");
    new LoopSwapTrans().apply(firstLoop(s));
  }

  @Test
  public void testBlockOpaqueBody() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    print *, a(i)\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("cannot be analysed");
    new BlockLoopTrans(Settings.defaultSettings()).apply(firstLoop(s));
  }

  @Test
  public void testBlockNotALoop() throws Exception {
    Routine s = routine(NEST);
    exception.expect(TransformationException.class);
    exception.expectMessage("must be a loop");
    new BlockLoopTrans(Settings.defaultSettings()).apply(s);
  }

  @Test
  public void testSwap() throws Exception {
    Routine s = routine(NEST);
    new LoopSwapTrans().apply(firstLoop(s));
    assertEquals(
        "do j = 1, m, 1\n" +
        "  do i = 1, n, 1\n" +
        "    a(i, j) = 0.0\n" +
        "  end do\n" +
        "end do\n", text(s.getChild(0)));
  }

  @Test
  public void testSwapTriangular() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i, j\n" +
        "  real :: a(n, n)\n" +
        "  do i = 1, n\n" +
        "    do j = 1, i\n" +
        "      a(i, j) = 0.0\n" +
        "    end do\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("depend on the outer loop variable 'i'");
    new LoopSwapTrans().apply(firstLoop(s));
  }

  @Test
  public void testSwapNeedsNestedLoop() throws Exception {
    Routine s = routine(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    a(i) = 0.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("must consist of exactly one loop");
    new LoopSwapTrans().apply(firstLoop(s));
  }

  @Test
  public void testTile() throws Exception {
    Routine s = routine(NEST);
    new LoopTiling2DTrans(Settings.defaultSettings()).apply(firstLoop(s),
        TransformationOptions.of(LoopTiling2DTrans.TILESIZE, "16"));
    assertEquals(
        "do i_out_var = 1, n, 16\n" +
        "  i_el_inner = MIN(i_out_var + 15, n)\n" +
        "  do j_out_var = 1, m, 16\n" +
        "    do i = i_out_var, i_el_inner, 1\n" +
        "      j_el_inner = MIN(j_out_var + 15, m)\n" +
        "      do j = j_out_var, j_el_inner, 1\n" +
        "        a(i, j) = 0.0\n" +
        "      end do\n" +
        "    end do\n" +
        "  end do\n" +
        "end do\n", text(s.getChild(0)));
  }

  @Test
  public void testTileDefaultFromSettings() throws Exception {
    Routine s = routine(NEST);
    Settings settings = Settings.defaultSettings()
                                .with(Settings.TRANS_TILESIZE, "8");
    new LoopTiling2DTrans(settings).apply(firstLoop(s));
    assertEquals("do i_out_var = 1, n, 8",
                 text(s.getChild(0)).split("\n")[0]);
  }

  private static final String TWO_LOOPS =
      "subroutine s(a, b, n)\n" +
      "  integer :: n, i\n" +
      "  real :: a(n), b(n)\n" +
      "  do i = 1, n\n" +
      "    a(i) = 1.0\n" +
      "  end do\n" +
      "  do i = 1, n\n" +
      "    b(i) = %s\n" +
      "  end do\n" +
      "end subroutine s\n";

  @Test
  public void testFuse() throws Exception {
    Routine s = routine(String.format(TWO_LOOPS, "a(i) * 2.0"));
    new LoopFuseTrans().apply(firstLoop(s));
    assertEquals(1, s.numChildren());
    assertEquals(
        "do i = 1, n, 1\n" +
        "  a(i) = 1.0\n" +
        "  b(i) = a(i) * 2.0\n" +
        "end do\n", text(s.getChild(0)));
  }

  @Test
  public void testFuseDifferentIndex() throws Exception {
    Routine s = routine(String.format(TWO_LOOPS, "a(i + 1)"));
    exception.expect(TransformationException.class);
    exception.expectMessage("accessed at different indices");
    new LoopFuseTrans().apply(firstLoop(s));
  }

  @Test
  public void testFuseEquivalentIndex() throws Exception {
    Routine s = routine(String.format(TWO_LOOPS, "a(2 * i - i)"));
    new LoopFuseTrans().apply(firstLoop(s));
    assertEquals(1, s.numChildren());
  }

  @Test
  public void testFuseDifferentBounds() throws Exception {
    Routine s = routine(
        "subroutine s(a, n, m)\n" +
        "  integer :: n, m, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    a(i) = 1.0\n" +
        "  end do\n" +
        "  do i = 1, m\n" +
        "    a(i) = 2.0\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("loop stop expressions differ");
    new LoopFuseTrans().apply(firstLoop(s));
  }

  @Test
  public void testFuseStructureWrittenWhole() throws Exception {
    Routine s = routine(
        "subroutine s(g, a, n)\n" +
        "  use grid_mod, only: grid_type\n" +
        "  type(grid_type), intent(inout) :: g\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "  do i = 1, n\n" +
        "    call refresh(g)\n" +
        "  end do\n" +
        "  do i = 1, n\n" +
        "    a(i) = g%scale\n" +
        "  end do\n" +
        "end subroutine s\n");
    exception.expect(TransformationException.class);
    exception.expectMessage("'g' is written in one loop and 'g%scale' " +
                            "is accessed in the other");
    new LoopFuseTrans().apply(firstLoop(s));
  }

  @Test
  public void testFuseLastLoop() throws Exception {
    Routine s = routine(NEST);
    exception.expect(TransformationException.class);
    exception.expectMessage("not immediately followed by another loop");
    new LoopFuseTrans().apply(firstLoop(s));
  }
}
