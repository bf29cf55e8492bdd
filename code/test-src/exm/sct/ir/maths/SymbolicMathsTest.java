package exm.sct.ir.maths;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sct.common.Logging;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.maths.SymbolicMaths.Equality;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

public class SymbolicMathsTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  /**
   * Parse an expression in the context of a few declared variables
   */
  private static Node expr(String text) throws Exception {
    Container root = new FortranReader().psyirFromSource(
        "subroutine s(g)\n" +
        "  use grid_mod, only: grid_type\n" +
        "  type(grid_type), intent(inout) :: g\n" +
        "  integer :: i, j, n\n" +
        "  real :: a(n), x\n" +
        "  x = " + text + "\n" +
        "end subroutine s\n");
    Assignment a = (Assignment)root.walkList(NodeKind.ASSIGNMENT).get(0);
    return a.getRhs();
  }

  private static void check(Equality expected, String a, String b)
                                                      throws Exception {
    assertEquals(a + " vs " + b, expected, SymbolicMaths.equal(expr(a),
                                                                expr(b)));
  }

  @Test
  public void testEqual() throws Exception {
    check(Equality.EQUAL, "i + 1", "1 + i");
    check(Equality.EQUAL, "2 * i - i", "i");
    check(Equality.EQUAL, "(i + 1) ** 2", "i * i + 2 * i + 1");
    check(Equality.EQUAL, "-(-j)", "+j");
    check(Equality.EQUAL, "6 / 3", "2");
    check(Equality.EQUAL, "I + N", "n + i");
    check(Equality.EQUAL, "0.5 * i", "i * 0.5");
  }

  @Test
  public void testSubscriptsNormalised() throws Exception {
    check(Equality.EQUAL, "a(2 * i)", "a(3 * i - i)");
    check(Equality.EQUAL, "g%b(2 * i)", "g%b(i + i)");
    check(Equality.NOT_EQUAL, "a(i)", "a(i + 1)");
    check(Equality.NOT_EQUAL, "g%b(i)", "g%c(i)");
  }

  @Test
  public void testNotEqual() throws Exception {
    check(Equality.NOT_EQUAL, "i + 1", "i");
    check(Equality.NOT_EQUAL, "i", "j");
    check(Equality.NOT_EQUAL, "2 * n", "n");
    check(Equality.NOT_EQUAL, "(i + 1) ** 2", "i * i + 1");
  }

  @Test
  public void testUnknown() throws Exception {
    check(Equality.UNKNOWN, "MAX(1, 2, 3)", "MAX(3, 2, 1)");
    check(Equality.UNKNOWN, "i / 2", "j");
    check(Equality.UNKNOWN, "7 / 2", "3");
    check(Equality.UNKNOWN, "a(i / 2)", "a(j)");
    check(Equality.UNKNOWN, "i ** n", "i");
    check(Equality.UNKNOWN, "0.5 * i", "i / 2");
  }

  @Test
  public void testSameOpaqueTextIsEqual() throws Exception {
    check(Equality.EQUAL, "MAX(i, j) + 1", "1 + MAX(i, j)");
    check(Equality.EQUAL, "i / 2", "i / 2");
    check(Equality.EQUAL, "a(i / 2)", "a(i / 2)");
  }

  @Test
  public void testIntegerValue() throws Exception {
    assertEquals(Integer.valueOf(7), SymbolicMaths.integerValue(
        expr("2 * 3 + 1")));
    assertEquals(Integer.valueOf(4), SymbolicMaths.integerValue(
        expr("n - n + 4")));
    assertEquals(Integer.valueOf(-8), SymbolicMaths.integerValue(
        expr("-2 ** 3")));
    assertNull(SymbolicMaths.integerValue(expr("n + 1")));
    assertNull(SymbolicMaths.integerValue(expr("7 / 2")));
  }

  @Test
  public void testCanonical() throws Exception {
    assertEquals(SymbolicMaths.canonical(expr("j * 2 + i")),
                 SymbolicMaths.canonical(expr("i + j + j")));
  }
}
