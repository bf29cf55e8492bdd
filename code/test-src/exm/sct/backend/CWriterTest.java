package exm.sct.backend;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.BackendException;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.BinaryOperation.Operator;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.Routine;

public class CWriterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final CWriter writer = new CWriter();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Container read(String source) throws Exception {
    return new FortranReader().psyirFromSource(source);
  }

  private static Routine routine(Container root) {
    return (Routine)root.walkList(NodeKind.ROUTINE).get(0);
  }

  @Test
  public void testRoutine() throws Exception {
    Container root = read(
        "subroutine axpy(x, y, n, alpha)\n" +
        "  integer, intent(in) :: n\n" +
        "  real, dimension(n), intent(in) :: x\n" +
        "  real, dimension(n), intent(inout) :: y\n" +
        "  real, intent(in) :: alpha\n" +
        "  integer :: i\n" +
        "  do i = 1, n\n" +
        "    if (alpha /= 0.0 .and. .not. (i > n)) then\n" +
        "      y(i) = alpha * x(i) + y(i)\n" +
        "    else\n" +
        "      y(i) = y(i) ** 2\n" +
        "    end if\n" +
        "  end do\n" +
        "end subroutine axpy\n");
    assertEquals(
        "void axpy(double x[n], double y[n], int n, double alpha)\n" +
        "{\n" +
        "  int i;\n" +
        "  for (i = 1; i <= n; i += 1) {\n" +
        "    if (alpha != 0.0 && !(i > n)) {\n" +
        "      y[i] = alpha * x[i] + y[i];\n" +
        "    } else {\n" +
        "      y[i] = pow(y[i], 2);\n" +
        "    }\n" +
        "  }\n" +
        "}\n", writer.render(routine(root)));
  }

  @Test
  public void testSubscriptsReversed() throws Exception {
    Container root = read(
        "subroutine s(a, n, m)\n" +
        "  integer :: n, m, i, j\n" +
        "  real(kind=4) :: a(n, m)\n" +
        "  do j = m, 1, -1\n" +
        "    a(1, j) = MIN(a(2, j), a(3, j), 0.0)\n" +
        "  end do\n" +
        "end subroutine s\n");
    String text = writer.render(routine(root));
    assertEquals(
        "void s(float a[m][n], int n, int m)\n" +
        "{\n" +
        "  int i;\n" +
        "  int j;\n" +
        "  for (j = m; j >= 1; j += -1) {\n" +
        "    a[j][1] = fmin(a[j][2], fmin(a[j][3], 0.0));\n" +
        "  }\n" +
        "}\n", text);
  }

  @Test
  public void testModuleRejected() throws Exception {
    Container root = read(
        "module m\n" +
        "  integer :: k\n" +
        "end module m\n");
    exception.expect(BackendException.class);
    exception.expectMessage("Modules cannot be written in C");
    writer.render(root.getChild(0));
  }

  @Test
  public void testCodeBlockRejected() throws Exception {
    Container root = read(
        "subroutine s()\n" +
        "  print *, 'hello'\n" +
        "end subroutine s\n");
    exception.expect(BackendException.class);
    exception.expectMessage("Code blocks cannot be written in C");
    writer.render(routine(root));
  }

  @Test
  public void testSumRejected() throws Exception {
    DataSymbol a = new DataSymbol("a", Types.INTEGER_TYPE);
    Node sum = IntrinsicCall.create(Intrinsic.SUM,
                                    Arrays.asList(new Reference(a)));
    exception.expect(BackendException.class);
    exception.expectMessage("SUM has no C equivalent");
    writer.expression(sum);
  }

  @Test
  public void testExpressions() throws Exception {
    DataSymbol a = new DataSymbol("a", Types.REAL_TYPE);
    DataSymbol k = new DataSymbol("k", Types.INTEGER_TYPE);
    Node cast = IntrinsicCall.create(Intrinsic.REAL,
        Arrays.asList(BinaryOperation.create(Operator.ADD, new Reference(k),
                                             Literal.integer(1))));
    assertEquals("a * (double)(k + 1)", writer.expression(
        BinaryOperation.create(Operator.MUL, new Reference(a), cast)));
    assertEquals("1", writer.expression(
        new Literal("true", Types.BOOLEAN_TYPE)));
    assertEquals("fabs(a)", writer.expression(IntrinsicCall.create(
        Intrinsic.ABS, Arrays.asList(new Reference(a)))));
  }
}
