package exm.sct.ir.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sct.common.Logging;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Routine;

public class VariablesAccessInfoTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Routine routine(String decls, String body)
                                                  throws Exception {
    Container root = new FortranReader().psyirFromSource(
        "subroutine s(g, a, n)\n" +
        "  use grid_mod, only: grid_type\n" +
        "  type(grid_type), intent(inout) :: g\n" +
        "  integer, intent(in) :: n\n" +
        "  real, dimension(n), intent(inout) :: a\n" +
        "  integer :: i\n" +
        "  real :: x, y\n" +
        decls + body +
        "end subroutine s\n");
    return (Routine)root.walkList(NodeKind.ROUTINE).get(0);
  }

  private static Signature sig(String... parts) {
    return new Signature(parts);
  }

  @Test
  public void testAssignment() throws Exception {
    Routine r = routine("", "  x = y + a(i)\n  y = y * 2.0\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals("Rhs is read before the target is written",
                 Arrays.asList(sig("y"), sig("i"), sig("a"), sig("x")),
                 info.getSignatures());
    assertTrue(info.isRead(sig("a")));
    assertFalse(info.isWritten(sig("a")));
    assertTrue(info.isWritten(sig("x")));
    assertFalse(info.isRead(sig("x")));

    SingleVariableAccessInfo y = info.get(sig("Y"));
    assertEquals(3, y.getAccesses().size());
    assertEquals(AccessType.READ, y.firstAccess().getType());
    assertEquals("Target also read by the value", AccessType.READWRITE,
                 y.getAccesses().get(2).getType());
    assertSame(r.getSymbolTable().lookup("y"), y.getSymbol());
    assertNull(info.get(sig("n")));
    assertFalse(info.hasOpaqueAccess());
  }

  @Test
  public void testSubscriptsOfTargetAreRead() throws Exception {
    Routine r = routine("", "  a(i + 1) = 0.0\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList(sig("i"), sig("a")), info.getSignatures());
    assertTrue(info.isRead(sig("i")));
    assertTrue(info.isWritten(sig("a")));
    assertEquals(Arrays.asList(sig("a")), info.getWrittenSignatures());
    assertEquals(Arrays.asList(sig("i")), info.getReadSignatures());
  }

  @Test
  public void testLoop() throws Exception {
    Routine r = routine("", "  do i = 1, n\n    a(i) = x\n  end do\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList(sig("n"), sig("i"), sig("x"), sig("a")),
                 info.getSignatures());
    AccessInfo first = info.get(sig("i")).firstAccess();
    assertEquals(AccessType.READWRITE, first.getType());
    assertTrue(first.isLoopVariable());
    assertTrue(first.getNode() instanceof Loop);
    assertFalse("Loop sets its own variable",
                info.get(sig("i")).isReadFirst());
  }

  @Test
  public void testStructureAccess() throws Exception {
    Routine r = routine("",
        "  g%data(i) = g%scale * x\n" +
        "  x = g%data(1)\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    Signature data = sig("g", "data");
    assertEquals(Arrays.asList(sig("i"), sig("g", "scale"), sig("x"), data),
                 info.getSignatures());
    assertTrue(data.isStructure());
    assertEquals("g%data", data.toString());
    assertEquals("g", data.getVarName());
    assertTrue(info.isWritten(data));
    assertFalse(info.isWritten(sig("g", "scale")));
    assertTrue(info.isVariableWritten("G"));
    assertFalse(info.isVariableWritten("n"));
  }

  @Test
  public void testWholeStructureWriteOverlapsComponents() throws Exception {
    assertTrue(sig("g").overlaps(sig("g", "n")));
    assertTrue(sig("g", "n").overlaps(sig("G")));
    assertFalse(sig("g", "n").overlaps(sig("g", "m")));
    assertFalse(sig("g").overlaps(sig("h")));

    Routine r = routine("", "  call update(g)\n  x = g%scale\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertFalse(info.isWritten(sig("g", "n")));
    assertTrue(info.isWrittenOverlapping(sig("g", "n")));
    assertFalse(info.isWrittenOverlapping(sig("n")));

    r = routine("", "  g%data(i) = 0.0\n");
    info = new VariablesAccessInfo(r);
    assertTrue("Writing a component writes part of the structure",
               info.isWrittenOverlapping(sig("g")));
    assertFalse(info.isWrittenOverlapping(sig("g", "scale")));
  }

  @Test
  public void testCallArgumentsReadAndWritten() throws Exception {
    Routine r = routine("", "  call update(a, x + 1.0)\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertTrue(info.isRead(sig("a")));
    assertTrue(info.isWritten(sig("a")));
    assertTrue(info.isRead(sig("x")));
    assertFalse("Expression arguments are only read",
                info.isWritten(sig("x")));
  }

  @Test
  public void testCodeBlockIsOpaque() throws Exception {
    Routine r = routine("", "  print *, x\n");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertTrue(info.hasOpaqueAccess());
  }

  @Test
  public void testStatementSubset() throws Exception {
    Routine r = routine("", "  x = 1.0\n  y = x\n  x = y\n");
    List<Node> tail = r.getChildren().subList(1, 3);
    VariablesAccessInfo info = new VariablesAccessInfo(tail);
    assertEquals(Arrays.asList(sig("x"), sig("y")), info.getSignatures());
    assertTrue(info.get(sig("x")).isReadFirst());
    assertFalse(info.get(sig("y")).isReadFirst());
    assertEquals("x: READ+WRITE, y: READ+WRITE", info.toString());
  }

  @Test
  public void testReadWriteInfo() throws Exception {
    Routine r = routine("  real, parameter :: c = 2.0\n",
        "  do i = 1, n\n" +
        "    y = a(i) * c\n" +
        "    a(i) = y + x\n" +
        "  end do\n");
    ReadWriteInfo rw = new ReadWriteInfo(r.getChildren());
    assertEquals("Named constants are left out",
                 Arrays.asList(sig("n"), sig("a"), sig("x")),
                 rw.getInputs());
    assertEquals(Arrays.asList(sig("i"), sig("a"), sig("y")),
                 rw.getOutputs());
  }
}
