package exm.sct.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sct.backend.FortranWriter;
import exm.sct.common.Logging;
import exm.sct.common.exceptions.InvalidSyntaxException;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.RoutineSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.UnknownType;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.CodeBlock;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Directive;
import exm.sct.ir.tree.IRValidator;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Routine;

public class FortranReaderTest {

  private static final String KERNELS =
      "module kernels_mod\n" +
      "  use field_mod, only: field_type\n" +
      "  implicit none\n" +
      "contains\n" +
      "  subroutine scale(a, n, alpha)\n" +
      "    integer, intent(in) :: n\n" +
      "    real, dimension(n), intent(inout) :: a\n" +
      "    real, intent(in) :: alpha\n" +
      "    integer :: i\n" +
      "    ! Scale every element\n" +
      "    do i = 1, n\n" +
      "      a(i) = alpha * a(i)\n" +
      "    end do\n" +
      "  end subroutine scale\n" +
      "end module kernels_mod\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Container read(String source) throws InvalidSyntaxException {
    Container root = new FortranReader().psyirFromSource(source);
    IRValidator.validate(Logging.getSCTLogger(), root);
    return root;
  }

  private static Routine firstRoutine(Node root) {
    return (Routine)root.walkList(NodeKind.ROUTINE).get(0);
  }

  @Test
  public void testModuleStructure() throws Exception {
    Container root = read(KERNELS);
    assertTrue("Root is the file container", root.isFileContainer());
    assertEquals(1, root.numChildren());
    Container module = (Container)root.getChild(0);
    assertEquals("kernels_mod", module.getName());

    Routine scale = (Routine)module.getChild(0);
    assertEquals("scale", scale.getName());
    assertFalse(scale.isProgram());

    List<DataSymbol> args = scale.getSymbolTable().getArgumentList();
    assertEquals("Arguments in order of the subroutine statement", 3,
                 args.size());
    assertEquals("a", args.get(0).getName());
    assertEquals("n", args.get(1).getName());
    assertEquals("alpha", args.get(2).getName());
  }

  @Test
  public void testDeclarations() throws Exception {
    Routine scale = firstRoutine(read(KERNELS));
    SymbolTable table = scale.getSymbolTable();

    DataSymbol n = (DataSymbol)table.lookup("n");
    assertEquals(Types.INTEGER_TYPE, n.getDatatype());
    assertEquals(SymbolInterface.Access.READ,
        ((SymbolInterface.ArgumentInterface)n.getInterface()).access());

    DataSymbol a = (DataSymbol)table.lookup("a");
    assertTrue(a.isArray());
    ArrayType aType = (ArrayType)a.getDatatype();
    assertEquals(1, aType.rank());
    assertTrue("Extent refers to the argument n",
               aType.shape().get(0).symbol() == n);
    assertEquals(SymbolInterface.Access.READWRITE,
        ((SymbolInterface.ArgumentInterface)a.getInterface()).access());

    DataSymbol i = (DataSymbol)table.lookup("i");
    assertTrue(i.getInterface().isLocal());
  }

  @Test
  public void testImports() throws Exception {
    Container root = read(KERNELS);
    SymbolTable moduleTable = root.getChild(0).getSymbolTable();
    ContainerSymbol fieldMod = (ContainerSymbol)moduleTable.lookup("field_mod");
    assertFalse(fieldMod.hasWildcardImport());
    Symbol fieldType = moduleTable.lookup("field_type");
    assertTrue(fieldType.isImported());
    assertEquals(1, moduleTable.symbolsImportedFrom(fieldMod).size());
  }

  @Test
  public void testLoopAndAssignment() throws Exception {
    Routine scale = firstRoutine(read(KERNELS));
    assertEquals(1, scale.numChildren());
    Loop loop = (Loop)scale.getChild(0);
    assertEquals("i", loop.getVariable().getName());
    assertEquals("Default step is 1", "1",
                 new FortranWriter().render(loop.getStepExpr()));
    assertEquals(11, loop.getLine());

    Assignment a = (Assignment)loop.getLoopBody().getChild(0);
    assertEquals(NodeKind.ARRAY_REFERENCE, a.getLhs().kind());
    assertEquals("alpha * a(i)", new FortranWriter().render(a.getRhs()));
  }

  @Test
  public void testIfElseIf() throws Exception {
    Container root = read(
        "subroutine clip(x)\n" +
        "  real, intent(inout) :: x\n" +
        "  if (x < 0.0) then\n" +
        "    x = 0.0\n" +
        "  else if (x > 1.0) then\n" +
        "    x = 1.0\n" +
        "  else\n" +
        "    x = x * 2.0\n" +
        "  end if\n" +
        "end subroutine clip\n");
    Routine clip = firstRoutine(root);
    IfBlock outer = (IfBlock)clip.getChild(0);
    assertEquals(1, outer.getIfBody().numChildren());
    assertEquals("else if is nested in the else body", 1,
                 outer.getElseBody().numChildren());
    IfBlock inner = (IfBlock)outer.getElseBody().getChild(0);
    assertEquals("x > 1.0",
                 new FortranWriter().render(inner.getCondition()));
    assertEquals(1, inner.getElseBody().numChildren());
  }

  @Test
  public void testLogicalIf() throws Exception {
    Container root = read(
        "subroutine s(x)\n" +
        "  integer :: x\n" +
        "  if (x > 3) x = 3\n" +
        "end subroutine s\n");
    IfBlock ifBlock = (IfBlock)firstRoutine(root).getChild(0);
    assertNull(ifBlock.getElseBody());
    assertEquals(NodeKind.ASSIGNMENT,
                 ifBlock.getIfBody().getChild(0).kind());
  }

  @Test
  public void testUnsupportedStatementsBecomeCodeBlocks() throws Exception {
    Container root = read(
        "program main\n" +
        "  integer :: i\n" +
        "  i = 1\n" +
        "  print *, 'i is ', i\n" +
        "  i = my_function(i)\n" +
        "end program main\n");
    Routine main = firstRoutine(root);
    assertTrue(main.isProgram());
    assertEquals(3, main.numChildren());
    assertEquals(NodeKind.ASSIGNMENT, main.getChild(0).kind());

    CodeBlock print = (CodeBlock)main.getChild(1);
    assertEquals("print *, 'i is ', i", print.getLines().get(0));
    assertTrue("Code block records the variables it names",
               print.refersTo(main.getSymbolTable().lookup("i")));

    assertEquals("Function call can't be represented", NodeKind.CODE_BLOCK,
                 main.getChild(2).kind());
  }

  @Test
  public void testCallToImportedRoutine() throws Exception {
    Container root = read(
        "subroutine driver(f)\n" +
        "  use timers, only: start_timer\n" +
        "  real :: f\n" +
        "  call start_timer(f, 2)\n" +
        "  call other\n" +
        "end subroutine driver\n");
    Routine driver = firstRoutine(root);
    Call first = (Call)driver.getChild(0);
    RoutineSymbol timer = first.getRoutine();
    assertEquals("start_timer", timer.getName());
    assertTrue("Imported name becomes an imported routine",
               timer.isImported());
    assertEquals(2, first.getArguments().size());

    Call second = (Call)driver.getChild(1);
    assertTrue(second.getRoutine().isUnresolved());
    assertEquals(0, second.getArguments().size());
  }

  @Test
  public void testUnknownDeclarationKeptVerbatim() throws Exception {
    Container root = read(
        "subroutine s(grid)\n" +
        "  use grid_mod\n" +
        "  type(grid_type), intent(in) :: grid\n" +
        "  character(len=10) :: label\n" +
        "  real(kind=wp) :: x, y\n" +
        "  x = grid%dx\n" +
        "end subroutine s\n");
    SymbolTable table = firstRoutine(root).getSymbolTable();
    DataSymbol grid = (DataSymbol)table.lookup("grid");
    assertEquals("type(grid_type), intent(in) :: grid",
                 ((UnknownType)grid.getDatatype()).declaration());
    assertTrue(grid.isArgument());
    DataSymbol y = (DataSymbol)table.lookup("y");
    assertEquals("real(kind=wp) :: y",
                 ((UnknownType)y.getDatatype()).declaration());
    assertTrue(((ContainerSymbol)table.lookup("grid_mod"))
                                            .hasWildcardImport());
  }

  @Test
  public void testParameters() throws Exception {
    Container root = read(
        "module sizes\n" +
        "  integer, parameter :: n = 10, m = n * 2\n" +
        "  real, dimension(m) :: work\n" +
        "end module sizes\n");
    SymbolTable table = root.getChild(0).getSymbolTable();
    DataSymbol m = (DataSymbol)table.lookup("m");
    assertTrue(m.isConstant());
    assertEquals("n * 2", new FortranWriter().render(m.getConstantValue()));
    DataSymbol work = (DataSymbol)table.lookup("work");
    assertTrue(((ArrayType)work.getDatatype()).shape().get(0).symbol() == m);
  }

  @Test
  public void testDirectives() throws Exception {
    Container root = read(
        "subroutine s(a, n)\n" +
        "  integer :: n, i\n" +
        "  real :: a(n)\n" +
        "!$omp parallel do\n" +
        "  do i = 1, n\n" +
        "    a(i) = 0.0\n" +
        "  end do\n" +
        "!$omp end parallel do\n" +
        "!$acc kernels\n" +
        "  a(1) = 1.0\n" +
        "  a(2) = 2.0\n" +
        "end subroutine s\n");
    Routine s = firstRoutine(root);
    assertEquals(3, s.numChildren());
    Directive omp = (Directive)s.getChild(0);
    assertEquals("omp parallel do", omp.getBeginText());
    assertEquals("omp end parallel do", omp.getEndText());
    assertEquals(NodeKind.LOOP, omp.getBody().getChild(0).kind());

    Directive acc = (Directive)s.getChild(1);
    assertNull("No end directive", acc.getEndText());
    assertEquals("Without an end the directive applies to one statement",
                 1, acc.getBody().numChildren());
    assertEquals(NodeKind.ASSIGNMENT, s.getChild(2).kind());
  }

  @Test
  public void testUndeclaredNameIsUnresolved() throws Exception {
    Container root = read(
        "subroutine s()\n" +
        "  integer :: i\n" +
        "  i = nx + 1\n" +
        "end subroutine s\n");
    Symbol nx = firstRoutine(root).getSymbolTable().lookup("nx");
    assertTrue(nx.isUnresolved());
  }

  @Test
  public void testContinuationAndCase() throws Exception {
    Container root = read(
        "SUBROUTINE S(X)\n" +
        "  REAL :: X\n" +
        "  X = X + &\n" +
        "      & 1.0d0 ; X = -X\n" +
        "END SUBROUTINE S\n");
    Routine s = firstRoutine(root);
    assertEquals(2, s.numChildren());
    FortranWriter writer = new FortranWriter();
    assertEquals("x + 1.0e0_8",
        writer.render(((Assignment)s.getChild(0)).getRhs()));
    assertEquals("-x", writer.render(((Assignment)s.getChild(1)).getRhs()));
  }

  @Test
  public void testFunctionRejected() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("functions are not supported");
    read("real function f(x)\n" +
         "  real :: x\n" +
         "  f = x\n" +
         "end function f\n");
  }

  @Test
  public void testMissingEndDo() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unexpected 'end subroutine'");
    read("subroutine s()\n" +
         "  integer :: i\n" +
         "  do i = 1, 10\n" +
         "    i = i\n" +
         "end subroutine s\n");
  }

  @Test
  public void testDoWhileRejected() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("only counted do loops");
    read("subroutine s()\n" +
         "  logical :: more\n" +
         "  do while (more)\n" +
         "  end do\n" +
         "end subroutine s\n");
  }

  @Test
  public void testIntentOnLocalRejected() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("not an argument");
    read("subroutine s()\n" +
         "  integer, intent(in) :: i\n" +
         "end subroutine s\n");
  }

  @Test
  public void testIntentOnLocalReportsLine() throws Exception {
    try {
      read("subroutine s()\n" +
           "  integer :: j\n" +
           "  real, intent(out) :: x\n" +
           "end subroutine s\n");
    } catch (InvalidSyntaxException e) {
      assertEquals(-1, e.getLine());
      assertTrue(e.getMessage(), e.getMessage().contains(
          "Intent given for 'x', which is not an argument (line 3)"));
      return;
    }
    throw new AssertionError("intent on a local was accepted");
  }

  @Test
  public void testDuplicateDeclarationRejected() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Symbol 'i' is declared more than once (line 3)");
    read("subroutine s()\n" +
         "  integer :: i\n" +
         "  real :: i\n" +
         "end subroutine s\n");
  }

  @Test
  public void testRoundTrip() throws Exception {
    String source =
        "module m\n" +
        "  use constants_mod, only: wp\n" +
        "  integer, parameter :: nmax = 100\n" +
        "contains\n" +
        "  subroutine step(u, v, n)\n" +
        "    integer, intent(in) :: n\n" +
        "    real(kind=8), dimension(n, nmax), intent(inout) :: u\n" +
        "    real(wp) :: v\n" +
        "    integer :: i, j\n" +
        "    logical :: flag\n" +
        "    flag = .not. (n > 2 .and. n < 10)\n" +
        "!$omp parallel do\n" +
        "    do j = 1, nmax\n" +
        "      do i = 2, n - 1, 1\n" +
        "        u(i, j) = (u(i - 1, j) + u(i + 1, j)) / 2.0_8 - u(i, j) ** 2\n" +
        "        if (u(i, j) < 0.0) u(i, j) = ABS(u(i, j))\n" +
        "      end do\n" +
        "    end do\n" +
        "!$omp end parallel do\n" +
        "    u(:, 1) = 0.0\n" +
        "    write(*, *) 'done'\n" +
        "    call finish(u(1, 1), v)\n" +
        "    return\n" +
        "  end subroutine step\n" +
        "end module m\n";
    FortranWriter writer = new FortranWriter();
    String first = writer.render(read(source));
    String second = writer.render(read(first));
    assertEquals("Writing what was read back gives the same text", first,
                 second);
    assertTrue(first, first.contains(
        "real(kind=8), dimension(n,nmax), intent(inout) :: u"));
    assertTrue(first, first.contains("real(wp) :: v"));
    assertTrue(first, first.contains("u(:, 1) = 0.0"));
    assertTrue(first, first.contains(
        "flag = .NOT. (n > 2 .AND. n < 10)"));
  }
}
