package exm.sct.backend;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.RoutineSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolInterface.Access;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.Extent;
import exm.sct.ir.symbols.Types.UnknownType;
import exm.sct.ir.tree.ArrayReference;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.BinaryOperation.Operator;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.Routine;
import exm.sct.ir.tree.UnaryOperation;

public class FortranWriterTest {

  private final FortranWriter writer = new FortranWriter();

  private final DataSymbol a = new DataSymbol("a", Types.INTEGER_TYPE);
  private final DataSymbol b = new DataSymbol("b", Types.INTEGER_TYPE);
  private final DataSymbol c = new DataSymbol("c", Types.INTEGER_TYPE);

  private static Reference ref(DataSymbol s) {
    return new Reference(s);
  }

  private static Node bin(Operator op, Node lhs, Node rhs) {
    return BinaryOperation.create(op, lhs, rhs);
  }

  @Test
  public void testPrecedence() throws Exception {
    assertEquals("a - (b - c)", writer.expression(
        bin(Operator.SUB, ref(a), bin(Operator.SUB, ref(b), ref(c)))));
    assertEquals("a - b - c", writer.expression(
        bin(Operator.SUB, bin(Operator.SUB, ref(a), ref(b)), ref(c))));
    assertEquals("(a + b) * c", writer.expression(
        bin(Operator.MUL, bin(Operator.ADD, ref(a), ref(b)), ref(c))));
    assertEquals("a + b * c", writer.expression(
        bin(Operator.ADD, ref(a), bin(Operator.MUL, ref(b), ref(c)))));
    assertEquals("Power is right associative", "a ** b ** c",
        writer.expression(bin(Operator.POW, ref(a),
                              bin(Operator.POW, ref(b), ref(c)))));
    assertEquals("(a ** b) ** c", writer.expression(
        bin(Operator.POW, bin(Operator.POW, ref(a), ref(b)), ref(c))));
    assertEquals("-(a + b)", writer.expression(
        UnaryOperation.create(UnaryOperation.Operator.MINUS,
                              bin(Operator.ADD, ref(a), ref(b)))));
  }

  @Test
  public void testLogicalOperators() throws Exception {
    Node cmp1 = bin(Operator.LT, ref(a), ref(b));
    Node cmp2 = bin(Operator.GE, ref(b), ref(c));
    assertEquals("a < b .AND. b >= c",
                 writer.expression(bin(Operator.AND, cmp1, cmp2)));
    assertEquals(".NOT. (a < b .OR. b >= c)", writer.expression(
        UnaryOperation.create(UnaryOperation.Operator.NOT,
            bin(Operator.OR, cmp1.copy(), cmp2.copy()))));
    assertEquals("(a .OR. b) .AND. c", writer.expression(
        bin(Operator.AND, bin(Operator.OR, ref(a), ref(b)), ref(c))));
    assertEquals("a /= b", writer.expression(bin(Operator.NE, ref(a),
                                                 ref(b))));
  }

  @Test
  public void testLiterals() throws Exception {
    assertEquals(".true.", writer.expression(
        new Literal("true", Types.BOOLEAN_TYPE)));
    assertEquals("'it''s'", writer.expression(
        new Literal("it's", Types.CHARACTER_TYPE)));
    assertEquals("2.0", writer.expression(
        new Literal("2", Types.REAL_TYPE)));
    assertEquals("1.5e3_8", writer.expression(
        new Literal("1.5e3", Types.DOUBLE_TYPE)));
  }

  @Test
  public void testDeclarations() throws Exception {
    DataSymbol n = new DataSymbol("n", Types.INTEGER_TYPE,
                                  SymbolInterface.argument(Access.READ));
    assertEquals("integer, intent(in) :: n", writer.declaration(n));

    DataSymbol arr = new DataSymbol("arr", new ArrayType(Types.REAL_TYPE,
        Arrays.asList(Extent.of(n), Extent.of(10))));
    assertEquals("real, dimension(n,10) :: arr", writer.declaration(arr));

    DataSymbol field = new DataSymbol("field", new ArrayType(
        Types.DOUBLE_TYPE, Arrays.asList(Extent.deferred())),
        SymbolInterface.argument(Access.WRITE));
    assertEquals("real(kind=8), dimension(:), intent(out) :: field",
                 writer.declaration(field));

    DataSymbol pi = new DataSymbol("pi", Types.REAL_TYPE);
    pi.setConstantValue(new Literal("3.14", Types.REAL_TYPE));
    assertEquals("real, parameter :: pi = 3.14", writer.declaration(pi));

    DataSymbol x = new DataSymbol("x", Types.BOOLEAN_TYPE,
                                  SymbolInterface.argument(Access.UNKNOWN));
    assertEquals("Unknown intent is left out", "logical :: x",
                 writer.declaration(x));

    assertEquals("type(grid_type) :: grid", writer.declaration(
        new DataSymbol("grid", new UnknownType("type(grid_type)"))));
    assertEquals("character(len=*) :: s", writer.declaration(
        new DataSymbol("s", new UnknownType("character(len=*) :: s"))));
  }

  @Test
  public void testRoutine() throws Exception {
    Routine r = new Routine("work");
    DataSymbol v = new DataSymbol("v", new ArrayType(Types.REAL_TYPE,
        Arrays.asList(Extent.of(10))),
        SymbolInterface.argument(Access.READWRITE));
    DataSymbol i = new DataSymbol("i", Types.INTEGER_TYPE);
    DataSymbol flag = new DataSymbol("flag", Types.BOOLEAN_TYPE,
                                     SymbolInterface.argument(Access.READ));
    ContainerSymbol mod = new ContainerSymbol("timing_mod");
    RoutineSymbol tick = new RoutineSymbol("tick",
                                           SymbolInterface.imported(mod));
    r.getSymbolTable().add(mod);
    r.getSymbolTable().add(tick);
    r.getSymbolTable().add(v);
    r.getSymbolTable().add(flag);
    r.getSymbolTable().add(i);
    r.getSymbolTable().specifyArgumentList(Arrays.asList(v, flag));

    List<Node> loopBody = new ArrayList<Node>();
    loopBody.add(Assignment.create(
        ArrayReference.create(v, Arrays.asList(ref(i))),
        new Literal("0.0", Types.REAL_TYPE)));
    List<Node> ifBody = new ArrayList<Node>();
    ifBody.add(Loop.create(i, Literal.integer(1), Literal.integer(10),
                           Literal.integer(1), loopBody));
    List<Node> elseBody = new ArrayList<Node>();
    elseBody.add(Call.create(tick, new ArrayList<Node>()));
    r.addChild(IfBlock.create(ref(flag), ifBody, elseBody));

    Container module = new Container("work_mod");
    module.addChild(r);

    assertEquals(
        "module work_mod\n" +
        "\n" +
        "contains\n" +
        "  subroutine work(v, flag)\n" +
        "    use timing_mod, only: tick\n" +
        "    real, dimension(10), intent(inout) :: v\n" +
        "    logical, intent(in) :: flag\n" +
        "    integer :: i\n" +
        "\n" +
        "    if (flag) then\n" +
        "      do i = 1, 10, 1\n" +
        "        v(i) = 0.0\n" +
        "      end do\n" +
        "    else\n" +
        "      call tick()\n" +
        "    end if\n" +
        "\n" +
        "  end subroutine work\n" +
        "end module work_mod\n", writer.render(module));
  }

  @Test
  public void testDeclarationOrderFollowsDependencies() throws Exception {
    Container module = new Container("sizes");
    DataSymbol n = new DataSymbol("n", Types.INTEGER_TYPE);
    DataSymbol work = new DataSymbol("work", new ArrayType(Types.REAL_TYPE,
                                     Arrays.asList(Extent.of(n))));
    n.setConstantValue(Literal.integer(4));
    // Added before the constant its shape uses
    module.getSymbolTable().add(work);
    module.getSymbolTable().add(n);
    Symbol unresolved = new Symbol("elsewhere", SymbolInterface.unresolved());
    module.getSymbolTable().add(unresolved);
    assertEquals(
        "module sizes\n" +
        "  integer, parameter :: n = 4\n" +
        "  real, dimension(n) :: work\n" +
        "end module sizes\n", writer.render(module));
  }
}
