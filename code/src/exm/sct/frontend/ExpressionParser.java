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
package exm.sct.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.InvalidSyntaxException;
import exm.sct.common.exceptions.NameCollisionException;
import exm.sct.common.exceptions.SCTRuntimeError;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.tree.ArrayReference;
import exm.sct.ir.tree.BinaryOperation;
import exm.sct.ir.tree.IntrinsicCall;
import exm.sct.ir.tree.IntrinsicCall.Intrinsic;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Member;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.Range;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.StructureReference;
import exm.sct.ir.tree.UnaryOperation;

/**
 * Recursive descent parser for Fortran expressions over the tokens of one
 * statement.  Names are resolved in a symbol table; names that aren't
 * declared anywhere are added to it as unresolved symbols.
 *
 * Precedence, loosest first: .or., .and., .not., comparisons, + and -,
 * * and /, unary signs, **.
 */
class ExpressionParser {
  private final List<Token> tokens;
  private int pos;
  private final SymbolTable table;
  private final String file;
  private final int line;

  ExpressionParser(List<Token> tokens, int start, SymbolTable table,
                   String file, int line) {
    this.tokens = tokens;
    this.pos = start;
    this.table = table;
    this.file = file;
    this.line = line;
  }

  Token peek() {
    return tokens.get(pos);
  }

  Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  Token next() {
    Token t = tokens.get(pos);
    if (t.kind != Token.Kind.END) {
      pos++;
    }
    return t;
  }

  int position() {
    return pos;
  }

  boolean atEnd() {
    return peek().kind == Token.Kind.END;
  }

  boolean accept(String symbol) {
    if (peek().is(symbol)) {
      pos++;
      return true;
    }
    return false;
  }

  void expect(String symbol) throws InvalidSyntaxException {
    if (!accept(symbol)) {
      throw error("expected '" + symbol + "' but found " + peek());
    }
  }

  String expectName() throws InvalidSyntaxException {
    Token t = next();
    if (t.kind != Token.Kind.NAME) {
      throw error("expected a name but found " + t);
    }
    return t.text;
  }

  void expectEnd() throws InvalidSyntaxException {
    if (!atEnd()) {
      throw error("unexpected " + peek());
    }
  }

  InvalidSyntaxException error(String msg) {
    return new InvalidSyntaxException(file, line, msg);
  }

  Node expression()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node lhs = andExpr();
    while (accept(".or.")) {
      lhs = BinaryOperation.create(BinaryOperation.Operator.OR, lhs,
                                   andExpr());
    }
    return lhs;
  }

  private Node andExpr()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node lhs = notExpr();
    while (accept(".and.")) {
      lhs = BinaryOperation.create(BinaryOperation.Operator.AND, lhs,
                                   notExpr());
    }
    return lhs;
  }

  private Node notExpr()
        throws InvalidSyntaxException, UnsupportedConstructException {
    if (accept(".not.")) {
      return UnaryOperation.create(UnaryOperation.Operator.NOT, notExpr());
    }
    return comparison();
  }

  private Node comparison()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node lhs = additive();
    BinaryOperation.Operator op = comparisonOperator(peek());
    if (op != null) {
      next();
      return BinaryOperation.create(op, lhs, additive());
    }
    if (peek().is(".eqv.") || peek().is(".neqv.")) {
      throw new UnsupportedConstructException("logical equivalence operator");
    }
    return lhs;
  }

  private static BinaryOperation.Operator comparisonOperator(Token t) {
    if (t.kind != Token.Kind.SYMBOL) {
      return null;
    }
    if (t.is("==") || t.is(".eq.")) {
      return BinaryOperation.Operator.EQ;
    } else if (t.is("/=") || t.is(".ne.")) {
      return BinaryOperation.Operator.NE;
    } else if (t.is("<") || t.is(".lt.")) {
      return BinaryOperation.Operator.LT;
    } else if (t.is("<=") || t.is(".le.")) {
      return BinaryOperation.Operator.LE;
    } else if (t.is(">") || t.is(".gt.")) {
      return BinaryOperation.Operator.GT;
    } else if (t.is(">=") || t.is(".ge.")) {
      return BinaryOperation.Operator.GE;
    }
    return null;
  }

  private Node additive()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node lhs = multiplicative();
    while (true) {
      if (accept("+")) {
        lhs = BinaryOperation.create(BinaryOperation.Operator.ADD, lhs,
                                     multiplicative());
      } else if (accept("-")) {
        lhs = BinaryOperation.create(BinaryOperation.Operator.SUB, lhs,
                                     multiplicative());
      } else {
        return lhs;
      }
    }
  }

  private Node multiplicative()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node lhs = unary();
    while (true) {
      if (accept("*")) {
        lhs = BinaryOperation.create(BinaryOperation.Operator.MUL, lhs,
                                     unary());
      } else if (accept("/")) {
        lhs = BinaryOperation.create(BinaryOperation.Operator.DIV, lhs,
                                     unary());
      } else {
        return lhs;
      }
    }
  }

  private Node unary()
        throws InvalidSyntaxException, UnsupportedConstructException {
    if (accept("-")) {
      return UnaryOperation.create(UnaryOperation.Operator.MINUS, unary());
    } else if (accept("+")) {
      return UnaryOperation.create(UnaryOperation.Operator.PLUS, unary());
    }
    return power();
  }

  private Node power()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Node base = primary();
    if (accept("**")) {
      // Right associative, and the exponent may be signed
      return BinaryOperation.create(BinaryOperation.Operator.POW, base,
                                    unary());
    }
    return base;
  }

  private Node primary()
        throws InvalidSyntaxException, UnsupportedConstructException {
    Token t = peek();
    switch (t.kind) {
      case INTEGER:
        next();
        return new Literal(t.text, numericType(Types.Intrinsic.INTEGER, t));
      case REAL:
        next();
        return new Literal(t.text, numericType(Types.Intrinsic.REAL, t));
      case STRING:
        next();
        return new Literal(t.text, Types.CHARACTER_TYPE);
      case NAME:
        return nameExpression();
      case SYMBOL:
        if (accept("(")) {
          Node inner = expression();
          if (peek().is(",")) {
            throw new UnsupportedConstructException("complex constant");
          }
          expect(")");
          return inner;
        } else if (accept(".true.")) {
          return new Literal("true", Types.BOOLEAN_TYPE);
        } else if (accept(".false.")) {
          return new Literal("false", Types.BOOLEAN_TYPE);
        }
        throw error("unexpected " + t + " in expression");
      default:
        throw error("unexpected " + t + " in expression");
    }
  }

  private ScalarType numericType(Types.Intrinsic intrinsic, Token t)
                                      throws UnsupportedConstructException {
    if (t.kindParam == null) {
      return intrinsic == Types.Intrinsic.INTEGER ? Types.INTEGER_TYPE
                                                  : Types.REAL_TYPE;
    }
    if (!t.kindParam.matches("[0-9]+")) {
      throw new UnsupportedConstructException("named kind parameter '" +
                                              t.kindParam + "'");
    }
    return new ScalarType(intrinsic, Integer.parseInt(t.kindParam));
  }

  /**
   * Reference, array element or section, structure access or intrinsic
   * call
   */
  private Node nameExpression()
        throws InvalidSyntaxException, UnsupportedConstructException {
    String name = peek().text;
    Symbol sym = table.findSymbol(name);
    if (sym == null && peek(1).is("(")) {
      Intrinsic intrinsic = Intrinsic.fromName(name);
      if (intrinsic == null) {
        throw new UnsupportedConstructException("call to function '" +
                                                name + "'");
      }
      next();
      return intrinsicCall(intrinsic);
    }
    return designator();
  }

  private Node intrinsicCall(Intrinsic intrinsic)
        throws InvalidSyntaxException, UnsupportedConstructException {
    expect("(");
    List<Node> args = new ArrayList<Node>();
    if (!accept(")")) {
      do {
        if (peek().kind == Token.Kind.NAME && peek(1).is("=")) {
          throw new UnsupportedConstructException("keyword argument '" +
              peek().text + "' to " + intrinsic.name());
        }
        args.add(expression());
      } while (accept(","));
      expect(")");
    }
    if (args.size() < intrinsic.minArgs || args.size() > intrinsic.maxArgs) {
      throw error("wrong number of arguments to " + intrinsic.name() +
                  ": " + args.size());
    }
    return IntrinsicCall.create(intrinsic, args);
  }

  /**
   * Variable, array access or structure access: the target of an
   * assignment or a value in an expression
   */
  Reference designator()
        throws InvalidSyntaxException, UnsupportedConstructException {
    String name = expectName();
    Symbol sym = resolve(name);
    List<Node> subscripts = null;
    if (peek().is("(")) {
      if (sym instanceof DataSymbol && ((DataSymbol)sym).isScalar()) {
        throw new UnsupportedConstructException("substring of '" + name +
                                                "'");
      }
      subscripts = subscripts(sym);
    }
    if (peek().is("%")) {
      if (subscripts != null) {
        throw new UnsupportedConstructException("component of array " +
                                                "element '" + name + "'");
      }
      return StructureReference.create(sym, member());
    }
    if (subscripts != null) {
      return ArrayReference.create(sym, subscripts);
    }
    return new Reference(sym);
  }

  private Member member()
        throws InvalidSyntaxException, UnsupportedConstructException {
    expect("%");
    String name = expectName();
    List<Node> subscripts = new ArrayList<Node>();
    if (peek().is("(")) {
      subscripts = subscripts(null);
    }
    Member next = peek().is("%") ? member() : null;
    return Member.create(name, subscripts, next);
  }

  /**
   * Parse (s1, s2, ...) where each subscript is an expression or a range.
   * Omitted range bounds become LBOUND/UBOUND of the array.
   * @param array array being indexed, or null for a structure component
   */
  private List<Node> subscripts(Symbol array)
        throws InvalidSyntaxException, UnsupportedConstructException {
    expect("(");
    List<Node> result = new ArrayList<Node>();
    int dim = 1;
    do {
      Node start = null;
      if (!peek().is(":")) {
        start = expression();
      }
      if (accept(":")) {
        Node stop = null;
        if (!peek().is(":") && !peek().is(",") && !peek().is(")")) {
          stop = expression();
        }
        Node step = accept(":") ? expression() : Literal.integer(1);
        if (array == null && (start == null || stop == null)) {
          throw new UnsupportedConstructException("range with omitted " +
                                      "bound in a structure component");
        }
        if (start == null) {
          start = bound(Intrinsic.LBOUND, array, dim);
        }
        if (stop == null) {
          stop = bound(Intrinsic.UBOUND, array, dim);
        }
        result.add(Range.create(start, stop, step));
      } else {
        result.add(start);
      }
      dim++;
    } while (accept(","));
    expect(")");
    return result;
  }

  private static Node bound(Intrinsic which, Symbol array, int dim) {
    return IntrinsicCall.create(which, Arrays.asList(new Reference(array),
                                                     Literal.integer(dim)));
  }

  /**
   * Find the symbol for a name, adding an unresolved symbol if it isn't
   * declared
   */
  Symbol resolve(String name) {
    Symbol sym = table.findSymbol(name);
    if (sym != null) {
      return sym;
    }
    if (!hasWildcardImport()) {
      Logging.uniqueWarn("Symbol '" + name + "' is not declared: assuming " +
                         "it is defined elsewhere (" + file + ":" + line + ")");
    }
    DataSymbol unresolved = new DataSymbol(name, Types.DEFERRED,
                                           SymbolInterface.unresolved());
    try {
      table.add(unresolved);
    } catch (NameCollisionException e) {
      throw new SCTRuntimeError("Name '" + name + "' was not found but " +
                                "collides", e);
    }
    return unresolved;
  }

  private boolean hasWildcardImport() {
    for (SymbolTable t = table; t != null; t = t.parentSymbolTable()) {
      for (ContainerSymbol c: t.getContainerSymbols()) {
        if (c.hasWildcardImport()) {
          return true;
        }
      }
    }
    return false;
  }
}
