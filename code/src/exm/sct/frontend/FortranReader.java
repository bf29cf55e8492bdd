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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import exm.sct.common.Logging;
import exm.sct.common.exceptions.InvalidSyntaxException;
import exm.sct.common.exceptions.NameCollisionException;
import exm.sct.common.exceptions.SymbolException;
import exm.sct.frontend.FortranLexer.Statement;
import exm.sct.ir.symbols.ContainerSymbol;
import exm.sct.ir.symbols.DataSymbol;
import exm.sct.ir.symbols.RoutineSymbol;
import exm.sct.ir.symbols.Symbol;
import exm.sct.ir.symbols.SymbolInterface;
import exm.sct.ir.symbols.SymbolInterface.Access;
import exm.sct.ir.symbols.SymbolTable;
import exm.sct.ir.symbols.Types;
import exm.sct.ir.symbols.Types.ArrayType;
import exm.sct.ir.symbols.Types.Extent;
import exm.sct.ir.symbols.Types.ScalarType;
import exm.sct.ir.symbols.Types.Type;
import exm.sct.ir.symbols.Types.UnknownType;
import exm.sct.ir.tree.Assignment;
import exm.sct.ir.tree.Call;
import exm.sct.ir.tree.CodeBlock;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.Directive;
import exm.sct.ir.tree.IfBlock;
import exm.sct.ir.tree.Literal;
import exm.sct.ir.tree.Loop;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.Return;
import exm.sct.ir.tree.Routine;

/**
 * Reads free-form Fortran into the IR.
 *
 * Modules, subroutines and main programs are supported.  Declarations of
 * integer, real and logical scalars and arrays become typed symbols; any
 * other declaration is kept verbatim.  Loops, if blocks, assignments, calls
 * and directives become IR nodes.  Any other executable statement, or one
 * using a construct the IR can't express, is kept as a code block.
 */
public class FortranReader {

  private static final String DEFAULT_FILE = "<source>";

  /** Statements that end or split a block */
  private static final Set<String> BLOCK_KEYWORDS = ImmutableSet.of(
      "end", "end do", "end if", "else", "else if", "end subroutine",
      "end program", "end module", "end function", "contains");

  /** Specification statements that are skipped with a warning */
  private static final Set<String> IGNORED_SPECIFICATIONS = ImmutableSet.of(
      "public", "private", "save", "external", "intrinsic", "data",
      "common", "equivalence", "namelist", "target", "pointer",
      "allocatable", "optional", "protected", "volatile", "import",
      "sequence");

  /** Prefixes that can appear before subroutine */
  private static final Set<String> PROCEDURE_PREFIXES = ImmutableSet.of(
      "pure", "elemental", "recursive", "impure");

  private final Logger logger;

  public FortranReader(Logger logger) {
    this.logger = logger;
  }

  public FortranReader() {
    this(Logging.getSCTLogger());
  }

  public Container psyirFromSource(String source)
                                        throws InvalidSyntaxException {
    return psyirFromSource(source, DEFAULT_FILE);
  }

  /**
   * Read a complete source file
   * @param source Fortran source text
   * @param fileName name used in error messages
   * @return file container holding the modules and routines of the source
   * @throws InvalidSyntaxException if the source cannot be read
   */
  public Container psyirFromSource(String source, String fileName)
                                        throws InvalidSyntaxException {
    FortranLexer lexer = new FortranLexer(fileName);
    Input in = new Input(fileName, lexer, lexer.statements(source));
    Container file = new Container(Container.FILE_CONTAINER);
    while (!in.done()) {
      Statement stmt = in.peek();
      if (stmt.directive) {
        throw in.error(stmt, "directive outside of a routine");
      }
      List<Token> tokens = in.tokens(stmt);
      String head = head(tokens);
      if (head.equals("module")) {
        readModule(in, file);
      } else if (head.equals("program")) {
        readProgram(in, file);
      } else if (isSubroutine(tokens)) {
        readSubroutine(in, file);
      } else if (isFunction(tokens)) {
        throw in.error(stmt, "functions are not supported");
      } else {
        throw in.error(stmt, "expected module, subroutine or program " +
                             "but found: " + stmt.text);
      }
    }
    logger.debug("Read " + file.numChildren() + " program units from " +
                 fileName);
    return file;
  }

  /**
   * Statements of the source and the reading position
   */
  private static class Input {
    final String file;
    final FortranLexer lexer;
    final List<Statement> statements;
    int pos = 0;
    final Map<Statement, List<Token>> tokenCache =
                              new HashMap<Statement, List<Token>>();

    Input(String file, FortranLexer lexer, List<Statement> statements) {
      this.file = file;
      this.lexer = lexer;
      this.statements = statements;
    }

    boolean done() {
      return pos >= statements.size();
    }

    Statement peek() {
      return statements.get(pos);
    }

    Statement next() {
      return statements.get(pos++);
    }

    List<Token> tokens(Statement stmt) throws InvalidSyntaxException {
      List<Token> tokens = tokenCache.get(stmt);
      if (tokens == null) {
        tokens = lexer.tokenize(stmt);
        tokenCache.put(stmt, tokens);
      }
      return tokens;
    }

    ExpressionParser parser(Statement stmt, SymbolTable table)
                                        throws InvalidSyntaxException {
      return new ExpressionParser(tokens(stmt), 0, table, file, stmt.line);
    }

    InvalidSyntaxException error(Statement stmt, String msg) {
      return new InvalidSyntaxException(file, stmt.line, msg);
    }

    InvalidSyntaxException endOfInput(String expected) {
      int line = statements.isEmpty() ? -1 :
                 statements.get(statements.size() - 1).line;
      return new InvalidSyntaxException(file, line, "end of source " +
                                        "before " + expected);
    }
  }

  /**
   * Leading keyword of a statement, with compound keywords such as "end do"
   * and "else if" normalised to two words
   */
  private static String head(List<Token> tokens) {
    Token first = tokens.get(0);
    if (first.kind != Token.Kind.NAME) {
      return "";
    }
    String word = first.text;
    Token second = tokens.get(1);
    if (word.equals("end")) {
      return second.kind == Token.Kind.NAME ? "end " + second.text : "end";
    } else if (word.equals("else")) {
      return second.is("if") ? "else if" : "else";
    } else if (word.equals("double") && second.is("precision")) {
      return "double precision";
    } else if (word.equals("elseif")) {
      return "else if";
    } else if (word.startsWith("end") && word.length() > 3 &&
               BLOCK_KEYWORDS.contains("end " + word.substring(3))) {
      return "end " + word.substring(3);
    }
    return word;
  }

  private static boolean isSubroutine(List<Token> tokens) {
    return leadingKeyword(tokens).equals("subroutine");
  }

  private static boolean isFunction(List<Token> tokens) {
    int depth = 0;
    for (Token t: tokens) {
      if (t.is("(")) {
        depth++;
      } else if (t.is(")")) {
        depth--;
      } else if (depth == 0 && t.is("function")) {
        return true;
      } else if (depth == 0 && (t.is("=") || t.is("::"))) {
        return false;
      }
    }
    return false;
  }

  /**
   * @return first word after any procedure prefixes
   */
  private static String leadingKeyword(List<Token> tokens) {
    for (Token t: tokens) {
      if (t.kind != Token.Kind.NAME || !PROCEDURE_PREFIXES.contains(t.text)) {
        return t.kind == Token.Kind.NAME ? t.text : "";
      }
    }
    return "";
  }

  private void readModule(Input in, Container file)
                                        throws InvalidSyntaxException {
    Statement stmt = in.next();
    ExpressionParser p = in.parser(stmt, file.getSymbolTable());
    p.expectName();
    if (p.peek().is("procedure")) {
      throw in.error(stmt, "module procedures are not supported");
    }
    String name = p.expectName();
    p.expectEnd();
    Container module = new Container(name);
    module.setLine(stmt.line);
    file.addChild(module);

    readSpecification(in, module.getSymbolTable(),
                      Collections.<String>emptyList());
    if (in.done()) {
      throw in.endOfInput("end module " + name);
    }
    if (head(in.tokens(in.peek())).equals("contains")) {
      in.next();
      while (!in.done()) {
        Statement s = in.peek();
        List<Token> tokens = in.tokens(s);
        if (isModuleEnd(head(tokens))) {
          break;
        } else if (!s.directive && isSubroutine(tokens)) {
          readSubroutine(in, module);
        } else if (!s.directive && isFunction(tokens)) {
          throw in.error(s, "functions are not supported");
        } else {
          throw in.error(s, "expected a subroutine in module " + name +
                            " but found: " + s.text);
        }
      }
    }
    if (in.done()) {
      throw in.endOfInput("end module " + name);
    }
    Statement end = in.next();
    if (!isModuleEnd(head(in.tokens(end)))) {
      throw in.error(end, "unexpected statement in module " + name +
                          ": " + end.text);
    }
    logger.debug("Read module " + name);
  }

  private static boolean isModuleEnd(String head) {
    return head.equals("end module") || head.equals("end");
  }

  private void readSubroutine(Input in, Container parent)
                                        throws InvalidSyntaxException {
    Statement stmt = in.next();
    ExpressionParser p = in.parser(stmt, parent.getSymbolTable());
    while (!p.peek().is("subroutine")) {
      p.next();
    }
    p.expect("subroutine");
    String name = p.expectName();
    List<String> argNames = new ArrayList<String>();
    if (p.accept("(")) {
      if (!p.accept(")")) {
        do {
          if (p.accept("*")) {
            throw in.error(stmt, "alternate returns are not supported");
          }
          argNames.add(p.expectName());
        } while (p.accept(","));
        p.expect(")");
      }
    }
    if (!p.atEnd()) {
      Logging.uniqueWarn("Ignoring suffix of subroutine statement: " +
                         stmt.text);
    }
    Routine routine = new Routine(name);
    routine.setLine(stmt.line);
    parent.addChild(routine);
    SymbolTable table = routine.getSymbolTable();

    readSpecification(in, table, argNames);
    table.specifyArgumentList(arguments(table, argNames));
    readRoutineBody(in, routine, "end subroutine");
    logger.debug("Read subroutine " + name + " with " + argNames.size() +
                 " arguments");
  }

  private void readProgram(Input in, Container parent)
                                        throws InvalidSyntaxException {
    Statement stmt = in.next();
    ExpressionParser p = in.parser(stmt, parent.getSymbolTable());
    p.expect("program");
    String name = p.expectName();
    p.expectEnd();
    Routine program = new Routine(name, true);
    program.setLine(stmt.line);
    parent.addChild(program);

    readSpecification(in, program.getSymbolTable(),
                      Collections.<String>emptyList());
    readRoutineBody(in, program, "end program");
    logger.debug("Read program " + name);
  }

  private void readRoutineBody(Input in, Routine routine, String endKeyword)
                                        throws InvalidSyntaxException {
    Set<String> terminators = ImmutableSet.of(endKeyword, "end", "contains");
    List<Node> body = readBlock(in, routine.getSymbolTable(), terminators);
    Statement end = in.next();
    if (head(in.tokens(end)).equals("contains")) {
      throw in.error(end, "internal procedures are not supported");
    }
    routine.addChildren(body, 0);
  }

  /**
   * Argument symbols in order.  Arguments that weren't declared are added
   * with a deferred type.
   */
  private static List<DataSymbol> arguments(SymbolTable table,
        List<String> argNames) throws InvalidSyntaxException {
    List<DataSymbol> args = new ArrayList<DataSymbol>();
    for (String name: argNames) {
      Symbol sym = table.containsName(name) ? table.findSymbol(name) : null;
      if (sym == null) {
        DataSymbol arg = new DataSymbol(name, Types.DEFERRED,
                                  SymbolInterface.argument(Access.UNKNOWN));
        addSymbol(table, arg, null);
        args.add(arg);
      } else if (sym instanceof DataSymbol) {
        if (!sym.isArgument()) {
          sym.setInterface(SymbolInterface.argument(Access.UNKNOWN));
        }
        args.add((DataSymbol)sym);
      } else {
        throw new InvalidSyntaxException("Argument '" + name +
                                         "' is not a variable");
      }
    }
    return args;
  }

  private static void addSymbol(SymbolTable table, Symbol sym, Statement stmt)
                                        throws InvalidSyntaxException {
    try {
      table.add(sym);
    } catch (NameCollisionException e) {
      throw new InvalidSyntaxException("Symbol '" + sym.getName() +
          "' is declared more than once" +
          (stmt == null ? "" : " (line " + stmt.line + ")"));
    }
  }

  /**
   * Read specification statements until the first statement that isn't
   * one
   */
  private void readSpecification(Input in, SymbolTable table,
        List<String> argNames) throws InvalidSyntaxException {
    while (!in.done()) {
      Statement stmt = in.peek();
      if (stmt.directive) {
        return;
      }
      List<Token> tokens = in.tokens(stmt);
      String head = head(tokens);
      if (head.equals("use")) {
        in.next();
        readUse(in, stmt, table);
      } else if (head.equals("implicit")) {
        in.next();
        if (!tokens.get(1).is("none")) {
          Logging.uniqueWarn("Ignoring implicit typing: " + stmt.text);
        }
      } else if (head.equals("type") && !tokens.get(1).is("(")) {
        throw in.error(stmt, "derived type definitions are not supported");
      } else if (head.equals("interface") || head.equals("abstract")) {
        throw in.error(stmt, "interface blocks are not supported");
      } else if (isTypeDeclaration(head, tokens)) {
        in.next();
        readDeclaration(in, stmt, table, argNames);
      } else if (IGNORED_SPECIFICATIONS.contains(head) ||
                 head.equals("parameter") || head.equals("dimension")) {
        in.next();
        Logging.uniqueWarn("Ignoring unsupported specification statement: " +
                           stmt.text);
      } else {
        return;
      }
    }
  }

  private static boolean isTypeDeclaration(String head, List<Token> tokens) {
    if (isFunction(tokens)) {
      return false;
    }
    return head.equals("integer") || head.equals("real") ||
           head.equals("logical") || head.equals("double precision") ||
           head.equals("character") || head.equals("complex") ||
           head.equals("type") || head.equals("class");
  }

  private void readUse(Input in, Statement stmt, SymbolTable table)
                                        throws InvalidSyntaxException {
    ExpressionParser p = in.parser(stmt, table);
    p.expect("use");
    if (p.accept(",")) {
      // use, intrinsic :: name
      p.expectName();
    }
    p.accept("::");
    String moduleName = p.expectName();
    ContainerSymbol module;
    Symbol existing = table.containsName(moduleName) ?
                      table.findSymbol(moduleName) : null;
    if (existing instanceof ContainerSymbol) {
      module = (ContainerSymbol)existing;
    } else {
      module = new ContainerSymbol(moduleName);
      addSymbol(table, module, stmt);
    }
    if (p.atEnd()) {
      module.setWildcardImport(true);
      return;
    }
    p.expect(",");
    if (!p.peek().is("only")) {
      throw in.error(stmt, "renamed imports are not supported: " + stmt.text);
    }
    p.expect("only");
    p.expect(":");
    if (p.atEnd()) {
      return;
    }
    do {
      String name = p.expectName();
      if (p.peek().is("=>")) {
        throw in.error(stmt, "renamed imports are not supported: " +
                             stmt.text);
      }
      if (!table.containsName(name)) {
        addSymbol(table, new Symbol(name, SymbolInterface.imported(module)),
                  stmt);
      }
    } while (p.accept(","));
    p.expectEnd();
  }

  /**
   * Declaration of one or more entities.  A declaration whose type or
   * attributes can't be represented is kept verbatim, one entity at a
   * time.
   */
  private void readDeclaration(Input in, Statement stmt, SymbolTable table,
        List<String> argNames) throws InvalidSyntaxException {
    ExpressionParser p = in.parser(stmt, table);
    DeclaredType declared;
    try {
      declared = declaredType(p);
    } catch (UnsupportedConstructException e) {
      logger.debug("Keeping declaration verbatim: " + e.getMessage());
      declared = null;
    }

    int sep = separatorIndex(stmt.text);
    if (sep < 0) {
      sep = typeSpecEnd(stmt.text);
    }
    String prefix = stmt.text.substring(0, sep).trim();
    String rest = stmt.text.substring(sep);
    if (rest.startsWith("::")) {
      rest = rest.substring(2);
    }
    for (String entity: splitTopLevel(rest)) {
      if (declared == null) {
        verbatimEntity(in, stmt, table, argNames, prefix, entity);
        continue;
      }
      Statement entityStmt = new Statement(entity, stmt.line, false);
      ExpressionParser ep = in.parser(entityStmt, table);
      String name = ep.expectName();
      try {
        declareEntity(ep, stmt, table, argNames, declared, name);
        ep.expectEnd();
      } catch (UnsupportedConstructException e) {
        logger.debug("Keeping declaration of " + name + " verbatim: " +
                     e.getMessage());
        removeIfAdded(table, name);
        verbatimEntity(in, stmt, table, argNames, prefix, entity);
      }
    }
  }

  /**
   * Type and attributes shared by the entities of a declaration
   */
  private static class DeclaredType {
    ScalarType scalar;
    List<Extent> shape = null;
    Access intent = null;
    boolean parameter = false;
  }

  private static DeclaredType declaredType(ExpressionParser p)
        throws InvalidSyntaxException, UnsupportedConstructException {
    DeclaredType declared = new DeclaredType();
    String typeName = p.expectName();
    if (typeName.equals("double")) {
      p.expect("precision");
      declared.scalar = Types.DOUBLE_TYPE;
    } else if (typeName.equals("integer") || typeName.equals("real") ||
               typeName.equals("logical")) {
      Types.Intrinsic intrinsic = typeName.equals("integer") ?
          Types.Intrinsic.INTEGER : typeName.equals("real") ?
          Types.Intrinsic.REAL : Types.Intrinsic.BOOLEAN;
      int precision = Types.DEFAULT_PRECISION;
      if (p.accept("(")) {
        if (p.peek().is("kind") && p.peek(1).is("=")) {
          p.next();
          p.next();
        }
        Token kind = p.next();
        if (kind.kind != Token.Kind.INTEGER || !p.peek().is(")")) {
          throw new UnsupportedConstructException("kind selector");
        }
        precision = Integer.parseInt(kind.text);
        p.expect(")");
      } else if (p.peek().is("*")) {
        throw new UnsupportedConstructException("length selector");
      }
      declared.scalar = new ScalarType(intrinsic, precision);
    } else {
      throw new UnsupportedConstructException("type " + typeName);
    }

    while (p.accept(",")) {
      String attr = p.expectName();
      if (attr.equals("intent")) {
        p.expect("(");
        String intent = p.expectName();
        if (intent.equals("in") && p.peek().is("out")) {
          p.next();
          intent = "inout";
        }
        p.expect(")");
        if (intent.equals("in")) {
          declared.intent = Access.READ;
        } else if (intent.equals("out")) {
          declared.intent = Access.WRITE;
        } else if (intent.equals("inout")) {
          declared.intent = Access.READWRITE;
        } else {
          throw p.error("unknown intent '" + intent + "'");
        }
      } else if (attr.equals("dimension")) {
        declared.shape = shape(p);
      } else if (attr.equals("parameter")) {
        declared.parameter = true;
      } else {
        throw new UnsupportedConstructException("attribute " + attr);
      }
    }
    p.accept("::");
    return declared;
  }

  /**
   * Parse (e1, e2, ...) where each extent is a literal, a declared scalar
   * or ':'
   */
  private static List<Extent> shape(ExpressionParser p)
        throws InvalidSyntaxException, UnsupportedConstructException {
    p.expect("(");
    List<Extent> shape = new ArrayList<Extent>();
    do {
      Token t = p.peek();
      Token after = p.peek(1);
      boolean alone = after.is(",") || after.is(")");
      if (t.is(":") && alone) {
        p.next();
        shape.add(Extent.deferred());
      } else if (t.kind == Token.Kind.INTEGER && alone) {
        p.next();
        shape.add(Extent.of(Integer.parseInt(t.text)));
      } else if (t.kind == Token.Kind.NAME && alone) {
        p.next();
        Symbol sym = p.resolve(t.text);
        if (!(sym instanceof DataSymbol)) {
          throw new UnsupportedConstructException("extent '" + t.text + "'");
        }
        try {
          shape.add(Extent.of((DataSymbol)sym));
        } catch (IllegalArgumentException e) {
          throw new UnsupportedConstructException("extent '" + t.text +
                                                  "': " + e.getMessage());
        }
      } else {
        throw new UnsupportedConstructException("array bounds");
      }
    } while (p.accept(","));
    p.expect(")");
    return shape;
  }

  private void declareEntity(ExpressionParser p, Statement stmt,
        SymbolTable table, List<String> argNames, DeclaredType declared,
        String name)
        throws InvalidSyntaxException, UnsupportedConstructException {
    List<Extent> shape = declared.shape;
    if (p.peek().is("(")) {
      shape = shape(p);
    }
    if (p.peek().is("*")) {
      throw new UnsupportedConstructException("length of '" + name + "'");
    }
    Type type = shape == null ? declared.scalar :
                new ArrayType(declared.scalar, shape);
    DataSymbol sym = declare(table, stmt, argNames, name, type,
                             declared.intent);
    if (p.accept("=")) {
      if (!declared.parameter) {
        throw new UnsupportedConstructException("initial value of '" +
                                                name + "'");
      }
      sym.setConstantValue(p.expression());
    } else if (declared.parameter) {
      throw p.error("parameter '" + name + "' has no value");
    } else if (p.peek().is("=>")) {
      throw new UnsupportedConstructException("pointer initialisation");
    }
  }

  /**
   * Add a declared variable, or complete the symbol if the name was used
   * before it was declared
   */
  private static DataSymbol declare(SymbolTable table, Statement stmt,
        List<String> argNames, String name, Type type, Access intent)
                                        throws InvalidSyntaxException {
    SymbolInterface iface;
    if (argNames.contains(name)) {
      iface = SymbolInterface.argument(intent == null ? Access.UNKNOWN
                                                      : intent);
    } else if (intent != null) {
      throw new InvalidSyntaxException("Intent given for '" + name +
          "', which is not an argument (line " + stmt.line + ")");
    } else {
      iface = SymbolInterface.local();
    }
    Symbol existing = table.containsName(name) ? table.findSymbol(name)
                                               : null;
    if (existing instanceof DataSymbol && existing.isUnresolved()) {
      DataSymbol sym = (DataSymbol)existing;
      sym.resolveType(type);
      sym.setInterface(iface);
      return sym;
    }
    DataSymbol sym = new DataSymbol(name, type, iface);
    addSymbol(table, sym, stmt);
    return sym;
  }

  private static void verbatimEntity(Input in, Statement stmt,
        SymbolTable table, List<String> argNames, String prefix,
        String entity) throws InvalidSyntaxException {
    String name = leadingName(entity);
    if (name == null) {
      throw in.error(stmt, "expected a name in declaration: " + stmt.text);
    }
    Type type = new UnknownType(prefix + " :: " + entity);
    SymbolInterface iface = argNames.contains(name) ?
          SymbolInterface.argument(Access.UNKNOWN) : SymbolInterface.local();
    Symbol existing = table.containsName(name) ? table.findSymbol(name)
                                               : null;
    if (existing instanceof DataSymbol && existing.isUnresolved()) {
      ((DataSymbol)existing).resolveType(type);
      existing.setInterface(iface);
    } else {
      addSymbol(table, new DataSymbol(name, type, iface), stmt);
    }
  }

  private static void removeIfAdded(SymbolTable table, String name) {
    if (!table.containsName(name)) {
      return;
    }
    try {
      table.remove(table.lookup(name));
    } catch (SymbolException e) {
      // Still referenced by an earlier extent: keep it
      Logging.getSCTLogger().debug("Could not remove " + name + ": " +
                                   e.getMessage());
    }
  }

  private static String leadingName(String text) {
    int end = 0;
    while (end < text.length() &&
           (Character.isLetterOrDigit(text.charAt(end)) ||
            text.charAt(end) == '_')) {
      end++;
    }
    if (end == 0 || !Character.isLetter(text.charAt(0))) {
      return null;
    }
    return text.substring(0, end).toLowerCase();
  }

  /**
   * @return index after the type specification of a declaration without
   *         "::", such as "integer" or "real(8)"
   */
  private static int typeSpecEnd(String text) {
    int i = wordEnd(text, 0);
    if (text.substring(0, i).equalsIgnoreCase("double")) {
      while (i < text.length() && text.charAt(i) == ' ') {
        i++;
      }
      i = wordEnd(text, i);
    }
    while (i < text.length() && text.charAt(i) == ' ') {
      i++;
    }
    if (i < text.length() && text.charAt(i) == '(') {
      i = closingParen(text.substring(i)) + i + 1;
    } else if (i < text.length() && text.charAt(i) == '*') {
      i++;
      while (i < text.length() && Character.isDigit(text.charAt(i))) {
        i++;
      }
    }
    return i;
  }

  private static int wordEnd(String text, int start) {
    int i = start;
    while (i < text.length() && Character.isLetter(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static int separatorIndex(String text) {
    char quote = 0;
    for (int i = 0; i + 1 < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ':' && text.charAt(i + 1) == ':') {
        return i;
      }
    }
    return -1;
  }

  private static List<String> splitTopLevel(String text) {
    List<String> parts = new ArrayList<String>();
    int depth = 0;
    char quote = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(' || c == '[') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(text.substring(start, i).trim());
        start = i + 1;
      }
    }
    parts.add(text.substring(start).trim());
    return parts;
  }

  /**
   * Read statements until one whose keyword is in terminators, which is
   * left unread
   */
  private List<Node> readBlock(Input in, SymbolTable table,
        Set<String> terminators) throws InvalidSyntaxException {
    List<Node> block = new ArrayList<Node>();
    while (true) {
      if (in.done()) {
        throw in.endOfInput(terminators.iterator().next());
      }
      Statement stmt = in.peek();
      if (!stmt.directive) {
        String head = head(in.tokens(stmt));
        if (terminators.contains(head)) {
          return block;
        }
        if (BLOCK_KEYWORDS.contains(head)) {
          throw in.error(stmt, "unexpected '" + head + "'");
        }
      } else if (isEndDirective(stmt)) {
        throw in.error(stmt, "end directive without a matching directive: " +
                             stmt.text);
      }
      block.addAll(readStatement(in, table));
    }
  }

  /**
   * Read one statement, which may be a block construct
   * @return nodes for the statement
   */
  private List<Node> readStatement(Input in, SymbolTable table)
                                        throws InvalidSyntaxException {
    Statement stmt = in.peek();
    if (stmt.directive) {
      return readDirective(in, table);
    }
    List<Token> tokens = in.tokens(stmt);
    String head = head(tokens);
    Node result;
    if (tokens.get(0).kind == Token.Kind.NAME && tokens.get(1).is(":") &&
        !tokens.get(2).is(":")) {
      throw in.error(stmt, "named constructs are not supported");
    } else if (head.equals("do")) {
      result = readLoop(in, table);
    } else if (head.equals("if")) {
      result = readIf(in, table);
    } else if (head.equals("select") || head.equals("where") ||
               head.equals("forall") || head.equals("block") ||
               head.equals("associate")) {
      throw in.error(stmt, "'" + head + "' constructs are not supported");
    } else {
      in.next();
      result = simpleStatement(in, stmt, table);
    }
    return Collections.singletonList(result);
  }

  private Loop readLoop(Input in, SymbolTable table)
                                        throws InvalidSyntaxException {
    Statement stmt = in.next();
    ExpressionParser p = in.parser(stmt, table);
    p.expect("do");
    if (p.atEnd() || p.peek().is("while") || p.peek().is("concurrent")) {
      throw in.error(stmt, "only counted do loops are supported: " +
                           stmt.text);
    }
    if (p.peek().kind == Token.Kind.INTEGER) {
      throw in.error(stmt, "labelled do loops are not supported");
    }
    Node start, stop, step;
    DataSymbol var;
    try {
      Symbol sym = p.resolve(p.expectName());
      if (!(sym instanceof DataSymbol)) {
        throw in.error(stmt, "loop variable '" + sym.getName() +
                             "' is not a variable");
      }
      var = (DataSymbol)sym;
      p.expect("=");
      start = p.expression();
      p.expect(",");
      stop = p.expression();
      step = p.accept(",") ? p.expression() : Literal.integer(1);
      p.expectEnd();
    } catch (UnsupportedConstructException e) {
      throw in.error(stmt, e.getMessage() + " in loop bounds");
    }
    List<Node> body = readBlock(in, table, ImmutableSet.of("end do"));
    in.next();
    Loop loop = Loop.create(var, start, stop, step, body);
    loop.setLine(stmt.line);
    return loop;
  }

  private IfBlock readIf(Input in, SymbolTable table)
                                        throws InvalidSyntaxException {
    Statement stmt = in.next();
    ExpressionParser p = in.parser(stmt, table);
    p.expect("if");
    Node condition = condition(in, stmt, p);
    if (p.accept("then")) {
      p.expectEnd();
      IfBlock block = ifRest(in, table, condition, stmt);
      in.next();
      return block;
    }
    // Single statement if
    String rest = stmt.text.substring(closingParen(stmt.text) + 1).trim();
    Statement inner = new Statement(rest, stmt.line, false);
    String innerHead = head(in.tokens(inner));
    if (innerHead.equals("if") || innerHead.equals("do") ||
        BLOCK_KEYWORDS.contains(innerHead)) {
      throw in.error(stmt, "invalid statement in logical if: " + rest);
    }
    IfBlock block = IfBlock.create(condition,
        Collections.singletonList(simpleStatement(in, inner, table)), null);
    block.setLine(stmt.line);
    return block;
  }

  /**
   * Body and else parts of an if block, leaving the "end if" unread.
   * An "else if" becomes an if block inside the else body.
   */
  private IfBlock ifRest(Input in, SymbolTable table, Node condition,
        Statement stmt) throws InvalidSyntaxException {
    Set<String> ends = ImmutableSet.of("else", "else if", "end if");
    List<Node> ifBody = readBlock(in, table, ends);
    List<Node> elseBody = null;
    Statement next = in.peek();
    String head = head(in.tokens(next));
    if (head.equals("else if")) {
      in.next();
      ExpressionParser p = in.parser(next, table);
      p.next();
      if (p.peek().is("if")) {
        p.next();
      }
      Node elseCondition = condition(in, next, p);
      p.expect("then");
      p.expectEnd();
      elseBody = Collections.<Node>singletonList(
                      ifRest(in, table, elseCondition, next));
    } else if (head.equals("else")) {
      in.next();
      elseBody = readBlock(in, table, ImmutableSet.of("end if"));
    }
    IfBlock block = IfBlock.create(condition, ifBody, elseBody);
    block.setLine(stmt.line);
    return block;
  }

  private static Node condition(Input in, Statement stmt, ExpressionParser p)
                                        throws InvalidSyntaxException {
    p.expect("(");
    try {
      Node condition = p.expression();
      p.expect(")");
      return condition;
    } catch (UnsupportedConstructException e) {
      throw in.error(stmt, e.getMessage() + " in condition");
    }
  }

  /**
   * @return index of the parenthesis closing the first one in text
   */
  private static int closingParen(String text) {
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return text.length() - 1;
  }

  /**
   * Directive and the statements it applies to.  The body runs to a
   * directive with the same sentinel and "end" followed by the directive
   * name.  Without one, the directive applies to the next statement only.
   */
  private List<Node> readDirective(Input in, SymbolTable table)
                                        throws InvalidSyntaxException {
    Statement begin = in.next();
    List<Node> body = new ArrayList<Node>();
    while (!in.done()) {
      Statement next = in.peek();
      if (next.directive) {
        if (isEndOf(begin, next)) {
          in.next();
          Directive d = Directive.create(begin.text, next.text, body);
          d.setLine(begin.line);
          return Collections.<Node>singletonList(d);
        } else if (isEndDirective(next)) {
          break;
        }
      } else if (BLOCK_KEYWORDS.contains(head(in.tokens(next)))) {
        break;
      }
      body.addAll(readStatement(in, table));
    }

    List<Node> result = new ArrayList<Node>();
    Directive d;
    if (body.isEmpty()) {
      d = Directive.create(begin.text, null, body);
    } else {
      d = Directive.create(begin.text, null, body.subList(0, 1));
      result.addAll(body.subList(1, body.size()));
    }
    d.setLine(begin.line);
    result.add(0, d);
    return result;
  }

  private static List<String> words(String text) {
    List<String> words = new ArrayList<String>();
    for (String w: text.toLowerCase().split("[\\s(,]+")) {
      if (!w.isEmpty()) {
        words.add(w);
      }
    }
    return words;
  }

  private static boolean isEndDirective(Statement stmt) {
    List<String> w = words(stmt.text);
    return w.size() >= 2 && w.get(1).equals("end");
  }

  private static boolean isEndOf(Statement begin, Statement end) {
    List<String> b = words(begin.text);
    List<String> e = words(end.text);
    if (e.size() < 2 || b.isEmpty() || !e.get(0).equals(b.get(0)) ||
        !e.get(1).equals("end")) {
      return false;
    }
    // Directive name after "end" must match the start of the begin text
    for (int i = 2; i < e.size(); i++) {
      int bi = i - 1;
      if (bi >= b.size() || !b.get(bi).equals(e.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAssignment(List<Token> tokens) {
    int depth = 0;
    for (Token t: tokens) {
      if (t.is("(")) {
        depth++;
      } else if (t.is(")")) {
        depth--;
      } else if (depth == 0 && (t.is("=") || t.is("=>"))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Assignment, call, return, or a code block for anything else
   */
  private Node simpleStatement(Input in, Statement stmt, SymbolTable table)
                                        throws InvalidSyntaxException {
    List<Token> tokens = in.tokens(stmt);
    String head = head(tokens);
    Node result;
    try {
      if (isAssignment(tokens)) {
        result = assignment(in, stmt, table);
      } else if (head.equals("call")) {
        result = call(in, stmt, table);
      } else if (head.equals("return") && tokens.get(1).kind ==
                                          Token.Kind.END) {
        result = new Return();
      } else {
        result = codeBlock(in, stmt, table);
      }
    } catch (UnsupportedConstructException e) {
      logger.debug("Line " + stmt.line + ": " + e.getMessage() +
                   ": keeping statement as a code block");
      result = codeBlock(in, stmt, table);
    } catch (InvalidSyntaxException e) {
      // Valid Fortran outside the expression subset, e.g. concatenation
      logger.debug("Line " + stmt.line + ": could not parse: " +
                   e.getMessage() + ": keeping statement as a code block");
      result = codeBlock(in, stmt, table);
    }
    result.setLine(stmt.line);
    return result;
  }

  private static Node assignment(Input in, Statement stmt, SymbolTable table)
        throws InvalidSyntaxException, UnsupportedConstructException {
    ExpressionParser p = in.parser(stmt, table);
    Reference lhs = p.designator();
    if (p.peek().is("=>")) {
      throw new UnsupportedConstructException("pointer assignment");
    }
    p.expect("=");
    Node rhs = p.expression();
    p.expectEnd();
    return Assignment.create(lhs, rhs);
  }

  private static Node call(Input in, Statement stmt, SymbolTable table)
        throws InvalidSyntaxException, UnsupportedConstructException {
    ExpressionParser p = in.parser(stmt, table);
    p.expect("call");
    String name = p.expectName();
    if (p.peek().is("%")) {
      throw new UnsupportedConstructException("type-bound procedure call");
    }
    List<Node> args = new ArrayList<Node>();
    if (p.accept("(")) {
      if (!p.accept(")")) {
        do {
          if (p.peek().kind == Token.Kind.NAME && p.peek(1).is("=")) {
            throw new UnsupportedConstructException("keyword argument");
          }
          if (p.peek().is("*")) {
            throw new UnsupportedConstructException("alternate return");
          }
          args.add(p.expression());
        } while (p.accept(","));
        p.expect(")");
      }
    }
    p.expectEnd();
    return Call.create(routineSymbol(table, name), args);
  }

  /**
   * Symbol for a called routine.  An imported name is replaced by a
   * routine symbol with the same interface.
   */
  private static RoutineSymbol routineSymbol(SymbolTable table, String name)
        throws InvalidSyntaxException, UnsupportedConstructException {
    Symbol sym = table.findSymbol(name);
    if (sym instanceof RoutineSymbol) {
      return (RoutineSymbol)sym;
    } else if (sym == null) {
      RoutineSymbol routine = new RoutineSymbol(name,
                                        SymbolInterface.unresolved());
      addSymbol(table, routine, null);
      return routine;
    } else if (sym.getClass() == Symbol.class) {
      for (SymbolTable t = table; t != null; t = t.parentSymbolTable()) {
        if (t.contains(sym)) {
          RoutineSymbol routine = new RoutineSymbol(name, sym.getInterface());
          try {
            t.remove(sym);
            t.add(routine);
          } catch (SymbolException e) {
            throw new UnsupportedConstructException("call to '" + name +
                                        "': " + e.getMessage());
          }
          return routine;
        }
      }
    }
    throw new UnsupportedConstructException("call to '" + name +
                                            "', which is not a routine");
  }

  /**
   * Statement kept as text.  Names in it that are declared variables are
   * recorded so that analyses see the accesses.
   */
  private static Node codeBlock(Input in, Statement stmt, SymbolTable table)
                                        throws InvalidSyntaxException {
    Set<DataSymbol> symbols = new LinkedHashSet<DataSymbol>();
    for (Token t: in.tokens(stmt)) {
      if (t.kind == Token.Kind.NAME) {
        Symbol sym = table.findSymbol(t.text);
        if (sym instanceof DataSymbol) {
          symbols.add((DataSymbol)sym);
        }
      }
    }
    return new CodeBlock(Arrays.asList(stmt.text),
                         new ArrayList<DataSymbol>(symbols));
  }
}
