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
import java.util.List;

import exm.sct.common.exceptions.InvalidSyntaxException;

/**
 * Splits free-form Fortran source into statements and statements into
 * tokens.  Continuation lines are joined, comments removed and
 * semicolon-separated statements split.  Lines starting with the "!$"
 * sentinel are kept as directive statements.
 */
class FortranLexer {

  /**
   * One logical statement of the source
   */
  static class Statement {
    final String text;
    final int line;
    final boolean directive;

    Statement(String text, int line, boolean directive) {
      this.text = text;
      this.line = line;
      this.directive = directive;
    }

    @Override
    public String toString() {
      return line + ": " + text;
    }
  }

  private static final String[] SYMBOLS = {
    "**", "==", "/=", "<=", ">=", "=>", "::", "(", ")", ",", "=", "<", ">",
    "+", "-", "*", "/", "%", ":"
  };

  private static final String[] DOTTED = {
    ".and.", ".or.", ".not.", ".eq.", ".ne.", ".lt.", ".le.", ".gt.", ".ge.",
    ".true.", ".false.", ".eqv.", ".neqv."
  };

  private final String file;

  FortranLexer(String file) {
    this.file = file;
  }

  List<Statement> statements(String source) throws InvalidSyntaxException {
    List<Statement> result = new ArrayList<Statement>();
    String[] lines = source.split("\r?\n", -1);
    StringBuilder pending = null;
    int pendingLine = 0;
    for (int i = 0; i < lines.length; i++) {
      int lineNum = i + 1;
      String raw = lines[i];
      String trimmed = raw.trim();
      if (pending == null && trimmed.startsWith("!$")) {
        result.add(new Statement(trimmed.substring(2).trim(), lineNum, true));
        continue;
      }
      String code = stripComment(raw, lineNum).trim();
      if (pending != null) {
        if (code.startsWith("&")) {
          code = code.substring(1);
        }
        pending.append(code);
      } else {
        if (code.isEmpty()) {
          continue;
        }
        pending = new StringBuilder(code);
        pendingLine = lineNum;
      }
      int last = pending.length() - 1;
      if (last >= 0 && pending.charAt(last) == '&') {
        pending.setLength(last);
        continue;
      }
      for (String part: splitSemicolons(pending.toString())) {
        if (!part.trim().isEmpty()) {
          result.add(new Statement(part.trim(), pendingLine, false));
        }
      }
      pending = null;
    }
    if (pending != null) {
      throw new InvalidSyntaxException(file, pendingLine,
                          "continuation line at end of source");
    }
    return result;
  }

  private String stripComment(String line, int lineNum)
                                    throws InvalidSyntaxException {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '!') {
        return line.substring(0, i);
      }
    }
    if (quote != 0 && !line.trim().endsWith("&")) {
      throw new InvalidSyntaxException(file, lineNum,
                                       "unterminated character constant");
    }
    return line;
  }

  private static List<String> splitSemicolons(String text) {
    List<String> parts = new ArrayList<String>();
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
      } else if (c == ';') {
        parts.add(text.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(text.substring(start));
    return parts;
  }

  /**
   * @return tokens of statement, ending with an END token
   */
  List<Token> tokenize(Statement stmt) throws InvalidSyntaxException {
    String text = stmt.text;
    List<Token> tokens = new ArrayList<Token>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isLetter(c)) {
        int end = i;
        while (end < text.length() && isNameChar(text.charAt(end))) {
          end++;
        }
        tokens.add(new Token(Token.Kind.NAME,
                             text.substring(i, end).toLowerCase()));
        i = end;
      } else if (Character.isDigit(c) ||
                 (c == '.' && i + 1 < text.length() &&
                  Character.isDigit(text.charAt(i + 1)))) {
        i = number(text, i, tokens);
      } else if (c == '\'' || c == '"') {
        i = string(text, i, stmt.line, tokens);
      } else if (c == '.') {
        String op = dotted(text, i);
        if (op == null) {
          throw new InvalidSyntaxException(file, stmt.line,
                          "unexpected '.' in: " + text);
        }
        tokens.add(new Token(Token.Kind.SYMBOL, op));
        i += op.length();
      } else {
        String sym = symbol(text, i);
        if (sym == null) {
          throw new InvalidSyntaxException(file, stmt.line,
                          "unexpected character '" + c + "' in: " + text);
        }
        tokens.add(new Token(Token.Kind.SYMBOL, sym));
        i += sym.length();
      }
    }
    tokens.add(new Token(Token.Kind.END, ""));
    return tokens;
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static String dotted(String text, int i) {
    String rest = text.substring(i).toLowerCase();
    for (String op: DOTTED) {
      if (rest.startsWith(op)) {
        return op;
      }
    }
    return null;
  }

  private static String symbol(String text, int i) {
    for (String sym: SYMBOLS) {
      if (text.startsWith(sym, i)) {
        return sym;
      }
    }
    return null;
  }

  /**
   * Numeric literal with optional kind suffix.  A "d" exponent is stored
   * as "e" with kind 8.
   * @return index after the literal
   */
  private static int number(String text, int start, List<Token> tokens) {
    int i = start;
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      i++;
    }
    boolean real = false;
    // A dot followed by a dotted operator, as in 1.eq.2, ends the integer
    if (i < text.length() && text.charAt(i) == '.' &&
        dotted(text, i) == null) {
      real = true;
      i++;
      while (i < text.length() && Character.isDigit(text.charAt(i))) {
        i++;
      }
    }
    String kindParam = null;
    if (i < text.length() && "eEdD".indexOf(text.charAt(i)) >= 0) {
      int j = i + 1;
      if (j < text.length() && "+-".indexOf(text.charAt(j)) >= 0) {
        j++;
      }
      if (j < text.length() && Character.isDigit(text.charAt(j))) {
        if (Character.toLowerCase(text.charAt(i)) == 'd') {
          kindParam = "8";
        }
        real = true;
        i = j;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
          i++;
        }
      }
    }
    String value = text.substring(start, i).replace('d', 'e')
                                           .replace('D', 'e');
    if (value.startsWith(".")) {
      value = "0" + value;
    }
    if (i < text.length() && text.charAt(i) == '_') {
      int end = i + 1;
      while (end < text.length() && isNameChar(text.charAt(end))) {
        end++;
      }
      kindParam = text.substring(i + 1, end).toLowerCase();
      i = end;
    }
    tokens.add(new Token(real ? Token.Kind.REAL : Token.Kind.INTEGER, value,
                         kindParam));
    return i;
  }

  /**
   * @return index after the closing quote
   */
  private int string(String text, int start, int line, List<Token> tokens)
                                        throws InvalidSyntaxException {
    char quote = text.charAt(start);
    StringBuilder value = new StringBuilder();
    int i = start + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == quote) {
        if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
          value.append(c);
          i += 2;
          continue;
        }
        tokens.add(new Token(Token.Kind.STRING, value.toString()));
        return i + 1;
      }
      value.append(c);
      i++;
    }
    throw new InvalidSyntaxException(file, line,
                          "unterminated character constant in: " + text);
  }
}
