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

/**
 * Lexical token of one Fortran statement
 */
class Token {
  enum Kind {
    NAME,
    INTEGER,
    REAL,
    STRING,
    /** Operators and punctuation, including dotted operators */
    SYMBOL,
    END;
  }

  final Kind kind;
  /** Lower case for names and symbols, verbatim otherwise */
  final String text;
  /** Kind parameter of a numeric literal, or null */
  final String kindParam;

  Token(Kind kind, String text) {
    this(kind, text, null);
  }

  Token(Kind kind, String text, String kindParam) {
    this.kind = kind;
    this.text = text;
    this.kindParam = kindParam;
  }

  boolean is(String symbolOrName) {
    return (kind == Kind.SYMBOL || kind == Kind.NAME) &&
           text.equals(symbolOrName);
  }

  @Override
  public String toString() {
    return kind == Kind.END ? "end of statement" : "'" + text + "'";
  }
}
