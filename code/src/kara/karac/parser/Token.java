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
package kara.karac.parser;

import kara.karac.ast.FilePosition;

/**
 * A scanned token.  The lexeme is the exact source text; value holds the
 * decoded literal (Long, Double, String or Boolean) where there is one.
 */
public class Token {
  private final TokenKind kind;
  private final String lexeme;
  private final Object value;
  private final FilePosition position;

  public Token(TokenKind kind, String lexeme, Object value,
               FilePosition position) {
    this.kind = kind;
    this.lexeme = lexeme;
    this.value = value;
    this.position = position;
  }

  public TokenKind kind() {
    return kind;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  public String lexeme() {
    return lexeme;
  }

  public Object value() {
    return value;
  }

  public FilePosition position() {
    return position;
  }

  /**
   * @return lexeme for use in messages
   */
  public String describe() {
    if (kind == TokenKind.EOF) {
      return "end of input";
    }
    return "'" + lexeme + "'";
  }

  @Override
  public String toString() {
    return kind + "(" + lexeme + ")@" + position.line + ":" + position.col;
  }
}
