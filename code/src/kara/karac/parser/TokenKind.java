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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public enum TokenKind {
  // Keywords
  RECORD("record"),
  FN("fn"),
  FLOW("flow"),
  TYPE("type"),
  LET("let"),
  IF("if"),
  ELSE("else"),
  TRUE("true"),
  FALSE("false"),
  AS("as"),

  // Operators
  ARROW("->"),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  EQUAL_EQUAL("=="),
  BANG_EQUAL("!="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">="),
  EQUAL("="),
  BANG("!"),

  // Delimiters
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_BRACE("{"),
  RIGHT_BRACE("}"),
  COMMA(","),
  COLON(":"),
  SEMICOLON(";"),
  DOT("."),

  // Literals and names
  IDENTIFIER(null),
  INTEGER(null),
  FLOAT(null),
  STRING(null),

  ERROR(null),
  EOF(null);

  private static final Map<String, TokenKind> keywords;

  static {
    Map<String, TokenKind> kw = new HashMap<String, TokenKind>();
    for (TokenKind k: new TokenKind[] {RECORD, FN, FLOW, TYPE, LET, IF, ELSE,
                                       TRUE, FALSE, AS}) {
      kw.put(k.text, k);
    }
    keywords = Collections.unmodifiableMap(kw);
  }

  /** Fixed spelling, null for tokens whose text varies */
  private final String text;

  private TokenKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean isKeyword() {
    return keywords.containsKey(text);
  }

  /**
   * Exact-match keyword lookup
   * @return keyword kind, or null if name is an ordinary identifier
   */
  public static TokenKind keyword(String name) {
    return keywords.get(name);
  }

  /**
   * @return description for "expected X" messages
   */
  public String describe() {
    if (text != null) {
      return "'" + text + "'";
    }
    switch (this) {
      case IDENTIFIER:
        return "identifier";
      case INTEGER:
        return "integer literal";
      case FLOAT:
        return "float literal";
      case STRING:
        return "string literal";
      case EOF:
        return "end of input";
      default:
        return name().toLowerCase();
    }
  }
}
