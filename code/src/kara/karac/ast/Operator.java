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
package kara.karac.ast;

/**
 * Unary and binary operators, loosest binding first
 */
public enum Operator {
  EQ("==", 1),
  NEQ("!=", 1),
  LT("<", 1),
  LTE("<=", 1),
  GT(">", 1),
  GTE(">=", 1),
  PLUS("+", 2),
  MINUS("-", 2),
  MULT("*", 3),
  DIV("/", 3),
  NOT("!", 4),
  NEGATE("-", 4);

  private final String symbol;
  private final int precedence;

  private Operator(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isComparison() {
    return precedence == 1;
  }

  public boolean isArithmetic() {
    return precedence == 2 || precedence == 3;
  }

  public boolean isUnary() {
    return this == NOT || this == NEGATE;
  }
}
