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

package kara.karac.common.exceptions;

import kara.karac.ast.FilePosition;
import kara.karac.common.diagnostics.DiagnosticKind;

/**
 * Syntax error: the token stream does not match the grammar.
 */
public class InvalidSyntaxException extends UserException {

  public InvalidSyntaxException(FilePosition position, String message) {
    this(position, DiagnosticKind.UNEXPECTED_TOKEN, message);
  }

  public InvalidSyntaxException(FilePosition position, DiagnosticKind kind,
      String message) {
    super(position, kind, message);
  }

  /**
   * Standard message for a missing token
   * @param position where the unexpected token starts
   * @param expected description of what the grammar allowed here
   * @param found lexeme actually present
   */
  public static InvalidSyntaxException expected(FilePosition position,
                                       String expected, String found) {
    return new InvalidSyntaxException(position,
                          "expected " + expected + ", found " + found);
  }

  private static final long serialVersionUID = 1L;
}
