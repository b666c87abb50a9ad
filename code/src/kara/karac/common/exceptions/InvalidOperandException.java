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
 * Operator, condition or field access applied to a value of the wrong
 * type inside a body.  Unlike {@link TypeMismatchException} these are
 * not boundary errors.
 */
public class InvalidOperandException extends UserException {

  public InvalidOperandException(FilePosition position, String message) {
    super(position, DiagnosticKind.INVALID_OPERAND, message);
  }

  private static final long serialVersionUID = 1L;
}
