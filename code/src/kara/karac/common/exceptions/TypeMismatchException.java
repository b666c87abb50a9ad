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
 * A value crossed a call, return or field boundary with the wrong
 * nominal type, or an invalid conversion was requested.
 */
public class TypeMismatchException extends UserException {

  public TypeMismatchException(FilePosition position, String message) {
    super(position, DiagnosticKind.BOUNDARY_TYPE_MISMATCH, message);
  }

  public static TypeMismatchException mismatch(FilePosition position,
      String boundary, Object expected, Object actual) {
    return new TypeMismatchException(position, boundary + ": expected " +
                    expected + " but got " + actual);
  }

  private static final long serialVersionUID = 1L;
}
