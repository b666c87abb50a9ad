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
 * A name was defined twice where only one definition is allowed: at the
 * top level, in a record's fields or parameter list, or a rebinding in
 * one scope.
 */
public class DoubleDefineException extends UserException {

  public DoubleDefineException(FilePosition position, DiagnosticKind kind,
                               String message) {
    super(position, kind, message);
    assert(kind == DiagnosticKind.DUPLICATE_DEFINITION ||
           kind == DiagnosticKind.IMMUTABLE_REBINDING) : kind;
  }

  public static DoubleDefineException duplicate(FilePosition position,
      String what, String name, FilePosition previous) {
    return new DoubleDefineException(position,
        DiagnosticKind.DUPLICATE_DEFINITION,
        what + " called " + name + " already defined at " + previous);
  }

  public static DoubleDefineException rebinding(FilePosition position,
      String name, FilePosition previous) {
    return new DoubleDefineException(position,
        DiagnosticKind.IMMUTABLE_REBINDING,
        "Cannot rebind " + name + " in the same scope: already bound at " +
        previous + ". Bindings are immutable");
  }

  private static final long serialVersionUID = 1L;
}
