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
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final FilePosition position;
  private final DiagnosticKind kind;
  private final String detail;

  public UserException(FilePosition position, DiagnosticKind kind,
                       String message) {
    super(position + ": " + message);
    this.position = position;
    this.kind = kind;
    this.detail = message;
  }

  public FilePosition getPosition() {
    return position;
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  /**
   * @return message without the location prefix
   */
  public String getDetail() {
    return detail;
  }

  public Diagnostic toDiagnostic() {
    return new Diagnostic(kind.defaultSeverity(), kind, detail, position);
  }

  private static final long serialVersionUID = 1L;
}
