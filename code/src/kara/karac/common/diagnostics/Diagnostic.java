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
package kara.karac.common.diagnostics;

import java.util.Comparator;

import kara.karac.ast.FilePosition;

/**
 * One reported problem.  Immutable.
 */
public class Diagnostic {

  /** Orders by source position; sorts using it must be stable */
  public static final Comparator<Diagnostic> BY_POSITION =
      new Comparator<Diagnostic>() {
        @Override
        public int compare(Diagnostic d1, Diagnostic d2) {
          return d1.position.compareTo(d2.position);
        }
      };

  private final Severity severity;
  private final DiagnosticKind kind;
  private final String message;
  private final FilePosition position;

  public Diagnostic(Severity severity, DiagnosticKind kind, String message,
                    FilePosition position) {
    this.severity = severity;
    this.kind = kind;
    this.message = message;
    this.position = position;
  }

  public static Diagnostic error(DiagnosticKind kind, String message,
                                 FilePosition position) {
    return new Diagnostic(Severity.ERROR, kind, message, position);
  }

  public static Diagnostic warning(DiagnosticKind kind, String message,
                                   FilePosition position) {
    return new Diagnostic(Severity.WARNING, kind, message, position);
  }

  public Severity getSeverity() {
    return severity;
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public FilePosition getPosition() {
    return position;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return position + ": " + severity.humanReadable() + ": [" +
           kind.displayName() + "] " + message;
  }
}
