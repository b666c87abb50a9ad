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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import kara.karac.ast.FilePosition;
import kara.karac.common.exceptions.UserException;

/**
 * Accumulates diagnostics for one unit of work, e.g. one definition.
 * Not thread-safe: concurrent checks each get their own instance and
 * results are merged afterwards.
 */
public class Diagnostics {
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private int errorCount = 0;

  public void add(Diagnostic d) {
    diagnostics.add(d);
    if (d.isError()) {
      errorCount++;
    }
  }

  public void add(UserException e) {
    add(e.toDiagnostic());
  }

  public void error(DiagnosticKind kind, String message, FilePosition pos) {
    add(Diagnostic.error(kind, message, pos));
  }

  public void warning(DiagnosticKind kind, String message, FilePosition pos) {
    add(Diagnostic.warning(kind, message, pos));
  }

  public void addAll(Diagnostics other) {
    for (Diagnostic d: other.diagnostics) {
      add(d);
    }
  }

  public void addAll(Collection<Diagnostic> other) {
    for (Diagnostic d: other) {
      add(d);
    }
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public int errorCount() {
    return errorCount;
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int size() {
    return diagnostics.size();
  }

  /**
   * @return diagnostics in order added
   */
  public List<Diagnostic> getAll() {
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * @return diagnostics stably sorted by source position
   */
  public List<Diagnostic> sorted() {
    List<Diagnostic> result = new ArrayList<Diagnostic>(diagnostics);
    // Collections.sort is a stable merge sort
    Collections.sort(result, Diagnostic.BY_POSITION);
    return Collections.unmodifiableList(result);
  }
}
