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
package kara.karac.ui;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import kara.karac.ast.Program;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.lang.Purity;
import kara.karac.frontend.GlobalContext;
import kara.karac.frontend.TypeTable;
import kara.karac.frontend.dataflow.DependencyGraph;

/**
 * Everything the front end found out about one source file.  The program
 * and graphs may only be handed on if there were no errors.
 */
public class CompilationResult {
  private final Program program;
  private final GlobalContext globals;
  private final List<Diagnostic> diagnostics;
  private final Map<String, DependencyGraph> graphs;
  private final Map<String, Purity> purity;
  private final TypeTable types;
  private final boolean success;

  /**
   * @param diagnostics sorted by position
   */
  CompilationResult(Program program, GlobalContext globals,
                    List<Diagnostic> diagnostics,
                    Map<String, DependencyGraph> graphs,
                    Map<String, Purity> purity, TypeTable types) {
    this.program = program;
    this.globals = globals;
    this.diagnostics = Collections.unmodifiableList(diagnostics);
    this.graphs = Collections.unmodifiableMap(
                  new LinkedHashMap<String, DependencyGraph>(graphs));
    this.purity = Collections.unmodifiableMap(
                  new LinkedHashMap<String, Purity>(purity));
    this.types = types;
    boolean ok = true;
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        ok = false;
        break;
      }
    }
    this.success = ok;
  }

  /**
   * Result when lexing could not continue
   */
  static CompilationResult lexicalFailure(List<Diagnostic> diagnostics) {
    return new CompilationResult(null, null, diagnostics,
                  Collections.<String, DependencyGraph>emptyMap(),
                  Collections.<String, Purity>emptyMap(), new TypeTable());
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return all diagnostics, warnings included, ordered by position
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public int errorCount() {
    int n = 0;
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        n++;
      }
    }
    return n;
  }

  /**
   * @return the checked program
   * @throws KaracRuntimeError if compilation had errors
   */
  public Program getProgram() {
    checkSuccess("Program");
    return program;
  }

  /**
   * Available after errors too, for diagnostic use.
   * @return the global context, or null if lexing failed fatally
   */
  public GlobalContext getGlobals() {
    return globals;
  }

  /**
   * @return dependency graph of each flow, by flow name in program order
   * @throws KaracRuntimeError if compilation had errors
   */
  public Map<String, DependencyGraph> getGraphs() {
    checkSuccess("Dependency graphs");
    return graphs;
  }

  /**
   * @return purity of every function, flow and built-in after inference
   */
  public Map<String, Purity> getPurity() {
    return purity;
  }

  /**
   * @return type of every binding and expression in the checked program
   * @throws KaracRuntimeError if compilation had errors
   */
  public TypeTable getTypes() {
    checkSuccess("Type table");
    return types;
  }

  private void checkSuccess(String what) {
    if (!success) {
      throw new KaracRuntimeError(what + " requested after " +
                                  errorCount() + " errors");
    }
  }
}
