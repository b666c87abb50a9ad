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
package kara.karac.frontend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;

import kara.karac.ast.Program;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.PurityException;
import kara.karac.common.lang.Builtins.BuiltinFunction;
import kara.karac.common.lang.Purity;
import kara.karac.frontend.CallFinder.CallSite;

/**
 * Works out which functions are impure.  Built-ins and flows are impure
 * to start with; any function calling an impure function becomes impure.
 * This is iterated to a least fixpoint over the whole call graph, so a
 * group of mutually recursive functions stays pure unless some member
 * reaches an impure callee.
 *
 * Runs after every body has been resolved and before any dependency graph
 * is built.
 */
public class PurityAnalyzer {
  private static final Logger logger = Logging.getKaracLogger();

  private final GlobalContext globals;

  /** caller -> callees, in order first called */
  private final SetMultimap<String, String> callGraph =
                                    LinkedHashMultimap.create();

  /** caller -> every call site in its body */
  private final ListMultimap<String, CallSite> callSites =
                                    ArrayListMultimap.create();

  private final Map<String, Purity> purity =
                                    new LinkedHashMap<String, Purity>();

  /**
   * For each function found impure, the callee that was already impure
   * when the tag changed.  Following these always ends at a leaf.
   */
  private final Map<String, String> impureBecause =
                                    new HashMap<String, String>();

  private boolean analyzed = false;

  public PurityAnalyzer(GlobalContext globals, Program program) {
    this.globals = globals;
    for (FunctionDef fn: program.getFunctions()) {
      Declaration decl = globals.lookupDeclaration(fn.getName());
      if (decl == null || decl.getDef() != fn) {
        // A duplicate: the name belongs to another definition
        continue;
      }
      for (CallSite site: CallFinder.inBlock(fn.getBody())) {
        callSites.put(fn.getName(), site);
        if (globals.lookupFunction(site.getCallee()) != null) {
          callGraph.put(fn.getName(), site.getCallee());
        }
      }
    }
  }

  /**
   * Compute purity of every function, flow and built-in
   * @return map from name to purity
   */
  public Map<String, Purity> analyze() {
    for (BuiltinFunction b: globals.getBuiltins().getAll()) {
      purity.put(b.getName(), b.getPurity());
    }
    List<String> pureFns = new ArrayList<String>();
    for (Declaration decl: globals.getDeclarations().values()) {
      if (decl.getKind() == Declaration.Kind.FUNCTION) {
        purity.put(decl.getName(), decl.getPurity());
        if (decl.getPurity() == Purity.PURE) {
          pureFns.add(decl.getName());
        }
      }
    }

    // Repeat until no tag changes.  Tags only go from pure to impure,
    // so this terminates.
    boolean changed;
    int iterations = 0;
    do {
      changed = false;
      iterations++;
      for (String fn: pureFns) {
        if (purity.get(fn) == Purity.IMPURE) {
          continue;
        }
        String impureCallee = firstImpureCallee(fn);
        if (impureCallee != null) {
          if (logger.isTraceEnabled()) {
            logger.trace("purity: " + fn + " is impure: calls " +
                         impureCallee);
          }
          purity.put(fn, Purity.IMPURE);
          impureBecause.put(fn, impureCallee);
          changed = true;
        }
      }
    } while (changed);
    logger.debug("purity: fixpoint after " + iterations + " iterations");
    analyzed = true;
    return Collections.unmodifiableMap(purity);
  }

  /**
   * Report each call from a pure function to an impure one
   * @param resolved definitions that passed resolution: only these
   *                 are checked
   */
  public void reportViolations(Collection<FunctionDef> resolved,
                               Diagnostics diagnostics) {
    if (!analyzed) {
      throw new IllegalStateException("analyze() not yet run");
    }
    for (FunctionDef fn: resolved) {
      if (fn.getPurity() != Purity.PURE) {
        continue;
      }
      for (CallSite site: callSites.get(fn.getName())) {
        String callee = site.getCallee();
        if (purity.get(callee) == Purity.IMPURE) {
          PurityException e = PurityException.impureCall(site.getPosition(),
                                                     fn.getName(), callee);
          String why = explain(callee);
          if (why != null) {
            e = new PurityException(site.getPosition(), e.getDetail() +
                                    ": " + why);
          }
          diagnostics.add(e);
        }
      }
    }
  }

  /**
   * @return why a function declared pure was found impure, or null if
   *         it was impure by declaration
   */
  private String explain(String fn) {
    String callee = impureBecause.get(fn);
    if (callee == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    sb.append(fn).append(" is impure because it calls ").append(callee);
    String next = impureBecause.get(callee);
    while (next != null) {
      sb.append(", which calls ").append(next);
      next = impureBecause.get(next);
    }
    return sb.toString();
  }

  private String firstImpureCallee(String fn) {
    for (String callee: callGraph.get(fn)) {
      if (purity.get(callee) == Purity.IMPURE) {
        return callee;
      }
    }
    return null;
  }

  public Set<String> getCallees(String fn) {
    return Collections.unmodifiableSet(callGraph.get(fn));
  }
}
