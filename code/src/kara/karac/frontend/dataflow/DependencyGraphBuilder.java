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
package kara.karac.frontend.dataflow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import kara.karac.ast.Block;
import kara.karac.ast.Expr;
import kara.karac.ast.Expr.Identifier;
import kara.karac.ast.FilePosition;
import kara.karac.ast.Stmt;
import kara.karac.ast.Stmt.Conditional;
import kara.karac.ast.Stmt.LetBinding;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.ast.TypedName;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.lang.Purity;
import kara.karac.common.lang.Types.Type;
import kara.karac.frontend.CallFinder;
import kara.karac.frontend.CallFinder.CallSite;
import kara.karac.frontend.ExprWalker;
import kara.karac.frontend.TypeTable;

/**
 * Builds the dependency graph of a flow body that passed resolution.
 * Also rejects reads of names bound later in the same or an enclosing
 * block, and warns about let bindings that are never read.
 */
public class DependencyGraphBuilder {
  private static final Logger logger = Logging.getKaracLogger();

  private final Map<String, Purity> purity;
  private final TypeTable types;
  private final boolean warnUnused;

  /**
   * @param purity result of purity analysis
   * @param types types of all checked bodies
   */
  public DependencyGraphBuilder(Map<String, Purity> purity, TypeTable types,
                                boolean warnUnused) {
    this.purity = purity;
    this.types = types;
    this.warnUnused = warnUnused;
  }

  /**
   * Block scope during the build
   */
  private static class Scope {
    final Scope parent;
    final Set<String> bound = new HashSet<String>();
    /** Names bound by statements not yet reached */
    final Map<String, FilePosition> pending =
                                new HashMap<String, FilePosition>();

    Scope(Scope parent) {
      this.parent = parent;
    }

    boolean isBound(String name) {
      return bound.contains(name) || (parent != null && parent.isBound(name));
    }

    FilePosition boundLater(String name) {
      FilePosition pos = pending.get(name);
      if (pos == null && parent != null) {
        return parent.boundLater(name);
      }
      return pos;
    }
  }

  /**
   * @param diagnostics problems found are added here
   * @return the graph; only valid if no errors were added
   */
  public DependencyGraph build(FunctionDef flow, Diagnostics diagnostics) {
    if (!flow.isFlow()) {
      throw new KaracRuntimeError("Dependency graph requested for fn " +
                                  flow.getName());
    }
    Scope top = new Scope(null);
    List<String> params = new ArrayList<String>();
    for (TypedName param: flow.getParams()) {
      top.bound.add(param.getName());
      params.add(param.getName());
    }
    DependencyGraph graph = buildBlock(flow, params, flow.getBody(), top,
                                       diagnostics);
    if (logger.isDebugEnabled()) {
      logger.debug("dependency graph for " + flow.getName() + ": " +
                   graph.size() + " nodes, " + graph.edgeCount() + " edges");
    }
    if (logger.isTraceEnabled()) {
      logger.trace(graph.toString());
    }
    return graph;
  }

  private DependencyGraph buildBlock(FunctionDef flow,
        List<String> graphInputs, Block block, Scope scope,
        Diagnostics diagnostics) {
    for (Stmt stmt: block.getStatements()) {
      scope.pending.putAll(VariableUsageInfo.boundNames(stmt));
    }

    List<StatementNode> nodes = new ArrayList<StatementNode>();
    for (Stmt stmt: block.getStatements()) {
      checkReads(VariableUsageInfo.directReads(stmt), scope, diagnostics);

      List<DependencyGraph> nested = new ArrayList<DependencyGraph>();
      boolean impure = callsImpure(CallFinder.shallow(stmt));
      if (stmt instanceof Conditional) {
        Conditional c = (Conditional)stmt;
        nested.add(buildBranch(flow, c.getThenBlock(), scope, diagnostics));
        impure = impure || callsImpure(CallFinder.inBlock(c.getThenBlock()));
        if (c.hasElse()) {
          nested.add(buildBranch(flow, c.getElseBlock(), scope, diagnostics));
          impure = impure ||
                   callsImpure(CallFinder.inBlock(c.getElseBlock()));
        }
      }

      List<String> callees = calleeNames(CallFinder.shallow(stmt));
      nodes.add(new StatementNode(nodes.size(), stmt, null,
            VariableUsageInfo.inputs(stmt), types.getBindings(stmt),
            callees, impure, callees.contains(flow.getName()), nested));

      for (String name: VariableUsageInfo.boundNames(stmt).keySet()) {
        scope.pending.remove(name);
        scope.bound.add(name);
      }
    }

    if (block.hasResult()) {
      Expr result = block.getResult();
      checkReads(VariableUsageInfo.directReads(result), scope, diagnostics);
      List<CallSite> calls = CallFinder.inExpr(result);
      List<String> callees = calleeNames(calls);
      nodes.add(new StatementNode(nodes.size(), null, result,
            VariableUsageInfo.inputs(result),
            new LinkedHashMap<String, Type>(), callees, callsImpure(calls),
            callees.contains(flow.getName()),
            new ArrayList<DependencyGraph>()));
    }

    DependencyGraph graph = new DependencyGraph(flow.getName(), graphInputs,
                                                nodes);
    addEdges(graph);
    if (warnUnused) {
      warnUnused(graph, diagnostics);
    }
    return graph;
  }

  private DependencyGraph buildBranch(FunctionDef flow, Block branch,
                              Scope enclosing, Diagnostics diagnostics) {
    List<String> free = new ArrayList<String>(
                              VariableUsageInfo.freeNames(branch));
    return buildBlock(flow, free, branch, new Scope(enclosing), diagnostics);
  }

  /**
   * A read must come after its binder
   */
  private void checkReads(List<Identifier> reads, Scope scope,
                          Diagnostics diagnostics) {
    for (Identifier id: reads) {
      if (scope.isBound(id.getName())) {
        continue;
      }
      FilePosition binder = scope.boundLater(id.getName());
      if (binder != null) {
        diagnostics.add(ExprWalker.forwardReference(id, binder));
      }
      // Otherwise a name outside the flow: the resolver has checked it
    }
  }

  /**
   * Flow edges from the latest producer of each input.  A binder that
   * shadows an outer name also gets an edge from every earlier reader of
   * that name, so it can't be run ahead of them.
   */
  private void addEdges(DependencyGraph graph) {
    Map<String, Integer> producer = new HashMap<String, Integer>();
    SetMultimap<String, Integer> readers = HashMultimap.create();
    for (StatementNode node: graph.getNodes()) {
      int index = node.getIndex();
      for (String in: node.getInputs()) {
        Integer from = producer.get(in);
        if (from != null) {
          graph.addEdge(from, index);
        }
        readers.put(in, index);
      }
      for (String out: node.getOutputs()) {
        for (int reader: readers.removeAll(out)) {
          if (reader != index) {
            graph.addEdge(reader, index);
          }
        }
        producer.put(out, index);
      }
    }
  }

  private void warnUnused(DependencyGraph graph, Diagnostics diagnostics) {
    List<StatementNode> nodes = graph.getNodes();
    for (StatementNode node: nodes) {
      if (!(node.getStatement() instanceof LetBinding)) {
        continue;
      }
      String name = ((LetBinding)node.getStatement()).getName();
      if (name.startsWith("_")) {
        continue;
      }
      boolean read = false;
      for (int i = node.getIndex() + 1; i < nodes.size() && !read; i++) {
        read = nodes.get(i).getInputs().contains(name);
      }
      if (!read) {
        diagnostics.warning(DiagnosticKind.UNUSED_BINDING, "let binding " +
            name + " is never read", node.getPosition());
      }
    }
  }

  private boolean callsImpure(List<CallSite> calls) {
    for (CallSite call: calls) {
      if (purity.get(call.getCallee()) == Purity.IMPURE) {
        return true;
      }
    }
    return false;
  }

  private static List<String> calleeNames(List<CallSite> calls) {
    List<String> names = new ArrayList<String>(calls.size());
    for (CallSite call: calls) {
      if (!names.contains(call.getCallee())) {
        names.add(call.getCallee());
      }
    }
    return names;
  }
}
