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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import kara.karac.ast.Program;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.common.Settings;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.InvalidOptionException;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.lang.Builtins;
import kara.karac.common.lang.Purity;
import kara.karac.frontend.ASTWalker;
import kara.karac.frontend.DeclarationRegistry;
import kara.karac.frontend.GlobalContext;
import kara.karac.frontend.PurityAnalyzer;
import kara.karac.frontend.TypeTable;
import kara.karac.frontend.dataflow.DependencyGraph;
import kara.karac.frontend.dataflow.DependencyGraphBuilder;
import kara.karac.parser.Lexer;
import kara.karac.parser.Parser;
import kara.karac.parser.Token;

/**
 * Runs the front end over one source file.
 *
 * This contains the high-level logic orchestrating the different
 * passes: lexing, parsing, declaration registry, body resolution,
 * purity analysis and dependency graph construction.  Bodies are checked
 * independently and may run on a thread pool; their results are merged
 * in program order, so output doesn't depend on scheduling.
 */
public class KaraCompiler {

  private final Logger logger;
  private final Builtins builtins;
  private final int threads;
  private final boolean warnUnused;

  public KaraCompiler(Logger logger, Builtins builtins, int threads,
                      boolean warnUnused) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be positive: " +
                                         threads);
    }
    this.logger = logger;
    this.builtins = builtins;
    this.threads = threads;
    this.warnUnused = warnUnused;
  }

  /**
   * Configure from karac.* settings
   * @throws InvalidOptionException if a setting or the built-in table
   *         is invalid
   * @throws IOException if the built-in table file can't be read
   */
  public static KaraCompiler fromSettings(Logger logger)
      throws InvalidOptionException, IOException {
    String builtinsFile = Settings.get(Settings.BUILTINS_FILE);
    Builtins builtins;
    if (builtinsFile != null && builtinsFile.length() > 0) {
      builtins = Builtins.load(new File(builtinsFile));
    } else {
      builtins = Builtins.loadDefault();
    }
    int threads = Settings.getInt(Settings.THREADS);
    if (threads < 1) {
      throw new InvalidOptionException(Settings.THREADS +
                          " must be at least 1, was " + threads);
    }
    return new KaraCompiler(logger, builtins, threads,
                            Settings.getBoolean(Settings.WARN_UNUSED));
  }

  public CompilationResult compile(String file, byte[] source) {
    logger.info("karac starting: " + file);
    Diagnostics diagnostics = new Diagnostics();

    Lexer lexer = new Lexer(file, source);
    List<Token> tokens = lexer.tokenize();
    diagnostics.addAll(lexer.getDiagnostics());
    if (lexer.hitFatalError()) {
      logger.debug("fatal lexical error, stopping");
      return CompilationResult.lexicalFailure(diagnostics.sorted());
    }

    Parser parser = new Parser(file, tokens);
    Program program = parser.parseProgram();
    diagnostics.addAll(parser.getDiagnostics());

    DeclarationRegistry registry = new DeclarationRegistry(builtins,
                                                           diagnostics);
    final GlobalContext globals = registry.build(program,
                                        parser.getMalformedDefinitions());

    // Resolve bodies.  The global context is frozen from here on.
    List<Callable<ASTWalker>> walks = new ArrayList<Callable<ASTWalker>>();
    for (final FunctionDef fn: program.getFunctions()) {
      if (globals.isFailed(fn)) {
        continue;
      }
      walks.add(new Callable<ASTWalker>() {
        @Override
        public ASTWalker call() {
          ASTWalker walker = new ASTWalker(globals, fn);
          walker.walk();
          return walker;
        }
      });
    }
    TypeTable types = new TypeTable();
    List<FunctionDef> resolved = new ArrayList<FunctionDef>();
    for (ASTWalker walker: runAll(walks)) {
      diagnostics.addAll(walker.getDiagnostics());
      types.putAll(walker.getTypes());
      if (!walker.getDiagnostics().hasErrors()) {
        resolved.add(walker.getFunction());
      }
    }

    // Barrier: purity needs the whole call graph
    PurityAnalyzer purityAnalyzer = new PurityAnalyzer(globals, program);
    final Map<String, Purity> purity = purityAnalyzer.analyze();
    purityAnalyzer.reportViolations(resolved, diagnostics);

    final DependencyGraphBuilder graphBuilder =
                  new DependencyGraphBuilder(purity, types, warnUnused);
    List<Callable<GraphJob>> jobs = new ArrayList<Callable<GraphJob>>();
    for (final FunctionDef fn: resolved) {
      if (!fn.isFlow()) {
        continue;
      }
      jobs.add(new Callable<GraphJob>() {
        @Override
        public GraphJob call() {
          GraphJob job = new GraphJob(fn);
          job.graph = graphBuilder.build(fn, job.diagnostics);
          return job;
        }
      });
    }
    Map<String, DependencyGraph> graphs =
                        new LinkedHashMap<String, DependencyGraph>();
    for (GraphJob job: runAll(jobs)) {
      diagnostics.addAll(job.diagnostics);
      if (!job.diagnostics.hasErrors()) {
        graphs.put(job.flow.getName(), job.graph);
      }
    }

    CompilationResult result = new CompilationResult(program, globals,
                      diagnostics.sorted(), graphs, purity, types);
    logger.info("karac done: " + file + ": " + result.errorCount() +
                " errors, " + graphs.size() + " dependency graphs");
    return result;
  }

  private static class GraphJob {
    final FunctionDef flow;
    final Diagnostics diagnostics = new Diagnostics();
    DependencyGraph graph;

    GraphJob(FunctionDef flow) {
      this.flow = flow;
    }
  }

  /**
   * Run tasks, on the pool if there is more than one thread
   * @return results in task order
   */
  private <T> List<T> runAll(List<Callable<T>> tasks) {
    List<T> results = new ArrayList<T>(tasks.size());
    if (threads == 1 || tasks.size() <= 1) {
      for (Callable<T> task: tasks) {
        try {
          results.add(task.call());
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new KaracRuntimeError("Unexpected checked exception", e);
        }
      }
      return results;
    }

    ExecutorService pool = Executors.newFixedThreadPool(
                                  Math.min(threads, tasks.size()));
    try {
      List<Future<T>> futures = pool.invokeAll(tasks);
      for (Future<T> f: futures) {
        results.add(f.get());
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KaracRuntimeError("Interrupted while checking bodies", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException)cause;
      } else if (cause instanceof Error) {
        throw (Error)cause;
      }
      throw new KaracRuntimeError("Body check failed", cause);
    } finally {
      pool.shutdownNow();
    }
  }
}
