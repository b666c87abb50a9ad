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
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import kara.karac.common.Logging;
import kara.karac.common.Settings;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.exceptions.InvalidOptionException;
import kara.karac.common.exceptions.KaracFatal;
import kara.karac.frontend.dataflow.DependencyGraph;

/**
 * Command line interface to the Kara front end.  Some options are
 * passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String GRAPH_FLAG = "g";
  private static final String THREADS_FLAG = "t";
  private static final String VERBOSE_FLAG = "v";
  private static final String BUILTINS_FLAG = "b";
  private static final String HELP_FLAG = "h";

  static class Args {
    final String inputFilename;
    final boolean verbose;

    Args(String inputFilename, boolean verbose) {
      this.inputFilename = inputFilename;
      this.verbose = verbose;
    }
  }

  public static void main(String[] args) {
    try {
      Settings.initKaracProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      Args karacArgs = processArgs(args);
      Logger logger = setupLogging(karacArgs);
      int code = run(logger, karacArgs, System.out, System.err);
      System.exit(code);
    } catch (KaracFatal ex) {
      if (ex.getMessage() != null) {
        System.err.println(ex.getMessage());
      }
      System.exit(ex.exitCode);
    }
  }

  /**
   * Compile one file, printing diagnostics and, if requested, graphs
   * @return exit code
   */
  static int run(Logger logger, Args args, PrintStream out,
                 PrintStream err) {
    byte[] source = readInput(args.inputFilename);
    KaraCompiler compiler;
    try {
      compiler = KaraCompiler.fromSettings(logger);
    } catch (InvalidOptionException e) {
      throw new KaracFatal(ExitCode.ERROR_COMMAND.code(),
                           "Invalid option: " + e.getMessage());
    } catch (IOException e) {
      throw new KaracFatal(ExitCode.ERROR_IO.code(),
                           "Could not read built-in table: " + e.getMessage());
    }

    CompilationResult result;
    try {
      result = compiler.compile(args.inputFilename, source);
    } catch (RuntimeException e) {
      reportInternalError(e);
      throw new KaracFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (AssertionError e) {
      reportInternalError(e);
      throw new KaracFatal(ExitCode.ERROR_INTERNAL.code());
    }

    for (Diagnostic d: result.getDiagnostics()) {
      err.println(d);
    }
    if (!result.isSuccess()) {
      err.println(result.errorCount() + " errors");
      return ExitCode.ERROR_USER.code();
    }

    if (dumpGraphs()) {
      for (Map.Entry<String, DependencyGraph> e:
                              result.getGraphs().entrySet()) {
        out.print(e.getValue());
      }
    }
    return ExitCode.SUCCESS.code();
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(GRAPH_FLAG, "graph", false,
                   "Print dependency graph of each flow");
    Option threads = new Option(THREADS_FLAG, "threads", true,
                   "Threads used to check definitions");
    threads.setArgName("n");
    opts.addOption(threads);
    opts.addOption(VERBOSE_FLAG, "verbose", false,
                   "Log compiler progress to stderr");
    Option builtins = new Option(BUILTINS_FLAG, "builtins", true,
                   "Built-in function table to use instead of the default");
    builtins.setArgName("file");
    opts.addOption(builtins);
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new KaracFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      throw new KaracFatal(ExitCode.SUCCESS.code());
    }
    if (cmd.hasOption(GRAPH_FLAG)) {
      Settings.set(Settings.DUMP_GRAPHS, "true");
    }
    if (cmd.hasOption(THREADS_FLAG)) {
      Settings.set(Settings.THREADS, cmd.getOptionValue(THREADS_FLAG));
    }
    if (cmd.hasOption(BUILTINS_FLAG)) {
      Settings.set(Settings.BUILTINS_FILE, cmd.getOptionValue(BUILTINS_FLAG));
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      throw new KaracFatal(ExitCode.ERROR_COMMAND.code());
    }
    Settings.set(Settings.INPUT_FILENAME, remainingArgs[0]);
    return new Args(remainingArgs[0], cmd.hasOption(VERBOSE_FLAG));
  }

  private static Logger setupLogging(Args args) {
    if (args.verbose) {
      return Logging.setupConsoleLogging(Level.DEBUG);
    }
    try {
      String logfile = Settings.get(Settings.LOG_FILE);
      boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
      return Logging.setupLogging(logfile, trace);
    } catch (InvalidOptionException ex) {
      throw new KaracFatal(ExitCode.ERROR_COMMAND.code(),
                           "Error setting up logging: " + ex.getMessage());
    }
  }

  private static boolean dumpGraphs() {
    try {
      return Settings.getBoolean(Settings.DUMP_GRAPHS);
    } catch (InvalidOptionException e) {
      throw new KaracFatal(ExitCode.ERROR_COMMAND.code(), e.getMessage());
    }
  }

  private static byte[] readInput(String filename) {
    try {
      return FileUtils.readFileToByteArray(new File(filename));
    } catch (FileNotFoundException e) {
      throw new KaracFatal(ExitCode.ERROR_IO.code(),
                           "Input file " + filename + " does not exist");
    } catch (IOException e) {
      throw new KaracFatal(ExitCode.ERROR_IO.code(),
                           "Error reading " + filename + ": " + e.getMessage());
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("karac [options] <input.kara>", opts);
  }

  static void reportInternalError(Throwable e) {
    System.err.println("KARAC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
