/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package org.diagsudoku.cli;

import static java.util.logging.Level.WARNING;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import org.diagsudoku.core.Topology;
import org.diagsudoku.history.AssignmentLog;
import org.diagsudoku.history.HistoryJson;
import org.diagsudoku.solve.Solver;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Writer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Solves one puzzle given on the command line, prints the solution, and
 * optionally saves the assignment history as json for a step-by-step viewer.
 *
 * <pre>
 *   Solve [--standard | --diagonal] [--history FILE] [GRID]
 * </pre>
 *
 * <p> Puzzles are diagonal unless --standard is given.  Without a grid, solves
 * {@link #DIAGONAL_EXAMPLE}.  Exits with 0 when a solution is printed, 1 when
 * there is none, and 2 when the arguments or the grid are malformed.
 */
public class Solve {
  private static final Logger logger = Logger.getLogger(Solve.class.getName());

  public static final String DIAGONAL_EXAMPLE =
      "2.............62....1....7...6..8...3...9...7...6..4...4....8....52.............3";

  static final int SOLVED = 0;
  static final int NO_SOLUTION = 1;
  static final int BAD_INPUT = 2;

  static final String USAGE = "Usage: Solve [--standard | --diagonal] [--history FILE] [GRID]";

  public static void main(String[] args) {
    configureLogging();
    System.exit(run(args, System.out, System.err));
  }

  /** Does the work of {@link #main}, returning the exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options;
    Solver.Result result;
    AssignmentLog log = new AssignmentLog();
    try {
      options = Options.parse(args);
      result = Solver.solve(Topology.of(options.diagonal), options.grid, log);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return BAD_INPUT;
    }
    logger.info("Puzzle " + options.grid + " " + result + ", " + log.size() + " steps recorded");

    if (result.isSolved()) {
      out.print(result.solution);
    } else {
      out.println("No solution");
    }

    // The solution is already out, so a failure here only costs the history.
    if (options.history != null) {
      try {
        writeHistory(log, options.history);
        logger.info("Wrote " + log.size() + " steps to " + options.history);
      } catch (IOException e) {
        logger.log(WARNING, "Could not write the history to " + options.history, e);
      }
    }
    return result.isSolved() ? SOLVED : NO_SOLUTION;
  }

  static void writeHistory(AssignmentLog log, File file) throws IOException {
    Writer writer = Files.newWriter(file, Charsets.UTF_8);
    try {
      HistoryJson.write(log, writer);
    } finally {
      writer.close();
    }
  }

  /** Reads logging.properties from the classpath, if it's there. */
  static void configureLogging() {
    InputStream in = Solve.class.getResourceAsStream("/logging.properties");
    if (in == null) return;
    try {
      try {
        LogManager.getLogManager().readConfiguration(in);
      } finally {
        in.close();
      }
    } catch (IOException e) {
      logger.log(WARNING, "Could not read logging.properties", e);
    }
  }

  /** The parsed command line. */
  static class Options {
    boolean diagonal = true;
    @Nullable File history;
    String grid = DIAGONAL_EXAMPLE;

    static Options parse(String... args) {
      Options options = new Options();
      boolean sawGrid = false;
      for (int i = 0; i < args.length; ++i) {
        String arg = args[i];
        if (arg.equals("--standard")) {
          options.diagonal = false;
        } else if (arg.equals("--diagonal")) {
          options.diagonal = true;
        } else if (arg.equals("--history")) {
          if (i + 1 == args.length)
            throw new IllegalArgumentException("--history needs a file name");
          options.history = new File(args[++i]);
        } else if (arg.startsWith("--history=")) {
          options.history = new File(arg.substring("--history=".length()));
        } else if (arg.startsWith("--")) {
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else if (sawGrid) {
          throw new IllegalArgumentException("Only one grid allowed, got another: " + arg);
        } else {
          options.grid = arg;
          sawGrid = true;
        }
      }
      return options;
    }
  }
}
