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
package us.blanshard.deduce.tool;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.core.MalformedPuzzleException;
import us.blanshard.deduce.solve.LoggingListener;
import us.blanshard.deduce.solve.Solver;

import com.google.common.base.Charsets;
import com.google.common.base.Stopwatch;
import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.io.CharStreams;
import com.google.common.io.Closeables;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Solves the Sudoku puzzles named on the command line, or read one per line
 * from standard input, and prints the results.
 *
 * @author Luke Blanshard
 */
public class SolvePuzzles {
  private static final Logger logger = Logger.getLogger(SolvePuzzles.class.getName());
  private static final Logger libraryLogger = Logger.getLogger("us.blanshard.deduce");

  /** The puzzle solved by {@code --demo}. */
  static final String DEMO_PUZZLE =
      "006100008080090030200005400400001800030070040007900003008400006020050080100002500";

  public static void main(String[] args) throws IOException {
    Arguments arguments;
    try {
      arguments = Arguments.parse(args);
    } catch (IllegalArgumentException e) {
      exitWithUsage(e.getMessage());
      return;  // Convince the compiler.
    }

    configureLogging(arguments.logLevel());

    List<String> puzzles = arguments.puzzles;
    if (arguments.demo) {
      puzzles = ImmutableList.<String>builder().add(DEMO_PUZZLE).addAll(puzzles).build();
    } else if (puzzles.isEmpty()) {
      puzzles = CharStreams.readLines(new InputStreamReader(System.in, Charsets.UTF_8));
    }

    int status = new SolvePuzzles(arguments, System.out, System.err).run(puzzles);
    System.exit(status);
  }

  private static void exitWithUsage(String problem) {
    System.err.println(problem);
    System.err.println(Arguments.USAGE);
    System.exit(2);
  }

  /**
   * Reads the bundled logging setup, then opens up the library's loggers to
   * the given level.
   */
  static void configureLogging(@Nullable Level level) {
    InputStream in = SolvePuzzles.class.getResourceAsStream("/logging.properties");
    if (in != null) {
      try {
        LogManager.getLogManager().readConfiguration(in);
      } catch (IOException e) {
        logger.log(Level.WARNING, "Unable to read logging.properties", e);
      } finally {
        Closeables.closeQuietly(in);
      }
    }
    if (level != null)
      libraryLogger.setLevel(level);
  }

  private final Arguments arguments;
  private final Solver.Options options;
  private final PrintStream out;
  private final PrintStream err;
  private final Multiset<Solver.Outcome> outcomes = EnumMultiset.create(Solver.Outcome.class);
  private final SummaryStatistics states = new SummaryStatistics();
  private final SummaryStatistics millis = new SummaryStatistics();

  SolvePuzzles(Arguments arguments, PrintStream out, PrintStream err) {
    this.arguments = arguments;
    this.options = arguments.verbosity > 0
        ? arguments.options.toBuilder().listener(new LoggingListener()).build()
        : arguments.options;
    this.out = out;
    this.err = err;
  }

  /**
   * Solves each of the given puzzles in turn.  Blank lines and lines starting
   * with '#' are skipped.  Returns the process exit status: 0 if every puzzle
   * could be read, 1 otherwise.
   */
  int run(List<String> puzzles) {
    int status = 0;
    int number = 0;
    for (String line : puzzles) {
      String puzzle = line.trim();
      if (puzzle.isEmpty() || puzzle.startsWith("#")) continue;
      ++number;

      Grid start;
      try {
        start = Grid.fromString(puzzle);
      } catch (MalformedPuzzleException e) {
        err.printf("Puzzle %d: %s%n", number, e.getMessage());
        status = 1;
        continue;
      }

      Stopwatch stopwatch = Stopwatch.createStarted();
      Solver.Result result = Solver.solve(start, options);
      stopwatch.stop();
      outcomes.add(result.outcome);
      states.addValue(result.numStates);
      millis.addValue(stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1000.0);

      if (arguments.json) {
        out.println(ResultJson.GSON.toJson(result));
      } else {
        print(number, result, stopwatch);
      }
    }
    if (!arguments.json && states.getN() > 1)
      printSummary();
    return status;
  }

  private void printSummary() {
    out.printf("Solved %d puzzles: %d unique, %d without solution, %d with several%n",
               states.getN(),
               outcomes.count(Solver.Outcome.UNIQUE_SOLUTION),
               outcomes.count(Solver.Outcome.NO_SOLUTION),
               outcomes.count(Solver.Outcome.MULTIPLE_SOLUTIONS));
    out.printf("States: mean %.1f, max %.0f; milliseconds: mean %.2f, max %.2f%n",
               states.getMean(), states.getMax(), millis.getMean(), millis.getMax());
  }

  private void print(int number, Solver.Result result, Stopwatch stopwatch) {
    out.printf("Puzzle %d: %s, %d state(s), %d pass(es), %s%n",
               number, result.outcome, result.numStates, result.numPasses, stopwatch);
    out.println(result.start);
    switch (result.outcome) {
      case UNIQUE_SOLUTION:
        out.println("Solution:");
        out.println(result.solution);
        break;
      case MULTIPLE_SOLUTIONS:
        out.printf("At least %d solutions; the first two:%n", result.numSolutions);
        out.println(result.solutions.get(0));
        out.println(result.solutions.get(1));
        break;
      case NO_SOLUTION:
        out.println("No solution.");
        break;
    }
  }
}
