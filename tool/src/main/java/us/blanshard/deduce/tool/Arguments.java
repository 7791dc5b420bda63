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

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.deduce.solve.Propagator;
import us.blanshard.deduce.solve.Solver;

import com.google.common.collect.ImmutableList;

import java.util.logging.Level;

import javax.annotation.Nullable;

/**
 * The parsed command line of {@link SolvePuzzles}.
 *
 * @author Luke Blanshard
 */
final class Arguments {
  static final String USAGE =
      "Usage: SolvePuzzles [-v]... [--bfs] [--exhaustive] [--max <n>] [--json] [--demo] [<puzzle>...]";

  final int verbosity;
  final Solver.Options options;
  final boolean json;
  final boolean demo;
  final ImmutableList<String> puzzles;

  private Arguments(int verbosity, Solver.Options options, boolean json, boolean demo,
                    ImmutableList<String> puzzles) {
    this.verbosity = verbosity;
    this.options = options;
    this.json = json;
    this.demo = demo;
    this.puzzles = puzzles;
  }

  /**
   * Parses the given command line.
   *
   * @throws IllegalArgumentException if the command line can't be understood
   */
  static Arguments parse(String... args) {
    int verbosity = 0;
    Solver.Options.Builder options = Solver.Options.builder();
    boolean json = false;
    boolean demo = false;
    ImmutableList.Builder<String> puzzles = ImmutableList.builder();

    for (int i = 0; i < args.length; ++i) {
      String arg = args[i];
      if (arg.equals("-v") || arg.equals("--verbose")) {
        ++verbosity;
      } else if (arg.matches("-v+")) {
        verbosity += arg.length() - 1;
      } else if (arg.equals("--bfs")) {
        options.searchOrder(Solver.SearchOrder.BREADTH_FIRST);
      } else if (arg.equals("--exhaustive")) {
        options.schedule(Propagator.Schedule.EXHAUSTIVE);
      } else if (arg.equals("--max")) {
        checkArgument(i + 1 < args.length, "--max needs a number");
        try {
          options.maxSolutions(Integer.decode(args[++i]));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("--max needs a number, got " + args[i], e);
        }
      } else if (arg.equals("--json")) {
        json = true;
      } else if (arg.equals("--demo")) {
        demo = true;
      } else if (arg.startsWith("-") && arg.length() > 1) {
        throw new IllegalArgumentException("Unknown flag " + arg);
      } else {
        puzzles.add(arg);
      }
    }
    return new Arguments(verbosity, options.build(), json, demo, puzzles.build());
  }

  /** The level for the library's loggers, or null to leave it alone. */
  @Nullable Level logLevel() {
    switch (verbosity) {
      case 0: return null;
      case 1: return Level.FINE;
      case 2: return Level.FINER;
      case 3: return Level.FINEST;
      default: return Level.ALL;
    }
  }
}
