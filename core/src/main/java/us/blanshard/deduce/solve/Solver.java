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
package us.blanshard.deduce.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.core.Location;
import us.blanshard.deduce.core.MalformedPuzzleException;
import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.core.NumSet;
import us.blanshard.deduce.rules.Rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A worklist-based Sudoku solver that leans on deduction before guessing.
 * Each state taken off the worklist is propagated to a fixpoint; if it's still
 * open, the first open location (in row-major order) is tried with each of its
 * remaining digits, smallest first, as new states on the worklist.  This is an
 * Iterable: its iterator returns all solutions (if any) to the starting grid.
 *
 * <p> The worklist is a stack by default, so the search goes depth first and
 * memory stays proportional to the depth of the tree.  A first-in-first-out
 * queue is available with {@link SearchOrder#BREADTH_FIRST}; both orders
 * visit the same finite tree and find the same solutions, though not
 * necessarily in the same order.
 *
 * <p> The search tree is finite, since each hypothesis fixes one more location
 * than its parent had fixed, so iteration always ends.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Solver implements Iterable<Grid> {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given puzzle, 9 rows of 9 numbers with 0 for blanks, returns a
   * summary of the result.
   *
   * @throws MalformedPuzzleException if the puzzle isn't a 9x9 grid of the
   *     numbers 0 through 9
   */
  public static Result solve(int[][] puzzle) {
    return solve(Grid.fromRows(puzzle));
  }

  /**
   * Solves the given starting grid, returns a summary of the result.
   */
  public static Result solve(Grid start) {
    return solve(start, Options.DEFAULT);
  }

  /**
   * Solves the given starting grid, returns a summary of the result.
   */
  public static Result solve(Grid start, int maxSolutions) {
    return solve(start, Options.builder().maxSolutions(maxSolutions).build());
  }

  /**
   * Solves the given starting grid using the given options, returns a summary
   * of the result.
   */
  public static Result solve(Grid start, Options options) {
    return new Solver(start, options).result();
  }

  /** The three ways a solve can turn out. */
  public enum Outcome {
    UNIQUE_SOLUTION, NO_SOLUTION, MULTIPLE_SOLUTIONS;
  }

  /** The order in which the worklist is consumed. */
  public enum SearchOrder {
    /** A stack: the newest hypotheses are explored first.  Memory stays small. */
    DEPTH_FIRST,
    /** A queue: all hypotheses at one depth are explored before the next. */
    BREADTH_FIRST;
  }

  /**
   * Settings for a solver.
   */
  @Immutable
  public static final class Options {
    public static final Options DEFAULT = builder().build();

    /** How many solutions to look for before stopping; one more is always sought. */
    public final int maxSolutions;
    public final SearchOrder searchOrder;
    public final Propagator.Schedule schedule;
    public final Propagator.Listener listener;

    private Options(Builder builder) {
      this.maxSolutions = builder.maxSolutions;
      this.searchOrder = builder.searchOrder;
      this.schedule = builder.schedule;
      this.listener = builder.listener;
    }

    public static Builder builder() {
      return new Builder();
    }

    public Builder toBuilder() {
      return new Builder()
          .maxSolutions(maxSolutions)
          .searchOrder(searchOrder)
          .schedule(schedule)
          .listener(listener);
    }

    @NotThreadSafe
    public static final class Builder {
      private int maxSolutions = 1;
      private SearchOrder searchOrder = SearchOrder.DEPTH_FIRST;
      private Propagator.Schedule schedule = Propagator.Schedule.CHEAPEST_FIRST;
      private Propagator.Listener listener = Propagator.SILENT;

      private Builder() {}

      public Builder maxSolutions(int maxSolutions) {
        checkArgument(maxSolutions >= 1, "maxSolutions must be positive: %s", maxSolutions);
        this.maxSolutions = maxSolutions;
        return this;
      }

      public Builder searchOrder(SearchOrder searchOrder) {
        this.searchOrder = checkNotNull(searchOrder);
        return this;
      }

      public Builder schedule(Propagator.Schedule schedule) {
        this.schedule = checkNotNull(schedule);
        return this;
      }

      public Builder listener(Propagator.Listener listener) {
        this.listener = checkNotNull(listener);
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public final class Result {
    public final Grid start;
    public final Outcome outcome;
    public final int numSolutions;  // maxSolutions + 1 if more than maxSolutions
    public final ImmutableList<Grid> solutions;
    @Nullable public final Grid solution;  // Not null when numSolutions == 1
    public final int numStates;  // The number of states taken off the worklist
    public final int numPasses;
    public final ImmutableMultiset<Rule> eliminations;

    private Result() {
      Iter iter = iterator();
      ImmutableList.Builder<Grid> builder = ImmutableList.builder();
      int count = 0;
      while (count <= options.maxSolutions && iter.hasNext()) {
        builder.add(iter.next());
        ++count;
      }
      this.start = Solver.this.start;
      this.solutions = builder.build();
      this.numSolutions = count;
      this.solution = count == 1 ? solutions.get(0) : null;
      this.outcome = count == 0 ? Outcome.NO_SOLUTION
          : count == 1 ? Outcome.UNIQUE_SOLUTION
          : Outcome.MULTIPLE_SOLUTIONS;
      this.numStates = iter.getStepCount();
      this.numPasses = iter.propagator.getPassCount();
      this.eliminations = iter.propagator.getEliminations();
    }

    /** Returns the unique solution as 9 rows of 9 digits, or null if there isn't one. */
    @Nullable public int[][] solutionRows() {
      return solution == null ? null : solution.toRows();
    }
  }

  private final Grid start;
  private final Options options;
  private final Marks startMarks;

  public Solver(Grid start) {
    this(start, Options.DEFAULT);
  }

  public Solver(Grid start, Options options) {
    this.start = checkNotNull(start);
    this.options = checkNotNull(options);
    this.startMarks = Marks.fromGrid(start);
  }

  @Override public Iter iterator() {
    return new Iter();
  }

  public Result result() {
    return new Result();
  }

  public final class Iter implements Iterator<Grid> {
    private final ArrayDeque<WorkItem> worklist = new ArrayDeque<WorkItem>();
    private final Propagator propagator = new Propagator(options.schedule, options.listener);
    private boolean nextComputed;
    @Nullable private Grid next;
    private int stepCount;
    private int foundCount;

    private Iter() {
      worklist.add(new WorkItem(startMarks, null, 0));
    }

    /**
     * Returns the number of states taken off the worklist so far.
     */
    public int getStepCount() {
      return stepCount;
    }

    /**
     * Returns the number of states waiting on the worklist.
     */
    public int getPendingCount() {
      return worklist.size();
    }

    @Override public boolean hasNext() {
      if (!nextComputed) {
        next = computeNext();
        nextComputed = true;
      }
      return next != null;
    }

    @Override public Grid next() {
      if (!hasNext()) throw new NoSuchElementException();
      nextComputed = false;
      return next;
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }

    @Nullable private Grid computeNext() {
      while (!worklist.isEmpty()) {
        WorkItem item = worklist.removeFirst();
        ++stepCount;
        Marks.Builder builder = item.marks.toBuilder();
        if (item.location != null)
          builder.restrict(item.location, NumSet.bit(item.digit));

        switch (propagator.propagate(builder)) {
          case SOLVED:
            Grid solution = builder.build().toGrid();
            checkState(solution.isSolved(), "Propagation produced a broken grid:\n%s", solution);
            ++foundCount;
            if (logger.isLoggable(Level.FINE))
              logger.fine(String.format("Solution #%d found after %d state(s) (%d remain)",
                                        foundCount, stepCount, worklist.size()));
            return solution;

          case CONTRADICTION:
            if (logger.isLoggable(Level.FINER))
              logger.finer("Dead end: " + item + " (" + worklist.size() + " remain)");
            break;

          case IN_PROGRESS:
            pushNextItems(builder.build());
            break;
        }
      }
      return null;
    }

    private void pushNextItems(Marks marks) {
      Location loc = marks.firstOpenLocation();
      checkState(loc != null, "An open state must have an open location");
      NumSet possible = marks.get(loc);
      List<WorkItem> items = makeItems(marks, loc, possible);

      if (options.searchOrder == SearchOrder.DEPTH_FIRST) {
        // Push in reverse so the smallest digit comes off first.
        for (int i = items.size(); i-- > 0; )
          worklist.addFirst(items.get(i));
      } else {
        worklist.addAll(items);
      }

      if (logger.isLoggable(Level.FINE)) {
        logger.fine(String.format("Spawning at %s using values %s (%d queued)",
                                  loc, possible, worklist.size()));
      }
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest("\n" + marks.toSimpleString());
      }
    }
  }

  private static List<WorkItem> makeItems(Marks marks, Location loc, NumSet possible) {
    ImmutableList.Builder<WorkItem> builder = ImmutableList.builder();
    for (int i = 0; i < possible.size(); ++i)
      builder.add(new WorkItem(marks, loc, possible.get(i)));
    return builder.build();
  }

  /**
   * A hypothesis waiting to be tried: the given location holds the given digit
   * in the given marks.  The starting state has no location.
   */
  private static class WorkItem {
    final Marks marks;
    @Nullable final Location location;
    final int digit;

    WorkItem(Marks marks, @Nullable Location location, int digit) {
      this.marks = marks;
      this.location = location;
      this.digit = digit;
    }

    @Override public String toString() {
      return location == null ? "start" : location + "=" + digit;
    }
  }
}
