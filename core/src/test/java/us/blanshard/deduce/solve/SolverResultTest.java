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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static us.blanshard.deduce.TestHelper.SAMPLE;
import static us.blanshard.deduce.TestHelper.SAMPLE_SOLUTION;
import static us.blanshard.deduce.TestHelper.SEVENTEEN;
import static us.blanshard.deduce.TestHelper.SEVENTEEN_SOLUTION;
import static us.blanshard.deduce.TestHelper.SOLVED;
import static us.blanshard.deduce.TestHelper.g;
import static us.blanshard.deduce.TestHelper.l;
import static us.blanshard.deduce.TestHelper.without;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.core.MalformedPuzzleException;
import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.rules.Rule;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import java.util.NoSuchElementException;

/**
 * Scenario tests for the search.
 */
public class SolverResultTest {

  @Test public void alreadySolved() {
    Solver.Result result = Solver.solve(g(SOLVED));
    assertEquals(Solver.Outcome.UNIQUE_SOLUTION, result.outcome);
    assertEquals(g(SOLVED), result.solution);
    assertEquals(1, result.numStates);
    assertTrue(result.eliminations.isEmpty());
  }

  @Test public void oneBlank() {
    Solver.Result result = Solver.solve(g(without(SOLVED, 0, 0)));
    assertEquals(Solver.Outcome.UNIQUE_SOLUTION, result.outcome);
    assertEquals(g(SOLVED), result.solution);
    assertEquals(1, result.numStates);
    assertEquals(2, result.numPasses);
    assertEquals(8, result.eliminations.count(Rule.ELIMINATE_FOUND));
  }

  @Test public void sample() {
    Solver.Result result = Solver.solve(g(SAMPLE));
    assertEquals(Solver.Outcome.UNIQUE_SOLUTION, result.outcome);
    assertEquals(g(SAMPLE_SOLUTION), result.solution);
    assertEquals(g(SAMPLE), result.start);
  }

  @Test public void needsSearch() {
    for (Solver.SearchOrder order : Solver.SearchOrder.values()) {
      Solver.Options options = Solver.Options.builder().searchOrder(order).build();
      Solver.Result result = Solver.solve(g(SEVENTEEN), options);
      assertEquals(order.toString(), Solver.Outcome.UNIQUE_SOLUTION, result.outcome);
      assertEquals(g(SEVENTEEN_SOLUTION), result.solution);
      assertThat(result.numStates).isGreaterThan(1);
    }
  }

  @Test public void contradictoryGivens() {
    Grid start = Grid.builder().put(l(0, 0), 5).put(l(0, 7), 5).build();
    assertEquals(Grid.State.BROKEN, start.getState());
    Solver.Result result = Solver.solve(start);
    assertEquals(Solver.Outcome.NO_SOLUTION, result.outcome);
    assertEquals(0, result.numSolutions);
    assertNull(result.solution);
    assertNull(result.solutionRows());
  }

  @Test public void emptyGrid() {
    Solver.Result result = Solver.solve(Grid.BLANK);
    assertEquals(Solver.Outcome.MULTIPLE_SOLUTIONS, result.outcome);
    assertEquals(2, result.numSolutions);
    assertNull(result.solution);
    Grid first = result.solutions.get(0);
    Grid second = result.solutions.get(1);
    assertTrue(first.isSolved());
    assertTrue(second.isSolved());
    assertFalse(first.equals(second));
  }

  @Test public void maxSolutions() {
    Solver.Result result = Solver.solve(Grid.BLANK, 3);
    assertEquals(Solver.Outcome.MULTIPLE_SOLUTIONS, result.outcome);
    assertEquals(4, result.numSolutions);
    assertEquals(4, result.solutions.size());
    assertEquals(4, ImmutableSet.copyOf(result.solutions).size());
  }

  @Test public void maxSolutions_mustBePositive() {
    try {
      Solver.Options.builder().maxSolutions(0);
      fail();
    } catch (IllegalArgumentException e) {
      assertThat(e).hasMessageThat().contains("maxSolutions");
    }
  }

  @Test public void deterministic() {
    Solver.Result first = Solver.solve(Grid.BLANK);
    Solver.Result second = Solver.solve(Grid.BLANK);
    assertEquals(first.solutions, second.solutions);
    assertEquals(first.numStates, second.numStates);
    assertEquals(first.eliminations, second.eliminations);
  }

  @Test public void rows() {
    int[][] puzzle = g(SAMPLE).toRows();
    Solver.Result result = Solver.solve(puzzle);
    int[][] rows = result.solutionRows();
    assertNotNull(rows);
    assertEquals(9, rows.length);
    assertEquals(g(SAMPLE_SOLUTION), Grid.fromRows(rows));
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        if (puzzle[r][c] != 0) assertEquals(puzzle[r][c], rows[r][c]);
  }

  @Test public void malformedRows() {
    try {
      Solver.solve(new int[8][9]);
      fail();
    } catch (MalformedPuzzleException e) {
      // expected
    }
    int[][] puzzle = new int[9][9];
    puzzle[3][3] = 10;
    try {
      Solver.solve(puzzle);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e).hasMessageThat().contains("10");
    }
  }

  @Test public void iterator() {
    Solver solver = new Solver(g(SEVENTEEN));
    Solver.Iter iter = solver.iterator();
    assertTrue(iter.hasNext());
    assertEquals(g(SEVENTEEN_SOLUTION), iter.next());
    assertFalse(iter.hasNext());
    assertEquals(0, iter.getPendingCount());
    assertThat(iter.getStepCount()).isGreaterThan(1);
    try {
      iter.next();
      fail();
    } catch (NoSuchElementException e) {
      // expected
    }
  }

  @Test public void listenerSeesSearch() {
    final int[] passes = {0};
    Propagator.Listener counter = new Propagator.Listener() {
      @Override public void ruleApplied(Rule rule, int removed, Marks marks) {}
      @Override public void passCompleted(int pass, int removed, Marks marks) {
        ++passes[0];
      }
    };
    Solver.Result result =
        Solver.solve(g(SEVENTEEN), Solver.Options.builder().listener(counter).build());
    assertEquals(result.numPasses, passes[0]);
  }
}
