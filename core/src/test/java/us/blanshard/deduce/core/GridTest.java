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
package us.blanshard.deduce.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static us.blanshard.deduce.TestHelper.SAMPLE;
import static us.blanshard.deduce.TestHelper.SAMPLE_SOLUTION;
import static us.blanshard.deduce.TestHelper.SOLVED;
import static us.blanshard.deduce.TestHelper.g;
import static us.blanshard.deduce.TestHelper.l;

import org.junit.Test;

public class GridTest {

  @Test public void build() {
    Grid.Builder builder = Grid.builder().put(l(3, 7), 6);
    Grid g1 = builder.build();
    builder.put(l(8, 5), 1);
    Grid g2 = builder.build();
    builder.remove(l(8, 5));
    Grid g3 = builder.build();
    assertEquals(g1, g3);
    assertEquals(g1.hashCode(), g3.hashCode());
    assertFalse(g1.equals(g2));
    assertEquals(1, g1.size());
    assertEquals(2, g2.size());
    assertEquals(0, Grid.BLANK.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void put_rejectsZero() {
    Grid.builder().put(l(0, 0), 0);
  }

  @Test public void strings() {
    String s = "...8.9..6.23.........6.8...7....1..2...45...9......6......7......1.46.....3......";
    Grid g = Grid.fromString(s);
    assertEquals(s, g.toFlatString());
    Grid g2 = Grid.fromString(g.toString());
    assertEquals(g, g2);
    assertEquals(g, Grid.fromString(s.replace('.', '0')));
  }

  @Test public void fromString_wrongLength() {
    try {
      Grid.fromString("123");
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e).hasMessageThat().contains("got 3");
    }
  }

  @Test public void rows() {
    Grid grid = g(SAMPLE);
    int[][] rows = grid.toRows();
    assertEquals(9, rows.length);
    assertEquals(6, rows[0][2]);
    assertEquals(0, rows[0][0]);
    assertEquals(5, rows[8][6]);
    assertEquals(grid, Grid.fromRows(rows));
  }

  @Test public void fromRows_wrongShape() {
    try {
      Grid.fromRows(new int[8][9]);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e).hasMessageThat().contains("9x9");
    }
    int[][] ragged = new int[9][9];
    ragged[4] = new int[10];
    try {
      Grid.fromRows(ragged);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e).hasMessageThat().contains("9x9");
    }
    try {
      Grid.fromRows(null);
      fail();
    } catch (MalformedPuzzleException e) {
      // expected
    }
  }

  @Test public void fromRows_badValues() {
    int[][] rows = new int[9][9];
    rows[2][3] = 10;
    rows[7][7] = -1;
    rows[8][0] = 10;
    try {
      Grid.fromRows(rows);
      fail();
    } catch (MalformedPuzzleException e) {
      assertEquals("invalid value(s) in puzzle: [-1, 10]", e.getMessage());
    }
  }

  @Test public void states() {
    assertEquals(Grid.State.INCOMPLETE, g(SAMPLE).getState());
    assertEquals(Grid.State.SOLVED, g(SOLVED).getState());
    assertTrue(g(SOLVED).isSolved());
    Grid broken = g(SAMPLE).toBuilder().put(l(0, 0), 6).build();
    assertEquals(Grid.State.BROKEN, broken.getState());
  }

  @Test public void getBrokenLocations() {
    Grid grid = Grid.builder()
        .put(l(0, 0), 1)
        .put(l(0, 8), 1)
        .put(l(8, 0), 1)
        .put(l(6, 2), 1)
        .put(l(4, 4), 2)
        .build();
    assertThat(grid.getBrokenLocations())
        .containsExactly(l(0, 0), l(0, 8), l(6, 2), l(8, 0)).inOrder();
  }

  @Test public void isSubsetOf() {
    assertTrue(g(SAMPLE).isSubsetOf(g(SAMPLE_SOLUTION)));
    assertTrue(Grid.BLANK.isSubsetOf(g(SOLVED)));
    assertFalse(g(SOLVED).isSubsetOf(g(SAMPLE)));
  }
}
