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
import static org.junit.Assert.assertSame;
import static us.blanshard.deduce.TestHelper.l;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Set;

public class TripletTest {

  @Test public void count() {
    assertEquals(54, Triplet.all().size());
    for (int i = 0; i < Triplet.COUNT; ++i)
      assertEquals(i, Triplet.ofIndex(i).index);
  }

  @Test public void firstRowTriplet() {
    Triplet triplet = Triplet.ofIndex(0);
    assertEquals("R0S0", triplet.toString());
    assertSame(Unit.row(0), triplet.line);
    assertSame(Unit.block(0), triplet.block);
    assertThat(triplet.cells).containsExactly(l(0, 0), l(0, 1), l(0, 2)).inOrder();
    assertThat(triplet.lineSisters).containsExactly(
        l(0, 3), l(0, 4), l(0, 5), l(0, 6), l(0, 7), l(0, 8)).inOrder();
    assertThat(triplet.squareSisters).containsExactly(
        l(1, 0), l(1, 1), l(1, 2), l(2, 0), l(2, 1), l(2, 2)).inOrder();
  }

  @Test public void columnTriplet() {
    Triplet triplet = Triplet.ofIndex(27 + 4 * 3 + 1);
    assertEquals("C4S4", triplet.toString());
    assertThat(triplet.cells).containsExactly(l(3, 4), l(4, 4), l(5, 4)).inOrder();
    assertThat(triplet.lineSisters).containsExactly(
        l(0, 4), l(1, 4), l(2, 4), l(6, 4), l(7, 4), l(8, 4)).inOrder();
    assertThat(triplet.squareSisters).containsExactly(
        l(3, 3), l(3, 5), l(4, 3), l(4, 5), l(5, 3), l(5, 5)).inOrder();
  }

  @Test public void lastRowTriplet() {
    Triplet triplet = Triplet.ofIndex(26);
    assertEquals("R8S8", triplet.toString());
    assertThat(triplet.cells).containsExactly(l(8, 6), l(8, 7), l(8, 8)).inOrder();
  }

  @Test public void partitions() {
    for (Triplet triplet : Triplet.all()) {
      Set<Location> cells = Sets.newHashSet(triplet.cells);
      Set<Location> line = Sets.newHashSet(triplet.lineSisters);
      Set<Location> square = Sets.newHashSet(triplet.squareSisters);
      assertEquals(3, cells.size());
      assertEquals(6, line.size());
      assertEquals(6, square.size());
      assertThat(Sets.union(cells, line)).containsExactlyElementsIn(triplet.line);
      assertThat(Sets.union(cells, square)).containsExactlyElementsIn(triplet.block);
      assertThat(Sets.intersection(line, square)).isEmpty();
    }
  }

  @Test public void everyCrossingOnce() {
    Set<String> names = Sets.newHashSet();
    for (Triplet triplet : Triplet.all())
      names.add(triplet.toString());
    assertEquals(54, names.size());
    int rows = 0;
    for (Triplet triplet : Triplet.all())
      if (triplet.line.type == Unit.Type.ROW) ++rows;
    assertEquals(27, rows);
  }
}
