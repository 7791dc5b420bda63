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

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One of the 81 cells of a Sudoku grid.  Rows, columns and blocks are indexed
 * from 0, and the flat {@link #index} runs row by row.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Location implements Comparable<Location> {

  /** The number of distinct locations. */
  public static final int COUNT = 81;

  /** A number in the range [0, COUNT). */
  public final int index;

  /** The row index, in the range [0, 9). */
  public final int row;

  /** The column index, in the range [0, 9). */
  public final int column;

  /** The block index, in the range [0, 9), numbered left to right, top to bottom. */
  public final int block;

  public static Location of(int index) {
    checkElementIndex(index, COUNT);
    return instances[index];
  }

  public static Location ofIndices(int row, int column) {
    checkElementIndex(row, 9);
    checkElementIndex(column, 9);
    return instances[row * 9 + column];
  }

  /** All locations, in row-major order. */
  public static final List<Location> ALL;

  /** Returns the unit of the given type that contains this location. */
  public Unit unit(Unit.Type type) {
    switch (type) {
      case ROW: return Unit.row(row);
      case COLUMN: return Unit.column(column);
      default: return Unit.block(block);
    }
  }

  @Override public int compareTo(Location that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }

  private Location(int index) {
    this.index = index;
    this.row = index / 9;
    this.column = index % 9;
    this.block = row / 3 * 3 + column / 3;
  }

  private static final Location[] instances;
  static {
    instances = new Location[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Location(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
