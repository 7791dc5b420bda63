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

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.NoSuchElementException;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, or block of a Sudoku grid: a set of 9 locations that must all
 * contain different digits in a solved Sudoku.  Units are views: they hold
 * location indices, never cell contents, so every unit sees the same cells as
 * the grid and as the other units that overlap it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Unit implements Iterable<Location>, Comparable<Unit> {

  public static final int COUNT = 3 * 9;  // 9 each of rows, columns, and blocks.

  public enum Type {
    ROW("R"), COLUMN("C"), BLOCK("S");

    private final String prefix;

    private Type(String prefix) {
      this.prefix = prefix;
    }
  }

  public final Type type;

  /** The index of this unit among the units of its type, in [0, 9). */
  public final int number;

  /** The index of this unit in {@link #allUnits}: rows, then columns, then blocks. */
  public final int index;

  private final byte[] locations;

  public static Unit row(int number) {
    checkElementIndex(number, 9);
    return instances[number];
  }

  public static Unit column(int number) {
    checkElementIndex(number, 9);
    return instances[9 + number];
  }

  public static Unit block(int number) {
    checkElementIndex(number, 9);
    return instances[18 + number];
  }

  public static Unit ofIndex(int index) {
    checkElementIndex(index, COUNT);
    return instances[index];
  }

  /** All 27 units, indexed by {@link #index}. */
  public static ImmutableList<Unit> allUnits() {
    return ALL;
  }

  public static ImmutableList<Unit> rows() {
    return ALL.subList(0, 9);
  }

  public static ImmutableList<Unit> columns() {
    return ALL.subList(9, 18);
  }

  public static ImmutableList<Unit> blocks() {
    return ALL.subList(18, 27);
  }

  /**
   * For a row or column, returns the perpendicular line that crosses this one
   * at the given position.
   */
  public Unit crossing(int position) {
    switch (type) {
      case ROW: return column(position);
      case COLUMN: return row(position);
      default: throw new UnsupportedOperationException("Blocks have no crossing lines");
    }
  }

  /** Returns the location at the given position within this unit. */
  public Location get(int position) {
    return Location.of(locations[position]);
  }

  /** Returns the position of the given location within this unit, or -1. */
  public int indexOf(Location loc) {
    for (int i = 0; i < 9; ++i)
      if (locations[i] == loc.index) return i;
    return -1;
  }

  public boolean contains(Location loc) {
    return loc.unit(type) == this;
  }

  public int size() {
    return 9;
  }

  @Override public Iterator<Location> iterator() {
    return new Iterator<Location>() {
      private int next;

      @Override public boolean hasNext() {
        return next < 9;
      }

      @Override public Location next() {
        if (next >= 9) throw new NoSuchElementException();
        return get(next++);
      }

      @Override public void remove() {
        throw new UnsupportedOperationException();
      }
    };
  }

  @Override public int compareTo(Unit that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return type.prefix + number;
  }

  private Unit(Type type, int number) {
    this.type = type;
    this.number = number;
    this.index = type.ordinal() * 9 + number;
    this.locations = new byte[9];
    for (int i = 0; i < 9; ++i) {
      int row, column;
      switch (type) {
        case ROW:
          row = number;
          column = i;
          break;
        case COLUMN:
          row = i;
          column = number;
          break;
        default:
          row = number / 3 * 3 + i / 3;
          column = number % 3 * 3 + i % 3;
          break;
      }
      this.locations[i] = (byte) (row * 9 + column);
    }
  }

  private static final Unit[] instances;
  private static final ImmutableList<Unit> ALL;
  static {
    instances = new Unit[COUNT];
    for (Type type : Type.values()) {
      for (int i = 0; i < 9; ++i) {
        Unit unit = new Unit(type, i);
        instances[unit.index] = unit;
      }
    }
    ALL = ImmutableList.copyOf(instances);
  }
}
