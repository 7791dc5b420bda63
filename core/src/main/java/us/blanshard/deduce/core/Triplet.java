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

import javax.annotation.concurrent.Immutable;

/**
 * The three locations where a block crosses a row or a column, together with
 * the six other locations of that line (the "line sisters") and the six other
 * locations of that block (the "square sisters").  A numeral that may go in a
 * triplet must go in the triplet if it is barred from either set of sisters.
 *
 * <p> There are 54 triplets: indices 0 through 26 lie along rows, three per
 * row from left to right, and 27 through 53 along columns, three per column
 * from top to bottom.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Triplet {

  public static final int COUNT = 54;

  /** The index of this triplet in {@link #all}. */
  public final int index;

  /** The row or column this triplet lies along. */
  public final Unit line;

  /** The block this triplet lies within. */
  public final Unit block;

  public final ImmutableList<Location> cells;
  public final ImmutableList<Location> lineSisters;
  public final ImmutableList<Location> squareSisters;

  public static Triplet ofIndex(int index) {
    checkElementIndex(index, COUNT);
    return ALL.get(index);
  }

  public static ImmutableList<Triplet> all() {
    return ALL;
  }

  @Override public String toString() {
    return line.toString() + block;
  }

  private Triplet(int index, Unit line, int third) {
    this.index = index;
    this.line = line;
    this.block = line.get(third * 3).unit(Unit.Type.BLOCK);

    ImmutableList.Builder<Location> cells = ImmutableList.builder();
    ImmutableList.Builder<Location> lineSisters = ImmutableList.builder();
    for (int i = 0; i < 9; ++i) {
      if (i / 3 == third) cells.add(line.get(i));
      else lineSisters.add(line.get(i));
    }
    ImmutableList.Builder<Location> squareSisters = ImmutableList.builder();
    for (Location loc : block) {
      if (!line.contains(loc)) squareSisters.add(loc);
    }
    this.cells = cells.build();
    this.lineSisters = lineSisters.build();
    this.squareSisters = squareSisters.build();
  }

  private static final ImmutableList<Triplet> ALL;
  static {
    ImmutableList.Builder<Triplet> builder = ImmutableList.builder();
    int index = 0;
    for (Unit row : Unit.rows())
      for (int third = 0; third < 3; ++third)
        builder.add(new Triplet(index++, row, third));
    for (Unit column : Unit.columns())
      for (int third = 0; third < 3; ++third)
        builder.add(new Triplet(index++, column, third));
    ALL = builder.build();
  }
}
