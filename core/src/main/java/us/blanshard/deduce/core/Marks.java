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

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Keeps track of the digits that could still go in each location, like the
 * pencil marks people fill in to Sudoku grids.  All 81 candidate sets live in
 * one flat array indexed by {@link Location#index}; units and triplets only
 * name locations, so a change made while looking at a row is seen by the
 * column, block and triplets sharing that cell.
 *
 * <p> The outer class is immutable; the nested builder is the mutable working
 * state that deduction rules operate on.  A builder made from a Marks shares
 * its array until the first change, which copies it, so hypotheses spawned
 * from the same state can never disturb one another.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Marks {

  private final short[] bits;

  private Marks(short[] bits) {
    this.bits = bits;
  }

  /**
   * Returns the starting marks for the given grid: a given location may hold
   * only its digit, a blank one may hold any digit.
   */
  public static Marks fromGrid(Grid grid) {
    short[] bits = new short[Location.COUNT];
    for (Location loc : Location.ALL) {
      int digit = grid.get(loc);
      bits[loc.index] = (short) (digit == 0 ? NumSet.ALL_BITS : NumSet.bit(digit));
    }
    return new Marks(bits);
  }

  /** Returns a builder starting from {@link #fromGrid}. */
  public static Builder builder(Grid grid) {
    return fromGrid(grid).toBuilder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Returns the set of digits that could go in the given location. */
  public NumSet get(Location loc) {
    return NumSet.ofBits(bits[loc.index]);
  }

  /** Returns the bit-set corresponding to {@link #get}. */
  public int getBits(Location loc) {
    return bits[loc.index];
  }

  /** Returns the total number of candidates across all 81 locations. */
  public int candidateCount() {
    int answer = 0;
    for (short b : bits)
      answer += Integer.bitCount(b);
    return answer;
  }

  /** Tells whether some location has no candidates left. */
  public boolean hasEmptyLocation() {
    for (short b : bits)
      if (b == 0) return true;
    return false;
  }

  /** Tells whether every location is down to a single candidate. */
  public boolean isFullyDetermined() {
    for (short b : bits)
      if (Integer.bitCount(b) != 1) return false;
    return true;
  }

  /**
   * Returns the first location, in row-major order, that still has more than
   * one candidate, or null if there is none.
   */
  @Nullable public Location firstOpenLocation() {
    for (int i = 0; i < Location.COUNT; ++i)
      if (Integer.bitCount(bits[i]) > 1) return Location.of(i);
    return null;
  }

  /** Returns the grid of all locations narrowed down to a single digit. */
  public Grid toGrid() {
    Grid.Builder builder = Grid.builder();
    for (Location loc : Location.ALL) {
      NumSet possible = get(loc);
      if (possible.isSingleton())
        builder.put(loc, possible.get(0));
    }
    return builder.build();
  }

  /**
   * Renders the grid with a digit for each determined location, "?" for each
   * open one, and "X" for a dead one.
   */
  public String toSimpleString() {
    StringBuilder sb = new StringBuilder();
    for (Unit row : Unit.rows()) {
      for (Location loc : row) {
        NumSet possible = get(loc);
        if (loc.column > 0) sb.append(' ');
        if (possible.isEmpty()) sb.append('X');
        else if (possible.isSingleton()) sb.append(possible.get(0));
        else sb.append('?');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Renders the number of candidates left at each location. */
  public String toCountString() {
    StringBuilder sb = new StringBuilder();
    for (Unit row : Unit.rows()) {
      for (Location loc : row) {
        if (loc.column > 0) sb.append(' ');
        sb.append(Integer.bitCount(bits[loc.index]));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Renders every location's candidates, in aligned columns. */
  public String toCandidateString() {
    StringBuilder sb = new StringBuilder();
    for (Unit row : Unit.rows()) {
      for (Location loc : row) {
        String digits = get(loc).toDigitString();
        sb.append(' ').append(digits);
        for (int pad = digits.length(); pad < 9; ++pad)
          sb.append(' ');
        if (loc.column == 2 || loc.column == 5)
          sb.append('|');
      }
      sb.append('\n');
      if (row.number == 2 || row.number == 5)
        sb.append("------------------------------+------------------------------+------------------------------\n");
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Marks)) return false;
    return Arrays.equals(this.bits, ((Marks) o).bits);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(bits);
  }

  @Override public String toString() {
    return toCandidateString();
  }

  @NotThreadSafe
  public static final class Builder {
    private Marks marks;
    private boolean built;

    private Builder(Marks marks) {
      this.marks = marks;
      this.built = true;
    }

    private short[] bits() {
      if (built) {
        this.marks = new Marks(marks.bits.clone());
        this.built = false;
      }
      return marks.bits;
    }

    /** Returns an immutable snapshot of the current state. */
    public Marks build() {
      built = true;
      return marks;
    }

    public NumSet get(Location loc) {
      return marks.get(loc);
    }

    public int getBits(Location loc) {
      return marks.getBits(loc);
    }

    public int candidateCount() {
      return marks.candidateCount();
    }

    /**
     * Removes the given digits from the location's candidates.  Returns the
     * number of candidates actually removed.
     */
    public int eliminate(Location loc, int digitBits) {
      int current = marks.bits[loc.index];
      int removed = current & digitBits;
      if (removed == 0) return 0;
      bits()[loc.index] = (short) (current & ~removed);
      return Integer.bitCount(removed);
    }

    /**
     * Narrows the location's candidates to those among the given digits.
     * Returns the number of candidates actually removed.
     */
    public int restrict(Location loc, int digitBits) {
      return eliminate(loc, NumSet.ALL_BITS & ~digitBits);
    }
  }
}
