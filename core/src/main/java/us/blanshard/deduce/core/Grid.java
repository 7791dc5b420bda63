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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable Sudoku grid: each location holds a digit from 1 to 9 or is
 * blank (0).  The nested Builder class is a mutable version of the grid.  It
 * accepts any digit at any location: it does not enforce the constraints of
 * the game.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Grid {

  private final byte[] squares;

  private Grid(byte[] squares) {
    this.squares = squares;
  }

  public static final Grid BLANK = new Grid(new byte[Location.COUNT]);

  /** Returns a new Builder. */
  public static Builder builder() {
    return new Builder(BLANK);
  }

  /** Returns a mutable version of this grid. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Possible states for a Sudoku grid. */
  public enum State {
    INCOMPLETE,  // Not all filled in, but nothing that is filled in breaks the rules.
    BROKEN,      // Something that's filled in breaks the rules.
    SOLVED;      // Completely filled in, no rule violations.
  }

  public State getState() {
    if (!getBrokenLocations().isEmpty())
      return State.BROKEN;
    return size() < Location.COUNT ? State.INCOMPLETE : State.SOLVED;
  }

  public boolean isSolved() {
    return getState() == State.SOLVED;
  }

  /**
   * Returns locations that share their digit with another location in some
   * unit.
   */
  public ImmutableSortedSet<Location> getBrokenLocations() {
    Set<Location> answer = new TreeSet<Location>();
    for (Unit unit : Unit.allUnits()) {
      Location[] seen = new Location[10];
      for (Location loc : unit) {
        int digit = get(loc);
        if (digit == 0) continue;
        if (seen[digit] != null) {
          answer.add(seen[digit]);
          answer.add(loc);
        } else {
          seen[digit] = loc;
        }
      }
    }
    return ImmutableSortedSet.copyOf(answer);
  }

  /** Returns the digit at the given location, or 0 if it is blank. */
  public int get(Location loc) {
    return squares[loc.index];
  }

  public boolean isSet(Location loc) {
    return squares[loc.index] != 0;
  }

  /** Returns the number of locations that are filled in. */
  public int size() {
    int answer = 0;
    for (byte square : squares) {
      if (square != 0) ++answer;
    }
    return answer;
  }

  /**
   * Tells whether every location filled in here holds the same digit in the
   * given grid.
   */
  public boolean isSubsetOf(Grid that) {
    for (int i = 0; i < Location.COUNT; ++i) {
      if (squares[i] != 0 && squares[i] != that.squares[i])
        return false;
    }
    return true;
  }

  @NotThreadSafe
  public static final class Builder {
    private Grid grid;
    private boolean built;

    private Builder(Grid grid) {
      this.grid = grid;
      this.built = true;
    }

    private Grid grid() {
      if (built) {
        this.grid = new Grid(grid.squares.clone());
        this.built = false;
      }
      return grid;
    }

    /** Returns an immutable snapshot of this grid. */
    public Grid build() {
      built = true;
      return grid;
    }

    /** Returns the digit at the given location, or 0. */
    public int get(Location loc) {
      return grid.get(loc);
    }

    /** Sets the digit for the given location. */
    public Builder put(Location loc, int digit) {
      checkArgument(digit >= 1 && digit <= 9, "Not a Sudoku digit: %s", digit);
      grid().squares[loc.index] = (byte) digit;
      return this;
    }

    /** Erases the given location. */
    public Builder remove(Location loc) {
      grid().squares[loc.index] = 0;
      return this;
    }

    /** Returns the number of squares filled in. */
    public int size() {
      return grid.size();
    }
  }

  /**
   * Builds a grid from 9 rows of 9 numbers each, 0 meaning blank.
   *
   * @throws MalformedPuzzleException if the rows are the wrong shape or hold
   *     numbers outside 0 through 9
   */
  public static Grid fromRows(@Nullable int[][] rows) {
    if (rows == null || rows.length != 9)
      throw new MalformedPuzzleException("puzzle is not a 9x9 grid");
    for (int[] row : rows) {
      if (row == null || row.length != 9)
        throw new MalformedPuzzleException("puzzle is not a 9x9 grid");
    }
    Set<Integer> badValues = new TreeSet<Integer>();
    for (int[] row : rows)
      for (int value : row)
        if (value < 0 || value > 9) badValues.add(value);
    if (!badValues.isEmpty())
      throw new MalformedPuzzleException("invalid value(s) in puzzle: " + badValues);

    byte[] squares = new byte[Location.COUNT];
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        squares[r * 9 + c] = (byte) rows[r][c];
    return new Grid(squares);
  }

  /** Returns this grid as 9 rows of 9 numbers each, 0 meaning blank. */
  public int[][] toRows() {
    int[][] rows = new int[9][9];
    for (int i = 0; i < Location.COUNT; ++i)
      rows[i / 9][i % 9] = squares[i];
    return rows;
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.  Zeros and periods are blanks.
   *
   * @throws MalformedPuzzleException if there are not exactly 81 locations
   */
  public static Grid fromString(String s) {
    byte[] squares = new byte[Location.COUNT];
    int index = 0;
    for (char c : s.toCharArray()) {
      if ((c >= '0' && c <= '9') || c == '.') {
        if (index < Location.COUNT && c != '.')
          squares[index] = (byte) (c - '0');
        ++index;
      }
    }
    if (index != Location.COUNT) {
      throw new MalformedPuzzleException(
          String.format("A puzzle requires 81 locations, got %d in %s", index, s));
    }
    return new Grid(squares);
  }

  /**
   * Generates a string of 81 characters with dots for blank locations and
   * digits for set ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder(Location.COUNT);
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(squares);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Unit row : Unit.rows()) {
      for (Location loc : row) {
        if (isSet(loc)) sb.append(' ').append(get(loc));
        else sb.append(" .");
        if (loc.column == 2 || loc.column == 5)
          sb.append(" |");
      }
      sb.append('\n');
      if (row.number == 2 || row.number == 5)
        sb.append("-------+-------+-------\n");
    }
    return sb.toString();
  }
}
