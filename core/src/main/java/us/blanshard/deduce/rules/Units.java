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
package us.blanshard.deduce.rules;

import us.blanshard.deduce.core.Location;
import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.core.Unit;

import javax.annotation.Nullable;

/**
 * Bit-twiddling helpers for looking at the locations of a unit.  A "position
 * mask" has bit i set when the unit's location i is included.
 *
 * @author Luke Blanshard
 */
final class Units {

  /** Returns the position mask of the unit's locations that admit any of the digits. */
  static int positionsOf(Marks.Builder marks, Unit unit, int digitBits) {
    int positions = 0;
    for (int i = 0; i < 9; ++i)
      if ((marks.getBits(unit.get(i)) & digitBits) != 0)
        positions |= 1 << i;
    return positions;
  }

  /**
   * Returns the one location in the unit that admits the given digit, or null
   * if there are none or several.
   */
  @Nullable static Location onlyLocation(Marks.Builder marks, Unit unit, int digitBit) {
    int positions = positionsOf(marks, unit, digitBit);
    if (Integer.bitCount(positions) != 1) return null;
    return unit.get(Integer.numberOfTrailingZeros(positions));
  }

  /** Sets the first {@code size} indices to 0, 1, 2... */
  static void firstSubset(int size, int[] indices) {
    for (int i = 0; i < size; ++i)
      indices[i] = i;
  }

  /**
   * Advances the indices to the next subset of {@code count} items in
   * lexicographic order, returns false when there are no more.
   */
  static boolean nextSubset(int size, int[] indices, int count) {
    for (int i = size; i-- > 0; --count) {
      if (++indices[i] < count) {
        while (++i < size)
          indices[i] = 1 + indices[i - 1];
        return true;
      }
    }
    return false;
  }

  private Units() {}
}
