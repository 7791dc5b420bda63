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
import us.blanshard.deduce.core.NumSet;
import us.blanshard.deduce.core.Unit;

import com.google.common.collect.ImmutableList;

import java.util.BitSet;

/**
 * The "fish" family of patterns, of which X-Wing (size 2) and Swordfish (size
 * 3) are members.  If in {@code size} parallel lines a digit may only go in
 * locations lying along the same {@code size} crossing lines, then each of
 * those crossing lines gets its copy of the digit from one of the parallel
 * lines, and the digit can be dropped from the rest of the crossing lines.
 *
 * <p> Every parallel line must admit the digit in at least two places; for
 * size 2 that means both lines admit it in exactly the same two places.
 *
 * @author Luke Blanshard
 */
final class Fish {

  static int apply(Marks.Builder marks, int size) {
    return apply(marks, size, Unit.rows()) + apply(marks, size, Unit.columns());
  }

  private static int apply(Marks.Builder marks, int size, ImmutableList<Unit> lines) {
    int count = 0;
    int[] indices = new int[size];
    Unit[] chosen = new Unit[size];
    Units.firstSubset(size, indices);
    do {
      for (int i = 0; i < size; ++i)
        chosen[i] = lines.get(indices[i]);
      for (int digit = 1; digit <= 9; ++digit) {
        int removed = apply(marks, chosen, NumSet.bit(digit));
        if (removed > 0) {
          count += removed;
          Singles.log(size == 2 ? "xWing" : "swordfish", describe(chosen, digit), removed);
        }
      }
    } while (Units.nextSubset(size, indices, lines.size()));
    return count;
  }

  private static int apply(Marks.Builder marks, Unit[] lines, int bit) {
    int cover = 0;
    for (Unit line : lines) {
      int positions = Units.positionsOf(marks, line, bit);
      if (Integer.bitCount(positions) < 2) return 0;
      cover |= positions;
    }
    if (Integer.bitCount(cover) != lines.length) return 0;

    // The corners of the pattern are the only places the digit stays put.
    BitSet keep = new BitSet(Location.COUNT);
    for (Unit line : lines)
      for (int i = 0; i < 9; ++i)
        if ((cover & (1 << i)) != 0)
          keep.set(line.get(i).index);

    int count = 0;
    for (int i = 0; i < 9; ++i) {
      if ((cover & (1 << i)) == 0) continue;
      for (Location loc : lines[0].crossing(i)) {
        if (!keep.get(loc.index))
          count += marks.eliminate(loc, bit);
      }
    }
    return count;
  }

  private static String describe(Unit[] lines, int digit) {
    StringBuilder sb = new StringBuilder();
    for (Unit line : lines) {
      if (sb.length() > 0) sb.append('x');
      sb.append(line);
    }
    return sb.append(':').append(digit).toString();
  }

  private Fish() {}
}
