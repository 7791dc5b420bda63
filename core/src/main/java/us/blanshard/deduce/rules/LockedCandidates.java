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
import us.blanshard.deduce.core.Triplet;

import java.util.List;

/**
 * Locked candidates, also known as pointing and claiming.  A digit that may
 * go in a triplet must appear in the triplet's line and in its block.  If it
 * is missing from the line sisters it has to be in the triplet, which keeps it
 * out of the square sisters, and vice versa.
 *
 * @author Luke Blanshard
 */
final class LockedCandidates {

  static int apply(Marks.Builder marks) {
    int count = 0;
    for (Triplet triplet : Triplet.all()) {
      int before = count;
      int inTriplet = 0;
      for (Location loc : triplet.cells) {
        int bits = marks.getBits(loc);
        if (Integer.bitCount(bits) > 1) inTriplet |= bits;
      }
      int inLine = union(marks, triplet.lineSisters);
      int inSquare = union(marks, triplet.squareSisters);

      for (int bit = 1; bit <= inTriplet; bit <<= 1) {
        if ((inTriplet & bit) == 0) continue;
        boolean line = (inLine & bit) != 0;
        boolean square = (inSquare & bit) != 0;
        if (line && !square) count += eliminate(marks, triplet.lineSisters, bit);
        if (square && !line) count += eliminate(marks, triplet.squareSisters, bit);
      }
      Singles.log("lockedCandidates", triplet, count - before);
    }
    return count;
  }

  private static int union(Marks.Builder marks, List<Location> locs) {
    int bits = 0;
    for (Location loc : locs)
      bits |= marks.getBits(loc);
    return bits;
  }

  private static int eliminate(Marks.Builder marks, List<Location> locs, int bit) {
    int count = 0;
    for (Location loc : locs)
      count += marks.eliminate(loc, bit);
    return count;
  }

  private LockedCandidates() {}
}
