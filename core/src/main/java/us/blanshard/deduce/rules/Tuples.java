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

/**
 * Naked and hidden tuples: sets of k locations within a unit that between them
 * hold exactly k digits.  Each undetermined location's own candidate set is
 * tried as the tuple's digits.
 *
 * @author Luke Blanshard
 */
final class Tuples {

  /**
   * If the locations whose candidates are a subset of some location's
   * candidates number as many as those candidates, the digits are locked into
   * those locations: remove them from the unit's other locations.
   */
  static int naked(Marks.Builder marks) {
    int count = 0;
    for (Unit unit : Unit.allUnits()) {
      int before = count;
      for (Location loc : unit) {
        int tuple = marks.getBits(loc);
        int size = Integer.bitCount(tuple);
        if (size < 2) continue;

        int subsets = 0;
        for (int i = 0; i < 9; ++i)
          if ((marks.getBits(unit.get(i)) & ~tuple) == 0)
            subsets |= 1 << i;
        if (Integer.bitCount(subsets) != size) continue;

        for (int i = 0; i < 9; ++i)
          if ((subsets & (1 << i)) == 0)
            count += marks.eliminate(unit.get(i), tuple);
      }
      Singles.log("nakedTuple", unit, count - before);
    }
    return count;
  }

  /**
   * If some location's candidates are contained in as many locations as there
   * are candidates, and no location of the unit holds only some of them, those
   * locations must hold exactly those digits: drop everything else from them.
   */
  static int hidden(Marks.Builder marks) {
    int count = 0;
    for (Unit unit : Unit.allUnits()) {
      int before = count;
      for (Location loc : unit) {
        int tuple = marks.getBits(loc);
        int size = Integer.bitCount(tuple);
        if (size < 2) continue;

        int supersets = 0;
        boolean partial = false;
        for (int i = 0; i < 9; ++i) {
          int bits = marks.getBits(unit.get(i));
          if ((tuple & ~bits) == 0) supersets |= 1 << i;
          else if ((tuple & bits) != 0) partial = true;
        }
        if (partial || Integer.bitCount(supersets) != size) continue;

        for (int i = 0; i < 9; ++i)
          if ((supersets & (1 << i)) != 0)
            count += marks.restrict(unit.get(i), tuple);
      }
      Singles.log("hiddenTuple", unit, count - before);
    }
    return count;
  }

  private Tuples() {}
}
