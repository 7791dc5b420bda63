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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The two single-location rules.
 *
 * @author Luke Blanshard
 */
final class Singles {
  private static final Logger logger = Logger.getLogger(Singles.class.getName());

  static int eliminateFound(Marks.Builder marks) {
    int count = 0;
    for (Unit unit : Unit.allUnits()) {
      int before = count;
      for (Location loc : unit) {
        int bits = marks.getBits(loc);
        if (Integer.bitCount(bits) != 1) continue;
        for (Location other : unit) {
          if (other != loc)
            count += marks.eliminate(other, bits);
        }
      }
      log("eliminateFound", unit, count - before);
    }
    return count;
  }

  static int uniqueCell(Marks.Builder marks) {
    int count = 0;
    for (Unit unit : Unit.allUnits()) {
      int before = count;
      for (int digit = 1; digit <= 9; ++digit) {
        Location found = Units.onlyLocation(marks, unit, NumSet.bit(digit));
        if (found != null && Integer.bitCount(marks.getBits(found)) > 1)
          count += marks.restrict(found, NumSet.bit(digit));
      }
      log("uniqueCell", unit, count - before);
    }
    return count;
  }

  static void log(String rule, Object where, int count) {
    if (count > 0 && logger.isLoggable(Level.FINEST))
      logger.finest(String.format("%s - %s removed %d candidate(s)", rule, where, count));
  }

  private Singles() {}
}
