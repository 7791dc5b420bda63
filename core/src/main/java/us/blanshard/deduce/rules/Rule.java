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

import us.blanshard.deduce.core.Marks;

import com.google.common.base.CaseFormat;

/**
 * The deduction rules, listed from cheapest to most expensive.  Each one looks
 * for a pattern across the whole grid and removes the candidates the pattern
 * rules out, returning the number it removed.  Rules never add candidates, and
 * a rule applied to marks it has already processed removes nothing.
 *
 * @author Luke Blanshard
 */
public enum Rule {

  /** A digit that is settled in one location can't go anywhere else in its units. */
  ELIMINATE_FOUND {
    @Override public int apply(Marks.Builder marks) {
      return Singles.eliminateFound(marks);
    }
  },

  /** A digit with only one possible location in a unit goes there. */
  UNIQUE_CELL {
    @Override public int apply(Marks.Builder marks) {
      return Singles.uniqueCell(marks);
    }
  },

  /** k locations of a unit confined to k digits keep those digits to themselves. */
  NAKED_TUPLE {
    @Override public int apply(Marks.Builder marks) {
      return Tuples.naked(marks);
    }
  },

  /** k digits confined to k locations of a unit crowd out the locations' other digits. */
  HIDDEN_TUPLE {
    @Override public int apply(Marks.Builder marks) {
      return Tuples.hidden(marks);
    }
  },

  /** Where a block crosses a line, a digit confined to one side of the crossing leaves the other. */
  LOCKED_CANDIDATES {
    @Override public int apply(Marks.Builder marks) {
      return LockedCandidates.apply(marks);
    }
  },

  /** Two parallel lines that hold a digit in the same two crossing lines. */
  X_WING {
    @Override public int apply(Marks.Builder marks) {
      return Fish.apply(marks, 2);
    }
  },

  /** Three parallel lines that hold a digit within the same three crossing lines. */
  SWORDFISH {
    @Override public int apply(Marks.Builder marks) {
      return Fish.apply(marks, 3);
    }
  };

  /**
   * Applies this rule to the given marks, returns the number of candidates it
   * eliminated.
   */
  public abstract int apply(Marks.Builder marks);

  /** The rule's name in camel case, for logs. */
  public String displayName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }
}
