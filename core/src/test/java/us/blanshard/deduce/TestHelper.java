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
package us.blanshard.deduce;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.core.Location;
import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.core.NumSet;

/**
 * Shorthand factories for tests.
 */
public class TestHelper {
  /** A classic newspaper-style puzzle; has a unique solution. */
  public static final String SAMPLE =
      "0 0 6 | 1 0 0 | 0 0 8" +
      "0 8 0 | 0 9 0 | 0 3 0" +
      "2 0 0 | 0 0 5 | 4 0 0" +
      "------+-------+------" +
      "4 0 0 | 0 0 1 | 8 0 0" +
      "0 3 0 | 0 7 0 | 0 4 0" +
      "0 0 7 | 9 0 0 | 0 0 3" +
      "------+-------+------" +
      "0 0 8 | 4 0 0 | 0 0 6" +
      "0 2 0 | 0 5 0 | 0 8 0" +
      "1 0 0 | 0 0 2 | 5 0 0";

  public static final String SAMPLE_SOLUTION =
      "346127958785694132219385467462531879931278645857946213598413726624759381173862594";

  /** A complete, valid grid. */
  public static final String SOLVED =
      "693784512487512936125963874932651487568247391741398625319475268856129743274836159";

  /** A 17-clue puzzle that the deduction rules alone can't finish. */
  public static final String SEVENTEEN =
      "000000013040000080200060000609000400000800000000300000030100500000040706000000000";

  public static final String SEVENTEEN_SOLUTION =
      "867459213945231687213768954689517432324896175571324869436172598158943726792685341";

  public static Grid g(String s) { return Grid.fromString(s); }
  public static Marks m(String s) { return Marks.fromGrid(g(s)); }
  public static Marks.Builder mb(String s) { return Marks.builder(g(s)); }
  public static Marks.Builder blank() { return Marks.builder(Grid.BLANK); }
  public static NumSet ns(int... digits) { return NumSet.of(digits); }
  public static int bits(int... digits) { return NumSet.of(digits).bits; }
  public static Location l(int row, int col) { return Location.ofIndices(row, col); }

  /** Returns the given grid string with one location blanked out. */
  public static String without(String s, int row, int col) {
    int index = row * 9 + col;
    return s.substring(0, index) + '0' + s.substring(index + 1);
  }
}
