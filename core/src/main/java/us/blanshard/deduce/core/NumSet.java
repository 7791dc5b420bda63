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

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of the digits 1 through 9, the candidates for one cell of a
 * Sudoku grid.  There is exactly one instance per possible set, so sets may be
 * compared with {@code ==}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class NumSet extends AbstractSet<Integer> implements Set<Integer> {

  /** The bit pattern for the set of all nine digits. */
  public static final int ALL_BITS = (1 << 9) - 1;

  /** The digits in this set expressed as a bit set: digit d is bit d-1. */
  public final short bits;

  private final byte[] digits;

  private NumSet(short bits) {
    this.bits = bits;
    this.digits = new byte[Integer.bitCount(bits)];
    int count = 0;
    for (int digit = 1; digit <= 9; ++digit) {
      if ((bits & bit(digit)) != 0)
        digits[count++] = (byte) digit;
    }
  }

  /** Returns the bit corresponding to the given digit. */
  public static int bit(int digit) {
    checkArgument(digit >= 1 && digit <= 9, "Not a Sudoku digit: %s", digit);
    return 1 << (digit - 1);
  }

  /** Returns the set corresponding to the given bit set. */
  public static NumSet ofBits(int bits) {
    checkArgument((bits & ~ALL_BITS) == 0, "Bits out of range: %s", bits);
    return instances[bits];
  }

  /** Returns the set containing the given digits. */
  public static NumSet of(int... digits) {
    int bits = 0;
    for (int digit : digits)
      bits |= bit(digit);
    return instances[bits];
  }

  /** The set of all nine digits. */
  public static NumSet all() {
    return instances[ALL_BITS];
  }

  /** The empty set. */
  public static NumSet none() {
    return instances[0];
  }

  /** Returns the complement of this set. */
  public NumSet not() {
    return instances[ALL_BITS & ~bits];
  }

  /** Returns the intersection of this set and another one. */
  public NumSet and(NumSet that) {
    return instances[this.bits & that.bits];
  }

  /** Returns the union of this set and another one. */
  public NumSet or(NumSet that) {
    return instances[this.bits | that.bits];
  }

  /** Returns the asymmetric difference of this set and another one. */
  public NumSet minus(NumSet that) {
    return instances[this.bits & ~that.bits];
  }

  public boolean contains(int digit) {
    return digit >= 1 && digit <= 9 && (bits & bit(digit)) != 0;
  }

  @Override public boolean contains(Object o) {
    return o instanceof Integer && contains(((Integer) o).intValue());
  }

  public boolean isSubsetOf(NumSet that) {
    return (this.bits & ~that.bits) == 0;
  }

  public boolean isSupersetOf(NumSet that) {
    return that.isSubsetOf(this);
  }

  public boolean intersects(NumSet that) {
    return (this.bits & that.bits) != 0;
  }

  /** Returns the digit at the given index within this set, smallest first. */
  public int get(int index) {
    return digits[index];
  }

  /** Tells whether this set has exactly one digit. */
  public boolean isSingleton() {
    return digits.length == 1;
  }

  @Override public int size() {
    return digits.length;
  }

  @Override public Iterator<Integer> iterator() {
    return new Iter();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof NumSet) return bits == ((NumSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract: the sum of the elements' hash codes.
    int answer = 0;
    for (byte digit : digits) answer += digit;
    return answer;
  }

  /** Returns the digits run together, like "139", or "-" for the empty set. */
  public String toDigitString() {
    if (digits.length == 0) return "-";
    StringBuilder sb = new StringBuilder(digits.length);
    for (byte digit : digits) sb.append((char) ('0' + digit));
    return sb.toString();
  }

  private class Iter implements Iterator<Integer> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < digits.length;
    }

    @Override public Integer next() {
      if (!hasNext()) throw new NoSuchElementException();
      return (int) digits[nextIndex++];
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private static final NumSet[] instances;
  static {
    instances = new NumSet[1 << 9];
    for (short i = 0; i < instances.length; ++i) {
      instances[i] = new NumSet(i);
    }
  }
}
