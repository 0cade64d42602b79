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
package org.diagsudoku.core;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of Numerals: the digits still possible for one cell.
 * Iteration is always in increasing numeric order.  A set of size 1 means the
 * cell is solved, an empty set means the board holding it is contradictory.
 */
@Immutable
public final class Candidates extends AbstractSet<Numeral> implements Set<Numeral> {

  /** The numerals in this set expressed as a bit set. */
  public final short bits;

  private final byte[] nums;

  private Candidates(short bits) {
    this.bits = bits;

    this.nums = new byte[Integer.bitCount(bits)];
    byte num = 1;
    int count = 0;
    for (int bit = 1; bit <= bits; bit = bit << 1, ++num) {
      if ((bits & bit) != 0) {
        nums[count++] = num;
      }
    }
  }

  /** Returns the set corresponding to the given bit set. */
  public static Candidates ofBits(int bits) {
    return instances[bits];
  }

  /** Returns the set containing the given numerals. */
  public static Candidates of(Numeral... nums) {
    int bits = 0;
    for (Numeral n : nums)
      bits |= n.bit;
    return instances[bits];
  }

  /**
   * Parses a string of digits such as "2357" as produced by {@link #toDigits}.
   * The empty string gives the empty set.
   */
  public static Candidates fromDigits(String digits) {
    int bits = 0;
    for (int i = 0; i < digits.length(); ++i) {
      Numeral num = Numeral.fromDigit(digits.charAt(i));
      checkArgument(num != null, "Not a digit: '%s' in \"%s\"", digits.charAt(i), digits);
      bits |= num.bit;
    }
    return instances[bits];
  }

  /** Returns this set with the given numeral added. */
  public Candidates with(Numeral num) {
    return instances[this.bits | num.bit];
  }

  /** Returns this set with the given numeral removed. */
  public Candidates minus(Numeral num) {
    return instances[this.bits & ~num.bit];
  }

  /** Returns the asymmetric difference of this set and another one. */
  public Candidates minus(Candidates that) {
    return instances[this.bits & ~that.bits];
  }

  /** Returns the intersection of this set and another one. */
  public Candidates and(Candidates that) {
    return instances[this.bits & that.bits];
  }

  /** Returns the union of this set and another one. */
  public Candidates or(Candidates that) {
    return instances[this.bits | that.bits];
  }

  public boolean contains(Numeral num) {
    return (bits & num.bit) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Numeral) {
      return contains((Numeral) o);
    }
    return false;
  }

  /** Tells whether this set has exactly one numeral in it. */
  public boolean isSingleton() {
    return nums.length == 1;
  }

  /** Returns the numeral at the given index within this set. */
  public Numeral get(int index) {
    return Numeral.of(nums[index]);
  }

  @Override public Iterator<Numeral> iterator() {
    return new Iter();
  }

  @Override public int size() {
    return nums.length;
  }

  /** Renders the set as its digits run together, for example "147". */
  public String toDigits() {
    StringBuilder sb = new StringBuilder(nums.length);
    for (byte num : nums)
      sb.append((char) ('0' + num));
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof Candidates) return bits == ((Candidates) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    int answer = 0;
    for (byte num : nums) answer += num;
    return answer;
  }

  @Override public String toString() {
    return toDigits();
  }

  private class Iter implements Iterator<Numeral> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < nums.length;
    }

    @Override public Numeral next() {
      if (!hasNext()) throw new NoSuchElementException();
      return Numeral.of(nums[nextIndex++]);
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private static final Candidates[] instances;
  static {
    instances = new Candidates[1 << Numeral.COUNT];
    for (short i = 0; i < instances.length; ++i) {
      instances[i] = new Candidates(i);
    }
  }

  /** The empty set. */
  public static final Candidates NONE = instances[0];

  /** All nine numerals. */
  public static final Candidates ALL = instances[(1 << Numeral.COUNT) - 1];
}
