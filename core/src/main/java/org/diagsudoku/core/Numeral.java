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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * One of the digits 1 through 9 that fill a Sudoku cell.  Instances are
 * interned, so identity comparison is fine.
 */
@Immutable
public final class Numeral implements Comparable<Numeral> {

  /** The number of Numerals. */
  public static final int COUNT = 9;

  /** The number, in the range 1..9. */
  public final int number;

  /** The index, one less than the number. */
  public final int index;

  /** The bit corresponding to the number, 1 &lt;&lt; index. */
  public final short bit;

  /** The character used for this numeral in grid strings. */
  public final char digit;

  public static Numeral of(int number) {
    return instances[number - 1];
  }

  public static Numeral ofIndex(int index) {
    return instances[index];
  }

  /** Returns the numeral for the character '1' through '9', or null for anything else. */
  @Nullable public static Numeral fromDigit(char c) {
    return c >= '1' && c <= '9' ? instances[c - '1'] : null;
  }

  /** All the numerals, in increasing order. */
  public static List<Numeral> all() {
    return ALL;
  }

  public Candidates asSet() {
    return Candidates.ofBits(bit);
  }

  @Override public int compareTo(Numeral that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.valueOf(digit);
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return number;  // Relied upon by Candidates
  }

  private Numeral(int index) {
    this.index = index;
    this.number = index + 1;
    this.bit = (short) (1 << index);
    this.digit = (char) ('1' + index);
  }

  private static final Numeral[] instances;
  private static final List<Numeral> ALL;
  static {
    instances = new Numeral[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Numeral(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
