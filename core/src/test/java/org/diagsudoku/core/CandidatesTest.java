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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

public class CandidatesTest {

  public static Candidates set(int... nums) {
    short bits = 0;
    for (int n : nums)
      bits |= 1 << (n - 1);
    return Candidates.ofBits(bits);
  }

  @Test public void of() {
    assertEquals(set(), Candidates.of());
    assertEquals(set(4), Candidates.of(Numeral.of(4)));
    assertEquals(set(1, 8), Candidates.of(Numeral.of(1), Numeral.of(8)));
    assertSame(Candidates.NONE, set());
    assertSame(Candidates.ALL, set(1, 2, 3, 4, 5, 6, 7, 8, 9));
  }

  @Test public void withAndMinus() {
    assertEquals(set(2, 5), set(2).with(Numeral.of(5)));
    assertEquals(set(2), set(2).with(Numeral.of(2)));
    assertEquals(set(2), set(2, 5).minus(Numeral.of(5)));
    assertEquals(set(2, 5), set(2, 5).minus(Numeral.of(7)));
    assertEquals(set(2, 3), set(1, 2, 3, 8).minus(set(1, 8)));
  }

  @Test public void andOr() {
    assertEquals(set(4, 5), set(3, 4, 5).and(set(4, 5, 6)));
    assertEquals(set(), set(3, 4, 5).and(set(6, 7, 8)));
    assertEquals(set(1, 2, 3), set(1, 2).or(set(1, 3)));
  }

  @Test public void contains() {
    Candidates set = set(1, 3, 7, 8);
    assertEquals(true, set.contains(Numeral.of(3)));
    assertEquals(false, set.contains(Numeral.of(2)));
    assertEquals(false, set.contains("3"));
  }

  @Test public void iteratesInIncreasingOrder() {
    Candidates set = set(9, 2, 8);
    Iterator<Numeral> it = set.iterator();
    assertTrue(it.hasNext());
    assertSame(Numeral.of(2), it.next());
    assertSame(Numeral.of(8), it.next());
    assertSame(Numeral.of(9), it.next());
    assertFalse(it.hasNext());
    assertSame(Numeral.of(8), set.get(1));
  }

  @Test public void sizes() {
    assertEquals(0, set().size());
    assertEquals(1, set(5).size());
    assertEquals(9, Candidates.ALL.size());
    assertTrue(set(5).isSingleton());
    assertFalse(set(5, 6).isSingleton());
    assertFalse(set().isSingleton());
  }

  @Test public void equalsOtherSets() {
    Set<Numeral> hashSet = new HashSet<Numeral>();
    hashSet.addAll(Arrays.asList(Numeral.of(2), Numeral.of(4), Numeral.of(6)));
    Candidates set = set(2, 4, 6);
    assertEquals(set, hashSet);
    assertEquals(hashSet, set);
    assertEquals(set.hashCode(), hashSet.hashCode());
    assertEquals(false, set(1, 2, 3).equals(set(1, 2)));
  }

  @Test public void digits() {
    assertEquals("3489", set(3, 4, 8, 9).toDigits());
    assertEquals("3489", set(3, 4, 8, 9).toString());
    assertEquals("", set().toDigits());
    assertEquals(set(3, 4, 8, 9), Candidates.fromDigits("9834"));
    assertSame(Candidates.NONE, Candidates.fromDigits(""));
    assertSame(Candidates.ALL, Candidates.fromDigits("123456789"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromDigits_rejectsZero() {
    Candidates.fromDigits("102");
  }
}
