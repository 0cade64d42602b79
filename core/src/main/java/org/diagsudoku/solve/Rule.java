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
package org.diagsudoku.solve;

import com.google.common.collect.Lists;

import org.diagsudoku.core.Board;
import org.diagsudoku.core.Candidates;
import org.diagsudoku.core.Cell;
import org.diagsudoku.core.Numeral;
import org.diagsudoku.core.Topology;
import org.diagsudoku.core.Unit;

import java.util.List;

/**
 * The propagation rules.  Each one makes a single pass over a board builder,
 * narrowing candidates, and returns false as soon as it empties some cell.
 * A rule never undoes a narrowing, so rules can be applied in any order and
 * any number of times.
 */
public enum Rule {

  /** Removes each solved cell's numeral from all of its peers. */
  ELIMINATE {
    @Override public boolean apply(Topology topology, Board.Builder builder) {
      List<Cell> solved = Lists.newArrayList();
      for (Cell cell : Cell.all()) {
        if (builder.get(cell).isSingleton())
          solved.add(cell);
      }
      for (Cell cell : solved) {
        Candidates candidates = builder.get(cell);
        if (!candidates.isSingleton())
          return false;  // Emptied by an earlier cell holding the same numeral
        Numeral num = candidates.get(0);
        for (Cell peer : topology.peersOf(cell)) {
          if (!builder.eliminate(peer, num))
            return false;
        }
      }
      return true;
    }
  },

  /**
   * Assigns a numeral to a cell when that cell is the only one left in some
   * unit that can hold it.
   */
  ONLY_CHOICE {
    @Override public boolean apply(Topology topology, Board.Builder builder) {
      for (Unit unit : topology.units()) {
        for (Numeral num : Numeral.all()) {
          Cell place = null;
          int count = 0;
          for (Cell cell : unit) {
            if (builder.get(cell).contains(num)) {
              place = cell;
              ++count;
            }
          }
          if (count == 1)
            builder.assign(place, num);
        }
      }
      return true;
    }
  },

  /**
   * When exactly two cells of a unit share the same pair of candidates, no
   * other cell in the unit can hold either of them.
   *
   * <p> A unit is only narrowed when it contains exactly one such pair.  Units
   * with two different pairs, or with three cells sharing a pair, are left
   * untouched.
   */
  NAKED_TWINS {
    @Override public boolean apply(Topology topology, Board.Builder builder) {
      for (Unit unit : topology.units()) {
        Cell first = null;
        Cell second = null;
        int pairs = 0;
        for (int i = 0; i < 9; ++i) {
          Candidates candidates = builder.get(unit.get(i));
          if (candidates.size() != 2) continue;
          for (int j = i + 1; j < 9; ++j) {
            if (builder.get(unit.get(j)).equals(candidates)) {
              first = unit.get(i);
              second = unit.get(j);
              ++pairs;
            }
          }
        }
        if (pairs != 1) continue;

        Candidates twins = builder.get(first);
        for (Cell cell : unit) {
          if (cell == first || cell == second) continue;
          for (Numeral num : twins) {
            if (!builder.eliminate(cell, num))
              return false;
          }
        }
      }
      return true;
    }
  };

  /**
   * Applies this rule once to the given builder.  Returns false if the board
   * turned out to be contradictory.
   */
  public abstract boolean apply(Topology topology, Board.Builder builder);
}
