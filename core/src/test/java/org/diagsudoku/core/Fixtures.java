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

import static org.junit.Assert.assertTrue;

/**
 * Puzzles shared by the tests, with their solutions where they have exactly
 * one.
 */
public class Fixtures {

  public static final String DIAGONAL_PUZZLE =
      "2.............62....1....7...6..8...3...9...7...6..4...4....8....52.............3";
  public static final String DIAGONAL_SOLUTION =
      "267945381853716249491823576576438192384192657129657438642379815935281764718564923";

  /** Needs a few guesses. */
  public static final String STANDARD_PUZZLE =
      ".6.5.4.3.1...9...8.........9...5...6.4.6.2.7.7...4...5.........4...8...1.5.2.3.4.";
  public static final String STANDARD_SOLUTION =
      "869574132124396758375128694932857416541632879786941325217469583493785261658213947";

  /** Solved by propagation alone. */
  public static final String EASY_PUZZLE =
      ".9..74....2....6.375...........9..545.3.4.......58.....45....8....1.2.3.......92.";
  public static final String EASY_SOLUTION =
      "396874512428915673751326849812697354563241798974583261245739186689152437137468925";

  /** Two 1s in row A. */
  public static final String DUPLICATE_IN_ROW = "11" + dots(79);

  /** Two 1s on the main diagonal only: fine for standard Sudoku, not for diagonal. */
  public static final String DUPLICATE_ON_DIAGONAL = "1" + dots(79) + "1";

  /** Givens that contradict each other in a column and a box. */
  public static final String BROKEN_PUZZLE =
      "...8.9..6.23.........6.8...7....1..2...45...9......6......7......1.46.....3......";

  public static final String EMPTY = dots(81);

  public static String dots(int count) {
    StringBuilder sb = new StringBuilder();
    while (count-- > 0)
      sb.append(Board.UNKNOWN);
    return sb.toString();
  }

  /** Checks every unit of the topology holds each numeral exactly once. */
  public static void assertValidSolution(Topology topology, Board board) {
    assertTrue("not solved:\n" + board, board.isSolved());
    for (Unit unit : topology.units()) {
      int bits = 0;
      for (Cell cell : unit)
        bits |= board.get(cell).bits;
      assertTrue(unit + " is missing numerals:\n" + board, bits == Candidates.ALL.bits);
    }
  }

  /** Checks the board keeps every given of the grid string. */
  public static void assertKeepsGivens(String grid, Board board) {
    for (Cell cell : Cell.all()) {
      Numeral given = Numeral.fromDigit(grid.charAt(cell.index));
      if (given != null)
        assertTrue(cell + " lost its given " + given, board.get(cell).equals(given.asSet()));
    }
  }
}
