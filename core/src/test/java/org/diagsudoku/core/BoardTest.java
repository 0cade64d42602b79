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

import static org.diagsudoku.core.CandidatesTest.set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class BoardTest {

  private static class Recorder implements AssignmentRecorder {
    final List<Step> steps = Lists.newArrayList();
    @Override public void record(Step step) {
      steps.add(step);
    }
  }

  @Test public void open() {
    Board board = Board.OPEN;
    assertEquals(81, board.size());
    assertEquals(0, board.numSolved());
    assertFalse(board.isSolved());
    assertFalse(board.hasContradiction());
    for (Cell cell : Cell.all())
      assertSame(Candidates.ALL, board.get(cell));
    assertSame(Board.OPEN, Board.builder().build());
  }

  @Test public void fromString() {
    Board board = Board.fromString(Fixtures.DIAGONAL_PUZZLE);
    assertEquals(set(2), board.get(Cell.of("A1")));
    assertEquals(Candidates.ALL, board.get(Cell.of("A2")));
    assertEquals(set(6), board.get(Cell.of("B6")));
    assertEquals(set(3), board.get(Cell.of("I9")));
    assertEquals(17, board.numSolved());
    assertEquals(Fixtures.DIAGONAL_PUZZLE, board.toFlatString());
  }

  @Test public void fromString_recordsEveryCell() {
    Recorder recorder = new Recorder();
    Board board = Board.fromString(Fixtures.DIAGONAL_PUZZLE, recorder);
    assertEquals(81, recorder.steps.size());
    for (int i = 0; i < 81; ++i) {
      Step step = recorder.steps.get(i);
      assertSame(Cell.of(i), step.cell);
      char c = Fixtures.DIAGONAL_PUZZLE.charAt(i);
      assertEquals(c == '.' ? Candidates.ALL : Numeral.fromDigit(c).asSet(), step.candidates);
      assertEquals(step.candidates, step.board.get(step.cell));
    }
    assertEquals(board, recorder.steps.get(80).board);
  }

  @Test public void fromString_tooShort() {
    try {
      Board.fromString(Fixtures.dots(80));
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("81"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromString_tooLong() {
    Board.fromString(Fixtures.dots(82));
  }

  @Test public void fromString_badCharacter() {
    try {
      Board.fromString("x" + Fixtures.dots(80));
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("'x'"));
      assertTrue(e.getMessage(), e.getMessage().contains("A1"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromString_zeroIsNotUnknown() {
    Board.fromString("0" + Fixtures.dots(80));
  }

  @Test public void flatStringRoundTrip() {
    Board solution = Board.fromString(Fixtures.DIAGONAL_SOLUTION);
    assertTrue(solution.isSolved());
    Board reparsed = Board.fromString(solution.toFlatString());
    assertEquals(solution, reparsed);
    assertEquals(solution.hashCode(), reparsed.hashCode());
  }

  @Test public void flatString_undeterminedCellsAreDots() {
    Board board = Board.builder()
        .assign(Cell.of("A1"), Numeral.of(4))
        .set(Cell.of("A2"), set(1, 2))
        .build();
    assertEquals("4" + Fixtures.dots(80), board.toFlatString());
  }

  @Test public void builderCopiesOnWrite() {
    Board start = Board.fromString(Fixtures.DIAGONAL_PUZZLE);
    Board.Builder builder = start.toBuilder();
    assertSame(start, builder.build());

    builder.assign(Cell.of("A2"), Numeral.of(6));
    Board first = builder.build();
    builder.assign(Cell.of("A3"), Numeral.of(7));
    Board second = builder.build();

    assertEquals(Candidates.ALL, start.get(Cell.of("A2")));
    assertEquals(set(6), first.get(Cell.of("A2")));
    assertEquals(Candidates.ALL, first.get(Cell.of("A3")));
    assertEquals(set(7), second.get(Cell.of("A3")));
  }

  @Test public void siblingBuildersAreIndependent() {
    Board start = Board.fromString(Fixtures.DIAGONAL_PUZZLE);
    Board left = start.toBuilder().assign(Cell.of("A2"), Numeral.of(6)).build();
    Board right = start.toBuilder().assign(Cell.of("A2"), Numeral.of(7)).build();
    assertEquals(set(6), left.get(Cell.of("A2")));
    assertEquals(set(7), right.get(Cell.of("A2")));
    assertEquals(Candidates.ALL, start.get(Cell.of("A2")));
  }

  @Test public void builderRecordsNewlySolvedCells() {
    Recorder recorder = new Recorder();
    Board.Builder builder = Board.builder(recorder);
    builder.set(Cell.of("B3"), set(4, 5));
    assertEquals(0, recorder.steps.size());

    assertTrue(builder.eliminate(Cell.of("B3"), Numeral.of(5)));
    assertEquals(1, recorder.steps.size());
    Step step = recorder.steps.get(0);
    assertSame(Cell.of("B3"), step.cell);
    assertEquals(set(4), step.candidates);
    assertEquals(set(4), step.board.get(Cell.of("B3")));

    // No change, no step.
    builder.assign(Cell.of("B3"), Numeral.of(4));
    assertTrue(builder.eliminate(Cell.of("B3"), Numeral.of(9)));
    assertEquals(1, recorder.steps.size());

    // Later changes leave the recorded snapshot alone.
    builder.assign(Cell.of("C3"), Numeral.of(1));
    assertEquals(2, recorder.steps.size());
    assertEquals(Candidates.ALL, step.board.get(Cell.of("C3")));
  }

  @Test public void eliminateDetectsEmptyCell() {
    Board.Builder builder = Board.builder().assign(Cell.of("E5"), Numeral.of(3));
    assertFalse(builder.eliminate(Cell.of("E5"), Numeral.of(3)));
    assertTrue(builder.hasContradiction());
    assertTrue(builder.build().hasContradiction());
    assertEquals(Candidates.NONE, builder.get(Cell.of("E5")));
  }

  @Test public void isMap() {
    Board board = Board.fromString(Fixtures.DIAGONAL_PUZZLE);
    assertEquals(81, board.entrySet().size());
    assertTrue(board.containsKey(Cell.of("H4")));
    assertFalse(board.containsKey("H4"));
    assertNull(board.get("H4"));

    Map<Cell, Candidates> copy = new HashMap<Cell, Candidates>(board);
    assertEquals(copy, board);
    assertEquals(board, copy);
    assertEquals(copy.hashCode(), board.hashCode());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void isImmutable() {
    Board.OPEN.put(Cell.of("A1"), Candidates.ALL);
  }

  @Test public void display_solved() {
    String expected = Joiner.on('\n').join(
        " 2 6 7 | 9 4 5 | 3 8 1",
        " 8 5 3 | 7 1 6 | 2 4 9",
        " 4 9 1 | 8 2 3 | 5 7 6",
        "-------+-------+-------",
        " 5 7 6 | 4 3 8 | 1 9 2",
        " 3 8 4 | 1 9 2 | 6 5 7",
        " 1 2 9 | 6 5 7 | 4 3 8",
        "-------+-------+-------",
        " 6 4 2 | 3 7 9 | 8 1 5",
        " 9 3 5 | 2 8 1 | 7 6 4",
        " 7 1 8 | 5 6 4 | 9 2 3",
        "");
    assertEquals(expected, Board.fromString(Fixtures.DIAGONAL_SOLUTION).toString());
  }

  @Test public void display_widthFollowsLargestCell() {
    Board board = Board.fromString(Fixtures.DIAGONAL_SOLUTION).toBuilder()
        .set(Cell.of("A1"), set(2, 6, 7))
        .set(Cell.of("A2"), set(6, 7))
        .set(Cell.of("A3"), Candidates.NONE)
        .build();
    String[] lines = board.toString().split("\n");
    assertEquals(" 267 67   ?  |  9   4   5  |  3   8   1 ", lines[0]);
    assertEquals("-------------+-------------+-------------", lines[3]);
  }
}
