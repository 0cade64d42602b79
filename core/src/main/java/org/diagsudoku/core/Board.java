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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The candidates of all 81 cells of a Sudoku puzzle in progress.  The class is
 * an immutable Map from Cell to {@link Candidates} that always holds every
 * cell; the nested Builder is its mutable, copy-on-write counterpart.
 *
 * <p> Building a board never disturbs the board the builder started from, so
 * the search can branch from one board any number of times, and snapshots
 * handed to an {@link AssignmentRecorder} stay as they were.
 */
@Immutable
public final class Board extends AbstractMap<Cell, Candidates> implements Map<Cell, Candidates> {

  /** The character used for unknown cells in grid strings. */
  public static final char UNKNOWN = '.';

  /** The board with every numeral still possible in every cell. */
  public static final Board OPEN;

  private final short[] bits;

  private Board(short[] bits) {
    this.bits = bits;
  }

  /** Returns a builder starting from {@link #OPEN}. */
  public static Builder builder() {
    return builder(AssignmentRecorder.NONE);
  }

  /** Returns a builder starting from {@link #OPEN} that reports to the given recorder. */
  public static Builder builder(AssignmentRecorder recorder) {
    return new Builder(OPEN, recorder);
  }

  /** Returns a mutable version of this board. */
  public Builder toBuilder() {
    return toBuilder(AssignmentRecorder.NONE);
  }

  /** Returns a mutable version of this board that reports to the given recorder. */
  public Builder toBuilder(AssignmentRecorder recorder) {
    return new Builder(this, recorder);
  }

  /**
   * Parses a grid string: 81 characters, row by row, each either a digit 1-9
   * for a given cell or a period for an unknown one.
   *
   * @throws IllegalArgumentException if the string is the wrong length or
   *     holds any other character
   */
  public static Board fromString(String grid) {
    return fromString(grid, AssignmentRecorder.NONE);
  }

  /**
   * Parses a grid string as {@link #fromString(String)} does, reporting each
   * of the 81 initial cell assignments to the given recorder in row-major
   * order, unknown cells included.
   */
  public static Board fromString(String grid, AssignmentRecorder recorder) {
    checkNotNull(grid);
    checkArgument(grid.length() == Cell.COUNT,
        "A grid needs %s characters, got %s in \"%s\"", Cell.COUNT, grid.length(), grid);
    Builder builder = builder();
    for (Cell cell : Cell.all()) {
      char c = grid.charAt(cell.index);
      Numeral given = Numeral.fromDigit(c);
      checkArgument(given != null || c == UNKNOWN,
          "Unexpected character '%s' for cell %s in \"%s\"", c, cell, grid);
      Candidates candidates = given == null ? Candidates.ALL : given.asSet();
      builder.set(cell, candidates);
      recorder.record(new Step(cell, candidates, builder.build()));
    }
    return builder.build();
  }

  @NotThreadSafe
  public static final class Builder {
    private final AssignmentRecorder recorder;
    private Board board;
    private boolean built;

    private Builder(Board board, AssignmentRecorder recorder) {
      this.recorder = checkNotNull(recorder);
      this.board = board;
      this.built = true;
    }

    private Board board() {
      if (built) {
        Board board = new Board(this.board.bits.clone());
        this.board = board;
        this.built = false;
      }
      return this.board;
    }

    /** Returns an immutable snapshot of this board. */
    public Board build() {
      built = true;
      return board;
    }

    public Candidates get(Cell cell) {
      return board.get(cell);
    }

    /**
     * Sets the candidates of the given cell.  If that solves the cell, the new
     * state of the board is reported to this builder's recorder.
     */
    public Builder set(Cell cell, Candidates candidates) {
      if (board.bits[cell.index] == candidates.bits)
        return this;
      board().bits[cell.index] = candidates.bits;
      if (candidates.isSingleton())
        recorder.record(new Step(cell, candidates, build()));
      return this;
    }

    /** Narrows the given cell's candidates to just the given numeral. */
    public Builder assign(Cell cell, Numeral num) {
      return set(cell, num.asSet());
    }

    /**
     * Removes the given numeral from the given cell's candidates.  Returns
     * false if the cell is left with no candidates.
     */
    public boolean eliminate(Cell cell, Numeral num) {
      Candidates candidates = get(cell);
      if (candidates.contains(num)) {
        candidates = candidates.minus(num);
        set(cell, candidates);
      }
      return !candidates.isEmpty();
    }

    public int numSolved() {
      return board.numSolved();
    }

    public boolean hasContradiction() {
      return board.hasContradiction();
    }
  }

  @Override public Candidates get(Object key) {
    if (key instanceof Cell) {
      return get((Cell) key);
    }
    return null;
  }

  public Candidates get(Cell cell) {
    return Candidates.ofBits(bits[cell.index]);
  }

  /** Returns the number of cells with exactly one candidate. */
  public int numSolved() {
    int answer = 0;
    for (short b : bits) {
      if (Integer.bitCount(b) == 1) ++answer;
    }
    return answer;
  }

  /** Tells whether every cell has exactly one candidate. */
  public boolean isSolved() {
    return numSolved() == Cell.COUNT;
  }

  /** Tells whether some cell has no candidates left. */
  public boolean hasContradiction() {
    for (short b : bits) {
      if (b == 0) return true;
    }
    return false;
  }

  @Override public boolean containsKey(Object key) {
    return key instanceof Cell;
  }

  @Override public int size() {
    return Cell.COUNT;
  }

  @Override public Set<Entry<Cell, Candidates>> entrySet() {
    return Maps.asMap(CELLS, new Function<Cell, Candidates>() {
      @Override public Candidates apply(Cell cell) {
        return get(cell);
      }
    }).entrySet();
  }

  @Override public Candidates put(Cell key, Candidates value) {
    throw new UnsupportedOperationException();
  }

  @Override public Candidates remove(Object key) {
    throw new UnsupportedOperationException();
  }

  @Override public void clear() {
    throw new UnsupportedOperationException();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (object instanceof Board) return Arrays.equals(this.bits, ((Board) object).bits);
    return super.equals(object);
  }

  @Override public int hashCode() {
    // Must match Map's contract.
    int answer = 0;
    for (Cell cell : Cell.all())
      answer += cell.hashCode() ^ get(cell).hashCode();
    return answer;
  }

  /**
   * Generates a string of 81 characters with digits for solved cells and
   * periods for all others.  For a solved board this parses back to an equal
   * board.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder(Cell.COUNT);
    for (Cell cell : Cell.all()) {
      Candidates candidates = get(cell);
      sb.append(candidates.isSingleton() ? candidates.get(0).digit : UNKNOWN);
    }
    return sb.toString();
  }

  /**
   * Lays the board out as a 9x9 grid, each cell showing all its candidates
   * centered in a column as wide as the largest candidate set on the board.
   * An empty cell shows a question mark.
   */
  @Override public String toString() {
    int width = 1;
    for (Cell cell : Cell.all()) {
      width = Math.max(width, get(cell).size());
    }
    StringBuilder sb = new StringBuilder();
    for (int row = 0; row < 9; ++row) {
      for (int col = 0; col < 9; ++col) {
        append(get(Cell.ofIndices(row, col)), width, sb.append(' '));
        if (col == 2 || col == 5)
          sb.append(" |");
      }
      sb.append('\n');
      if (row == 2 || row == 5) {
        append('-', 3 * width + 4, sb).append('+');
        append('-', 3 * width + 4, sb).append('+');
        append('-', 3 * width + 4, sb).append('\n');
      }
    }
    return sb.toString();
  }

  private static StringBuilder append(Candidates candidates, int width, StringBuilder sb) {
    int size = Math.max(1, candidates.size());
    append(' ', (width - size) / 2, sb);
    sb.append(candidates.isEmpty() ? "?" : candidates.toDigits());
    return append(' ', width - size - (width - size) / 2, sb);
  }

  private static StringBuilder append(char c, int count, StringBuilder sb) {
    while (count-- > 0)
      sb.append(c);
    return sb;
  }

  private static final Set<Cell> CELLS = ImmutableSet.copyOf(Cell.all());
  static {
    short[] all = new short[Cell.COUNT];
    Arrays.fill(all, Candidates.ALL.bits);
    OPEN = new Board(all);
  }
}
