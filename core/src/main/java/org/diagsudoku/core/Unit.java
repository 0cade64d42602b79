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

import com.google.common.collect.ImmutableList;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, box, or diagonal of a Sudoku grid: a set of 9 cells that must
 * all contain different numerals in a valid Sudoku.  Which units take part in
 * a puzzle is decided by its {@link Topology}.
 */
@Immutable
public final class Unit extends AbstractCollection<Cell> implements Collection<Cell> {

  public enum Kind {
    ROW, COLUMN, BOX, DIAGONAL
  }

  private final Kind kind;
  private final int number;
  private final byte[] cells;

  private Unit(Kind kind, int number, byte[] cells) {
    this.kind = kind;
    this.number = number;
    this.cells = cells;
  }

  /** The nine rows, top to bottom. */
  public static List<Unit> rows() {
    return AllUnits.INSTANCE.rows;
  }

  /** The nine columns, left to right. */
  public static List<Unit> columns() {
    return AllUnits.INSTANCE.columns;
  }

  /** The nine 3x3 boxes, left to right, top to bottom. */
  public static List<Unit> boxes() {
    return AllUnits.INSTANCE.boxes;
  }

  /** The main diagonal (A1 to I9) followed by the anti-diagonal (A9 to I1). */
  public static List<Unit> diagonals() {
    return AllUnits.INSTANCE.diagonals;
  }

  public Kind getKind() {
    return kind;
  }

  /** The unit's number within its kind, starting from 1. */
  public int getNumber() {
    return number;
  }

  /** Returns the cell at the given index within this unit. */
  public Cell get(int index) {
    return Cell.of(cells[index]);
  }

  /** Returns the index of the given cell within this unit, or -1. */
  public int indexOf(Cell cell) {
    for (int i = 0; i < cells.length; ++i)
      if (cells[i] == cell.index)
        return i;
    return -1;
  }

  public boolean contains(Cell cell) {
    return indexOf(cell) >= 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Cell) {
      return contains((Cell) o);
    }
    return false;
  }

  @Override public int size() {
    return 9;
  }

  @Override public Iterator<Cell> iterator() {
    return new Iter();
  }

  @Override public String toString() {
    switch (kind) {
      case ROW: return "row " + Cell.ROW_NAMES.charAt(number - 1);
      case COLUMN: return "column " + number;
      case BOX: return "box " + number;
      default: return number == 1 ? "main diagonal" : "anti-diagonal";
    }
  }

  private class Iter implements Iterator<Cell> {
    private int next;

    @Override public boolean hasNext() {
      return next < cells.length;
    }

    @Override public Cell next() {
      if (!hasNext()) throw new NoSuchElementException();
      return Cell.of(cells[next++]);
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private static enum AllUnits {
    INSTANCE;
    private final List<Unit> rows;
    private final List<Unit> columns;
    private final List<Unit> boxes;
    private final List<Unit> diagonals;

    private AllUnits() {
      ImmutableList.Builder<Unit> rows = ImmutableList.builder();
      ImmutableList.Builder<Unit> columns = ImmutableList.builder();
      ImmutableList.Builder<Unit> boxes = ImmutableList.builder();
      for (int i = 0; i < 9; ++i) {
        byte[] row = new byte[9];
        byte[] column = new byte[9];
        byte[] box = new byte[9];
        int ul = i / 3 * 27 + i % 3 * 3;
        for (int j = 0; j < 9; ++j) {
          row[j] = (byte) (i * 9 + j);
          column[j] = (byte) (j * 9 + i);
          box[j] = (byte) (ul + j / 3 * 9 + j % 3);
        }
        rows.add(new Unit(Kind.ROW, i + 1, row));
        columns.add(new Unit(Kind.COLUMN, i + 1, column));
        boxes.add(new Unit(Kind.BOX, i + 1, box));
      }
      byte[] main = new byte[9];
      byte[] anti = new byte[9];
      for (int i = 0; i < 9; ++i) {
        main[i] = (byte) (i * 9 + i);
        anti[i] = (byte) (i * 9 + 8 - i);
      }
      this.rows = rows.build();
      this.columns = columns.build();
      this.boxes = boxes.build();
      this.diagonals = ImmutableList.of(
          new Unit(Kind.DIAGONAL, 1, main), new Unit(Kind.DIAGONAL, 2, anti));
    }
  }
}
