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
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A cell of a Sudoku grid, named by its row letter and column digit: "A1" is
 * the top left cell, "I9" the bottom right.  Cells are interned and carry no
 * state of their own; they are keys into a {@link Board}.
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  /** The number of distinct cells. */
  public static final int COUNT = 81;

  /** The letters naming the rows, top to bottom. */
  public static final String ROW_NAMES = "ABCDEFGHI";

  /** The digits naming the columns, left to right. */
  public static final String COLUMN_NAMES = "123456789";

  /** A number in the range [0, COUNT), in row-major order. */
  public final int index;

  /** The row index, in the range [0, 9). */
  public final int rowIndex;

  /** The column index, in the range [0, 9). */
  public final int columnIndex;

  /** The index of the 3x3 box holding this cell, left to right, top to bottom. */
  public final int boxIndex;

  /** The row letter followed by the column digit, as in "C7". */
  public final String name;

  public static Cell of(int index) {
    checkElementIndex(index, COUNT);
    return instances[index];
  }

  public static Cell ofIndices(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, 9);
    checkElementIndex(columnIndex, 9);
    return instances[rowIndex * 9 + columnIndex];
  }

  /** Returns the cell with the given name, such as "E5". */
  public static Cell of(String name) {
    checkArgument(name.length() == 2, "Bad cell name: %s", name);
    int rowIndex = ROW_NAMES.indexOf(name.charAt(0));
    int columnIndex = COLUMN_NAMES.indexOf(name.charAt(1));
    checkArgument(rowIndex >= 0 && columnIndex >= 0, "Bad cell name: %s", name);
    return instances[rowIndex * 9 + columnIndex];
  }

  /** All cells, in row-major order. */
  public static List<Cell> all() {
    return ALL;
  }

  /** Tells whether this cell lies on the diagonal from A1 to I9. */
  public boolean onMainDiagonal() {
    return rowIndex == columnIndex;
  }

  /** Tells whether this cell lies on the diagonal from A9 to I1. */
  public boolean onAntiDiagonal() {
    return rowIndex + columnIndex == 8;
  }

  @Override public int compareTo(Cell that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return name;
  }

  private Cell(int index) {
    this.index = index;
    this.rowIndex = index / 9;
    this.columnIndex = index % 9;
    this.boxIndex = rowIndex / 3 * 3 + columnIndex / 3;
    this.name = "" + ROW_NAMES.charAt(rowIndex) + COLUMN_NAMES.charAt(columnIndex);
  }

  private static final Cell[] instances;
  private static final List<Cell> ALL;
  static {
    instances = new Cell[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Cell(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
