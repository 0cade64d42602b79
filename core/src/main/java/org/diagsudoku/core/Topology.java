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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * The static shape of a puzzle: which units it has, which units each cell
 * belongs to, and each cell's peers (the other cells sharing a unit with it).
 * There are two topologies, standard and diagonal, each built once on first
 * use and shared by every solve.
 *
 * <p> The diagonal topology adds the two long diagonals to the 27 rows,
 * columns and boxes of the standard one.
 */
@Immutable
public final class Topology {

  /** Possible states for a board, judged against a topology's units. */
  public enum State {
    INCOMPLETE,  // Not all solved, but no two solved cells in a unit agree.
    BROKEN,      // Some unit holds the same solved numeral twice.
    SOLVED;      // Every cell solved, no rule violations.
  }

  /** The 27 units of ordinary Sudoku. */
  public static Topology standard() {
    return Variant.STANDARD.topology;
  }

  /** The 29 units of diagonal Sudoku. */
  public static Topology diagonal() {
    return Variant.DIAGONAL.topology;
  }

  public static Topology of(boolean diagonal) {
    return diagonal ? diagonal() : standard();
  }

  private final boolean isDiagonal;
  private final ImmutableList<Unit> units;
  private final ImmutableList<ImmutableList<Unit>> unitsByCell;
  private final ImmutableList<ImmutableSet<Cell>> peersByCell;

  private Topology(boolean isDiagonal) {
    this.isDiagonal = isDiagonal;

    ImmutableList.Builder<Unit> units = ImmutableList.builder();
    units.addAll(Unit.rows()).addAll(Unit.columns()).addAll(Unit.boxes());
    if (isDiagonal)
      units.addAll(Unit.diagonals());
    this.units = units.build();

    ImmutableList.Builder<ImmutableList<Unit>> unitsByCell = ImmutableList.builder();
    ImmutableList.Builder<ImmutableSet<Cell>> peersByCell = ImmutableList.builder();
    for (Cell cell : Cell.all()) {
      ImmutableList.Builder<Unit> cellUnits = ImmutableList.builder();
      SortedSet<Cell> peers = Sets.newTreeSet();
      for (Unit unit : this.units) {
        if (unit.contains(cell)) {
          cellUnits.add(unit);
          peers.addAll(unit);
        }
      }
      peers.remove(cell);
      unitsByCell.add(cellUnits.build());
      peersByCell.add(ImmutableSet.copyOf(peers));
    }
    this.unitsByCell = unitsByCell.build();
    this.peersByCell = peersByCell.build();
  }

  public boolean isDiagonal() {
    return isDiagonal;
  }

  /** All units: rows, then columns, then boxes, then any diagonals. */
  public List<Unit> units() {
    return units;
  }

  /** The units containing the given cell, in the order of {@link #units}. */
  public List<Unit> unitsOf(Cell cell) {
    return unitsByCell.get(cell.index);
  }

  /** The cells sharing at least one unit with the given cell, in row-major order. */
  public Set<Cell> peersOf(Cell cell) {
    return peersByCell.get(cell.index);
  }

  public State getState(Board board) {
    if (!getBrokenCells(board).isEmpty())
      return State.BROKEN;
    return board.isSolved() ? State.SOLVED : State.INCOMPLETE;
  }

  /**
   * Tells whether the board is completely and correctly solved: every unit
   * holds each numeral exactly once.
   */
  public boolean isSolution(Board board) {
    return getState(board) == State.SOLVED;
  }

  /**
   * Returns the solved cells whose numeral is shared by another solved cell
   * in one of the units.
   */
  public SortedSet<Cell> getBrokenCells(Board board) {
    SortedSet<Cell> answer = Sets.newTreeSet();
    for (Unit unit : units) {
      int bits = 0;
      for (Cell cell : unit) {
        Candidates candidates = board.get(cell);
        if (!candidates.isSingleton()) continue;
        if ((bits & candidates.bits) != 0) {
          answer.add(cell);
          for (Cell first : unit)
            if (first != cell && board.get(first).equals(candidates)) {
              answer.add(first);
              break;
            }
        }
        bits |= candidates.bits;
      }
    }
    return answer;
  }

  @Override public String toString() {
    return isDiagonal ? "diagonal" : "standard";
  }

  private static enum Variant {
    STANDARD(false), DIAGONAL(true);

    private final Topology topology;

    private Variant(boolean isDiagonal) {
      this.topology = new Topology(isDiagonal);
    }
  }
}
