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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.logging.Level.FINER;

import org.diagsudoku.core.AssignmentRecorder;
import org.diagsudoku.core.Board;
import org.diagsudoku.core.Candidates;
import org.diagsudoku.core.Cell;
import org.diagsudoku.core.Numeral;
import org.diagsudoku.core.Topology;

import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first Sudoku solver.  At every node of the search it propagates
 * constraints to a fixed point, then branches on the undetermined cell with
 * the fewest candidates, trying them in increasing order on independent
 * copies of the board.  The first solution found is the answer.
 *
 * <p> The mutually recursive propagate-then-branch structure follows Peter
 * Norvig (http://norvig.com/sudoku.html).
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given starting board, returns a summary of the result.
   */
  public static Result solve(Topology topology, Board start) {
    return solve(topology, start, AssignmentRecorder.NONE);
  }

  /**
   * Solves the given starting board, reporting every cell that becomes solved
   * to the given recorder, and returns a summary of the result.
   */
  public static Result solve(Topology topology, Board start, AssignmentRecorder recorder) {
    return new Solver(topology, recorder).result(start);
  }

  /**
   * Parses the given grid string and solves it.  The recorder sees the 81
   * initial assignments of the grid followed by everything the solver does.
   *
   * @throws IllegalArgumentException if the grid string is malformed
   */
  public static Result solve(Topology topology, String grid, AssignmentRecorder recorder) {
    return solve(topology, Board.fromString(grid, recorder), recorder);
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Board start;
    @Nullable public final Board solution;  // Null when there is no solution
    public final int numNodes;  // Boards propagated, the start included
    public final int numDeadEnds;  // Boards that propagation showed to be contradictory

    Result(Board start, @Nullable Board solution, int numNodes, int numDeadEnds) {
      this.start = start;
      this.solution = solution;
      this.numNodes = numNodes;
      this.numDeadEnds = numDeadEnds;
    }

    public boolean isSolved() {
      return solution != null;
    }

    @Override public String toString() {
      return (isSolved() ? "solved" : "no solution")
          + " after " + numNodes + " nodes, " + numDeadEnds + " dead ends";
    }
  }

  private final Topology topology;
  private final AssignmentRecorder recorder;
  private final Propagator propagator;
  private int numNodes;
  private int numDeadEnds;

  public Solver(Topology topology, AssignmentRecorder recorder) {
    this(new Propagator(topology, recorder), recorder);
  }

  public Solver(Propagator propagator, AssignmentRecorder recorder) {
    this.propagator = checkNotNull(propagator);
    this.topology = propagator.getTopology();
    this.recorder = checkNotNull(recorder);
  }

  /** Searches for a solution to the given board. */
  public Result result(Board start) {
    numNodes = 0;
    numDeadEnds = 0;
    Board solution = search(start);
    logger.fine("Searched " + topology + " board " + start.toFlatString() + ": "
        + (solution == null ? "no solution" : solution.toFlatString())
        + " after " + numNodes + " nodes, " + numDeadEnds + " dead ends");
    return new Result(start, solution, numNodes, numDeadEnds);
  }

  /**
   * Returns a solved board reachable from the given one, or null if there
   * isn't one.
   */
  @Nullable private Board search(Board board) {
    ++numNodes;
    Board reduced = propagator.reduce(board);
    if (reduced == null) {
      ++numDeadEnds;
      return null;
    }

    Cell cell = chooseCell(reduced);
    if (cell == null)
      return reduced;  // Every cell is solved.

    for (Numeral num : reduced.get(cell)) {
      if (logger.isLoggable(FINER))
        logger.finer("Trying " + num + " at " + cell);
      Board trial = reduced.toBuilder(recorder).assign(cell, num).build();
      Board found = search(trial);
      if (found != null)
        return found;
    }
    return null;
  }

  /**
   * Chooses the unsolved cell with the fewest candidates, the earliest one in
   * row-major order among equals.  Returns null if every cell is solved.
   */
  @Nullable static Cell chooseCell(Board board) {
    Cell best = null;
    int bestSize = Numeral.COUNT + 1;
    for (Cell cell : Cell.all()) {
      Candidates candidates = board.get(cell);
      int size = candidates.size();
      if (size > 1 && size < bestSize) {
        best = cell;
        bestSize = size;
        if (size == 2) break;  // Can't do better
      }
    }
    return best;
  }
}
