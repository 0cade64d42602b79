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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * One entry of an assignment history: the cell whose candidates were set, the
 * candidates it was given, and the whole board just after.
 */
@Immutable
public final class Step {

  public final Cell cell;
  public final Candidates candidates;
  public final Board board;

  public Step(Cell cell, Candidates candidates, Board board) {
    this.cell = checkNotNull(cell);
    this.candidates = checkNotNull(candidates);
    this.board = checkNotNull(board);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Step)) return false;
    Step that = (Step) o;
    return this.cell == that.cell
        && this.candidates.equals(that.candidates)
        && this.board.equals(that.board);
  }

  @Override public int hashCode() {
    return Objects.hashCode(cell, candidates, board);
  }

  @Override public String toString() {
    return cell + " \u2190 " + candidates.toDigits();  // That's a left arrow
  }
}
