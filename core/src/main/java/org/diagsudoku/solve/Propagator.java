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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import org.diagsudoku.core.AssignmentRecorder;
import org.diagsudoku.core.Board;
import org.diagsudoku.core.Topology;

import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Runs propagation rules over a board until they stop solving cells.  This
 * only prunes candidates; a board it can't finish is left for the search.
 */
@Immutable
public final class Propagator {

  /** The standard rules, in the order they are applied. */
  public static final List<Rule> DEFAULT_RULES =
      ImmutableList.of(Rule.ELIMINATE, Rule.ONLY_CHOICE, Rule.NAKED_TWINS);

  private final Topology topology;
  private final AssignmentRecorder recorder;
  private final ImmutableList<Rule> rules;

  public Propagator(Topology topology) {
    this(topology, AssignmentRecorder.NONE);
  }

  public Propagator(Topology topology, AssignmentRecorder recorder) {
    this(topology, recorder, DEFAULT_RULES);
  }

  public Propagator(Topology topology, AssignmentRecorder recorder, List<Rule> rules) {
    checkArgument(!rules.isEmpty(), "No rules given");
    this.topology = checkNotNull(topology);
    this.recorder = checkNotNull(recorder);
    this.rules = ImmutableList.copyOf(rules);
  }

  public Topology getTopology() {
    return topology;
  }

  public List<Rule> getRules() {
    return rules;
  }

  /**
   * Applies the rules in order, over and over, until a full round solves no
   * new cells.  Returns the resulting board, or null if some cell ran out of
   * candidates along the way.  The given board is not changed.
   */
  @Nullable public Board reduce(Board board) {
    Board.Builder builder = board.toBuilder(recorder);
    while (true) {
      int solvedBefore = builder.numSolved();
      for (Rule rule : rules) {
        if (!rule.apply(topology, builder))
          return null;
      }
      if (builder.hasContradiction())
        return null;
      if (builder.numSolved() == solvedBefore)
        return builder.build();
    }
  }
}
