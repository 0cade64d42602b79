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
package org.diagsudoku.history;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import org.diagsudoku.core.AssignmentRecorder;
import org.diagsudoku.core.Step;

import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * An append-only history of {@linkplain Step steps}: every moment some cell
 * became solved while parsing or solving a puzzle, in the order they happened.
 * Meant for replaying a solve step by step.
 */
@NotThreadSafe
public class AssignmentLog implements AssignmentRecorder {

  private final List<Step> steps;

  public AssignmentLog() {
    this(Lists.<Step>newArrayList());
  }

  AssignmentLog(List<Step> steps) {
    this.steps = checkNotNull(steps);
  }

  @Override public void record(Step step) {
    steps.add(checkNotNull(step));
  }

  /** Returns a read-only view of the steps recorded so far. */
  public List<Step> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  public int size() {
    return steps.size();
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  /** Returns the most recent step. */
  public Step getLast() {
    checkState(!steps.isEmpty(), "Nothing recorded");
    return Iterables.getLast(steps);
  }
}
