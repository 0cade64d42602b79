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

/**
 * Receives a {@link Step} each time a cell of a board being built becomes
 * solved.  Recorders are passed explicitly to whatever builds boards, so
 * independent solves never share one by accident.
 */
public interface AssignmentRecorder {

  /** A recorder that drops everything. */
  AssignmentRecorder NONE = new AssignmentRecorder() {
    @Override public void record(Step step) {}
  };

  void record(Step step);
}
