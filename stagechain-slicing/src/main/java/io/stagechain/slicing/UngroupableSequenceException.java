package io.stagechain.slicing;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Exception thrown when a slice sequence handed to the {@link RunGrouper} is malformed,
/// for example out of order, duplicated, or mixing tuples of different structure.
/// Batching such a sequence would silently produce overlapping writes.
public class UngroupableSequenceException extends RuntimeException {

  private final int position;
  private final SliceTuple previous;
  private final SliceTuple candidate;

  public UngroupableSequenceException(int position, SliceTuple previous, SliceTuple candidate, String reason) {
    super(String.format("Cannot group slice %d %s after %s: %s", position, candidate, previous, reason));
    this.position = position;
    this.previous = previous;
    this.candidate = candidate;
  }

  /// @return the position of the offending tuple in the input sequence
  public int getPosition() {
    return position;
  }

  public SliceTuple getPrevious() {
    return previous;
  }

  public SliceTuple getCandidate() {
    return candidate;
  }
}
