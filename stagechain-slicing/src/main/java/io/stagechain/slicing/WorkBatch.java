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


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A grouped run of frames that advance along a single step axis.
///
/// The batch is addressed by one {@link SliceTuple} in which the step axis holds a
/// {@link SliceIndex#range(int, int, int) range} and every other dimension is fixed or full.
/// A batch built from a tuple with no single-index dimension has no step axis and covers
/// exactly one frame.
public final class WorkBatch {
  private final SliceTuple slice;
  private final int stepAxis;

  public WorkBatch(SliceTuple slice, int stepAxis) {
    this.slice = Objects.requireNonNull(slice);
    if (stepAxis >= 0 && !slice.get(stepAxis).isRange()) {
      throw new IllegalArgumentException("Step axis " + stepAxis + " of " + slice + " is not a range");
    }
    this.stepAxis = stepAxis;
  }

  /// @return the tuple addressing the whole batch
  public SliceTuple slice() {
    return slice;
  }

  /// @return the varying axis, or -1 for a batch without one
  public int stepAxis() {
    return stepAxis;
  }

  /// @return the stride along the step axis, 0 for a batch without one
  public int step() {
    return stepAxis < 0 ? 0 : slice.get(stepAxis).step();
  }

  /// @return the number of frames covered
  public int frameCount() {
    return stepAxis < 0 ? 1 : slice.get(stepAxis).length(0);
  }

  /// Flattens this batch back into the individual frames it was grouped from.
  /// @return one tuple per frame, in order
  public List<SliceTuple> frames() {
    if (stepAxis < 0) {
      return List.of(slice);
    }
    SliceIndex range = slice.get(stepAxis);
    List<SliceTuple> frames = new ArrayList<>(frameCount());
    for (int i = 0; i < frameCount(); i++) {
      frames.add(slice.with(stepAxis, SliceIndex.point(range.indexAt(i))));
    }
    return frames;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    WorkBatch that = (WorkBatch) o;
    return stepAxis == that.stepAxis && slice.equals(that.slice);
  }

  @Override
  public int hashCode() {
    return Objects.hash(slice, stepAxis);
  }

  @Override
  public String toString() {
    return "WorkBatch" + slice + (stepAxis < 0 ? "" : "@" + stepAxis);
  }
}
