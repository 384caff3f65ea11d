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


import java.util.Objects;

/// One entry of a {@link SliceTuple}: the whole extent of a dimension, a single index, or a
/// `(start, stop, step)` range with an exclusive stop.
public final class SliceIndex {

  /// The kind of selection along one dimension
  public enum Kind {
    /// The full extent of the dimension
    FULL,
    /// A single index
    POINT,
    /// An arithmetic range of indices
    RANGE
  }

  private static final SliceIndex FULL = new SliceIndex(Kind.FULL, 0, 0, 1);

  private final Kind kind;
  private final int start;
  private final int stop;
  private final int step;

  private SliceIndex(Kind kind, int start, int stop, int step) {
    this.kind = kind;
    this.start = start;
    this.stop = stop;
    this.step = step;
  }

  /// @return the full-extent marker used for core dimensions
  public static SliceIndex full() {
    return FULL;
  }

  /// @param index a non-negative index
  /// @return a single-index selection
  public static SliceIndex point(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Index cannot be negative: " + index);
    }
    return new SliceIndex(Kind.POINT, index, index + 1, 1);
  }

  /// @param start first index, inclusive
  /// @param stop end index, exclusive
  /// @param step positive stride between selected indices
  /// @return a range selection of at least one index
  public static SliceIndex range(int start, int stop, int step) {
    if (start < 0) {
      throw new IllegalArgumentException("Range start cannot be negative: " + start);
    }
    if (step <= 0) {
      throw new IllegalArgumentException("Range step must be positive: " + step);
    }
    if (stop <= start) {
      throw new IllegalArgumentException(
          "Range stop (" + stop + ") must be greater than start (" + start + ")");
    }
    return new SliceIndex(Kind.RANGE, start, stop, step);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isFull() {
    return kind == Kind.FULL;
  }

  public boolean isPoint() {
    return kind == Kind.POINT;
  }

  public boolean isRange() {
    return kind == Kind.RANGE;
  }

  public int start() {
    return start;
  }

  public int stop() {
    return stop;
  }

  public int step() {
    return step;
  }

  /// @param extent the extent of the dimension this entry applies to
  /// @return the number of indices selected
  public int length(int extent) {
    switch (kind) {
      case FULL:
        return extent;
      case POINT:
        return 1;
      default:
        return (stop - start + step - 1) / step;
    }
  }

  /// @param ordinal position within the selection
  /// @return the dimension index selected at that position
  public int indexAt(int ordinal) {
    return start + ordinal * step;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SliceIndex that = (SliceIndex) o;
    return kind == that.kind && start == that.start && stop == that.stop && step == that.step;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, start, stop, step);
  }

  @Override
  public String toString() {
    switch (kind) {
      case FULL:
        return ":";
      case POINT:
        return String.valueOf(start);
      default:
        return start + ":" + stop + ":" + step;
    }
  }
}
