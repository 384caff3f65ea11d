package io.stagechain.pipeline.data;


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



import io.stagechain.slicing.SliceIndex;
import io.stagechain.slicing.SliceTuple;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A per-dimension sub-selection of a dataset.
///
/// Each dimension is either left whole or restricted to a `start:stop:step` range. Slicing
/// a previewed dataset enumerates the previewed extents; every index is then mapped back
/// to storage coordinates with {@link #toStorage(SliceTuple)}.
///
/// Previews can be parsed from strings such as `":"`, `"10:20"` or `"0:100:2"`.
public final class Preview {
  private final SliceIndex[] selection;

  private Preview(SliceIndex[] selection) {
    this.selection = selection;
  }

  /// @param selection one entry per dimension, each full or a range; a single index is
  ///     taken as a range of one
  /// @return a preview
  public static Preview of(SliceIndex... selection) {
    SliceIndex[] entries = new SliceIndex[selection.length];
    for (int dim = 0; dim < selection.length; dim++) {
      SliceIndex entry = selection[dim];
      entries[dim] = entry.isPoint() ? SliceIndex.range(entry.start(), entry.start() + 1, 1) : entry;
    }
    return new Preview(entries);
  }

  /// Parses one `start:stop:step` entry per dimension. Missing parts default to the start
  /// of the dimension and a step of one; a missing stop means the whole dimension.
  /// @param entries the per-dimension strings
  /// @param shape the storage shape, used to resolve open stops
  /// @return a preview
  public static Preview parse(List<String> entries, int[] shape) {
    if (entries.size() != shape.length) {
      throw new IllegalArgumentException(
          "Preview " + entries + " does not match a shape of rank " + shape.length);
    }
    List<SliceIndex> parsed = new ArrayList<>();
    for (int dim = 0; dim < shape.length; dim++) {
      String entry = entries.get(dim).trim();
      String[] parts = entry.split(":", -1);
      if (entry.equals(":") || entry.isEmpty()) {
        parsed.add(SliceIndex.full());
        continue;
      }
      try {
        int start = parts[0].isBlank() ? 0 : Integer.parseInt(parts[0].trim());
        int stop = parts.length < 2 ? start + 1 : (parts[1].isBlank() ? shape[dim] : Integer.parseInt(parts[1].trim()));
        int step = parts.length < 3 || parts[2].isBlank() ? 1 : Integer.parseInt(parts[2].trim());
        parsed.add(SliceIndex.range(start, stop, step));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid preview entry '" + entry + "' for dimension " + dim, e);
      }
    }
    return of(parsed.toArray(new SliceIndex[0]));
  }

  public int rank() {
    return selection.length;
  }

  public SliceIndex get(int dimension) {
    return selection[dimension];
  }

  /// Computes the extents seen through this preview.
  /// @param shape the storage shape
  /// @return the previewed shape
  /// @throws IllegalArgumentException if a range reaches outside the storage shape
  public int[] shape(int[] shape) {
    if (shape.length != selection.length) {
      throw new IllegalArgumentException(
          "Preview " + this + " does not match shape " + Arrays.toString(shape));
    }
    int[] previewed = new int[shape.length];
    for (int dim = 0; dim < shape.length; dim++) {
      SliceIndex entry = selection[dim];
      if (entry.isRange() && entry.stop() > shape[dim]) {
        throw new IllegalArgumentException("Preview " + this + " reaches outside dimension " + dim
            + " of shape " + Arrays.toString(shape));
      }
      previewed[dim] = entry.length(shape[dim]);
    }
    return previewed;
  }

  /// Maps a tuple in previewed coordinates to storage coordinates.
  /// @param previewed a tuple over the previewed shape
  /// @return the same selection in storage coordinates
  public SliceTuple toStorage(SliceTuple previewed) {
    if (previewed.rank() != selection.length) {
      throw new IllegalArgumentException("Tuple " + previewed + " does not match preview " + this);
    }
    SliceIndex[] mapped = new SliceIndex[selection.length];
    for (int dim = 0; dim < selection.length; dim++) {
      mapped[dim] = map(selection[dim], previewed.get(dim));
    }
    return new SliceTuple(mapped);
  }

  private static SliceIndex map(SliceIndex window, SliceIndex entry) {
    if (window.isFull()) {
      return entry;
    }
    switch (entry.kind()) {
      case FULL:
        return window;
      case POINT:
        return SliceIndex.point(window.indexAt(entry.start()));
      default:
        int start = window.indexAt(entry.start());
        int step = entry.step() * window.step();
        int count = entry.length(0);
        return SliceIndex.range(start, start + (count - 1) * step + 1, step);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(selection, ((Preview) o).selection);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(selection);
  }

  @Override
  public String toString() {
    return new SliceTuple(selection).toString();
  }
}
