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


import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/// An index tuple addressing one block of an N-dimensional dataset, with one
/// {@link SliceIndex} per dimension in the dataset's shape order.
public final class SliceTuple {
  private final SliceIndex[] entries;

  public SliceTuple(SliceIndex... entries) {
    if (entries.length == 0) {
      throw new IllegalArgumentException("A slice tuple needs at least one dimension");
    }
    for (SliceIndex entry : entries) {
      if (entry == null) {
        throw new IllegalArgumentException("Slice tuple entries cannot be null: " + Arrays.toString(entries));
      }
    }
    this.entries = entries.clone();
  }

  public static SliceTuple of(List<SliceIndex> entries) {
    return new SliceTuple(entries.toArray(new SliceIndex[0]));
  }

  /// @param rank the number of dimensions
  /// @return a tuple selecting the whole of every dimension
  public static SliceTuple fullOf(int rank) {
    SliceIndex[] all = new SliceIndex[rank];
    Arrays.fill(all, SliceIndex.full());
    return new SliceTuple(all);
  }

  public int rank() {
    return entries.length;
  }

  public SliceIndex get(int dimension) {
    return entries[dimension];
  }

  public List<SliceIndex> entries() {
    return List.of(entries);
  }

  /// @return a copy of this tuple with one dimension replaced
  public SliceTuple with(int dimension, SliceIndex index) {
    SliceIndex[] copy = entries.clone();
    copy[dimension] = index;
    return new SliceTuple(copy);
  }

  /// @return the index of the last dimension holding a single index, or -1 if there is none
  public int lastPointDimension() {
    for (int dim = entries.length - 1; dim >= 0; dim--) {
      if (entries[dim].isPoint()) {
        return dim;
      }
    }
    return -1;
  }

  /// Computes the shape of the block this tuple selects from a dataset of the given shape.
  /// Single indices keep their dimension with extent one.
  /// @param shape the dataset shape
  /// @return the block shape
  public int[] blockShape(int[] shape) {
    if (shape.length != entries.length) {
      throw new IllegalArgumentException(
          "Tuple " + this + " does not match a shape of rank " + shape.length);
    }
    int[] block = new int[shape.length];
    for (int dim = 0; dim < shape.length; dim++) {
      block[dim] = entries[dim].length(shape[dim]);
    }
    return block;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(entries, ((SliceTuple) o).entries);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(entries);
  }

  @Override
  public String toString() {
    return Arrays.stream(entries).map(SliceIndex::toString).collect(Collectors.joining(", ", "(", ")"));
  }
}
