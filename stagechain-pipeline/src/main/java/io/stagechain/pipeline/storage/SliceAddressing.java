package io.stagechain.pipeline.storage;


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

import java.util.Arrays;

/// Flat offset arithmetic for row-major arrays addressed by {@link SliceTuple}s.
public final class SliceAddressing {

  private SliceAddressing() {
  }

  /// @param shape an array shape
  /// @return the number of elements, the product of all extents
  public static long elementCount(int[] shape) {
    long count = 1;
    for (int extent : shape) {
      if (extent < 0) {
        throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
      }
      count *= extent;
    }
    return count;
  }

  /// Lists the flat offsets, within an array of the given shape, of every element a slice
  /// selects. Offsets are listed in the row-major order of the selected block, so the
  /// `i`-th offset holds the `i`-th value of the block.
  /// @param shape the array shape
  /// @param slice the selection, one entry per dimension
  /// @return the flat offsets
  public static int[] flatOffsets(int[] shape, SliceTuple slice) {
    if (slice.rank() != shape.length) {
      throw new IllegalArgumentException(
          "Slice " + slice + " does not match shape " + Arrays.toString(shape));
    }
    int[] block = slice.blockShape(shape);
    int[] offsets = new int[Math.toIntExact(elementCount(block))];
    if (offsets.length == 0) {
      return offsets;
    }
    int[] strides = new int[shape.length];
    int stride = 1;
    for (int dim = shape.length - 1; dim >= 0; dim--) {
      strides[dim] = stride;
      stride *= shape[dim];
    }

    int[] counter = new int[shape.length];
    for (int n = 0; n < offsets.length; n++) {
      int offset = 0;
      for (int dim = 0; dim < shape.length; dim++) {
        int index = indexAt(slice.get(dim), counter[dim]);
        if (index >= shape[dim]) {
          throw new IndexOutOfBoundsException(
              "Slice " + slice + " reaches outside shape " + Arrays.toString(shape));
        }
        offset += index * strides[dim];
      }
      offsets[n] = offset;
      for (int dim = shape.length - 1; dim >= 0; dim--) {
        if (++counter[dim] < block[dim]) {
          break;
        }
        counter[dim] = 0;
      }
    }
    return offsets;
  }

  private static int indexAt(SliceIndex entry, int ordinal) {
    return entry.isFull() ? ordinal : entry.indexAt(ordinal);
  }
}
