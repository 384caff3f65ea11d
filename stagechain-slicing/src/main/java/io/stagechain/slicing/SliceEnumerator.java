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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Enumerates the index space of a dataset under a pattern.
///
/// Every combination of indices across the slice dimensions yields one {@link SliceTuple}
/// with core dimensions left {@link SliceIndex#full() full}. Combinations are produced in
/// row-major order: the highest-numbered slice dimension varies fastest, consistent with
/// the dataset's shape order, independent of the order slice dimensions were declared in.
///
/// The enumerator is stateless; repeated calls with the same arguments produce identical
/// sequences.
public class SliceEnumerator {
  private static final Logger logger = LogManager.getLogger(SliceEnumerator.class);

  /// Enumerates all frames of a shape under a pattern.
  /// @param shape the dataset extents, all positive
  /// @param pattern the pattern to slice by
  /// @return the ordered frames, one per combination of slice indices
  /// @throws InvalidPatternException if the pattern is not usable for the shape's rank
  public List<SliceTuple> enumerate(int[] shape, PatternDescriptor pattern) {
    for (int extent : shape) {
      if (extent <= 0) {
        throw new IllegalArgumentException("Shape extents must be positive: " + Arrays.toString(shape));
      }
    }
    pattern.validate(shape.length);

    int[] sliceDims = pattern.sliceDimensions();
    Arrays.sort(sliceDims);

    long total = 1;
    for (int dim : sliceDims) {
      total *= shape[dim];
    }
    if (total > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          "Pattern " + pattern.name() + " on shape " + Arrays.toString(shape) + " yields too many frames: " + total);
    }

    List<SliceTuple> tuples = new ArrayList<>((int) total);
    int[] counters = new int[sliceDims.length];
    SliceIndex[] entries = new SliceIndex[shape.length];
    Arrays.fill(entries, SliceIndex.full());

    for (long n = 0; n < total; n++) {
      for (int i = 0; i < sliceDims.length; i++) {
        entries[sliceDims[i]] = SliceIndex.point(counters[i]);
      }
      tuples.add(new SliceTuple(entries));

      // odometer increment, last slice dimension fastest
      for (int i = sliceDims.length - 1; i >= 0; i--) {
        if (++counters[i] < shape[sliceDims[i]]) {
          break;
        }
        counters[i] = 0;
      }
    }

    logger.debug("enumerated {} frames for pattern {} on shape {}", tuples.size(), pattern.name(), Arrays.toString(shape));
    return tuples;
  }
}
