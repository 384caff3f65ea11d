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

/// Coalesces consecutive frames into batched range reads.
///
/// The grouper scans an enumerated frame sequence greedily, keeping one open batch:
/// - a one-frame batch is extended when the step to the candidate varies along exactly one
///   axis, which then becomes the batch's step;
/// - an established batch is extended only when the step to the candidate is identical;
/// - anything else closes the batch and opens a new one at the candidate.
///
/// A step along several axes is always a boundary. The grouper does not try to pick an axis
/// among several changing ones.
///
/// Closed batches are converted into a single `(start, stop, step)` range along the step
/// axis and split into {@link WorkBatch}es of at most `maxBatch` frames.
public class RunGrouper {
  private static final Logger logger = LogManager.getLogger(RunGrouper.class);

  /// Groups a frame sequence into batches.
  /// @param sliceTuples frames as produced by a {@link SliceEnumerator}, strictly increasing
  /// @param maxBatch the maximum number of frames per batch, at least one
  /// @return the batches, in frame order
  /// @throws UngroupableSequenceException if the sequence is out of order or inconsistent
  public List<WorkBatch> group(List<SliceTuple> sliceTuples, int maxBatch) {
    if (maxBatch < 1) {
      throw new IllegalArgumentException("Maximum batch size must be at least 1: " + maxBatch);
    }
    List<WorkBatch> grouped = new ArrayList<>();
    List<SliceTuple> batch = new ArrayList<>();
    int[] step = null;

    for (int position = 0; position < sliceTuples.size(); position++) {
      SliceTuple candidate = sliceTuples.get(position);
      if (batch.isEmpty()) {
        checkStructure(position, null, candidate);
        batch.add(candidate);
        continue;
      }
      SliceTuple last = batch.get(batch.size() - 1);
      int[] newStep = calcStep(position, last, candidate);

      if (step == null && varyingAxes(newStep) == 1) {
        batch.add(candidate);
        step = newStep;
      } else if (step != null && Arrays.equals(step, newStep)) {
        batch.add(candidate);
      } else {
        close(batch, step, maxBatch, grouped);
        batch = new ArrayList<>();
        batch.add(candidate);
        step = null;
      }
    }
    if (!batch.isEmpty()) {
      close(batch, step, maxBatch, grouped);
    }

    logger.debug("grouped {} frames into {} batches of at most {} frames", sliceTuples.size(), grouped.size(), maxBatch);
    return grouped;
  }

  /// Per-axis difference between two consecutive frames. Full dimensions contribute zero.
  private int[] calcStep(int position, SliceTuple previous, SliceTuple candidate) {
    checkStructure(position, previous, candidate);
    int[] result = new int[candidate.rank()];
    int firstDifference = 0;
    for (int dim = 0; dim < candidate.rank(); dim++) {
      SliceIndex a = previous.get(dim);
      SliceIndex b = candidate.get(dim);
      if (a.isFull()) {
        continue;
      }
      result[dim] = b.start() - a.start();
      if (firstDifference == 0) {
        firstDifference = result[dim];
      }
    }
    if (firstDifference <= 0) {
      throw new UngroupableSequenceException(position, previous, candidate,
          firstDifference == 0 ? "duplicate frame" : "frames are out of order");
    }
    return result;
  }

  private void checkStructure(int position, SliceTuple previous, SliceTuple candidate) {
    for (int dim = 0; dim < candidate.rank(); dim++) {
      if (candidate.get(dim).isRange()) {
        throw new UngroupableSequenceException(position, previous, candidate,
            "dimension " + dim + " is already a range");
      }
    }
    if (previous == null) {
      return;
    }
    if (previous.rank() != candidate.rank()) {
      throw new UngroupableSequenceException(position, previous, candidate, "rank differs");
    }
    for (int dim = 0; dim < candidate.rank(); dim++) {
      if (previous.get(dim).isFull() != candidate.get(dim).isFull()) {
        throw new UngroupableSequenceException(position, previous, candidate,
            "full dimensions differ at dimension " + dim);
      }
    }
  }

  private static int varyingAxes(int[] step) {
    int count = 0;
    for (int s : step) {
      if (s != 0) {
        count++;
      }
    }
    return count;
  }

  private static int stepAxis(int[] step) {
    for (int dim = 0; dim < step.length; dim++) {
      if (step[dim] != 0) {
        return dim;
      }
    }
    return -1;
  }

  private void close(List<SliceTuple> batch, int[] step, int maxBatch, List<WorkBatch> grouped) {
    SliceTuple first = batch.get(0);
    int axis;
    int stride;
    if (step == null) {
      axis = first.lastPointDimension();
      stride = 1;
      if (axis < 0) {
        grouped.add(new WorkBatch(first, -1));
        return;
      }
    } else {
      axis = stepAxis(step);
      stride = step[axis];
    }

    int start = first.get(axis).start();
    int frames = batch.size();
    for (int offset = 0; offset < frames; offset += maxBatch) {
      int count = Math.min(maxBatch, frames - offset);
      int subStart = start + offset * stride;
      SliceIndex range = SliceIndex.range(subStart, subStart + count * stride, stride);
      grouped.add(new WorkBatch(first.with(axis, range), axis));
    }
  }
}
