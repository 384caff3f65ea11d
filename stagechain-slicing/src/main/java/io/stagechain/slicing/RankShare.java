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


import java.util.List;

/**
 * Immutable description of the contiguous part of a global batch list assigned to one rank.
 * The share is the sub-list {@code [startInclusive, endExclusive)} of the global ordering,
 * which is identical on every rank.
 *
 * @param <T> the batch type
 */
public class RankShare<T> {
  /// The rank this share belongs to
  private final int rank;
  /// The number of ranks the list was partitioned across
  private final int totalRanks;
  /// The first global batch index of this share (inclusive)
  private final int startInclusive;
  /// The end global batch index of this share (exclusive)
  private final int endExclusive;
  /// The length of the global list
  private final int fullBatchCount;
  private final List<T> batches;

  public RankShare(int rank, int totalRanks, int startInclusive, int endExclusive, int fullBatchCount, List<T> batches) {
    if (startInclusive < 0 || endExclusive < startInclusive || endExclusive > fullBatchCount) {
      throw new IllegalArgumentException(
          "Invalid share [" + startInclusive + ", " + endExclusive + ") of " + fullBatchCount + " batches");
    }
    if (batches.size() != endExclusive - startInclusive) {
      throw new IllegalArgumentException(
          "Share holds " + batches.size() + " batches but spans " + (endExclusive - startInclusive));
    }
    this.rank = rank;
    this.totalRanks = totalRanks;
    this.startInclusive = startInclusive;
    this.endExclusive = endExclusive;
    this.fullBatchCount = fullBatchCount;
    this.batches = List.copyOf(batches);
  }

  public int rank() {
    return rank;
  }

  public int totalRanks() {
    return totalRanks;
  }

  public int startInclusive() {
    return startInclusive;
  }

  public int endExclusive() {
    return endExclusive;
  }

  /// @return the number of batches in the global list, across all ranks
  public int fullBatchCount() {
    return fullBatchCount;
  }

  /// @return the batches assigned to this rank, in global order
  public List<T> batches() {
    return batches;
  }

  public int size() {
    return batches.size();
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }

  /**
   * Checks if this share contains the specified global batch index.
   *
   * @param globalIndex an index into the global batch list
   * @return true if the index falls within this share
   */
  public boolean contains(int globalIndex) {
    return globalIndex >= startInclusive && globalIndex < endExclusive;
  }

  @Override
  public String toString() {
    return "RankShare{rank=" + rank + "/" + totalRanks + ", [" + startInclusive + ", " + endExclusive + ") of " + fullBatchCount + "}";
  }
}
