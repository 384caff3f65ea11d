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

/// Partitions an ordered batch list into contiguous, near-equal shares, one per rank.
///
/// For `L` batches and `R` ranks the first `L % R` ranks receive `L / R + 1` batches and
/// the remainder `L / R`. Shares depend only on `(L, R)`, so every rank computes the same
/// partitioning without communication, and shares never overlap.
public class WorkDistributor {

  /// Computes this rank's share of a batch list.
  /// @param batches the global batch list, identical on all ranks
  /// @param rank this rank, in `[0, totalRanks)`
  /// @param totalRanks the number of ranks, at least one
  /// @param <T> the batch type
  /// @return the share for `rank`
  /// @throws InvalidRankException if the rank or rank count is out of range
  public <T> RankShare<T> distribute(List<T> batches, int rank, int totalRanks) {
    int[] bounds = partitionBounds(batches.size(), rank, totalRanks);
    return new RankShare<>(rank, totalRanks, bounds[0], bounds[1], batches.size(),
        batches.subList(bounds[0], bounds[1]));
  }

  /// Computes the `[start, end)` bounds of one rank's partition of `length` items.
  /// @param length the number of items to partition
  /// @param rank the rank whose bounds are wanted
  /// @param totalRanks the number of ranks
  /// @return a two-element array of start (inclusive) and end (exclusive)
  public static int[] partitionBounds(int length, int rank, int totalRanks) {
    if (totalRanks < 1 || rank < 0 || rank >= totalRanks) {
      throw new InvalidRankException(rank, totalRanks);
    }
    int base = length / totalRanks;
    int extra = length % totalRanks;
    int start = rank * base + Math.min(rank, extra);
    int size = base + (rank < extra ? 1 : 0);
    return new int[]{start, start + size};
  }
}
