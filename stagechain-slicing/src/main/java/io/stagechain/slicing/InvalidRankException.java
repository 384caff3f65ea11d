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

/// Exception thrown when work is distributed for a rank that does not exist in the
/// configured topology. This always indicates a topology misconfiguration.
public class InvalidRankException extends RuntimeException {

  private final int rank;
  private final int totalRanks;

  public InvalidRankException(int rank, int totalRanks) {
    super(String.format("Cannot distribute work to rank %d of %d ranks.", rank, totalRanks));
    this.rank = rank;
    this.totalRanks = totalRanks;
  }

  public int getRank() {
    return rank;
  }

  public int getTotalRanks() {
    return totalRanks;
  }
}
