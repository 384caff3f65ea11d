package io.stagechain.pipeline;


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

/// What one rank did for one stage of a run.
public class StageReport {
  private final int index;
  private final String name;
  private final int iterations;
  private final int batchesProcessed;
  private final int batchCount;
  private final List<String> kept;
  private final List<String> removed;

  public StageReport(int index, String name, int iterations, int batchesProcessed, int batchCount,
                     List<String> kept, List<String> removed) {
    this.index = index;
    this.name = name;
    this.iterations = iterations;
    this.batchesProcessed = batchesProcessed;
    this.batchCount = batchCount;
    this.kept = List.copyOf(kept);
    this.removed = List.copyOf(removed);
  }

  public int index() {
    return index;
  }

  public String name() {
    return name;
  }

  public int iterations() {
    return iterations;
  }

  /// @return the batches this rank executed, summed over iterations
  public int batchesProcessed() {
    return batchesProcessed;
  }

  /// @return the length of the global batch list of the last iteration
  public int batchCount() {
    return batchCount;
  }

  /// @return the outputs that continued into the next stage
  public List<String> kept() {
    return kept;
  }

  public List<String> removed() {
    return removed;
  }

  @Override
  public String toString() {
    return index + "-" + name + "{iterations=" + iterations + ", batches=" + batchesProcessed + "/" + batchCount
        + ", kept=" + kept + ", removed=" + removed + "}";
  }
}
