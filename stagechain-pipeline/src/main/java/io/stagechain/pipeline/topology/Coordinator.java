package io.stagechain.pipeline.topology;


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



/// The view one rank has of the fixed pool of ranks running a pipeline.
///
/// Ranks run the same program in lock-step and block only at these points:
/// - {@link #awaitLayoutFixed()} once the loaders have fixed the initial datasets;
/// - {@link #commitPipelineMetadata(MetadataWriter)}, which barriers, lets the coordinating
///   rank write the pipeline metadata, and barriers again, so no rank reads the metadata
///   before it is complete;
/// - {@link #awaitStageComplete(String)} at the end of each stage iteration, so writes by
///   every rank are visible before any rank reads them.
///
/// Every rank must reach every point the same number of times, in the same order.
public interface Coordinator {

  /// @return this rank, in `[0, totalRanks())`
  int rank();

  int totalRanks();

  /// @return true for the rank that performs one-time actions, the last rank
  default boolean isCoordinatingRank() {
    return rank() == totalRanks() - 1;
  }

  void awaitLayoutFixed();

  void commitPipelineMetadata(MetadataWriter writer);

  void awaitStageComplete(String stageName);
}
