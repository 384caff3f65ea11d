package io.stagechain.pipeline.stage;


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



import io.stagechain.pipeline.storage.ArrayBlock;

import java.util.Map;
import java.util.Optional;

/// One processing step of a pipeline.
///
/// The driver runs every stage twice. In the setup pass it calls {@link #setup} and
/// {@link #bindings()} to learn the datasets and patterns; in the execution pass it calls
/// {@link #execute} once per batch of this rank's share, around {@link #preProcess} and
/// {@link #postProcess}.
public interface Stage {

  String name();

  /// Creates outputs and declares patterns and previews. Called once, in the setup pass.
  void setup(PipelineContext context);

  /// @return the datasets this stage reads and writes, with their patterns
  StageBindings bindings();

  /// @return the maximum frames per batch, or 0 to use the pipeline default
  default int maxBatchSize() {
    return 0;
  }

  /// Processes one batch.
  /// @param frames the input blocks and the expected output shapes
  /// @return one block per output, keyed by output dataset name
  Map<String, ArrayBlock> execute(StageFrames frames);

  default void preProcess(PipelineContext context) {
  }

  default void postProcess(PipelineContext context) {
  }

  /// @return the controller of an iterative stage
  default Optional<IterationController> iterations() {
    return Optional.empty();
  }
}
