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



import io.stagechain.pipeline.config.PipelineOptions;
import io.stagechain.pipeline.data.DataKind;
import io.stagechain.pipeline.data.Dataset;
import io.stagechain.pipeline.data.DatasetRegistry;
import io.stagechain.pipeline.storage.StorageBackend;
import io.stagechain.pipeline.topology.Coordinator;

import java.util.List;
import java.util.Optional;

/// What a stage or loader sees of the running pipeline: the datasets of the registry, the
/// options, the rank topology and the storage backend.
public class PipelineContext {
  private final DatasetRegistry registry;
  private final PipelineOptions options;
  private final Coordinator coordinator;
  private final StorageBackend storage;
  private final int stageIndex;
  private final String stageName;
  private final IterationController iterations;

  public PipelineContext(DatasetRegistry registry, PipelineOptions options, Coordinator coordinator,
                         StorageBackend storage, int stageIndex, String stageName,
                         IterationController iterations) {
    this.registry = registry;
    this.options = options;
    this.coordinator = coordinator;
    this.storage = storage;
    this.stageIndex = stageIndex;
    this.stageName = stageName;
    this.iterations = iterations;
  }

  public Dataset input(String name) {
    return registry.input(name);
  }

  public Dataset output(String name) {
    return registry.output(name);
  }

  /// @return the dataset of that name among the outputs, or else the inputs
  public Dataset dataset(String name) {
    return registry.resolve(name);
  }

  public Dataset createInput(String name, int[] shape, String dtype) {
    return registry.createInput(name, shape, dtype);
  }

  public Dataset createOutput(String name, int[] shape, String dtype) {
    return registry.createOutput(name, shape, dtype);
  }

  /// Creates an output with the view shape, type and patterns of an existing dataset.
  /// A replicated dataset contributes its source shape and patterns.
  public Dataset createOutput(String name, Dataset basedOn) {
    Dataset source = basedOn;
    if (basedOn.kind() == DataKind.REPLICATED) {
      source = basedOn.copy();
      source.unreplicate();
    }
    Dataset output = registry.createOutput(name, source.viewShape(), source.dtype());
    source.patterns().values().forEach(output::addPattern);
    return output;
  }

  /// @return the names of all datasets available to read, excluding iteration buffers
  public List<String> allDatasetNames() {
    return registry.allDatasetNames();
  }

  public PipelineOptions options() {
    return options;
  }

  public int rank() {
    return coordinator.rank();
  }

  public int totalRanks() {
    return coordinator.totalRanks();
  }

  public StorageBackend storage() {
    return storage;
  }

  /// @return the position of the stage in the chain, or -1 for a loader
  public int stageIndex() {
    return stageIndex;
  }

  public String stageName() {
    return stageName;
  }

  public Optional<IterationController> iterations() {
    return Optional.ofNullable(iterations);
  }

  /// @return the current iteration, 0 for a stage that does not iterate
  public int iteration() {
    return iterations == null ? 0 : iterations.iteration();
  }
}
