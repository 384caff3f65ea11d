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



import io.stagechain.pipeline.metadata.PipelineMetadata;
import io.stagechain.pipeline.storage.StorageHandle;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/// The result of {@link PipelineDriver#run} on one rank.
public class RunReport {
  private final int rank;
  private final PipelineMetadata metadata;
  private final List<StageReport> stages;
  private final Map<String, StorageHandle> datasets;

  public RunReport(int rank, PipelineMetadata metadata, List<StageReport> stages, Map<String, StorageHandle> datasets) {
    this.rank = rank;
    this.metadata = metadata;
    this.stages = List.copyOf(stages);
    this.datasets = Map.copyOf(datasets);
  }

  public int rank() {
    return rank;
  }

  public PipelineMetadata metadata() {
    return metadata;
  }

  public List<StageReport> stages() {
    return stages;
  }

  public StageReport stage(String name) {
    return stages.stream().filter(s -> s.name().equals(name)).findFirst()
        .orElseThrow(() -> new NoSuchElementException("No stage " + name + " in " + stages));
  }

  /// @return the storage of every dataset available at the end of the chain, by name
  public Map<String, StorageHandle> datasets() {
    return datasets;
  }

  public StorageHandle dataset(String name) {
    StorageHandle handle = datasets.get(name);
    if (handle == null) {
      throw new NoSuchElementException("No dataset " + name + " in " + datasets.keySet());
    }
    return handle;
  }
}
