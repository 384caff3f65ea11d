package io.stagechain.pipeline.metadata;


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



import io.stagechain.pipeline.utils.SHARED;

import java.util.ArrayList;
import java.util.List;

/// The ordered list of stages of a run with their resolved patterns. Written once per run
/// by the coordinating rank and read by every rank afterwards.
public class PipelineMetadata {
  private final List<StageEntry> stages;

  public PipelineMetadata(List<StageEntry> stages) {
    this.stages = List.copyOf(stages);
  }

  public List<StageEntry> stages() {
    return stages;
  }

  public StageEntry stage(int index) {
    return stages.get(index);
  }

  /// For every output of a stage, finds its current pattern and the pattern the first
  /// later stage reading it uses.
  /// @param stageIndex the producing stage
  /// @return one handoff per output, in output order
  public List<PatternHandoff> currentAndNext(int stageIndex) {
    List<PatternHandoff> handoffs = new ArrayList<>();
    for (DatasetUsage output : stages.get(stageIndex).outputs()) {
      handoffs.add(new PatternHandoff(output.dataset(), output.pattern(), nextPattern(stageIndex, output.dataset())));
    }
    return handoffs;
  }

  private String nextPattern(int stageIndex, String dataset) {
    for (StageEntry later : stages.subList(stageIndex + 1, stages.size())) {
      for (DatasetUsage input : later.inputs()) {
        if (input.dataset().equals(dataset)) {
          return input.pattern();
        }
      }
    }
    return "";
  }

  public String toJson() {
    return SHARED.gson.toJson(this);
  }

  public static PipelineMetadata fromJson(String json) {
    PipelineMetadata metadata = SHARED.gson.fromJson(json, PipelineMetadata.class);
    if (metadata == null || metadata.stages == null) {
      throw new RuntimeException("invalid pipeline metadata:" + json);
    }
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return stages.equals(((PipelineMetadata) o).stages);
  }

  @Override
  public int hashCode() {
    return stages.hashCode();
  }

  @Override
  public String toString() {
    return "PipelineMetadata" + stages;
  }
}
