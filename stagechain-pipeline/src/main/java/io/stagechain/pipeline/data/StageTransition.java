package io.stagechain.pipeline.data;


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
import java.util.stream.Collectors;

/// The outcome of finalizing one stage: which outputs are dropped, which continue into the
/// next stage, and which existing inputs they replace. Created by
/// {@link DatasetRegistry#finalizeStage()} and consumed by
/// {@link DatasetRegistry#reorganise(StageTransition)}.
public final class StageTransition {
  private final List<Dataset> remove;
  private final List<Dataset> keep;
  private final List<Dataset> replace;

  public StageTransition(List<Dataset> remove, List<Dataset> keep, List<Dataset> replace) {
    this.remove = List.copyOf(remove);
    this.keep = List.copyOf(keep);
    this.replace = List.copyOf(replace);
  }

  public List<Dataset> remove() {
    return remove;
  }

  public List<Dataset> keep() {
    return keep;
  }

  /// @return the inputs that share a name with an output and will be superseded by it
  public List<Dataset> replace() {
    return replace;
  }

  public static List<String> names(List<Dataset> datasets) {
    return datasets.stream().map(Dataset::name).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "StageTransition{remove=" + names(remove) + ", keep=" + names(keep) + ", replace=" + names(replace) + "}";
  }
}
