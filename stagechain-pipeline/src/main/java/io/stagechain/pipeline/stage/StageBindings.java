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



import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// The ordered input and output datasets of a stage with their patterns.
public final class StageBindings {
  private final List<DatasetBinding> inputs;
  private final List<DatasetBinding> outputs;

  public StageBindings(List<DatasetBinding> inputs, List<DatasetBinding> outputs) {
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<DatasetBinding> inputs() {
    return inputs;
  }

  public List<DatasetBinding> outputs() {
    return outputs;
  }

  public List<String> inputNames() {
    return inputs.stream().map(DatasetBinding::name).collect(Collectors.toList());
  }

  public List<String> outputNames() {
    return outputs.stream().map(DatasetBinding::name).collect(Collectors.toList());
  }

  /// Rebinds the datasets by position, keeping each position's pattern.
  /// @param inputNames the new input dataset names, one per input
  /// @param outputNames the new output dataset names, one per output
  /// @return the rebound bindings
  public StageBindings withDatasets(List<String> inputNames, List<String> outputNames) {
    return new StageBindings(rename(inputs, inputNames), rename(outputs, outputNames));
  }

  private static List<DatasetBinding> rename(List<DatasetBinding> bindings, List<String> names) {
    if (bindings.size() != names.size()) {
      throw new IllegalArgumentException("Cannot bind " + names + " to the " + bindings.size() + " positions " + bindings);
    }
    List<DatasetBinding> renamed = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      renamed.add(bindings.get(i).withName(names.get(i)));
    }
    return renamed;
  }

  @Override
  public String toString() {
    return inputs + " -> " + outputs;
  }

  public static class Builder {
    private final List<DatasetBinding> inputs = new ArrayList<>();
    private final List<DatasetBinding> outputs = new ArrayList<>();

    public Builder in(String dataset, String pattern) {
      inputs.add(new DatasetBinding(dataset, pattern));
      return this;
    }

    public Builder out(String dataset, String pattern) {
      outputs.add(new DatasetBinding(dataset, pattern));
      return this;
    }

    public StageBindings build() {
      return new StageBindings(inputs, outputs);
    }
  }
}
