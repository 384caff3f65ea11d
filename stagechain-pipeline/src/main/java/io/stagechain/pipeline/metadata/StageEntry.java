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



import java.util.List;
import java.util.Objects;

/// The resolved bindings of one stage of the chain.
public class StageEntry {
  private final int index;
  private final String name;
  private final List<DatasetUsage> inputs;
  private final List<DatasetUsage> outputs;

  public StageEntry(int index, String name, List<DatasetUsage> inputs, List<DatasetUsage> outputs) {
    this.index = index;
    this.name = name;
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
  }

  public int index() {
    return index;
  }

  public String name() {
    return name;
  }

  public List<DatasetUsage> inputs() {
    return inputs;
  }

  public List<DatasetUsage> outputs() {
    return outputs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StageEntry that = (StageEntry) o;
    return index == that.index && name.equals(that.name) && inputs.equals(that.inputs) && outputs.equals(that.outputs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, name, inputs, outputs);
  }

  @Override
  public String toString() {
    return index + "-" + name + inputs + "->" + outputs;
  }
}
