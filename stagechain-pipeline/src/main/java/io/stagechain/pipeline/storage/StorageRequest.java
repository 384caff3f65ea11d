package io.stagechain.pipeline.storage;


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



import java.util.Arrays;
import java.util.Objects;

/// Everything a backend needs to allocate the backing array of a stage output.
public final class StorageRequest {
  private final String name;
  private final int[] shape;
  private final String dtype;
  private final int stageIndex;
  private final String stageName;

  /// @param name the dataset name
  /// @param shape the full array shape
  /// @param dtype the element type name, such as `float64`
  /// @param stageIndex the position of the producing stage in the chain, counted from zero
  /// @param stageName the name of the producing stage
  public StorageRequest(String name, int[] shape, String dtype, int stageIndex, String stageName) {
    this.name = Objects.requireNonNull(name, "name");
    this.shape = shape.clone();
    this.dtype = Objects.requireNonNull(dtype, "dtype");
    this.stageIndex = stageIndex;
    this.stageName = Objects.requireNonNull(stageName, "stage name");
  }

  public String name() {
    return name;
  }

  public int[] shape() {
    return shape.clone();
  }

  public String dtype() {
    return dtype;
  }

  public int stageIndex() {
    return stageIndex;
  }

  public String stageName() {
    return stageName;
  }

  @Override
  public String toString() {
    return "StorageRequest{" + name + Arrays.toString(shape) + " " + dtype + ", stage " + stageIndex + ":" + stageName + "}";
  }
}
