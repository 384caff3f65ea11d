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

/// Opaque reference to an array held by a {@link StorageBackend}. Several datasets may share
/// one handle when a dataset is copied between the registry's maps.
public final class StorageHandle {
  private final long id;
  private final String name;
  private final int[] shape;
  private final String dtype;

  public StorageHandle(long id, String name, int[] shape, String dtype) {
    this.id = id;
    this.name = name;
    this.shape = shape.clone();
    this.dtype = dtype;
  }

  public long id() {
    return id;
  }

  /// @return the name the array was allocated or registered under
  public String name() {
    return name;
  }

  public int[] shape() {
    return shape.clone();
  }

  public String dtype() {
    return dtype;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return id == ((StorageHandle) o).id;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public String toString() {
    return "StorageHandle{" + id + ":" + name + Arrays.toString(shape) + " " + dtype + "}";
  }
}
