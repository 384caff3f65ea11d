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



/// Stable reference to one entry of a {@link DatasetStore}.
public final class DatasetHandle {
  private final int index;

  DatasetHandle(int index) {
    this.index = index;
  }

  public int index() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return index == ((DatasetHandle) o).index;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(index);
  }

  @Override
  public String toString() {
    return "#" + index;
  }
}
