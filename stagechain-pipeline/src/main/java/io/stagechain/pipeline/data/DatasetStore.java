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



import java.util.ArrayList;
import java.util.List;

/// Append-only arena of datasets. Entries are never removed, so a {@link DatasetHandle}
/// stays valid for the life of the store and a checkpoint can be kept as a set of handles.
public class DatasetStore {
  private final List<Dataset> arena = new ArrayList<>();

  public DatasetHandle add(Dataset dataset) {
    arena.add(dataset);
    return new DatasetHandle(arena.size() - 1);
  }

  public Dataset get(DatasetHandle handle) {
    return arena.get(handle.index());
  }

  public int size() {
    return arena.size();
  }
}
