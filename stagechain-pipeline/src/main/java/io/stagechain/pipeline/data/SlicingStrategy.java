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



import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.pipeline.storage.StorageBackend;
import io.stagechain.slicing.PatternDescriptor;
import io.stagechain.slicing.SliceEnumerator;
import io.stagechain.slicing.SliceTuple;

import java.util.List;

/// Kind-specific slicing of a dataset. Frames are produced in view coordinates, grouped
/// into batches there, and mapped to storage coordinates only when data is read or written.
public interface SlicingStrategy {

  /// Lists the frames of a dataset under one of its patterns.
  /// @param dataset the dataset
  /// @param pattern a pattern declared on the dataset
  /// @param enumerator the enumerator to list view frames with
  /// @return the frames to process, in view coordinates
  List<SliceTuple> frames(Dataset dataset, PatternDescriptor pattern, SliceEnumerator enumerator);

  /// Maps a view selection to the storage selection it reads or writes.
  SliceTuple toStorage(Dataset dataset, SliceTuple viewSlice);

  default ArrayBlock read(Dataset dataset, SliceTuple viewSlice, StorageBackend backend) {
    return backend.read(dataset.storage(), toStorage(dataset, viewSlice));
  }

  default void write(Dataset dataset, SliceTuple viewSlice, ArrayBlock block, StorageBackend backend) {
    backend.write(dataset.storage(), toStorage(dataset, viewSlice), block);
  }
}
