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



import io.stagechain.slicing.SliceTuple;

/// Backing storage for dataset arrays.
///
/// All ranks of a run address the same arrays. Writes from different ranks always cover
/// disjoint index ranges, so a backend needs no locking for them, but it must make writes
/// visible to readers once the ranks have passed a barrier.
public interface StorageBackend extends AutoCloseable {

  /// Allocates the backing array for a stage output. Every rank allocates each output;
  /// requests for the same stage and dataset return the same array.
  /// @param request the output description
  /// @return a handle to the new array
  StorageHandle allocate(StorageRequest request);

  /// Reads the block a slice selects. Single-index entries keep their dimension with
  /// extent one.
  /// @param handle the array to read
  /// @param slice the selection, in storage coordinates
  /// @return a new block holding the selected values
  ArrayBlock read(StorageHandle handle, SliceTuple slice);

  /// Writes a block to the region a slice selects.
  /// @param handle the array to write
  /// @param slice the selection, in storage coordinates
  /// @param block the values, with as many elements as the selection
  void write(StorageHandle handle, SliceTuple slice, ArrayBlock block);

  /// Releases the backend. Backends that persist data do so here.
  @Override
  void close();
}
