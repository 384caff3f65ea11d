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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// Heap storage for dataset arrays, shared by all ranks running in one JVM.
///
/// Arrays are plain `double[]`s in row-major order. Allocation and registration are
/// collective: every rank asking for the same array receives the same handle. Concurrent
/// writes to disjoint regions are safe; visibility between ranks is established by the
/// coordinator's barriers.
public class InMemoryStorageBackend implements StorageBackend {
  private static final Logger logger = LogManager.getLogger(InMemoryStorageBackend.class);

  private final Map<Long, double[]> arrays = new ConcurrentHashMap<>();
  private final Map<Long, StorageHandle> handles = new ConcurrentHashMap<>();
  private final Map<String, StorageHandle> byKey = new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong();

  @Override
  public StorageHandle allocate(StorageRequest request) {
    String key = request.stageIndex() + ":" + request.stageName() + ":" + request.name();
    return byKey.computeIfAbsent(key, k -> {
      StorageHandle handle = newHandle(request.name(), request.shape(), request.dtype());
      arrays.put(handle.id(), new double[Math.toIntExact(SliceAddressing.elementCount(request.shape()))]);
      logger.debug("allocated {} for stage {}:{}", handle, request.stageIndex(), request.stageName());
      return handle;
    });
  }

  /// Registers existing source data, as a loader does for its input datasets.
  /// @param name the dataset name
  /// @param block the values, whose shape becomes the array shape
  /// @param dtype the element type name
  /// @return a handle to the registered array
  public StorageHandle register(String name, ArrayBlock block, String dtype) {
    return byKey.computeIfAbsent("source:" + name, k -> {
      StorageHandle handle = newHandle(name, block.shape(), dtype);
      arrays.put(handle.id(), block.data().clone());
      logger.debug("registered source {}", handle);
      return handle;
    });
  }

  @Override
  public ArrayBlock read(StorageHandle handle, SliceTuple slice) {
    double[] array = array(handle);
    int[] offsets = SliceAddressing.flatOffsets(handle.shape(), slice);
    double[] values = new double[offsets.length];
    for (int i = 0; i < offsets.length; i++) {
      values[i] = array[offsets[i]];
    }
    return new ArrayBlock(slice.blockShape(handle.shape()), values);
  }

  @Override
  public void write(StorageHandle handle, SliceTuple slice, ArrayBlock block) {
    double[] array = array(handle);
    int[] offsets = SliceAddressing.flatOffsets(handle.shape(), slice);
    if (offsets.length != block.size()) {
      throw new IllegalArgumentException("Cannot write " + block + " to " + slice + " of " + handle
          + ": expected " + offsets.length + " values");
    }
    double[] values = block.data();
    for (int i = 0; i < offsets.length; i++) {
      array[offsets[i]] = values[i];
    }
  }

  /// @return the whole array behind a handle
  public ArrayBlock contents(StorageHandle handle) {
    return new ArrayBlock(handle.shape(), array(handle).clone());
  }

  /// @return the handle last allocated or registered under a name
  public StorageHandle handleFor(String name) {
    return handles.values().stream()
        .filter(h -> h.name().equals(name))
        .max((a, b) -> Long.compare(a.id(), b.id()))
        .orElseThrow(() -> new IllegalArgumentException("No array named " + name));
  }

  @Override
  public void close() {
    logger.debug("releasing {} arrays", arrays.size());
    arrays.clear();
    handles.clear();
    byKey.clear();
  }

  private StorageHandle newHandle(String name, int[] shape, String dtype) {
    StorageHandle handle = new StorageHandle(nextId.getAndIncrement(), name, shape, dtype);
    handles.put(handle.id(), handle);
    return handle;
  }

  private double[] array(StorageHandle handle) {
    double[] array = arrays.get(handle.id());
    if (array == null) {
      throw new IllegalArgumentException("Unknown storage handle " + handle + " " + Arrays.toString(handle.shape()));
    }
    return array;
  }
}
