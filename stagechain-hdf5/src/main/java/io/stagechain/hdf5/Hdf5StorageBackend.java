package io.stagechain.hdf5;


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



import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.WritableGroup;
import io.stagechain.pipeline.config.PipelineOptions;
import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.pipeline.storage.SliceAddressing;
import io.stagechain.pipeline.storage.StorageBackend;
import io.stagechain.pipeline.storage.StorageHandle;
import io.stagechain.pipeline.storage.StorageRequest;
import io.stagechain.slicing.SliceIndex;
import io.stagechain.slicing.SliceTuple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/// Storage backed by HDF5 files.
///
/// Source datasets are read from their files on demand, each read fetching the bounding box
/// of the selection with one jHDF slice read. A source that a stage writes to is first copied
/// into memory. Stage outputs are held in memory while the run lasts and each is written to
/// its own file, named by {@link Hdf5OutputNaming}, when the backend is closed.
///
/// As with the in-memory backend, all ranks of a JVM share one instance, and allocation and
/// registration return the same handle to every rank that asks.
public class Hdf5StorageBackend implements StorageBackend {
  private static final Logger logger = LogManager.getLogger(Hdf5StorageBackend.class);

  private final Hdf5OutputNaming naming;
  private final Map<String, StorageHandle> byKey = new ConcurrentHashMap<>();
  private final Map<Long, Source> sources = new ConcurrentHashMap<>();
  private final Map<Long, double[]> buffers = new ConcurrentHashMap<>();
  private final Map<Long, OutputTarget> targets = new LinkedHashMap<>();
  private final AtomicLong nextId = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();

  public Hdf5StorageBackend(PipelineOptions options) {
    this.naming = new Hdf5OutputNaming(options);
  }

  public Hdf5OutputNaming naming() {
    return naming;
  }

  /// Opens a dataset in an HDF5 file as the source of an input dataset.
  /// @param name the input dataset name
  /// @param file the HDF5 file
  /// @param datasetPath the path of the dataset within the file
  /// @return a handle to the source
  public StorageHandle registerSource(String name, Path file, String datasetPath) {
    return byKey.computeIfAbsent("source:" + name, k -> {
      HdfFile hdfFile = new HdfFile(file);
      Dataset dataset = hdfFile.getDatasetByPath(datasetPath);
      StorageHandle handle = new StorageHandle(nextId.getAndIncrement(), name, dataset.getDimensions(),
          Hdf5Arrays.dtypeOf(dataset.getDataType().getJavaType()));
      sources.put(handle.id(), new Source(hdfFile, dataset));
      logger.debug("registered {} from {}:{}", handle, file, datasetPath);
      return handle;
    });
  }

  @Override
  public StorageHandle allocate(StorageRequest request) {
    String key = request.stageIndex() + ":" + request.stageName() + ":" + request.name();
    return byKey.computeIfAbsent(key, k -> {
      StorageHandle handle = new StorageHandle(nextId.getAndIncrement(), request.name(), request.shape(),
          request.dtype());
      buffers.put(handle.id(), new double[Math.toIntExact(SliceAddressing.elementCount(request.shape()))]);
      OutputTarget target = new OutputTarget(
          naming.outputFile(request.stageIndex(), request.stageName(), request.name()),
          naming.groupName(request.stageIndex(), request.stageName()),
          request.name());
      synchronized (targets) {
        targets.put(handle.id(), target);
      }
      logger.debug("allocated {} for {}", handle, target.file);
      return handle;
    });
  }

  @Override
  public ArrayBlock read(StorageHandle handle, SliceTuple slice) {
    double[] buffer = buffers.get(handle.id());
    if (buffer != null) {
      return readBuffer(buffer, handle, slice);
    }
    return source(handle).read(handle.shape(), slice);
  }

  @Override
  public void write(StorageHandle handle, SliceTuple slice, ArrayBlock block) {
    double[] buffer = buffers.computeIfAbsent(handle.id(), id -> {
      logger.debug("copying source {} into memory before the first write", handle);
      return source(handle).read(handle.shape(), SliceTuple.fullOf(handle.shape().length)).data();
    });
    int[] offsets = SliceAddressing.flatOffsets(handle.shape(), slice);
    if (offsets.length != block.size()) {
      throw new IllegalArgumentException("Cannot write " + block + " to " + slice + " of " + handle
          + ": expected " + offsets.length + " values");
    }
    double[] values = block.data();
    for (int i = 0; i < offsets.length; i++) {
      buffer[offsets[i]] = values[i];
    }
  }

  /// @return the file an allocated output is written to on close
  public Optional<Path> outputFile(StorageHandle handle) {
    synchronized (targets) {
      return Optional.ofNullable(targets.get(handle.id())).map(t -> t.file);
    }
  }

  /// Writes the given datasets into the processed file of the run, one HDF5 dataset each.
  /// @param datasets the datasets to write, by name
  /// @return the processed file
  public Path writeProcessedFile(Map<String, StorageHandle> datasets) {
    Path file = naming.processedFile();
    createParent(file);
    try (WritableHdfFile writable = HdfFile.write(file)) {
      datasets.forEach((name, handle) -> writable.putDataset(name,
          Hdf5Arrays.nest(read(handle, SliceTuple.fullOf(handle.shape().length)).data(), handle.shape())));
    }
    logger.info("wrote {} datasets to {}", datasets.size(), file);
    return file;
  }

  /// Writes every allocated output to its file and closes the source files. Later calls do
  /// nothing.
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    Map<Long, OutputTarget> toWrite;
    synchronized (targets) {
      toWrite = new LinkedHashMap<>(targets);
    }
    toWrite.forEach((id, target) -> {
      StorageHandle handle = handleFor(id);
      createParent(target.file);
      try (WritableHdfFile writable = HdfFile.write(target.file)) {
        WritableGroup group = writable.putGroup(target.group);
        group.putDataset(target.dataset, Hdf5Arrays.nest(buffers.get(id), handle.shape()));
      }
      logger.info("wrote {} to {}", target.dataset, target.file);
    });
    sources.values().forEach(Source::close);
    sources.clear();
    buffers.clear();
  }

  private StorageHandle handleFor(long id) {
    return byKey.values().stream().filter(h -> h.id() == id).findFirst()
        .orElseThrow(() -> new IllegalStateException("No handle with id " + id));
  }

  private Source source(StorageHandle handle) {
    Source source = sources.get(handle.id());
    if (source == null) {
      throw new IllegalArgumentException("Unknown storage handle " + handle);
    }
    return source;
  }

  private static ArrayBlock readBuffer(double[] buffer, StorageHandle handle, SliceTuple slice) {
    int[] offsets = SliceAddressing.flatOffsets(handle.shape(), slice);
    double[] values = new double[offsets.length];
    for (int i = 0; i < offsets.length; i++) {
      values[i] = buffer[offsets[i]];
    }
    return new ArrayBlock(slice.blockShape(handle.shape()), values);
  }

  private static void createParent(Path file) {
    try {
      Files.createDirectories(file.toAbsolutePath().getParent());
    } catch (IOException e) {
      throw new UncheckedIOException("unable to create directory for " + file, e);
    }
  }

  /// An open HDF5 dataset. jHDF reads of one file are serialized.
  private static final class Source {
    private final HdfFile file;
    private final Dataset dataset;

    private Source(HdfFile file, Dataset dataset) {
      this.file = file;
      this.dataset = dataset;
    }

    /// Reads the bounding box of a selection and picks the selected elements from it.
    private ArrayBlock read(int[] shape, SliceTuple slice) {
      int rank = shape.length;
      long[] offset = new long[rank];
      int[] box = new int[rank];
      SliceIndex[] local = new SliceIndex[rank];
      for (int dim = 0; dim < rank; dim++) {
        SliceIndex entry = slice.get(dim);
        if (entry.isFull()) {
          box[dim] = shape[dim];
          local[dim] = SliceIndex.full();
        } else if (entry.isPoint()) {
          offset[dim] = entry.start();
          box[dim] = 1;
          local[dim] = SliceIndex.point(0);
        } else {
          int count = entry.length(shape[dim]);
          offset[dim] = entry.start();
          box[dim] = (count - 1) * entry.step() + 1;
          local[dim] = SliceIndex.range(0, box[dim], entry.step());
        }
        if (offset[dim] + box[dim] > shape[dim]) {
          throw new IndexOutOfBoundsException(
              "Slice " + slice + " reaches outside shape " + Arrays.toString(shape));
        }
      }
      Object data;
      synchronized (this) {
        data = dataset.getData(offset, box);
      }
      double[] boxValues = Hdf5Arrays.flatten(data);
      int[] picks = SliceAddressing.flatOffsets(box, new SliceTuple(local));
      double[] values = new double[picks.length];
      for (int i = 0; i < picks.length; i++) {
        values[i] = boxValues[picks[i]];
      }
      return new ArrayBlock(slice.blockShape(shape), values);
    }

    private void close() {
      file.close();
    }
  }

  private static final class OutputTarget {
    private final Path file;
    private final String group;
    private final String dataset;

    private OutputTarget(Path file, String group, String dataset) {
      this.file = file;
      this.group = group;
      this.dataset = dataset;
    }
  }
}
