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
import io.stagechain.slicing.InvalidPatternException;
import io.stagechain.slicing.PatternDescriptor;
import io.stagechain.slicing.SliceEnumerator;
import io.stagechain.slicing.SliceIndex;
import io.stagechain.slicing.SliceTuple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// The slicing strategy of each {@link DataKind}.
public final class SlicingStrategies {
  private static final Logger logger = LogManager.getLogger(SlicingStrategies.class);

  private static final Map<DataKind, SlicingStrategy> STRATEGIES = new EnumMap<>(DataKind.class);

  static {
    STRATEGIES.put(DataKind.STANDARD, new Standard());
    STRATEGIES.put(DataKind.RAW, new Raw());
    STRATEGIES.put(DataKind.REPLICATED, new Replicated());
  }

  private SlicingStrategies() {
  }

  public static SlicingStrategy forKind(DataKind kind) {
    return STRATEGIES.get(kind);
  }

  public static SlicingStrategy forDataset(Dataset dataset) {
    return forKind(dataset.kind());
  }

  private static SliceTuple throughPreview(Dataset dataset, SliceTuple previewed) {
    return dataset.preview().map(p -> p.toStorage(previewed)).orElse(previewed);
  }

  /// Enumerates the previewed shape and maps indices through the preview.
  private static class Standard implements SlicingStrategy {
    @Override
    public List<SliceTuple> frames(Dataset dataset, PatternDescriptor pattern, SliceEnumerator enumerator) {
      return enumerator.enumerate(dataset.viewShape(), pattern);
    }

    @Override
    public SliceTuple toStorage(Dataset dataset, SliceTuple viewSlice) {
      return throughPreview(dataset, viewSlice);
    }
  }

  /// Keeps only the frames whose image key marks a projection.
  private static class Raw extends Standard {
    @Override
    public List<SliceTuple> frames(Dataset dataset, PatternDescriptor pattern, SliceEnumerator enumerator) {
      List<SliceTuple> all = super.frames(dataset, pattern, enumerator);
      int keyDim = dataset.imageKeyDimension();
      if (keyDim < 0) {
        return all;
      }
      List<SliceTuple> projections = all.stream()
          .filter(frame -> frame.get(keyDim).isFull()
              || dataset.imageKey(toStorage(dataset, frame).get(keyDim).start()) == 0)
          .collect(Collectors.toList());
      if (projections.isEmpty()) {
        throw new InvalidPatternException(pattern.name(), dataset.name(),
            "the data does not support slicing in directions " + Arrays.toString(pattern.sliceDimensions()));
      }
      logger.debug("{} keeps {} of {} frames as projections", dataset.name(), projections.size(), all.size());
      return projections;
    }
  }

  /// Reads drop the replica axis and repeat the stored block once per selected replica.
  private static class Replicated implements SlicingStrategy {
    @Override
    public List<SliceTuple> frames(Dataset dataset, PatternDescriptor pattern, SliceEnumerator enumerator) {
      return enumerator.enumerate(dataset.viewShape(), pattern);
    }

    @Override
    public SliceTuple toStorage(Dataset dataset, SliceTuple viewSlice) {
      List<SliceIndex> entries = viewSlice.entries();
      return throughPreview(dataset, SliceTuple.of(entries.subList(1, entries.size())));
    }

    @Override
    public ArrayBlock read(Dataset dataset, SliceTuple viewSlice, StorageBackend backend) {
      ArrayBlock block = backend.read(dataset.storage(), toStorage(dataset, viewSlice));
      int copies = viewSlice.get(0).length(dataset.replicas());
      int[] shape = new int[block.rank() + 1];
      shape[0] = copies;
      System.arraycopy(block.shape(), 0, shape, 1, block.rank());
      double[] tiled = new double[copies * block.size()];
      for (int c = 0; c < copies; c++) {
        System.arraycopy(block.data(), 0, tiled, c * block.size(), block.size());
      }
      return new ArrayBlock(shape, tiled);
    }

    @Override
    public void write(Dataset dataset, SliceTuple viewSlice, ArrayBlock block, StorageBackend backend) {
      throw new IllegalStateException("Replicated dataset " + dataset.name() + " cannot be written");
    }
  }
}
