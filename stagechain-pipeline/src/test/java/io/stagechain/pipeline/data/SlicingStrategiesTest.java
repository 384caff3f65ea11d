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
import io.stagechain.pipeline.storage.InMemoryStorageBackend;
import io.stagechain.slicing.InvalidPatternException;
import io.stagechain.slicing.PatternDescriptor;
import io.stagechain.slicing.SliceEnumerator;
import io.stagechain.slicing.SliceIndex;
import io.stagechain.slicing.SliceTuple;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SlicingStrategiesTest {

  private final SliceEnumerator enumerator = new SliceEnumerator();
  private final PatternDescriptor projection = new PatternDescriptor("PROJECTION", new int[]{1, 2}, new int[]{0});

  @Test
  public void testPreviewMapsFramesToStorage() {
    Dataset data = new Dataset("tomo", new int[]{10, 4, 4}, "float64");
    data.addPattern(projection);
    data.setPreview(Preview.of(SliceIndex.range(2, 9, 3), SliceIndex.full(), SliceIndex.range(1, 3, 1)));
    SlicingStrategy strategy = SlicingStrategies.forDataset(data);

    List<SliceTuple> frames = strategy.frames(data, projection, enumerator);

    assertArrayEquals(new int[]{3, 4, 2}, data.viewShape());
    assertEquals(3, frames.size());
    List<Integer> storageIndices = frames.stream()
        .map(f -> strategy.toStorage(data, f).get(0).start())
        .collect(Collectors.toList());
    assertEquals(List.of(2, 5, 8), storageIndices);
    assertEquals(SliceIndex.range(1, 3, 1), strategy.toStorage(data, frames.get(0)).get(2));
  }

  @Test
  public void testPreviewMapsRanges() {
    Preview preview = Preview.of(SliceIndex.range(2, 9, 3), SliceIndex.full());

    SliceTuple mapped = preview.toStorage(new SliceTuple(SliceIndex.range(0, 3, 1), SliceIndex.point(1)));

    assertEquals(SliceIndex.range(2, 9, 3), mapped.get(0));
    assertEquals(SliceIndex.point(1), mapped.get(1));
  }

  @Test
  public void testPreviewParse() {
    Preview preview = Preview.parse(List.of(":", "10:20", "0::2", "5"), new int[]{8, 30, 6, 9});

    assertArrayEquals(new int[]{8, 10, 3, 1}, preview.shape(new int[]{8, 30, 6, 9}));
    assertThrows(IllegalArgumentException.class, () -> preview.shape(new int[]{8, 15, 6, 9}));
  }

  @Test
  public void testRawKeepsOnlyProjections() {
    Dataset raw = new Dataset("raw", new int[]{6, 2, 2}, "float64");
    raw.addPattern(projection);
    raw.setImageKey(0, new int[]{2, 1, 0, 0, 0, 1});
    SlicingStrategy strategy = SlicingStrategies.forDataset(raw);

    List<SliceTuple> frames = strategy.frames(raw, projection, enumerator);

    assertEquals(DataKind.RAW, raw.kind());
    assertEquals(List.of(2, 3, 4), frames.stream().map(f -> f.get(0).start()).collect(Collectors.toList()));
  }

  @Test
  public void testRawWithoutProjectionsCannotBeSliced() {
    Dataset raw = new Dataset("darks", new int[]{3, 2, 2}, "float64");
    raw.addPattern(projection);
    raw.setImageKey(0, new int[]{2, 2, 1});

    InvalidPatternException e = assertThrows(InvalidPatternException.class,
        () -> SlicingStrategies.forDataset(raw).frames(raw, projection, enumerator));
    assertEquals("darks", e.getDatasetName());
    assertTrue(e.getMessage().contains("does not support slicing in directions [0]"));
  }

  @Test
  public void testReplicatedReadsRepeatTheSource() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    Dataset flat = new Dataset("flat", new int[]{2, 3}, "float64");
    flat.addPattern("FRAME", new int[]{0, 1}, new int[0]);
    flat.attachStorage(memory.register("flat", ArrayBlock.generate(new int[]{2, 3}, i -> i), "float64"));
    flat.replicate(4);
    SlicingStrategy strategy = SlicingStrategies.forDataset(flat);
    PatternDescriptor replicated = flat.pattern("FRAME");

    List<SliceTuple> frames = strategy.frames(flat, replicated, enumerator);
    ArrayBlock block = strategy.read(flat, new SliceTuple(SliceIndex.range(1, 3, 1), SliceIndex.full(), SliceIndex.full()), memory);

    assertEquals(4, frames.size());
    assertArrayEquals(new int[]{2, 2, 3}, block.shape());
    assertEquals(5.0, block.get(1, 1, 2));
    assertEquals(block.get(0, 0, 1), block.get(1, 0, 1));
    assertThrows(IllegalStateException.class, () -> strategy.write(flat, frames.get(0), block, memory));
  }
}
