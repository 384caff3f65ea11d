package io.stagechain.slicing;

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


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static io.stagechain.slicing.SliceEnumeratorTest.tuple;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunGrouper")
class RunGrouperTest {

  private final SliceEnumerator enumerator = new SliceEnumerator();
  private final RunGrouper grouper = new RunGrouper();

  @Nested
  @DisplayName("batching")
  class Batching {

    @Test
    @DisplayName("splits a ten frame run into batches of four")
    void shouldSplitSingleRun() {
      List<SliceTuple> frames = List.of(
          tuple(0), tuple(1), tuple(2), tuple(3), tuple(4), tuple(5), tuple(6), tuple(7), tuple(8), tuple(9));

      List<WorkBatch> batches = grouper.group(frames, 4);

      assertThat(batches).extracting(b -> b.slice().get(0)).containsExactly(
          SliceIndex.range(0, 4, 1), SliceIndex.range(4, 8, 1), SliceIndex.range(8, 10, 1));
      assertThat(batches).extracting(WorkBatch::stepAxis).containsOnly(0);
    }

    @Test
    @DisplayName("closes a run at every wrap of the fastest axis")
    void shouldCloseOnMultiAxisStep() {
      PatternDescriptor sino = new PatternDescriptor("SINOGRAM", new int[]{2}, new int[]{0, 1});

      List<WorkBatch> batches = grouper.group(enumerator.enumerate(new int[]{3, 4, 5}, sino), 10);

      assertThat(batches).hasSize(3);
      assertThat(batches).allSatisfy(b -> {
        assertThat(b.stepAxis()).isEqualTo(1);
        assertThat(b.slice().get(1)).isEqualTo(SliceIndex.range(0, 4, 1));
        assertThat(b.slice().get(2).isFull()).isTrue();
      });
      assertThat(batches).extracting(b -> b.slice().get(0).start()).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("keeps a constant stride larger than one")
    void shouldPreserveStride() {
      List<SliceTuple> frames = List.of(tuple(0, -1), tuple(3, -1), tuple(6, -1), tuple(9, -1), tuple(12, -1));

      List<WorkBatch> batches = grouper.group(frames, 3);

      assertThat(batches).extracting(b -> b.slice().get(0)).containsExactly(
          SliceIndex.range(0, 9, 3), SliceIndex.range(9, 15, 3));
      assertThat(batches.get(1).frameCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("closes a batch when the stride changes")
    void shouldCloseOnStrideChange() {
      List<SliceTuple> frames = List.of(tuple(0), tuple(1), tuple(2), tuple(5), tuple(6));

      List<WorkBatch> batches = grouper.group(frames, 100);

      assertThat(batches).extracting(b -> b.slice().get(0)).containsExactly(
          SliceIndex.range(0, 3, 1), SliceIndex.range(5, 7, 1));
    }

    @Test
    @DisplayName("emits an isolated frame as a one frame batch along its last point axis")
    void shouldEmitSingletons() {
      List<SliceTuple> frames = List.of(tuple(0, 0), tuple(1, 1), tuple(2, 2));

      List<WorkBatch> batches = grouper.group(frames, 4);

      assertThat(batches).containsExactly(
          new WorkBatch(new SliceTuple(SliceIndex.point(0), SliceIndex.range(0, 1, 1)), 1),
          new WorkBatch(new SliceTuple(SliceIndex.point(1), SliceIndex.range(1, 2, 1)), 1),
          new WorkBatch(new SliceTuple(SliceIndex.point(2), SliceIndex.range(2, 3, 1)), 1));
    }

    @Test
    @DisplayName("passes a core-only frame through without a step axis")
    void shouldPassFullFrame() {
      List<WorkBatch> batches = grouper.group(List.of(SliceTuple.fullOf(3)), 8);

      assertThat(batches).containsExactly(new WorkBatch(SliceTuple.fullOf(3), -1));
      assertThat(batches.get(0).frameCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("invariants")
  class Invariants {

    @ParameterizedTest(name = "max batch {0}")
    @ValueSource(ints = {1, 2, 3, 7, 64})
    @DisplayName("flattening the batches reproduces the enumeration and respects the bound")
    void shouldReconstructEnumeration(int maxBatch) {
      int[] shape = {3, 5, 4, 6};
      List<PatternDescriptor> patterns = List.of(
          new PatternDescriptor("A", new int[]{2, 3}, new int[]{0, 1}),
          new PatternDescriptor("B", new int[]{0}, new int[]{1, 2, 3}),
          new PatternDescriptor("C", new int[]{1, 3}, new int[]{2, 0}),
          new PatternDescriptor("D", new int[]{0, 1, 2}, new int[]{3}));

      for (PatternDescriptor pattern : patterns) {
        List<SliceTuple> frames = enumerator.enumerate(shape, pattern);
        List<WorkBatch> batches = grouper.group(frames, maxBatch);

        List<SliceTuple> flattened = new ArrayList<>();
        batches.forEach(b -> flattened.addAll(b.frames()));
        assertThat(flattened).as("pattern %s", pattern.name()).isEqualTo(frames);
        assertThat(batches).allSatisfy(b -> assertThat(b.frameCount()).isBetween(1, maxBatch));
      }
    }
  }

  @Nested
  @DisplayName("malformed sequences")
  class Malformed {

    @Test
    @DisplayName("rejects frames out of order")
    void shouldRejectDescendingFrames() {
      List<SliceTuple> frames = List.of(tuple(0, -1), tuple(2, -1), tuple(1, -1));

      assertThatThrownBy(() -> grouper.group(frames, 4))
          .isInstanceOf(UngroupableSequenceException.class)
          .hasMessageContaining("out of order")
          .satisfies(e -> assertThat(((UngroupableSequenceException) e).getPosition()).isEqualTo(2));
    }

    @Test
    @DisplayName("rejects duplicate frames")
    void shouldRejectDuplicates() {
      assertThatThrownBy(() -> grouper.group(List.of(tuple(4), tuple(4)), 4))
          .isInstanceOf(UngroupableSequenceException.class)
          .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("rejects frames with different full dimensions")
    void shouldRejectMixedStructure() {
      assertThatThrownBy(() -> grouper.group(List.of(tuple(0, -1), tuple(1, 0)), 4))
          .isInstanceOf(UngroupableSequenceException.class);
    }

    @Test
    @DisplayName("rejects a non-positive batch size")
    void shouldRejectZeroBatch() {
      assertThatThrownBy(() -> grouper.group(List.of(tuple(0)), 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
