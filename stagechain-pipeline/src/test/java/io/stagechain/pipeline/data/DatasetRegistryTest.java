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



import io.stagechain.slicing.SliceIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatasetRegistry")
class DatasetRegistryTest {

  private static final int[] SHAPE = {4, 6, 5};
  private DatasetRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new DatasetRegistry();
    registry.createInput("tomo", SHAPE, "float64").addPattern("PROJECTION", new int[]{1, 2}, new int[]{0});
    registry.checkpoint();
    registry.beginStage("filter");
  }

  @Nested
  @DisplayName("merge")
  class Merge {

    @Test
    @DisplayName("moves outputs into inputs and clears the outputs")
    void shouldMergeOutputs() {
      registry.createOutput("A", SHAPE, "float64");
      registry.createOutput("B", SHAPE, "float64");

      registry.merge();

      assertThat(registry.inputNames()).containsExactly("tomo", "A", "B");
      assertThat(registry.outputNames()).isEmpty();
    }

    @Test
    @DisplayName("is idempotent")
    void shouldBeIdempotent() {
      registry.createOutput("A", SHAPE, "float64");
      registry.merge();
      var afterFirst = registry.inputs();

      registry.merge();

      assertThat(registry.inputs()).containsExactlyElementsOf(afterFirst);
    }

    @Test
    @DisplayName("drops outputs marked for removal")
    void shouldSkipRemoved() {
      registry.createOutput("A", SHAPE, "float64").setRemove(true);

      registry.merge();

      assertThat(registry.inputNames()).containsExactly("tomo");
    }

    @Test
    @DisplayName("overwrites an input of the same name with the output")
    void shouldOverwriteInput() {
      Dataset replacement = registry.createOutput("tomo", new int[]{2, 2}, "float32");

      registry.merge();

      assertThat(registry.input("tomo")).isSameAs(replacement);
    }
  }

  @Nested
  @DisplayName("finalize")
  class Finalize {

    @Test
    @DisplayName("lists removed outputs and drops them from the inputs")
    void shouldRemoveMarkedOutputs() {
      registry.createOutput("A", SHAPE, "float64").setRemove(true);

      StageTransition transition = registry.finalizeStage();
      registry.reorganise(transition);

      assertThat(StageTransition.names(transition.remove())).containsExactly("A");
      assertThat(transition.keep()).isEmpty();
      assertThat(registry.hasInput("A")).isFalse();
      assertThat(registry.outputNames()).isEmpty();
    }

    @Test
    @DisplayName("replaces inputs by a copy of the output of the same name")
    void shouldReplaceInputs() {
      Dataset original = registry.input("tomo");
      Dataset output = registry.createOutput("tomo", SHAPE, "float64");
      output.addPattern("SINOGRAM", new int[]{0, 2}, new int[]{1});
      output.setPreview(Preview.of(SliceIndex.range(0, 2, 1), SliceIndex.full(), SliceIndex.full()));

      StageTransition transition = registry.finalizeStage();
      registry.reorganise(transition);

      assertThat(transition.replace()).containsExactly(original);
      Dataset survivor = registry.input("tomo");
      assertThat(survivor).isNotSameAs(output).isNotSameAs(original);
      assertThat(survivor.patterns()).containsOnlyKeys("SINOGRAM");
      assertThat(survivor.preview()).isEmpty();
      assertThat(output.preview()).isPresent();
    }

    @Test
    @DisplayName("resets replicated inputs to their source form")
    void shouldUnreplicate() {
      Dataset tomo = registry.input("tomo");
      tomo.replicate(3);
      assertThat(tomo.viewShape()).containsExactly(3, 4, 6, 5);

      registry.reorganise(registry.finalizeStage());

      Dataset restored = registry.input("tomo");
      assertThat(restored.kind()).isEqualTo(DataKind.STANDARD);
      assertThat(restored.viewShape()).containsExactly(SHAPE);
      assertThat(restored.pattern("PROJECTION").coreDimensions()).containsExactly(1, 2);
    }
  }

  @Test
  @DisplayName("rejects a second output of the same name within a stage")
  void shouldRejectDuplicateOutput() {
    registry.createOutput("A", SHAPE, "float64");

    assertThatThrownBy(() -> registry.createOutput("A", SHAPE, "float64"))
        .isInstanceOf(DuplicateDatasetException.class)
        .hasMessageContaining("'A'")
        .hasMessageContaining("'filter'");
  }

  @Test
  @DisplayName("restores the loaded inputs from the checkpoint")
  void shouldResetToCheckpoint() {
    registry.input("tomo").addPattern("SINOGRAM", new int[]{0, 2}, new int[]{1});
    registry.createOutput("A", SHAPE, "float64");
    registry.merge();

    registry.resetToCheckpoint();

    assertThat(registry.inputNames()).containsExactly("tomo");
    assertThat(registry.input("tomo").patterns()).containsOnlyKeys("PROJECTION");
    assertThat(registry.outputNames()).isEmpty();
  }

  @Test
  @DisplayName("lists all datasets except iteration buffers")
  void shouldHideIterationClones() {
    registry.createInput("X_itr_clone1", SHAPE, "float64");
    registry.createInput("X", SHAPE, "float64");

    assertThat(registry.allDatasetNames()).containsExactly("tomo", "X");
  }

  @Test
  @DisplayName("settles an alternating pair under the primary name")
  void shouldResolveAlternatingPair() {
    Dataset y = registry.createOutput("Y", SHAPE, "float64");
    Dataset x = registry.input("tomo");

    registry.resolveAlternatingPair("Y", "tomo", "tomo");
    StageTransition transition = registry.finalizeStage();
    registry.reorganise(transition);

    assertThat(x.isRemove()).isTrue();
    assertThat(y.isRemove()).isFalse();
    assertThat(y.name()).isEqualTo("tomo");
    assertThat(transition.remove()).containsExactly(x);
    assertThat(registry.inputNames()).containsExactly("tomo");
    assertThat(registry.input("tomo")).isNotSameAs(x);
  }

  @Test
  @DisplayName("fails on unknown names")
  void shouldRejectUnknownDataset() {
    assertThatThrownBy(() -> registry.input("missing"))
        .isInstanceOf(UnknownDatasetException.class)
        .hasMessageContaining("missing");
  }
}
