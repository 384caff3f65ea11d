package io.stagechain.pipeline;


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



import io.stagechain.pipeline.config.PipelineOptions;
import io.stagechain.pipeline.data.Preview;
import io.stagechain.pipeline.data.ShapeMismatchException;
import io.stagechain.pipeline.metadata.PatternHandoff;
import io.stagechain.pipeline.metadata.PipelineMetadata;
import io.stagechain.pipeline.metadata.PipelineMetadataStore;
import io.stagechain.pipeline.stage.IterationController;
import io.stagechain.pipeline.stage.Loader;
import io.stagechain.pipeline.stage.PipelineContext;
import io.stagechain.pipeline.stage.Stage;
import io.stagechain.pipeline.stage.StageBindings;
import io.stagechain.pipeline.stage.StageFrames;
import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.pipeline.storage.InMemoryStorageBackend;
import io.stagechain.pipeline.topology.LocalCoordinatorGroup;
import io.stagechain.pipeline.topology.SingleRankCoordinator;
import io.stagechain.slicing.SliceIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.IntToDoubleFunction;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class PipelineDriverTest {

  private static final int[] SHAPE = {6, 4};

  @TempDir
  Path tempDir;

  private static ArrayLoader rawLoader() {
    return new ArrayLoader("raw", ArrayBlock.generate(SHAPE, i -> i))
        .pattern("PROJECTION", new int[]{1}, new int[]{0})
        .pattern("SINOGRAM", new int[]{0}, new int[]{1});
  }

  private static List<Stage> chain() {
    return List.of(
        new MapStage("scale", "raw", "scaled", "PROJECTION", v -> v * 2).maxBatch(2),
        new MapStage("shift", "scaled", "shifted", "SINOGRAM", v -> v + 1));
  }

  private static ArrayLoader xLoader() {
    return new ArrayLoader("X", ArrayBlock.generate(SHAPE, i -> i))
        .pattern("PROJECTION", new int[]{1}, new int[]{0});
  }

  private static double[] expected(IntToDoubleFunction f) {
    return ArrayBlock.generate(SHAPE, f).data();
  }

  @Test
  public void testTwoStageChain() throws Exception {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    PipelineOptions options = new PipelineOptions().withOutPath(tempDir);
    PipelineDriver driver = new PipelineDriver(options, new SingleRankCoordinator(), memory);

    RunReport report = driver.run(List.of(rawLoader()), chain());

    assertArrayEquals(expected(i -> 2 * i), memory.contents(report.dataset("scaled")).data());
    assertArrayEquals(expected(i -> 2 * i + 1), memory.contents(report.dataset("shifted")).data());
    assertArrayEquals(expected(i -> i), memory.contents(report.dataset("raw")).data());
    assertEquals(3, report.stage("scale").batchCount());
    assertEquals(1, report.stage("shift").batchCount());
    assertEquals(List.of("shifted"), report.stage("shift").kept());

    Path metadataFile = tempDir.resolve(PipelineOptions.DEFAULT_METADATA_FILE);
    assertTrue(Files.exists(metadataFile));
    PipelineMetadata written = new PipelineMetadataStore().read(metadataFile);
    assertEquals(report.metadata(), written);
    assertEquals(List.of(new PatternHandoff("scaled", "PROJECTION", "SINOGRAM")), written.currentAndNext(0));
    assertFalse(written.currentAndNext(1).get(0).isReadAgain());
  }

  @Test
  public void testTwoRanksMatchOneRank() throws Exception {
    InMemoryStorageBackend single = new InMemoryStorageBackend();
    RunReport reference = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), single)
        .run(List.of(rawLoader()), chain());

    InMemoryStorageBackend shared = new InMemoryStorageBackend();
    PipelineOptions options = new PipelineOptions().withOutPath(tempDir);
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(2);
    List<RunReport> reports = group.runOnAllRanks(
        coordinator -> new PipelineDriver(options, coordinator, shared).run(List.of(rawLoader()), chain()));

    for (String name : List.of("scaled", "shifted")) {
      assertArrayEquals(single.contents(reference.dataset(name)).data(),
          shared.contents(reports.get(0).dataset(name)).data(), name);
      assertEquals(reports.get(0).dataset(name), reports.get(1).dataset(name));
    }
    assertEquals(2, reports.get(0).stage("scale").batchesProcessed());
    assertEquals(1, reports.get(1).stage("scale").batchesProcessed());
    assertEquals(0, reports.get(1).stage("shift").batchesProcessed());
    assertEquals(reference.metadata(), new PipelineMetadataStore().read(options.metadataPath().orElseThrow()));
  }

  @Test
  public void testAlternatingPairKeepsPrimaryName() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    IncrementStage increment = new IncrementStage(3);

    RunReport report = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory)
        .run(List.of(xLoader()), List.of(increment));

    assertEquals(3, report.stage("increment").iterations());
    assertEquals(List.of(0, 1, 2), increment.iterationsSeen);
    assertEquals(List.of("Y_itr_clone"), report.stage("increment").removed());
    assertFalse(report.datasets().containsKey("Y_itr_clone"));
    assertArrayEquals(expected(i -> i + 3), memory.contents(report.dataset("Y")).data());
    assertArrayEquals(expected(i -> i), memory.contents(report.dataset("X")).data());
  }

  @Test
  public void testEvenIterationsLeaveLoadedInputIntact() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();

    for (int run = 0; run < 2; run++) {
      RunReport report = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory)
          .run(List.of(xLoader()), List.of(new IncrementStage(2)));

      assertArrayEquals(expected(i -> i + 2), memory.contents(report.dataset("Y")).data(), "run " + run);
      assertArrayEquals(expected(i -> i), memory.contents(report.dataset("X")).data(), "run " + run);
      assertEquals(List.of("Y"), report.stage("increment").kept());
    }
  }

  @Test
  public void testRestartFromCheckpoint() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    IncrementStage increment = new IncrementStage(3);
    PipelineDriver driver = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory);

    assertThrows(IllegalStateException.class, () -> driver.rerun(List.of(increment)));
    RunReport first = driver.run(List.of(xLoader()), List.of(increment));
    RunReport restarted = driver.rerun(List.of(increment));
    RunReport reloaded = driver.run(List.of(xLoader()), List.of(increment));

    for (RunReport report : List.of(first, restarted, reloaded)) {
      assertEquals(3, report.stage("increment").iterations());
      assertEquals(first.metadata(), report.metadata());
      assertArrayEquals(expected(i -> i + 3), memory.contents(report.dataset("Y")).data());
      assertArrayEquals(expected(i -> i), memory.contents(report.dataset("X")).data());
    }
    assertEquals(List.of(0, 1, 2, 0, 1, 2, 0, 1, 2), increment.iterationsSeen);
    assertEquals(List.of("X"), List.copyOf(driver.registry().inputNames()));
  }

  @Test
  public void testPreviewLimitsFrames() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    ArrayLoader loader = rawLoader().preview(Preview.of(SliceIndex.range(0, 6, 2), SliceIndex.full()));
    MapStage copy = new MapStage("copy", "raw", "even", "PROJECTION", v -> v);

    RunReport report = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory)
        .run(List.of(loader), List.of(copy));

    ArrayBlock even = memory.contents(report.dataset("even"));
    assertArrayEquals(new int[]{3, 4}, even.shape());
    assertArrayEquals(new double[]{0, 1, 2, 3, 8, 9, 10, 11, 16, 17, 18, 19}, even.data());
  }

  @Test
  public void testRemovedOutputIsDropped() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    MapStage scratch = new MapStage("scratch", "raw", "tmp", "PROJECTION", v -> -v).removeOutput();

    RunReport report = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory)
        .run(List.of(rawLoader()), List.of(scratch));

    assertEquals(List.of("tmp"), report.stage("scratch").removed());
    assertFalse(report.datasets().containsKey("tmp"));
    assertEquals(1, scratch.executed().size());
  }

  @Test
  public void testUnequalBatchCounts() {
    InMemoryStorageBackend memory = new InMemoryStorageBackend();
    ArrayLoader other = new ArrayLoader("other", ArrayBlock.generate(new int[]{5, 4}, i -> i))
        .pattern("PROJECTION", new int[]{1}, new int[]{0});
    Stage pairwise = new Stage() {
      @Override
      public String name() {
        return "pairwise";
      }

      @Override
      public void setup(PipelineContext context) {
        context.createOutput("sum", context.input("raw"));
      }

      @Override
      public StageBindings bindings() {
        return StageBindings.builder().in("raw", "PROJECTION").in("other", "PROJECTION").out("sum", "PROJECTION").build();
      }

      @Override
      public int maxBatchSize() {
        return 1;
      }

      @Override
      public Map<String, ArrayBlock> execute(StageFrames frames) {
        return Map.of("sum", frames.input(0));
      }
    };
    PipelineDriver driver = new PipelineDriver(new PipelineOptions(), new SingleRankCoordinator(), memory);

    ShapeMismatchException thrown = assertThrows(ShapeMismatchException.class,
        () -> driver.run(List.<Loader>of(rawLoader(), other), List.of(pairwise)));
    assertTrue(thrown.getMessage().contains("other"), thrown.getMessage());
  }

  /// Adds one per iteration. The first iteration reads X into Y, later ones alternate between
  /// Y and its buffer.
  private static class IncrementStage implements Stage {
    private final IterationController controller = new IterationController();
    private final List<Integer> iterationsSeen = new CopyOnWriteArrayList<>();

    IncrementStage(int iterations) {
      controller.setIterations(iterations);
      controller.setIterationDatasets(1, List.of("Y"), List.of("Y_itr_clone"));
      controller.setAlternatingDatasets("Y", "Y_itr_clone");
    }

    @Override
    public String name() {
      return "increment";
    }

    @Override
    public void setup(PipelineContext context) {
      context.createOutput("Y", context.input("X"));
      context.createOutput("Y_itr_clone", context.input("X"));
    }

    @Override
    public StageBindings bindings() {
      return StageBindings.builder().in("X", "PROJECTION").out("Y", "PROJECTION").build();
    }

    @Override
    public void preProcess(PipelineContext context) {
      iterationsSeen.add(context.iteration());
    }

    @Override
    public Map<String, ArrayBlock> execute(StageFrames frames) {
      String output = frames.outputName(0);
      return Map.of(output, frames.input(0).map(v -> v + 1));
    }

    @Override
    public Optional<IterationController> iterations() {
      return Optional.of(controller);
    }
  }
}
