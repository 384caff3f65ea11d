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
import io.stagechain.pipeline.data.Dataset;
import io.stagechain.pipeline.data.DatasetHandle;
import io.stagechain.pipeline.data.DatasetRegistry;
import io.stagechain.pipeline.data.Preview;
import io.stagechain.pipeline.data.ShapeMismatchException;
import io.stagechain.pipeline.data.SlicingStrategies;
import io.stagechain.pipeline.data.SlicingStrategy;
import io.stagechain.pipeline.data.StageTransition;
import io.stagechain.pipeline.metadata.DatasetUsage;
import io.stagechain.pipeline.metadata.PipelineMetadata;
import io.stagechain.pipeline.metadata.PipelineMetadataStore;
import io.stagechain.pipeline.metadata.StageEntry;
import io.stagechain.pipeline.stage.DatasetBinding;
import io.stagechain.pipeline.stage.IterationController;
import io.stagechain.pipeline.stage.Loader;
import io.stagechain.pipeline.stage.PipelineContext;
import io.stagechain.pipeline.stage.Stage;
import io.stagechain.pipeline.stage.StageBindings;
import io.stagechain.pipeline.stage.StageFrames;
import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.pipeline.storage.StorageBackend;
import io.stagechain.pipeline.storage.StorageHandle;
import io.stagechain.pipeline.storage.StorageRequest;
import io.stagechain.pipeline.topology.Coordinator;
import io.stagechain.slicing.InvalidPatternException;
import io.stagechain.slicing.PatternDescriptor;
import io.stagechain.slicing.RankShare;
import io.stagechain.slicing.RunGrouper;
import io.stagechain.slicing.SliceEnumerator;
import io.stagechain.slicing.WorkBatch;
import io.stagechain.slicing.WorkDistributor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// Runs a chain of stages on one rank.
///
/// A run has four phases:
/// 1. the loaders create the input datasets, which are checkpointed, and all ranks wait
///    for the layout to be fixed;
/// 2. the setup pass sets up every stage, resolves its patterns, snapshots its outputs and
///    merges them into the inputs of the next stage;
/// 3. the resolved stage list is committed as pipeline metadata and the inputs are reset to
///    the checkpoint;
/// 4. the execution pass re-enrolls each stage's outputs, runs this rank's share of the
///    batches, and finalizes the stage.
///
/// After the chain the inputs are reset to the checkpoint again, so {@link #rerun(List)} can
/// restart the chain without reloading.
public class PipelineDriver {
  private static final Logger logger = LogManager.getLogger(PipelineDriver.class);

  private final PipelineOptions options;
  private final Coordinator coordinator;
  private final StorageBackend storage;
  private final DatasetRegistry registry;
  private final PipelineMetadataStore metadataStore = new PipelineMetadataStore();
  private final SliceEnumerator enumerator = new SliceEnumerator();
  private final RunGrouper grouper = new RunGrouper();
  private final WorkDistributor distributor = new WorkDistributor();

  public PipelineDriver(PipelineOptions options, Coordinator coordinator, StorageBackend storage) {
    this(options, coordinator, storage, new DatasetRegistry());
  }

  public PipelineDriver(PipelineOptions options, Coordinator coordinator, StorageBackend storage,
                        DatasetRegistry registry) {
    this.options = options;
    this.coordinator = coordinator;
    this.storage = storage;
    this.registry = registry;
  }

  public DatasetRegistry registry() {
    return registry;
  }

  /// Loads the inputs afresh and runs the chain. Datasets left from an earlier run are
  /// discarded first.
  public RunReport run(List<Loader> loaders, List<Stage> stages) {
    logger.info("rank {} of {} running {} loaders and {} stages",
        coordinator.rank(), coordinator.totalRanks(), loaders.size(), stages.size());
    registry.clear();
    load(loaders);
    return runChain(stages);
  }

  /// Runs a chain again on the inputs checkpointed by the last {@link #run(List, List)},
  /// without calling the loaders.
  /// @throws IllegalStateException if nothing has been loaded yet
  public RunReport rerun(List<Stage> stages) {
    if (!registry.hasCheckpoint()) {
      throw new IllegalStateException("Nothing has been loaded on rank " + coordinator.rank() + ", run the loaders first");
    }
    logger.info("rank {} of {} restarting {} stages from the loader checkpoint",
        coordinator.rank(), coordinator.totalRanks(), stages.size());
    registry.resetToCheckpoint();
    coordinator.awaitLayoutFixed();
    return runChain(stages);
  }

  private RunReport runChain(List<Stage> stages) {
    List<Map<String, DatasetHandle>> outputPlan = new ArrayList<>();
    PipelineMetadata metadata = setupPass(stages, outputPlan);
    commit(metadata);
    registry.resetToCheckpoint();

    List<StageReport> reports = new ArrayList<>();
    for (int i = 0; i < stages.size(); i++) {
      reports.add(execute(i, stages.get(i), outputPlan.get(i)));
    }
    Map<String, StorageHandle> finalDatasets = new LinkedHashMap<>();
    registry.inputs().stream().filter(Dataset::hasStorage).forEach(d -> finalDatasets.put(d.name(), d.storage()));

    registry.resetToCheckpoint();
    logger.info("rank {} finished {} stages", coordinator.rank(), stages.size());
    return new RunReport(coordinator.rank(), metadata, reports, finalDatasets);
  }

  private void load(List<Loader> loaders) {
    for (Loader loader : loaders) {
      registry.beginStage(loader.name());
      loader.load(context(-1, loader.name(), null));
    }
    registry.checkpoint();
    registry.log("loaders");
    coordinator.awaitLayoutFixed();
  }

  private PipelineMetadata setupPass(List<Stage> stages, List<Map<String, DatasetHandle>> outputPlan) {
    List<StageEntry> entries = new ArrayList<>();
    for (int i = 0; i < stages.size(); i++) {
      Stage stage = stages.get(i);
      registry.beginStage(stage.name());
      Map<Dataset, Optional<Preview>> previews = new LinkedHashMap<>();
      registry.inputs().forEach(d -> previews.put(d, d.preview()));

      logger.debug("setting up stage {}: {}", i, stage.name());
      stage.setup(context(i, stage.name(), stage.iterations().orElse(null)));
      entries.add(resolve(i, stage.name(), stage.bindings()));
      outputPlan.add(registry.snapshotOutputs());

      previews.forEach((dataset, preview) -> {
        if (preview.isPresent()) {
          dataset.setPreview(preview.get());
        } else {
          dataset.clearPreview();
        }
      });
      registry.merge();
    }
    return new PipelineMetadata(entries);
  }

  private StageEntry resolve(int index, String stageName, StageBindings bindings) {
    List<DatasetUsage> in = new ArrayList<>();
    for (DatasetBinding binding : bindings.inputs()) {
      in.add(DatasetUsage.of(binding.name(), resolvePattern(binding)));
    }
    List<DatasetUsage> out = new ArrayList<>();
    for (DatasetBinding binding : bindings.outputs()) {
      out.add(DatasetUsage.of(binding.name(), resolvePattern(binding)));
    }
    return new StageEntry(index, stageName, in, out);
  }

  private PatternDescriptor resolvePattern(DatasetBinding binding) {
    Dataset dataset = registry.resolve(binding.name());
    PatternDescriptor pattern = dataset.pattern(binding.patternName());
    if (!pattern.fitsRank(dataset.viewRank())) {
      throw new ShapeMismatchException(dataset.name(), pattern.name(),
          "pattern does not cover the " + dataset.viewRank() + " dimensions of the dataset");
    }
    if (pattern.coreDimensions().length == 0) {
      throw new InvalidPatternException(pattern.name(), dataset.name(), "a pattern needs at least one core dimension");
    }
    dataset.setCurrentPattern(pattern.name());
    return pattern;
  }

  private void commit(PipelineMetadata metadata) {
    Optional<Path> target = options.metadataPath();
    coordinator.commitPipelineMetadata(() -> {
      if (target.isPresent()) {
        metadataStore.write(target.get(), metadata);
      } else {
        logger.debug("no output path set, pipeline metadata is not persisted");
      }
    });
  }

  private StageReport execute(int index, Stage stage, Map<String, DatasetHandle> outputs) {
    logger.info("rank {} executing stage {}: {}", coordinator.rank(), index, stage.name());
    registry.beginStage(stage.name());
    registry.enrollOutputs(outputs);
    for (Dataset output : registry.outputs()) {
      if (!output.hasStorage()) {
        output.attachStorage(storage.allocate(
            new StorageRequest(output.name(), output.shape(), output.dtype(), index, stage.name())));
      }
    }

    IterationController iterations = stage.iterations().orElse(null);
    PipelineContext context = context(index, stage.name(), iterations);
    StageBindings declared = stage.bindings();
    int processed = 0;
    int batchCount = 0;
    int iteration = 0;
    if (iterations != null) {
      iterations.reset();
    }
    do {
      StageBindings current = iterations == null ? declared : iterations.bindingsFor(declared);
      stage.preProcess(context);
      List<Bound> bound = bind(stage, current);
      batchCount = bound.isEmpty() ? 0 : bound.get(0).batches.size();
      processed += executeShare(stage, bound, batchCount, iteration);
      stage.postProcess(context);
      coordinator.awaitStageComplete(stage.name());
      iteration++;
      if (iterations != null) {
        iterations.endIteration();
      }
    } while (iterations != null && !iterations.isComplete());

    if (iterations != null) {
      iterations.resolvePairs().forEach(r -> registry.resolveAlternatingPair(r.survivor(), r.obsolete(), r.finalName()));
    }
    StageTransition transition = registry.finalizeStage();
    registry.reorganise(transition);
    registry.log(stage.name());
    return new StageReport(index, stage.name(), iteration, processed, batchCount,
        StageTransition.names(transition.keep()), StageTransition.names(transition.remove()));
  }

  /// Groups the frames of every binding. All bindings must yield the same number of batches,
  /// since batch `i` of each is processed together.
  private List<Bound> bind(Stage stage, StageBindings bindings) {
    int maxBatch = stage.maxBatchSize() > 0 ? stage.maxBatchSize() : options.defaultMaxFrames();
    List<Bound> bound = new ArrayList<>();
    for (DatasetBinding binding : bindings.inputs()) {
      bound.add(new Bound(binding, true, maxBatch));
    }
    for (DatasetBinding binding : bindings.outputs()) {
      bound.add(new Bound(binding, false, maxBatch));
    }
    for (Bound b : bound) {
      Bound first = bound.get(0);
      if (b.batches.size() != first.batches.size()) {
        throw new ShapeMismatchException(b.dataset.name(), b.binding.patternName(), "yields " + b.batches.size()
            + " batches where " + first.dataset.name() + " yields " + first.batches.size());
      }
    }
    return bound;
  }

  private int executeShare(Stage stage, List<Bound> bound, int batchCount, int iteration) {
    List<Integer> order = IntStream.range(0, batchCount).boxed().collect(Collectors.toList());
    RankShare<Integer> share = distributor.distribute(order, coordinator.rank(), coordinator.totalRanks());
    logger.debug("rank {} runs {} of stage {}", coordinator.rank(), share, stage.name());

    for (int batchIndex : share.batches()) {
      Map<String, ArrayBlock> inputs = new LinkedHashMap<>();
      Map<String, WorkBatch> inputBatches = new LinkedHashMap<>();
      Map<String, WorkBatch> outputBatches = new LinkedHashMap<>();
      Map<String, int[]> outputShapes = new LinkedHashMap<>();
      for (Bound b : bound) {
        WorkBatch batch = b.batches.get(batchIndex);
        if (b.input) {
          inputBatches.put(b.dataset.name(), batch);
          inputs.put(b.dataset.name(), b.strategy.read(b.dataset, batch.slice(), storage));
        } else {
          outputBatches.put(b.dataset.name(), batch);
          outputShapes.put(b.dataset.name(), batch.slice().blockShape(b.dataset.viewShape()));
        }
      }

      Map<String, ArrayBlock> produced = stage.execute(
          new StageFrames(batchIndex, batchCount, iteration, inputs, inputBatches, outputBatches, outputShapes));

      for (Bound b : bound) {
        if (b.input) {
          continue;
        }
        ArrayBlock block = produced.get(b.dataset.name());
        if (block == null) {
          throw new IllegalStateException(String.format("Stage %s produced no block for output %s in batch %d",
              stage.name(), b.dataset.name(), batchIndex));
        }
        b.strategy.write(b.dataset, outputBatches.get(b.dataset.name()).slice(), block, storage);
      }
    }
    return share.size();
  }

  private PipelineContext context(int index, String name, IterationController iterations) {
    return new PipelineContext(registry, options, coordinator, storage, index, name, iterations);
  }

  /// One binding of the current iteration with its grouped batches.
  private class Bound {
    private final DatasetBinding binding;
    private final boolean input;
    private final Dataset dataset;
    private final SlicingStrategy strategy;
    private final List<WorkBatch> batches;

    private Bound(DatasetBinding binding, boolean input, int maxBatch) {
      this.binding = binding;
      this.input = input;
      this.dataset = registry.resolve(binding.name());
      PatternDescriptor pattern = resolvePattern(binding);
      this.strategy = SlicingStrategies.forDataset(dataset);
      this.batches = grouper.group(strategy.frames(dataset, pattern, enumerator), maxBatch);
    }
  }
}
