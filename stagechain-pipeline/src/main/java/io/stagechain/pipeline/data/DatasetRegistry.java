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



import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// Owns the input and output datasets of a run and moves datasets between them as stages
/// complete.
///
/// Inputs are what the active stage reads; outputs are what it creates. Between stages
/// outputs flow into inputs:
/// - {@link #merge()} during the setup pass, sharing the output objects;
/// - {@link #finalizeStage()} and {@link #reorganise(StageTransition)} after a stage has
///   executed, copying survivors into new arena entries.
///
/// A checkpoint taken after loading lets the driver restore the loaded inputs between the
/// setup and execution passes and after the run.
public class DatasetRegistry {
  private static final Logger logger = LogManager.getLogger(DatasetRegistry.class);

  /// Marker in the names of the internal buffers of iterative stages
  public static final String ITERATION_CLONE = "itr_clone";

  private final DatasetStore store;
  private Map<String, DatasetHandle> inputs = new LinkedHashMap<>();
  private Map<String, DatasetHandle> outputs = new LinkedHashMap<>();
  private Map<String, DatasetHandle> checkpoint;
  private final List<Dataset> pendingRemovals = new ArrayList<>();
  private String activeStage = "loader";

  public DatasetRegistry() {
    this(new DatasetStore());
  }

  public DatasetRegistry(DatasetStore store) {
    this.store = store;
  }

  public DatasetStore store() {
    return store;
  }

  /// Names the stage that creates datasets from now on, for diagnostics.
  public void beginStage(String stageName) {
    this.activeStage = stageName;
  }

  public String activeStage() {
    return activeStage;
  }

  /// Creates an input dataset, as a loader does.
  /// @throws DuplicateDatasetException if an input of that name exists
  public Dataset createInput(String name, int[] shape, String dtype) {
    if (inputs.containsKey(name)) {
      throw new DuplicateDatasetException(name, activeStage);
    }
    Dataset dataset = new Dataset(name, shape, dtype);
    inputs.put(name, store.add(dataset));
    return dataset;
  }

  /// Creates an output dataset of the active stage.
  /// @throws DuplicateDatasetException if the stage has already created an output of that name
  public Dataset createOutput(String name, int[] shape, String dtype) {
    if (outputs.containsKey(name)) {
      throw new DuplicateDatasetException(name, activeStage);
    }
    Dataset dataset = new Dataset(name, shape, dtype);
    outputs.put(name, store.add(dataset));
    return dataset;
  }

  public boolean hasInput(String name) {
    return inputs.containsKey(name);
  }

  public boolean hasOutput(String name) {
    return outputs.containsKey(name);
  }

  public Dataset input(String name) {
    DatasetHandle handle = inputs.get(name);
    if (handle == null) {
      throw new UnknownDatasetException(name, "input", inputs.keySet());
    }
    return store.get(handle);
  }

  public Dataset output(String name) {
    DatasetHandle handle = outputs.get(name);
    if (handle == null) {
      throw new UnknownDatasetException(name, "output", outputs.keySet());
    }
    return store.get(handle);
  }

  /// Looks a dataset up among the outputs, then the inputs.
  public Optional<Dataset> find(String name) {
    DatasetHandle handle = outputs.getOrDefault(name, inputs.get(name));
    return Optional.ofNullable(handle).map(store::get);
  }

  @NotNull
  public Dataset resolve(String name) {
    return find(name).orElseThrow(() -> new UnknownDatasetException(name, "registered",
        List.of("inputs=" + inputs.keySet(), "outputs=" + outputs.keySet())));
  }

  public Set<String> inputNames() {
    return Collections.unmodifiableSet(inputs.keySet());
  }

  public Set<String> outputNames() {
    return Collections.unmodifiableSet(outputs.keySet());
  }

  public List<Dataset> inputs() {
    return inputs.values().stream().map(store::get).collect(Collectors.toList());
  }

  public List<Dataset> outputs() {
    return outputs.values().stream().map(store::get).collect(Collectors.toList());
  }

  /// @return the names of all input datasets except the internal buffers of iterative stages
  public List<String> allDatasetNames() {
    return inputs.keySet().stream().filter(n -> !n.contains(ITERATION_CLONE)).collect(Collectors.toList());
  }

  /// Moves the outputs not marked for removal into the inputs, overwriting inputs of the
  /// same name, and clears the outputs. Used between stages of the setup pass.
  public void merge() {
    outputs.forEach((name, handle) -> {
      if (!store.get(handle).isRemove()) {
        inputs.put(name, handle);
      }
    });
    outputs = new LinkedHashMap<>();
  }

  /// Files every output of the finished stage under remove or keep, and lists the inputs
  /// the kept outputs will replace.
  /// @return the transition to apply with {@link #reorganise(StageTransition)}
  public StageTransition finalizeStage() {
    List<Dataset> remove = new ArrayList<>(pendingRemovals);
    List<Dataset> keep = new ArrayList<>();
    for (DatasetHandle handle : outputs.values()) {
      Dataset dataset = store.get(handle);
      (dataset.isRemove() ? remove : keep).add(dataset);
    }
    List<Dataset> replace = new ArrayList<>();
    for (String name : outputs.keySet()) {
      if (inputs.containsKey(name)) {
        replace.add(store.get(inputs.get(name)));
      }
    }
    pendingRemovals.clear();
    StageTransition transition = new StageTransition(remove, keep, replace);
    logger.debug("stage {} finalized: {}", activeStage, transition);
    return transition;
  }

  /// Applies a stage transition. Replicated inputs are reset to their source form, removed
  /// datasets are dropped, and surviving outputs are copied into the inputs with their
  /// previews cleared. The outputs are empty afterwards.
  public void reorganise(StageTransition transition) {
    for (Dataset input : inputs()) {
      if (input.unreplicate()) {
        logger.debug("unreplicated {}", input.name());
      }
    }
    for (Dataset removed : transition.remove()) {
      dropIfSame(outputs, removed);
      dropIfSame(inputs, removed);
    }
    outputs.forEach((name, handle) -> {
      Dataset survivor = store.get(handle).copy();
      survivor.clearPreview();
      inputs.put(name, store.add(survivor));
    });
    outputs = new LinkedHashMap<>();
  }

  private void dropIfSame(Map<String, DatasetHandle> index, Dataset dataset) {
    DatasetHandle handle = index.get(dataset.name());
    if (handle != null && store.get(handle) == dataset) {
      index.remove(dataset.name());
    }
  }

  /// Settles an alternating pair of an iterative stage. The obsolete member is marked for
  /// removal and leaves the outputs; the survivor takes the pair's final name.
  /// @param survivor the current name of the member that holds the final result
  /// @param obsolete the current name of the other member
  /// @param finalName the name the result continues under
  public void resolveAlternatingPair(String survivor, String obsolete, String finalName) {
    Dataset discarded = resolve(obsolete);
    Dataset kept = resolve(survivor);
    discarded.setRemove(true);
    pendingRemovals.add(discarded);
    dropIfSame(outputs, discarded);

    if (!kept.name().equals(finalName)) {
      boolean wasOutput = outputs.containsKey(survivor);
      Map<String, DatasetHandle> index = wasOutput ? outputs : inputs;
      DatasetHandle handle = index.remove(survivor);
      kept.setName(finalName);
      index.put(finalName, handle);
    }
    logger.debug("alternating pair settled: {} continues as {}, {} removed", survivor, finalName, obsolete);
  }

  /// Saves the current inputs. Later changes to the inputs do not affect the checkpoint.
  public void checkpoint() {
    checkpoint = copyAll(inputs);
    logger.debug("checkpoint of {} inputs", checkpoint.size());
  }

  public boolean hasCheckpoint() {
    return checkpoint != null;
  }

  /// Forgets every input, output and the checkpoint, as before loading.
  public void clear() {
    inputs = new LinkedHashMap<>();
    outputs = new LinkedHashMap<>();
    checkpoint = null;
    pendingRemovals.clear();
  }

  /// Restores the inputs saved by {@link #checkpoint()} and clears the outputs.
  public void resetToCheckpoint() {
    if (checkpoint == null) {
      throw new IllegalStateException("No checkpoint has been taken");
    }
    inputs = copyAll(checkpoint);
    outputs = new LinkedHashMap<>();
    pendingRemovals.clear();
  }

  private Map<String, DatasetHandle> copyAll(Map<String, DatasetHandle> source) {
    Map<String, DatasetHandle> copies = new LinkedHashMap<>();
    source.forEach((name, handle) -> copies.put(name, store.add(store.get(handle).copy())));
    return copies;
  }

  /// @return the current outputs, to be re-enrolled by {@link #enrollOutputs(Map)}
  public Map<String, DatasetHandle> snapshotOutputs() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  public void enrollOutputs(Map<String, DatasetHandle> snapshot) {
    outputs = new LinkedHashMap<>(snapshot);
  }

  /// Logs the shapes of all inputs and outputs at debug level.
  public void log(String tag) {
    log(tag, Level.DEBUG);
  }

  public void log(String tag, Level level) {
    if (!logger.isEnabled(level)) {
      return;
    }
    logger.log(level, "datasets for {}", tag);
    inputs.forEach((name, handle) -> logger.log(level, "in data ({}) shape = {} patterns = {}",
        name, Arrays.toString(store.get(handle).viewShape()), patternNames(store.get(handle))));
    outputs.forEach((name, handle) -> logger.log(level, "out data ({}) shape = {} patterns = {}",
        name, Arrays.toString(store.get(handle).viewShape()), patternNames(store.get(handle))));
  }

  private static Set<String> patternNames(Dataset dataset) {
    return dataset.patterns().keySet();
  }
}
