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



import io.stagechain.pipeline.storage.StorageHandle;
import io.stagechain.slicing.InvalidPatternException;
import io.stagechain.slicing.PatternDescriptor;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A named, shaped, typed N-dimensional array together with the patterns it can be
/// sliced by.
///
/// The storage shape is fixed at construction. What slicing sees, the view shape, may
/// differ: a {@link Preview} narrows it and replication adds a leading replica axis.
/// Patterns are always declared against the view shape.
///
/// Datasets are mutable and owned by a {@link DatasetRegistry}; {@link #copy()} produces a
/// new dataset sharing the same storage.
public class Dataset {
  private String name;
  private final int[] shape;
  private final String dtype;
  private Map<String, PatternDescriptor> patterns = new LinkedHashMap<>();
  private String currentPattern;
  private boolean remove;
  private DataKind kind = DataKind.STANDARD;
  private Preview preview;
  private StorageHandle storage;

  private int imageKeyDimension = -1;
  private int[] imageKeys;

  private int replicas;
  private DataKind sourceKind;
  private Map<String, PatternDescriptor> sourcePatterns;

  public Dataset(String name, int[] shape, String dtype) {
    this.name = Objects.requireNonNull(name, "name");
    for (int extent : shape) {
      if (extent <= 0) {
        throw new IllegalArgumentException(
            "Dataset " + name + " needs positive extents: " + Arrays.toString(shape));
      }
    }
    this.shape = shape.clone();
    this.dtype = Objects.requireNonNull(dtype, "dtype");
  }

  public String name() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  /// @return the shape of the backing storage
  public int[] shape() {
    return shape.clone();
  }

  /// @return the shape slicing sees, after the preview and any replica axis
  public int[] viewShape() {
    int[] previewed = preview == null ? shape.clone() : preview.shape(shape);
    if (kind != DataKind.REPLICATED) {
      return previewed;
    }
    int[] replicated = new int[previewed.length + 1];
    replicated[0] = replicas;
    System.arraycopy(previewed, 0, replicated, 1, previewed.length);
    return replicated;
  }

  public int viewRank() {
    return shape.length + (kind == DataKind.REPLICATED ? 1 : 0);
  }

  public String dtype() {
    return dtype;
  }

  public DataKind kind() {
    return kind;
  }

  /// Declares a pattern.
  /// @throws ShapeMismatchException if the pattern does not assign every view dimension exactly once
  public Dataset addPattern(PatternDescriptor pattern) {
    if (!pattern.fitsRank(viewRank())) {
      throw new ShapeMismatchException(name, pattern.name(), "pattern " + pattern
          + " does not cover the " + viewRank() + " dimensions of shape " + Arrays.toString(viewShape()));
    }
    patterns.put(pattern.name(), pattern);
    return this;
  }

  public Dataset addPattern(String patternName, int[] core, int[] slice) {
    return addPattern(new PatternDescriptor(patternName, core, slice));
  }

  public Map<String, PatternDescriptor> patterns() {
    return Collections.unmodifiableMap(patterns);
  }

  public boolean hasPattern(String patternName) {
    return patterns.containsKey(patternName);
  }

  /// @throws InvalidPatternException if the pattern is not declared on this dataset
  public PatternDescriptor pattern(String patternName) {
    PatternDescriptor pattern = patterns.get(patternName);
    if (pattern == null) {
      throw new InvalidPatternException(patternName, name,
          "pattern is not declared; declared patterns are " + patterns.keySet());
    }
    return pattern;
  }

  /// Selects the active pattern.
  /// @throws InvalidPatternException if the pattern is not declared on this dataset
  public void setCurrentPattern(String patternName) {
    pattern(patternName);
    this.currentPattern = patternName;
  }

  public Optional<PatternDescriptor> currentPattern() {
    return Optional.ofNullable(currentPattern).map(patterns::get);
  }

  public boolean isRemove() {
    return remove;
  }

  /// Marks this dataset for removal when the producing stage finalizes.
  public void setRemove(boolean remove) {
    this.remove = remove;
  }

  public Optional<Preview> preview() {
    return Optional.ofNullable(preview);
  }

  /// @throws IllegalArgumentException if the preview does not fit the storage shape
  public void setPreview(Preview preview) {
    preview.shape(shape);
    this.preview = preview;
  }

  public void clearPreview() {
    this.preview = null;
  }

  public boolean hasStorage() {
    return storage != null;
  }

  public StorageHandle storage() {
    if (storage == null) {
      throw new IllegalStateException("Dataset " + name + " has no storage allocated");
    }
    return storage;
  }

  /// Attaches the backing array. The array shape must equal the dataset shape.
  public void attachStorage(StorageHandle handle) {
    if (!Arrays.equals(handle.shape(), shape)) {
      throw new ShapeMismatchException(name, String.valueOf(currentPattern), "storage shape "
          + Arrays.toString(handle.shape()) + " differs from dataset shape " + Arrays.toString(shape));
    }
    if (storage != null && !storage.equals(handle)) {
      throw new IllegalStateException("Dataset " + name + " is already backed by " + storage);
    }
    this.storage = handle;
  }

  /// Tags the frames of a raw dataset along one dimension. A key of 0 marks a projection,
  /// 1 a flat field and 2 a dark field. Tagging makes this a {@link DataKind#RAW} dataset.
  /// @param dimension the storage dimension the keys run along
  /// @param keys one key per index of that dimension
  public void setImageKey(int dimension, int[] keys) {
    if (dimension < 0 || dimension >= shape.length || keys.length != shape[dimension]) {
      throw new IllegalArgumentException("Image key of length " + keys.length + " does not fit dimension "
          + dimension + " of " + name + Arrays.toString(shape));
    }
    this.imageKeyDimension = dimension;
    this.imageKeys = keys.clone();
    this.kind = DataKind.RAW;
  }

  /// @return the storage dimension the image key runs along, or -1 when there is none
  public int imageKeyDimension() {
    return imageKeyDimension;
  }

  public int imageKey(int index) {
    if (imageKeys == null) {
      throw new IllegalStateException("Dataset " + name + " has no image key");
    }
    return imageKeys[index];
  }

  /// Repeats this dataset virtually `count` times along a new leading axis. Declared
  /// patterns move up one dimension and gain the replica axis as a slice dimension.
  public void replicate(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Replica count must be positive: " + count);
    }
    if (kind == DataKind.REPLICATED) {
      throw new IllegalStateException("Dataset " + name + " is already replicated");
    }
    sourceKind = kind;
    sourcePatterns = patterns;
    patterns = new LinkedHashMap<>();
    sourcePatterns.values().forEach(p -> patterns.put(p.name(), p.withLeadingReplicaAxis()));
    replicas = count;
    kind = DataKind.REPLICATED;
  }

  /// Resets a replicated dataset to its source form. Patterns that only fit the replicated
  /// view are dropped.
  /// @return true if the dataset was replicated
  public boolean unreplicate() {
    if (kind != DataKind.REPLICATED) {
      return false;
    }
    Map<String, PatternDescriptor> restored = new LinkedHashMap<>(sourcePatterns);
    patterns.values().stream().filter(p -> p.fitsRank(shape.length)).forEach(p -> restored.putIfAbsent(p.name(), p));
    patterns = restored;
    kind = sourceKind;
    replicas = 0;
    sourceKind = null;
    sourcePatterns = null;
    if (currentPattern != null && !patterns.containsKey(currentPattern)) {
      currentPattern = null;
    }
    return true;
  }

  /// @return the number of replicas, 0 when not replicated
  public int replicas() {
    return replicas;
  }

  /// @return a new dataset with the same state, sharing this dataset's storage
  public Dataset copy() {
    Dataset copy = new Dataset(name, shape, dtype);
    copy.patterns = new LinkedHashMap<>(patterns);
    copy.currentPattern = currentPattern;
    copy.remove = remove;
    copy.kind = kind;
    copy.preview = preview;
    copy.storage = storage;
    copy.imageKeyDimension = imageKeyDimension;
    copy.imageKeys = imageKeys;
    copy.replicas = replicas;
    copy.sourceKind = sourceKind;
    copy.sourcePatterns = sourcePatterns == null ? null : new LinkedHashMap<>(sourcePatterns);
    return copy;
  }

  @Override
  public String toString() {
    return "Dataset{" + name + Arrays.toString(shape) + " " + dtype + ", " + kind
        + (currentPattern == null ? "" : ", pattern=" + currentPattern)
        + (remove ? ", remove" : "") + "}";
  }
}
