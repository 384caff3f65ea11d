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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Describes how the axes of a dataset are classified under one named pattern.
///
/// A pattern such as `PROJECTION` or `SINOGRAM` assigns each dimension either the
/// {@link DimensionRole#CORE} role (always read whole) or the {@link DimensionRole#SLICE}
/// role (divided into frames). The descriptor is pure data; {@link #validate(int)} checks it
/// against a concrete rank.
///
/// Patterns may be described in YAML form:
/// ```yaml
/// SINOGRAM:
///   core: [0, 2]
///   slice: [1]
/// ```
public class PatternDescriptor {
  /// The pattern name, unique within a dataset
  private final String name;
  /// Dimensions that are always included whole
  private final int[] coreDimensions;
  /// Dimensions that may be divided, in declaration order
  private final int[] sliceDimensions;

  /// Creates a pattern descriptor.
  /// @param name The pattern name
  /// @param coreDimensions The dimensions processed whole
  /// @param sliceDimensions The dimensions which may be divided into frames
  public PatternDescriptor(String name, int[] coreDimensions, int[] sliceDimensions) {
    this.name = Objects.requireNonNull(name, "pattern name");
    this.coreDimensions = Objects.requireNonNull(coreDimensions, "core dimensions").clone();
    this.sliceDimensions = Objects.requireNonNull(sliceDimensions, "slice dimensions").clone();
  }

  public String name() {
    return name;
  }

  public int[] coreDimensions() {
    return coreDimensions.clone();
  }

  public int[] sliceDimensions() {
    return sliceDimensions.clone();
  }

  /// @return the number of dimensions this pattern assigns a role to
  public int rank() {
    return coreDimensions.length + sliceDimensions.length;
  }

  /// The main dimension is the first declared slice dimension, the direction
  /// frames advance along when the pattern is read.
  /// @return the main dimension, or -1 if the pattern has no slice dimension
  public int mainDimension() {
    return sliceDimensions.length == 0 ? -1 : sliceDimensions[0];
  }

  /// @param dimension a dimension index
  /// @return the role of the dimension
  /// @throws InvalidPatternException if the dimension has no role under this pattern
  public DimensionRole roleOf(int dimension) {
    for (int core : coreDimensions) {
      if (core == dimension) {
        return DimensionRole.CORE;
      }
    }
    for (int slice : sliceDimensions) {
      if (slice == dimension) {
        return DimensionRole.SLICE;
      }
    }
    throw new InvalidPatternException(name, "dimension " + dimension + " has no role");
  }

  /// @return true if this pattern assigns exactly the dimensions `0..rank-1`, each once
  public boolean fitsRank(int rank) {
    if (rank() != rank) {
      return false;
    }
    boolean[] seen = new boolean[rank];
    for (int dim : allDimensions()) {
      if (dim < 0 || dim >= rank || seen[dim]) {
        return false;
      }
      seen[dim] = true;
    }
    return true;
  }

  /// Checks this pattern for use in the slicing engine against a dataset of the given rank.
  /// @param rank the dataset rank
  /// @throws InvalidPatternException if there is no core dimension, a dimension is out of
  ///     range, assigned twice, or left unassigned
  public void validate(int rank) {
    if (coreDimensions.length == 0) {
      throw new InvalidPatternException(name, "a pattern needs at least one core dimension");
    }
    boolean[] seen = new boolean[rank];
    for (int dim : allDimensions()) {
      if (dim < 0 || dim >= rank) {
        throw new InvalidPatternException(name, "dimension " + dim + " is outside [0, " + rank + ")");
      }
      if (seen[dim]) {
        throw new InvalidPatternException(name, "dimension " + dim + " is assigned more than one role");
      }
      seen[dim] = true;
    }
    for (int dim = 0; dim < rank; dim++) {
      if (!seen[dim]) {
        throw new InvalidPatternException(name, "dimension " + dim + " has no role");
      }
    }
  }

  /// Returns this pattern as seen through a new leading replica axis. Every dimension moves
  /// up by one and the replica axis becomes an additional slice dimension.
  /// @return the shifted pattern
  public PatternDescriptor withLeadingReplicaAxis() {
    int[] core = Arrays.stream(coreDimensions).map(d -> d + 1).toArray();
    int[] slice = new int[sliceDimensions.length + 1];
    for (int i = 0; i < sliceDimensions.length; i++) {
      slice[i] = sliceDimensions[i] + 1;
    }
    slice[sliceDimensions.length] = 0;
    return new PatternDescriptor(name, core, slice);
  }

  private int[] allDimensions() {
    int[] all = Arrays.copyOf(coreDimensions, rank());
    System.arraycopy(sliceDimensions, 0, all, coreDimensions.length, sliceDimensions.length);
    return all;
  }

  /// Creates a PatternDescriptor from loaded YAML or JSON data.
  /// @param name The pattern name
  /// @param data A map with `core` and `slice` lists of dimension indices
  /// @return A new PatternDescriptor
  public static PatternDescriptor fromData(String name, Object data) {
    if (!(data instanceof Map<?, ?> map)) {
      throw new InvalidPatternException(name, "invalid pattern format: " + data);
    }
    return new PatternDescriptor(name, dims(name, map.get("core")), dims(name, map.get("slice")));
  }

  private static int[] dims(String name, Object value) {
    if (value == null) {
      return new int[0];
    }
    List<Integer> dims = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object o : list) {
        dims.add(toDimension(name, o));
      }
    } else {
      dims.add(toDimension(name, value));
    }
    return dims.stream().mapToInt(Integer::intValue).toArray();
  }

  private static int toDimension(String name, Object o) {
    if (o instanceof Number n) {
      return n.intValue();
    }
    try {
      return Integer.parseInt(o.toString().trim());
    } catch (NumberFormatException e) {
      throw new InvalidPatternException(name, "invalid dimension index: " + o);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PatternDescriptor that = (PatternDescriptor) o;
    return name.equals(that.name)
        && Arrays.equals(coreDimensions, that.coreDimensions)
        && Arrays.equals(sliceDimensions, that.sliceDimensions);
  }

  @Override
  public int hashCode() {
    int result = name.hashCode();
    result = 31 * result + Arrays.hashCode(coreDimensions);
    result = 31 * result + Arrays.hashCode(sliceDimensions);
    return result;
  }

  @Override
  public String toString() {
    return name + "{core=" + Arrays.toString(coreDimensions) + ", slice=" + Arrays.toString(sliceDimensions) + "}";
  }
}
