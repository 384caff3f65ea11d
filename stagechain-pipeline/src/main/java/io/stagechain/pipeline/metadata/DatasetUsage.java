package io.stagechain.pipeline.metadata;


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



import io.stagechain.slicing.PatternDescriptor;

import java.util.Arrays;
import java.util.Objects;

/// One dataset bound to a stage, with the pattern it is accessed under.
public class DatasetUsage {
  private final String dataset;
  private final String pattern;
  private final int[] core;
  private final int[] slice;

  public DatasetUsage(String dataset, String pattern, int[] core, int[] slice) {
    this.dataset = dataset;
    this.pattern = pattern;
    this.core = core.clone();
    this.slice = slice.clone();
  }

  public static DatasetUsage of(String dataset, PatternDescriptor pattern) {
    return new DatasetUsage(dataset, pattern.name(), pattern.coreDimensions(), pattern.sliceDimensions());
  }

  public String dataset() {
    return dataset;
  }

  public String pattern() {
    return pattern;
  }

  public PatternDescriptor toPattern() {
    return new PatternDescriptor(pattern, core, slice);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DatasetUsage that = (DatasetUsage) o;
    return dataset.equals(that.dataset) && pattern.equals(that.pattern)
        && Arrays.equals(core, that.core) && Arrays.equals(slice, that.slice);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataset, pattern, Arrays.hashCode(core), Arrays.hashCode(slice));
  }

  @Override
  public String toString() {
    return dataset + ":" + pattern;
  }
}
