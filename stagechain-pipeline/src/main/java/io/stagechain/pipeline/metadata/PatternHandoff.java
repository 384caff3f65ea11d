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



import java.util.Objects;

/// The pattern a stage writes a dataset under and the pattern a later stage next reads it
/// under. An empty next pattern means no later stage reads the dataset.
public class PatternHandoff {
  private final String dataset;
  private final String current;
  private final String next;

  public PatternHandoff(String dataset, String current, String next) {
    this.dataset = dataset;
    this.current = current;
    this.next = next;
  }

  public String dataset() {
    return dataset;
  }

  public String current() {
    return current;
  }

  public String next() {
    return next;
  }

  public boolean isReadAgain() {
    return !next.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PatternHandoff that = (PatternHandoff) o;
    return dataset.equals(that.dataset) && current.equals(that.current) && next.equals(that.next);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataset, current, next);
  }

  @Override
  public String toString() {
    return dataset + ":" + current + "->" + (next.isEmpty() ? "(none)" : next);
  }
}
