package io.stagechain.pipeline.stage;


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

/// A dataset a stage reads or writes, and the pattern it is sliced by.
public final class DatasetBinding {
  private final String name;
  private final String patternName;

  public DatasetBinding(String name, String patternName) {
    this.name = Objects.requireNonNull(name, "dataset name");
    this.patternName = Objects.requireNonNull(patternName, "pattern name");
  }

  public String name() {
    return name;
  }

  public String patternName() {
    return patternName;
  }

  public DatasetBinding withName(String newName) {
    return new DatasetBinding(newName, patternName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DatasetBinding that = (DatasetBinding) o;
    return name.equals(that.name) && patternName.equals(that.patternName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, patternName);
  }

  @Override
  public String toString() {
    return name + ":" + patternName;
  }
}
