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

/// Thrown when a pattern cannot be used for slicing: it has no core dimension, references
/// a dimension outside the dataset rank, or does not assign every dimension exactly once.
public class InvalidPatternException extends RuntimeException {

  private final String patternName;
  private final String datasetName;

  public InvalidPatternException(String patternName, String reason) {
    this(patternName, null, reason);
  }

  public InvalidPatternException(String patternName, String datasetName, String reason) {
    super(String.format("Invalid pattern '%s'%s: %s",
        patternName,
        datasetName == null ? "" : " for dataset '" + datasetName + "'",
        reason));
    this.patternName = patternName;
    this.datasetName = datasetName;
  }

  public String getPatternName() {
    return patternName;
  }

  /// @return the dataset the pattern was applied to, or null when checked standalone
  public String getDatasetName() {
    return datasetName;
  }
}
