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



/// Thrown when a pattern does not match the dimensions of the dataset it is declared on,
/// or when the datasets bound to one stage cannot be sliced in step with each other.
public class ShapeMismatchException extends RuntimeException {

  private final String datasetName;
  private final String patternName;

  public ShapeMismatchException(String datasetName, String patternName, String reason) {
    super(String.format("Dataset '%s' with pattern '%s': %s", datasetName, patternName, reason));
    this.datasetName = datasetName;
    this.patternName = patternName;
  }

  public String getDatasetName() {
    return datasetName;
  }

  public String getPatternName() {
    return patternName;
  }
}
