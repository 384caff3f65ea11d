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



/// Thrown when a stage or loader creates a dataset under a name it has already used.
public class DuplicateDatasetException extends RuntimeException {

  private final String datasetName;
  private final String stageName;

  public DuplicateDatasetException(String datasetName, String stageName) {
    super(String.format("Dataset '%s' already exists in stage '%s'", datasetName, stageName));
    this.datasetName = datasetName;
    this.stageName = stageName;
  }

  public String getDatasetName() {
    return datasetName;
  }

  public String getStageName() {
    return stageName;
  }
}
