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



/// Thrown when a dataset is looked up under a name the registry does not hold.
public class UnknownDatasetException extends RuntimeException {

  private final String datasetName;

  public UnknownDatasetException(String datasetName, String where, Iterable<String> known) {
    super(String.format("No dataset '%s' among the %s datasets %s", datasetName, where, known));
    this.datasetName = datasetName;
  }

  public String getDatasetName() {
    return datasetName;
  }
}
