package io.stagechain.hdf5;


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



import io.stagechain.pipeline.config.PipelineOptions;

import java.nio.file.Path;

/// File and group names for the HDF5 files a run writes under its output path.
///
/// Each output dataset of a stage gets its own file,
/// `<process file base><stage index, two digits>_<stage name>_<dataset>.h5`, holding the
/// dataset in a group named `<stage index>-<stage name>`. The final datasets of a run are
/// collected in `<data file base>_processed.h5`.
public class Hdf5OutputNaming {
  private final Path outPath;
  private final String processBase;
  private final String dataBase;

  public Hdf5OutputNaming(PipelineOptions options) {
    this.outPath = options.outPath().orElseThrow(
        () -> new IllegalArgumentException(PipelineOptions.OUT_PATH + " must be set to write HDF5 output"));
    this.processBase = baseName(options.processFile());
    this.dataBase = baseName(options.datafileName());
  }

  public Path outPath() {
    return outPath;
  }

  public Path outputFile(int stageIndex, String stageName, String dataset) {
    return outPath.resolve(String.format("%s%02d_%s_%s.h5", processBase, stageIndex, stageName, dataset));
  }

  public String groupName(int stageIndex, String stageName) {
    return String.format("%d-%s", stageIndex, stageName);
  }

  public Path processedFile() {
    return outPath.resolve(dataBase + "_processed.h5");
  }

  /// @return the file name of a path without directories or extension
  static String baseName(String file) {
    String name = Path.of(file).getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
