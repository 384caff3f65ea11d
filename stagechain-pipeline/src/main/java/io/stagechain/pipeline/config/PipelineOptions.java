package io.stagechain.pipeline.config;


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



import io.stagechain.pipeline.utils.SHARED;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Run-wide settings of a pipeline.
///
/// Options are usually read from YAML:
/// ```yaml
/// out_path: /data/run42
/// process_file: tomo_pipeline
/// datafile_name: scan_0042
/// default_max_frames: 8
/// metadata_file: pipeline_metadata.json
/// ```
public class PipelineOptions {
  public static final String OUT_PATH = "out_path";
  public static final String PROCESS_FILE = "process_file";
  public static final String DATAFILE_NAME = "datafile_name";
  public static final String DEFAULT_MAX_FRAMES = "default_max_frames";
  public static final String METADATA_FILE = "metadata_file";

  public static final int DEFAULT_FRAMES = 8;
  public static final String DEFAULT_METADATA_FILE = "pipeline_metadata.json";

  private Path outPath;
  private String processFile = "process";
  private String datafileName = "data";
  private int defaultMaxFrames = DEFAULT_FRAMES;
  private String metadataFile = DEFAULT_METADATA_FILE;

  public PipelineOptions() {
  }

  /// Creates options from YAML text.
  /// @throws RuntimeException if the text is not a map of valid options
  public static PipelineOptions fromYaml(String yaml) {
    Object configObject = SHARED.yamlLoader.loadFromString(yaml);
    if (configObject instanceof Map<?, ?>) {
      return fromData((Map<?, ?>) configObject);
    }
    throw new RuntimeException("invalid pipeline options format:" + yaml);
  }

  /// Reads options from a YAML file.
  public static PipelineOptions load(Path optionsFile) throws IOException {
    return fromYaml(Files.readString(optionsFile));
  }

  public static PipelineOptions fromData(Map<?, ?> m) {
    PipelineOptions options = new PipelineOptions();
    Optional.ofNullable(m.get(OUT_PATH)).map(Object::toString).map(Path::of).ifPresent(options::withOutPath);
    Optional.ofNullable(m.get(PROCESS_FILE)).map(Object::toString).ifPresent(options::withProcessFile);
    Optional.ofNullable(m.get(DATAFILE_NAME)).map(Object::toString).ifPresent(options::withDatafileName);
    Optional.ofNullable(m.get(METADATA_FILE)).map(Object::toString).ifPresent(options::withMetadataFile);
    Object frames = m.get(DEFAULT_MAX_FRAMES);
    if (frames != null) {
      try {
        options.withDefaultMaxFrames(frames instanceof Number ? ((Number) frames).intValue()
            : Integer.parseInt(frames.toString().trim()));
      } catch (NumberFormatException e) {
        throw new RuntimeException("invalid " + DEFAULT_MAX_FRAMES + ": " + frames, e);
      }
    }
    return options;
  }

  public Map<String, Object> toData() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (outPath != null) {
      map.put(OUT_PATH, outPath.toString());
    }
    map.put(PROCESS_FILE, processFile);
    map.put(DATAFILE_NAME, datafileName);
    map.put(DEFAULT_MAX_FRAMES, defaultMaxFrames);
    map.put(METADATA_FILE, metadataFile);
    return map;
  }

  public String toYaml() {
    return SHARED.yamlDumper.dumpToString(toData());
  }

  public Optional<Path> outPath() {
    return Optional.ofNullable(outPath);
  }

  public PipelineOptions withOutPath(Path outPath) {
    this.outPath = outPath;
    return this;
  }

  public String processFile() {
    return processFile;
  }

  public PipelineOptions withProcessFile(String processFile) {
    this.processFile = processFile;
    return this;
  }

  public String datafileName() {
    return datafileName;
  }

  public PipelineOptions withDatafileName(String datafileName) {
    this.datafileName = datafileName;
    return this;
  }

  /// @return the batch size used for stages that do not set their own
  public int defaultMaxFrames() {
    return defaultMaxFrames;
  }

  public PipelineOptions withDefaultMaxFrames(int defaultMaxFrames) {
    if (defaultMaxFrames < 1) {
      throw new IllegalArgumentException(DEFAULT_MAX_FRAMES + " must be at least 1: " + defaultMaxFrames);
    }
    this.defaultMaxFrames = defaultMaxFrames;
    return this;
  }

  public String metadataFile() {
    return metadataFile;
  }

  public PipelineOptions withMetadataFile(String metadataFile) {
    this.metadataFile = metadataFile;
    return this;
  }

  /// @return where the pipeline metadata is written, if an output path is set
  public Optional<Path> metadataPath() {
    return outPath().map(p -> p.resolve(metadataFile));
  }

  @Override
  public String toString() {
    return "PipelineOptions" + toData();
  }
}
