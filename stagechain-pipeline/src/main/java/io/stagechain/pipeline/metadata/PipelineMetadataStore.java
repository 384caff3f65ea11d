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



import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// Persists {@link PipelineMetadata} as JSON.
public class PipelineMetadataStore {
  private static final Logger logger = LogManager.getLogger(PipelineMetadataStore.class);

  /// Writes the metadata through a temporary file, so readers never see a partial file.
  public void write(Path file, PipelineMetadata metadata) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    Files.writeString(tmp, metadata.toJson());
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    logger.info("wrote pipeline metadata for {} stages to {}", metadata.stages().size(), file);
  }

  public PipelineMetadata read(Path file) throws IOException {
    return PipelineMetadata.fromJson(Files.readString(file));
  }
}
