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



import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PipelineOptionsTest {

  @TempDir
  Path tempDir;

  @Test
  public void testFromYaml() {
    PipelineOptions options = PipelineOptions.fromYaml(
        "out_path: /tmp/run1\n"
            + "process_file: tomo\n"
            + "datafile_name: scan42\n"
            + "default_max_frames: 16\n");

    assertEquals(Path.of("/tmp/run1"), options.outPath().orElseThrow());
    assertEquals("tomo", options.processFile());
    assertEquals("scan42", options.datafileName());
    assertEquals(16, options.defaultMaxFrames());
    assertEquals(Path.of("/tmp/run1", PipelineOptions.DEFAULT_METADATA_FILE), options.metadataPath().orElseThrow());
  }

  @Test
  public void testDefaults() {
    PipelineOptions options = PipelineOptions.fromYaml("datafile_name: scan42\n");

    assertEquals(PipelineOptions.DEFAULT_FRAMES, options.defaultMaxFrames());
    assertFalse(options.metadataPath().isPresent());
  }

  @Test
  public void testLoadAndDump() throws IOException {
    PipelineOptions original = new PipelineOptions()
        .withOutPath(tempDir)
        .withDefaultMaxFrames(3)
        .withMetadataFile("meta.json");
    Path file = tempDir.resolve("options.yaml");
    Files.writeString(file, original.toYaml());

    PipelineOptions loaded = PipelineOptions.load(file);

    assertEquals(original.toData(), loaded.toData());
  }

  @Test
  public void testDumpedKeys() {
    assertEquals(List.of("out_path", "process_file", "datafile_name", "default_max_frames", "metadata_file"),
        new ArrayList<>(new PipelineOptions().withOutPath(tempDir).toData().keySet()));
  }

  @Test
  public void testInvalidOptions() {
    assertThrows(RuntimeException.class, () -> PipelineOptions.fromYaml("- just\n- a list\n"));
    RuntimeException badFrames = assertThrows(RuntimeException.class,
        () -> PipelineOptions.fromYaml("default_max_frames: many\n"));
    assertTrue(badFrames.getMessage().contains("default_max_frames"));
    assertThrows(IllegalArgumentException.class, () -> new PipelineOptions().withDefaultMaxFrames(0));
  }
}
