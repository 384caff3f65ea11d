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
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Hdf5OutputNamingTest {

  private final Hdf5OutputNaming naming = new Hdf5OutputNaming(new PipelineOptions()
      .withOutPath(Path.of("/data/run7"))
      .withProcessFile("/configs/tomo_process.nxs")
      .withDatafileName("scan_4411.h5"));

  @Test
  public void testStageOutputFile() {
    assertThat(naming.outputFile(3, "median_filter", "tomo"))
        .isEqualTo(Path.of("/data/run7/tomo_process03_median_filter_tomo.h5"));
    assertThat(naming.groupName(3, "median_filter")).isEqualTo("3-median_filter");
  }

  @Test
  public void testProcessedFile() {
    assertThat(naming.processedFile()).isEqualTo(Path.of("/data/run7/scan_4411_processed.h5"));
  }

  @Test
  public void testRequiresOutPath() {
    assertThatThrownBy(() -> new Hdf5OutputNaming(new PipelineOptions()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out_path");
  }
}
