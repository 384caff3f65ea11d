package io.stagechain.pipeline.topology;


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



import java.io.IOException;
import java.io.UncheckedIOException;

/// A pool of one rank. Barriers return immediately.
public class SingleRankCoordinator implements Coordinator {

  @Override
  public int rank() {
    return 0;
  }

  @Override
  public int totalRanks() {
    return 1;
  }

  @Override
  public void awaitLayoutFixed() {
  }

  @Override
  public void commitPipelineMetadata(MetadataWriter writer) {
    try {
      writer.write();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void awaitStageComplete(String stageName) {
  }
}
