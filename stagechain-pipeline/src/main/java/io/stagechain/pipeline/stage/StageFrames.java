package io.stagechain.pipeline.stage;


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



import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.slicing.WorkBatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The data of one batch handed to {@link Stage#execute(StageFrames)}: an input block per
/// input binding, and the batch and block shape each output is written at.
public final class StageFrames {
  private final int batchIndex;
  private final int batchCount;
  private final int iteration;
  private final Map<String, ArrayBlock> inputs;
  private final Map<String, WorkBatch> inputBatches;
  private final Map<String, WorkBatch> outputBatches;
  private final Map<String, int[]> outputShapes;

  public StageFrames(int batchIndex, int batchCount, int iteration,
                     Map<String, ArrayBlock> inputs, Map<String, WorkBatch> inputBatches,
                     Map<String, WorkBatch> outputBatches, Map<String, int[]> outputShapes) {
    this.batchIndex = batchIndex;
    this.batchCount = batchCount;
    this.iteration = iteration;
    this.inputs = new LinkedHashMap<>(inputs);
    this.inputBatches = new LinkedHashMap<>(inputBatches);
    this.outputBatches = new LinkedHashMap<>(outputBatches);
    this.outputShapes = new LinkedHashMap<>(outputShapes);
  }

  /// @return the position of this batch in the global batch list
  public int batchIndex() {
    return batchIndex;
  }

  /// @return the length of the global batch list, across all ranks
  public int batchCount() {
    return batchCount;
  }

  public int iteration() {
    return iteration;
  }

  public ArrayBlock input(String dataset) {
    ArrayBlock block = inputs.get(dataset);
    if (block == null) {
      throw new IllegalArgumentException("No input " + dataset + " in " + inputs.keySet());
    }
    return block;
  }

  /// @return the block of the input bound at a position
  public ArrayBlock input(int position) {
    return input(inputNames().get(position));
  }

  public List<String> inputNames() {
    return new ArrayList<>(inputs.keySet());
  }

  public List<String> outputNames() {
    return new ArrayList<>(outputShapes.keySet());
  }

  public String outputName(int position) {
    return outputNames().get(position);
  }

  public WorkBatch inputBatch(String dataset) {
    return inputBatches.get(dataset);
  }

  public WorkBatch outputBatch(String dataset) {
    return outputBatches.get(dataset);
  }

  /// @return the shape of the block expected for an output
  public int[] outputShape(String dataset) {
    int[] shape = outputShapes.get(dataset);
    if (shape == null) {
      throw new IllegalArgumentException("No output " + dataset + " in " + outputShapes.keySet());
    }
    return shape.clone();
  }
}
