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



/// How a dataset maps frames to its backing storage. Each kind has one
/// {@link SlicingStrategy}, looked up through {@link SlicingStrategies}.
public enum DataKind {
  /// Frames map directly to storage, through the preview if one is set
  STANDARD,
  /// Raw scan data carrying an image key per frame; only projection frames are processed
  RAW,
  /// A dataset repeated along a virtual leading replica axis
  REPLICATED
}
