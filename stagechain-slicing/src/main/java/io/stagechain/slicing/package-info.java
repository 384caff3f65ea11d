/// Pattern-driven slicing of N-dimensional index spaces.
///
/// The classes in this package turn a dataset shape and a {@link io.stagechain.slicing.PatternDescriptor}
/// into the work a rank performs:
///
/// - {@link io.stagechain.slicing.SliceEnumerator} lists every frame of the pattern
/// - {@link io.stagechain.slicing.RunGrouper} coalesces frames into size-bounded range batches
/// - {@link io.stagechain.slicing.WorkDistributor} assigns each rank a contiguous share
///
/// All three are deterministic and hold no state between calls.
package io.stagechain.slicing;

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
