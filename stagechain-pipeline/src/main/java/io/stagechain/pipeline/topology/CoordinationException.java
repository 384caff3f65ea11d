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



/// Thrown when a rank cannot pass a synchronization point, because it was interrupted or
/// another rank failed while the pool was waiting.
public class CoordinationException extends RuntimeException {

  private final int rank;
  private final String point;

  public CoordinationException(int rank, String point, Throwable cause) {
    super(String.format("Rank %d failed at synchronization point '%s'", rank, point), cause);
    this.rank = rank;
    this.point = point;
  }

  public int getRank() {
    return rank;
  }

  public String getPoint() {
    return point;
  }
}
