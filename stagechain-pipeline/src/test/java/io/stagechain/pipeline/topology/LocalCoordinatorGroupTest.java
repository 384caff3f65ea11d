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



import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class LocalCoordinatorGroupTest {

  @Test
  public void testMetadataWrittenOnceByLastRank() {
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(4);
    AtomicInteger writes = new AtomicInteger();
    List<Integer> writers = new CopyOnWriteArrayList<>();

    List<Integer> ranks = group.runOnAllRanks(c -> {
      c.awaitLayoutFixed();
      c.commitPipelineMetadata(() -> {
        writes.incrementAndGet();
        writers.add(c.rank());
      });
      c.awaitStageComplete("noop");
      return c.rank();
    });

    assertEquals(List.of(0, 1, 2, 3), ranks);
    assertEquals(1, writes.get());
    assertEquals(List.of(3), writers);
  }

  @Test
  public void testNoRankReadsBeforeCommit() {
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(3);
    AtomicInteger written = new AtomicInteger();

    List<Integer> seen = group.runOnAllRanks(c -> {
      c.commitPipelineMetadata(written::incrementAndGet);
      return written.get();
    });

    assertEquals(List.of(1, 1, 1), seen);
  }

  @Test
  public void testFailureReleasesWaitingRanks() {
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(3);

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
        group.runOnAllRanks(c -> {
          if (c.rank() == 1) {
            throw new IllegalStateException("rank 1 broke");
          }
          c.awaitLayoutFixed();
          c.awaitStageComplete("never");
          return c.rank();
        }));

    assertEquals("rank 1 broke", thrown.getMessage());
  }

  @Test
  public void testWriterFailureAborts() {
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(2);

    CoordinationException thrown = assertThrows(CoordinationException.class, () ->
        group.runOnAllRanks(c -> {
          c.commitPipelineMetadata(() -> {
            throw new IOException("disk full");
          });
          return c.rank();
        }));

    assertTrue(thrown.getMessage().startsWith("Rank "));
    assertThrows(CoordinationException.class, () -> group.member(0).awaitLayoutFixed());
  }

  @Test
  public void testCoordinatingRank() {
    LocalCoordinatorGroup group = new LocalCoordinatorGroup(2);

    assertFalse(group.member(0).isCoordinatingRank());
    assertTrue(group.member(1).isCoordinatingRank());
    assertTrue(new SingleRankCoordinator().isCoordinatingRank());
    assertThrows(IllegalArgumentException.class, () -> group.member(2));
  }
}
