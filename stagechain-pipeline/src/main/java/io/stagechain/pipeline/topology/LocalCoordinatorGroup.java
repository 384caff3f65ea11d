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



import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.function.Function;

/// A pool of ranks running as threads of one JVM, synchronized by a shared {@link Phaser}
/// with one party per rank.
///
/// A rank that fails terminates the phaser, which releases every rank waiting now or later
/// with a {@link CoordinationException}.
public class LocalCoordinatorGroup {
  private static final Logger logger = LogManager.getLogger(LocalCoordinatorGroup.class);

  private final int size;
  private final Phaser phaser;

  public LocalCoordinatorGroup(int size) {
    if (size < 1) {
      throw new IllegalArgumentException("A rank pool needs at least one rank: " + size);
    }
    this.size = size;
    this.phaser = new Phaser(size);
  }

  public int size() {
    return size;
  }

  /// @return the coordinator of one member rank
  public Coordinator member(int rank) {
    if (rank < 0 || rank >= size) {
      throw new IllegalArgumentException("Rank " + rank + " is not in a pool of " + size);
    }
    return new Member(rank);
  }

  /// Releases all ranks after a failure. Every later synchronization attempt fails.
  public void abort() {
    phaser.forceTermination();
  }

  /// Runs a body once per rank, each on its own thread, and waits for all of them. When
  /// ranks fail, the first failure that is not a {@link CoordinationException} is rethrown.
  /// @param body the per-rank program
  /// @param <T> the result type
  /// @return the results, in rank order
  public <T> List<T> runOnAllRanks(Function<Coordinator, T> body) {
    ExecutorService executor = Executors.newFixedThreadPool(size);
    try {
      List<Future<T>> futures = new ArrayList<>();
      for (int rank = 0; rank < size; rank++) {
        Coordinator member = member(rank);
        futures.add(executor.submit(() -> {
          try {
            return body.apply(member);
          } catch (RuntimeException | Error e) {
            abort();
            throw e;
          }
        }));
      }
      List<T> results = new ArrayList<>();
      RuntimeException failure = null;
      for (Future<T> future : futures) {
        try {
          results.add(future.get());
        } catch (ExecutionException e) {
          RuntimeException cause = e.getCause() instanceof RuntimeException
              ? (RuntimeException) e.getCause()
              : new CoordinationException(-1, "run", e.getCause());
          if (failure == null || (failure instanceof CoordinationException && !(cause instanceof CoordinationException))) {
            failure = cause;
          }
        }
      }
      if (failure != null) {
        throw failure;
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abort();
      throw new CoordinationException(-1, "run", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private class Member implements Coordinator {
    private final int rank;

    private Member(int rank) {
      this.rank = rank;
    }

    @Override
    public int rank() {
      return rank;
    }

    @Override
    public int totalRanks() {
      return size;
    }

    @Override
    public void awaitLayoutFixed() {
      await("layout fixed");
    }

    @Override
    public void commitPipelineMetadata(MetadataWriter writer) {
      await("before metadata commit");
      if (isCoordinatingRank()) {
        try {
          writer.write();
        } catch (IOException e) {
          abort();
          throw new CoordinationException(rank, "metadata commit", e);
        }
      }
      await("after metadata commit");
    }

    @Override
    public void awaitStageComplete(String stageName) {
      await("stage " + stageName + " complete");
    }

    private void await(String point) {
      logger.debug("rank {} of {} waiting at {}", rank, size, point);
      if (phaser.arriveAndAwaitAdvance() < 0) {
        throw new CoordinationException(rank, point,
            new IllegalStateException("the rank pool was aborted after a failure"));
      }
      logger.debug("rank {} past {}", rank, point);
    }
  }
}
