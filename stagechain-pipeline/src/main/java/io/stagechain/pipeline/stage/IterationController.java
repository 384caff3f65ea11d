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



import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.stagechain.pipeline.data.DatasetRegistry.ITERATION_CLONE;

/// Repeats a stage, keeping its state between iterations.
///
/// An iterative stage either sets a fixed number of iterations or calls
/// {@link #markComplete()} when it has converged. Between iterations the datasets it is
/// bound to may change:
/// - explicit in and out lists can be given for a specific iteration;
/// - otherwise, from the second iteration on, each alternating pair swaps places, so the
///   previous output is read and the previous input is overwritten.
///
/// When the stage completes, the pair member bound as an output holds the result. It
/// continues under the pair's primary name and the other member is removed.
public class IterationController {
  private static final Logger logger = LogManager.getLogger(IterationController.class);

  private int iteration;
  private int fixedIterations;
  private boolean complete;
  private final Map<Integer, List<List<String>>> iterationDatasets = new HashMap<>();
  private final Map<String, String> alternating = new LinkedHashMap<>();
  private List<String> currentIn;
  private List<String> currentOut;

  /// @param iterations the number of iterations to run, at least one
  public void setIterations(int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("Iteration count must be positive: " + iterations);
    }
    this.fixedIterations = iterations;
  }

  /// @return the fixed iteration count, or 0 when the stage decides itself
  public int fixedIterations() {
    return fixedIterations;
  }

  /// Binds specific datasets for one iteration.
  public void setIterationDatasets(int iteration, List<String> in, List<String> out) {
    iterationDatasets.put(iteration, List.of(List.copyOf(in), List.copyOf(out)));
  }

  /// Registers two datasets that alternate between being read and written. One of them must
  /// be an iteration buffer, a dataset with `itr_clone` in its name, so the stage never
  /// overwrites a dataset it did not create.
  /// @param primary the member whose name the result continues under
  /// @param partner the other member
  /// @throws IllegalArgumentException if neither member is an iteration buffer
  public void setAlternatingDatasets(String primary, String partner) {
    if (primary.equals(partner)) {
      throw new IllegalArgumentException("An alternating pair needs two datasets: " + primary);
    }
    if (!primary.contains(ITERATION_CLONE) && !partner.contains(ITERATION_CLONE)) {
      throw new IllegalArgumentException("Alternating datasets " + primary + " and " + partner
          + " must include an iteration buffer named with '" + ITERATION_CLONE + "'");
    }
    alternating.put(primary, partner);
  }

  public Map<String, String> alternatingDatasets() {
    return Map.copyOf(alternating);
  }

  public int iteration() {
    return iteration;
  }

  /// Ends the iterations after the current one.
  public void markComplete() {
    this.complete = true;
  }

  public boolean isComplete() {
    return complete;
  }

  /// Computes the bindings of the current iteration.
  /// @param declared the bindings the stage declared
  /// @return the bindings to run this iteration with
  @NotNull
  public StageBindings bindingsFor(StageBindings declared) {
    if (currentIn == null) {
      currentIn = new ArrayList<>(declared.inputNames());
      currentOut = new ArrayList<>(declared.outputNames());
    }
    List<List<String>> explicit = iterationDatasets.get(iteration);
    if (explicit != null) {
      currentIn = new ArrayList<>(explicit.get(0));
      currentOut = new ArrayList<>(explicit.get(1));
    } else if (iteration > 0) {
      alternating.forEach(this::swap);
    }
    logger.debug("iteration {} reads {} and writes {}", iteration, currentIn, currentOut);
    return declared.withDatasets(currentIn, currentOut);
  }

  private void swap(String a, String b) {
    List<String> listA = currentIn.contains(a) ? currentIn : currentOut;
    List<String> listB = currentIn.contains(b) ? currentIn : currentOut;
    int ia = listA.indexOf(a);
    int ib = listB.indexOf(b);
    if (ia < 0 || ib < 0) {
      throw new IllegalStateException("Alternating datasets " + a + " and " + b
          + " must both be bound, found in=" + currentIn + " out=" + currentOut);
    }
    listA.set(ia, b);
    listB.set(ib, a);
  }

  /// Returns to the first iteration, keeping the iteration count, the explicit datasets and
  /// the alternating pairs. Called before every execution of the stage.
  public void reset() {
    iteration = 0;
    complete = false;
    currentIn = null;
    currentOut = null;
  }

  /// Advances to the next iteration, completing once the fixed count is reached.
  public void endIteration() {
    if (fixedIterations > 0 && iteration == fixedIterations - 1) {
      complete = true;
    }
    iteration++;
  }

  /// Decides the outcome of every alternating pair once the stage is complete.
  /// @return one resolution per pair
  public List<PairResolution> resolvePairs() {
    List<PairResolution> resolutions = new ArrayList<>();
    alternating.forEach((primary, partner) -> {
      String finalName = primary.contains(ITERATION_CLONE) ? partner : primary;
      String survivor = currentOut != null && currentOut.contains(primary) ? primary : partner;
      String obsolete = survivor.equals(primary) ? partner : primary;
      resolutions.add(new PairResolution(survivor, obsolete, finalName));
    });
    return resolutions;
  }

  /// The outcome of one alternating pair.
  public static final class PairResolution {
    private final String survivor;
    private final String obsolete;
    private final String finalName;

    public PairResolution(String survivor, String obsolete, String finalName) {
      this.survivor = survivor;
      this.obsolete = obsolete;
      this.finalName = finalName;
    }

    public String survivor() {
      return survivor;
    }

    public String obsolete() {
      return obsolete;
    }

    public String finalName() {
      return finalName;
    }

    @Override
    public String toString() {
      return survivor + " -> " + finalName + ", removing " + obsolete;
    }
  }
}
