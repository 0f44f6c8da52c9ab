/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.refine.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.refine.concurrent.FanOut;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.Puzzle;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Solves a batch of independent puzzles, one task per puzzle.  Each task runs
 * the sequential solver; the call returns once every task has reported
 * completion.  A solver failure in any task fails the whole batch.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class BatchSolver {
  private static final Logger logger = Logger.getLogger(BatchSolver.class.getName());

  /** Hears about each puzzle as its completion is received. */
  public interface Listener {
    void solved(Puzzle puzzle, Grid solution);
  }

  private final FanOut fanOut;
  private final Solver solver;

  public BatchSolver(FanOut fanOut) {
    this(fanOut, Solver.sequential());
  }

  /** Makes a batch solver whose tasks use the given solver. */
  BatchSolver(FanOut fanOut, Solver solver) {
    this.fanOut = checkNotNull(fanOut);
    this.solver = checkNotNull(solver);
  }

  /**
   * Solves all the puzzles, returns a map from puzzle name to solution (or
   * {@link Grid#CONTRADICTION}) in the order given.  Names must be distinct.
   *
   * @throws InvalidSolutionException if any task's solver produced an invalid
   *     solution
   */
  public ImmutableMap<String, Grid> solveAll(List<Puzzle> puzzles) {
    return solveAll(puzzles, null);
  }

  /**
   * Solves all the puzzles, telling the listener about each one as it
   * finishes.  Returns a map from puzzle name to solution in the order given.
   */
  public ImmutableMap<String, Grid> solveAll(
      final List<Puzzle> puzzles, @Nullable final Listener listener) {
    Set<String> names = Sets.newHashSet();
    List<Callable<Grid>> tasks = Lists.newArrayListWithCapacity(puzzles.size());
    for (final Puzzle puzzle : puzzles) {
      checkArgument(names.add(puzzle.name), "Duplicate puzzle name: %s", puzzle.name);
      tasks.add(new Callable<Grid>() {
        @Override public Grid call() {
          return solver.solve(puzzle);
        }
      });
    }

    FanOut.Listener<Grid> completions = null;
    if (listener != null) {
      completions = new FanOut.Listener<Grid>() {
        @Override public void completed(int index, Grid solution) {
          listener.solved(puzzles.get(index), solution);
        }
      };
    }
    ImmutableList<Grid> solutions = fanOut.run(tasks, completions);
    logger.fine("Solved a batch of " + puzzles.size());

    ImmutableMap.Builder<String, Grid> builder = ImmutableMap.builder();
    for (int i = 0; i < puzzles.size(); ++i) {
      builder.put(puzzles.get(i).name, solutions.get(i));
    }
    return builder.build();
  }
}
