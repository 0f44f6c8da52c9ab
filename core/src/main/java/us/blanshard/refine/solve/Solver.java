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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.refine.concurrent.FanOut;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.Puzzle;

import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Solves puzzles: fills them in, refines them, searches what refinement
 * leaves undecided, and validates the answer.  Returns either a fully fixed
 * grid or {@link Grid#CONTRADICTION} when the puzzle has no solution.
 *
 * <p> The two flavors differ only in how the puzzle's initial refinement is
 * done.  The search that follows always refines its branches sequentially.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  private static final Solver SEQUENTIAL = new Solver(Refiner.sequential());

  private final Refiner refiner;
  private final Search search;

  private Solver(Refiner refiner) {
    this(refiner, new Search(Refiner.sequential()));
  }

  /**
   * Makes a solver that refines each puzzle with the given refiner, then
   * finishes it with the given search.
   */
  Solver(Refiner refiner, Search search) {
    this.refiner = checkNotNull(refiner);
    this.search = checkNotNull(search);
  }

  /** Returns the solver that does all its work on the calling thread. */
  public static Solver sequential() {
    return SEQUENTIAL;
  }

  /**
   * Returns a solver whose initial refinement runs one task per row on the
   * given coordinator.
   */
  public static Solver parallel(FanOut fanOut) {
    return new Solver(new ParallelRefiner(fanOut));
  }

  /**
   * Solves the given puzzle.
   *
   * @throws InvalidSolutionException if the answer breaks the rules, which
   *     means the solver is broken
   */
  public Grid solve(Puzzle puzzle) {
    Grid solution = search.solveRefined(refiner.refine(Refiner.fill(puzzle)));
    if (!Validator.isValidSolution(solution)) {
      logger.log(Level.SEVERE, "Invalid solution for {0}:\n{1}",
          new Object[] {puzzle.name, solution});
      throw new InvalidSolutionException(solution);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine((solution.isContradiction() ? "No solution for " : "Solved ") + puzzle.name);
    }
    return solution;
  }
}
