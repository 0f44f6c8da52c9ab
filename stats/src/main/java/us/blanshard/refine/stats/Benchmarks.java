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
package us.blanshard.refine.stats;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.refine.concurrent.FanOut;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.Puzzle;
import us.blanshard.refine.solve.BatchSolver;
import us.blanshard.refine.solve.Refiner;
import us.blanshard.refine.solve.Solver;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Solves puzzle files and prints timings, or checks the solutions found
 * against known ones.
 *
 * <p>The number of executions averaged over comes from the
 * {@code refine.executions} system property.
 *
 * @author Luke Blanshard
 */
public class Benchmarks {
  private static final Logger logger = Logger.getLogger(Benchmarks.class.getName());

  static final String PUZZLES_RESOURCE = "/puzzles.json";
  static final String SOLUTIONS_RESOURCE = "/solutions.json";

  private final PrintStream out;
  private final Benchmark benchmark;
  private final Solver solver;
  private final BatchSolver batchSolver;

  Benchmarks(PrintStream out, Benchmark benchmark, FanOut fanOut) {
    this.out = out;
    this.benchmark = benchmark;
    this.solver = Solver.parallel(fanOut);
    this.batchSolver = new BatchSolver(fanOut);
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 1) exitWithUsage();
    String command = args[0];
    String name = null;
    int fileArg = 1;
    if (command.equals("one") || command.equals("one-seq")) {
      if (args.length < 2 || args.length > 3) exitWithUsage();
      name = args[1];
      fileArg = 2;
    } else if (command.equals("each") || command.equals("batch")) {
      if (args.length > 2) exitWithUsage();
    } else if (command.equals("check")) {
      if (args.length > 3) exitWithUsage();
    } else {
      exitWithUsage();
    }

    List<Puzzle> puzzles = args.length > fileArg
        ? PuzzleFile.read(new File(args[fileArg]))
        : PuzzleFile.readResource(PUZZLES_RESOURCE);
    int executions = Integer.getInteger("refine.executions", Benchmark.DEFAULT_EXECUTIONS);
    logger.info("Loaded " + puzzles.size() + " puzzles; " + executions + " executions");

    ListeningExecutorService executor = FanOut.newExecutor("refine-%d");
    int mismatches = 0;
    try {
      Benchmarks benchmarks =
          new Benchmarks(System.out, new Benchmark(executions), new FanOut(executor));
      if (command.equals("each")) {
        benchmarks.each(puzzles);
      } else if (command.equals("batch")) {
        benchmarks.batch(puzzles);
      } else if (command.equals("one")) {
        benchmarks.one(puzzles, name);
      } else if (command.equals("one-seq")) {
        benchmarks.oneSequential(puzzles, name);
      } else {
        List<Puzzle> solutions = args.length > 2
            ? PuzzleFile.read(new File(args[2]))
            : PuzzleFile.readResource(SOLUTIONS_RESOURCE);
        mismatches = benchmarks.check(puzzles, solutions);
      }
    } finally {
      MoreExecutors.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS);
    }
    if (mismatches > 0) System.exit(1);
  }

  private static void exitWithUsage() {
    System.err.println("Usage: Benchmarks each|batch [<puzzles.json>]");
    System.err.println("       Benchmarks one|one-seq <name> [<puzzles.json>]");
    System.err.println("       Benchmarks check [<puzzles.json> [<solutions.json>]]");
    System.exit(1);
  }

  /** Prints the mean time to solve each puzzle on its own. */
  void each(List<Puzzle> puzzles) {
    out.println("Puzzle\tMean ms");
    for (final Puzzle puzzle : puzzles) {
      double millis = benchmark.meanMillis(new Runnable() {
        @Override public void run() {
          solver.solve(puzzle);
        }
      });
      out.printf("%s\t%.3f%n", puzzle.name, millis);
    }
  }

  /** Prints the mean time to solve all the puzzles at once. */
  void batch(final List<Puzzle> puzzles) {
    double millis = benchmark.meanMillis(new Runnable() {
      @Override public void run() {
        batchSolver.solveAll(puzzles);
      }
    });
    out.printf("%d puzzles\t%.3f ms%n", puzzles.size(), millis);
  }

  /**
   * Solves the named puzzle once with the parallel solver, printing the time
   * taken and the result.
   */
  Grid one(List<Puzzle> puzzles, String name) {
    return timeOne(find(puzzles, name), solver);
  }

  /** Like {@link #one}, but with the sequential solver. */
  Grid oneSequential(List<Puzzle> puzzles, String name) {
    return timeOne(find(puzzles, name), Solver.sequential());
  }

  private Grid timeOne(final Puzzle puzzle, final Solver puzzleSolver) {
    final Grid[] result = new Grid[1];
    long micros = benchmark.micros(new Runnable() {
      @Override public void run() {
        result[0] = puzzleSolver.solve(puzzle);
      }
    });
    out.printf("%s\t%d us%n", puzzle.name, micros);
    out.print(result[0]);
    return result[0];
  }

  /**
   * Solves every puzzle sequentially and compares the results with the given
   * solutions, matched up by position.  Prints each mismatch and returns their
   * number.
   */
  int check(List<Puzzle> puzzles, List<Puzzle> solutions) {
    checkArgument(puzzles.size() == solutions.size(),
        "%s puzzles but %s solutions", puzzles.size(), solutions.size());
    int mismatches = 0;
    for (int i = 0; i < puzzles.size(); ++i) {
      Puzzle puzzle = puzzles.get(i);
      Puzzle expected = solutions.get(i);
      if (!puzzle.name.equals(expected.name)) {
        out.printf("%s: solution is named %s%n", puzzle.name, expected.name);
        ++mismatches;
        continue;
      }
      Grid solved = Solver.sequential().solve(puzzle);
      if (solved.equals(Refiner.fill(expected))) {
        out.printf("%s: ok%n", puzzle.name);
      } else {
        out.printf("%s: expected%n%sbut found%n%s", puzzle.name, Refiner.fill(expected), solved);
        ++mismatches;
      }
    }
    logger.info(mismatches + " mismatches in " + puzzles.size() + " puzzles");
    return mismatches;
  }

  private static Puzzle find(List<Puzzle> puzzles, String name) {
    for (Puzzle puzzle : puzzles)
      if (puzzle.name.equals(name)) return puzzle;
    throw new IllegalArgumentException("No puzzle named " + name);
  }
}
