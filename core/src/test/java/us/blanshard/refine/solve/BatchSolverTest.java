package us.blanshard.refine.solve;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import us.blanshard.refine.concurrent.FanOut;
import us.blanshard.refine.core.Cell;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.Puzzle;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ForwardingListeningExecutorService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class BatchSolverTest {
  private ListeningExecutorService executor;
  private final AtomicInteger launched = new AtomicInteger();
  private BatchSolver batchSolver;

  /** Counts the tasks submitted to the underlying executor. */
  private class CountingExecutor extends ForwardingListeningExecutorService {
    @Override protected ListeningExecutorService delegate() {
      return executor;
    }

    @Override public <T> ListenableFuture<T> submit(Callable<T> task) {
      launched.incrementAndGet();
      return super.submit(task);
    }
  }

  @Before public void setUp() {
    executor = FanOut.newExecutor("batch-test-%d");
    batchSolver = new BatchSolver(new FanOut(new CountingExecutor()));
  }

  @After public void tearDown() {
    MoreExecutors.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS);
  }

  @Test public void solvesEveryPuzzle() {
    List<Puzzle> puzzles = ImmutableList.<Puzzle>builder()
        .addAll(Fixtures.SOLVABLE)
        .add(Fixtures.NO_SOLUTION)
        .build();
    ImmutableMap<String, Grid> solutions = batchSolver.solveAll(puzzles);

    assertEquals(ImmutableList.of("easy", "hintpad", "no_steps", "inkala", "seventeen", "no_solution"),
                 solutions.keySet().asList());
    assertEquals(Fixtures.EASY_SOLUTION, solutions.get("easy").toFlatString());
    assertEquals(Fixtures.HINTPAD_SOLUTION, solutions.get("hintpad").toFlatString());
    assertEquals(Fixtures.NO_STEPS_SOLUTION, solutions.get("no_steps").toFlatString());
    assertEquals(Fixtures.INKALA_SOLUTION, solutions.get("inkala").toFlatString());
    assertEquals(Fixtures.SEVENTEEN_SOLUTION, solutions.get("seventeen").toFlatString());
    assertSame(Grid.CONTRADICTION, solutions.get("no_solution"));
  }

  @Test public void oneCompletionPerPuzzle() {
    final List<String> completed = Collections.synchronizedList(Lists.<String>newArrayList());
    ImmutableMap<String, Grid> solutions =
        batchSolver.solveAll(Fixtures.SOLVABLE, new BatchSolver.Listener() {
          @Override public void solved(Puzzle puzzle, Grid solution) {
            assertEquals(true, Validator.isValidSolution(solution));
            completed.add(puzzle.name);
          }
        });

    int n = Fixtures.SOLVABLE.size();
    assertEquals(n, launched.get());
    assertEquals(n, completed.size());
    assertEquals(n, solutions.size());
    assertEquals(solutions.keySet(), ImmutableSet.copyOf(completed));
  }

  @Test public void invalidSolutionFailsTheBatch() {
    // Only the inkala puzzle starts with an 8 in the top left.
    Solver broken = new Solver(Fixtures.refinerBreakingOn(Cell.fixed(8)), new Search());
    BatchSolver brokenBatch = new BatchSolver(new FanOut(new CountingExecutor()), broken);
    try {
      brokenBatch.solveAll(Fixtures.SOLVABLE);
      fail();
    } catch (InvalidSolutionException e) {
      assertEquals(Fixtures.ALL_ONES, e.getSolution());
    }
    assertEquals(Fixtures.SOLVABLE.size(), launched.get());
  }

  @Test public void emptyBatch() {
    assertEquals(ImmutableMap.of(), batchSolver.solveAll(ImmutableList.<Puzzle>of()));
    assertEquals(0, launched.get());
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateNames() {
    batchSolver.solveAll(ImmutableList.of(Fixtures.EASY, Fixtures.EASY));
  }
}
