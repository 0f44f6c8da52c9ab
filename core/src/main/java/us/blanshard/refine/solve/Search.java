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

import us.blanshard.refine.core.Cell;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.NumSet;

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;

import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A depth-first backtracking search over refined grids.  Each step picks the
 * undecided cell with the fewest candidates, tries every candidate there,
 * refines the result, throws away contradictions, and explores what remains
 * easiest first.
 *
 * <p> The search is sequential: a branch is only tried once all the branches
 * ahead of it have come up empty.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Search {

  /**
   * A cell to guess at: its location and the candidates to try there.
   */
  @Immutable
  public static final class Guess {
    /** The row index, in the range 0..8. */
    public final int rowIndex;

    /** The column index, in the range 0..8. */
    public final int columnIndex;

    public final NumSet candidates;

    public Guess(int rowIndex, int columnIndex, NumSet candidates) {
      this.rowIndex = rowIndex;
      this.columnIndex = columnIndex;
      this.candidates = candidates;
    }

    /** The row number, one more than the row index. */
    public int rowNumber() {
      return rowIndex + 1;
    }

    /** The column number, one more than the column index. */
    public int columnNumber() {
      return columnIndex + 1;
    }

    @Override public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Guess)) return false;
      Guess that = (Guess) o;
      return this.rowIndex == that.rowIndex
          && this.columnIndex == that.columnIndex
          && this.candidates.equals(that.candidates);
    }

    @Override public int hashCode() {
      return Objects.hashCode(rowIndex, columnIndex, candidates);
    }

    @Override public String toString() {
      return String.format("(%d, %d)=%s", rowNumber(), columnNumber(), candidates);
    }
  }

  /**
   * Fixed cells before candidate sets; fixed cells by digit, candidate sets
   * lexicographically by their ascending digits.
   */
  private static final Ordering<Cell> CELL_ORDER = new Ordering<Cell>() {
    private final Ordering<Iterable<Integer>> setOrder =
        Ordering.<Integer>natural().lexicographical();

    @Override public int compare(Cell a, Cell b) {
      if (a.kind != b.kind) return a.kind.compareTo(b.kind);
      if (a.isFixed()) return Ints.compare(a.digit(), b.digit());
      if (a.isCandidates()) return setOrder.compare(a.candidates(), b.candidates());
      return 0;
    }
  };

  /** Compares grids cell by cell in row-major order. */
  private static final Ordering<Grid> CELL_BY_CELL = new Ordering<Grid>() {
    @Override public int compare(Grid a, Grid b) {
      for (int r = 0; r < Grid.SIZE; ++r) {
        for (int c = 0; c < Grid.SIZE; ++c) {
          int answer = CELL_ORDER.compare(a.get(r, c), b.get(r, c));
          if (answer != 0) return answer;
        }
      }
      return 0;
    }
  };

  private static final Ordering<Grid> EASIEST_FIRST =
      Ordering.<Integer>natural().onResultOf(new Function<Grid, Integer>() {
        @Override public Integer apply(Grid grid) {
          return grid.hardness();
        }
      }).compound(CELL_BY_CELL);

  private final Refiner refiner;

  /** Makes a search that refines each branch with the given refiner. */
  public Search(Refiner refiner) {
    this.refiner = refiner;
  }

  /** Makes a search that refines each branch sequentially. */
  public Search() {
    this(Refiner.sequential());
  }

  /**
   * Tells whether there is nothing left to search: the grid is the
   * contradiction, or every cell is decided.
   */
  public static boolean isSolved(Grid grid) {
    return grid.isDecided();
  }

  /**
   * Chooses the undecided cell with the fewest candidates.  Ties go to the
   * smallest row index, then the smallest column index.
   *
   * @throws IllegalArgumentException if the grid has no undecided cell
   */
  public static Guess guess(Grid grid) {
    checkArgument(!isSolved(grid), "Nothing to guess in a solved grid");
    Guess best = null;
    for (int r = 0; r < Grid.SIZE; ++r) {
      for (int c = 0; c < Grid.SIZE; ++c) {
        Cell cell = grid.get(r, c);
        if (!cell.isCandidates()) continue;
        // Strictly fewer, so the first location seen wins ties.
        if (best == null || cell.candidates().size() < best.candidates.size()) {
          best = new Guess(r, c, cell.candidates());
        }
      }
    }
    return best;
  }

  /**
   * Makes one refined grid per candidate at the chosen guess, drops those that
   * refine to the contradiction, and sorts the rest by increasing hardness.
   * Grids of equal hardness are ordered cell by cell, reading row by row: a
   * fixed cell before a candidate set, lower digits first, and candidate sets
   * compared digit by digit.
   */
  public List<Grid> guesses(Grid grid) {
    Guess guess = guess(grid);
    ImmutableList.Builder<Grid> children = ImmutableList.builder();
    for (int digit : guess.candidates) {
      Grid child = refiner.refine(grid.with(guess.rowIndex, guess.columnIndex, Cell.fixed(digit)));
      if (!child.isContradiction())
        children.add(child);
    }
    return EASIEST_FIRST.sortedCopy(children.build());
  }

  /**
   * Solves an already refined grid.  Returns a fully decided grid, or the
   * contradiction if there is no solution.
   */
  public Grid solveRefined(Grid grid) {
    if (isSolved(grid)) return grid;
    return solveOne(guesses(grid).iterator());
  }

  /**
   * Tries each grid in turn, returning the first solution found, or the
   * contradiction if none of them has one.
   */
  public Grid solveOne(Iterator<Grid> grids) {
    while (grids.hasNext()) {
      Grid solution = solveRefined(grids.next());
      if (!solution.isContradiction()) return solution;
    }
    return Grid.CONTRADICTION;
  }
}
