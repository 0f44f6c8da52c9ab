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

import us.blanshard.refine.core.Cell;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.NumSet;
import us.blanshard.refine.core.Puzzle;
import us.blanshard.refine.core.Row;

import java.util.Arrays;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Constraint propagation: removes candidates that are already fixed elsewhere
 * in the same row, column, or block, until nothing more changes.
 *
 * <p> Only rows are ever refined.  Columns and blocks get the same treatment by
 * refining the transposed grid and the block view of the grid.  Subclasses
 * decide how the nine rows of one pass are scheduled.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public abstract class Refiner {

  private static final Refiner SEQUENTIAL = new Refiner() {
    @Override protected Grid refineRows(Grid grid) {
      Row[] rows = new Row[Grid.SIZE];
      for (int i = 0; i < Grid.SIZE; ++i) {
        rows[i] = refineRow(grid.row(i));
        if (rows[i].isContradiction()) return Grid.CONTRADICTION;
      }
      return Grid.ofRows(Arrays.asList(rows));
    }
  };

  /** Returns the refiner that handles one row at a time. */
  public static Refiner sequential() {
    return SEQUENTIAL;
  }

  /**
   * Converts a puzzle to a grid: known digits become fixed cells, unknown
   * squares become the full candidate set.
   */
  public static Grid fill(Puzzle puzzle) {
    Grid.Builder builder = Grid.builder();
    for (int r = 0; r < Grid.SIZE; ++r) {
      for (int c = 0; c < Grid.SIZE; ++c) {
        builder.put(r, c, Cell.ofPuzzleDigit(puzzle.get(r, c)));
      }
    }
    return builder.build();
  }

  /**
   * Removes the row's fixed digits from each of its candidate sets.  A set
   * left with one digit becomes fixed.  The whole row becomes the
   * contradiction if a set is left empty, or if the result fixes some digit
   * twice.
   */
  public static Row refineRow(Row row) {
    if (row.isContradiction()) return row;
    NumSet entries = row.entries();
    Cell[] cells = new Cell[Row.SIZE];
    for (int i = 0; i < Row.SIZE; ++i) {
      cells[i] = row.get(i).eliminate(entries);
      if (cells[i].isContradiction()) return Row.CONTRADICTION;
    }
    Row answer = Row.of(cells);
    return answer.hasDuplicateEntries() ? Row.CONTRADICTION : answer;
  }

  /**
   * Refines the grid's rows, then its columns, then its blocks, and repeats
   * until a full cycle leaves the grid unchanged.  Stops at once if the grid
   * becomes the contradiction.
   */
  public final Grid refine(Grid grid) {
    while (!grid.isContradiction()) {
      Grid next = refineRows(grid);
      if (next.isContradiction()) return next;

      next = refineRows(next.transpose()).transpose();
      if (next.isContradiction()) return next;

      next = refineRows(next.toBlockView()).fromBlockView();
      if (next.isContradiction() || next.equals(grid)) return next;

      grid = next;
    }
    return grid;
  }

  /**
   * Applies {@link #refineRow} to each row of a non-contradiction grid.
   * Returns the contradiction if any row refines to it.
   */
  protected abstract Grid refineRows(Grid grid);
}
