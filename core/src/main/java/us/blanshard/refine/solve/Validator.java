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
import us.blanshard.refine.core.Row;

/**
 * Checks solver output against the rules of Sudoku.
 *
 * @author Luke Blanshard
 */
public final class Validator {
  private Validator() {}

  /**
   * Tells whether the grid is a true solution: every row, column, and block
   * holds each digit exactly once.  The contradiction counts as valid, since
   * it claims nothing.
   */
  public static boolean isValidSolution(Grid grid) {
    if (grid.isContradiction()) return true;
    return allRowsValid(grid)
        && allRowsValid(grid.transpose())
        && allRowsValid(grid.toBlockView());
  }

  private static boolean allRowsValid(Grid grid) {
    for (Row row : grid.rows())
      if (!isValidRow(row)) return false;
    return true;
  }

  private static boolean isValidRow(Row row) {
    int seen = 0;
    for (Cell cell : row.cells()) {
      if (!cell.isFixed()) return false;
      int bit = NumSet.bit(cell.digit());
      if ((seen & bit) != 0) return false;
      seen |= bit;
    }
    return seen == NumSet.all().bits;
  }
}
