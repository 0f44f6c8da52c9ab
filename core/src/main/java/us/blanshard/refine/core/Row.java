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
package us.blanshard.refine.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * Nine cells that must all end up holding different digits: a row of a grid,
 * or a column or block once the grid has been rearranged so that it appears
 * as a row.  A row that can no longer be completed is replaced as a whole by
 * {@link #CONTRADICTION}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Row {

  /** The number of cells in every row. */
  public static final int SIZE = 9;

  /** The row that cannot be completed. */
  public static final Row CONTRADICTION = new Row(null);

  private final Cell[] cells;

  private Row(Cell[] cells) {
    this.cells = cells;
  }

  /** Returns the row with the given cells, which must number nine. */
  public static Row of(Cell... cells) {
    checkArgument(cells.length == SIZE, "Rows hold %s cells, got %s", SIZE, cells.length);
    Cell[] copy = cells.clone();
    for (Cell cell : copy) checkNotNull(cell);
    return new Row(copy);
  }

  /** Returns the row with the given cells, which must number nine. */
  public static Row of(List<Cell> cells) {
    return of(cells.toArray(new Cell[cells.size()]));
  }

  /** Package-private factory that takes ownership of the array. */
  static Row wrap(Cell[] cells) {
    return new Row(cells);
  }

  public boolean isContradiction() {
    return cells == null;
  }

  /** Returns the cell at the given index, in the range 0..8. */
  public Cell get(int index) {
    checkState(!isContradiction(), "The contradiction has no cells");
    checkElementIndex(index, SIZE);
    return cells[index];
  }

  /** Returns the cells of this row in order. */
  public List<Cell> cells() {
    checkState(!isContradiction(), "The contradiction has no cells");
    return ImmutableList.copyOf(cells);
  }

  /** Returns the digits of the fixed cells in this row. */
  public NumSet entries() {
    int bits = 0;
    if (cells != null) {
      for (Cell cell : cells)
        if (cell.isFixed()) bits |= NumSet.bit(cell.digit());
    }
    return NumSet.ofBits(bits);
  }

  /** Tells whether some digit is fixed in more than one cell of this row. */
  public boolean hasDuplicateEntries() {
    if (cells == null) return false;
    int seen = 0;
    for (Cell cell : cells) {
      if (cell.isFixed()) {
        int bit = NumSet.bit(cell.digit());
        if ((seen & bit) != 0) return true;
        seen |= bit;
      }
    }
    return false;
  }

  /** Tells whether every cell of this row is decided. */
  public boolean isDecided() {
    if (cells == null) return true;
    for (Cell cell : cells)
      if (!cell.isDecided()) return false;
    return true;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Row)) return false;
    Row that = (Row) object;
    return Arrays.equals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(cells);
  }

  @Override public String toString() {
    if (cells == null) return "no solution";
    return "[" + Joiner.on(' ').join(cells) + "]";
  }
}
