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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable 9x9 grid of cells, or {@link #CONTRADICTION} for a grid that
 * cannot be completed.  Every operation returns a new grid; the nested
 * Builder is a mutable version that copies the cells only on its first write
 * after a build.
 *
 * <p> The transforms {@link #transpose} and {@link #toBlockView} rearrange
 * the same 81 cells so that columns, or 3x3 blocks, appear as rows.  They let
 * a single row operation enforce all three kinds of constraint.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Grid {

  /** The number of rows, and of columns. */
  public static final int SIZE = Row.SIZE;

  /** The number of cells. */
  public static final int CELLS = SIZE * SIZE;

  /** The grid that cannot be completed. */
  public static final Grid CONTRADICTION = new Grid(null);

  private final Cell[] cells;

  private Grid(Cell[] cells) {
    this.cells = cells;
  }

  /** Returns a new Builder, with every cell holding all candidates. */
  public static Builder builder() {
    Cell[] cells = new Cell[CELLS];
    Arrays.fill(cells, Cell.candidates(NumSet.all()));
    return new Builder(new Grid(cells));
  }

  /** Returns a mutable version of this grid. */
  public Builder toBuilder() {
    checkState(!isContradiction(), "The contradiction cannot be built upon");
    return new Builder(this);
  }

  /**
   * Assembles a grid from nine rows.  If any of the rows is the
   * contradiction, so is the grid.
   */
  public static Grid ofRows(List<Row> rows) {
    checkArgument(rows.size() == SIZE, "Grids hold %s rows, got %s", SIZE, rows.size());
    Cell[] cells = new Cell[CELLS];
    int index = 0;
    for (Row row : rows) {
      if (checkNotNull(row).isContradiction()) return CONTRADICTION;
      for (int i = 0; i < SIZE; ++i)
        cells[index++] = row.get(i);
    }
    return new Grid(cells);
  }

  public static final class Builder {
    private Grid grid;
    private boolean built;

    private Builder(Grid grid) {
      this.grid = grid;
      this.built = true;
    }

    private Grid grid() {
      if (built) {
        this.grid = new Grid(this.grid.cells.clone());
        this.built = false;
      }
      return this.grid;
    }

    /** Returns an immutable snapshot of this grid. */
    public Grid build() {
      built = true;
      return grid;
    }

    /** Returns the cell at the given zero-based location. */
    public Cell get(int rowIndex, int columnIndex) {
      return grid.get(rowIndex, columnIndex);
    }

    /** Sets the cell at the given zero-based location. */
    public Builder put(int rowIndex, int columnIndex, Cell cell) {
      checkNotNull(cell);
      grid().cells[index(rowIndex, columnIndex)] = cell;
      return this;
    }
  }

  public boolean isContradiction() {
    return cells == null;
  }

  /** Returns the cell at the given zero-based location. */
  public Cell get(int rowIndex, int columnIndex) {
    checkState(!isContradiction(), "The contradiction has no cells");
    return cells[index(rowIndex, columnIndex)];
  }

  /** Returns the row at the given index, in the range 0..8. */
  public Row row(int index) {
    checkState(!isContradiction(), "The contradiction has no rows");
    checkElementIndex(index, SIZE);
    return Row.wrap(Arrays.copyOfRange(cells, index * SIZE, (index + 1) * SIZE));
  }

  /** Returns all nine rows, top to bottom. */
  public List<Row> rows() {
    ImmutableList.Builder<Row> builder = ImmutableList.builder();
    for (int i = 0; i < SIZE; ++i)
      builder.add(row(i));
    return builder.build();
  }

  /**
   * Returns a grid equal to this one except at the given zero-based location,
   * which holds the given cell.
   */
  public Grid with(int rowIndex, int columnIndex, Cell cell) {
    return toBuilder().put(rowIndex, columnIndex, cell).build();
  }

  /**
   * Tells whether every cell is decided.  The contradiction counts as
   * decided.
   */
  public boolean isDecided() {
    if (cells == null) return true;
    for (Cell cell : cells)
      if (!cell.isDecided()) return false;
    return true;
  }

  /** The total number of open candidates over all the cells. */
  public int hardness() {
    int answer = 0;
    if (cells != null) {
      for (Cell cell : cells)
        answer += cell.hardness();
    }
    return answer;
  }

  /** Swaps rows and columns.  Is its own inverse. */
  public Grid transpose() {
    return permute(TRANSPOSE, false);
  }

  /**
   * Rearranges the grid so that each 3x3 block, read left to right and top to
   * bottom, becomes a row.  Blocks are numbered the same way.
   */
  public Grid toBlockView() {
    return permute(BLOCKS, false);
  }

  /** The exact inverse of {@link #toBlockView}. */
  public Grid fromBlockView() {
    return permute(BLOCKS, true);
  }

  /**
   * Builds the grid whose cell {@code i} is our cell {@code map[i]}, or the
   * grid whose cell {@code map[i]} is our cell {@code i} when inverting.
   */
  private Grid permute(byte[] map, boolean invert) {
    if (cells == null) return CONTRADICTION;
    Cell[] answer = new Cell[CELLS];
    for (int i = 0; i < CELLS; ++i) {
      if (invert) answer[map[i]] = cells[i];
      else answer[i] = cells[map[i]];
    }
    return new Grid(answer);
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(cells);
  }

  @Override public String toString() {
    if (cells == null) return "no solution\n";
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < SIZE; ++r) {
      for (int c = 0; c < SIZE; ++c) {
        Cell cell = get(r, c);
        if (cell.isFixed()) sb.append(' ').append(cell.digit());
        else if (cell.isContradiction()) sb.append(" X");
        else sb.append(" .");
        if (c == 2 || c == 5)
          sb.append(" |");
      }
      sb.append('\n');
      if (r == 2 || r == 5)
        sb.append("-------+-------+-------\n");
    }
    return sb.toString();
  }

  /**
   * Generates a string of 81 characters with digits for fixed cells and dots
   * for all others.
   */
  public String toFlatString() {
    checkState(!isContradiction(), "The contradiction has no cells");
    StringBuilder sb = new StringBuilder();
    for (Cell cell : cells)
      sb.append(cell.isFixed() ? (char) ('0' + cell.digit()) : '.');
    return sb.toString();
  }

  private static int index(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, SIZE, "row index");
    checkElementIndex(columnIndex, SIZE, "column index");
    return rowIndex * SIZE + columnIndex;
  }

  private static final byte[] TRANSPOSE = new byte[CELLS];
  private static final byte[] BLOCKS = new byte[CELLS];
  static {
    for (int r = 0; r < SIZE; ++r) {
      for (int c = 0; c < SIZE; ++c) {
        TRANSPOSE[r * SIZE + c] = (byte) (c * SIZE + r);
        // Row r of the block view is block r; column c is the cell's
        // position within the block.
        int row = r / 3 * 3 + c / 3;
        int col = r % 3 * 3 + c % 3;
        BLOCKS[r * SIZE + c] = (byte) (row * SIZE + col);
      }
    }
  }
}
