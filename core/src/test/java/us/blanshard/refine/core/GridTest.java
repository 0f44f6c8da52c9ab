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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static us.blanshard.refine.core.RowTest.row;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.util.List;

public class GridTest {

  /** A grid whose 81 cells are all different from one another. */
  static Grid distinct() {
    Grid.Builder builder = Grid.builder();
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        builder.put(r, c, distinctCell(r, c));
    return builder.build();
  }

  static Cell distinctCell(int r, int c) {
    return Cell.candidates(NumSet.ofBits(r * 9 + c + 1));
  }

  @Test public void builderCopiesOnWrite() {
    Grid.Builder builder = Grid.builder().put(3, 4, Cell.fixed(6));
    Grid g1 = builder.build();
    builder.put(7, 7, Cell.fixed(1));
    Grid g2 = builder.build();
    assertSame(Cell.fixed(6), g1.get(3, 4));
    assertSame(Cell.candidates(NumSet.all()), g1.get(7, 7));
    assertSame(Cell.fixed(1), g2.get(7, 7));
    assertEquals(false, g1.equals(g2));
  }

  @Test public void transpose() {
    Grid grid = distinct();
    Grid t = grid.transpose();
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        assertSame(grid.get(r, c), t.get(c, r));
    assertEquals(grid, t.transpose());
  }

  @Test public void blockView() {
    Grid blocks = distinct().toBlockView();
    // The first block is the top left square, read row by row.
    assertSame(distinctCell(0, 0), blocks.get(0, 0));
    assertSame(distinctCell(0, 2), blocks.get(0, 2));
    assertSame(distinctCell(1, 0), blocks.get(0, 3));
    assertSame(distinctCell(2, 2), blocks.get(0, 8));
    // The sixth is the middle right square.
    assertSame(distinctCell(3, 6), blocks.get(5, 0));
    assertSame(distinctCell(5, 8), blocks.get(5, 8));
    // The last is the bottom right square.
    assertSame(distinctCell(6, 6), blocks.get(8, 0));
    assertSame(distinctCell(7, 7), blocks.get(8, 4));
  }

  @Test public void blockViewRoundTrips() {
    Grid grid = distinct();
    assertEquals(grid, grid.toBlockView().fromBlockView());
    assertEquals(grid, grid.fromBlockView().toBlockView());
  }

  @Test public void with() {
    Grid grid = distinct();
    Grid changed = grid.with(4, 8, Cell.fixed(2));
    assertSame(Cell.fixed(2), changed.get(4, 8));
    assertSame(distinctCell(4, 8), grid.get(4, 8));
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        if (r != 4 || c != 8) assertSame(grid.get(r, c), changed.get(r, c));
  }

  @Test public void withSameCellIsEqual() {
    Grid grid = distinct();
    for (int r = 0; r < 9; ++r)
      for (int c = 0; c < 9; ++c)
        assertEquals(grid, grid.with(r, c, grid.get(r, c)));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void withOutOfRange() {
    distinct().with(9, 0, Cell.fixed(1));
  }

  @Test public void rows() {
    Grid grid = distinct();
    List<Row> rows = grid.rows();
    assertEquals(9, rows.size());
    assertSame(distinctCell(2, 5), rows.get(2).get(5));
    assertEquals(grid, Grid.ofRows(rows));
  }

  @Test public void ofRowsWithContradiction() {
    Row open = row(0, 0, 0, 0, 0, 0, 0, 0, 0);
    List<Row> rows = ImmutableList.of(
        open, open, open, open, Row.CONTRADICTION, open, open, open, open);
    assertSame(Grid.CONTRADICTION, Grid.ofRows(rows));
  }

  @Test public void contradictionTransforms() {
    assertSame(Grid.CONTRADICTION, Grid.CONTRADICTION.transpose());
    assertSame(Grid.CONTRADICTION, Grid.CONTRADICTION.toBlockView());
    assertSame(Grid.CONTRADICTION, Grid.CONTRADICTION.fromBlockView());
    assertTrue(Grid.CONTRADICTION.isDecided());
    assertEquals(0, Grid.CONTRADICTION.hardness());
  }

  @Test public void hardness() {
    assertEquals(81 * 9, Grid.builder().build().hardness());
    Grid grid = Grid.builder()
        .put(0, 0, Cell.fixed(1))
        .put(0, 1, Cell.candidates(NumSetTest.set(2, 3)))
        .build();
    assertEquals(79 * 9 + 2, grid.hardness());
  }

  @Test public void strings() {
    Grid grid = Grid.builder()
        .put(0, 0, Cell.fixed(5))
        .put(8, 8, Cell.fixed(9))
        .build();
    String flat = grid.toFlatString();
    assertEquals(81, flat.length());
    assertEquals('5', flat.charAt(0));
    assertEquals('9', flat.charAt(80));
    assertEquals('.', flat.charAt(40));
    assertEquals(" 5 . . | . . . | . . .\n", grid.toString().substring(0, 23));
    assertEquals("no solution\n", Grid.CONTRADICTION.toString());
  }
}
