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
import us.blanshard.refine.core.Puzzle;

import com.google.common.collect.ImmutableList;

public class Fixtures {

  // Solved by refinement alone.
  static final Puzzle EASY = Puzzle.fromString("easy",
      "003020600900305001001806400008102900700000008006708200002609500800203009005010300");
  static final String EASY_SOLUTION =
      "483921657967345821251876493548132976729564138136798245372689514814253769695417382";

  // Refinement leaves a two-way guess at the top left corner.
  static final Puzzle HINTPAD = Puzzle.fromString("hintpad",
      ".6.5.4.3.1...9...8.........9...5...6.4.6.2.7.7...4...5.........4...8...1.5.2.3.4.");
  static final String HINTPAD_SOLUTION =
      "869574132124396758375128694932857416541632879786941325217469583493785261658213947";

  static final Puzzle NO_STEPS = Puzzle.fromString("no_steps",
      ".9..74....2....6.375...........9..545.3.4.......58.....45....8....1.2.3.......92.");
  static final String NO_STEPS_SOLUTION =
      "396874512428915673751326849812697354563241798974583261245739186689152437137468925";

  static final Puzzle INKALA = Puzzle.fromString("inkala",
      "8..........36......7..9.2...5...7.......457.....1...3...1....68..85...1..9....4..");
  static final String INKALA_SOLUTION =
      "812753649943682175675491283154237896369845721287169534521974368438526917796318452";

  static final Puzzle SEVENTEEN = Puzzle.fromString("seventeen",
      "000000010400000000020000000000050407008000300001090000300400200050100000000806000");
  static final String SEVENTEEN_SOLUTION =
      "693784512487512936125963874932651487568247391741398625319475268856129743274836159";

  // Consistent givens, but no completion exists; found only by search.
  static final Puzzle NO_SOLUTION = Puzzle.fromString("no_solution",
      "1....6....59.....82....8....45...3....3...7....6..3.54...325..6........17389.....");

  // Two 5s in the first row.
  static final Puzzle BROKEN = Puzzle.fromString("broken",
      "5...5....23..........6.8...7....1..2...45...9......6......7......1.46.....3......");

  static final ImmutableList<Puzzle> SOLVABLE =
      ImmutableList.of(EASY, HINTPAD, NO_STEPS, INKALA, SEVENTEEN);

  /** A fully fixed grid that breaks every rule: all ones. */
  static final Grid ALL_ONES;
  static {
    Grid.Builder builder = Grid.builder();
    for (int r = 0; r < Grid.SIZE; ++r)
      for (int c = 0; c < Grid.SIZE; ++c)
        builder.put(r, c, Cell.fixed(1));
    ALL_ONES = builder.build();
  }

  /** A refiner that turns every grid into {@link #ALL_ONES}. */
  static Refiner brokenRefiner() {
    return new Refiner() {
      @Override protected Grid refineRows(Grid grid) {
        return ALL_ONES;
      }
    };
  }

  /**
   * A refiner that works normally except on grids whose top left cell is the
   * given one, which it turns into {@link #ALL_ONES}.
   */
  static Refiner refinerBreakingOn(final Cell topLeft) {
    return new Refiner() {
      @Override protected Grid refineRows(Grid grid) {
        if (grid.get(0, 0) == topLeft || grid.equals(ALL_ONES)) return ALL_ONES;
        return Refiner.sequential().refineRows(grid);
      }
    };
  }
}
