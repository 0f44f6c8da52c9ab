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

import com.google.common.base.Objects;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

/**
 * A named starting position: a 9x9 array of digits where 0 marks an unknown
 * square.  The puzzle enforces no Sudoku rules, so it may contain conflicts.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {

  /** The identifier of this puzzle, opaque to the solver. */
  public final String name;

  private final byte[] digits;

  private Puzzle(String name, byte[] digits) {
    this.name = checkNotNull(name);
    this.digits = digits;
  }

  /** Makes a puzzle from nine rows of nine digits each, 0 for unknown. */
  public static Puzzle of(String name, int[][] rows) {
    checkArgument(rows.length == Grid.SIZE, "Puzzles have %s rows, got %s", Grid.SIZE, rows.length);
    byte[] digits = new byte[Grid.CELLS];
    for (int r = 0; r < Grid.SIZE; ++r) {
      checkArgument(rows[r].length == Grid.SIZE,
          "Row %s has %s digits, expected %s", r + 1, rows[r].length, Grid.SIZE);
      for (int c = 0; c < Grid.SIZE; ++c) {
        digits[r * Grid.SIZE + c] = checkDigit(rows[r][c]);
      }
    }
    return new Puzzle(name, digits);
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.  Both 0 and period mean unknown.
   */
  public static Puzzle fromString(String name, String s) {
    byte[] digits = new byte[Grid.CELLS];
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '0' && c <= '9' || c == '.') {
        if (index < Grid.CELLS)
          digits[index] = c == '.' ? 0 : (byte) (c - '0');
        ++index;
      }
    }
    if (index != Grid.CELLS) {
      throw new IllegalArgumentException(
          String.format("Puzzle.fromString requires 81 locations, got %d in %s", index, s));
    }
    return new Puzzle(name, digits);
  }

  /** Returns the digit at the given zero-based location, 0 if unknown. */
  public int get(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, Grid.SIZE, "row index");
    checkElementIndex(columnIndex, Grid.SIZE, "column index");
    return digits[rowIndex * Grid.SIZE + columnIndex];
  }

  /** Returns the digits as nine rows of nine. */
  public int[][] toRows() {
    int[][] rows = new int[Grid.SIZE][Grid.SIZE];
    for (int i = 0; i < Grid.CELLS; ++i)
      rows[i / Grid.SIZE][i % Grid.SIZE] = digits[i];
    return rows;
  }

  /** The number of known squares. */
  public int clueCount() {
    int answer = 0;
    for (byte digit : digits)
      if (digit > 0) ++answer;
    return answer;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Puzzle)) return false;
    Puzzle that = (Puzzle) object;
    return this.name.equals(that.name) && Arrays.equals(this.digits, that.digits);
  }

  @Override public int hashCode() {
    return Objects.hashCode(name, Arrays.hashCode(digits));
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder(name).append(": ");
    for (byte digit : digits)
      sb.append(digit == 0 ? '.' : (char) ('0' + digit));
    return sb.toString();
  }

  private static byte checkDigit(int digit) {
    checkArgument(digit >= 0 && digit <= 9, "Puzzle digits run from 0 to 9, got %s", digit);
    return (byte) digit;
  }
}
