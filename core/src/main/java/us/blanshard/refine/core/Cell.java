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
import static com.google.common.base.Preconditions.checkState;

import javax.annotation.concurrent.Immutable;

/**
 * The contents of one square of a grid under refinement: a fixed digit, a
 * non-empty set of candidate digits, or the contradiction marker.  All
 * instances are preallocated, so cells may be compared by identity.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell {

  public enum Kind {
    FIXED, CANDIDATES, CONTRADICTION
  }

  /** The marker for a square that cannot hold any digit. */
  public static final Cell CONTRADICTION = new Cell(Kind.CONTRADICTION, NumSet.none());

  /** This cell's kind. */
  public final Kind kind;

  /**
   * For a fixed cell, the singleton set of its digit; for a candidates cell,
   * the candidates; empty for the contradiction.
   */
  private final NumSet digits;

  private Cell(Kind kind, NumSet digits) {
    this.kind = kind;
    this.digits = digits;
  }

  /** Returns the fixed cell for the given digit. */
  public static Cell fixed(int digit) {
    checkArgument(digit >= 1 && digit <= NumSet.COUNT, "Not a digit: %s", digit);
    return FIXED[digit - 1];
  }

  /** Returns the cell holding the given non-empty candidate set. */
  public static Cell candidates(NumSet candidates) {
    checkArgument(!candidates.isEmpty(), "Candidate sets may not be empty");
    return CANDIDATES[candidates.bits];
  }

  /**
   * Returns the cell for a puzzle square: the fixed cell for 1 through 9, or
   * all candidates for 0.
   */
  public static Cell ofPuzzleDigit(int digit) {
    return digit == 0 ? candidates(NumSet.all()) : fixed(digit);
  }

  public boolean isFixed() {
    return kind == Kind.FIXED;
  }

  public boolean isCandidates() {
    return kind == Kind.CANDIDATES;
  }

  public boolean isContradiction() {
    return kind == Kind.CONTRADICTION;
  }

  /**
   * Tells whether this cell needs no more work: it is fixed, or it is the
   * contradiction.
   */
  public boolean isDecided() {
    return kind != Kind.CANDIDATES;
  }

  /** Returns the digit of a fixed cell. */
  public int digit() {
    checkState(isFixed(), "Not a fixed cell: %s", this);
    return digits.get(0);
  }

  /** Returns the candidate set of a candidates cell. */
  public NumSet candidates() {
    checkState(isCandidates(), "Not a candidates cell: %s", this);
    return digits;
  }

  /** The number of candidates still open in this cell, zero when decided. */
  public int hardness() {
    return isCandidates() ? digits.size() : 0;
  }

  /**
   * Removes the given digits from this cell's candidates.  Fixed cells and the
   * contradiction are returned as is.  A candidate set left with a single
   * digit becomes that fixed digit; one left empty becomes the contradiction.
   */
  public Cell eliminate(NumSet entries) {
    if (!isCandidates()) return this;
    NumSet remaining = digits.minus(entries);
    switch (remaining.size()) {
      case 0: return CONTRADICTION;
      case 1: return fixed(remaining.get(0));
      default: return candidates(remaining);
    }
  }

  @Override public String toString() {
    switch (kind) {
      case FIXED: return Integer.toString(digits.get(0));
      case CANDIDATES: return digits.toString();
      default: return "X";
    }
  }

  private static final Cell[] FIXED;
  private static final Cell[] CANDIDATES;
  static {
    FIXED = new Cell[NumSet.COUNT];
    for (int d = 1; d <= NumSet.COUNT; ++d) {
      FIXED[d - 1] = new Cell(Kind.FIXED, NumSet.of(d));
    }
    CANDIDATES = new Cell[NumSet.all().bits + 1];
    for (int bits = 1; bits < CANDIDATES.length; ++bits) {
      CANDIDATES[bits] = new Cell(Kind.CANDIDATES, NumSet.ofBits(bits));
    }
  }
}
