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

import us.blanshard.refine.core.Grid;

/**
 * Thrown when the solver produces a grid that is not a valid Sudoku solution.
 * This means the solver itself is broken; it is not something callers are
 * expected to recover from.
 *
 * @author Luke Blanshard
 */
public class InvalidSolutionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient Grid solution;

  public InvalidSolutionException(Grid solution) {
    super("Invalid solution:\n" + solution);
    this.solution = solution;
  }

  /** The offending grid. */
  public Grid getSolution() {
    return solution;
  }
}
