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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.refine.concurrent.FanOut;
import us.blanshard.refine.core.Grid;
import us.blanshard.refine.core.Row;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.concurrent.Callable;

import javax.annotation.concurrent.ThreadSafe;

/**
 * A refiner that hands each of the nine rows of a pass to its own task, and
 * assembles the pass's result once all nine have reported back.  The rows of
 * one pass never depend on each other, so the output is the same as the
 * sequential refiner's.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class ParallelRefiner extends Refiner {
  private final FanOut fanOut;

  public ParallelRefiner(FanOut fanOut) {
    this.fanOut = checkNotNull(fanOut);
  }

  @Override protected Grid refineRows(Grid grid) {
    List<Callable<Row>> tasks = Lists.newArrayListWithCapacity(Grid.SIZE);
    for (final Row row : grid.rows()) {
      tasks.add(new Callable<Row>() {
        @Override public Row call() {
          return refineRow(row);
        }
      });
    }
    ImmutableList<Row> rows = fanOut.run(tasks);
    return Grid.ofRows(rows);
  }
}
