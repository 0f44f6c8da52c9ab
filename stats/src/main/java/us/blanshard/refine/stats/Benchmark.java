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
package us.blanshard.refine.stats;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MICROSECONDS;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

/**
 * Times repeated executions of a task.
 *
 * @author Luke Blanshard
 */
public class Benchmark {
  public static final int DEFAULT_EXECUTIONS = 42;

  private final int executions;
  private final Ticker ticker;

  public Benchmark(int executions) {
    this(executions, Ticker.systemTicker());
  }

  Benchmark(int executions, Ticker ticker) {
    checkArgument(executions > 0, "executions must be positive: %s", executions);
    this.executions = executions;
    this.ticker = checkNotNull(ticker);
  }

  public int executions() {
    return executions;
  }

  /**
   * Runs the task the configured number of times, back to back, and returns
   * the mean elapsed time of one execution in milliseconds.
   */
  public double meanMillis(Runnable task) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    for (int i = 0; i < executions; ++i)
      task.run();
    stopwatch.stop();
    return stopwatch.elapsed(MICROSECONDS) / 1000.0 / executions;
  }

  /** Runs the task once and returns its elapsed time in microseconds. */
  public long micros(Runnable task) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    task.run();
    return stopwatch.stop().elapsed(MICROSECONDS);
  }
}
