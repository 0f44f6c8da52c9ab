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
package us.blanshard.refine.concurrent;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Queues;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.common.util.concurrent.Uninterruptibles;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Launches a group of independent tasks and joins their results.  Each task
 * reports back with a one-shot message tagged with its index; the join takes
 * exactly one message per task, in whatever order they arrive, and places each
 * result by its index.
 *
 * <p> The first failure received is rethrown from {@link #run}.  Nothing is
 * cancelled: the other tasks of the group still run to completion, and their
 * messages are dropped.  The join has no timeout.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class FanOut {
  private static final Logger logger = Logger.getLogger(FanOut.class.getName());

  /**
   * Receives each result as the coordinator takes its message, in arrival
   * order.  Called on the thread that called {@link #run}.
   */
  public interface Listener<T> {
    void completed(int index, T result);
  }

  private final ListeningExecutorService executor;

  public FanOut(ListeningExecutorService executor) {
    this.executor = checkNotNull(executor);
  }

  /**
   * Makes an unbounded pool of daemon threads named with the given format,
   * suitable for passing to the constructor.
   */
  public static ListeningExecutorService newExecutor(String nameFormat) {
    return MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build()));
  }

  /** Runs all the tasks concurrently, returns their results in task order. */
  public <T> ImmutableList<T> run(List<? extends Callable<T>> tasks) {
    return run(tasks, null);
  }

  /**
   * Runs all the tasks concurrently, returns their results in task order.
   * The listener, if given, sees each result as it arrives.
   */
  public <T> ImmutableList<T> run(
      List<? extends Callable<T>> tasks, @Nullable Listener<? super T> listener) {
    int count = tasks.size();
    BlockingQueue<Message<T>> inbox = Queues.newLinkedBlockingQueue();
    logger.log(Level.FINE, "Launching {0} tasks", count);
    for (int i = 0; i < count; ++i) {
      launch(i, tasks.get(i), inbox);
    }

    Object[] results = new Object[count];
    for (int received = 0; received < count; ++received) {
      Message<T> message = Uninterruptibles.takeUninterruptibly(inbox);
      if (message.failure != null) {
        logger.log(Level.WARNING, "Task " + message.index + " of " + count + " failed",
            message.failure);
        Throwables.throwIfUnchecked(message.failure);
        throw new UncheckedExecutionException(message.failure);
      }
      checkState(results[message.index] == null, "Second result for task %s", message.index);
      results[message.index] = checkNotNull(message.result, "Task %s returned null", message.index);
      if (listener != null)
        listener.completed(message.index, message.result);
    }

    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (Object result : results) {
      @SuppressWarnings("unchecked")  // Only T results were stored.
      T t = (T) result;
      builder.add(t);
    }
    return builder.build();
  }

  private <T> void launch(
      final int index, Callable<T> task, final BlockingQueue<Message<T>> inbox) {
    ListenableFuture<T> future = executor.submit(task);
    Futures.addCallback(future, new FutureCallback<T>() {
      @Override public void onSuccess(@Nullable T result) {
        inbox.add(new Message<T>(index, result, null));
      }
      @Override public void onFailure(Throwable t) {
        inbox.add(new Message<T>(index, null, t));
      }
    }, MoreExecutors.directExecutor());
  }

  @Immutable
  private static final class Message<T> {
    final int index;
    @Nullable final T result;
    @Nullable final Throwable failure;

    Message(int index, @Nullable T result, @Nullable Throwable failure) {
      this.index = index;
      this.result = result;
      this.failure = failure;
    }
  }
}
