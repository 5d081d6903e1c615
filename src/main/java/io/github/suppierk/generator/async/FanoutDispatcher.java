/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.generator.async;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget front of a {@link FanoutChannel}.
 *
 * <p>{@link #dispatch(DomainNotification)} returns as soon as the publication is queued. The
 * outcome of the publication is never reported back: failures are logged and dropped, so a slow or
 * broken channel can neither fail a command nor hold back a generation tick.
 */
public final class FanoutDispatcher implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(FanoutDispatcher.class);

  private static final long SHUTDOWN_GRACE_SECONDS = 5L;

  private final FanoutChannel channel;
  private final ExecutorService executor;

  /**
   * Default constructor.
   *
   * @param channel to publish through
   * @param executor to run publications on, owned by this dispatcher from now on
   */
  public FanoutDispatcher(final FanoutChannel channel, final ExecutorService executor) {
    if (channel == null) {
      throw new IllegalArgumentException("Fanout channel cannot be null");
    }

    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null");
    }

    this.channel = channel;
    this.executor = executor;
  }

  /**
   * Publications beyond the queue capacity are dropped and logged, a stuck channel therefore costs
   * at most {@code queueCapacity} pending notifications.
   *
   * @param channel to publish through
   * @param threads amount of publisher threads
   * @param queueCapacity amount of publications waiting for a thread
   * @return a new dispatcher backed by a fixed pool of daemon threads
   */
  public static FanoutDispatcher withThreads(
      final FanoutChannel channel, final int threads, final int queueCapacity) {
    if (threads < 1) {
      throw new IllegalArgumentException("At least one publisher thread is required");
    }

    if (queueCapacity < 1) {
      throw new IllegalArgumentException("Queue capacity must be positive");
    }

    return new FanoutDispatcher(
        channel,
        new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new Daemons(),
            new ThreadPoolExecutor.AbortPolicy()));
  }

  /**
   * Queues the publication and returns immediately.
   *
   * @param notification to publish
   */
  public void dispatch(final DomainNotification<?, ?> notification) {
    if (notification == null) {
      throw new IllegalArgumentException("Notification cannot be null");
    }

    try {
      executor.execute(() -> deliver(notification));
    } catch (RejectedExecutionException e) {
      LOG.warn(
          "Dropped '{}' notification for topic '{}': {}",
          notification.messageType(),
          notification.topic(),
          executor.isShutdown() ? "dispatcher is shut down" : "publication queue is full");
    }
  }

  private void deliver(final DomainNotification<?, ?> notification) {
    try {
      channel.publish(notification);
    } catch (RuntimeException e) {
      LOG.warn(
          "Failed to publish '{}' notification {} to topic '{}'",
          notification.messageType(),
          notification.messageId(),
          notification.topic(),
          e);
    }
  }

  /** Stops accepting publications and waits a little for the queued ones. */
  @Override
  public void close() {
    executor.shutdown();

    try {
      if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("Publications still pending after {}s, abandoning them", SHUTDOWN_GRACE_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class Daemons implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable, "fanout-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
