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

package io.github.suppierk.generator.generation;

import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.async.FanoutNotification;
import io.github.suppierk.generator.cqrs.CommandResult;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces random vehicles at a fixed rate while a run is active and publishes each one on the
 * generation feed and the live update topics.
 *
 * <p>At most one run is active at a time. {@link #start()}, {@link #stop()}, {@link #status()} and
 * every tick read and modify {@link GenerationRunState} under a single lock. Publications are handed
 * to a {@link FanoutDispatcher}, so a slow channel never delays the next tick and a failing one
 * never ends the run.
 */
public final class GenerationEngine implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(GenerationEngine.class);

  static final String ALREADY_RUNNING = "Generation is already running";
  static final String NOT_RUNNING = "Generation is not running";
  static final String STARTED = "Vehicle generation started";
  static final String STOPPED = "Vehicle generation stopped";

  static final String MESSAGE_TYPE = "VehicleGenerated";

  private static final int AID_LOG_PREFIX = 8;
  private static final long SHUTDOWN_GRACE_SECONDS = 5L;

  private final ScheduledExecutorService scheduler;
  private final FanoutDispatcher fanoutDispatcher;
  private final GeneratedVehicleFactory factory;
  private final Duration tickPeriod;
  private final String generationFeedTopic;
  private final String liveUpdateTopic;
  private final Clock clock;

  private final ReentrantLock lock;
  private final GenerationRunState state;

  /**
   * @param scheduler running the ticks, owned by this engine from now on
   * @param fanoutDispatcher publishing generated vehicles
   * @param factory drawing the vehicles
   * @param tickPeriod between two vehicles
   * @param generationFeedTopic receiving the plain envelopes
   * @param liveUpdateTopic receiving the envelopes with the running total
   * @param clock stamping the envelopes
   */
  public GenerationEngine(
      final ScheduledExecutorService scheduler,
      final FanoutDispatcher fanoutDispatcher,
      final GeneratedVehicleFactory factory,
      final Duration tickPeriod,
      final String generationFeedTopic,
      final String liveUpdateTopic,
      final Clock clock) {
    if (scheduler == null || fanoutDispatcher == null || factory == null || clock == null) {
      throw new IllegalArgumentException("Scheduler, dispatcher, factory and clock are required");
    }

    if (tickPeriod == null || tickPeriod.isNegative() || tickPeriod.isZero()) {
      throw new IllegalArgumentException("Tick period must be positive");
    }

    if (generationFeedTopic == null || generationFeedTopic.isBlank()) {
      throw new IllegalArgumentException("Generation feed topic cannot be blank");
    }

    if (liveUpdateTopic == null || liveUpdateTopic.isBlank()) {
      throw new IllegalArgumentException("Live update topic cannot be blank");
    }

    this.scheduler = scheduler;
    this.fanoutDispatcher = fanoutDispatcher;
    this.factory = factory;
    this.tickPeriod = tickPeriod;
    this.generationFeedTopic = generationFeedTopic;
    this.liveUpdateTopic = liveUpdateTopic;
    this.clock = clock;

    this.lock = new ReentrantLock();
    this.state = new GenerationRunState();
  }

  /**
   * @return a new single-threaded scheduler suitable for the engine, on a daemon thread
   */
  public static ScheduledExecutorService newScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          final Thread thread = new Thread(runnable, "vehicle-generation");
          thread.setDaemon(true);
          return thread;
        });
  }

  /**
   * Starts a new run with a zero count. Returns without waiting for the first tick.
   *
   * @return {@code 200} when started, {@code 400} when a run is already active
   */
  public CommandResult start() {
    lock.lock();
    try {
      if (state.isRunning()) {
        LOG.info("Start rejected, run is already active");
        return CommandResult.rejected(ALREADY_RUNNING);
      }

      final long runId = state.begin();
      final long periodMillis = tickPeriod.toMillis();

      try {
        state.attach(
            scheduler.scheduleAtFixedRate(
                () -> tick(runId), periodMillis, periodMillis, TimeUnit.MILLISECONDS));
      } catch (RejectedExecutionException e) {
        state.end();
        throw new IllegalStateException("Generation engine is closed", e);
      }

      LOG.info("Starting vehicle generation, one vehicle every {} ms", periodMillis);
      return CommandResult.ok(STARTED);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the active run. A tick already running completes, no new tick starts. The count is kept.
   *
   * @return {@code 200} when stopped, {@code 400} when no run is active
   */
  public CommandResult stop() {
    lock.lock();
    try {
      if (!state.isRunning()) {
        LOG.info("Stop rejected, no run is active");
        return CommandResult.rejected(NOT_RUNNING);
      }

      final ScheduledFuture<?> handle = state.end();

      if (handle != null) {
        handle.cancel(false);
      }

      LOG.info("Stopping vehicle generation after {} vehicles", state.generatedCount());
      return CommandResult.ok(STOPPED);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return current state, never modifies it
   */
  public GenerationStatus status() {
    lock.lock();
    try {
      return state.snapshot();
    } finally {
      lock.unlock();
    }
  }

  private void tick(final long runId) {
    try {
      final GeneratedVehicle vehicle;
      final long generatedCount;

      lock.lock();
      try {
        if (!state.isCurrentRun(runId)) {
          return;
        }

        vehicle = factory.next();
        generatedCount = state.increment();
      } finally {
        lock.unlock();
      }

      final var envelope = GeneratedVehicleEnvelope.of(vehicle, clock.instant());

      fanoutDispatcher.dispatch(
          FanoutNotification.of(generationFeedTopic, MESSAGE_TYPE, envelope));
      fanoutDispatcher.dispatch(
          FanoutNotification.of(
              liveUpdateTopic, MESSAGE_TYPE, LiveGenerationUpdate.of(envelope, generatedCount)));

      LOG.debug(
          "Vehicle generated: {}... - Total: {}",
          envelope.aid().substring(0, AID_LOG_PREFIX),
          generatedCount);
    } catch (RuntimeException e) {
      // An exception escaping a periodic task cancels all of its future runs
      LOG.warn("Generation tick of run {} failed", runId, e);
    }
  }

  /** Stops the active run, if any, and shuts the scheduler down. */
  @Override
  public void close() {
    lock.lock();
    try {
      if (state.isRunning()) {
        stop();
      }
    } finally {
      lock.unlock();
    }

    scheduler.shutdown();

    try {
      if (!scheduler.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
