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

import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of the generation engine. Not thread-safe: every access happens while the engine
 * holds its lock.
 *
 * <p>Each run gets a new id. A tick of a cancelled run that was already dispatched sees a
 * different id once it gets the lock and does nothing.
 */
final class GenerationRunState {
  private boolean running;
  private long generatedCount;
  private long runId;
  private ScheduledFuture<?> cancellationHandle;

  boolean isRunning() {
    return running;
  }

  long generatedCount() {
    return generatedCount;
  }

  /**
   * @return id of the new run
   */
  long begin() {
    running = true;
    generatedCount = 0L;
    return ++runId;
  }

  void attach(final ScheduledFuture<?> handle) {
    cancellationHandle = handle;
  }

  /**
   * Marks the run stopped, the count is kept until the next {@link #begin()}.
   *
   * @return handle of the stopped run, {@code null} if none was attached
   */
  ScheduledFuture<?> end() {
    final ScheduledFuture<?> handle = cancellationHandle;
    running = false;
    cancellationHandle = null;
    return handle;
  }

  boolean isCurrentRun(final long candidateRunId) {
    return running && runId == candidateRunId;
  }

  long increment() {
    return ++generatedCount;
  }

  GenerationStatus snapshot() {
    return new GenerationStatus(running, generatedCount);
  }
}
