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

package io.github.suppierk.generator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replay driver: reads the {@link EventLog} in append order and feeds an {@link EventProjector}.
 *
 * <p>This is the only path that invokes projectors. Live commands never do, so replayed state can
 * not race with the fresher state a command has just committed through the normal write path.
 */
public final class EventReplayer {
  private static final Logger LOG = LoggerFactory.getLogger(EventReplayer.class);

  private final EventLog eventLog;
  private final EventProjector projector;
  private final int batchSize;

  /**
   * @param eventLog to read from
   * @param projector to apply events with
   * @param batchSize amount of events read per round trip
   */
  public EventReplayer(
      final EventLog eventLog, final EventProjector projector, final int batchSize) {
    if (eventLog == null) {
      throw new IllegalArgumentException("Event log cannot be null");
    }

    if (projector == null) {
      throw new IllegalArgumentException("Event projector cannot be null");
    }

    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive");
    }

    this.eventLog = eventLog;
    this.projector = projector;
    this.batchSize = batchSize;
  }

  /**
   * Replays the whole log.
   *
   * @return checkpoint to resume from
   */
  public long replayAll() {
    return replayFrom(0L);
  }

  /**
   * Replays every event appended after the checkpoint. A failing event stops the replay, the
   * exception propagates and the events before it stay applied.
   *
   * @param checkpoint sequence of the last event applied by a previous replay, {@code 0} for none
   * @return sequence of the last event seen, to resume from
   */
  public long replayFrom(final long checkpoint) {
    long position = checkpoint;
    int applied = 0;
    int skipped = 0;

    while (true) {
      final var batch = eventLog.readAfter(position, batchSize);

      for (StoredEvent storedEvent : batch) {
        if (projector.supports(storedEvent)) {
          projector.apply(storedEvent);
          applied++;
        } else {
          skipped++;
        }

        position = storedEvent.sequence();
      }

      if (batch.size() < batchSize) {
        break;
      }
    }

    LOG.info(
        "Replay from {} finished at {}: {} applied, {} skipped",
        checkpoint,
        position,
        applied,
        skipped);
    return position;
  }
}
