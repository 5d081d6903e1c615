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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable fact describing one past mutation of an aggregate.
 *
 * <p>{@link #data()} always carries the {@link ModificationType} tag under {@link
 * ModificationType#DATA_KEY}; for everything but {@link ModificationType#DELETE} the rest of the
 * map is the post-mutation snapshot of the aggregate.
 *
 * @param eventType name of the event, {@code <AggregateType>Modified}
 * @param eventTypeVersion version of the snapshot layout, selects the decoding strategy on replay
 * @param aggregateType type of the mutated aggregate
 * @param aggregateId identifier of the mutated aggregate
 * @param data modification tag plus snapshot
 * @param actor name of the client who issued the mutation
 * @param timestamp when the mutation happened
 */
public record DomainEvent(
    String eventType,
    int eventTypeVersion,
    String aggregateType,
    String aggregateId,
    Map<String, Object> data,
    String actor,
    Instant timestamp) {
  /** Layout of snapshots produced by this build. */
  public static final int CURRENT_VERSION = 1;

  private static final String MODIFIED_SUFFIX = "Modified";

  public DomainEvent {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    if (aggregateType == null || aggregateType.isBlank()) {
      throw new IllegalArgumentException("Aggregate type cannot be blank");
    }

    if (aggregateId == null || aggregateId.isBlank()) {
      throw new IllegalArgumentException("Aggregate id cannot be blank");
    }

    if (data == null) {
      throw new IllegalArgumentException("Event data cannot be null");
    }

    if (timestamp == null) {
      throw new IllegalArgumentException("Event timestamp cannot be null");
    }

    // Snapshots may legitimately hold null values, so Map.copyOf is not an option
    data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /**
   * Builds a {@code <AggregateType>Modified} event of the current layout.
   *
   * @param aggregateType type of the mutated aggregate
   * @param aggregateId identifier of the mutated aggregate
   * @param modificationType kind of mutation
   * @param snapshot post-mutation state, empty for deletions
   * @param actor name of the client who issued the mutation
   * @param timestamp when the mutation happened
   * @return a new event
   */
  public static DomainEvent modified(
      final String aggregateType,
      final String aggregateId,
      final ModificationType modificationType,
      final Map<String, Object> snapshot,
      final String actor,
      final Instant timestamp) {
    if (modificationType == null) {
      throw new IllegalArgumentException("Modification type cannot be null");
    }

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put(ModificationType.DATA_KEY, modificationType.name());

    if (snapshot != null) {
      data.putAll(snapshot);
    }

    return new DomainEvent(
        aggregateType + MODIFIED_SUFFIX,
        CURRENT_VERSION,
        aggregateType,
        aggregateId,
        data,
        actor,
        timestamp);
  }

  /**
   * @return modification tag of this event
   * @throws IllegalStateException if the tag is missing or unknown
   */
  public ModificationType modificationType() {
    final Object tag = data.get(ModificationType.DATA_KEY);

    if (tag == null) {
      throw new IllegalStateException(
          "Event %s of %s has no %s".formatted(eventType, aggregateId, ModificationType.DATA_KEY));
    }

    try {
      return ModificationType.valueOf(tag.toString());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          "Event %s of %s has unknown %s '%s'"
              .formatted(eventType, aggregateId, ModificationType.DATA_KEY, tag),
          e);
    }
  }
}
