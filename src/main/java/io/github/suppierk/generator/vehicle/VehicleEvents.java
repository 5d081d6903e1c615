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

package io.github.suppierk.generator.vehicle;

import io.github.suppierk.generator.async.DomainNotification;
import io.github.suppierk.generator.async.FanoutNotification;
import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventSerializer;
import io.github.suppierk.generator.event.ModificationType;
import java.time.Clock;
import java.util.Optional;

/** Builds the events and the materialized-view notifications of vehicle commands. */
final class VehicleEvents {
  static final String MATERIALIZED_VIEW_MESSAGE_TYPE = "GeneratorVehicleModified";

  private final String materializedViewTopic;
  private final Clock clock;

  VehicleEvents(final String materializedViewTopic, final Clock clock) {
    if (materializedViewTopic == null || materializedViewTopic.isBlank()) {
      throw new IllegalArgumentException("Materialized view topic cannot be blank");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.materializedViewTopic = materializedViewTopic;
    this.clock = clock;
  }

  Clock clock() {
    return clock;
  }

  DomainEvent modified(
      final ModificationType modificationType,
      final String aggregateId,
      final Vehicle snapshot,
      final DomainClient actor) {
    return DomainEvent.modified(
        Vehicle.AGGREGATE_TYPE,
        aggregateId,
        modificationType,
        snapshot == null ? null : EventSerializer.toSnapshot(snapshot),
        actor.clientName(),
        clock.instant());
  }

  Optional<DomainNotification<?, ?>> viewUpdate(final Vehicle payload) {
    return Optional.of(
        FanoutNotification.of(materializedViewTopic, MATERIALIZED_VIEW_MESSAGE_TYPE, payload));
  }
}
