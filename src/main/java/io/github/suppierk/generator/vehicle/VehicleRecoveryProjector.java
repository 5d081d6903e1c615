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

import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventProjector;
import io.github.suppierk.generator.event.EventSerializer;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.event.StoredEvent;
import io.github.suppierk.generator.event.UnsupportedEventVersionException;
import io.github.suppierk.generator.jooq.StoreFailures;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs the vehicle store from replayed {@code VehicleModified} events.
 *
 * <p>Deletions are idempotent. Snapshots are decoded by a strategy picked by the event type
 * version and written only if the stored vehicle does not reflect a later event, so the same log
 * can be replayed any number of times.
 */
public final class VehicleRecoveryProjector implements EventProjector {
  private static final Logger LOG = LoggerFactory.getLogger(VehicleRecoveryProjector.class);

  private static final String EVENT_TYPE = Vehicle.AGGREGATE_TYPE + "Modified";
  private static final String ID_KEY = "id";

  private static final Map<Integer, UnaryOperator<Map<String, Object>>> SNAPSHOT_DECODERS =
      Map.of(1, VehicleRecoveryProjector::withoutModificationType);

  private final DSLContext dsl;
  private final VehicleStore store;

  /**
   * @param dsl to repair the store with
   * @param store to repair
   */
  public VehicleRecoveryProjector(final DSLContext dsl, final VehicleStore store) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    if (store == null) {
      throw new IllegalArgumentException("Vehicle store cannot be null");
    }

    this.dsl = dsl;
    this.store = store;
  }

  @Override
  public boolean supports(final StoredEvent storedEvent) {
    final DomainEvent event = storedEvent.event();
    return Vehicle.AGGREGATE_TYPE.equals(event.aggregateType())
        && EVENT_TYPE.equals(event.eventType());
  }

  @Override
  public void apply(final StoredEvent storedEvent) {
    if (storedEvent == null) {
      throw new IllegalArgumentException("Stored event cannot be null");
    }

    final DomainEvent event = storedEvent.event();
    final ModificationType modificationType = event.modificationType();

    try {
      if (modificationType == ModificationType.DELETE) {
        final int deleted =
            dsl.transactionResult(
                (final Configuration trx) ->
                    store.delete(trx.dsl(), List.of(event.aggregateId())));

        LOG.info(
            "{}: aid={}, timestamp={}, {}",
            modificationType,
            event.aggregateId(),
            event.timestamp(),
            deleted > 0 ? "deleted" : "already absent");
        return;
      }

      final Vehicle snapshot =
          EventSerializer.fromSnapshot(decodeSnapshot(event), Vehicle.class);
      final boolean written =
          dsl.transactionResult(
              (final Configuration trx) ->
                  store.upsertSnapshot(trx.dsl(), snapshot, storedEvent.aggregateVersion()));

      LOG.info(
          "{}: aid={}, timestamp={}, version={}, {}",
          modificationType,
          event.aggregateId(),
          event.timestamp(),
          storedEvent.aggregateVersion(),
          written ? "applied" : "skipped, stored state is newer");
    } catch (RuntimeException e) {
      throw StoreFailures.translate(e);
    }
  }

  private static Map<String, Object> decodeSnapshot(final DomainEvent event) {
    final var decoder = SNAPSHOT_DECODERS.get(event.eventTypeVersion());

    if (decoder == null) {
      throw new UnsupportedEventVersionException(event.eventType(), event.eventTypeVersion());
    }

    final Map<String, Object> snapshot = decoder.apply(event.data());
    snapshot.putIfAbsent(ID_KEY, event.aggregateId());
    return snapshot;
  }

  private static Map<String, Object> withoutModificationType(final Map<String, Object> data) {
    final Map<String, Object> snapshot = new LinkedHashMap<>(data);
    snapshot.remove(ModificationType.DATA_KEY);
    return snapshot;
  }
}
