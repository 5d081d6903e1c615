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
import io.github.suppierk.generator.cqrs.DomainCommandHandler;
import io.github.suppierk.generator.cqrs.ValidationException;
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;

/** Creates a vehicle under a fresh random id. */
final class CreateVehicleHandler extends DomainCommandHandler.Create<CreateVehicle, Vehicle> {
  private final VehicleStore store;
  private final VehicleEvents events;

  CreateVehicleHandler(final VehicleStore store, final VehicleEvents events) {
    super(CreateVehicle.class);
    this.store = throwIllegalArgumentIfNull(store, "Vehicle store");
    this.events = throwIllegalArgumentIfNull(events, "Vehicle events");
  }

  @Override
  protected Vehicle insert(final CreateVehicle command, final DSLContext trx) {
    final VehicleInput input = command.input();

    if (input == null) {
      throw new ValidationException("input is required");
    }

    input.validateForCreate();

    final String actor = command.domainClient().clientName();
    // The store keeps milliseconds, the returned vehicle must read back identically
    final Instant now = events.clock().instant().truncatedTo(ChronoUnit.MILLIS);

    return store.insert(
        trx,
        new Vehicle(
            UUID.randomUUID().toString(),
            input.organizationId(),
            input.name(),
            input.description(),
            Boolean.TRUE.equals(input.active()),
            new Vehicle.Metadata(actor, now, actor, now)));
  }

  @Override
  protected String aggregateIdOf(final Vehicle vehicle) {
    return vehicle.id();
  }

  @Override
  protected DomainEvent describe(
      final CreateVehicle command,
      final ModificationType modificationType,
      final String aggregateId,
      final Vehicle snapshot) {
    return events.modified(modificationType, aggregateId, snapshot, command.domainClient());
  }

  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final CreateVehicle command, final Vehicle vehicle) {
    return events.viewUpdate(vehicle);
  }
}
