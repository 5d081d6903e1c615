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
import io.github.suppierk.generator.cqrs.NotFoundException;
import io.github.suppierk.generator.cqrs.ValidationException;
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.jooq.DSLContext;

/** Merges into or replaces the mutable fields of a vehicle. */
final class UpdateVehicleHandler extends DomainCommandHandler.Update<UpdateVehicle, Vehicle> {
  private final VehicleStore store;
  private final VehicleEvents events;

  UpdateVehicleHandler(final VehicleStore store, final VehicleEvents events) {
    super(UpdateVehicle.class);
    this.store = throwIllegalArgumentIfNull(store, "Vehicle store");
    this.events = throwIllegalArgumentIfNull(events, "Vehicle events");
  }

  @Override
  protected Vehicle update(final UpdateVehicle command, final DSLContext trx) {
    final VehicleInput input = command.input();

    if (command.aggregateId() == null || command.aggregateId().isBlank()) {
      throw new ValidationException("id is required");
    }

    if (input == null) {
      throw new ValidationException("input is required");
    }

    if (command.merge()) {
      input.validateForMerge();
    } else {
      input.validateForReplace();
    }

    return store
        .update(
            trx,
            command.aggregateId(),
            input,
            command.merge(),
            command.domainClient().clientName(),
            events.clock().instant().truncatedTo(ChronoUnit.MILLIS))
        .orElseThrow(() -> new NotFoundException(Vehicle.AGGREGATE_TYPE, command.aggregateId()));
  }

  @Override
  protected DomainEvent describe(
      final UpdateVehicle command,
      final ModificationType modificationType,
      final String aggregateId,
      final Vehicle snapshot) {
    return events.modified(modificationType, aggregateId, snapshot, command.domainClient());
  }

  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final UpdateVehicle command, final Vehicle vehicle) {
    return events.viewUpdate(vehicle);
  }
}
