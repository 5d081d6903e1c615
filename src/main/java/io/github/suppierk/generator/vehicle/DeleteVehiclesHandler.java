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
import io.github.suppierk.generator.cqrs.CommandResult;
import io.github.suppierk.generator.cqrs.DomainCommandHandler;
import io.github.suppierk.generator.cqrs.ValidationException;
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventSerializer;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import java.util.Optional;
import org.jooq.DSLContext;

/**
 * Deletes vehicles in bulk. Subscribers are told that something was deleted through {@link
 * Vehicle#deletedPlaceholder()}, not which vehicles.
 */
final class DeleteVehiclesHandler
    extends DomainCommandHandler.BatchDelete<DeleteVehicles, Vehicle> {
  private final VehicleStore store;
  private final VehicleEvents events;

  DeleteVehiclesHandler(final VehicleStore store, final VehicleEvents events) {
    super(DeleteVehicles.class);
    this.store = throwIllegalArgumentIfNull(store, "Vehicle store");
    this.events = throwIllegalArgumentIfNull(events, "Vehicle events");
  }

  @Override
  protected int delete(final DeleteVehicles command, final DSLContext trx) {
    if (command.aggregateIds().isEmpty()) {
      throw new ValidationException("ids must not be empty");
    }

    if (command.aggregateIds().stream().anyMatch(id -> id == null || id.isBlank())) {
      throw new ValidationException("ids must not contain blank values");
    }

    return store.delete(trx, command.aggregateIds());
  }

  @Override
  protected CommandResult summarize(final DeleteVehicles command, final int deletedCount) {
    final String ids = EventSerializer.write(command.aggregateIds());

    return deletedCount > 0
        ? CommandResult.ok("Vehicle with id:s %s has been deleted".formatted(ids))
        : CommandResult.rejected("Vehicle with id:s %s not found for deletion".formatted(ids));
  }

  @Override
  protected DomainEvent describe(
      final DeleteVehicles command,
      final ModificationType modificationType,
      final String aggregateId,
      final Vehicle snapshot) {
    return events.modified(modificationType, aggregateId, null, command.domainClient());
  }

  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final DeleteVehicles command, final CommandResult result) {
    return events.viewUpdate(Vehicle.deletedPlaceholder());
  }
}
