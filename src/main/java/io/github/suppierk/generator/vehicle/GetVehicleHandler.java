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

import io.github.suppierk.generator.cqrs.DomainQueryHandler;
import io.github.suppierk.generator.cqrs.NotFoundException;
import io.github.suppierk.generator.cqrs.ValidationException;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import org.jooq.DSLContext;

final class GetVehicleHandler extends DomainQueryHandler.One<GetVehicle, Vehicle> {
  private final VehicleStore store;

  GetVehicleHandler(final VehicleStore store) {
    super(GetVehicle.class);
    this.store = throwIllegalArgumentIfNull(store, "Vehicle store");
  }

  @Override
  protected Vehicle run(final GetVehicle query, final DSLContext dsl) {
    if (query.aggregateId() == null || query.organizationId() == null) {
      throw new ValidationException("id and organizationId are required");
    }

    return store
        .findByIdAndOrganization(dsl, query.aggregateId(), query.organizationId())
        .orElseThrow(() -> new NotFoundException(Vehicle.AGGREGATE_TYPE, query.aggregateId()));
  }
}
