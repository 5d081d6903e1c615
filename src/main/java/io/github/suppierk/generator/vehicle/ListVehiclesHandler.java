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
import io.github.suppierk.generator.cqrs.Listing;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import org.jooq.DSLContext;

/** The total is counted by a second, independent query and only when requested. */
final class ListVehiclesHandler extends DomainQueryHandler.Many<ListVehicles, Vehicle> {
  private final VehicleStore store;

  ListVehiclesHandler(final VehicleStore store) {
    super(ListVehicles.class);
    this.store = throwIllegalArgumentIfNull(store, "Vehicle store");
  }

  @Override
  protected Listing<Vehicle> run(final ListVehicles query, final DSLContext dsl) {
    final var listing = store.list(dsl, query.filter(), query.pagination(), query.sort());
    final Long total =
        query.pagination().queryTotalResultCount() ? store.count(dsl, query.filter()) : null;

    return new Listing<>(listing, total);
  }
}
