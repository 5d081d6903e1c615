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

import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.cqrs.BoundedContext;
import io.github.suppierk.generator.cqrs.CommandResult;
import io.github.suppierk.generator.cqrs.Listing;
import io.github.suppierk.generator.event.EventLog;
import io.github.suppierk.generator.jooq.DslContextProvider;
import io.github.suppierk.generator.vehicle.store.VehicleStore;
import java.time.Clock;
import java.util.List;

/**
 * Command processor of the vehicle aggregate.
 *
 * <p>Each mutation writes the store, appends exactly one event per vehicle it touched and
 * publishes the result on the materialized-view topic. The outcome waits for the store write and
 * the event append, never for the publication.
 */
public final class VehicleContext extends BoundedContext<Vehicle> {
  /**
   * @param writeDslContextProvider resolves the context commands write with
   * @param readDslContextProvider resolves the context queries read with
   * @param eventLog vehicle events are appended to
   * @param fanoutDispatcher materialized-view updates are published with
   * @param store keeping the current vehicles
   * @param materializedViewTopic to publish vehicle updates to
   * @param clock stamping metadata and events
   */
  public VehicleContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider,
      final EventLog eventLog,
      final FanoutDispatcher fanoutDispatcher,
      final VehicleStore store,
      final String materializedViewTopic,
      final Clock clock) {
    super(writeDslContextProvider, readDslContextProvider, eventLog, fanoutDispatcher);

    final var events = new VehicleEvents(materializedViewTopic, clock);

    addDomainCommandHandler(new CreateVehicleHandler(store, events));
    addDomainCommandHandler(new UpdateVehicleHandler(store, events));
    addDomainCommandHandler(new DeleteVehiclesHandler(store, events));
    addDomainQueryHandler(new GetVehicleHandler(store));
    addDomainQueryHandler(new ListVehiclesHandler(store));
  }

  public Vehicle create(final DomainClient actor, final VehicleInput input) {
    return createModel(CreateVehicle.of(actor, input));
  }

  public Vehicle update(
      final DomainClient actor, final String id, final VehicleInput input, final boolean merge) {
    return updateModel(UpdateVehicle.of(actor, id, input, merge));
  }

  public CommandResult delete(final DomainClient actor, final List<String> ids) {
    return deleteModels(DeleteVehicles.of(actor, ids));
  }

  public Vehicle get(final DomainClient actor, final String id, final String organizationId) {
    return readModel(GetVehicle.of(actor, id, organizationId));
  }

  public Listing<Vehicle> list(
      final DomainClient actor,
      final VehicleFilter filter,
      final Pagination pagination,
      final VehicleSort sort) {
    return readModels(ListVehicles.of(actor, filter, pagination, sort));
  }
}
