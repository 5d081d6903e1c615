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

package io.github.suppierk.generator.vehicle.store;

import io.github.suppierk.generator.vehicle.Pagination;
import io.github.suppierk.generator.vehicle.Vehicle;
import io.github.suppierk.generator.vehicle.VehicleFilter;
import io.github.suppierk.generator.vehicle.VehicleInput;
import io.github.suppierk.generator.vehicle.VehicleSort;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;

/**
 * Durable current state of the vehicles, the materialized view.
 *
 * <p>Every operation takes the {@link DSLContext} to run with, so writes join the transaction of
 * the command that issued them. Each stored vehicle carries the aggregate version of the last event
 * describing it, which guards replayed snapshots against overwriting newer state.
 */
public interface VehicleStore {
  /**
   * @param dsl to write with
   * @param vehicle to insert, with aggregate version 1
   * @return inserted vehicle
   */
  Vehicle insert(final DSLContext dsl, final Vehicle vehicle);

  /**
   * Overwrites either the fields present in the input or all mutable fields, then bumps the
   * aggregate version.
   *
   * @param dsl to write with
   * @param id of the vehicle to update
   * @param input new field values
   * @param merge {@code true} to keep the fields absent from the input
   * @param actor name recorded as {@code updatedBy}
   * @param at time recorded as {@code updatedAt}
   * @return updated vehicle, empty if there is no vehicle with the id
   */
  Optional<Vehicle> update(
      final DSLContext dsl,
      final String id,
      final VehicleInput input,
      final boolean merge,
      final String actor,
      final Instant at);

  /**
   * @param dsl to write with
   * @param ids of the vehicles to delete, absent ones are ignored
   * @return amount of deleted vehicles
   */
  int delete(final DSLContext dsl, final Collection<String> ids);

  /**
   * @param dsl to read with
   * @param id of the vehicle
   * @return found vehicle
   */
  Optional<Vehicle> findById(final DSLContext dsl, final String id);

  /**
   * @param dsl to read with
   * @param id of the vehicle
   * @param organizationId which must own the vehicle
   * @return found vehicle
   */
  Optional<Vehicle> findByIdAndOrganization(
      final DSLContext dsl, final String id, final String organizationId);

  /**
   * @param dsl to read with
   * @param filter to apply
   * @param pagination page to return
   * @param sort order of the vehicles
   * @return page of vehicles
   */
  List<Vehicle> list(
      final DSLContext dsl,
      final VehicleFilter filter,
      final Pagination pagination,
      final VehicleSort sort);

  /**
   * @param dsl to read with
   * @param filter to apply
   * @return amount of vehicles matching the filter
   */
  long count(final DSLContext dsl, final VehicleFilter filter);

  /**
   * Writes a replayed snapshot unless the stored vehicle already reflects a later event.
   *
   * @param dsl to write with
   * @param snapshot to write
   * @param aggregateVersion of the event carrying the snapshot
   * @return {@code true} if the snapshot was written
   */
  boolean upsertSnapshot(final DSLContext dsl, final Vehicle snapshot, final long aggregateVersion);

  /**
   * @return aggregate version of the stored vehicle, empty if there is none
   */
  Optional<Long> aggregateVersionOf(final DSLContext dsl, final String id);
}
