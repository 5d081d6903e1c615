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

import static io.github.suppierk.generator.vehicle.store.VehicleTable.ACTIVE;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.CREATED_AT;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.CREATED_BY;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.DESCRIPTION;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.EVENT_VERSION;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.ID;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.NAME;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.ORGANIZATION_ID;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.UPDATED_AT;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.UPDATED_BY;
import static io.github.suppierk.generator.vehicle.store.VehicleTable.VEHICLE;

import io.github.suppierk.generator.vehicle.Pagination;
import io.github.suppierk.generator.vehicle.Vehicle;
import io.github.suppierk.generator.vehicle.VehicleFilter;
import io.github.suppierk.generator.vehicle.VehicleInput;
import io.github.suppierk.generator.vehicle.VehicleSort;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SortField;
import org.jooq.impl.DSL;

/** {@link VehicleStore} kept in the {@code vehicle} table. Timestamps are epoch milliseconds. */
public final class JooqVehicleStore implements VehicleStore {
  /** {@inheritDoc} */
  @Override
  public Vehicle insert(final DSLContext dsl, final Vehicle vehicle) {
    insertRow(dsl, vehicle, 1L);
    return vehicle;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Vehicle> update(
      final DSLContext dsl,
      final String id,
      final VehicleInput input,
      final boolean merge,
      final String actor,
      final Instant at) {
    final Map<Field<?>, Object> changes = new LinkedHashMap<>();

    if (!merge || input.name() != null) {
      changes.put(NAME, input.name());
    }

    if (!merge || input.description() != null) {
      changes.put(DESCRIPTION, input.description());
    }

    if (!merge || input.active() != null) {
      changes.put(ACTIVE, Boolean.TRUE.equals(input.active()));
    }

    changes.put(UPDATED_BY, actor);
    changes.put(UPDATED_AT, at.toEpochMilli());

    final int updated =
        dsl.update(VEHICLE)
            .set(changes)
            .set(EVENT_VERSION, DSL.coalesce(EVENT_VERSION, 0L).plus(1L))
            .where(ID.eq(id))
            .execute();

    return updated == 0 ? Optional.empty() : findById(dsl, id);
  }

  /** {@inheritDoc} */
  @Override
  public int delete(final DSLContext dsl, final Collection<String> ids) {
    if (ids.isEmpty()) {
      return 0;
    }

    return dsl.deleteFrom(VEHICLE).where(ID.in(ids)).execute();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Vehicle> findById(final DSLContext dsl, final String id) {
    return dsl.selectFrom(VEHICLE).where(ID.eq(id)).fetchOptional(JooqVehicleStore::toVehicle);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Vehicle> findByIdAndOrganization(
      final DSLContext dsl, final String id, final String organizationId) {
    return dsl.selectFrom(VEHICLE)
        .where(ID.eq(id))
        .and(ORGANIZATION_ID.eq(organizationId))
        .fetchOptional(JooqVehicleStore::toVehicle);
  }

  /** {@inheritDoc} */
  @Override
  public List<Vehicle> list(
      final DSLContext dsl,
      final VehicleFilter filter,
      final Pagination pagination,
      final VehicleSort sort) {
    return dsl.selectFrom(VEHICLE)
        .where(conditionOf(filter))
        .orderBy(orderOf(sort), ID.asc())
        .limit(pagination.count())
        .offset(pagination.offset())
        .fetch(JooqVehicleStore::toVehicle);
  }

  /** {@inheritDoc} */
  @Override
  public long count(final DSLContext dsl, final VehicleFilter filter) {
    return dsl.fetchCount(VEHICLE, conditionOf(filter));
  }

  /** {@inheritDoc} */
  @Override
  public boolean upsertSnapshot(
      final DSLContext dsl, final Vehicle snapshot, final long aggregateVersion) {
    final var metadata = metadataOf(snapshot);

    final int updated =
        dsl.update(VEHICLE)
            .set(ORGANIZATION_ID, snapshot.organizationId())
            .set(NAME, snapshot.name())
            .set(DESCRIPTION, snapshot.description())
            .set(ACTIVE, snapshot.active())
            .set(CREATED_BY, metadata.createdBy())
            .set(CREATED_AT, toMillis(metadata.createdAt()))
            .set(UPDATED_BY, metadata.updatedBy())
            .set(UPDATED_AT, toMillis(metadata.updatedAt()))
            .set(EVENT_VERSION, aggregateVersion)
            .where(ID.eq(snapshot.id()))
            .and(EVENT_VERSION.isNull().or(EVENT_VERSION.le(aggregateVersion)))
            .execute();

    if (updated > 0) {
      return true;
    }

    if (dsl.fetchExists(VEHICLE, ID.eq(snapshot.id()))) {
      return false;
    }

    insertRow(dsl, snapshot, aggregateVersion);
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Long> aggregateVersionOf(final DSLContext dsl, final String id) {
    return dsl.select(EVENT_VERSION).from(VEHICLE).where(ID.eq(id)).fetchOptional(EVENT_VERSION);
  }

  private static void insertRow(
      final DSLContext dsl, final Vehicle vehicle, final long aggregateVersion) {
    final var metadata = metadataOf(vehicle);

    dsl.insertInto(VEHICLE)
        .set(ID, vehicle.id())
        .set(ORGANIZATION_ID, vehicle.organizationId())
        .set(NAME, vehicle.name())
        .set(DESCRIPTION, vehicle.description())
        .set(ACTIVE, vehicle.active())
        .set(CREATED_BY, metadata.createdBy())
        .set(CREATED_AT, toMillis(metadata.createdAt()))
        .set(UPDATED_BY, metadata.updatedBy())
        .set(UPDATED_AT, toMillis(metadata.updatedAt()))
        .set(EVENT_VERSION, aggregateVersion)
        .execute();
  }

  private static Condition conditionOf(final VehicleFilter filter) {
    Condition condition = DSL.noCondition();

    if (filter.organizationId() != null) {
      condition = condition.and(ORGANIZATION_ID.eq(filter.organizationId()));
    }

    if (filter.name() != null && !filter.name().isBlank()) {
      condition = condition.and(NAME.containsIgnoreCase(filter.name()));
    }

    if (filter.active() != null) {
      condition = condition.and(ACTIVE.eq(filter.active()));
    }

    return condition;
  }

  private static SortField<?> orderOf(final VehicleSort sort) {
    final Field<?> field =
        switch (sort.field()) {
          case NAME -> NAME;
          case ACTIVE -> ACTIVE;
          case ORGANIZATION_ID -> ORGANIZATION_ID;
          case CREATED_AT -> CREATED_AT;
          case UPDATED_AT -> UPDATED_AT;
        };

    return sort.ascending() ? field.asc() : field.desc();
  }

  private static Vehicle toVehicle(final Record dbRecord) {
    return new Vehicle(
        dbRecord.get(ID),
        dbRecord.get(ORGANIZATION_ID),
        dbRecord.get(NAME),
        dbRecord.get(DESCRIPTION),
        Boolean.TRUE.equals(dbRecord.get(ACTIVE)),
        new Vehicle.Metadata(
            dbRecord.get(CREATED_BY),
            toInstant(dbRecord.get(CREATED_AT)),
            dbRecord.get(UPDATED_BY),
            toInstant(dbRecord.get(UPDATED_AT))));
  }

  private static Vehicle.Metadata metadataOf(final Vehicle vehicle) {
    return vehicle.metadata() == null
        ? new Vehicle.Metadata(null, null, null, null)
        : vehicle.metadata();
  }

  private static Long toMillis(final Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }

  private static Instant toInstant(final Long millis) {
    return millis == null ? null : Instant.ofEpochMilli(millis);
  }
}
