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

import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.cqrs.DomainQuery;
import java.time.Instant;
import java.util.UUID;

/**
 * Reads a page of vehicles. Absent filter, pagination or sort fall back to their defaults.
 *
 * @param messageId of this query
 * @param createdAt when this query was issued
 * @param domainClient who issued this query
 * @param filter to apply
 * @param pagination page to return
 * @param sort order of the page
 */
public record ListVehicles(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    VehicleFilter filter,
    Pagination pagination,
    VehicleSort sort)
    implements DomainQuery.Many<UUID, Instant> {
  public ListVehicles {
    filter = filter == null ? VehicleFilter.NONE : filter;
    pagination = pagination == null ? Pagination.DEFAULT : pagination;
    sort = sort == null ? VehicleSort.DEFAULT : sort;
  }

  public static ListVehicles of(
      final DomainClient domainClient,
      final VehicleFilter filter,
      final Pagination pagination,
      final VehicleSort sort) {
    return new ListVehicles(
        UUID.randomUUID(), Instant.now(), domainClient, filter, pagination, sort);
  }
}
