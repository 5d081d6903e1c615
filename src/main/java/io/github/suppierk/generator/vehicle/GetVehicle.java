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
 * Reads one vehicle of an organization.
 *
 * @param messageId of this query
 * @param createdAt when this query was issued
 * @param domainClient who issued this query
 * @param aggregateId of the vehicle
 * @param organizationId which must own the vehicle
 */
public record GetVehicle(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    String aggregateId,
    String organizationId)
    implements DomainQuery.One<UUID, Instant> {
  public static GetVehicle of(
      final DomainClient domainClient, final String aggregateId, final String organizationId) {
    return new GetVehicle(
        UUID.randomUUID(), Instant.now(), domainClient, aggregateId, organizationId);
  }
}
