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
import io.github.suppierk.generator.cqrs.DomainCommand;
import java.time.Instant;
import java.util.UUID;

/**
 * Intent to update a vehicle.
 *
 * @param messageId of this command
 * @param createdAt when this command was issued
 * @param domainClient who issued this command
 * @param aggregateId of the vehicle
 * @param input new field values
 * @param merge {@code true} to keep the fields absent from the input, {@code false} to reset them
 */
public record UpdateVehicle(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    String aggregateId,
    VehicleInput input,
    boolean merge)
    implements DomainCommand.Update<UUID, Instant> {
  public static UpdateVehicle of(
      final DomainClient domainClient,
      final String aggregateId,
      final VehicleInput input,
      final boolean merge) {
    return new UpdateVehicle(
        UUID.randomUUID(), Instant.now(), domainClient, aggregateId, input, merge);
  }
}
