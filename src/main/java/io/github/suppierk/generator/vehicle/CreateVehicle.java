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
 * Intent to create a vehicle. {@code active} defaults to {@code false} when absent.
 *
 * @param messageId of this command
 * @param createdAt when this command was issued
 * @param domainClient who issued this command
 * @param input fields of the new vehicle
 */
public record CreateVehicle(
    UUID messageId, Instant createdAt, DomainClient domainClient, VehicleInput input)
    implements DomainCommand.Create<UUID, Instant> {
  public static CreateVehicle of(final DomainClient domainClient, final VehicleInput input) {
    return new CreateVehicle(UUID.randomUUID(), Instant.now(), domainClient, input);
  }
}
