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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Intent to delete vehicles.
 *
 * @param messageId of this command
 * @param createdAt when this command was issued
 * @param domainClient who issued this command
 * @param aggregateIds of the vehicles, absent ones are tolerated
 */
public record DeleteVehicles(
    UUID messageId, Instant createdAt, DomainClient domainClient, List<String> aggregateIds)
    implements DomainCommand.BatchDelete<UUID, Instant> {
  public DeleteVehicles {
    // Null entries are kept, the handler rejects them
    aggregateIds =
        aggregateIds == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(aggregateIds));
  }

  public static DeleteVehicles of(final DomainClient domainClient, final List<String> ids) {
    return new DeleteVehicles(UUID.randomUUID(), Instant.now(), domainClient, ids);
  }
}
