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

package io.github.suppierk.generator.authorization;

/**
 * A {@link DomainClient} resolved by the gateway from the caller's token.
 *
 * @param clientName preferred username of the caller
 * @param domainRole role the gateway granted access with, e.g. {@code VEHICLE_WRITE}
 */
public record AuthenticatedClient(String clientName, String domainRole) implements DomainClient {
  public AuthenticatedClient {
    if (clientName == null || clientName.isBlank()) {
      throw new IllegalArgumentException("Client name cannot be blank");
    }

    if (domainRole == null || domainRole.isBlank()) {
      throw new IllegalArgumentException("Domain role cannot be blank");
    }
  }
}
