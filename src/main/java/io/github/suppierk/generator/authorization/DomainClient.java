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

import java.io.Serializable;

/**
 * Represents an already authenticated actor interacting with the service.
 *
 * <p>Authentication and role checks happen in the gateway in front of this service, so {@link
 * DomainClient} only carries what the service needs afterwards: a name to stamp into aggregate
 * metadata and domain events, and a role used primarily for error reporting.
 */
public interface DomainClient extends Serializable {
  /**
   * @return assumed client's role within the domain used primarily for error reporting
   */
  String domainRole();

  /**
   * @return the name recorded as {@code createdBy} / {@code updatedBy} and as the event actor
   */
  String clientName();
}
