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

package io.github.suppierk.generator.cqrs;

import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.List;

/**
 * Represents an immutable command which must mutate an aggregate as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Every successful command results in exactly one stored mutation per aggregate and exactly one
 * domain event per aggregate it touched; a failed command results in neither.
 *
 * <p>Three of the four CRUD operations are commands. The {@code sealed} hierarchy forces users to
 * pick one of them rather than defining a command completely on their own, which is what lets
 * {@link DomainCommandHandler} derive the matching modification type for the emitted event.
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public sealed interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>
permits
  DomainCommand.Create,
  DomainCommand.Update,
  DomainCommand.BatchDelete
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate, whose identifier is assigned by the handler.
   */
  // @formatter:off
  non-sealed interface Create<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {}
  // @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to update an
   * existing aggregate.
   */
  // @formatter:off
  non-sealed interface Update<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return identifier of the aggregate to update
     */
    String aggregateId();

    /**
     * @return {@code true} to only overwrite the fields present in the command, {@code false} to
     *     replace all mutable fields
     */
    boolean merge();
  }

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to delete
   * multiple existing aggregates in one go.
   */
  // @formatter:off
  non-sealed interface BatchDelete<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return identifiers of the aggregates to delete, which are not required to exist
     */
    List<String> aggregateIds();
  }
}
