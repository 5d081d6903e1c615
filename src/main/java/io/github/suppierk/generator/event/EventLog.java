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

package io.github.suppierk.generator.event;

import java.util.List;
import org.jooq.DSLContext;

/**
 * Append-only log of {@link DomainEvent}s, ordered per aggregate id.
 *
 * <p>Appends take the {@link DSLContext} of the caller so that an event can be committed or rolled
 * back together with the store write it describes.
 */
public interface EventLog {
  /**
   * Appends the event as the next version of its aggregate. Does not open a transaction of its own.
   *
   * @param dsl to write with, usually the one of an ongoing transaction
   * @param event to append
   */
  void append(final DSLContext dsl, final DomainEvent event);

  /**
   * @param afterSequence exclusive lower bound, {@code 0} to start from the beginning
   * @param limit maximum amount of events to return
   * @return events in append order
   */
  List<StoredEvent> readAfter(final long afterSequence, final int limit);

  /**
   * @param aggregateId to read the history of
   * @return events of the aggregate in version order
   */
  List<StoredEvent> readAggregate(final String aggregateId);
}
