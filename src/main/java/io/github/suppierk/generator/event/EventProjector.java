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

/**
 * Re-derives materialized state from a {@link StoredEvent}.
 *
 * <p>Implementations must be idempotent: applying the same event twice leaves the same state as
 * applying it once.
 */
@FunctionalInterface
public interface EventProjector {
  /**
   * @param storedEvent to apply
   */
  void apply(final StoredEvent storedEvent);

  /**
   * @param storedEvent to check
   * @return {@code true} if this projector understands the event, others are skipped on replay
   */
  default boolean supports(final StoredEvent storedEvent) {
    return true;
  }
}
