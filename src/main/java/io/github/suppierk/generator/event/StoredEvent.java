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
 * {@link DomainEvent} as the {@link EventLog} returns it.
 *
 * @param sequence global append order, replay follows it
 * @param aggregateVersion position of the event among the events of its aggregate, starting at 1
 * @param event itself
 */
public record StoredEvent(long sequence, long aggregateVersion, DomainEvent event) {
  public StoredEvent {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (aggregateVersion < 1) {
      throw new IllegalArgumentException("Aggregate version starts at 1");
    }
  }
}
