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

import java.io.Serial;

/**
 * Thrown on replay of an event whose {@link DomainEvent#eventTypeVersion()} has no decoding
 * strategy. Version {@code 0} never had one.
 */
public class UnsupportedEventVersionException extends IllegalStateException {
  @Serial private static final long serialVersionUID = 3165820981536517395L;

  private final int eventTypeVersion;

  public UnsupportedEventVersionException(final String eventType, final int eventTypeVersion) {
    super("%s version %d is not supported".formatted(eventType, eventTypeVersion));
    this.eventTypeVersion = eventTypeVersion;
  }

  public int getEventTypeVersion() {
    return eventTypeVersion;
  }
}
