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

package io.github.suppierk.generator.async;

import java.time.Instant;
import java.util.UUID;

/**
 * Default {@link DomainNotification} implementation.
 *
 * @param messageId of this notification
 * @param createdAt when this notification was built
 * @param topic to publish to
 * @param messageType to publish with
 * @param payload to publish
 */
@SuppressWarnings("squid:S1948")
public record FanoutNotification(
    UUID messageId, Instant createdAt, String topic, String messageType, Object payload)
    implements DomainNotification<UUID, Instant> {
  public FanoutNotification {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Topic cannot be blank");
    }

    if (messageType == null || messageType.isBlank()) {
      throw new IllegalArgumentException("Message type cannot be blank");
    }

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }
  }

  /**
   * @param topic to publish to
   * @param messageType to publish with
   * @param payload to publish
   * @return a new notification stamped with a random identifier and the current time
   */
  public static FanoutNotification of(String topic, String messageType, Object payload) {
    return new FanoutNotification(UUID.randomUUID(), Instant.now(), topic, messageType, payload);
  }
}
