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

import io.github.suppierk.generator.cqrs.DomainMessage;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Represents a notification about a change within the system, addressed to a named topic of a
 * {@link FanoutChannel}.
 *
 * <p>Notifications are a courtesy towards real-time subscribers, not a source of truth: they are
 * delivered at least once, with no ordering across topics, and losing one never fails the
 * operation which produced it.
 *
 * @param <I> is the type of this notification identifier
 * @param <T> is the type of the timestamp when this notification was created
 */
// @formatter:off
public interface DomainNotification<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T> {
// @formatter:on

  /**
   * @return name of the topic to publish to
   */
  String topic();

  /**
   * @return name subscribers use to tell messages on the same topic apart
   */
  String messageType();

  /**
   * @return body of the message, encoded by the channel implementation
   */
  Object payload();
}
