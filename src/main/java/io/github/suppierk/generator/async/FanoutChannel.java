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

/**
 * Abstract contract for an entity which is able to publish {@link DomainNotification}s to named
 * topics for real-time subscribers.
 *
 * <p>Implementations may block on I/O and may throw; callers on a hot path must go through {@link
 * FanoutDispatcher}, which detaches the call and only logs failures.
 */
@FunctionalInterface
public interface FanoutChannel {
  /**
   * @return an instance of channel which does not perform any operations
   */
  static FanoutChannel empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Publishes {@link DomainNotification} to {@link DomainNotification#topic()}.
   *
   * @param notification to publish
   */
  void publish(final DomainNotification<?, ?> notification);

  /** Default implementation of the fake channel */
  final class NoOp implements FanoutChannel {
    private static final FanoutChannel INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainNotification<?, ?> notification) {
      // Do nothing
    }
  }
}
