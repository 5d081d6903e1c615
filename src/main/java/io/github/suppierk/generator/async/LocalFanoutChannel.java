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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link FanoutChannel} delivering every notification to the subscribers of its topic.
 *
 * <p>Each subscriber may carry a filter, which is how a per-aggregate real-time stream is built on
 * top of a shared topic. Subscribers are isolated from each other: one throwing does not prevent
 * the rest from receiving the notification.
 */
public final class LocalFanoutChannel implements FanoutChannel {
  private static final Logger LOG = LoggerFactory.getLogger(LocalFanoutChannel.class);

  private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

  /**
   * Subscribes to every notification of the topic.
   *
   * @param topic to listen to
   * @param listener to invoke
   * @return handle to unsubscribe with
   */
  public Subscription subscribe(
      final String topic, final Consumer<DomainNotification<?, ?>> listener) {
    return subscribe(topic, notification -> true, listener);
  }

  /**
   * Subscribes to the notifications of the topic which pass the filter.
   *
   * @param topic to listen to
   * @param filter to apply before delivery
   * @param listener to invoke
   * @return handle to unsubscribe with
   */
  public Subscription subscribe(
      final String topic,
      final Predicate<DomainNotification<?, ?>> filter,
      final Consumer<DomainNotification<?, ?>> listener) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Topic cannot be blank");
    }

    if (filter == null) {
      throw new IllegalArgumentException("Filter cannot be null");
    }

    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null");
    }

    final var subscription = new Subscription(topic, filter, listener);
    subscriptions.computeIfAbsent(topic, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
    return subscription;
  }

  /**
   * @param topic to inspect
   * @return amount of active subscribers of the topic
   */
  public int subscriberCount(final String topic) {
    return subscriptions.getOrDefault(topic, List.of()).size();
  }

  /** {@inheritDoc} */
  @Override
  public void publish(final DomainNotification<?, ?> notification) {
    if (notification == null) {
      throw new IllegalArgumentException("Notification cannot be null");
    }

    for (Subscription subscription : subscriptions.getOrDefault(notification.topic(), List.of())) {
      try {
        if (subscription.filter.test(notification)) {
          subscription.listener.accept(notification);
        }
      } catch (RuntimeException e) {
        LOG.warn(
            "Subscriber of topic '{}' failed to handle '{}'",
            notification.topic(),
            notification.messageType(),
            e);
      }
    }
  }

  /** Handle of a single subscriber, closing it stops the delivery. */
  public final class Subscription implements AutoCloseable {
    private final String topic;
    private final Predicate<DomainNotification<?, ?>> filter;
    private final Consumer<DomainNotification<?, ?>> listener;

    private Subscription(
        final String topic,
        final Predicate<DomainNotification<?, ?>> filter,
        final Consumer<DomainNotification<?, ?>> listener) {
      this.topic = topic;
      this.filter = filter;
      this.listener = listener;
    }

    @Override
    public void close() {
      final var topicSubscriptions = subscriptions.get(topic);

      if (topicSubscriptions != null) {
        topicSubscriptions.remove(this);
      }
    }
  }
}
