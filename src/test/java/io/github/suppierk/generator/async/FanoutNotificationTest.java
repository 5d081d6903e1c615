package io.github.suppierk.generator.async;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FanoutNotificationTest {
  @Test
  void when_topic_type_or_payload_is_missing_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> FanoutNotification.of(null, "Type", "p"));
    assertThrows(IllegalArgumentException.class, () -> FanoutNotification.of("topic", "", "p"));
    assertThrows(IllegalArgumentException.class, () -> FanoutNotification.of("topic", "Type", null));
  }

  @Test
  void every_notification_gets_its_own_identifier() {
    final var first = FanoutNotification.of("topic", "Type", "payload");
    final var second = FanoutNotification.of("topic", "Type", "payload");

    assertNotNull(first.messageId());
    assertNotNull(first.createdAt());
    assertNotEquals(first.messageId(), second.messageId());
  }

  @Test
  void empty_channel_accepts_anything() {
    assertDoesNotThrow(() -> FanoutChannel.empty().publish(null));
  }
}
