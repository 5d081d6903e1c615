package io.github.suppierk.generator.async;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.DirectExecutorService;
import io.github.suppierk.test.RecordingFanoutChannel;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class FanoutDispatcherTest {
  static final DomainNotification<?, ?> NOTIFICATION =
      FanoutNotification.of("topic", "Something", "payload");

  @Test
  void when_constructor_arguments_are_missing_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new FanoutDispatcher(null, new DirectExecutorService()));
    assertThrows(
        IllegalArgumentException.class, () -> new FanoutDispatcher(FanoutChannel.empty(), null));
    assertThrows(
        IllegalArgumentException.class,
        () -> FanoutDispatcher.withThreads(FanoutChannel.empty(), 0, 10));
    assertThrows(
        IllegalArgumentException.class,
        () -> FanoutDispatcher.withThreads(FanoutChannel.empty(), 1, 0));
  }

  @Test
  void when_notification_is_null_illegal_argument_must_be_thrown() {
    final var dispatcher = new FanoutDispatcher(FanoutChannel.empty(), new DirectExecutorService());
    assertThrows(IllegalArgumentException.class, () -> dispatcher.dispatch(null));
  }

  @Test
  void dispatched_notification_reaches_the_channel() {
    final var channel = new RecordingFanoutChannel();
    final var dispatcher = new FanoutDispatcher(channel, new DirectExecutorService());

    dispatcher.dispatch(NOTIFICATION);

    assertEquals(1, channel.published().size());
    assertEquals(NOTIFICATION, channel.published().get(0));
  }

  @Test
  void when_channel_fails_dispatch_never_reports_it() {
    final var dispatcher =
        new FanoutDispatcher(
            notification -> {
              throw new IllegalStateException("Broker is down");
            },
            new DirectExecutorService());

    assertDoesNotThrow(() -> dispatcher.dispatch(NOTIFICATION));
  }

  @Test
  void when_dispatcher_is_closed_notifications_are_dropped_silently() {
    final var channel = new RecordingFanoutChannel();
    final var dispatcher = new FanoutDispatcher(channel, new DirectExecutorService());

    dispatcher.close();

    assertDoesNotThrow(() -> dispatcher.dispatch(NOTIFICATION));
    assertTrue(channel.published().isEmpty());
  }

  @Test
  void dispatch_does_not_wait_for_a_slow_channel() throws InterruptedException {
    final var release = new CountDownLatch(1);
    final var delivered = new CountDownLatch(1);
    final var dispatcher =
        FanoutDispatcher.withThreads(
            notification -> {
              try {
                release.await(5, TimeUnit.SECONDS);
                delivered.countDown();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            1,
            10);

    try {
      dispatcher.dispatch(NOTIFICATION);
      assertEquals(1, delivered.getCount());

      release.countDown();
      assertTrue(delivered.await(5, TimeUnit.SECONDS));
    } finally {
      dispatcher.close();
    }
  }

  @Test
  void when_queue_is_full_further_notifications_are_dropped() throws InterruptedException {
    final var started = new CountDownLatch(1);
    final var release = new CountDownLatch(1);
    final var published = new AtomicInteger();
    final var dispatcher =
        FanoutDispatcher.withThreads(
            notification -> {
              started.countDown();

              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }

              published.incrementAndGet();
            },
            1,
            1);

    try {
      dispatcher.dispatch(NOTIFICATION);
      assertTrue(started.await(5, TimeUnit.SECONDS));

      // One publication is running, one waits in the queue
      dispatcher.dispatch(NOTIFICATION);
      assertDoesNotThrow(() -> dispatcher.dispatch(NOTIFICATION));
      assertDoesNotThrow(() -> dispatcher.dispatch(NOTIFICATION));

      release.countDown();
    } finally {
      dispatcher.close();
    }

    assertEquals(2, published.get());
  }
}
