package io.github.suppierk.generator.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.generator.async.DomainNotification;
import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.cqrs.CommandResult;
import io.github.suppierk.test.DirectExecutorService;
import io.github.suppierk.test.RecordingFanoutChannel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GenerationEngineTest {
  static final String FEED = "fleet/vehicles/generated";
  static final String LIVE = "generator-ui-gateway-websocket-updates";
  static final Duration TICK = Duration.ofMillis(10);
  static final Duration PATIENCE = Duration.ofSeconds(5);
  static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  RecordingFanoutChannel channel;
  GenerationEngine engine;

  @BeforeEach
  void setUp() {
    channel = new RecordingFanoutChannel();
    engine = newEngine(CLOCK);
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  GenerationEngine newEngine(final Clock clock) {
    return new GenerationEngine(
        GenerationEngine.newScheduler(),
        new FanoutDispatcher(channel, new DirectExecutorService()),
        new GeneratedVehicleFactory(new Random(5L)),
        TICK,
        FEED,
        LIVE,
        clock);
  }

  static void awaitUntil(final BooleanSupplier condition) throws InterruptedException {
    final long deadline = System.nanoTime() + PATIENCE.toNanos();

    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met within " + PATIENCE);
      }

      Thread.sleep(5L);
    }
  }

  @Nested
  class Lifecycle {
    @Test
    void fresh_engine_is_stopped() {
      assertEquals(new GenerationStatus(false, 0L), engine.status());
    }

    @Test
    void started_engine_keeps_generating() throws InterruptedException {
      assertEquals(CommandResult.ok(GenerationEngine.STARTED), engine.start());

      awaitUntil(() -> engine.status().generatedCount() >= 3);
      assertTrue(engine.status().isGenerating());
    }

    @Test
    void second_start_is_rejected_and_keeps_the_run() throws InterruptedException {
      engine.start();
      awaitUntil(() -> engine.status().generatedCount() >= 2);

      assertEquals(CommandResult.rejected(GenerationEngine.ALREADY_RUNNING), engine.start());
      assertTrue(engine.status().generatedCount() >= 2);

      engine.stop();
      final long generated = engine.status().generatedCount();
      awaitUntil(() -> channel.publishedTo(LIVE).size() >= generated);

      // A second schedule would publish more than one live update per count
      assertEquals(generated, channel.publishedTo(LIVE).size());
    }

    @Test
    void concurrent_starts_begin_exactly_one_run() throws Exception {
      final int threads = 8;
      final var ready = new CountDownLatch(threads);
      final var go = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(threads);
      final List<CommandResult> results = new ArrayList<>();
      try {
        final List<Future<CommandResult>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
          futures.add(
              executor.submit(
                  () -> {
                    ready.countDown();
                    go.await();
                    return engine.start();
                  }));
        }
        ready.await();
        go.countDown();

        for (final var future : futures) {
          results.add(future.get(5, TimeUnit.SECONDS));
        }
      } finally {
        executor.shutdownNow();
      }

      assertEquals(
          1, results.stream().filter(CommandResult.ok(GenerationEngine.STARTED)::equals).count());
      assertEquals(
          threads - 1,
          results.stream()
              .filter(CommandResult.rejected(GenerationEngine.ALREADY_RUNNING)::equals)
              .count());

      awaitUntil(() -> engine.status().generatedCount() >= 3);
      engine.stop();
      final long generated = engine.status().generatedCount();
      awaitUntil(() -> channel.publishedTo(LIVE).size() >= generated);

      final var counts =
          channel.publishedTo(LIVE).stream()
              .map(notification -> (LiveGenerationUpdate) notification.payload())
              .map(LiveGenerationUpdate::generatedCount)
              .sorted()
              .toList();
      assertEquals(LongStream.rangeClosed(1L, generated).boxed().toList(), counts);
    }

    @Test
    void stopped_engine_keeps_its_count() throws InterruptedException {
      engine.start();
      awaitUntil(() -> engine.status().generatedCount() >= 2);

      assertEquals(CommandResult.ok(GenerationEngine.STOPPED), engine.stop());
      final var stopped = engine.status();
      Thread.sleep(TICK.multipliedBy(5).toMillis());

      assertFalse(stopped.isGenerating());
      assertEquals(stopped, engine.status());
    }

    @Test
    void stop_without_run_is_rejected() {
      assertEquals(CommandResult.rejected(GenerationEngine.NOT_RUNNING), engine.stop());
    }

    @Test
    void restart_begins_a_new_count() throws InterruptedException {
      engine.start();
      awaitUntil(() -> engine.status().generatedCount() >= 3);
      engine.stop();

      engine.start();
      engine.stop();

      assertTrue(engine.status().generatedCount() <= 1);
    }

    @Test
    void closed_engine_cannot_start() {
      engine.close();

      assertThrows(IllegalStateException.class, engine::start);
      assertFalse(engine.status().isGenerating());
    }
  }

  @Nested
  class Publications {
    @Test
    void every_vehicle_reaches_both_topics() throws InterruptedException {
      engine.start();
      awaitUntil(() -> engine.status().generatedCount() >= 3);
      engine.stop();
      final long generated = engine.status().generatedCount();
      awaitUntil(() -> channel.publishedTo(LIVE).size() >= generated);

      final List<DomainNotification<?, ?>> feed = channel.publishedTo(FEED);
      final List<DomainNotification<?, ?>> live = channel.publishedTo(LIVE);
      assertEquals(generated, feed.size());
      assertEquals(generated, live.size());

      for (int i = 0; i < feed.size(); i++) {
        final var envelope =
            assertInstanceOf(GeneratedVehicleEnvelope.class, feed.get(i).payload());
        final var update = assertInstanceOf(LiveGenerationUpdate.class, live.get(i).payload());

        assertEquals(GenerationEngine.MESSAGE_TYPE, feed.get(i).messageType());
        assertEquals(GenerationEngine.MESSAGE_TYPE, live.get(i).messageType());
        assertEquals("Vehicle", envelope.at());
        assertEquals("Generated", envelope.et());
        assertEquals(ContentAddress.of(envelope.data()), envelope.aid());
        assertEquals(CLOCK.instant(), envelope.timestamp());
        assertEquals(envelope, update.data());
        assertEquals(i + 1L, update.generatedCount());
      }
    }

    @Test
    void failing_tick_does_not_end_the_run() throws InterruptedException {
      final var calls = new AtomicInteger();
      final Clock flakyClock =
          new Clock() {
            @Override
            public ZoneId getZone() {
              return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
              return this;
            }

            @Override
            public Instant instant() {
              if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("Clock is not ready");
              }

              return CLOCK.instant();
            }
          };

      engine.close();
      engine = newEngine(flakyClock);
      engine.start();

      awaitUntil(() -> channel.publishedTo(FEED).size() >= 2);
      final int published = channel.publishedTo(FEED).size();

      assertTrue(engine.status().isGenerating());
      assertTrue(engine.status().generatedCount() > published);
    }
  }

  @Test
  void invalid_arguments_are_rejected() {
    final var dispatcher = new FanoutDispatcher(channel, new DirectExecutorService());
    final var factory = new GeneratedVehicleFactory(new Random());
    final var scheduler = GenerationEngine.newScheduler();

    try {
      assertThrows(
          IllegalArgumentException.class,
          () -> new GenerationEngine(null, dispatcher, factory, TICK, FEED, LIVE, CLOCK));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new GenerationEngine(
                  scheduler, dispatcher, factory, Duration.ZERO, FEED, LIVE, CLOCK));
      assertThrows(
          IllegalArgumentException.class,
          () -> new GenerationEngine(scheduler, dispatcher, factory, TICK, " ", LIVE, CLOCK));
      assertThrows(
          IllegalArgumentException.class,
          () -> new GenerationEngine(scheduler, dispatcher, factory, TICK, FEED, null, CLOCK));
      assertThrows(
          IllegalArgumentException.class,
          () -> new GenerationEngine(scheduler, dispatcher, null, TICK, FEED, LIVE, CLOCK));
    } finally {
      scheduler.shutdownNow();
    }
  }
}
