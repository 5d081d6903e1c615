package io.github.suppierk.generator.vehicle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.authorization.AuthenticatedClient;
import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.cqrs.CommandResult;
import io.github.suppierk.generator.cqrs.NotFoundException;
import io.github.suppierk.generator.cqrs.ValidationException;
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventLog;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.event.StoredEvent;
import io.github.suppierk.generator.jooq.DslContextProvider;
import io.github.suppierk.generator.jooq.JooqEventLog;
import io.github.suppierk.generator.vehicle.store.JooqVehicleStore;
import io.github.suppierk.test.DirectExecutorService;
import io.github.suppierk.test.RecordingFanoutChannel;
import io.github.suppierk.test.TestDatabase;
import io.github.suppierk.test.TickingClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VehicleContextTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.open("vehicle_context");
  static final DslContextProvider DSL_CONTEXT_PROVIDER = DslContextProvider.fixed(DSL_CONTEXT);
  static final String TOPIC = "generator-ui-gateway-materialized-view-updates";
  static final DomainClient ALICE = new AuthenticatedClient("alice", "OPERATOR");
  static final DomainClient BOB = new AuthenticatedClient("bob", "OPERATOR");
  static final String ORGANIZATION = "org-1";

  RecordingFanoutChannel channel;
  JooqEventLog eventLog;
  VehicleContext context;

  @BeforeEach
  void setUp() {
    TestDatabase.clean(DSL_CONTEXT);
    channel = new RecordingFanoutChannel();
    eventLog = new JooqEventLog(DSL_CONTEXT);
    context = newContext(eventLog);
  }

  VehicleContext newContext(final EventLog log) {
    return new VehicleContext(
        DSL_CONTEXT_PROVIDER,
        DSL_CONTEXT_PROVIDER,
        log,
        new FanoutDispatcher(channel, new DirectExecutorService()),
        new JooqVehicleStore(),
        TOPIC,
        new TickingClock(Instant.parse("2024-05-01T10:00:00Z"), Duration.ofSeconds(1)));
  }

  /** Delegates to the real log but fails to append events of the given aggregates. */
  EventLog failingFor(final Set<String> aggregateIds) {
    return new EventLog() {
      @Override
      public void append(DSLContext dsl, DomainEvent event) {
        if (aggregateIds.contains(event.aggregateId())) {
          throw new IllegalStateException("Event log rejected " + event.aggregateId());
        }

        eventLog.append(dsl, event);
      }

      @Override
      public List<StoredEvent> readAfter(long afterSequence, int limit) {
        return eventLog.readAfter(afterSequence, limit);
      }

      @Override
      public List<StoredEvent> readAggregate(String aggregateId) {
        return eventLog.readAggregate(aggregateId);
      }
    };
  }

  Vehicle createTruck(final String name, final String description, final Boolean active) {
    return context.create(ALICE, new VehicleInput(ORGANIZATION, name, description, active));
  }

  List<ModificationType> modificationTypesOf(final String id) {
    return eventLog.readAggregate(id).stream()
        .map(stored -> stored.event().modificationType())
        .toList();
  }

  @Test
  void every_vehicle_command_and_query_has_a_handler() {
    assertEquals(
        Set.of(CreateVehicle.class, UpdateVehicle.class, DeleteVehicles.class),
        context.getSupportedDomainCommandClasses());
    assertEquals(
        Set.of(GetVehicle.class, ListVehicles.class), context.getSupportedDomainQueryClasses());
  }

  @Nested
  class Create {
    @Test
    void created_vehicle_reads_back_identically() {
      final var created = createTruck("Truck A", null, true);

      assertNotNull(created.id());
      assertEquals("Truck A", created.name());
      assertTrue(created.active());
      assertNull(created.description());
      assertEquals("alice", created.metadata().createdBy());
      assertEquals(created.metadata().createdAt(), created.metadata().updatedAt());

      assertEquals(created, context.get(BOB, created.id(), ORGANIZATION));
    }

    @Test
    void active_defaults_to_false() {
      assertFalse(createTruck("Truck A", null, null).active());
    }

    @Test
    void creation_appends_one_event_and_publishes_the_vehicle() {
      final var created = createTruck("Truck A", "Blue", true);

      final var events = eventLog.readAggregate(created.id());
      assertEquals(1, events.size());
      assertEquals(1L, events.get(0).aggregateVersion());
      assertEquals(ModificationType.CREATE, events.get(0).event().modificationType());
      assertEquals("Truck A", events.get(0).event().data().get("name"));
      assertEquals("alice", events.get(0).event().actor());

      final var published = channel.publishedTo(TOPIC);
      assertEquals(1, published.size());
      assertEquals(VehicleEvents.MATERIALIZED_VIEW_MESSAGE_TYPE, published.get(0).messageType());
      assertEquals(created, published.get(0).payload());
    }

    @Test
    void invalid_input_is_rejected_before_any_side_effect() {
      assertThrows(
          ValidationException.class,
          () -> context.create(ALICE, new VehicleInput(ORGANIZATION, " ", null, true)));
      assertThrows(
          ValidationException.class,
          () -> context.create(ALICE, new VehicleInput(null, "Truck A", null, true)));
      assertThrows(
          ValidationException.class,
          () -> context.create(ALICE, new VehicleInput(ORGANIZATION, "x".repeat(257), null, true)));
      assertThrows(ValidationException.class, () -> context.create(ALICE, null));

      assertTrue(eventLog.readAfter(0L, 10).isEmpty());
      assertTrue(channel.published().isEmpty());
      assertEquals(0, context.list(ALICE, null, new Pagination(0, 10, true), null).totalResultCount());
    }

    @Test
    void when_event_cannot_be_appended_vehicle_is_not_created() {
      final var failing =
          newContext(
              new EventLog() {
                @Override
                public void append(DSLContext dsl, DomainEvent event) {
                  throw new IllegalStateException("Event log is down");
                }

                @Override
                public List<StoredEvent> readAfter(long afterSequence, int limit) {
                  return List.of();
                }

                @Override
                public List<StoredEvent> readAggregate(String aggregateId) {
                  return List.of();
                }
              });

      assertThrows(
          IllegalStateException.class,
          () -> failing.create(ALICE, new VehicleInput(ORGANIZATION, "Truck A", null, true)));

      assertTrue(context.list(ALICE, null, null, null).listing().isEmpty());
      assertTrue(channel.publishedTo(TOPIC).isEmpty());
    }
  }

  @Nested
  class Update {
    @Test
    void merge_overwrites_only_present_fields() {
      final var created = createTruck("Truck A", "Blue", true);

      final var updated =
          context.update(BOB, created.id(), new VehicleInput(null, "Truck B", null, null), true);

      assertEquals("Truck B", updated.name());
      assertEquals("Blue", updated.description());
      assertTrue(updated.active());
      assertEquals(ORGANIZATION, updated.organizationId());
      assertEquals("alice", updated.metadata().createdBy());
      assertEquals("bob", updated.metadata().updatedBy());
      assertTrue(updated.metadata().updatedAt().isAfter(created.metadata().createdAt()));
      assertEquals(updated, context.get(ALICE, created.id(), ORGANIZATION));
    }

    @Test
    void replace_resets_absent_fields() {
      final var created = createTruck("Truck A", "Blue", true);

      final var replaced =
          context.update(BOB, created.id(), new VehicleInput(null, "Truck C", null, null), false);

      assertEquals("Truck C", replaced.name());
      assertNull(replaced.description());
      assertFalse(replaced.active());
    }

    @Test
    void every_update_appends_an_event_with_the_next_version() {
      final var created = createTruck("Truck A", "Blue", true);

      context.update(BOB, created.id(), new VehicleInput(null, null, "Red", null), true);
      context.update(BOB, created.id(), new VehicleInput(null, "Truck C", null, false), false);

      assertEquals(
          List.of(
              ModificationType.CREATE,
              ModificationType.UPDATE_MERGE,
              ModificationType.UPDATE_REPLACE),
          modificationTypesOf(created.id()));
      assertEquals(
          List.of(1L, 2L, 3L),
          eventLog.readAggregate(created.id()).stream()
              .map(StoredEvent::aggregateVersion)
              .toList());
      assertEquals(3, channel.publishedTo(TOPIC).size());
    }

    @Test
    void when_vehicle_is_missing_not_found_must_be_thrown() {
      final var exception =
          assertThrows(
              NotFoundException.class,
              () -> context.update(BOB, "missing", new VehicleInput(null, "Truck B", null, null), true));

      assertEquals("missing", exception.getAggregateId());
      assertTrue(eventLog.readAggregate("missing").isEmpty());
    }

    @Test
    void replace_without_name_is_rejected() {
      final var created = createTruck("Truck A", "Blue", true);

      assertThrows(
          ValidationException.class,
          () -> context.update(BOB, created.id(), new VehicleInput(null, null, "Red", null), false));
      assertThrows(
          ValidationException.class,
          () -> context.update(BOB, created.id(), new VehicleInput(null, "", null, null), true));
      assertEquals(created, context.get(ALICE, created.id(), ORGANIZATION));
    }

    @Test
    void when_event_cannot_be_appended_update_is_rolled_back() {
      final var created = createTruck("Truck A", "Blue", true);
      final var failing = newContext(failingFor(Set.of(created.id())));

      assertThrows(
          IllegalStateException.class,
          () ->
              failing.update(
                  BOB, created.id(), new VehicleInput(null, "Truck B", null, null), true));

      assertEquals(created, context.get(ALICE, created.id(), ORGANIZATION));
      assertEquals(List.of(ModificationType.CREATE), modificationTypesOf(created.id()));
    }
  }

  @Nested
  class Delete {
    @Test
    void deleted_vehicle_can_no_longer_be_read() {
      final var created = createTruck("Truck A", null, true);

      final var result = context.delete(ALICE, List.of(created.id()));

      assertEquals(
          CommandResult.ok("Vehicle with id:s [\"" + created.id() + "\"] has been deleted"),
          result);
      assertThrows(
          NotFoundException.class, () -> context.get(ALICE, created.id(), ORGANIZATION));
    }

    @Test
    void deleting_only_missing_vehicles_is_rejected() {
      final var result = context.delete(ALICE, List.of("a", "b"));

      assertEquals(
          CommandResult.rejected("Vehicle with id:s [\"a\",\"b\"] not found for deletion"), result);
    }

    @Test
    void one_delete_event_is_appended_per_requested_id() {
      final var created = createTruck("Truck A", null, true);

      context.delete(ALICE, List.of(created.id(), "missing"));

      assertEquals(
          List.of(ModificationType.CREATE, ModificationType.DELETE),
          modificationTypesOf(created.id()));
      assertEquals(List.of(ModificationType.DELETE), modificationTypesOf("missing"));
    }

    @Test
    void subscribers_receive_the_deletion_placeholder() {
      final var created = createTruck("Truck A", null, true);
      channel.clear();

      context.delete(ALICE, List.of(created.id()));

      final var published = channel.publishedTo(TOPIC);
      assertEquals(1, published.size());
      assertEquals(Vehicle.deletedPlaceholder(), published.get(0).payload());
    }

    @Test
    void when_event_cannot_be_appended_deletion_still_succeeds() {
      final var first = createTruck("Truck A", null, true);
      final var second = createTruck("Truck B", null, true);
      final var failing = newContext(failingFor(Set.of(first.id())));

      final var result = failing.delete(ALICE, List.of(first.id(), second.id()));

      assertTrue(result.isSuccessful());
      assertEquals(List.of(ModificationType.CREATE), modificationTypesOf(first.id()));
      assertEquals(
          List.of(ModificationType.CREATE, ModificationType.DELETE),
          modificationTypesOf(second.id()));
    }

    @Test
    void empty_or_blank_ids_are_rejected() {
      assertThrows(ValidationException.class, () -> context.delete(ALICE, List.of()));
      assertThrows(ValidationException.class, () -> context.delete(ALICE, null));
      assertThrows(ValidationException.class, () -> context.delete(ALICE, List.of("a", " ")));
      assertThrows(
          ValidationException.class, () -> context.delete(ALICE, Arrays.asList("a", null)));
      assertTrue(eventLog.readAfter(0L, 10).isEmpty());
    }
  }

  @Nested
  class Get {
    @Test
    void vehicle_of_another_organization_is_not_found() {
      final var created = createTruck("Truck A", null, true);

      assertThrows(NotFoundException.class, () -> context.get(ALICE, created.id(), "org-2"));
    }

    @Test
    void missing_identifiers_are_rejected() {
      assertThrows(ValidationException.class, () -> context.get(ALICE, null, ORGANIZATION));
      assertThrows(ValidationException.class, () -> context.get(ALICE, "id", null));
    }

    @Test
    void reads_append_no_events_and_publish_nothing() {
      final var created = createTruck("Truck A", null, true);
      channel.clear();

      context.get(ALICE, created.id(), ORGANIZATION);
      context.list(ALICE, null, null, null);

      assertEquals(1, eventLog.readAfter(0L, 10).size());
      assertTrue(channel.published().isEmpty());
    }
  }

  @Nested
  class Listing {
    @BeforeEach
    void setUp() {
      createTruck("Truck Alpha", null, true);
      createTruck("Van Beta", null, false);
      createTruck("truck gamma", null, true);
      context.create(ALICE, new VehicleInput("org-2", "Truck Delta", null, true));
    }

    List<String> names(final VehicleFilter filter, final Pagination pagination, final VehicleSort sort) {
      return context.list(ALICE, filter, pagination, sort).listing().stream()
          .map(Vehicle::name)
          .toList();
    }

    @Test
    void default_order_is_newest_first() {
      assertEquals(
          List.of("Truck Delta", "truck gamma", "Van Beta", "Truck Alpha"),
          names(null, null, null));
    }

    @Test
    void filter_criteria_are_combined() {
      assertEquals(
          List.of("truck gamma", "Van Beta", "Truck Alpha"),
          names(new VehicleFilter(ORGANIZATION, null, null), null, null));
      assertEquals(
          List.of("truck gamma", "Truck Alpha"),
          names(new VehicleFilter(ORGANIZATION, "TRUCK", null), null, null));
      assertEquals(
          List.of("truck gamma", "Truck Alpha"),
          names(new VehicleFilter(ORGANIZATION, null, true), null, null));
      assertEquals(
          List.of("Van Beta"), names(new VehicleFilter(null, "van", false), null, null));
    }

    @Test
    void pages_follow_the_sort_order() {
      final var byName = VehicleSort.of("name", true);

      assertEquals(
          List.of("Truck Alpha", "Truck Delta"), names(null, new Pagination(0, 2, false), byName));
      assertEquals(
          List.of("Van Beta", "truck gamma"), names(null, new Pagination(1, 2, false), byName));
      assertTrue(names(null, new Pagination(2, 2, false), byName).isEmpty());
    }

    @Test
    void total_is_counted_only_on_request() {
      final var filter = new VehicleFilter(ORGANIZATION, null, null);

      final var withTotal = context.list(ALICE, filter, new Pagination(0, 1, true), null);
      final var withoutTotal = context.list(ALICE, filter, new Pagination(0, 1, false), null);

      assertEquals(1, withTotal.listing().size());
      assertEquals(3L, withTotal.totalResultCount());
      assertNull(withoutTotal.totalResultCount());
      assertTrue(withoutTotal.total().isEmpty());
    }

    @Test
    void invalid_listing_parameters_are_rejected() {
      final var exception =
          assertThrows(ValidationException.class, () -> VehicleSort.of("horsepower", true));

      assertTrue(exception.getMessage().contains("horsepower"));
      assertThrows(ValidationException.class, () -> new Pagination(-1, 10, false));
      assertThrows(ValidationException.class, () -> new Pagination(0, 0, false));
    }
  }

  @Nested
  class Concurrency {
    @Test
    void failing_updates_never_undo_concurrent_creations() throws Exception {
      final var running = new AtomicBoolean(true);
      final var failures = new AtomicInteger();
      final var updater =
          new Thread(
              () -> {
                while (running.get()) {
                  try {
                    context.update(
                        BOB, "missing", new VehicleInput(null, "Truck B", null, null), true);
                  } catch (NotFoundException e) {
                    failures.incrementAndGet();
                  }
                }
              });
      updater.start();

      final var created = new ArrayList<Vehicle>();
      try {
        for (int i = 0; i < 200; i++) {
          created.add(createTruck("Truck " + i, null, true));
        }
      } finally {
        running.set(false);
        updater.join();
      }

      assertTrue(failures.get() > 0);
      for (final var vehicle : created) {
        assertEquals(vehicle, context.get(ALICE, vehicle.id(), ORGANIZATION));
        assertEquals(List.of(ModificationType.CREATE), modificationTypesOf(vehicle.id()));
      }
      assertTrue(eventLog.readAggregate("missing").isEmpty());
    }

    @Test
    void concurrent_creations_all_commit() throws Exception {
      final int threads = 4;
      final int perThread = 25;
      final var ready = new CountDownLatch(threads);
      final var go = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(threads);
      try {
        final var futures = new ArrayList<Future<List<Vehicle>>>();
        for (int t = 0; t < threads; t++) {
          final int thread = t;
          futures.add(
              executor.submit(
                  () -> {
                    ready.countDown();
                    go.await();
                    final var vehicles = new ArrayList<Vehicle>();
                    for (int i = 0; i < perThread; i++) {
                      vehicles.add(createTruck("Truck " + thread + "-" + i, null, true));
                    }
                    return vehicles;
                  }));
        }
        ready.await();
        go.countDown();

        final var created = new ArrayList<Vehicle>();
        for (final var future : futures) {
          created.addAll(future.get(30, TimeUnit.SECONDS));
        }

        assertEquals(threads * perThread, created.size());
        for (final var vehicle : created) {
          assertEquals(vehicle, context.get(BOB, vehicle.id(), ORGANIZATION));
        }
        final var sequences =
            eventLog.readAfter(0L, threads * perThread + 1).stream()
                .map(StoredEvent::sequence)
                .toList();
        assertEquals(threads * perThread, sequences.size());
        assertEquals(sequences.size(), Set.copyOf(sequences).size());
      } finally {
        executor.shutdownNow();
      }
    }
  }
}
