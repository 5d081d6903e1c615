package io.github.suppierk.generator.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DomainEventTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

  @Test
  void modified_event_is_named_after_the_aggregate_and_tagged_with_modification_type() {
    final var event =
        DomainEvent.modified(
            "Vehicle", "v-1", ModificationType.CREATE, Map.of("name", "Truck A"), "alice", NOW);

    assertEquals("VehicleModified", event.eventType());
    assertEquals(DomainEvent.CURRENT_VERSION, event.eventTypeVersion());
    assertEquals(ModificationType.CREATE, event.modificationType());
    assertEquals("Truck A", event.data().get("name"));
    assertEquals("CREATE", event.data().get(ModificationType.DATA_KEY));
  }

  @Test
  void deletion_carries_only_the_modification_type() {
    final var event =
        DomainEvent.modified("Vehicle", "v-1", ModificationType.DELETE, null, "alice", NOW);

    assertEquals(Map.of(ModificationType.DATA_KEY, "DELETE"), event.data());
  }

  @Test
  void snapshot_may_contain_null_values() {
    final Map<String, Object> snapshot = new HashMap<>();
    snapshot.put("description", null);

    final var event =
        DomainEvent.modified("Vehicle", "v-1", ModificationType.CREATE, snapshot, "alice", NOW);

    assertNull(event.data().get("description"));
    assertThrows(UnsupportedOperationException.class, () -> event.data().put("name", "changed"));
  }

  @Test
  void when_modification_type_is_missing_or_unknown_illegal_state_must_be_thrown() {
    final var untagged =
        new DomainEvent("VehicleModified", 1, "Vehicle", "v-1", Map.of(), "alice", NOW);
    final var unknown =
        new DomainEvent(
            "VehicleModified",
            1,
            "Vehicle",
            "v-1",
            Map.of(ModificationType.DATA_KEY, "UPSERT"),
            "alice",
            NOW);

    assertThrows(IllegalStateException.class, untagged::modificationType);
    assertThrows(IllegalStateException.class, unknown::modificationType);
  }

  @Test
  void when_mandatory_fields_are_missing_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DomainEvent(" ", 1, "Vehicle", "v-1", Map.of(), "alice", NOW));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DomainEvent("VehicleModified", 1, null, "v-1", Map.of(), "alice", NOW));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DomainEvent("VehicleModified", 1, "Vehicle", "", Map.of(), "alice", NOW));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DomainEvent("VehicleModified", 1, "Vehicle", "v-1", null, "alice", NOW));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DomainEvent("VehicleModified", 1, "Vehicle", "v-1", Map.of(), "alice", null));
    assertThrows(
        IllegalArgumentException.class,
        () -> DomainEvent.modified("Vehicle", "v-1", null, Map.of(), "alice", NOW));
  }
}
