package io.github.suppierk.generator.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.suppierk.generator.authorization.AuthenticatedClient;
import io.github.suppierk.generator.vehicle.CreateVehicle;
import io.github.suppierk.generator.vehicle.VehicleInput;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DomainMessageTest {
  @Test
  void message_without_client_is_sent_by_anonymous() {
    final var message = new Heartbeat(UUID.randomUUID(), Instant.now());

    assertEquals("ANONYMOUS", message.domainClient().domainRole());
    assertEquals("anonymous", message.domainClient().clientName());
  }

  @Test
  void explicit_client_is_kept() {
    final var client = new AuthenticatedClient("alice", "OPERATOR");
    final var command = CreateVehicle.of(client, new VehicleInput("org-1", "Truck", null, null));

    assertEquals(client, command.domainClient());
  }

  /**
   * Relies on the default {@link DomainMessage#domainClient()}.
   *
   * @param messageId to fulfill {@link DomainMessage#messageId()} contract
   * @param createdAt to fulfill {@link DomainMessage#createdAt()} contract
   */
  record Heartbeat(UUID messageId, Instant createdAt) implements DomainMessage<UUID, Instant> {}
}
