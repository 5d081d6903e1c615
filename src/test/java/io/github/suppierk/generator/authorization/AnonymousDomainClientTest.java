package io.github.suppierk.generator.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class AnonymousDomainClientTest {
  @Test
  void when_client_is_used_essential_properties_are_not_null() {
    final DomainClient client = AnonymousDomainClient.getInstance();

    assertNotNull(client);
    assertEquals("ANONYMOUS", client.domainRole());
    assertEquals("anonymous", client.clientName());
  }

  @Test
  void the_same_instance_is_always_returned() {
    final DomainClient first = AnonymousDomainClient.getInstance();
    final DomainClient second = AnonymousDomainClient.getInstance();

    assertSame(first, second);
  }
}
