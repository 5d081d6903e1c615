package io.github.suppierk.generator.jooq;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.generator.authorization.AnonymousDomainClient;
import io.github.suppierk.generator.vehicle.DeleteVehicles;
import java.util.List;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class DslContextProviderTest {
  @Test
  void when_fixed_provider_is_requested_with_null_argument_it_throws_an_exception() {
    assertThrows(IllegalArgumentException.class, () -> DslContextProvider.fixed(null));
  }

  @Test
  void fixed_provider_returns_the_same_context_for_every_message() {
    final var dslContext = DSL.using(SQLDialect.H2);
    final var provider = DslContextProvider.fixed(dslContext);

    assertSame(
        dslContext,
        provider.apply(DeleteVehicles.of(AnonymousDomainClient.getInstance(), List.of("v-1"))));
  }
}
