package io.github.suppierk.generator.jooq;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.test.TestDatabase;
import org.junit.jupiter.api.Test;

class SchemaInitializerTest {
  @Test
  void initialization_can_run_again_on_an_initialized_database() {
    final var dsl = TestDatabase.open("schema_initializer");

    assertDoesNotThrow(() -> SchemaInitializer.initialize(dsl));
  }

  @Test
  void when_context_is_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> SchemaInitializer.initialize(null));
  }
}
