package io.github.suppierk.generator.jooq;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.generator.cqrs.ConflictException;
import io.github.suppierk.generator.cqrs.TransientStoreException;
import io.github.suppierk.generator.cqrs.ValidationException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import org.jooq.exception.DataAccessException;
import org.junit.jupiter.api.Test;

class StoreFailuresTest {
  static DataAccessException failure(final SQLException cause) {
    return new DataAccessException("SQL failed", cause);
  }

  @Test
  void integrity_constraint_violation_becomes_conflict() {
    final var translated =
        StoreFailures.translate(failure(new SQLException("Unique index violated", "23505")));

    assertInstanceOf(ConflictException.class, translated);
  }

  @Test
  void connection_and_rollback_failures_become_transient() {
    assertInstanceOf(
        TransientStoreException.class,
        StoreFailures.translate(failure(new SQLException("Connection lost", "08006"))));
    assertInstanceOf(
        TransientStoreException.class,
        StoreFailures.translate(failure(new SQLException("Deadlock detected", "40P01"))));
  }

  @Test
  void timeouts_and_transient_driver_failures_become_transient() {
    final var timeout = StoreFailures.translate(failure(new SQLTimeoutException("Timed out")));
    final var transientFailure =
        StoreFailures.translate(failure(new SQLTransientConnectionException("Pool exhausted")));

    assertInstanceOf(TransientStoreException.class, timeout);
    assertTrue(((TransientStoreException) timeout).isRetryable());
    assertInstanceOf(TransientStoreException.class, transientFailure);
  }

  @Test
  void other_store_failures_are_returned_unchanged() {
    final var syntaxError = failure(new SQLException("Syntax error", "42601"));

    assertSame(syntaxError, StoreFailures.translate(syntaxError));
  }

  @Test
  void non_store_failures_are_returned_unchanged() {
    final var validation = new ValidationException("name is required");

    assertSame(validation, StoreFailures.translate(validation));
  }
}
