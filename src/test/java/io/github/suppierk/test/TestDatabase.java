package io.github.suppierk.test;

import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.suppierk.generator.jooq.SchemaInitializer;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

/** In-memory H2 databases in PostgreSQL mode holding the service schema. */
public final class TestDatabase {
  private static final int POOL_SIZE = 4;

  private TestDatabase() {
    // Utility class
  }

  /**
   * @param databaseName unique per database, so test classes never see each other's rows
   * @return JDBC URL of the in-memory database
   */
  public static String url(final String databaseName) {
    return "jdbc:h2:mem:"
        + databaseName
        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1"
        + ";LOCK_TIMEOUT=10000";
  }

  /**
   * Every transaction of the returned context runs on its own pooled connection, the pool lives as
   * long as the test JVM.
   *
   * @param databaseName unique per test class, so classes never see each other's rows
   * @return context connected to a fresh database with every table created
   */
  public static DSLContext open(final String databaseName) {
    final var hikariConfig = new HikariConfig();
    hikariConfig.setPoolName("test-" + databaseName);
    hikariConfig.setJdbcUrl(url(databaseName));
    hikariConfig.setUsername("sa");
    hikariConfig.setPassword("");
    hikariConfig.setMaximumPoolSize(POOL_SIZE);

    final var dsl = DSL.using(new HikariDataSource(hikariConfig), SQLDialect.H2);
    SchemaInitializer.initialize(dsl);
    return dsl;
  }

  /** Removes every vehicle and every event. */
  public static void clean(final DSLContext dsl) {
    dsl.deleteFrom(table(name("vehicle"))).execute();
    dsl.deleteFrom(table(name("domain_event"))).execute();
  }
}
