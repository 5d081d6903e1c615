/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.generator;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.async.LocalFanoutChannel;
import io.github.suppierk.generator.config.GeneratorConfig;
import io.github.suppierk.generator.config.GeneratorConfigLoader;
import io.github.suppierk.generator.event.EventReplayer;
import io.github.suppierk.generator.generation.GeneratedVehicleFactory;
import io.github.suppierk.generator.generation.GenerationEngine;
import io.github.suppierk.generator.jooq.DslContextProvider;
import io.github.suppierk.generator.jooq.JooqEventLog;
import io.github.suppierk.generator.jooq.SchemaInitializer;
import io.github.suppierk.generator.vehicle.VehicleContext;
import io.github.suppierk.generator.vehicle.VehicleRecoveryProjector;
import io.github.suppierk.generator.vehicle.store.JooqVehicleStore;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the service together from a {@link GeneratorConfig}.
 *
 * <p>Run with {@code --replay} to rebuild the vehicle table from the event log before serving.
 */
public final class GeneratorApplication implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(GeneratorApplication.class);

  static final String REPLAY_ARGUMENT = "--replay";
  static final int REPLAY_BATCH_SIZE = 500;

  private static final String POOL_NAME = "generator-db";

  private final HikariDataSource dataSource;
  private final LocalFanoutChannel channel;
  private final FanoutDispatcher fanoutDispatcher;
  private final GenerationEngine generationEngine;
  private final EventReplayer replayer;
  private final VehicleGeneratorService service;

  private GeneratorApplication(
      final HikariDataSource dataSource,
      final LocalFanoutChannel channel,
      final FanoutDispatcher fanoutDispatcher,
      final GenerationEngine generationEngine,
      final EventReplayer replayer,
      final VehicleGeneratorService service) {
    this.dataSource = dataSource;
    this.channel = channel;
    this.fanoutDispatcher = fanoutDispatcher;
    this.generationEngine = generationEngine;
    this.replayer = replayer;
    this.service = service;
  }

  /**
   * Opens the connection pool, creates missing tables and builds every component. Generation
   * starts right away when {@code generator.generation.autostart} is set.
   *
   * <p>Every transaction borrows its own pooled connection, so concurrent commands never share
   * one.
   *
   * @param config to start with
   * @return running application, to be closed by the caller
   */
  public static GeneratorApplication start(final GeneratorConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null");
    }

    final HikariDataSource dataSource = connect(config.datasource());

    try {
      final DSLContext dsl =
          DSL.using(dataSource, SQLDialect.valueOf(config.datasource().dialect()));
      SchemaInitializer.initialize(dsl);

      final var clock = Clock.systemUTC();
      final var channel = new LocalFanoutChannel();
      final var fanoutDispatcher =
          FanoutDispatcher.withThreads(
              channel, config.fanout().threads(), config.fanout().queueCapacity());

      final var store = new JooqVehicleStore();
      final var eventLog = new JooqEventLog(dsl);
      final var dslContextProvider = DslContextProvider.fixed(dsl);

      final var vehicles =
          new VehicleContext(
              dslContextProvider,
              dslContextProvider,
              eventLog,
              fanoutDispatcher,
              store,
              config.topics().materializedView(),
              clock);

      final var generationEngine =
          new GenerationEngine(
              GenerationEngine.newScheduler(),
              fanoutDispatcher,
              new GeneratedVehicleFactory(new SecureRandom()),
              Duration.ofMillis(config.generation().tickPeriodMillis()),
              config.topics().generationFeed(),
              config.topics().liveUpdate(),
              clock);

      final var application =
          new GeneratorApplication(
              dataSource,
              channel,
              fanoutDispatcher,
              generationEngine,
              new EventReplayer(
                  eventLog, new VehicleRecoveryProjector(dsl, store), REPLAY_BATCH_SIZE),
              new VehicleGeneratorService(vehicles, generationEngine));

      LOG.info("Vehicle generator started");

      if (config.generation().autostart()) {
        application.service.startGeneration();
      }

      return application;
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }
  }

  public VehicleGeneratorService service() {
    return service;
  }

  /**
   * @return channel to subscribe to the published topics with
   */
  public LocalFanoutChannel channel() {
    return channel;
  }

  /**
   * Rebuilds the vehicle table from the whole event log.
   *
   * @return sequence of the last replayed event
   */
  public long recover() {
    LOG.info("Recovering vehicles from the event log");
    return replayer.replayAll();
  }

  /** Stops generation, drains pending publications and closes the connection pool. */
  @Override
  public void close() {
    generationEngine.close();
    fanoutDispatcher.close();
    dataSource.close();

    LOG.info("Vehicle generator stopped");
  }

  public static void main(final String[] args) {
    final GeneratorApplication application;

    try {
      application = start(GeneratorConfigLoader.load());
    } catch (RuntimeException e) {
      LOG.error("Vehicle generator failed to start", e);
      System.exit(1);
      return;
    }

    if (Arrays.asList(args).contains(REPLAY_ARGUMENT)) {
      try {
        application.recover();
      } catch (RuntimeException e) {
        LOG.error("Vehicle recovery failed", e);
        application.close();
        System.exit(1);
        return;
      }
    }

    final var stopped = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  application.close();
                  stopped.countDown();
                },
                "generator-shutdown"));

    try {
      stopped.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static HikariDataSource connect(final GeneratorConfig.Datasource datasource) {
    final var hikariConfig = new HikariConfig();
    hikariConfig.setPoolName(POOL_NAME);
    hikariConfig.setJdbcUrl(datasource.url());
    hikariConfig.setUsername(datasource.username());
    hikariConfig.setPassword(datasource.password().orElse(""));
    hikariConfig.setMaximumPoolSize(datasource.maximumPoolSize());

    try {
      return new HikariDataSource(hikariConfig);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Cannot connect to " + datasource.url(), e);
    }
  }
}
