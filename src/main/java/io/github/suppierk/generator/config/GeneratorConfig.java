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

package io.github.suppierk.generator.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.util.Optional;

/**
 * Settings of the vehicle generator service.
 *
 * <pre>
 * generator.datasource.url=jdbc:postgresql://localhost:5432/generator
 * generator.datasource.dialect=POSTGRES
 * generator.generation.tick-period-millis=50
 * generator.topics.generation-feed=fleet/vehicles/generated
 * </pre>
 */
@ConfigMapping(prefix = "generator")
public interface GeneratorConfig {
  /** Database holding the vehicles and the event log. */
  Datasource datasource();

  /** Generation engine settings. */
  Generation generation();

  /** Names of the published topics. */
  Topics topics();

  /** Notification dispatch settings. */
  Fanout fanout();

  interface Datasource {
    @WithDefault(
        "jdbc:h2:mem:generator;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000")
    String url();

    @WithDefault("sa")
    String username();

    Optional<String> password();

    /** Name of a jOOQ {@code SQLDialect} constant. */
    @WithDefault("H2")
    String dialect();

    /** Connections in the pool, each transaction holds one. */
    @WithDefault("8")
    int maximumPoolSize();
  }

  interface Generation {
    /** Delay between two generated vehicles. */
    @WithDefault("50")
    long tickPeriodMillis();

    /** Whether generation starts together with the service. */
    @WithDefault("false")
    boolean autostart();
  }

  interface Topics {
    @WithDefault("generator-ui-gateway-materialized-view-updates")
    String materializedView();

    @WithDefault("fleet/vehicles/generated")
    String generationFeed();

    @WithDefault("generator-ui-gateway-websocket-updates")
    String liveUpdate();
  }

  interface Fanout {
    /** Threads publishing notifications. */
    @WithDefault("2")
    int threads();

    /** Notifications waiting for a thread, further ones are dropped. */
    @WithDefault("1024")
    int queueCapacity();
  }
}
