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

package io.github.suppierk.generator.jooq;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the tables of the service if they are missing. */
public final class SchemaInitializer {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

  /** Classpath location of the schema script. */
  public static final String SCHEMA_RESOURCE = "db/schema.sql";

  private SchemaInitializer() {
    // Utility class
  }

  /**
   * Runs every statement of {@link #SCHEMA_RESOURCE}. Statements are separated by {@code ;} and
   * must be idempotent.
   *
   * @param dsl to execute statements with
   */
  public static void initialize(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    int executed = 0;

    for (String statement : readSchema().split(";")) {
      if (!statement.isBlank()) {
        dsl.execute(statement.trim());
        executed++;
      }
    }

    LOG.info("Schema initialized, {} statements executed", executed);
  }

  private static String readSchema() {
    try (InputStream stream =
        SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (stream == null) {
        throw new IllegalStateException(SCHEMA_RESOURCE + " is missing from the classpath");
      }

      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
    }
  }
}
