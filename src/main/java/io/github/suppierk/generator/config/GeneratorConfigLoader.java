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

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;

/** Builds {@link GeneratorConfig} from system properties, environment and the properties file. */
public final class GeneratorConfigLoader {
  private static final String OVERRIDES_SOURCE = "overrides";
  private static final int OVERRIDES_ORDINAL = 500;

  private GeneratorConfigLoader() {
    // Utility class
  }

  /**
   * @return configuration from the default sources
   */
  public static GeneratorConfig load() {
    return load(Map.of());
  }

  /**
   * @param overrides taking precedence over every default source
   * @return configuration from the default sources and the overrides
   * @throws io.smallrye.config.ConfigValidationException if a property cannot be converted
   */
  public static GeneratorConfig load(final Map<String, String> overrides) {
    if (overrides == null) {
      throw new IllegalArgumentException("Overrides cannot be null, use an empty map");
    }

    final SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDiscoveredConverters()
            .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL))
            .withMapping(GeneratorConfig.class)
            .build();

    return config.getConfigMapping(GeneratorConfig.class);
  }
}
