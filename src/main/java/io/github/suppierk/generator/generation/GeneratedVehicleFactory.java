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

package io.github.suppierk.generator.generation;

import java.util.Random;

/** Draws uniformly random {@link GeneratedVehicle}s. Ranges are inclusive. */
public final class GeneratedVehicleFactory {
  static final int MIN_HP = 75;
  static final int MAX_HP = 300;
  static final int MIN_YEAR = 1980;
  static final int MAX_YEAR = 2025;
  static final int MIN_TOP_SPEED = 120;
  static final int MAX_TOP_SPEED = 320;

  private static final VehicleType[] TYPES = VehicleType.values();
  private static final PowerSource[] POWER_SOURCES = PowerSource.values();

  private final Random random;

  /**
   * @param random source of randomness, seed it for reproducible sequences
   */
  public GeneratedVehicleFactory(final Random random) {
    if (random == null) {
      throw new IllegalArgumentException("Random cannot be null");
    }

    this.random = random;
  }

  public GeneratedVehicle next() {
    return new GeneratedVehicle(
        TYPES[random.nextInt(TYPES.length)],
        POWER_SOURCES[random.nextInt(POWER_SOURCES.length)],
        between(MIN_HP, MAX_HP),
        between(MIN_YEAR, MAX_YEAR),
        between(MIN_TOP_SPEED, MAX_TOP_SPEED));
  }

  private int between(final int min, final int max) {
    return min + random.nextInt(max - min + 1);
  }
}
