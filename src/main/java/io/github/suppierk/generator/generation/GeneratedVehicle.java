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

/**
 * Synthetic fleet vehicle. Never stored, only published.
 *
 * @param type body type
 * @param powerSource power train
 * @param hp horse power
 * @param year model year
 * @param topSpeed in km/h
 */
public record GeneratedVehicle(
    VehicleType type, PowerSource powerSource, int hp, int year, int topSpeed) {
  private static final String DELIMITER = "|";

  public GeneratedVehicle {
    if (type == null) {
      throw new IllegalArgumentException("Vehicle type cannot be null");
    }

    if (powerSource == null) {
      throw new IllegalArgumentException("Power source cannot be null");
    }
  }

  /**
   * Fixed-order, fixed-delimiter encoding of exactly the five attributes, e.g. {@code
   * SUV|Electric|200|2023|180}.
   *
   * @return canonical form hashed into the content address
   */
  public String canonicalForm() {
    return String.join(
        DELIMITER,
        type.label(),
        powerSource.label(),
        Integer.toString(hp),
        Integer.toString(year),
        Integer.toString(topSpeed));
  }
}
