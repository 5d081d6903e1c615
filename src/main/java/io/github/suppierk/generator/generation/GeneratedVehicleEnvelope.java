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

import java.time.Instant;

/**
 * Message of the generation feed topic.
 *
 * @param at aggregate type, always {@code Vehicle}
 * @param et event type, always {@code Generated}
 * @param aid content address of {@code data}
 * @param timestamp when the vehicle was generated
 * @param data generated vehicle
 */
public record GeneratedVehicleEnvelope(
    String at, String et, String aid, Instant timestamp, GeneratedVehicle data) {
  static final String AGGREGATE_TYPE = "Vehicle";
  static final String EVENT_TYPE = "Generated";

  public static GeneratedVehicleEnvelope of(
      final GeneratedVehicle vehicle, final Instant timestamp) {
    return new GeneratedVehicleEnvelope(
        AGGREGATE_TYPE, EVENT_TYPE, ContentAddress.of(vehicle), timestamp, vehicle);
  }
}
