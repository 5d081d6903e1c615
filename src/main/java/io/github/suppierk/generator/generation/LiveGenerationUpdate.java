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
 * Message of the live update topic: the feed envelope plus the running total.
 *
 * @param type always {@code VehicleGenerated}
 * @param data envelope published on the generation feed
 * @param generatedCount amount of vehicles generated by the current run so far
 */
public record LiveGenerationUpdate(
    String type, GeneratedVehicleEnvelope data, long generatedCount) {
  static final String TYPE = "VehicleGenerated";

  public static LiveGenerationUpdate of(
      final GeneratedVehicleEnvelope envelope, final long generatedCount) {
    return new LiveGenerationUpdate(TYPE, envelope, generatedCount);
  }
}
