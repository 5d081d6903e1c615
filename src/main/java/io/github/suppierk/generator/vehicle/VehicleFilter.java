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

package io.github.suppierk.generator.vehicle;

/**
 * Listing filter, absent criteria match everything.
 *
 * @param organizationId exact match
 * @param name case-insensitive substring match
 * @param active exact match
 */
public record VehicleFilter(String organizationId, String name, Boolean active) {
  public static final VehicleFilter NONE = new VehicleFilter(null, null, null);
}
