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

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Current state of one vehicle, as kept by the materialized view. Absent values are left out of
 * the JSON form.
 *
 * @param id opaque unique identifier assigned on creation
 * @param organizationId owning organization
 * @param name display name
 * @param description free text, may be {@code null}
 * @param active whether the vehicle is in service
 * @param metadata audit information
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Vehicle(
    String id,
    String organizationId,
    String name,
    String description,
    boolean active,
    Metadata metadata) {
  public static final String AGGREGATE_TYPE = "Vehicle";

  private static final String DELETED_ID = "deleted";

  /**
   * Payload published to the materialized-view topic after a bulk delete. Subscribers of a single
   * vehicle never match its id, only {@code ANY} subscribers receive it and reload. Serialized it
   * carries {@code id}, {@code name}, {@code description} and {@code active} only.
   *
   * @return placeholder standing for "something was deleted"
   */
  public static Vehicle deletedPlaceholder() {
    return new Vehicle(DELETED_ID, null, "", "", false, null);
  }

  /**
   * @param createdBy name of the client who created the vehicle
   * @param createdAt when the vehicle was created
   * @param updatedBy name of the client who last modified the vehicle
   * @param updatedAt when the vehicle was last modified
   */
  public record Metadata(String createdBy, Instant createdAt, String updatedBy, Instant updatedAt) {}
}
