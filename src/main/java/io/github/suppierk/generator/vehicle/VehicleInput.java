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

import io.github.suppierk.generator.cqrs.ValidationException;

/**
 * Client-supplied vehicle fields. Absent fields are {@code null}.
 *
 * @param organizationId owning organization, only used on creation
 * @param name display name
 * @param description free text
 * @param active whether the vehicle is in service
 */
public record VehicleInput(String organizationId, String name, String description, Boolean active) {
  static final int MAX_NAME_LENGTH = 256;
  static final int MAX_DESCRIPTION_LENGTH = 1024;

  /** Checks what is required to create a vehicle. */
  void validateForCreate() {
    requireText(organizationId, "organizationId");
    requireText(name, "name");
    validateLengths();
  }

  /** Checks what is required to replace all mutable fields of a vehicle. */
  void validateForReplace() {
    requireText(name, "name");
    validateLengths();
  }

  /** Checks what is required to merge present fields into a vehicle. */
  void validateForMerge() {
    if (name != null && name.isBlank()) {
      throw new ValidationException("name cannot be blank");
    }

    validateLengths();
  }

  private void validateLengths() {
    if (name != null && name.length() > MAX_NAME_LENGTH) {
      throw new ValidationException("name is longer than " + MAX_NAME_LENGTH + " characters");
    }

    if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
      throw new ValidationException(
          "description is longer than " + MAX_DESCRIPTION_LENGTH + " characters");
    }
  }

  private static void requireText(final String value, final String fieldName) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(fieldName + " is required");
    }
  }
}
