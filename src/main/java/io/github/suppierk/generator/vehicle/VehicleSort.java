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
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * @param field to order by
 * @param ascending direction
 */
public record VehicleSort(Field field, boolean ascending) {
  public static final VehicleSort DEFAULT = new VehicleSort(Field.CREATED_AT, false);

  public VehicleSort {
    if (field == null) {
      throw new ValidationException("sort field is required");
    }
  }

  /**
   * @param fieldName as exposed to clients, e.g. {@code createdAt}
   * @param ascending direction
   * @return parsed sort
   * @throws ValidationException if the field is not sortable
   */
  public static VehicleSort of(final String fieldName, final boolean ascending) {
    return new VehicleSort(Field.byName(fieldName), ascending);
  }

  /** Sortable fields. */
  public enum Field {
    NAME("name"),
    ACTIVE("active"),
    ORGANIZATION_ID("organizationId"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt");

    private final String fieldName;

    Field(final String fieldName) {
      this.fieldName = fieldName;
    }

    public String fieldName() {
      return fieldName;
    }

    static Field byName(final String fieldName) {
      for (Field field : values()) {
        if (field.fieldName.equals(fieldName)) {
          return field;
        }
      }

      throw new ValidationException(
          "Cannot sort by '%s', expected one of %s"
              .formatted(
                  fieldName,
                  Arrays.stream(values())
                      .map(Field::fieldName)
                      .collect(Collectors.joining(", ", "[", "]"))));
    }
  }
}
