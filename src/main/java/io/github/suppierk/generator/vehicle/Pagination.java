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
 * @param page zero-based page number
 * @param count page size
 * @param queryTotalResultCount whether to count all matching vehicles as well
 */
public record Pagination(int page, int count, boolean queryTotalResultCount) {
  public static final Pagination DEFAULT = new Pagination(0, 10, false);

  public Pagination {
    if (page < 0) {
      throw new ValidationException("page cannot be negative");
    }

    if (count < 1) {
      throw new ValidationException("count must be positive");
    }
  }

  public int offset() {
    return page * count;
  }
}
