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

package io.github.suppierk.generator.cqrs;

import java.util.List;
import java.util.OptionalLong;

/**
 * A page of aggregates.
 *
 * <p>The total is counted by a separate query and only on request, so it is not guaranteed to be
 * consistent with the page it is returned with.
 *
 * @param listing aggregates of the page in the requested order
 * @param totalResultCount amount of aggregates matching the filter, {@code null} when not requested
 * @param <A> is the type of the aggregates
 */
public record Listing<A>(List<A> listing, Long totalResultCount) {
  public Listing {
    if (listing == null) {
      throw new IllegalArgumentException("Listing cannot be null");
    }

    listing = List.copyOf(listing);
  }

  /**
   * @return total amount of matching aggregates, if it was requested
   */
  public OptionalLong total() {
    return totalResultCount == null ? OptionalLong.empty() : OptionalLong.of(totalResultCount);
  }
}
