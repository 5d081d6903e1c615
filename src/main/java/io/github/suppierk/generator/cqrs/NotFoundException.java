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

import java.io.Serial;

/** The aggregate addressed by a read or an update does not exist. */
public final class NotFoundException extends DomainException {
  @Serial private static final long serialVersionUID = -1870361905411278815L;

  private final String aggregateId;

  public NotFoundException(String aggregateType, String aggregateId) {
    super("%s with id '%s' was not found".formatted(aggregateType, aggregateId));
    this.aggregateId = aggregateId;
  }

  /**
   * @return identifier which was looked up
   */
  public String getAggregateId() {
    return aggregateId;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 404;
  }
}
