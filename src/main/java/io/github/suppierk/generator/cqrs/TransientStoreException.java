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

/**
 * The store or the event log could not be reached in time.
 *
 * <p>Unlike the other {@link DomainException}s this one is never masked: the caller gets it as is
 * and decides whether to retry.
 */
public final class TransientStoreException extends DomainException {
  @Serial private static final long serialVersionUID = -7715209338914700286L;

  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/503">503 Service
   *     Unavailable</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 503;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
