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

package io.github.suppierk.generator.authorization;

import java.io.Serial;

/**
 * Thrown when a handler refuses the {@link DomainClient} attached to a command or query.
 *
 * <p>Role checks are owned by the gateway; handlers only get a last say through {@code
 * canBeUsedBy}, e.g. to keep replay-only clients away from live commands.
 */
public class UnauthorizedException extends RuntimeException {
  @Serial private static final long serialVersionUID = 7996325054039085081L;

  /**
   * @param message describing which client was refused and for what
   */
  public UnauthorizedException(String message) {
    super(message);
  }

  /**
   * @param message describing which client was refused and for what
   * @param cause of the refusal, if any
   */
  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 403;
  }
}
