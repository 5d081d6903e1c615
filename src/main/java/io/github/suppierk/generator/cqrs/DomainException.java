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
 * Base of the failures a command or query surfaces to its caller.
 *
 * <p>Every subtype maps to a single machine-readable status code, so that the gateway can translate
 * it without inspecting messages.
 *
 * @see ValidationException
 * @see NotFoundException
 * @see ConflictException
 * @see TransientStoreException
 */
public abstract sealed class DomainException extends RuntimeException
    permits ValidationException, NotFoundException, ConflictException, TransientStoreException {
  @Serial private static final long serialVersionUID = -5319834447418398232L;

  protected DomainException(String message) {
    super(message);
  }

  protected DomainException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public abstract int getStatusCode();

  /**
   * @return {@code true} when the caller may reasonably retry the same request later
   */
  public boolean isRetryable() {
    return false;
  }
}
