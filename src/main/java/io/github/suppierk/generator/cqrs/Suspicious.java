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

/**
 * Null-guards shared by the handler registry and the handlers.
 *
 * <p>The exception type tells who is to blame: the caller for arguments, the implementation for
 * properties and results, the configuration for missing resources.
 */
abstract sealed class Suspicious permits BoundedContext, DomainHandler {
  /**
   * For properties and results produced by implementations.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the name used in the message
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * For method arguments only.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the name used in the message
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * For lookups of resources which were never registered.
   *
   * @param value which must not be {@code null}
   * @param whatIsMissing is the name used in the message
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatIsMissing)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is not registered".formatted(whatIsMissing));
    }

    return value;
  }
}
