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
 * Outcome of a command which reports expected failures as data rather than exceptions.
 *
 * @param code HTTP-like status, {@code 200} on success and {@code 400} on rejection
 * @param message human-readable description
 */
public record CommandResult(int code, String message) {
  public static final int OK = 200;
  public static final int REJECTED = 400;

  public CommandResult {
    if (message == null) {
      throw new IllegalArgumentException("Message cannot be null");
    }
  }

  public static CommandResult ok(final String message) {
    return new CommandResult(OK, message);
  }

  public static CommandResult rejected(final String message) {
    return new CommandResult(REJECTED, message);
  }

  public boolean isSuccessful() {
    return code == OK;
  }
}
