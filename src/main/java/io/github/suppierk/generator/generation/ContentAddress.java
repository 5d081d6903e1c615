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

package io.github.suppierk.generator.generation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the {@code aid} of a {@link GeneratedVehicle}: lowercase hex SHA-256 of its {@link
 * GeneratedVehicle#canonicalForm()}. Equal attributes always give the same address, so consumers
 * can drop retransmitted records.
 */
public final class ContentAddress {
  private static final String ALGORITHM = "SHA-256";

  private ContentAddress() {
    // Utility class
  }

  /**
   * @param vehicle to address
   * @return 64 lowercase hex characters
   */
  public static String of(final GeneratedVehicle vehicle) {
    if (vehicle == null) {
      throw new IllegalArgumentException("Generated vehicle cannot be null");
    }

    return HexFormat.of().formatHex(sha256(vehicle.canonicalForm()));
  }

  private static byte[] sha256(final String text) {
    try {
      // MessageDigest instances are not thread-safe, hence one per call
      return MessageDigest.getInstance(ALGORITHM).digest(text.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(ALGORITHM + " is mandatory for every JVM", e);
    }
  }
}
