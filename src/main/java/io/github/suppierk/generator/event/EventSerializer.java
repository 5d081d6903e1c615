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

package io.github.suppierk.generator.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/**
 * JSON conversions of event data and aggregate snapshots.
 *
 * <p>{@link java.time.Instant}s are written as ISO-8601 strings. Unknown snapshot properties are
 * ignored on read, so an older build can still replay events written by a newer one.
 */
public final class EventSerializer {
  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private EventSerializer() {
    // Utility class
  }

  /**
   * @param value to encode
   * @return JSON text
   * @throws EventSerializationException if the value cannot be encoded
   */
  public static String write(final Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException(
          "Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  /**
   * @param json event data as stored in the log
   * @return decoded data map
   * @throws EventSerializationException if the text is not a JSON object
   */
  public static Map<String, Object> readData(final String json) {
    try {
      return MAPPER.readValue(json, DATA_TYPE);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Failed to deserialize event data", e);
    }
  }

  /**
   * @param aggregate to take a snapshot of
   * @return property map of the aggregate, as it is embedded into event data
   */
  public static Map<String, Object> toSnapshot(final Object aggregate) {
    try {
      return MAPPER.convertValue(aggregate, DATA_TYPE);
    } catch (IllegalArgumentException e) {
      throw new EventSerializationException(
          "Failed to snapshot " + aggregate.getClass().getSimpleName(), e);
    }
  }

  /**
   * @param snapshot property map produced by {@link #toSnapshot(Object)}
   * @param type of the aggregate
   * @param <T> is the type of the aggregate
   * @return restored aggregate
   */
  public static <T> T fromSnapshot(final Map<String, Object> snapshot, final Class<T> type) {
    try {
      return MAPPER.convertValue(snapshot, type);
    } catch (IllegalArgumentException e) {
      throw new EventSerializationException(
          "Failed to restore " + type.getSimpleName() + " from snapshot", e);
    }
  }

  /** Thrown when event data cannot be encoded or decoded. */
  public static class EventSerializationException extends RuntimeException {
    public EventSerializationException(final String message, final Throwable cause) {
      super(message, cause);
    }
  }
}
