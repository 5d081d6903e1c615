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

package io.github.suppierk.generator.jooq;

import io.github.suppierk.generator.cqrs.DomainMessage;
import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Picks the {@link DSLContext} a command or query runs against.
 *
 * <p>Commands resolve the read-write context, queries the read-only one, which can point to a
 * replica of the materialized view.
 */
@FunctionalInterface
// @formatter:off
public interface DslContextProvider extends Function<
  DomainMessage<
      ? extends Serializable,
      ? extends Temporal
    >,
  DSLContext
> {
// @formatter:on

  /**
   * @param dslContext to hand out for every message
   * @return provider which ignores the message and always returns the given context
   */
  static DslContextProvider fixed(DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return message -> dslContext;
  }
}
