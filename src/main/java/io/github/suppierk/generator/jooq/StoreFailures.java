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

import io.github.suppierk.generator.cqrs.ConflictException;
import io.github.suppierk.generator.cqrs.TransientStoreException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;

/** Translates jOOQ failures into the exceptions commands and queries surface to callers. */
public final class StoreFailures {
  private StoreFailures() {
    // Utility class
  }

  /**
   * Maps SQL state class 23 to {@link ConflictException}, connection and transaction rollback
   * failures as well as timeouts to {@link TransientStoreException}. Everything else, including
   * non-jOOQ exceptions, is returned unchanged.
   *
   * @param failure to translate
   * @return exception to rethrow
   */
  public static RuntimeException translate(final RuntimeException failure) {
    if (!(failure instanceof DataAccessException dataAccessException)) {
      return failure;
    }

    final SQLStateClass stateClass = dataAccessException.sqlStateClass();

    if (stateClass == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
      return new ConflictException(
          "Write conflicts with existing data: " + dataAccessException.getMessage(),
          dataAccessException);
    }

    if (stateClass == SQLStateClass.C08_CONNECTION_EXCEPTION
        || stateClass == SQLStateClass.C40_TRANSACTION_ROLLBACK
        || dataAccessException.getCause(SQLTransientException.class) != null
        || dataAccessException.getCause(SQLTimeoutException.class) != null) {
      return new TransientStoreException(
          "Store is temporarily unavailable: " + dataAccessException.getMessage(),
          dataAccessException);
    }

    return dataAccessException;
  }
}
