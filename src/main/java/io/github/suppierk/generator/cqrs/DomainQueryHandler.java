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

import io.github.suppierk.generator.async.FanoutDispatcher;
import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.authorization.UnauthorizedException;
import io.github.suppierk.generator.jooq.StoreFailures;
import org.jooq.DSLContext;

/**
 * Defines rules of query handling in the system: queries read the materialized view and never
 * append events.
 *
 * @param <QUERY> supported by this handler
 * @param <OUTPUT> of the query execution
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainQueryHandler<
  QUERY extends DomainQuery<?, ?>,
  OUTPUT
>
extends
        DomainHandler<QUERY, OUTPUT>
permits
  DomainQueryHandler.One,
  DomainQueryHandler.Many
{
// @formatter:on
  private final Class<QUERY> queryClass;

  /**
   * Default constructor.
   *
   * @param queryClass to be used for handler lookup
   */
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    this.queryClass = throwIllegalArgumentIfNull(queryClass, "Query class");
  }

  /**
   * @return query class supported by this handler
   */
  public final Class<QUERY> getQueryClass() {
    return queryClass;
  }

  /**
   * Runs the query.
   *
   * @param query to run
   * @param dsl read-only context
   * @return query result
   */
  protected abstract OUTPUT run(final QUERY query, final DSLContext dsl);

  final OUTPUT runInContext(
      final QUERY query, final DSLContext readOnlyDsl, final FanoutDispatcher fanoutDispatcher) {
    final QUERY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullQuery.domainClient(), "Query's client");

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' query"
              .formatted(nonNullDomainClient.domainRole(), getQueryClass().getSimpleName()));
    }

    final DSLContext nonNullReadOnlyDsl = throwIllegalStateIfNull(readOnlyDsl, "Read-only DSL");
    final FanoutDispatcher nonNullDispatcher =
        throwIllegalStateIfNull(fanoutDispatcher, "Fanout dispatcher");

    final OUTPUT output;

    try {
      output =
          throwIllegalStateIfNull(run(nonNullQuery, nonNullReadOnlyDsl), "Query handler result");
    } catch (RuntimeException e) {
      final RuntimeException failure = StoreFailures.translate(e);
      notifyFailure(nonNullQuery, failure, nonNullDispatcher);
      throw failure;
    }

    notifySuccess(nonNullQuery, output, nonNullDispatcher);
    return output;
  }

  /**
   * Reads a single aggregate, absence is a {@link NotFoundException}.
   *
   * @param <ONE> query type
   * @param <AGGREGATE> aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends DomainQuery.One<?, ?>,
    AGGREGATE
  > extends DomainQueryHandler<ONE, AGGREGATE> {
  // @formatter:on
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /**
   * Reads a page of aggregates.
   *
   * @param <MANY> query type
   * @param <AGGREGATE> aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends DomainQuery.Many<?, ?>,
    AGGREGATE
  > extends DomainQueryHandler<MANY, Listing<AGGREGATE>> {
  // @formatter:on
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
