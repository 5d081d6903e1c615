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
import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventLog;
import io.github.suppierk.generator.event.ModificationType;
import io.github.suppierk.generator.jooq.StoreFailures;
import java.util.List;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defines rules of command handling in the system.
 *
 * <p>Every variant writes the store and appends one {@link DomainEvent} per touched aggregate,
 * then hands the optional success notification to the {@link FanoutDispatcher}. Store and event
 * log failures reach the caller, translated by {@link StoreFailures}; notification failures never
 * do.
 *
 * <p>The modification type of the emitted events is derived from the handler variant, so users
 * only describe how an aggregate is turned into an event.
 *
 * @param <COMMAND> supported by this handler
 * @param <AGGREGATE> mutated by this handler
 * @param <OUTPUT> of the command execution
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?, ?>,
  AGGREGATE,
  OUTPUT
>
extends
        DomainHandler<COMMAND, OUTPUT>
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update,
  DomainCommandHandler.BatchDelete
{
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(DomainCommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Default constructor.
   *
   * @param commandClass to be used for handler lookup
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * @return command class supported by this handler
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Describes one mutation of one aggregate.
   *
   * @param command being handled
   * @param modificationType derived from the handler variant
   * @param aggregateId of the mutated aggregate
   * @param snapshot post-mutation state, {@code null} for deletions
   * @return event to append
   */
  protected abstract DomainEvent describe(
      final COMMAND command,
      final ModificationType modificationType,
      final String aggregateId,
      final AGGREGATE snapshot);

  /**
   * Variant-specific part of the command execution.
   *
   * @param command to handle
   * @param readWriteDsl to open transactions with
   * @param eventLog to append events to
   * @return command execution result
   */
  protected abstract OUTPUT internalRunContract(
      final COMMAND command, final DSLContext readWriteDsl, final EventLog eventLog);

  final OUTPUT runInContext(
      final COMMAND command,
      final DSLContext readWriteDsl,
      final EventLog eventLog,
      final FanoutDispatcher fanoutDispatcher) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' command"
              .formatted(nonNullDomainClient.domainRole(), getCommandClass().getSimpleName()));
    }

    final DSLContext nonNullReadWriteDsl = throwIllegalStateIfNull(readWriteDsl, "Read-write DSL");
    final EventLog nonNullEventLog = throwIllegalStateIfNull(eventLog, "Event log");
    final FanoutDispatcher nonNullDispatcher =
        throwIllegalStateIfNull(fanoutDispatcher, "Fanout dispatcher");

    final OUTPUT output;

    try {
      output =
          throwIllegalStateIfNull(
              internalRunContract(nonNullCommand, nonNullReadWriteDsl, nonNullEventLog),
              "Command handler result");
    } catch (RuntimeException e) {
      final RuntimeException failure = StoreFailures.translate(e);
      notifyFailure(nonNullCommand, failure, nonNullDispatcher);
      throw failure;
    }

    notifySuccess(nonNullCommand, output, nonNullDispatcher);
    return output;
  }

  final void appendEvent(
      final DSLContext dsl,
      final EventLog eventLog,
      final COMMAND command,
      final ModificationType modificationType,
      final String aggregateId,
      final AGGREGATE snapshot) {
    eventLog.append(
        dsl,
        throwIllegalStateIfNull(
            describe(command, modificationType, aggregateId, snapshot), "Domain event"));
  }

  /**
   * Defines the creation of a single aggregate. The store write and the {@link
   * ModificationType#CREATE} event commit together or not at all.
   *
   * @param <CREATE> command type
   * @param <AGGREGATE> created aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>,
    AGGREGATE
  > extends DomainCommandHandler<CREATE, AGGREGATE, AGGREGATE> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Validates the command and inserts the new aggregate.
     *
     * @param command to create the aggregate from
     * @param trx transactional context to write with
     * @return created aggregate
     */
    protected abstract AGGREGATE insert(final CREATE command, final DSLContext trx);

    /**
     * @param aggregate which was created
     * @return its identifier
     */
    protected abstract String aggregateIdOf(final AGGREGATE aggregate);

    @Override
    protected final AGGREGATE internalRunContract(
        final CREATE command, final DSLContext readWriteDsl, final EventLog eventLog) {
      return readWriteDsl.transactionResult(
          (final Configuration trx) -> {
            final AGGREGATE created =
                throwIllegalStateIfNull(insert(command, trx.dsl()), "Created aggregate");
            appendEvent(
                trx.dsl(),
                eventLog,
                command,
                ModificationType.CREATE,
                aggregateIdOf(created),
                created);
            return created;
          });
    }
  }

  /**
   * Defines the update of a single existing aggregate, either merging the present fields or
   * replacing all of them. The store write and the event commit together or not at all; the row
   * stays locked until then, so the events of concurrent updates follow the commit order.
   *
   * @param <UPDATE> command type
   * @param <AGGREGATE> updated aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?, ?>,
    AGGREGATE
  > extends DomainCommandHandler<UPDATE, AGGREGATE, AGGREGATE> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /**
     * Validates the command and updates the aggregate.
     *
     * @param command to update the aggregate with
     * @param trx transactional context to write with
     * @return updated aggregate
     * @throws NotFoundException if there is no aggregate with {@link
     *     DomainCommand.Update#aggregateId()}
     */
    protected abstract AGGREGATE update(final UPDATE command, final DSLContext trx);

    @Override
    protected final AGGREGATE internalRunContract(
        final UPDATE command, final DSLContext readWriteDsl, final EventLog eventLog) {
      return readWriteDsl.transactionResult(
          (final Configuration trx) -> {
            final AGGREGATE updated =
                throwIllegalStateIfNull(update(command, trx.dsl()), "Updated aggregate");
            appendEvent(
                trx.dsl(),
                eventLog,
                command,
                ModificationType.ofUpdate(command.merge()),
                command.aggregateId(),
                updated);
            return updated;
          });
    }
  }

  /**
   * Defines the deletion of several aggregates at once.
   *
   * <p>The bulk delete commits first. Then a {@link ModificationType#DELETE} event is appended for
   * every requested id, whether the store had it or not, each on its own: a failing append is
   * logged and changes neither the deletion nor the reported result.
   *
   * @param <DELETE> command type
   * @param <AGGREGATE> deleted aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class BatchDelete<
    DELETE extends DomainCommand.BatchDelete<?, ?>,
    AGGREGATE
  > extends DomainCommandHandler<DELETE, AGGREGATE, CommandResult> {
  // @formatter:on
    protected BatchDelete(final Class<DELETE> commandClass) {
      super(commandClass);
    }

    /**
     * Validates the command and deletes the aggregates.
     *
     * @param command listing the aggregates to delete
     * @param trx transactional context to write with
     * @return amount of aggregates which existed and were deleted
     */
    protected abstract int delete(final DELETE command, final DSLContext trx);

    /**
     * @param command which was handled
     * @param deletedCount as returned by {@link #delete(DomainCommand.BatchDelete, DSLContext)}
     * @return result to report to the caller
     */
    protected abstract CommandResult summarize(final DELETE command, final int deletedCount);

    @Override
    protected final CommandResult internalRunContract(
        final DELETE command, final DSLContext readWriteDsl, final EventLog eventLog) {
      final List<String> aggregateIds =
          throwIllegalStateIfNull(command.aggregateIds(), "Aggregate ids");
      final int deletedCount =
          readWriteDsl.transactionResult((final Configuration trx) -> delete(command, trx.dsl()));

      for (String aggregateId : aggregateIds) {
        try {
          readWriteDsl.transaction(
              (final Configuration trx) ->
                  appendEvent(
                      trx.dsl(), eventLog, command, ModificationType.DELETE, aggregateId, null));
        } catch (RuntimeException e) {
          LOG.warn("Failed to append {} event for '{}'", ModificationType.DELETE, aggregateId, e);
        }
      }

      return summarize(command, deletedCount);
    }
  }
}
