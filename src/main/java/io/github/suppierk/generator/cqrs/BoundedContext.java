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
import io.github.suppierk.generator.event.EventLog;
import io.github.suppierk.generator.jooq.DslContextProvider;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the handlers of one aggregate type and the single entry point to run commands and
 * queries against it.
 *
 * <p>Handlers are looked up by the exact class of the message. Registration and lookup are guarded
 * by a read-write lock, so handlers can be added while the context already serves traffic.
 *
 * @param <AGGREGATE> type of the aggregate this context manages
 */
public abstract non-sealed class BoundedContext<AGGREGATE> extends Suspicious {
  private static final Logger LOG = LoggerFactory.getLogger(BoundedContext.class);

  private final DslContextProvider writeDslContextProvider;
  private final DslContextProvider readDslContextProvider;
  private final EventLog eventLog;
  private final FanoutDispatcher fanoutDispatcher;

  private final ReentrantReadWriteLock lock;
  private final Map<Class<?>, DomainCommandHandler<?, AGGREGATE, ?>> commandHandlers;
  private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers;

  /**
   * Default constructor.
   *
   * @param writeDslContextProvider resolves the context commands write with
   * @param readDslContextProvider resolves the context queries read with
   * @param eventLog commands append their events to
   * @param fanoutDispatcher handler notifications are published with
   */
  protected BoundedContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider,
      final EventLog eventLog,
      final FanoutDispatcher fanoutDispatcher) {
    this.writeDslContextProvider =
        throwIllegalArgumentIfNull(writeDslContextProvider, "Read-write DSL provider");
    this.readDslContextProvider =
        throwIllegalArgumentIfNull(readDslContextProvider, "Read-only DSL provider");
    this.eventLog = throwIllegalArgumentIfNull(eventLog, "Event log");
    this.fanoutDispatcher = throwIllegalArgumentIfNull(fanoutDispatcher, "Fanout dispatcher");

    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
    this.queryHandlers = new HashMap<>();
  }

  /**
   * @param handler to register
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public final void addDomainCommandHandler(final DomainCommandHandler<?, AGGREGATE, ?> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Command handler");
    final Class<?> commandClass = nonNullHandler.getCommandClass();

    lock.writeLock().lock();
    try {
      if (commandHandlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(commandClass.getSimpleName()));
      }

      commandHandlers.put(commandClass, nonNullHandler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @param handler to register
   * @throws IllegalStateException if a handler for the same query class is already registered
   */
  public final void addDomainQueryHandler(final DomainQueryHandler<?, ?> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Query handler");
    final Class<?> queryClass = nonNullHandler.getQueryClass();

    lock.writeLock().lock();
    try {
      if (queryHandlers.containsKey(queryClass)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(queryClass.getSimpleName()));
      }

      queryHandlers.put(queryClass, nonNullHandler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(commandHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  public final Set<Class<?>> getSupportedDomainQueryClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(queryHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Visible for tests: registration must never leak the write lock. */
  final boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  /** Visible for tests: handler lookup must never leak a read lock. */
  final boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }

  /**
   * @param command to create an aggregate from
   * @param <C> is the type of the command
   * @return created aggregate
   */
  public final <C extends DomainCommand.Create<?, ?>> AGGREGATE createModel(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    @SuppressWarnings("unchecked")
    final var handler =
        (DomainCommandHandler.Create<C, AGGREGATE>)
            findCommandHandler(nonNullCommand, DomainCommandHandler.Create.class);

    return handler.runInContext(
        nonNullCommand, writeDslContextProvider.apply(nonNullCommand), eventLog, fanoutDispatcher);
  }

  /**
   * @param command to update an aggregate with
   * @param <C> is the type of the command
   * @return updated aggregate
   */
  public final <C extends DomainCommand.Update<?, ?>> AGGREGATE updateModel(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    @SuppressWarnings("unchecked")
    final var handler =
        (DomainCommandHandler.Update<C, AGGREGATE>)
            findCommandHandler(nonNullCommand, DomainCommandHandler.Update.class);

    return handler.runInContext(
        nonNullCommand, writeDslContextProvider.apply(nonNullCommand), eventLog, fanoutDispatcher);
  }

  /**
   * @param command listing aggregates to delete
   * @param <C> is the type of the command
   * @return summary of the deletion
   */
  public final <C extends DomainCommand.BatchDelete<?, ?>> CommandResult deleteModels(
      final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    @SuppressWarnings("unchecked")
    final var handler =
        (DomainCommandHandler.BatchDelete<C, AGGREGATE>)
            findCommandHandler(nonNullCommand, DomainCommandHandler.BatchDelete.class);

    return handler.runInContext(
        nonNullCommand, writeDslContextProvider.apply(nonNullCommand), eventLog, fanoutDispatcher);
  }

  /**
   * @param query addressing a single aggregate
   * @param <Q> is the type of the query
   * @return found aggregate
   */
  public final <Q extends DomainQuery.One<?, ?>> AGGREGATE readModel(final Q query) {
    final Q nonNullQuery = throwIllegalArgumentIfNull(query, "Query");

    @SuppressWarnings("unchecked")
    final var handler =
        (DomainQueryHandler.One<Q, AGGREGATE>)
            findQueryHandler(nonNullQuery, DomainQueryHandler.One.class);

    return handler.runInContext(
        nonNullQuery, readDslContextProvider.apply(nonNullQuery), fanoutDispatcher);
  }

  /**
   * @param query describing a page of aggregates
   * @param <Q> is the type of the query
   * @return found page
   */
  public final <Q extends DomainQuery.Many<?, ?>> Listing<AGGREGATE> readModels(final Q query) {
    final Q nonNullQuery = throwIllegalArgumentIfNull(query, "Query");

    @SuppressWarnings("unchecked")
    final var handler =
        (DomainQueryHandler.Many<Q, AGGREGATE>)
            findQueryHandler(nonNullQuery, DomainQueryHandler.Many.class);

    return handler.runInContext(
        nonNullQuery, readDslContextProvider.apply(nonNullQuery), fanoutDispatcher);
  }

  private DomainCommandHandler<?, AGGREGATE, ?> findCommandHandler(
      final DomainCommand<?, ?> command, final Class<?> expectedVariant) {
    final DomainCommandHandler<?, AGGREGATE, ?> handler;

    lock.readLock().lock();
    try {
      handler =
          throwUnsupportedOperationIfNull(
              commandHandlers.get(command.getClass()),
              "Handler for '%s'".formatted(command.getClass().getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }

    if (!expectedVariant.isInstance(handler)) {
      throw new UnsupportedOperationException(
          "Handler for '%s' is not a %s handler"
              .formatted(command.getClass().getSimpleName(), expectedVariant.getSimpleName()));
    }

    LOG.debug(
        "Dispatching {} to {}",
        command.getClass().getSimpleName(),
        handler.getClass().getSimpleName());
    return handler;
  }

  private DomainQueryHandler<?, ?> findQueryHandler(
      final DomainQuery<?, ?> query, final Class<?> expectedVariant) {
    final DomainQueryHandler<?, ?> handler;

    lock.readLock().lock();
    try {
      handler =
          throwUnsupportedOperationIfNull(
              queryHandlers.get(query.getClass()),
              "Handler for '%s'".formatted(query.getClass().getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }

    if (!expectedVariant.isInstance(handler)) {
      throw new UnsupportedOperationException(
          "Handler for '%s' is not a %s handler"
              .formatted(query.getClass().getSimpleName(), expectedVariant.getSimpleName()));
    }

    LOG.debug(
        "Dispatching {} to {}", query.getClass().getSimpleName(), handler.getClass().getSimpleName());
    return handler;
  }
}
