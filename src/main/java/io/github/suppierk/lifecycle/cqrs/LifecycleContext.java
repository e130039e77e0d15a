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

package io.github.suppierk.lifecycle.cqrs;

import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleFold;
import io.github.suppierk.lifecycle.errors.ConcurrencyConflictException;
import io.github.suppierk.lifecycle.errors.LifecycleException;
import io.github.suppierk.lifecycle.errors.ValidationException;
import io.github.suppierk.lifecycle.jooq.DslContextProvider;
import io.github.suppierk.lifecycle.store.EventStore;
import io.github.suppierk.lifecycle.store.PendingEvent;
import io.github.suppierk.lifecycle.store.StoredEvent;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The bounded context of company product lifecycles: a registry of command and query handlers and
 * the single place where commands meet the event store.
 *
 * <p>Executing a command:
 *
 * <ol>
 *   <li>authorize and validate it via its handler,
 *   <li>replay the events of the aggregate into its current state,
 *   <li>let the handler decide the events,
 *   <li>append them with the replayed sequence number as the expected one.
 * </ol>
 *
 * <p>Losing an append race reloads the state and decides again, up to the configured number of
 * retries. Commands on different aggregates share nothing but the handler registry, which is
 * guarded by a {@link ReentrantReadWriteLock}.
 */
public final class LifecycleContext extends Suspicious {
  private static final Logger LOG = LoggerFactory.getLogger(LifecycleContext.class);

  private final EventStore eventStore;
  private final DslContextProvider readDslContextProvider;
  private final int maxConcurrencyRetries;
  private final Clock clock;

  private final ReentrantReadWriteLock lock;
  private final Map<Class<? extends LifecycleCommand>, LifecycleCommandHandler<?>> commandHandlers;
  private final Map<Class<? extends ReadModelQuery>, ReadModelQueryHandler<?, ?>> queryHandlers;

  /**
   * @param eventStore commands are loaded from and appended to
   * @param readDslContextProvider picks the database queries run against
   * @param maxConcurrencyRetries how many times a command is retried after losing an append race
   * @param clock commands are decided at
   * @throws IllegalArgumentException if any argument is null or the retry count is negative
   */
  public LifecycleContext(
      final EventStore eventStore,
      final DslContextProvider readDslContextProvider,
      final int maxConcurrencyRetries,
      final Clock clock) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.readDslContextProvider =
        throwIllegalArgumentIfNull(readDslContextProvider, "Read DSL context provider");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");

    if (maxConcurrencyRetries < 0) {
      throw new IllegalArgumentException("Concurrency retries cannot be negative");
    }
    this.maxConcurrencyRetries = maxConcurrencyRetries;

    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
    this.queryHandlers = new HashMap<>();
  }

  /**
   * @param handler to register, exactly one per command class
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if the command class already has a handler
   */
  public void addCommandHandler(final LifecycleCommandHandler<?> handler) {
    final LifecycleCommandHandler<?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");

    lock.writeLock().lock();
    try {
      if (commandHandlers.putIfAbsent(nonNullHandler.getCommandClass(), nonNullHandler) != null) {
        throw new IllegalStateException(
            "Command '%s' already has a handler"
                .formatted(nonNullHandler.getCommandClass().getSimpleName()));
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @param handler to register, exactly one per query class
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if the query class already has a handler
   */
  public void addQueryHandler(final ReadModelQueryHandler<?, ?> handler) {
    final ReadModelQueryHandler<?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Query handler");

    lock.writeLock().lock();
    try {
      if (queryHandlers.putIfAbsent(nonNullHandler.getQueryClass(), nonNullHandler) != null) {
        throw new IllegalStateException(
            "Query '%s' already has a handler"
                .formatted(nonNullHandler.getQueryClass().getSimpleName()));
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Set<Class<? extends LifecycleCommand>> getSupportedCommandClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(commandHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Set<Class<? extends ReadModelQuery>> getSupportedQueryClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(queryHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Executes a single command.
   *
   * @param command to execute
   * @return accepted or rejected result, rejections never throw
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public CommandResult execute(final LifecycleCommand command) {
    final LifecycleCommand nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final LifecycleCommandHandler<LifecycleCommand> handler = commandHandlerFor(nonNullCommand);

    try {
      handler.authorize(nonNullCommand);
    } catch (LifecycleException e) {
      return reject(nonNullCommand, e);
    }

    int attempt = 0;
    while (true) {
      try {
        return executeOnce(handler, nonNullCommand);
      } catch (ConcurrencyConflictException e) {
        if (attempt >= maxConcurrencyRetries) {
          LOG.warn(
              "Giving up on '{}' for aggregate '{}' after {} concurrency retries",
              nonNullCommand.action().actionName(),
              nonNullCommand.target().aggregateId(),
              attempt);
          return CommandResult.rejected(nonNullCommand.action(), e);
        }

        attempt++;
        LOG.debug(
            "Retrying '{}' for aggregate '{}', attempt {} of {}",
            nonNullCommand.action().actionName(),
            nonNullCommand.target().aggregateId(),
            attempt,
            maxConcurrencyRetries);
      } catch (LifecycleException e) {
        return reject(nonNullCommand, e);
      }
    }
  }

  private CommandResult executeOnce(
      final LifecycleCommandHandler<LifecycleCommand> handler, final LifecycleCommand command) {
    final AggregateRef target = command.target();
    eventStore
        .findAggregate(target.aggregateId())
        .filter(recorded -> !recorded.sameIdentityAs(target))
        .ifPresent(
            recorded -> {
              throw new ValidationException(
                  "Company product '%s' belongs to company '%s' and product '%s'"
                      .formatted(
                          recorded.aggregateId(), recorded.companyId(), recorded.productId()));
            });

    final CompanyProductState state =
        LifecycleFold.replay(target, eventStore.readEvents(target.aggregateId(), 1));
    final List<LifecycleEvent> decided = handler.runInContext(command, state, clock.instant());

    if (decided.isEmpty()) {
      LOG.debug(
          "'{}' is a no-op for aggregate '{}' at sequence {}",
          command.action().actionName(),
          target.aggregateId(),
          state.lastAppliedSequenceNo());
      return CommandResult.noOp(command.action());
    }

    final List<PendingEvent> pending =
        decided.stream().map(event -> new PendingEvent(event, command.actor())).toList();
    final List<StoredEvent> stored =
        eventStore.append(target, pending, state.lastAppliedSequenceNo());

    LOG.info(
        "'{}' by {} appended {} event(s) to aggregate '{}'",
        command.action().actionName(),
        command.actor().domainRole(),
        stored.size(),
        target.aggregateId());
    return CommandResult.accepted(command.action(), stored);
  }

  private CommandResult reject(final LifecycleCommand command, final LifecycleException cause) {
    LOG.info(
        "'{}' rejected for aggregate '{}': {}",
        command.action().actionName(),
        command.target() == null ? null : command.target().aggregateId(),
        cause.getMessage());
    return CommandResult.rejected(command.action(), cause);
  }

  /**
   * Runs a query returning at most one row.
   *
   * @param query to run
   * @param <ROW> type of the row
   * @return the row, if any
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  @SuppressWarnings("unchecked")
  public <ROW> Optional<ROW> queryOne(final ReadModelQuery.One<ROW> query) {
    final ReadModelQuery.One<ROW> nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final var handler =
        (ReadModelQueryHandler<ReadModelQuery.One<ROW>, Optional<ROW>>)
            queryHandlerFor(nonNullQuery);
    return handler.runInContext(nonNullQuery, readDslContextProvider.apply(nonNullQuery));
  }

  /**
   * Runs a query listing rows.
   *
   * @param query to run
   * @param <ROW> type of the rows
   * @return rows, possibly empty
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  @SuppressWarnings("unchecked")
  public <ROW> List<ROW> queryMany(final ReadModelQuery.Many<ROW> query) {
    final ReadModelQuery.Many<ROW> nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final var handler =
        (ReadModelQueryHandler<ReadModelQuery.Many<ROW>, List<ROW>>) queryHandlerFor(nonNullQuery);
    return handler.runInContext(nonNullQuery, readDslContextProvider.apply(nonNullQuery));
  }

  @SuppressWarnings("unchecked")
  private LifecycleCommandHandler<LifecycleCommand> commandHandlerFor(
      final LifecycleCommand command) {
    lock.readLock().lock();
    try {
      return (LifecycleCommandHandler<LifecycleCommand>)
          throwUnsupportedOperationIfNull(
              commandHandlers.get(command.getClass()),
              "Handler for command '%s'".formatted(command.getClass().getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }
  }

  private ReadModelQueryHandler<?, ?> queryHandlerFor(final ReadModelQuery query) {
    lock.readLock().lock();
    try {
      return throwUnsupportedOperationIfNull(
          queryHandlers.get(query.getClass()),
          "Handler for query '%s'".formatted(query.getClass().getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return {@code true} if any thread holds the registry write lock, used by tests
   */
  boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }
}
