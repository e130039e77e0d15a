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

import io.github.suppierk.lifecycle.authorization.ActorType;
import io.github.suppierk.lifecycle.authorization.DomainClient;
import io.github.suppierk.lifecycle.authorization.UnauthorizedException;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.FieldLimits;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import io.github.suppierk.lifecycle.errors.NotFoundException;
import io.github.suppierk.lifecycle.errors.ValidationException;
import java.time.Instant;
import java.util.List;

/**
 * Class to accept and process the work associated to a specific {@link LifecycleCommand}:
 *
 * <ul>
 *   <li>Assert that the {@link DomainClient} can invoke the {@link LifecycleCommand}.
 *   <li>Validate the shape of the command.
 *   <li>Ask the {@link LifecycleStateMachine} which events the command produces for the replayed
 *       state of the aggregate.
 * </ul>
 *
 * <p>Handlers never touch storage: {@link LifecycleContext} loads the state before and appends
 * the decided events after.
 *
 * <p>Because {@link LifecycleCommand} leverages Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature: phase-moving commands extend {@link Transition},
 * attribute mutations extend {@link Attribute} and two-step commands extend {@link Compound}.
 *
 * @param <COMMAND> the type of the particular {@link LifecycleCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class LifecycleCommandHandler<
  COMMAND extends LifecycleCommand
>
extends
        DomainHandler<COMMAND, List<LifecycleEvent>>
permits
  LifecycleCommandHandler.Transition,
  LifecycleCommandHandler.Attribute,
  LifecycleCommandHandler.Compound
{
// @formatter:on
  private final Class<COMMAND> commandClass;
  private final LifecycleStateMachine stateMachine;

  /**
   * @param commandClass the class of the {@link LifecycleCommand} to handle
   * @param stateMachine to delegate decisions to
   * @throws IllegalArgumentException if any argument is null
   */
  protected LifecycleCommandHandler(
      final Class<COMMAND> commandClass, final LifecycleStateMachine stateMachine) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
    this.stateMachine = throwIllegalArgumentIfNull(stateMachine, "State machine");
  }

  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  protected final LifecycleStateMachine stateMachine() {
    return stateMachine;
  }

  /**
   * @return {@code true} if the command may run against an aggregate without history
   */
  protected boolean createsAggregate() {
    return false;
  }

  /**
   * Rejects commands with missing or malformed fields before any state is loaded.
   *
   * @param command being validated
   * @throws ValidationException if the command is malformed
   */
  protected abstract void validate(final COMMAND command);

  /**
   * Defines business logic of this particular handler.
   *
   * @param command being invoked
   * @param state of the aggregate replayed from its events
   * @param now instant the command is decided at
   * @return events to append, empty if the aggregate already is in the requested state
   */
  protected abstract List<LifecycleEvent> decide(
      final COMMAND command, final CompanyProductState state, final Instant now);

  /**
   * Checks the client and the command shape. Package-private as it is intended to be invoked by
   * {@link LifecycleContext} only, once per command regardless of retries.
   *
   * @param command to check
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if the command has no client
   * @throws UnauthorizedException if the client is not allowed to execute the command
   * @throws ValidationException if the command is malformed
   */
  final void authorize(final COMMAND command) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' command"
              .formatted(nonNullDomainClient.domainRole(), getCommandClass().getSimpleName()));
    }

    final AggregateRef target = throwValidationIfNull(nonNullCommand.target(), "Aggregate");
    throwValidationIfBlank(target.aggregateId(), "companyProductId");
    throwValidationIfBlank(target.companyId(), "companyId");
    throwValidationIfBlank(target.productId(), "productId");
    throwValidationIfLongerThan(target.aggregateId(), FieldLimits.IDENTIFIER, "companyProductId");
    throwValidationIfLongerThan(target.companyId(), FieldLimits.IDENTIFIER, "companyId");
    throwValidationIfLongerThan(target.productId(), FieldLimits.IDENTIFIER, "productId");
    if (nonNullCommand.actor() != null) {
      throwValidationIfLongerThan(nonNullCommand.actor().id(), FieldLimits.ACTOR_ID, "actorId");
    }

    validate(nonNullCommand);
  }

  /**
   * Decides the events of an authorized command.
   *
   * @param command being executed
   * @param state of the aggregate, the initial state if it has no events
   * @param now instant the command is decided at
   * @return events to append
   * @throws NotFoundException if the aggregate has no history and the command cannot create it
   */
  final List<LifecycleEvent> runInContext(
      final COMMAND command, final CompanyProductState state, final Instant now) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final CompanyProductState nonNullState = throwIllegalStateIfNull(state, "Aggregate state");
    final Instant nonNullNow = throwIllegalStateIfNull(now, "Decision instant");

    if (nonNullState.isNew() && !createsAggregate()) {
      throw new NotFoundException(
          "Company product '%s' does not exist".formatted(nonNullState.aggregateId()));
    }

    return List.copyOf(
        throwIllegalStateIfNull(
            decide(nonNullCommand, nonNullState, nonNullNow), "Command handler result"));
  }

  /**
   * AI collaborators may propose changes but never move an aggregate along its lifecycle.
   *
   * @param domainClient invoking the command
   * @return {@code true} unless the client is an AI actor
   */
  static boolean isNotAi(final DomainClient domainClient) {
    return domainClient.actorType() != ActorType.AI;
  }

  /**
   * Commands moving the aggregate between phases or stages.
   *
   * @param <COMMAND> the type of the particular {@link LifecycleCommand}
   */
  public abstract static non-sealed class Transition<COMMAND extends LifecycleCommand>
      extends LifecycleCommandHandler<COMMAND> {
    protected Transition(
        final Class<COMMAND> commandClass, final LifecycleStateMachine stateMachine) {
      super(commandClass, stateMachine);
    }

    @Override
    protected boolean canBeUsedBy(final DomainClient domainClient) {
      return isNotAi(domainClient);
    }
  }

  /**
   * Commands changing a single attribute, independent of the phase.
   *
   * @param <COMMAND> the type of the particular {@link LifecycleCommand}
   */
  public abstract static non-sealed class Attribute<COMMAND extends LifecycleCommand>
      extends LifecycleCommandHandler<COMMAND> {
    protected Attribute(
        final Class<COMMAND> commandClass, final LifecycleStateMachine stateMachine) {
      super(commandClass, stateMachine);
    }
  }

  /**
   * Commands completing the current process and starting the next one. Both events are appended
   * in one batch or not at all.
   *
   * @param <COMMAND> the type of the particular {@link LifecycleCommand}
   */
  public abstract static non-sealed class Compound<COMMAND extends LifecycleCommand>
      extends LifecycleCommandHandler<COMMAND> {
    protected Compound(
        final Class<COMMAND> commandClass, final LifecycleStateMachine stateMachine) {
      super(commandClass, stateMachine);
    }

    @Override
    protected boolean canBeUsedBy(final DomainClient domainClient) {
      return isNotAi(domainClient);
    }
  }
}
