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

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.StageTrigger;
import io.github.suppierk.lifecycle.domain.TerminalOutcome;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Represents an immutable intent to change a single company product.
 *
 * <p>Commands are task-oriented: each one maps to a single {@link CommandAction} and a single
 * {@link LifecycleCommandHandler}. Field values are validated by the handler, not here, so that
 * malformed input surfaces as a rejected command rather than a construction failure.
 */
// @formatter:off
public sealed interface LifecycleCommand extends DomainMessage
permits
  LifecycleCommand.StartSale, LifecycleCommand.AdvanceStage,
  LifecycleCommand.SetPhase, LifecycleCommand.SetOwner,
  LifecycleCommand.SetTier, LifecycleCommand.SetMrr,
  LifecycleCommand.SetSeats, LifecycleCommand.SetNextStepDue,
  LifecycleCommand.SetCloseConfidence, LifecycleCommand.CompleteProcess,
  LifecycleCommand.CompleteSaleAndStartOnboarding,
  LifecycleCommand.CompleteOnboardingAndStartEngagement,
  LifecycleCommand.StartProcess
{
// @formatter:on

  /**
   * @return identity of the company product the command targets
   */
  AggregateRef target();

  CommandAction action();

  /** Begins a sales process on a prospect, implicitly creating the aggregate. */
  record StartSale(AggregateRef target, Actor actor, String processId, String initialStageId)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.START_SALE;
    }
  }

  /**
   * @param trigger optional, manual when absent
   */
  record AdvanceStage(
      AggregateRef target, Actor actor, String toStageId, String reason, StageTrigger trigger)
      implements LifecycleCommand {
    public AdvanceStage(AggregateRef target, Actor actor, String toStageId, String reason) {
      this(target, actor, toStageId, reason, null);
    }

    @Override
    public CommandAction action() {
      return CommandAction.ADVANCE_STAGE;
    }
  }

  /**
   * Manual phase override.
   *
   * @param churnReason required when {@code toPhase} is churned
   */
  record SetPhase(
      AggregateRef target,
      Actor actor,
      LifecyclePhase toPhase,
      String reason,
      String churnReason)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_PHASE;
    }
  }

  record SetOwner(
      AggregateRef target, Actor actor, String ownerId, String ownerName, String reason)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_OWNER;
    }
  }

  record SetTier(AggregateRef target, Actor actor, Integer tier, String reason)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_TIER;
    }
  }

  /**
   * @param currency three-letter code, the configured default when absent
   */
  record SetMrr(AggregateRef target, Actor actor, BigDecimal mrr, String currency, String reason)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_MRR;
    }
  }

  record SetSeats(AggregateRef target, Actor actor, Integer seats, String reason)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_SEATS;
    }
  }

  record SetNextStepDue(AggregateRef target, Actor actor, String nextStep, Instant dueAt)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_NEXT_STEP_DUE;
    }
  }

  /**
   * @param confidence percentage between 0 and 100
   */
  record SetCloseConfidence(AggregateRef target, Actor actor, Integer confidence)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.SET_CLOSE_CONFIDENCE;
    }
  }

  /**
   * @param processId optional, must match the current process when present
   */
  record CompleteProcess(
      AggregateRef target,
      Actor actor,
      String processId,
      String terminalStageId,
      TerminalOutcome outcome,
      String notes)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.COMPLETE_PROCESS;
    }
  }

  /**
   * @param onboardingProcessId optional, the product's default onboarding process when absent
   */
  record CompleteSaleAndStartOnboarding(
      AggregateRef target, Actor actor, String onboardingProcessId, String notes)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.COMPLETE_SALE_START_ONBOARDING;
    }
  }

  /**
   * @param engagementProcessId optional, the product's default engagement process when absent
   */
  record CompleteOnboardingAndStartEngagement(
      AggregateRef target, Actor actor, String engagementProcessId, String notes)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.COMPLETE_ONBOARDING_START_ENGAGEMENT;
    }
  }

  /**
   * Starts a process on an aggregate without one running, within its current phase.
   *
   * @param initialStageId optional, the first stage of the process when absent
   */
  record StartProcess(AggregateRef target, Actor actor, String processId, String initialStageId)
      implements LifecycleCommand {
    @Override
    public CommandAction action() {
      return CommandAction.START_PROCESS;
    }
  }
}
