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

package io.github.suppierk.lifecycle.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.authorization.ActorType;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommand;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.StageTrigger;
import io.github.suppierk.lifecycle.domain.TerminalOutcome;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * JSON shape of a command at the request boundary, discriminated by its {@code action} field.
 *
 * <p>Every request names the company product and may name the actor; {@code actorType} defaults to
 * {@code user}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "action")
@JsonSubTypes({
  @JsonSubTypes.Type(value = LifecycleCommandRequest.StartSale.class, name = "start-sale"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.AdvanceStage.class, name = "advance-stage"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.SetPhase.class, name = "set-phase"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.SetOwner.class, name = "set-owner"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.SetTier.class, name = "set-tier"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.SetMrr.class, name = "set-mrr"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.SetSeats.class, name = "set-seats"),
  @JsonSubTypes.Type(
      value = LifecycleCommandRequest.SetNextStepDue.class,
      name = "set-next-step-due"),
  @JsonSubTypes.Type(
      value = LifecycleCommandRequest.SetCloseConfidence.class,
      name = "set-close-confidence"),
  @JsonSubTypes.Type(
      value = LifecycleCommandRequest.CompleteProcess.class,
      name = "complete-process"),
  @JsonSubTypes.Type(
      value = LifecycleCommandRequest.CompleteSaleAndStartOnboarding.class,
      name = "complete-sale-start-onboarding"),
  @JsonSubTypes.Type(
      value = LifecycleCommandRequest.CompleteOnboardingAndStartEngagement.class,
      name = "complete-onboarding-start-engagement"),
  @JsonSubTypes.Type(value = LifecycleCommandRequest.StartProcess.class, name = "start-process")
})
public sealed interface LifecycleCommandRequest {
  String companyProductId();

  String companyId();

  String productId();

  String actorType();

  String actorId();

  LifecycleCommand toCommand();

  /**
   * @return {@code true} if every identity field is present and not blank
   */
  default boolean hasIdentity() {
    return isPresent(companyProductId()) && isPresent(companyId()) && isPresent(productId());
  }

  default AggregateRef target() {
    return new AggregateRef(companyProductId(), companyId(), productId());
  }

  /**
   * @throws IllegalArgumentException if {@code actorType} is unknown
   */
  default Actor actor() {
    final ActorType type =
        actorType() == null ? ActorType.USER : ActorType.fromWireName(actorType());
    return new Actor(type, actorId());
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  record StartSale(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String processId,
      String initialStageId)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.StartSale(target(), actor(), processId, initialStageId);
    }
  }

  record AdvanceStage(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String toStageId,
      String reason,
      StageTrigger trigger)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.AdvanceStage(target(), actor(), toStageId, reason, trigger);
    }
  }

  record SetPhase(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      LifecyclePhase toPhase,
      String reason,
      String churnReason)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetPhase(target(), actor(), toPhase, reason, churnReason);
    }
  }

  record SetOwner(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String ownerId,
      String ownerName,
      String reason)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetOwner(target(), actor(), ownerId, ownerName, reason);
    }
  }

  record SetTier(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      Integer tier,
      String reason)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetTier(target(), actor(), tier, reason);
    }
  }

  record SetMrr(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      BigDecimal mrr,
      String currency,
      String reason)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetMrr(target(), actor(), mrr, currency, reason);
    }
  }

  record SetSeats(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      Integer seats,
      String reason)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetSeats(target(), actor(), seats, reason);
    }
  }

  record SetNextStepDue(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String nextStep,
      Instant dueAt)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetNextStepDue(target(), actor(), nextStep, dueAt);
    }
  }

  record SetCloseConfidence(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      Integer confidence)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.SetCloseConfidence(target(), actor(), confidence);
    }
  }

  record CompleteProcess(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String processId,
      String terminalStageId,
      TerminalOutcome outcome,
      String notes)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.CompleteProcess(
          target(), actor(), processId, terminalStageId, outcome, notes);
    }
  }

  record CompleteSaleAndStartOnboarding(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String onboardingProcessId,
      String notes)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.CompleteSaleAndStartOnboarding(
          target(), actor(), onboardingProcessId, notes);
    }
  }

  record CompleteOnboardingAndStartEngagement(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String engagementProcessId,
      String notes)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.CompleteOnboardingAndStartEngagement(
          target(), actor(), engagementProcessId, notes);
    }
  }

  record StartProcess(
      String companyProductId,
      String companyId,
      String productId,
      String actorType,
      String actorId,
      String processId,
      String initialStageId)
      implements LifecycleCommandRequest {
    @Override
    public LifecycleCommand toCommand() {
      return new LifecycleCommand.StartProcess(target(), actor(), processId, initialStageId);
    }
  }
}
