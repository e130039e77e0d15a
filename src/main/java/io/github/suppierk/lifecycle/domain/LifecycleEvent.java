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

package io.github.suppierk.lifecycle.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable facts recorded for a company product. Payloads only: sequence numbers, actors and
 * timestamps are assigned by the event store.
 *
 * <p>New versions may add optional fields; readers ignore properties they do not know.
 */
// @formatter:off
public sealed interface LifecycleEvent
permits
  LifecycleEvent.SaleStarted, LifecycleEvent.ProcessStarted,
  LifecycleEvent.StageAdvanced, LifecycleEvent.PhaseChanged,
  LifecycleEvent.ProcessCompleted, LifecycleEvent.OwnerChanged,
  LifecycleEvent.TierChanged, LifecycleEvent.MrrChanged,
  LifecycleEvent.SeatsChanged, LifecycleEvent.NextStepScheduled,
  LifecycleEvent.CloseConfidenceChanged
{
// @formatter:on

  @JsonIgnore
  LifecycleEventType type();

  /** A sales process began on a prospect. */
  record SaleStarted(
      String processId,
      int processVersion,
      String stageId,
      String stageName,
      int stageOrder,
      LifecyclePhase fromPhase,
      LifecyclePhase toPhase)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.SALE_STARTED;
    }
  }

  /** A follow-up process began right after the previous one completed. */
  record ProcessStarted(
      String processId,
      ProcessType processType,
      int processVersion,
      String stageId,
      String stageName,
      int stageOrder,
      LifecyclePhase fromPhase,
      LifecyclePhase toPhase)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.PROCESS_STARTED;
    }
  }

  /**
   * The aggregate moved to another stage of its current process.
   *
   * @param progression {@code false} when the target stage comes earlier than the current one
   * @param trigger absent in events recorded before triggers were tracked
   */
  record StageAdvanced(
      String fromStageId,
      String fromStageName,
      Integer fromStageOrder,
      String toStageId,
      String toStageName,
      int toStageOrder,
      boolean progression,
      String reason,
      StageTrigger trigger)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.STAGE_ADVANCED;
    }
  }

  record PhaseChanged(
      LifecyclePhase fromPhase, LifecyclePhase toPhase, String reason, String churnReason)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.PHASE_CHANGED;
    }
  }

  /** The current process reached one of its terminal stages. */
  record ProcessCompleted(
      String processId,
      ProcessType processType,
      String terminalStageId,
      String terminalStageName,
      int terminalStageOrder,
      TerminalOutcome outcome,
      long durationDays,
      int stageTransitionCount,
      String notes)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.PROCESS_COMPLETED;
    }
  }

  record OwnerChanged(
      String fromOwnerId, String fromOwnerName, String toOwnerId, String toOwnerName, String reason)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.OWNER_CHANGED;
    }
  }

  record TierChanged(Integer fromTier, int toTier, String reason) implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.TIER_CHANGED;
    }
  }

  record MrrChanged(BigDecimal fromMrr, BigDecimal toMrr, String currency, String reason)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.MRR_CHANGED;
    }
  }

  record SeatsChanged(Integer fromSeats, int toSeats, String reason) implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.SEATS_CHANGED;
    }
  }

  /**
   * @param overdue whether the due instant was already in the past when scheduled
   */
  record NextStepScheduled(
      String fromNextStep,
      Instant fromDueAt,
      String toNextStep,
      Instant toDueAt,
      boolean overdue)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.NEXT_STEP_SCHEDULED;
    }
  }

  /**
   * @param closeReady whether the confidence crossed the ready-to-close threshold
   */
  record CloseConfidenceChanged(Integer fromConfidence, int toConfidence, boolean closeReady)
      implements LifecycleEvent {
    @Override
    public LifecycleEventType type() {
      return LifecycleEventType.CLOSE_CONFIDENCE_CHANGED;
    }
  }
}
