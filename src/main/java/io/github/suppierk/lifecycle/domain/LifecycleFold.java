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

import io.github.suppierk.lifecycle.store.StoredEvent;
import java.time.Instant;
import java.util.List;

/**
 * Folds events into {@link CompanyProductState}.
 *
 * <p>A pure function of its inputs: no I/O, no clock, no randomness, so that a replay of the same
 * log always yields the same state. Used by the command layer to load aggregates and by the
 * projector to build read model rows.
 */
public final class LifecycleFold {
  private LifecycleFold() {
    // Cannot be instantiated
  }

  /**
   * @param ref identity of the aggregate
   * @param events full history ordered by sequence number
   * @return state after all events
   * @throws IllegalStateException if the history is out of order or has gaps
   */
  public static CompanyProductState replay(AggregateRef ref, List<StoredEvent> events) {
    return applyAll(CompanyProductState.initial(ref), events);
  }

  public static CompanyProductState applyAll(CompanyProductState state, List<StoredEvent> events) {
    CompanyProductState current = state;
    for (StoredEvent event : events) {
      current = apply(current, event);
    }
    return current;
  }

  /**
   * Applies the next event of the aggregate.
   *
   * @param state current state
   * @param event must carry {@code state.lastAppliedSequenceNo() + 1}
   * @return new state with the watermark moved to the event
   * @throws IllegalStateException if the event belongs elsewhere or is not the next one
   */
  public static CompanyProductState apply(CompanyProductState state, StoredEvent event) {
    if (state == null || event == null) {
      throw new IllegalArgumentException("State and event cannot be null");
    }
    if (!state.aggregateId().equals(event.aggregateId())) {
      throw new IllegalStateException(
          "Event of aggregate '%s' cannot be applied to aggregate '%s'"
              .formatted(event.aggregateId(), state.aggregateId()));
    }

    final long expected = state.lastAppliedSequenceNo() + 1;
    if (event.sequenceNo() != expected) {
      throw new IllegalStateException(
          "Event %d of aggregate '%s' is out of order, expected %d"
              .formatted(event.sequenceNo(), state.aggregateId(), expected));
    }

    final CompanyProductState.Builder next = state.toBuilder();
    final Instant at = event.occurredAt();
    final LifecycleEvent payload = event.payload();

    if (payload instanceof LifecycleEvent.SaleStarted e) {
      startProcess(next, e.processId(), ProcessType.SALES, at)
          .phase(e.toPhase())
          .currentStage(e.stageId(), e.stageName(), e.stageOrder());
    } else if (payload instanceof LifecycleEvent.ProcessStarted e) {
      startProcess(next, e.processId(), e.processType(), at)
          .phase(e.toPhase())
          .currentStage(e.stageId(), e.stageName(), e.stageOrder());
    } else if (payload instanceof LifecycleEvent.StageAdvanced e) {
      next.currentStage(e.toStageId(), e.toStageName(), e.toStageOrder())
          .stageEnteredAt(at)
          .lastStageMovedAt(at)
          .stageTransitionCount(state.stageTransitionCount() + 1);
    } else if (payload instanceof LifecycleEvent.PhaseChanged e) {
      next.phase(e.toPhase())
          .churnReason(e.toPhase() == LifecyclePhase.CHURNED ? e.churnReason() : null);
    } else if (payload instanceof LifecycleEvent.ProcessCompleted e) {
      next.status(ProcessStatus.COMPLETED)
          .terminalOutcome(e.outcome())
          .processCompletedAt(at)
          .currentStage(e.terminalStageId(), e.terminalStageName(), e.terminalStageOrder())
          .stageEnteredAt(at)
          .lastStageMovedAt(at);
    } else if (payload instanceof LifecycleEvent.OwnerChanged e) {
      next.owner(e.toOwnerId(), e.toOwnerName());
    } else if (payload instanceof LifecycleEvent.TierChanged e) {
      next.tier(e.toTier());
    } else if (payload instanceof LifecycleEvent.MrrChanged e) {
      next.mrr(e.toMrr(), e.currency());
    } else if (payload instanceof LifecycleEvent.SeatsChanged e) {
      next.seats(e.toSeats());
    } else if (payload instanceof LifecycleEvent.NextStepScheduled e) {
      next.nextStep(e.toNextStep(), e.toDueAt());
    } else if (payload instanceof LifecycleEvent.CloseConfidenceChanged e) {
      next.closeConfidence(e.toConfidence(), e.closeReady());
    } else {
      throw new IllegalStateException(
          "Unsupported event payload %s".formatted(payload.getClass().getName()));
    }

    return next.lastEvent(event.eventType(), at, event.sequenceNo()).build();
  }

  private static CompanyProductState.Builder startProcess(
      CompanyProductState.Builder next, String processId, ProcessType type, Instant at) {
    return next.currentProcess(processId, type)
        .status(ProcessStatus.IN_PROGRESS)
        .processStartedAt(at)
        .processCompletedAt(null)
        .terminalOutcome(null)
        .stageTransitionCount(0)
        .stageEnteredAt(at)
        .lastStageMovedAt(at);
  }
}
