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


package io.github.suppierk.lifecycle.projection;

import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.store.StoredEvent;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives stage fact writes from a single fold step.
 *
 * <p>A fact opens whenever an event puts the aggregate into a stage of a running process and closes
 * when the aggregate leaves that stage or the process stops running. A process resumed by a phase
 * override gets its next fact at its next stage move. Pure, like {@link
 * io.github.suppierk.lifecycle.domain.LifecycleFold}, so that catch-up and rebuild agree.
 */
public final class StageFacts {
  private StageFacts() {
    // Cannot be instantiated
  }

  /**
   * @param before state the event was applied to
   * @param event applied
   * @param after state after the event
   * @return writes in the order they must be applied, close before open
   */
  public static List<StageFactChange> changes(
      CompanyProductState before, StoredEvent event, CompanyProductState after) {
    final LifecycleEvent payload = event.payload();
    final List<StageFactChange> changes = new ArrayList<>(2);

    if (before.hasActiveProcess() && leavesStage(payload, after)) {
      final Instant enteredAt =
          before.stageEnteredAt() == null ? event.occurredAt() : before.stageEnteredAt();
      changes.add(
          new StageFactChange.Closed(
              before.aggregateId(),
              event.sequenceNo(),
              event.occurredAt(),
              Duration.between(enteredAt, event.occurredAt()).getSeconds(),
              businessDays(enteredAt, event.occurredAt()),
              exitReason(payload)));
    }

    if (entersStage(payload) && after.hasActiveProcess()) {
      changes.add(
          new StageFactChange.Opened(
              new StageFact(
                  after.aggregateId(),
                  event.sequenceNo(),
                  after.companyId(),
                  after.productId(),
                  after.currentProcessId(),
                  after.currentProcessType(),
                  after.currentStageId(),
                  after.currentStageName(),
                  after.currentStageOrder(),
                  event.occurredAt(),
                  null,
                  null,
                  null,
                  null,
                  null)));
    }

    return changes;
  }

  /**
   * Counts the weekdays, in UTC, among {@code from}, {@code from} plus one day and so on while
   * before {@code to}.
   */
  static int businessDays(Instant from, Instant to) {
    int count = 0;
    ZonedDateTime current = from.atZone(ZoneOffset.UTC);
    while (current.toInstant().isBefore(to)) {
      final DayOfWeek day = current.getDayOfWeek();
      if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
        count++;
      }
      current = current.plusDays(1);
    }
    return count;
  }

  private static boolean entersStage(LifecycleEvent payload) {
    return payload instanceof LifecycleEvent.SaleStarted
        || payload instanceof LifecycleEvent.ProcessStarted
        || payload instanceof LifecycleEvent.StageAdvanced;
  }

  private static boolean leavesStage(LifecycleEvent payload, CompanyProductState after) {
    return entersStage(payload)
        || payload instanceof LifecycleEvent.ProcessCompleted
        || !after.hasActiveProcess();
  }

  private static StageExitReason exitReason(LifecycleEvent payload) {
    if (payload instanceof LifecycleEvent.StageAdvanced e) {
      return e.fromStageOrder() != null && e.toStageOrder() < e.fromStageOrder()
          ? StageExitReason.REGRESSED
          : StageExitReason.PROGRESSED;
    }
    if (payload instanceof LifecycleEvent.ProcessCompleted) {
      return StageExitReason.COMPLETED;
    }
    return StageExitReason.CANCELLED;
  }
}
