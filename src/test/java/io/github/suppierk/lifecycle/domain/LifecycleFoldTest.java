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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.store.StoredEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LifecycleFoldTest {
  static final AggregateRef REF = new AggregateRef("cp-1", "acme", "prod-1");
  static final Instant T1 = Instant.parse("2024-03-01T09:00:00Z");
  static final Instant T2 = Instant.parse("2024-03-05T09:00:00Z");

  static StoredEvent stored(long sequenceNo, Instant at, LifecycleEvent payload) {
    return stored(REF.aggregateId(), sequenceNo, at, payload);
  }

  static StoredEvent stored(
      String aggregateId, long sequenceNo, Instant at, LifecycleEvent payload) {
    return new StoredEvent(
        UUID.randomUUID(),
        aggregateId,
        sequenceNo,
        sequenceNo,
        payload.type(),
        LifecycleEventType.CURRENT_VERSION,
        payload,
        Actor.system("test"),
        at);
  }

  static List<StoredEvent> history() {
    final List<StoredEvent> events = new ArrayList<>();
    events.add(
        stored(
            1,
            T1,
            new LifecycleEvent.SaleStarted(
                "P1", 1, "S1", "Discovery", 1, LifecyclePhase.PROSPECT, LifecyclePhase.IN_SALES)));
    events.add(
        stored(
            2,
            T2,
            new LifecycleEvent.StageAdvanced(
                "S1", "Discovery", 1, "S2", "Demo", 2, true, "call went well", null)));
    events.add(
        stored(3, T2, new LifecycleEvent.MrrChanged(null, new BigDecimal("500.00"), "USD", null)));
    return events;
  }

  @Nested
  class Replay {
    @Test
    void replay_must_track_stage_and_timestamps() {
      final CompanyProductState state = LifecycleFold.replay(REF, history());

      assertEquals(LifecyclePhase.IN_SALES, state.phase());
      assertEquals(ProcessStatus.IN_PROGRESS, state.status());
      assertEquals("P1", state.currentProcessId());
      assertEquals("S2", state.currentStageId());
      assertEquals(2, state.currentStageOrder());
      assertEquals(T1, state.processStartedAt());
      assertEquals(T2, state.stageEnteredAt());
      assertEquals(T2, state.lastStageMovedAt());
      assertEquals(1, state.stageTransitionCount());
      assertEquals(new BigDecimal("500.00"), state.mrr());
      assertEquals(LifecycleEventType.MRR_CHANGED, state.lastEventType());
      assertEquals(3, state.lastAppliedSequenceNo());
      assertTrue(state.hasActiveProcess());
    }

    @Test
    void replaying_twice_must_yield_equal_states() {
      assertEquals(LifecycleFold.replay(REF, history()), LifecycleFold.replay(REF, history()));
    }

    @Test
    void empty_history_is_the_initial_state() {
      final CompanyProductState state = LifecycleFold.replay(REF, List.of());

      assertTrue(state.isNew());
      assertEquals(LifecyclePhase.PROSPECT, state.phase());
      assertEquals(ProcessStatus.NONE, state.status());
      assertNull(state.currentStageId());
    }
  }

  @Nested
  class Guard {
    @Test
    void gaps_and_repeated_events_must_be_refused() {
      final List<StoredEvent> events = history();
      final CompanyProductState afterFirst =
          LifecycleFold.apply(CompanyProductState.initial(REF), events.get(0));

      assertThrows(
          IllegalStateException.class, () -> LifecycleFold.apply(afterFirst, events.get(0)));
      assertThrows(
          IllegalStateException.class, () -> LifecycleFold.apply(afterFirst, events.get(2)));
    }

    @Test
    void events_of_other_aggregates_must_be_refused() {
      final StoredEvent foreign =
          stored("cp-2", 1, T1, new LifecycleEvent.SeatsChanged(null, 10, null));

      assertThrows(
          IllegalStateException.class,
          () -> LifecycleFold.apply(CompanyProductState.initial(REF), foreign));
    }
  }

  @Nested
  class Completion {
    @Test
    void completed_process_keeps_its_terminal_stage_and_counts() {
      final List<StoredEvent> events = history();
      events.add(
          stored(
              4,
              T2,
              new LifecycleEvent.ProcessCompleted(
                  "P1", ProcessType.SALES, "S_WON", "Won", 4, TerminalOutcome.WON, 4, 1, null)));
      events.add(
          stored(
              5,
              T2,
              new LifecycleEvent.PhaseChanged(
                  LifecyclePhase.IN_SALES, LifecyclePhase.ONBOARDING, "won", "ignored")));

      final CompanyProductState state = LifecycleFold.replay(REF, events);

      assertEquals(ProcessStatus.COMPLETED, state.status());
      assertEquals(TerminalOutcome.WON, state.terminalOutcome());
      assertEquals("S_WON", state.currentStageId());
      assertEquals(T2, state.processCompletedAt());
      assertEquals(LifecyclePhase.ONBOARDING, state.phase());
      assertNull(state.churnReason());
      assertEquals(1, state.stageTransitionCount());
    }
  }
}
