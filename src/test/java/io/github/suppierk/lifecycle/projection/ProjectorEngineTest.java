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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.lifecycle.LifecycleEngine;
import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.config.LifecycleConfigs;
import io.github.suppierk.lifecycle.cqrs.CommandResult;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommand;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleFold;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.ProcessStatus;
import io.github.suppierk.lifecycle.domain.ProcessType;
import io.github.suppierk.lifecycle.domain.TerminalOutcome;
import io.github.suppierk.lifecycle.query.LifecycleQueries;
import io.github.suppierk.lifecycle.store.StoredEvent;
import io.github.suppierk.lifecycle.test.TestCatalog;
import io.github.suppierk.lifecycle.test.TestClock;
import io.github.suppierk.lifecycle.test.TestDatabase;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProjectorEngineTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.dsl("projector");
  static final Actor ACTOR = Actor.user("u-1");
  static final AggregateRef CP1 = new AggregateRef("cp-1", "acme", TestCatalog.PRODUCT);
  static final AggregateRef CP2 = new AggregateRef("cp-2", "globex", TestCatalog.PRODUCT);
  static final AggregateRef CP3 = new AggregateRef("cp-3", "initech", TestCatalog.PRODUCT);

  final TestClock clock = new TestClock();
  LifecycleEngine engine;

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll(DSL_CONTEXT);
    engine = engine(Map.of());
  }

  LifecycleEngine engine(Map<String, String> overrides) {
    return LifecycleEngine.create(
        DSL_CONTEXT, TestCatalog.catalog(), LifecycleConfigs.load(overrides), clock);
  }

  static void accepted(CommandResult result) {
    assertTrue(result.success(), () -> "%s: %s".formatted(result.errorCode(), result.error()));
  }

  void startSale(AggregateRef ref) {
    accepted(engine.context().execute(new LifecycleCommand.StartSale(ref, ACTOR, "P1", "S1")));
  }

  void setMrr(AggregateRef ref, String mrr) {
    accepted(
        engine
            .context()
            .execute(new LifecycleCommand.SetMrr(ref, ACTOR, new BigDecimal(mrr), null, null)));
  }

  void advance(AggregateRef ref, String stageId) {
    accepted(
        engine.context().execute(new LifecycleCommand.AdvanceStage(ref, ACTOR, stageId, null)));
  }

  void seedThreeDeals() {
    startSale(CP1);
    setMrr(CP1, "500");
    startSale(CP2);
    setMrr(CP2, "250");
    startSale(CP3);
    advance(CP3, "S2");
  }

  void execute(LifecycleCommand command) {
    accepted(engine.context().execute(command));
  }

  List<StageFact> facts(AggregateRef ref) {
    return engine
        .context()
        .queryMany(new LifecycleQueries.ListStageFacts(ACTOR, ref.aggregateId()));
  }

  Map<String, List<StageFact>> allFacts() {
    final Map<String, List<StageFact>> facts = new LinkedHashMap<>();
    for (AggregateRef ref : List.of(CP1, CP2, CP3)) {
      facts.put(ref.aggregateId(), facts(ref));
    }
    return facts;
  }

  List<CompanyProductState> rows() {
    return List.of(CP1, CP2, CP3).stream()
        .map(ref -> engine.readModelStore().find(ref.aggregateId()))
        .flatMap(Optional::stream)
        .toList();
  }

  @Nested
  class CatchUp {
    @Test
    void catch_up_must_project_every_event_once() {
      seedThreeDeals();

      final ProjectionResult first = engine.projector().catchUp();
      assertEquals(3, first.aggregatesProcessed());
      assertEquals(6, first.eventsProcessed());
      assertTrue(first.completed());
      assertTrue(first.failedAggregates().isEmpty());

      final List<CompanyProductState> projected = rows();
      final ProjectionResult second = engine.projector().catchUp();
      assertEquals(0, second.eventsProcessed());
      assertEquals(projected, rows());

      final CompanyProductState cp1 = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(LifecyclePhase.IN_SALES, cp1.phase());
      assertEquals("S1", cp1.currentStageId());
      assertEquals(0, new BigDecimal("500").compareTo(cp1.mrr()));
      assertEquals(2, cp1.lastAppliedSequenceNo());
    }

    @Test
    void catch_up_must_only_fold_the_missing_suffix() {
      startSale(CP1);
      engine.projector().catchUp();

      advance(CP1, "S2");
      advance(CP1, "S3");
      final ProjectionResult result = engine.projector().catchUp(List.of("cp-1", "unknown"));

      assertEquals(2, result.eventsProcessed());
      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals("S3", row.currentStageId());
      assertEquals(2, row.stageTransitionCount());
    }

    @Test
    void failing_aggregate_must_not_stop_the_others() {
      startSale(CP1);
      DSL_CONTEXT.execute(
          "insert into lifecycle_events (event_id, aggregate_id, sequence_no, event_type,"
              + " event_version, payload, actor_type, actor_id, occurred_at)"
              + " values (?, ?, ?, ?, ?, ?, ?, ?, ?)",
          UUID.randomUUID(),
          "ghost",
          1L,
          "SeatsChanged",
          1,
          "{\"toSeats\":3}",
          "system",
          "replay-job",
          OffsetDateTime.of(2024, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC));

      final ProjectionResult result = engine.projector().catchUp();

      assertEquals(List.of("ghost"), result.failedAggregates());
      assertEquals(1, result.eventsProcessed());
      assertTrue(engine.readModelStore().find("cp-1").isPresent());
      assertEquals(1, engine.projector().lag().aggregatesBehind());
    }

    @Test
    void exhausted_time_budget_must_stop_early_and_leave_the_rest_for_later() {
      seedThreeDeals();
      final ProjectorEngine hurried =
          new ProjectorEngine(
              engine.eventStore(),
              engine.readModelStore(),
              LifecycleConfigs.load(Map.of("lifecycle.projector.time-budget", "PT0S")).projector(),
              new TestClock(TestClock.START, Duration.ofSeconds(1)));

      final ProjectionResult hurriedResult = hurried.catchUp();
      assertFalse(hurriedResult.completed());
      assertEquals(0, hurriedResult.eventsProcessed());
      assertEquals(new ProjectionLag(3, 6), engine.projector().lag());

      assertTrue(engine.projector().catchUp().completed());
      assertTrue(engine.projector().lag().isCaughtUp());
    }
  }

  @Nested
  class Rebuild {
    @Test
    void full_rebuild_must_match_incremental_projection() {
      seedThreeDeals();
      engine.projector().catchUp();
      final List<CompanyProductState> incremental = rows();

      final ProjectionResult rebuilt = engine.projector().rebuildAll();

      assertTrue(rebuilt.completed());
      assertEquals(6, rebuilt.eventsProcessed());
      assertEquals(incremental, rows());
    }

    @Test
    void full_rebuild_must_page_through_the_log() {
      seedThreeDeals();
      engine.projector().catchUp();
      final List<CompanyProductState> incremental = rows();

      final LifecycleEngine paged = engine(Map.of("lifecycle.projector.batch-size", "1"));
      paged.projector().rebuildAll();

      assertEquals(incremental, rows());
    }

    @Test
    void rebuilding_one_aggregate_must_restore_its_row() {
      seedThreeDeals();
      engine.projector().catchUp();
      final CompanyProductState before = engine.readModelStore().find("cp-3").orElseThrow();

      engine.readModelStore().delete(List.of("cp-3"));
      assertEquals(1, engine.projector().lag().aggregatesBehind());

      final ProjectionResult result = engine.projector().rebuild(List.of("cp-3"));
      assertEquals(2, result.eventsProcessed());
      assertEquals(before, engine.readModelStore().find("cp-3").orElseThrow());
    }

    @Test
    void won_sale_with_active_policy_must_project_and_rebuild_identically() {
      engine = engine(Map.of("lifecycle.policy.sales-won-phase", "active"));
      startSale(CP1);
      advance(CP1, "S2");
      clock.advance(Duration.ofDays(3));
      accepted(
          engine
              .context()
              .execute(
                  new LifecycleCommand.CompleteProcess(
                      CP1, ACTOR, null, "S_WON", TerminalOutcome.WON, "signed")));

      engine.projector().catchUp();
      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(LifecyclePhase.ACTIVE, row.phase());
      assertEquals(ProcessStatus.COMPLETED, row.status());
      assertEquals(TerminalOutcome.WON, row.terminalOutcome());
      assertEquals("S_WON", row.currentStageId());
      assertEquals(clock.instant(), row.processCompletedAt());

      engine.projector().rebuildAll();
      assertEquals(row, engine.readModelStore().find("cp-1").orElseThrow());
    }
  }

  @Nested
  class Watermark {
    @Test
    void save_must_refuse_rows_folded_from_a_stale_watermark() {
      startSale(CP1);
      setMrr(CP1, "100");
      engine.projector().catchUp();
      final CompanyProductState current = engine.readModelStore().find("cp-1").orElseThrow();

      final CompanyProductState replayedAgain =
          current.toBuilder().mrr(new BigDecimal("1.00"), "USD").build();
      assertFalse(engine.readModelStore().save(replayedAgain, 1));
      assertFalse(engine.readModelStore().save(replayedAgain, 0));
      assertEquals(current, engine.readModelStore().find("cp-1").orElseThrow());
    }

    @Test
    void overlapping_and_redelivered_batches_must_leave_the_same_rows_and_facts() {
      seedThreeDeals();
      advance(CP1, "S3");
      engine.projector().catchUp();
      final List<CompanyProductState> projected = rows();
      final Map<String, List<StageFact>> projectedFacts = allFacts();

      // cp-1 goes back to its second event, cp-2 is dropped entirely
      final List<StoredEvent> cp1Events = engine.eventStore().readEvents("cp-1", 1);
      CompanyProductState prefix = CompanyProductState.initial(CP1);
      final List<StageFactChange> prefixFacts = new ArrayList<>();
      for (StoredEvent event : cp1Events.subList(0, 2)) {
        final CompanyProductState next = LifecycleFold.apply(prefix, event);
        prefixFacts.addAll(StageFacts.changes(prefix, event, next));
        prefix = next;
      }
      engine.readModelStore().delete(List.of("cp-1", "cp-2"));
      assertTrue(engine.readModelStore().save(prefix, 0, prefixFacts));
      assertEquals(2, engine.projector().lag().aggregatesBehind());

      // the same batch delivered again, overlapping with current rows
      assertFalse(engine.readModelStore().save(prefix, 0, prefixFacts));
      engine.projector().catchUp(List.of("cp-1", "cp-2", "cp-3"));
      engine.projector().catchUp(List.of("cp-3", "cp-2", "cp-1"));
      engine.projector().catchUp();

      assertEquals(projected, rows());
      assertEquals(projectedFacts, allFacts());
      assertTrue(engine.projector().lag().isCaughtUp());
    }

    @Test
    void lag_must_count_unprojected_events() {
      seedThreeDeals();
      assertEquals(new ProjectionLag(3, 6), engine.projector().lag());

      engine.projector().catchUp(List.of("cp-1"));
      assertEquals(new ProjectionLag(2, 4), engine.projector().lag());
    }
  }

  @Nested
  class Summary {
    @Test
    void stage_summary_must_count_open_processes_and_sum_their_mrr() {
      seedThreeDeals();
      engine.projector().catchUp();

      final List<StageSummaryRow> summary =
          engine
              .context()
              .queryMany(new LifecycleQueries.StageSummary(ACTOR, ProcessType.SALES));

      assertEquals(2, summary.size());
      final StageSummaryRow s1 = summary.get(0);
      assertEquals("S1", s1.stageId());
      assertEquals(2, s1.aggregateCount());
      assertEquals(0, new BigDecimal("750").compareTo(s1.totalMrr()));
      final StageSummaryRow s2 = summary.get(1);
      assertEquals("S2", s2.stageId());
      assertEquals(1, s2.aggregateCount());
      assertEquals(0, BigDecimal.ZERO.compareTo(s2.totalMrr()));

      assertTrue(
          engine
              .context()
              .queryMany(new LifecycleQueries.StageSummary(ACTOR, ProcessType.ONBOARDING))
              .isEmpty());
    }

    @Test
    void phase_overrides_must_drop_processes_from_the_summary() {
      seedThreeDeals();
      execute(
          new LifecycleCommand.SetPhase(
              CP1, ACTOR, LifecyclePhase.CHURNED, "went dark", "no budget"));
      execute(
          new LifecycleCommand.SetPhase(CP2, ACTOR, LifecyclePhase.PROSPECT, "too early", null));
      engine.projector().catchUp();

      final CompanyProductState churned = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(ProcessStatus.IN_PROGRESS, churned.status());

      final List<StageSummaryRow> summary =
          engine.context().queryMany(new LifecycleQueries.StageSummary(ACTOR, null));
      assertEquals(1, summary.size());
      assertEquals("S2", summary.get(0).stageId());
      assertEquals(1, summary.get(0).aggregateCount());
    }
  }

  @Nested
  class Facts {
    @Test
    void stage_moves_must_close_facts_with_their_durations() {
      // 2024-03-01 is a Friday
      startSale(CP1);
      clock.advance(Duration.ofDays(3));
      advance(CP1, "S2");
      clock.advance(Duration.ofDays(1));
      advance(CP1, "S1");
      clock.advance(Duration.ofDays(2));
      execute(
          new LifecycleCommand.CompleteProcess(
              CP1, ACTOR, null, "S_WON", TerminalOutcome.WON, null));
      engine.projector().catchUp();

      final List<StageFact> facts = facts(CP1);
      assertEquals(3, facts.size());
      assertTrue(facts.stream().noneMatch(StageFact::isOpen));

      final StageFact discovery = facts.get(0);
      assertEquals("S1", discovery.stageId());
      assertEquals(1, discovery.entrySequenceNo());
      assertEquals(2L, discovery.exitSequenceNo());
      assertEquals(Duration.ofDays(3).getSeconds(), discovery.durationSeconds());
      assertEquals(1, discovery.durationBusinessDays());
      assertEquals(StageExitReason.PROGRESSED, discovery.exitReason());

      final StageFact demo = facts.get(1);
      assertEquals("S2", demo.stageId());
      assertEquals(1, demo.durationBusinessDays());
      assertEquals(StageExitReason.REGRESSED, demo.exitReason());

      final StageFact backToDiscovery = facts.get(2);
      assertEquals("S1", backToDiscovery.stageId());
      assertEquals(2, backToDiscovery.durationBusinessDays());
      assertEquals(StageExitReason.COMPLETED, backToDiscovery.exitReason());
    }

    @Test
    void started_process_after_a_plain_win_must_open_a_fact_and_show_in_the_summary() {
      startSale(CP1);
      execute(
          new LifecycleCommand.CompleteProcess(
              CP1, ACTOR, null, "S_WON", TerminalOutcome.WON, "signed"));
      execute(new LifecycleCommand.StartProcess(CP1, ACTOR, "O1", null));
      engine.projector().catchUp();

      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(LifecyclePhase.ONBOARDING, row.phase());
      assertEquals("O_KICKOFF", row.currentStageId());

      final List<StageFact> facts = facts(CP1);
      assertEquals(2, facts.size());
      assertEquals(StageExitReason.COMPLETED, facts.get(0).exitReason());
      assertTrue(facts.get(1).isOpen());
      assertEquals("O_KICKOFF", facts.get(1).stageId());
      assertEquals(ProcessType.ONBOARDING, facts.get(1).processType());

      final List<StageSummaryRow> onboarding =
          engine
              .context()
              .queryMany(new LifecycleQueries.StageSummary(ACTOR, ProcessType.ONBOARDING));
      assertEquals(1, onboarding.size());
      assertEquals("O_KICKOFF", onboarding.get(0).stageId());
    }

    @Test
    void phase_override_must_cancel_the_open_fact() {
      startSale(CP1);
      execute(
          new LifecycleCommand.SetPhase(
              CP1, ACTOR, LifecyclePhase.CHURNED, "went dark", "no budget"));
      engine.projector().catchUp();

      final List<StageFact> facts = facts(CP1);
      assertEquals(1, facts.size());
      assertEquals(StageExitReason.CANCELLED, facts.get(0).exitReason());
    }

    @Test
    void rebuilds_must_reproduce_the_facts_of_incremental_projection() {
      seedThreeDeals();
      advance(CP3, "S3");
      advance(CP3, "S1");
      execute(new LifecycleCommand.CompleteSaleAndStartOnboarding(CP2, ACTOR, null, "signed"));
      engine.projector().catchUp();
      final Map<String, List<StageFact>> incremental = allFacts();
      assertEquals(4, incremental.get("cp-3").size());
      assertEquals(2, incremental.get("cp-2").size());

      engine.projector().rebuildAll();
      assertEquals(incremental, allFacts());

      engine(Map.of("lifecycle.projector.batch-size", "2")).projector().rebuildAll();
      assertEquals(incremental, allFacts());

      engine.projector().rebuild(List.of("cp-3"));
      assertEquals(incremental, allFacts());
    }
  }
}
