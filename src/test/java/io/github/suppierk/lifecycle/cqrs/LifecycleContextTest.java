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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.command.DefaultHandlers;
import io.github.suppierk.lifecycle.command.SetTierHandler;
import io.github.suppierk.lifecycle.config.LifecycleConfigs;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.domain.LifecycleFold;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import io.github.suppierk.lifecycle.domain.TerminalOutcome;
import io.github.suppierk.lifecycle.jooq.DslContextProvider;
import io.github.suppierk.lifecycle.query.LifecycleQueries;
import io.github.suppierk.lifecycle.store.EventPayloadCodec;
import io.github.suppierk.lifecycle.store.EventStore;
import io.github.suppierk.lifecycle.store.JooqEventStore;
import io.github.suppierk.lifecycle.store.PendingEvent;
import io.github.suppierk.lifecycle.store.StoredEvent;
import io.github.suppierk.lifecycle.test.TestCatalog;
import io.github.suppierk.lifecycle.test.TestClock;
import io.github.suppierk.lifecycle.test.TestDatabase;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LifecycleContextTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.dsl("context");
  static final DslContextProvider DSL_CONTEXT_PROVIDER =
      DslContextProvider.dslContextIdentity(DSL_CONTEXT);
  static final AggregateRef REF = new AggregateRef("cp-1", "acme", TestCatalog.PRODUCT);
  static final Actor USER = Actor.user("u-1");
  static final Actor AI = Actor.ai("enricher");

  final TestClock clock = new TestClock();
  final LifecycleStateMachine stateMachine =
      new LifecycleStateMachine(TestCatalog.catalog(), LifecycleConfigs.load().policy());
  final InterleavingEventStore eventStore =
      new InterleavingEventStore(
          new JooqEventStore(DSL_CONTEXT, new EventPayloadCodec(), clock));

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll(DSL_CONTEXT);
  }

  LifecycleContext context(int retries) {
    final LifecycleContext context =
        new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, retries, clock);
    DefaultHandlers.all(stateMachine).forEach(context::addCommandHandler);
    return context;
  }

  CompanyProductState replay() {
    return LifecycleFold.replay(REF, eventStore.readEvents(REF.aggregateId(), 1));
  }

  static LifecycleCommand startSale(Actor actor) {
    return new LifecycleCommand.StartSale(REF, actor, "P1", "S1");
  }

  static LifecycleCommand setMrr(String mrr) {
    return new LifecycleCommand.SetMrr(REF, USER, new BigDecimal(mrr), null, null);
  }

  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_invalid_throw_illegal_argument_exception() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new LifecycleContext(null, DSL_CONTEXT_PROVIDER, 0, clock));
      assertThrows(
          IllegalArgumentException.class, () -> new LifecycleContext(eventStore, null, 0, clock));
      assertThrows(
          IllegalArgumentException.class,
          () -> new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, 0, null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, -1, clock));
      assertDoesNotThrow(() -> new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, 0, clock));
    }

    @Test
    void when_adding_null_or_duplicate_handlers_registration_must_fail() {
      final LifecycleContext context =
          new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, 0, clock);

      assertThrows(IllegalArgumentException.class, () -> context.addCommandHandler(null));
      assertThrows(IllegalArgumentException.class, () -> context.addQueryHandler(null));
      assertTrue(context.getSupportedCommandClasses().isEmpty());

      context.addCommandHandler(new SetTierHandler(stateMachine));
      assertTrue(context.getSupportedCommandClasses().contains(LifecycleCommand.SetTier.class));
      assertFalse(context.isAnyWriteLockHeld());
      assertThrows(
          IllegalStateException.class,
          () -> context.addCommandHandler(new SetTierHandler(stateMachine)));
    }

    @Test
    void unregistered_commands_and_queries_must_be_unsupported() {
      final LifecycleContext context =
          new LifecycleContext(eventStore, DSL_CONTEXT_PROVIDER, 0, clock);

      assertThrows(UnsupportedOperationException.class, () -> context.execute(startSale(USER)));
      assertThrows(
          UnsupportedOperationException.class,
          () -> context.queryOne(new LifecycleQueries.FindCompanyProduct(USER, "cp-1")));
      assertThrows(IllegalArgumentException.class, () -> context.execute(null));
    }
  }

  @Nested
  class Execute {
    @Test
    void start_sale_must_create_the_aggregate() {
      final CommandResult result = context(0).execute(startSale(USER));

      assertTrue(result.success());
      assertEquals(CommandAction.START_SALE, result.action());
      assertEquals(1, result.steps().size());
      assertEquals(LifecycleEventType.SALE_STARTED, result.steps().get(0).eventType());
      assertEquals(1, result.steps().get(0).sequenceNo());
      assertEquals(LifecyclePhase.IN_SALES, replay().phase());
    }

    @Test
    void other_commands_against_a_missing_aggregate_must_be_not_found() {
      final CommandResult result =
          context(0).execute(new LifecycleCommand.AdvanceStage(REF, USER, "S2", null));

      assertFalse(result.success());
      assertEquals("NOT_FOUND", result.errorCode());
      assertEquals(404, result.statusCode());
      assertTrue(eventStore.findAggregate(REF.aggregateId()).isEmpty());
    }

    @Test
    void malformed_commands_must_be_validation_errors() {
      final LifecycleContext context = context(0);

      final CommandResult missingProcess =
          context.execute(new LifecycleCommand.StartSale(REF, USER, " ", "S1"));
      assertEquals("VALIDATION_ERROR", missingProcess.errorCode());
      assertEquals(400, missingProcess.statusCode());

      final CommandResult missingCompany =
          context.execute(
              new LifecycleCommand.StartSale(
                  new AggregateRef("cp-1", null, TestCatalog.PRODUCT), USER, "P1", "S1"));
      assertEquals("VALIDATION_ERROR", missingCompany.errorCode());

      final CommandResult churnWithoutReason =
          context.execute(
              new LifecycleCommand.SetPhase(REF, USER, LifecyclePhase.CHURNED, "lost", null));
      assertEquals("VALIDATION_ERROR", churnWithoutReason.errorCode());
    }

    @Test
    void aggregate_id_reused_for_another_pair_must_be_rejected() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));

      final CommandResult result =
          context.execute(
              new LifecycleCommand.SetTier(
                  new AggregateRef("cp-1", "other", TestCatalog.PRODUCT), USER, 2, null));

      assertEquals("VALIDATION_ERROR", result.errorCode());
    }

    @Test
    void ai_actors_may_set_attributes_but_not_move_the_lifecycle() {
      final LifecycleContext context = context(0);

      final CommandResult start = context.execute(startSale(AI));
      assertFalse(start.success());
      assertEquals("UNAUTHORIZED", start.errorCode());
      assertEquals(403, start.statusCode());

      context.execute(startSale(USER));
      assertTrue(
          context.execute(new LifecycleCommand.SetCloseConfidence(REF, AI, 80)).success());
      assertEquals(
          "UNAUTHORIZED",
          context
              .execute(
                  new LifecycleCommand.SetPhase(REF, AI, LifecyclePhase.PROSPECT, "stale", null))
              .errorCode());
      assertEquals(
          "UNAUTHORIZED",
          context
              .execute(new LifecycleCommand.CompleteSaleAndStartOnboarding(REF, AI, null, null))
              .errorCode());
      assertEquals(2, eventStore.lastSequence(REF.aggregateId()));
    }

    @Test
    void repeating_a_command_must_be_an_accepted_no_op() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));

      final CommandResult first =
          context.execute(new LifecycleCommand.SetTier(REF, USER, 3, "upsell"));
      final CommandResult second =
          context.execute(new LifecycleCommand.SetTier(REF, USER, 3, "upsell"));

      assertFalse(first.isNoOp());
      assertTrue(second.success());
      assertTrue(second.isNoOp());
      assertTrue(second.eventIds().isEmpty());
      assertEquals(2, eventStore.lastSequence(REF.aggregateId()));
    }

    @Test
    void compound_command_must_report_one_step_per_event() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));

      final CommandResult result =
          context.execute(
              new LifecycleCommand.CompleteSaleAndStartOnboarding(REF, USER, null, "signed"));

      assertTrue(result.success());
      assertEquals(
          List.of(LifecycleEventType.PROCESS_COMPLETED, LifecycleEventType.PROCESS_STARTED),
          result.steps().stream().map(CommandResult.Step::eventType).toList());
      assertEquals(
          List.of(2L, 3L), result.steps().stream().map(CommandResult.Step::sequenceNo).toList());
      assertEquals(LifecyclePhase.ONBOARDING, replay().phase());
    }

    @Test
    void compound_command_without_next_process_must_append_nothing() {
      final AggregateRef ref =
          new AggregateRef("cp-2", "acme", TestCatalog.PRODUCT_WITHOUT_ONBOARDING);
      final LifecycleContext context = context(0);
      context.execute(new LifecycleCommand.StartSale(ref, USER, "Q1", "Q_START"));

      final CommandResult result =
          context.execute(
              new LifecycleCommand.CompleteSaleAndStartOnboarding(ref, USER, null, null));

      assertEquals("NOT_FOUND", result.errorCode());
      assertEquals(1, eventStore.lastSequence(ref.aggregateId()));
    }
  }

  @Nested
  class Limits {
    void assertRejected(LifecycleContext context, LifecycleCommand command) {
      final CommandResult result = context.execute(command);
      assertEquals("VALIDATION_ERROR", result.errorCode(), result.error());
      assertEquals(400, result.statusCode());
      assertEquals(1, eventStore.lastSequence(REF.aggregateId()));
    }

    @Test
    void identifiers_longer_than_their_columns_must_be_validation_errors() {
      final LifecycleContext context = context(0);
      final String longId = "x".repeat(65);

      for (AggregateRef ref :
          List.of(
              new AggregateRef(longId, "acme", TestCatalog.PRODUCT),
              new AggregateRef("cp-1", longId, TestCatalog.PRODUCT),
              new AggregateRef("cp-1", "acme", longId))) {
        final CommandResult result =
            context.execute(new LifecycleCommand.StartSale(ref, USER, "P1", "S1"));
        assertEquals("VALIDATION_ERROR", result.errorCode(), result.error());
      }

      final CommandResult longActor =
          context.execute(startSale(Actor.user("u".repeat(129))));
      assertEquals("VALIDATION_ERROR", longActor.errorCode());
      assertTrue(eventStore.aggregateHeads().isEmpty());

      assertTrue(context.execute(startSale(Actor.user("u".repeat(128)))).success());
    }

    @Test
    void text_longer_than_its_column_must_be_validation_errors() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));
      final String tooLong = "t".repeat(1001);

      assertRejected(
          context,
          new LifecycleCommand.SetNextStepDue(REF, USER, tooLong, clock.instant()));
      assertRejected(
          context,
          new LifecycleCommand.SetOwner(REF, USER, "o".repeat(129), "Jane", null));
      assertRejected(
          context,
          new LifecycleCommand.SetOwner(REF, USER, "o-1", "n".repeat(256), null));
      assertRejected(
          context,
          new LifecycleCommand.SetPhase(REF, USER, LifecyclePhase.CHURNED, "gone", tooLong));
      assertRejected(
          context,
          new LifecycleCommand.CompleteProcess(
              REF, USER, null, "S_LOST", TerminalOutcome.LOST, tooLong));
      assertRejected(context, new LifecycleCommand.AdvanceStage(REF, USER, "S2", tooLong));
      assertRejected(context, setMrr("1000000000000"));
    }

    @Test
    void values_at_their_column_limits_must_be_accepted() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));

      assertTrue(
          context
              .execute(
                  new LifecycleCommand.SetNextStepDue(
                      REF, USER, "  " + "t".repeat(1000) + "  ", clock.instant()))
              .success());
      assertTrue(
          context
              .execute(
                  new LifecycleCommand.SetOwner(
                      REF, USER, "o".repeat(128), "n".repeat(255), null))
              .success());
      assertTrue(context.execute(setMrr("999999999999.99")).success());
      assertEquals(4, eventStore.lastSequence(REF.aggregateId()));
    }
  }

  @Nested
  class Products {
    final AggregateRef otherProduct =
        new AggregateRef("cp-2", "acme", TestCatalog.PRODUCT_WITHOUT_ONBOARDING);

    @Test
    void process_of_another_product_must_violate_invariants() {
      final CommandResult result =
          context(0).execute(new LifecycleCommand.StartSale(otherProduct, USER, "P1", "S1"));

      assertEquals("INVARIANT_VIOLATION", result.errorCode());
      assertTrue(eventStore.findAggregate(otherProduct.aggregateId()).isEmpty());
    }

    @Test
    void plain_win_must_be_resumable_with_start_process() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));
      assertTrue(
          context
              .execute(
                  new LifecycleCommand.CompleteProcess(
                      REF, USER, null, "S_WON", TerminalOutcome.WON, null))
              .success());
      assertFalse(replay().hasActiveProcess());

      final CommandResult started =
          context.execute(new LifecycleCommand.StartProcess(REF, USER, "O1", null));
      assertTrue(started.success());
      assertEquals(CommandAction.START_PROCESS, started.action());
      assertTrue(
          context
              .execute(new LifecycleCommand.AdvanceStage(REF, USER, "O_CONFIG", null))
              .success());
      assertEquals("O_CONFIG", replay().currentStageId());

      assertEquals(
          "UNAUTHORIZED",
          context.execute(new LifecycleCommand.StartProcess(REF, AI, "O1", null)).errorCode());
      assertEquals(
          "NOT_FOUND",
          context
              .execute(
                  new LifecycleCommand.StartProcess(
                      new AggregateRef("cp-9", "acme", TestCatalog.PRODUCT), USER, "O1", null))
              .errorCode());
    }
  }

  @Nested
  class Concurrency {
    @Test
    void losing_the_race_without_retries_must_surface_the_conflict() {
      final LifecycleContext context = context(0);
      context.execute(startSale(USER));
      eventStore.beforeNextAppend(() -> assertTrue(context.execute(setMrr("500")).success()));

      final CommandResult result = context.execute(setMrr("750"));

      assertFalse(result.success());
      assertEquals("CONCURRENCY_CONFLICT", result.errorCode());
      assertEquals(409, result.statusCode());
      assertEquals(0, new BigDecimal("500").compareTo(replay().mrr()));
    }

    @Test
    void losing_the_race_with_retries_must_reload_and_apply_on_top() {
      final LifecycleContext context = context(3);
      context.execute(startSale(USER));
      eventStore.beforeNextAppend(() -> assertTrue(context.execute(setMrr("500")).success()));

      final CommandResult result = context.execute(setMrr("750"));

      assertTrue(result.success());
      assertEquals(3, result.steps().get(0).sequenceNo());
      assertEquals(0, new BigDecimal("750").compareTo(replay().mrr()));
    }
  }

  /** Runs another command right before the next append reaches the database. */
  static final class InterleavingEventStore implements EventStore {
    private final EventStore delegate;
    private Runnable beforeNextAppend;

    InterleavingEventStore(EventStore delegate) {
      this.delegate = delegate;
    }

    void beforeNextAppend(Runnable interleaved) {
      this.beforeNextAppend = interleaved;
    }

    @Override
    public List<StoredEvent> append(
        AggregateRef ref, List<PendingEvent> events, long expectedLastSequence) {
      final Runnable interleaved = beforeNextAppend;
      beforeNextAppend = null;
      if (interleaved != null) {
        interleaved.run();
      }
      return delegate.append(ref, events, expectedLastSequence);
    }

    @Override
    public List<StoredEvent> readEvents(String aggregateId, long fromSequence) {
      return delegate.readEvents(aggregateId, fromSequence);
    }

    @Override
    public List<StoredEvent> readAllSince(long globalCursor, int limit) {
      return delegate.readAllSince(globalCursor, limit);
    }

    @Override
    public long lastSequence(String aggregateId) {
      return delegate.lastSequence(aggregateId);
    }

    @Override
    public Map<String, Long> aggregateHeads() {
      return delegate.aggregateHeads();
    }

    @Override
    public Optional<AggregateRef> findAggregate(String aggregateId) {
      return delegate.findAggregate(aggregateId);
    }

    @Override
    public Optional<AggregateRef> findAggregate(String companyId, String productId) {
      return delegate.findAggregate(companyId, productId);
    }
  }
}
