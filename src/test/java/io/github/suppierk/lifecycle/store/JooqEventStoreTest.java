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

package io.github.suppierk.lifecycle.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.authorization.ActorType;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.errors.ConcurrencyConflictException;
import io.github.suppierk.lifecycle.errors.ValidationException;
import io.github.suppierk.lifecycle.test.TestClock;
import io.github.suppierk.lifecycle.test.TestDatabase;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jooq.DSLContext;
import org.jooq.ExecuteContext;
import org.jooq.ExecuteListener;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.DefaultExecuteListenerProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventStoreTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.dsl("event-store");
  static final AggregateRef REF = new AggregateRef("cp-1", "acme", "prod-1");
  static final Actor ACTOR = Actor.user("u-1");

  final TestClock clock = new TestClock();
  final JooqEventStore store = new JooqEventStore(DSL_CONTEXT, new EventPayloadCodec(), clock);

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll(DSL_CONTEXT);
  }

  static PendingEvent seats(int seats) {
    return new PendingEvent(new LifecycleEvent.SeatsChanged(null, seats, null), ACTOR);
  }

  @Nested
  class Append {
    @Test
    void events_must_get_consecutive_sequence_numbers_and_keep_actor_and_payload() {
      final List<StoredEvent> first = store.append(REF, List.of(seats(1), seats(2)), 0);
      final List<StoredEvent> second =
          store.append(
              REF,
              List.of(
                  new PendingEvent(new LifecycleEvent.TierChanged(null, 3, null), Actor.ai("a-1"))),
              2);

      assertEquals(List.of(1L, 2L), first.stream().map(StoredEvent::sequenceNo).toList());
      assertEquals(3, second.get(0).sequenceNo());
      assertTrue(second.get(0).globalSequence() > first.get(1).globalSequence());
      assertEquals(ActorType.AI, second.get(0).actor().type());
      assertEquals(LifecycleEventType.TIER_CHANGED, second.get(0).eventType());
      assertEquals(new LifecycleEvent.TierChanged(null, 3, null), second.get(0).payload());
      assertEquals(TestClock.START, second.get(0).occurredAt());
      assertEquals(3, store.lastSequence(REF.aggregateId()));
    }

    @Test
    void stale_expected_sequence_must_conflict() {
      store.append(REF, List.of(seats(1)), 0);

      final ConcurrencyConflictException conflict =
          assertThrows(
              ConcurrencyConflictException.class,
              () -> store.append(REF, List.of(seats(2)), 0));
      assertEquals(REF.aggregateId(), conflict.getAggregateId());
      assertEquals(409, conflict.getStatusCode());

      assertThrows(
          ConcurrencyConflictException.class, () -> store.append(REF, List.of(seats(2)), 5));
      assertEquals(1, store.lastSequence(REF.aggregateId()));
    }

    @Test
    void second_aggregate_for_the_same_pair_must_be_rejected() {
      store.append(REF, List.of(seats(1)), 0);

      assertThrows(
          ValidationException.class,
          () -> store.append(new AggregateRef("cp-2", "acme", "prod-1"), List.of(seats(1)), 0));
      assertThrows(
          ValidationException.class,
          () -> store.append(new AggregateRef("cp-1", "other", "prod-1"), List.of(seats(2)), 1));
    }

    @Test
    void empty_batches_are_programming_errors() {
      assertThrows(IllegalArgumentException.class, () -> store.append(REF, List.of(), 0));
      assertThrows(IllegalArgumentException.class, () -> store.append(REF, null, 0));
    }

    @Test
    void racing_appends_must_let_exactly_one_writer_win() throws Exception {
      store.append(REF, List.of(seats(1)), 0);

      final int writers = 4;
      final CountDownLatch start = new CountDownLatch(1);
      final ExecutorService executor = Executors.newFixedThreadPool(writers);
      final List<Future<List<StoredEvent>>> results = new ArrayList<>();
      try {
        for (int i = 0; i < writers; i++) {
          final int seats = 10 + i;
          final Callable<List<StoredEvent>> append =
              () -> {
                start.await();
                return store.append(REF, List.of(seats(seats)), 1);
              };
          results.add(executor.submit(append));
        }
        start.countDown();

        int wins = 0;
        int conflicts = 0;
        for (Future<List<StoredEvent>> result : results) {
          try {
            result.get(30, TimeUnit.SECONDS);
            wins++;
          } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof ConcurrencyConflictException, e.toString());
            conflicts++;
          }
        }

        assertEquals(1, wins);
        assertEquals(writers - 1, conflicts);
        assertEquals(2, store.lastSequence(REF.aggregateId()));
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    void batch_failing_half_way_must_leave_nothing_behind() {
      final AtomicInteger eventInserts = new AtomicInteger();
      final ExecuteListener failOnSecondEvent =
          new ExecuteListener() {
            @Override
            public void executeStart(ExecuteContext ctx) {
              if (ctx.sql() != null
                  && ctx.sql().startsWith("insert into \"lifecycle_events\"")
                  && eventInserts.incrementAndGet() == 2) {
                throw new DataAccessException("Injected failure");
              }
            }
          };
      final JooqEventStore failing =
          new JooqEventStore(
              DSL.using(
                  DSL_CONTEXT
                      .configuration()
                      .derive(new DefaultExecuteListenerProvider(failOnSecondEvent))),
              new EventPayloadCodec(),
              clock);

      assertThrows(
          DataAccessException.class, () -> failing.append(REF, List.of(seats(1), seats(2)), 0));

      assertEquals(0, store.lastSequence(REF.aggregateId()));
      assertTrue(store.findAggregate(REF.aggregateId()).isEmpty());
    }
  }

  @Nested
  class Read {
    @Test
    void reads_must_follow_sequence_and_global_order() {
      final AggregateRef other = new AggregateRef("cp-2", "globex", "prod-1");
      store.append(REF, List.of(seats(1), seats(2)), 0);
      store.append(other, List.of(seats(5)), 0);
      store.append(REF, List.of(seats(3)), 2);

      assertEquals(
          List.of(2L, 3L),
          store.readEvents(REF.aggregateId(), 2).stream().map(StoredEvent::sequenceNo).toList());

      final List<StoredEvent> firstPage = store.readAllSince(0, 2);
      assertEquals(2, firstPage.size());
      final List<StoredEvent> rest = store.readAllSince(firstPage.get(1).globalSequence(), 10);
      assertEquals(
          List.of("cp-2", "cp-1"), rest.stream().map(StoredEvent::aggregateId).toList());

      assertEquals(Map.of("cp-1", 3L, "cp-2", 1L), store.aggregateHeads());
      assertEquals(other, store.findAggregate("globex", "prod-1").orElseThrow());
      assertEquals(REF, store.findAggregate("cp-1").orElseThrow());
      assertEquals(0, store.lastSequence("missing"));
    }
  }
}
