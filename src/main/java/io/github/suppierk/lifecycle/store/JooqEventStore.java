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

import static io.github.suppierk.lifecycle.jooq.JooqTimestamps.toInstant;
import static io.github.suppierk.lifecycle.jooq.JooqTimestamps.toOffsetDateTime;
import static io.github.suppierk.lifecycle.store.EventStoreTables.ACTOR_ID;
import static io.github.suppierk.lifecycle.store.EventStoreTables.ACTOR_TYPE;
import static io.github.suppierk.lifecycle.store.EventStoreTables.AGGREGATES;
import static io.github.suppierk.lifecycle.store.EventStoreTables.AGGREGATE_ID;
import static io.github.suppierk.lifecycle.store.EventStoreTables.COMPANY_ID;
import static io.github.suppierk.lifecycle.store.EventStoreTables.CREATED_AT;
import static io.github.suppierk.lifecycle.store.EventStoreTables.EVENTS;
import static io.github.suppierk.lifecycle.store.EventStoreTables.EVENT_ID;
import static io.github.suppierk.lifecycle.store.EventStoreTables.EVENT_TYPE;
import static io.github.suppierk.lifecycle.store.EventStoreTables.EVENT_VERSION;
import static io.github.suppierk.lifecycle.store.EventStoreTables.GLOBAL_SEQUENCE;
import static io.github.suppierk.lifecycle.store.EventStoreTables.OCCURRED_AT;
import static io.github.suppierk.lifecycle.store.EventStoreTables.PAYLOAD;
import static io.github.suppierk.lifecycle.store.EventStoreTables.PRODUCT_ID;
import static io.github.suppierk.lifecycle.store.EventStoreTables.SEQUENCE_NO;

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.authorization.ActorType;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.errors.ConcurrencyConflictException;
import io.github.suppierk.lifecycle.errors.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SelectSelectStep;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} over two tables: {@code lifecycle_aggregates} registers the identity of each
 * aggregate, {@code lifecycle_events} holds the log itself.
 *
 * <p>Every append runs in its own transaction: the head check and all inserts either commit
 * together or not at all. The unique key on {@code (aggregate_id, sequence_no)} is the last line
 * of defence when two writers pass the head check at the same time.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  /** Unique violation, serialization failure and H2's concurrent update. */
  private static final Set<String> RACE_SQL_STATES = Set.of("23505", "40001", "90131");

  private static final Field<Long> HEAD = DSL.max(SEQUENCE_NO).as("head");

  private static final List<Field<?>> EVENT_COLUMNS =
      List.of(
          GLOBAL_SEQUENCE,
          EVENT_ID,
          AGGREGATE_ID,
          SEQUENCE_NO,
          EVENT_TYPE,
          EVENT_VERSION,
          PAYLOAD,
          ACTOR_TYPE,
          ACTOR_ID,
          OCCURRED_AT);

  private final DSLContext dsl;
  private final EventPayloadCodec codec;
  private final Clock clock;

  public JooqEventStore(final DSLContext dsl) {
    this(dsl, new EventPayloadCodec(), Clock.systemUTC());
  }

  public JooqEventStore(final DSLContext dsl, final EventPayloadCodec codec, final Clock clock) {
    if (dsl == null || codec == null || clock == null) {
      throw new IllegalArgumentException("DSLContext, codec and clock cannot be null");
    }

    this.dsl = dsl;
    this.codec = codec;
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> append(
      final AggregateRef ref, final List<PendingEvent> events, final long expectedLastSequence) {
    if (ref == null) {
      throw new IllegalArgumentException("Aggregate reference cannot be null");
    }
    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("Events to append cannot be empty");
    }
    if (expectedLastSequence < 0) {
      throw new IllegalArgumentException("Expected last sequence cannot be negative");
    }

    try {
      final List<StoredEvent> stored =
          dsl.transactionResult(
              (final Configuration trx) ->
                  appendInTransaction(trx.dsl(), ref, events, expectedLastSequence));

      LOG.debug(
          "Appended {} event(s) to aggregate '{}' after sequence {}",
          stored.size(),
          ref.aggregateId(),
          expectedLastSequence);
      return stored;
    } catch (DataAccessException e) {
      if (e.sqlState() != null && RACE_SQL_STATES.contains(e.sqlState())) {
        throw new ConcurrencyConflictException(
            ref.aggregateId(),
            expectedLastSequence,
            "concurrent append was rejected by the database",
            e);
      }

      throw e;
    }
  }

  private List<StoredEvent> appendInTransaction(
      final DSLContext trx,
      final AggregateRef ref,
      final List<PendingEvent> events,
      final long expectedLastSequence) {
    if (expectedLastSequence == 0) {
      registerAggregate(trx, ref);
    } else {
      verifyIdentity(trx, ref);
    }

    final long head = lastSequence(trx, ref.aggregateId());
    if (head != expectedLastSequence) {
      throw new ConcurrencyConflictException(
          ref.aggregateId(), expectedLastSequence, "last sequence is %d".formatted(head));
    }

    final Instant occurredAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
    long sequenceNo = expectedLastSequence;
    for (PendingEvent event : events) {
      sequenceNo++;
      trx.insertInto(EVENTS)
          .set(EVENT_ID, UUID.randomUUID())
          .set(AGGREGATE_ID, ref.aggregateId())
          .set(SEQUENCE_NO, sequenceNo)
          .set(EVENT_TYPE, event.payload().type().storedName())
          .set(EVENT_VERSION, LifecycleEventType.CURRENT_VERSION)
          .set(PAYLOAD, codec.encode(event.payload()))
          .set(ACTOR_TYPE, event.actor().type().wireName())
          .set(ACTOR_ID, event.actor().id())
          .set(OCCURRED_AT, toOffsetDateTime(occurredAt))
          .execute();
    }

    return readEvents(trx, ref.aggregateId(), expectedLastSequence + 1);
  }

  private void registerAggregate(final DSLContext trx, final AggregateRef ref) {
    final Optional<AggregateRef> byPair = findAggregate(trx, ref.companyId(), ref.productId());
    if (byPair.isPresent() && !byPair.get().aggregateId().equals(ref.aggregateId())) {
      throw new ValidationException(
          "Company '%s' and product '%s' already belong to aggregate '%s'"
              .formatted(ref.companyId(), ref.productId(), byPair.get().aggregateId()));
    }

    final Optional<AggregateRef> byId = findAggregate(trx, ref.aggregateId());
    if (byId.isPresent()) {
      // Someone else created it first, the head check reports the conflict
      verifyIdentity(trx, ref);
      return;
    }

    trx.insertInto(AGGREGATES)
        .set(AGGREGATE_ID, ref.aggregateId())
        .set(COMPANY_ID, ref.companyId())
        .set(PRODUCT_ID, ref.productId())
        .set(CREATED_AT, toOffsetDateTime(clock.instant().truncatedTo(ChronoUnit.MICROS)))
        .execute();
  }

  private void verifyIdentity(final DSLContext trx, final AggregateRef ref) {
    findAggregate(trx, ref.aggregateId())
        .filter(recorded -> !recorded.sameIdentityAs(ref))
        .ifPresent(
            recorded -> {
              throw new ValidationException(
                  "Aggregate '%s' belongs to company '%s' and product '%s'"
                      .formatted(
                          recorded.aggregateId(), recorded.companyId(), recorded.productId()));
            });
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readEvents(final String aggregateId, final long fromSequence) {
    return readEvents(dsl, aggregateId, fromSequence);
  }

  private List<StoredEvent> readEvents(
      final DSLContext context, final String aggregateId, final long fromSequence) {
    return selectEvents(context)
        .from(EVENTS)
        .where(AGGREGATE_ID.eq(aggregateId))
        .and(SEQUENCE_NO.ge(fromSequence))
        .orderBy(SEQUENCE_NO)
        .fetch(this::toStoredEvent);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readAllSince(final long globalCursor, final int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive");
    }

    return selectEvents(dsl)
        .from(EVENTS)
        .where(GLOBAL_SEQUENCE.gt(globalCursor))
        .orderBy(GLOBAL_SEQUENCE)
        .limit(limit)
        .fetch(this::toStoredEvent);
  }

  /** {@inheritDoc} */
  @Override
  public long lastSequence(final String aggregateId) {
    return lastSequence(dsl, aggregateId);
  }

  private long lastSequence(final DSLContext context, final String aggregateId) {
    final Long head =
        context.select(HEAD).from(EVENTS).where(AGGREGATE_ID.eq(aggregateId)).fetchOne(HEAD);
    return head == null ? 0L : head;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Long> aggregateHeads() {
    final Map<String, Long> heads = new LinkedHashMap<>();
    dsl.select(AGGREGATE_ID, HEAD)
        .from(EVENTS)
        .groupBy(AGGREGATE_ID)
        .orderBy(AGGREGATE_ID)
        .fetch()
        .forEach(r -> heads.put(r.get(AGGREGATE_ID), r.get(HEAD)));
    return heads;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<AggregateRef> findAggregate(final String aggregateId) {
    return findAggregate(dsl, aggregateId);
  }

  private Optional<AggregateRef> findAggregate(final DSLContext context, final String aggregateId) {
    return context
        .select(AGGREGATE_ID, COMPANY_ID, PRODUCT_ID)
        .from(AGGREGATES)
        .where(AGGREGATE_ID.eq(aggregateId))
        .fetchOptional(r -> new AggregateRef(r.value1(), r.value2(), r.value3()));
  }

  /** {@inheritDoc} */
  @Override
  public Optional<AggregateRef> findAggregate(final String companyId, final String productId) {
    return findAggregate(dsl, companyId, productId);
  }

  private Optional<AggregateRef> findAggregate(
      final DSLContext context, final String companyId, final String productId) {
    return context
        .select(AGGREGATE_ID, COMPANY_ID, PRODUCT_ID)
        .from(AGGREGATES)
        .where(COMPANY_ID.eq(companyId))
        .and(PRODUCT_ID.eq(productId))
        .fetchOptional(r -> new AggregateRef(r.value1(), r.value2(), r.value3()));
  }

  private static SelectSelectStep<Record> selectEvents(final DSLContext context) {
    return context.select(EVENT_COLUMNS);
  }

  private StoredEvent toStoredEvent(final Record r) {
    final LifecycleEventType type = LifecycleEventType.fromStoredName(r.get(EVENT_TYPE));
    return new StoredEvent(
        r.get(EVENT_ID),
        r.get(AGGREGATE_ID),
        r.get(SEQUENCE_NO),
        r.get(GLOBAL_SEQUENCE),
        type,
        r.get(EVENT_VERSION),
        codec.decode(type, r.get(PAYLOAD)),
        new Actor(ActorType.fromWireName(r.get(ACTOR_TYPE)), r.get(ACTOR_ID)),
        toInstant(r.get(OCCURRED_AT)));
  }
}
