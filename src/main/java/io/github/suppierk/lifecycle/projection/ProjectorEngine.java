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

import io.github.suppierk.lifecycle.config.LifecycleConfig;
import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleFold;
import io.github.suppierk.lifecycle.store.EventStore;
import io.github.suppierk.lifecycle.store.StoredEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds stored events into read model rows and their stage facts.
 *
 * <p>Every row carries the sequence number of the last event folded into it and is only ever
 * written if that watermark did not move in the meantime, so overlapping passes, retries and
 * concurrent projectors never apply an event twice. A failure on one aggregate is logged and the
 * pass moves on; the next pass retries it.
 */
public final class ProjectorEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ProjectorEngine.class);

  private final EventStore eventStore;
  private final ReadModelStore readModelStore;
  private final LifecycleConfig.Projector config;
  private final Clock clock;

  public ProjectorEngine(
      final EventStore eventStore,
      final ReadModelStore readModelStore,
      final LifecycleConfig.Projector config,
      final Clock clock) {
    if (eventStore == null || readModelStore == null || config == null || clock == null) {
      throw new IllegalArgumentException("Projector dependencies cannot be null");
    }
    if (config.batchSize() <= 0) {
      throw new IllegalArgumentException("Batch size must be positive");
    }

    this.eventStore = eventStore;
    this.readModelStore = readModelStore;
    this.config = config;
    this.clock = clock;
  }

  /** Projects every aggregate whose head is ahead of its row. */
  public ProjectionResult catchUp() {
    final Map<String, Long> heads = eventStore.aggregateHeads();
    final Map<String, Long> watermarks = readModelStore.watermarks();
    final Set<String> behind = new TreeSet<>();
    heads.forEach(
        (id, head) -> {
          if (head > watermarks.getOrDefault(id, 0L)) {
            behind.add(id);
          }
        });
    return catchUp(behind);
  }

  /**
   * Projects the given aggregates up to their current heads.
   *
   * @param aggregateIds to project, unknown or already current ones are skipped
   */
  public ProjectionResult catchUp(final Collection<String> aggregateIds) {
    final Pass pass = new Pass();
    final Map<String, Long> heads = eventStore.aggregateHeads();
    final Map<String, Long> watermarks = readModelStore.watermarks();

    for (String aggregateId : new TreeSet<>(aggregateIds)) {
      if (pass.outOfTime()) {
        break;
      }

      final long head = heads.getOrDefault(aggregateId, 0L);
      if (head <= watermarks.getOrDefault(aggregateId, 0L)) {
        continue;
      }

      try {
        pass.processed(projectSuffix(aggregateId));
      } catch (RuntimeException e) {
        pass.failed(aggregateId, e);
      }
    }

    return pass.finish("Catch-up");
  }

  /**
   * Drops the rows of the given aggregates and rebuilds them from their full histories.
   *
   * @param aggregateIds to rebuild
   */
  public ProjectionResult rebuild(final Collection<String> aggregateIds) {
    final Pass pass = new Pass();

    for (String aggregateId : new TreeSet<>(aggregateIds)) {
      if (pass.outOfTime()) {
        break;
      }

      try {
        readModelStore.delete(List.of(aggregateId));
        final List<StoredEvent> events = eventStore.readEvents(aggregateId, 1);
        if (events.isEmpty()) {
          continue;
        }

        CompanyProductState row = CompanyProductState.initial(identityOf(aggregateId));
        final List<StageFactChange> stageFacts = new ArrayList<>();
        for (StoredEvent event : events) {
          row = fold(row, event, stageFacts);
        }
        if (readModelStore.save(row, 0, stageFacts)) {
          pass.processed(events.size());
        }
      } catch (RuntimeException e) {
        pass.failed(aggregateId, e);
      }
    }

    return pass.finish("Rebuild");
  }

  /**
   * Drops every row and replays the whole log in global order, {@code batchSize} events at a time.
   *
   * <p>If the time budget runs out the rows folded so far are stored and a later {@link
   * #catchUp()} finishes the job.
   */
  public ProjectionResult rebuildAll() {
    final Pass pass = new Pass();
    final Map<String, CompanyProductState> rows = new LinkedHashMap<>();
    final Map<String, Long> eventCounts = new LinkedHashMap<>();
    final Map<String, List<StageFactChange>> stageFacts = new HashMap<>();
    final Set<String> failed = new HashSet<>();

    readModelStore.deleteAll();

    long cursor = 0;
    List<StoredEvent> page = eventStore.readAllSince(cursor, config.batchSize());
    while (!page.isEmpty() && !pass.outOfTime()) {
      for (StoredEvent event : page) {
        final String aggregateId = event.aggregateId();
        if (failed.contains(aggregateId)) {
          continue;
        }

        try {
          final CompanyProductState current = rows.get(aggregateId);
          rows.put(
              aggregateId,
              fold(
                  current == null ? CompanyProductState.initial(identityOf(aggregateId)) : current,
                  event,
                  stageFacts.computeIfAbsent(aggregateId, id -> new ArrayList<>())));
          eventCounts.merge(aggregateId, 1L, Long::sum);
        } catch (RuntimeException e) {
          failed.add(aggregateId);
          rows.remove(aggregateId);
          stageFacts.remove(aggregateId);
          pass.failed(aggregateId, e);
        }
      }

      cursor = page.get(page.size() - 1).globalSequence();
      page = eventStore.readAllSince(cursor, config.batchSize());
    }

    for (CompanyProductState row : rows.values()) {
      try {
        if (readModelStore.save(row, 0, stageFacts.get(row.aggregateId()))) {
          pass.processed(eventCounts.get(row.aggregateId()));
        }
      } catch (RuntimeException e) {
        pass.failed(row.aggregateId(), e);
      }
    }

    return pass.finish("Full rebuild");
  }

  /**
   * @return how far the read models trail the event store
   */
  public ProjectionLag lag() {
    final Map<String, Long> watermarks = readModelStore.watermarks();
    int aggregatesBehind = 0;
    long eventsBehind = 0;

    for (Map.Entry<String, Long> head : eventStore.aggregateHeads().entrySet()) {
      final long missing = head.getValue() - watermarks.getOrDefault(head.getKey(), 0L);
      if (missing > 0) {
        aggregatesBehind++;
        eventsBehind += missing;
      }
    }

    return new ProjectionLag(aggregatesBehind, eventsBehind);
  }

  private long projectSuffix(final String aggregateId) {
    CompanyProductState row =
        readModelStore
            .find(aggregateId)
            .orElseGet(() -> CompanyProductState.initial(identityOf(aggregateId)));

    long applied = 0;
    for (StoredEvent event : eventStore.readEvents(aggregateId, row.lastAppliedSequenceNo() + 1)) {
      final List<StageFactChange> stageFacts = new ArrayList<>(2);
      final CompanyProductState next = fold(row, event, stageFacts);
      if (!readModelStore.save(next, row.lastAppliedSequenceNo(), stageFacts)) {
        LOG.debug(
            "Row of aggregate '{}' moved past {} concurrently, leaving it to the other projector",
            aggregateId,
            row.lastAppliedSequenceNo());
        break;
      }

      row = next;
      applied++;
    }

    return applied;
  }

  private static CompanyProductState fold(
      final CompanyProductState row,
      final StoredEvent event,
      final List<StageFactChange> stageFacts) {
    final CompanyProductState next = LifecycleFold.apply(row, event);
    stageFacts.addAll(StageFacts.changes(row, event, next));
    return next;
  }

  private AggregateRef identityOf(final String aggregateId) {
    return eventStore
        .findAggregate(aggregateId)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Aggregate '%s' has events but no registered identity"
                        .formatted(aggregateId)));
  }

  /** Counters of one pass. */
  private final class Pass {
    private final Instant startedAt = clock.instant();
    private final Instant deadline = startedAt.plus(config.timeBudget());
    private final List<String> failedAggregates = new ArrayList<>();
    private int aggregatesProcessed;
    private long eventsProcessed;
    private boolean completed = true;

    boolean outOfTime() {
      if (completed && clock.instant().isAfter(deadline)) {
        completed = false;
      }
      return !completed;
    }

    void processed(final long events) {
      if (events > 0) {
        aggregatesProcessed++;
        eventsProcessed += events;
      }
    }

    void failed(final String aggregateId, final RuntimeException e) {
      LOG.warn(
          "Projection of aggregate '{}' failed, it is retried on the next pass", aggregateId, e);
      failedAggregates.add(aggregateId);
    }

    ProjectionResult finish(final String kind) {
      if (eventsProcessed > 0) {
        readModelStore.refreshStageSummary();
      }

      final Duration duration = Duration.between(startedAt, clock.instant());
      if (completed) {
        LOG.debug(
            "{} projected {} events of {} aggregates in {}",
            kind,
            eventsProcessed,
            aggregatesProcessed,
            duration);
      } else {
        LOG.info(
            "{} ran out of its {} budget after {} events of {} aggregates",
            kind,
            config.timeBudget(),
            eventsProcessed,
            aggregatesProcessed);
      }

      return new ProjectionResult(
          aggregatesProcessed, eventsProcessed, duration, failedAggregates, completed);
    }
  }
}
