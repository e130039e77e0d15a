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

import io.github.suppierk.lifecycle.domain.AggregateRef;
import io.github.suppierk.lifecycle.errors.ConcurrencyConflictException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, append-only log of lifecycle events partitioned per aggregate.
 *
 * <p>Only the command layer appends; projectors and replays read.
 */
public interface EventStore {
  /**
   * Appends all events atomically at consecutive sequence numbers.
   *
   * @param ref identity of the aggregate, registered on its first append
   * @param events to append, in causal order
   * @param expectedLastSequence the sequence number the caller based its decision on, {@code 0} for
   *     a new aggregate
   * @return the appended events with their assigned positions
   * @throws ConcurrencyConflictException if the aggregate moved past {@code expectedLastSequence}
   */
  List<StoredEvent> append(AggregateRef ref, List<PendingEvent> events, long expectedLastSequence);

  /**
   * @return events of the aggregate with {@code sequenceNo >= fromSequence}, ordered by sequence
   */
  List<StoredEvent> readEvents(String aggregateId, long fromSequence);

  /**
   * @return up to {@code limit} events with {@code globalSequence > globalCursor}, ordered by
   *     global sequence
   */
  List<StoredEvent> readAllSince(long globalCursor, int limit);

  /**
   * @return highest sequence number of the aggregate, {@code 0} if it has no events
   */
  long lastSequence(String aggregateId);

  /**
   * @return highest sequence number per aggregate
   */
  Map<String, Long> aggregateHeads();

  Optional<AggregateRef> findAggregate(String aggregateId);

  Optional<AggregateRef> findAggregate(String companyId, String productId);
}
