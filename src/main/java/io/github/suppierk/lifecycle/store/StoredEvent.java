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

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import java.time.Instant;
import java.util.UUID;

/**
 * An event as recorded in the log.
 *
 * @param eventId unique identifier
 * @param aggregateId partition key
 * @param sequenceNo position within the aggregate, gap-free starting at 1
 * @param globalSequence store-wide monotonic position used for full scans
 * @param eventType of the payload
 * @param eventVersion of the payload schema
 * @param payload decoded event
 * @param actor who caused the event
 * @param occurredAt informational timestamp, never used for ordering
 */
public record StoredEvent(
    UUID eventId,
    String aggregateId,
    long sequenceNo,
    long globalSequence,
    LifecycleEventType eventType,
    int eventVersion,
    LifecycleEvent payload,
    Actor actor,
    Instant occurredAt) {}
