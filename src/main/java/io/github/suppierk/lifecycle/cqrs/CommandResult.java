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

import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.errors.LifecycleException;
import io.github.suppierk.lifecycle.store.StoredEvent;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a single command.
 *
 * @param action that was executed
 * @param success whether the command was accepted, a no-op counts as accepted
 * @param steps one entry per appended event, in append order
 * @param error human-readable rejection reason, {@code null} on success
 * @param errorCode stable rejection code, {@code null} on success
 * @param statusCode HTTP-like status for request boundaries
 */
public record CommandResult(
    CommandAction action,
    boolean success,
    List<Step> steps,
    String error,
    String errorCode,
    int statusCode) {

  public CommandResult {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }

  static CommandResult accepted(CommandAction action, List<StoredEvent> events) {
    return new CommandResult(
        action,
        true,
        events.stream()
            .map(event -> new Step(event.eventId(), event.eventType(), event.sequenceNo()))
            .toList(),
        null,
        null,
        200);
  }

  static CommandResult noOp(CommandAction action) {
    return new CommandResult(action, true, List.of(), null, null, 200);
  }

  static CommandResult rejected(CommandAction action, LifecycleException cause) {
    return new CommandResult(
        action, false, List.of(), cause.getMessage(), cause.getErrorCode(), cause.getStatusCode());
  }

  /**
   * @return {@code true} if the command was accepted without producing events
   */
  public boolean isNoOp() {
    return success && steps.isEmpty();
  }

  public List<UUID> eventIds() {
    return steps.stream().map(Step::eventId).toList();
  }

  /**
   * One appended event.
   *
   * @param eventId of the event
   * @param eventType of the event
   * @param sequenceNo assigned by the event store
   */
  public record Step(UUID eventId, LifecycleEventType eventType, long sequenceNo) {}
}
