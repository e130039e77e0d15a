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

/**
 * An event decided by the command layer, not yet assigned a position in the log.
 *
 * @param payload of the event
 * @param actor who caused it
 */
public record PendingEvent(LifecycleEvent payload, Actor actor) {
  public PendingEvent {
    if (payload == null || actor == null) {
      throw new IllegalArgumentException("Pending event payload and actor cannot be null");
    }
  }
}
