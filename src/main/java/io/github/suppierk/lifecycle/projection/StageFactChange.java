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

import java.time.Instant;

/** A write to the stage facts caused by a single event. */
// @formatter:off
public sealed interface StageFactChange
permits
  StageFactChange.Opened, StageFactChange.Closed
{
// @formatter:on

  String aggregateId();

  record Opened(StageFact fact) implements StageFactChange {
    @Override
    public String aggregateId() {
      return fact.aggregateId();
    }
  }

  /** Closes the open fact of the aggregate, if there is one. */
  record Closed(
      String aggregateId,
      long exitSequenceNo,
      Instant exitedAt,
      long durationSeconds,
      int durationBusinessDays,
      StageExitReason exitReason)
      implements StageFactChange {}
}
