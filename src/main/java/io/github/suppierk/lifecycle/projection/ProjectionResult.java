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

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a single projector pass.
 *
 * @param aggregatesProcessed aggregates whose rows moved
 * @param eventsProcessed events folded into rows
 * @param duration wall-clock time of the pass
 * @param failedAggregates aggregates skipped because folding or storing them failed
 * @param completed {@code false} if the time budget ran out before every aggregate was visited
 */
public record ProjectionResult(
    int aggregatesProcessed,
    long eventsProcessed,
    Duration duration,
    List<String> failedAggregates,
    boolean completed) {
  public ProjectionResult {
    failedAggregates = List.copyOf(failedAggregates);
  }
}
