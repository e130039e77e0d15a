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

import io.github.suppierk.lifecycle.domain.ProcessType;
import java.time.Instant;

/**
 * A single stay of a company product in a stage.
 *
 * @param aggregateId company product
 * @param entrySequenceNo sequence number of the event that entered the stage
 * @param enteredAt occurrence time of that event
 * @param exitedAt occurrence time of the event that left the stage, {@code null} while open
 * @param exitSequenceNo sequence number of that event, {@code null} while open
 * @param durationSeconds whole seconds spent in the stage, {@code null} while open
 * @param durationBusinessDays weekdays started during the stay, {@code null} while open
 * @param exitReason {@code null} while open
 */
public record StageFact(
    String aggregateId,
    long entrySequenceNo,
    String companyId,
    String productId,
    String processId,
    ProcessType processType,
    String stageId,
    String stageName,
    int stageOrder,
    Instant enteredAt,
    Instant exitedAt,
    Long exitSequenceNo,
    Long durationSeconds,
    Integer durationBusinessDays,
    StageExitReason exitReason) {
  public boolean isOpen() {
    return exitedAt == null;
  }
}
