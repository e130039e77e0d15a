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
import java.math.BigDecimal;

/**
 * How many company products currently sit in a stage, and their combined MRR.
 *
 * @param processType of the process
 * @param processId owning process
 * @param stageId of the stage
 * @param stageName display name
 * @param stageOrder position within the process
 * @param aggregateCount company products with an in-progress process at this stage
 * @param totalMrr sum of their MRR, zero when none is set
 */
public record StageSummaryRow(
    ProcessType processType,
    String processId,
    String stageId,
    String stageName,
    Integer stageOrder,
    int aggregateCount,
    BigDecimal totalMrr) {}
