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

package io.github.suppierk.lifecycle.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reference data describing a workflow of a product.
 *
 * @param id of the process
 * @param productId owning product
 * @param type of the process
 * @param name display name
 * @param version of the definition events record at the time they were emitted
 * @param published whether the process may be picked as the product default
 * @param stages of the process in any order
 */
public record ProcessDefinition(
    String id,
    String productId,
    ProcessType type,
    String name,
    int version,
    boolean published,
    List<StageDefinition> stages) {
  public ProcessDefinition {
    if (id == null || productId == null || type == null) {
      throw new IllegalArgumentException("Process id, product id and type cannot be null");
    }

    stages = stages == null ? List.of() : List.copyOf(stages);
  }

  public Optional<StageDefinition> stage(String stageId) {
    return stages.stream().filter(stage -> stage.id().equals(stageId)).findFirst();
  }

  /**
   * @return the lowest-order non-terminal stage, where a freshly started process begins
   */
  public Optional<StageDefinition> initialStage() {
    return stages.stream()
        .filter(stage -> !stage.isTerminal())
        .min(Comparator.comparingInt(StageDefinition::stageOrder));
  }

  /**
   * @param outcome marker to look for
   * @return the lowest-order terminal stage carrying the marker
   */
  public Optional<StageDefinition> terminalStage(TerminalOutcome outcome) {
    return stages.stream()
        .filter(stage -> stage.terminalType() == outcome)
        .min(Comparator.comparingInt(StageDefinition::stageOrder));
  }
}
