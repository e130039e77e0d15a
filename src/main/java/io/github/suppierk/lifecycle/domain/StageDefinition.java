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

/**
 * A single step of a process.
 *
 * @param id of the stage
 * @param processId owning process
 * @param name display name
 * @param stageOrder position within the process, lower comes first
 * @param terminalType outcome marker of a terminal stage, {@code null} for regular stages
 */
public record StageDefinition(
    String id, String processId, String name, int stageOrder, TerminalOutcome terminalType) {
  public StageDefinition {
    if (id == null || processId == null || name == null) {
      throw new IllegalArgumentException("Stage id, process id and name cannot be null");
    }
  }

  public boolean isTerminal() {
    return terminalType != null;
  }
}
