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

import java.util.Optional;

/** Read-only access to process and stage definitions. */
public interface ProcessCatalog {
  Optional<ProcessDefinition> findProcess(String processId);

  /**
   * Finds the stage together with the process it belongs to.
   *
   * @param stageId to look up
   * @return the owning process, which is guaranteed to contain the stage
   */
  Optional<ProcessDefinition> findProcessOfStage(String stageId);

  /**
   * @param productId to pick a process for
   * @param type of the process
   * @return the published process of the given type with the highest version
   */
  Optional<ProcessDefinition> findDefaultProcess(String productId, ProcessType type);
}
