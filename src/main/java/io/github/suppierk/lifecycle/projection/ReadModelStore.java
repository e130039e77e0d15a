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

import io.github.suppierk.lifecycle.domain.CompanyProductState;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage of projected rows. Only the projector writes here, queries read the tables directly.
 *
 * <p>The store is a cache over the event log: discrepancies are repaired by rebuilding, never by
 * editing rows.
 */
public interface ReadModelStore {
  Optional<CompanyProductState> find(String aggregateId);

  /**
   * @return {@code last_applied_sequence_no} per projected aggregate
   */
  Map<String, Long> watermarks();

  default boolean save(CompanyProductState row, long expectedWatermark) {
    return save(row, expectedWatermark, List.of());
  }

  /**
   * Stores a row only if the stored watermark still equals {@code expectedWatermark}, inserting
   * when it is {@code 0}. The stage fact changes of the folded events are written atomically with
   * the row, and not at all when the guard fails.
   *
   * @param row to store, its watermark must be greater than {@code expectedWatermark}
   * @param expectedWatermark watermark the row was folded from
   * @param stageFactChanges caused by the events folded since {@code expectedWatermark}, in order
   * @return {@code false} if another projector moved the row first
   */
  boolean save(
      CompanyProductState row, long expectedWatermark, List<StageFactChange> stageFactChanges);

  /** Drops the rows and stage facts of the given aggregates. */
  void delete(Collection<String> aggregateIds);

  void deleteAll();

  /** Recomputes the stage summary from the current rows. */
  void refreshStageSummary();
}
