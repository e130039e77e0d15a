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

package io.github.suppierk.lifecycle.query;

import static io.github.suppierk.lifecycle.projection.ReadModelTables.AGGREGATE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CLOSE_CONFIDENCE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CLOSE_READY;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.PHASE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.READ_MODEL;

import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.projection.ReadModelTables;
import io.github.suppierk.lifecycle.query.LifecycleQueries.ListReadyToClose;
import java.util.List;
import org.jooq.DSLContext;

/** Most confident deals first. */
public final class ListReadyToCloseHandler
    extends ReadModelQueryHandler.Many<ListReadyToClose, CompanyProductState> {
  private final int readyToCloseConfidence;

  /**
   * @param readyToCloseConfidence confidence at or above which a deal counts as ready
   */
  public ListReadyToCloseHandler(final int readyToCloseConfidence) {
    super(ListReadyToClose.class);
    this.readyToCloseConfidence = readyToCloseConfidence;
  }

  @Override
  protected List<CompanyProductState> run(final ListReadyToClose query, final DSLContext dsl) {
    return dsl.selectFrom(READ_MODEL)
        .where(PHASE.eq(LifecyclePhase.IN_SALES.wireName()))
        .and(CLOSE_READY.isTrue().or(CLOSE_CONFIDENCE.ge(readyToCloseConfidence)))
        .orderBy(CLOSE_CONFIDENCE.desc().nullsLast(), AGGREGATE_ID)
        .fetch(ReadModelTables::toState);
  }
}
