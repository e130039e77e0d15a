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

import static io.github.suppierk.lifecycle.projection.ReadModelTables.STAGE_SUMMARY;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_PROCESS_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_PROCESS_TYPE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_STAGE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_STAGE_ORDER;

import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import io.github.suppierk.lifecycle.projection.ReadModelTables;
import io.github.suppierk.lifecycle.projection.StageSummaryRow;
import io.github.suppierk.lifecycle.query.LifecycleQueries.StageSummary;
import java.util.List;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.impl.DSL;

/** Reads the summary as of the last projector pass that moved any row. */
public final class StageSummaryHandler
    extends ReadModelQueryHandler.Many<StageSummary, StageSummaryRow> {
  public StageSummaryHandler() {
    super(StageSummary.class);
  }

  @Override
  protected List<StageSummaryRow> run(final StageSummary query, final DSLContext dsl) {
    final Condition condition =
        query.processType() == null
            ? DSL.noCondition()
            : SUMMARY_PROCESS_TYPE.eq(query.processType().wireName());

    return dsl.selectFrom(STAGE_SUMMARY)
        .where(condition)
        .orderBy(SUMMARY_PROCESS_TYPE, SUMMARY_PROCESS_ID, SUMMARY_STAGE_ORDER, SUMMARY_STAGE_ID)
        .fetch(ReadModelTables::toSummaryRow);
  }
}
