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

import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_AGGREGATE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_ENTRY_SEQUENCE_NO;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.STAGE_FACTS;

import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import io.github.suppierk.lifecycle.projection.ReadModelTables;
import io.github.suppierk.lifecycle.projection.StageFact;
import io.github.suppierk.lifecycle.query.LifecycleQueries.ListStageFacts;
import java.util.List;
import org.jooq.DSLContext;

public final class ListStageFactsHandler
    extends ReadModelQueryHandler.Many<ListStageFacts, StageFact> {
  public ListStageFactsHandler() {
    super(ListStageFacts.class);
  }

  @Override
  protected List<StageFact> run(final ListStageFacts query, final DSLContext dsl) {
    return dsl.selectFrom(STAGE_FACTS)
        .where(FACT_AGGREGATE_ID.eq(query.aggregateId()))
        .orderBy(FACT_ENTRY_SEQUENCE_NO)
        .fetch(ReadModelTables::toStageFact);
  }
}
