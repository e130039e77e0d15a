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
import static io.github.suppierk.lifecycle.projection.ReadModelTables.NEXT_STEP_DUE_AT;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.PHASE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.READ_MODEL;

import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.errors.ValidationException;
import io.github.suppierk.lifecycle.jooq.JooqTimestamps;
import io.github.suppierk.lifecycle.projection.ReadModelTables;
import io.github.suppierk.lifecycle.query.LifecycleQueries.ListOverdueNextSteps;
import java.util.List;
import org.jooq.DSLContext;

/** Oldest due date first; churned company products are left out. */
public final class ListOverdueNextStepsHandler
    extends ReadModelQueryHandler.Many<ListOverdueNextSteps, CompanyProductState> {
  public ListOverdueNextStepsHandler() {
    super(ListOverdueNextSteps.class);
  }

  @Override
  protected List<CompanyProductState> run(
      final ListOverdueNextSteps query, final DSLContext dsl) {
    if (query.asOf() == null) {
      throw new ValidationException("asOf is required");
    }

    return dsl.selectFrom(READ_MODEL)
        .where(NEXT_STEP_DUE_AT.lt(JooqTimestamps.toOffsetDateTime(query.asOf())))
        .and(PHASE.ne(LifecyclePhase.CHURNED.wireName()))
        .orderBy(NEXT_STEP_DUE_AT, AGGREGATE_ID)
        .fetch(ReadModelTables::toState);
  }
}
