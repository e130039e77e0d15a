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

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.cqrs.ReadModelQuery;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.ProcessType;
import io.github.suppierk.lifecycle.projection.StageFact;
import io.github.suppierk.lifecycle.projection.StageSummaryRow;
import java.time.Instant;

/** Queries over the projected read models. */
public final class LifecycleQueries {
  private LifecycleQueries() {
    // Cannot be instantiated
  }

  public record FindCompanyProduct(Actor actor, String aggregateId)
      implements ReadModelQuery.One<CompanyProductState> {}

  public record FindCompanyProductByPair(Actor actor, String companyId, String productId)
      implements ReadModelQuery.One<CompanyProductState> {}

  /** Company products whose current stage is {@code stageId}, terminal stages included. */
  public record ListByStage(Actor actor, String stageId)
      implements ReadModelQuery.Many<CompanyProductState> {}

  public record ListByProcessType(Actor actor, ProcessType processType)
      implements ReadModelQuery.Many<CompanyProductState> {}

  public record ListByPhase(Actor actor, LifecyclePhase phase)
      implements ReadModelQuery.Many<CompanyProductState> {}

  /** Deals in sales that are flagged close-ready or reached the configured confidence. */
  public record ListReadyToClose(Actor actor)
      implements ReadModelQuery.Many<CompanyProductState> {}

  /** Company products whose next step was due strictly before {@code asOf}. */
  public record ListOverdueNextSteps(Actor actor, Instant asOf)
      implements ReadModelQuery.Many<CompanyProductState> {}

  /**
   * @param processType to narrow the summary to, every type when {@code null}
   */
  public record StageSummary(Actor actor, ProcessType processType)
      implements ReadModelQuery.Many<StageSummaryRow> {}

  /** Stays of a company product in its stages, oldest first, the current one still open. */
  public record ListStageFacts(Actor actor, String aggregateId)
      implements ReadModelQuery.Many<StageFact> {}
}
