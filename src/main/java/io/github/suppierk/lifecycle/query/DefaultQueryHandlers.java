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

import io.github.suppierk.lifecycle.config.LifecycleConfig;
import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import java.util.List;

/** Every read model query with its handler. */
public final class DefaultQueryHandlers {
  private DefaultQueryHandlers() {
    // Cannot be instantiated
  }

  public static List<ReadModelQueryHandler<?, ?>> all(final LifecycleConfig.Policy policy) {
    return List.of(
        new FindCompanyProductHandler(),
        new FindCompanyProductByPairHandler(),
        new ListByStageHandler(),
        new ListByProcessTypeHandler(),
        new ListByPhaseHandler(),
        new ListReadyToCloseHandler(policy.readyToCloseConfidence()),
        new ListOverdueNextStepsHandler(),
        new StageSummaryHandler(),
        new ListStageFactsHandler());
  }
}
