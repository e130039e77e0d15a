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

package io.github.suppierk.lifecycle.command;

import io.github.suppierk.lifecycle.cqrs.CommandAction;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommandHandler;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import java.util.ArrayList;
import java.util.List;

/** One handler per {@link CommandAction}. */
public final class DefaultHandlers {
  private DefaultHandlers() {
    // Cannot be instantiated
  }

  public static LifecycleCommandHandler<?> forAction(
      final CommandAction action, final LifecycleStateMachine stateMachine) {
    return switch (action) {
      case START_SALE -> new StartSaleHandler(stateMachine);
      case ADVANCE_STAGE -> new AdvanceStageHandler(stateMachine);
      case SET_PHASE -> new SetPhaseHandler(stateMachine);
      case SET_OWNER -> new SetOwnerHandler(stateMachine);
      case SET_TIER -> new SetTierHandler(stateMachine);
      case SET_MRR -> new SetMrrHandler(stateMachine);
      case SET_SEATS -> new SetSeatsHandler(stateMachine);
      case SET_NEXT_STEP_DUE -> new SetNextStepDueHandler(stateMachine);
      case SET_CLOSE_CONFIDENCE -> new SetCloseConfidenceHandler(stateMachine);
      case COMPLETE_PROCESS -> new CompleteProcessHandler(stateMachine);
      case COMPLETE_SALE_START_ONBOARDING ->
          new CompleteSaleAndStartOnboardingHandler(stateMachine);
      case COMPLETE_ONBOARDING_START_ENGAGEMENT ->
          new CompleteOnboardingAndStartEngagementHandler(stateMachine);
      case START_PROCESS -> new StartProcessHandler(stateMachine);
    };
  }

  /**
   * @param stateMachine shared by every handler
   * @return handlers for every command, in {@link CommandAction} order
   */
  public static List<LifecycleCommandHandler<?>> all(final LifecycleStateMachine stateMachine) {
    final List<LifecycleCommandHandler<?>> handlers = new ArrayList<>();
    for (CommandAction action : CommandAction.values()) {
      handlers.add(forAction(action, stateMachine));
    }
    return List.copyOf(handlers);
  }
}
