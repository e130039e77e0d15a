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

package io.github.suppierk.lifecycle.cqrs;

/** Every command the lifecycle engine accepts, with the action name used at request boundaries. */
public enum CommandAction {
  START_SALE("start-sale", LifecycleCommand.StartSale.class),
  ADVANCE_STAGE("advance-stage", LifecycleCommand.AdvanceStage.class),
  SET_PHASE("set-phase", LifecycleCommand.SetPhase.class),
  SET_OWNER("set-owner", LifecycleCommand.SetOwner.class),
  SET_TIER("set-tier", LifecycleCommand.SetTier.class),
  SET_MRR("set-mrr", LifecycleCommand.SetMrr.class),
  SET_SEATS("set-seats", LifecycleCommand.SetSeats.class),
  SET_NEXT_STEP_DUE("set-next-step-due", LifecycleCommand.SetNextStepDue.class),
  SET_CLOSE_CONFIDENCE("set-close-confidence", LifecycleCommand.SetCloseConfidence.class),
  COMPLETE_PROCESS("complete-process", LifecycleCommand.CompleteProcess.class),
  COMPLETE_SALE_START_ONBOARDING(
      "complete-sale-start-onboarding", LifecycleCommand.CompleteSaleAndStartOnboarding.class),
  COMPLETE_ONBOARDING_START_ENGAGEMENT(
      "complete-onboarding-start-engagement",
      LifecycleCommand.CompleteOnboardingAndStartEngagement.class),
  START_PROCESS("start-process", LifecycleCommand.StartProcess.class);

  private final String actionName;
  private final Class<? extends LifecycleCommand> commandClass;

  CommandAction(String actionName, Class<? extends LifecycleCommand> commandClass) {
    this.actionName = actionName;
    this.commandClass = commandClass;
  }

  public String actionName() {
    return actionName;
  }

  public Class<? extends LifecycleCommand> commandClass() {
    return commandClass;
  }
}
