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

import io.github.suppierk.lifecycle.cqrs.LifecycleCommand.SetPhase;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommandHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.FieldLimits;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import java.time.Instant;
import java.util.List;

/** Manual phase override, outside the normal process flow. */
public final class SetPhaseHandler extends LifecycleCommandHandler.Transition<SetPhase> {
  public SetPhaseHandler(final LifecycleStateMachine stateMachine) {
    super(SetPhase.class, stateMachine);
  }

  @Override
  protected void validate(final SetPhase command) {
    throwValidationIfNull(command.toPhase(), "toPhase");
    throwValidationIfBlank(command.reason(), "reason");
    throwValidationIfLongerThan(command.reason(), FieldLimits.TEXT, "reason");
    throwValidationIfLongerThan(command.churnReason(), FieldLimits.TEXT, "churnReason");

    if (command.toPhase() == LifecyclePhase.CHURNED) {
      throwValidationIfBlank(command.churnReason(), "churnReason");
    }
  }

  @Override
  protected List<LifecycleEvent> decide(
      final SetPhase command, final CompanyProductState state, final Instant now) {
    return stateMachine()
        .setPhase(state, command.toPhase(), command.reason(), command.churnReason());
  }
}
