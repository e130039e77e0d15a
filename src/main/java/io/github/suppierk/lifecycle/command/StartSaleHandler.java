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

import io.github.suppierk.lifecycle.cqrs.LifecycleCommand.StartSale;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommandHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.FieldLimits;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import java.time.Instant;
import java.util.List;

/** The only command allowed to run against a company product without history. */
public final class StartSaleHandler extends LifecycleCommandHandler.Transition<StartSale> {
  public StartSaleHandler(final LifecycleStateMachine stateMachine) {
    super(StartSale.class, stateMachine);
  }

  @Override
  protected boolean createsAggregate() {
    return true;
  }

  @Override
  protected void validate(final StartSale command) {
    throwValidationIfBlank(command.processId(), "processId");
    throwValidationIfBlank(command.initialStageId(), "initialStageId");
    throwValidationIfLongerThan(command.processId(), FieldLimits.IDENTIFIER, "processId");
    throwValidationIfLongerThan(
        command.initialStageId(), FieldLimits.IDENTIFIER, "initialStageId");
  }

  @Override
  protected List<LifecycleEvent> decide(
      final StartSale command, final CompanyProductState state, final Instant now) {
    return stateMachine().startSale(state, command.processId(), command.initialStageId());
  }
}
