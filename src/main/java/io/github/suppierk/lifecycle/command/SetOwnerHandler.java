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

import io.github.suppierk.lifecycle.cqrs.LifecycleCommand.SetOwner;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommandHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.FieldLimits;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import java.time.Instant;
import java.util.List;

public final class SetOwnerHandler extends LifecycleCommandHandler.Attribute<SetOwner> {
  public SetOwnerHandler(final LifecycleStateMachine stateMachine) {
    super(SetOwner.class, stateMachine);
  }

  @Override
  protected void validate(final SetOwner command) {
    throwValidationIfBlank(command.ownerId(), "ownerId");
    throwValidationIfLongerThan(command.ownerId(), FieldLimits.OWNER_ID, "ownerId");
    throwValidationIfLongerThan(command.ownerName(), FieldLimits.NAME, "ownerName");
    throwValidationIfLongerThan(command.reason(), FieldLimits.TEXT, "reason");
  }

  @Override
  protected List<LifecycleEvent> decide(
      final SetOwner command, final CompanyProductState state, final Instant now) {
    return stateMachine()
        .setOwner(state, command.ownerId(), command.ownerName(), command.reason());
  }
}
