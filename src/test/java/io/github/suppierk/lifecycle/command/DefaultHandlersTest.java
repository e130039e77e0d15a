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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.lifecycle.config.LifecycleConfigs;
import io.github.suppierk.lifecycle.cqrs.CommandAction;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommandHandler;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import io.github.suppierk.lifecycle.test.TestCatalog;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DefaultHandlersTest {
  final LifecycleStateMachine stateMachine =
      new LifecycleStateMachine(TestCatalog.catalog(), LifecycleConfigs.load().policy());

  @Test
  void every_action_must_have_a_handler_for_its_command_class() {
    for (CommandAction action : CommandAction.values()) {
      assertEquals(
          action.commandClass(),
          DefaultHandlers.forAction(action, stateMachine).getCommandClass(),
          action.actionName());
    }
  }

  @Test
  void all_must_cover_every_action_once() {
    final List<LifecycleCommandHandler<?>> handlers = DefaultHandlers.all(stateMachine);
    final Set<Class<?>> commandClasses =
        handlers.stream()
            .<Class<?>>map(LifecycleCommandHandler::getCommandClass)
            .collect(Collectors.toSet());

    assertEquals(CommandAction.values().length, handlers.size());
    assertEquals(CommandAction.values().length, commandClasses.size());
  }

  @Test
  void null_state_machine_must_be_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new SetTierHandler(null));
  }
}
