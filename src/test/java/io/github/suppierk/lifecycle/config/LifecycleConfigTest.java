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

package io.github.suppierk.lifecycle.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.TerminalAttributePolicy;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LifecycleConfigTest {
  @Test
  void defaults_must_be_loaded_from_bundled_properties() {
    final LifecycleConfig config = LifecycleConfigs.load();

    assertEquals(3, config.command().maxConcurrencyRetries());
    assertEquals(TerminalAttributePolicy.OWNER_ONLY, config.policy().terminalAttributePolicy());
    assertEquals(LifecyclePhase.ONBOARDING, config.policy().salesWonPhase());
    assertEquals(75, config.policy().readyToCloseConfidence());
    assertEquals("USD", config.policy().defaultCurrency());
    assertEquals(1, config.policy().minTier());
    assertEquals(5, config.policy().maxTier());
    assertEquals(500, config.projector().batchSize());
    assertEquals(Duration.ofSeconds(30), config.projector().timeBudget());
  }

  @Test
  void overrides_must_take_precedence() {
    final LifecycleConfig config =
        LifecycleConfigs.load(
            Map.of(
                "lifecycle.command.max-concurrency-retries", "0",
                "lifecycle.policy.terminal-attribute-policy", "allow-all",
                "lifecycle.policy.sales-won-phase", "active",
                "lifecycle.projector.batch-size", "10",
                "lifecycle.projector.time-budget", "PT0.5S"));

    assertEquals(0, config.command().maxConcurrencyRetries());
    assertEquals(TerminalAttributePolicy.ALLOW_ALL, config.policy().terminalAttributePolicy());
    assertEquals(LifecyclePhase.ACTIVE, config.policy().salesWonPhase());
    assertEquals(10, config.projector().batchSize());
    assertEquals(Duration.ofMillis(500), config.projector().timeBudget());
    assertEquals(75, config.policy().readyToCloseConfidence());
  }

  @Test
  void null_overrides_must_be_rejected() {
    assertThrows(IllegalArgumentException.class, () -> LifecycleConfigs.load(null));
  }
}
