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

import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.TerminalAttributePolicy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.time.Duration;

/**
 * Configuration of the lifecycle engine.
 *
 * <p>Configure in {@code META-INF/microprofile-config.properties}, system properties or
 * environment variables:
 *
 * <pre>
 * lifecycle.command.max-concurrency-retries=3
 * lifecycle.policy.terminal-attribute-policy=owner-only
 * lifecycle.policy.sales-won-phase=onboarding
 * lifecycle.projector.time-budget=PT30S
 * </pre>
 */
@ConfigMapping(prefix = "lifecycle")
public interface LifecycleConfig {

  /** Command layer settings. */
  Command command();

  /** Business policy knobs of the state machine. */
  Policy policy();

  /** Projector settings. */
  Projector projector();

  interface Command {
    /** How many times a command is reloaded and retried after losing an append race. */
    @WithName("max-concurrency-retries")
    @WithDefault("3")
    int maxConcurrencyRetries();
  }

  interface Policy {
    @WithName("terminal-attribute-policy")
    @WithDefault("owner-only")
    TerminalAttributePolicy terminalAttributePolicy();

    /** Phase a won sale moves into when completed on its own: onboarding or active. */
    @WithName("sales-won-phase")
    @WithDefault("onboarding")
    LifecyclePhase salesWonPhase();

    /** Close confidence at or above which a deal counts as ready to close. */
    @WithName("ready-to-close-confidence")
    @WithDefault("75")
    int readyToCloseConfidence();

    @WithName("default-currency")
    @WithDefault("USD")
    String defaultCurrency();

    @WithName("min-tier")
    @WithDefault("1")
    int minTier();

    @WithName("max-tier")
    @WithDefault("5")
    int maxTier();
  }

  interface Projector {
    /** Page size of global event scans during a full rebuild. */
    @WithName("batch-size")
    @WithDefault("500")
    int batchSize();

    /** Wall-clock budget of a single projector pass. */
    @WithName("time-budget")
    @WithDefault("PT30S")
    Duration timeBudget();
  }
}
