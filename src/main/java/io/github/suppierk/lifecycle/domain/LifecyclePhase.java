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

package io.github.suppierk.lifecycle.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * High-level journey of a company product.
 *
 * <ul>
 *   <li>{@link #PROSPECT}: initial interest, no running sale.
 *   <li>{@link #IN_SALES}: a sales process is underway.
 *   <li>{@link #ONBOARDING}: won, now implementing.
 *   <li>{@link #ACTIVE}: fully onboarded and engaged.
 *   <li>{@link #CHURNED}: lost or cancelled, the terminal phase.
 * </ul>
 */
public enum LifecyclePhase {
  PROSPECT("prospect"),
  IN_SALES("in_sales"),
  ONBOARDING("onboarding"),
  ACTIVE("active"),
  CHURNED("churned");

  private final String wireName;

  LifecyclePhase(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == CHURNED;
  }

  @JsonCreator
  public static LifecyclePhase fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Lifecycle phase cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (LifecyclePhase phase : values()) {
      if (phase.wireName.equals(normalized)) {
        return phase;
      }
    }

    throw new IllegalArgumentException("Unknown lifecycle phase '%s'".formatted(value));
  }
}
