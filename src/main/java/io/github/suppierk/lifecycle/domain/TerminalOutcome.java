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

/** Marker of a terminal stage and the outcome a completed process ended with. */
public enum TerminalOutcome {
  WON("won"),
  LOST("lost"),
  COMPLETED("completed"),
  CHURNED("churned"),
  CANCELLED("cancelled");

  private final String wireName;

  TerminalOutcome(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static TerminalOutcome fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Terminal outcome cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (TerminalOutcome outcome : values()) {
      if (outcome.wireName.equals(normalized)) {
        return outcome;
      }
    }

    throw new IllegalArgumentException("Unknown terminal outcome '%s'".formatted(value));
  }
}
