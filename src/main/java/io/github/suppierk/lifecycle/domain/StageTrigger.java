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

/** What moved an aggregate to another stage. */
public enum StageTrigger {
  MANUAL("manual"),
  AUTOMATION("automation"),
  AI("ai"),
  EXIT_CRITERIA_MET("exit_criteria_met");

  private final String wireName;

  StageTrigger(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static StageTrigger fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Stage trigger cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (StageTrigger trigger : values()) {
      if (trigger.wireName.equals(normalized)) {
        return trigger;
      }
    }

    throw new IllegalArgumentException("Unknown stage trigger '%s'".formatted(value));
  }
}
