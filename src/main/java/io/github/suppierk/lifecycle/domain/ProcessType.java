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

/** Kind of workflow a process definition describes, each bound to the phase it runs in. */
public enum ProcessType {
  SALES("sales", LifecyclePhase.IN_SALES),
  ONBOARDING("onboarding", LifecyclePhase.ONBOARDING),
  ENGAGEMENT("engagement", LifecyclePhase.ACTIVE);

  private final String wireName;
  private final LifecyclePhase phase;

  ProcessType(String wireName, LifecyclePhase phase) {
    this.wireName = wireName;
    this.phase = phase;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * @return phase the aggregate is in while a process of this type runs
   */
  public LifecyclePhase phase() {
    return phase;
  }

  @JsonCreator
  public static ProcessType fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Process type cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ProcessType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }

    throw new IllegalArgumentException("Unknown process type '%s'".formatted(value));
  }
}
