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


package io.github.suppierk.lifecycle.projection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a company product left a stage. */
public enum StageExitReason {
  /** Moved to a stage of equal or higher order. */
  PROGRESSED("progressed"),
  REGRESSED("regressed"),
  /** The process reached a terminal stage. */
  COMPLETED("completed"),
  /** The process stopped running without completing, for example after a phase override. */
  CANCELLED("cancelled");

  private final String wireName;

  StageExitReason(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static StageExitReason fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Stage exit reason cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (StageExitReason reason : values()) {
      if (reason.wireName.equals(normalized)) {
        return reason;
      }
    }

    throw new IllegalArgumentException("Unknown stage exit reason '%s'".formatted(value));
  }
}
