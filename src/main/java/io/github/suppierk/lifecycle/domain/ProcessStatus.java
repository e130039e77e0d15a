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

import java.util.Locale;

/** Status of the current process of an aggregate. */
public enum ProcessStatus {
  NONE("none"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed");

  private final String wireName;

  ProcessStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static ProcessStatus fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Process status cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ProcessStatus status : values()) {
      if (status.wireName.equals(normalized)) {
        return status;
      }
    }

    throw new IllegalArgumentException("Unknown process status '%s'".formatted(value));
  }
}
