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

package io.github.suppierk.lifecycle.authorization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Who or what caused an event. */
public enum ActorType {
  USER("user"),
  SYSTEM("system"),
  AI("ai");

  private final String wireName;

  ActorType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * @param value stored or transmitted representation, case-insensitive
   * @return matching actor type
   * @throws IllegalArgumentException if nothing matches
   */
  @JsonCreator
  public static ActorType fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Actor type cannot be null");
    }

    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ActorType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }

    throw new IllegalArgumentException("Unknown actor type '%s'".formatted(value));
  }
}
