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

package io.github.suppierk.lifecycle.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;

/**
 * JSON codec for event payloads.
 *
 * <p>Serialization failures are treated as system errors. Unknown properties are ignored on read
 * so that newer payload versions with extra optional fields stay readable.
 */
public final class EventPayloadCodec {
  private final ObjectMapper objectMapper;

  public EventPayloadCodec() {
    this(defaultObjectMapper());
  }

  public EventPayloadCodec(ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.objectMapper = objectMapper;
  }

  /**
   * @return mapper configured the way stored payloads expect: ISO-8601 instants, lenient reads
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(LifecycleEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize %s payload".formatted(event.type().storedName()), e);
    }
  }

  public LifecycleEvent decode(LifecycleEventType type, String payload) {
    try {
      return objectMapper.readValue(payload, type.payloadClass());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to deserialize %s payload".formatted(type.storedName()), e);
    }
  }
}
