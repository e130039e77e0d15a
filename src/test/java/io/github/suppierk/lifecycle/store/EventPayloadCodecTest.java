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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.lifecycle.domain.LifecycleEvent;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventPayloadCodecTest {
  final EventPayloadCodec codec = new EventPayloadCodec();

  @Test
  void phases_and_instants_must_use_their_wire_representation() {
    final String json =
        codec.encode(
            new LifecycleEvent.NextStepScheduled(
                null, null, "call", Instant.parse("2024-03-01T09:00:00Z"), false));

    assertTrue(json.contains("\"toDueAt\":\"2024-03-01T09:00:00Z\""), json);
    assertFalse(json.contains("\"type\""), json);

    final String phase =
        codec.encode(
            new LifecycleEvent.PhaseChanged(
                LifecyclePhase.IN_SALES, LifecyclePhase.PROSPECT, "requalify", null));
    assertTrue(phase.contains("\"fromPhase\":\"in_sales\""), phase);
  }

  @Test
  void unknown_properties_of_newer_payload_versions_must_be_ignored() {
    final LifecycleEvent event =
        codec.decode(
            LifecycleEventType.SEATS_CHANGED,
            "{\"fromSeats\":null,\"toSeats\":12,\"reason\":\"expansion\",\"addedLater\":true}");

    assertEquals(new LifecycleEvent.SeatsChanged(null, 12, "expansion"), event);
  }

  @Test
  void unreadable_payload_must_be_a_system_error() {
    assertThrows(
        IllegalStateException.class,
        () -> codec.decode(LifecycleEventType.TIER_CHANGED, "{not json"));
  }
}
