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

/** Catalog of event types with their stored names and payload classes. */
public enum LifecycleEventType {
  SALE_STARTED("SaleStarted", LifecycleEvent.SaleStarted.class),
  PROCESS_STARTED("ProcessStarted", LifecycleEvent.ProcessStarted.class),
  STAGE_ADVANCED("StageAdvanced", LifecycleEvent.StageAdvanced.class),
  PHASE_CHANGED("PhaseChanged", LifecycleEvent.PhaseChanged.class),
  PROCESS_COMPLETED("ProcessCompleted", LifecycleEvent.ProcessCompleted.class),
  OWNER_CHANGED("OwnerChanged", LifecycleEvent.OwnerChanged.class),
  TIER_CHANGED("TierChanged", LifecycleEvent.TierChanged.class),
  MRR_CHANGED("MRRChanged", LifecycleEvent.MrrChanged.class),
  SEATS_CHANGED("SeatsChanged", LifecycleEvent.SeatsChanged.class),
  NEXT_STEP_SCHEDULED("NextStepScheduled", LifecycleEvent.NextStepScheduled.class),
  CLOSE_CONFIDENCE_CHANGED(
      "CloseConfidenceChanged", LifecycleEvent.CloseConfidenceChanged.class);

  /** Every payload is currently written in this version. */
  public static final int CURRENT_VERSION = 1;

  private final String storedName;
  private final Class<? extends LifecycleEvent> payloadClass;

  LifecycleEventType(String storedName, Class<? extends LifecycleEvent> payloadClass) {
    this.storedName = storedName;
    this.payloadClass = payloadClass;
  }

  public String storedName() {
    return storedName;
  }

  public Class<? extends LifecycleEvent> payloadClass() {
    return payloadClass;
  }

  public static LifecycleEventType fromStoredName(String value) {
    for (LifecycleEventType type : values()) {
      if (type.storedName.equals(value)) {
        return type;
      }
    }

    throw new IllegalArgumentException("Unknown event type '%s'".formatted(value));
  }
}
