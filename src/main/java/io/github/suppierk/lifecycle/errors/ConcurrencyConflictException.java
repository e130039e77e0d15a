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

package io.github.suppierk.lifecycle.errors;

import java.io.Serial;

/**
 * Thrown by the event store when the last sequence number of an aggregate moved since the caller
 * loaded it, i.e. another writer appended first.
 */
public class ConcurrencyConflictException extends LifecycleException {
  @Serial private static final long serialVersionUID = 3409874361752304405L;

  private final String aggregateId;
  private final long expectedLastSequence;

  public ConcurrencyConflictException(
      String aggregateId, long expectedLastSequence, String detail) {
    this(aggregateId, expectedLastSequence, detail, null);
  }

  public ConcurrencyConflictException(
      String aggregateId, long expectedLastSequence, String detail, Throwable cause) {
    super(
        "Aggregate '%s' was modified concurrently, expected last sequence %d: %s"
            .formatted(aggregateId, expectedLastSequence, detail),
        cause);
    this.aggregateId = aggregateId;
    this.expectedLastSequence = expectedLastSequence;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public long getExpectedLastSequence() {
    return expectedLastSequence;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }

  @Override
  public final String getErrorCode() {
    return "CONCURRENCY_CONFLICT";
  }
}
