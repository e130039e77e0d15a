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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LifecycleExceptionTest {
  @Test
  void every_exception_must_map_to_a_status_and_code() {
    assertStatus(new ValidationException("bad"), 400, "VALIDATION_ERROR");
    assertStatus(new NotFoundException("missing"), 404, "NOT_FOUND");
    assertStatus(new InvariantViolationException("illegal"), 409, "INVARIANT_VIOLATION");
    assertStatus(
        new ConcurrencyConflictException("cp-1", 3, "head moved to 4"),
        409,
        "CONCURRENCY_CONFLICT");
  }

  @Test
  void concurrency_conflict_must_keep_its_coordinates() {
    final ConcurrencyConflictException exception =
        new ConcurrencyConflictException("cp-1", 3, "head moved to 4");

    assertEquals("cp-1", exception.getAggregateId());
    assertEquals(3, exception.getExpectedLastSequence());
    assertTrue(exception.getMessage().contains("cp-1"));
  }

  static void assertStatus(LifecycleException exception, int status, String code) {
    assertEquals(status, exception.getStatusCode());
    assertEquals(code, exception.getErrorCode());
  }
}
