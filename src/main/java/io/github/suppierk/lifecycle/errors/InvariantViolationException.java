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
 * Thrown when a well-formed command is illegal for the current state of the aggregate, e.g.
 * advancing into a stage of another process.
 */
public class InvariantViolationException extends LifecycleException {
  @Serial private static final long serialVersionUID = -1795553005937641183L;

  public InvariantViolationException(String message) {
    super(message);
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
    return "INVARIANT_VIOLATION";
  }
}
