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
 * Base type for every rejection the lifecycle engine reports back to its callers.
 *
 * <p>Each subclass maps to a single HTTP-like status code and a stable machine-readable error
 * code, so that request boundaries can translate failures without inspecting messages.
 */
public abstract class LifecycleException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4409188239514392011L;

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message
   */
  protected LifecycleException(String message) {
    super(message);
  }

  /**
   * Constructs a new exception with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause, {@code null} is permitted
   */
  protected LifecycleException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience
   */
  public abstract int getStatusCode();

  /**
   * @return stable error code, e.g. {@code VALIDATION_ERROR}
   */
  public abstract String getErrorCode();
}
