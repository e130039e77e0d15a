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

package io.github.suppierk.lifecycle.cqrs;

import io.github.suppierk.lifecycle.errors.ValidationException;

/**
 * Defines internal sealed utility for verifying inputs.
 *
 * <p>{@code throw*IfNull} methods guard against programming errors, {@code throwValidation*}
 * methods reject consumer-provided command fields with a {@link ValidationException}.
 */
abstract sealed class Suspicious permits LifecycleContext, DomainHandler {
  /**
   * This method must be used whenever we deal with properties of classes.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we cannot provide services because expected resource was
   * missing.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatMustNotBeNull)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @param value of a required command field
   * @param field name as the consumer knows it
   * @return value if present
   * @throws ValidationException when the value is {@code null}
   */
  protected final <T> T throwValidationIfNull(T value, String field) throws ValidationException {
    if (value == null) {
      throw new ValidationException("%s is required".formatted(field));
    }

    return value;
  }

  /**
   * @param value of a required text field
   * @param field name as the consumer knows it
   * @return value if it has at least one non-whitespace character
   * @throws ValidationException when the value is {@code null} or blank
   */
  protected final String throwValidationIfBlank(String value, String field)
      throws ValidationException {
    if (value == null || value.isBlank()) {
      throw new ValidationException("%s is required".formatted(field));
    }

    return value;
  }

  /**
   * @param value to check, {@code null} passes
   * @param maxLength longest accepted value
   * @param field name used in the error message
   * @return the value as is
   * @throws ValidationException if the value is longer than allowed
   */
  protected final String throwValidationIfLongerThan(String value, int maxLength, String field)
      throws ValidationException {
    if (value != null && value.length() > maxLength) {
      throw new ValidationException(
          "%s cannot be longer than %d characters, got %d"
              .formatted(field, maxLength, value.length()));
    }

    return value;
  }
}
