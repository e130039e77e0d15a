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

import java.math.BigDecimal;

/**
 * Widths of the persisted columns. Commands exceeding them are rejected up front, as an appended
 * event that cannot be projected would stall its aggregate's read model row.
 */
public final class FieldLimits {
  /** Company product, company, product, process and stage identifiers. */
  public static final int IDENTIFIER = 64;

  public static final int ACTOR_ID = 128;
  public static final int OWNER_ID = 128;
  public static final int NAME = 255;

  /** Free text: next steps, reasons, churn reasons and completion notes. */
  public static final int TEXT = 1000;

  /** Largest amount a {@code numeric(14, 2)} column holds. */
  public static final BigDecimal MAX_MRR = new BigDecimal("999999999999.99");

  private FieldLimits() {
    // Cannot be instantiated
  }
}
