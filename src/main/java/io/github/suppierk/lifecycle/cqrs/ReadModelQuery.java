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

/**
 * Represents an immutable request to read the read models as per CQRS paradigm.
 *
 * <p>In terms of 'read-write' {@link ReadModelQuery} is the 'read' counterpart of {@link
 * LifecycleCommand}. Queries never see the event store, only projected rows.
 */
// @formatter:off
public sealed interface ReadModelQuery extends DomainMessage
permits
  ReadModelQuery.One,
  ReadModelQuery.Many
{
// @formatter:on

  /**
   * Marker interface, denoting that the query looks up at most one row.
   *
   * @param <ROW> type of the row
   */
  non-sealed interface One<ROW> extends ReadModelQuery {}

  /**
   * Marker interface, denoting that the query lists rows.
   *
   * @param <ROW> type of the rows
   */
  non-sealed interface Many<ROW> extends ReadModelQuery {}
}
