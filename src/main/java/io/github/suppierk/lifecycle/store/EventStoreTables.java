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

import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Tables and columns of the event log, see {@code db/lifecycle-schema.sql}. */
final class EventStoreTables {
  static final Table<Record> AGGREGATES = DSL.table(DSL.name("lifecycle_aggregates"));
  static final Table<Record> EVENTS = DSL.table(DSL.name("lifecycle_events"));

  // Shared by both tables
  static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR);

  static final Field<String> COMPANY_ID = DSL.field(DSL.name("company_id"), SQLDataType.VARCHAR);
  static final Field<String> PRODUCT_ID = DSL.field(DSL.name("product_id"), SQLDataType.VARCHAR);
  static final Field<OffsetDateTime> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  static final Field<Long> GLOBAL_SEQUENCE =
      DSL.field(DSL.name("global_sequence"), SQLDataType.BIGINT);
  static final Field<UUID> EVENT_ID = DSL.field(DSL.name("event_id"), SQLDataType.UUID);
  static final Field<Long> SEQUENCE_NO = DSL.field(DSL.name("sequence_no"), SQLDataType.BIGINT);
  static final Field<String> EVENT_TYPE = DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR);
  static final Field<Integer> EVENT_VERSION =
      DSL.field(DSL.name("event_version"), SQLDataType.INTEGER);
  static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.VARCHAR);
  static final Field<String> ACTOR_TYPE = DSL.field(DSL.name("actor_type"), SQLDataType.VARCHAR);
  static final Field<String> ACTOR_ID = DSL.field(DSL.name("actor_id"), SQLDataType.VARCHAR);
  static final Field<OffsetDateTime> OCCURRED_AT =
      DSL.field(DSL.name("occurred_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  private EventStoreTables() {
    // Cannot be instantiated
  }
}
