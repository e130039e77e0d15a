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

package io.github.suppierk.lifecycle.projection;

import static io.github.suppierk.lifecycle.jooq.JooqTimestamps.toOffsetDateTime;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.AGGREGATE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CURRENT_PROCESS_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CURRENT_PROCESS_TYPE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CURRENT_STAGE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CURRENT_STAGE_NAME;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.CURRENT_STAGE_ORDER;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_AGGREGATE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_DURATION_BUSINESS_DAYS;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_DURATION_SECONDS;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_EXITED_AT;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_EXIT_REASON;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.FACT_EXIT_SEQUENCE_NO;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.LAST_APPLIED_SEQUENCE_NO;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.MRR;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.READ_MODEL;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.STAGE_FACTS;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.STAGE_SUMMARY;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_AGGREGATE_COUNT;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_PROCESS_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_PROCESS_TYPE;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_STAGE_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_STAGE_NAME;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_STAGE_ORDER;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.SUMMARY_TOTAL_MRR;

import io.github.suppierk.lifecycle.domain.CompanyProductState;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ReadModelStore} writing each row and its stage facts in one guarded transaction. */
public final class JooqReadModelStore implements ReadModelStore {
  private static final Logger LOG = LoggerFactory.getLogger(JooqReadModelStore.class);

  private static final String UNIQUE_VIOLATION = "23505";

  private final DSLContext dsl;

  public JooqReadModelStore(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dsl = dsl;
  }

  @Override
  public Optional<CompanyProductState> find(final String aggregateId) {
    return dsl.selectFrom(READ_MODEL)
        .where(AGGREGATE_ID.eq(aggregateId))
        .fetchOptional(ReadModelTables::toState);
  }

  @Override
  public Map<String, Long> watermarks() {
    final Map<String, Long> watermarks = new LinkedHashMap<>();
    dsl.select(AGGREGATE_ID, LAST_APPLIED_SEQUENCE_NO)
        .from(READ_MODEL)
        .orderBy(AGGREGATE_ID)
        .fetch()
        .forEach(r -> watermarks.put(r.value1(), r.value2()));
    return watermarks;
  }

  @Override
  public boolean save(
      final CompanyProductState row,
      final long expectedWatermark,
      final List<StageFactChange> stageFactChanges) {
    if (row == null) {
      throw new IllegalArgumentException("Row cannot be null");
    }
    if (row.lastAppliedSequenceNo() <= expectedWatermark) {
      throw new IllegalArgumentException(
          "Watermark of aggregate '%s' cannot move from %d to %d"
              .formatted(row.aggregateId(), expectedWatermark, row.lastAppliedSequenceNo()));
    }

    final List<StageFactChange> changes =
        stageFactChanges == null ? List.of() : List.copyOf(stageFactChanges);
    try {
      return dsl.transactionResult(
          (final Configuration trx) -> {
            if (!writeRow(trx.dsl(), row, expectedWatermark)) {
              return false;
            }

            for (StageFactChange change : changes) {
              writeStageFact(trx.dsl(), change);
            }
            return true;
          });
    } catch (DataAccessException e) {
      if (expectedWatermark == 0 && UNIQUE_VIOLATION.equals(e.sqlState())) {
        LOG.debug("Row of aggregate '{}' was inserted by another projector", row.aggregateId());
        return false;
      }

      throw e;
    }
  }

  @Override
  public void delete(final Collection<String> aggregateIds) {
    if (aggregateIds == null || aggregateIds.isEmpty()) {
      return;
    }

    dsl.transaction(
        (final Configuration trx) -> {
          trx.dsl().deleteFrom(STAGE_FACTS).where(FACT_AGGREGATE_ID.in(aggregateIds)).execute();
          trx.dsl().deleteFrom(READ_MODEL).where(AGGREGATE_ID.in(aggregateIds)).execute();
        });
  }

  @Override
  public void deleteAll() {
    dsl.transaction(
        (final Configuration trx) -> {
          trx.dsl().deleteFrom(STAGE_FACTS).execute();
          trx.dsl().deleteFrom(READ_MODEL).execute();
        });
  }

  @Override
  public void refreshStageSummary() {
    dsl.transaction(
        (final Configuration trx) -> {
          trx.dsl().deleteFrom(STAGE_SUMMARY).execute();
          trx.dsl()
              .insertInto(
                  STAGE_SUMMARY,
                  SUMMARY_PROCESS_TYPE,
                  SUMMARY_PROCESS_ID,
                  SUMMARY_STAGE_ID,
                  SUMMARY_STAGE_NAME,
                  SUMMARY_STAGE_ORDER,
                  SUMMARY_AGGREGATE_COUNT,
                  SUMMARY_TOTAL_MRR)
              .select(
                  DSL.select(
                          CURRENT_PROCESS_TYPE,
                          CURRENT_PROCESS_ID,
                          CURRENT_STAGE_ID,
                          DSL.max(CURRENT_STAGE_NAME),
                          DSL.max(CURRENT_STAGE_ORDER),
                          DSL.count(),
                          DSL.coalesce(DSL.sum(MRR), BigDecimal.ZERO))
                      .from(READ_MODEL)
                      .where(ReadModelTables.runningProcess())
                      .and(CURRENT_STAGE_ID.isNotNull())
                      .groupBy(CURRENT_PROCESS_TYPE, CURRENT_PROCESS_ID, CURRENT_STAGE_ID))
              .execute();
        });
  }

  private static boolean writeRow(
      final DSLContext trx, final CompanyProductState row, final long expectedWatermark) {
    if (expectedWatermark == 0) {
      trx.insertInto(READ_MODEL)
          .set(AGGREGATE_ID, row.aggregateId())
          .set(ReadModelTables.toColumns(row))
          .execute();
      return true;
    }

    return trx.update(READ_MODEL)
            .set(ReadModelTables.toColumns(row))
            .where(AGGREGATE_ID.eq(row.aggregateId()))
            .and(LAST_APPLIED_SEQUENCE_NO.eq(expectedWatermark))
            .execute()
        == 1;
  }

  private static void writeStageFact(final DSLContext trx, final StageFactChange change) {
    if (change instanceof StageFactChange.Opened opened) {
      trx.insertInto(STAGE_FACTS).set(ReadModelTables.toColumns(opened.fact())).execute();
    } else if (change instanceof StageFactChange.Closed closed) {
      trx.update(STAGE_FACTS)
          .set(FACT_EXITED_AT, toOffsetDateTime(closed.exitedAt()))
          .set(FACT_EXIT_SEQUENCE_NO, closed.exitSequenceNo())
          .set(FACT_DURATION_SECONDS, closed.durationSeconds())
          .set(FACT_DURATION_BUSINESS_DAYS, closed.durationBusinessDays())
          .set(FACT_EXIT_REASON, closed.exitReason().wireName())
          .where(FACT_AGGREGATE_ID.eq(closed.aggregateId()))
          .and(FACT_EXITED_AT.isNull())
          .execute();
    }
  }
}
