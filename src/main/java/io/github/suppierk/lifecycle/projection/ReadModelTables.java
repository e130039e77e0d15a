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

import static io.github.suppierk.lifecycle.jooq.JooqTimestamps.toInstant;
import static io.github.suppierk.lifecycle.jooq.JooqTimestamps.toOffsetDateTime;

import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecycleEventType;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.domain.ProcessStatus;
import io.github.suppierk.lifecycle.domain.ProcessType;
import io.github.suppierk.lifecycle.domain.TerminalOutcome;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Tables and columns of the read models with their row mappings, see {@code
 * db/lifecycle-schema.sql}.
 */
public final class ReadModelTables {
  public static final Table<Record> READ_MODEL = DSL.table(DSL.name("company_product_read_model"));

  public static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR);
  public static final Field<String> COMPANY_ID =
      DSL.field(DSL.name("company_id"), SQLDataType.VARCHAR);
  public static final Field<String> PRODUCT_ID =
      DSL.field(DSL.name("product_id"), SQLDataType.VARCHAR);
  public static final Field<String> PHASE = DSL.field(DSL.name("phase"), SQLDataType.VARCHAR);
  public static final Field<String> STATUS = DSL.field(DSL.name("status"), SQLDataType.VARCHAR);
  public static final Field<String> CURRENT_PROCESS_ID =
      DSL.field(DSL.name("current_process_id"), SQLDataType.VARCHAR);
  public static final Field<String> CURRENT_PROCESS_TYPE =
      DSL.field(DSL.name("current_process_type"), SQLDataType.VARCHAR);
  public static final Field<String> CURRENT_STAGE_ID =
      DSL.field(DSL.name("current_stage_id"), SQLDataType.VARCHAR);
  public static final Field<String> CURRENT_STAGE_NAME =
      DSL.field(DSL.name("current_stage_name"), SQLDataType.VARCHAR);
  public static final Field<Integer> CURRENT_STAGE_ORDER =
      DSL.field(DSL.name("current_stage_order"), SQLDataType.INTEGER);
  public static final Field<OffsetDateTime> STAGE_ENTERED_AT =
      DSL.field(DSL.name("stage_entered_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<OffsetDateTime> LAST_STAGE_MOVED_AT =
      DSL.field(DSL.name("last_stage_moved_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<OffsetDateTime> PROCESS_STARTED_AT =
      DSL.field(DSL.name("process_started_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<OffsetDateTime> PROCESS_COMPLETED_AT =
      DSL.field(DSL.name("process_completed_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<String> TERMINAL_OUTCOME =
      DSL.field(DSL.name("terminal_outcome"), SQLDataType.VARCHAR);
  public static final Field<Integer> STAGE_TRANSITION_COUNT =
      DSL.field(DSL.name("stage_transition_count"), SQLDataType.INTEGER);
  public static final Field<String> OWNER_ID = DSL.field(DSL.name("owner_id"), SQLDataType.VARCHAR);
  public static final Field<String> OWNER_NAME =
      DSL.field(DSL.name("owner_name"), SQLDataType.VARCHAR);
  public static final Field<Integer> TIER = DSL.field(DSL.name("tier"), SQLDataType.INTEGER);
  public static final Field<BigDecimal> MRR = DSL.field(DSL.name("mrr"), SQLDataType.NUMERIC);
  public static final Field<String> MRR_CURRENCY =
      DSL.field(DSL.name("mrr_currency"), SQLDataType.VARCHAR);
  public static final Field<Integer> SEATS = DSL.field(DSL.name("seats"), SQLDataType.INTEGER);
  public static final Field<String> NEXT_STEP =
      DSL.field(DSL.name("next_step"), SQLDataType.VARCHAR);
  public static final Field<OffsetDateTime> NEXT_STEP_DUE_AT =
      DSL.field(DSL.name("next_step_due_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<Integer> CLOSE_CONFIDENCE =
      DSL.field(DSL.name("close_confidence"), SQLDataType.INTEGER);
  public static final Field<Boolean> CLOSE_READY =
      DSL.field(DSL.name("close_ready"), SQLDataType.BOOLEAN);
  public static final Field<String> CHURN_REASON =
      DSL.field(DSL.name("churn_reason"), SQLDataType.VARCHAR);
  public static final Field<String> LAST_EVENT_TYPE =
      DSL.field(DSL.name("last_event_type"), SQLDataType.VARCHAR);
  public static final Field<OffsetDateTime> LAST_EVENT_AT =
      DSL.field(DSL.name("last_event_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<Long> LAST_APPLIED_SEQUENCE_NO =
      DSL.field(DSL.name("last_applied_sequence_no"), SQLDataType.BIGINT);

  public static final Table<Record> STAGE_SUMMARY = DSL.table(DSL.name("lifecycle_stage_summary"));

  public static final Field<String> SUMMARY_PROCESS_TYPE =
      DSL.field(DSL.name("process_type"), SQLDataType.VARCHAR);
  public static final Field<String> SUMMARY_PROCESS_ID =
      DSL.field(DSL.name("process_id"), SQLDataType.VARCHAR);
  public static final Field<String> SUMMARY_STAGE_ID =
      DSL.field(DSL.name("stage_id"), SQLDataType.VARCHAR);
  public static final Field<String> SUMMARY_STAGE_NAME =
      DSL.field(DSL.name("stage_name"), SQLDataType.VARCHAR);
  public static final Field<Integer> SUMMARY_STAGE_ORDER =
      DSL.field(DSL.name("stage_order"), SQLDataType.INTEGER);
  public static final Field<Integer> SUMMARY_AGGREGATE_COUNT =
      DSL.field(DSL.name("aggregate_count"), SQLDataType.INTEGER);
  public static final Field<BigDecimal> SUMMARY_TOTAL_MRR =
      DSL.field(DSL.name("total_mrr"), SQLDataType.NUMERIC);

  public static final Table<Record> STAGE_FACTS = DSL.table(DSL.name("lifecycle_stage_facts"));

  public static final Field<String> FACT_AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR);
  public static final Field<Long> FACT_ENTRY_SEQUENCE_NO =
      DSL.field(DSL.name("entry_sequence_no"), SQLDataType.BIGINT);
  public static final Field<String> FACT_COMPANY_ID =
      DSL.field(DSL.name("company_id"), SQLDataType.VARCHAR);
  public static final Field<String> FACT_PRODUCT_ID =
      DSL.field(DSL.name("product_id"), SQLDataType.VARCHAR);
  public static final Field<String> FACT_PROCESS_ID =
      DSL.field(DSL.name("process_id"), SQLDataType.VARCHAR);
  public static final Field<String> FACT_PROCESS_TYPE =
      DSL.field(DSL.name("process_type"), SQLDataType.VARCHAR);
  public static final Field<String> FACT_STAGE_ID =
      DSL.field(DSL.name("stage_id"), SQLDataType.VARCHAR);
  public static final Field<String> FACT_STAGE_NAME =
      DSL.field(DSL.name("stage_name"), SQLDataType.VARCHAR);
  public static final Field<Integer> FACT_STAGE_ORDER =
      DSL.field(DSL.name("stage_order"), SQLDataType.INTEGER);
  public static final Field<OffsetDateTime> FACT_ENTERED_AT =
      DSL.field(DSL.name("entered_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<OffsetDateTime> FACT_EXITED_AT =
      DSL.field(DSL.name("exited_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  public static final Field<Long> FACT_EXIT_SEQUENCE_NO =
      DSL.field(DSL.name("exit_sequence_no"), SQLDataType.BIGINT);
  public static final Field<Long> FACT_DURATION_SECONDS =
      DSL.field(DSL.name("duration_seconds"), SQLDataType.BIGINT);
  public static final Field<Integer> FACT_DURATION_BUSINESS_DAYS =
      DSL.field(DSL.name("duration_business_days"), SQLDataType.INTEGER);
  public static final Field<String> FACT_EXIT_REASON =
      DSL.field(DSL.name("exit_reason"), SQLDataType.VARCHAR);

  private ReadModelTables() {
    // Cannot be instantiated
  }

  public static CompanyProductState toState(Record r) {
    return new CompanyProductState(
        r.get(AGGREGATE_ID),
        r.get(COMPANY_ID),
        r.get(PRODUCT_ID),
        LifecyclePhase.fromWireName(r.get(PHASE)),
        ProcessStatus.fromWireName(r.get(STATUS)),
        r.get(CURRENT_PROCESS_ID),
        nullable(r.get(CURRENT_PROCESS_TYPE), ProcessType::fromWireName),
        r.get(CURRENT_STAGE_ID),
        r.get(CURRENT_STAGE_NAME),
        r.get(CURRENT_STAGE_ORDER),
        toInstant(r.get(STAGE_ENTERED_AT)),
        toInstant(r.get(LAST_STAGE_MOVED_AT)),
        toInstant(r.get(PROCESS_STARTED_AT)),
        toInstant(r.get(PROCESS_COMPLETED_AT)),
        nullable(r.get(TERMINAL_OUTCOME), TerminalOutcome::fromWireName),
        r.get(STAGE_TRANSITION_COUNT),
        r.get(OWNER_ID),
        r.get(OWNER_NAME),
        r.get(TIER),
        r.get(MRR),
        r.get(MRR_CURRENCY),
        r.get(SEATS),
        r.get(NEXT_STEP),
        toInstant(r.get(NEXT_STEP_DUE_AT)),
        r.get(CLOSE_CONFIDENCE),
        Boolean.TRUE.equals(r.get(CLOSE_READY)),
        r.get(CHURN_REASON),
        nullable(r.get(LAST_EVENT_TYPE), LifecycleEventType::fromStoredName),
        toInstant(r.get(LAST_EVENT_AT)),
        r.get(LAST_APPLIED_SEQUENCE_NO));
  }

  /**
   * @param state to store
   * @return column values of every non-key column
   */
  static Map<Field<?>, Object> toColumns(CompanyProductState state) {
    final Map<Field<?>, Object> columns = new LinkedHashMap<>();
    columns.put(COMPANY_ID, state.companyId());
    columns.put(PRODUCT_ID, state.productId());
    columns.put(PHASE, state.phase().wireName());
    columns.put(STATUS, state.status().wireName());
    columns.put(CURRENT_PROCESS_ID, state.currentProcessId());
    columns.put(CURRENT_PROCESS_TYPE, nullable(state.currentProcessType(), ProcessType::wireName));
    columns.put(CURRENT_STAGE_ID, state.currentStageId());
    columns.put(CURRENT_STAGE_NAME, state.currentStageName());
    columns.put(CURRENT_STAGE_ORDER, state.currentStageOrder());
    columns.put(STAGE_ENTERED_AT, toOffsetDateTime(state.stageEnteredAt()));
    columns.put(LAST_STAGE_MOVED_AT, toOffsetDateTime(state.lastStageMovedAt()));
    columns.put(PROCESS_STARTED_AT, toOffsetDateTime(state.processStartedAt()));
    columns.put(PROCESS_COMPLETED_AT, toOffsetDateTime(state.processCompletedAt()));
    columns.put(TERMINAL_OUTCOME, nullable(state.terminalOutcome(), TerminalOutcome::wireName));
    columns.put(STAGE_TRANSITION_COUNT, state.stageTransitionCount());
    columns.put(OWNER_ID, state.ownerId());
    columns.put(OWNER_NAME, state.ownerName());
    columns.put(TIER, state.tier());
    columns.put(MRR, state.mrr());
    columns.put(MRR_CURRENCY, state.mrrCurrency());
    columns.put(SEATS, state.seats());
    columns.put(NEXT_STEP, state.nextStep());
    columns.put(NEXT_STEP_DUE_AT, toOffsetDateTime(state.nextStepDueAt()));
    columns.put(CLOSE_CONFIDENCE, state.closeConfidence());
    columns.put(CLOSE_READY, state.closeReady());
    columns.put(CHURN_REASON, state.churnReason());
    columns.put(LAST_EVENT_TYPE, nullable(state.lastEventType(), LifecycleEventType::storedName));
    columns.put(LAST_EVENT_AT, toOffsetDateTime(state.lastEventAt()));
    columns.put(LAST_APPLIED_SEQUENCE_NO, state.lastAppliedSequenceNo());
    return columns;
  }

  public static StageSummaryRow toSummaryRow(Record r) {
    return new StageSummaryRow(
        ProcessType.fromWireName(r.get(SUMMARY_PROCESS_TYPE)),
        r.get(SUMMARY_PROCESS_ID),
        r.get(SUMMARY_STAGE_ID),
        r.get(SUMMARY_STAGE_NAME),
        r.get(SUMMARY_STAGE_ORDER),
        r.get(SUMMARY_AGGREGATE_COUNT),
        r.get(SUMMARY_TOTAL_MRR));
  }

  /**
   * @return rows whose current process belongs to their phase, the ones a stage can be counted for
   */
  static Condition runningProcess() {
    final List<Condition> matches = new ArrayList<>();
    for (ProcessType type : ProcessType.values()) {
      matches.add(
          CURRENT_PROCESS_TYPE.eq(type.wireName()).and(PHASE.eq(type.phase().wireName())));
    }

    return STATUS.eq(ProcessStatus.IN_PROGRESS.wireName()).and(DSL.or(matches));
  }

  public static StageFact toStageFact(Record r) {
    return new StageFact(
        r.get(FACT_AGGREGATE_ID),
        r.get(FACT_ENTRY_SEQUENCE_NO),
        r.get(FACT_COMPANY_ID),
        r.get(FACT_PRODUCT_ID),
        r.get(FACT_PROCESS_ID),
        ProcessType.fromWireName(r.get(FACT_PROCESS_TYPE)),
        r.get(FACT_STAGE_ID),
        r.get(FACT_STAGE_NAME),
        r.get(FACT_STAGE_ORDER),
        toInstant(r.get(FACT_ENTERED_AT)),
        toInstant(r.get(FACT_EXITED_AT)),
        r.get(FACT_EXIT_SEQUENCE_NO),
        r.get(FACT_DURATION_SECONDS),
        r.get(FACT_DURATION_BUSINESS_DAYS),
        nullable(r.get(FACT_EXIT_REASON), StageExitReason::fromWireName));
  }

  static Map<Field<?>, Object> toColumns(StageFact fact) {
    final Map<Field<?>, Object> columns = new LinkedHashMap<>();
    columns.put(FACT_AGGREGATE_ID, fact.aggregateId());
    columns.put(FACT_ENTRY_SEQUENCE_NO, fact.entrySequenceNo());
    columns.put(FACT_COMPANY_ID, fact.companyId());
    columns.put(FACT_PRODUCT_ID, fact.productId());
    columns.put(FACT_PROCESS_ID, fact.processId());
    columns.put(FACT_PROCESS_TYPE, fact.processType().wireName());
    columns.put(FACT_STAGE_ID, fact.stageId());
    columns.put(FACT_STAGE_NAME, fact.stageName());
    columns.put(FACT_STAGE_ORDER, fact.stageOrder());
    columns.put(FACT_ENTERED_AT, toOffsetDateTime(fact.enteredAt()));
    columns.put(FACT_EXITED_AT, toOffsetDateTime(fact.exitedAt()));
    columns.put(FACT_EXIT_SEQUENCE_NO, fact.exitSequenceNo());
    columns.put(FACT_DURATION_SECONDS, fact.durationSeconds());
    columns.put(FACT_DURATION_BUSINESS_DAYS, fact.durationBusinessDays());
    columns.put(FACT_EXIT_REASON, nullable(fact.exitReason(), StageExitReason::wireName));
    return columns;
  }

  private static <T, R> R nullable(T value, Function<T, R> mapper) {
    return value == null ? null : mapper.apply(value);
  }
}
