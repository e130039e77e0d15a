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

import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * {@link ProcessCatalog} reading the {@code product_processes} and {@code product_process_stages}
 * tables on every lookup. Definitions are owned by whoever maintains the product configuration;
 * this class never writes them.
 */
public final class JooqProcessCatalog implements ProcessCatalog {
  static final Table<Record> PROCESSES = DSL.table(DSL.name("product_processes"));
  static final Table<Record> STAGES = DSL.table(DSL.name("product_process_stages"));

  static final Field<String> PROCESS_ID = DSL.field(DSL.name("id"), SQLDataType.VARCHAR);
  static final Field<String> PRODUCT_ID = DSL.field(DSL.name("product_id"), SQLDataType.VARCHAR);
  static final Field<String> PROCESS_TYPE =
      DSL.field(DSL.name("process_type"), SQLDataType.VARCHAR);
  static final Field<String> PROCESS_NAME = DSL.field(DSL.name("name"), SQLDataType.VARCHAR);
  static final Field<Integer> VERSION = DSL.field(DSL.name("version"), SQLDataType.INTEGER);
  static final Field<String> STATUS = DSL.field(DSL.name("status"), SQLDataType.VARCHAR);

  static final Field<String> STAGE_ID = DSL.field(DSL.name("id"), SQLDataType.VARCHAR);
  static final Field<String> STAGE_PROCESS_ID =
      DSL.field(DSL.name("process_id"), SQLDataType.VARCHAR);
  static final Field<String> STAGE_NAME = DSL.field(DSL.name("name"), SQLDataType.VARCHAR);
  static final Field<Integer> STAGE_ORDER = DSL.field(DSL.name("stage_order"), SQLDataType.INTEGER);
  static final Field<String> TERMINAL_TYPE =
      DSL.field(DSL.name("terminal_type"), SQLDataType.VARCHAR);

  static final String PUBLISHED = "published";

  private final DSLContext dsl;

  public JooqProcessCatalog(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dsl = dsl;
  }

  @Override
  public Optional<ProcessDefinition> findProcess(final String processId) {
    if (processId == null) {
      return Optional.empty();
    }

    return dsl.selectFrom(PROCESSES)
        .where(PROCESS_ID.eq(processId))
        .fetchOptional()
        .map(this::toDefinition);
  }

  @Override
  public Optional<ProcessDefinition> findProcessOfStage(final String stageId) {
    if (stageId == null) {
      return Optional.empty();
    }

    return dsl.select(STAGE_PROCESS_ID)
        .from(STAGES)
        .where(STAGE_ID.eq(stageId))
        .fetchOptional(STAGE_PROCESS_ID)
        .flatMap(this::findProcess);
  }

  @Override
  public Optional<ProcessDefinition> findDefaultProcess(
      final String productId, final ProcessType type) {
    return dsl.selectFrom(PROCESSES)
        .where(PRODUCT_ID.eq(productId))
        .and(PROCESS_TYPE.eq(type.wireName()))
        .and(STATUS.eq(PUBLISHED))
        .orderBy(VERSION.desc(), PROCESS_ID)
        .limit(1)
        .fetchOptional()
        .map(this::toDefinition);
  }

  private ProcessDefinition toDefinition(final Record process) {
    final String id = process.get(PROCESS_ID);
    final List<StageDefinition> stages =
        dsl.selectFrom(STAGES)
            .where(STAGE_PROCESS_ID.eq(id))
            .orderBy(STAGE_ORDER, STAGE_ID)
            .fetch(
                stage ->
                    new StageDefinition(
                        stage.get(STAGE_ID),
                        id,
                        stage.get(STAGE_NAME),
                        stage.get(STAGE_ORDER),
                        stage.get(TERMINAL_TYPE) == null
                            ? null
                            : TerminalOutcome.fromWireName(stage.get(TERMINAL_TYPE))));

    return new ProcessDefinition(
        id,
        process.get(PRODUCT_ID),
        ProcessType.fromWireName(process.get(PROCESS_TYPE)),
        process.get(PROCESS_NAME),
        process.get(VERSION),
        PUBLISHED.equals(process.get(STATUS)),
        stages);
  }
}
