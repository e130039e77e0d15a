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

package io.github.suppierk.lifecycle.jooq;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs and verifies the tables of the lifecycle engine.
 *
 * <p>The schema carries an explicit version. Services call {@link #verify(DSLContext)} once at
 * startup instead of probing for columns on every call.
 */
public final class LifecycleSchema {
  private static final Logger LOG = LoggerFactory.getLogger(LifecycleSchema.class);

  public static final int CURRENT_VERSION = 1;
  public static final String SCHEMA_RESOURCE = "db/lifecycle-schema.sql";

  private static final Table<?> SCHEMA_VERSION = DSL.table(DSL.name("lifecycle_schema_version"));
  private static final Field<Integer> VERSION = DSL.field(DSL.name("version"), SQLDataType.INTEGER);
  private static final Field<OffsetDateTime> INSTALLED_AT =
      DSL.field(DSL.name("installed_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  private LifecycleSchema() {
    // Cannot be instantiated
  }

  /**
   * Creates missing tables and records the current schema version. Safe to run repeatedly.
   *
   * @param dsl with DDL permissions
   */
  public static void install(DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    final List<String> statements = statements(readResource());
    dsl.transaction(
        trx -> {
          for (String statement : statements) {
            trx.dsl().execute(statement);
          }

          if (!trx.dsl().fetchExists(SCHEMA_VERSION, VERSION.eq(CURRENT_VERSION))) {
            trx.dsl()
                .insertInto(SCHEMA_VERSION)
                .set(VERSION, CURRENT_VERSION)
                .set(INSTALLED_AT, JooqTimestamps.toOffsetDateTime(Instant.now()))
                .execute();
          }
        });

    LOG.info("Lifecycle schema version {} installed", CURRENT_VERSION);
  }

  /**
   * @param dsl to check
   * @throws IllegalStateException if the schema is missing or has another version
   */
  public static void verify(DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    final Integer installed;
    try {
      installed = dsl.select(DSL.max(VERSION)).from(SCHEMA_VERSION).fetchOne(0, Integer.class);
    } catch (DataAccessException e) {
      throw new IllegalStateException("Lifecycle schema is not installed", e);
    }

    if (installed == null || installed != CURRENT_VERSION) {
      throw new IllegalStateException(
          "Lifecycle schema version %s found, %d expected".formatted(installed, CURRENT_VERSION));
    }
  }

  /**
   * Splits a script into statements, dropping {@code --} comment lines.
   *
   * @throws IllegalArgumentException if the script quotes anything, as a quoted semicolon would
   *     split a statement
   */
  static List<String> statements(String script) {
    final String withoutComments =
        script
            .lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));
    if (withoutComments.indexOf('\'') >= 0 || withoutComments.indexOf('"') >= 0) {
      throw new IllegalArgumentException("Schema scripts cannot contain quoted text or names");
    }

    return Arrays.stream(withoutComments.split(";"))
        .map(String::trim)
        .filter(statement -> !statement.isEmpty())
        .toList();
  }

  private static String readResource() {
    try (InputStream in =
        LifecycleSchema.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing resource " + SCHEMA_RESOURCE);
      }

      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
