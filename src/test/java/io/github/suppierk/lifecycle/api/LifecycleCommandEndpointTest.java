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

package io.github.suppierk.lifecycle.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.lifecycle.LifecycleEngine;
import io.github.suppierk.lifecycle.config.LifecycleConfigs;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.domain.LifecyclePhase;
import io.github.suppierk.lifecycle.store.EventPayloadCodec;
import io.github.suppierk.lifecycle.test.TestCatalog;
import io.github.suppierk.lifecycle.test.TestClock;
import io.github.suppierk.lifecycle.test.TestDatabase;
import java.math.BigDecimal;
import java.util.List;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LifecycleCommandEndpointTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.dsl("endpoint");

  LifecycleEngine engine;
  LifecycleCommandEndpoint endpoint;

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll(DSL_CONTEXT);
    engine =
        LifecycleEngine.create(
            DSL_CONTEXT, TestCatalog.catalog(), LifecycleConfigs.load(), new TestClock());
    endpoint = engine.endpoint();
  }

  static String request(String action, String fields) {
    return """
        {"action": "%s", "companyProductId": "cp-1", "companyId": "acme", "productId": "%s"%s}
        """
        .formatted(action, TestCatalog.PRODUCT, fields.isEmpty() ? "" : ", " + fields);
  }

  static String startSale() {
    return request("start-sale", "\"processId\": \"P1\", \"initialStageId\": \"S1\"");
  }

  @Test
  void when_any_of_the_dependencies_is_null_throw_illegal_argument_exception() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new LifecycleCommandEndpoint(
                null, engine.projector(), EventPayloadCodec.defaultObjectMapper()));
  }

  @Nested
  class BadRequests {
    void assertBadRequest(String json) {
      final LifecycleResponse response = endpoint.handle(json);

      assertEquals(400, response.statusCode());
      assertFalse(response.isSuccess());
      assertTrue(response.body().hasNonNull("error"));
    }

    @Test
    void empty_or_malformed_bodies_must_be_rejected() {
      assertBadRequest(null);
      assertBadRequest("   ");
      assertBadRequest("{not json");
    }

    @Test
    void unknown_or_missing_actions_must_be_rejected() {
      assertBadRequest(request("teleport", ""));
      assertBadRequest("{\"companyProductId\": \"cp-1\", \"companyId\": \"acme\"}");
    }

    @Test
    void missing_identity_must_be_rejected() {
      assertBadRequest(
          "{\"action\": \"set-tier\", \"companyProductId\": \"cp-1\", \"tier\": 2}");
      assertBadRequest(
          "{\"action\": \"set-tier\", \"companyProductId\": \" \", \"companyId\": \"acme\","
              + " \"productId\": \"prod-1\", \"tier\": 2}");
    }

    @Test
    void unknown_actor_types_and_phases_must_be_rejected() {
      assertBadRequest(request("set-tier", "\"tier\": 2, \"actorType\": \"robot\""));
      assertBadRequest(request("set-phase", "\"toPhase\": \"dormant\", \"reason\": \"x\""));
      assertBadRequest(request("advance-stage", "\"toStageId\": \"S2\", \"trigger\": \"whim\""));
    }

    @Test
    void identifiers_longer_than_their_columns_must_be_validation_errors() {
      final String longId = "x".repeat(65);

      for (String json :
          List.of(
              startSale().replace("\"cp-1\"", "\"%s\"".formatted(longId)),
              startSale().replace("\"acme\"", "\"%s\"".formatted(longId)),
              request(
                  "start-sale",
                  "\"processId\": \"P1\", \"initialStageId\": \"S1\", \"actorId\": \"%s\""
                      .formatted("u".repeat(129))))) {
        assertBadRequest(json);
        assertEquals("VALIDATION_ERROR", endpoint.handle(json).body().get("code").asText());
      }

      assertTrue(engine.eventStore().aggregateHeads().isEmpty());
    }
  }

  @Nested
  class Commands {
    @Test
    void accepted_command_must_report_steps_and_projection() {
      final LifecycleResponse response = endpoint.handle(startSale());
      final JsonNode body = response.body();

      assertEquals(200, response.statusCode());
      assertTrue(response.isSuccess());
      assertTrue(body.get("success").asBoolean());
      assertEquals(1, body.get("result").size());
      assertEquals("SaleStarted", body.get("result").get(0).get("eventType").asText());
      assertEquals(1, body.get("result").get(0).get("sequenceNo").asLong());
      assertTrue(body.get("projection").get("completed").asBoolean());
      assertEquals(1, body.get("projection").get("eventsProcessed").asLong());

      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(LifecyclePhase.IN_SALES, row.phase());
      assertEquals("S1", row.currentStageId());
    }

    @Test
    void read_model_must_follow_every_accepted_command() {
      endpoint.handle(startSale());
      endpoint.handle(request("set-mrr", "\"mrr\": 1200.5, \"currency\": \"eur\""));
      endpoint.handle(request("advance-stage", "\"toStageId\": \"S2\""));

      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(0, new BigDecimal("1200.50").compareTo(row.mrr()));
      assertEquals("EUR", row.mrrCurrency());
      assertEquals("S2", row.currentStageId());
      assertEquals(3, row.lastAppliedSequenceNo());
    }

    @Test
    void rejected_command_must_report_code_and_status() {
      final LifecycleResponse response =
          endpoint.handle(request("advance-stage", "\"toStageId\": \"S2\""));
      final JsonNode body = response.body();

      assertEquals(404, response.statusCode());
      assertFalse(body.get("success").asBoolean());
      assertEquals("NOT_FOUND", body.get("code").asText());
      assertTrue(body.get("result").isEmpty());
      assertFalse(body.has("projection"));
    }

    @Test
    void ai_actors_must_be_forbidden_from_lifecycle_moves() {
      endpoint.handle(startSale());

      final LifecycleResponse response =
          endpoint.handle(
              request(
                  "complete-sale-start-onboarding", "\"actorType\": \"ai\", \"actorId\": \"bot\""));

      assertEquals(403, response.statusCode());
      assertEquals("UNAUTHORIZED", response.body().get("code").asText());
    }

    @Test
    void start_process_must_resume_a_plain_win() {
      endpoint.handle(startSale());
      endpoint.handle(
          request(
              "complete-process",
              "\"terminalStageId\": \"S_WON\", \"outcome\": \"won\""));

      final LifecycleResponse started =
          endpoint.handle(request("start-process", "\"processId\": \"O1\""));
      assertEquals(200, started.statusCode());
      assertEquals("ProcessStarted", started.body().get("result").get(0).get("eventType").asText());

      final LifecycleResponse advanced =
          endpoint.handle(
              request(
                  "advance-stage",
                  "\"toStageId\": \"O_CONFIG\", \"trigger\": \"exit_criteria_met\""));
      assertEquals(200, advanced.statusCode());

      final CompanyProductState row = engine.readModelStore().find("cp-1").orElseThrow();
      assertEquals(LifecyclePhase.ONBOARDING, row.phase());
      assertEquals("O_CONFIG", row.currentStageId());
    }

    @Test
    void no_op_must_succeed_with_empty_result() {
      endpoint.handle(startSale());
      endpoint.handle(request("set-seats", "\"seats\": 25"));

      final LifecycleResponse response = endpoint.handle(request("set-seats", "\"seats\": 25"));

      assertEquals(200, response.statusCode());
      assertTrue(response.body().get("result").isEmpty());
      assertEquals(0, response.body().get("projection").get("eventsProcessed").asLong());
    }
  }
}
