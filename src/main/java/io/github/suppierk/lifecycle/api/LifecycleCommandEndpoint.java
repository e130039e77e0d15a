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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.lifecycle.cqrs.CommandResult;
import io.github.suppierk.lifecycle.cqrs.LifecycleCommand;
import io.github.suppierk.lifecycle.cqrs.LifecycleContext;
import io.github.suppierk.lifecycle.projection.ProjectionResult;
import io.github.suppierk.lifecycle.projection.ProjectorEngine;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport-neutral request boundary: takes a JSON command, executes it and brings the read model
 * of the targeted company product up to date before answering.
 *
 * <p>A failing projection never fails the command, the events are already stored and the next
 * catch-up picks them up.
 */
public final class LifecycleCommandEndpoint {
  private static final Logger LOG = LoggerFactory.getLogger(LifecycleCommandEndpoint.class);

  private static final int BAD_REQUEST = 400;
  private static final int OK = 200;

  private final LifecycleContext context;
  private final ProjectorEngine projector;
  private final ObjectMapper objectMapper;

  public LifecycleCommandEndpoint(
      final LifecycleContext context,
      final ProjectorEngine projector,
      final ObjectMapper objectMapper) {
    if (context == null || projector == null || objectMapper == null) {
      throw new IllegalArgumentException("Endpoint dependencies cannot be null");
    }

    this.context = context;
    this.projector = projector;
    this.objectMapper = objectMapper;
  }

  /**
   * @param json command request
   * @return response with the status of the command
   */
  public LifecycleResponse handle(final String json) {
    if (json == null || json.isBlank()) {
      return badRequest("Request body is required");
    }

    final LifecycleCommand command;
    try {
      final LifecycleCommandRequest request =
          objectMapper.readValue(json, LifecycleCommandRequest.class);
      if (!request.hasIdentity()) {
        return badRequest("companyProductId, companyId and productId are required");
      }

      command = request.toCommand();
    } catch (JsonProcessingException e) {
      LOG.debug("Rejected malformed command request", e);
      return badRequest("Malformed command request: %s".formatted(e.getOriginalMessage()));
    } catch (IllegalArgumentException e) {
      LOG.debug("Rejected command request", e);
      return badRequest(e.getMessage());
    }

    final CommandResult result = context.execute(command);
    final ObjectNode body = objectMapper.createObjectNode();
    body.put("success", result.success());
    body.set("result", steps(result));

    if (!result.success()) {
      body.put("error", result.error());
      body.put("code", result.errorCode());
      return new LifecycleResponse(result.statusCode(), body);
    }

    body.set("projection", project(command.target().aggregateId()));
    return new LifecycleResponse(OK, body);
  }

  private ObjectNode project(final String aggregateId) {
    final ObjectNode projection = objectMapper.createObjectNode();
    try {
      final ProjectionResult result = projector.catchUp(List.of(aggregateId));
      projection.put("aggregatesProcessed", result.aggregatesProcessed());
      projection.put("eventsProcessed", result.eventsProcessed());
      projection.put("durationMillis", result.duration().toMillis());
      projection.put("completed", result.completed() && result.failedAggregates().isEmpty());
    } catch (RuntimeException e) {
      LOG.error("Projection after a command on aggregate '{}' failed", aggregateId, e);
      projection.put("completed", false);
      projection.put("error", e.getMessage());
    }
    return projection;
  }

  private ArrayNode steps(final CommandResult result) {
    final ArrayNode steps = objectMapper.createArrayNode();
    for (CommandResult.Step step : result.steps()) {
      steps
          .addObject()
          .put("eventId", step.eventId().toString())
          .put("eventType", step.eventType().storedName())
          .put("sequenceNo", step.sequenceNo());
    }
    return steps;
  }

  private LifecycleResponse badRequest(final String error) {
    final ObjectNode body = objectMapper.createObjectNode();
    body.put("error", error);
    return new LifecycleResponse(BAD_REQUEST, body);
  }
}
