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

package io.github.suppierk.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.lifecycle.api.LifecycleCommandEndpoint;
import io.github.suppierk.lifecycle.command.DefaultHandlers;
import io.github.suppierk.lifecycle.config.LifecycleConfig;
import io.github.suppierk.lifecycle.cqrs.LifecycleContext;
import io.github.suppierk.lifecycle.domain.LifecycleStateMachine;
import io.github.suppierk.lifecycle.domain.ProcessCatalog;
import io.github.suppierk.lifecycle.jooq.DslContextProvider;
import io.github.suppierk.lifecycle.jooq.LifecycleSchema;
import io.github.suppierk.lifecycle.projection.JooqReadModelStore;
import io.github.suppierk.lifecycle.projection.ProjectorEngine;
import io.github.suppierk.lifecycle.projection.ReadModelStore;
import io.github.suppierk.lifecycle.query.DefaultQueryHandlers;
import io.github.suppierk.lifecycle.store.EventPayloadCodec;
import io.github.suppierk.lifecycle.store.EventStore;
import io.github.suppierk.lifecycle.store.JooqEventStore;
import java.time.Clock;
import org.jooq.DSLContext;

/**
 * Wires the lifecycle engine over a single database.
 *
 * @param eventStore append-only log
 * @param readModelStore projected rows
 * @param stateMachine shared by the command handlers
 * @param context executes commands and queries
 * @param projector keeps the read models up to date
 * @param endpoint JSON request boundary
 */
public record LifecycleEngine(
    EventStore eventStore,
    ReadModelStore readModelStore,
    LifecycleStateMachine stateMachine,
    LifecycleContext context,
    ProjectorEngine projector,
    LifecycleCommandEndpoint endpoint) {

  /**
   * @param dsl database holding an installed and current schema
   * @param catalog process definitions
   * @param config engine configuration
   * @param clock commands are decided and events stamped at
   * @return engine with every command and query handler registered
   * @throws IllegalStateException if the schema is missing or outdated
   */
  public static LifecycleEngine create(
      final DSLContext dsl,
      final ProcessCatalog catalog,
      final LifecycleConfig config,
      final Clock clock) {
    if (dsl == null || catalog == null || config == null || clock == null) {
      throw new IllegalArgumentException("Engine dependencies cannot be null");
    }

    LifecycleSchema.verify(dsl);

    final ObjectMapper objectMapper = EventPayloadCodec.defaultObjectMapper();
    final EventStore eventStore =
        new JooqEventStore(dsl, new EventPayloadCodec(objectMapper), clock);
    final ReadModelStore readModelStore = new JooqReadModelStore(dsl);
    final LifecycleStateMachine stateMachine = new LifecycleStateMachine(catalog, config.policy());

    final LifecycleContext context =
        new LifecycleContext(
            eventStore,
            DslContextProvider.dslContextIdentity(dsl),
            config.command().maxConcurrencyRetries(),
            clock);
    DefaultHandlers.all(stateMachine).forEach(context::addCommandHandler);
    DefaultQueryHandlers.all(config.policy()).forEach(context::addQueryHandler);

    final ProjectorEngine projector =
        new ProjectorEngine(eventStore, readModelStore, config.projector(), clock);

    return new LifecycleEngine(
        eventStore,
        readModelStore,
        stateMachine,
        context,
        projector,
        new LifecycleCommandEndpoint(context, projector, objectMapper));
  }
}
