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

/**
 * Defines how work reaches a company product aggregate.
 *
 * <p>Here is an example to help explain how different objects are related to each other - let's
 * assume that we are an account executive working a deal:
 *
 * <ul>
 *   <li>We, as an account executive, are a {@link
 *       io.github.suppierk.lifecycle.authorization.DomainClient} of type {@code user}. An
 *       enrichment job scoring the deal is a {@link
 *       io.github.suppierk.lifecycle.authorization.DomainClient} of type {@code ai}.
 *   <li>The deal itself is a company product aggregate, known only through its events:
 *       <ul>
 *         <li>We move the deal along via {@link
 *             io.github.suppierk.lifecycle.cqrs.LifecycleCommand}s:
 *             <ul>
 *               <li>We might send {@code AdvanceStage} to move the deal from {@code Discovery}
 *                   to {@code Demo}, which appends a {@code StageAdvanced} event.
 *               <li>The enrichment job might send {@code SetCloseConfidence}, but never {@code
 *                   AdvanceStage}: {@code ai} clients cannot move the lifecycle.
 *             </ul>
 *         <li>We inspect deals via {@link io.github.suppierk.lifecycle.cqrs.ReadModelQuery}s:
 *             <ul>
 *               <li>We might send {@code ListReadyToClose}, which reads the projected rows and
 *                   never the events.
 *             </ul>
 *       </ul>
 *   <li>Commands and queries, combined with their handlers, form a {@link
 *       io.github.suppierk.lifecycle.cqrs.LifecycleContext} describing possible interactions.
 * </ul>
 */
package io.github.suppierk.lifecycle.cqrs;
