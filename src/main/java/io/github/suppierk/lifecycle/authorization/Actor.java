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

package io.github.suppierk.lifecycle.authorization;

import java.io.Serial;

/**
 * Concrete {@link DomainClient} recorded on every event.
 *
 * @param type of the actor
 * @param id of the actor, optional for system jobs
 */
public record Actor(ActorType type, String id) implements DomainClient {
  @Serial private static final long serialVersionUID = -7402284624981175836L;

  public Actor {
    if (type == null) {
      throw new IllegalArgumentException("Actor type cannot be null");
    }
  }

  public static Actor user(String id) {
    return new Actor(ActorType.USER, id);
  }

  public static Actor system(String id) {
    return new Actor(ActorType.SYSTEM, id);
  }

  public static Actor ai(String id) {
    return new Actor(ActorType.AI, id);
  }

  /** {@inheritDoc} */
  @Override
  public String domainRole() {
    return id == null ? type.wireName() : "%s:%s".formatted(type.wireName(), id);
  }

  /** {@inheritDoc} */
  @Override
  public ActorType actorType() {
    return type;
  }
}
