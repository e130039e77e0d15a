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

package io.github.suppierk.lifecycle.cqrs;

import io.github.suppierk.lifecycle.authorization.Actor;
import io.github.suppierk.lifecycle.authorization.DomainClient;
import java.io.Serializable;

/**
 * Describes general properties of system interactions which can be tracked or used for system
 * audit.
 *
 * <p>Messages are {@link Serializable} so that they can be queued rather than processed right
 * away.
 */
public interface DomainMessage extends Serializable {
  /**
   * @return who issues the interaction, recorded on every resulting event
   */
  Actor actor();

  /**
   * @return the client who interacts with the system
   */
  default DomainClient domainClient() {
    return actor();
  }
}
