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

import java.io.Serial;
import java.io.Serializable;

/**
 * Identity of a company product aggregate.
 *
 * @param aggregateId the company product id all events are partitioned by
 * @param companyId owning company
 * @param productId product being adopted
 */
public record AggregateRef(String aggregateId, String companyId, String productId)
    implements Serializable {
  @Serial private static final long serialVersionUID = 5410317725993120544L;

  /**
   * @param other identity recorded earlier for the same aggregate id
   * @return {@code true} if both point to the same company and product
   */
  public boolean sameIdentityAs(AggregateRef other) {
    return other != null
        && aggregateId.equals(other.aggregateId)
        && companyId.equals(other.companyId)
        && productId.equals(other.productId);
  }
}
