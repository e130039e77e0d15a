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

package io.github.suppierk.lifecycle.query;

import static io.github.suppierk.lifecycle.projection.ReadModelTables.COMPANY_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.PRODUCT_ID;
import static io.github.suppierk.lifecycle.projection.ReadModelTables.READ_MODEL;

import io.github.suppierk.lifecycle.cqrs.ReadModelQueryHandler;
import io.github.suppierk.lifecycle.domain.CompanyProductState;
import io.github.suppierk.lifecycle.projection.ReadModelTables;
import io.github.suppierk.lifecycle.query.LifecycleQueries.FindCompanyProductByPair;
import java.util.Optional;
import org.jooq.DSLContext;

public final class FindCompanyProductByPairHandler
    extends ReadModelQueryHandler.One<FindCompanyProductByPair, CompanyProductState> {
  public FindCompanyProductByPairHandler() {
    super(FindCompanyProductByPair.class);
  }

  @Override
  protected Optional<CompanyProductState> run(
      final FindCompanyProductByPair query, final DSLContext dsl) {
    return dsl.selectFrom(READ_MODEL)
        .where(COMPANY_ID.eq(query.companyId()))
        .and(PRODUCT_ID.eq(query.productId()))
        .fetchOptional(ReadModelTables::toState);
  }
}
