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

import io.github.suppierk.lifecycle.authorization.DomainClient;
import io.github.suppierk.lifecycle.authorization.UnauthorizedException;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;

/**
 * Class to accept and process the work associated to a specific {@link ReadModelQuery}:
 *
 * <ul>
 *   <li>Assert that the {@link DomainClient} can invoke the {@link ReadModelQuery}.
 *   <li>Read the read model tables.
 * </ul>
 *
 * @param <QUERY> the type of the particular {@link ReadModelQuery}
 * @param <OUTPUT> the expected output type, {@link Optional} or {@link List}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class ReadModelQueryHandler<
  QUERY extends ReadModelQuery,
  OUTPUT
>
extends
        DomainHandler<QUERY, OUTPUT>
permits
  ReadModelQueryHandler.One,
  ReadModelQueryHandler.Many
{
// @formatter:on
  private final Class<QUERY> queryClass;

  /**
   * Default constructor.
   *
   * @param queryClass this handler is intended for
   */
  protected ReadModelQueryHandler(final Class<QUERY> queryClass) {
    this.queryClass = throwIllegalArgumentIfNull(queryClass, "Query class");
  }

  /**
   * @return specific {@link ReadModelQuery} class
   */
  public final Class<QUERY> getQueryClass() {
    return queryClass;
  }

  /**
   * Defines business logic of this particular {@link ReadModelQueryHandler}.
   *
   * @param query being invoked
   * @param dsl created by {@link LifecycleContext} to perform database querying
   * @return read model rows
   */
  protected abstract OUTPUT run(final QUERY query, final DSLContext dsl);

  /**
   * General business logic invocation to be used and exposed via {@link LifecycleContext}.
   *
   * @param query being invoked
   * @param readOnlyDsl to use for the invocation
   * @return a result of query invocation
   */
  final OUTPUT runInContext(final QUERY query, final DSLContext readOnlyDsl) {
    final QUERY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullQuery.domainClient(), "Query's client");

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' query"
              .formatted(nonNullDomainClient.domainRole(), getQueryClass().getSimpleName()));
    }

    final DSLContext nonNullReadOnlyDsl = throwIllegalStateIfNull(readOnlyDsl, "Read-only DSL");
    return throwIllegalStateIfNull(run(nonNullQuery, nonNullReadOnlyDsl), "Query handler result");
  }

  /**
   * A variant of the {@link ReadModelQueryHandler} for {@link ReadModelQuery.One}.
   *
   * @param <ONE> the type of the particular {@link ReadModelQuery.One}
   * @param <ROW> the row type
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends ReadModelQuery.One<ROW>,
    ROW
  > extends ReadModelQueryHandler<ONE, Optional<ROW>> {
  // @formatter:on
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /**
   * A variant of the {@link ReadModelQueryHandler} for {@link ReadModelQuery.Many}.
   *
   * @param <MANY> the type of the particular {@link ReadModelQuery.Many}
   * @param <ROW> the row type
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends ReadModelQuery.Many<ROW>,
    ROW
  > extends ReadModelQueryHandler<MANY, List<ROW>> {
  // @formatter:on
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
