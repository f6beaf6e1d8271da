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

package io.github.suppierk.kernel.jooq;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.UnavailableError;
import io.github.suppierk.kernel.uniqueness.UniquenessChecker;
import io.github.suppierk.kernel.uniqueness.UniquenessClaim;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UniquenessChecker} answering with a single indexed query against a claims table.
 *
 * <p>Expected table layout, with a unique constraint over all three columns:
 *
 * <pre>{@code
 * CREATE TABLE unique_claims (
 *   claim_scope   VARCHAR(255) NOT NULL,
 *   claim_field   VARCHAR(255) NOT NULL,
 *   candidate_key VARCHAR(1024) NOT NULL,
 *   PRIMARY KEY (claim_scope, claim_field, candidate_key)
 * );
 * }</pre>
 *
 * <p>A {@code false} answer reserves the candidate within the same transaction. When two
 * transactions race for the same candidate, the unique constraint rejects the second reservation,
 * which is then answered with {@code true}.
 */
public final class JooqUniquenessChecker implements UniquenessChecker {
  public static final String DEFAULT_TABLE_NAME = "unique_claims";

  private static final Logger LOG = LoggerFactory.getLogger(JooqUniquenessChecker.class);

  private static final Field<String> CLAIM_SCOPE =
      DSL.field(DSL.name("claim_scope"), SQLDataType.VARCHAR);
  private static final Field<String> CLAIM_FIELD =
      DSL.field(DSL.name("claim_field"), SQLDataType.VARCHAR);
  private static final Field<String> CANDIDATE_KEY =
      DSL.field(DSL.name("candidate_key"), SQLDataType.VARCHAR);

  private final DslContextProvider dslContextProvider;
  private final Table<Record> table;

  /**
   * @param dslContextProvider routing scopes to databases
   */
  public JooqUniquenessChecker(final DslContextProvider dslContextProvider) {
    this(dslContextProvider, DEFAULT_TABLE_NAME);
  }

  /**
   * @param dslContextProvider routing scopes to databases
   * @param tableName of the claims table
   */
  public JooqUniquenessChecker(
      final DslContextProvider dslContextProvider, final String tableName) {
    this.dslContextProvider = throwIllegalArgumentIfNull(dslContextProvider, "DSL provider");
    this.table = DSL.table(DSL.name(throwIllegalArgumentIfBlank(tableName, "Table name")));
  }

  @Override
  public Outcome<Boolean> exists(final UniquenessClaim claim) {
    final UniquenessClaim nonNullClaim = throwIllegalArgumentIfNull(claim, "Claim");
    final DSLContext dsl =
        throwIllegalStateIfNull(dslContextProvider.apply(nonNullClaim.scope()), "DSL context");

    try {
      final boolean present =
          dsl.transactionResult(
              (final Configuration trx) -> {
                final DSLContext trxDsl = trx.dsl();
                if (trxDsl.fetchExists(table, matching(nonNullClaim))) {
                  return true;
                }

                trxDsl
                    .insertInto(table, CLAIM_SCOPE, CLAIM_FIELD, CANDIDATE_KEY)
                    .values(nonNullClaim.scope(), nonNullClaim.field(), nonNullClaim.candidateKey())
                    .execute();
                return false;
              });

      return Outcome.success(present);
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        LOG.debug("{} was reserved concurrently", nonNullClaim);
        return Outcome.success(true);
      }

      LOG.warn("Cannot look up {}", nonNullClaim, e);
      return Outcome.failure(
          new UnavailableError(
              nonNullClaim.scope(),
              nonNullClaim.field(),
              e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
    }
  }

  /**
   * Deletes the reservation. Failures are logged, the reservation then stays in place.
   *
   * @param claim previously answered with {@code false}
   */
  @Override
  public void release(final UniquenessClaim claim) {
    final UniquenessClaim nonNullClaim = throwIllegalArgumentIfNull(claim, "Claim");
    final DSLContext dsl =
        throwIllegalStateIfNull(dslContextProvider.apply(nonNullClaim.scope()), "DSL context");

    try {
      dsl.deleteFrom(table).where(matching(nonNullClaim)).execute();
    } catch (DataAccessException e) {
      LOG.warn("Cannot release {}, the candidate stays reserved", nonNullClaim, e);
    }
  }

  private static Condition matching(final UniquenessClaim claim) {
    return CLAIM_SCOPE
        .eq(claim.scope())
        .and(CLAIM_FIELD.eq(claim.field()))
        .and(CANDIDATE_KEY.eq(claim.candidateKey()));
  }
}
