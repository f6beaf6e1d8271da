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

package io.github.suppierk.kernel.coordination;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;
import static io.github.suppierk.kernel.Suspicious.throwUnsupportedOperationIfNull;

import io.github.suppierk.kernel.aggregate.AggregateRoot;
import io.github.suppierk.kernel.aggregate.DomainEvent;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.AlreadyTaken;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.StorageError;
import io.github.suppierk.kernel.outcome.UnavailableError;
import io.github.suppierk.kernel.outcome.Unit;
import io.github.suppierk.kernel.uniqueness.UniquenessChecker;
import io.github.suppierk.kernel.uniqueness.UniquenessClaim;
import io.github.suppierk.kernel.value.ValueObject;
import io.github.suppierk.kernel.value.Values;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Procedure assigning a value which must be unique within a scope to an aggregate, for example
 * "set the username of a user account".
 *
 * <p>The work is sequenced strictly, and nothing is reordered or parallelized:
 *
 * <ol>
 *   <li>Parse the raw candidate into a value - a {@link
 *       io.github.suppierk.kernel.outcome.ValidationError} touches nothing.
 *   <li>Run the aggregate's pure {@link #preflight(AggregateRoot, ValueObject)} check - rules which
 *       do not need global data reject the candidate before any lookup.
 *   <li>Ask the {@link UniquenessChecker} - {@link UnavailableError} or {@link AlreadyTaken} leave
 *       the aggregate untouched.
 *   <li>Invoke the aggregate operation via {@link #apply(AggregateRoot, ValueObject)}, which
 *       re-validates the aggregate invariants. A rejection releases the candidate and is returned
 *       unchanged.
 *   <li>Drain the uncommitted events and hand them to the {@link AggregateStore}. A commit failure
 *       releases the candidate and is returned as is, while the in-memory aggregate keeps its
 *       mutated state - callers must discard such instance and retry with a freshly loaded one.
 *   <li>After a successful commit, release the value the aggregate held before, as reported by
 *       {@link #previous(AggregateRoot)}.
 * </ol>
 *
 * <p>No expected failure is thrown across this boundary, exceptions raised by collaborators are
 * converted into {@link UnavailableError} or {@link StorageError}.
 *
 * @param <ID> type of the aggregate identity
 * @param <AGGREGATE> type of the aggregate
 * @param <VALUE> type of the unique value
 * @param <SUMMARY> type of the result returned to callers
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract class UniqueValueClaim<
  ID extends Identity<?>,
  AGGREGATE extends AggregateRoot<ID, ?>,
  VALUE extends ValueObject,
  SUMMARY
> {
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(UniqueValueClaim.class);

  private final String scope;
  private final String field;
  private final UniquenessChecker uniquenessChecker;
  private final AggregateStore aggregateStore;
  private final AggregateSource<ID, AGGREGATE> aggregateSource;

  /**
   * Constructor for procedures working only with aggregates checked out by the caller.
   *
   * @param scope within which values must be unique, for example {@code users}
   * @param field holding the value, for example {@code username}
   * @param uniquenessChecker to consult before the aggregate is touched
   * @param aggregateStore to commit the changes to
   */
  protected UniqueValueClaim(
      final String scope,
      final String field,
      final UniquenessChecker uniquenessChecker,
      final AggregateStore aggregateStore) {
    this.scope = throwIllegalArgumentIfBlank(scope, "Scope");
    this.field = throwIllegalArgumentIfBlank(field, "Field");
    this.uniquenessChecker = throwIllegalArgumentIfNull(uniquenessChecker, "Uniqueness checker");
    this.aggregateStore = throwIllegalArgumentIfNull(aggregateStore, "Aggregate store");
    this.aggregateSource = null;
  }

  /**
   * Constructor for procedures which also load aggregates by identity.
   *
   * @param scope within which values must be unique, for example {@code users}
   * @param field holding the value, for example {@code username}
   * @param uniquenessChecker to consult before the aggregate is touched
   * @param aggregateStore to commit the changes to
   * @param aggregateSource to load aggregates from
   */
  protected UniqueValueClaim(
      final String scope,
      final String field,
      final UniquenessChecker uniquenessChecker,
      final AggregateStore aggregateStore,
      final AggregateSource<ID, AGGREGATE> aggregateSource) {
    this.scope = throwIllegalArgumentIfBlank(scope, "Scope");
    this.field = throwIllegalArgumentIfBlank(field, "Field");
    this.uniquenessChecker = throwIllegalArgumentIfNull(uniquenessChecker, "Uniqueness checker");
    this.aggregateStore = throwIllegalArgumentIfNull(aggregateStore, "Aggregate store");
    this.aggregateSource = throwIllegalArgumentIfNull(aggregateSource, "Aggregate source");
  }

  public final String getScope() {
    return scope;
  }

  public final String getField() {
    return field;
  }

  /**
   * Converts raw input into the unique value.
   *
   * @param candidate as provided by the caller
   * @return a validated value
   * @throws io.github.suppierk.kernel.value.ValidationException if the input is malformed
   */
  protected abstract VALUE parse(final String candidate);

  /**
   * Pure check of the candidate against aggregate rules which do not depend on global data, run
   * before the uniqueness lookup. Must not change the aggregate.
   *
   * @param aggregate which will receive the value
   * @param value candidate
   * @return {@link Unit} to proceed, or the reason to reject the candidate
   */
  protected Outcome<Unit> preflight(final AGGREGATE aggregate, final VALUE value) {
    return Outcome.unit();
  }

  /**
   * Reports the value the aggregate currently holds, so that it can be released once the
   * replacement is committed.
   *
   * @param aggregate before the change
   * @return currently held value, empty if the aggregate holds none
   */
  protected Optional<VALUE> previous(final AGGREGATE aggregate) {
    return Optional.empty();
  }

  /**
   * Invokes the aggregate operation assigning the value.
   *
   * @param aggregate to change
   * @param value known to be free within the scope
   * @return outcome of the aggregate operation
   */
  protected abstract Outcome<Unit> apply(final AGGREGATE aggregate, final VALUE value);

  /**
   * @param aggregate after a successful commit
   * @return result to hand back to the caller
   */
  protected abstract SUMMARY summarize(final AGGREGATE aggregate);

  /**
   * Loads the aggregate and claims the candidate for it.
   *
   * @param identity of the aggregate
   * @param candidate raw value to claim
   * @return summary of the updated aggregate or the failure reason
   * @throws UnsupportedOperationException if this procedure has no {@link AggregateSource}
   */
  public final Outcome<SUMMARY> claim(final ID identity, final String candidate) {
    final ID nonNullIdentity = throwIllegalArgumentIfNull(identity, "Identity");
    final AggregateSource<ID, AGGREGATE> source =
        throwUnsupportedOperationIfNull(aggregateSource, "Aggregate source");

    return throwIllegalStateIfNull(source.load(nonNullIdentity), "Loaded aggregate outcome")
        .flatMap(aggregate -> claim(aggregate, candidate));
  }

  /**
   * Claims the candidate for an aggregate checked out by the caller.
   *
   * @param aggregate to assign the value to
   * @param candidate raw value to claim
   * @return summary of the updated aggregate or the failure reason
   */
  public final Outcome<SUMMARY> claim(final AGGREGATE aggregate, final String candidate) {
    final AGGREGATE nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");

    final Outcome<VALUE> parsed = Values.attempt(() -> parse(candidate));
    if (parsed.isFailure()) {
      LOG.debug("Candidate for {}.{} rejected: {}", scope, field, parsed.error().message());
      return Outcome.failure(parsed.error());
    }

    final VALUE value = parsed.get();
    final Outcome<Unit> preflight =
        throwIllegalStateIfNull(preflight(nonNullAggregate, value), "Preflight outcome");
    if (preflight.isFailure()) {
      LOG.debug("{} rejected {} before lookup: {}", nonNullAggregate, value, preflight.error());
      return Outcome.failure(preflight.error());
    }

    final UniquenessClaim claim = UniquenessClaim.of(scope, field, value);
    final Outcome<Boolean> exists = lookup(claim);
    if (exists.isFailure()) {
      return Outcome.failure(exists.error());
    }

    if (Boolean.TRUE.equals(exists.get())) {
      LOG.debug("{} is already taken", claim);
      return Outcome.failure(new AlreadyTaken(scope, field, claim.candidateText()));
    }

    final Optional<VALUE> replaced =
        throwIllegalStateIfNull(previous(nonNullAggregate), "Previous value");

    final Outcome<Unit> applied;
    try {
      applied = throwIllegalStateIfNull(apply(nonNullAggregate, value), "Aggregate outcome");
    } catch (RuntimeException e) {
      uniquenessChecker.release(claim);
      throw e;
    }

    if (applied.isFailure()) {
      LOG.debug("{} rejected {}: {}", nonNullAggregate, value, applied.error());
      uniquenessChecker.release(claim);
      return Outcome.failure(applied.error());
    }

    final Outcome<Unit> committed = commit(nonNullAggregate);
    if (committed.isFailure()) {
      uniquenessChecker.release(claim);
      return Outcome.failure(committed.error());
    }

    replaced
        .filter(old -> !old.equals(value))
        .map(old -> UniquenessClaim.of(scope, field, old))
        .ifPresent(
            old -> {
              LOG.debug("Releasing replaced {}", old);
              uniquenessChecker.release(old);
            });

    return Outcome.success(summarize(nonNullAggregate));
  }

  private Outcome<Boolean> lookup(final UniquenessClaim claim) {
    try {
      final Outcome<Boolean> answer =
          throwIllegalStateIfNull(uniquenessChecker.exists(claim), "Uniqueness answer");
      answer.ifFailure(error -> LOG.warn("Uniqueness of {} cannot be verified: {}", claim, error));
      return answer;
    } catch (RuntimeException e) {
      LOG.warn("Uniqueness checker failed for {}", claim, e);
      return Outcome.failure(new UnavailableError(scope, field, describe(e)));
    }
  }

  private Outcome<Unit> commit(final AGGREGATE aggregate) {
    final long expectedVersion = aggregate.committedVersion();
    final long newVersion = aggregate.version();
    final List<DomainEvent> events = aggregate.pullUncommittedEvents();

    Outcome<Unit> committed;
    try {
      committed = aggregateStore.commit(aggregate.identity(), expectedVersion, newVersion, events);
    } catch (RuntimeException e) {
      LOG.warn("Aggregate store failed for {}", aggregate, e);
      committed = Outcome.failure(new StorageError(aggregate.identity().asString(), describe(e)));
    }

    throwIllegalStateIfNull(committed, "Commit outcome")
        .ifSuccess(
            ignored -> {
              aggregate.markCommitted();
              LOG.debug(
                  "{} committed at version {} with {} event(s)",
                  aggregate,
                  newVersion,
                  events.size());
            })
        .ifFailure(error -> LOG.warn("{} was not committed: {}", aggregate, error));

    return committed;
  }

  private static String describe(final RuntimeException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
