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

package io.github.suppierk.kernel.aggregate;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.kernel.entity.Entity;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.InvariantViolationError;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.Unit;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Entity} acting as the consistency boundary and the unit of optimistic concurrency for a
 * cluster of related state.
 *
 * <p>The whole attribute state is a single immutable {@code STATE} object, replaced only through
 * {@link #mutate(Mutation)}:
 *
 * <ul>
 *   <li>A mutation either fails without any observable change, or replaces the state, appends its
 *       events and increments {@link #version()} by exactly one.
 *   <li>Declared {@link #invariants()} are evaluated after every attempted change. A violation
 *       restores the previous state and yields {@link InvariantViolationError}.
 *   <li>Produced events stay in the uncommitted log until drained by {@link
 *       #pullUncommittedEvents()}.
 * </ul>
 *
 * <p><b>Single writer</b>: instances are not thread-safe and perform no locking. Callers must
 * serialize access to one instance, typically by using one instance per logical transaction.
 * Re-entrant mutation is detected and rejected with {@link IllegalStateException}. Conflicts
 * between instances are detected by the persistence collaborator comparing {@link
 * #committedVersion()} with the stored version.
 *
 * <p><b>Immutable state, pure mutations</b>: rollback keeps the previous {@code STATE} reference
 * rather than a copy, so {@code STATE} must be deeply immutable and a {@link Mutation} must return
 * a new state without modifying the one it receives or touching anything outside the aggregate.
 * Mutating the received state in place survives a rolled back change.
 *
 * @param <ID> type of the identity
 * @param <STATE> type of the immutable attribute state
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class AggregateRoot<ID extends Identity<?>, STATE> extends Entity<ID> {
  private final InvariantPolicy invariantPolicy;
  private final List<DomainEvent> uncommittedEvents;

  private STATE state;
  private long version;
  private long committedVersion;
  private MutationPhase phase;

  /**
   * Creates a fresh aggregate at version 0.
   *
   * @param identity of the aggregate
   * @param initialState of the aggregate
   */
  protected AggregateRoot(final ID identity, final STATE initialState) {
    this(identity, initialState, 0L, InvariantPolicy.FIRST_VIOLATION);
  }

  /**
   * Rehydrates an aggregate from persisted state.
   *
   * @param identity of the aggregate
   * @param persistedState of the aggregate
   * @param persistedVersion stored alongside the state
   */
  protected AggregateRoot(
      final ID identity, final STATE persistedState, final long persistedVersion) {
    this(identity, persistedState, persistedVersion, InvariantPolicy.FIRST_VIOLATION);
  }

  /**
   * @param identity of the aggregate
   * @param state of the aggregate
   * @param version of the given state, {@code 0} for a fresh aggregate
   * @param invariantPolicy deciding how many violations are reported
   * @throws IllegalArgumentException if state or policy is {@code null}, or version is negative
   */
  protected AggregateRoot(
      final ID identity,
      final STATE state,
      final long version,
      final InvariantPolicy invariantPolicy) {
    super(identity);
    if (version < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    this.state = throwIllegalArgumentIfNull(state, "State");
    this.invariantPolicy = throwIllegalArgumentIfNull(invariantPolicy, "Invariant policy");
    this.uncommittedEvents = new ArrayList<>();
    this.version = version;
    this.committedVersion = version;
    this.phase = MutationPhase.IDLE;
  }

  /**
   * Declares the invariants of this aggregate type. Evaluated in the returned order.
   *
   * <p>Implementations should return the same constant list on every call.
   *
   * @return invariants every state must satisfy
   */
  protected List<Invariant<STATE>> invariants() {
    return List.of();
  }

  /**
   * @return current attribute state
   */
  public final STATE state() {
    return state;
  }

  /**
   * @return number of successful mutations applied since creation, including the persisted ones
   */
  public final long version() {
    return version;
  }

  /**
   * @return version last acknowledged by the persistence collaborator
   */
  public final long committedVersion() {
    return committedVersion;
  }

  /**
   * @return current mutation phase, {@link MutationPhase#IDLE} outside of {@link #mutate(Mutation)}
   */
  public final MutationPhase phase() {
    return phase;
  }

  public final InvariantPolicy invariantPolicy() {
    return invariantPolicy;
  }

  /**
   * Evaluates all declared invariants against the current state.
   *
   * @return {@link Unit} if every invariant holds, otherwise {@link InvariantViolationError} naming
   *     the violated invariants according to {@link #invariantPolicy()}
   */
  public final Outcome<Unit> applyInvariants() {
    final List<String> violated = new ArrayList<>();
    for (Invariant<STATE> invariant : throwIllegalStateIfNull(invariants(), "Invariants")) {
      if (!invariant.holdsFor(state)) {
        violated.add(invariant.name());
        if (invariantPolicy == InvariantPolicy.FIRST_VIOLATION) {
          break;
        }
      }
    }

    if (violated.isEmpty()) {
      return Outcome.unit();
    }

    return Outcome.failure(new InvariantViolationError(getClass().getSimpleName(), violated));
  }

  /**
   * Applies a state transition atomically.
   *
   * <ol>
   *   <li>Snapshots the current state and enters {@link MutationPhase#VALIDATING}.
   *   <li>Asks the mutation for a {@link Change}; a failure is returned as is.
   *   <li>Installs the candidate state and runs {@link #applyInvariants()}.
   *   <li>On violation restores the snapshot ({@link MutationPhase#ROLLED_BACK}).
   *   <li>On success stamps and appends the events, increments the version ({@link
   *       MutationPhase#COMMITTED}).
   * </ol>
   *
   * <p>If the mutation or an invariant throws, the snapshot is restored and the exception is
   * propagated.
   *
   * @param mutation to apply
   * @return {@link Unit} on success, the rejection reason otherwise
   * @throws IllegalStateException if another mutation of this instance is in progress
   */
  protected final Outcome<Unit> mutate(final Mutation<STATE> mutation) {
    throwIllegalArgumentIfNull(mutation, "Mutation");
    if (phase != MutationPhase.IDLE) {
      throw new IllegalStateException(
          "%s is already being mutated, concurrent mutation is not supported".formatted(this));
    }

    final STATE snapshot = state;
    phase = MutationPhase.VALIDATING;
    try {
      final Outcome<Change<STATE>> attempt =
          throwIllegalStateIfNull(mutation.apply(snapshot), "Mutation outcome");
      if (attempt.isFailure()) {
        phase = MutationPhase.ROLLED_BACK;
        return Outcome.failure(attempt.error());
      }

      final Change<STATE> change = attempt.get();
      state = change.state();

      final Outcome<Unit> verdict = applyInvariants();
      if (verdict.isFailure()) {
        state = snapshot;
        phase = MutationPhase.ROLLED_BACK;
        return verdict;
      }

      final long nextVersion = version + 1;
      final List<DomainEvent> produced = new ArrayList<>(change.emissions().size());
      for (Change.Emission emission : change.emissions()) {
        produced.add(
            DomainEvent.of(
                identity(), emission.type(), emission.payload(), nextVersion, produced.size()));
      }

      uncommittedEvents.addAll(produced);
      version = nextVersion;
      phase = MutationPhase.COMMITTED;
      return Outcome.unit();
    } finally {
      if (phase != MutationPhase.COMMITTED) {
        state = snapshot;
      }
      phase = MutationPhase.IDLE;
    }
  }

  /**
   * Drains the uncommitted event log.
   *
   * <p>Meant to be called exactly once per commit cycle by the coordination layer. A second call
   * without an intervening mutation returns an empty list.
   *
   * @return events produced since the previous drain, in production order
   */
  public final List<DomainEvent> pullUncommittedEvents() {
    if (phase != MutationPhase.IDLE) {
      throw new IllegalStateException(
          "Events cannot be pulled while %s is mutated".formatted(this));
    }

    final List<DomainEvent> drained = List.copyOf(uncommittedEvents);
    uncommittedEvents.clear();
    return drained;
  }

  /**
   * @return events produced since the previous drain, without draining them
   */
  public final List<DomainEvent> uncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  /** Records that the persistence collaborator accepted every change up to {@link #version()}. */
  public final void markCommitted() {
    committedVersion = version;
  }

  /**
   * @return {@code true} if some mutations were not acknowledged by the persistence collaborator
   */
  public final boolean hasUncommittedChanges() {
    return committedVersion != version;
  }
}
