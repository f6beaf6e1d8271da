package io.github.suppierk.kernel.coordination;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.suppierk.kernel.aggregate.DomainEvent;
import io.github.suppierk.kernel.outcome.AlreadyTaken;
import io.github.suppierk.kernel.outcome.ConcurrencyConflictError;
import io.github.suppierk.kernel.outcome.ErrorKind;
import io.github.suppierk.kernel.outcome.InvariantViolationError;
import io.github.suppierk.kernel.outcome.NotFoundError;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.UnavailableError;
import io.github.suppierk.kernel.outcome.ValidationError;
import io.github.suppierk.kernel.uniqueness.UniquenessChecker;
import io.github.suppierk.kernel.uniqueness.UniquenessClaim;
import io.github.suppierk.test.AccountSummary;
import io.github.suppierk.test.ClaimUsername;
import io.github.suppierk.test.UserAccount;
import io.github.suppierk.test.UserId;
import io.github.suppierk.test.Username;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UniqueValueClaimTest {
  static final UniquenessClaim ALICE =
      UniquenessClaim.of(ClaimUsername.SCOPE, ClaimUsername.FIELD, Username.of("alice"));

  @Mock UniquenessChecker checker;
  @Mock AggregateStore store;
  @Captor ArgumentCaptor<List<DomainEvent>> eventsCaptor;

  UserAccount account;
  ClaimUsername claimUsername;

  @BeforeEach
  void setUp() {
    account = new UserAccount(UserId.random());
    claimUsername = new ClaimUsername(checker, store);
  }

  @Nested
  class Scenarios {
    @Test
    void banned_username_is_rejected_before_any_lookup() {
      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "admin");

      assertTrue(outcome.isFailure());
      assertEquals(
          InvariantViolationError.of("UserAccount", UserAccount.BANNED_TERM), outcome.error());
      assertEquals(UserAccount.BANNED_TERM, outcome.error().subject());
      verify(checker, never()).exists(any(UniquenessClaim.class));
      verifyNoInteractions(store);
      assertEquals(0, account.version());
    }

    @Test
    void taken_username_leaves_the_aggregate_untouched() {
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(true));

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(new AlreadyTaken("users", "username", "alice"), outcome.error());
      assertEquals(0, account.version());
      assertTrue(account.uncommittedEvents().isEmpty());
      verify(checker).exists(ALICE);
      verify(checker, never()).release(any());
      verifyNoInteractions(store);
    }

    @Test
    void free_username_is_set_and_committed_with_one_event() {
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));
      when(store.commit(any(), anyLong(), anyLong(), anyList())).thenReturn(Outcome.unit());

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(new AccountSummary(account.identity(), "alice", 1), outcome.get());
      assertEquals(1, account.version());
      assertEquals(1, account.committedVersion());
      assertFalse(account.hasUncommittedChanges());
      verify(store).commit(eq(account.identity()), eq(0L), eq(1L), eventsCaptor.capture());

      final List<DomainEvent> events = eventsCaptor.getValue();
      assertEquals(1, events.size());
      assertEquals(UserAccount.USERNAME_SET, events.get(0).type());
      assertEquals("alice", events.get(0).payload(Username.class).value());
      assertEquals(1, events.get(0).aggregateVersion());
      assertTrue(account.pullUncommittedEvents().isEmpty());
      verify(checker, never()).release(any());
    }

    @Test
    void replaced_username_is_released_after_commit() {
      final UserAccount named =
          new UserAccount(UserId.random(), new UserAccount.Profile(Username.of("bob"), 1), 1);
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));
      when(store.commit(any(), anyLong(), anyLong(), anyList())).thenReturn(Outcome.unit());

      final Outcome<AccountSummary> outcome = claimUsername.claim(named, "alice");

      assertEquals("alice", outcome.get().username());
      verify(checker).release(UniquenessClaim.of("users", "username", Username.of("bob")));
      verify(checker, never()).release(ALICE);
    }

    @Test
    void commit_conflict_is_reported_and_events_are_not_redelivered() {
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));
      when(store.commit(any(), anyLong(), anyLong(), anyList()))
          .thenReturn(
              Outcome.failure(
                  new ConcurrencyConflictError(account.identity().asString(), 0, 1)));

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(ErrorKind.CONCURRENCY_CONFLICT, outcome.error().kind());
      assertTrue(account.pullUncommittedEvents().isEmpty());
      verify(checker).release(ALICE);
      assertEquals(1, account.version());
      assertEquals(0, account.committedVersion());
      assertEquals("alice", account.username().value());
    }
  }

  @Nested
  class Failures {
    @Test
    void malformed_candidate_touches_nothing() {
      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "a");

      assertEquals(ErrorKind.VALIDATION, outcome.error().kind());
      assertEquals("value", ((ValidationError) outcome.error()).component());
      verifyNoInteractions(checker, store);
    }

    @Test
    void unavailable_checker_is_reported_unchanged() {
      final UnavailableError unavailable = new UnavailableError("users", "username", "timeout");
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.failure(unavailable));

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(unavailable, outcome.error());
      assertEquals(0, account.version());
      verifyNoInteractions(store);
    }

    @Test
    void throwing_checker_is_reported_as_unavailable() {
      when(checker.exists(any(UniquenessClaim.class)))
          .thenThrow(new IllegalStateException("connection refused"));

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(
          new UnavailableError("users", "username", "connection refused"), outcome.error());
      assertEquals(0, account.version());
      verifyNoInteractions(store);
    }

    @Test
    void rejected_change_releases_the_reservation() {
      final UserAccount exhausted =
          new UserAccount(
              UserId.random(),
              new UserAccount.Profile(Username.of("bob"), UserAccount.MAX_USERNAME_CHANGES),
              3);
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));

      final Outcome<AccountSummary> outcome = claimUsername.claim(exhausted, "alice");

      assertEquals(UserAccount.CHANGE_LIMIT, outcome.error().subject());
      assertEquals(3, exhausted.version());
      assertEquals("bob", exhausted.username().value());
      verify(checker).release(ALICE);
      verifyNoInteractions(store);
    }

    @Test
    void throwing_store_is_reported_as_storage_error() {
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));
      when(store.commit(any(), anyLong(), anyLong(), anyList()))
          .thenThrow(new IllegalStateException("disk full"));

      final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

      assertEquals(ErrorKind.STORAGE, outcome.error().kind());
      verify(checker).release(ALICE);
      assertEquals(account.identity().asString(), outcome.error().subject());
      assertTrue(account.uncommittedEvents().isEmpty());
      assertTrue(account.hasUncommittedChanges());
    }
  }

  @Nested
  class ByIdentity {
    @Test
    void claim_by_identity_needs_a_source() {
      final UserId identity = account.identity();

      assertThrows(
          UnsupportedOperationException.class, () -> claimUsername.claim(identity, "alice"));
    }

    @Test
    void missing_aggregate_is_reported_without_lookup() {
      final ClaimUsername withSource =
          new ClaimUsername(
              checker,
              store,
              identity -> Outcome.failure(new NotFoundError("UserAccount", identity.asString())));

      final Outcome<AccountSummary> outcome = withSource.claim(account.identity(), "alice");

      assertEquals(ErrorKind.NOT_FOUND, outcome.error().kind());
      verifyNoInteractions(checker, store);
    }

    @Test
    void loaded_aggregate_is_claimed() {
      when(checker.exists(any(UniquenessClaim.class))).thenReturn(Outcome.success(false));
      when(store.commit(any(), anyLong(), anyLong(), anyList())).thenReturn(Outcome.unit());
      final ClaimUsername withSource =
          new ClaimUsername(checker, store, identity -> Outcome.success(account));

      final Outcome<AccountSummary> outcome = withSource.claim(account.identity(), "alice");

      assertEquals("alice", outcome.get().username());
      assertEquals(1, account.version());
    }
  }

  @Test
  void scope_and_field_are_exposed() {
    assertEquals("users", claimUsername.getScope());
    assertEquals("username", claimUsername.getField());
  }
}
