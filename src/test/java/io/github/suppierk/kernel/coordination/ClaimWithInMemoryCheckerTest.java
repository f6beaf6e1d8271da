package io.github.suppierk.kernel.coordination;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.kernel.aggregate.DomainEvent;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.ConcurrencyConflictError;
import io.github.suppierk.kernel.outcome.ErrorKind;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.Unit;
import io.github.suppierk.kernel.uniqueness.InMemoryUniquenessChecker;
import io.github.suppierk.kernel.uniqueness.UniquenessClaim;
import io.github.suppierk.test.AccountSummary;
import io.github.suppierk.test.ClaimUsername;
import io.github.suppierk.test.UserAccount;
import io.github.suppierk.test.UserId;
import io.github.suppierk.test.Username;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClaimWithInMemoryCheckerTest {
  InMemoryUniquenessChecker checker;
  VersionedStore store;
  ClaimUsername claimUsername;

  @BeforeEach
  void setUp() {
    checker = new InMemoryUniquenessChecker();
    store = new VersionedStore();
    claimUsername = new ClaimUsername(checker, store);
  }

  @Test
  void second_account_cannot_claim_the_same_username() {
    final UserAccount first = new UserAccount(UserId.random());
    final UserAccount second = new UserAccount(UserId.random());

    assertTrue(claimUsername.claim(first, "alice").isSuccess());
    final Outcome<AccountSummary> outcome = claimUsername.claim(second, " Alice ");

    assertEquals(ErrorKind.ALREADY_TAKEN, outcome.error().kind());
    assertEquals(0, second.version());
    assertEquals(1, store.events.size());
  }

  @Test
  void consecutive_claims_keep_versions_in_sync() {
    final UserAccount account = new UserAccount(UserId.random());

    claimUsername.claim(account, "alice");
    final Outcome<AccountSummary> outcome = claimUsername.claim(account, "bob");

    assertEquals(2, outcome.get().version());
    assertEquals(2L, store.versions.get(account.identity()));
    assertEquals(
        List.of(Username.of("alice"), Username.of("bob")),
        store.events.stream().map(DomainEvent::payload).toList());
  }

  @Test
  void banned_username_never_reserves_anything() {
    final UserAccount account = new UserAccount(UserId.random());

    claimUsername.claim(account, "root");

    assertFalse(
        checker.contains(
            UniquenessClaim.of(ClaimUsername.SCOPE, ClaimUsername.FIELD, Username.of("root"))));
  }

  @Test
  void stale_copy_of_an_aggregate_gets_a_conflict() {
    final UserId identity = UserId.random();
    final UserAccount current = new UserAccount(identity);
    final UserAccount stale = new UserAccount(identity);
    claimUsername.claim(current, "alice");

    final Outcome<AccountSummary> outcome = claimUsername.claim(stale, "bob");

    assertEquals(new ConcurrencyConflictError(identity.asString(), 0, 1), outcome.error());
    assertTrue(stale.pullUncommittedEvents().isEmpty());
  }

  @Test
  void retry_after_a_conflict_can_claim_the_same_username() {
    final UserId identity = UserId.random();
    store.versions.put(identity, 5L);
    final UserAccount stale = new UserAccount(identity);

    final Outcome<AccountSummary> conflict = claimUsername.claim(stale, "alice");
    final UserAccount reloaded =
        new UserAccount(identity, new UserAccount.Profile(null, 0), store.versions.get(identity));
    final Outcome<AccountSummary> retry = claimUsername.claim(reloaded, "alice");

    assertEquals(ErrorKind.CONCURRENCY_CONFLICT, conflict.error().kind());
    assertEquals(new AccountSummary(identity, "alice", 6), retry.get());
    assertEquals(6L, store.versions.get(identity));
  }

  @Test
  void renamed_account_frees_its_old_username() {
    final UserAccount first = new UserAccount(UserId.random());
    final UserAccount second = new UserAccount(UserId.random());
    claimUsername.claim(first, "alice");
    claimUsername.claim(first, "bob");

    final Outcome<AccountSummary> outcome = claimUsername.claim(second, "alice");

    assertEquals("alice", outcome.get().username());
    assertTrue(
        checker.contains(
            UniquenessClaim.of(ClaimUsername.SCOPE, ClaimUsername.FIELD, Username.of("bob"))));
  }

  @Test
  void claiming_the_held_username_again_is_taken() {
    final UserAccount account = new UserAccount(UserId.random());
    claimUsername.claim(account, "alice");

    final Outcome<AccountSummary> outcome = claimUsername.claim(account, "alice");

    assertEquals(ErrorKind.ALREADY_TAKEN, outcome.error().kind());
    assertTrue(
        checker.contains(
            UniquenessClaim.of(ClaimUsername.SCOPE, ClaimUsername.FIELD, Username.of("alice"))));
  }

  static final class VersionedStore implements AggregateStore {
    final Map<Identity<?>, Long> versions = new HashMap<>();
    final List<DomainEvent> events = new ArrayList<>();

    @Override
    public Outcome<Unit> commit(
        Identity<?> identity, long expectedVersion, long newVersion, List<DomainEvent> produced) {
      final long actual = versions.getOrDefault(identity, 0L);
      if (actual != expectedVersion) {
        return Outcome.failure(
            new ConcurrencyConflictError(identity.asString(), expectedVersion, actual));
      }

      versions.put(identity, newVersion);
      events.addAll(produced);
      return Outcome.unit();
    }
  }
}
