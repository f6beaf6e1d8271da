package io.github.suppierk.test;

import io.github.suppierk.kernel.aggregate.AggregateRoot;
import io.github.suppierk.kernel.aggregate.Change;
import io.github.suppierk.kernel.aggregate.Invariant;
import io.github.suppierk.kernel.outcome.InvariantViolationError;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.Unit;
import java.util.List;
import java.util.Set;

/** Aggregate owning a user name for tests. */
public final class UserAccount extends AggregateRoot<UserId, UserAccount.Profile> {
  public static final String BANNED_TERM = "bannedTerm";
  public static final String CHANGE_LIMIT = "changeLimit";
  public static final String USERNAME_SET = "UsernameSet";
  public static final int MAX_USERNAME_CHANGES = 3;

  private static final Set<String> BANNED = Set.of("admin", "root", "system");

  public UserAccount(UserId identity) {
    super(identity, new Profile(null, 0));
  }

  public UserAccount(UserId identity, Profile profile, long version) {
    super(identity, profile, version);
  }

  @Override
  protected List<Invariant<Profile>> invariants() {
    return List.of(
        Invariant.of(
            BANNED_TERM, profile -> profile.username() == null || !isBanned(profile.username())),
        Invariant.of(CHANGE_LIMIT, profile -> profile.usernameChanges() <= MAX_USERNAME_CHANGES));
  }

  public Outcome<Unit> checkUsername(Username candidate) {
    if (isBanned(candidate)) {
      return Outcome.failure(InvariantViolationError.of(getClass().getSimpleName(), BANNED_TERM));
    }

    return Outcome.unit();
  }

  public Outcome<Unit> setUsername(Username username) {
    return mutate(
        current ->
            Outcome.success(
                Change.to(new Profile(username, current.usernameChanges() + 1))
                    .withEvent(USERNAME_SET, username)));
  }

  public Username username() {
    return state().username();
  }

  private static boolean isBanned(Username username) {
    return BANNED.contains(username.value());
  }

  public record Profile(Username username, int usernameChanges) {}
}
