package io.github.suppierk.test;

/** What the user name claim reports back to callers in tests. */
public record AccountSummary(UserId identity, String username, long version) {}
