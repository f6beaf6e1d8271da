package io.github.suppierk.test;

import io.github.suppierk.kernel.value.Components;
import io.github.suppierk.kernel.value.ValueObject;
import io.github.suppierk.kernel.value.Values;
import java.io.Serial;
import java.util.Locale;
import java.util.regex.Pattern;

/** Normalized, lower case user name for tests. */
public final class Username extends ValueObject {
  @Serial private static final long serialVersionUID = -6601298765432458170L;

  private static final Pattern ALLOWED = Pattern.compile("[a-z0-9_]{3,32}");

  private final String value;

  private Username(String value) {
    this.value = value;
  }

  public static Username of(String raw) {
    final String normalized =
        Values.requireNonBlank(raw, Username.class, "value").strip().toLowerCase(Locale.ROOT);
    Values.requireThat(
        ALLOWED.matcher(normalized).matches(),
        Username.class,
        "value",
        "must be 3 to 32 letters, digits or underscores");
    return new Username(normalized);
  }

  public String value() {
    return value;
  }

  @Override
  protected Components components() {
    return Components.of("value", value);
  }
}
