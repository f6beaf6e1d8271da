package io.github.suppierk.kernel.uniqueness;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.kernel.value.Components;
import io.github.suppierk.kernel.value.ValidationException;
import io.github.suppierk.kernel.value.ValueObject;
import io.github.suppierk.test.LineItem;
import io.github.suppierk.test.Money;
import io.github.suppierk.test.Username;
import java.io.Serial;
import org.junit.jupiter.api.Test;

class UniquenessClaimTest {
  @Test
  void claims_with_the_same_scope_field_and_candidate_are_equal() {
    assertEquals(
        UniquenessClaim.of("users", "username", Username.of("alice")),
        UniquenessClaim.of("users", "username", Username.of("Alice ")));
    assertNotEquals(
        UniquenessClaim.of("users", "username", Username.of("alice")),
        UniquenessClaim.of("admins", "username", Username.of("alice")));
  }

  @Test
  void candidate_key_encodes_nested_components() {
    assertEquals(
        "5:alice", UniquenessClaim.of("users", "username", Username.of("alice")).candidateKey());
    assertEquals(
        "5:sku-1|[3:100|3:EUR]",
        UniquenessClaim.of("catalog", "item", LineItem.of("sku-1", Money.of(100, "EUR")))
            .candidateKey());
  }

  @Test
  void candidate_key_keeps_delimiters_inside_components_apart() {
    final UniquenessClaim first = UniquenessClaim.of("people", "name", new FullName("a|b", "c"));
    final UniquenessClaim second = UniquenessClaim.of("people", "name", new FullName("a", "b|c"));

    assertNotEquals(first, second);
    assertNotEquals(first.candidateKey(), second.candidateKey());
    assertEquals("3:a|b|1:c", first.candidateKey());
  }

  @Test
  void candidate_key_tells_null_from_text() {
    final UniquenessClaim missing = UniquenessClaim.of("people", "name", new FullName(null, "c"));
    final UniquenessClaim literal =
        UniquenessClaim.of("people", "name", new FullName("null", "c"));

    assertNotEquals(missing.candidateKey(), literal.candidateKey());
    assertEquals("-|1:c", missing.candidateKey());
  }

  @Test
  void colliding_texts_are_different_candidates_for_a_checker() {
    final InMemoryUniquenessChecker checker = new InMemoryUniquenessChecker();

    assertFalse(checker.exists("people", "name", new FullName("a|b", "c")).get());
    assertFalse(checker.exists("people", "name", new FullName("a", "b|c")).get());
  }

  @Test
  void candidate_text_is_readable() {
    assertEquals(
        "sku-1|100|EUR",
        UniquenessClaim.of("catalog", "item", LineItem.of("sku-1", Money.of(100, "EUR")))
            .candidateText());
  }

  @Test
  void incomplete_claims_are_rejected() {
    final var scope =
        assertThrows(
            ValidationException.class,
            () -> UniquenessClaim.of(" ", "username", Username.of("alice")));
    final var candidate =
        assertThrows(
            ValidationException.class, () -> UniquenessClaim.of("users", "username", null));

    assertEquals("scope", scope.getError().component());
    assertEquals("candidate", candidate.getError().component());
  }

  static final class FullName extends ValueObject {
    @Serial private static final long serialVersionUID = 1L;

    private final String first;
    private final String last;

    FullName(String first, String last) {
      this.first = first;
      this.last = last;
    }

    @Override
    protected Components components() {
      return Components.of("first", first).and("last", last);
    }
  }
}
