package io.github.suppierk.kernel.jooq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.kernel.outcome.ErrorKind;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.uniqueness.UniquenessClaim;
import io.github.suppierk.test.H2Database;
import io.github.suppierk.test.LineItem;
import io.github.suppierk.test.Money;
import io.github.suppierk.test.Username;
import java.util.ArrayList;
import java.util.List;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqUniquenessCheckerTest {
  static final DSLContext DSL_CONTEXT = H2Database.open("uniqueness");
  static final DslContextProvider DSL_CONTEXT_PROVIDER =
      DslContextProvider.dslContextIdentity(DSL_CONTEXT);
  static final Table<Record> UNIQUE_CLAIMS =
      DSL.table(DSL.name(JooqUniquenessChecker.DEFAULT_TABLE_NAME));

  static final UniquenessClaim ALICE =
      UniquenessClaim.of("users", "username", Username.of("alice"));

  JooqUniquenessChecker checker;

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.deleteFrom(UNIQUE_CLAIMS).execute();
    checker = new JooqUniquenessChecker(DSL_CONTEXT_PROVIDER);
  }

  @Nested
  class Lookup {
    @Test
    void free_candidate_is_reserved_by_the_first_lookup() {
      assertFalse(checker.exists(ALICE).get());
      assertTrue(checker.exists(ALICE).get());
      assertEquals(1, DSL_CONTEXT.fetchCount(UNIQUE_CLAIMS));
    }

    @Test
    void candidates_are_scoped_by_scope_and_field() {
      checker.exists(ALICE);

      assertFalse(checker.exists("admins", "username", Username.of("alice")).get());
      assertFalse(checker.exists("users", "nickname", Username.of("alice")).get());
      assertEquals(3, DSL_CONTEXT.fetchCount(UNIQUE_CLAIMS));
    }

    @Test
    void composite_candidates_are_stored_by_their_key() {
      checker.exists("catalog", "item", LineItem.of("sku-1", Money.of(100, "EUR")));

      final String key =
          DSL_CONTEXT
              .select(DSL.field(DSL.name("candidate_key"), String.class))
              .from(UNIQUE_CLAIMS)
              .fetchOne(0, String.class);

      assertEquals("5:sku-1|[3:100|3:EUR]", key);
    }

    @Test
    void scope_routes_the_lookup() {
      final List<String> routingKeys = new ArrayList<>();
      final JooqUniquenessChecker routed =
          new JooqUniquenessChecker(
              routingKey -> {
                routingKeys.add(routingKey);
                return DSL_CONTEXT;
              });

      routed.exists(ALICE);

      assertEquals(List.of("users"), routingKeys);
    }
  }

  @Nested
  class Release {
    @Test
    void released_candidate_becomes_free_again() {
      checker.exists(ALICE);

      checker.release(ALICE);

      assertEquals(0, DSL_CONTEXT.fetchCount(UNIQUE_CLAIMS));
      assertFalse(checker.exists(ALICE).get());
    }

    @Test
    void releasing_unknown_candidate_is_harmless() {
      checker.release(ALICE);

      assertEquals(0, DSL_CONTEXT.fetchCount(UNIQUE_CLAIMS));
    }
  }

  @Nested
  class Failures {
    @Test
    void unreachable_table_is_reported_as_unavailable() {
      final JooqUniquenessChecker broken =
          new JooqUniquenessChecker(DSL_CONTEXT_PROVIDER, "missing_claims");

      final Outcome<Boolean> outcome = broken.exists(ALICE);

      assertEquals(ErrorKind.UNAVAILABLE, outcome.error().kind());
      assertEquals("username", outcome.error().subject());
    }

    @Test
    void invalid_configuration_is_rejected() {
      assertThrows(IllegalArgumentException.class, () -> new JooqUniquenessChecker(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new JooqUniquenessChecker(DSL_CONTEXT_PROVIDER, " "));
    }
  }
}
