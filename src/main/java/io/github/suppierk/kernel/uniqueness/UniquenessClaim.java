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

package io.github.suppierk.kernel.uniqueness;

import io.github.suppierk.kernel.value.Components;
import io.github.suppierk.kernel.value.ValueObject;
import io.github.suppierk.kernel.value.Values;
import java.io.Serial;
import java.lang.reflect.Array;
import java.util.StringJoiner;

/**
 * Request to verify that a candidate value does not exist yet within a named scope, for example
 * {@code ("users", "username", Username("alice"))}.
 *
 * <p>Claims are passed to a {@link UniquenessChecker} and never stored by the kernel.
 */
public final class UniquenessClaim extends ValueObject {
  @Serial private static final long serialVersionUID = 5573014617622381095L;

  private static final String KEY_DELIMITER = "|";
  private static final String NULL_LEAF = "-";

  private final String scope;
  private final String field;
  private final ValueObject candidate;

  private UniquenessClaim(String scope, String field, ValueObject candidate) {
    this.scope = scope;
    this.field = field;
    this.candidate = candidate;
  }

  /**
   * @param scope within which the candidate must be unique
   * @param field holding the candidate
   * @param candidate value to verify
   * @return a new claim
   * @throws io.github.suppierk.kernel.value.ValidationException if any component is missing
   */
  public static UniquenessClaim of(String scope, String field, ValueObject candidate) {
    return new UniquenessClaim(
        Values.requireNonBlank(scope, UniquenessClaim.class, "scope"),
        Values.requireNonBlank(field, UniquenessClaim.class, "field"),
        Values.requireNonNull(candidate, UniquenessClaim.class, "candidate"));
  }

  public String scope() {
    return scope;
  }

  public String field() {
    return field;
  }

  public ValueObject candidate() {
    return candidate;
  }

  /**
   * Canonical text of the candidate, suitable for indexed lookups. Two candidates share a key only
   * when they have the same leaf components in the same nesting.
   *
   * <p>Components are encoded in declaration order and joined with {@code |}:
   *
   * <ul>
   *   <li>a leaf as its length, a colon and its text, so {@code "a|b"} becomes {@code 3:a|b};
   *   <li>a {@code null} leaf as {@code -};
   *   <li>a nested value as its encoded components within {@code [ ]};
   *   <li>an array as its encoded elements within {@code ( )}.
   * </ul>
   *
   * @return canonical candidate key
   */
  public String candidateKey() {
    final StringJoiner joiner = new StringJoiner(KEY_DELIMITER);
    for (Object component : candidate.describe().values()) {
      joiner.add(encode(component));
    }
    return joiner.toString();
  }

  /**
   * Human-readable rendering of the candidate for error messages: the leaf components joined with
   * {@code |}. Unlike {@link #candidateKey()} it is not guaranteed to be unique.
   *
   * @return candidate text
   */
  public String candidateText() {
    final StringJoiner joiner = new StringJoiner(KEY_DELIMITER);
    flatten(candidate, joiner);
    return joiner.toString();
  }

  private static String encode(Object value) {
    if (value == null) {
      return NULL_LEAF;
    }

    if (value instanceof ValueObject nested) {
      final StringJoiner joiner = new StringJoiner(KEY_DELIMITER, "[", "]");
      for (Object component : nested.describe().values()) {
        joiner.add(encode(component));
      }
      return joiner.toString();
    }

    if (value.getClass().isArray()) {
      final StringJoiner joiner = new StringJoiner(KEY_DELIMITER, "(", ")");
      for (int i = 0; i < Array.getLength(value); i++) {
        joiner.add(encode(Array.get(value, i)));
      }
      return joiner.toString();
    }

    final String text = value.toString();
    return text.length() + ":" + text;
  }

  private static void flatten(Object value, StringJoiner joiner) {
    if (value instanceof ValueObject nested) {
      for (Object component : nested.describe().values()) {
        flatten(component, joiner);
      }
    } else {
      joiner.add(String.valueOf(value));
    }
  }

  @Override
  protected Components components() {
    return Components.of("scope", scope).and("field", field).and("candidate", candidate);
  }
}
