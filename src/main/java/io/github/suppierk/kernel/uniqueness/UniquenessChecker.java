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

import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.UnavailableError;
import io.github.suppierk.kernel.value.ValueObject;

/**
 * Capability answering whether a candidate value already exists within a scope.
 *
 * <p>This is the only I/O-capable collaborator of the uniqueness flow and the single designated
 * suspension point: it is consulted by the coordination layer before an aggregate operation runs,
 * and it is never constructed by or passed into an aggregate.
 *
 * <p>Implementations backing concurrent callers must provide check-then-reserve semantics: two
 * concurrent claims for the same candidate in the same scope must not both be answered {@code
 * false}.
 */
@FunctionalInterface
public interface UniquenessChecker {
  /**
   * @param claim to verify
   * @return {@code true} if the candidate exists, {@code false} if it is free (and, for reserving
   *     implementations, now reserved), or {@link UnavailableError} if no definitive answer could
   *     be given
   */
  Outcome<Boolean> exists(UniquenessClaim claim);

  /**
   * Shortcut for {@link #exists(UniquenessClaim)}.
   *
   * @param scope within which the candidate must be unique
   * @param field holding the candidate
   * @param candidate value to verify
   * @return same as {@link #exists(UniquenessClaim)}
   */
  default Outcome<Boolean> exists(String scope, String field, ValueObject candidate) {
    return exists(UniquenessClaim.of(scope, field, candidate));
  }

  /**
   * Frees a candidate reserved by a previous {@code false} answer which ended up unused.
   *
   * @param claim previously answered with {@code false}
   */
  default void release(UniquenessClaim claim) {
    // Nothing is reserved by default
  }
}
