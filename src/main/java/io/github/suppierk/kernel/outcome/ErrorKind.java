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

package io.github.suppierk.kernel.outcome;

/**
 * Stable classification of {@link DomainError}s, allowing callers to branch on the failure without
 * matching message text.
 */
public enum ErrorKind {
  /** A value could not be constructed from the given input. */
  VALIDATION,

  /** An aggregate rejected a change because one of its invariants would not hold. */
  INVARIANT_VIOLATION,

  /** A unique candidate value is already present in its scope. */
  ALREADY_TAKEN,

  /** The uniqueness collaborator could not give a definitive answer. */
  UNAVAILABLE,

  /** Stored aggregate version differs from the version the change was based on. */
  CONCURRENCY_CONFLICT,

  /** The persistence collaborator failed for a reason other than a version mismatch. */
  STORAGE,

  /** The requested aggregate does not exist. */
  NOT_FOUND;

  /**
   * @return {@code true} if the same call may succeed when repeated later without changing the
   *     input, {@code false} if the input itself has to change
   */
  public boolean isRetryable() {
    return this == UNAVAILABLE || this == CONCURRENCY_CONFLICT || this == STORAGE;
  }
}
