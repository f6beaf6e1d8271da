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

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;

/**
 * Stored aggregate version did not match the version the change was based on.
 *
 * <p>Callers are expected to reload the aggregate and repeat the whole operation.
 *
 * @param aggregateId string form of the aggregate identity
 * @param expectedVersion version the change was based on
 * @param actualVersion version found in the store
 */
public record ConcurrencyConflictError(String aggregateId, long expectedVersion, long actualVersion)
    implements DomainError {
  public ConcurrencyConflictError {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.CONCURRENCY_CONFLICT;
  }

  @Override
  public String subject() {
    return aggregateId;
  }

  @Override
  public String message() {
    return "Aggregate %s was expected at version %d but is at version %d"
        .formatted(aggregateId, expectedVersion, actualVersion);
  }
}
