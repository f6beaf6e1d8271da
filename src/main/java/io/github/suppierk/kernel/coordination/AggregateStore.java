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

package io.github.suppierk.kernel.coordination;

import io.github.suppierk.kernel.aggregate.DomainEvent;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.ConcurrencyConflictError;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.StorageError;
import io.github.suppierk.kernel.outcome.Unit;
import java.util.List;

/**
 * Persistence collaborator accepting the changes of an aggregate.
 *
 * <p>Implementations own the optimistic concurrency check: the commit is accepted only if the
 * stored version equals {@code expectedVersion}, in which case the stored version becomes {@code
 * newVersion}. The kernel never retries - callers reload the aggregate and repeat the operation.
 */
@FunctionalInterface
public interface AggregateStore {
  /**
   * @param identity of the aggregate
   * @param expectedVersion the changes are based on, as in {@code committedVersion()}
   * @param newVersion of the aggregate after the changes
   * @param events produced by the changes, in production order
   * @return {@link Unit} on success, {@link ConcurrencyConflictError} on version mismatch or
   *     {@link StorageError} on any other failure
   */
  Outcome<Unit> commit(
      Identity<?> identity, long expectedVersion, long newVersion, List<DomainEvent> events);
}
