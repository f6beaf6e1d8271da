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

package io.github.suppierk.kernel.aggregate;

import io.github.suppierk.kernel.outcome.Outcome;

/**
 * Attempted state transition of an {@link AggregateRoot}.
 *
 * <p>Implementations must be pure: compute the {@link Change} from the given state, or reject the
 * attempt with a failed {@link Outcome}, without touching anything else.
 *
 * @param <STATE> type of the aggregate state
 */
@FunctionalInterface
@SuppressWarnings("squid:S119")
public interface Mutation<STATE> {
  /**
   * @param current state of the aggregate
   * @return the candidate {@link Change} or a domain failure
   */
  Outcome<Change<STATE>> apply(STATE current);
}
