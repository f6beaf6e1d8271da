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

import io.github.suppierk.kernel.aggregate.AggregateRoot;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.NotFoundError;
import io.github.suppierk.kernel.outcome.Outcome;

/**
 * Persistence collaborator providing aggregates to coordination procedures.
 *
 * @param <ID> type of the aggregate identity
 * @param <AGGREGATE> type of the aggregate
 */
@FunctionalInterface
@SuppressWarnings("squid:S119")
public interface AggregateSource<ID extends Identity<?>, AGGREGATE extends AggregateRoot<ID, ?>> {
  /**
   * @param identity of the aggregate to check out
   * @return a fresh instance owned by the caller, or {@link NotFoundError}
   */
  Outcome<AGGREGATE> load(ID identity);
}
