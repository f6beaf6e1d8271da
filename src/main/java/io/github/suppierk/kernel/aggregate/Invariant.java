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

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;

import java.util.function.Predicate;

/**
 * Named predicate which must hold for every state of an {@link AggregateRoot}.
 *
 * <p>The name is the reason code reported through {@link
 * io.github.suppierk.kernel.outcome.InvariantViolationError}, so it must stay stable.
 *
 * @param name stable reason code, for example {@code bannedTerm}
 * @param predicate returning {@code true} when the state is valid
 * @param <STATE> type of the aggregate state
 */
@SuppressWarnings("squid:S119")
public record Invariant<STATE>(String name, Predicate<? super STATE> predicate) {
  public Invariant {
    throwIllegalArgumentIfBlank(name, "Invariant name");
    throwIllegalArgumentIfNull(predicate, "Invariant predicate");
  }

  /**
   * @param name stable reason code
   * @param predicate returning {@code true} when the state is valid
   * @param <STATE> type of the aggregate state
   * @return a new invariant
   */
  public static <STATE> Invariant<STATE> of(String name, Predicate<? super STATE> predicate) {
    return new Invariant<>(name, predicate);
  }

  /**
   * @param state to evaluate
   * @return {@code true} if the state satisfies this invariant
   */
  public boolean holdsFor(STATE state) {
    return predicate.test(state);
  }
}
