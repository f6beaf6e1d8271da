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

import io.github.suppierk.kernel.value.ValueObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Candidate result of a {@link Mutation}: the next aggregate state and the events describing the
 * transition.
 *
 * <p>Events are recorded only as type and payload - identity, version and position are stamped by
 * {@link AggregateRoot} once the invariants accept the new state.
 *
 * @param state candidate state, replacing the current one if all invariants hold
 * @param emissions events the transition produces, in production order
 * @param <STATE> type of the aggregate state
 */
@SuppressWarnings("squid:S119")
public record Change<STATE>(STATE state, List<Emission> emissions) {
  public Change {
    throwIllegalArgumentIfNull(state, "Changed state");
    emissions = List.copyOf(throwIllegalArgumentIfNull(emissions, "Emissions"));
  }

  /**
   * @param state candidate state
   * @param <STATE> type of the aggregate state
   * @return a change without events
   */
  public static <STATE> Change<STATE> to(STATE state) {
    return new Change<>(state, List.of());
  }

  /**
   * @param type event type tag, for example {@code UsernameSet}
   * @param payload of the event
   * @return a new change with the event appended
   */
  public Change<STATE> withEvent(String type, ValueObject payload) {
    final List<Emission> next = new ArrayList<>(emissions);
    next.add(new Emission(type, payload));
    return new Change<>(state, next);
  }

  /**
   * Unstamped event.
   *
   * @param type event type tag
   * @param payload of the event
   */
  public record Emission(String type, ValueObject payload) {
    public Emission {
      throwIllegalArgumentIfBlank(type, "Event type");
      throwIllegalArgumentIfNull(payload, "Event payload");
    }
  }
}
