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

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.value.Components;
import io.github.suppierk.kernel.value.ValueObject;
import io.github.suppierk.kernel.value.Values;
import java.io.Serial;
import java.util.Comparator;

/**
 * Immutable record of a fact which occurred to an aggregate.
 *
 * <p>The logical sequence position of an event is the pair of {@link #aggregateVersion()} - the
 * version produced by the mutation which emitted it - and {@link #position()} within that
 * mutation's batch. Events are ordered by this pair, then by the aggregate identity class and
 * value, then by type, so events of different aggregates sharing a slot never compare as equal.
 * Events of one aggregate with the same version, position and type compare as equal even when
 * their payloads differ; an aggregate never emits two events into one slot.
 */
public final class DomainEvent extends ValueObject implements Comparable<DomainEvent> {
  @Serial private static final long serialVersionUID = -1838254036318457405L;

  private static final Comparator<DomainEvent> SEQUENCE =
      Comparator.comparingLong(DomainEvent::aggregateVersion)
          .thenComparingInt(DomainEvent::position)
          .thenComparing(event -> event.aggregateId().getClass().getName())
          .thenComparing(event -> event.aggregateId().asString())
          .thenComparing(DomainEvent::type);

  private final Identity<?> aggregateId;
  private final String type;
  private final ValueObject payload;
  private final long aggregateVersion;
  private final int position;

  private DomainEvent(
      Identity<?> aggregateId,
      String type,
      ValueObject payload,
      long aggregateVersion,
      int position) {
    this.aggregateId = aggregateId;
    this.type = type;
    this.payload = payload;
    this.aggregateVersion = aggregateVersion;
    this.position = position;
  }

  /**
   * @param aggregateId identity of the aggregate the event belongs to
   * @param type event type tag
   * @param payload of the event
   * @param aggregateVersion version produced by the emitting mutation, starting from 1
   * @param position 0-based position within the emitting mutation
   * @return a new event
   * @throws io.github.suppierk.kernel.value.ValidationException if any component is invalid
   */
  public static DomainEvent of(
      Identity<?> aggregateId,
      String type,
      ValueObject payload,
      long aggregateVersion,
      int position) {
    Values.requireNonNull(aggregateId, DomainEvent.class, "aggregateId");
    Values.requireNonBlank(type, DomainEvent.class, "type");
    Values.requireNonNull(payload, DomainEvent.class, "payload");
    Values.requireThat(
        aggregateVersion > 0, DomainEvent.class, "aggregateVersion", "must be positive");
    Values.requireThat(position >= 0, DomainEvent.class, "position", "cannot be negative");
    return new DomainEvent(aggregateId, type, payload, aggregateVersion, position);
  }

  public Identity<?> aggregateId() {
    return aggregateId;
  }

  public String type() {
    return type;
  }

  public ValueObject payload() {
    return payload;
  }

  /**
   * @param payloadType expected class of the payload
   * @param <P> type of the payload
   * @return payload cast to the expected class
   * @throws ClassCastException if the payload is of another class
   */
  public <P extends ValueObject> P payload(Class<P> payloadType) {
    return throwIllegalArgumentIfNull(payloadType, "Payload type").cast(payload);
  }

  public long aggregateVersion() {
    return aggregateVersion;
  }

  public int position() {
    return position;
  }

  @Override
  public int compareTo(DomainEvent other) {
    return SEQUENCE.compare(this, other);
  }

  @Override
  protected Components components() {
    return Components.of("aggregateId", aggregateId)
        .and("type", type)
        .and("payload", payload)
        .and("aggregateVersion", aggregateVersion)
        .and("position", position);
  }
}
