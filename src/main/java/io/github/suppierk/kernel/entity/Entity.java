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

package io.github.suppierk.kernel.entity;

/**
 * Object defined by a stable {@link Identity} rather than by its attributes.
 *
 * <p>Equality and hashing rely <b>solely</b> on the identity: a stale in-memory copy and a freshly
 * loaded copy of the same entity are equal even if their attributes differ.
 *
 * <p>The identity is assigned exactly once, at construction. Subclasses must not expose settable
 * fields - attributes change only through named operations.
 *
 * @param <ID> type of the identity
 */
public abstract class Entity<ID extends Identity<?>> {
  private final ID identity;

  /**
   * @param identity of this entity
   * @throws InvalidIdentityException if identity is {@code null}
   */
  protected Entity(final ID identity) {
    if (identity == null) {
      throw new InvalidIdentityException(
          "%s identity cannot be null".formatted(getClass().getSimpleName()));
    }

    this.identity = identity;
  }

  /**
   * @return identity assigned at construction
   */
  public final ID identity() {
    return identity;
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Entity<?> that)) return false;

    return identity.equals(that.identity);
  }

  @Override
  public final int hashCode() {
    return identity.hashCode();
  }

  @Override
  public String toString() {
    return "%s[identity=%s]".formatted(getClass().getSimpleName(), identity.asString());
  }
}
