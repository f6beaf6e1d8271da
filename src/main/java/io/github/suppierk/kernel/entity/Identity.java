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

import io.github.suppierk.kernel.value.Components;
import io.github.suppierk.kernel.value.ValueObject;
import java.io.Serial;
import java.io.Serializable;

/**
 * Typed, immutable wrapper around an opaque unique token.
 *
 * <p>The concrete subclass denotes the entity kind: a {@code UserId} and an {@code OrderId}
 * wrapping the same token are different identities, because {@link ValueObject} equality includes
 * the runtime class.
 *
 * <p>Tokens must not be {@code null}, and textual tokens must not be blank.
 *
 * @param <T> type of the token, typically {@link java.util.UUID}, {@link Long} or {@link String}
 */
public abstract class Identity<T extends Serializable> extends ValueObject {
  @Serial private static final long serialVersionUID = 3326741086120953347L;

  private final T token;

  /**
   * @param token uniquely identifying the entity within its kind
   * @throws InvalidIdentityException if the token is {@code null} or blank
   */
  protected Identity(final T token) {
    if (token == null) {
      throw new InvalidIdentityException(
          "%s token cannot be null".formatted(getClass().getSimpleName()));
    }

    if (token instanceof CharSequence text && text.toString().isBlank()) {
      throw new InvalidIdentityException(
          "%s token cannot be blank".formatted(getClass().getSimpleName()));
    }

    this.token = token;
  }

  /**
   * @return the underlying token
   */
  public final T token() {
    return token;
  }

  /**
   * @return token rendered as text, as used by stores and error reports
   */
  public String asString() {
    return String.valueOf(token);
  }

  @Override
  protected final Components components() {
    return Components.of("token", token);
  }
}
