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

import java.io.Serial;
import java.util.UUID;
import java.util.function.Function;

/**
 * {@link Identity} backed by a {@link UUID}.
 *
 * <p>Subclasses usually expose a {@code random()} factory built on {@link #randomToken()} and a
 * parsing factory built on {@link #parse(String, Function)}.
 */
public abstract class UuidIdentity extends Identity<UUID> {
  @Serial private static final long serialVersionUID = -2716873260512948063L;

  /**
   * @param token uniquely identifying the entity within its kind
   * @throws InvalidIdentityException if the token is {@code null}
   */
  protected UuidIdentity(final UUID token) {
    super(token);
  }

  /**
   * @return freshly generated random token
   */
  protected static UUID randomToken() {
    return UUID.randomUUID();
  }

  /**
   * @param text canonical UUID representation
   * @param factory creating the concrete identity
   * @param <ID> type of the concrete identity
   * @return identity wrapping the parsed token
   * @throws InvalidIdentityException if the text is not a UUID
   */
  @SuppressWarnings("squid:S119")
  protected static <ID extends UuidIdentity> ID parse(
      final String text, final Function<UUID, ID> factory) {
    if (text == null || text.isBlank()) {
      throw new InvalidIdentityException("UUID token cannot be blank");
    }

    final UUID token;
    try {
      token = UUID.fromString(text.strip());
    } catch (IllegalArgumentException e) {
      throw new InvalidIdentityException("'%s' is not a UUID".formatted(text), e);
    }

    return factory.apply(token);
  }
}
