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
import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;

/**
 * The candidate value already exists within its scope.
 *
 * @param scope of the uniqueness check, for example {@code users}
 * @param field which must be unique, for example {@code username}
 * @param candidate canonical form of the rejected value
 */
public record AlreadyTaken(String scope, String field, String candidate) implements DomainError {
  public AlreadyTaken {
    throwIllegalArgumentIfBlank(scope, "Scope");
    throwIllegalArgumentIfBlank(field, "Field");
    throwIllegalArgumentIfNull(candidate, "Candidate");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.ALREADY_TAKEN;
  }

  @Override
  public String subject() {
    return field;
  }

  @Override
  public String message() {
    return "%s '%s' is already taken in %s".formatted(field, candidate, scope);
  }
}
