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

/**
 * The uniqueness collaborator could not answer, which is different from a definitive yes or no.
 *
 * @param scope of the attempted check
 * @param field of the attempted check
 * @param reason why the answer is missing
 */
public record UnavailableError(String scope, String field, String reason) implements DomainError {
  public UnavailableError {
    throwIllegalArgumentIfBlank(scope, "Scope");
    throwIllegalArgumentIfBlank(field, "Field");
    throwIllegalArgumentIfBlank(reason, "Reason");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.UNAVAILABLE;
  }

  @Override
  public String subject() {
    return field;
  }

  @Override
  public String message() {
    return "Cannot verify uniqueness of %s in %s: %s".formatted(field, scope, reason);
  }
}
