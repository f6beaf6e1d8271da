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

import java.io.Serializable;

/**
 * Structured reason of an expected domain failure carried by {@link Outcome.Failure}.
 *
 * <p>Every implementation names its {@link ErrorKind} and the offending element (component,
 * invariant or field), which is enough for a caller to render an actionable message.
 */
public sealed interface DomainError extends Serializable
    permits ValidationError,
        InvariantViolationError,
        AlreadyTaken,
        UnavailableError,
        ConcurrencyConflictError,
        StorageError,
        NotFoundError {

  /**
   * @return classification of this error
   */
  ErrorKind kind();

  /**
   * @return name of the element which caused the failure, such as a value component, an invariant
   *     or a unique field
   */
  String subject();

  /**
   * @return human-readable description, meant for logs rather than for branching
   */
  String message();
}
