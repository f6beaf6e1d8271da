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

import java.util.List;

/**
 * An aggregate change was rolled back because the resulting state broke declared invariants.
 *
 * @param aggregateType simple name of the aggregate class
 * @param invariants names of the violated invariants in declaration order, never empty
 */
public record InvariantViolationError(String aggregateType, List<String> invariants)
    implements DomainError {
  public InvariantViolationError {
    throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    invariants = List.copyOf(throwIllegalArgumentIfNull(invariants, "Invariants"));
    if (invariants.isEmpty()) {
      throw new IllegalArgumentException("Invariants cannot be empty");
    }
  }

  /**
   * Shortcut for a single violated invariant.
   *
   * @param aggregateType simple name of the aggregate class
   * @param invariant name of the violated invariant
   * @return a new error instance
   */
  public static InvariantViolationError of(String aggregateType, String invariant) {
    return new InvariantViolationError(aggregateType, List.of(invariant));
  }

  /**
   * @return the first violated invariant
   */
  public String invariant() {
    return invariants.get(0);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.INVARIANT_VIOLATION;
  }

  @Override
  public String subject() {
    return invariant();
  }

  @Override
  public String message() {
    return "%s rejected the change, violated: %s"
        .formatted(aggregateType, String.join(", ", invariants));
  }
}
