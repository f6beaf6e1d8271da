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
 * The persistence collaborator failed to store a change.
 *
 * @param aggregateId string form of the aggregate identity
 * @param reason of the failure
 */
public record StorageError(String aggregateId, String reason) implements DomainError {
  public StorageError {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfBlank(reason, "Reason");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.STORAGE;
  }

  @Override
  public String subject() {
    return aggregateId;
  }

  @Override
  public String message() {
    return "Cannot store aggregate %s: %s".formatted(aggregateId, reason);
  }
}
