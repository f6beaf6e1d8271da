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
 * Requested aggregate is not known to the source.
 *
 * @param aggregateType simple name of the requested aggregate class
 * @param aggregateId string form of the requested identity
 */
public record NotFoundError(String aggregateType, String aggregateId) implements DomainError {
  public NotFoundError {
    throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.NOT_FOUND;
  }

  @Override
  public String subject() {
    return aggregateId;
  }

  @Override
  public String message() {
    return "%s %s does not exist".formatted(aggregateType, aggregateId);
  }
}
