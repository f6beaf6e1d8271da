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
 * A value could not be built because one of its components is malformed.
 *
 * @param valueType simple name of the value class being constructed
 * @param component name of the rejected component
 * @param reason why the component was rejected
 */
public record ValidationError(String valueType, String component, String reason)
    implements DomainError {
  public ValidationError {
    throwIllegalArgumentIfBlank(valueType, "Value type");
    throwIllegalArgumentIfBlank(component, "Component");
    throwIllegalArgumentIfBlank(reason, "Reason");
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.VALIDATION;
  }

  @Override
  public String subject() {
    return component;
  }

  @Override
  public String message() {
    return "%s.%s is invalid: %s".formatted(valueType, component, reason);
  }
}
