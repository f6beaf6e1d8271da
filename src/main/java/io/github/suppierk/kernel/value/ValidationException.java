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

package io.github.suppierk.kernel.value;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.kernel.outcome.ValidationError;
import java.io.Serial;

/**
 * Thrown by validating factories of {@link ValueObject}s when the input is malformed.
 *
 * <p>The exception never escapes the coordination boundary: {@link Values#attempt} turns it into a
 * failed {@link io.github.suppierk.kernel.outcome.Outcome}.
 */
public class ValidationException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2291046823107315370L;

  private final ValidationError error;

  /**
   * @param error describing the rejected component
   */
  public ValidationException(ValidationError error) {
    super(throwIllegalArgumentIfNull(error, "Validation error").message());
    this.error = error;
  }

  /**
   * @return structured description of the rejected component
   */
  public ValidationError getError() {
    return error;
  }
}
