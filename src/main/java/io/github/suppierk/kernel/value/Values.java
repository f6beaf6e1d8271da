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

import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.ValidationError;
import java.util.function.Supplier;

/** Validation helpers for {@link ValueObject} factories. */
public final class Values {
  private Values() {
    // Cannot be instantiated
  }

  /**
   * Runs a validating factory and captures {@link ValidationException} as a failed {@link
   * Outcome}.
   *
   * @param factory building a value
   * @param <V> type of the value
   * @return {@link Outcome} with the value or with the {@link ValidationError}
   */
  public static <V> Outcome<V> attempt(Supplier<V> factory) {
    throwIllegalArgumentIfNull(factory, "Value factory");
    try {
      return Outcome.success(factory.get());
    } catch (ValidationException e) {
      return Outcome.failure(e.getError());
    }
  }

  /**
   * @param valueType being constructed
   * @param component being validated
   * @param reason why the component is invalid
   * @return a new exception to throw
   */
  public static ValidationException invalid(Class<?> valueType, String component, String reason) {
    final String typeName = throwIllegalArgumentIfNull(valueType, "Value type").getSimpleName();
    return new ValidationException(new ValidationError(typeName, component, reason));
  }

  /**
   * @param condition which must hold
   * @param valueType being constructed
   * @param component being validated
   * @param reason reported when the condition does not hold
   * @throws ValidationException if condition is {@code false}
   */
  public static void requireThat(
      boolean condition, Class<?> valueType, String component, String reason) {
    if (!condition) {
      throw invalid(valueType, component, reason);
    }
  }

  /**
   * @param value to check
   * @param valueType being constructed
   * @param component being validated
   * @param <T> type of the component
   * @return value if it was not {@code null}
   * @throws ValidationException if value is {@code null}
   */
  public static <T> T requireNonNull(T value, Class<?> valueType, String component) {
    requireThat(value != null, valueType, component, "is required");
    return value;
  }

  /**
   * @param value to check
   * @param valueType being constructed
   * @param component being validated
   * @return value if it was not blank
   * @throws ValidationException if value is {@code null} or blank
   */
  public static String requireNonBlank(String value, Class<?> valueType, String component) {
    requireThat(value != null && !value.isBlank(), valueType, component, "cannot be blank");
    return value;
  }
}
