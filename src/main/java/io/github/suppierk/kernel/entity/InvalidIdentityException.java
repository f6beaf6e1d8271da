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

/**
 * Thrown when an {@link Entity} or an {@link Identity} is constructed without a usable identity.
 *
 * <p>This is a programming error, not an expected domain failure, so it is never converted into a
 * failed {@link io.github.suppierk.kernel.outcome.Outcome}.
 */
public class InvalidIdentityException extends RuntimeException {
  @Serial private static final long serialVersionUID = -6893374217452904921L;

  /**
   * Constructs a new runtime exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public InvalidIdentityException(String message) {
    super(message);
  }

  /**
   * Constructs a new runtime exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public InvalidIdentityException(String message, Throwable cause) {
    super(message, cause);
  }
}
