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

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of an operation which can fail for an expected domain reason.
 *
 * <p>Expected failures are values, not exceptions: every kernel operation which can be rejected by
 * a business rule or by an external collaborator returns either {@link Success} or {@link Failure}
 * carrying a structured {@link DomainError}.
 *
 * @param <T> type of the successful result
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {
  /**
   * @param value of the successful operation
   * @param <T> type of the value
   * @return a new {@link Success}
   * @throws IllegalArgumentException if value is {@code null}
   */
  static <T> Outcome<T> success(T value) {
    return new Success<>(value);
  }

  /**
   * @return a {@link Success} without a meaningful value
   */
  static Outcome<Unit> unit() {
    return new Success<>(Unit.INSTANCE);
  }

  /**
   * @param error describing the failure
   * @param <T> type of the value the operation would have produced
   * @return a new {@link Failure}
   * @throws IllegalArgumentException if error is {@code null}
   */
  static <T> Outcome<T> failure(DomainError error) {
    return new Failure<>(error);
  }

  /**
   * @return {@code true} if this is a {@link Success}
   */
  boolean isSuccess();

  /**
   * @return {@code true} if this is a {@link Failure}
   */
  default boolean isFailure() {
    return !isSuccess();
  }

  /**
   * @return the successful value
   * @throws IllegalStateException if this is a {@link Failure}
   */
  T get();

  /**
   * @return the failure reason
   * @throws IllegalStateException if this is a {@link Success}
   */
  DomainError error();

  /**
   * @param mapper to transform the successful value with
   * @param <R> type of the transformed value
   * @return transformed {@link Success} or this {@link Failure}
   */
  <R> Outcome<R> map(Function<? super T, ? extends R> mapper);

  /**
   * @param mapper producing the next {@link Outcome}
   * @param <R> type of the next value
   * @return the next {@link Outcome} or this {@link Failure}
   */
  <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper);

  /**
   * @param onSuccess to apply to the value
   * @param onFailure to apply to the error
   * @param <R> type of the result
   * @return result of the matching function
   */
  <R> R fold(
      Function<? super T, ? extends R> onSuccess, Function<DomainError, ? extends R> onFailure);

  /**
   * @param fallback to return when this is a {@link Failure}
   * @return the successful value or the fallback
   */
  default T orElse(T fallback) {
    return fold(Function.identity(), error -> fallback);
  }

  /**
   * @param action to run with the value if this is a {@link Success}
   * @return this instance
   */
  default Outcome<T> ifSuccess(Consumer<? super T> action) {
    throwIllegalArgumentIfNull(action, "Success action");
    if (isSuccess()) {
      action.accept(get());
    }
    return this;
  }

  /**
   * @param action to run with the error if this is a {@link Failure}
   * @return this instance
   */
  default Outcome<T> ifFailure(Consumer<DomainError> action) {
    throwIllegalArgumentIfNull(action, "Failure action");
    if (isFailure()) {
      action.accept(error());
    }
    return this;
  }

  /**
   * Successful {@link Outcome}.
   *
   * @param value produced by the operation
   * @param <T> type of the value
   */
  record Success<T>(T value) implements Outcome<T> {
    public Success {
      throwIllegalArgumentIfNull(value, "Success value");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public DomainError error() {
      throw new IllegalStateException("Successful outcome has no error");
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
      throwIllegalArgumentIfNull(mapper, "Mapper");
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
      throwIllegalArgumentIfNull(mapper, "Mapper");
      return throwIllegalStateIfNull(mapper.apply(value), "Mapped outcome");
    }

    @Override
    public <R> R fold(
        Function<? super T, ? extends R> onSuccess, Function<DomainError, ? extends R> onFailure) {
      return throwIllegalArgumentIfNull(onSuccess, "Success function").apply(value);
    }
  }

  /**
   * Failed {@link Outcome}.
   *
   * @param reason of the failure
   * @param <T> type of the value the operation would have produced
   */
  record Failure<T>(DomainError reason) implements Outcome<T> {
    public Failure {
      throwIllegalArgumentIfNull(reason, "Failure reason");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T get() {
      throw new IllegalStateException(
          "Failed outcome has no value: %s".formatted(reason.message()));
    }

    @Override
    public DomainError error() {
      return reason;
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
      return new Failure<>(reason);
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
      return new Failure<>(reason);
    }

    @Override
    public <R> R fold(
        Function<? super T, ? extends R> onSuccess, Function<DomainError, ? extends R> onFailure) {
      return throwIllegalArgumentIfNull(onFailure, "Failure function").apply(reason);
    }
  }
}
