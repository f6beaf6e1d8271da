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

import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;

import java.io.Serial;
import java.io.Serializable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Base class for immutable objects which have no identity and are compared by their content.
 *
 * <p>Equality is derived explicitly from the runtime class and the ordered {@link Components}
 * returned by {@link #components()}:
 *
 * <ul>
 *   <li>Two values are equal only if their runtime classes are identical - two different value
 *       types holding coincidentally identical components are <b>not</b> equal.
 *   <li>Components are compared pairwise by name and value, recursively for nested values.
 *   <li>{@link #hashCode()} is derived from the same data and is therefore consistent with {@link
 *       #equals(Object)}.
 * </ul>
 *
 * <p>Immutability is verified structurally: the first construction of each subclass checks that
 * every instance field declared between the subclass and this class is {@code final}, otherwise
 * construction fails with {@link IllegalStateException}. Subclasses are expected to:
 *
 * <ul>
 *   <li>Keep constructors private and expose validating static factories which throw {@link
 *       ValidationException} (see {@link Values}).
 *   <li>Model "changes" as {@code withX(...)} factories which build a new validated instance.
 * </ul>
 */
public abstract class ValueObject implements Serializable {
  @Serial private static final long serialVersionUID = -4419164318004458121L;

  private static final ClassValue<Boolean> VERIFIED_TYPES =
      new ClassValue<>() {
        @Override
        protected Boolean computeValue(Class<?> type) {
          verifyImmutable(type);
          return Boolean.TRUE;
        }
      };

  /** Verifies the structural immutability of the concrete class, once per class. */
  protected ValueObject() {
    VERIFIED_TYPES.get(getClass());
  }

  /**
   * Defines the state of this value, in a stable order.
   *
   * <p>Implementations must only read {@code final} fields, so that two calls always return equal
   * {@link Components}.
   *
   * @return ordered, named components of this value
   */
  protected abstract Components components();

  /**
   * @return state of this value, as used for equality
   */
  public final Components describe() {
    return throwIllegalStateIfNull(components(), "Value components");
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    return describe().sameAs(((ValueObject) o).describe());
  }

  @Override
  public final int hashCode() {
    return 31 * getClass().getName().hashCode() + describe().structuralHash();
  }

  @Override
  public String toString() {
    return describe().render(getClass().getSimpleName());
  }

  private static void verifyImmutable(Class<?> type) {
    for (Class<?> current = type;
        current != null && current != ValueObject.class;
        current = current.getSuperclass()) {
      for (Field field : current.getDeclaredFields()) {
        final int modifiers = field.getModifiers();
        if (!Modifier.isStatic(modifiers) && !Modifier.isFinal(modifiers)) {
          throw new IllegalStateException(
              "Value type %s declares mutable field '%s'"
                  .formatted(type.getName(), field.getName()));
        }
      }
    }
  }
}
