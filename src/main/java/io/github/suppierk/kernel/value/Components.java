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

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Ordered, named sequence of the components defining a {@link ValueObject}.
 *
 * <p>Instances are immutable, {@link #and(String, Object)} returns a new instance. Component
 * values may be {@code null} to represent an absent optional component.
 */
public final class Components implements Serializable {
  @Serial private static final long serialVersionUID = 6205432118190367518L;

  private static final Components EMPTY = new Components(Collections.emptyList());

  private final List<Component> entries;

  private Components(List<Component> entries) {
    this.entries = entries;
  }

  /**
   * @return components of a value without any state
   */
  public static Components none() {
    return EMPTY;
  }

  /**
   * @param name of the first component
   * @param value of the first component
   * @return a new instance with a single component
   */
  public static Components of(String name, Object value) {
    return EMPTY.and(name, value);
  }

  /**
   * @param name of the next component, must be unique within this instance
   * @param value of the next component
   * @return a new instance with the component appended
   * @throws IllegalArgumentException if name is blank or already present
   */
  public Components and(String name, Object value) {
    throwIllegalArgumentIfBlank(name, "Component name");
    for (Component entry : entries) {
      if (entry.name().equals(name)) {
        throw new IllegalArgumentException("Component '%s' is declared twice".formatted(name));
      }
    }

    final List<Component> next = new ArrayList<>(entries.size() + 1);
    next.addAll(entries);
    next.add(new Component(name, value));
    return new Components(Collections.unmodifiableList(next));
  }

  /**
   * @return number of components
   */
  public int size() {
    return entries.size();
  }

  /**
   * @return component names in declaration order
   */
  public List<String> names() {
    return entries.stream().map(Component::name).toList();
  }

  /**
   * @return component values in declaration order, {@code null}s included
   */
  public List<Object> values() {
    return entries.stream().map(Component::value).toList();
  }

  /**
   * Structural comparison: same names in the same order and deeply equal values.
   *
   * <p>Nested {@link ValueObject}s compare through their own {@link ValueObject#equals(Object)},
   * which applies the same rule recursively.
   *
   * @param other components to compare with
   * @return {@code true} if both sequences are structurally equal
   */
  boolean sameAs(Components other) {
    if (entries.size() != other.entries.size()) {
      return false;
    }

    for (int i = 0; i < entries.size(); i++) {
      final Component left = entries.get(i);
      final Component right = other.entries.get(i);
      if (!left.name().equals(right.name()) || !Objects.deepEquals(left.value(), right.value())) {
        return false;
      }
    }

    return true;
  }

  /**
   * @return hash derived from names and values, consistent with {@link #sameAs(Components)}
   */
  int structuralHash() {
    int result = 1;
    for (Component entry : entries) {
      result = 31 * result + entry.name().hashCode();
      result = 31 * result + Arrays.deepHashCode(new Object[] {entry.value()});
    }
    return result;
  }

  String render(String typeName) {
    final StringJoiner joiner = new StringJoiner(", ", typeName + "[", "]");
    for (Component entry : entries) {
      final Object value = entry.value();
      joiner.add(
          entry.name()
              + "="
              + (value instanceof Object[] array ? Arrays.deepToString(array) : value));
    }
    return joiner.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    return sameAs((Components) o);
  }

  @Override
  public int hashCode() {
    return structuralHash();
  }

  @Override
  public String toString() {
    return render(Components.class.getSimpleName());
  }

  private record Component(String name, Object value) implements Serializable {}
}
