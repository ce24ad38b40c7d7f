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

package io.github.suppierk.persistence.model;

import java.io.Serial;
import java.util.List;
import java.util.UUID;

/**
 * Typed identity of a {@link BaseEntity}.
 *
 * <p>Identity comparison is kept apart from the structural equality of the entity itself: two
 * entities are the same entity when their {@link EntityId}s are equal, regardless of the rest of
 * their state.
 */
public final class EntityId extends ValueObject implements Comparable<EntityId> {
  @Serial private static final long serialVersionUID = -6651392017735482416L;

  private final UUID value;

  private EntityId(final UUID value) {
    this.value = value;
  }

  /**
   * Wraps an existing identifier.
   *
   * @param value to wrap
   * @return a new instance of {@link EntityId}
   * @throws IllegalArgumentException if value is {@code null}
   */
  public static EntityId of(final UUID value) {
    if (value == null) {
      throw new IllegalArgumentException("Entity ID value cannot be null");
    }

    return new EntityId(value);
  }

  /**
   * @return a new instance of {@link EntityId} with a freshly generated random value
   */
  public static EntityId newId() {
    return new EntityId(UUID.randomUUID());
  }

  /**
   * @param value in the canonical {@link UUID} textual form
   * @return a new instance of {@link EntityId}
   * @throws IllegalArgumentException if value is {@code null} or malformed
   */
  public static EntityId fromString(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Entity ID value cannot be null");
    }

    return new EntityId(UUID.fromString(value));
  }

  /**
   * @return the underlying identifier
   */
  public UUID value() {
    return value;
  }

  /**
   * Compares this identity directly against a raw identifier.
   *
   * @param rawValue to compare with
   * @return {@code true} if the underlying identifier is equal to the given value
   */
  public boolean is(final UUID rawValue) {
    return value.equals(rawValue);
  }

  @Override
  protected List<?> equalityComponents() {
    return List.of(value);
  }

  @Override
  public int compareTo(final EntityId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
