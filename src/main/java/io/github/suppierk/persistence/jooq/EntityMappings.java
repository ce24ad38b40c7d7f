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

package io.github.suppierk.persistence.jooq;

import io.github.suppierk.persistence.model.BaseEntity;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/** Immutable lookup of {@link EntityMapping}s by entity class. */
public final class EntityMappings {
  private final Map<Class<?>, EntityMapping<?>> mappings;

  /**
   * @param mappings to register
   * @throws IllegalArgumentException if mappings are {@code null} or contain {@code null}
   * @throws IllegalStateException if the same entity type is mapped twice
   */
  public EntityMappings(final Collection<EntityMapping<?>> mappings) {
    if (mappings == null) {
      throw new IllegalArgumentException("Entity mappings cannot be null");
    }

    final Map<Class<?>, EntityMapping<?>> byType = new HashMap<>();

    for (EntityMapping<?> mapping : mappings) {
      if (mapping == null) {
        throw new IllegalArgumentException("Entity mapping cannot be null");
      }

      if (byType.putIfAbsent(mapping.entityType(), mapping) != null) {
        throw new IllegalStateException(
            "%s is already mapped".formatted(mapping.entityType().getSimpleName()));
      }
    }

    this.mappings = Map.copyOf(byType);
  }

  /**
   * Looks up the mapping of the type itself or of its closest mapped superclass.
   *
   * @param type of the entity
   * @param <E> is the type of the entity
   * @return mapping for the type
   * @throws IllegalArgumentException if the type is not mapped
   */
  @SuppressWarnings("unchecked")
  public <E extends BaseEntity> EntityMapping<E> mappingFor(final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Entity type cannot be null");
    }

    Class<?> current = type;
    while (current != null && current != Object.class) {
      final EntityMapping<?> mapping = mappings.get(current);

      if (mapping != null) {
        return (EntityMapping<E>) mapping;
      }

      current = current.getSuperclass();
    }

    throw new IllegalArgumentException("%s is not mapped".formatted(type.getName()));
  }
}
