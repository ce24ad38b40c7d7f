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

package io.github.suppierk.persistence.specification;

import io.github.suppierk.persistence.model.BaseEntity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiConsumer;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.RecordMapper;
import org.jooq.Table;

/**
 * Related data to load together with the root entities of a query.
 *
 * <p>Includes run after the root rows were fetched, in declaration order, once per query.
 *
 * @param <E> is the type of the root entity
 */
public interface Include<E extends BaseEntity> {
  /**
   * Creates an include which loads child rows referencing the roots by a foreign key and attaches
   * them to each root. Roots without children receive an empty list.
   *
   * @param path to register the include under
   * @param table holding child rows
   * @param foreignKey column of the child table referencing the root ID
   * @param mapper converting a child row
   * @param attach assigning loaded children to their root
   * @param <E> is the type of the root entity
   * @param <C> is the type of the child
   * @return a new include
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  static <E extends BaseEntity, C> Include<E> children(
      final String path,
      final Table<?> table,
      final Field<UUID> foreignKey,
      final RecordMapper<Record, C> mapper,
      final BiConsumer<E, List<C>> attach) {
    if (path == null || table == null || foreignKey == null || mapper == null || attach == null) {
      throw new IllegalArgumentException("Include arguments cannot be null");
    }

    return new Include<>() {
      @Override
      public String path() {
        return path;
      }

      @Override
      public void load(final DSLContext dsl, final List<E> roots) {
        if (roots.isEmpty()) {
          return;
        }

        final List<UUID> ids = new ArrayList<>(roots.size());
        for (E root : roots) {
          ids.add(root.id().value());
        }

        final Map<UUID, List<C>> children = new LinkedHashMap<>();
        for (Record record : dsl.select().from(table).where(foreignKey.in(ids)).fetch()) {
          children
              .computeIfAbsent(record.get(foreignKey), ignored -> new ArrayList<>())
              .add(mapper.map(record));
        }

        for (E root : roots) {
          attach.accept(root, children.getOrDefault(root.id().value(), new ArrayList<>()));
        }
      }
    };
  }

  /**
   * @return name of the navigation this include loads
   */
  String path();

  /**
   * @param dsl to query with
   * @param roots loaded by the query, never empty when invoked by a query
   */
  void load(final DSLContext dsl, final List<E> roots);
}
