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

import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.persistence.specification.Include;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;

/**
 * Describes how one entity type is stored in a table.
 *
 * <p>Every mapped table must carry the ID column and both timestamp columns, which are managed by
 * the session. Subclasses describe the rest of the columns:
 *
 * <ul>
 *   <li>{@link #columns()} lists the entity-specific columns to select.
 *   <li>{@link #newInstance(Record)} creates the entity from a selected row.
 *   <li>{@link #values(BaseEntity)} produces the entity-specific column values to write.
 * </ul>
 *
 * @param <E> is the type of the mapped entity
 */
public abstract class EntityMapping<E extends BaseEntity> extends Suspicious {
  private final Class<E> entityType;
  private final Table<?> table;
  private final Field<UUID> id;
  private final Field<LocalDateTime> createdOn;
  private final Field<LocalDateTime> updatedOn;
  private final Map<String, Include<E>> includes;

  /**
   * @param entityType which is mapped
   * @param table storing the entity
   * @param id column of the table
   * @param createdOn column of the table
   * @param updatedOn column of the table
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  protected EntityMapping(
      final Class<E> entityType,
      final Table<?> table,
      final Field<UUID> id,
      final Field<LocalDateTime> createdOn,
      final Field<LocalDateTime> updatedOn) {
    this.entityType = throwIllegalArgumentIfNull(entityType, "Entity type");
    this.table = throwIllegalArgumentIfNull(table, "Table");
    this.id = throwIllegalArgumentIfNull(id, "ID field");
    this.createdOn = throwIllegalArgumentIfNull(createdOn, "Created on field");
    this.updatedOn = throwIllegalArgumentIfNull(updatedOn, "Updated on field");
    this.includes = new LinkedHashMap<>();
  }

  /**
   * @return entity-specific columns, without ID and timestamps
   */
  protected abstract List<Field<?>> columns();

  /**
   * ID and timestamps are assigned by {@link #read(Record)} afterward.
   *
   * @param record containing {@link #fields()}
   * @return a new entity
   */
  protected abstract E newInstance(final Record record);

  /**
   * @param entity to write
   * @return values of entity-specific columns, {@code null} values are permitted
   */
  protected abstract Map<Field<?>, Object> values(final E entity);

  /**
   * Registers an include which can be requested by its path.
   *
   * @param include to register
   * @throws IllegalArgumentException if include is {@code null}
   * @throws IllegalStateException if an include with the same path is already registered
   */
  protected final void registerInclude(final Include<E> include) {
    final Include<E> nonNullInclude = throwIllegalArgumentIfNull(include, "Include");
    final String path = throwIllegalStateIfNull(nonNullInclude.path(), "Include path");

    if (includes.putIfAbsent(path, nonNullInclude) != null) {
      throw new IllegalStateException(
          "Include '%s' is already registered for %s"
              .formatted(path, entityType.getSimpleName()));
    }
  }

  public final Class<E> entityType() {
    return entityType;
  }

  public final Table<?> table() {
    return table;
  }

  public final Field<UUID> id() {
    return id;
  }

  public final Field<LocalDateTime> createdOn() {
    return createdOn;
  }

  public final Field<LocalDateTime> updatedOn() {
    return updatedOn;
  }

  /**
   * @param path of the include
   * @return registered include
   */
  public final Optional<Include<E>> include(final String path) {
    return Optional.ofNullable(includes.get(path));
  }

  /**
   * @return all columns to select, ID and timestamps first
   */
  public final List<Field<?>> fields() {
    final List<Field<?>> fields = new ArrayList<>();
    fields.add(id);
    fields.add(createdOn);
    fields.add(updatedOn);
    fields.addAll(throwIllegalStateIfNull(columns(), "Mapped columns"));
    return fields;
  }

  /**
   * @param record containing {@link #fields()}
   * @return a new entity with ID and timestamps assigned
   */
  public final E read(final Record record) {
    final E entity =
        throwIllegalStateIfNull(
            newInstance(record), "%s instance".formatted(entityType.getSimpleName()));

    entity.assignId(EntityId.of(record.get(id)));
    entity.stampCreated(record.get(createdOn));
    entity.stampUpdated(record.get(updatedOn));

    return entity;
  }

  /**
   * @param entity to insert
   * @param now timestamp of the write
   * @return values of every column
   */
  final Map<Field<?>, Object> insertValues(final E entity, final LocalDateTime now) {
    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(id, entity.id().value());
    values.put(createdOn, now);
    values.put(updatedOn, null);
    values.putAll(throwIllegalStateIfNull(values(entity), "Mapped values"));
    return values;
  }

  /**
   * @param entity to update
   * @param now timestamp of the write
   * @return values of every column except ID and creation timestamp
   */
  final Map<Field<?>, Object> updateValues(final E entity, final LocalDateTime now) {
    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(updatedOn, now);
    values.putAll(throwIllegalStateIfNull(values(entity), "Mapped values"));
    return values;
  }
}
